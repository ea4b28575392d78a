package com.meltwater.rxamqp;

import com.rabbitmq.client.AMQP;
import rx.Completable;
import rx.Single;

import java.util.Collections;
import java.util.HashMap;
import java.util.Map;

/**
 * An exchange on the broker, bound to the {@link Channel} it was declared or looked up on.
 *
 * Instances are values: two exchanges are equal when they belong to the same channel and have the same declaration.
 *
 * @see Channel#declareExchange(String, ExchangeType)
 * @see Channel#getExchange(String, boolean)
 */
public class Exchange {

    private final Channel channel;

    public final String name;
    public final String type;
    public final boolean durable;
    public final boolean autoDelete;
    public final boolean internal;
    public final boolean passive;
    public final Map<String, Object> arguments;

    Exchange(Channel channel,
             String name,
             String type,
             boolean durable,
             boolean autoDelete,
             boolean internal,
             boolean passive,
             Map<String, Object> arguments) {
        assert channel != null;
        if (name == null) {
            throw new IllegalArgumentException("Exchange name must not be null");
        }
        this.channel = channel;
        this.name = name;
        this.type = type == null ? ExchangeType.DIRECT.value : type;
        this.durable = durable;
        this.autoDelete = autoDelete;
        this.internal = internal;
        this.passive = passive;
        this.arguments = arguments == null
                ? Collections.emptyMap()
                : Collections.unmodifiableMap(new HashMap<>(arguments));
    }

    public Channel getChannel() {
        return channel;
    }

    public boolean isDefault() {
        return name.isEmpty();
    }

    /**
     * Declares this exchange on the broker, or with {@link #passive} only checks that it exists.
     * The nameless default exchange always exists and is never sent to the broker.
     *
     * A failed passive declaration makes the broker close the channel.
     */
    public Completable declare(long timeoutMillis) {
        if (isDefault()) {
            return Completable.complete();
        }
        return channel.execute(ch -> passive
                ? ch.exchangeDeclarePassive(name)
                : ch.exchangeDeclare(name, type, durable, autoDelete, internal, arguments), timeoutMillis)
                .toCompletable();
    }

    public Single<AMQP.Exchange.DeleteOk> delete(boolean ifUnused, long timeoutMillis) {
        return channel.exchangeDelete(name, ifUnused, timeoutMillis);
    }

    /**
     * Publishes a message to this exchange. When the channel uses publisher confirms the returned single
     * succeeds once the broker has confirmed the message.
     *
     * @return the channel local delivery tag of the message
     */
    public Single<Long> publish(String routingKey, AMQP.BasicProperties props, byte[] body, boolean mandatory, long timeoutMillis) {
        return channel.execute(ch -> channel.publish(ch, name, routingKey, mandatory, props, body, timeoutMillis), timeoutMillis);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        Exchange exchange = (Exchange) o;
        return channel == exchange.channel
                && durable == exchange.durable
                && autoDelete == exchange.autoDelete
                && internal == exchange.internal
                && passive == exchange.passive
                && name.equals(exchange.name)
                && type.equals(exchange.type)
                && arguments.equals(exchange.arguments);
    }

    @Override
    public int hashCode() {
        int result = name.hashCode();
        result = 31 * result + type.hashCode();
        result = 31 * result + (durable ? 1 : 0);
        result = 31 * result + (autoDelete ? 1 : 0);
        result = 31 * result + (passive ? 1 : 0);
        return result;
    }

    @Override
    public String toString() {
        return "Exchange{" +
                "name='" + name + '\'' +
                ", type=" + type +
                ", durable=" + durable +
                ", autoDelete=" + autoDelete +
                ", internal=" + internal +
                ", passive=" + passive +
                '}';
    }
}
