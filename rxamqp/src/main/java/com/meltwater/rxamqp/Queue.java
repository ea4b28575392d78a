package com.meltwater.rxamqp;

import com.rabbitmq.client.AMQP;
import rx.Single;

import java.util.Collections;
import java.util.HashMap;
import java.util.Map;

/**
 * A queue on the broker, bound to the {@link Channel} it was declared or looked up on.
 *
 * A queue declared without a name gets its name from the broker, {@link #getName()} returns it after the declaration.
 *
 * @see Channel#declareQueue(String)
 * @see Channel#getQueue(String, boolean)
 */
public class Queue {

    private final Channel channel;

    public final boolean durable;
    public final boolean exclusive;
    public final boolean autoDelete;
    public final boolean passive;
    public final Map<String, Object> arguments;

    private volatile String name;
    private volatile int messageCount;
    private volatile int consumerCount;

    Queue(Channel channel,
          String name,
          boolean durable,
          boolean exclusive,
          boolean autoDelete,
          boolean passive,
          Map<String, Object> arguments) {
        assert channel != null;
        this.channel = channel;
        this.name = name == null ? "" : name;
        this.durable = durable;
        this.exclusive = exclusive;
        this.autoDelete = autoDelete;
        this.passive = passive;
        this.arguments = arguments == null
                ? Collections.emptyMap()
                : Collections.unmodifiableMap(new HashMap<>(arguments));
    }

    public Channel getChannel() {
        return channel;
    }

    public String getName() {
        return name;
    }

    /**
     * @return the number of ready messages reported by the last declaration
     */
    public int getMessageCount() {
        return messageCount;
    }

    /**
     * @return the number of consumers reported by the last declaration
     */
    public int getConsumerCount() {
        return consumerCount;
    }

    /**
     * Declares this queue, or with {@link #passive} only checks that it exists.
     * A failed passive declaration makes the broker close the channel.
     */
    public Single<AMQP.Queue.DeclareOk> declare(long timeoutMillis) {
        return channel.execute(ch -> {
            AMQP.Queue.DeclareOk ok = passive
                    ? ch.queueDeclarePassive(name)
                    : ch.queueDeclare(name, durable, exclusive, autoDelete, arguments);
            name = ok.getQueue();
            messageCount = ok.getMessageCount();
            consumerCount = ok.getConsumerCount();
            return ok;
        }, timeoutMillis);
    }

    public Single<AMQP.Queue.PurgeOk> purge(long timeoutMillis) {
        return channel.execute(ch -> ch.queuePurge(name), timeoutMillis);
    }

    public Single<AMQP.Queue.DeleteOk> delete(boolean ifUnused, boolean ifEmpty, long timeoutMillis) {
        return channel.queueDelete(name, ifUnused, ifEmpty, timeoutMillis);
    }

    @Override
    public String toString() {
        return "Queue{" +
                "name='" + name + '\'' +
                ", durable=" + durable +
                ", exclusive=" + exclusive +
                ", autoDelete=" + autoDelete +
                ", passive=" + passive +
                '}';
    }
}
