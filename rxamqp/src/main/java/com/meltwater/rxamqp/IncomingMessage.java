package com.meltwater.rxamqp;

import com.rabbitmq.client.AMQP;

/**
 * A message handed to the application by a {@link Channel}.
 *
 * Messages that the broker returned as unroutable are delivered with {@link #noAck} set, since there is nothing
 * to acknowledge on the broker side. Calling the {@link #acknowledger} of such a message throws {@link IllegalStateException}.
 *
 * @see Channel#getReturnCallbacks()
 */
public class IncomingMessage {

    private static final Acknowledger NO_ACK = new Acknowledger() {
        @Override
        public void ack() {
            throw new IllegalStateException("Can't ack message with no_ack flag");
        }

        @Override
        public void reject() {
            throw new IllegalStateException("Can't reject message with no_ack flag");
        }
    };

    public final Acknowledger acknowledger;
    public final String exchange;
    public final String routingKey;
    public final AMQP.BasicProperties basicProperties;
    public final byte[] body;
    public final boolean noAck;

    /**
     * Set when this message is a broker return, null otherwise.
     */
    public final ReturnedMessage returned;

    public IncomingMessage(ReturnedMessage returned, boolean noAck) {
        this(noAck ? NO_ACK : null, returned.exchange, returned.routingKey, returned.basicProperties, returned.body, noAck, returned);
    }

    public IncomingMessage(Acknowledger acknowledger,
                           String exchange,
                           String routingKey,
                           AMQP.BasicProperties basicProperties,
                           byte[] body,
                           boolean noAck,
                           ReturnedMessage returned) {
        if (!noAck && acknowledger == null) {
            throw new IllegalArgumentException("An acknowledger is required unless noAck is set");
        }
        this.acknowledger = noAck ? NO_ACK : acknowledger;
        this.exchange = exchange;
        this.routingKey = routingKey;
        this.basicProperties = basicProperties;
        this.body = body;
        this.noAck = noAck;
        this.returned = returned;
    }

    public String getMessageId() {
        return basicProperties == null ? null : basicProperties.getMessageId();
    }

    @Override
    public String toString() {
        return "IncomingMessage{" +
                "exchange='" + exchange + '\'' +
                ", routingKey='" + routingKey + '\'' +
                ", messageId='" + getMessageId() + '\'' +
                ", noAck=" + noAck +
                ", size=" + (body == null ? 0 : body.length) + " bytes" +
                '}';
    }
}
