package com.meltwater.rxamqp;

import com.rabbitmq.client.AMQP;

import java.util.Arrays;

/**
 * A published message that the broker handed back with basic.return because it could not be routed.
 */
public class ReturnedMessage {

    public final int replyCode;
    public final String replyText;
    public final String exchange;
    public final String routingKey;
    public final AMQP.BasicProperties basicProperties;
    public final byte[] body;

    public ReturnedMessage(int replyCode,
                           String replyText,
                           String exchange,
                           String routingKey,
                           AMQP.BasicProperties basicProperties,
                           byte[] body) {
        this.replyCode = replyCode;
        this.replyText = replyText;
        this.exchange = exchange;
        this.routingKey = routingKey;
        this.basicProperties = basicProperties;
        this.body = body;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        ReturnedMessage that = (ReturnedMessage) o;
        return replyCode == that.replyCode
                && exchange.equals(that.exchange)
                && routingKey.equals(that.routingKey)
                && Arrays.equals(body, that.body);
    }

    @Override
    public int hashCode() {
        int result = replyCode;
        result = 31 * result + exchange.hashCode();
        result = 31 * result + routingKey.hashCode();
        result = 31 * result + Arrays.hashCode(body);
        return result;
    }

    @Override
    public String toString() {
        return "ReturnedMessage{" +
                "replyCode=" + replyCode +
                ", replyText='" + replyText + '\'' +
                ", exchange='" + exchange + '\'' +
                ", routingKey='" + routingKey + '\'' +
                ", size=" + (body == null ? 0 : body.length) + " bytes" +
                '}';
    }
}
