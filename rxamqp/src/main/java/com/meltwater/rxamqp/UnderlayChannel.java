package com.meltwater.rxamqp;

import com.rabbitmq.client.AMQP;

import java.io.IOException;
import java.util.Map;
import java.util.concurrent.TimeoutException;

/**
 * The protocol level channel a {@link Channel} is built on, as handed out by a {@link Transport}.
 *
 * All broker operations are blocking round trips. Errors reported by the broker surface as the
 * {@link IOException} (usually caused by a {@link com.rabbitmq.client.ShutdownSignalException}) of the
 * amqp client and must not be translated by implementations.
 *
 * @see com.rabbitmq.client.Channel
 */
public interface UnderlayChannel {

    /**
     * @return the channel number assigned to this channel
     */
    int getNumber();

    /**
     * Checking this method should be only for information, because of the race conditions - state can change after the call.
     *
     * @return true when the channel and its connection are open
     */
    boolean isOpen();

    boolean isPublisherConfirms();

    boolean isOnReturnRaises();

    /**
     * Closes the channel. A null reason closes with {@link AMQP#REPLY_SUCCESS}, otherwise the reason is reported
     * to the broker as an internal error.
     */
    void close(Throwable reason) throws IOException, TimeoutException;

    AMQP.Exchange.DeclareOk exchangeDeclare(String exchange,
                                            String type,
                                            boolean durable,
                                            boolean autoDelete,
                                            boolean internal,
                                            Map<String, Object> arguments) throws IOException;

    /**
     * @throws IOException the server will raise a 404 channel exception if the named exchange does not exist.
     */
    AMQP.Exchange.DeclareOk exchangeDeclarePassive(String exchange) throws IOException;

    AMQP.Exchange.DeleteOk exchangeDelete(String exchange, boolean ifUnused) throws IOException;

    AMQP.Queue.DeclareOk queueDeclare(String queue,
                                      boolean durable,
                                      boolean exclusive,
                                      boolean autoDelete,
                                      Map<String, Object> arguments) throws IOException;

    /**
     * @throws IOException if the queue does not exist or if the queue is exclusively owned by another connection.
     */
    AMQP.Queue.DeclareOk queueDeclarePassive(String queue) throws IOException;

    AMQP.Queue.DeleteOk queueDelete(String queue, boolean ifUnused, boolean ifEmpty) throws IOException;

    AMQP.Queue.PurgeOk queuePurge(String queue) throws IOException;

    void basicQos(int prefetchSize, int prefetchCount, boolean global) throws IOException;

    AMQP.Channel.FlowOk flow(boolean active) throws IOException;

    /**
     * Publishes a message. With publisher confirms enabled the call returns when the broker confirmed the message.
     *
     * @param confirmTimeoutMillis how long to wait for the confirm, 0 means forever
     * @throws DeliveryException if the channel raises on returns and the broker returned the mandatory message
     * @throws IOException if the broker nacked the message, the channel stays open
     * @throws TimeoutException if the confirm did not arrive in time, the channel stays open
     */
    void basicPublish(String exchange,
                      String routingKey,
                      boolean mandatory,
                      AMQP.BasicProperties props,
                      byte[] body,
                      long confirmTimeoutMillis) throws IOException, InterruptedException, TimeoutException;

    AMQP.Tx.SelectOk txSelect() throws IOException;

    AMQP.Tx.CommitOk txCommit() throws IOException;

    AMQP.Tx.RollbackOk txRollback() throws IOException;

    /**
     * @return the handlers called for every message the broker returns on this channel
     */
    CallbackCollection<UnderlayChannel, ReturnedMessage> getReturnCallbacks();
}
