package com.meltwater.rxamqp.impl;

import com.rabbitmq.client.impl.AMQConnection;
import com.meltwater.rxamqp.CallbackCollection;
import com.meltwater.rxamqp.DeliveryException;
import com.meltwater.rxamqp.ReturnedMessage;
import com.meltwater.rxamqp.UnderlayChannel;
import com.meltwater.rxamqp.util.Logger;
import com.rabbitmq.client.AMQP;
import com.rabbitmq.client.Channel;
import com.rabbitmq.client.Command;
import com.rabbitmq.client.ShutdownSignalException;
import rx.functions.Action2;

import java.io.IOException;
import java.util.Map;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;

/**
 * {@link UnderlayChannel} on top of a channel of the java amqp client.
 */
public class RabbitUnderlayChannel implements UnderlayChannel {

    private static final Logger log = new Logger(RabbitUnderlayChannel.class);

    private final Channel delegate;
    private final boolean publisherConfirms;
    private final boolean onReturnRaises;
    private final CallbackCollection<UnderlayChannel, ReturnedMessage> returnCallbacks;

    private final Object publishLock = new Object();
    private final AtomicReference<ReturnedMessage> lastReturn = new AtomicReference<>();
    private final AtomicBoolean closeReported = new AtomicBoolean(false);
    private final AtomicReference<Throwable> userCloseReason = new AtomicReference<>();

    public RabbitUnderlayChannel(Channel delegate,
                                 Action2<UnderlayChannel, Throwable> onClose,
                                 boolean publisherConfirms,
                                 boolean onReturnRaises) throws IOException {
        this.delegate = delegate;
        this.publisherConfirms = publisherConfirms;
        this.onReturnRaises = onReturnRaises;
        this.returnCallbacks = new CallbackCollection<>(this);

        if (publisherConfirms) {
            delegate.confirmSelect();
        }
        delegate.addReturnListener(returned -> {
            ReturnedMessage message = new ReturnedMessage(
                    returned.getReplyCode(),
                    returned.getReplyText(),
                    returned.getExchange(),
                    returned.getRoutingKey(),
                    returned.getProperties(),
                    returned.getBody());
            lastReturn.set(message);
            returnCallbacks.fire(message);
        });
        delegate.addShutdownListener(cause -> {
            if (closeReported.compareAndSet(false, true)) {
                onClose.call(this, closeReason(cause, userCloseReason.get()));
            }
        });
        log.debugWithParams("Opened underlying channel.",
                "channelNr", delegate.getChannelNumber(),
                "publisherConfirms", publisherConfirms);
    }

    /**
     * A close requested by this application with reply code 200 is a clean close and has no reason. A close this
     * application requested with a reason reports a shutdown signal caused by that reason.
     */
    static Throwable closeReason(ShutdownSignalException cause, Throwable userReason) {
        if (!cause.isInitiatedByApplication() || !(cause.getReason() instanceof AMQP.Channel.Close)) {
            return cause;
        }
        AMQP.Channel.Close close = (AMQP.Channel.Close) cause.getReason();
        if (close.getReplyCode() == AMQP.REPLY_SUCCESS) {
            return null;
        }
        if (userReason == null || cause.getCause() != null) {
            return cause;
        }
        ShutdownSignalException withReason = new ShutdownSignalException(
                cause.isHardError(), true, cause.getReason(), cause.getReference());
        withReason.initCause(userReason);
        return withReason;
    }

    @Override
    public int getNumber() {
        return delegate.getChannelNumber();
    }

    @Override
    public boolean isOpen() {
        return delegate.isOpen() && delegate.getConnection().isOpen();
    }

    @Override
    public boolean isPublisherConfirms() {
        return publisherConfirms;
    }

    @Override
    public boolean isOnReturnRaises() {
        return onReturnRaises;
    }

    @Override
    public void close(Throwable reason) throws IOException, TimeoutException {
        if (reason == null) {
            delegate.close();
        } else {
            userCloseReason.set(reason);
            delegate.close(AMQP.INTERNAL_ERROR, String.valueOf(reason));
        }
    }

    @Override
    public AMQP.Exchange.DeclareOk exchangeDeclare(String exchange, String type, boolean durable, boolean autoDelete, boolean internal, Map<String, Object> arguments) throws IOException {
        return delegate.exchangeDeclare(exchange, type, durable, autoDelete, internal, arguments);
    }

    @Override
    public AMQP.Exchange.DeclareOk exchangeDeclarePassive(String exchange) throws IOException {
        return delegate.exchangeDeclarePassive(exchange);
    }

    @Override
    public AMQP.Exchange.DeleteOk exchangeDelete(String exchange, boolean ifUnused) throws IOException {
        return delegate.exchangeDelete(exchange, ifUnused);
    }

    @Override
    public AMQP.Queue.DeclareOk queueDeclare(String queue, boolean durable, boolean exclusive, boolean autoDelete, Map<String, Object> arguments) throws IOException {
        return delegate.queueDeclare(queue, durable, exclusive, autoDelete, arguments);
    }

    @Override
    public AMQP.Queue.DeclareOk queueDeclarePassive(String queue) throws IOException {
        return delegate.queueDeclarePassive(queue);
    }

    @Override
    public AMQP.Queue.DeleteOk queueDelete(String queue, boolean ifUnused, boolean ifEmpty) throws IOException {
        return delegate.queueDelete(queue, ifUnused, ifEmpty);
    }

    @Override
    public AMQP.Queue.PurgeOk queuePurge(String queue) throws IOException {
        return delegate.queuePurge(queue);
    }

    @Override
    public void basicQos(int prefetchSize, int prefetchCount, boolean global) throws IOException {
        delegate.basicQos(prefetchSize, prefetchCount, global);
    }

    /**
     * The amqp client has no channel.flow method, the RPC is sent as is.
     */
    @Override
    public AMQP.Channel.FlowOk flow(boolean active) throws IOException {
        Command reply = delegate.rpc(new AMQP.Channel.Flow.Builder().active(active).build());
        return (AMQP.Channel.FlowOk) reply.getMethod();
    }

    @Override
    public void basicPublish(String exchange,
                             String routingKey,
                             boolean mandatory,
                             AMQP.BasicProperties props,
                             byte[] body,
                             long confirmTimeoutMillis) throws IOException, InterruptedException, TimeoutException {
        synchronized (publishLock) {
            lastReturn.set(null);
            delegate.basicPublish(exchange, routingKey, mandatory, props, body);
            if (!publisherConfirms) {
                return;
            }
            // a nack or a missing confirm fails the publish but leaves the channel open
            boolean acked = confirmTimeoutMillis > 0
                    ? delegate.waitForConfirms(confirmTimeoutMillis)
                    : delegate.waitForConfirms();
            if (!acked) {
                throw new IOException("Message was nacked by the broker");
            }
            // basic.return arrives before the confirm of the same message
            ReturnedMessage returned = lastReturn.getAndSet(null);
            if (onReturnRaises && mandatory && returned != null) {
                throw new DeliveryException(returned);
            }
        }
    }

    @Override
    public AMQP.Tx.SelectOk txSelect() throws IOException {
        return delegate.txSelect();
    }

    @Override
    public AMQP.Tx.CommitOk txCommit() throws IOException {
        return delegate.txCommit();
    }

    @Override
    public AMQP.Tx.RollbackOk txRollback() throws IOException {
        return delegate.txRollback();
    }

    @Override
    public CallbackCollection<UnderlayChannel, ReturnedMessage> getReturnCallbacks() {
        return returnCallbacks;
    }

    @Override
    public String toString() {
        return "{" +
                "channelNo=" + delegate.getChannelNumber() +
                ", localPort=" + ((AMQConnection) delegate.getConnection()).getLocalPort() +
                '}';
    }
}
