package com.meltwater.rxamqp;

import com.meltwater.rxamqp.util.Logger;
import com.rabbitmq.client.AMQP;
import rx.Completable;
import rx.Scheduler;
import rx.Single;
import rx.functions.Action2;
import rx.schedulers.Schedulers;
import rx.subjects.BehaviorSubject;
import rx.subjects.Subject;

import java.io.IOException;
import java.util.List;
import java.util.Map;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;
import java.util.concurrent.locks.ReentrantLock;

import static com.meltwater.rxamqp.ChannelLifecycleException.Reason.ALREADY_INITIALIZED;
import static com.meltwater.rxamqp.ChannelLifecycleException.Reason.CLOSED;
import static com.meltwater.rxamqp.ChannelLifecycleException.Reason.CLOSED_BY_USER;
import static com.meltwater.rxamqp.ChannelLifecycleException.Reason.NOT_OPENED;

/**
 * A logical AMQP channel on an {@link AmqpConnection}.
 *
 * The channel owns one {@link UnderlayChannel} at a time. {@link #initialize()}, {@link #close()} and {@link #reopen()}
 * are serialized by one operation lock, so no two of them run at the same time and each of them completes all its
 * state changes before the next one starts. The declarative operations are not serialized, they only require the channel
 * to be open when they start. If the channel closes while they are in flight they fail with the error of the closed
 * underlying channel.
 *
 * All operations are lazy: nothing happens until the returned {@link Single} or {@link Completable} is subscribed to.
 * The blocking broker round trips run on the {@link Scheduler} given to the constructor. Operations that take a
 * {@code timeoutMillis} fail with a {@link TimeoutException} when it elapses, 0 means no timeout. A timeout never
 * changes the state of the channel.
 *
 * Broker errors (for example a passive declaration of a missing queue) are propagated unchanged. The broker closes the
 * channel on such errors, which is reported to everyone through {@link #getCloseCallbacks()}.
 *
 * @see ChannelScope
 */
public class Channel {

    private static final Logger log = new Logger(Channel.class);

    private final AmqpConnection connection;
    private final ChannelSettings settings;
    private final Scheduler scheduler;

    private final ReentrantLock operationLock = new ReentrantLock();
    private final AtomicReference<ChannelState> state = new AtomicReference<>(ChannelState.UNINITIALIZED);
    private final BehaviorSubject<Boolean> ready = BehaviorSubject.create(false);
    private final Subject<Boolean, Boolean> readyUpdates = ready.toSerialized();
    private final AtomicLong deliveryTag = new AtomicLong();
    private final Object publishLock = new Object();

    private final CallbackCollection<Channel, Throwable> closeCallbacks;
    private final CallbackCollection<Channel, IncomingMessage> returnCallbacks;
    private final Action2<UnderlayChannel, ReturnedMessage> returnBridge = (ch, message) -> onReturn(message);

    private volatile UnderlayChannel underlay;
    private volatile Exchange defaultExchange;

    public Channel(AmqpConnection connection) {
        this(connection, ChannelSettings.defaults());
    }

    public Channel(AmqpConnection connection, ChannelSettings settings) {
        this(connection, settings, Schedulers.io());
    }

    /**
     * @param connection the connection to open the channel on
     * @param settings the channel number, publisher confirms and return handling of this channel
     * @param scheduler the scheduler the blocking broker operations are run on
     *
     * @throws ChannelConfigurationException if {@link ChannelSettings#on_return_raises} is set without {@link ChannelSettings#publisher_confirms}
     */
    public Channel(AmqpConnection connection, ChannelSettings settings, Scheduler scheduler) {
        if (settings.on_return_raises && !settings.publisher_confirms) {
            throw new ChannelConfigurationException("\"on_return_raises\" not applicable without \"publisher_confirms\"");
        }
        assert connection != null;
        this.connection = connection;
        this.settings = settings;
        this.scheduler = scheduler;
        this.closeCallbacks = new CallbackCollection<>(this);
        this.returnCallbacks = new CallbackCollection<>(this);
    }

    public AmqpConnection getConnection() {
        return connection;
    }

    public ChannelSettings getSettings() {
        return settings;
    }

    public ChannelState getState() {
        return state.get();
    }

    public boolean isPublisherConfirms() {
        return settings.publisher_confirms;
    }

    public boolean isOnReturnRaises() {
        return settings.on_return_raises;
    }

    /**
     * @return true when the channel has been opened and is ready for interaction
     */
    public boolean isInitialized() {
        return ready.getValue();
    }

    /**
     * @return true when the channel has been closed from the broker side, after {@link #close()} or when it was never opened
     */
    public boolean isClosed() {
        if (!isInitialized() || state.get() == ChannelState.CLOSED_BY_USER) {
            return true;
        }
        UnderlayChannel channel = underlay;
        return channel == null || !channel.isOpen();
    }

    /**
     * @return the number of the open underlying channel, or the configured channel number when not open
     */
    public Integer getNumber() {
        UnderlayChannel channel = underlay;
        if (isInitialized() && channel != null) {
            return channel.getNumber();
        }
        return settings.channel_number;
    }

    /**
     * Handlers called with the close reason every time the underlying channel closes. The reason is null when the
     * channel was closed cleanly. The handlers are called before the channel stops reporting itself as initialized,
     * so they must not wait for the channel to become ready.
     */
    public CallbackCollection<Channel, Throwable> getCloseCallbacks() {
        return closeCallbacks;
    }

    /**
     * Handlers called for every published message the broker returns as unroutable.
     */
    public CallbackCollection<Channel, IncomingMessage> getReturnCallbacks() {
        return returnCallbacks;
    }

    /**
     * @return the nameless default exchange, recreated every time the channel is opened
     * @throws ChannelInvalidStateException if the channel has never been opened
     */
    public Exchange getDefaultExchange() {
        Exchange exchange = defaultExchange;
        if (exchange == null) {
            throw new ChannelInvalidStateException(NOT_OPENED, "Channel was not opened");
        }
        return exchange;
    }

    /**
     * The live underlying channel.
     *
     * @throws ChannelInvalidStateException with reason {@link ChannelLifecycleException.Reason#NOT_OPENED} if the channel
     * was never opened, or {@link ChannelLifecycleException.Reason#CLOSED} if it has been closed
     */
    public UnderlayChannel getUnderlayChannel() {
        ChannelState current = state.get();
        if (current == ChannelState.UNINITIALIZED || current == ChannelState.OPENING) {
            throw new ChannelInvalidStateException(NOT_OPENED, "Channel was not opened");
        }
        UnderlayChannel channel = underlay;
        if (current.isClosed() || channel == null || !isInitialized() || !channel.isOpen()) {
            throw new ChannelInvalidStateException(CLOSED, "Channel has been closed");
        }
        return channel;
    }

    public Completable initialize() {
        return initialize(settings.operation_timeout_millis);
    }

    /**
     * Opens the channel: waits for the connection, opens a new underlying channel and marks the channel ready.
     *
     * Fails with a {@link ChannelLifecycleException} if the channel is already open or opening
     * ({@link ChannelLifecycleException.Reason#ALREADY_INITIALIZED}), or if it was closed by {@link #close()}
     * ({@link ChannelLifecycleException.Reason#CLOSED_BY_USER}).
     */
    public Completable initialize(long timeoutMillis) {
        return withTimeout(Completable.fromCallable(() -> {
            checkCanInitialize();
            operationLock.lockInterruptibly();
            try {
                checkCanInitialize();
                open(null);
            } finally {
                operationLock.unlock();
            }
            return null;
        }).subscribeOn(scheduler), timeoutMillis);
    }

    private void checkCanInitialize() {
        ChannelState current = state.get();
        if (current == ChannelState.READY || current == ChannelState.OPENING) {
            throw new ChannelLifecycleException(ALREADY_INITIALIZED, "Already initialized");
        }
        if (current == ChannelState.CLOSED_BY_USER) {
            throw new ChannelLifecycleException(CLOSED_BY_USER, "Can't initialize closed channel");
        }
    }

    /**
     * @return the channel once it is ready, initializing it first if that has not been done yet
     */
    public Single<Channel> ensureReady() {
        return ensureReady(settings.operation_timeout_millis);
    }

    public Single<Channel> ensureReady(long timeoutMillis) {
        return withTimeout(readyOrOpen(), timeoutMillis);
    }

    /**
     * Opens the channel unless it is ready. When another initialize or reopen is in progress its outcome is waited
     * for, a failed attempt of another caller is followed by an attempt of our own.
     */
    private Single<Channel> readyOrOpen() {
        return Single.defer(() -> {
            if (isInitialized()) {
                return Single.just(this);
            }
            return initialize(0)
                    .toSingleDefault(this)
                    .onErrorResumeNext(e -> {
                        if (e instanceof ChannelLifecycleException
                                && ((ChannelLifecycleException) e).getReason() == ALREADY_INITIALIZED) {
                            return awaitLifecycleOperation().andThen(readyOrOpen());
                        }
                        return Single.error(e);
                    });
        });
    }

    /**
     * Completes once the running initialize, close or reopen, if any, has released the operation lock.
     */
    private Completable awaitLifecycleOperation() {
        return Completable.fromCallable(() -> {
            operationLock.lockInterruptibly();
            operationLock.unlock();
            return null;
        }).subscribeOn(scheduler);
    }

    /**
     * @return completes the next time the channel is ready, immediately if it is ready now
     */
    public Completable awaitReady() {
        return ready.filter(isReady -> isReady).first().toCompletable();
    }

    public Completable close() {
        return close(null);
    }

    /**
     * Closes the channel and marks it as closed by the user, also if closing the underlying channel fails.
     * Closing a channel that was never opened or that is already closed does nothing.
     *
     * @param reason reported to the broker as the close reason, null for a normal close
     */
    public Completable close(Throwable reason) {
        return Completable.fromCallable(() -> {
            operationLock.lock();
            try {
                ChannelState current = state.get();
                if (current == ChannelState.UNINITIALIZED) {
                    log.warnWithParams("Channel not opened.", "channel", this);
                    return null;
                }
                if (current == ChannelState.CLOSED_BY_USER) {
                    log.debugWithParams("Channel already closed.", "channel", this);
                    return null;
                }
                state.set(ChannelState.CLOSED_BY_USER);
                UnderlayChannel channel = underlay;
                log.debugWithParams("Closing channel.",
                        "channel", this,
                        "previousState", current,
                        "reason", reason);
                try {
                    if (channel != null && current != ChannelState.CLOSED_BY_PEER) {
                        channel.close(reason);
                    }
                } catch (Exception e) {
                    log.warnWithParams("Unexpected error when closing channel.", e,
                            "channel", this,
                            "isOpen", channel.isOpen());
                } finally {
                    readyUpdates.onNext(false);
                }
                log.infoWithParams("Closed channel.", "channel", this);
            } finally {
                operationLock.unlock();
            }
            return null;
        }).subscribeOn(scheduler);
    }

    /**
     * Replaces the underlying channel with a new one and marks the channel ready again. Close and return callbacks
     * as well as the settings are kept. The previous underlying channel is closed if it is still open.
     */
    public Completable reopen() {
        return Completable.fromCallable(() -> {
            log.debugWithParams("Start reopening channel.", "channel", this);
            operationLock.lockInterruptibly();
            try {
                UnderlayChannel previous = underlay;
                underlay = null;
                readyUpdates.onNext(false);
                if (previous != null && previous.isOpen()) {
                    try {
                        previous.close(null);
                    } catch (Exception e) {
                        log.warnWithParams("Unexpected error when closing replaced channel.", e,
                                "channelNr", previous.getNumber());
                    }
                }
                log.debugWithParams("Reopening channel.", "channel", this, "previousState", state.get());
                open(previous == null ? null : ChannelState.CLOSED_BY_PEER);
            } finally {
                operationLock.unlock();
            }
            return null;
        }).subscribeOn(scheduler);
    }

    private void open(ChannelState stateOnFailure) throws Exception {
        ChannelState previous = state.getAndSet(ChannelState.OPENING);
        boolean opened = false;
        UnderlayChannel channel = null;
        try {
            connection.connected().await();
            Transport transport = connection.getTransport();
            channel = transport.openChannel(
                    this::onUnderlayClosed,
                    settings.publisher_confirms,
                    settings.on_return_raises,
                    settings.channel_number);
            underlay = channel;
            // a close reported before the assignment above was ignored
            if (!channel.isOpen()) {
                throw new IOException("Channel " + channel.getNumber() + " was closed while opening");
            }
            deliveryTag.set(0);
            defaultExchange = new Exchange(this, "", ExchangeType.DIRECT.value, false, false, false, false, null);
            if (!state.compareAndSet(ChannelState.OPENING, ChannelState.READY)) {
                throw new IOException("Channel " + channel.getNumber() + " was closed while opening");
            }
            readyUpdates.onNext(true);
            channel.getReturnCallbacks().add(returnBridge);
            opened = true;
            log.infoWithParams("Opened channel.",
                    "channel", this,
                    "publisherConfirms", settings.publisher_confirms,
                    "onReturnRaises", settings.on_return_raises);
        } finally {
            if (!opened) {
                if (channel != null && underlay == channel) {
                    underlay = null;
                }
                state.set(stateOnFailure == null ? previous : stateOnFailure);
            }
        }
    }

    private void onUnderlayClosed(UnderlayChannel closed, Throwable reason) {
        if (closed != underlay) {
            log.debugWithParams("Ignoring close of a replaced channel.", "channelNr", closed.getNumber());
            return;
        }
        if (state.compareAndSet(ChannelState.OPENING, ChannelState.CLOSED_BY_PEER)) {
            log.infoWithParams("Underlying channel closed while opening.",
                    "channel", this,
                    "reason", reason);
            return;
        }
        log.infoWithParams("Underlying channel closed.",
                "channel", this,
                "state", state.get(),
                "reason", reason);
        try {
            List<Throwable> failures = closeCallbacks.fire(reason);
            if (!failures.isEmpty()) {
                log.warnWithParams("Close callbacks failed.", "channel", this, "failures", failures.size());
            }
        } finally {
            state.compareAndSet(ChannelState.READY, ChannelState.CLOSED_BY_PEER);
            readyUpdates.onNext(false);
        }
    }

    private void onReturn(ReturnedMessage message) {
        log.debugWithParams("Message returned by the broker.", "channel", this, "message", message);
        List<Throwable> failures = returnCallbacks.fire(new IncomingMessage(message, true));
        if (!failures.isEmpty()) {
            log.warnWithParams("Return callbacks failed.", "channel", this, "failures", failures.size());
        }
    }

    /**
     * Runs an operation on the live underlying channel. The channel is checked to be open when the operation starts.
     */
    public <T> Single<T> execute(ChannelOperation<T> operation, long timeoutMillis) {
        return withTimeout(Single.fromCallable(() -> operation.call(getUnderlayChannel())).subscribeOn(scheduler), timeoutMillis);
    }

    long publish(UnderlayChannel channel,
                 String exchange,
                 String routingKey,
                 boolean mandatory,
                 AMQP.BasicProperties props,
                 byte[] body,
                 long timeoutMillis) throws Exception {
        synchronized (publishLock) {
            long tag = deliveryTag.incrementAndGet();
            channel.basicPublish(exchange, routingKey, mandatory, props, body, timeoutMillis);
            log.traceWithParams("Published message.",
                    "exchange", exchange,
                    "routingKey", routingKey,
                    "deliveryTag", tag);
            return tag;
        }
    }

    /**
     * @return the delivery tag of the last message published since the channel was opened
     */
    public long getDeliveryTag() {
        return deliveryTag.get();
    }

    public Single<Exchange> declareExchange(String name, ExchangeType type) {
        return declareExchange(name, type, false, false);
    }

    public Single<Exchange> declareExchange(String name, ExchangeType type, boolean durable, boolean autoDelete) {
        return declareExchange(name, type.value, durable, autoDelete, false, false, null, settings.operation_timeout_millis);
    }

    public Single<Exchange> declareExchange(String name,
                                            ExchangeType type,
                                            boolean durable,
                                            boolean autoDelete,
                                            boolean internal,
                                            boolean passive,
                                            Map<String, Object> arguments,
                                            long timeoutMillis) {
        return declareExchange(name, type.value, durable, autoDelete, internal, passive, arguments, timeoutMillis);
    }

    /**
     * Declares an exchange.
     *
     * @param name the name of the exchange
     * @param type the exchange type, see {@link ExchangeType} for the known values
     * @param durable the exchange survives a broker restart
     * @param autoDelete the broker deletes the exchange when it is no longer in use
     * @param internal the exchange can not be published to directly by clients
     * @param passive only check that the exchange exists. Fails with the broker's 404 channel error when it does not,
     *                which also closes this channel
     * @param arguments other properties (construction arguments) for the exchange
     * @param timeoutMillis execution timeout, 0 for none
     *
     * @return the declared exchange
     */
    public Single<Exchange> declareExchange(String name,
                                            String type,
                                            boolean durable,
                                            boolean autoDelete,
                                            boolean internal,
                                            boolean passive,
                                            Map<String, Object> arguments,
                                            long timeoutMillis) {
        return Single.defer(() -> {
            Exchange exchange = new Exchange(this, name, type, durable, autoDelete, internal, passive, arguments);
            return exchange.declare(timeoutMillis)
                    .doOnCompleted(() -> log.debugWithParams("Exchange declared.", "channel", this, "exchange", exchange))
                    .toSingleDefault(exchange);
        });
    }

    public Single<Exchange> getExchange(String name) {
        return getExchange(name, true);
    }

    /**
     * With {@code ensure} this is the same as a passive {@link #declareExchange}, otherwise an exchange reference is
     * returned without contacting the broker.
     *
     * Use this on a separate channel or right after the channel is created, a missing exchange closes the channel.
     */
    public Single<Exchange> getExchange(String name, boolean ensure) {
        if (ensure) {
            return declareExchange(name, ExchangeType.DIRECT.value, false, false, false, true, null, settings.operation_timeout_millis);
        }
        return Single.fromCallable(() -> new Exchange(this, name, ExchangeType.DIRECT.value, false, false, false, true, null));
    }

    /**
     * Declares a non durable, non exclusive queue. A null or empty name lets the broker name the queue.
     */
    public Single<Queue> declareQueue(String name) {
        return declareQueue(name, false, false, false, false, null, settings.operation_timeout_millis);
    }

    public Single<Queue> declareQueue(String name, boolean durable) {
        return declareQueue(name, durable, false, false, false, null, settings.operation_timeout_millis);
    }

    /**
     * Declares a queue.
     *
     * @param name the name of the queue, null or empty to let the broker name it
     * @param durable the queue survives a broker restart
     * @param exclusive the queue may only be used by this connection and is deleted when the connection closes.
     *                  Other connections are not allowed to declare it passively either
     * @param passive only check that the queue exists. Fails with the broker's 404 channel error when it does not,
     *                which also closes this channel
     * @param autoDelete the broker deletes the queue when its last consumer is gone
     * @param arguments other properties (construction arguments) for the queue
     * @param timeoutMillis execution timeout, 0 for none
     *
     * @return the declared queue
     */
    public Single<Queue> declareQueue(String name,
                                      boolean durable,
                                      boolean exclusive,
                                      boolean passive,
                                      boolean autoDelete,
                                      Map<String, Object> arguments,
                                      long timeoutMillis) {
        return Single.defer(() -> {
            Queue queue = new Queue(this, name, durable, exclusive, autoDelete, passive, arguments);
            return queue.declare(timeoutMillis)
                    .doOnSuccess(ok -> log.debugWithParams("Queue declared.",
                            "channel", this,
                            "queue", queue,
                            "messageCount", ok.getMessageCount()))
                    .map(ok -> queue);
        });
    }

    public Single<Queue> getQueue(String name) {
        return getQueue(name, true);
    }

    /**
     * With {@code ensure} this is the same as a passive {@link #declareQueue}, otherwise a queue reference is
     * returned without contacting the broker.
     *
     * Use this on a separate channel or right after the channel is created, a missing queue closes the channel.
     */
    public Single<Queue> getQueue(String name, boolean ensure) {
        if (ensure) {
            return declareQueue(name, false, false, true, false, null, settings.operation_timeout_millis);
        }
        return Single.fromCallable(() -> new Queue(this, name, false, false, false, true, null));
    }

    public Completable setQos(int prefetchCount) {
        return setQos(prefetchCount, 0, false, settings.operation_timeout_millis);
    }

    /**
     * @param prefetchCount maximum number of unacknowledged messages, 0 for unlimited
     * @param prefetchSize maximum amount of unacknowledged content in bytes, 0 for unlimited
     * @param global apply the limits to the whole connection instead of each consumer
     */
    public Completable setQos(int prefetchCount, int prefetchSize, boolean global, long timeoutMillis) {
        return execute(ch -> {
            ch.basicQos(prefetchSize, prefetchCount, global);
            return null;
        }, timeoutMillis).toCompletable();
    }

    public Single<AMQP.Queue.DeleteOk> queueDelete(String queueName) {
        return queueDelete(queueName, false, false, settings.operation_timeout_millis);
    }

    /**
     * @param ifUnused only delete the queue if it has no consumers, otherwise the broker fails the call and closes the channel
     * @param ifEmpty only delete the queue if it has no messages, otherwise the broker fails the call and closes the channel
     */
    public Single<AMQP.Queue.DeleteOk> queueDelete(String queueName, boolean ifUnused, boolean ifEmpty, long timeoutMillis) {
        return execute(ch -> ch.queueDelete(queueName, ifUnused, ifEmpty), timeoutMillis);
    }

    public Single<AMQP.Exchange.DeleteOk> exchangeDelete(String exchangeName) {
        return exchangeDelete(exchangeName, false, settings.operation_timeout_millis);
    }

    /**
     * @param ifUnused only delete the exchange if it has no bindings, otherwise the broker fails the call and closes the channel
     */
    public Single<AMQP.Exchange.DeleteOk> exchangeDelete(String exchangeName, boolean ifUnused, long timeoutMillis) {
        return execute(ch -> ch.exchangeDelete(exchangeName, ifUnused), timeoutMillis);
    }

    /**
     * @throws ChannelConfigurationException if the channel uses publisher confirms, transactions can not be combined with them
     */
    public Transaction transaction() {
        if (settings.publisher_confirms) {
            throw new ChannelConfigurationException("Cannot create transaction when publisher confirms are enabled");
        }
        return new Transaction(this);
    }

    public Single<AMQP.Channel.FlowOk> flow(boolean active) {
        return flow(active, settings.operation_timeout_millis);
    }

    /**
     * Asks the broker to stop or restart the flow of messages to this channel.
     */
    public Single<AMQP.Channel.FlowOk> flow(boolean active, long timeoutMillis) {
        return execute(ch -> ch.flow(active), timeoutMillis);
    }

    private <T> Single<T> withTimeout(Single<T> single, long timeoutMillis) {
        return timeoutMillis > 0 ? single.timeout(timeoutMillis, TimeUnit.MILLISECONDS) : single;
    }

    private Completable withTimeout(Completable completable, long timeoutMillis) {
        return timeoutMillis > 0 ? completable.timeout(timeoutMillis, TimeUnit.MILLISECONDS) : completable;
    }

    @Override
    public String toString() {
        Integer number = getNumber();
        return "Channel{" +
                "number=" + (number == null ? "not initialized" : number) +
                ", state=" + state.get() +
                '}';
    }
}
