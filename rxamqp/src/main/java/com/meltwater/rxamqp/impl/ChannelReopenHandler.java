package com.meltwater.rxamqp.impl;

import com.meltwater.rxamqp.Channel;
import com.meltwater.rxamqp.ChannelState;
import com.meltwater.rxamqp.util.BackoffAlgorithm;
import com.meltwater.rxamqp.util.Logger;
import rx.Completable;
import rx.Observable;
import rx.Scheduler;
import rx.Subscription;
import rx.functions.Action2;
import rx.functions.Func1;
import rx.schedulers.Schedulers;
import rx.subscriptions.Subscriptions;

import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Reopens a {@link Channel} after the broker or the transport closed it.
 *
 * A close with a reason that was not requested by the user schedules a {@link Channel#reopen()}. Failed reopen attempts
 * are retried with the delays of the {@link BackoffAlgorithm} until {@code maxAttempts} is reached. The attempt counter
 * is reset after every successful reopen.
 */
public class ChannelReopenHandler implements Func1<Observable<? extends Throwable>, Observable<?>> {

    public static final int RETRY_FOREVER = -1;

    private static final Logger log = new Logger(ChannelReopenHandler.class);

    private final Channel channel;
    private final BackoffAlgorithm backoffAlgorithm;
    private final int maxAttempts;
    private final Scheduler scheduler;

    private final AtomicInteger reopenAttempt = new AtomicInteger();
    private final AtomicInteger reopenCount = new AtomicInteger();
    private final AtomicReference<Subscription> pending = new AtomicReference<>(Subscriptions.unsubscribed());
    private final Action2<Channel, Throwable> closeHandler = (ch, reason) -> onClose(reason);

    public ChannelReopenHandler(Channel channel, BackoffAlgorithm backoffAlgorithm, int maxAttempts) {
        this(channel, backoffAlgorithm, maxAttempts, Schedulers.computation());
    }

    public ChannelReopenHandler(Channel channel, BackoffAlgorithm backoffAlgorithm, int maxAttempts, Scheduler scheduler) {
        assert maxAttempts == RETRY_FOREVER || maxAttempts > 0;
        this.channel = channel;
        this.backoffAlgorithm = backoffAlgorithm;
        this.maxAttempts = maxAttempts;
        this.scheduler = scheduler;
    }

    /**
     * Starts watching the channel.
     */
    public ChannelReopenHandler start() {
        channel.getCloseCallbacks().add(closeHandler);
        return this;
    }

    /**
     * Stops watching the channel and cancels a scheduled reopen.
     */
    public void stop() {
        channel.getCloseCallbacks().discard(closeHandler);
        pending.get().unsubscribe();
    }

    /**
     * @return the number of times the channel was successfully reopened
     */
    public int getReopenCount() {
        return reopenCount.get();
    }

    /**
     * @return the number of failed reopen attempts since the last successful reopen
     */
    public int getFailedAttempts() {
        return reopenAttempt.get();
    }

    public boolean isReopenPending() {
        return !pending.get().isUnsubscribed();
    }

    private void onClose(Throwable reason) {
        if (reason == null || channel.getState() == ChannelState.CLOSED_BY_USER) {
            log.debugWithParams("Channel closed without error, not reopening.", "channel", channel);
            return;
        }
        if (isReopenPending()) {
            log.debugWithParams("Reopen already scheduled.", "channel", channel);
            return;
        }
        log.infoWithParams("Channel closed with error, scheduling reopen.",
                "channel", channel,
                "reason", reason,
                "backoff", backoffAlgorithm);
        Subscription subscription = Completable.timer(backoffAlgorithm.getDelayMs(0), TimeUnit.MILLISECONDS, scheduler)
                .andThen(Completable.defer(this::reopen).retryWhen(this))
                .subscribe(
                        () -> {
                            reset();
                            reopenCount.incrementAndGet();
                            log.infoWithParams("Channel reopened.", "channel", channel);
                        },
                        e -> log.errorWithParams("Giving up reopening channel.", e,
                                "channel", channel,
                                "attempts", reopenAttempt.get()));
        pending.set(subscription);
    }

    private Completable reopen() {
        if (channel.getState() == ChannelState.CLOSED_BY_USER) {
            log.infoWithParams("Channel was closed by the user, not reopening.", "channel", channel);
            return Completable.complete();
        }
        return channel.reopen();
    }

    @Override
    public Observable<?> call(Observable<? extends Throwable> errors) {
        return errors.flatMap(throwable -> {
            int attempt = reopenAttempt.incrementAndGet();
            if (maxAttempts == RETRY_FOREVER || attempt < maxAttempts) {
                final int delayMs = backoffAlgorithm.getDelayMs(attempt);
                log.infoWithParams("Scheduling attempt to reopen channel.",
                        "channel", channel,
                        "attempt", attempt,
                        "delayMs", delayMs,
                        "error", throwable.toString());
                return Observable.timer(delayMs, TimeUnit.MILLISECONDS, scheduler);
            } else {
                return Observable.error(throwable);
            }
        });
    }

    public void reset() {
        reopenAttempt.set(0);
    }
}
