package com.meltwater.rxamqp;

import com.meltwater.rxamqp.util.Logger;
import rx.Single;
import rx.functions.Func1;

import java.util.concurrent.CancellationException;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Opens a {@link Channel} for the duration of a block and always closes it afterwards.
 *
 * <pre>
 * try (ChannelScope scope = ChannelScope.open(channel)) {
 *     scope.channel().declareQueue("jobs", true).toBlocking().value();
 * }
 * </pre>
 *
 * When the block fails the failure should be recorded with {@link #fail(Throwable)}, it is then handed to
 * {@link Channel#close(Throwable)} as the close reason. {@link #using(Channel, Func1)} and {@link #single(Channel, Func1)}
 * do that for you.
 */
public class ChannelScope implements AutoCloseable {

    private static final Logger log = new Logger(ChannelScope.class);

    private final Channel channel;
    private final AtomicBoolean closed = new AtomicBoolean(false);
    private volatile Throwable failure;

    private ChannelScope(Channel channel) {
        this.channel = channel;
    }

    /**
     * Blocks until the channel is ready, initializing it if needed.
     */
    public static ChannelScope open(Channel channel) {
        return open(channel, channel.getSettings().operation_timeout_millis);
    }

    public static ChannelScope open(Channel channel, long timeoutMillis) {
        channel.ensureReady(timeoutMillis).toBlocking().value();
        return new ChannelScope(channel);
    }

    public Channel channel() {
        return channel;
    }

    /**
     * Records the error the scope is left with.
     */
    public void fail(Throwable error) {
        this.failure = error;
    }

    /**
     * Closes the channel with the recorded failure as reason. Only the first call has an effect.
     */
    @Override
    public void close() {
        if (closed.compareAndSet(false, true)) {
            channel.close(failure).await();
        }
    }

    /**
     * Runs the function with a ready channel and closes the channel when it returns or throws.
     */
    public static <T> T using(Channel channel, Func1<Channel, T> function) {
        try (ChannelScope scope = open(channel)) {
            try {
                return function.call(scope.channel());
            } catch (RuntimeException | Error e) {
                scope.fail(e);
                throw e;
            }
        }
    }

    /**
     * The reactive form of {@link #using(Channel, Func1)}. The channel is made ready on subscription and closed once
     * the single produced by the function succeeds, fails or is unsubscribed from. An unsubscribe closes the channel
     * with a {@link CancellationException} as reason.
     */
    public static <T> Single<T> single(Channel channel, Func1<Channel, Single<T>> function) {
        return Single.defer(() -> {
            AtomicBoolean released = new AtomicBoolean(false);
            return channel.ensureReady()
                    .flatMap(function::call)
                    .flatMap(result -> released.compareAndSet(false, true)
                            ? channel.close().andThen(Single.just(result))
                            : Single.just(result))
                    .onErrorResumeNext(error -> released.compareAndSet(false, true)
                            ? channel.close(error).onErrorComplete().andThen(Single.<T>error(error))
                            : Single.<T>error(error))
                    .doOnUnsubscribe(() -> {
                        if (released.compareAndSet(false, true)) {
                            log.debugWithParams("Scope unsubscribed, closing channel.", "channel", channel);
                            channel.close(new CancellationException("Channel scope was unsubscribed"))
                                    .subscribe(() -> {}, e -> log.warnWithParams("Failed to close channel.", e, "channel", channel));
                        }
                    });
        });
    }
}
