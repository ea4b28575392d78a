package com.meltwater.rxamqp;

/**
 * An operation issued on the live {@link UnderlayChannel} of a {@link Channel}.
 *
 * @see Channel#execute(ChannelOperation, long)
 */
@FunctionalInterface
public interface ChannelOperation<T> {
    T call(UnderlayChannel channel) throws Exception;
}
