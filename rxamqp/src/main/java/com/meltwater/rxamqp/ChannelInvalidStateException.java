package com.meltwater.rxamqp;

/**
 * Thrown by {@link Channel#getUnderlayChannel()} when there is no usable underlying channel.
 * The reason is either {@link Reason#NOT_OPENED} or {@link Reason#CLOSED}.
 */
public class ChannelInvalidStateException extends ChannelLifecycleException {

    public ChannelInvalidStateException(Reason reason, String message) {
        super(reason, message);
    }
}
