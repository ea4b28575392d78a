package com.meltwater.rxamqp;

/**
 * Thrown when an operation is not allowed in the current lifecycle state of a {@link Channel}.
 * The state of the channel is left unchanged.
 */
public class ChannelLifecycleException extends IllegalStateException {

    public enum Reason {
        /** initialize called on a channel that is already open or opening */
        ALREADY_INITIALIZED,
        /** initialize called on a channel that was closed with close() and not reopened */
        CLOSED_BY_USER,
        /** the channel has never been opened */
        NOT_OPENED,
        /** the channel has been closed, by the user or by the broker */
        CLOSED
    }

    private final Reason reason;

    public ChannelLifecycleException(Reason reason, String message) {
        super(message);
        this.reason = reason;
    }

    public Reason getReason() {
        return reason;
    }
}
