package com.meltwater.rxamqp;

/**
 * The lifecycle states of a {@link Channel}.
 */
public enum ChannelState {
    /** Constructed, never opened. */
    UNINITIALIZED,
    /** Inside initialize or reopen, the underlying channel is being opened. */
    OPENING,
    /** Open and usable. */
    READY,
    /** Closed by an explicit call to {@link Channel#close()}. Only reopen brings it back. */
    CLOSED_BY_USER,
    /** Closed by the broker or because the transport went away. */
    CLOSED_BY_PEER;

    public boolean isClosed() {
        return this == CLOSED_BY_USER || this == CLOSED_BY_PEER;
    }
}
