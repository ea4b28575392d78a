package com.meltwater.rxamqp;

import rx.Completable;

/**
 * The connection a {@link Channel} lives on. Establishing and re-establishing the connection is the
 * responsibility of the implementation.
 */
public interface AmqpConnection {

    /**
     * @return completes as soon as the connection is established, immediately if it already is
     */
    Completable connected();

    /**
     * @return the established transport
     * @throws IllegalStateException if the connection is not established
     */
    Transport getTransport();
}
