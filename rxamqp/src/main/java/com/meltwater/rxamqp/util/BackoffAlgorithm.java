package com.meltwater.rxamqp.util;

/**
 * Decides how long to wait before the next attempt of a retried operation.
 */
public interface BackoffAlgorithm {

    /**
     * @param attempt the zero based number of attempts done so far
     * @return the delay in milliseconds before the next attempt
     */
    int getDelayMs(Integer attempt);
}
