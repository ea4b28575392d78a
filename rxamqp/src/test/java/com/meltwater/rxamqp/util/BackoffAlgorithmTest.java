package com.meltwater.rxamqp.util;

import org.junit.Test;

import static org.hamcrest.Matchers.is;
import static org.junit.Assert.assertThat;

public class BackoffAlgorithmTest {

    @Test
    public void fibonacci_delays_grow_and_level_off() {
        FibonacciBackoffAlgorithm backoff = new FibonacciBackoffAlgorithm(10);

        assertThat(backoff.getDelayMs(0), is(10));
        assertThat(backoff.getDelayMs(1), is(10));
        assertThat(backoff.getDelayMs(4), is(50));
        assertThat(backoff.getDelayMs(8), is(340));
        assertThat(backoff.getDelayMs(100), is(340));
    }

    @Test
    public void fibonacci_defaults_to_seconds() {
        assertThat(new FibonacciBackoffAlgorithm().getDelayMs(2), is(2000));
    }

    @Test
    public void constant_delay_ignores_the_attempt() {
        ConstantBackoffAlgorithm backoff = new ConstantBackoffAlgorithm(25);

        assertThat(backoff.getDelayMs(0), is(25));
        assertThat(backoff.getDelayMs(42), is(25));
    }
}
