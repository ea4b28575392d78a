package com.meltwater.rxamqp.util;

public class FibonacciBackoffAlgorithm implements BackoffAlgorithm{

    private static final int[] SEQUENCE = new int[] { 1, 1, 2, 3, 5, 8, 13, 21, 34};

    private final int unitMs;

    public FibonacciBackoffAlgorithm() {
        this(1_000);
    }

    /**
     * @param unitMs the length of one step in the sequence, the default is one second
     */
    public FibonacciBackoffAlgorithm(int unitMs) {
        this.unitMs = unitMs;
    }

    private int getDelayUnits(int attempt) {
        return attempt < SEQUENCE.length ? SEQUENCE[attempt] : SEQUENCE[SEQUENCE.length-1];
    }

    @Override
    public int getDelayMs(Integer attempt) {
        return unitMs * getDelayUnits(attempt);
    }

    @Override
    public String toString() {
        return "fibonacci(" + unitMs + "ms)";
    }
}
