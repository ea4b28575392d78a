package com.meltwater.rxamqp.util;

public class ConstantBackoffAlgorithm implements BackoffAlgorithm {
    private final Integer backoffMs;

    public ConstantBackoffAlgorithm(Integer backoffMs) {
        assert backoffMs >= 0;
        this.backoffMs = backoffMs;
    }

    @Override
    public int getDelayMs(Integer attempt) {
        return backoffMs;
    }

    @Override
    public String toString() {
        return "constant(" + backoffMs + "ms)";
    }
}
