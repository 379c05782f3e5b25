package com.meltwater.rxqueue.util;

public class ConstantBackoffAlgorithm implements BackoffAlgorithm {

    private final int backoffMs;

    public ConstantBackoffAlgorithm(int backoffMs) {
        this.backoffMs = backoffMs;
    }

    @Override
    public int getDelayMs(int attempt) {
        return backoffMs;
    }

    @Override
    public String toString() {
        return "ConstantBackoffAlgorithm{backoffMs=" + backoffMs + '}';
    }
}
