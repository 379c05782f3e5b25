package com.meltwater.rxqueue.util;

public class FibonacciBackoffAlgorithm implements BackoffAlgorithm {

    private static final int[] SEQUENCE_SEC = new int[] { 1, 1, 2, 3, 5, 8, 13, 21, 34};

    @Override
    public int getDelayMs(int attempt) {
        int index = Math.min(attempt, SEQUENCE_SEC.length - 1);
        return 1_000 * SEQUENCE_SEC[index];
    }

    @Override
    public String toString() {
        return "FibonacciBackoffAlgorithm";
    }
}
