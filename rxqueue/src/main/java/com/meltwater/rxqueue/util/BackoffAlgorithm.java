package com.meltwater.rxqueue.util;

/**
 * Decides how long to wait before the next attempt to (re)open a channel.
 */
public interface BackoffAlgorithm {

    /**
     * @param attempt the zero based number of attempts made so far
     * @return the delay in milliseconds before the next attempt
     */
    int getDelayMs(int attempt);
}
