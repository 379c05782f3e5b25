package com.meltwater.rxqueue;

import com.meltwater.rxqueue.util.BackoffAlgorithm;
import com.meltwater.rxqueue.util.FibonacciBackoffAlgorithm;

import static com.google.common.base.Preconditions.checkNotNull;

/**
 * This class contains the settings used by {@link com.meltwater.rxqueue.impl.RabbitQueueChannel}.
 */
public class ChannelSettings {

    public static final int RETRY_FOREVER = -1;
    public static final int DEFAULT_RETRY_COUNT = RETRY_FOREVER;
    public static final int DEFAULT_PREFETCH_COUNT = 0;
    public static final long DEFAULT_CLOSE_TIMEOUT_MILLIS = 10_000;

    private int retry_count                     = DEFAULT_RETRY_COUNT;
    private int pre_fetch_count                 = DEFAULT_PREFETCH_COUNT; //0 = unlimited
    private long close_timeout_millis           = DEFAULT_CLOSE_TIMEOUT_MILLIS;
    private BackoffAlgorithm backoff_algorithm  = new FibonacciBackoffAlgorithm();

    public int getRetry_count() {
        return retry_count;
    }

    public int getPre_fetch_count() {
        return pre_fetch_count;
    }

    public long getClose_timeout_millis() {
        return close_timeout_millis;
    }

    public BackoffAlgorithm getBackoff_algorithm() {
        return backoff_algorithm;
    }

    /**
     * @param retry_count how many times to retry opening the channel, {@link #RETRY_FOREVER} to never give up
     */
    public ChannelSettings withRetryCount(int retry_count) {
        assert retry_count >= RETRY_FOREVER;
        this.retry_count = retry_count;
        return this;
    }

    public ChannelSettings withPreFetchCount(int pre_fetch_count) {
        assert pre_fetch_count >= 0;
        this.pre_fetch_count = pre_fetch_count;
        return this;
    }

    public ChannelSettings withCloseTimeoutMillis(long close_timeout_millis) {
        assert close_timeout_millis >= 0;
        this.close_timeout_millis = close_timeout_millis;
        return this;
    }

    public ChannelSettings withBackoffAlgorithm(BackoffAlgorithm backoff_algorithm) {
        this.backoff_algorithm = checkNotNull(backoff_algorithm);
        return this;
    }

    @Override
    public String toString() {
        return "{" +
                "retry_count:" + retry_count +
                ", pre_fetch_count:" + pre_fetch_count +
                ", close_timeout_millis:" + close_timeout_millis +
                ", backoff_algorithm:" + backoff_algorithm +
                '}';
    }
}
