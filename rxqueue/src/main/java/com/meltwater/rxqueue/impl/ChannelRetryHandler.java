package com.meltwater.rxqueue.impl;

import com.meltwater.rxqueue.util.BackoffAlgorithm;
import com.meltwater.rxqueue.util.Logger;
import rx.Observable;
import rx.functions.Func1;

import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static com.meltwater.rxqueue.ChannelSettings.RETRY_FOREVER;

/**
 * Used with {@link Observable#retryWhen(Func1)} to re-try opening a channel with a back-off delay.
 */
public class ChannelRetryHandler implements Func1<Observable<? extends Throwable>, Observable<?>> {

    private static final Logger log = new Logger(ChannelRetryHandler.class);

    private final AtomicInteger attempt = new AtomicInteger();
    private final BackoffAlgorithm backoffAlgorithm;
    private final int maxAttempts;

    public ChannelRetryHandler(BackoffAlgorithm backoffAlgorithm, int maxAttempts) {
        this.backoffAlgorithm = backoffAlgorithm;
        this.maxAttempts = maxAttempts;
    }

    @Override
    public Observable<?> call(Observable<? extends Throwable> errors) {
        return errors.flatMap(throwable -> {
            int current = attempt.get();
            if (maxAttempts == RETRY_FOREVER || current < maxAttempts) {
                final int delayMs = backoffAlgorithm.getDelayMs(current);
                attempt.incrementAndGet();
                log.infoWithParams("Scheduling another attempt to open the channel.",
                        "attempt", attempt.get(),
                        "delayMs", delayMs,
                        "error", throwable.toString());
                return Observable.timer(delayMs, TimeUnit.MILLISECONDS);
            }
            return Observable.error(throwable);
        });
    }

    public int getAttempts() {
        return attempt.get();
    }
}
