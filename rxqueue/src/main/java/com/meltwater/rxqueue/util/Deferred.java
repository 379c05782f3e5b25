package com.meltwater.rxqueue.util;

import rx.functions.Action0;

import java.util.ArrayDeque;
import java.util.Queue;

/**
 * A single-fire gate. Continuations registered before {@link #fire()} are queued and run in registration
 * order when it fires; continuations registered afterwards run immediately on the calling thread.
 *
 * There is no failure or cancellation path, a gate either stays pending or gets fulfilled once.
 *
 * NOTE this class is not thread safe. All calls are expected to come from the same execution context
 * (or be guarded by the owner's monitor).
 */
public class Deferred {

    private final Queue<Action0> continuations = new ArrayDeque<>();
    private boolean fulfilled = false;

    public void onFulfilled(Action0 continuation) {
        if (fulfilled) {
            continuation.call();
        } else {
            continuations.add(continuation);
        }
    }

    public void fire() {
        if (fulfilled) {
            return;
        }
        fulfilled = true;
        Action0 next;
        while ((next = continuations.poll()) != null) {
            next.call();
        }
    }

    public boolean isFulfilled() {
        return fulfilled;
    }

    public int pending() {
        return continuations.size();
    }

    @Override
    public String toString() {
        return "Deferred{" +
                "fulfilled=" + fulfilled +
                ", pending=" + continuations.size() +
                '}';
    }
}
