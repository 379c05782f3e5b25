package com.meltwater.rxqueue;

/**
 * Options for {@link AmqpQueue#unsubscribe}. No_wait defaults to true.
 */
public class UnsubscribeOptions {

    private boolean no_wait = true;

    public boolean isNo_wait() {
        return no_wait;
    }

    public UnsubscribeOptions withNoWait(boolean no_wait) {
        this.no_wait = no_wait;
        return this;
    }

    @Override
    public String toString() {
        return "{no_wait:" + no_wait + '}';
    }
}
