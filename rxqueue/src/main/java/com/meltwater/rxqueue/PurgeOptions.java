package com.meltwater.rxqueue;

/**
 * Options for {@link AmqpQueue#purge}.
 */
public class PurgeOptions {

    private boolean no_wait = false;

    public boolean isNo_wait() {
        return no_wait;
    }

    public PurgeOptions withNoWait(boolean no_wait) {
        this.no_wait = no_wait;
        return this;
    }

    @Override
    public String toString() {
        return "{no_wait:" + no_wait + '}';
    }
}
