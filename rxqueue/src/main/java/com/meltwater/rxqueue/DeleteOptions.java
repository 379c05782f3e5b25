package com.meltwater.rxqueue;

/**
 * Options for {@link AmqpQueue#delete}. All flags default to false.
 */
public class DeleteOptions {

    private boolean if_unused   = false;
    private boolean if_empty    = false;
    private boolean no_wait     = false;

    public boolean isIf_unused() {
        return if_unused;
    }

    public boolean isIf_empty() {
        return if_empty;
    }

    public boolean isNo_wait() {
        return no_wait;
    }

    /**
     * @param if_unused only delete the queue if it has no consumers, the broker raises a channel error otherwise
     */
    public DeleteOptions withIfUnused(boolean if_unused) {
        this.if_unused = if_unused;
        return this;
    }

    /**
     * @param if_empty only delete the queue if it has no messages, the broker raises a channel error otherwise
     */
    public DeleteOptions withIfEmpty(boolean if_empty) {
        this.if_empty = if_empty;
        return this;
    }

    public DeleteOptions withNoWait(boolean no_wait) {
        this.no_wait = no_wait;
        return this;
    }

    @Override
    public String toString() {
        return "{" +
                "if_unused:" + if_unused +
                ", if_empty:" + if_empty +
                ", no_wait:" + no_wait +
                '}';
    }
}
