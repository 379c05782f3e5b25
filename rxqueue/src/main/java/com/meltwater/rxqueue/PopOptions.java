package com.meltwater.rxqueue;

/**
 * Options for {@link AmqpQueue#pop}.
 */
public class PopOptions {

    private boolean ack = false;

    /**
     * @return true if the fetched message must be acknowledged explicitly, false for automatic acknowledgement
     */
    public boolean isAck() {
        return ack;
    }

    public PopOptions withAck(boolean ack) {
        this.ack = ack;
        return this;
    }

    @Override
    public String toString() {
        return "{ack:" + ack + '}';
    }
}
