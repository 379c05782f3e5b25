package com.meltwater.rxqueue;

/**
 * Client side lifecycle status of an {@link AmqpQueue}.
 */
public enum QueueStatus {

    /**
     * The declaration has been requested but the broker has not confirmed it yet.
     */
    OPENING,

    /**
     * The broker confirmed the declaration, or the queue was declared without waiting for a confirmation.
     */
    OPENED,

    /**
     * {@link AmqpQueue#bind} has been called at least once. Set before the broker confirms the binding
     * and kept until the queue is reset.
     */
    UNBOUND
}
