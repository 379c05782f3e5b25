package com.meltwater.rxqueue;

/**
 * The wide handler form kept for callers written against the positional delivery callback.
 * New code should use {@link DeliveryCallback#withMetadata} instead, every argument after the payload is also
 * available on the {@link Metadata}.
 */
public interface LegacyDeliveryHandler {

    /**
     * @param consumerTag the consumer tag of the subscription, null for {@link AmqpQueue#pop}
     */
    void handle(Metadata metadata,
                byte[] payload,
                long deliveryTag,
                boolean redelivered,
                String exchange,
                String routingKey,
                String consumerTag);
}
