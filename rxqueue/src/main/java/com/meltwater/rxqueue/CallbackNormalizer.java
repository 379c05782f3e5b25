package com.meltwater.rxqueue;

import com.meltwater.rxqueue.util.Logger;

/**
 * Calls a {@link DeliveryCallback} with the arguments its shape asks for.
 *
 * The {@link Metadata} (and with it the decoded content header) is only built for the metadata and legacy shapes,
 * exactly once per delivery.
 */
final class CallbackNormalizer {

    private static final Logger log = new Logger(CallbackNormalizer.class);

    private final QueueChannel channel;

    CallbackNormalizer(QueueChannel channel) {
        this.channel = channel;
    }

    void dispatch(DeliveryCallback callback, RawDelivery delivery) {
        byte[] payload = delivery.getBody();
        switch (callback.shape) {
            case PAYLOAD:
                callback.payloadHandler.call(payload);
                break;
            case METADATA:
                callback.metadataHandler.call(new Metadata(channel, delivery), payload);
                break;
            case LEGACY:
                Metadata metadata = new Metadata(channel, delivery);
                callback.legacyHandler.handle(metadata,
                        payload,
                        metadata.getDeliveryTag(),
                        metadata.isRedelivered(),
                        metadata.getExchange(),
                        metadata.getRoutingKey(),
                        metadata.getConsumerTag());
                break;
        }
    }

    /**
     * Like {@link #dispatch} but an exception thrown by the handler is logged instead of propagated,
     * so one bad message does not end a subscription.
     */
    void dispatchSafely(DeliveryCallback callback, RawDelivery delivery) {
        try {
            dispatch(callback, delivery);
        } catch (RuntimeException e) {
            log.errorWithParams("Unhandled error in message handler.", e,
                    "delivery", delivery,
                    "callback", callback);
        }
    }
}
