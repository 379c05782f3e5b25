package com.meltwater.rxqueue;

import rx.functions.Action1;
import rx.functions.Action2;

import static com.google.common.base.Preconditions.checkNotNull;

/**
 * An application message handler together with the shape of arguments it wants.
 *
 * <ul>
 *     <li>{@link #payloadOnly(Action1)} receives the message body only. No {@link Metadata} is created.</li>
 *     <li>{@link #withMetadata(Action2)} receives the {@link Metadata} and the body.</li>
 *     <li>{@link #legacy(LegacyDeliveryHandler)} receives the metadata, the body and the routing fields as positional arguments.</li>
 * </ul>
 *
 * @see CallbackNormalizer
 */
public final class DeliveryCallback {

    enum Shape { PAYLOAD, METADATA, LEGACY }

    final Shape shape;
    final Action1<byte[]> payloadHandler;
    final Action2<Metadata, byte[]> metadataHandler;
    final LegacyDeliveryHandler legacyHandler;

    private DeliveryCallback(Shape shape,
                             Action1<byte[]> payloadHandler,
                             Action2<Metadata, byte[]> metadataHandler,
                             LegacyDeliveryHandler legacyHandler) {
        this.shape = shape;
        this.payloadHandler = payloadHandler;
        this.metadataHandler = metadataHandler;
        this.legacyHandler = legacyHandler;
    }

    public static DeliveryCallback payloadOnly(Action1<byte[]> handler) {
        return new DeliveryCallback(Shape.PAYLOAD, checkNotNull(handler), null, null);
    }

    public static DeliveryCallback withMetadata(Action2<Metadata, byte[]> handler) {
        return new DeliveryCallback(Shape.METADATA, null, checkNotNull(handler), null);
    }

    public static DeliveryCallback legacy(LegacyDeliveryHandler handler) {
        return new DeliveryCallback(Shape.LEGACY, null, null, checkNotNull(handler));
    }

    @Override
    public String toString() {
        return "DeliveryCallback{" + shape + '}';
    }
}
