package com.meltwater.rxqueue;

import com.rabbitmq.client.AMQP;
import com.rabbitmq.client.Envelope;
import rx.functions.Func0;

/**
 * A message as handed over by a {@link QueueChannel}, before it is shaped for the application handler.
 *
 * The content header is kept behind a decoder and only decoded when {@link #decodeProperties()} is called.
 * Both basic.deliver (subscriptions) and basic.get-ok / basic.get-empty (pop) are represented by this class.
 */
public class RawDelivery {

    private static final RawDelivery EMPTY = new RawDelivery(null, null, null, null, 0);

    private final String consumerTag;
    private final Envelope envelope;
    private final Func0<AMQP.BasicProperties> propertiesDecoder;
    private final byte[] body;
    private final int messageCount;

    private RawDelivery(String consumerTag,
                        Envelope envelope,
                        Func0<AMQP.BasicProperties> propertiesDecoder,
                        byte[] body,
                        int messageCount) {
        this.consumerTag = consumerTag;
        this.envelope = envelope;
        this.propertiesDecoder = propertiesDecoder;
        this.body = body;
        this.messageCount = messageCount;
    }

    /**
     * A message pushed to a consumer (basic.deliver).
     */
    public static RawDelivery delivered(String consumerTag, Envelope envelope, Func0<AMQP.BasicProperties> propertiesDecoder, byte[] body) {
        return new RawDelivery(consumerTag, envelope, propertiesDecoder, body, -1);
    }

    /**
     * A message fetched with basic.get, messageCount is the number of messages left in the queue.
     */
    public static RawDelivery fetched(Envelope envelope, Func0<AMQP.BasicProperties> propertiesDecoder, byte[] body, int messageCount) {
        return new RawDelivery(null, envelope, propertiesDecoder, body, messageCount);
    }

    /**
     * The answer to a basic.get on an empty queue.
     */
    public static RawDelivery empty() {
        return EMPTY;
    }

    public boolean isEmpty() {
        return envelope == null;
    }

    public String getConsumerTag() {
        return consumerTag;
    }

    public Envelope getEnvelope() {
        return envelope;
    }

    public byte[] getBody() {
        return body;
    }

    public int getMessageCount() {
        return messageCount;
    }

    /**
     * Decodes the content header. Returns null for an empty basic.get or when the message carried no header.
     */
    public AMQP.BasicProperties decodeProperties() {
        return propertiesDecoder == null ? null : propertiesDecoder.call();
    }

    @Override
    public String toString() {
        if (isEmpty()) {
            return "RawDelivery{empty}";
        }
        return "RawDelivery{" +
                "consumerTag='" + consumerTag + '\'' +
                ", deliveryTag=" + envelope.getDeliveryTag() +
                ", exchange='" + envelope.getExchange() + '\'' +
                ", routingKey='" + envelope.getRoutingKey() + '\'' +
                ", bodySize=" + (body == null ? 0 : body.length) +
                '}';
    }
}
