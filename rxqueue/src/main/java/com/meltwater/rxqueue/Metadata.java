package com.meltwater.rxqueue;

import com.rabbitmq.client.AMQP;
import com.rabbitmq.client.Envelope;

import java.util.Collections;
import java.util.Date;
import java.util.Map;

import static com.google.common.base.Preconditions.checkState;

/**
 * The routing information and message properties that came with a message.
 *
 * Created once per delivery, and only for handlers that asked for it, since creating it decodes the content header.
 *
 * For a {@link AmqpQueue#pop} on an empty queue {@link #isEmpty()} is true, the routing fields are zero/null
 * and there are no properties.
 */
public class Metadata {

    private final QueueChannel channel;
    private final String consumerTag;
    private final Envelope envelope;
    private final AMQP.BasicProperties properties;

    public Metadata(QueueChannel channel, RawDelivery delivery) {
        this.channel = channel;
        this.consumerTag = delivery.getConsumerTag();
        this.envelope = delivery.getEnvelope();
        this.properties = delivery.decodeProperties();
    }

    public boolean isEmpty() {
        return envelope == null;
    }

    /**
     * Acknowledge this message.
     */
    public void ack() {
        ack(false);
    }

    /**
     * @param multiple true to also acknowledge all earlier unacknowledged messages on the channel
     */
    public void ack(boolean multiple) {
        checkState(!isEmpty(), "there is no message to acknowledge");
        channel.basicAck(envelope.getDeliveryTag(), multiple);
    }

    /**
     * @param requeue true to put the message back on the queue, false to discard or dead-letter it
     */
    public void reject(boolean requeue) {
        checkState(!isEmpty(), "there is no message to reject");
        channel.basicReject(envelope.getDeliveryTag(), requeue);
    }

    public QueueChannel getChannel() {
        return channel;
    }

    public String getConsumerTag() {
        return consumerTag;
    }

    public long getDeliveryTag() {
        return envelope == null ? 0 : envelope.getDeliveryTag();
    }

    public boolean isRedelivered() {
        return envelope != null && envelope.isRedeliver();
    }

    public String getExchange() {
        return envelope == null ? null : envelope.getExchange();
    }

    public String getRoutingKey() {
        return envelope == null ? null : envelope.getRoutingKey();
    }

    /**
     * @return the decoded message properties, null if the message had none
     */
    public AMQP.BasicProperties getProperties() {
        return properties;
    }

    public Map<String, Object> getHeaders() {
        if (properties == null || properties.getHeaders() == null) {
            return Collections.emptyMap();
        }
        return properties.getHeaders();
    }

    public String getContentType() {
        return properties == null ? null : properties.getContentType();
    }

    public String getContentEncoding() {
        return properties == null ? null : properties.getContentEncoding();
    }

    public Integer getDeliveryMode() {
        return properties == null ? null : properties.getDeliveryMode();
    }

    public Integer getPriority() {
        return properties == null ? null : properties.getPriority();
    }

    public String getCorrelationId() {
        return properties == null ? null : properties.getCorrelationId();
    }

    public String getReplyTo() {
        return properties == null ? null : properties.getReplyTo();
    }

    public String getExpiration() {
        return properties == null ? null : properties.getExpiration();
    }

    public String getMessageId() {
        return properties == null ? null : properties.getMessageId();
    }

    public Date getTimestamp() {
        return properties == null ? null : properties.getTimestamp();
    }

    public String getType() {
        return properties == null ? null : properties.getType();
    }

    public String getUserId() {
        return properties == null ? null : properties.getUserId();
    }

    public String getAppId() {
        return properties == null ? null : properties.getAppId();
    }

    public String getClusterId() {
        return properties == null ? null : properties.getClusterId();
    }

    @Override
    public String toString() {
        return "Metadata{" +
                "consumerTag='" + consumerTag + '\'' +
                ", deliveryTag=" + getDeliveryTag() +
                ", redelivered=" + isRedelivered() +
                ", exchange='" + getExchange() + '\'' +
                ", routingKey='" + getRoutingKey() + '\'' +
                ", properties=" + properties +
                '}';
    }
}
