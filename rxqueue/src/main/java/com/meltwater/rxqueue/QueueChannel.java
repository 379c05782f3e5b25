package com.meltwater.rxqueue;

import com.rabbitmq.client.AMQP;
import com.rabbitmq.client.Connection;
import rx.functions.Action0;
import rx.functions.Action1;

import java.util.Map;

/**
 * The channel an {@link AmqpQueue} talks to the broker through.
 *
 * Every method returns immediately. Continuations and completion callbacks are invoked later on the channel's
 * execution context, one at a time and in the order the corresponding requests were made. Completion callbacks
 * may be null, in which case the reply (if any) is dropped.
 *
 * @see com.meltwater.rxqueue.impl.RabbitQueueChannel
 */
public interface QueueChannel {

    /**
     * Runs the continuation once the channel is open, right away if it already is.
     * Continuations registered while the channel is not open run in registration order when it opens.
     */
    void onceOpen(Action0 continuation);

    /**
     * Checking this method should only be for information, the state can change right after the call.
     *
     * @return true when the channel is open
     */
    boolean isOpen();

    /**
     * @return the connection carrying this channel
     */
    Connection getConnection();

    /**
     * Associates a queue with this channel. Registered queues are {@link AmqpQueue#reset() reset} when the
     * channel fails, because the broker discards their consumers and (for exclusive queues) the queues themselves.
     */
    void register(AmqpQueue queue);

    /**
     * @see com.rabbitmq.client.AMQP.Queue.Declare
     */
    void queueDeclare(String queue,
                      boolean passive,
                      boolean durable,
                      boolean exclusive,
                      boolean autoDelete,
                      boolean noWait,
                      Map<String, Object> arguments,
                      Action1<AMQP.Queue.DeclareOk> onDeclareOk);

    /**
     * @see com.rabbitmq.client.AMQP.Queue.Bind
     */
    void queueBind(String queue,
                   String exchange,
                   String routingKey,
                   boolean noWait,
                   Map<String, Object> arguments,
                   Action1<AMQP.Queue.BindOk> onBindOk);

    /**
     * queue.unbind has no no-wait variant in AMQP 0-9-1.
     *
     * @see com.rabbitmq.client.AMQP.Queue.Unbind
     */
    void queueUnbind(String queue,
                     String exchange,
                     String routingKey,
                     Map<String, Object> arguments,
                     Action1<AMQP.Queue.UnbindOk> onUnbindOk);

    /**
     * @see com.rabbitmq.client.AMQP.Queue.Delete
     */
    void queueDelete(String queue,
                     boolean ifUnused,
                     boolean ifEmpty,
                     boolean noWait,
                     Action1<AMQP.Queue.DeleteOk> onDeleteOk);

    /**
     * @see com.rabbitmq.client.AMQP.Queue.Purge
     */
    void queuePurge(String queue, boolean noWait, Action1<AMQP.Queue.PurgeOk> onPurgeOk);

    /**
     * Fetches a single message. The callback receives {@link RawDelivery#empty()} if the queue had no messages.
     *
     * @see com.rabbitmq.client.AMQP.Basic.Get
     */
    void basicGet(String queue, boolean autoAck, Action1<RawDelivery> onResult);

    /**
     * Registers a consumer. onDelivery is called for every message pushed to it until it is cancelled.
     *
     * @param consumerTag the client generated consumer tag, the broker generates one if empty
     * @see com.rabbitmq.client.AMQP.Basic.Consume
     */
    void basicConsume(String queue,
                      String consumerTag,
                      boolean autoAck,
                      boolean exclusive,
                      boolean noLocal,
                      boolean noWait,
                      Map<String, Object> arguments,
                      Action1<RawDelivery> onDelivery,
                      Action1<AMQP.Basic.ConsumeOk> onConsumeOk);

    /**
     * @see com.rabbitmq.client.AMQP.Basic.Cancel
     */
    void basicCancel(String consumerTag, boolean noWait, Action1<AMQP.Basic.CancelOk> onCancelOk);

    /**
     * @see com.rabbitmq.client.AMQP.Basic.Publish
     */
    void basicPublish(String exchange, String routingKey, AMQP.BasicProperties properties, byte[] body);

    /**
     * @see com.rabbitmq.client.AMQP.Basic.Ack
     */
    void basicAck(long deliveryTag, boolean multiple);

    /**
     * @see com.rabbitmq.client.AMQP.Basic.Reject
     */
    void basicReject(long deliveryTag, boolean requeue);
}
