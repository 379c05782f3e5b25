package com.meltwater.rxqueue.impl;

import com.google.common.util.concurrent.ThreadFactoryBuilder;
import com.meltwater.rxqueue.AmqpQueue;
import com.meltwater.rxqueue.ChannelSettings;
import com.meltwater.rxqueue.QueueChannel;
import com.meltwater.rxqueue.RawDelivery;
import com.meltwater.rxqueue.util.Deferred;
import com.meltwater.rxqueue.util.Logger;
import com.rabbitmq.client.AMQP;
import com.rabbitmq.client.Channel;
import com.rabbitmq.client.Connection;
import com.rabbitmq.client.DefaultConsumer;
import com.rabbitmq.client.Envelope;
import com.rabbitmq.client.GetResponse;
import com.rabbitmq.client.ShutdownSignalException;
import com.rabbitmq.client.impl.AMQImpl;
import org.joda.time.DateTime;
import org.joda.time.DateTimeZone;
import rx.Observable;
import rx.Scheduler;
import rx.functions.Action0;
import rx.functions.Action1;
import rx.schedulers.Schedulers;

import java.io.IOException;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;

import static com.google.common.base.Preconditions.checkNotNull;
import static com.google.common.base.Preconditions.checkState;

/**
 * A {@link QueueChannel} backed by a {@link Channel} of the RabbitMQ java client.
 *
 * Two single threaded workers are used:
 * <ul>
 *     <li>the event loop, where all continuations and completion callbacks run, one at a time</li>
 *     <li>the rpc worker, where the (blocking) calls on the underlying channel are made, in the order they were requested</li>
 * </ul>
 *
 * If the underlying channel is shut down by anything other than {@link #close()} (typically a channel error raised by
 * the broker) the readiness gate is replaced, all registered queues are reset and a new channel is opened on the
 * same connection with the configured back-off. Work queued by the reset queues runs once the new channel is open.
 */
public class RabbitQueueChannel implements QueueChannel {

    private static final Logger log = new Logger(RabbitQueueChannel.class);
    private static final AtomicInteger channelCount = new AtomicInteger();

    private final Connection connection;
    private final ChannelSettings settings;
    private final String threadNamePrefix;

    private final ExecutorService loopExecutor;
    private final ExecutorService rpcExecutor;
    private final Scheduler loopScheduler;
    private final Scheduler rpcScheduler;
    private final Scheduler.Worker loop;
    private final Scheduler.Worker rpc;

    private final List<AmqpQueue> queues = new CopyOnWriteArrayList<>();

    //only touched on the event loop
    private Deferred openGate = new Deferred();
    private DateTime openedAt;

    private volatile Channel delegate;
    private volatile boolean started = false;
    private volatile boolean closed = false;

    public RabbitQueueChannel(Connection connection, ChannelSettings settings) {
        this.connection = checkNotNull(connection, "connection must not be null");
        this.settings = checkNotNull(settings, "settings must not be null");
        this.threadNamePrefix = "queue-channel-" + channelCount.incrementAndGet();
        this.loopExecutor = Executors.newSingleThreadExecutor(
                new ThreadFactoryBuilder().setNameFormat(threadNamePrefix + "-loop").setDaemon(true).build());
        this.rpcExecutor = Executors.newSingleThreadExecutor(
                new ThreadFactoryBuilder().setNameFormat(threadNamePrefix + "-rpc").setDaemon(true).build());
        this.loopScheduler = Schedulers.from(loopExecutor);
        this.rpcScheduler = Schedulers.from(rpcExecutor);
        this.loop = loopScheduler.createWorker();
        this.rpc = rpcScheduler.createWorker();
    }

    /**
     * Opens the underlying channel in the background. Continuations passed to {@link #onceOpen} run once it is open.
     *
     * @return this channel
     */
    public synchronized RabbitQueueChannel open() {
        checkState(!closed, "channel has been closed");
        if (!started) {
            started = true;
            openDelegate();
        }
        return this;
    }

    private void openDelegate() {
        final ChannelRetryHandler retryHandler = new ChannelRetryHandler(settings.getBackoff_algorithm(), settings.getRetry_count());
        Observable.fromCallable(this::createDelegate)
                .subscribeOn(rpcScheduler)
                // stop re-trying once closed
                .retryWhen(errors -> retryHandler.call(errors.takeWhile(error -> !closed)))
                .observeOn(loopScheduler)
                .subscribe(this::onOpened,
                        error -> log.errorWithParams("Giving up opening the channel.", error,
                                "channel", threadNamePrefix,
                                "settings", settings));
    }

    private Channel createDelegate() throws IOException {
        checkState(!closed, "channel has been closed");
        final Channel channel = connection.createChannel();
        if (channel == null) {
            throw new IOException("No channel number available on the connection");
        }
        if (settings.getPre_fetch_count() > 0) {
            channel.basicQos(settings.getPre_fetch_count());
        }
        channel.addShutdownListener(cause -> onShutdown(channel, cause));
        return channel;
    }

    private void onOpened(Channel channel) {
        if (closed) {
            closeQuietly(channel);
            return;
        }
        delegate = channel;
        openedAt = new DateTime(DateTimeZone.UTC);
        log.infoWithParams("Successfully opened channel.",
                "channel", threadNamePrefix,
                "channelNr", channel.getChannelNumber(),
                "openedAt", openedAt,
                "queues", queues.size());
        openGate.fire();
    }

    private void onShutdown(Channel channel, ShutdownSignalException cause) {
        if (closed || cause.isInitiatedByApplication()) {
            log.infoWithParams("Channel shut down.",
                    "channel", threadNamePrefix,
                    "channelNr", channel.getChannelNumber());
            return;
        }
        onLoop("channel failure", () -> onChannelFailure(channel, cause));
    }

    private void onChannelFailure(Channel channel, ShutdownSignalException cause) {
        if (channel != delegate || closed) {
            return;
        }
        log.errorWithParams("Channel failed. Resetting queues and re-opening the channel.", cause,
                "channel", threadNamePrefix,
                "channelNr", channel.getChannelNumber(),
                "openedAt", openedAt,
                "queues", queues.size());
        delegate = null;
        openGate = new Deferred();
        for (AmqpQueue queue : queues) {
            queue.reset();
        }
        if (connection.isOpen()) {
            openDelegate();
        } else {
            log.warnWithParams("Connection is closed, the channel will not be re-opened.",
                    "channel", threadNamePrefix);
        }
    }

    @Override
    public void onceOpen(Action0 continuation) {
        checkNotNull(continuation);
        onLoop("continuation", () -> openGate.onFulfilled(() -> runSafely("continuation", continuation)));
    }

    @Override
    public boolean isOpen() {
        final Channel channel = delegate;
        return channel != null && channel.isOpen();
    }

    @Override
    public Connection getConnection() {
        return connection;
    }

    @Override
    public void register(AmqpQueue queue) {
        queues.add(checkNotNull(queue));
    }

    @Override
    public void queueDeclare(String queue, boolean passive, boolean durable, boolean exclusive, boolean autoDelete,
                             boolean noWait, Map<String, Object> arguments, Action1<AMQP.Queue.DeclareOk> onDeclareOk) {
        call("queue.declare", channel -> {
            if (passive) {
                return channel.queueDeclarePassive(queue);
            }
            if (noWait) {
                channel.queueDeclareNoWait(queue, durable, exclusive, autoDelete, arguments);
                return null;
            }
            return channel.queueDeclare(queue, durable, exclusive, autoDelete, arguments);
        }, onDeclareOk);
    }

    @Override
    public void queueBind(String queue, String exchange, String routingKey, boolean noWait,
                          Map<String, Object> arguments, Action1<AMQP.Queue.BindOk> onBindOk) {
        call("queue.bind", channel -> {
            if (noWait) {
                channel.queueBindNoWait(queue, exchange, routingKey, arguments);
                return null;
            }
            return channel.queueBind(queue, exchange, routingKey, arguments);
        }, onBindOk);
    }

    @Override
    public void queueUnbind(String queue, String exchange, String routingKey,
                            Map<String, Object> arguments, Action1<AMQP.Queue.UnbindOk> onUnbindOk) {
        call("queue.unbind", channel -> channel.queueUnbind(queue, exchange, routingKey, arguments), onUnbindOk);
    }

    @Override
    public void queueDelete(String queue, boolean ifUnused, boolean ifEmpty, boolean noWait, Action1<AMQP.Queue.DeleteOk> onDeleteOk) {
        call("queue.delete", channel -> {
            if (noWait) {
                channel.queueDeleteNoWait(queue, ifUnused, ifEmpty);
                return null;
            }
            return channel.queueDelete(queue, ifUnused, ifEmpty);
        }, onDeleteOk);
    }

    @Override
    public void queuePurge(String queue, boolean noWait, Action1<AMQP.Queue.PurgeOk> onPurgeOk) {
        //the java client has no no-wait purge, the reply is dropped instead
        call("queue.purge", channel -> channel.queuePurge(queue), noWait ? null : onPurgeOk);
    }

    @Override
    public void basicGet(String queue, boolean autoAck, Action1<RawDelivery> onResult) {
        call("basic.get", channel -> {
            GetResponse response = channel.basicGet(queue, autoAck);
            if (response == null) {
                return RawDelivery.empty();
            }
            return RawDelivery.fetched(response.getEnvelope(), response::getProps, response.getBody(), response.getMessageCount());
        }, onResult);
    }

    @Override
    public void basicConsume(String queue, String consumerTag, boolean autoAck, boolean exclusive, boolean noLocal,
                             boolean noWait, Map<String, Object> arguments,
                             Action1<RawDelivery> onDelivery, Action1<AMQP.Basic.ConsumeOk> onConsumeOk) {
        //the java client always waits for consume-ok, no_wait only decides if it is reported
        final Action1<AMQP.Basic.ConsumeOk> reportConsumeOk = noWait ? null : onConsumeOk;
        call("basic.consume", channel -> {
            channel.basicConsume(queue, autoAck, consumerTag, noLocal, exclusive, arguments,
                    new DeliveryConsumer(channel, onDelivery, reportConsumeOk));
            return null;
        }, null);
    }

    @Override
    public void basicCancel(String consumerTag, boolean noWait, Action1<AMQP.Basic.CancelOk> onCancelOk) {
        call("basic.cancel", channel -> {
            channel.basicCancel(consumerTag);
            return new AMQImpl.Basic.CancelOk(consumerTag);
        }, noWait ? null : onCancelOk);
    }

    @Override
    public void basicPublish(String exchange, String routingKey, AMQP.BasicProperties properties, byte[] body) {
        call("basic.publish", channel -> {
            channel.basicPublish(exchange, routingKey, properties, body);
            return null;
        }, null);
    }

    @Override
    public void basicAck(long deliveryTag, boolean multiple) {
        call("basic.ack", channel -> {
            channel.basicAck(deliveryTag, multiple);
            return null;
        }, null);
    }

    @Override
    public void basicReject(long deliveryTag, boolean requeue) {
        call("basic.reject", channel -> {
            channel.basicReject(deliveryTag, requeue);
            return null;
        }, null);
    }

    /**
     * Closes the underlying channel and stops the workers. Work already queued on the event loop runs first and its
     * broker requests are sent before the channel closes. Continuations still waiting for the channel to open are dropped.
     *
     * Must not be called from a continuation or a callback, those run on the event loop this method waits for.
     */
    public void close() {
        synchronized (this) {
            if (closed) {
                log.infoWithParams("Already closed, doing nothing.", "channel", threadNamePrefix);
                return;
            }
            closed = true;
        }
        log.infoWithParams("Closing channel.",
                "channel", threadNamePrefix,
                "queues", queues.size());
        //the loop goes first, work queued there may still send broker requests
        loopExecutor.shutdown();
        awaitTermination(loopExecutor, "continuations");
        rpc.schedule(() -> {
            final Channel channel = delegate;
            delegate = null;
            if (channel != null) {
                closeQuietly(channel);
            }
        });
        rpcExecutor.shutdown();
        awaitTermination(rpcExecutor, "broker requests");
        loop.unsubscribe();
        rpc.unsubscribe();
    }

    private void awaitTermination(ExecutorService executor, String what) {
        try {
            if (!executor.awaitTermination(settings.getClose_timeout_millis(), TimeUnit.MILLISECONDS)) {
                log.warnWithParams("Timed out waiting for outstanding work.",
                        "channel", threadNamePrefix,
                        "waitingFor", what,
                        "closeTimeoutMillis", settings.getClose_timeout_millis());
                executor.shutdownNow();
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            executor.shutdownNow();
        }
    }

    private void onLoop(String what, Action0 action) {
        if (loopExecutor.isShutdown()) {
            log.debugWithParams("Channel closed, dropping work for the event loop.",
                    "channel", threadNamePrefix,
                    "in", what);
            return;
        }
        loop.schedule(() -> runSafely(what, action));
    }

    private void closeQuietly(Channel channel) {
        if (!channel.isOpen()) {
            return;
        }
        try {
            channel.close();
        } catch (IOException | TimeoutException | ShutdownSignalException e) {
            log.warnWithParams("Unexpected error when closing channel.", e,
                    "channel", threadNamePrefix,
                    "isOpen", channel.isOpen());
        }
    }

    private <T> void call(String method, ChannelCall<T> request, Action1<T> onReply) {
        if (rpcExecutor.isShutdown()) {
            log.debugWithParams("Channel closed, dropping broker request.",
                    "channel", threadNamePrefix,
                    "method", method);
            return;
        }
        rpc.schedule(() -> {
            final Channel channel = delegate;
            if (channel == null) {
                log.warnWithParams("Dropping broker request, the channel is not open.",
                        "channel", threadNamePrefix,
                        "method", method);
                return;
            }
            try {
                final T reply = request.call(channel);
                if (onReply != null && reply != null) {
                    onLoop(method + " callback", () -> onReply.call(reply));
                }
            } catch (IOException | ShutdownSignalException e) {
                log.errorWithParams("Broker request failed.", e,
                        "channel", threadNamePrefix,
                        "channelNr", channel.getChannelNumber(),
                        "method", method);
            }
        });
    }

    private void runSafely(String what, Action0 action) {
        try {
            action.call();
        } catch (RuntimeException e) {
            log.errorWithParams("Unhandled error on the channel event loop.", e,
                    "channel", threadNamePrefix,
                    "in", what);
        }
    }

    @Override
    public String toString() {
        final Channel channel = delegate;
        return "{" +
                "channel=" + threadNamePrefix +
                ", channelNo=" + (channel == null ? "-" : String.valueOf(channel.getChannelNumber())) +
                ", open=" + isOpen() +
                '}';
    }

    private interface ChannelCall<T> {
        T call(Channel channel) throws IOException;
    }

    private class DeliveryConsumer extends DefaultConsumer {

        private final Action1<RawDelivery> onDelivery;
        private final Action1<AMQP.Basic.ConsumeOk> onConsumeOk;

        DeliveryConsumer(Channel channel, Action1<RawDelivery> onDelivery, Action1<AMQP.Basic.ConsumeOk> onConsumeOk) {
            super(channel);
            this.onDelivery = onDelivery;
            this.onConsumeOk = onConsumeOk;
        }

        @Override
        public void handleConsumeOk(String consumerTag) {
            super.handleConsumeOk(consumerTag);
            if (onConsumeOk != null) {
                final AMQP.Basic.ConsumeOk consumeOk = new AMQImpl.Basic.ConsumeOk(consumerTag);
                onLoop("basic.consume-ok callback", () -> onConsumeOk.call(consumeOk));
            }
        }

        @Override
        public void handleCancel(String consumerTag) {
            log.warnWithParams("Consumer cancelled by the broker. It will not receive any more messages.",
                    "channel", threadNamePrefix,
                    "consumerTag", consumerTag);
        }

        @Override
        public void handleDelivery(String consumerTag, Envelope envelope, AMQP.BasicProperties properties, byte[] body) {
            log.traceWithParams("Consumer received message",
                    "consumerTag", consumerTag,
                    "deliveryTag", envelope.getDeliveryTag(),
                    "messageId", properties == null ? null : properties.getMessageId());
            final RawDelivery delivery = RawDelivery.delivered(consumerTag, envelope, () -> properties, body);
            onLoop("delivery", () -> onDelivery.call(delivery));
        }
    }
}
