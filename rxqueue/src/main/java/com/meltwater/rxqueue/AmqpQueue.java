package com.meltwater.rxqueue;

import com.meltwater.rxqueue.util.Deferred;
import com.meltwater.rxqueue.util.Logger;
import com.rabbitmq.client.AMQP;
import rx.functions.Action0;
import rx.functions.Action1;
import rx.functions.Action2;

import java.util.Map;
import java.util.concurrent.atomic.AtomicInteger;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;
import static com.google.common.base.Preconditions.checkState;

/**
 * Client side handle of a broker queue.
 *
 * Creating an instance declares the queue on the given {@link QueueChannel}. All operations return immediately,
 * the broker requests are made once the channel is open. Operations called before that are sent in the order
 * they were called.
 *
 * A queue created with an empty name is server-named: the broker picks the name and returns it in
 * queue.declare-ok. {@link #bind} on a server-named queue waits for the declaration to complete before
 * it is sent, since the name is needed for the binding.
 *
 * Only one subscription can be active per instance.
 *
 * When the channel fails the broker forgets the consumer and exclusive queues, the channel then calls
 * {@link #reset()} which clears bindings, consumer and declaration state and declares the queue again.
 */
public class AmqpQueue {

    private static final Logger log = new Logger(AmqpQueue.class);
    private static final AtomicInteger consumerCount = new AtomicInteger();

    /**
     * Consumer tag held between {@link #subscribe} and the moment basic.consume is sent.
     */
    static final String PENDING_CONSUMER_TAG = "pending";
    static final String CONSUMER_TAG_PREFIX = "rxqueue";
    static final String DEFAULT_EXCHANGE = "";

    private final QueueChannel channel;
    private final String declaredName;
    private final QueueOptions declaredOptions;
    private final DeclareCallback declareCallback;
    private final CallbackNormalizer normalizer;

    private String name;
    private QueueOptions options;
    private QueueStatus status;
    private BindingRegistry bindings;
    private Deferred declarationGate;
    private String consumerTag;

    public AmqpQueue(QueueChannel channel, String name) {
        this(channel, name, new QueueOptions(), null);
    }

    public AmqpQueue(QueueChannel channel, String name, QueueOptions options) {
        this(channel, name, options, null);
    }

    /**
     * @param channel the channel to declare and use the queue on
     * @param name the queue name, an empty string asks the broker to generate one
     * @param options declaration attributes
     * @param declareCallback called when the declaration completes, may be null
     *
     * @throws IllegalArgumentException if the name is empty and no_wait is explicitly true
     */
    public AmqpQueue(QueueChannel channel, String name, QueueOptions options, DeclareCallback declareCallback) {
        this.channel = checkNotNull(channel, "channel must not be null");
        this.declaredName = checkNotNull(name,
                "queue name must not be null; if you want the broker to generate a queue name, pass an empty string");
        this.declaredOptions = checkNotNull(options, "options must not be null").copy();
        this.declareCallback = declareCallback;
        this.normalizer = new CallbackNormalizer(channel);
        checkArgument(!(declaredName.isEmpty() && declaredOptions.isNo_wait()),
                "server-named queues (name = '') can not be declared with no_wait = true, the name is only known from the broker reply");
        channel.register(this);
        initialize();
    }

    /**
     * Discards bindings, consumer tag and declaration state and declares the queue again from the name, options
     * and callback it was created with. Called by the channel after a channel level failure.
     */
    public synchronized void reset() {
        log.infoWithParams("Resetting queue.",
                "queue", name,
                "status", status,
                "bindings", bindings.size(),
                "consumerTag", consumerTag);
        initialize();
    }

    private synchronized void initialize() {
        name = declaredName;
        options = resolveOptions(declaredName, declaredOptions, declareCallback);
        bindings = new BindingRegistry();
        declarationGate = new Deferred();
        consumerTag = null;
        if (options.isNo_wait()) {
            status = QueueStatus.OPENED;
            if (declareCallback != null) {
                declareCallback.call(this, null);
            }
        } else {
            status = QueueStatus.OPENING;
        }
        final Deferred gate = declarationGate;
        channel.onceOpen(() -> declare(gate));
    }

    private static QueueOptions resolveOptions(String name, QueueOptions requested, DeclareCallback callback) {
        QueueOptions resolved = requested.copy();
        if (resolved.getNo_wait() == null) {
            resolved.withNoWait(callback == null && !name.isEmpty());
        }
        return resolved;
    }

    private synchronized void declare(Deferred gate) {
        if (gate != declarationGate) {
            return;
        }
        log.debugWithParams("Declaring queue.",
                "queue", name,
                "options", options);
        if (declareCallback == null) {
            // the reply is always requested here so the declaration gate can fire
            channel.queueDeclare(name, options.isPassive(), options.isDurable(), options.isExclusive(), options.isAuto_delete(),
                    false, options.getArguments(), declareOk -> onDeclareOk(gate, declareOk, false));
        } else if (options.isNo_wait()) {
            channel.queueDeclare(name, options.isPassive(), options.isDurable(), options.isExclusive(), options.isAuto_delete(),
                    true, options.getArguments(), null);
            gate.fire();
        } else {
            channel.queueDeclare(name, options.isPassive(), options.isDurable(), options.isExclusive(), options.isAuto_delete(),
                    false, options.getArguments(), declareOk -> onDeclareOk(gate, declareOk, true));
        }
    }

    private void onDeclareOk(Deferred gate, AMQP.Queue.DeclareOk declareOk, boolean notifyCallback) {
        synchronized (this) {
            if (gate != declarationGate) {
                log.debugWithParams("Ignoring declare-ok for a queue that has been reset since.",
                        "queue", declareOk.getQueue());
                return;
            }
            if (isServerNamed()) {
                name = declareOk.getQueue();
            }
            if (status == QueueStatus.OPENING) {
                status = QueueStatus.OPENED;
            }
            log.infoWithParams("Queue declared.",
                    "queue", name,
                    "messageCount", declareOk.getMessageCount(),
                    "consumerCount", declareOk.getConsumerCount());
            gate.fire();
        }
        if (notifyCallback) {
            declareCallback.call(this, declareOk);
        }
    }

    public AmqpQueue bind(String exchange) {
        return bind(new Exchange(exchange), new BindOptions(), null);
    }

    public AmqpQueue bind(Exchange exchange) {
        return bind(exchange, new BindOptions(), null);
    }

    public AmqpQueue bind(Exchange exchange, BindOptions options) {
        return bind(exchange, options, null);
    }

    /**
     * Binds the queue to an exchange. The binding is recorded in {@link #getBindings()} right away.
     *
     * @param onBindOk called with queue.bind-ok, may be null. Without it the binding is sent with no_wait.
     * @return this queue
     */
    public synchronized AmqpQueue bind(Exchange exchange, BindOptions options, Action1<AMQP.Queue.BindOk> onBindOk) {
        checkNotNull(exchange, "exchange must not be null");
        checkNotNull(options, "options must not be null");
        final BindOptions requested = options.copy();
        status = QueueStatus.UNBOUND;
        bindings.record(exchange, requested);

        final boolean noWait = requested.isNo_wait() || onBindOk == null;
        final String routingKey = requested.effectiveRoutingKey();
        final Action0 issueBind = () ->
                channel.queueBind(getName(), exchange.name, routingKey, noWait, requested.getArguments(), onBindOk);

        if (isServerNamed()) {
            final Deferred gate = declarationGate;
            channel.onceOpen(() -> afterDeclaration(gate, issueBind));
        } else {
            channel.onceOpen(issueBind);
        }
        return this;
    }

    private synchronized void afterDeclaration(Deferred gate, Action0 action) {
        if (gate == declarationGate) {
            gate.onFulfilled(action);
        }
    }

    public void unbind(String exchange) {
        unbind(new Exchange(exchange), new BindOptions(), null);
    }

    public void unbind(Exchange exchange) {
        unbind(exchange, new BindOptions(), null);
    }

    /**
     * Removes the binding at the broker. The entry in {@link #getBindings()} is kept.
     *
     * Messages already routed to the queue can still arrive after this completes.
     */
    public void unbind(Exchange exchange, BindOptions options, Action1<AMQP.Queue.UnbindOk> onUnbindOk) {
        checkNotNull(exchange, "exchange must not be null");
        checkNotNull(options, "options must not be null");
        final String routingKey = options.effectiveRoutingKey();
        final Map<String, Object> arguments = options.getArguments();
        channel.onceOpen(() ->
                channel.queueUnbind(getName(), exchange.name, routingKey, arguments, onUnbindOk));
    }

    public void delete() {
        delete(new DeleteOptions(), null);
    }

    /**
     * Deletes the queue at the broker. Pending messages are dead-lettered if configured and consumers are cancelled.
     *
     * @param onDeleteOk called with queue.delete-ok, which carries the number of messages that were in the queue
     */
    public void delete(DeleteOptions options, Action1<AMQP.Queue.DeleteOk> onDeleteOk) {
        checkNotNull(options, "options must not be null");
        channel.onceOpen(() ->
                channel.queueDelete(getName(), options.isIf_unused(), options.isIf_empty(), options.isNo_wait(), onDeleteOk));
    }

    public void purge() {
        purge(new PurgeOptions(), null);
    }

    /**
     * Removes all messages from the queue that are not awaiting acknowledgement.
     *
     * @param onPurgeOk called with queue.purge-ok, which carries the number of purged messages
     */
    public void purge(PurgeOptions options, Action1<AMQP.Queue.PurgeOk> onPurgeOk) {
        checkNotNull(options, "options must not be null");
        channel.onceOpen(() -> channel.queuePurge(getName(), options.isNo_wait(), onPurgeOk));
    }

    public void pop(DeliveryCallback callback) {
        pop(new PopOptions(), callback);
    }

    /**
     * Fetches a single message. On an empty queue the callback gets a null payload and an empty {@link Metadata}.
     *
     * @param callback may be null, the message is then fetched (and with ack=false acknowledged) without being handed over
     */
    public void pop(PopOptions options, DeliveryCallback callback) {
        checkNotNull(options, "options must not be null");
        final Action1<RawDelivery> onResult = callback == null ? null : delivery -> normalizer.dispatch(callback, delivery);
        channel.onceOpen(() -> channel.basicGet(getName(), !options.isAck(), onResult));
    }

    public AmqpQueue subscribe(DeliveryCallback callback) {
        return subscribe(new SubscribeOptions(), callback);
    }

    /**
     * Starts consuming messages. Every message pushed by the broker is handed to the callback until
     * {@link #unsubscribe} completes.
     *
     * @throws IllegalStateException if this queue already has a subscription, active or pending
     * @return this queue
     */
    public synchronized AmqpQueue subscribe(SubscribeOptions options, DeliveryCallback callback) {
        checkNotNull(options, "options must not be null");
        checkState(consumerTag == null, "already subscribed to the queue '%s'", name);
        consumerTag = PENDING_CONSUMER_TAG;

        final boolean noWait = options.isNo_wait() || callback == null;
        final Deferred generation = declarationGate;
        channel.onceOpen(() -> consume(generation, options, noWait, callback));
        return this;
    }

    private synchronized void consume(Deferred generation, SubscribeOptions options, boolean noWait, DeliveryCallback callback) {
        if (generation != declarationGate) {
            return;
        }
        final String issuedTag = CONSUMER_TAG_PREFIX + "-" + name + "-" + consumerCount.incrementAndGet();
        consumerTag = issuedTag;
        log.infoWithParams("Starting up consumer.",
                "queue", name,
                "consumerTag", issuedTag,
                "options", options);
        channel.basicConsume(name,
                issuedTag,
                !options.isAck(),
                options.isExclusive(),
                options.isNo_local(),
                noWait,
                options.getArguments(),
                delivery -> onDelivery(callback, delivery),
                consumeOk -> onConsumeOk(generation, issuedTag, consumeOk, options.getConfirm()));
    }

    private void onDelivery(DeliveryCallback callback, RawDelivery delivery) {
        if (callback == null) {
            log.debugWithParams("Dropping message, the subscription has no callback.",
                    "delivery", delivery);
            return;
        }
        normalizer.dispatchSafely(callback, delivery);
    }

    private void onConsumeOk(Deferred generation, String issuedTag, AMQP.Basic.ConsumeOk consumeOk, Action1<AMQP.Basic.ConsumeOk> confirm) {
        synchronized (this) {
            // the subscription this reply belongs to has been cancelled or replaced
            if (generation != declarationGate || !issuedTag.equals(consumerTag)) {
                log.debugWithParams("Ignoring consume-ok for a consumer that is no longer current.",
                        "queue", name,
                        "issuedTag", issuedTag,
                        "consumerTag", consumerTag);
                return;
            }
            consumerTag = consumeOk.getConsumerTag();
            log.infoWithParams("Consumer registered and ready to receive messages.",
                    "queue", name,
                    "consumerTag", consumerTag);
        }
        if (confirm != null) {
            confirm.call(consumeOk);
        }
    }

    public void unsubscribe() {
        unsubscribe(new UnsubscribeOptions(), null);
    }

    /**
     * Cancels the consumer. The consumer tag is cleared when basic.cancel-ok arrives, or right after the cancel
     * is sent when no_wait is set (the default). The callback is only called when no_wait is false.
     *
     * Messages already in flight can still reach the subscription callback after this completes.
     */
    public synchronized void unsubscribe(UnsubscribeOptions options, Action1<AMQP.Basic.CancelOk> onCancelOk) {
        checkNotNull(options, "options must not be null");
        final Deferred generation = declarationGate;
        channel.onceOpen(() -> cancel(generation, options.isNo_wait(), onCancelOk));
    }

    private synchronized void cancel(Deferred generation, boolean noWait, Action1<AMQP.Basic.CancelOk> onCancelOk) {
        if (generation != declarationGate) {
            return;
        }
        final String tag = consumerTag;
        if (tag == null || PENDING_CONSUMER_TAG.equals(tag)) {
            log.warnWithParams("Unsubscribe called on a queue without a consumer. Doing nothing.",
                    "queue", name);
            return;
        }
        log.infoWithParams("Stopping consumer.",
                "queue", name,
                "consumerTag", tag,
                "noWait", noWait);
        if (noWait) {
            channel.basicCancel(tag, true, null);
            consumerTag = null;
        } else {
            channel.basicCancel(tag, false, cancelOk -> onCancelOk(generation, tag, cancelOk, onCancelOk));
        }
    }

    private void onCancelOk(Deferred generation, String tag, AMQP.Basic.CancelOk cancelOk, Action1<AMQP.Basic.CancelOk> onCancelOk) {
        synchronized (this) {
            if (generation == declarationGate && tag.equals(consumerTag)) {
                consumerTag = null;
            }
        }
        if (onCancelOk != null) {
            onCancelOk.call(cancelOk);
        }
    }

    /**
     * Reads the number of messages and active consumers with a passive declaration.
     *
     * @param callback called with (messageCount, consumerCount)
     * @throws NullPointerException if the callback is null
     */
    public void status(Action2<Integer, Integer> callback) {
        checkNotNull(callback, "status does not make any sense without a callback");
        final QueueOptions current = getOptions();
        channel.onceOpen(() ->
                channel.queueDeclare(getName(), true, current.isDurable(), current.isExclusive(), current.isAuto_delete(),
                        false, current.getArguments(),
                        declareOk -> callback.call(declareOk.getMessageCount(), declareOk.getConsumerCount())));
    }

    public void publish(byte[] payload) {
        publish(payload, null);
    }

    /**
     * Publishes a message straight to this queue, through the default exchange with the queue name as routing key.
     * On a server-named queue the publish waits for the declaration to complete.
     *
     * @param properties message properties, may be null
     */
    public synchronized void publish(byte[] payload, AMQP.BasicProperties properties) {
        checkNotNull(payload, "payload must not be null");
        final Action0 issuePublish = () ->
                channel.basicPublish(DEFAULT_EXCHANGE, getName(), properties, payload);
        if (isServerNamed()) {
            final Deferred gate = declarationGate;
            channel.onceOpen(() -> afterDeclaration(gate, issuePublish));
        } else {
            channel.onceOpen(issuePublish);
        }
    }

    /**
     * @return the queue name, empty for a server-named queue until the broker has replied to the declaration
     */
    public synchronized String getName() {
        return name;
    }

    public boolean isServerNamed() {
        return declaredName.isEmpty();
    }

    /**
     * @return a copy of the options in effect, with no_wait resolved
     */
    public synchronized QueueOptions getOptions() {
        return options.copy();
    }

    public synchronized QueueStatus getStatus() {
        return status;
    }

    public synchronized BindingRegistry getBindings() {
        return bindings;
    }

    public synchronized String getConsumerTag() {
        return consumerTag;
    }

    /**
     * @return true if a subscription is active or pending
     */
    public synchronized boolean isSubscribed() {
        return consumerTag != null;
    }

    public synchronized boolean isDeclared() {
        return declarationGate.isFulfilled();
    }

    public QueueChannel getChannel() {
        return channel;
    }

    /**
     * @return the callback given at construction, null if there was none
     */
    public DeclareCallback getDeclareCallback() {
        return declareCallback;
    }

    @Override
    public synchronized String toString() {
        return "AmqpQueue{" +
                "name='" + name + '\'' +
                ", serverNamed=" + isServerNamed() +
                ", status=" + status +
                ", options=" + options +
                ", consumerTag=" + consumerTag +
                '}';
    }
}
