package com.meltwater.rxqueue;

import com.rabbitmq.client.AMQP;
import rx.functions.Action1;
import rx.functions.Action2;

import static com.google.common.base.Preconditions.checkNotNull;

/**
 * Called once the queue declaration completes, either with the queue only or with the queue and the broker's
 * queue.declare-ok.
 *
 * When the queue is declared with no_wait the callback runs right away at construction and the declare-ok
 * argument is null.
 */
public final class DeclareCallback {

    private final Action1<AmqpQueue> queueHandler;
    private final Action2<AmqpQueue, AMQP.Queue.DeclareOk> declareOkHandler;

    private DeclareCallback(Action1<AmqpQueue> queueHandler, Action2<AmqpQueue, AMQP.Queue.DeclareOk> declareOkHandler) {
        this.queueHandler = queueHandler;
        this.declareOkHandler = declareOkHandler;
    }

    public static DeclareCallback onQueue(Action1<AmqpQueue> handler) {
        return new DeclareCallback(checkNotNull(handler), null);
    }

    public static DeclareCallback onDeclareOk(Action2<AmqpQueue, AMQP.Queue.DeclareOk> handler) {
        return new DeclareCallback(null, checkNotNull(handler));
    }

    void call(AmqpQueue queue, AMQP.Queue.DeclareOk declareOk) {
        if (queueHandler != null) {
            queueHandler.call(queue);
        } else {
            declareOkHandler.call(queue, declareOk);
        }
    }
}
