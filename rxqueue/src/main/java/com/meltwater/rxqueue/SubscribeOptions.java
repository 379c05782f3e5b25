package com.meltwater.rxqueue;

import com.google.common.collect.ImmutableMap;
import com.rabbitmq.client.AMQP;
import rx.functions.Action1;

import java.util.Map;

import static com.google.common.base.Preconditions.checkNotNull;

/**
 * Options for {@link AmqpQueue#subscribe}.
 *
 * Setting a confirm callback forces no_wait to false, the broker only sends basic.consume-ok when asked to reply.
 */
public class SubscribeOptions {

    private boolean ack                                 = false;
    private boolean exclusive                           = false;
    private boolean no_local                            = false;
    private boolean no_wait                             = false;
    private Map<String, Object> arguments               = ImmutableMap.of();
    private Action1<AMQP.Basic.ConsumeOk> confirm       = null;

    /**
     * @return true if deliveries must be acknowledged explicitly, false if the broker acknowledges them on delivery
     */
    public boolean isAck() {
        return ack;
    }

    public boolean isExclusive() {
        return exclusive;
    }

    public boolean isNo_local() {
        return no_local;
    }

    public boolean isNo_wait() {
        return no_wait && confirm == null;
    }

    public Map<String, Object> getArguments() {
        return arguments;
    }

    public Action1<AMQP.Basic.ConsumeOk> getConfirm() {
        return confirm;
    }

    public SubscribeOptions withAck(boolean ack) {
        this.ack = ack;
        return this;
    }

    public SubscribeOptions withExclusive(boolean exclusive) {
        this.exclusive = exclusive;
        return this;
    }

    public SubscribeOptions withNoLocal(boolean no_local) {
        this.no_local = no_local;
        return this;
    }

    public SubscribeOptions withNoWait(boolean no_wait) {
        this.no_wait = no_wait;
        return this;
    }

    public SubscribeOptions withArguments(Map<String, Object> arguments) {
        this.arguments = ImmutableMap.copyOf(checkNotNull(arguments));
        return this;
    }

    /**
     * @param confirm called with the broker's basic.consume-ok once the consumer is registered
     */
    public SubscribeOptions withConfirm(Action1<AMQP.Basic.ConsumeOk> confirm) {
        this.confirm = checkNotNull(confirm);
        return this;
    }

    @Override
    public String toString() {
        return "{" +
                "ack:" + ack +
                ", exclusive:" + exclusive +
                ", no_local:" + no_local +
                ", no_wait:" + isNo_wait() +
                ", arguments:" + arguments +
                ", confirm:" + (confirm != null) +
                '}';
    }
}
