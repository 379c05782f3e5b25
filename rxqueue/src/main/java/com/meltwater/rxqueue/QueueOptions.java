package com.meltwater.rxqueue;

import com.google.common.collect.ImmutableMap;

import java.util.Map;
import java.util.Objects;

import static com.google.common.base.Preconditions.checkNotNull;

/**
 * The declaration attributes of an {@link AmqpQueue}.
 *
 * The no_wait flag starts out unset (null). An unset flag is resolved when the queue is constructed:
 * it becomes true for a named queue created without a declare callback and false otherwise.
 *
 * @see <a href="https://www.rabbitmq.com/amqp-0-9-1-reference.html#queue.declare">queue.declare</a>
 */
public class QueueOptions {

    private boolean durable                 = false;
    private boolean exclusive               = false;
    private boolean auto_delete             = false;
    private boolean passive                 = false;
    private Boolean no_wait                 = null;
    private Map<String, Object> arguments   = ImmutableMap.of();

    public QueueOptions() {}

    private QueueOptions(QueueOptions that) {
        this.durable = that.durable;
        this.exclusive = that.exclusive;
        this.auto_delete = that.auto_delete;
        this.passive = that.passive;
        this.no_wait = that.no_wait;
        this.arguments = that.arguments;
    }

    public boolean isDurable() {
        return durable;
    }

    public boolean isExclusive() {
        return exclusive;
    }

    public boolean isAuto_delete() {
        return auto_delete;
    }

    public boolean isPassive() {
        return passive;
    }

    /**
     * @return the no_wait flag, or null if it has not been set explicitly
     */
    public Boolean getNo_wait() {
        return no_wait;
    }

    public boolean isNo_wait() {
        return Boolean.TRUE.equals(no_wait);
    }

    public Map<String, Object> getArguments() {
        return arguments;
    }

    public QueueOptions withDurable(boolean durable) {
        this.durable = durable;
        return this;
    }

    public QueueOptions withExclusive(boolean exclusive) {
        this.exclusive = exclusive;
        return this;
    }

    public QueueOptions withAutoDelete(boolean auto_delete) {
        this.auto_delete = auto_delete;
        return this;
    }

    public QueueOptions withPassive(boolean passive) {
        this.passive = passive;
        return this;
    }

    public QueueOptions withNoWait(boolean no_wait) {
        this.no_wait = no_wait;
        return this;
    }

    /**
     * @param arguments optional declaration arguments, for example x-message-ttl. Null values are not allowed.
     */
    public QueueOptions withArguments(Map<String, Object> arguments) {
        this.arguments = ImmutableMap.copyOf(checkNotNull(arguments));
        return this;
    }

    QueueOptions copy() {
        return new QueueOptions(this);
    }

    @Override
    public String toString() {
        return "{" +
                "durable:" + durable +
                ", exclusive:" + exclusive +
                ", auto_delete:" + auto_delete +
                ", passive:" + passive +
                ", no_wait:" + no_wait +
                ", arguments:" + arguments +
                '}';
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        QueueOptions that = (QueueOptions) o;
        if (durable != that.durable) return false;
        if (exclusive != that.exclusive) return false;
        if (auto_delete != that.auto_delete) return false;
        if (passive != that.passive) return false;
        if (!Objects.equals(no_wait, that.no_wait)) return false;
        return arguments.equals(that.arguments);
    }

    @Override
    public int hashCode() {
        return Objects.hash(durable, exclusive, auto_delete, passive, no_wait, arguments);
    }
}
