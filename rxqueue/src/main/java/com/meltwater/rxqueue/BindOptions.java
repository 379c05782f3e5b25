package com.meltwater.rxqueue;

import com.google.common.collect.ImmutableMap;

import java.util.Map;
import java.util.Objects;

import static com.google.common.base.Preconditions.checkNotNull;

/**
 * Options for {@link AmqpQueue#bind} and {@link AmqpQueue#unbind}.
 *
 * Both key and routing_key name the binding routing key, key takes precedence when both are set.
 * The routing key is the empty string when neither is set.
 */
public class BindOptions {

    private String key                      = null;
    private String routing_key              = null;
    private boolean no_wait                 = false;
    private Map<String, Object> arguments   = ImmutableMap.of();

    public String getKey() {
        return key;
    }

    public String getRouting_key() {
        return routing_key;
    }

    public boolean isNo_wait() {
        return no_wait;
    }

    public Map<String, Object> getArguments() {
        return arguments;
    }

    /**
     * @return the routing key that is sent to the broker
     */
    public String effectiveRoutingKey() {
        if (key != null) {
            return key;
        }
        return routing_key != null ? routing_key : "";
    }

    public BindOptions withKey(String key) {
        this.key = key;
        return this;
    }

    public BindOptions withRoutingKey(String routing_key) {
        this.routing_key = routing_key;
        return this;
    }

    public BindOptions withNoWait(boolean no_wait) {
        this.no_wait = no_wait;
        return this;
    }

    public BindOptions withArguments(Map<String, Object> arguments) {
        this.arguments = ImmutableMap.copyOf(checkNotNull(arguments));
        return this;
    }

    BindOptions copy() {
        BindOptions copy = new BindOptions();
        copy.key = key;
        copy.routing_key = routing_key;
        copy.no_wait = no_wait;
        copy.arguments = arguments;
        return copy;
    }

    @Override
    public String toString() {
        return "{" +
                "key:" + key +
                ", routing_key:" + routing_key +
                ", no_wait:" + no_wait +
                ", arguments:" + arguments +
                '}';
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        BindOptions that = (BindOptions) o;
        return no_wait == that.no_wait
                && Objects.equals(key, that.key)
                && Objects.equals(routing_key, that.routing_key)
                && arguments.equals(that.arguments);
    }

    @Override
    public int hashCode() {
        return Objects.hash(key, routing_key, no_wait, arguments);
    }
}
