package com.meltwater.rxqueue;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.Maps;
import rx.Observable;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static com.google.common.base.Preconditions.checkNotNull;

/**
 * The bindings requested for an {@link AmqpQueue}, keyed by exchange and kept in the order they were first requested.
 *
 * Entries are never removed. Unbinding is a broker operation and does not touch the registry, so the registry
 * lists every exchange the queue has been bound to since it was created or last reset.
 */
public class BindingRegistry {

    private final Map<Exchange, BindOptions> bindings = new LinkedHashMap<>();

    /**
     * Stores a copy of the options for the exchange. Re-binding an exchange replaces its options but keeps its position.
     */
    public synchronized void record(Exchange exchange, BindOptions options) {
        bindings.put(checkNotNull(exchange), checkNotNull(options).copy());
    }

    /**
     * @return a cold observable of the bindings in insertion order. Every subscription reads the registry again,
     *         so the same observable can be subscribed to any number of times.
     */
    public Observable<Map.Entry<Exchange, BindOptions>> all() {
        return Observable.defer(() -> Observable.from(snapshot()));
    }

    /**
     * @return a copy of the options recorded for the exchange, null if it was never bound
     */
    public synchronized BindOptions get(Exchange exchange) {
        BindOptions options = bindings.get(exchange);
        return options == null ? null : options.copy();
    }

    public synchronized boolean contains(Exchange exchange) {
        return bindings.containsKey(exchange);
    }

    public synchronized int size() {
        return bindings.size();
    }

    public synchronized boolean isEmpty() {
        return bindings.isEmpty();
    }

    private synchronized List<Map.Entry<Exchange, BindOptions>> snapshot() {
        ImmutableList.Builder<Map.Entry<Exchange, BindOptions>> builder = ImmutableList.builder();
        for (Map.Entry<Exchange, BindOptions> e : bindings.entrySet()) {
            builder.add(Maps.immutableEntry(e.getKey(), e.getValue().copy()));
        }
        return builder.build();
    }

    @Override
    public synchronized String toString() {
        return "BindingRegistry" + bindings;
    }
}
