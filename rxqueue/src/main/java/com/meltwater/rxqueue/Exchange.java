package com.meltwater.rxqueue;

import static com.google.common.base.Preconditions.checkNotNull;

/**
 * A typed {@link String} naming the exchange a queue is bound to. Used as the key of the {@link BindingRegistry},
 * two instances with the same name identify the same routing source.
 *
 * The default exchange is named by the empty string.
 */
public class Exchange {

    public final String name;

    public Exchange(String name) {
        this.name = checkNotNull(name, "exchange name must not be null, use an empty string for the default exchange");
    }

    @Override
    public String toString() {
        return name;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        return name.equals(((Exchange) o).name);
    }

    @Override
    public int hashCode() {
        return name.hashCode();
    }
}
