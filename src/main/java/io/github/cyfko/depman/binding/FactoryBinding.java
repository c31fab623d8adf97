package io.github.cyfko.depman.binding;

import io.github.cyfko.depman.Lifecycle;

import java.util.Objects;
import java.util.function.Supplier;

/**
 * Builds a new instance on every {@link #get()}.
 */
public final class FactoryBinding<T> extends AbstractBinding<T> {

    private final Supplier<? extends T> factory;

    public FactoryBinding(Class<T> contract, Supplier<? extends T> factory) {
        super(contract);
        this.factory = Objects.requireNonNull(factory, "factory cannot be null");
    }

    @Override
    public Lifecycle lifecycle() {
        return Lifecycle.FACTORY;
    }

    @Override
    public T get() {
        return activate(factory);
    }
}
