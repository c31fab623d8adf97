package io.github.cyfko.depman.binding;

import io.github.cyfko.depman.Lifecycle;

import java.util.Objects;
import java.util.function.Supplier;

/**
 * Builds its instance on the first {@link #get()} and returns it from then on.
 * <p>
 * The instance slot is filled using double-checked locking on a monitor owned
 * by this binding, so concurrent first callers block until the single
 * construction completes and all of them observe the same instance. If the
 * factory fails the slot stays empty and the next call tries again.
 * </p>
 */
public final class LazySingletonBinding<T> extends AbstractBinding<T> {

    private final Supplier<? extends T> factory;
    private final Object lock = new Object();

    private volatile T instance;

    public LazySingletonBinding(Class<T> contract, Supplier<? extends T> factory) {
        super(contract);
        this.factory = Objects.requireNonNull(factory, "factory cannot be null");
    }

    @Override
    public Lifecycle lifecycle() {
        return Lifecycle.LAZY;
    }

    @Override
    public T get() {
        T result = instance;
        if (result == null) {
            synchronized (lock) {
                result = instance;
                if (result == null) {
                    result = activate(factory);
                    instance = result;
                }
            }
        }
        return result;
    }

    /**
     * @return whether the instance has been built
     */
    public boolean isConstructed() {
        return instance != null;
    }
}
