package io.github.cyfko.depman.binding;

import io.github.cyfko.depman.Lifecycle;
import io.github.cyfko.depman.exception.ContractMismatchException;

import java.util.Objects;
import java.util.function.Supplier;

/**
 * Holds an instance that already exists when the binding is created.
 */
public final class EagerSingletonBinding<T> extends AbstractBinding<T> {

    private final T instance;

    /**
     * Builds the instance right away.
     *
     * @throws io.github.cyfko.depman.exception.ActivationException if the factory fails
     */
    public EagerSingletonBinding(Class<T> contract, Supplier<? extends T> factory) {
        super(contract);
        Objects.requireNonNull(factory, "factory cannot be null");
        this.instance = activate(factory);
    }

    private EagerSingletonBinding(Class<T> contract, T instance) {
        super(contract);
        this.instance = instance;
    }

    /**
     * Wraps an instance built by the caller.
     *
     * @throws ContractMismatchException if {@code instance} is not a {@code contract}
     */
    public static <T> EagerSingletonBinding<T> ofInstance(Class<T> contract, T instance) {
        Objects.requireNonNull(contract, "contract cannot be null");
        Objects.requireNonNull(instance, "instance cannot be null");
        if (!contract.isInstance(instance)) {
            throw new ContractMismatchException(instance.getClass(), contract);
        }
        return new EagerSingletonBinding<>(contract, instance);
    }

    @Override
    public Lifecycle lifecycle() {
        return Lifecycle.EAGER;
    }

    @Override
    public T get() {
        return instance;
    }
}
