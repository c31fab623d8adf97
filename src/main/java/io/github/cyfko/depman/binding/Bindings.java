package io.github.cyfko.depman.binding;

import io.github.cyfko.depman.Lifecycle;

import java.util.function.Supplier;

/**
 * Creates the binding matching a {@link Lifecycle}.
 */
public final class Bindings {

    private Bindings() {
        // Not instantiable
    }

    /**
     * Creates a binding for {@code contract}. For {@link Lifecycle#EAGER} the
     * factory runs before this method returns.
     *
     * @throws io.github.cyfko.depman.exception.ActivationException if an eager factory fails
     */
    public static <T> Binding<T> create(Class<T> contract, Supplier<? extends T> factory, Lifecycle lifecycle) {
        switch (lifecycle) {
            case EAGER:
                return new EagerSingletonBinding<>(contract, factory);
            case LAZY:
                return new LazySingletonBinding<>(contract, factory);
            case FACTORY:
                return new FactoryBinding<>(contract, factory);
            default:
                throw new IllegalArgumentException("Unsupported lifecycle: " + lifecycle);
        }
    }
}
