package io.github.cyfko.depman.binding;

import io.github.cyfko.depman.exception.ActivationException;
import io.github.cyfko.depman.exception.ContractMismatchException;

import java.util.Objects;
import java.util.function.Supplier;

/**
 * Common base holding the contract and the activation logic shared by all bindings.
 */
abstract class AbstractBinding<T> implements Binding<T> {

    private final Class<T> contract;

    AbstractBinding(Class<T> contract) {
        this.contract = Objects.requireNonNull(contract, "contract cannot be null");
    }

    @Override
    public Class<T> contract() {
        return contract;
    }

    /**
     * Runs the factory once and checks what it produced.
     *
     * @throws ActivationException       if the factory throws a runtime exception or a
     *                                   linkage error (e.g. a class missing at run time),
     *                                   or returns {@code null}
     * @throws ContractMismatchException if the product is not an instance of the contract
     */
    T activate(Supplier<? extends T> factory) {
        Object instance;
        try {
            instance = factory.get();
        } catch (RuntimeException | LinkageError e) {
            throw new ActivationException(contract, e);
        }

        if (instance == null) {
            throw new ActivationException(contract, "factory returned null");
        }
        // Raw-typed callers can slip anything through the Supplier.
        if (!contract.isInstance(instance)) {
            throw new ContractMismatchException(instance.getClass(), contract);
        }
        return contract.cast(instance);
    }

    @Override
    public String toString() {
        return getClass().getSimpleName() + "[" + contract.getName() + "]";
    }
}
