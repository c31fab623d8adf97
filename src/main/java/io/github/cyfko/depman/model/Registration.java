package io.github.cyfko.depman.model;

import io.github.cyfko.depman.Lifecycle;

import java.util.Objects;
import java.util.function.Supplier;

/**
 * Immutable description of one binding found by auto-discovery.
 *
 * <p>
 * Instances are produced by the generated {@code RegistrationProviderImpl},
 * one per {@link io.github.cyfko.depman.Implements @Implements} class, and are
 * consumed by {@link io.github.cyfko.depman.DependencyRegistry#init(boolean)}.
 * The {@code factory} is a constructor reference to the implementation, so
 * no reflection is involved when the binding is activated.
 * </p>
 *
 * @param contract       The contract the implementation is bound to.
 * @param implementation The concrete class; must be assignable to {@code contract}.
 * @param factory        Zero-argument factory producing {@code implementation} instances.
 * @param lifecycle      Lifecycle of the resulting binding.
 * @param <C>            The contract type.
 */
public record Registration<C>(
        Class<C> contract,
        Class<? extends C> implementation,
        Supplier<? extends C> factory,
        Lifecycle lifecycle
) {

    public Registration {
        Objects.requireNonNull(contract, "contract cannot be null");
        Objects.requireNonNull(implementation, "implementation cannot be null");
        Objects.requireNonNull(factory, "factory cannot be null");
        Objects.requireNonNull(lifecycle, "lifecycle cannot be null");
    }

    /**
     * Convenience factory taking the {@code @Implements} flag pair.
     */
    public static <C> Registration<C> of(Class<C> contract,
                                         Class<? extends C> implementation,
                                         Supplier<? extends C> factory,
                                         boolean constructEagerly,
                                         boolean singleInstance) {
        return new Registration<>(contract, implementation, factory,
                Lifecycle.of(constructEagerly, singleInstance));
    }

    /**
     * @return whether {@code implementation} really is a subtype of {@code contract}
     */
    public boolean satisfiesContract() {
        return contract.isAssignableFrom(implementation);
    }
}
