package io.github.cyfko.depman.providers;

import io.github.cyfko.depman.model.Registration;

import java.util.List;

/**
 * Supplies the bindings discovered at compile time.
 * <p>
 * This interface is implemented automatically by the annotation processor,
 * which generates a deterministic and immutable list of registrations.
 */
public interface RegistrationProvider {

    /**
     * Fully-qualified name of the implementation generated by the annotation processor.
     */
    String GENERATED_CLASS_NAME = "io.github.cyfko.depman.providers.RegistrationProviderImpl";

    /**
     * Returns the discovered registrations, in declaration order.
     *
     * @return unmodifiable list of registrations
     */
    List<Registration<?>> getRegistrations();
}
