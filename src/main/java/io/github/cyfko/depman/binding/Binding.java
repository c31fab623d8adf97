package io.github.cyfko.depman.binding;

import io.github.cyfko.depman.Lifecycle;

/**
 * The registry's record of how to obtain the instance bound to one contract.
 *
 * @param <T> the contract type
 */
public interface Binding<T> {

    /**
     * @return the contract this binding was registered against
     */
    Class<T> contract();

    /**
     * @return the lifecycle policy applied by {@link #get()}
     */
    Lifecycle lifecycle();

    /**
     * Returns the instance for this binding, building it if the lifecycle requires.
     *
     * @return a non-null instance of {@link #contract()}
     * @throws io.github.cyfko.depman.exception.ActivationException if building the instance failed
     */
    T get();
}
