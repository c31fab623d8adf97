package io.github.cyfko.depman.exception;

/**
 * Thrown when a contract already has a binding. Bindings are never replaced.
 */
public class AlreadyRegisteredException extends DependencyManagerException {

    private final Class<?> contract;

    public AlreadyRegisteredException(Class<?> contract) {
        super(contract.getName() + " already registered!");
        this.contract = contract;
    }

    public Class<?> getContract() {
        return contract;
    }
}
