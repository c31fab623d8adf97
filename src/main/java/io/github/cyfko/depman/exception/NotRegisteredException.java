package io.github.cyfko.depman.exception;

/**
 * Thrown by {@code resolve} for a contract without binding.
 */
public class NotRegisteredException extends DependencyManagerException {

    private final Class<?> contract;

    public NotRegisteredException(Class<?> contract) {
        super(contract.getName() + " not registered!");
        this.contract = contract;
    }

    public Class<?> getContract() {
        return contract;
    }
}
