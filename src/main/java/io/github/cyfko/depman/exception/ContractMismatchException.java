package io.github.cyfko.depman.exception;

/**
 * Thrown when an implementation (or a pre-built instance) does not satisfy
 * the contract it is registered against.
 */
public class ContractMismatchException extends DependencyManagerException {

    public ContractMismatchException(Class<?> implementation, Class<?> contract) {
        super("The class " + implementation.getName() + " does not implement " + contract.getName() + ".");
    }
}
