package io.github.cyfko.depman.exception;

/**
 * Wraps a failure raised while a binding was building its instance.
 * <p>
 * The cause is the exception thrown by the factory, or {@code null} when the
 * factory returned {@code null}.
 * </p>
 */
public class ActivationException extends DependencyManagerException {

    private final Class<?> contract;

    public ActivationException(Class<?> contract, String message) {
        super("Cannot activate " + contract.getName() + ": " + message);
        this.contract = contract;
    }

    public ActivationException(Class<?> contract, Throwable cause) {
        super("Cannot activate " + contract.getName() + ": " + cause, cause);
        this.contract = contract;
    }

    public Class<?> getContract() {
        return contract;
    }
}
