package io.github.cyfko.depman.exception;

/**
 * Thrown by {@code resolve} when neither {@code init} nor {@code register} has run.
 */
public class NotInitializedException extends DependencyManagerException {

    public NotInitializedException() {
        super("DependencyManager is not initialized. Call init or register first");
    }
}
