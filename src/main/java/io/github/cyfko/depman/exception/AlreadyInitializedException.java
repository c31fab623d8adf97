package io.github.cyfko.depman.exception;

/**
 * Thrown by {@code init} when the registry has already been initialized,
 * either explicitly or implicitly by a first {@code register}.
 */
public class AlreadyInitializedException extends DependencyManagerException {

    public AlreadyInitializedException() {
        super("DependencyManager is already initialized. Only call init once");
    }
}
