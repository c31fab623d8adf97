package io.github.cyfko.depman.exception;

/**
 * Base type of every error raised by the dependency registry.
 * <p>
 * All subtypes are unchecked and surface synchronously to the caller of the
 * operation that triggered them. The registry never retries.
 * </p>
 */
public class DependencyManagerException extends RuntimeException {

    public DependencyManagerException(String message) {
        super(message);
    }

    public DependencyManagerException(String message, Throwable cause) {
        super(message, cause);
    }
}
