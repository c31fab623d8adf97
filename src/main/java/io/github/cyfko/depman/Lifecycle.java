package io.github.cyfko.depman;

/**
 * How a binding produces the instance handed out by
 * {@link DependencyRegistry#resolve(Class)}.
 *
 * @since 1.0.0
 */
public enum Lifecycle {

    /**
     * Single instance, built while the binding is registered.
     */
    EAGER,

    /**
     * Single instance, built on the first {@code resolve} and cached afterwards.
     * Concurrent first calls build it only once.
     */
    LAZY,

    /**
     * No caching: every {@code resolve} builds a new instance.
     */
    FACTORY;

    /**
     * Maps the {@link Implements} flag pair onto a lifecycle.
     * <p>
     * {@code singleInstance == false} always yields {@link #FACTORY};
     * {@code constructEagerly} only matters for single instances.
     * </p>
     *
     * @param constructEagerly whether a single instance is built at registration
     * @param singleInstance   whether the built instance is kept and reused
     * @return the matching lifecycle
     */
    public static Lifecycle of(boolean constructEagerly, boolean singleInstance) {
        if (!singleInstance) {
            return FACTORY;
        }
        return constructEagerly ? EAGER : LAZY;
    }
}
