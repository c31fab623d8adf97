package io.github.cyfko.depman;

import java.util.function.Supplier;

/**
 * Process-wide handle on a single {@link DependencyRegistry}.
 *
 * <p>
 * The registry behind this class is created when the class is loaded and
 * lives until the JVM exits; it is never reset. Its contract is the one of
 * {@link DependencyRegistry}: {@link #init(boolean)} may run once, and the
 * first {@code register} call initializes it implicitly, without
 * auto-discovery, when {@code init} was not called before.
 * </p>
 *
 * <h2>Usage</h2>
 * <pre>{@code
 * // @Implements -> init -> resolve
 * DependencyManager.init();
 * Clock clock = DependencyManager.resolve(Clock.class);
 *
 * // register -> resolve
 * DependencyManager.register(Clock.class, SystemClock::new, Lifecycle.LAZY);
 * Clock clock = DependencyManager.resolve(Clock.class);
 * }</pre>
 *
 * <p>
 * Components that can receive their dependencies explicitly should be given
 * {@link #registry()} (or their own {@code DependencyRegistry}) rather than
 * calling these static methods.
 * </p>
 *
 * @since 1.0.0
 */
public final class DependencyManager {

    private static final DependencyRegistry REGISTRY = new DependencyRegistry();

    private DependencyManager() {
        // Not instantiable
    }

    /**
     * @return the process-wide registry
     */
    public static DependencyRegistry registry() {
        return REGISTRY;
    }

    /**
     * @see DependencyRegistry#init()
     */
    public static void init() {
        REGISTRY.init();
    }

    /**
     * @see DependencyRegistry#init(boolean)
     */
    public static void init(boolean autoDiscover) {
        REGISTRY.init(autoDiscover);
    }

    /**
     * @see DependencyRegistry#register(Class, Supplier)
     */
    public static <C> boolean register(Class<C> contract, Supplier<? extends C> factory) {
        return REGISTRY.register(contract, factory);
    }

    /**
     * @see DependencyRegistry#register(Class, Supplier, boolean, boolean)
     */
    public static <C> boolean register(Class<C> contract, Supplier<? extends C> factory,
                                       boolean constructEagerly, boolean singleInstance) {
        return REGISTRY.register(contract, factory, constructEagerly, singleInstance);
    }

    /**
     * @see DependencyRegistry#register(Class, Supplier, Lifecycle)
     */
    public static <C> boolean register(Class<C> contract, Supplier<? extends C> factory, Lifecycle lifecycle) {
        return REGISTRY.register(contract, factory, lifecycle);
    }

    /**
     * @see DependencyRegistry#registerInstance(Class, Object)
     */
    public static <C> boolean registerInstance(Class<C> contract, C instance) {
        return REGISTRY.registerInstance(contract, instance);
    }

    /**
     * @see DependencyRegistry#isRegistered(Class)
     */
    public static boolean isRegistered(Class<?> contract) {
        return REGISTRY.isRegistered(contract);
    }

    /**
     * @see DependencyRegistry#resolve(Class)
     */
    public static <C> C resolve(Class<C> contract) {
        return REGISTRY.resolve(contract);
    }
}
