package io.github.cyfko.depman;

import io.github.cyfko.depman.binding.Binding;
import io.github.cyfko.depman.binding.Bindings;
import io.github.cyfko.depman.binding.EagerSingletonBinding;
import io.github.cyfko.depman.exception.AlreadyInitializedException;
import io.github.cyfko.depman.exception.AlreadyRegisteredException;
import io.github.cyfko.depman.exception.ContractMismatchException;
import io.github.cyfko.depman.exception.NotInitializedException;
import io.github.cyfko.depman.exception.NotRegisteredException;
import io.github.cyfko.depman.model.Registration;
import io.github.cyfko.depman.providers.RegistrationProvider;

import java.lang.reflect.InvocationTargetException;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Supplier;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Thread-safe lookup table binding contract types to their implementations.
 *
 * <p>
 * Callers register a concrete implementation against a contract and later
 * retrieve it by that contract. Each contract is bound at most once for the
 * lifetime of the registry; bindings are never replaced nor removed.
 * </p>
 *
 * <h2>Usage</h2>
 * <pre>{@code
 * DependencyRegistry registry = new DependencyRegistry();
 * registry.register(Clock.class, SystemClock::new, Lifecycle.LAZY);
 * registry.registerInstance(Logger.class, consoleLogger);
 *
 * Clock clock = registry.resolve(Clock.class);
 * }</pre>
 *
 * <h2>Lifecycle</h2>
 * <p>
 * The bindings map is created once, either by {@link #init(boolean)} or
 * implicitly by the first {@code register} call, and is never reset. The
 * implicit initialization disables auto-discovery and makes any later
 * {@code init} call fail with {@link AlreadyInitializedException}. Use either
 * the {@code @Implements -> init -> resolve} pattern or the
 * {@code register -> resolve} pattern.
 * </p>
 *
 * <h2>Concurrency</h2>
 * <p>
 * Initialization is guarded by a lock, so concurrent {@code init} calls yield
 * exactly one success. Bindings live in a {@link ConcurrentHashMap} and are
 * inserted with {@code putIfAbsent}: when two threads register the same
 * contract, one wins and the other gets {@link AlreadyRegisteredException}.
 * {@code register} never returns {@code false}.
 * </p>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public final class DependencyRegistry {
    private static final Logger log = Logger.getLogger(DependencyRegistry.class.getName());

    private final Object initLock = new Object();
    private final Supplier<RegistrationProvider> providerSource;

    /**
     * Non-null iff the registry is initialized.
     */
    private volatile Map<Class<?>, Binding<?>> bindings;

    /**
     * Creates a registry whose auto-discovery reads the provider generated by
     * the annotation processor.
     */
    public DependencyRegistry() {
        this.providerSource = () -> loadProvider(RegistrationProvider.GENERATED_CLASS_NAME);
    }

    /**
     * Creates a registry whose auto-discovery reads the given provider.
     *
     * @param provider source of discovered registrations
     */
    public DependencyRegistry(RegistrationProvider provider) {
        Objects.requireNonNull(provider, "provider cannot be null");
        this.providerSource = () -> provider;
    }

    /**
     * Initializes the registry with auto-discovery enabled.
     *
     * @see #init(boolean)
     */
    public void init() {
        init(true);
    }

    /**
     * Initializes the registry. Must be called at most once, and not after a
     * {@code register} call, which initializes the registry implicitly.
     *
     * @param autoDiscover {@code true} to register every class indexed from
     *                     {@link Implements @Implements} annotations
     * @throws AlreadyInitializedException if the registry is already initialized
     * @throws ContractMismatchException   if a discovered class does not implement its contract
     * @throws AlreadyRegisteredException  if a discovered contract is bound twice, or is
     *                                     bound concurrently by {@code register}
     * @throws io.github.cyfko.depman.exception.ActivationException if a discovered eager factory fails
     */
    public void init(boolean autoDiscover) {
        synchronized (initLock) {
            if (bindings != null) {
                throw new AlreadyInitializedException();
            }
            bindings = new ConcurrentHashMap<>();
        }

        int discovered = autoDiscover ? discover() : 0;
        log.info("DependencyRegistry initialized (auto-discovery "
                + (autoDiscover ? "enabled, " + discovered + " binding(s) found" : "disabled") + ")");
    }

    /**
     * Registers the auto-discovered bindings, all or nothing.
     * <p>
     * Every registration is validated and every binding is built (running
     * eager factories) before the first one is inserted. If an insert then
     * loses against a concurrent {@code register}, the bindings already
     * inserted by this scan are removed again. The first error aborts the
     * whole scan.
     * </p>
     */
    private int discover() {
        List<Registration<?>> registrations = providerSource.get().getRegistrations();

        Set<Class<?>> seen = new HashSet<>();
        for (Registration<?> registration : registrations) {
            if (!registration.satisfiesContract()) {
                throw new ContractMismatchException(registration.implementation(), registration.contract());
            }
            if (!seen.add(registration.contract())) {
                throw new AlreadyRegisteredException(registration.contract());
            }
        }

        List<Binding<?>> built = new ArrayList<>(registrations.size());
        for (Registration<?> registration : registrations) {
            built.add(build(registration));
        }

        Map<Class<?>, Binding<?>> map = bindings;
        List<Binding<?>> inserted = new ArrayList<>(built.size());
        try {
            for (int i = 0; i < built.size(); i++) {
                Binding<?> binding = built.get(i);
                insert(map, binding, registrations.get(i).implementation());
                inserted.add(binding);
            }
        } catch (RuntimeException e) {
            for (Binding<?> binding : inserted) {
                map.remove(binding.contract(), binding);
            }
            throw e;
        }
        return registrations.size();
    }

    private static <C> Binding<C> build(Registration<C> registration) {
        return Bindings.create(registration.contract(), registration.factory(), registration.lifecycle());
    }

    /**
     * Registers {@code factory} as an eager singleton for {@code contract}.
     *
     * @see #register(Class, Supplier, Lifecycle)
     */
    public <C> boolean register(Class<C> contract, Supplier<? extends C> factory) {
        return register(contract, factory, Lifecycle.EAGER);
    }

    /**
     * Registers {@code factory} for {@code contract} using the
     * {@link Implements @Implements} flag pair.
     *
     * @see Lifecycle#of(boolean, boolean)
     * @see #register(Class, Supplier, Lifecycle)
     */
    public <C> boolean register(Class<C> contract, Supplier<? extends C> factory,
                                boolean constructEagerly, boolean singleInstance) {
        return register(contract, factory, Lifecycle.of(constructEagerly, singleInstance));
    }

    /**
     * Binds a factory to a contract.
     * <p>
     * If the registry is not initialized yet, this call initializes it with
     * auto-discovery disabled. For {@link Lifecycle#EAGER} the factory runs
     * before this method returns; if it fails nothing is registered.
     * </p>
     *
     * @param contract  the contract, also the retrieval key
     * @param factory   zero-argument factory producing implementations of {@code contract}
     * @param lifecycle how instances are built and cached
     * @return always {@code true}
     * @throws AlreadyRegisteredException if {@code contract} is already bound
     * @throws io.github.cyfko.depman.exception.ActivationException if an eager factory fails
     */
    public <C> boolean register(Class<C> contract, Supplier<? extends C> factory, Lifecycle lifecycle) {
        Objects.requireNonNull(contract, "contract cannot be null");
        Objects.requireNonNull(factory, "factory cannot be null");
        Objects.requireNonNull(lifecycle, "lifecycle cannot be null");

        return bind(contract, null, factory, lifecycle);
    }

    /**
     * Binds an already built instance to a contract, as an eager singleton.
     * This form does not require a factory, so the instance may come from any
     * constructor.
     *
     * @param contract the contract, also the retrieval key
     * @param instance the instance returned by every {@code resolve(contract)}
     * @return always {@code true}
     * @throws AlreadyRegisteredException if {@code contract} is already bound
     * @throws ContractMismatchException  if {@code instance} is not a {@code contract}
     */
    public <C> boolean registerInstance(Class<C> contract, C instance) {
        Objects.requireNonNull(contract, "contract cannot be null");
        Objects.requireNonNull(instance, "instance cannot be null");

        Map<Class<?>, Binding<?>> map = ensureInitialized();
        if (map.containsKey(contract)) {
            throw new AlreadyRegisteredException(contract);
        }
        return insert(map, EagerSingletonBinding.ofInstance(contract, instance), instance.getClass());
    }

    private <C> boolean bind(Class<C> contract, Class<?> implementation,
                             Supplier<? extends C> factory, Lifecycle lifecycle) {
        Map<Class<?>, Binding<?>> map = ensureInitialized();

        // Fail fast before an eager factory runs.
        if (map.containsKey(contract)) {
            throw new AlreadyRegisteredException(contract);
        }
        return insert(map, Bindings.create(contract, factory, lifecycle), implementation);
    }

    private boolean insert(Map<Class<?>, Binding<?>> map, Binding<?> binding, Class<?> implementation) {
        if (map.putIfAbsent(binding.contract(), binding) != null) {
            throw new AlreadyRegisteredException(binding.contract());
        }

        if (log.isLoggable(Level.FINE)) {
            log.fine("Registered " + binding.contract().getName()
                    + (implementation != null ? " -> " + implementation.getName() : "")
                    + " (" + binding.lifecycle() + ")");
        }
        return true;
    }

    /**
     * Returns the bindings map, creating it without auto-discovery if needed.
     */
    private Map<Class<?>, Binding<?>> ensureInitialized() {
        Map<Class<?>, Binding<?>> map = bindings;
        if (map == null) {
            synchronized (initLock) {
                map = bindings;
                if (map == null) {
                    map = new ConcurrentHashMap<>();
                    bindings = map;
                    log.info("DependencyRegistry initialized implicitly by register (auto-discovery disabled)");
                }
            }
        }
        return map;
    }

    /**
     * Checks whether a binding exists for {@code contract}.
     *
     * @return {@code false} if the registry is not initialized or the contract is unbound
     */
    public boolean isRegistered(Class<?> contract) {
        Objects.requireNonNull(contract, "contract cannot be null");
        Map<Class<?>, Binding<?>> map = bindings;
        return map != null && map.containsKey(contract);
    }

    /**
     * @return whether {@code init} or {@code register} has run
     */
    public boolean isInitialized() {
        return bindings != null;
    }

    /**
     * Retrieves the instance bound to {@code contract}, applying its lifecycle.
     *
     * @param contract the contract to look up
     * @return the eager or cached instance, or a new instance for factory bindings
     * @throws NotInitializedException if neither {@code init} nor {@code register} has run
     * @throws NotRegisteredException  if {@code contract} has no binding
     * @throws io.github.cyfko.depman.exception.ActivationException if building the instance fails
     */
    public <C> C resolve(Class<C> contract) {
        Objects.requireNonNull(contract, "contract cannot be null");

        Map<Class<?>, Binding<?>> map = bindings;
        if (map == null) {
            throw new NotInitializedException();
        }

        Binding<?> binding = map.get(contract);
        if (binding == null) {
            throw new NotRegisteredException(contract);
        }
        return contract.cast(binding.get());
    }

    /**
     * Loads the auto-generated {@code RegistrationProviderImpl} using reflection.
     * <p>
     * If the generated class cannot be found (no {@code @Implements} class was
     * compiled with the processor), a warning is logged and an empty provider
     * is returned.
     * </p>
     *
     * @throws IllegalStateException if the generated class cannot be instantiated
     */
    static RegistrationProvider loadProvider(String className) {
        try {
            Class<?> cls = Class.forName(className);
            return (RegistrationProvider) cls.getConstructor().newInstance();

        } catch (ClassNotFoundException e) {
            log.warning("""
                No generated registration index found, auto-discovery registers nothing.
                Expected generated class: %s
                Ensure that @Implements classes are compiled with annotation processing enabled.
                """.formatted(className) + e);
            return List::of;

        } catch (InvocationTargetException | InstantiationException |
                 NoSuchMethodException | IllegalAccessException e) {
            throw new IllegalStateException("Failed to instantiate " + className, e);
        }
    }
}
