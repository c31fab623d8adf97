package io.github.cyfko.depman;

import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * Marks a class as the implementation of a contract so that it is registered
 * automatically when the registry is initialized with auto-discovery.
 * <p>
 * {@code @Implements} is read by the DepMan annotation processor, which
 * generates an index of all marked classes at compile time. At runtime
 * {@link DependencyRegistry#init(boolean) init(true)} registers every indexed
 * class against its contract; no classpath scanning takes place.
 * </p>
 *
 * <h3>Validation Rules</h3>
 * <p>
 * The processor enforces the following constraints at compile time:
 * </p>
 * <ul>
 *   <li>{@code @Implements} can only be applied to concrete, public classes;
 *       nested classes must be {@code static} and every enclosing class
 *       must be public.</li>
 *   <li>The class must declare a public no-argument constructor
 *       (the implicit default constructor qualifies) that declares no
 *       checked exception.</li>
 *   <li>The class must be assignable to the {@linkplain #value() contract}.</li>
 *   <li>A contract may be implemented by at most one marked class; any
 *       duplicate causes compilation to fail, with diagnostics pointing to both
 *       conflicting declarations.</li>
 * </ul>
 *
 * <h3>Typical Usage</h3>
 * <pre>{@code
 * @Implements(Clock.class)
 * public final class SystemClock implements Clock {
 *     // ...
 * }
 *
 * @Implements(value = RequestId.class, singleInstance = false)
 * public final class RandomRequestId implements RequestId {
 *     // ...
 * }
 *
 * DependencyManager.init();
 * Clock clock = DependencyManager.resolve(Clock.class);
 * }</pre>
 *
 * <p>
 * Classes without this annotation can still be registered explicitly through
 * {@link DependencyRegistry#register(Class, java.util.function.Supplier, Lifecycle)}.
 * </p>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
@Target(ElementType.TYPE)
@Retention(RetentionPolicy.SOURCE)
public @interface Implements {

    /**
     * The contract implemented by the annotated class, also the key used to resolve it.
     *
     * @return the contract type
     */
    Class<?> value();

    /**
     * Whether the instance should be built at registration, or on first use.
     * Ignored when {@link #singleInstance()} is {@code false}.
     *
     * @return {@code true} to build the instance during {@code init}
     */
    boolean constructEagerly() default true;

    /**
     * Whether the built instance is kept and reused.
     *
     * @return {@code false} to build a new instance on every resolve
     */
    boolean singleInstance() default true;
}
