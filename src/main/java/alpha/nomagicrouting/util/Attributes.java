package alpha.nomagicrouting.util;

import java.util.Map;
import java.util.Optional;

/**
 * Named objects associated with a holder.<p>
 *
 * Useful when passing data from one handler to another, for example from an
 * authentication middleware to the route handler that needs the principal:
 *
 * <pre>{@code
 *   // In the middleware
 *   ctx.attributes().set("app.user", user);
 *   // In the route handler
 *   User user = ctx.attributes().getAny("app.user");
 * }</pre>
 *
 * Setting a {@code null} value removes the attribute.<p>
 *
 * The names prefixed "alpha.nomagicrouting." are reserved for the library.
 *
 * @author NoMagicRouting contributors
 */
public interface Attributes {
    /**
     * Returns the value of the named attribute.
     *
     * @param name of attribute
     * @return the value (may be {@code null})
     * @throws NullPointerException if {@code name} is {@code null}
     */
    Object get(String name);

    /**
     * Sets the value of the named attribute.
     *
     * @param name  of attribute
     * @param value of attribute ({@code null} removes the attribute)
     * @return the old value (may be {@code null})
     * @throws NullPointerException if {@code name} is {@code null}
     */
    Object set(String name, Object value);

    /**
     * Returns the value of the named attribute cast to V.<p>
     *
     * The cast is unchecked; a call site assigning the value to an
     * incompatible type fails with a {@code ClassCastException}.
     *
     * @param <V>  value type (inferred)
     * @param name of attribute
     * @return the value (may be {@code null})
     * @throws NullPointerException if {@code name} is {@code null}
     */
    <V> V getAny(String name);

    /**
     * Returns the value of the named attribute as an Optional.
     *
     * @param name of attribute
     * @return the value (never {@code null} but possibly empty)
     * @throws NullPointerException if {@code name} is {@code null}
     */
    Optional<Object> getOpt(String name);

    /**
     * Returns an unmodifiable snapshot of all attributes.
     *
     * @return an unmodifiable snapshot of all attributes
     */
    Map<String, Object> asMap();
}
