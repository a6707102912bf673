package alpha.nomagicrouting.internal;

import alpha.nomagicrouting.util.Attributes;

import java.util.HashMap;
import java.util.Map;
import java.util.Optional;

import static java.util.Objects.requireNonNull;

/**
 * Default implementation of {@link Attributes}.<p>
 *
 * Not thread-safe; the attributes belong to one dispatch and a dispatch runs
 * on one thread.
 *
 * @author NoMagicRouting contributors
 */
final class DefaultAttributes implements Attributes {
    // Lazily created, most dispatches never set an attribute
    private Map<String, Object> map;

    @Override
    public Object get(String name) {
        requireNonNull(name);
        return map == null ? null : map.get(name);
    }

    @Override
    public Object set(String name, Object value) {
        requireNonNull(name);
        if (value == null) {
            return map == null ? null : map.remove(name);
        }
        if (map == null) {
            map = new HashMap<>();
        }
        return map.put(name, value);
    }

    @Override
    public <V> V getAny(String name) {
        @SuppressWarnings("unchecked")
        V v = (V) get(name);
        return v;
    }

    @Override
    public Optional<Object> getOpt(String name) {
        return Optional.ofNullable(get(name));
    }

    @Override
    public Map<String, Object> asMap() {
        return map == null ? Map.of() : Map.copyOf(map);
    }

    @Override
    public String toString() {
        return String.valueOf(map == null ? Map.of() : map);
    }
}
