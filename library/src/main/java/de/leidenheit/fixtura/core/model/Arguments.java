package de.leidenheit.fixtura.core.model;

import de.leidenheit.fixtura.core.exception.FixturaIllegalStateException;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

/**
 * Immutable, ordered view of named values handed to a fixture provider or a test body.
 */
public final class Arguments {

    private static final Arguments EMPTY = new Arguments(Map.of());

    private final Map<String, Object> values;

    private Arguments(final Map<String, ?> values) {
        // LinkedHashMap keeps null values and insertion order
        this.values = Collections.unmodifiableMap(new LinkedHashMap<String, Object>(values));
    }

    public static Arguments of(final Map<String, ?> values) {
        if (values.isEmpty()) return EMPTY;
        return new Arguments(values);
    }

    public static Arguments empty() {
        return EMPTY;
    }

    public boolean contains(final String name) {
        return values.containsKey(name);
    }

    public Object get(final String name) {
        if (!values.containsKey(name)) {
            throw new FixturaIllegalStateException("No argument named '%s', available: %s".formatted(name, values.keySet()));
        }
        return values.get(name);
    }

    public <T> T get(final String name, final Class<T> type) {
        var value = get(name);
        if (value != null && !type.isInstance(value)) {
            throw new FixturaIllegalStateException("Argument '%s' is of type %s, expected %s"
                    .formatted(name, value.getClass().getName(), type.getName()));
        }
        return type.cast(value);
    }

    public Set<String> names() {
        return values.keySet();
    }

    public Map<String, Object> asMap() {
        return values;
    }

    public int size() {
        return values.size();
    }

    @Override
    public String toString() {
        return values.toString();
    }
}
