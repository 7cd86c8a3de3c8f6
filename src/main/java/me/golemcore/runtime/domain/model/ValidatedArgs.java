package me.golemcore.runtime.domain.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Tool arguments that passed structural validation against the tool's input
 * schema. Produced by the tool registry; executors can rely on required fields
 * being present and on every value having its declared type.
 */
public final class ValidatedArgs {

    private final Map<String, Object> values;

    private ValidatedArgs(Map<String, Object> values) {
        this.values = Collections.unmodifiableMap(new LinkedHashMap<>(values));
    }

    public static ValidatedArgs of(Map<String, Object> values) {
        return new ValidatedArgs(values != null ? values : Map.of());
    }

    public boolean has(String name) {
        return values.get(name) != null;
    }

    public Object get(String name) {
        return values.get(name);
    }

    public String getString(String name) {
        Object value = values.get(name);
        return value != null ? value.toString() : null;
    }

    public boolean getBoolean(String name, boolean defaultValue) {
        Object value = values.get(name);
        return value instanceof Boolean flag ? flag : defaultValue;
    }

    public Map<String, Object> asMap() {
        return values;
    }

    @Override
    public boolean equals(Object other) {
        if (this == other) {
            return true;
        }
        return other instanceof ValidatedArgs that && values.equals(that.values);
    }

    @Override
    public int hashCode() {
        return values.hashCode();
    }

    @Override
    public String toString() {
        return values.toString();
    }
}
