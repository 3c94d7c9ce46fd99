package com.behaviourmonitor.core.model;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Copy helpers for the free-form attribute maps carried by {@link Event} and
 * {@link Alert}.
 *
 * <p>
 * Stored copies use plain {@link LinkedHashMap} and {@link ArrayList}
 * instances at every level so that Flink's generic serializer can rebuild
 * them. Callers only ever see read-only views.
 * </p>
 */
final class Attributes {

    private Attributes() {
    }

    /**
     * Copy a map, recursing into nested maps and collections.
     */
    static Map<String, Object> copyOf(Map<String, ?> source) {
        Map<String, Object> copy = new LinkedHashMap<>();
        if (source != null) {
            source.forEach((name, value) -> copy.put(name, copyValue(value)));
        }
        return copy;
    }

    /**
     * Read-only view of a map produced by {@link #copyOf(Map)}; nested
     * containers are wrapped as well.
     */
    static Map<String, Object> readOnly(Map<String, Object> attributes) {
        Map<String, Object> view = new LinkedHashMap<>();
        attributes.forEach((name, value) -> view.put(name, readOnlyValue(value)));
        return Collections.unmodifiableMap(view);
    }

    static Object readOnlyValue(Object value) {
        if (value instanceof Map<?, ?> map) {
            Map<Object, Object> view = new LinkedHashMap<>();
            map.forEach((k, v) -> view.put(k, readOnlyValue(v)));
            return Collections.unmodifiableMap(view);
        }
        if (value instanceof List<?> list) {
            List<Object> view = new ArrayList<>(list.size());
            list.forEach(v -> view.add(readOnlyValue(v)));
            return Collections.unmodifiableList(view);
        }
        return value;
    }

    private static Object copyValue(Object value) {
        if (value instanceof Map<?, ?> map) {
            Map<Object, Object> copy = new LinkedHashMap<>();
            map.forEach((k, v) -> copy.put(k, copyValue(v)));
            return copy;
        }
        if (value instanceof Collection<?> collection) {
            List<Object> copy = new ArrayList<>(collection.size());
            collection.forEach(v -> copy.add(copyValue(v)));
            return copy;
        }
        return value;
    }
}
