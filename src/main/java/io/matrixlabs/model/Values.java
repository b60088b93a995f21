package io.matrixlabs.model;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/** Helpers for the JSON-like values carried by windows and metadata. */
public final class Values {

    private Values() {}

    /**
     * Deep copy a JSON-like value into unmodifiable collections. Maps keep their iteration order.
     * Scalars are returned as is; they are expected to be immutable (strings, numbers, booleans,
     * java.time values).
     */
    public static Object freeze(Object value) {
        if (value instanceof Map) {
            return freezeMap((Map<?, ?>) value);
        }
        if (value instanceof Collection) {
            List<Object> result = new ArrayList<>(((Collection<?>) value).size());
            for (Object o : (Collection<?>) value) {
                result.add(freeze(o));
            }
            return Collections.unmodifiableList(result);
        }
        return value;
    }

    public static Map<String, Object> freezeMap(Map<?, ?> map) {
        LinkedHashMap<String, Object> result = new LinkedHashMap<>();
        for (Map.Entry<?, ?> e : map.entrySet()) {
            result.put(String.valueOf(e.getKey()), freeze(e.getValue()));
        }
        return Collections.unmodifiableMap(result);
    }
}
