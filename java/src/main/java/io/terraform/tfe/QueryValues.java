package io.terraform.tfe;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Mutable multimap of query parameters collected from an options object before encoding.
 */
public final class QueryValues {

    private final Map<String, List<String>> values = new LinkedHashMap<>();

    public QueryValues add(String key, String value) {
        if (value == null) {
            return this;
        }
        values.computeIfAbsent(key, k -> new ArrayList<>()).add(value);
        return this;
    }

    public QueryValues add(String key, int value) {
        if (value == 0) {
            return this;
        }
        return add(key, Integer.toString(value));
    }

    public QueryValues add(String key, Boolean value) {
        if (value == null) {
            return this;
        }
        return add(key, value.toString());
    }

    public QueryValues addAll(String key, Collection<?> items) {
        if (items == null) {
            return this;
        }
        for (Object item : items) {
            if (item != null) {
                add(key, item.toString());
            }
        }
        return this;
    }

    public Map<String, List<String>> asMap() {
        return values;
    }

    public boolean isEmpty() {
        return values.isEmpty();
    }
}
