package com.hellokaton.lumen.kit;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.Map;

/**
 * String and "truthiness" helpers.
 */
public final class StringKit {

    private StringKit() {
    }

    public static boolean isBlank(String value) {
        return null == value || value.trim().isEmpty();
    }

    public static boolean isNotBlank(String value) {
        return !isBlank(value);
    }

    /**
     * Whether a value counts as "supplied": non null, {@code TRUE} for booleans,
     * non empty for strings, collections, maps and arrays.
     */
    public static boolean isTruthy(Object value) {
        if (null == value) {
            return false;
        }
        if (value instanceof Boolean) {
            return (Boolean) value;
        }
        if (value instanceof CharSequence) {
            return ((CharSequence) value).length() > 0;
        }
        if (value instanceof Collection) {
            return !((Collection<?>) value).isEmpty();
        }
        if (value instanceof Map) {
            return !((Map<?, ?>) value).isEmpty();
        }
        if (value.getClass().isArray()) {
            return java.lang.reflect.Array.getLength(value) > 0;
        }
        return true;
    }

    /**
     * Split a comma separated list, trimming items and dropping empty ones.
     */
    public static List<String> splitList(String value) {
        if (isBlank(value)) {
            return Collections.emptyList();
        }
        List<String> items = new ArrayList<>();
        for (String item : value.split(",")) {
            String trimmed = item.trim();
            if (!trimmed.isEmpty()) {
                items.add(trimmed);
            }
        }
        return items;
    }

}
