package com.di.bqindexer.document;

import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Row helpers shared by the document and merge builders.
 */
public final class RowValues {

    private RowValues() {}

    /**
     * Copies {@code row} without its null values. A stored null cannot be told
     * apart from an absent field and would wipe values written by a partial
     * update, so missing values are never sent.
     */
    public static Map<String, Object> dropNulls(Map<String, Object> row) {
        Map<String, Object> out = new LinkedHashMap<>();
        for (Map.Entry<String, Object> e : row.entrySet()) {
            if (e.getValue() != null) {
                out.put(e.getKey(), e.getValue());
            }
        }
        return out;
    }

    /** Renders an id column value as a document id; null stays null. */
    public static String idOf(Object value) {
        return value == null ? null : String.valueOf(value);
    }

    /**
     * Truthiness used for derived flags: null, {@code false}, zero, blank strings
     * and empty collections or maps are false.
     */
    public static boolean isTruthy(Object value) {
        if (value == null) return false;
        if (value instanceof Boolean b) return b;
        if (value instanceof Number n) return n.doubleValue() != 0d;
        if (value instanceof CharSequence cs) return cs.length() > 0;
        if (value instanceof Collection<?> c) return !c.isEmpty();
        if (value instanceof Map<?, ?> m) return !m.isEmpty();
        return true;
    }
}
