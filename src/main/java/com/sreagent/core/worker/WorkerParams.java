package com.sreagent.core.worker;

import java.util.Map;

/**
 * Lenient accessors for classifier-supplied action parameters, which may arrive as
 * numbers, numeric strings, or not at all.
 */
public final class WorkerParams {

    private WorkerParams() {}

    public static int intParam(Map<String, Object> params, String key, int defaultValue) {
        Object value = params.get(key);
        if (value instanceof Number n) {
            return n.intValue();
        }
        if (value instanceof String s && !s.isBlank()) {
            try {
                return (int) Double.parseDouble(s.trim());
            } catch (NumberFormatException e) {
                return defaultValue;
            }
        }
        return defaultValue;
    }

    public static String stringParam(Map<String, Object> params, String key, String defaultValue) {
        Object value = params.get(key);
        if (value == null) {
            return defaultValue;
        }
        String s = value.toString();
        return s.isBlank() ? defaultValue : s;
    }
}
