package com.libragraph.batchsim.core.value;

import com.libragraph.batchsim.core.config.InvalidParameterException;

import java.util.Locale;

/**
 * Converts raw config scalars (as read by Jackson or produced by generators) to the
 * type a consumer asked for.
 */
final class ValueCoercion {

    private ValueCoercion() {
    }

    static <T> T coerce(Object raw, Class<T> type, String key) {
        if (raw == null) {
            throw new InvalidParameterException("Attribute " + key + " has no value");
        }
        try {
            return type.cast(convert(raw, type));
        } catch (NumberFormatException | ClassCastException e) {
            throw new InvalidParameterException("Could not convert " + key + " = " + raw
                    + " to " + type.getSimpleName(), e);
        }
    }

    private static Object convert(Object raw, Class<?> type) {
        if (type == Object.class || type.isInstance(raw) && type != Integer.class && type != Double.class) {
            return raw;
        }
        if (type == Integer.class) {
            if (raw instanceof Integer) return raw;
            if (raw instanceof Number n) {
                double d = n.doubleValue();
                if (d != Math.rint(d)) throw new NumberFormatException("not an integer: " + raw);
                return n.intValue();
            }
            if (raw instanceof String s) return Integer.parseInt(s.trim());
            if (raw instanceof Boolean b) return b ? 1 : 0;
        }
        if (type == Double.class) {
            if (raw instanceof Number n) return n.doubleValue();
            if (raw instanceof String s) return Double.parseDouble(s.trim());
        }
        if (type == Boolean.class) {
            if (raw instanceof Number n) return n.doubleValue() != 0.0;
            if (raw instanceof String s) return parseBoolean(s);
        }
        if (type == String.class) {
            return String.valueOf(raw);
        }
        throw new ClassCastException(raw.getClass().getSimpleName());
    }

    private static Boolean parseBoolean(String s) {
        String v = s.trim().toLowerCase(Locale.ROOT);
        if (v.equals("true") || v.equals("yes")) return Boolean.TRUE;
        if (v.equals("false") || v.equals("no")) return Boolean.FALSE;
        return Integer.parseInt(v) != 0;
    }
}
