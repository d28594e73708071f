/*
 * Copyright Lealone Database Group.
 * Licensed under the Server Side Public License, v 1.
 * Initial Developer: zhh
 */
package com.walpool.common.util;

public class Utils {

    private Utils() {
        // utility class
    }

    public static int toInt(String value, int def) {
        if (value == null)
            return def;
        return Integer.parseInt(value.trim());
    }

    public static long toLong(String value, long def) {
        if (value == null)
            return def;
        return Long.parseLong(value.trim());
    }

    public static boolean toBoolean(String value, boolean def) {
        if (value == null)
            return def;
        String v = value.trim();
        if (v.equalsIgnoreCase("true") || v.equals("1"))
            return true;
        if (v.equalsIgnoreCase("false") || v.equals("0"))
            return false;
        throw new IllegalArgumentException("Not a boolean value: " + value);
    }

    @SuppressWarnings("unchecked")
    public static <T> T newInstance(Class<?> clz) throws ReflectiveOperationException {
        return (T) clz.getDeclaredConstructor().newInstance();
    }
}
