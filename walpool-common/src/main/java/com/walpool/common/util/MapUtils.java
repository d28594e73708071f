/*
 * Copyright Lealone Database Group.
 * Licensed under the Server Side Public License, v 1.
 * Initial Developer: zhh
 */
package com.walpool.common.util;

import java.util.Map;

public class MapUtils {

    private MapUtils() {
        // utility class
    }

    public static int getInt(Map<String, String> map, String key, int def) {
        if (map == null)
            return def;
        return Utils.toInt(map.get(key), def);
    }

    public static long getLong(Map<String, String> map, String key, long def) {
        if (map == null)
            return def;
        return Utils.toLong(map.get(key), def);
    }

    public static boolean getBoolean(Map<String, String> map, String key, boolean def) {
        if (map == null)
            return def;
        return Utils.toBoolean(map.get(key), def);
    }

    public static String getString(Map<String, String> map, String key, String def) {
        if (map == null)
            return def;
        String value = map.get(key);
        if (value == null)
            return def;
        else
            return value;
    }
}
