/*
 * Copyright Lealone Database Group.
 * Licensed under the Server Side Public License, v 1.
 * Initial Developer: zhh
 */
package com.walpool.db;

/**
 * Keys of the map form of {@link Configuration}.
 */
public enum DbSetting {
    READ_ONLY,
    DEFAULT_TRANSACTION_KIND,
    BUSY_TIMEOUT,
    FOREIGN_KEYS_ENABLED,
    TRACE_SQL,
    LOOP_INTERVAL,
    STATEMENT_CACHE_SIZE;

    public static DbSetting get(String key) {
        try {
            return valueOf(key.trim().toUpperCase());
        } catch (IllegalArgumentException e) {
            return null;
        }
    }
}
