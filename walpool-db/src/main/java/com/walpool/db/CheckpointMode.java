/*
 * Copyright Lealone Database Group.
 * Licensed under the Server Side Public License, v 1.
 * Initial Developer: zhh
 */
package com.walpool.db;

/**
 * The checkpoint modes of sqlite3_wal_checkpoint_v2, with their native values.
 */
public enum CheckpointMode {
    PASSIVE(0), // SQLITE_CHECKPOINT_PASSIVE
    FULL(1), // SQLITE_CHECKPOINT_FULL
    RESTART(2), // SQLITE_CHECKPOINT_RESTART
    TRUNCATE(3); // SQLITE_CHECKPOINT_TRUNCATE

    private final int code;

    private CheckpointMode(int code) {
        this.code = code;
    }

    public int getCode() {
        return code;
    }

    public static CheckpointMode valueOf(int code) {
        for (CheckpointMode mode : values()) {
            if (mode.code == code)
                return mode;
        }
        throw new IllegalArgumentException("Unknown checkpoint mode: " + code);
    }
}
