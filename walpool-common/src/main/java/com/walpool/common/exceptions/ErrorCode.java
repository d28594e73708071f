/*
 * Copyright Lealone Database Group.
 * Licensed under the Server Side Public License, v 1.
 * Initial Developer: zhh
 */
package com.walpool.common.exceptions;

import java.text.MessageFormat;
import java.util.HashMap;
import java.util.Map;

/**
 * Error codes carried by {@link DbException}.
 * <p>
 * Codes below 1000 are SQLite result codes and come straight from the engine.
 * Codes in the 90000 range are raised by walpool itself.
 */
public class ErrorCode {

    // SQLite result codes
    public static final int SQLITE_ERROR = 1;
    public static final int SQLITE_BUSY = 5;
    public static final int SQLITE_READONLY = 8;
    public static final int SQLITE_CONSTRAINT = 19;

    public static final int GENERAL_ERROR_1 = 90000;
    public static final int WAL_MODE_NOT_ACTIVATED_1 = 90001;
    public static final int DATABASE_CLOSED_1 = 90002;
    public static final int NOT_REENTRANT_1 = 90003;
    public static final int READER_OPEN_FAILED_1 = 90004;
    public static final int INTERRUPTED_1 = 90005;

    private static final Map<Integer, String> MESSAGES = new HashMap<>();

    static {
        MESSAGES.put(GENERAL_ERROR_1, "General error: {0}");
        MESSAGES.put(WAL_MODE_NOT_ACTIVATED_1, "could not activate WAL Mode at path: {0}");
        MESSAGES.put(DATABASE_CLOSED_1, "Database is closed: {0}");
        MESSAGES.put(NOT_REENTRANT_1, "Database methods are not reentrant: {0}");
        MESSAGES.put(READER_OPEN_FAILED_1, "Could not open a reader connection at path: {0}");
        MESSAGES.put(INTERRUPTED_1, "Interrupted while waiting for {0}");
    }

    private ErrorCode() {
    }

    public static String getMessage(int errorCode, Object... params) {
        String pattern = MESSAGES.get(errorCode);
        if (pattern == null)
            return "Error " + errorCode;
        return MessageFormat.format(pattern, params);
    }

    public static boolean isEngineError(int errorCode) {
        return errorCode > 0 && errorCode < 1000;
    }
}
