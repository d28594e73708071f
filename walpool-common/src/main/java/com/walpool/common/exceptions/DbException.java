/*
 * Copyright Lealone Database Group.
 * Licensed under the Server Side Public License, v 1.
 * Initial Developer: zhh
 */
package com.walpool.common.exceptions;

import java.lang.reflect.InvocationTargetException;
import java.sql.SQLException;

/**
 * This exception wraps a checked exception and any failure reported by the engine.
 * The error code is either a SQLite result code or one of the walpool codes in {@link ErrorCode}.
 */
public class DbException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    private final int errorCode;
    private final String sql;

    public DbException(int errorCode, String message, String sql, Throwable cause) {
        super(message, cause);
        this.errorCode = errorCode;
        this.sql = sql;
    }

    public int getErrorCode() {
        return errorCode;
    }

    public String getSQL() {
        return sql;
    }

    @Override
    public String getMessage() {
        String msg = super.getMessage();
        if (sql != null)
            msg += " [SQL: " + sql + "]";
        return msg;
    }

    public static DbException get(int errorCode, Object... params) {
        return new DbException(errorCode, ErrorCode.getMessage(errorCode, params), null, null);
    }

    public static DbException get(int errorCode, Throwable cause, Object... params) {
        return new DbException(errorCode, ErrorCode.getMessage(errorCode, params), null, cause);
    }

    /**
     * Keeps the result code and the message the engine reported.
     */
    public static DbException fromSQLException(SQLException e, String sql) {
        int code = e.getErrorCode();
        if (code == 0)
            code = ErrorCode.SQLITE_ERROR;
        return new DbException(code, e.getMessage(), sql, e);
    }

    public static DbException convert(Throwable e) {
        if (e instanceof DbException) {
            return (DbException) e;
        } else if (e instanceof SQLException) {
            return fromSQLException((SQLException) e, null);
        } else if (e instanceof InvocationTargetException) {
            return convert(e.getCause());
        } else if (e instanceof InterruptedException) {
            return get(ErrorCode.INTERRUPTED_1, e, "a result");
        }
        return get(ErrorCode.GENERAL_ERROR_1, e, e);
    }

    /**
     * Rethrows runtime exceptions and errors unchanged, converts everything else.
     */
    public static RuntimeException rethrow(Throwable e) {
        if (e instanceof RuntimeException)
            throw (RuntimeException) e;
        if (e instanceof Error)
            throw (Error) e;
        throw convert(e);
    }
}
