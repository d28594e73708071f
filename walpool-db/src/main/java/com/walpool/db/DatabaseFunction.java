/*
 * Copyright Lealone Database Group.
 * Licensed under the Server Side Public License, v 1.
 * Initial Developer: zhh
 */
package com.walpool.db;

import java.sql.SQLException;

import org.sqlite.Function;

/**
 * A custom SQL function.
 * <p>
 * Two functions with the same name (ignoring case) and the same argument count are the
 * same function: adding one to a pool replaces the other.
 *
 * <pre>
 * DatabaseFunction succ = new DatabaseFunction("succ", 1, args -&gt; {
 *     Long v = (Long) args[0];
 *     return v == null ? null : v + 1;
 * });
 * pool.addFunction(succ);
 * pool.read(db -&gt; db.fetchInt("SELECT succ(1)")); // 2
 * </pre>
 */
public class DatabaseFunction {

    /**
     * Receives the arguments as Long, Double, String, byte[] or null and returns a value of
     * one of these types (Integer and Boolean are accepted too). An exception thrown by the
     * body becomes an SQL error of the calling statement.
     */
    @FunctionalInterface
    public interface Body {
        Object call(Object[] args) throws Exception;
    }

    // sqlite3_value_type
    private static final int SQLITE_INTEGER = 1;
    private static final int SQLITE_FLOAT = 2;
    private static final int SQLITE_TEXT = 3;
    private static final int SQLITE_BLOB = 4;

    private final String name;
    private final int argumentCount;
    private final boolean deterministic;
    private final Body body;

    public DatabaseFunction(String name, int argumentCount, Body body) {
        this(name, argumentCount, false, body);
    }

    /**
     * @param argumentCount the number of arguments, -1 for a variadic function
     */
    public DatabaseFunction(String name, int argumentCount, boolean deterministic, Body body) {
        if (name == null || name.isEmpty())
            throw new IllegalArgumentException("function name can not be empty");
        if (argumentCount < -1)
            throw new IllegalArgumentException("invalid argument count: " + argumentCount);
        if (body == null)
            throw new IllegalArgumentException("function body can not be null");
        this.name = name;
        this.argumentCount = argumentCount;
        this.deterministic = deterministic;
        this.body = body;
    }

    public String getName() {
        return name;
    }

    public int getArgumentCount() {
        return argumentCount;
    }

    int getFlags() {
        return deterministic ? Function.FLAG_DETERMINISTIC : 0;
    }

    Function toSQLiteFunction() {
        return new Function() {
            @Override
            protected void xFunc() throws SQLException {
                int count = args();
                Object[] values = new Object[count];
                for (int i = 0; i < count; i++) {
                    switch (value_type(i)) {
                    case SQLITE_INTEGER:
                        values[i] = value_long(i);
                        break;
                    case SQLITE_FLOAT:
                        values[i] = value_double(i);
                        break;
                    case SQLITE_TEXT:
                        values[i] = value_text(i);
                        break;
                    case SQLITE_BLOB:
                        values[i] = value_blob(i);
                        break;
                    default:
                        values[i] = null;
                    }
                }
                Object r;
                try {
                    r = body.call(values);
                } catch (Exception e) {
                    error(name + ": " + e.getMessage());
                    return;
                }
                if (r == null)
                    result();
                else if (r instanceof Integer || r instanceof Long || r instanceof Short
                        || r instanceof Byte)
                    result(((Number) r).longValue());
                else if (r instanceof Number)
                    result(((Number) r).doubleValue());
                else if (r instanceof Boolean)
                    result(((Boolean) r) ? 1 : 0);
                else if (r instanceof String)
                    result((String) r);
                else if (r instanceof byte[])
                    result((byte[]) r);
                else
                    error(name + ": unsupported result type " + r.getClass().getName());
            }
        };
    }

    @Override
    public int hashCode() {
        return name.toUpperCase().hashCode() * 31 + argumentCount;
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj)
            return true;
        if (!(obj instanceof DatabaseFunction))
            return false;
        DatabaseFunction other = (DatabaseFunction) obj;
        return argumentCount == other.argumentCount && name.equalsIgnoreCase(other.name);
    }

    @Override
    public String toString() {
        return name + "/" + argumentCount;
    }
}
