/*
 * Copyright Lealone Database Group.
 * Licensed under the Server Side Public License, v 1.
 * Initial Developer: zhh
 */
package com.walpool.db;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.sqlite.Collation;
import org.sqlite.Function;
import org.sqlite.SQLiteErrorCode;
import org.sqlite.SQLiteException;

import com.walpool.common.exceptions.DbException;
import com.walpool.common.exceptions.ErrorCode;
import com.walpool.common.logging.Logger;
import com.walpool.common.logging.LoggerFactory;

/**
 * One SQLite connection.
 * <p>
 * A Database is not thread-safe: it must be used by one thread at a time,
 * which {@link com.walpool.db.scheduler.SerializedDatabase} guarantees.
 */
public class Database implements AutoCloseable {

    private static final Logger logger = LoggerFactory.getLogger(Database.class);

    private final String path;
    private final Configuration configuration;
    // 这个连接上注册过的函数和排序规则，重新打开连接时要再注册一次
    private final DatabaseRegistry registry = new DatabaseRegistry();
    // 按SQL文本缓存PreparedStatement，最久没用的先关闭，releaseMemory时清空
    private final LinkedHashMap<String, PreparedStatement> statementCache;
    private Connection conn;
    private boolean insideTransaction;
    private boolean closed;

    public Database(String path, Configuration configuration) {
        this.path = path;
        this.configuration = configuration.copy();
        statementCache = newStatementCache(this.configuration.getStatementCacheSize());
        conn = open();
    }

    private Connection open() {
        try {
            return configuration.toSQLiteConfig().createConnection(getURL(path));
        } catch (SQLException e) {
            throw DbException.fromSQLException(e, null);
        }
    }

    private LinkedHashMap<String, PreparedStatement> newStatementCache(int maxSize) {
        return new LinkedHashMap<String, PreparedStatement>(16, 0.75f, true) {
            private static final long serialVersionUID = 1L;

            @Override
            protected boolean removeEldestEntry(Map.Entry<String, PreparedStatement> eldest) {
                if (size() <= maxSize)
                    return false;
                try {
                    eldest.getValue().close();
                } catch (SQLException e) {
                    logger.warn("Failed to close cached statement {} of {}", e, eldest.getKey(), path);
                }
                return true;
            }
        };
    }

    public static String getURL(String path) {
        return "jdbc:sqlite:" + path;
    }

    public String getPath() {
        return path;
    }

    public Configuration getConfiguration() {
        return configuration;
    }

    public boolean isReadOnly() {
        return configuration.isReadOnly();
    }

    public boolean isClosed() {
        return closed;
    }

    /**
     * The underlying JDBC connection, for statements this class does not cover.
     */
    public Connection getConnection() {
        checkClosed();
        return conn;
    }

    public void execute(String sql, Object... args) {
        try {
            PreparedStatement ps = prepare(sql, args);
            if (ps.execute())
                ps.getResultSet().close();
        } catch (SQLException e) {
            throw DbException.fromSQLException(e, sql);
        }
    }

    public int executeUpdate(String sql, Object... args) {
        try {
            return prepare(sql, args).executeUpdate();
        } catch (SQLException e) {
            throw DbException.fromSQLException(e, sql);
        }
    }

    public <T> T fetchOne(String sql, RowMapper<T> mapper, Object... args) {
        try (ResultSet rs = prepare(sql, args).executeQuery()) {
            return rs.next() ? mapper.map(rs) : null;
        } catch (SQLException e) {
            throw DbException.fromSQLException(e, sql);
        }
    }

    public <T> List<T> fetchAll(String sql, RowMapper<T> mapper, Object... args) {
        List<T> list = new ArrayList<>();
        try (ResultSet rs = prepare(sql, args).executeQuery()) {
            while (rs.next())
                list.add(mapper.map(rs));
        } catch (SQLException e) {
            throw DbException.fromSQLException(e, sql);
        }
        return list;
    }

    public Integer fetchInt(String sql, Object... args) {
        return fetchOne(sql, rs -> {
            int v = rs.getInt(1);
            return rs.wasNull() ? null : v;
        }, args);
    }

    public Long fetchLong(String sql, Object... args) {
        return fetchOne(sql, rs -> {
            long v = rs.getLong(1);
            return rs.wasNull() ? null : v;
        }, args);
    }

    public String fetchString(String sql, Object... args) {
        return fetchOne(sql, rs -> rs.getString(1), args);
    }

    private PreparedStatement prepare(String sql, Object... args) throws SQLException {
        checkClosed();
        if (configuration.isTraceSql() && logger.isDebugEnabled()) {
            if (args == null || args.length == 0)
                logger.debug("{}: {}", path, sql);
            else
                logger.debug("{}: {} {}", path, sql, Arrays.toString(args));
        }
        PreparedStatement ps = statementCache.get(sql);
        if (ps == null) {
            ps = conn.prepareStatement(sql);
            statementCache.put(sql, ps);
        } else {
            ps.clearParameters();
        }
        if (args != null) {
            for (int i = 0; i < args.length; i++)
                ps.setObject(i + 1, args[i]);
        }
        return ps;
    }

    public int getCachedStatementCount() {
        return statementCache.size();
    }

    // --------------------- 事务 ---------------------

    public boolean isInsideTransaction() {
        return insideTransaction;
    }

    public void beginTransaction(TransactionKind kind) {
        execute(kind.getBeginSQL());
        insideTransaction = true;
    }

    public void commit() {
        execute("COMMIT TRANSACTION");
        insideTransaction = false;
    }

    public void rollback() {
        try {
            execute("ROLLBACK TRANSACTION");
        } finally {
            insideTransaction = false;
        }
    }

    /**
     * Runs the block inside a transaction of the given kind, null meaning the
     * configuration's default kind.
     * <p>
     * The block decides between commit and rollback. If it throws, the transaction is
     * rolled back and the block's exception is rethrown; a failed rollback is attached
     * to it as a suppressed exception.
     */
    public void inTransaction(TransactionKind kind, TransactionBlock block) throws SQLException {
        if (kind == null)
            kind = configuration.getDefaultTransactionKind();
        beginTransaction(kind);
        TransactionCompletion completion;
        try {
            completion = block.run(this);
        } catch (Throwable t) {
            rollbackAfter(t);
            throw t;
        }
        if (completion == null) {
            IllegalStateException e = new IllegalStateException(
                    "A transaction block must return COMMIT or ROLLBACK");
            rollbackAfter(e);
            throw e;
        }
        switch (completion) {
        case COMMIT:
            commitOrRollback();
            break;
        case ROLLBACK:
            rollback();
            break;
        }
    }

    /**
     * Runs the block inside a DEFERRED transaction and returns its result.
     * All statements of the block see the same snapshot of the database.
     */
    public <T> T inReadTransaction(DatabaseBlock<T> block) throws SQLException {
        beginTransaction(TransactionKind.DEFERRED);
        T result;
        try {
            result = block.run(this);
        } catch (Throwable t) {
            rollbackAfter(t);
            throw t;
        }
        commitOrRollback();
        return result;
    }

    private void commitOrRollback() {
        try {
            commit();
        } catch (RuntimeException e) {
            rollbackAfter(e);
            throw e;
        }
    }

    private void rollbackAfter(Throwable cause) {
        try {
            rollback();
        } catch (RuntimeException e) {
            cause.addSuppressed(e);
        }
    }

    // --------------------- 函数和排序规则 ---------------------

    public void addFunction(DatabaseFunction function) {
        checkClosed();
        try {
            Function.create(conn, function.getName(), function.toSQLiteFunction(),
                    function.getArgumentCount(), function.getFlags());
        } catch (SQLException e) {
            throw DbException.fromSQLException(e, null);
        }
        registry.addFunction(function);
    }

    /**
     * Removes a function. The driver can only drop the variadic overload of a name,
     * so removing a function with a fixed argument count reopens the connection
     * and registers the remaining functions and collations again.
     * <p>
     * Must not be called inside a transaction.
     */
    public void removeFunction(DatabaseFunction function) {
        checkClosed();
        boolean fixedArity = function.getArgumentCount() != -1;
        if (fixedArity && insideTransaction)
            throw new IllegalStateException("Can not remove function " + function + " inside a transaction");
        if (!registry.removeFunction(function))
            return;
        if (fixedArity) {
            reopen();
            return;
        }
        // 被缓存的语句可能引用了这个函数
        clearStatementCache();
        try {
            Function.destroy(conn, function.getName(), function.getArgumentCount());
        } catch (SQLException e) {
            throw DbException.fromSQLException(e, null);
        }
    }

    public void addCollation(DatabaseCollation collation) {
        checkClosed();
        try {
            Collation.create(conn, collation.getName(), collation.toSQLiteCollation());
        } catch (SQLException e) {
            throw DbException.fromSQLException(e, null);
        }
        registry.addCollation(collation);
    }

    public void removeCollation(DatabaseCollation collation) {
        checkClosed();
        registry.removeCollation(collation);
        clearStatementCache();
        try {
            Collation.destroy(conn, collation.getName());
        } catch (SQLException e) {
            throw DbException.fromSQLException(e, null);
        }
    }

    private void reopen() {
        clearStatementCache();
        try {
            conn.close();
        } catch (SQLException e) {
            throw DbException.fromSQLException(e, null);
        }
        try {
            conn = open();
        } catch (RuntimeException e) {
            closed = true;
            throw e;
        }
        registry.applyTo(this);
        if (logger.isDebugEnabled())
            logger.debug("Reopened {}", path);
    }

    // --------------------- WAL和内存管理 ---------------------

    /**
     * Runs a WAL checkpoint. See https://www.sqlite.org/c3ref/wal_checkpoint_v2.html
     * <p>
     * A FULL, RESTART or TRUNCATE checkpoint blocked by a reader or a writer fails
     * with SQLITE_BUSY.
     */
    public CheckpointResult checkpoint(CheckpointMode mode) {
        String sql = "PRAGMA wal_checkpoint(" + mode.name() + ")";
        int[] row = fetchOne(sql, rs -> new int[] { rs.getInt(1), rs.getInt(2), rs.getInt(3) });
        if (row == null)
            throw DbException.get(ErrorCode.GENERAL_ERROR_1, sql + " returned no row");
        if (row[0] != 0) {
            // 被阻塞的checkpoint不是错误，只在第一列返回1，这里按驱动的格式生成SQLITE_BUSY异常
            SQLiteErrorCode busy = SQLiteErrorCode.SQLITE_BUSY;
            String msg = "[" + busy.name() + "] " + busy.message + " (database is locked)";
            throw DbException.fromSQLException(new SQLiteException(msg, busy), sql);
        }
        return new CheckpointResult(mode, row[1], row[2]);
    }

    /**
     * Closes the cached statements and asks SQLite to free as much memory as possible.
     */
    public void releaseMemory() {
        checkClosed();
        clearStatementCache();
        try (Statement stmt = conn.createStatement()) {
            stmt.execute("PRAGMA shrink_memory");
        } catch (SQLException e) {
            throw DbException.fromSQLException(e, "PRAGMA shrink_memory");
        }
    }

    private void clearStatementCache() {
        SQLException error = null;
        for (PreparedStatement ps : statementCache.values()) {
            try {
                ps.close();
            } catch (SQLException e) {
                if (error == null)
                    error = e;
                else
                    error.addSuppressed(e);
            }
        }
        statementCache.clear();
        if (error != null)
            throw DbException.fromSQLException(error, null);
    }

    private void checkClosed() {
        if (closed)
            throw DbException.get(ErrorCode.DATABASE_CLOSED_1, path);
    }

    @Override
    public void close() {
        if (closed)
            return;
        closed = true;
        RuntimeException error = null;
        try {
            clearStatementCache();
        } catch (RuntimeException e) {
            error = e;
        }
        try {
            conn.close();
        } catch (SQLException e) {
            DbException e2 = DbException.fromSQLException(e, null);
            if (error != null)
                e2.addSuppressed(error);
            throw e2;
        }
        if (error != null)
            throw error;
    }

    @Override
    public String toString() {
        return "Database[" + path + (isReadOnly() ? ", readonly" : "") + "]";
    }
}
