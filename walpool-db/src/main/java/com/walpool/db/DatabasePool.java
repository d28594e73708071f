/*
 * Copyright Lealone Database Group.
 * Licensed under the Server Side Public License, v 1.
 * Initial Developer: zhh
 */
package com.walpool.db;

import java.io.File;
import java.util.concurrent.atomic.AtomicInteger;

import com.walpool.common.exceptions.ConfigException;
import com.walpool.common.exceptions.DbException;
import com.walpool.common.exceptions.ErrorCode;
import com.walpool.common.logging.Logger;
import com.walpool.common.logging.LoggerFactory;
import com.walpool.db.pool.Pool;
import com.walpool.db.scheduler.SerializedDatabase;
import com.walpool.db.scheduler.SerializedThread;

/**
 * A DatabasePool grants concurrent accesses to a SQLite database in WAL mode.
 * <p>
 * It owns one writer connection and at most maximumReaderCount reader connections,
 * opened when they are first needed. Reads run concurrently with each other and with
 * the writer. Writes are serialized.
 * <p>
 * The entry points are not reentrant: calling them from a block that runs on one of the
 * pool's connections fails with {@link ErrorCode#NOT_REENTRANT_1}.
 */
public class DatabasePool implements AutoCloseable {

    private static final Logger logger = LoggerFactory.getLogger(DatabasePool.class);

    public static final int DEFAULT_MAXIMUM_READER_COUNT = 5;

    private final String path;
    private final String fileName;
    private final Configuration configuration;
    private final Configuration writerConfiguration;
    private final Configuration readerConfiguration;
    private final int maximumReaderCount;

    private final SerializedDatabase writer;
    private final Pool<SerializedDatabase> readerPool;
    private final DatabaseRegistry registry = new DatabaseRegistry();
    private final AtomicInteger readerIds = new AtomicInteger();

    // 保证函数和排序规则的广播按调用顺序完成
    private final Object broadcastLock = new Object();
    private volatile boolean closed;

    public DatabasePool(String path) {
        this(path, new Configuration());
    }

    public DatabasePool(String path, Configuration configuration) {
        this(path, configuration, DEFAULT_MAXIMUM_READER_COUNT);
    }

    /**
     * Opens the SQLite database at path, and activates the WAL mode.
     *
     * @param path the path to the database file
     * @param configuration the configuration, copied
     * @param maximumReaderCount the maximum number of readers, at least 2
     * @throws DbException if the database can not be opened or the WAL mode can not be activated
     */
    public DatabasePool(String path, Configuration configuration, int maximumReaderCount) {
        if (maximumReaderCount <= 1)
            throw new ConfigException("maximumReaderCount must be at least 2, got " + maximumReaderCount);
        if (configuration == null)
            configuration = new Configuration();
        this.path = path;
        this.fileName = new File(path).getName();
        this.configuration = configuration.copy();
        this.maximumReaderCount = maximumReaderCount;

        // Writer
        writerConfiguration = configuration.copy().setReadOnly(false);
        writer = new SerializedDatabase(path, writerConfiguration, "walpool-writer:" + fileName, this);
        try {
            activateWALMode();
        } catch (RuntimeException e) {
            closeAfter(writer, e);
            throw e;
        }

        // Readers
        readerConfiguration = configuration.copy().setReadOnly(true)
                .setDefaultTransactionKind(TransactionKind.DEFERRED);
        readerPool = new Pool<>("walpool-readers:" + fileName, maximumReaderCount, this::openReader,
                this::closeReader);

        logger.info("Opened database pool {}, maximum reader count: {}", path, maximumReaderCount);
    }

    private void activateWALMode() {
        String mode = writer.inDatabase(db -> db.fetchString("PRAGMA journal_mode=WAL"));
        if (!"wal".equals(mode)) {
            logger.warn("Journal mode of {} is {}", path, mode);
            throw DbException.get(ErrorCode.WAL_MODE_NOT_ACTIVATED_1, path);
        }
    }

    // 每个新的reader都要应用registry的当前内容，而不是创建pool时的快照
    private SerializedDatabase openReader() {
        String name = "walpool-reader-" + readerIds.incrementAndGet() + ":" + fileName;
        SerializedDatabase reader;
        try {
            reader = new SerializedDatabase(path, readerConfiguration, name, this);
        } catch (RuntimeException e) {
            logger.warn("Failed to open reader {}", e, name);
            throw DbException.get(ErrorCode.READER_OPEN_FAILED_1, e, path);
        }
        try {
            reader.inDatabase(db -> {
                registry.applyTo(db);
                return null;
            });
        } catch (RuntimeException e) {
            logger.warn("Failed to prepare reader {}", e, name);
            closeAfter(reader, e);
            throw DbException.get(ErrorCode.READER_OPEN_FAILED_1, e, path);
        }
        if (logger.isDebugEnabled())
            logger.debug("Opened reader {}", name);
        return reader;
    }

    private void closeReader(SerializedDatabase reader) {
        reader.close();
        if (logger.isDebugEnabled())
            logger.debug("Closed reader {}", reader.getName());
    }

    private static void closeAfter(SerializedDatabase db, Throwable cause) {
        try {
            db.close();
        } catch (RuntimeException e) {
            cause.addSuppressed(e);
        }
    }

    public String getPath() {
        return path;
    }

    public Configuration getConfiguration() {
        return configuration.copy();
    }

    public int getMaximumReaderCount() {
        return maximumReaderCount;
    }

    public int getLiveReaderCount() {
        return readerPool.getLiveCount();
    }

    private void checkAccess() {
        if (closed)
            throw DbException.get(ErrorCode.DATABASE_CLOSED_1, path);
        SerializedDatabase current = SerializedThread.currentDatabase();
        if (current != null && current.getOwner() == this)
            throw DbException.get(ErrorCode.NOT_REENTRANT_1, current.getName());
    }

    // --------------------- 读写 ---------------------

    /**
     * Synchronously executes a read-only block in the database, and returns its result.
     * <p>
     * The block runs inside a DEFERRED transaction, so that all its statements see the same
     * snapshot of the database even when the writer commits in the meantime.
     *
     * <pre>
     * int count = pool.read(db -&gt; db.fetchInt("SELECT COUNT(*) FROM items"));
     * </pre>
     *
     * This method is not reentrant.
     */
    public <T> T read(DatabaseBlock<T> block) {
        checkAccess();
        return readerPool.get(reader -> reader.inReadTransaction(block));
    }

    /**
     * Synchronously executes an update block in the database, without implicit transaction.
     * <p>
     * This method is not reentrant.
     */
    public void write(DatabaseAction block) {
        checkAccess();
        writer.inDatabase(db -> {
            block.run(db);
            return null;
        });
    }

    /**
     * Synchronously executes a block in the database, wrapped inside a transaction of the
     * writer configuration's default kind.
     * <p>
     * This method is not reentrant.
     */
    public void writeInTransaction(TransactionBlock block) {
        writeInTransaction(null, block);
    }

    /**
     * Synchronously executes a block in the database, wrapped inside a transaction.
     * <p>
     * The block returns COMMIT or ROLLBACK. If it throws, the transaction is rolled back and
     * the exception is rethrown.
     *
     * <pre>
     * pool.writeInTransaction(TransactionKind.IMMEDIATE, db -&gt; {
     *     db.execute("INSERT INTO items (name) VALUES (?)", "foo");
     *     return TransactionCompletion.COMMIT;
     * });
     * </pre>
     *
     * This method is not reentrant.
     *
     * @param kind the transaction kind, null for the writer configuration's default kind
     */
    public void writeInTransaction(TransactionKind kind, TransactionBlock block) {
        checkAccess();
        TransactionKind k = kind != null ? kind : writerConfiguration.getDefaultTransactionKind();
        writer.inTransaction(k, block);
    }

    // --------------------- WAL ---------------------

    public CheckpointResult checkpoint() {
        return checkpoint(CheckpointMode.PASSIVE);
    }

    /**
     * Runs a WAL checkpoint on the writer connection.
     * <p>
     * A checkpoint can not reclaim the WAL frames that readers still need.
     *
     * @throws DbException with error code SQLITE_BUSY when the checkpoint is blocked
     */
    public CheckpointResult checkpoint(CheckpointMode mode) {
        checkAccess();
        CheckpointMode m = mode != null ? mode : CheckpointMode.PASSIVE;
        CheckpointResult result = writer.inDatabase(db -> db.checkpoint(m));
        if (logger.isDebugEnabled())
            logger.debug("Checkpoint {}: {}", path, result);
        return result;
    }

    // --------------------- 内存管理 ---------------------

    /**
     * Frees as much memory as possible.
     * <p>
     * Blocks until the in-flight accesses are completed, then closes the idle readers.
     * The next reads open new readers.
     */
    public void releaseMemory() {
        checkAccess();
        writer.releaseMemory();
        readerPool.forEach(SerializedDatabase::releaseMemory);
        readerPool.clear();
        if (logger.isDebugEnabled())
            logger.debug("Released memory of {}, live readers: {}", path, readerPool.getLiveCount());
    }

    // --------------------- 函数和排序规则 ---------------------

    /**
     * Adds or redefines an SQL function on every connection, current and future.
     */
    public void addFunction(DatabaseFunction function) {
        checkAccess();
        synchronized (broadcastLock) {
            registry.addFunction(function);
            writer.inDatabase(db -> {
                db.addFunction(function);
                return null;
            });
            readerPool.forEach(reader -> reader.inDatabase(db -> {
                db.addFunction(function);
                return null;
            }));
        }
        if (logger.isDebugEnabled())
            logger.debug("Added function {} to {}", function, path);
    }

    public void removeFunction(DatabaseFunction function) {
        checkAccess();
        synchronized (broadcastLock) {
            registry.removeFunction(function);
            writer.inDatabase(db -> {
                db.removeFunction(function);
                return null;
            });
            readerPool.forEach(reader -> reader.inDatabase(db -> {
                db.removeFunction(function);
                return null;
            }));
        }
        if (logger.isDebugEnabled())
            logger.debug("Removed function {} from {}", function, path);
    }

    /**
     * Adds or redefines a collation on every connection, current and future.
     */
    public void addCollation(DatabaseCollation collation) {
        checkAccess();
        synchronized (broadcastLock) {
            registry.addCollation(collation);
            writer.inDatabase(db -> {
                db.addCollation(collation);
                return null;
            });
            readerPool.forEach(reader -> reader.inDatabase(db -> {
                db.addCollation(collation);
                return null;
            }));
        }
        if (logger.isDebugEnabled())
            logger.debug("Added collation {} to {}", collation, path);
    }

    public void removeCollation(DatabaseCollation collation) {
        checkAccess();
        synchronized (broadcastLock) {
            registry.removeCollation(collation);
            writer.inDatabase(db -> {
                db.removeCollation(collation);
                return null;
            });
            readerPool.forEach(reader -> reader.inDatabase(db -> {
                db.removeCollation(collation);
                return null;
            }));
        }
        if (logger.isDebugEnabled())
            logger.debug("Removed collation {} from {}", collation, path);
    }

    // --------------------- 关闭 ---------------------

    public boolean isClosed() {
        return closed;
    }

    /**
     * Closes the readers and the writer. Readers in use are closed when they are returned.
     */
    @Override
    public void close() {
        if (closed)
            return;
        SerializedDatabase current = SerializedThread.currentDatabase();
        if (current != null && current.getOwner() == this)
            throw DbException.get(ErrorCode.NOT_REENTRANT_1, current.getName());
        closed = true;
        try {
            readerPool.close();
        } finally {
            writer.close();
        }
        logger.info("Closed database pool {}", path);
    }

    @Override
    public String toString() {
        return "DatabasePool[" + path + "]";
    }
}
