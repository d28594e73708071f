/*
 * Copyright Lealone Database Group.
 * Licensed under the Server Side Public License, v 1.
 * Initial Developer: zhh
 */
package com.walpool.db.scheduler;

import java.util.concurrent.ConcurrentLinkedQueue;

import com.walpool.common.async.AsyncCallback;
import com.walpool.common.exceptions.DbException;
import com.walpool.common.exceptions.ErrorCode;
import com.walpool.common.logging.Logger;
import com.walpool.common.logging.LoggerFactory;
import com.walpool.common.util.Awaiter;
import com.walpool.db.Configuration;
import com.walpool.db.Database;
import com.walpool.db.DatabaseBlock;
import com.walpool.db.TransactionBlock;
import com.walpool.db.TransactionKind;

/**
 * A database connection that only its own thread touches.
 * <p>
 * Every access is a task put in a queue and run by the connection's {@link SerializedThread},
 * one at a time and in submission order. The submitting thread blocks until its task completes.
 */
public class SerializedDatabase implements Runnable, AutoCloseable {

    private static final Logger logger = LoggerFactory.getLogger(SerializedDatabase.class);

    private final String name;
    private final Object owner;
    private final Database db;
    private final long loopInterval;
    private final SerializedThread thread;
    private final Awaiter awaiter = new Awaiter(logger);

    // 外部线程和串行线程会并发访问这个队列
    private final ConcurrentLinkedQueue<Runnable> tasks = new ConcurrentLinkedQueue<>();
    private boolean closed; // 受tasks保护
    private volatile boolean stopped;

    public SerializedDatabase(String path, Configuration configuration, String name) {
        this(path, configuration, name, null);
    }

    /**
     * @param owner the object this connection belongs to, used to detect reentrant calls
     */
    public SerializedDatabase(String path, Configuration configuration, String name, Object owner) {
        this.name = name;
        this.owner = owner;
        this.loopInterval = configuration.getLoopInterval();
        db = new Database(path, configuration);
        thread = new SerializedThread(this, name);
        thread.start();
    }

    public String getName() {
        return name;
    }

    public Object getOwner() {
        return owner;
    }

    public Configuration getConfiguration() {
        return db.getConfiguration();
    }

    @Override
    public void run() {
        while (!stopped) {
            runTasks();
            if (!stopped)
                awaiter.doAwait(loopInterval);
        }
        logger.debug("{} stopped", name);
    }

    private void runTasks() {
        Runnable task = tasks.poll();
        while (task != null) {
            try {
                task.run();
            } catch (Throwable e) {
                logger.warn("Failed to run task on {}", e, name);
            }
            task = tasks.poll();
        }
    }

    private void submit(Runnable task) {
        synchronized (tasks) {
            if (closed)
                throw DbException.get(ErrorCode.DATABASE_CLOSED_1, name);
            tasks.add(task);
        }
        awaiter.wakeUp();
    }

    /**
     * Synchronously runs the block on this connection's thread and returns its result.
     * <p>
     * This method is not reentrant: calling it from a block already running on this
     * connection fails with {@link ErrorCode#NOT_REENTRANT_1}.
     */
    public <T> T inDatabase(DatabaseBlock<T> block) {
        checkNotReentrant();
        AsyncCallback<T> ac = new AsyncCallback<>();
        submit(() -> {
            try {
                ac.setAsyncResult(block.run(db));
            } catch (Throwable t) {
                ac.setAsyncResult(t);
            }
        });
        return ac.await();
    }

    public void inTransaction(TransactionKind kind, TransactionBlock block) {
        inDatabase(db -> {
            db.inTransaction(kind, block);
            return null;
        });
    }

    public <T> T inReadTransaction(DatabaseBlock<T> block) {
        return inDatabase(db -> db.inReadTransaction(block));
    }

    /**
     * Waits for the tasks already submitted, then releases the memory of the connection.
     */
    public void releaseMemory() {
        inDatabase(db -> {
            db.releaseMemory();
            return null;
        });
    }

    private void checkNotReentrant() {
        if (Thread.currentThread() == thread)
            throw DbException.get(ErrorCode.NOT_REENTRANT_1, name);
    }

    public boolean isClosed() {
        synchronized (tasks) {
            return closed;
        }
    }

    /**
     * Runs the tasks already submitted, closes the connection and stops the thread.
     */
    @Override
    public void close() {
        checkNotReentrant();
        AsyncCallback<Void> ac = new AsyncCallback<>();
        synchronized (tasks) {
            if (closed)
                return;
            closed = true;
            // 关闭任务是队列中的最后一个任务
            tasks.add(() -> {
                try {
                    db.close();
                    ac.setAsyncResult((Void) null);
                } catch (Throwable t) {
                    ac.setAsyncResult(t);
                } finally {
                    stopped = true;
                }
            });
        }
        awaiter.wakeUp();
        ac.await();
    }

    @Override
    public String toString() {
        return name;
    }
}
