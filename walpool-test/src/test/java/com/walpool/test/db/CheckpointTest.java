/*
 * Copyright Lealone Database Group.
 * Licensed under the Server Side Public License, v 1.
 * Initial Developer: zhh
 */
package com.walpool.test.db;

import java.io.File;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import org.junit.After;
import org.junit.Before;
import org.junit.Test;

import com.walpool.common.exceptions.DbException;
import com.walpool.common.exceptions.ErrorCode;
import com.walpool.db.CheckpointMode;
import com.walpool.db.CheckpointResult;
import com.walpool.db.DatabasePool;
import com.walpool.test.TestBase;

public class CheckpointTest extends TestBase {

    private String path;
    private DatabasePool pool;

    @Before
    public void before() {
        path = newDatabasePath("CheckpointTest");
        pool = new DatabasePool(path);
        pool.write(db -> {
            db.execute("CREATE TABLE items (id INTEGER PRIMARY KEY, name TEXT)");
            db.execute("INSERT INTO items (name) VALUES ('a')");
        });
    }

    @After
    public void after() {
        pool.close();
    }

    @Test
    public void testModeCodes() {
        assertEquals(0, CheckpointMode.PASSIVE.getCode());
        assertEquals(1, CheckpointMode.FULL.getCode());
        assertEquals(2, CheckpointMode.RESTART.getCode());
        assertEquals(3, CheckpointMode.TRUNCATE.getCode());
        for (CheckpointMode mode : CheckpointMode.values())
            assertSame(mode, CheckpointMode.valueOf(mode.getCode()));
    }

    @Test
    public void testPassive() {
        CheckpointResult result = pool.checkpoint();
        assertEquals(CheckpointMode.PASSIVE, result.getMode());
        assertTrue(result.getLogFrames() > 0);
        assertEquals(result.getLogFrames(), result.getCheckpointedFrames());
    }

    @Test
    public void testTruncate() {
        File wal = new File(path + "-wal");
        assertTrue(wal.length() > 0);
        pool.checkpoint(CheckpointMode.TRUNCATE);
        assertEquals(0, wal.length());
        // 数据没有丢失
        assertEquals(Integer.valueOf(1), pool.read(db -> db.fetchInt("SELECT COUNT(*) FROM items")));
    }

    @Test
    public void testBlockedByReader() throws Exception {
        CountDownLatch snapshotTaken = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);
        ExecutorService executor = Executors.newSingleThreadExecutor();
        try {
            Future<Integer> reader = executor.submit(() -> pool.read(db -> {
                int count = db.fetchInt("SELECT COUNT(*) FROM items");
                snapshotTaken.countDown();
                try {
                    release.await();
                } catch (InterruptedException e) {
                    throw new IllegalStateException(e);
                }
                return count;
            }));
            assertTrue(snapshotTaken.await(10, TimeUnit.SECONDS));

            // reader还在使用旧的快照
            pool.write(db -> db.execute("INSERT INTO items (name) VALUES ('b')"));
            try {
                pool.checkpoint(CheckpointMode.FULL);
                fail();
            } catch (DbException e) {
                assertEquals(ErrorCode.SQLITE_BUSY, e.getErrorCode());
                assertTrue(e.getMessage(), e.getMessage().contains("database is locked"));
                assertEquals("PRAGMA wal_checkpoint(FULL)", e.getSQL());
            }
            CheckpointResult result = pool.checkpoint(CheckpointMode.PASSIVE);
            assertTrue(result.getCheckpointedFrames() < result.getLogFrames());

            release.countDown();
            assertEquals(Integer.valueOf(1), reader.get(10, TimeUnit.SECONDS));
        } finally {
            release.countDown();
            executor.shutdown();
        }
        pool.checkpoint(CheckpointMode.TRUNCATE);
        assertEquals(0, new File(path + "-wal").length());
    }
}
