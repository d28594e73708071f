/*
 * Copyright Lealone Database Group.
 * Licensed under the Server Side Public License, v 1.
 * Initial Developer: zhh
 */
package com.walpool.test.db;

import org.junit.After;
import org.junit.Before;
import org.junit.Test;

import com.walpool.common.exceptions.ConfigException;
import com.walpool.common.exceptions.DbException;
import com.walpool.common.exceptions.ErrorCode;
import com.walpool.db.Configuration;
import com.walpool.db.DatabasePool;
import com.walpool.db.TransactionCompletion;
import com.walpool.db.TransactionKind;
import com.walpool.test.TestBase;

public class DatabasePoolTest extends TestBase {

    private DatabasePool pool;

    @Before
    public void before() {
        pool = newDatabasePool("DatabasePoolTest");
        pool.write(db -> db.execute("CREATE TABLE items (id INTEGER PRIMARY KEY, name TEXT)"));
    }

    @After
    public void after() {
        pool.close();
    }

    @Test
    public void testOpen() {
        assertEquals(DatabasePool.DEFAULT_MAXIMUM_READER_COUNT, pool.getMaximumReaderCount());
        assertEquals(0, pool.getLiveReaderCount()); // 按需创建reader
        assertEquals("wal", pool.read(db -> db.fetchString("PRAGMA journal_mode")));
        assertEquals(1, pool.getLiveReaderCount());
        assertFalse(pool.getConfiguration().isReadOnly());
        assertTrue(pool.getPath().endsWith("DatabasePoolTest.sqlite"));
    }

    @Test
    public void testInvalidMaximumReaderCount() {
        try {
            new DatabasePool(newDatabasePath("DatabasePoolTest-invalid"), new Configuration(), 1);
            fail();
        } catch (ConfigException e) {
        }
    }

    @Test
    public void testWALModeNotActivated() {
        try {
            new DatabasePool(":memory:");
            fail();
        } catch (DbException e) {
            assertEquals(ErrorCode.WAL_MODE_NOT_ACTIVATED_1, e.getErrorCode());
            assertTrue(e.getMessage(), e.getMessage().contains(":memory:"));
        }
    }

    @Test
    public void testReadWrite() {
        pool.write(db -> db.execute("INSERT INTO items (name) VALUES (?)", "foo"));
        assertEquals(Integer.valueOf(1), pool.read(db -> db.fetchInt("SELECT COUNT(*) FROM items")));
        assertEquals("foo", pool.read(db -> db.fetchString("SELECT name FROM items")));
    }

    @Test
    public void testReadIsReadOnly() {
        try {
            pool.read(db -> db.executeUpdate("INSERT INTO items (name) VALUES ('x')"));
            fail();
        } catch (DbException e) {
            assertEquals(ErrorCode.SQLITE_READONLY, e.getErrorCode() & 0xFF);
        }
        // reader仍然可用
        assertEquals(Integer.valueOf(0), pool.read(db -> db.fetchInt("SELECT COUNT(*) FROM items")));
    }

    @Test
    public void testWriteInTransaction() {
        pool.writeInTransaction(db -> {
            db.execute("INSERT INTO items (name) VALUES ('a')");
            db.execute("INSERT INTO items (name) VALUES ('b')");
            return TransactionCompletion.COMMIT;
        });
        pool.writeInTransaction(TransactionKind.EXCLUSIVE, db -> {
            db.execute("INSERT INTO items (name) VALUES ('c')");
            return TransactionCompletion.ROLLBACK;
        });
        assertEquals(Integer.valueOf(2), pool.read(db -> db.fetchInt("SELECT COUNT(*) FROM items")));
    }

    @Test
    public void testWriteInTransactionFailure() {
        IllegalStateException error = new IllegalStateException("abort");
        try {
            pool.writeInTransaction(TransactionKind.DEFERRED, db -> {
                db.execute("INSERT INTO items (name) VALUES ('a')");
                throw error;
            });
            fail();
        } catch (IllegalStateException e) {
            assertSame(error, e);
        }
        assertEquals(Integer.valueOf(0), pool.read(db -> db.fetchInt("SELECT COUNT(*) FROM items")));
        // 回滚之后writer没有停留在事务中
        pool.write(db -> assertFalse(db.isInsideTransaction()));
    }

    @Test
    public void testEngineErrors() {
        try {
            pool.read(db -> db.fetchInt("SELECT COUNT(*) FROM missing"));
            fail();
        } catch (DbException e) {
            assertEquals(ErrorCode.SQLITE_ERROR, e.getErrorCode());
            assertTrue(e.getMessage(), e.getMessage().contains("no such table"));
        }
        try {
            pool.write(db -> db.execute("INSERT INTO missing VALUES (1)"));
            fail();
        } catch (DbException e) {
            assertEquals(ErrorCode.SQLITE_ERROR, e.getErrorCode());
        }
    }

    @Test
    public void testNotReentrant() {
        assertNotReentrant(() -> pool.read(db -> pool.read(db2 -> 1)));
        assertNotReentrant(() -> pool.read(db -> {
            pool.write(db2 -> {
            });
            return null;
        }));
        assertNotReentrant(() -> pool.write(db -> pool.read(db2 -> 1)));
        assertNotReentrant(() -> pool.write(db -> pool.checkpoint()));
        assertNotReentrant(() -> pool.write(db -> pool.releaseMemory()));
        assertNotReentrant(() -> pool.write(db -> pool.close()));
        assertFalse(pool.isClosed());
    }

    private static void assertNotReentrant(Runnable r) {
        try {
            r.run();
            fail();
        } catch (DbException e) {
            assertEquals(ErrorCode.NOT_REENTRANT_1, e.getErrorCode());
        }
    }

    @Test
    public void testOtherPoolIsNotReentrantCall() {
        try (DatabasePool other = newDatabasePool("DatabasePoolTest-other")) {
            other.write(db -> db.execute("CREATE TABLE t (v INTEGER)"));
            pool.write(db -> other.write(db2 -> db2.execute("INSERT INTO t VALUES (1)")));
            assertEquals(Integer.valueOf(1), other.read(db -> db.fetchInt("SELECT COUNT(*) FROM t")));
        }
    }

    @Test
    public void testStatementCacheIsBounded() {
        int max = new Configuration().getStatementCacheSize();
        for (int i = 0; i < max * 3; i++) {
            int n = i;
            pool.write(db -> db.execute("INSERT INTO items (name) VALUES ('" + n + "')"));
        }
        pool.write(db -> assertEquals(max, db.getCachedStatementCount()));
        assertEquals(Integer.valueOf(max * 3), pool.read(db -> db.fetchInt("SELECT COUNT(*) FROM items")));
    }

    @Test
    public void testReleaseMemory() {
        pool.read(db -> db.fetchInt("SELECT COUNT(*) FROM items"));
        assertEquals(1, pool.getLiveReaderCount());
        pool.releaseMemory();
        assertEquals(0, pool.getLiveReaderCount());
        // 下一次读创建新的reader
        assertEquals(Integer.valueOf(0), pool.read(db -> db.fetchInt("SELECT COUNT(*) FROM items")));
        assertEquals(1, pool.getLiveReaderCount());
    }

    @Test
    public void testClose() {
        pool.read(db -> 1);
        pool.close();
        assertTrue(pool.isClosed());
        assertEquals(0, pool.getLiveReaderCount());
        try {
            pool.read(db -> 1);
            fail();
        } catch (DbException e) {
            assertEquals(ErrorCode.DATABASE_CLOSED_1, e.getErrorCode());
        }
        try {
            pool.write(db -> {
            });
            fail();
        } catch (DbException e) {
            assertEquals(ErrorCode.DATABASE_CLOSED_1, e.getErrorCode());
        }
        pool.close();
    }
}
