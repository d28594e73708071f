/*
 * Copyright Lealone Database Group.
 * Licensed under the Server Side Public License, v 1.
 * Initial Developer: zhh
 */
package com.walpool.test;

import java.io.File;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import org.junit.Assert;

import com.walpool.db.Configuration;
import com.walpool.db.DatabasePool;

public class TestBase extends Assert {

    public static final String TEST_BASE_DIR = "." + File.separatorChar + "target" + File.separatorChar
            + "test-data";

    public static String joinDirs(String... dirs) {
        StringBuilder s = new StringBuilder(TEST_BASE_DIR);
        for (String dir : dirs)
            s.append(File.separatorChar).append(dir);
        return s.toString();
    }

    /**
     * Returns the path of a fresh database file, deleting what a previous run left.
     */
    public static String newDatabasePath(String name) {
        File dir = new File(TEST_BASE_DIR);
        dir.mkdirs();
        String path = joinDirs(name + ".sqlite");
        for (String suffix : new String[] { "", "-wal", "-shm", "-journal" }) {
            File f = new File(path + suffix);
            if (f.exists() && !f.delete())
                fail("Could not delete " + f);
        }
        return path;
    }

    public static DatabasePool newDatabasePool(String name) {
        return new DatabasePool(newDatabasePath(name));
    }

    public static DatabasePool newDatabasePool(String name, int maximumReaderCount) {
        return new DatabasePool(newDatabasePath(name), new Configuration(), maximumReaderCount);
    }

    /**
     * Runs the task in another thread and waits for it, rethrowing its exception.
     */
    public static <T> T runInOtherThread(Callable<T> task) {
        ExecutorService executor = Executors.newSingleThreadExecutor();
        try {
            Future<T> f = executor.submit(task);
            return f.get(30, TimeUnit.SECONDS);
        } catch (Exception e) {
            throw new RuntimeException(e);
        } finally {
            executor.shutdown();
        }
    }

    public static void sleep(long millis) {
        try {
            Thread.sleep(millis);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }
}
