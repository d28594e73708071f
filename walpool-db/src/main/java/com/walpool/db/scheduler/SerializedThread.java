/*
 * Copyright Lealone Database Group.
 * Licensed under the Server Side Public License, v 1.
 * Initial Developer: zhh
 */
package com.walpool.db.scheduler;

public class SerializedThread extends Thread {

    private final SerializedDatabase database;

    public SerializedThread(SerializedDatabase database, String name) {
        super(database, name);
        this.database = database;
        setDaemon(true);
    }

    public SerializedDatabase getDatabase() {
        return database;
    }

    public static SerializedDatabase currentDatabase() {
        Thread t = Thread.currentThread();
        if (t instanceof SerializedThread) {
            return ((SerializedThread) t).getDatabase();
        } else {
            return null;
        }
    }
}
