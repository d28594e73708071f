/*
 * Copyright Lealone Database Group.
 * Licensed under the Server Side Public License, v 1.
 * Initial Developer: zhh
 */
package com.walpool.db;

/**
 * How a transaction acquires its lock. See https://www.sqlite.org/lang_transaction.html
 */
public enum TransactionKind {
    DEFERRED,
    IMMEDIATE,
    EXCLUSIVE;

    public String getBeginSQL() {
        return "BEGIN " + name() + " TRANSACTION";
    }
}
