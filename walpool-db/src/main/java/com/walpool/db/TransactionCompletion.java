/*
 * Copyright Lealone Database Group.
 * Licensed under the Server Side Public License, v 1.
 * Initial Developer: zhh
 */
package com.walpool.db;

public enum TransactionCompletion {
    COMMIT,
    ROLLBACK
}
