/*
 * Copyright Lealone Database Group.
 * Licensed under the Server Side Public License, v 1.
 * Initial Developer: zhh
 */
package com.walpool.db;

import java.sql.SQLException;

@FunctionalInterface
public interface TransactionBlock {

    TransactionCompletion run(Database db) throws SQLException;
}
