/*
 * Copyright Lealone Database Group.
 * Licensed under the Server Side Public License, v 1.
 * Initial Developer: zhh
 */
package com.walpool.db;

import java.sql.SQLException;

@FunctionalInterface
public interface DatabaseAction {

    void run(Database db) throws SQLException;
}
