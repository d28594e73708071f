/*
 * Copyright Lealone Database Group.
 * Licensed under the Server Side Public License, v 1.
 * Initial Developer: zhh
 */
package com.walpool.test.db;

import java.util.HashMap;
import java.util.Map;

import org.junit.Test;

import com.walpool.common.exceptions.ConfigException;
import com.walpool.db.Configuration;
import com.walpool.db.DbSetting;
import com.walpool.db.TransactionKind;
import com.walpool.test.TestBase;

public class ConfigurationTest extends TestBase {

    @Test
    public void testDefaults() {
        Configuration c = new Configuration();
        assertFalse(c.isReadOnly());
        assertEquals(TransactionKind.IMMEDIATE, c.getDefaultTransactionKind());
        assertEquals(0, c.getBusyTimeout());
        assertTrue(c.isForeignKeysEnabled());
        assertFalse(c.isTraceSql());
        assertEquals(100, c.getLoopInterval());
        assertEquals(64, c.getStatementCacheSize());
    }

    @Test
    public void testCopy() {
        Configuration c = new Configuration().setBusyTimeout(500).setTraceSql(true);
        Configuration c2 = c.copy().setReadOnly(true);
        assertFalse(c.isReadOnly());
        assertTrue(c2.isReadOnly());
        assertEquals(500, c2.getBusyTimeout());
        assertTrue(c2.isTraceSql());
    }

    @Test
    public void testFromMap() {
        Map<String, String> map = new HashMap<>();
        map.put("read_only", "true");
        map.put("default_transaction_kind", "deferred");
        map.put(DbSetting.BUSY_TIMEOUT.name(), "1000");
        map.put("Foreign_Keys_Enabled", "0");
        map.put("LOOP_INTERVAL", "20");
        map.put("statement_cache_size", "8");
        Configuration c = Configuration.fromMap(map);
        assertTrue(c.isReadOnly());
        assertEquals(TransactionKind.DEFERRED, c.getDefaultTransactionKind());
        assertEquals(1000, c.getBusyTimeout());
        assertFalse(c.isForeignKeysEnabled());
        assertFalse(c.isTraceSql());
        assertEquals(20, c.getLoopInterval());
        assertEquals(8, c.getStatementCacheSize());

        Configuration c2 = Configuration.fromMap(c.toMap());
        assertEquals(c.toMap(), c2.toMap());

        assertEquals(new Configuration().toMap(), Configuration.fromMap(null).toMap());
    }

    @Test
    public void testInvalidSettings() {
        assertConfigException("unknown_setting", "1");
        assertConfigException("BUSY_TIMEOUT", "soon");
        assertConfigException("BUSY_TIMEOUT", "-1");
        assertConfigException("READ_ONLY", "maybe");
        assertConfigException("DEFAULT_TRANSACTION_KIND", "EVENTUAL");
        assertConfigException("LOOP_INTERVAL", "0");
        assertConfigException("STATEMENT_CACHE_SIZE", "0");

        try {
            new Configuration().setDefaultTransactionKind(null);
            fail();
        } catch (ConfigException e) {
        }
    }

    private static void assertConfigException(String key, String value) {
        Map<String, String> map = new HashMap<>();
        map.put(key, value);
        try {
            Configuration.fromMap(map);
            fail(key + "=" + value);
        } catch (ConfigException e) {
        }
    }
}
