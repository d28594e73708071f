/*
 * Copyright Lealone Database Group.
 * Licensed under the Server Side Public License, v 1.
 * Initial Developer: zhh
 */
package com.walpool.db;

import java.util.HashMap;
import java.util.Map;
import java.util.Map.Entry;

import org.sqlite.SQLiteConfig;

import com.walpool.common.exceptions.ConfigException;
import com.walpool.common.util.MapUtils;

/**
 * Options of one database connection.
 * <p>
 * The pool copies the configuration it receives: the writer copy is never read-only,
 * the reader copy is always read-only with DEFERRED transactions.
 */
public class Configuration {

    private boolean readOnly;
    private TransactionKind defaultTransactionKind = TransactionKind.IMMEDIATE;
    private int busyTimeout;
    private boolean foreignKeysEnabled = true;
    private boolean traceSql;
    private long loopInterval = 100;
    private int statementCacheSize = 64;

    public Configuration() {
    }

    public Configuration copy() {
        Configuration c = new Configuration();
        c.readOnly = readOnly;
        c.defaultTransactionKind = defaultTransactionKind;
        c.busyTimeout = busyTimeout;
        c.foreignKeysEnabled = foreignKeysEnabled;
        c.traceSql = traceSql;
        c.loopInterval = loopInterval;
        c.statementCacheSize = statementCacheSize;
        return c;
    }

    public boolean isReadOnly() {
        return readOnly;
    }

    public Configuration setReadOnly(boolean readOnly) {
        this.readOnly = readOnly;
        return this;
    }

    public TransactionKind getDefaultTransactionKind() {
        return defaultTransactionKind;
    }

    public Configuration setDefaultTransactionKind(TransactionKind defaultTransactionKind) {
        if (defaultTransactionKind == null)
            throw new ConfigException("defaultTransactionKind can not be null");
        this.defaultTransactionKind = defaultTransactionKind;
        return this;
    }

    public int getBusyTimeout() {
        return busyTimeout;
    }

    /**
     * @param busyTimeout milliseconds to wait on a locked database, 0 fails immediately with SQLITE_BUSY
     */
    public Configuration setBusyTimeout(int busyTimeout) {
        if (busyTimeout < 0)
            throw new ConfigException("busyTimeout must be >= 0, got " + busyTimeout);
        this.busyTimeout = busyTimeout;
        return this;
    }

    public boolean isForeignKeysEnabled() {
        return foreignKeysEnabled;
    }

    public Configuration setForeignKeysEnabled(boolean foreignKeysEnabled) {
        this.foreignKeysEnabled = foreignKeysEnabled;
        return this;
    }

    public boolean isTraceSql() {
        return traceSql;
    }

    public Configuration setTraceSql(boolean traceSql) {
        this.traceSql = traceSql;
        return this;
    }

    public long getLoopInterval() {
        return loopInterval;
    }

    public Configuration setLoopInterval(long loopInterval) {
        if (loopInterval <= 0)
            throw new ConfigException("loopInterval must be > 0, got " + loopInterval);
        this.loopInterval = loopInterval;
        return this;
    }

    public int getStatementCacheSize() {
        return statementCacheSize;
    }

    /**
     * @param statementCacheSize the number of prepared statements kept per connection,
     *            the least recently used one is closed beyond it
     */
    public Configuration setStatementCacheSize(int statementCacheSize) {
        if (statementCacheSize <= 0)
            throw new ConfigException("statementCacheSize must be > 0, got " + statementCacheSize);
        this.statementCacheSize = statementCacheSize;
        return this;
    }

    SQLiteConfig toSQLiteConfig() {
        SQLiteConfig config = new SQLiteConfig();
        config.setReadOnly(readOnly);
        config.setBusyTimeout(busyTimeout);
        config.enforceForeignKeys(foreignKeysEnabled);
        return config;
    }

    public Map<String, String> toMap() {
        Map<String, String> map = new HashMap<>();
        map.put(DbSetting.READ_ONLY.name(), String.valueOf(readOnly));
        map.put(DbSetting.DEFAULT_TRANSACTION_KIND.name(), defaultTransactionKind.name());
        map.put(DbSetting.BUSY_TIMEOUT.name(), String.valueOf(busyTimeout));
        map.put(DbSetting.FOREIGN_KEYS_ENABLED.name(), String.valueOf(foreignKeysEnabled));
        map.put(DbSetting.TRACE_SQL.name(), String.valueOf(traceSql));
        map.put(DbSetting.LOOP_INTERVAL.name(), String.valueOf(loopInterval));
        map.put(DbSetting.STATEMENT_CACHE_SIZE.name(), String.valueOf(statementCacheSize));
        return map;
    }

    public static Configuration fromMap(Map<String, String> config) {
        Map<String, String> settings = new HashMap<>();
        if (config != null) {
            for (Entry<String, String> e : config.entrySet()) {
                DbSetting setting = DbSetting.get(e.getKey());
                if (setting == null)
                    throw new ConfigException("Unsupported setting: " + e.getKey());
                settings.put(setting.name(), e.getValue());
            }
        }
        Configuration c = new Configuration();
        try {
            c.setReadOnly(MapUtils.getBoolean(settings, DbSetting.READ_ONLY.name(), c.readOnly));
            String kind = MapUtils.getString(settings, DbSetting.DEFAULT_TRANSACTION_KIND.name(),
                    c.defaultTransactionKind.name());
            c.setDefaultTransactionKind(TransactionKind.valueOf(kind.trim().toUpperCase()));
            c.setBusyTimeout(MapUtils.getInt(settings, DbSetting.BUSY_TIMEOUT.name(), c.busyTimeout));
            c.setForeignKeysEnabled(MapUtils.getBoolean(settings,
                    DbSetting.FOREIGN_KEYS_ENABLED.name(), c.foreignKeysEnabled));
            c.setTraceSql(MapUtils.getBoolean(settings, DbSetting.TRACE_SQL.name(), c.traceSql));
            c.setLoopInterval(MapUtils.getLong(settings, DbSetting.LOOP_INTERVAL.name(), c.loopInterval));
            c.setStatementCacheSize(MapUtils.getInt(settings, DbSetting.STATEMENT_CACHE_SIZE.name(),
                    c.statementCacheSize));
        } catch (IllegalArgumentException e) { // 包括NumberFormatException
            throw new ConfigException("Invalid setting value: " + e.getMessage(), e);
        }
        return c;
    }

    @Override
    public String toString() {
        return "Configuration" + toMap();
    }
}
