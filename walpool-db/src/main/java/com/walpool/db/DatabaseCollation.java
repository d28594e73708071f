/*
 * Copyright Lealone Database Group.
 * Licensed under the Server Side Public License, v 1.
 * Initial Developer: zhh
 */
package com.walpool.db;

import java.util.Comparator;

import org.sqlite.Collation;

/**
 * A custom collation, identified by its name (ignoring case).
 */
public class DatabaseCollation {

    private final String name;
    private final Comparator<String> comparator;

    public DatabaseCollation(String name, Comparator<String> comparator) {
        if (name == null || name.isEmpty())
            throw new IllegalArgumentException("collation name can not be empty");
        if (comparator == null)
            throw new IllegalArgumentException("comparator can not be null");
        this.name = name;
        this.comparator = comparator;
    }

    public String getName() {
        return name;
    }

    Collation toSQLiteCollation() {
        return new Collation() {
            @Override
            protected int xCompare(String str1, String str2) {
                return comparator.compare(str1, str2);
            }
        };
    }

    @Override
    public int hashCode() {
        return name.toUpperCase().hashCode();
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj)
            return true;
        if (!(obj instanceof DatabaseCollation))
            return false;
        return name.equalsIgnoreCase(((DatabaseCollation) obj).name);
    }

    @Override
    public String toString() {
        return name;
    }
}
