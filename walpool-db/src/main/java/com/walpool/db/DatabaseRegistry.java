/*
 * Copyright Lealone Database Group.
 * Licensed under the Server Side Public License, v 1.
 * Initial Developer: zhh
 */
package com.walpool.db;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;

/**
 * The functions and collations every connection of a pool must have.
 * <p>
 * Adding an entry replaces the entry with the same identity.
 * The lock only guards the two sets; {@link #applyTo(Database)} works on a copy.
 */
public class DatabaseRegistry {

    private final LinkedHashSet<DatabaseFunction> functions = new LinkedHashSet<>();
    private final LinkedHashSet<DatabaseCollation> collations = new LinkedHashSet<>();

    public synchronized void addFunction(DatabaseFunction function) {
        functions.remove(function);
        functions.add(function);
    }

    public synchronized boolean removeFunction(DatabaseFunction function) {
        return functions.remove(function);
    }

    public synchronized void addCollation(DatabaseCollation collation) {
        collations.remove(collation);
        collations.add(collation);
    }

    public synchronized boolean removeCollation(DatabaseCollation collation) {
        return collations.remove(collation);
    }

    public void applyTo(Database db) {
        List<DatabaseFunction> functions;
        List<DatabaseCollation> collations;
        synchronized (this) {
            functions = new ArrayList<>(this.functions);
            collations = new ArrayList<>(this.collations);
        }
        for (DatabaseFunction f : functions)
            db.addFunction(f);
        for (DatabaseCollation c : collations)
            db.addCollation(c);
    }
}
