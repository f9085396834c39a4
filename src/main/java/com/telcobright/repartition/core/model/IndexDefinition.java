package com.telcobright.repartition.core.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Secondary index on a table. Primary key indexes are not listed here.
 */
public final class IndexDefinition {

    private final String name;
    private final List<String> columns;
    private final boolean unique;

    public IndexDefinition(String name, List<String> columns, boolean unique) {
        this.name = Identifiers.requireValid(name, "Index name");
        if (columns == null || columns.isEmpty()) {
            throw new IllegalArgumentException("Index " + name + " has no columns");
        }
        columns.forEach(c -> Identifiers.requireValid(c, "Index column"));
        this.columns = Collections.unmodifiableList(new ArrayList<>(columns));
        this.unique = unique;
    }

    public String getName() { return name; }
    public List<String> getColumns() { return columns; }
    public boolean isUnique() { return unique; }

    @Override
    public String toString() {
        return (unique ? "UNIQUE " : "") + name + columns;
    }
}
