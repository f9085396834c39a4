package com.telcobright.repartition.core.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Typed result of schema discovery for one table.
 */
public final class TableMetadata {

    private final QualifiedName table;
    private final List<ColumnDefinition> columns;
    private final List<String> primaryKey;
    private final List<IndexDefinition> indexes;
    private final List<TableGrant> grants;

    public TableMetadata(QualifiedName table, List<ColumnDefinition> columns, List<String> primaryKey,
                         List<IndexDefinition> indexes, List<TableGrant> grants) {
        this.table = table;
        this.columns = Collections.unmodifiableList(new ArrayList<>(columns));
        this.primaryKey = Collections.unmodifiableList(new ArrayList<>(primaryKey));
        this.indexes = Collections.unmodifiableList(new ArrayList<>(indexes));
        this.grants = Collections.unmodifiableList(new ArrayList<>(grants));
    }

    public QualifiedName getTable() { return table; }
    public List<ColumnDefinition> getColumns() { return columns; }
    public List<String> getPrimaryKey() { return primaryKey; }
    public List<IndexDefinition> getIndexes() { return indexes; }
    public List<TableGrant> getGrants() { return grants; }

    public boolean hasPrimaryKey() {
        return !primaryKey.isEmpty();
    }

    public List<String> getColumnNames() {
        return columns.stream().map(ColumnDefinition::getName).collect(Collectors.toList());
    }
}
