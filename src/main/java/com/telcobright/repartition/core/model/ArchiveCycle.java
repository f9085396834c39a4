package com.telcobright.repartition.core.model;

import java.util.Objects;

/**
 * The three tables of one partition hand-off: active → staging → history.
 * Stateless; recreated on every scheduled invocation.
 */
public final class ArchiveCycle {

    private final QualifiedName activeTable;
    private final QualifiedName stagingTable;
    private final QualifiedName historyTable;

    public ArchiveCycle(QualifiedName activeTable, QualifiedName stagingTable, QualifiedName historyTable) {
        this.activeTable = Objects.requireNonNull(activeTable, "activeTable");
        this.stagingTable = Objects.requireNonNull(stagingTable, "stagingTable");
        this.historyTable = Objects.requireNonNull(historyTable, "historyTable");
        if (activeTable.equals(stagingTable) || activeTable.equals(historyTable) || stagingTable.equals(historyTable)) {
            throw new IllegalArgumentException("Active, staging and history must be three different tables");
        }
    }

    public QualifiedName getActiveTable() { return activeTable; }
    public QualifiedName getStagingTable() { return stagingTable; }
    public QualifiedName getHistoryTable() { return historyTable; }

    @Override
    public String toString() {
        return activeTable + " -> " + stagingTable + " -> " + historyTable;
    }
}
