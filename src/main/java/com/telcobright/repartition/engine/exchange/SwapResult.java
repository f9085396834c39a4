package com.telcobright.repartition.engine.exchange;

import com.telcobright.repartition.core.model.ArchiveCycle;

import java.time.Instant;

/**
 * One slice moved from the active table into history.
 */
public final class SwapResult {

    private final ArchiveCycle cycle;
    private final String activePartition;
    private final String historyPartition;
    private final String upperBound;
    private final long estimatedRows;
    private final Instant completedAt;

    public SwapResult(ArchiveCycle cycle, String activePartition, String historyPartition, String upperBound,
                      long estimatedRows, Instant completedAt) {
        this.cycle = cycle;
        this.activePartition = activePartition;
        this.historyPartition = historyPartition;
        this.upperBound = upperBound;
        this.estimatedRows = estimatedRows;
        this.completedAt = completedAt;
    }

    public ArchiveCycle getCycle() { return cycle; }

    /**
     * Slice dropped from the active table.
     */
    public String getActivePartition() { return activePartition; }

    /**
     * Slice added to the history table.
     */
    public String getHistoryPartition() { return historyPartition; }
    public String getUpperBound() { return upperBound; }
    public long getEstimatedRows() { return estimatedRows; }
    public Instant getCompletedAt() { return completedAt; }

    @Override
    public String toString() {
        return String.format("SwapResult[%s.%s -> %s.%s, bound %s, ~%d rows]",
            cycle.getActiveTable(), activePartition, cycle.getHistoryTable(), historyPartition,
            upperBound, estimatedRows);
    }
}
