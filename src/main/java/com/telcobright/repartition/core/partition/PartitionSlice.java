package com.telcobright.repartition.core.partition;

import com.telcobright.repartition.core.model.QualifiedName;

import java.util.Comparator;
import java.util.Objects;

/**
 * One partition of a live table as reported by the data dictionary.
 * Slices are ordered by ordinal position; for range schemes the lowest
 * position holds the smallest upper bound, i.e. the oldest data.
 */
public final class PartitionSlice {

    public static final Comparator<PartitionSlice> BY_POSITION =
        Comparator.comparingInt(PartitionSlice::getOrdinalPosition);

    private final QualifiedName owningTable;
    private final String name;
    private final int ordinalPosition;
    private final String upperBound;
    private final long estimatedRowCount;

    public PartitionSlice(QualifiedName owningTable, String name, int ordinalPosition,
                          String upperBound, long estimatedRowCount) {
        this.owningTable = Objects.requireNonNull(owningTable, "owningTable");
        this.name = Objects.requireNonNull(name, "name");
        this.ordinalPosition = ordinalPosition;
        this.upperBound = upperBound;
        this.estimatedRowCount = estimatedRowCount;
    }

    public QualifiedName getOwningTable() { return owningTable; }
    public String getName() { return name; }
    public int getOrdinalPosition() { return ordinalPosition; }
    public String getUpperBound() { return upperBound; }
    public long getEstimatedRowCount() { return estimatedRowCount; }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof PartitionSlice)) return false;
        PartitionSlice that = (PartitionSlice) o;
        return ordinalPosition == that.ordinalPosition
            && owningTable.equals(that.owningTable)
            && name.equals(that.name);
    }

    @Override
    public int hashCode() {
        return Objects.hash(owningTable, name, ordinalPosition);
    }

    @Override
    public String toString() {
        return String.format("%s:%s[#%d < %s, ~%d rows]",
            owningTable, name, ordinalPosition, upperBound, estimatedRowCount);
    }
}
