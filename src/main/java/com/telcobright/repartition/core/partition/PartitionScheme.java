package com.telcobright.repartition.core.partition;

import com.telcobright.repartition.core.model.Identifiers;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Plain-value description of a table's partitioning. Supplied by configuration;
 * the engine performs no parsing of its own.
 */
public final class PartitionScheme {

    private static final PartitionScheme UNPARTITIONED = new Builder(PartitionType.NONE).build();

    private final PartitionType type;
    private final List<String> keyColumns;
    private final String intervalExpression;
    private final int hashPartitionCount;
    private final List<PartitionBound> bounds;
    private final PartitionType subpartitionType;
    private final String subpartitionColumn;
    private final int subpartitionCount;

    private PartitionScheme(Builder builder) {
        this.type = builder.type;
        this.keyColumns = Collections.unmodifiableList(new ArrayList<>(builder.keyColumns));
        this.intervalExpression = builder.intervalExpression;
        this.hashPartitionCount = builder.hashPartitionCount;
        this.bounds = Collections.unmodifiableList(new ArrayList<>(builder.bounds));
        this.subpartitionType = builder.subpartitionType;
        this.subpartitionColumn = builder.subpartitionColumn;
        this.subpartitionCount = builder.subpartitionCount;
    }

    public static PartitionScheme unpartitioned() {
        return UNPARTITIONED;
    }

    public static Builder builder(PartitionType type) {
        return new Builder(type);
    }

    public PartitionType getType() { return type; }
    public List<String> getKeyColumns() { return keyColumns; }
    public String getIntervalExpression() { return intervalExpression; }
    public int getHashPartitionCount() { return hashPartitionCount; }
    public List<PartitionBound> getBounds() { return bounds; }
    public PartitionType getSubpartitionType() { return subpartitionType; }
    public String getSubpartitionColumn() { return subpartitionColumn; }
    public int getSubpartitionCount() { return subpartitionCount; }

    public boolean isPartitioned() {
        return type.isPartitioned();
    }

    public boolean hasSubpartitions() {
        return subpartitionType != null && subpartitionType != PartitionType.NONE;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof PartitionScheme)) return false;
        PartitionScheme that = (PartitionScheme) o;
        return hashPartitionCount == that.hashPartitionCount
            && subpartitionCount == that.subpartitionCount
            && type == that.type
            && keyColumns.equals(that.keyColumns)
            && Objects.equals(intervalExpression, that.intervalExpression)
            && bounds.equals(that.bounds)
            && subpartitionType == that.subpartitionType
            && Objects.equals(subpartitionColumn, that.subpartitionColumn);
    }

    @Override
    public int hashCode() {
        return Objects.hash(type, keyColumns, intervalExpression, hashPartitionCount, bounds,
            subpartitionType, subpartitionColumn, subpartitionCount);
    }

    @Override
    public String toString() {
        if (!isPartitioned()) {
            return "NONE";
        }
        StringBuilder sb = new StringBuilder(type.name()).append(keyColumns);
        if (intervalExpression != null) {
            sb.append(" interval ").append(intervalExpression);
        }
        if (type == PartitionType.HASH) {
            sb.append(" x").append(hashPartitionCount);
        }
        if (hasSubpartitions()) {
            sb.append(" / ").append(subpartitionType).append("(").append(subpartitionColumn).append(")");
        }
        return sb.toString();
    }

    public static class Builder {
        private final PartitionType type;
        private final List<String> keyColumns = new ArrayList<>();
        private String intervalExpression;
        private int hashPartitionCount;
        private final List<PartitionBound> bounds = new ArrayList<>();
        private PartitionType subpartitionType;
        private String subpartitionColumn;
        private int subpartitionCount;

        Builder(PartitionType type) {
            this.type = Objects.requireNonNull(type, "type");
        }

        public Builder keyColumn(String column) {
            this.keyColumns.add(Identifiers.requireValid(column, "Partition key column"));
            return this;
        }

        public Builder keyColumns(List<String> columns) {
            columns.forEach(this::keyColumn);
            return this;
        }

        public Builder interval(String expression) {
            this.intervalExpression = expression;
            return this;
        }

        public Builder hashPartitions(int count) {
            this.hashPartitionCount = count;
            return this;
        }

        public Builder bound(String partitionName, String expression) {
            this.bounds.add(new PartitionBound(partitionName, expression));
            return this;
        }

        public Builder subpartition(PartitionType subType, String column, int count) {
            this.subpartitionType = subType;
            this.subpartitionColumn = Identifiers.requireValid(column, "Subpartition column");
            this.subpartitionCount = count;
            return this;
        }

        public PartitionScheme build() {
            if (type.isPartitioned() && keyColumns.isEmpty()) {
                throw new IllegalStateException("Partition key column is required for " + type);
            }
            if (type == PartitionType.INTERVAL) {
                if (intervalExpression == null || intervalExpression.trim().isEmpty()) {
                    throw new IllegalStateException("INTERVAL partitioning requires an interval expression");
                }
                if (bounds.isEmpty()) {
                    throw new IllegalStateException("INTERVAL partitioning requires at least one initial bound");
                }
            }
            if ((type == PartitionType.RANGE || type == PartitionType.LIST) && bounds.isEmpty()) {
                throw new IllegalStateException(type + " partitioning requires at least one bound");
            }
            if (type == PartitionType.HASH && hashPartitionCount <= 0) {
                throw new IllegalStateException("HASH partitioning requires a positive partition count");
            }
            if (subpartitionType == PartitionType.HASH && subpartitionCount <= 0) {
                throw new IllegalStateException("HASH subpartitioning requires a positive subpartition count");
            }
            return new PartitionScheme(this);
        }
    }
}
