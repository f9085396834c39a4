package com.telcobright.repartition.core.partition;

/**
 * Partitioning methods a target scheme can request.
 *
 * Not every database supports every method; dialects call
 * {@link #validateSupported(boolean)} before rendering a scheme.
 */
public enum PartitionType {

    /**
     * Heap table without partitioning.
     */
    NONE("Non-partitioned table", false),

    /**
     * Range partitioning with explicit upper bounds.
     */
    RANGE("Range partitioning with explicit upper bounds", true),

    /**
     * Range partitioning where new slices are created automatically for each
     * interval past the last explicit bound. Oracle only.
     */
    INTERVAL("Interval (automatic range) partitioning", true),

    /**
     * List partitioning on discrete values.
     */
    LIST("List partitioning on categorical values", true),

    /**
     * Hash partitioning into a fixed number of buckets.
     */
    HASH("Hash partitioning into fixed buckets", false);

    private final String description;
    private final boolean bounded;

    PartitionType(String description, boolean bounded) {
        this.description = description;
        this.bounded = bounded;
    }

    public String getDescription() {
        return description;
    }

    /**
     * Whether slices of this type carry an explicit bound expression.
     */
    public boolean isBounded() {
        return bounded;
    }

    public boolean isPartitioned() {
        return this != NONE;
    }

    /**
     * Validate that the partition type is supported by a dialect.
     *
     * @param intervalSupported whether the dialect renders INTERVAL schemes
     * @throws UnsupportedOperationException if not supported
     */
    public void validateSupported(boolean intervalSupported) {
        if (this == INTERVAL && !intervalSupported) {
            throw new UnsupportedOperationException(
                String.format("Partition type %s is not supported by this database. Use %s with explicit bounds.",
                    this.name(), RANGE.name()));
        }
    }
}
