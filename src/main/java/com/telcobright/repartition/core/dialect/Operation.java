package com.telcobright.repartition.core.dialect;

/**
 * What a rendered statement does. Gateways other than JDBC (and log output)
 * rely on the tag rather than on the SQL text.
 */
public enum Operation {

    // dictionary reads
    OBJECT_EXISTS(true),
    COUNT_ROWS(true),
    DESCRIBE_COLUMNS(true),
    DESCRIBE_PRIMARY_KEY(true),
    DESCRIBE_INDEXES(true),
    DESCRIBE_GRANTS(true),
    DESCRIBE_CONSTRAINTS(true),
    LIST_PARTITIONS(true),
    ACTIVE_SESSIONS(true),
    LIST_DEPENDENTS(true),

    // mutations
    CREATE_TABLE(false),
    BACKFILL(false),
    CREATE_INDEX(false),
    GATHER_STATS(false),
    ENABLE_CONSTRAINT(false),
    RENAME_TABLE(false),
    CREATE_BRIDGE_VIEW(false),
    CREATE_BRIDGE_TRIGGER(false),
    DROP_TRIGGER(false),
    DROP_VIEW(false),
    DROP_TABLE(false),
    RECOMPILE(false),
    GRANT(false),
    INSERT_ROW(false),
    EXCHANGE_PARTITION(false),
    ADD_PARTITION(false),
    DROP_PARTITION(false);

    private final boolean query;

    Operation(boolean query) {
        this.query = query;
    }

    /**
     * Whether the statement returns rows and changes nothing.
     */
    public boolean isQuery() {
        return query;
    }
}
