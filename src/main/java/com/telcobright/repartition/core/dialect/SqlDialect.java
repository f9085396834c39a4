package com.telcobright.repartition.core.dialect;

import com.telcobright.repartition.core.model.ColumnDefinition;
import com.telcobright.repartition.core.model.DependentObject;
import com.telcobright.repartition.core.model.IndexDefinition;
import com.telcobright.repartition.core.model.QualifiedName;
import com.telcobright.repartition.core.model.TableGrant;
import com.telcobright.repartition.core.partition.PartitionScheme;

import java.util.List;

/**
 * Database-specific rendering of every statement the engine issues.
 *
 * Dictionary queries alias their result columns to fixed names so that
 * callers read rows the same way on every database:
 * <ul>
 *   <li>OBJECT_EXISTS, COUNT_ROWS: {@code CNT}</li>
 *   <li>DESCRIBE_COLUMNS: {@code COLUMN_NAME, DATA_TYPE, NULLABLE, POSITION}</li>
 *   <li>DESCRIBE_PRIMARY_KEY: {@code COLUMN_NAME, POSITION}</li>
 *   <li>DESCRIBE_INDEXES: {@code INDEX_NAME, COLUMN_NAME, UNIQUENESS, POSITION}</li>
 *   <li>DESCRIBE_GRANTS: {@code GRANTEE, PRIVILEGE, GRANTABLE}</li>
 *   <li>DESCRIBE_CONSTRAINTS: {@code CONSTRAINT_NAME, CONSTRAINT_TYPE, STATUS}</li>
 *   <li>LIST_PARTITIONS: {@code PARTITION_NAME, PARTITION_POSITION, HIGH_VALUE, NUM_ROWS}</li>
 *   <li>ACTIVE_SESSIONS: {@code SESSION_ID}</li>
 *   <li>LIST_DEPENDENTS: {@code OWNER, OBJECT_NAME, OBJECT_TYPE, STATUS}</li>
 * </ul>
 */
public interface SqlDialect {

    String COL_COUNT = "CNT";
    String COL_COLUMN_NAME = "COLUMN_NAME";
    String COL_DATA_TYPE = "DATA_TYPE";
    String COL_NULLABLE = "NULLABLE";
    String COL_POSITION = "POSITION";
    String COL_INDEX_NAME = "INDEX_NAME";
    String COL_UNIQUENESS = "UNIQUENESS";
    String COL_GRANTEE = "GRANTEE";
    String COL_PRIVILEGE = "PRIVILEGE";
    String COL_GRANTABLE = "GRANTABLE";
    String COL_CONSTRAINT_NAME = "CONSTRAINT_NAME";
    String COL_CONSTRAINT_TYPE = "CONSTRAINT_TYPE";
    String COL_STATUS = "STATUS";
    String COL_PARTITION_NAME = "PARTITION_NAME";
    String COL_PARTITION_POSITION = "PARTITION_POSITION";
    String COL_HIGH_VALUE = "HIGH_VALUE";
    String COL_NUM_ROWS = "NUM_ROWS";
    String COL_SESSION_ID = "SESSION_ID";
    String COL_OWNER = "OWNER";
    String COL_OBJECT_NAME = "OBJECT_NAME";
    String COL_OBJECT_TYPE = "OBJECT_TYPE";

    DatabaseType getDatabaseType();

    /**
     * Whether writes through the bridge can be routed by a database trigger.
     */
    boolean supportsNativeWriteRouting();

    boolean supportsIntervalPartitioning();

    /**
     * Whether dependent objects go invalid on rename and can be recompiled.
     */
    boolean supportsRecompilation();

    // Dictionary reads

    SqlStatement objectExists(QualifiedName name, ObjectKind kind);

    SqlStatement countRows(QualifiedName table);

    SqlStatement describeColumns(QualifiedName table);

    SqlStatement describePrimaryKey(QualifiedName table);

    /**
     * Non-primary-key indexes, one row per indexed column.
     */
    SqlStatement describeIndexes(QualifiedName table);

    SqlStatement describeGrants(QualifiedName table);

    SqlStatement describeConstraints(QualifiedName table);

    SqlStatement listPartitions(QualifiedName table);

    /**
     * Sessions other than the caller's that are executing SQL mentioning the table name.
     */
    SqlStatement activeSessions(QualifiedName table);

    /**
     * Objects depending on the canonical table or on its retired predecessor.
     */
    SqlStatement listDependents(QualifiedName canonical, QualifiedName retired);

    // Shadow build

    SqlStatement createTable(QualifiedName table, List<ColumnDefinition> columns,
                             List<String> primaryKey, PartitionScheme scheme);

    /**
     * Copy the rows of {@code source} missing from {@code target}, matched on the
     * primary key.
     *
     * @param sourcePartition restrict the copy to one source slice, or null for all rows
     */
    SqlStatement backfill(QualifiedName source, QualifiedName target, List<String> columns,
                          List<String> primaryKey, PartitionScheme targetScheme,
                          String sourcePartition, int parallelDegree);

    SqlStatement createIndex(QualifiedName table, String indexName, IndexDefinition definition,
                             PartitionScheme scheme);

    SqlStatement gatherStatistics(QualifiedName table, int parallelDegree);

    SqlStatement enableConstraint(QualifiedName table, String constraintName);

    // Cutover and finalize

    SqlStatement renameTable(QualifiedName from, QualifiedName to);

    SqlStatement dropTable(QualifiedName table);

    SqlStatement recompile(DependentObject object);

    SqlStatement grant(QualifiedName table, TableGrant grant);

    // Bridge

    SqlStatement createBridgeView(QualifiedName view, QualifiedName shadow, QualifiedName retired,
                                  List<String> primaryKey);

    SqlStatement createBridgeTrigger(QualifiedName trigger, QualifiedName view, QualifiedName shadow,
                                     List<String> columns);

    SqlStatement dropTrigger(QualifiedName trigger);

    SqlStatement dropView(QualifiedName view);

    SqlStatement insertRow(QualifiedName table, List<String> columns);

    // Partition exchange

    SqlStatement exchangePartition(QualifiedName table, String partition, QualifiedName other);

    SqlStatement addPartition(QualifiedName table, String partition, String upperBound);

    SqlStatement dropPartition(QualifiedName table, String partition);
}
