package com.telcobright.repartition.core.dialect;

import com.telcobright.repartition.core.model.DependentObject;
import com.telcobright.repartition.core.model.Identifiers;
import com.telcobright.repartition.core.model.IndexDefinition;
import com.telcobright.repartition.core.model.QualifiedName;
import com.telcobright.repartition.core.partition.PartitionBound;
import com.telcobright.repartition.core.partition.PartitionScheme;
import com.telcobright.repartition.core.partition.PartitionType;

import java.util.List;
import java.util.regex.Pattern;

/**
 * MySQL (and MariaDB) rendering.
 *
 * MySQL cannot put a trigger on a view, so bridge writes are routed by the
 * application. Views referencing a renamed table are resolved by name at
 * query time and never need recompiling.
 */
public class MySqlDialect extends AbstractSqlDialect {

    private static final Pattern ACCOUNT = Pattern.compile("'[^']+'@'[^']+'");

    private final DatabaseType databaseType;

    public MySqlDialect() {
        this(DatabaseType.MYSQL);
    }

    public MySqlDialect(DatabaseType databaseType) {
        this.databaseType = databaseType;
    }

    @Override
    public DatabaseType getDatabaseType() {
        return databaseType;
    }

    @Override
    public boolean supportsNativeWriteRouting() {
        return false;
    }

    @Override
    public boolean supportsIntervalPartitioning() {
        return false;
    }

    @Override
    public boolean supportsRecompilation() {
        return false;
    }

    @Override
    public SqlStatement objectExists(QualifiedName name, ObjectKind kind) {
        String sql;
        switch (kind) {
            case TABLE:
                sql = "SELECT COUNT(*) AS CNT FROM information_schema.TABLES "
                    + "WHERE TABLE_SCHEMA = ? AND TABLE_NAME = ? AND TABLE_TYPE = 'BASE TABLE'";
                break;
            case VIEW:
                sql = "SELECT COUNT(*) AS CNT FROM information_schema.TABLES "
                    + "WHERE TABLE_SCHEMA = ? AND TABLE_NAME = ? AND TABLE_TYPE = 'VIEW'";
                break;
            case TRIGGER:
                sql = "SELECT COUNT(*) AS CNT FROM information_schema.TRIGGERS "
                    + "WHERE TRIGGER_SCHEMA = ? AND TRIGGER_NAME = ?";
                break;
            default:
                throw new IllegalArgumentException("Unsupported object kind: " + kind);
        }
        return SqlStatement.builder(Operation.OBJECT_EXISTS)
            .sql(sql)
            .parameter(name.getSchema())
            .parameter(name.getName())
            .subject(name)
            .attribute(SqlStatement.ATTR_OBJECT_KIND, kind.name())
            .build();
    }

    @Override
    public SqlStatement describeColumns(QualifiedName table) {
        String sql = "SELECT COLUMN_NAME, COLUMN_TYPE AS DATA_TYPE, IS_NULLABLE AS NULLABLE, "
            + "ORDINAL_POSITION AS POSITION\n"
            + "FROM information_schema.COLUMNS\n"
            + "WHERE TABLE_SCHEMA = ? AND TABLE_NAME = ?\n"
            + "ORDER BY ORDINAL_POSITION";
        return dictionaryQuery(Operation.DESCRIBE_COLUMNS, sql, table);
    }

    @Override
    public SqlStatement describePrimaryKey(QualifiedName table) {
        String sql = "SELECT COLUMN_NAME, ORDINAL_POSITION AS POSITION\n"
            + "FROM information_schema.KEY_COLUMN_USAGE\n"
            + "WHERE TABLE_SCHEMA = ? AND TABLE_NAME = ? AND CONSTRAINT_NAME = 'PRIMARY'\n"
            + "ORDER BY ORDINAL_POSITION";
        return dictionaryQuery(Operation.DESCRIBE_PRIMARY_KEY, sql, table);
    }

    @Override
    public SqlStatement describeIndexes(QualifiedName table) {
        String sql = "SELECT INDEX_NAME, COLUMN_NAME,\n"
            + "       CASE WHEN NON_UNIQUE = 0 THEN 'UNIQUE' ELSE 'NONUNIQUE' END AS UNIQUENESS,\n"
            + "       SEQ_IN_INDEX AS POSITION\n"
            + "FROM information_schema.STATISTICS\n"
            + "WHERE TABLE_SCHEMA = ? AND TABLE_NAME = ? AND INDEX_NAME <> 'PRIMARY'\n"
            + "ORDER BY INDEX_NAME, SEQ_IN_INDEX";
        return dictionaryQuery(Operation.DESCRIBE_INDEXES, sql, table);
    }

    @Override
    public SqlStatement describeGrants(QualifiedName table) {
        String sql = "SELECT GRANTEE, PRIVILEGE_TYPE AS PRIVILEGE, IS_GRANTABLE AS GRANTABLE\n"
            + "FROM information_schema.TABLE_PRIVILEGES\n"
            + "WHERE TABLE_SCHEMA = ? AND TABLE_NAME = ?\n"
            + "ORDER BY GRANTEE, PRIVILEGE_TYPE";
        return dictionaryQuery(Operation.DESCRIBE_GRANTS, sql, table);
    }

    @Override
    public SqlStatement describeConstraints(QualifiedName table) {
        String sql = "SELECT CONSTRAINT_NAME, CONSTRAINT_TYPE, ENFORCED AS STATUS\n"
            + "FROM information_schema.TABLE_CONSTRAINTS\n"
            + "WHERE TABLE_SCHEMA = ? AND TABLE_NAME = ?\n"
            + "ORDER BY CONSTRAINT_NAME";
        return dictionaryQuery(Operation.DESCRIBE_CONSTRAINTS, sql, table);
    }

    @Override
    public SqlStatement listPartitions(QualifiedName table) {
        String sql = "SELECT PARTITION_NAME, PARTITION_ORDINAL_POSITION AS PARTITION_POSITION,\n"
            + "       PARTITION_DESCRIPTION AS HIGH_VALUE, TABLE_ROWS AS NUM_ROWS\n"
            + "FROM information_schema.PARTITIONS\n"
            + "WHERE TABLE_SCHEMA = ? AND TABLE_NAME = ? AND PARTITION_NAME IS NOT NULL\n"
            + "ORDER BY PARTITION_ORDINAL_POSITION";
        return dictionaryQuery(Operation.LIST_PARTITIONS, sql, table);
    }

    @Override
    public SqlStatement activeSessions(QualifiedName table) {
        String sql = "SELECT ID AS SESSION_ID FROM information_schema.PROCESSLIST\n"
            + "WHERE ID <> CONNECTION_ID() AND COMMAND <> 'Sleep'\n"
            + "  AND UPPER(INFO) LIKE ? ESCAPE '" + LIKE_ESCAPE + "'";
        return SqlStatement.builder(Operation.ACTIVE_SESSIONS)
            .sql(sql)
            .parameter(containsPattern(table.getName().toUpperCase()))
            .subject(table)
            .attribute(SqlStatement.ATTR_PATTERN, table.getName())
            .build();
    }

    @Override
    public SqlStatement listDependents(QualifiedName canonical, QualifiedName retired) {
        String sql = "SELECT DISTINCT VIEW_SCHEMA AS OWNER, VIEW_NAME AS OBJECT_NAME, 'VIEW' AS OBJECT_TYPE, "
            + "'VALID' AS STATUS\n"
            + "FROM information_schema.VIEW_TABLE_USAGE\n"
            + "WHERE TABLE_SCHEMA = ? AND TABLE_NAME IN (?, ?)\n"
            + "ORDER BY VIEW_SCHEMA, VIEW_NAME";
        return SqlStatement.builder(Operation.LIST_DEPENDENTS)
            .sql(sql)
            .parameter(canonical.getSchema())
            .parameter(canonical.getName())
            .parameter(retired.getName())
            .subject(canonical)
            .subject(retired)
            .build();
    }

    @Override
    public SqlStatement backfill(QualifiedName source, QualifiedName target, List<String> columns,
                                 List<String> primaryKey, PartitionScheme targetScheme,
                                 String sourcePartition, int parallelDegree) {
        // MySQL has no parallel DML hint; the degree only applies to Oracle
        StringBuilder sql = new StringBuilder()
            .append("INSERT INTO ").append(target.render()).append(" (").append(columnList(columns)).append(")\n")
            .append("SELECT ").append(prefixedColumnList("s", columns)).append("\n")
            .append("FROM ").append(source.render());
        if (sourcePartition != null) {
            sql.append(" PARTITION (").append(Identifiers.requireValid(sourcePartition, "Partition")).append(")");
        }
        sql.append(" AS s\n")
           .append("WHERE NOT EXISTS (SELECT 1 FROM ").append(target.render()).append(" x WHERE ")
           .append(keyMatch("x", "s", primaryKey)).append(")");
        if (targetScheme.isPartitioned()) {
            sql.append("\nORDER BY ").append(prefixedColumnList("s", targetScheme.getKeyColumns()));
        }
        return SqlStatement.builder(Operation.BACKFILL)
            .sql(sql.toString())
            .subject(source)
            .subject(target)
            .attribute(SqlStatement.ATTR_PARTITION, sourcePartition)
            .build();
    }

    @Override
    public SqlStatement gatherStatistics(QualifiedName table, int parallelDegree) {
        return SqlStatement.builder(Operation.GATHER_STATS)
            .sql("ANALYZE TABLE " + table.render())
            .subject(table)
            .build();
    }

    @Override
    public SqlStatement enableConstraint(QualifiedName table, String constraintName) {
        // only CHECK constraints can be switched off in MySQL
        return SqlStatement.builder(Operation.ENABLE_CONSTRAINT)
            .sql("ALTER TABLE " + table.render() + " ALTER CHECK "
                + Identifiers.requireValid(constraintName, "Constraint") + " ENFORCED")
            .subject(table)
            .attribute(SqlStatement.ATTR_CONSTRAINT, constraintName)
            .build();
    }

    @Override
    public SqlStatement renameTable(QualifiedName from, QualifiedName to) {
        return SqlStatement.builder(Operation.RENAME_TABLE)
            .sql("RENAME TABLE " + from.render() + " TO " + to.render())
            .subject(from)
            .subject(to)
            .build();
    }

    @Override
    public SqlStatement dropTable(QualifiedName table) {
        return SqlStatement.builder(Operation.DROP_TABLE)
            .sql("DROP TABLE " + table.render())
            .subject(table)
            .build();
    }

    @Override
    public SqlStatement recompile(DependentObject object) {
        throw new UnsupportedOperationException(databaseType.getDisplayName() + " does not recompile dependent objects");
    }

    @Override
    public SqlStatement createBridgeTrigger(QualifiedName trigger, QualifiedName view, QualifiedName shadow,
                                            List<String> columns) {
        throw new UnsupportedOperationException(
            databaseType.getDisplayName() + " cannot create triggers on views; use application write routing");
    }

    @Override
    public SqlStatement dropTrigger(QualifiedName trigger) {
        return SqlStatement.builder(Operation.DROP_TRIGGER)
            .sql("DROP TRIGGER IF EXISTS " + trigger.render())
            .subject(trigger)
            .build();
    }

    @Override
    public SqlStatement exchangePartition(QualifiedName table, String partition, QualifiedName other) {
        return SqlStatement.builder(Operation.EXCHANGE_PARTITION)
            .sql("ALTER TABLE " + table.render() + " EXCHANGE PARTITION "
                + Identifiers.requireValid(partition, "Partition")
                + " WITH TABLE " + other.render() + " WITHOUT VALIDATION")
            .subject(table)
            .subject(other)
            .attribute(SqlStatement.ATTR_PARTITION, partition)
            .build();
    }

    @Override
    public SqlStatement dropPartition(QualifiedName table, String partition) {
        return SqlStatement.builder(Operation.DROP_PARTITION)
            .sql("ALTER TABLE " + table.render() + " DROP PARTITION " + Identifiers.requireValid(partition, "Partition"))
            .subject(table)
            .attribute(SqlStatement.ATTR_PARTITION, partition)
            .build();
    }

    @Override
    protected String partitionClause(PartitionScheme scheme) {
        String keys = columnList(scheme.getKeyColumns());
        StringBuilder clause = new StringBuilder();
        switch (scheme.getType()) {
            case RANGE:
                clause.append("PARTITION BY RANGE COLUMNS(").append(keys).append(")");
                break;
            case LIST:
                clause.append("PARTITION BY LIST COLUMNS(").append(keys).append(")");
                break;
            case HASH:
                clause.append("PARTITION BY HASH (").append(keys).append(") PARTITIONS ")
                      .append(scheme.getHashPartitionCount());
                return clause.toString();
            default:
                throw new IllegalArgumentException("Unsupported partition type for MySQL: " + scheme.getType());
        }
        if (scheme.hasSubpartitions()) {
            if (scheme.getSubpartitionType() != PartitionType.HASH) {
                throw new IllegalArgumentException("MySQL only supports HASH subpartitioning");
            }
            clause.append("\nSUBPARTITION BY HASH (").append(scheme.getSubpartitionColumn())
                  .append(") SUBPARTITIONS ").append(scheme.getSubpartitionCount());
        }
        String keyword = scheme.getType() == PartitionType.LIST ? "VALUES IN" : "VALUES LESS THAN";
        clause.append('\n').append(boundList(scheme, keyword));
        return clause.toString();
    }

    @Override
    protected String indexOptions(IndexDefinition definition, PartitionScheme scheme) {
        return "";
    }

    @Override
    protected String indexReference(QualifiedName table, String indexName) {
        return indexName;
    }

    @Override
    protected String validGrantee(String grantee) {
        if (grantee == null || !ACCOUNT.matcher(grantee).matches()) {
            throw new IllegalArgumentException("Invalid MySQL account: " + grantee);
        }
        return grantee;
    }

    @Override
    protected String renderAddPartition(QualifiedName table, PartitionBound bound) {
        return "ALTER TABLE " + table.render() + " ADD PARTITION (PARTITION " + bound.getName()
            + " VALUES LESS THAN (" + bound.getExpression() + "))";
    }

    private SqlStatement dictionaryQuery(Operation operation, String sql, QualifiedName table) {
        return SqlStatement.builder(operation)
            .sql(sql)
            .parameter(table.getSchema())
            .parameter(table.getName())
            .subject(table)
            .build();
    }
}
