package com.telcobright.repartition.core.dialect;

import com.telcobright.repartition.core.model.DependentObject;
import com.telcobright.repartition.core.model.Identifiers;
import com.telcobright.repartition.core.model.IndexDefinition;
import com.telcobright.repartition.core.model.QualifiedName;
import com.telcobright.repartition.core.partition.PartitionBound;
import com.telcobright.repartition.core.partition.PartitionScheme;
import com.telcobright.repartition.core.partition.PartitionType;

import java.util.List;
import java.util.Locale;

/**
 * Oracle rendering. The dictionary stores unquoted names in upper case, so
 * dictionary lookups bind upper-cased owner and object names.
 *
 * Oracle has native INSTEAD OF triggers, interval partitioning and
 * recompilation of invalidated dependents.
 */
public class OracleDialect extends AbstractSqlDialect {

    private static final int BRIDGE_ERROR_CODE = -20001;

    @Override
    public DatabaseType getDatabaseType() {
        return DatabaseType.ORACLE;
    }

    @Override
    public boolean supportsNativeWriteRouting() {
        return true;
    }

    @Override
    public boolean supportsIntervalPartitioning() {
        return true;
    }

    @Override
    public boolean supportsRecompilation() {
        return true;
    }

    @Override
    public SqlStatement objectExists(QualifiedName name, ObjectKind kind) {
        return SqlStatement.builder(Operation.OBJECT_EXISTS)
            .sql("SELECT COUNT(*) AS CNT FROM ALL_OBJECTS WHERE OWNER = ? AND OBJECT_NAME = ? AND OBJECT_TYPE = ?")
            .parameter(upper(name.getSchema()))
            .parameter(upper(name.getName()))
            .parameter(kind.name())
            .subject(name)
            .attribute(SqlStatement.ATTR_OBJECT_KIND, kind.name())
            .build();
    }

    @Override
    public SqlStatement describeColumns(QualifiedName table) {
        String sql = "SELECT COLUMN_NAME,\n"
            + "       CASE\n"
            + "         WHEN DATA_TYPE IN ('VARCHAR2', 'NVARCHAR2', 'CHAR', 'NCHAR') THEN DATA_TYPE || '(' || CHAR_LENGTH || ')'\n"
            + "         WHEN DATA_TYPE = 'RAW' THEN DATA_TYPE || '(' || DATA_LENGTH || ')'\n"
            + "         WHEN DATA_TYPE = 'NUMBER' AND DATA_PRECISION IS NOT NULL\n"
            + "           THEN DATA_TYPE || '(' || DATA_PRECISION || ',' || NVL(DATA_SCALE, 0) || ')'\n"
            + "         ELSE DATA_TYPE\n"
            + "       END AS DATA_TYPE,\n"
            + "       NULLABLE,\n"
            + "       COLUMN_ID AS POSITION\n"
            + "FROM ALL_TAB_COLUMNS\n"
            + "WHERE OWNER = ? AND TABLE_NAME = ?\n"
            + "ORDER BY COLUMN_ID";
        return dictionaryQuery(Operation.DESCRIBE_COLUMNS, sql, table);
    }

    @Override
    public SqlStatement describePrimaryKey(QualifiedName table) {
        String sql = "SELECT cc.COLUMN_NAME, cc.POSITION\n"
            + "FROM ALL_CONSTRAINTS c\n"
            + "JOIN ALL_CONS_COLUMNS cc ON cc.OWNER = c.OWNER AND cc.CONSTRAINT_NAME = c.CONSTRAINT_NAME\n"
            + "WHERE c.OWNER = ? AND c.TABLE_NAME = ? AND c.CONSTRAINT_TYPE = 'P'\n"
            + "ORDER BY cc.POSITION";
        return dictionaryQuery(Operation.DESCRIBE_PRIMARY_KEY, sql, table);
    }

    @Override
    public SqlStatement describeIndexes(QualifiedName table) {
        String sql = "SELECT i.INDEX_NAME, ic.COLUMN_NAME, i.UNIQUENESS, ic.COLUMN_POSITION AS POSITION\n"
            + "FROM ALL_INDEXES i\n"
            + "JOIN ALL_IND_COLUMNS ic ON ic.INDEX_OWNER = i.OWNER AND ic.INDEX_NAME = i.INDEX_NAME\n"
            + "WHERE i.TABLE_OWNER = ? AND i.TABLE_NAME = ? AND i.INDEX_TYPE <> 'LOB'\n"
            + "  AND NOT EXISTS (SELECT 1 FROM ALL_CONSTRAINTS c\n"
            + "                  WHERE c.OWNER = i.TABLE_OWNER AND c.TABLE_NAME = i.TABLE_NAME\n"
            + "                    AND c.CONSTRAINT_TYPE = 'P' AND c.INDEX_NAME = i.INDEX_NAME)\n"
            + "ORDER BY i.INDEX_NAME, ic.COLUMN_POSITION";
        return dictionaryQuery(Operation.DESCRIBE_INDEXES, sql, table);
    }

    @Override
    public SqlStatement describeGrants(QualifiedName table) {
        String sql = "SELECT GRANTEE, PRIVILEGE, GRANTABLE FROM ALL_TAB_PRIVS\n"
            + "WHERE TABLE_SCHEMA = ? AND TABLE_NAME = ?\n"
            + "ORDER BY GRANTEE, PRIVILEGE";
        return dictionaryQuery(Operation.DESCRIBE_GRANTS, sql, table);
    }

    @Override
    public SqlStatement describeConstraints(QualifiedName table) {
        String sql = "SELECT CONSTRAINT_NAME, CONSTRAINT_TYPE, STATUS FROM ALL_CONSTRAINTS\n"
            + "WHERE OWNER = ? AND TABLE_NAME = ?\n"
            + "ORDER BY CONSTRAINT_NAME";
        return dictionaryQuery(Operation.DESCRIBE_CONSTRAINTS, sql, table);
    }

    @Override
    public SqlStatement listPartitions(QualifiedName table) {
        String sql = "SELECT PARTITION_NAME, PARTITION_POSITION, HIGH_VALUE, NUM_ROWS FROM ALL_TAB_PARTITIONS\n"
            + "WHERE TABLE_OWNER = ? AND TABLE_NAME = ?\n"
            + "ORDER BY PARTITION_POSITION";
        return dictionaryQuery(Operation.LIST_PARTITIONS, sql, table);
    }

    @Override
    public SqlStatement activeSessions(QualifiedName table) {
        String sql = "SELECT s.SID AS SESSION_ID\n"
            + "FROM V$SESSION s\n"
            + "JOIN V$SQLAREA q ON q.SQL_ID = s.SQL_ID\n"
            + "WHERE s.STATUS = 'ACTIVE'\n"
            + "  AND s.AUDSID <> SYS_CONTEXT('USERENV', 'SESSIONID')\n"
            + "  AND UPPER(q.SQL_TEXT) LIKE ? ESCAPE '" + LIKE_ESCAPE + "'";
        return SqlStatement.builder(Operation.ACTIVE_SESSIONS)
            .sql(sql)
            .parameter(containsPattern(upper(table.getName())))
            .subject(table)
            .attribute(SqlStatement.ATTR_PATTERN, table.getName())
            .build();
    }

    @Override
    public SqlStatement listDependents(QualifiedName canonical, QualifiedName retired) {
        String sql = "SELECT DISTINCT o.OWNER, o.OBJECT_NAME, o.OBJECT_TYPE, o.STATUS\n"
            + "FROM ALL_DEPENDENCIES d\n"
            + "JOIN ALL_OBJECTS o ON o.OWNER = d.OWNER AND o.OBJECT_NAME = d.NAME AND o.OBJECT_TYPE = d.TYPE\n"
            + "WHERE d.REFERENCED_OWNER = ? AND d.REFERENCED_NAME IN (?, ?)\n"
            + "ORDER BY o.OWNER, o.OBJECT_NAME";
        return SqlStatement.builder(Operation.LIST_DEPENDENTS)
            .sql(sql)
            .parameter(upper(canonical.getSchema()))
            .parameter(upper(canonical.getName()))
            .parameter(upper(retired.getName()))
            .subject(canonical)
            .subject(retired)
            .build();
    }

    @Override
    public SqlStatement backfill(QualifiedName source, QualifiedName target, List<String> columns,
                                 List<String> primaryKey, PartitionScheme targetScheme,
                                 String sourcePartition, int parallelDegree) {
        StringBuilder sql = new StringBuilder()
            .append("INSERT /*+ APPEND PARALLEL(t, ").append(parallelDegree).append(") */ INTO ")
            .append(target.render()).append(" t (").append(columnList(columns)).append(")\n")
            .append("SELECT /*+ PARALLEL(s, ").append(parallelDegree).append(") */ ")
            .append(prefixedColumnList("s", columns)).append("\n")
            .append("FROM ").append(source.render());
        if (sourcePartition != null) {
            sql.append(" PARTITION (").append(Identifiers.requireValid(sourcePartition, "Partition")).append(")");
        }
        sql.append(" s\n")
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
            .sql("BEGIN DBMS_STATS.GATHER_TABLE_STATS(ownname => ?, tabname => ?, degree => ?, cascade => TRUE); END;")
            .parameter(upper(table.getSchema()))
            .parameter(upper(table.getName()))
            .parameter(parallelDegree)
            .subject(table)
            .build();
    }

    @Override
    public SqlStatement enableConstraint(QualifiedName table, String constraintName) {
        return SqlStatement.builder(Operation.ENABLE_CONSTRAINT)
            .sql("ALTER TABLE " + table.render() + " ENABLE NOVALIDATE CONSTRAINT "
                + Identifiers.requireValid(constraintName, "Constraint"))
            .subject(table)
            .attribute(SqlStatement.ATTR_CONSTRAINT, constraintName)
            .build();
    }

    @Override
    public SqlStatement renameTable(QualifiedName from, QualifiedName to) {
        if (!from.getSchema().equalsIgnoreCase(to.getSchema())) {
            throw new IllegalArgumentException("Oracle cannot rename " + from + " into another schema: " + to);
        }
        return SqlStatement.builder(Operation.RENAME_TABLE)
            .sql("ALTER TABLE " + from.render() + " RENAME TO " + to.getName())
            .subject(from)
            .subject(to)
            .build();
    }

    @Override
    public SqlStatement dropTable(QualifiedName table) {
        return SqlStatement.builder(Operation.DROP_TABLE)
            .sql("DROP TABLE " + table.render() + " PURGE")
            .subject(table)
            .build();
    }

    @Override
    public SqlStatement recompile(DependentObject object) {
        QualifiedName name = QualifiedName.of(object.getOwner(), object.getName());
        String type = object.getType() == null ? "" : object.getType().toUpperCase(Locale.ROOT);
        String sql;
        switch (type) {
            case "VIEW":
            case "TRIGGER":
            case "PROCEDURE":
            case "FUNCTION":
            case "SYNONYM":
            case "MATERIALIZED VIEW":
                sql = "ALTER " + type + " " + name.render() + " COMPILE";
                break;
            case "PACKAGE":
                sql = "ALTER PACKAGE " + name.render() + " COMPILE PACKAGE";
                break;
            case "PACKAGE BODY":
                sql = "ALTER PACKAGE " + name.render() + " COMPILE BODY";
                break;
            case "TYPE":
                sql = "ALTER TYPE " + name.render() + " COMPILE";
                break;
            default:
                throw new IllegalArgumentException("Cannot recompile object type " + object.getType() + ": " + name);
        }
        return SqlStatement.builder(Operation.RECOMPILE)
            .sql(sql)
            .subject(name)
            .attribute(SqlStatement.ATTR_OBJECT_TYPE, type)
            .build();
    }

    @Override
    public SqlStatement createBridgeTrigger(QualifiedName trigger, QualifiedName view, QualifiedName shadow,
                                            List<String> columns) {
        String newValues = columns.stream()
            .map(c -> ":NEW." + c)
            .reduce((a, b) -> a + ", " + b)
            .orElseThrow(() -> new IllegalArgumentException("Column list cannot be empty"));
        String sql = "CREATE OR REPLACE TRIGGER " + trigger.render() + "\n"
            + "INSTEAD OF INSERT OR UPDATE OR DELETE ON " + view.render() + "\n"
            + "FOR EACH ROW\n"
            + "BEGIN\n"
            + "  IF INSERTING THEN\n"
            + "    INSERT INTO " + shadow.render() + " (" + columnList(columns) + ") VALUES (" + newValues + ");\n"
            + "  ELSE\n"
            + "    RAISE_APPLICATION_ERROR(" + BRIDGE_ERROR_CODE + ", 'Only INSERT is supported through "
            + view.render() + "');\n"
            + "  END IF;\n"
            + "END;";
        return SqlStatement.builder(Operation.CREATE_BRIDGE_TRIGGER)
            .sql(sql)
            .subject(trigger)
            .subject(view)
            .subject(shadow)
            .build();
    }

    @Override
    public SqlStatement dropTrigger(QualifiedName trigger) {
        return SqlStatement.builder(Operation.DROP_TRIGGER)
            .sql("DROP TRIGGER " + trigger.render())
            .subject(trigger)
            .build();
    }

    @Override
    public SqlStatement exchangePartition(QualifiedName table, String partition, QualifiedName other) {
        return SqlStatement.builder(Operation.EXCHANGE_PARTITION)
            .sql("ALTER TABLE " + table.render() + " EXCHANGE PARTITION "
                + Identifiers.requireValid(partition, "Partition")
                + " WITH TABLE " + other.render() + " INCLUDING INDEXES WITHOUT VALIDATION")
            .subject(table)
            .subject(other)
            .attribute(SqlStatement.ATTR_PARTITION, partition)
            .build();
    }

    @Override
    public SqlStatement dropPartition(QualifiedName table, String partition) {
        return SqlStatement.builder(Operation.DROP_PARTITION)
            .sql("ALTER TABLE " + table.render() + " DROP PARTITION "
                + Identifiers.requireValid(partition, "Partition") + " UPDATE GLOBAL INDEXES")
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
                clause.append("PARTITION BY RANGE (").append(keys).append(")");
                break;
            case INTERVAL:
                clause.append("PARTITION BY RANGE (").append(keys).append(")\n")
                      .append("INTERVAL (").append(scheme.getIntervalExpression()).append(")");
                break;
            case LIST:
                clause.append("PARTITION BY LIST (").append(keys).append(")");
                break;
            case HASH:
                clause.append("PARTITION BY HASH (").append(keys).append(")");
                break;
            default:
                throw new IllegalArgumentException("Not a partitioned scheme: " + scheme);
        }
        if (scheme.hasSubpartitions()) {
            clause.append("\nSUBPARTITION BY ").append(scheme.getSubpartitionType().name())
                  .append(" (").append(scheme.getSubpartitionColumn()).append(")");
            if (scheme.getSubpartitionType() == PartitionType.HASH) {
                clause.append(" SUBPARTITIONS ").append(scheme.getSubpartitionCount());
            }
        }
        if (scheme.getType() == PartitionType.HASH) {
            clause.append(" PARTITIONS ").append(scheme.getHashPartitionCount());
        } else {
            String keyword = scheme.getType() == PartitionType.LIST ? "VALUES" : "VALUES LESS THAN";
            clause.append('\n').append(boundList(scheme, keyword));
        }
        return clause.toString();
    }

    @Override
    protected String indexOptions(IndexDefinition definition, PartitionScheme scheme) {
        if (!scheme.isPartitioned()) {
            return "";
        }
        // unique LOCAL indexes must contain the partition key
        if (definition.isUnique() && !coversPartitionKey(definition, scheme)) {
            return "";
        }
        return " LOCAL";
    }

    @Override
    protected String indexReference(QualifiedName table, String indexName) {
        return table.withName(indexName).render();
    }

    @Override
    protected String validGrantee(String grantee) {
        return Identifiers.requireValid(grantee, "Grantee");
    }

    @Override
    protected String renderAddPartition(QualifiedName table, PartitionBound bound) {
        return "ALTER TABLE " + table.render() + " ADD PARTITION " + bound.getName()
            + " VALUES LESS THAN (" + bound.getExpression() + ")";
    }

    private SqlStatement dictionaryQuery(Operation operation, String sql, QualifiedName table) {
        return SqlStatement.builder(operation)
            .sql(sql)
            .parameter(upper(table.getSchema()))
            .parameter(upper(table.getName()))
            .subject(table)
            .build();
    }

    private static String upper(String name) {
        return name.toUpperCase(Locale.ROOT);
    }
}
