package com.telcobright.repartition.core.dialect;

import com.telcobright.repartition.core.model.ColumnDefinition;
import com.telcobright.repartition.core.model.Identifiers;
import com.telcobright.repartition.core.model.IndexDefinition;
import com.telcobright.repartition.core.model.QualifiedName;
import com.telcobright.repartition.core.model.TableGrant;
import com.telcobright.repartition.core.partition.PartitionBound;
import com.telcobright.repartition.core.partition.PartitionScheme;

import java.util.List;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Rendering shared by the Oracle and MySQL dialects. Subclasses supply
 * dictionary queries and the statements whose syntax differs.
 */
public abstract class AbstractSqlDialect implements SqlDialect {

    protected static final char LIKE_ESCAPE = '!';

    private static final Pattern PRIVILEGE = Pattern.compile("[A-Za-z]+( [A-Za-z]+)*");

    @Override
    public SqlStatement countRows(QualifiedName table) {
        return SqlStatement.builder(Operation.COUNT_ROWS)
            .sql("SELECT COUNT(*) AS " + COL_COUNT + " FROM " + table.render())
            .subject(table)
            .build();
    }

    @Override
    public SqlStatement createTable(QualifiedName table, List<ColumnDefinition> columns,
                                    List<String> primaryKey, PartitionScheme scheme) {
        if (columns.isEmpty()) {
            throw new IllegalArgumentException("Cannot create " + table + " without columns");
        }
        scheme.getType().validateSupported(supportsIntervalPartitioning());

        StringBuilder sql = new StringBuilder("CREATE TABLE ").append(table.render()).append(" (\n");
        for (ColumnDefinition column : columns) {
            sql.append("  ").append(Identifiers.requireValid(column.getName(), "Column"))
               .append(' ').append(column.getDataType());
            if (!column.isNullable()) {
                sql.append(" NOT NULL");
            }
            sql.append(",\n");
        }
        sql.append("  CONSTRAINT ")
           .append(Identifiers.withSuffix(table.getName(), "_PK"))
           .append(" PRIMARY KEY (").append(columnList(primaryKey)).append(")\n)");

        if (scheme.isPartitioned()) {
            sql.append('\n').append(partitionClause(scheme));
        }

        return SqlStatement.builder(Operation.CREATE_TABLE)
            .sql(sql.toString())
            .subject(table)
            .attribute(SqlStatement.ATTR_COLUMNS, String.join(",", columnNames(columns)))
            .attribute(SqlStatement.ATTR_PRIMARY_KEY, String.join(",", primaryKey))
            .build();
    }

    @Override
    public SqlStatement createIndex(QualifiedName table, String indexName, IndexDefinition definition,
                                    PartitionScheme scheme) {
        Identifiers.requireValid(indexName, "Index name");
        StringBuilder sql = new StringBuilder("CREATE ");
        if (definition.isUnique()) {
            sql.append("UNIQUE ");
        }
        sql.append("INDEX ").append(indexReference(table, indexName))
           .append(" ON ").append(table.render())
           .append(" (").append(columnList(definition.getColumns())).append(")");
        sql.append(indexOptions(definition, scheme));

        return SqlStatement.builder(Operation.CREATE_INDEX)
            .sql(sql.toString())
            .subject(table)
            .attribute(SqlStatement.ATTR_INDEX, indexName)
            .attribute(SqlStatement.ATTR_COLUMNS, String.join(",", definition.getColumns()))
            .build();
    }

    @Override
    public SqlStatement grant(QualifiedName table, TableGrant grant) {
        String privilege = grant.getPrivilege();
        if (!PRIVILEGE.matcher(privilege).matches()) {
            throw new IllegalArgumentException("Invalid privilege: " + privilege);
        }
        String sql = "GRANT " + privilege + " ON " + table.render() + " TO " + validGrantee(grant.getGrantee())
            + (grant.isGrantable() ? " WITH GRANT OPTION" : "");
        return SqlStatement.builder(Operation.GRANT)
            .sql(sql)
            .subject(table)
            .attribute(SqlStatement.ATTR_GRANTEE, grant.getGrantee())
            .attribute(SqlStatement.ATTR_PRIVILEGE, privilege)
            .build();
    }

    @Override
    public SqlStatement createBridgeView(QualifiedName view, QualifiedName shadow, QualifiedName retired,
                                         List<String> primaryKey) {
        String keys = columnList(primaryKey);
        String sql = "CREATE OR REPLACE VIEW " + view.render() + " AS\n"
            + "SELECT * FROM " + shadow.render() + "\n"
            + "UNION ALL\n"
            + "SELECT * FROM " + retired.render() + "\n"
            + "WHERE (" + keys + ") NOT IN (SELECT " + keys + " FROM " + shadow.render() + ")";
        return SqlStatement.builder(Operation.CREATE_BRIDGE_VIEW)
            .sql(sql)
            .subject(view)
            .subject(shadow)
            .subject(retired)
            .build();
    }

    @Override
    public SqlStatement dropView(QualifiedName view) {
        return SqlStatement.builder(Operation.DROP_VIEW)
            .sql("DROP VIEW " + view.render())
            .subject(view)
            .build();
    }

    @Override
    public SqlStatement insertRow(QualifiedName table, List<String> columns) {
        String placeholders = columns.stream().map(c -> "?").collect(Collectors.joining(", "));
        return SqlStatement.builder(Operation.INSERT_ROW)
            .sql("INSERT INTO " + table.render() + " (" + columnList(columns) + ") VALUES (" + placeholders + ")")
            .subject(table)
            .attribute(SqlStatement.ATTR_COLUMNS, String.join(",", columns))
            .build();
    }

    @Override
    public SqlStatement addPartition(QualifiedName table, String partition, String upperBound) {
        PartitionBound bound = new PartitionBound(partition, upperBound);
        return SqlStatement.builder(Operation.ADD_PARTITION)
            .sql(renderAddPartition(table, bound))
            .subject(table)
            .attribute(SqlStatement.ATTR_PARTITION, bound.getName())
            .attribute(SqlStatement.ATTR_BOUND, bound.getExpression())
            .build();
    }

    /**
     * The PARTITION BY clause for a partitioned scheme.
     */
    protected abstract String partitionClause(PartitionScheme scheme);

    /**
     * Trailing options of CREATE INDEX, e.g. LOCAL.
     */
    protected abstract String indexOptions(IndexDefinition definition, PartitionScheme scheme);

    /**
     * How the index name is written after CREATE INDEX.
     */
    protected abstract String indexReference(QualifiedName table, String indexName);

    protected abstract String validGrantee(String grantee);

    protected abstract String renderAddPartition(QualifiedName table, PartitionBound bound);

    protected static String columnList(List<String> columns) {
        if (columns.isEmpty()) {
            throw new IllegalArgumentException("Column list cannot be empty");
        }
        return columns.stream()
            .map(c -> Identifiers.requireValid(c, "Column"))
            .collect(Collectors.joining(", "));
    }

    /**
     * LIKE pattern matching {@code text} anywhere, with {@code _} and {@code %}
     * taken literally. Pair with {@code ESCAPE '!'}.
     */
    protected static String containsPattern(String text) {
        StringBuilder sb = new StringBuilder("%");
        for (char c : text.toCharArray()) {
            if (c == LIKE_ESCAPE || c == '_' || c == '%') {
                sb.append(LIKE_ESCAPE);
            }
            sb.append(c);
        }
        return sb.append('%').toString();
    }

    protected static String prefixedColumnList(String alias, List<String> columns) {
        return columns.stream()
            .map(c -> alias + "." + Identifiers.requireValid(c, "Column"))
            .collect(Collectors.joining(", "));
    }

    protected static String keyMatch(String left, String right, List<String> primaryKey) {
        return primaryKey.stream()
            .map(c -> left + "." + c + " = " + right + "." + c)
            .collect(Collectors.joining(" AND "));
    }

    protected static String boundList(PartitionScheme scheme, String valuesKeyword) {
        return scheme.getBounds().stream()
            .map(b -> "  PARTITION " + b.getName() + " " + valuesKeyword + " (" + b.getExpression() + ")")
            .collect(Collectors.joining(",\n", "(\n", "\n)"));
    }

    /**
     * Whether a unique index can be equipartitioned with the table: its columns
     * must cover the partition key.
     */
    protected static boolean coversPartitionKey(IndexDefinition definition, PartitionScheme scheme) {
        List<String> indexed = definition.getColumns().stream().map(String::toUpperCase).collect(Collectors.toList());
        return scheme.getKeyColumns().stream().map(String::toUpperCase).allMatch(indexed::contains);
    }

    private static List<String> columnNames(List<ColumnDefinition> columns) {
        return columns.stream().map(ColumnDefinition::getName).collect(Collectors.toList());
    }
}
