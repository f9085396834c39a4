package com.telcobright.repartition.db.discovery;

import com.telcobright.repartition.core.dialect.SqlDialect;
import com.telcobright.repartition.core.model.ColumnDefinition;
import com.telcobright.repartition.core.model.ConstraintInfo;
import com.telcobright.repartition.core.model.DependentObject;
import com.telcobright.repartition.core.model.IndexDefinition;
import com.telcobright.repartition.core.model.QualifiedName;
import com.telcobright.repartition.core.model.TableGrant;
import com.telcobright.repartition.core.model.TableMetadata;
import com.telcobright.repartition.core.partition.PartitionSlice;
import com.telcobright.repartition.db.gateway.DatabaseGateway;
import com.telcobright.repartition.db.gateway.ResultRow;

import java.sql.SQLException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Collectors;

import static com.telcobright.repartition.core.dialect.SqlDialect.*;

/**
 * Schema discovery built on the dialect's dictionary queries, issued through
 * the gateway.
 */
public class DictionarySchemaDiscovery implements SchemaDiscovery {

    private final DatabaseGateway gateway;
    private final SqlDialect dialect;

    public DictionarySchemaDiscovery(DatabaseGateway gateway, SqlDialect dialect) {
        this.gateway = gateway;
        this.dialect = dialect;
    }

    @Override
    public Optional<TableMetadata> describe(QualifiedName table, Duration timeout) throws SQLException {
        List<ColumnDefinition> columns = new ArrayList<>();
        for (ResultRow row : gateway.query(dialect.describeColumns(table), timeout)) {
            columns.add(new ColumnDefinition(
                row.getString(COL_COLUMN_NAME),
                row.getString(COL_DATA_TYPE),
                isYes(row.getString(COL_NULLABLE)),
                row.getInt(COL_POSITION)));
        }
        if (columns.isEmpty()) {
            return Optional.empty();
        }

        List<String> primaryKey = gateway.query(dialect.describePrimaryKey(table), timeout).stream()
            .map(row -> row.getString(COL_COLUMN_NAME))
            .collect(Collectors.toList());

        Map<String, List<String>> indexColumns = new LinkedHashMap<>();
        Map<String, Boolean> indexUnique = new LinkedHashMap<>();
        for (ResultRow row : gateway.query(dialect.describeIndexes(table), timeout)) {
            String name = row.getString(COL_INDEX_NAME);
            indexColumns.computeIfAbsent(name, k -> new ArrayList<>()).add(row.getString(COL_COLUMN_NAME));
            indexUnique.put(name, "UNIQUE".equalsIgnoreCase(row.getString(COL_UNIQUENESS)));
        }
        List<IndexDefinition> indexes = new ArrayList<>();
        indexColumns.forEach((name, cols) -> indexes.add(new IndexDefinition(name, cols, indexUnique.get(name))));

        List<TableGrant> grants = new ArrayList<>();
        for (ResultRow row : gateway.query(dialect.describeGrants(table), timeout)) {
            grants.add(new TableGrant(
                row.getString(COL_GRANTEE),
                row.getString(COL_PRIVILEGE),
                isYes(row.getString(COL_GRANTABLE))));
        }

        return Optional.of(new TableMetadata(table, columns, primaryKey, indexes, grants));
    }

    @Override
    public List<ConstraintInfo> constraints(QualifiedName table, Duration timeout) throws SQLException {
        return gateway.query(dialect.describeConstraints(table), timeout).stream()
            .map(row -> new ConstraintInfo(
                row.getString(COL_CONSTRAINT_NAME),
                row.getString(COL_CONSTRAINT_TYPE),
                row.getString(COL_STATUS)))
            .collect(Collectors.toList());
    }

    @Override
    public List<PartitionSlice> partitions(QualifiedName table, Duration timeout) throws SQLException {
        return gateway.query(dialect.listPartitions(table), timeout).stream()
            .map(row -> new PartitionSlice(
                table,
                row.getString(COL_PARTITION_NAME),
                row.getInt(COL_PARTITION_POSITION),
                row.getString(COL_HIGH_VALUE),
                row.getLong(COL_NUM_ROWS)))
            .sorted(PartitionSlice.BY_POSITION)
            .collect(Collectors.toList());
    }

    @Override
    public List<DependentObject> dependents(QualifiedName canonical, QualifiedName retired, Duration timeout)
            throws SQLException {
        return gateway.query(dialect.listDependents(canonical, retired), timeout).stream()
            .map(row -> new DependentObject(
                row.getString(COL_OWNER),
                row.getString(COL_OBJECT_NAME),
                row.getString(COL_OBJECT_TYPE),
                row.getString(COL_STATUS)))
            .collect(Collectors.toList());
    }

    private static boolean isYes(String flag) {
        return flag != null && (flag.equalsIgnoreCase("Y") || flag.equalsIgnoreCase("YES"));
    }
}
