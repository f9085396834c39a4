package com.telcobright.repartition.support;

import com.telcobright.repartition.core.dialect.ObjectKind;
import com.telcobright.repartition.core.dialect.Operation;
import com.telcobright.repartition.core.dialect.SqlDialect;
import com.telcobright.repartition.core.dialect.SqlStatement;
import com.telcobright.repartition.core.model.QualifiedName;
import com.telcobright.repartition.db.gateway.DatabaseGateway;
import com.telcobright.repartition.db.gateway.ResultRow;

import java.sql.SQLException;
import java.sql.SQLIntegrityConstraintViolationException;
import java.sql.SQLTimeoutException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;
import java.util.function.Predicate;
import java.util.stream.Collectors;

/**
 * In-memory database that interprets the engine's statements by operation,
 * subjects and attributes. Never parses SQL text.
 *
 * Tables hold rows keyed by primary key, optionally split into named
 * partitions. Views, bridge triggers, grants, indexes, constraints, dependent
 * objects and active sessions are tracked well enough for the engine's
 * dictionary reads. Failures can be injected per statement.
 */
public class SimulatedDatabase implements DatabaseGateway {

    private static final String DEFAULT_BUCKET = "";

    private final Map<QualifiedName, Table> tables = new LinkedHashMap<>();
    private final Map<QualifiedName, List<QualifiedName>> views = new LinkedHashMap<>();
    private final Map<QualifiedName, QualifiedName> triggers = new LinkedHashMap<>();
    private final Map<QualifiedName, QualifiedName> triggerTargets = new LinkedHashMap<>();
    private final List<Dependent> dependents = new ArrayList<>();
    private final Set<String> unfixableDependents = new TreeSet<>();
    private final Map<String, List<String>> sessions = new LinkedHashMap<>();
    private final List<Failure> failures = new ArrayList<>();
    private final Map<Operation, List<Runnable>> hooks = new EnumMap<>(Operation.class);
    private final List<SqlStatement> executed = new ArrayList<>();
    private final List<SqlStatement> queried = new ArrayList<>();

    // Seeding

    public synchronized Table table(QualifiedName name, List<String> columns, List<String> primaryKey) {
        Table table = new Table(name, columns, primaryKey);
        tables.put(name, table);
        table.constraints.add(new String[]{name.getName() + "_PK", "P", "ENABLED"});
        return table;
    }

    public synchronized Table table(QualifiedName name) {
        Table table = tables.get(name);
        if (table == null) {
            throw new IllegalArgumentException("No table " + name);
        }
        return table;
    }

    public synchronized boolean hasTable(QualifiedName name) {
        return tables.containsKey(name);
    }

    public synchronized boolean hasView(QualifiedName name) {
        return views.containsKey(name);
    }

    public synchronized boolean hasTrigger(QualifiedName name) {
        return triggers.containsKey(name);
    }

    public synchronized long rowCount(QualifiedName name) {
        return table(name).rowCount();
    }

    public synchronized List<String> tableNames() {
        return tables.keySet().stream().map(QualifiedName::render).collect(Collectors.toList());
    }

    /**
     * Register an object that depends on {@code referenced}. It goes invalid
     * whenever a table of that name is renamed or dropped.
     */
    public synchronized void dependent(String owner, String name, String type, QualifiedName referenced) {
        dependents.add(new Dependent(owner, name, type, referenced));
    }

    /**
     * The named dependent stays invalid however often it is recompiled.
     */
    public synchronized void unfixable(String name) {
        unfixableDependents.add(name.toUpperCase(Locale.ROOT));
    }

    public synchronized String dependentStatus(String name) {
        return dependents.stream().filter(d -> d.name.equalsIgnoreCase(name)).findFirst()
            .map(d -> d.status).orElse(null);
    }

    public synchronized void activeSessions(QualifiedName table, String... sessionIds) {
        sessions.put(table.getName().toUpperCase(Locale.ROOT), Arrays.asList(sessionIds));
    }

    // Failure injection and hooks

    public synchronized void failWhen(Predicate<SqlStatement> matcher, String message) {
        failures.add(new Failure(matcher, message, false, false));
    }

    public synchronized void failOnceWhen(Predicate<SqlStatement> matcher, String message) {
        failures.add(new Failure(matcher, message, true, false));
    }

    public synchronized void timeoutWhen(Predicate<SqlStatement> matcher) {
        failures.add(new Failure(matcher, "ORA-01013: user requested cancel of current operation", false, true));
    }

    public synchronized void clearFailures() {
        failures.clear();
    }

    /**
     * Run {@code action} just before every statement of the given operation.
     */
    public synchronized void onStatement(Operation operation, Runnable action) {
        hooks.computeIfAbsent(operation, k -> new ArrayList<>()).add(action);
    }

    public static Predicate<SqlStatement> renaming(QualifiedName from) {
        return s -> s.getOperation() == Operation.RENAME_TABLE && s.subject(0).equals(from);
    }

    public static Predicate<SqlStatement> operation(Operation operation) {
        return s -> s.getOperation() == operation;
    }

    public synchronized List<SqlStatement> executed() {
        return new ArrayList<>(executed);
    }

    public synchronized List<Operation> executedOperations() {
        return executed.stream().map(SqlStatement::getOperation).collect(Collectors.toList());
    }

    public synchronized long count(Operation operation) {
        return executed.stream().filter(s -> s.getOperation() == operation).count();
    }

    public synchronized List<SqlStatement> queried() {
        return new ArrayList<>(queried);
    }

    // Gateway

    @Override
    public long execute(SqlStatement statement, Duration timeout) throws SQLException {
        runHooks(statement);
        synchronized (this) {
            if (statement.getOperation().isQuery()) {
                throw new SQLException("Not a mutation: " + statement.describe());
            }
            checkFailures(statement);
            executed.add(statement);
            return apply(statement);
        }
    }

    @Override
    public List<ResultRow> query(SqlStatement statement, Duration timeout) throws SQLException {
        runHooks(statement);
        synchronized (this) {
            if (!statement.getOperation().isQuery()) {
                throw new SQLException("Not a query: " + statement.describe());
            }
            checkFailures(statement);
            queried.add(statement);
            return read(statement);
        }
    }

    private void runHooks(SqlStatement statement) {
        List<Runnable> actions;
        synchronized (this) {
            actions = new ArrayList<>(hooks.getOrDefault(statement.getOperation(), Collections.emptyList()));
        }
        actions.forEach(Runnable::run);
    }

    private void checkFailures(SqlStatement statement) throws SQLException {
        for (Failure failure : new ArrayList<>(failures)) {
            if (failure.matcher.test(statement)) {
                if (failure.once) {
                    failures.remove(failure);
                }
                if (failure.timeout) {
                    throw new SQLTimeoutException(failure.message);
                }
                throw new SQLException(failure.message);
            }
        }
    }

    private List<ResultRow> read(SqlStatement s) throws SQLException {
        QualifiedName subject = s.subject(0);
        Table table = tables.get(subject);
        switch (s.getOperation()) {
            case OBJECT_EXISTS:
                return count(exists(subject, ObjectKind.valueOf(s.attribute(SqlStatement.ATTR_OBJECT_KIND))) ? 1 : 0);
            case COUNT_ROWS:
                if (table != null) {
                    return count(table.rowCount());
                }
                if (views.containsKey(subject)) {
                    return count(viewRows(subject).size());
                }
                throw missing(subject);
            case DESCRIBE_COLUMNS:
                return table == null ? Collections.emptyList() : table.columnRows();
            case DESCRIBE_PRIMARY_KEY:
                return table == null ? Collections.emptyList() : table.primaryKeyRows();
            case DESCRIBE_INDEXES:
                return table == null ? Collections.emptyList() : table.indexRows();
            case DESCRIBE_GRANTS:
                return table == null ? Collections.emptyList() : table.grantRows();
            case DESCRIBE_CONSTRAINTS:
                return table == null ? Collections.emptyList() : table.constraintRows();
            case LIST_PARTITIONS:
                return table == null ? Collections.emptyList() : table.partitionRows();
            case ACTIVE_SESSIONS:
                return sessions.getOrDefault(s.attribute(SqlStatement.ATTR_PATTERN).toUpperCase(Locale.ROOT),
                        Collections.emptyList()).stream()
                    .map(id -> ResultRow.of(SqlDialect.COL_SESSION_ID, id))
                    .collect(Collectors.toList());
            case LIST_DEPENDENTS:
                QualifiedName retired = s.subject(1);
                return dependents.stream()
                    .filter(d -> d.referenced.equals(subject) || d.referenced.equals(retired))
                    .map(d -> ResultRow.of(
                        SqlDialect.COL_OWNER, d.owner,
                        SqlDialect.COL_OBJECT_NAME, d.name,
                        SqlDialect.COL_OBJECT_TYPE, d.type,
                        SqlDialect.COL_STATUS, d.status))
                    .collect(Collectors.toList());
            default:
                throw new SQLException("Unsupported query " + s.describe());
        }
    }

    private long apply(SqlStatement s) throws SQLException {
        QualifiedName subject = s.subject(0);
        switch (s.getOperation()) {
            case CREATE_TABLE: {
                if (exists(subject, ObjectKind.TABLE)) {
                    throw new SQLException("ORA-00955: name is already used by an existing object: " + subject);
                }
                table(subject, split(s.attribute(SqlStatement.ATTR_COLUMNS)),
                    split(s.attribute(SqlStatement.ATTR_PRIMARY_KEY)));
                return 0;
            }
            case BACKFILL: {
                Table source = require(subject);
                Table target = require(s.subject(1));
                String partition = s.attribute(SqlStatement.ATTR_PARTITION);
                Map<List<Object>, Map<String, Object>> rows = partition == null
                    ? source.allRows()
                    : source.partition(partition).rows;
                long copied = 0;
                for (Map<String, Object> row : rows.values()) {
                    if (!target.containsKey(row)) {
                        target.put(row);
                        copied++;
                    }
                }
                return copied;
            }
            case CREATE_INDEX: {
                Table table = require(subject);
                String index = s.attribute(SqlStatement.ATTR_INDEX);
                if (table.indexes.containsKey(index.toUpperCase(Locale.ROOT))) {
                    throw new SQLException("ORA-00955: index " + index + " already exists");
                }
                table.index(index, s.getSql().startsWith("CREATE UNIQUE"),
                    split(s.attribute(SqlStatement.ATTR_COLUMNS)).toArray(new String[0]));
                return 0;
            }
            case GATHER_STATS:
                require(subject);
                return 0;
            case ENABLE_CONSTRAINT: {
                Table table = require(subject);
                String name = s.attribute(SqlStatement.ATTR_CONSTRAINT);
                for (String[] c : table.constraints) {
                    if (c[0].equalsIgnoreCase(name)) {
                        c[2] = "ENABLED";
                        return 0;
                    }
                }
                throw new SQLException("ORA-02431: constraint " + name + " does not exist");
            }
            case RENAME_TABLE: {
                QualifiedName to = s.subject(1);
                Table table = require(subject);
                if (exists(to, ObjectKind.TABLE) || views.containsKey(to)) {
                    throw new SQLException("ORA-00955: name is already used by an existing object: " + to);
                }
                tables.remove(subject);
                table.name = to;
                tables.put(to, table);
                invalidateDependents(subject);
                invalidateDependents(to);
                return 0;
            }
            case DROP_TABLE:
                if (tables.remove(subject) == null) {
                    throw missing(subject);
                }
                invalidateDependents(subject);
                return 0;
            case RECOMPILE:
                for (Dependent d : dependents) {
                    if (d.name.equalsIgnoreCase(subject.getName()) && d.owner.equalsIgnoreCase(subject.getSchema())) {
                        d.compileCount++;
                        d.status = unfixableDependents.contains(d.name.toUpperCase(Locale.ROOT)) ? "INVALID" : "VALID";
                        return 0;
                    }
                }
                throw new SQLException("ORA-04043: object " + subject + " does not exist");
            case GRANT:
                require(subject).grant(s.attribute(SqlStatement.ATTR_GRANTEE), s.attribute(SqlStatement.ATTR_PRIVILEGE),
                    s.getSql().endsWith("WITH GRANT OPTION"));
                return 0;
            case CREATE_BRIDGE_VIEW:
                views.put(subject, Arrays.asList(s.subject(1), s.subject(2)));
                return 0;
            case CREATE_BRIDGE_TRIGGER:
                if (!views.containsKey(s.subject(1))) {
                    throw missing(s.subject(1));
                }
                triggers.put(subject, s.subject(1));
                triggerTargets.put(s.subject(1), s.subject(2));
                return 0;
            case DROP_TRIGGER: {
                QualifiedName view = triggers.remove(subject);
                if (view == null) {
                    throw new SQLException("ORA-04080: trigger " + subject + " does not exist");
                }
                triggerTargets.remove(view);
                return 0;
            }
            case DROP_VIEW:
                if (views.remove(subject) == null) {
                    throw missing(subject);
                }
                return 0;
            case INSERT_ROW: {
                QualifiedName target = subject;
                if (views.containsKey(subject)) {
                    target = triggerTargets.get(subject);
                    if (target == null) {
                        throw new SQLException("ORA-01732: data manipulation operation not legal on this view");
                    }
                }
                Table table = require(target);
                List<String> columns = split(s.attribute(SqlStatement.ATTR_COLUMNS));
                Map<String, Object> row = new LinkedHashMap<>();
                for (int i = 0; i < columns.size(); i++) {
                    row.put(columns.get(i).toUpperCase(Locale.ROOT), s.getParameters().get(i));
                }
                if (table.containsKey(row)) {
                    throw new SQLIntegrityConstraintViolationException("ORA-00001: unique constraint violated");
                }
                table.put(row);
                return 1;
            }
            case EXCHANGE_PARTITION: {
                Table partitioned = require(subject);
                Table other = require(s.subject(1));
                Partition partition = partitioned.partition(s.attribute(SqlStatement.ATTR_PARTITION));
                Partition bucket = other.partition(DEFAULT_BUCKET);
                Map<List<Object>, Map<String, Object>> swap = partition.rows;
                partition.rows = bucket.rows;
                bucket.rows = swap;
                return 0;
            }
            case ADD_PARTITION: {
                Table table = require(subject);
                String name = s.attribute(SqlStatement.ATTR_PARTITION);
                if (table.partitions.containsKey(name.toUpperCase(Locale.ROOT))) {
                    throw new SQLException("ORA-14074: partition bound must collate higher than that of the last partition");
                }
                table.addPartition(name, s.attribute(SqlStatement.ATTR_BOUND));
                return 0;
            }
            case DROP_PARTITION: {
                Table table = require(subject);
                String name = s.attribute(SqlStatement.ATTR_PARTITION);
                if (table.partitions.remove(name.toUpperCase(Locale.ROOT)) == null) {
                    throw new SQLException("ORA-02149: partition " + name + " does not exist");
                }
                return 0;
            }
            default:
                throw new SQLException("Unsupported statement " + s.describe());
        }
    }

    private boolean exists(QualifiedName name, ObjectKind kind) {
        switch (kind) {
            case TABLE:
                return tables.containsKey(name);
            case VIEW:
                return views.containsKey(name);
            default:
                return triggers.containsKey(name);
        }
    }

    private List<Map<String, Object>> viewRows(QualifiedName view) throws SQLException {
        List<QualifiedName> parts = views.get(view);
        Table shadow = require(parts.get(0));
        Table retired = require(parts.get(1));
        List<Map<String, Object>> rows = new ArrayList<>(shadow.allRows().values());
        for (Map<String, Object> row : retired.allRows().values()) {
            if (!shadow.containsKey(row)) {
                rows.add(row);
            }
        }
        return rows;
    }

    private void invalidateDependents(QualifiedName referenced) {
        for (Dependent d : dependents) {
            if (d.referenced.equals(referenced)) {
                d.status = "INVALID";
            }
        }
    }

    private Table require(QualifiedName name) throws SQLException {
        Table table = tables.get(name);
        if (table == null) {
            throw missing(name);
        }
        return table;
    }

    private static SQLException missing(QualifiedName name) {
        return new SQLException("ORA-00942: table or view does not exist: " + name);
    }

    private static List<ResultRow> count(long n) {
        return Collections.singletonList(ResultRow.of(SqlDialect.COL_COUNT, n));
    }

    private static List<String> split(String csv) {
        if (csv == null || csv.isEmpty()) {
            return Collections.emptyList();
        }
        return Arrays.asList(csv.split(","));
    }

    /**
     * A simulated table. Unpartitioned tables keep their rows in one hidden bucket.
     */
    public static final class Table {
        private QualifiedName name;
        private final List<String> columns;
        private final List<String> primaryKey;
        private final Map<String, Partition> partitions = new LinkedHashMap<>();
        private final Map<String, Object[]> indexes = new LinkedHashMap<>();
        private final List<String[]> grants = new ArrayList<>();
        private final List<String[]> constraints = new ArrayList<>();

        private Table(QualifiedName name, List<String> columns, List<String> primaryKey) {
            this.name = name;
            this.columns = columns.stream().map(c -> c.toUpperCase(Locale.ROOT)).collect(Collectors.toList());
            this.primaryKey = primaryKey.stream().map(c -> c.toUpperCase(Locale.ROOT)).collect(Collectors.toList());
            partitions.put(DEFAULT_BUCKET, new Partition(DEFAULT_BUCKET, null));
        }

        public Table addPartition(String partition, String bound) {
            Partition bucket = partitions.get(DEFAULT_BUCKET);
            if (bucket != null && bucket.rows.isEmpty()) {
                partitions.remove(DEFAULT_BUCKET);
            }
            partitions.put(partition.toUpperCase(Locale.ROOT), new Partition(partition.toUpperCase(Locale.ROOT), bound));
            return this;
        }

        /**
         * Insert rows with ids {@code from..to} inclusive into the given
         * partition, or the default bucket when null.
         */
        public Table rows(String partition, int from, int to) {
            Partition target = partition(partition == null ? DEFAULT_BUCKET : partition);
            for (int id = from; id <= to; id++) {
                Map<String, Object> row = new LinkedHashMap<>();
                for (String column : columns) {
                    row.put(column, primaryKey.contains(column) ? (Object) (long) id : column.toLowerCase() + "-" + id);
                }
                target.rows.put(key(row), row);
            }
            return this;
        }

        public Table rows(int from, int to) {
            return rows(firstPartitionName(), from, to);
        }

        public Table index(String indexName, boolean unique, String... indexColumns) {
            indexes.put(indexName.toUpperCase(Locale.ROOT), new Object[]{indexName, unique, Arrays.asList(indexColumns)});
            return this;
        }

        public Table grant(String grantee, String privilege, boolean grantable) {
            grants.add(new String[]{grantee, privilege, grantable ? "YES" : "NO"});
            return this;
        }

        public Table constraint(String constraintName, String type, String status) {
            constraints.add(new String[]{constraintName, type, status});
            return this;
        }

        public List<String> partitionNames() {
            return partitions.keySet().stream().filter(p -> !p.isEmpty()).collect(Collectors.toList());
        }

        public long partitionRowCount(String partition) {
            return partition(partition).rows.size();
        }

        public String partitionBound(String partition) {
            return partition(partition).bound;
        }

        public List<String> grantees() {
            return grants.stream().map(g -> g[0] + ":" + g[1]).collect(Collectors.toList());
        }

        public List<String> indexNames() {
            return indexes.values().stream().map(i -> (String) i[0]).collect(Collectors.toList());
        }

        public long rowCount() {
            return partitions.values().stream().mapToLong(p -> p.rows.size()).sum();
        }

        public boolean containsId(long id) {
            return partitions.values().stream().anyMatch(p -> p.rows.containsKey(Collections.singletonList((Object) id)));
        }

        private String firstPartitionName() {
            return partitions.keySet().iterator().next();
        }

        private Partition partition(String partition) {
            Partition p = partitions.get(partition.toUpperCase(Locale.ROOT));
            if (p == null) {
                throw new IllegalStateException("No partition " + partition + " in " + name);
            }
            return p;
        }

        private Map<List<Object>, Map<String, Object>> allRows() {
            Map<List<Object>, Map<String, Object>> all = new LinkedHashMap<>();
            partitions.values().forEach(p -> all.putAll(p.rows));
            return all;
        }

        private boolean containsKey(Map<String, Object> row) {
            List<Object> key = key(row);
            return partitions.values().stream().anyMatch(p -> p.rows.containsKey(key));
        }

        private void put(Map<String, Object> row) {
            partitions.values().iterator().next().rows.put(key(row), new LinkedHashMap<>(row));
        }

        private List<Object> key(Map<String, Object> row) {
            List<Object> key = new ArrayList<>();
            for (String column : primaryKey) {
                Object value = row.get(column);
                key.add(value instanceof Number ? (Object) ((Number) value).longValue() : value);
            }
            return key;
        }

        private List<ResultRow> columnRows() {
            List<ResultRow> rows = new ArrayList<>();
            for (int i = 0; i < columns.size(); i++) {
                String column = columns.get(i);
                rows.add(ResultRow.of(
                    SqlDialect.COL_COLUMN_NAME, column,
                    SqlDialect.COL_DATA_TYPE, primaryKey.contains(column) ? "NUMBER(19,0)" : "VARCHAR2(64)",
                    SqlDialect.COL_NULLABLE, primaryKey.contains(column) ? "N" : "Y",
                    SqlDialect.COL_POSITION, i + 1));
            }
            return rows;
        }

        private List<ResultRow> primaryKeyRows() {
            List<ResultRow> rows = new ArrayList<>();
            for (int i = 0; i < primaryKey.size(); i++) {
                rows.add(ResultRow.of(SqlDialect.COL_COLUMN_NAME, primaryKey.get(i), SqlDialect.COL_POSITION, i + 1));
            }
            return rows;
        }

        @SuppressWarnings("unchecked")
        private List<ResultRow> indexRows() {
            List<ResultRow> rows = new ArrayList<>();
            for (Object[] index : indexes.values()) {
                List<String> indexColumns = (List<String>) index[2];
                for (int i = 0; i < indexColumns.size(); i++) {
                    rows.add(ResultRow.of(
                        SqlDialect.COL_INDEX_NAME, index[0],
                        SqlDialect.COL_COLUMN_NAME, indexColumns.get(i),
                        SqlDialect.COL_UNIQUENESS, (Boolean) index[1] ? "UNIQUE" : "NONUNIQUE",
                        SqlDialect.COL_POSITION, i + 1));
                }
            }
            return rows;
        }

        private List<ResultRow> grantRows() {
            return grants.stream()
                .map(g -> ResultRow.of(SqlDialect.COL_GRANTEE, g[0], SqlDialect.COL_PRIVILEGE, g[1],
                    SqlDialect.COL_GRANTABLE, g[2]))
                .collect(Collectors.toList());
        }

        private List<ResultRow> constraintRows() {
            return constraints.stream()
                .map(c -> ResultRow.of(SqlDialect.COL_CONSTRAINT_NAME, c[0], SqlDialect.COL_CONSTRAINT_TYPE, c[1],
                    SqlDialect.COL_STATUS, c[2]))
                .collect(Collectors.toList());
        }

        private List<ResultRow> partitionRows() {
            List<ResultRow> rows = new ArrayList<>();
            int position = 1;
            for (Partition p : partitions.values()) {
                if (p.name.isEmpty()) {
                    continue;
                }
                rows.add(ResultRow.of(
                    SqlDialect.COL_PARTITION_NAME, p.name,
                    SqlDialect.COL_PARTITION_POSITION, position++,
                    SqlDialect.COL_HIGH_VALUE, p.bound,
                    SqlDialect.COL_NUM_ROWS, (long) p.rows.size()));
            }
            return rows;
        }
    }

    private static final class Partition {
        private final String name;
        private final String bound;
        private Map<List<Object>, Map<String, Object>> rows = new LinkedHashMap<>();

        private Partition(String name, String bound) {
            this.name = name;
            this.bound = bound;
        }
    }

    private static final class Dependent {
        private final String owner;
        private final String name;
        private final String type;
        private final QualifiedName referenced;
        private String status = "VALID";
        private int compileCount;

        private Dependent(String owner, String name, String type, QualifiedName referenced) {
            this.owner = owner;
            this.name = name;
            this.type = type;
            this.referenced = referenced;
        }
    }

    public synchronized int compileCount(String name) {
        return dependents.stream().filter(d -> d.name.equalsIgnoreCase(name)).findFirst()
            .map(d -> d.compileCount).orElse(0);
    }

    private static final class Failure {
        private final Predicate<SqlStatement> matcher;
        private final String message;
        private final boolean once;
        private final boolean timeout;

        private Failure(Predicate<SqlStatement> matcher, String message, boolean once, boolean timeout) {
            this.matcher = matcher;
            this.message = message;
            this.once = once;
            this.timeout = timeout;
        }
    }
}
