package com.telcobright.repartition.core.dialect;

import com.telcobright.repartition.core.model.QualifiedName;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * A rendered statement: operation tag, SQL text, positional bind parameters
 * and the objects it touches.
 *
 * Subject order is fixed per operation:
 * <ul>
 *   <li>RENAME_TABLE: from, to</li>
 *   <li>BACKFILL: source, target</li>
 *   <li>CREATE_BRIDGE_VIEW: view, shadow, retired</li>
 *   <li>CREATE_BRIDGE_TRIGGER: trigger, view, shadow</li>
 *   <li>EXCHANGE_PARTITION: partitioned table, exchanged table</li>
 *   <li>LIST_DEPENDENTS: canonical table, retired table</li>
 *   <li>everything else: the single object operated on</li>
 * </ul>
 */
public final class SqlStatement {

    public static final String ATTR_OBJECT_KIND = "objectKind";
    public static final String ATTR_PARTITION = "partition";
    public static final String ATTR_BOUND = "bound";
    public static final String ATTR_PATTERN = "pattern";
    public static final String ATTR_INDEX = "index";
    public static final String ATTR_CONSTRAINT = "constraint";
    public static final String ATTR_GRANTEE = "grantee";
    public static final String ATTR_PRIVILEGE = "privilege";
    public static final String ATTR_OBJECT_TYPE = "objectType";
    public static final String ATTR_COLUMNS = "columns";
    public static final String ATTR_PRIMARY_KEY = "primaryKey";

    private final Operation operation;
    private final String sql;
    private final List<Object> parameters;
    private final List<QualifiedName> subjects;
    private final Map<String, String> attributes;

    private SqlStatement(Builder builder) {
        this.operation = builder.operation;
        this.sql = builder.sql;
        this.parameters = Collections.unmodifiableList(new ArrayList<>(builder.parameters));
        this.subjects = Collections.unmodifiableList(new ArrayList<>(builder.subjects));
        this.attributes = Collections.unmodifiableMap(new LinkedHashMap<>(builder.attributes));
    }

    public static Builder builder(Operation operation) {
        return new Builder(operation);
    }

    public Operation getOperation() { return operation; }
    public String getSql() { return sql; }
    public List<Object> getParameters() { return parameters; }
    public List<QualifiedName> getSubjects() { return subjects; }
    public Map<String, String> getAttributes() { return attributes; }

    public QualifiedName subject(int index) {
        if (index >= subjects.size()) {
            throw new IllegalStateException(operation + " has no subject #" + index);
        }
        return subjects.get(index);
    }

    public String attribute(String key) {
        return attributes.get(key);
    }

    /**
     * Same statement with the given bind values in place of the current ones.
     */
    public SqlStatement withParameters(List<?> values) {
        Builder builder = new Builder(operation).sql(sql).parameters(values);
        subjects.forEach(builder::subject);
        attributes.forEach(builder::attribute);
        return builder.build();
    }

    /**
     * Short human-readable form used in logs and exception messages.
     */
    public String describe() {
        String names = subjects.stream().map(QualifiedName::render).collect(Collectors.joining(" -> "));
        String extra = attributes.containsKey(ATTR_PARTITION) ? " partition " + attributes.get(ATTR_PARTITION) : "";
        return operation + " " + names + extra;
    }

    @Override
    public String toString() {
        return describe() + ": " + sql;
    }

    public static class Builder {
        private final Operation operation;
        private String sql;
        private final List<Object> parameters = new ArrayList<>();
        private final List<QualifiedName> subjects = new ArrayList<>();
        private final Map<String, String> attributes = new LinkedHashMap<>();

        Builder(Operation operation) {
            this.operation = Objects.requireNonNull(operation, "operation");
        }

        public Builder sql(String sql) {
            this.sql = sql;
            return this;
        }

        public Builder parameter(Object value) {
            this.parameters.add(value);
            return this;
        }

        public Builder parameters(List<?> values) {
            this.parameters.addAll(values);
            return this;
        }

        public Builder subject(QualifiedName name) {
            this.subjects.add(Objects.requireNonNull(name, "subject"));
            return this;
        }

        public Builder attribute(String key, String value) {
            if (value != null) {
                this.attributes.put(key, value);
            }
            return this;
        }

        public SqlStatement build() {
            if (sql == null || sql.trim().isEmpty()) {
                throw new IllegalStateException("SQL text is required for " + operation);
            }
            if (subjects.isEmpty()) {
                throw new IllegalStateException("At least one subject is required for " + operation);
            }
            return new SqlStatement(this);
        }
    }
}
