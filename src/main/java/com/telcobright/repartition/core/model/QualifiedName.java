package com.telcobright.repartition.core.model;

import java.util.Objects;

/**
 * Schema-qualified database object name. The engine never relies on a
 * current/default schema, so every table, view and trigger it touches is
 * addressed through one of these.
 */
public final class QualifiedName {

    private final String schema;
    private final String name;

    private QualifiedName(String schema, String name) {
        this.schema = schema;
        this.name = name;
    }

    public static QualifiedName of(String schema, String name) {
        return new QualifiedName(
            Identifiers.requireValid(schema, "Schema"),
            Identifiers.requireValid(name, "Object name"));
    }

    public String getSchema() { return schema; }
    public String getName() { return name; }

    /**
     * Same schema, different object name.
     */
    public QualifiedName withName(String newName) {
        return of(schema, newName);
    }

    /**
     * Rendered as {@code SCHEMA.NAME} for use in statements.
     */
    public String render() {
        return schema + "." + name;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof QualifiedName)) return false;
        QualifiedName that = (QualifiedName) o;
        return schema.equalsIgnoreCase(that.schema) && name.equalsIgnoreCase(that.name);
    }

    @Override
    public int hashCode() {
        return Objects.hash(schema.toUpperCase(), name.toUpperCase());
    }

    @Override
    public String toString() {
        return render();
    }
}
