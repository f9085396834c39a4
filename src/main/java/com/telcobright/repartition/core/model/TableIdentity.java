package com.telcobright.repartition.core.model;

import java.util.Objects;

/**
 * The name external clients use for a table. It stays fixed for the whole
 * migration and must resolve to exactly one physical table at every committed
 * instant, except between the two cutover renames.
 */
public final class TableIdentity {

    private final QualifiedName qualifiedName;

    private TableIdentity(QualifiedName qualifiedName) {
        this.qualifiedName = qualifiedName;
    }

    public static TableIdentity of(String schema, String logicalName) {
        return new TableIdentity(QualifiedName.of(schema, logicalName));
    }

    public String getSchema() { return qualifiedName.getSchema(); }
    public String getLogicalName() { return qualifiedName.getName(); }

    /**
     * The canonical object name.
     */
    public QualifiedName canonicalName() {
        return qualifiedName;
    }

    /**
     * A sibling object in the same schema named {@code logicalName + suffix}.
     */
    public QualifiedName suffixed(String suffix) {
        return qualifiedName.withName(Identifiers.withSuffix(getLogicalName(), suffix));
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof TableIdentity)) return false;
        return qualifiedName.equals(((TableIdentity) o).qualifiedName);
    }

    @Override
    public int hashCode() {
        return Objects.hash(qualifiedName);
    }

    @Override
    public String toString() {
        return qualifiedName.render();
    }
}
