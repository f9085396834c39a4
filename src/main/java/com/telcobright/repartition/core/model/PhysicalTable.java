package com.telcobright.repartition.core.model;

import com.telcobright.repartition.core.partition.PartitionScheme;

import java.util.Objects;

/**
 * A concrete table instance: name, partitioning and the role it currently plays.
 * Immutable; renames produce a new value.
 */
public final class PhysicalTable {

    private final QualifiedName name;
    private final PartitionScheme scheme;
    private final TableRole role;

    public PhysicalTable(QualifiedName name, PartitionScheme scheme, TableRole role) {
        this.name = Objects.requireNonNull(name, "name");
        this.scheme = scheme != null ? scheme : PartitionScheme.unpartitioned();
        this.role = Objects.requireNonNull(role, "role");
    }

    public QualifiedName getName() { return name; }
    public PartitionScheme getScheme() { return scheme; }
    public TableRole getRole() { return role; }

    public PhysicalTable renamedTo(QualifiedName newName) {
        return new PhysicalTable(newName, scheme, role);
    }

    public PhysicalTable renamedTo(QualifiedName newName, TableRole newRole) {
        return new PhysicalTable(newName, scheme, newRole);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof PhysicalTable)) return false;
        PhysicalTable that = (PhysicalTable) o;
        return name.equals(that.name) && scheme.equals(that.scheme) && role == that.role;
    }

    @Override
    public int hashCode() {
        return Objects.hash(name, scheme, role);
    }

    @Override
    public String toString() {
        return role + "(" + name + ", " + scheme + ")";
    }
}
