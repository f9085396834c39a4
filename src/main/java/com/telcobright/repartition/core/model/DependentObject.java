package com.telcobright.repartition.core.model;

import java.util.Objects;

/**
 * A view, procedure, trigger or package that references a migrated table.
 */
public final class DependentObject {

    public static final String STATUS_VALID = "VALID";
    public static final String STATUS_INVALID = "INVALID";

    private final String owner;
    private final String name;
    private final String type;
    private final String status;

    public DependentObject(String owner, String name, String type, String status) {
        this.owner = Objects.requireNonNull(owner, "owner");
        this.name = Objects.requireNonNull(name, "name");
        this.type = Objects.requireNonNull(type, "type");
        this.status = status;
    }

    public String getOwner() { return owner; }
    public String getName() { return name; }
    public String getType() { return type; }
    public String getStatus() { return status; }

    public boolean isValid() {
        return STATUS_VALID.equalsIgnoreCase(status);
    }

    public DependentObject withStatus(String newStatus) {
        return new DependentObject(owner, name, type, newStatus);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof DependentObject)) return false;
        DependentObject that = (DependentObject) o;
        return owner.equals(that.owner) && name.equals(that.name) && type.equals(that.type);
    }

    @Override
    public int hashCode() {
        return Objects.hash(owner, name, type);
    }

    @Override
    public String toString() {
        return type + " " + owner + "." + name + " (" + status + ")";
    }
}
