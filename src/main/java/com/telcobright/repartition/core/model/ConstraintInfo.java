package com.telcobright.repartition.core.model;

/**
 * Integrity constraint row read for the constraint-state gate.
 * Type and status are kept as reported so unknown values can be rejected.
 */
public final class ConstraintInfo {

    public enum Type { PRIMARY_KEY, UNIQUE, FOREIGN_KEY, CHECK, UNKNOWN }

    public enum Status { ENABLED, DISABLED, UNKNOWN }

    private final String name;
    private final Type type;
    private final Status status;
    private final String rawType;
    private final String rawStatus;

    public ConstraintInfo(String name, String rawType, String rawStatus) {
        this.name = name;
        this.rawType = rawType;
        this.rawStatus = rawStatus;
        this.type = parseType(rawType);
        this.status = parseStatus(rawStatus);
    }

    private static Type parseType(String raw) {
        if (raw == null) {
            return Type.UNKNOWN;
        }
        switch (raw.trim().toUpperCase()) {
            case "P":
            case "PRIMARY KEY":
                return Type.PRIMARY_KEY;
            case "U":
            case "UNIQUE":
                return Type.UNIQUE;
            case "R":
            case "FOREIGN KEY":
                return Type.FOREIGN_KEY;
            case "C":
            case "CHECK":
                return Type.CHECK;
            default:
                return Type.UNKNOWN;
        }
    }

    private static Status parseStatus(String raw) {
        if (raw == null) {
            return Status.UNKNOWN;
        }
        switch (raw.trim().toUpperCase()) {
            case "ENABLED":
            case "YES":
                return Status.ENABLED;
            case "DISABLED":
            case "NO":
                return Status.DISABLED;
            default:
                return Status.UNKNOWN;
        }
    }

    public String getName() { return name; }
    public Type getType() { return type; }
    public Status getStatus() { return status; }
    public String getRawType() { return rawType; }
    public String getRawStatus() { return rawStatus; }

    public boolean isRecognised() {
        return type != Type.UNKNOWN && status != Status.UNKNOWN;
    }

    @Override
    public String toString() {
        return name + "(" + rawType + ", " + rawStatus + ")";
    }
}
