package com.telcobright.repartition.core.model;

/**
 * Outcome of a gate check, ordered by severity.
 */
public enum GateVerdict {
    PASS,
    WARN,
    FAIL;

    public boolean isFailure() {
        return this == FAIL;
    }

    public GateVerdict worst(GateVerdict other) {
        return other.ordinal() > ordinal() ? other : this;
    }
}
