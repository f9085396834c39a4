package com.telcobright.repartition.engine.gate;

import com.telcobright.repartition.core.model.QualifiedName;

/**
 * Shorthand constructors for the gate checks.
 */
public final class Gates {

    private Gates() {
    }

    public static GateCheck present(QualifiedName table) {
        return new ExistenceGate(table, Expectation.PRESENT);
    }

    public static GateCheck absent(QualifiedName table) {
        return new ExistenceGate(table, Expectation.ABSENT);
    }

    public static GateCheck rowReconciliation(QualifiedName source, QualifiedName target, long expected) {
        return new RowReconciliationGate(source, target, expected);
    }

    /**
     * Must-be-empty check.
     */
    public static GateCheck empty(QualifiedName table) {
        return new RowReconciliationGate(table, table, 0);
    }

    public static GateCheck constraintState(QualifiedName table) {
        return new ConstraintStateGate(table);
    }

    public static GateCheck activeWriters(QualifiedName table) {
        return new ActiveWritersGate(table);
    }

    public static GateCheck partitionDistribution(QualifiedName table) {
        return new PartitionDistributionGate(table);
    }
}
