package com.telcobright.repartition.engine.gate;

import com.telcobright.repartition.core.model.GateResult;
import com.telcobright.repartition.core.model.QualifiedName;

import java.sql.SQLException;
import java.util.Collections;
import java.util.Map;
import java.util.Objects;

public class ExistenceGate implements GateCheck {

    public static final String KIND = "Existence";
    public static final String FACT_EXISTS = "exists";

    private final QualifiedName table;
    private final Expectation expectation;

    public ExistenceGate(QualifiedName table, Expectation expectation) {
        this.table = Objects.requireNonNull(table, "table");
        this.expectation = Objects.requireNonNull(expectation, "expectation");
    }

    @Override
    public String kind() {
        return KIND;
    }

    @Override
    public QualifiedName target() {
        return table;
    }

    public Expectation getExpectation() {
        return expectation;
    }

    @Override
    public GateResult evaluate(GateProbe probe) throws SQLException {
        boolean exists = probe.tableExists(table);
        Map<String, Object> facts = Collections.singletonMap(FACT_EXISTS, exists);
        boolean satisfied = (expectation == Expectation.PRESENT) == exists;
        String detail = table + (exists ? " exists" : " does not exist") + ", required " + expectation;
        return satisfied
            ? GateResult.pass(KIND, table, detail, facts)
            : GateResult.fail(KIND, table, detail, facts);
    }
}
