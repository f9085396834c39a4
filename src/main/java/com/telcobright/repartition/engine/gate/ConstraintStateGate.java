package com.telcobright.repartition.engine.gate;

import com.telcobright.repartition.core.model.ConstraintInfo;
import com.telcobright.repartition.core.model.GateResult;
import com.telcobright.repartition.core.model.QualifiedName;

import java.sql.SQLException;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * FAIL on constraint data the engine cannot interpret or on a missing table,
 * WARN when integrity constraints are disabled. Deciding whether to enable
 * them is left to the caller.
 */
public class ConstraintStateGate implements GateCheck {

    public static final String KIND = "ConstraintState";
    public static final String FACT_DISABLED = "disabled";
    public static final String FACT_UNRECOGNISED = "unrecognised";
    public static final String FACT_TOTAL = "total";

    private final QualifiedName table;

    public ConstraintStateGate(QualifiedName table) {
        this.table = Objects.requireNonNull(table, "table");
    }

    @Override
    public String kind() {
        return KIND;
    }

    @Override
    public QualifiedName target() {
        return table;
    }

    @Override
    public GateResult evaluate(GateProbe probe) throws SQLException {
        if (!probe.tableExists(table)) {
            return GateResult.fail(KIND, table, table + " does not exist; no constraint data", null);
        }
        List<ConstraintInfo> constraints = probe.constraints(table);
        List<String> unrecognised = constraints.stream()
            .filter(c -> !c.isRecognised())
            .map(c -> c.getName() + "(" + c.getRawType() + "/" + c.getRawStatus() + ")")
            .collect(Collectors.toList());
        List<String> disabled = constraints.stream()
            .filter(ConstraintInfo::isRecognised)
            .filter(c -> c.getStatus() == ConstraintInfo.Status.DISABLED)
            .map(ConstraintInfo::getName)
            .collect(Collectors.toList());

        Map<String, Object> facts = new LinkedHashMap<>();
        facts.put(FACT_TOTAL, constraints.size());
        facts.put(FACT_DISABLED, disabled);
        facts.put(FACT_UNRECOGNISED, unrecognised);

        if (!unrecognised.isEmpty()) {
            return GateResult.fail(KIND, table, "unrecognised constraint state: " + unrecognised, facts);
        }
        if (!disabled.isEmpty()) {
            return GateResult.warn(KIND, table, "disabled constraints: " + disabled, facts);
        }
        return GateResult.pass(KIND, table, constraints.size() + " constraint(s) enabled", facts);
    }
}
