package com.telcobright.repartition.engine.gate;

import com.telcobright.repartition.core.model.GateResult;
import com.telcobright.repartition.core.model.GateVerdict;
import com.telcobright.repartition.core.model.QualifiedName;

import java.sql.SQLException;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Compares the row counts of two tables with a reference count.
 *
 * A count below the reference always fails: rows deleted from the source
 * after the reference was taken look exactly like rows the backfill missed.
 * More rows than the reference only warns, since writes continue during a
 * migration. {@code expected == 0} turns the gate into a must-be-empty check.
 */
public class RowReconciliationGate implements GateCheck {

    public static final String KIND = "RowReconciliation";
    public static final String FACT_SOURCE_COUNT = "sourceCount";
    public static final String FACT_TARGET_COUNT = "targetCount";
    public static final String FACT_EXPECTED = "expected";

    private final QualifiedName source;
    private final QualifiedName target;
    private final long expected;

    public RowReconciliationGate(QualifiedName source, QualifiedName target, long expected) {
        if (expected < 0) {
            throw new IllegalArgumentException("Expected row count cannot be negative");
        }
        this.source = Objects.requireNonNull(source, "source");
        this.target = Objects.requireNonNull(target, "target");
        this.expected = expected;
    }

    @Override
    public String kind() {
        return KIND;
    }

    @Override
    public QualifiedName target() {
        return target;
    }

    @Override
    public GateResult evaluate(GateProbe probe) throws SQLException {
        long sourceCount = probe.countRows(source);
        long targetCount = source.equals(target) ? sourceCount : probe.countRows(target);

        Map<String, Object> facts = new LinkedHashMap<>();
        facts.put(FACT_SOURCE_COUNT, sourceCount);
        facts.put(FACT_TARGET_COUNT, targetCount);
        facts.put(FACT_EXPECTED, expected);

        GateVerdict verdict = verdict(sourceCount, targetCount, expected);
        String detail = describe(verdict, sourceCount, targetCount);
        return new GateResult(KIND, target, verdict, detail, facts);
    }

    /**
     * The verdict as a pure function of the counts.
     */
    static GateVerdict verdict(long sourceCount, long targetCount, long expected) {
        if (targetCount == 0 && (sourceCount > 0 || expected > 0)) {
            return GateVerdict.FAIL;
        }
        if (expected == 0) {
            return targetCount == 0 ? GateVerdict.PASS : GateVerdict.FAIL;
        }
        if (sourceCount < expected || targetCount < expected) {
            return GateVerdict.FAIL;
        }
        if (sourceCount == expected && targetCount == expected) {
            return GateVerdict.PASS;
        }
        return GateVerdict.WARN;
    }

    private String describe(GateVerdict verdict, long sourceCount, long targetCount) {
        String counts = String.format("%s=%d, %s=%d, expected=%d", source, sourceCount, target, targetCount, expected);
        switch (verdict) {
            case PASS:
                return "counts match: " + counts;
            case WARN:
                return "more rows than expected: " + counts;
            default:
                if (expected == 0) {
                    return "must be empty: " + counts;
                }
                return targetCount == 0 ? "target is empty: " + counts : "fewer rows than expected: " + counts;
        }
    }
}
