package com.telcobright.repartition.core.model;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Result of one gate check.
 *
 * {@code facts} carries what the gate measured (row counts, session ids,
 * slice names) so that callers act on the same numbers the verdict was
 * based on.
 */
public final class GateResult {

    private final String kind;
    private final QualifiedName target;
    private final GateVerdict verdict;
    private final String detail;
    private final Map<String, Object> facts;
    private final Instant evaluatedAt;

    public GateResult(String kind, QualifiedName target, GateVerdict verdict, String detail,
                      Map<String, Object> facts) {
        this.kind = Objects.requireNonNull(kind, "kind");
        this.target = target;
        this.verdict = Objects.requireNonNull(verdict, "verdict");
        this.detail = detail;
        this.facts = facts == null ? Collections.emptyMap()
            : Collections.unmodifiableMap(new LinkedHashMap<>(facts));
        this.evaluatedAt = Instant.now();
    }

    public static GateResult pass(String kind, QualifiedName target, String detail, Map<String, Object> facts) {
        return new GateResult(kind, target, GateVerdict.PASS, detail, facts);
    }

    public static GateResult warn(String kind, QualifiedName target, String detail, Map<String, Object> facts) {
        return new GateResult(kind, target, GateVerdict.WARN, detail, facts);
    }

    public static GateResult fail(String kind, QualifiedName target, String detail, Map<String, Object> facts) {
        return new GateResult(kind, target, GateVerdict.FAIL, detail, facts);
    }

    public String getKind() { return kind; }
    public QualifiedName getTarget() { return target; }
    public GateVerdict getVerdict() { return verdict; }
    public String getDetail() { return detail; }
    public Map<String, Object> getFacts() { return facts; }
    public Instant getEvaluatedAt() { return evaluatedAt; }

    public boolean isPass() { return verdict == GateVerdict.PASS; }
    public boolean isWarn() { return verdict == GateVerdict.WARN; }
    public boolean isFail() { return verdict == GateVerdict.FAIL; }

    public Object fact(String key) {
        return facts.get(key);
    }

    @Override
    public String toString() {
        return String.format("%s(%s) %s: %s", kind, target, verdict, detail);
    }
}
