package com.telcobright.repartition.core.event;

import com.telcobright.repartition.core.model.GateResult;
import com.telcobright.repartition.core.model.MigrationPhase;
import com.telcobright.repartition.core.model.TableIdentity;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * One step of a migration or archive cycle as seen by an operator.
 * Phase is null for archive cycles, which have no run.
 */
public final class MigrationEvent {

    private final String runId;
    private final TableIdentity identity;
    private final MigrationPhase phase;
    private final String step;
    private final StepOutcome outcome;
    private final Instant timestamp;
    private final List<GateResult> gateResults;
    private final String detail;

    public MigrationEvent(String runId, TableIdentity identity, MigrationPhase phase, String step,
                          StepOutcome outcome, List<GateResult> gateResults, String detail) {
        this.runId = Objects.requireNonNull(runId, "runId");
        this.identity = Objects.requireNonNull(identity, "identity");
        this.phase = phase;
        this.step = Objects.requireNonNull(step, "step");
        this.outcome = Objects.requireNonNull(outcome, "outcome");
        this.timestamp = Instant.now();
        this.gateResults = gateResults == null ? Collections.emptyList()
            : Collections.unmodifiableList(new ArrayList<>(gateResults));
        this.detail = detail;
    }

    public String getRunId() { return runId; }
    public TableIdentity getIdentity() { return identity; }
    public MigrationPhase getPhase() { return phase; }
    public String getStep() { return step; }
    public StepOutcome getOutcome() { return outcome; }
    public Instant getTimestamp() { return timestamp; }
    public List<GateResult> getGateResults() { return gateResults; }
    public String getDetail() { return detail; }

    @Override
    public String toString() {
        return String.format("MigrationEvent[run=%s, table=%s, phase=%s, step=%s, outcome=%s%s]",
            runId, identity, phase, step, outcome, detail == null ? "" : ", detail=" + detail);
    }
}
