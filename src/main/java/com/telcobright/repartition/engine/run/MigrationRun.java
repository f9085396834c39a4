package com.telcobright.repartition.engine.run;

import com.telcobright.repartition.core.exception.PreconditionFailedException;
import com.telcobright.repartition.core.model.GateResult;
import com.telcobright.repartition.core.model.MigrationPhase;
import com.telcobright.repartition.core.model.PhysicalTable;
import com.telcobright.repartition.core.model.QualifiedName;
import com.telcobright.repartition.core.model.TableGrant;
import com.telcobright.repartition.core.model.TableIdentity;
import com.telcobright.repartition.core.model.TableMetadata;
import com.telcobright.repartition.core.partition.PartitionScheme;
import com.telcobright.repartition.engine.bridge.Bridge;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

/**
 * State of one re-partitioning migration.
 *
 * A run is mutated by one caller at a time: every operation enters through
 * {@link #exclusively(String, Supplier)} and a second concurrent caller is
 * refused rather than queued.
 */
public class MigrationRun implements StepContext {

    private final String id;
    private final TableIdentity identity;
    private final PartitionScheme targetScheme;
    private final QualifiedName retiredName;
    private final Clock clock;
    private final Instant createdAt;
    private final ReentrantLock lock = new ReentrantLock();
    private final CancellationSignal cancellation = new CancellationSignal();
    private final List<GateResult> gateResults = Collections.synchronizedList(new ArrayList<>());

    private volatile MigrationPhase phase = MigrationPhase.PLANNED;
    private volatile PhysicalTable source;
    private volatile PhysicalTable shadow;
    private volatile PhysicalTable retired;
    private volatile Bridge bridge;
    private volatile TableMetadata sourceMetadata;
    private volatile List<TableGrant> capturedGrants = Collections.emptyList();
    private volatile long sourceRowCountAtBuild = -1;
    private volatile boolean operatorIntervention;
    private volatile String abortReason;
    private volatile Instant updatedAt;
    private volatile Instant validationConfirmedAt;

    public MigrationRun(TableIdentity identity, PhysicalTable source, PhysicalTable shadow,
                        QualifiedName retiredName, PartitionScheme targetScheme, Clock clock) {
        this.id = UUID.randomUUID().toString();
        this.identity = identity;
        this.source = source;
        this.shadow = shadow;
        this.retiredName = retiredName;
        this.targetScheme = targetScheme;
        this.clock = clock;
        this.createdAt = clock.instant();
        this.updatedAt = createdAt;
    }

    /**
     * Run an operation holding the run's lock.
     *
     * @throws PreconditionFailedException if another caller is operating on the run
     */
    public <T> T exclusively(String operation, Supplier<T> action) {
        if (!lock.tryLock()) {
            throw new PreconditionFailedException(
                "Run " + id + " is busy; refusing concurrent " + operation, identity, phase);
        }
        try {
            return action.get();
        } finally {
            lock.unlock();
        }
    }

    /**
     * True while some caller holds the run's lock.
     */
    public boolean isBusy() {
        return lock.isLocked();
    }

    public void runExclusively(String operation, Runnable action) {
        exclusively(operation, () -> {
            action.run();
            return null;
        });
    }

    /**
     * Require one of the given phases.
     */
    public void requirePhase(String operation, MigrationPhase... allowed) {
        for (MigrationPhase p : allowed) {
            if (phase == p) {
                return;
            }
        }
        throw new PreconditionFailedException(
            operation + " is not allowed in phase " + phase, identity, phase);
    }

    public void transitionTo(MigrationPhase next) {
        if (!phase.canTransitionTo(next)) {
            throw new PreconditionFailedException(
                "Illegal phase transition " + phase + " -> " + next, identity, phase);
        }
        this.phase = next;
        touch();
    }

    public void recordGates(List<GateResult> results) {
        gateResults.addAll(results);
        touch();
    }

    private void touch() {
        this.updatedAt = clock.instant();
    }

    @Override
    public String getRunId() { return id; }

    @Override
    public TableIdentity getIdentity() { return identity; }

    @Override
    public MigrationPhase getPhase() { return phase; }

    @Override
    public CancellationSignal getCancellation() { return cancellation; }

    public String getId() { return id; }
    public PartitionScheme getTargetScheme() { return targetScheme; }
    public QualifiedName getRetiredName() { return retiredName; }
    public Instant getCreatedAt() { return createdAt; }
    public Instant getUpdatedAt() { return updatedAt; }
    public Clock getClock() { return clock; }

    public PhysicalTable getSource() { return source; }
    public PhysicalTable getShadow() { return shadow; }
    public PhysicalTable getRetired() { return retired; }
    public Bridge getBridge() { return bridge; }
    public TableMetadata getSourceMetadata() { return sourceMetadata; }
    public List<TableGrant> getCapturedGrants() { return capturedGrants; }
    public long getSourceRowCountAtBuild() { return sourceRowCountAtBuild; }
    public boolean isOperatorIntervention() { return operatorIntervention; }
    public String getAbortReason() { return abortReason; }
    public Instant getValidationConfirmedAt() { return validationConfirmedAt; }

    public List<GateResult> getGateResults() {
        synchronized (gateResults) {
            return Collections.unmodifiableList(new ArrayList<>(gateResults));
        }
    }

    public void setSource(PhysicalTable source) { this.source = source; touch(); }
    public void setShadow(PhysicalTable shadow) { this.shadow = shadow; touch(); }
    public void setRetired(PhysicalTable retired) { this.retired = retired; touch(); }
    public void setBridge(Bridge bridge) { this.bridge = bridge; touch(); }

    public void captureSource(TableMetadata metadata, long rowCount) {
        this.sourceMetadata = metadata;
        this.capturedGrants = Collections.unmodifiableList(new ArrayList<>(metadata.getGrants()));
        this.sourceRowCountAtBuild = rowCount;
        touch();
    }

    public void flagOperatorIntervention() {
        this.operatorIntervention = true;
        touch();
    }

    public void markAborted(String reason) {
        transitionTo(MigrationPhase.ABORTED);
        this.abortReason = reason;
    }

    public void confirmValidation() {
        this.validationConfirmedAt = clock.instant();
        touch();
    }

    @Override
    public String toString() {
        return String.format("MigrationRun[%s %s phase=%s source=%s shadow=%s]",
            id, identity, phase, source, shadow);
    }
}
