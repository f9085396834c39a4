package com.telcobright.repartition.engine.exchange;

import com.telcobright.repartition.core.model.ArchiveCycle;
import com.telcobright.repartition.core.model.MigrationPhase;
import com.telcobright.repartition.core.model.TableIdentity;
import com.telcobright.repartition.engine.run.CancellationSignal;
import com.telcobright.repartition.engine.run.StepContext;

import java.util.UUID;

/**
 * Step context of one exchange cycle. Cycles have no phase.
 */
final class ArchiveContext implements StepContext {

    private final String runId = UUID.randomUUID().toString();
    private final TableIdentity identity;
    private final CancellationSignal cancellation = new CancellationSignal();

    ArchiveContext(ArchiveCycle cycle) {
        this.identity = TableIdentity.of(cycle.getActiveTable().getSchema(), cycle.getActiveTable().getName());
    }

    @Override
    public String getRunId() {
        return runId;
    }

    @Override
    public TableIdentity getIdentity() {
        return identity;
    }

    @Override
    public MigrationPhase getPhase() {
        return null;
    }

    @Override
    public CancellationSignal getCancellation() {
        return cancellation;
    }
}
