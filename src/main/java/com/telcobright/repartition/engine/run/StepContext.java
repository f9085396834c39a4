package com.telcobright.repartition.engine.run;

import com.telcobright.repartition.core.model.MigrationPhase;
import com.telcobright.repartition.core.model.TableIdentity;

/**
 * What a step reports about the unit of work it belongs to.
 */
public interface StepContext {

    String getRunId();

    TableIdentity getIdentity();

    /**
     * Current phase, or null outside a migration run.
     */
    MigrationPhase getPhase();

    CancellationSignal getCancellation();
}
