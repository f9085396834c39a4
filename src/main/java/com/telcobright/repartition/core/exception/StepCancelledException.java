package com.telcobright.repartition.core.exception;

import com.telcobright.repartition.core.model.MigrationPhase;
import com.telcobright.repartition.core.model.TableIdentity;

/**
 * The operator cancelled a long-running step; it stopped at a batch boundary.
 */
public class StepCancelledException extends MigrationException {

    public StepCancelledException(String message, TableIdentity identity, MigrationPhase phase) {
        super(message, null, identity, phase, null, null);
    }
}
