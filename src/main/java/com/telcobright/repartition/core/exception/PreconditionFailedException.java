package com.telcobright.repartition.core.exception;

import com.telcobright.repartition.core.model.GateResult;
import com.telcobright.repartition.core.model.MigrationPhase;
import com.telcobright.repartition.core.model.TableIdentity;

/**
 * A gate returned FAIL or the run is not in a phase that allows the request.
 * Nothing was changed by the refused step.
 */
public class PreconditionFailedException extends MigrationException {

    public PreconditionFailedException(String message) {
        super(message);
    }

    public PreconditionFailedException(String message, TableIdentity identity, MigrationPhase phase) {
        super(message, null, identity, phase, null, null);
    }

    public PreconditionFailedException(String message, TableIdentity identity, MigrationPhase phase,
                                       GateResult failedGate) {
        super(message, null, identity, phase, null, failedGate);
    }
}
