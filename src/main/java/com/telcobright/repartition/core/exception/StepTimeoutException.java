package com.telcobright.repartition.core.exception;

import com.telcobright.repartition.core.model.MigrationPhase;
import com.telcobright.repartition.core.model.TableIdentity;

/**
 * A statement ran longer than the step timeout and was cancelled by the driver.
 */
public class StepTimeoutException extends TransientDatabaseException {

    public StepTimeoutException(String message, Throwable cause, TableIdentity identity,
                                MigrationPhase phase, String failedStatement) {
        super(message, cause, identity, phase, failedStatement);
    }
}
