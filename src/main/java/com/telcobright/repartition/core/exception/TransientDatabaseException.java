package com.telcobright.repartition.core.exception;

import com.telcobright.repartition.core.model.MigrationPhase;
import com.telcobright.repartition.core.model.TableIdentity;

/**
 * A statement failed in a way that leaves the run consistent; the step may be
 * retried.
 */
public class TransientDatabaseException extends MigrationException {

    public TransientDatabaseException(String message, Throwable cause) {
        super(message, cause);
    }

    public TransientDatabaseException(String message, Throwable cause, TableIdentity identity,
                                      MigrationPhase phase, String failedStatement) {
        super(message, cause, identity, phase, failedStatement, null);
    }
}
