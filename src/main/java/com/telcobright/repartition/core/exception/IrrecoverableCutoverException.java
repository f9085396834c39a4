package com.telcobright.repartition.core.exception;

import com.telcobright.repartition.core.model.MigrationPhase;
import com.telcobright.repartition.core.model.TableIdentity;

/**
 * Both the second cutover rename and its compensation failed: the logical
 * name may currently resolve to no table. The run is aborted and flagged for
 * operator intervention.
 */
public class IrrecoverableCutoverException extends MigrationException {

    public IrrecoverableCutoverException(String message, Throwable cause, TableIdentity identity,
                                         String failedStatement) {
        super(message, cause, identity, MigrationPhase.ABORTED, failedStatement, null);
    }
}
