package com.telcobright.repartition.core.exception;

import com.telcobright.repartition.core.model.GateResult;
import com.telcobright.repartition.core.model.MigrationPhase;
import com.telcobright.repartition.core.model.TableIdentity;

/**
 * Base class for every failure the engine raises. Carries enough context for
 * an operator to find where a run stopped: the table, the phase it was in, the
 * statement that failed and the gate that refused to proceed.
 */
public class MigrationException extends RuntimeException {

    private final TableIdentity identity;
    private final MigrationPhase phase;
    private final String failedStatement;
    private final GateResult failedGate;

    public MigrationException(String message) {
        this(message, null, null, null, null, null);
    }

    public MigrationException(String message, Throwable cause) {
        this(message, cause, null, null, null, null);
    }

    protected MigrationException(String message, Throwable cause, TableIdentity identity,
                                 MigrationPhase phase, String failedStatement, GateResult failedGate) {
        super(message, cause);
        this.identity = identity;
        this.phase = phase;
        this.failedStatement = failedStatement;
        this.failedGate = failedGate;
    }

    public TableIdentity getIdentity() { return identity; }
    public MigrationPhase getPhase() { return phase; }
    public String getFailedStatement() { return failedStatement; }
    public GateResult getFailedGate() { return failedGate; }

    @Override
    public String getMessage() {
        StringBuilder sb = new StringBuilder(super.getMessage());
        if (identity != null) {
            sb.append(" [table=").append(identity);
            if (phase != null) {
                sb.append(", phase=").append(phase);
            }
            sb.append(']');
        }
        return sb.toString();
    }
}
