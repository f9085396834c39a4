package com.telcobright.repartition.engine.run;

import com.telcobright.repartition.core.dialect.SqlStatement;
import com.telcobright.repartition.core.event.EventPublisher;
import com.telcobright.repartition.core.event.MigrationEvent;
import com.telcobright.repartition.core.event.StepOutcome;
import com.telcobright.repartition.core.exception.MigrationException;
import com.telcobright.repartition.core.exception.StepTimeoutException;
import com.telcobright.repartition.core.exception.TransientDatabaseException;
import com.telcobright.repartition.core.logging.Logger;
import com.telcobright.repartition.core.model.GateResult;
import com.telcobright.repartition.core.model.GateVerdict;
import com.telcobright.repartition.db.gateway.DatabaseGateway;

import java.sql.SQLException;
import java.sql.SQLTimeoutException;
import java.time.Duration;
import java.util.Collections;
import java.util.List;

/**
 * Runs one step: emits STARTED, runs the work, emits the outcome and turns
 * JDBC failures into the engine's exception types. Every statement issued
 * through {@link #execute} gets the step timeout.
 */
public class StepRunner {

    /**
     * Work that talks to the database.
     */
    @FunctionalInterface
    public interface SqlWork<T> {
        T run() throws SQLException;
    }

    private final EventPublisher events;
    private final Logger logger;
    private final Duration stepTimeout;

    public StepRunner(EventPublisher events, Logger logger, Duration stepTimeout) {
        this.events = events;
        this.logger = logger;
        this.stepTimeout = stepTimeout;
    }

    public Duration getStepTimeout() {
        return stepTimeout;
    }

    public <T> T step(StepContext context, String step, SqlWork<T> work) {
        return step(context, step, null, work);
    }

    /**
     * Issue a single statement as its own step.
     *
     * @return the update count
     */
    public long execute(StepContext context, String step, DatabaseGateway gateway, SqlStatement statement) {
        return step(context, step, statement, () -> gateway.execute(statement, stepTimeout));
    }

    private <T> T step(StepContext context, String step, SqlStatement statement, SqlWork<T> work) {
        publish(context, step, StepOutcome.STARTED, Collections.emptyList(),
            statement == null ? null : statement.describe());
        try {
            T result = work.run();
            publish(context, step, StepOutcome.SUCCEEDED, Collections.emptyList(), null);
            return result;
        } catch (SQLException e) {
            MigrationException wrapped = wrap(context, step, statement, e);
            publish(context, step, StepOutcome.FAILED, Collections.emptyList(), wrapped.getMessage());
            throw wrapped;
        } catch (RuntimeException e) {
            publish(context, step, StepOutcome.FAILED, Collections.emptyList(), e.getMessage());
            throw e;
        }
    }

    /**
     * Report gate results as a step of their own. The outcome follows the worst verdict.
     */
    public void reportGates(StepContext context, String step, List<GateResult> results) {
        GateVerdict worst = GateVerdict.PASS;
        for (GateResult result : results) {
            worst = worst.worst(result.getVerdict());
        }
        StepOutcome outcome;
        switch (worst) {
            case FAIL:
                outcome = StepOutcome.FAILED;
                break;
            case WARN:
                outcome = StepOutcome.WARNED;
                break;
            default:
                outcome = StepOutcome.SUCCEEDED;
        }
        publish(context, step, outcome, results, results.size() + " gate(s)");
    }

    /**
     * Report gates that could not be evaluated as a failed step and return the
     * error bound to the step's table and phase.
     */
    public TransientDatabaseException gateError(StepContext context, String step, TransientDatabaseException e) {
        TransientDatabaseException bound = e instanceof StepTimeoutException
            ? new StepTimeoutException(e.getMessage(), e.getCause(), context.getIdentity(), context.getPhase(),
                e.getFailedStatement())
            : new TransientDatabaseException(e.getMessage(), e.getCause(), context.getIdentity(),
                context.getPhase(), e.getFailedStatement());
        publish(context, step, StepOutcome.FAILED, Collections.emptyList(), bound.getMessage());
        return bound;
    }

    public void warn(StepContext context, String step, String detail) {
        publish(context, step, StepOutcome.WARNED, Collections.emptyList(), detail);
    }

    /**
     * Map a JDBC failure to the engine's hierarchy.
     */
    public static TransientDatabaseException wrap(StepContext context, String step, SqlStatement statement,
                                                  SQLException e) {
        String description = statement == null ? step : statement.describe();
        if (isTimeout(e)) {
            return new StepTimeoutException("Step " + step + " timed out: " + description, e,
                context.getIdentity(), context.getPhase(), description);
        }
        return new TransientDatabaseException("Step " + step + " failed: " + e.getMessage(), e,
            context.getIdentity(), context.getPhase(), description);
    }

    private static boolean isTimeout(SQLException e) {
        for (Throwable t = e; t != null; t = t.getCause()) {
            if (t instanceof SQLTimeoutException) {
                return true;
            }
        }
        return false;
    }

    private void publish(StepContext context, String step, StepOutcome outcome, List<GateResult> gates,
                         String detail) {
        logger.trace(step + " " + outcome + " for " + context.getIdentity());
        events.publish(new MigrationEvent(context.getRunId(), context.getIdentity(), context.getPhase(),
            step, outcome, gates, detail));
    }
}
