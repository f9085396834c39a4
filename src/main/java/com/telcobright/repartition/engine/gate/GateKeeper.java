package com.telcobright.repartition.engine.gate;

import com.telcobright.repartition.core.exception.PreconditionFailedException;
import com.telcobright.repartition.core.exception.TransientDatabaseException;
import com.telcobright.repartition.core.model.GateResult;
import com.telcobright.repartition.engine.run.MigrationRun;
import com.telcobright.repartition.engine.run.StepContext;
import com.telcobright.repartition.engine.run.StepRunner;

import java.util.Arrays;
import java.util.List;
import java.util.Optional;

/**
 * Runs gates on behalf of a step: evaluates them together, records them on
 * the run, publishes them and, for {@link #require}, refuses to continue on
 * the first FAIL.
 */
public class GateKeeper {

    private final GateEngine engine;
    private final StepRunner steps;

    public GateKeeper(GateEngine engine, StepRunner steps) {
        this.engine = engine;
        this.steps = steps;
    }

    public GateEngine getEngine() {
        return engine;
    }

    /**
     * @throws TransientDatabaseException bound to the step's table and phase
     *         when a gate query cannot be evaluated
     */
    public List<GateResult> check(StepContext context, String step, GateCheck... checks) {
        List<GateResult> results;
        try {
            results = engine.runAll(Arrays.asList(checks));
        } catch (TransientDatabaseException e) {
            throw steps.gateError(context, step, e);
        }
        if (context instanceof MigrationRun) {
            ((MigrationRun) context).recordGates(results);
        }
        steps.reportGates(context, step, results);
        return results;
    }

    /**
     * @throws PreconditionFailedException naming the first failing gate
     */
    public List<GateResult> require(StepContext context, String step, GateCheck... checks) {
        List<GateResult> results = check(context, step, checks);
        Optional<GateResult> failure = GateEngine.firstFailure(results);
        if (failure.isPresent()) {
            GateResult failed = failure.get();
            throw new PreconditionFailedException(
                step + " refused: " + failed.getKind() + " " + failed.getDetail(),
                context.getIdentity(), context.getPhase(), failed);
        }
        return results;
    }
}
