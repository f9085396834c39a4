package com.telcobright.repartition.engine.cutover;

import com.telcobright.repartition.core.config.MigrationSettings;
import com.telcobright.repartition.core.dialect.SqlDialect;
import com.telcobright.repartition.core.dialect.SqlStatement;
import com.telcobright.repartition.core.exception.IrrecoverableCutoverException;
import com.telcobright.repartition.core.exception.MigrationException;
import com.telcobright.repartition.core.exception.TransientDatabaseException;
import com.telcobright.repartition.core.logging.Logger;
import com.telcobright.repartition.core.model.MigrationPhase;
import com.telcobright.repartition.core.model.PhysicalTable;
import com.telcobright.repartition.core.model.QualifiedName;
import com.telcobright.repartition.core.model.TableRole;
import com.telcobright.repartition.db.gateway.DatabaseGateway;
import com.telcobright.repartition.engine.bridge.BridgeManager;
import com.telcobright.repartition.engine.gate.GateKeeper;
import com.telcobright.repartition.engine.gate.Gates;
import com.telcobright.repartition.engine.run.MigrationRun;
import com.telcobright.repartition.engine.run.StepRunner;

import java.util.HashMap;
import java.util.Map;

/**
 * Swaps the shadow in under the logical name with two renames.
 *
 * <pre>
 *   (a) source  -> retired name
 *   (b) shadow  -> logical name
 * </pre>
 * Between (a) and (b) the logical name resolves to nothing. If (b) fails the
 * controller renames the retired table back; if that fails too the run is
 * aborted and flagged for an operator.
 */
public class CutoverController {

    static final String STEP_GATES = "cutover-gates";
    static final String STEP_RENAME_SOURCE = "rename-source";
    static final String STEP_RENAME_SHADOW = "rename-shadow";
    static final String STEP_COMPENSATE = "compensate-rename";

    private final DatabaseGateway gateway;
    private final SqlDialect dialect;
    private final GateKeeper gates;
    private final StepRunner steps;
    private final BridgeManager bridges;
    private final MigrationSettings settings;
    private final Logger logger;

    public CutoverController(DatabaseGateway gateway, SqlDialect dialect, GateKeeper gates, StepRunner steps,
                             BridgeManager bridges, MigrationSettings settings, Logger logger) {
        this.gateway = gateway;
        this.dialect = dialect;
        this.gates = gates;
        this.steps = steps;
        this.bridges = bridges;
        this.settings = settings;
        this.logger = logger;
    }

    public MigrationRun cutOver(MigrationRun run) {
        run.requirePhase("cutOver", MigrationPhase.BUILT);
        QualifiedName canonical = run.getIdentity().canonicalName();
        PhysicalTable source = run.getSource();
        PhysicalTable shadow = run.getShadow();
        QualifiedName retiredName = run.getRetiredName();

        gates.require(run, STEP_GATES,
            Gates.present(source.getName()),
            Gates.present(shadow.getName()),
            Gates.absent(retiredName),
            Gates.activeWriters(canonical));

        steps.execute(run, STEP_RENAME_SOURCE, gateway, dialect.renameTable(source.getName(), retiredName));
        run.transitionTo(MigrationPhase.RENAMED_SOURCE);

        SqlStatement renameShadow = dialect.renameTable(shadow.getName(), canonical);
        try {
            steps.execute(run, STEP_RENAME_SHADOW, gateway, renameShadow);
        } catch (MigrationException renameFailure) {
            throw compensate(run, source.getName(), retiredName, renameShadow, renameFailure);
        }

        run.setRetired(source.renamedTo(retiredName, TableRole.RETIRED));
        run.setShadow(shadow.renamedTo(canonical));
        run.setSource(shadow.renamedTo(canonical, TableRole.SOURCE));
        run.transitionTo(MigrationPhase.CUT_OVER);

        Map<String, Object> context = new HashMap<>();
        context.put("runId", run.getId());
        context.put("canonical", canonical.render());
        context.put("retired", retiredName.render());
        logger.logEvent(Logger.Level.INFO, "CUTOVER_COMPLETED", "Shadow is now " + canonical, context);

        if (settings.isOpenBridgeAfterCutover()) {
            bridges.open(run);
        }
        return run;
    }

    /**
     * Operator abort. Leaves every table where it is.
     */
    public MigrationRun abort(MigrationRun run, String reason) {
        run.requirePhase("abort", MigrationPhase.PLANNED, MigrationPhase.BUILT, MigrationPhase.RENAMED_SOURCE);
        run.markAborted(reason);
        logger.warn("Run " + run.getId() + " for " + run.getIdentity() + " aborted: " + reason
            + "; shadow " + run.getShadow().getName() + " left in place");
        return run;
    }

    private MigrationException compensate(MigrationRun run, QualifiedName sourceName, QualifiedName retiredName,
                                          SqlStatement failedRename, MigrationException renameFailure) {
        logger.error("Second cutover rename failed for " + run.getIdentity() + "; renaming "
            + retiredName + " back to " + sourceName, renameFailure);
        SqlStatement restore = dialect.renameTable(retiredName, sourceName);
        try {
            steps.execute(run, STEP_COMPENSATE, gateway, restore);
        } catch (MigrationException compensationFailure) {
            run.markAborted("Cutover rename and compensation both failed");
            run.flagOperatorIntervention();
            IrrecoverableCutoverException fatal = new IrrecoverableCutoverException(
                "Cutover of " + run.getIdentity() + " could not be completed or undone; "
                    + sourceName + " may not exist. Operator intervention required",
                renameFailure, run.getIdentity(), restore.describe());
            fatal.addSuppressed(compensationFailure);
            logger.error(fatal.getMessage(), compensationFailure);
            return fatal;
        }

        run.transitionTo(MigrationPhase.BUILT);
        logger.warn("Cutover of " + run.getIdentity() + " rolled back; source and shadow keep their names");
        return new TransientDatabaseException(
            "Cutover rolled back after the shadow rename failed: " + renameFailure.getMessage(),
            renameFailure, run.getIdentity(), MigrationPhase.BUILT, failedRename.describe());
    }
}
