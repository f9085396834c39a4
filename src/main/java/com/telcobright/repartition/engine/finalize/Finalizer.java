package com.telcobright.repartition.engine.finalize;

import com.telcobright.repartition.core.config.MigrationSettings;
import com.telcobright.repartition.core.dialect.SqlDialect;
import com.telcobright.repartition.core.exception.MigrationException;
import com.telcobright.repartition.core.exception.PreconditionFailedException;
import com.telcobright.repartition.core.logging.Logger;
import com.telcobright.repartition.core.model.DependentObject;
import com.telcobright.repartition.core.model.GateResult;
import com.telcobright.repartition.core.model.MigrationPhase;
import com.telcobright.repartition.core.model.QualifiedName;
import com.telcobright.repartition.core.model.TableGrant;
import com.telcobright.repartition.db.discovery.SchemaDiscovery;
import com.telcobright.repartition.db.gateway.DatabaseGateway;
import com.telcobright.repartition.engine.bridge.Bridge;
import com.telcobright.repartition.engine.bridge.BridgeManager;
import com.telcobright.repartition.engine.gate.GateKeeper;
import com.telcobright.repartition.engine.gate.Gates;
import com.telcobright.repartition.engine.run.MigrationRegistry;
import com.telcobright.repartition.engine.run.MigrationRun;
import com.telcobright.repartition.engine.run.StepRunner;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Retires the old table once the operator has validated the new one.
 *
 * Every step is safe to repeat, so a finalize that failed half way can be
 * called again. A cutover is never attempted from here.
 */
public class Finalizer {

    static final String STEP_CLOSE_BRIDGE = "finalize-close-bridge";
    static final String STEP_DROP_RETIRED = "drop-retired";
    static final String STEP_RECOMPILE = "recompile-dependents";
    static final String STEP_GRANTS = "reapply-grants";

    private final DatabaseGateway gateway;
    private final SqlDialect dialect;
    private final SchemaDiscovery discovery;
    private final GateKeeper gates;
    private final StepRunner steps;
    private final BridgeManager bridges;
    private final MigrationRegistry registry;
    private final MigrationSettings settings;
    private final Logger logger;

    public Finalizer(DatabaseGateway gateway, SqlDialect dialect, SchemaDiscovery discovery, GateKeeper gates,
                     StepRunner steps, BridgeManager bridges, MigrationRegistry registry,
                     MigrationSettings settings, Logger logger) {
        this.gateway = gateway;
        this.dialect = dialect;
        this.discovery = discovery;
        this.gates = gates;
        this.steps = steps;
        this.bridges = bridges;
        this.registry = registry;
        this.settings = settings;
        this.logger = logger;
    }

    public FinalizeReport finalize(MigrationRun run) {
        checkPreconditions(run);
        QualifiedName canonical = run.getIdentity().canonicalName();
        QualifiedName retired = run.getRetired().getName();
        FinalizeReport.Builder report = FinalizeReport.builder(run.getId(), run.getIdentity());

        bridges.close(run, run.getBridge());

        gates.require(run, STEP_DROP_RETIRED, Gates.present(canonical));
        dropRetired(run, canonical, retired, report);

        if (dialect.supportsRecompilation()) {
            recompileDependents(run, canonical, retired, report);
        }
        reapplyGrants(run, canonical, report);

        run.transitionTo(MigrationPhase.FINALIZED);
        registry.archive(run);
        FinalizeReport result = report.build(run.getClock().instant());
        if (result.isClean()) {
            logger.info("Finalized " + run.getIdentity() + ": " + result);
        } else {
            logger.warn("Finalized " + run.getIdentity() + " with problems: " + result
                + " stillInvalid=" + result.getStillInvalid() + " grantsFailed=" + result.getGrantsFailed().keySet());
        }
        return result;
    }

    private void checkPreconditions(MigrationRun run) {
        run.requirePhase("finalize", MigrationPhase.BRIDGED);
        Bridge bridge = run.getBridge();
        if (bridge == null || run.getRetired() == null) {
            throw new PreconditionFailedException("Run has no open bridge", run.getIdentity(), run.getPhase());
        }
        if (run.getValidationConfirmedAt() == null) {
            throw new PreconditionFailedException(
                "Validation of " + run.getIdentity() + " has not been confirmed", run.getIdentity(), run.getPhase());
        }
        Instant now = run.getClock().instant();
        Duration open = Duration.between(bridge.getOpenedAt(), now);
        if (open.compareTo(settings.getValidationWindow()) < 0) {
            throw new PreconditionFailedException(String.format(
                "Bridge open for %s; validation window of %s has not elapsed", open, settings.getValidationWindow()),
                run.getIdentity(), run.getPhase());
        }
    }

    private void dropRetired(MigrationRun run, QualifiedName canonical, QualifiedName retired,
                             FinalizeReport.Builder report) {
        GateResult present = gates.check(run, STEP_DROP_RETIRED, Gates.present(retired)).get(0);
        if (!present.isPass()) {
            logger.info("Retired table " + retired + " already dropped");
            return;
        }
        long canonicalRows = count(run, canonical);
        long retiredRows = count(run, retired);
        if (canonicalRows < retiredRows) {
            steps.warn(run, STEP_DROP_RETIRED, String.format(
                "%s holds %d rows, fewer than %d in %s", canonical, canonicalRows, retiredRows, retired));
        }
        steps.execute(run, STEP_DROP_RETIRED, gateway, dialect.dropTable(retired));
        report.retiredDropped(canonicalRows, retiredRows);
    }

    private void recompileDependents(MigrationRun run, QualifiedName canonical, QualifiedName retired,
                                     FinalizeReport.Builder report) {
        List<DependentObject> invalid = invalidDependents(run, canonical, retired);
        if (invalid.isEmpty()) {
            return;
        }
        for (DependentObject object : invalid) {
            try {
                steps.execute(run, STEP_RECOMPILE + ":" + object.getName(), gateway, dialect.recompile(object));
                report.recompiled(object);
            } catch (MigrationException | IllegalArgumentException e) {
                logger.warn("Could not recompile " + object + ": " + e.getMessage());
            }
        }
        Set<DependentObject> attempted = invalid.stream().collect(Collectors.toSet());
        List<DependentObject> remaining = invalidDependents(run, canonical, retired).stream()
            .filter(attempted::contains)
            .collect(Collectors.toList());
        if (!remaining.isEmpty()) {
            steps.warn(run, STEP_RECOMPILE, "still invalid after recompilation: " + remaining);
        }
        report.stillInvalid(remaining);
    }

    private List<DependentObject> invalidDependents(MigrationRun run, QualifiedName canonical, QualifiedName retired) {
        return steps.step(run, STEP_RECOMPILE + "-inspect",
                () -> discovery.dependents(canonical, retired, steps.getStepTimeout()))
            .stream()
            .filter(d -> !d.isValid())
            .collect(Collectors.toList());
    }

    private void reapplyGrants(MigrationRun run, QualifiedName canonical, FinalizeReport.Builder report) {
        List<TableGrant> failed = new ArrayList<>();
        for (TableGrant grant : run.getCapturedGrants()) {
            try {
                steps.execute(run, STEP_GRANTS, gateway, dialect.grant(canonical, grant));
                report.grantApplied(grant);
            } catch (MigrationException | IllegalArgumentException e) {
                failed.add(grant);
                report.grantFailed(grant, e.getMessage());
            }
        }
        if (!failed.isEmpty()) {
            steps.warn(run, STEP_GRANTS, failed.size() + " grant(s) could not be reapplied: " + failed);
        }
    }

    private long count(MigrationRun run, QualifiedName table) {
        return steps.step(run, STEP_DROP_RETIRED + "-count", () ->
            gateway.query(dialect.countRows(table), steps.getStepTimeout()).get(0).getLong(SqlDialect.COL_COUNT));
    }
}
