package com.telcobright.repartition.engine.bridge;

import com.telcobright.repartition.core.config.MigrationSettings;
import com.telcobright.repartition.core.config.RoutingMode;
import com.telcobright.repartition.core.dialect.ObjectKind;
import com.telcobright.repartition.core.dialect.SqlDialect;
import com.telcobright.repartition.core.exception.ConfigurationException;
import com.telcobright.repartition.core.exception.PreconditionFailedException;
import com.telcobright.repartition.core.logging.Logger;
import com.telcobright.repartition.core.model.Identifiers;
import com.telcobright.repartition.core.model.MigrationPhase;
import com.telcobright.repartition.core.model.QualifiedName;
import com.telcobright.repartition.core.model.TableIdentity;
import com.telcobright.repartition.core.model.TableMetadata;
import com.telcobright.repartition.db.gateway.DatabaseGateway;
import com.telcobright.repartition.engine.gate.GateKeeper;
import com.telcobright.repartition.engine.gate.Gates;
import com.telcobright.repartition.engine.run.MigrationRun;
import com.telcobright.repartition.engine.run.StepContext;
import com.telcobright.repartition.engine.run.StepRunner;

/**
 * Opens and closes the bridge between the new canonical table and the
 * retired one.
 *
 * Reads go through a UNION ALL view that prefers the canonical row for a key
 * present in both tables. Writes go through a {@link WriteRouter}: an INSTEAD
 * OF trigger where the database supports it, the application otherwise.
 */
public class BridgeManager {

    static final String STEP_OPEN = "open-bridge";
    static final String STEP_CLOSE = "close-bridge";

    private final DatabaseGateway gateway;
    private final SqlDialect dialect;
    private final GateKeeper gates;
    private final StepRunner steps;
    private final MigrationSettings settings;
    private final Logger logger;

    public BridgeManager(DatabaseGateway gateway, SqlDialect dialect, GateKeeper gates, StepRunner steps,
                         MigrationSettings settings, Logger logger) {
        this.gateway = gateway;
        this.dialect = dialect;
        this.gates = gates;
        this.steps = steps;
        this.settings = settings;
        this.logger = logger;
    }

    /**
     * Open the bridge for a run that has just been cut over.
     */
    public Bridge open(MigrationRun run) {
        run.requirePhase("openBridge", MigrationPhase.CUT_OVER);
        if (run.getRetired() == null || run.getSourceMetadata() == null) {
            throw new PreconditionFailedException("Run has no retired table to bridge", run.getIdentity(), run.getPhase());
        }
        TableIdentity identity = run.getIdentity();
        QualifiedName canonical = identity.canonicalName();
        QualifiedName retired = run.getRetired().getName();
        TableMetadata metadata = run.getSourceMetadata();

        gates.require(run, STEP_OPEN, Gates.present(canonical), Gates.present(retired));

        RoutingMode routing = resolveRouting(identity);
        QualifiedName view = viewName(identity);
        steps.execute(run, STEP_OPEN + ":view", gateway,
            dialect.createBridgeView(view, canonical, retired, metadata.getPrimaryKey()));

        QualifiedName trigger = null;
        if (routing == RoutingMode.NATIVE_TRIGGER) {
            trigger = triggerName(identity);
            steps.execute(run, STEP_OPEN + ":trigger", gateway,
                dialect.createBridgeTrigger(trigger, view, canonical, metadata.getColumnNames()));
        }

        Bridge bridge = new Bridge(identity, view, canonical, retired, routing, trigger,
            metadata.getColumnNames(), run.getClock().instant());
        run.setBridge(bridge);
        run.transitionTo(MigrationPhase.BRIDGED);
        logger.info("Opened " + bridge);
        return bridge;
    }

    /**
     * Remove the write router, then the view. Safe to call repeatedly.
     */
    public void close(StepContext context, Bridge bridge) {
        QualifiedName trigger = bridge.getTrigger();
        if (trigger != null && exists(context, trigger, ObjectKind.TRIGGER)) {
            steps.execute(context, STEP_CLOSE + ":trigger", gateway, dialect.dropTrigger(trigger));
        }
        if (exists(context, bridge.getReadView(), ObjectKind.VIEW)) {
            steps.execute(context, STEP_CLOSE + ":view", gateway, dialect.dropView(bridge.getReadView()));
        } else {
            logger.debug("Bridge view " + bridge.getReadView() + " already gone");
        }
        logger.info("Closed " + bridge);
    }

    /**
     * Router for writes against an open bridge.
     */
    public WriteRouter router(Bridge bridge) {
        if (bridge.getRouting() == RoutingMode.NATIVE_TRIGGER) {
            return new TriggerWriteRouter(bridge, gateway, dialect, steps.getStepTimeout(), logger);
        }
        return new ApplicationWriteRouter(bridge, gateway, dialect, steps.getStepTimeout(), logger);
    }

    RoutingMode resolveRouting(TableIdentity identity) {
        RoutingMode requested = settings.getRoutingMode();
        switch (requested) {
            case NATIVE_TRIGGER:
                if (!dialect.supportsNativeWriteRouting()) {
                    throw new ConfigurationException(dialect.getDatabaseType().getDisplayName()
                        + " cannot route bridge writes with a trigger", identity, MigrationPhase.CUT_OVER);
                }
                return requested;
            case APPLICATION_PROXY:
                return requested;
            default:
                return dialect.supportsNativeWriteRouting() ? RoutingMode.NATIVE_TRIGGER : RoutingMode.APPLICATION_PROXY;
        }
    }

    QualifiedName viewName(TableIdentity identity) {
        return identity.suffixed(settings.getBridgeViewSuffix());
    }

    QualifiedName triggerName(TableIdentity identity) {
        String viewName = Identifiers.withSuffix(identity.getLogicalName(), settings.getBridgeViewSuffix());
        return identity.canonicalName().withName(Identifiers.withPrefix(settings.getBridgeTriggerPrefix(), viewName));
    }

    private boolean exists(StepContext context, QualifiedName name, ObjectKind kind) {
        return steps.step(context, STEP_CLOSE + ":inspect", () ->
            gateway.query(dialect.objectExists(name, kind), steps.getStepTimeout())
                .get(0).getLong(SqlDialect.COL_COUNT) > 0);
    }
}
