package com.telcobright.repartition;

import com.telcobright.repartition.core.config.DataSourceConfig;
import com.telcobright.repartition.core.config.MigrationSettings;
import com.telcobright.repartition.core.dialect.SqlDialect;
import com.telcobright.repartition.core.dialect.SqlDialectFactory;
import com.telcobright.repartition.core.event.EventPublisher;
import com.telcobright.repartition.core.event.LoggingEventListener;
import com.telcobright.repartition.core.event.MigrationEventListener;
import com.telcobright.repartition.core.exception.ConfigurationException;
import com.telcobright.repartition.core.exception.IrrecoverableCutoverException;
import com.telcobright.repartition.core.exception.PreconditionFailedException;
import com.telcobright.repartition.core.exception.StepCancelledException;
import com.telcobright.repartition.core.logging.Logger;
import com.telcobright.repartition.core.logging.Slf4jLogger;
import com.telcobright.repartition.core.model.ArchiveCycle;
import com.telcobright.repartition.core.model.GateResult;
import com.telcobright.repartition.core.model.MigrationPhase;
import com.telcobright.repartition.core.model.PhysicalTable;
import com.telcobright.repartition.core.model.QualifiedName;
import com.telcobright.repartition.core.model.TableIdentity;
import com.telcobright.repartition.core.model.TableRole;
import com.telcobright.repartition.core.partition.PartitionScheme;
import com.telcobright.repartition.db.discovery.DictionarySchemaDiscovery;
import com.telcobright.repartition.db.discovery.SchemaDiscovery;
import com.telcobright.repartition.db.gateway.DataSourceFactory;
import com.telcobright.repartition.db.gateway.DatabaseGateway;
import com.telcobright.repartition.db.gateway.JdbcDatabaseGateway;
import com.telcobright.repartition.engine.bridge.Bridge;
import com.telcobright.repartition.engine.bridge.BridgeManager;
import com.telcobright.repartition.engine.bridge.WriteRouter;
import com.telcobright.repartition.engine.cutover.CutoverController;
import com.telcobright.repartition.engine.exchange.ArchiveScheduler;
import com.telcobright.repartition.engine.exchange.PartitionExchangeEngine;
import com.telcobright.repartition.engine.exchange.SwapResult;
import com.telcobright.repartition.engine.finalize.FinalizeReport;
import com.telcobright.repartition.engine.finalize.Finalizer;
import com.telcobright.repartition.engine.gate.GateCheck;
import com.telcobright.repartition.engine.gate.GateEngine;
import com.telcobright.repartition.engine.gate.GateKeeper;
import com.telcobright.repartition.engine.run.MigrationRegistry;
import com.telcobright.repartition.engine.run.MigrationRun;
import com.telcobright.repartition.engine.run.StepRunner;
import com.telcobright.repartition.engine.shadow.ShadowBuilder;
import com.zaxxer.hikari.HikariDataSource;

import java.time.Clock;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Supplier;

/**
 * Entry point for online re-partitioning.
 *
 * <pre>
 * RepartitionEngine engine = RepartitionEngine.builder()
 *     .dataSource(DataSourceConfig.create(DatabaseType.ORACLE, "db1", 1521, "ORCL", "app", "secret"))
 *     .settings(MigrationSettings.builder().parallelDegree(8).build())
 *     .build();
 *
 * MigrationRun run = engine.plan(TableIdentity.of("APP", "CDR"), scheme);
 * engine.build(run.getId());
 * engine.cutOver(run.getId());
 * // production traffic through the bridge, operator validates
 * engine.confirmValidation(run.getId());
 * engine.finalize(run.getId());
 * </pre>
 *
 * Operations on one run are serialised; a second concurrent call on the same
 * run is refused with {@link PreconditionFailedException}.
 */
public class RepartitionEngine {

    private final DatabaseGateway gateway;
    private final SqlDialect dialect;
    private final MigrationSettings settings;
    private final Clock clock;
    private final Logger logger;
    private final HikariDataSource ownedDataSource;

    private final EventPublisher events;
    private final MigrationRegistry registry = new MigrationRegistry();
    private final GateEngine gateEngine;
    private final ShadowBuilder shadowBuilder;
    private final BridgeManager bridgeManager;
    private final CutoverController cutoverController;
    private final Finalizer finalizer;
    private final PartitionExchangeEngine exchangeEngine;
    private final List<ArchiveScheduler> schedulers = new CopyOnWriteArrayList<>();

    private RepartitionEngine(Builder builder) {
        this.settings = builder.settings;
        this.clock = builder.clock;
        this.logger = builder.logger != null ? builder.logger : new Slf4jLogger(RepartitionEngine.class);

        if (builder.gateway != null) {
            this.gateway = builder.gateway;
            this.dialect = builder.dialect;
            this.ownedDataSource = null;
        } else {
            this.ownedDataSource = DataSourceFactory.create(builder.dataSourceConfig);
            this.gateway = new JdbcDatabaseGateway(ownedDataSource, logger);
            this.dialect = builder.dialect != null
                ? builder.dialect
                : SqlDialectFactory.getDialect(builder.dataSourceConfig.getDatabaseType());
        }
        SchemaDiscovery discovery = builder.discovery != null
            ? builder.discovery
            : new DictionarySchemaDiscovery(gateway, dialect);

        this.events = new EventPublisher(logger);
        if (builder.logEvents) {
            events.register(new LoggingEventListener(logger));
        }
        builder.listeners.forEach(events::register);

        StepRunner steps = new StepRunner(events, logger, settings.getStepTimeout());
        this.gateEngine = new GateEngine(gateway, dialect, discovery, settings.getGateTimeout(),
            settings.getGateThreads(), logger);
        GateKeeper gates = new GateKeeper(gateEngine, steps);

        this.shadowBuilder = new ShadowBuilder(gateway, dialect, discovery, gates, steps, settings, logger);
        this.bridgeManager = new BridgeManager(gateway, dialect, gates, steps, settings, logger);
        this.cutoverController = new CutoverController(gateway, dialect, gates, steps, bridgeManager, settings, logger);
        this.finalizer = new Finalizer(gateway, dialect, discovery, gates, steps, bridgeManager, registry,
            settings, logger);
        this.exchangeEngine = new PartitionExchangeEngine(gateway, dialect, discovery, gates, steps, settings,
            registry, clock, logger);

        logger.info(String.format("RepartitionEngine ready on %s with %s",
            dialect.getDatabaseType().getDisplayName(), settings));
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Register a run that will move {@code identity} to {@code targetScheme}.
     *
     * @throws PreconditionFailedException if the table already has an active run
     * @throws ConfigurationException if the database cannot render the scheme
     */
    public MigrationRun plan(TableIdentity identity, PartitionScheme targetScheme) {
        try {
            targetScheme.getType().validateSupported(dialect.supportsIntervalPartitioning());
        } catch (UnsupportedOperationException e) {
            throw new ConfigurationException(e.getMessage(), identity, MigrationPhase.PLANNED);
        }
        QualifiedName shadowName = identity.suffixed(settings.getShadowSuffix());
        QualifiedName retiredName = identity.suffixed(settings.getRetiredSuffix());
        MigrationRun run = new MigrationRun(identity,
            new PhysicalTable(identity.canonicalName(), null, TableRole.SOURCE),
            new PhysicalTable(shadowName, targetScheme, TableRole.SHADOW),
            retiredName, targetScheme, clock);
        registry.register(run);
        logger.info("Planned " + run);
        return run;
    }

    public GateResult runGate(GateCheck check) {
        return gateEngine.run(check);
    }

    /**
     * Evaluate several gates concurrently; results are in request order.
     */
    public List<GateResult> runGates(List<GateCheck> checks) {
        return gateEngine.runAll(checks);
    }

    public PhysicalTable build(String runId) {
        MigrationRun run = requireRun(runId);
        return operate(run, "build", () -> shadowBuilder.build(run));
    }

    /**
     * Open the bridge of a run that was cut over without one.
     */
    public Bridge openBridge(String runId) {
        MigrationRun run = requireRun(runId);
        return operate(run, "openBridge", () -> bridgeManager.open(run));
    }

    /**
     * Tear down the bridge objects. The run keeps its bridge record so that
     * the validation window can still be measured; finalize closes it again
     * without effect.
     */
    public void closeBridge(String runId) {
        MigrationRun run = requireRun(runId);
        run.runExclusively("closeBridge", () -> {
            run.requirePhase("closeBridge", MigrationPhase.BRIDGED);
            bridgeManager.close(run, run.getBridge());
        });
    }

    public WriteRouter writeRouter(String runId) {
        MigrationRun run = requireRun(runId);
        if (run.getPhase() != MigrationPhase.BRIDGED || run.getBridge() == null) {
            throw new PreconditionFailedException("No open bridge", run.getIdentity(), run.getPhase());
        }
        return bridgeManager.router(run.getBridge());
    }

    public MigrationRun cutOver(String runId) {
        MigrationRun run = requireRun(runId);
        try {
            return operate(run, "cutOver", () -> cutoverController.cutOver(run));
        } catch (IrrecoverableCutoverException e) {
            registry.archive(run);
            throw e;
        }
    }

    /**
     * Record the operator's confirmation that the new table serves production
     * correctly. Finalize still waits for the validation window.
     */
    public void confirmValidation(String runId) {
        MigrationRun run = requireRun(runId);
        run.runExclusively("confirmValidation", () -> {
            run.requirePhase("confirmValidation", MigrationPhase.BRIDGED);
            run.confirmValidation();
            logger.info("Validation confirmed for " + run.getIdentity());
        });
    }

    public FinalizeReport finalize(String runId) {
        MigrationRun run = requireRun(runId);
        return operate(run, "finalize", () -> finalizer.finalize(run));
    }

    public MigrationRun abort(String runId, String reason) {
        MigrationRun run = requireRun(runId);
        return run.exclusively("abort", () -> {
            cutoverController.abort(run, reason);
            registry.archive(run);
            return run;
        });
    }

    /**
     * Ask the step currently running on the run to stop at its next batch
     * boundary. Does not wait.
     *
     * @throws PreconditionFailedException if no operation is running on the run
     */
    public void cancel(String runId) {
        MigrationRun run = requireRun(runId);
        if (!run.isBusy()) {
            throw new PreconditionFailedException("No operation running on run " + runId + " to cancel",
                run.getIdentity(), run.getPhase());
        }
        run.getCancellation().cancel();
        logger.info("Cancellation requested for " + run);
    }

    public SwapResult swapOldestSlice(ArchiveCycle cycle) {
        return exchangeEngine.swapOldestSlice(cycle);
    }

    public SwapResult swapOldestSlice(QualifiedName active, QualifiedName staging, QualifiedName history) {
        return swapOldestSlice(new ArchiveCycle(active, staging, history));
    }

    /**
     * Start a daily scheduler for the given cycles.
     *
     * @param adjustmentTime local time of day, "HH:mm"
     */
    public ArchiveScheduler scheduleArchiving(List<ArchiveCycle> cycles, String adjustmentTime) {
        ArchiveScheduler scheduler = new ArchiveScheduler(exchangeEngine, cycles, adjustmentTime, clock, logger);
        scheduler.start();
        schedulers.add(scheduler);
        return scheduler;
    }

    public void addListener(MigrationEventListener listener) {
        events.register(listener);
    }

    public void removeListener(MigrationEventListener listener) {
        events.unregister(listener);
    }

    public Optional<MigrationRun> findRun(String runId) {
        return registry.find(runId);
    }

    public Optional<MigrationRun> activeRun(TableIdentity identity) {
        return registry.activeRun(identity);
    }

    public List<MigrationRun> activeRuns() {
        return registry.activeRuns();
    }

    public List<MigrationRun> archivedRuns() {
        return registry.archivedRuns();
    }

    public SqlDialect getDialect() {
        return dialect;
    }

    public MigrationSettings getSettings() {
        return settings;
    }

    public void shutdown() {
        schedulers.forEach(ArchiveScheduler::stop);
        schedulers.clear();
        gateEngine.shutdown();
        if (ownedDataSource != null && !ownedDataSource.isClosed()) {
            ownedDataSource.close();
        }
        logger.info("RepartitionEngine shut down");
    }

    private MigrationRun requireRun(String runId) {
        return registry.find(runId)
            .orElseThrow(() -> new PreconditionFailedException("Unknown run " + runId));
    }

    private <T> T operate(MigrationRun run, String operation, Supplier<T> action) {
        return run.exclusively(operation, () -> {
            // a request that arrived after the previous operation finished does not carry over
            run.getCancellation().reset();
            try {
                return action.get();
            } catch (StepCancelledException e) {
                run.getCancellation().reset();
                throw e;
            }
        });
    }

    public static class Builder {
        private DataSourceConfig dataSourceConfig;
        private DatabaseGateway gateway;
        private SqlDialect dialect;
        private SchemaDiscovery discovery;
        private MigrationSettings settings = MigrationSettings.defaults();
        private Clock clock = Clock.systemDefaultZone();
        private Logger logger;
        private boolean logEvents = true;
        private final List<MigrationEventListener> listeners = new CopyOnWriteArrayList<>();

        Builder() {
        }

        /**
         * Connect through a HikariCP pool owned by the engine.
         */
        public Builder dataSource(DataSourceConfig config) {
            this.dataSourceConfig = config;
            return this;
        }

        /**
         * Use an existing gateway; the caller owns its connections.
         */
        public Builder gateway(DatabaseGateway gateway, SqlDialect dialect) {
            this.gateway = gateway;
            this.dialect = dialect;
            return this;
        }

        public Builder dialect(SqlDialect dialect) {
            this.dialect = dialect;
            return this;
        }

        public Builder schemaDiscovery(SchemaDiscovery discovery) {
            this.discovery = discovery;
            return this;
        }

        public Builder settings(MigrationSettings settings) {
            if (settings != null) {
                this.settings = settings;
            }
            return this;
        }

        public Builder clock(Clock clock) {
            if (clock != null) {
                this.clock = clock;
            }
            return this;
        }

        public Builder logger(Logger logger) {
            this.logger = logger;
            return this;
        }

        /**
         * Whether step events are also written to the logger. On by default.
         */
        public Builder logEvents(boolean logEvents) {
            this.logEvents = logEvents;
            return this;
        }

        public Builder listener(MigrationEventListener listener) {
            this.listeners.add(listener);
            return this;
        }

        public RepartitionEngine build() {
            if (gateway == null && dataSourceConfig == null) {
                throw new IllegalStateException("Either a data source configuration or a gateway is required");
            }
            if (gateway != null && dialect == null) {
                throw new IllegalStateException("A dialect is required with an explicit gateway");
            }
            return new RepartitionEngine(this);
        }
    }
}
