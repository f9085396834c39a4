package com.telcobright.repartition.engine.exchange;

import com.telcobright.repartition.core.config.MigrationSettings;
import com.telcobright.repartition.core.dialect.SqlDialect;
import com.telcobright.repartition.core.exception.PreconditionFailedException;
import com.telcobright.repartition.core.logging.Logger;
import com.telcobright.repartition.core.model.ArchiveCycle;
import com.telcobright.repartition.core.model.GateResult;
import com.telcobright.repartition.core.model.Identifiers;
import com.telcobright.repartition.core.model.QualifiedName;
import com.telcobright.repartition.core.partition.PartitionSlice;
import com.telcobright.repartition.db.discovery.SchemaDiscovery;
import com.telcobright.repartition.db.gateway.DatabaseGateway;
import com.telcobright.repartition.engine.gate.GateKeeper;
import com.telcobright.repartition.engine.gate.Gates;
import com.telcobright.repartition.engine.gate.PartitionDistributionGate;
import com.telcobright.repartition.engine.run.MigrationRegistry;
import com.telcobright.repartition.engine.run.MigrationRun;
import com.telcobright.repartition.engine.run.StepRunner;

import java.time.Clock;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Moves the oldest slice of an active table into a history table through an
 * empty staging table, using partition exchange only. No rows are copied.
 *
 * There is no compensation. If the first exchange fails nothing has moved;
 * if a later step fails the staging table is left holding the slice and the
 * next cycle refuses to start until it is emptied.
 *
 * Cycles on the same active table run one at a time; a second caller is
 * refused rather than queued, as is a cycle on a table with an active
 * migration run.
 */
public class PartitionExchangeEngine {

    static final String STEP_GATES = "exchange-gates";
    static final String STEP_TO_STAGING = "exchange-to-staging";
    static final String STEP_ADD_HISTORY = "add-history-partition";
    static final String STEP_TO_HISTORY = "exchange-to-history";
    static final String STEP_DROP_SLICE = "drop-active-partition";

    private static final DateTimeFormatter PARTITION_TIMESTAMP = DateTimeFormatter.ofPattern("yyyyMMddHHmmss");

    private final DatabaseGateway gateway;
    private final SqlDialect dialect;
    private final SchemaDiscovery discovery;
    private final GateKeeper gates;
    private final StepRunner steps;
    private final MigrationSettings settings;
    private final MigrationRegistry registry;
    private final Clock clock;
    private final Logger logger;
    private final Map<QualifiedName, ReentrantLock> cycleLocks = new ConcurrentHashMap<>();

    public PartitionExchangeEngine(DatabaseGateway gateway, SqlDialect dialect, SchemaDiscovery discovery,
                                   GateKeeper gates, StepRunner steps, MigrationSettings settings,
                                   MigrationRegistry registry, Clock clock, Logger logger) {
        this.gateway = gateway;
        this.dialect = dialect;
        this.discovery = discovery;
        this.gates = gates;
        this.steps = steps;
        this.settings = settings;
        this.registry = registry;
        this.clock = clock;
        this.logger = logger;
    }

    /**
     * @throws PreconditionFailedException if another cycle is running on the
     *         active table, the table has an active migration run, or a gate refuses
     */
    public SwapResult swapOldestSlice(ArchiveCycle cycle) {
        ArchiveContext context = new ArchiveContext(cycle);
        QualifiedName active = cycle.getActiveTable();
        ReentrantLock lock = cycleLocks.computeIfAbsent(active, k -> new ReentrantLock());
        if (!lock.tryLock()) {
            throw new PreconditionFailedException("An archive cycle is already running on " + active,
                context.getIdentity(), null);
        }
        try {
            Optional<MigrationRun> run = registry.activeRun(context.getIdentity());
            if (run.isPresent()) {
                throw new PreconditionFailedException("Run " + run.get().getId() + " is migrating " + active,
                    context.getIdentity(), run.get().getPhase());
            }
            return swap(context, cycle);
        } finally {
            lock.unlock();
        }
    }

    private SwapResult swap(ArchiveContext context, ArchiveCycle cycle) {
        QualifiedName active = cycle.getActiveTable();
        QualifiedName staging = cycle.getStagingTable();
        QualifiedName history = cycle.getHistoryTable();

        gates.require(context, STEP_GATES, Gates.present(active), Gates.present(staging), Gates.present(history));
        gates.require(context, STEP_GATES + ":staging-empty", Gates.empty(staging));
        PartitionSlice oldest = oldestSlice(context, active);
        if (oldest.getUpperBound() == null) {
            throw new PreconditionFailedException(
                "Slice " + oldest.getName() + " of " + active + " has no upper bound to recreate in history",
                context.getIdentity(), null);
        }

        String historyPartition = historyPartitionName();
        logger.info(String.format("Archiving %s.%s (bound %s, ~%d rows) into %s.%s via %s",
            active, oldest.getName(), oldest.getUpperBound(), oldest.getEstimatedRowCount(),
            history, historyPartition, staging));

        steps.execute(context, STEP_TO_STAGING, gateway, dialect.exchangePartition(active, oldest.getName(), staging));
        steps.execute(context, STEP_ADD_HISTORY, gateway,
            dialect.addPartition(history, historyPartition, oldest.getUpperBound()));
        steps.execute(context, STEP_TO_HISTORY, gateway, dialect.exchangePartition(history, historyPartition, staging));
        steps.execute(context, STEP_DROP_SLICE, gateway, dialect.dropPartition(active, oldest.getName()));

        SwapResult result = new SwapResult(cycle, oldest.getName(), historyPartition, oldest.getUpperBound(),
            oldest.getEstimatedRowCount(), clock.instant());
        Map<String, Object> eventContext = new HashMap<>();
        eventContext.put("active", active.render());
        eventContext.put("slice", oldest.getName());
        eventContext.put("history", history.render());
        eventContext.put("historyPartition", historyPartition);
        logger.logEvent(Logger.Level.INFO, "SLICE_EXCHANGED", result.toString(), eventContext);
        return result;
    }

    private PartitionSlice oldestSlice(ArchiveContext context, QualifiedName active) {
        GateResult distribution = gates.check(context, STEP_GATES + ":distribution",
            Gates.partitionDistribution(active)).get(0);
        if (!distribution.isPass()) {
            throw new PreconditionFailedException(active + " has no partitions to archive",
                context.getIdentity(), null, distribution);
        }
        String candidate = (String) distribution.fact(PartitionDistributionGate.FACT_CANDIDATE);
        List<PartitionSlice> slices = steps.step(context, STEP_GATES + ":slices",
            () -> discovery.partitions(active, steps.getStepTimeout()));
        return slices.stream()
            .filter(s -> s.getName().equalsIgnoreCase(candidate))
            .findFirst()
            .orElseThrow(() -> new PreconditionFailedException(
                "Slice " + candidate + " of " + active + " disappeared", context.getIdentity(), null));
    }

    String historyPartitionName() {
        String stamp = LocalDateTime.now(clock).format(PARTITION_TIMESTAMP);
        return Identifiers.withPrefix(settings.getHistoryPartitionPrefix(), stamp);
    }
}
