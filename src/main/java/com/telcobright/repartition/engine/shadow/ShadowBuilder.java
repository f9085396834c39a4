package com.telcobright.repartition.engine.shadow;

import com.telcobright.repartition.core.config.MigrationSettings;
import com.telcobright.repartition.core.dialect.SqlDialect;
import com.telcobright.repartition.core.exception.ConfigurationException;
import com.telcobright.repartition.core.exception.PreconditionFailedException;
import com.telcobright.repartition.core.logging.Logger;
import com.telcobright.repartition.core.model.GateResult;
import com.telcobright.repartition.core.model.Identifiers;
import com.telcobright.repartition.core.model.IndexDefinition;
import com.telcobright.repartition.core.model.MigrationPhase;
import com.telcobright.repartition.core.model.PhysicalTable;
import com.telcobright.repartition.core.model.QualifiedName;
import com.telcobright.repartition.core.model.TableMetadata;
import com.telcobright.repartition.core.partition.PartitionScheme;
import com.telcobright.repartition.core.partition.PartitionSlice;
import com.telcobright.repartition.db.discovery.SchemaDiscovery;
import com.telcobright.repartition.db.gateway.DatabaseGateway;
import com.telcobright.repartition.db.gateway.ResultRow;
import com.telcobright.repartition.engine.gate.ConstraintStateGate;
import com.telcobright.repartition.engine.gate.Gates;
import com.telcobright.repartition.engine.gate.GateKeeper;
import com.telcobright.repartition.engine.run.MigrationRun;
import com.telcobright.repartition.engine.run.StepRunner;

import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.TreeSet;
import java.util.stream.Collectors;

/**
 * Creates and fills the shadow table.
 *
 * Every step can be re-run after a partial failure: an existing shadow with
 * the source's columns is reused, the backfill only copies missing keys and
 * indexes already present are skipped. A failed build leaves the shadow in
 * place and the run in PLANNED.
 */
public class ShadowBuilder {

    static final String STEP_DESCRIBE = "describe-source";
    static final String STEP_CREATE = "create-shadow";
    static final String STEP_BACKFILL = "backfill";
    static final String STEP_INDEXES = "rebuild-indexes";
    static final String STEP_STATS = "gather-statistics";
    static final String STEP_RECONCILE = "reconcile-rows";
    static final String STEP_CONSTRAINTS = "check-constraints";

    private final DatabaseGateway gateway;
    private final SqlDialect dialect;
    private final SchemaDiscovery discovery;
    private final GateKeeper gates;
    private final StepRunner steps;
    private final MigrationSettings settings;
    private final Logger logger;

    public ShadowBuilder(DatabaseGateway gateway, SqlDialect dialect, SchemaDiscovery discovery,
                         GateKeeper gates, StepRunner steps, MigrationSettings settings, Logger logger) {
        this.gateway = gateway;
        this.dialect = dialect;
        this.discovery = discovery;
        this.gates = gates;
        this.steps = steps;
        this.settings = settings;
        this.logger = logger;
    }

    public PhysicalTable build(MigrationRun run) {
        run.requirePhase("build", MigrationPhase.PLANNED);
        QualifiedName source = run.getSource().getName();
        QualifiedName shadow = run.getShadow().getName();
        PartitionScheme scheme = run.getTargetScheme();

        logger.info("Building shadow " + shadow + " for " + source + " with " + scheme);

        TableMetadata metadata = describeSource(run, source, scheme);
        createShadow(run, metadata, shadow, scheme);
        backfill(run, metadata, source, shadow, scheme);
        rebuildIndexes(run, metadata, shadow, scheme);
        steps.execute(run, STEP_STATS, gateway, dialect.gatherStatistics(shadow, settings.getParallelDegree()));

        gates.require(run, STEP_RECONCILE,
            Gates.rowReconciliation(source, shadow, run.getSourceRowCountAtBuild()));
        checkConstraints(run, shadow);

        run.transitionTo(MigrationPhase.BUILT);
        logger.info("Shadow " + shadow + " built with " + run.getSourceRowCountAtBuild() + " reference rows");
        return run.getShadow();
    }

    private TableMetadata describeSource(MigrationRun run, QualifiedName source, PartitionScheme scheme) {
        TableMetadata metadata = steps.step(run, STEP_DESCRIBE, () -> discovery.describe(source, steps.getStepTimeout()))
            .orElseThrow(() -> new PreconditionFailedException(
                "Source table " + source + " does not exist", run.getIdentity(), run.getPhase()));
        if (!metadata.hasPrimaryKey()) {
            throw new ConfigurationException(
                "Source table " + source + " has no primary key; rows cannot be matched", run.getIdentity(), run.getPhase());
        }
        Set<String> columns = upper(metadata.getColumnNames());
        for (String key : scheme.getKeyColumns()) {
            if (!columns.contains(key.toUpperCase(Locale.ROOT))) {
                throw new ConfigurationException(
                    "Partition key column " + key + " is not a column of " + source, run.getIdentity(), run.getPhase());
            }
        }

        long rowCount = steps.step(run, STEP_DESCRIBE + "-count", () -> {
            List<ResultRow> rows = gateway.query(dialect.countRows(source), steps.getStepTimeout());
            return rows.get(0).getLong(SqlDialect.COL_COUNT);
        });
        run.captureSource(metadata, rowCount);
        logger.info(String.format("Source %s: %d columns, key %s, %d indexes, %d grants, %d rows",
            source, metadata.getColumns().size(), metadata.getPrimaryKey(), metadata.getIndexes().size(),
            metadata.getGrants().size(), rowCount));
        return metadata;
    }

    private void createShadow(MigrationRun run, TableMetadata metadata, QualifiedName shadow, PartitionScheme scheme) {
        List<GateResult> results = gates.check(run, STEP_CREATE, Gates.absent(shadow));
        if (results.get(0).isFail()) {
            TableMetadata existing = steps.step(run, STEP_CREATE + "-inspect",
                () -> discovery.describe(shadow, steps.getStepTimeout())).orElse(null);
            if (existing != null && upper(existing.getColumnNames()).equals(upper(metadata.getColumnNames()))) {
                logger.info("Shadow " + shadow + " already exists with the source columns; reusing it");
                return;
            }
            throw new PreconditionFailedException(
                "Shadow " + shadow + " exists with a different column set", run.getIdentity(), run.getPhase(),
                results.get(0));
        }
        steps.execute(run, STEP_CREATE, gateway,
            dialect.createTable(shadow, metadata.getColumns(), metadata.getPrimaryKey(), scheme));
    }

    private void backfill(MigrationRun run, TableMetadata metadata, QualifiedName source, QualifiedName shadow,
                          PartitionScheme scheme) {
        List<PartitionSlice> slices = steps.step(run, STEP_BACKFILL + "-plan",
            () -> discovery.partitions(source, steps.getStepTimeout()));
        List<String> columns = metadata.getColumnNames();
        List<String> key = metadata.getPrimaryKey();
        int degree = settings.getParallelDegree();

        if (slices.isEmpty()) {
            run.getCancellation().throwIfCancelled(run, STEP_BACKFILL);
            long copied = steps.execute(run, STEP_BACKFILL, gateway,
                dialect.backfill(source, shadow, columns, key, scheme, null, degree));
            logger.info("Backfilled " + copied + " rows into " + shadow);
            return;
        }

        long total = 0;
        for (PartitionSlice slice : slices) {
            run.getCancellation().throwIfCancelled(run, STEP_BACKFILL);
            total += steps.execute(run, STEP_BACKFILL + ":" + slice.getName(), gateway,
                dialect.backfill(source, shadow, columns, key, scheme, slice.getName(), degree));
        }
        logger.info("Backfilled " + total + " rows into " + shadow + " from " + slices.size() + " partition(s)");
    }

    private void rebuildIndexes(MigrationRun run, TableMetadata metadata, QualifiedName shadow,
                                PartitionScheme scheme) {
        Set<String> present = steps.step(run, STEP_INDEXES + "-inspect",
                () -> discovery.describe(shadow, steps.getStepTimeout()))
            .map(m -> upper(m.getIndexes().stream().map(IndexDefinition::getName).collect(Collectors.toList())))
            .orElseGet(TreeSet::new);

        for (IndexDefinition index : metadata.getIndexes()) {
            String name = Identifiers.withSuffix(index.getName(), settings.getIndexSuffix());
            if (present.contains(name.toUpperCase(Locale.ROOT))) {
                logger.debug("Index " + name + " already present on " + shadow);
                continue;
            }
            run.getCancellation().throwIfCancelled(run, STEP_INDEXES);
            steps.execute(run, STEP_INDEXES + ":" + name, gateway, dialect.createIndex(shadow, name, index, scheme));
        }
    }

    @SuppressWarnings("unchecked")
    private void checkConstraints(MigrationRun run, QualifiedName shadow) {
        GateResult result = gates.require(run, STEP_CONSTRAINTS, Gates.constraintState(shadow)).get(0);
        if (!result.isWarn()) {
            return;
        }
        List<String> disabled = (List<String>) result.fact(ConstraintStateGate.FACT_DISABLED);
        if (!settings.isAutoEnableConstraints()) {
            steps.warn(run, STEP_CONSTRAINTS, "left disabled on " + shadow + ": " + disabled);
            return;
        }
        for (String constraint : disabled) {
            steps.execute(run, STEP_CONSTRAINTS + ":enable:" + constraint, gateway,
                dialect.enableConstraint(shadow, constraint));
        }
        gates.require(run, STEP_CONSTRAINTS + "-recheck", Gates.constraintState(shadow));
    }

    private static Set<String> upper(List<String> names) {
        return names.stream()
            .map(n -> n.toUpperCase(Locale.ROOT))
            .collect(Collectors.toCollection(TreeSet::new));
    }
}
