package com.telcobright.repartition.engine.gate;

import com.telcobright.repartition.core.dialect.ObjectKind;
import com.telcobright.repartition.core.dialect.SqlDialect;
import com.telcobright.repartition.core.exception.StepTimeoutException;
import com.telcobright.repartition.core.exception.TransientDatabaseException;
import com.telcobright.repartition.core.logging.Logger;
import com.telcobright.repartition.core.model.ConstraintInfo;
import com.telcobright.repartition.core.model.GateResult;
import com.telcobright.repartition.core.model.QualifiedName;
import com.telcobright.repartition.core.partition.PartitionSlice;
import com.telcobright.repartition.db.discovery.SchemaDiscovery;
import com.telcobright.repartition.db.gateway.DatabaseGateway;
import com.telcobright.repartition.db.gateway.ResultRow;

import java.sql.SQLException;
import java.sql.SQLTimeoutException;
import java.time.Duration;
import java.util.Collections;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.stream.Collectors;

/**
 * Evaluates gate checks, alone or fanned out over a bounded pool. Results
 * come back in request order and are all joined before the caller mutates
 * anything. A check whose query errors raises
 * {@link TransientDatabaseException}; it never counts as PASS.
 */
public class GateEngine {

    private static final long JOIN_GRACE_MILLIS = 5_000L;

    private final GateProbe probe;
    private final Duration gateTimeout;
    private final ExecutorService executorService;
    private final Logger logger;

    public GateEngine(DatabaseGateway gateway, SqlDialect dialect, SchemaDiscovery discovery,
                      Duration gateTimeout, int threads, Logger logger) {
        this.probe = new DictionaryProbe(gateway, dialect, discovery, gateTimeout);
        this.gateTimeout = gateTimeout;
        this.logger = logger;
        AtomicInteger counter = new AtomicInteger();
        this.executorService = Executors.newFixedThreadPool(threads, r -> {
            Thread t = new Thread(r, "gate-worker-" + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
    }

    public GateResult run(GateCheck check) {
        try {
            GateResult result = check.evaluate(probe);
            if (logger.isDebugEnabled()) {
                logger.debug("Gate " + result);
            }
            return result;
        } catch (SQLException e) {
            throw wrap(check, e);
        }
    }

    public List<GateResult> runAll(List<GateCheck> checks) {
        if (checks.size() == 1) {
            return Collections.singletonList(run(checks.get(0)));
        }
        List<CompletableFuture<GateResult>> futures = checks.stream()
            .map(check -> CompletableFuture.supplyAsync(() -> run(check), executorService))
            .collect(Collectors.toList());

        try {
            CompletableFuture.allOf(futures.toArray(new CompletableFuture[0]))
                .get(gateTimeout.toMillis() + JOIN_GRACE_MILLIS, TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            futures.forEach(f -> f.cancel(true));
            throw new StepTimeoutException("Gate evaluation exceeded " + gateTimeout, e, null, null,
                describe(checks));
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            futures.forEach(f -> f.cancel(true));
            throw new TransientDatabaseException("Interrupted while evaluating gates " + describe(checks), e,
                null, null, describe(checks));
        } catch (ExecutionException e) {
            throw unwrap(e.getCause());
        }
        return futures.stream().map(CompletableFuture::join).collect(Collectors.toList());
    }

    /**
     * The first failing result, if any.
     */
    public static Optional<GateResult> firstFailure(List<GateResult> results) {
        return results.stream().filter(GateResult::isFail).findFirst();
    }

    public void shutdown() {
        executorService.shutdown();
        try {
            if (!executorService.awaitTermination(10, TimeUnit.SECONDS)) {
                executorService.shutdownNow();
            }
        } catch (InterruptedException e) {
            executorService.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }

    private static RuntimeException unwrap(Throwable cause) {
        Throwable t = cause instanceof CompletionException && cause.getCause() != null ? cause.getCause() : cause;
        if (t instanceof RuntimeException) {
            return (RuntimeException) t;
        }
        return new TransientDatabaseException("Gate evaluation failed", t);
    }

    private static TransientDatabaseException wrap(GateCheck check, SQLException e) {
        String what = check.kind() + "(" + check.target() + ")";
        if (e instanceof SQLTimeoutException) {
            return new StepTimeoutException("Gate " + what + " timed out", e, null, null, what);
        }
        return new TransientDatabaseException("Gate " + what + " could not be evaluated: " + e.getMessage(), e,
            null, null, what);
    }

    private static String describe(List<GateCheck> checks) {
        return checks.stream().map(c -> c.kind() + "(" + c.target() + ")").collect(Collectors.joining(", "));
    }

    /**
     * Probe backed by dictionary queries.
     */
    private static final class DictionaryProbe implements GateProbe {

        private final DatabaseGateway gateway;
        private final SqlDialect dialect;
        private final SchemaDiscovery discovery;
        private final Duration timeout;

        DictionaryProbe(DatabaseGateway gateway, SqlDialect dialect, SchemaDiscovery discovery, Duration timeout) {
            this.gateway = gateway;
            this.dialect = dialect;
            this.discovery = discovery;
            this.timeout = timeout;
        }

        @Override
        public boolean tableExists(QualifiedName table) throws SQLException {
            return single(gateway.query(dialect.objectExists(table, ObjectKind.TABLE), timeout)) > 0;
        }

        @Override
        public long countRows(QualifiedName table) throws SQLException {
            return single(gateway.query(dialect.countRows(table), timeout));
        }

        @Override
        public List<ConstraintInfo> constraints(QualifiedName table) throws SQLException {
            return discovery.constraints(table, timeout);
        }

        @Override
        public List<String> activeSessions(QualifiedName table) throws SQLException {
            return gateway.query(dialect.activeSessions(table), timeout).stream()
                .map(row -> row.getString(SqlDialect.COL_SESSION_ID))
                .collect(Collectors.toList());
        }

        @Override
        public List<PartitionSlice> partitions(QualifiedName table) throws SQLException {
            return discovery.partitions(table, timeout);
        }

        private static long single(List<ResultRow> rows) throws SQLException {
            if (rows.size() != 1) {
                throw new SQLException("Expected one row from count query, got " + rows.size());
            }
            return rows.get(0).getLong(SqlDialect.COL_COUNT);
        }
    }
}
