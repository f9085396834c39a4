package com.telcobright.repartition.engine.bridge;

import com.telcobright.repartition.core.dialect.SqlDialect;
import com.telcobright.repartition.core.dialect.SqlStatement;
import com.telcobright.repartition.core.exception.TransientDatabaseException;
import com.telcobright.repartition.core.exception.UnsupportedBridgeWriteException;
import com.telcobright.repartition.core.logging.Logger;
import com.telcobright.repartition.core.model.QualifiedName;
import com.telcobright.repartition.db.gateway.DatabaseGateway;

import java.sql.SQLException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.TreeSet;

/**
 * Insert-only routing shared by both router kinds. Subclasses choose the
 * object the insert is issued against.
 */
abstract class AbstractWriteRouter implements WriteRouter {

    private final Bridge bridge;
    private final DatabaseGateway gateway;
    private final SqlDialect dialect;
    private final Duration timeout;
    private final Set<String> knownColumns = new TreeSet<>();
    protected final Logger logger;

    AbstractWriteRouter(Bridge bridge, DatabaseGateway gateway, SqlDialect dialect, Duration timeout, Logger logger) {
        this.bridge = bridge;
        this.gateway = gateway;
        this.dialect = dialect;
        this.timeout = timeout;
        this.logger = logger;
        for (String column : bridge.getColumns()) {
            knownColumns.add(column.toUpperCase(Locale.ROOT));
        }
    }

    /**
     * Object the INSERT is written into.
     */
    protected abstract QualifiedName insertTarget();

    @Override
    public long route(WriteRequest request) {
        if (request.getKind() != WriteRequest.Kind.INSERT) {
            throw new UnsupportedBridgeWriteException(
                request.getKind() + " is not supported through the bridge " + bridge.getReadView()
                    + "; only INSERT is routed", bridge.getIdentity());
        }
        List<String> columns = request.getColumns();
        for (String column : columns) {
            if (!knownColumns.contains(column.toUpperCase(Locale.ROOT))) {
                throw new IllegalArgumentException("Unknown column " + column + " for " + bridge.getIdentity());
            }
        }

        SqlStatement insert = dialect.insertRow(insertTarget(), columns)
            .withParameters(new ArrayList<>(request.getValues().values()));
        try {
            long written = gateway.execute(insert, timeout);
            logger.trace("Routed " + request + " via " + getMode() + " to " + insertTarget());
            return written;
        } catch (SQLException e) {
            throw new TransientDatabaseException("Bridge insert failed: " + e.getMessage(), e,
                bridge.getIdentity(), null, insert.describe());
        }
    }

    @Override
    public Bridge getBridge() {
        return bridge;
    }
}
