package com.telcobright.repartition.engine.bridge;

import com.telcobright.repartition.core.config.RoutingMode;
import com.telcobright.repartition.core.dialect.SqlDialect;
import com.telcobright.repartition.core.logging.Logger;
import com.telcobright.repartition.core.model.QualifiedName;
import com.telcobright.repartition.db.gateway.DatabaseGateway;

import java.time.Duration;

/**
 * Routing done by the application: inserts become parameterised inserts
 * straight into the canonical table. Works on any database.
 */
public class ApplicationWriteRouter extends AbstractWriteRouter {

    public ApplicationWriteRouter(Bridge bridge, DatabaseGateway gateway, SqlDialect dialect, Duration timeout,
                                  Logger logger) {
        super(bridge, gateway, dialect, timeout, logger);
    }

    @Override
    protected QualifiedName insertTarget() {
        return getBridge().getWriteTarget();
    }

    @Override
    public RoutingMode getMode() {
        return RoutingMode.APPLICATION_PROXY;
    }
}
