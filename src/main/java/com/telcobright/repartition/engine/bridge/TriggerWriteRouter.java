package com.telcobright.repartition.engine.bridge;

import com.telcobright.repartition.core.config.RoutingMode;
import com.telcobright.repartition.core.dialect.SqlDialect;
import com.telcobright.repartition.core.logging.Logger;
import com.telcobright.repartition.core.model.QualifiedName;
import com.telcobright.repartition.db.gateway.DatabaseGateway;

import java.time.Duration;

/**
 * Routing done by an INSTEAD OF trigger on the bridge view. Inserts are
 * issued against the view and the trigger forwards them; updates and deletes
 * are refused here before reaching the database, where the trigger would
 * raise an application error anyway.
 */
public class TriggerWriteRouter extends AbstractWriteRouter {

    public TriggerWriteRouter(Bridge bridge, DatabaseGateway gateway, SqlDialect dialect, Duration timeout,
                              Logger logger) {
        super(bridge, gateway, dialect, timeout, logger);
        if (bridge.getTrigger() == null) {
            throw new IllegalArgumentException("Native routing needs a bridge trigger: " + bridge);
        }
    }

    @Override
    protected QualifiedName insertTarget() {
        return getBridge().getReadView();
    }

    @Override
    public RoutingMode getMode() {
        return RoutingMode.NATIVE_TRIGGER;
    }
}
