package com.telcobright.repartition.engine.bridge;

import com.telcobright.repartition.core.config.RoutingMode;
import com.telcobright.repartition.core.exception.TransientDatabaseException;
import com.telcobright.repartition.core.exception.UnsupportedBridgeWriteException;

/**
 * Sends writes made against an open bridge to the table holding the canonical
 * name. Only inserts are routed.
 */
public interface WriteRouter {

    /**
     * @return rows written
     * @throws UnsupportedBridgeWriteException for UPDATE and DELETE
     * @throws TransientDatabaseException if the insert fails
     */
    long route(WriteRequest request);

    RoutingMode getMode();

    Bridge getBridge();
}
