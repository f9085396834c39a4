package com.telcobright.repartition.core.exception;

import com.telcobright.repartition.core.model.TableIdentity;

/**
 * UPDATE or DELETE issued through an open bridge. Only inserts are routed.
 */
public class UnsupportedBridgeWriteException extends MigrationException {

    public UnsupportedBridgeWriteException(String message, TableIdentity identity) {
        super(message, null, identity, null, null, null);
    }
}
