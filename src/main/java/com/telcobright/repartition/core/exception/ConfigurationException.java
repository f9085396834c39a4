package com.telcobright.repartition.core.exception;

import com.telcobright.repartition.core.model.MigrationPhase;
import com.telcobright.repartition.core.model.TableIdentity;

/**
 * The source table or the supplied settings make the migration impossible,
 * e.g. a source without a primary key. Retrying does not help.
 */
public class ConfigurationException extends MigrationException {

    public ConfigurationException(String message) {
        super(message);
    }

    public ConfigurationException(String message, TableIdentity identity, MigrationPhase phase) {
        super(message, null, identity, phase, null, null);
    }
}
