package com.telcobright.repartition.core.config;

/**
 * How writes issued against the bridge reach the shadow table.
 */
public enum RoutingMode {
    /** Database-side INSTEAD OF trigger on the bridge view. */
    NATIVE_TRIGGER,
    /** Inserts intercepted in the application and redirected to the shadow table. */
    APPLICATION_PROXY,
    /** Native trigger where the dialect supports it, application proxy otherwise. */
    AUTO
}
