package com.telcobright.repartition.core.event;

/**
 * Receives every step event. Called on the thread running the step; listeners
 * must return quickly.
 */
@FunctionalInterface
public interface MigrationEventListener {

    void onEvent(MigrationEvent event);
}
