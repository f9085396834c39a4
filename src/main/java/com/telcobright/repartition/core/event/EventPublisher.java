package com.telcobright.repartition.core.event;

import com.telcobright.repartition.core.logging.Logger;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Fans events out to the registered listeners. A failing listener is logged
 * and does not stop delivery to the others or affect the step.
 */
public class EventPublisher {

    private final List<MigrationEventListener> listeners = new CopyOnWriteArrayList<>();
    private final Logger logger;

    public EventPublisher(Logger logger) {
        this.logger = logger;
    }

    public void register(MigrationEventListener listener) {
        listeners.add(listener);
    }

    public void unregister(MigrationEventListener listener) {
        listeners.remove(listener);
    }

    public void publish(MigrationEvent event) {
        for (MigrationEventListener listener : listeners) {
            try {
                listener.onEvent(event);
            } catch (RuntimeException e) {
                logger.warn("Event listener " + listener.getClass().getName() + " failed on " + event, e);
            }
        }
    }
}
