package com.telcobright.repartition.core.event;

import com.telcobright.repartition.core.logging.Logger;
import com.telcobright.repartition.core.model.GateResult;

import java.util.HashMap;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Renders events as structured log entries.
 */
public class LoggingEventListener implements MigrationEventListener {

    private final Logger logger;

    public LoggingEventListener(Logger logger) {
        this.logger = logger;
    }

    @Override
    public void onEvent(MigrationEvent event) {
        Map<String, Object> context = new HashMap<>();
        context.put("runId", event.getRunId());
        context.put("table", event.getIdentity().toString());
        context.put("step", event.getStep());
        context.put("outcome", event.getOutcome());
        if (event.getPhase() != null) {
            context.put("phase", event.getPhase());
        }
        if (!event.getGateResults().isEmpty()) {
            context.put("gates", event.getGateResults().stream()
                .map(g -> g.getKind() + "=" + g.getVerdict())
                .collect(Collectors.joining(",")));
        }

        String message = event.getStep() + " " + event.getOutcome().name().toLowerCase()
            + (event.getDetail() == null ? "" : ": " + event.getDetail());
        logger.logEvent(levelOf(event), "MIGRATION_" + event.getOutcome().name(), message, context);

        for (GateResult gate : event.getGateResults()) {
            if (!gate.isPass()) {
                logger.warn("  gate " + gate);
            }
        }
    }

    private static Logger.Level levelOf(MigrationEvent event) {
        switch (event.getOutcome()) {
            case FAILED:
                return Logger.Level.ERROR;
            case WARNED:
                return Logger.Level.WARN;
            case STARTED:
                return Logger.Level.DEBUG;
            default:
                return Logger.Level.INFO;
        }
    }
}
