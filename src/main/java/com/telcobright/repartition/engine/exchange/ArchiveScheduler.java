package com.telcobright.repartition.engine.exchange;

import com.telcobright.repartition.core.logging.Logger;
import com.telcobright.repartition.core.model.ArchiveCycle;

import java.time.Clock;
import java.time.Duration;
import java.time.LocalDateTime;
import java.time.LocalTime;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * Runs the configured archive cycles once a day at the adjustment time.
 * A failing cycle is logged and does not stop the others.
 */
public class ArchiveScheduler {

    private static final DateTimeFormatter ADJUSTMENT_TIME = DateTimeFormatter.ofPattern("HH:mm");

    private final PartitionExchangeEngine engine;
    private final List<ArchiveCycle> cycles;
    private final LocalTime adjustmentTime;
    private final Clock clock;
    private final Logger logger;
    private final ScheduledExecutorService scheduler;

    /**
     * @param adjustmentTime local time of day, "HH:mm" (e.g. "04:00")
     */
    public ArchiveScheduler(PartitionExchangeEngine engine, List<ArchiveCycle> cycles, String adjustmentTime,
                            Clock clock, Logger logger) {
        this.engine = engine;
        this.cycles = Collections.unmodifiableList(new ArrayList<>(cycles));
        this.adjustmentTime = LocalTime.parse(adjustmentTime, ADJUSTMENT_TIME);
        this.clock = clock;
        this.logger = logger;
        this.scheduler = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "archive-scheduler");
            t.setDaemon(true);
            return t;
        });
    }

    public void start() {
        long initialDelay = initialDelay().getSeconds();
        scheduler.scheduleAtFixedRate(this::runCycles, initialDelay, TimeUnit.DAYS.toSeconds(1), TimeUnit.SECONDS);
        logger.info("Archive scheduler started for " + cycles.size() + " cycle(s); next run at "
            + nextRun().format(DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm")));
    }

    public void stop() {
        scheduler.shutdown();
        try {
            if (!scheduler.awaitTermination(30, TimeUnit.SECONDS)) {
                scheduler.shutdownNow();
            }
        } catch (InterruptedException e) {
            scheduler.shutdownNow();
            Thread.currentThread().interrupt();
        }
        logger.info("Archive scheduler stopped");
    }

    /**
     * Run every cycle now on the scheduler thread.
     */
    public Future<?> triggerNow() {
        return scheduler.submit(this::runCycles);
    }

    Duration initialDelay() {
        return Duration.between(LocalDateTime.now(clock), nextRun());
    }

    LocalDateTime nextRun() {
        LocalDateTime now = LocalDateTime.now(clock);
        LocalDateTime next = now.toLocalDate().atTime(adjustmentTime);
        if (!next.isAfter(now)) {
            next = next.plusDays(1);
        }
        return next;
    }

    private void runCycles() {
        logger.info("Archive run started for " + cycles.size() + " cycle(s)");
        int failed = 0;
        for (ArchiveCycle cycle : cycles) {
            try {
                SwapResult result = engine.swapOldestSlice(cycle);
                logger.info("Archived " + result);
            } catch (RuntimeException e) {
                failed++;
                logger.error("Archive cycle " + cycle + " failed: " + e.getMessage(), e);
            }
        }
        logger.info("Archive run completed, " + failed + " of " + cycles.size() + " cycle(s) failed");
    }
}
