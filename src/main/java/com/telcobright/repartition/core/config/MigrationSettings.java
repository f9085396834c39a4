package com.telcobright.repartition.core.config;

import com.telcobright.repartition.core.model.Identifiers;

import java.time.Duration;

/**
 * Tunables for migrations and archive cycles.
 *
 * Defaults:
 * - shadow suffix {@code _NEW}, retired suffix {@code _OLD}
 * - bridge view suffix {@code _BRIDGE}, bridge trigger prefix {@code TRG_}
 * - parallel degree 1
 * - step timeout 30 minutes, gate timeout 60 seconds
 * - validation window 7 days before the retired table may be dropped
 * - routing mode AUTO
 */
public class MigrationSettings {

    private final String shadowSuffix;
    private final String retiredSuffix;
    private final String bridgeViewSuffix;
    private final String bridgeTriggerPrefix;
    private final String indexSuffix;
    private final String historyPartitionPrefix;
    private final int parallelDegree;
    private final Duration stepTimeout;
    private final Duration gateTimeout;
    private final Duration validationWindow;
    private final RoutingMode routingMode;
    private final boolean autoEnableConstraints;
    private final boolean openBridgeAfterCutover;
    private final int gateThreads;

    private MigrationSettings(Builder builder) {
        this.shadowSuffix = builder.shadowSuffix;
        this.retiredSuffix = builder.retiredSuffix;
        this.bridgeViewSuffix = builder.bridgeViewSuffix;
        this.bridgeTriggerPrefix = builder.bridgeTriggerPrefix;
        this.indexSuffix = builder.indexSuffix;
        this.historyPartitionPrefix = builder.historyPartitionPrefix;
        this.parallelDegree = builder.parallelDegree;
        this.stepTimeout = builder.stepTimeout;
        this.gateTimeout = builder.gateTimeout;
        this.validationWindow = builder.validationWindow;
        this.routingMode = builder.routingMode;
        this.autoEnableConstraints = builder.autoEnableConstraints;
        this.openBridgeAfterCutover = builder.openBridgeAfterCutover;
        this.gateThreads = builder.gateThreads;
    }

    public static MigrationSettings defaults() {
        return new Builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public String getShadowSuffix() { return shadowSuffix; }
    public String getRetiredSuffix() { return retiredSuffix; }
    public String getBridgeViewSuffix() { return bridgeViewSuffix; }
    public String getBridgeTriggerPrefix() { return bridgeTriggerPrefix; }
    public String getIndexSuffix() { return indexSuffix; }
    public String getHistoryPartitionPrefix() { return historyPartitionPrefix; }
    public int getParallelDegree() { return parallelDegree; }
    public Duration getStepTimeout() { return stepTimeout; }
    public Duration getGateTimeout() { return gateTimeout; }
    public Duration getValidationWindow() { return validationWindow; }
    public RoutingMode getRoutingMode() { return routingMode; }
    public boolean isAutoEnableConstraints() { return autoEnableConstraints; }
    public boolean isOpenBridgeAfterCutover() { return openBridgeAfterCutover; }
    public int getGateThreads() { return gateThreads; }

    public Builder toBuilder() {
        return new Builder()
            .shadowSuffix(shadowSuffix)
            .retiredSuffix(retiredSuffix)
            .bridgeViewSuffix(bridgeViewSuffix)
            .bridgeTriggerPrefix(bridgeTriggerPrefix)
            .indexSuffix(indexSuffix)
            .historyPartitionPrefix(historyPartitionPrefix)
            .parallelDegree(parallelDegree)
            .stepTimeout(stepTimeout)
            .gateTimeout(gateTimeout)
            .validationWindow(validationWindow)
            .routingMode(routingMode)
            .autoEnableConstraints(autoEnableConstraints)
            .openBridgeAfterCutover(openBridgeAfterCutover)
            .gateThreads(gateThreads);
    }

    @Override
    public String toString() {
        return String.format("MigrationSettings[shadow=%s, retired=%s, parallel=%d, stepTimeout=%s, routing=%s]",
            shadowSuffix, retiredSuffix, parallelDegree, stepTimeout, routingMode);
    }

    public static class Builder {
        private String shadowSuffix = "_NEW";
        private String retiredSuffix = "_OLD";
        private String bridgeViewSuffix = "_BRIDGE";
        private String bridgeTriggerPrefix = "TRG_";
        private String indexSuffix = "_N";
        private String historyPartitionPrefix = "P_HIST_";
        private int parallelDegree = 1;
        private Duration stepTimeout = Duration.ofMinutes(30);
        private Duration gateTimeout = Duration.ofSeconds(60);
        private Duration validationWindow = Duration.ofDays(7);
        private RoutingMode routingMode = RoutingMode.AUTO;
        private boolean autoEnableConstraints = false;
        private boolean openBridgeAfterCutover = true;
        private int gateThreads = 4;

        public Builder shadowSuffix(String suffix) {
            this.shadowSuffix = requireSuffix(suffix, "Shadow suffix");
            return this;
        }

        public Builder retiredSuffix(String suffix) {
            this.retiredSuffix = requireSuffix(suffix, "Retired suffix");
            return this;
        }

        public Builder bridgeViewSuffix(String suffix) {
            this.bridgeViewSuffix = requireSuffix(suffix, "Bridge view suffix");
            return this;
        }

        public Builder bridgeTriggerPrefix(String prefix) {
            this.bridgeTriggerPrefix = Identifiers.requireValid(prefix, "Bridge trigger prefix");
            return this;
        }

        public Builder indexSuffix(String suffix) {
            this.indexSuffix = requireSuffix(suffix, "Index suffix");
            return this;
        }

        public Builder historyPartitionPrefix(String prefix) {
            this.historyPartitionPrefix = Identifiers.requireValid(prefix, "History partition prefix");
            return this;
        }

        public Builder parallelDegree(int degree) {
            if (degree < 1) {
                throw new IllegalArgumentException("Parallel degree must be at least 1");
            }
            this.parallelDegree = degree;
            return this;
        }

        public Builder stepTimeout(Duration timeout) {
            this.stepTimeout = requirePositive(timeout, "Step timeout");
            return this;
        }

        public Builder gateTimeout(Duration timeout) {
            this.gateTimeout = requirePositive(timeout, "Gate timeout");
            return this;
        }

        public Builder validationWindow(Duration window) {
            if (window == null || window.isNegative()) {
                throw new IllegalArgumentException("Validation window cannot be null or negative");
            }
            this.validationWindow = window;
            return this;
        }

        public Builder routingMode(RoutingMode mode) {
            if (mode != null) {
                this.routingMode = mode;
            }
            return this;
        }

        public Builder autoEnableConstraints(boolean enable) {
            this.autoEnableConstraints = enable;
            return this;
        }

        public Builder openBridgeAfterCutover(boolean open) {
            this.openBridgeAfterCutover = open;
            return this;
        }

        public Builder gateThreads(int threads) {
            if (threads < 1) {
                throw new IllegalArgumentException("Gate threads must be at least 1");
            }
            this.gateThreads = threads;
            return this;
        }

        public MigrationSettings build() {
            if (shadowSuffix.equalsIgnoreCase(retiredSuffix)) {
                throw new IllegalStateException("Shadow and retired suffixes must differ");
            }
            return new MigrationSettings(this);
        }

        private static String requireSuffix(String suffix, String what) {
            // a suffix is appended to a valid identifier, so a leading letter is not required
            Identifiers.requireValid("X" + suffix, what);
            return suffix;
        }

        private static Duration requirePositive(Duration duration, String what) {
            if (duration == null || duration.isZero() || duration.isNegative()) {
                throw new IllegalArgumentException(what + " must be positive");
            }
            return duration;
        }
    }
}
