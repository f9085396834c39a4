package com.telcobright.repartition.core.model;

import java.util.Collections;
import java.util.EnumSet;
import java.util.Set;

/**
 * Phases of a re-partitioning run.
 *
 * <pre>
 * PLANNED -> BUILT -> RENAMED_SOURCE -> CUT_OVER -> BRIDGED -> FINALIZED
 * </pre>
 * RENAMED_SOURCE may fall back to BUILT when the compensating rename succeeds.
 * ABORTED is reachable from PLANNED, BUILT and RENAMED_SOURCE.
 */
public enum MigrationPhase {
    PLANNED,
    BUILT,
    RENAMED_SOURCE,
    CUT_OVER,
    BRIDGED,
    FINALIZED,
    ABORTED;

    public Set<MigrationPhase> successors() {
        switch (this) {
            case PLANNED:
                return EnumSet.of(BUILT, ABORTED);
            case BUILT:
                return EnumSet.of(RENAMED_SOURCE, ABORTED);
            case RENAMED_SOURCE:
                return EnumSet.of(CUT_OVER, BUILT, ABORTED);
            case CUT_OVER:
                return EnumSet.of(BRIDGED);
            case BRIDGED:
                return EnumSet.of(FINALIZED);
            default:
                return Collections.emptySet();
        }
    }

    public boolean canTransitionTo(MigrationPhase next) {
        return successors().contains(next);
    }

    public boolean isTerminal() {
        return this == FINALIZED || this == ABORTED;
    }
}
