package com.telcobright.repartition.core.event;

public enum StepOutcome {
    STARTED,
    SUCCEEDED,
    WARNED,
    FAILED
}
