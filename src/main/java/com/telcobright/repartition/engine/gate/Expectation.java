package com.telcobright.repartition.engine.gate;

/**
 * Whether an existence gate requires the object to be there or not.
 */
public enum Expectation {
    PRESENT,
    ABSENT
}
