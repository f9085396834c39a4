package com.telcobright.repartition.core.dialect;

/**
 * Dictionary object kinds the engine checks for.
 */
public enum ObjectKind {
    TABLE,
    VIEW,
    TRIGGER
}
