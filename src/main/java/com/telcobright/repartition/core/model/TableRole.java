package com.telcobright.repartition.core.model;

/**
 * Roles a physical table plays during a migration.
 */
public enum TableRole {
    /** The current canonical table. */
    SOURCE,
    /** The new-scheme replacement being built. */
    SHADOW,
    /** The former source, renamed aside after cutover and pending drop. */
    RETIRED
}
