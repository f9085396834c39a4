package com.telcobright.repartition.core.model;

import java.util.regex.Pattern;

/**
 * Validation of SQL identifiers that are inlined into DDL.
 * Only plain, unquoted identifiers are accepted.
 */
public final class Identifiers {

    public static final int MAX_LENGTH = 128;

    private static final Pattern PLAIN_IDENTIFIER = Pattern.compile("[A-Za-z][A-Za-z0-9_$#]*");

    private Identifiers() {
    }

    /**
     * Check an identifier and return it unchanged.
     *
     * @throws IllegalArgumentException if the name is empty, too long or contains
     *         characters other than letters, digits, '_', '$' and '#'
     */
    public static String requireValid(String identifier, String what) {
        if (identifier == null || identifier.trim().isEmpty()) {
            throw new IllegalArgumentException(what + " cannot be null or empty");
        }
        if (identifier.length() > MAX_LENGTH) {
            throw new IllegalArgumentException(String.format(
                "%s '%s' exceeds %d characters", what, identifier, MAX_LENGTH));
        }
        if (!PLAIN_IDENTIFIER.matcher(identifier).matches()) {
            throw new IllegalArgumentException(String.format(
                "Invalid %s: '%s'. Only letters, digits, '_', '$' and '#' are allowed", what, identifier));
        }
        return identifier;
    }

    /**
     * Append a suffix to a name, truncating the base so the result stays within
     * the identifier limit.
     */
    public static String withSuffix(String base, String suffix) {
        int room = MAX_LENGTH - suffix.length();
        String head = base.length() > room ? base.substring(0, room) : base;
        return head + suffix;
    }

    /**
     * Prepend a prefix to a name, truncating the tail when necessary.
     */
    public static String withPrefix(String prefix, String base) {
        String name = prefix + base;
        return name.length() > MAX_LENGTH ? name.substring(0, MAX_LENGTH) : name;
    }
}
