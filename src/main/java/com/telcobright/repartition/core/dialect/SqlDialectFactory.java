package com.telcobright.repartition.core.dialect;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Factory for database-specific dialects. One shared instance per database
 * type; dialects are stateless.
 */
public final class SqlDialectFactory {

    private static final Map<DatabaseType, SqlDialect> dialects = new ConcurrentHashMap<>();

    private SqlDialectFactory() {
    }

    /**
     * Get the dialect for a database type.
     *
     * @throws UnsupportedOperationException if the type has no dialect
     */
    public static SqlDialect getDialect(DatabaseType databaseType) {
        return dialects.computeIfAbsent(databaseType, type -> {
            switch (type) {
                case ORACLE:
                    return new OracleDialect();
                case MYSQL:
                case MARIADB:  // MySQL-compatible
                    return new MySqlDialect(type);
                default:
                    throw new UnsupportedOperationException("Database type " + type + " is not supported");
            }
        });
    }

    /**
     * Detect the database type from a JDBC URL.
     *
     * @throws IllegalArgumentException if the URL is not a JDBC URL
     * @throws UnsupportedOperationException if the database is not supported
     */
    public static SqlDialect getDialectFromUrl(String jdbcUrl) {
        if (jdbcUrl == null || !jdbcUrl.startsWith("jdbc:")) {
            throw new IllegalArgumentException("Invalid JDBC URL: " + jdbcUrl);
        }
        String lowerUrl = jdbcUrl.toLowerCase();
        if (lowerUrl.startsWith("jdbc:oracle:")) {
            return getDialect(DatabaseType.ORACLE);
        } else if (lowerUrl.startsWith("jdbc:mysql:")) {
            return getDialect(DatabaseType.MYSQL);
        } else if (lowerUrl.startsWith("jdbc:mariadb:")) {
            return getDialect(DatabaseType.MARIADB);
        }
        throw new UnsupportedOperationException("Cannot determine database type from URL: " + jdbcUrl);
    }
}
