package com.telcobright.repartition.core.config;

import com.telcobright.repartition.core.dialect.DatabaseType;

/**
 * Connection settings for the target database.
 * Immutable; create through {@link #create}.
 */
public class DataSourceConfig {
    private final DatabaseType databaseType;
    private final String host;
    private final int port;
    private final String database;
    private final String username;
    private final String password;
    private final int maximumPoolSize;

    private DataSourceConfig(DatabaseType databaseType, String host, int port, String database,
                             String username, String password, int maximumPoolSize) {
        this.databaseType = databaseType;
        this.host = host;
        this.port = port;
        this.database = database;
        this.username = username;
        this.password = password;
        this.maximumPoolSize = maximumPoolSize;
    }

    /**
     * Create a configuration with the default pool size.
     *
     * @param database MySQL database name or Oracle service name
     */
    public static DataSourceConfig create(DatabaseType databaseType, String host, int port, String database,
                                          String username, String password) {
        return create(databaseType, host, port, database, username, password, 4);
    }

    public static DataSourceConfig create(DatabaseType databaseType, String host, int port, String database,
                                          String username, String password, int maximumPoolSize) {
        if (databaseType == null) {
            throw new IllegalArgumentException("Database type is required");
        }
        if (host == null || host.trim().isEmpty()) {
            throw new IllegalArgumentException("Host cannot be null or empty");
        }
        if (port <= 0 || port > 65535) {
            throw new IllegalArgumentException("Port must be between 1 and 65535");
        }
        if (database == null || database.trim().isEmpty()) {
            throw new IllegalArgumentException("Database cannot be null or empty");
        }
        if (username == null || username.trim().isEmpty()) {
            throw new IllegalArgumentException("Username cannot be null or empty");
        }
        if (maximumPoolSize < 2) {
            // gate fan-out needs more than one connection
            throw new IllegalArgumentException("Maximum pool size must be at least 2");
        }
        return new DataSourceConfig(databaseType, host, port, database, username,
            password == null ? "" : password, maximumPoolSize);
    }

    public DatabaseType getDatabaseType() { return databaseType; }
    public String getHost() { return host; }
    public int getPort() { return port; }
    public String getDatabase() { return database; }
    public String getUsername() { return username; }
    public String getPassword() { return password; }
    public int getMaximumPoolSize() { return maximumPoolSize; }

    /**
     * JDBC URL for this configuration.
     */
    public String getJdbcUrl() {
        switch (databaseType) {
            case ORACLE:
                return String.format("jdbc:oracle:thin:@//%s:%d/%s", host, port, database);
            case MYSQL:
            case MARIADB:
            default:
                return String.format(
                    "jdbc:mysql://%s:%d/%s?useSSL=false&serverTimezone=UTC&allowPublicKeyRetrieval=true",
                    host, port, database);
        }
    }

    @Override
    public String toString() {
        return String.format("DataSource[%s %s:%d/%s]", databaseType.getDisplayName(), host, port, database);
    }
}
