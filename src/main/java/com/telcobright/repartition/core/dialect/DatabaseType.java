package com.telcobright.repartition.core.dialect;

/**
 * Database types the engine can drive.
 */
public enum DatabaseType {
    ORACLE("Oracle", "oracle.jdbc.OracleDriver"),
    MYSQL("MySQL", "com.mysql.cj.jdbc.Driver"),
    MARIADB("MariaDB", "com.mysql.cj.jdbc.Driver");

    private final String displayName;
    private final String driverClassName;

    DatabaseType(String displayName, String driverClassName) {
        this.displayName = displayName;
        this.driverClassName = driverClassName;
    }

    public String getDisplayName() {
        return displayName;
    }

    public String getDriverClassName() {
        return driverClassName;
    }
}
