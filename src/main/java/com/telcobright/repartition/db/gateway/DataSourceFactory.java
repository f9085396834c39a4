package com.telcobright.repartition.db.gateway;

import com.telcobright.repartition.core.config.DataSourceConfig;
import com.telcobright.repartition.core.dialect.DatabaseType;
import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Creates the HikariCP pool an engine owns. The engine closes it on shutdown.
 */
public final class DataSourceFactory {

    private static final Logger logger = LoggerFactory.getLogger(DataSourceFactory.class);

    private DataSourceFactory() {
    }

    public static HikariDataSource create(DataSourceConfig config) {
        HikariConfig hikariConfig = toHikariConfig(config);
        HikariDataSource dataSource = new HikariDataSource(hikariConfig);
        logger.info("Created connection pool {} for {}", hikariConfig.getPoolName(), config);
        return dataSource;
    }

    static HikariConfig toHikariConfig(DataSourceConfig config) {
        HikariConfig hikariConfig = new HikariConfig();
        hikariConfig.setPoolName("repartition-" + config.getDatabase());
        hikariConfig.setJdbcUrl(config.getJdbcUrl());
        hikariConfig.setUsername(config.getUsername());
        hikariConfig.setPassword(config.getPassword());
        hikariConfig.setDriverClassName(config.getDatabaseType().getDriverClassName());
        hikariConfig.setMaximumPoolSize(config.getMaximumPoolSize());
        hikariConfig.setMinimumIdle(1);
        // DDL must not run inside an open transaction on MySQL
        hikariConfig.setAutoCommit(true);
        hikariConfig.setConnectionTestQuery(
            config.getDatabaseType() == DatabaseType.ORACLE ? "SELECT 1 FROM DUAL" : "SELECT 1");
        return hikariConfig;
    }
}
