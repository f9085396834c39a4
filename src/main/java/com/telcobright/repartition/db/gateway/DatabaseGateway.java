package com.telcobright.repartition.db.gateway;

import com.telcobright.repartition.core.dialect.SqlStatement;

import java.sql.SQLException;
import java.time.Duration;
import java.util.List;

/**
 * The only path from the engine to the database. Every call carries its own
 * timeout; statements are schema-qualified so no session state is assumed.
 */
public interface DatabaseGateway {

    /**
     * Run a statement that changes the database.
     *
     * @return the update count, or 0 for DDL
     * @throws java.sql.SQLTimeoutException if the timeout elapsed
     */
    long execute(SqlStatement statement, Duration timeout) throws SQLException;

    /**
     * Run a read-only query.
     */
    List<ResultRow> query(SqlStatement statement, Duration timeout) throws SQLException;
}
