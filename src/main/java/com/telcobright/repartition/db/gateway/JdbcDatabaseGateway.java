package com.telcobright.repartition.db.gateway;

import com.telcobright.repartition.core.dialect.SqlStatement;
import com.telcobright.repartition.core.logging.Logger;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.ResultSetMetaData;
import java.sql.SQLException;
import java.sql.Statement;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * JDBC gateway over a pooled {@link DataSource}. Each call borrows a
 * connection in auto-commit mode; DDL commits implicitly on both supported
 * databases.
 */
public class JdbcDatabaseGateway implements DatabaseGateway {

    private final DataSource dataSource;
    private final Logger logger;

    public JdbcDatabaseGateway(DataSource dataSource, Logger logger) {
        this.dataSource = dataSource;
        this.logger = logger;
    }

    @Override
    public long execute(SqlStatement statement, Duration timeout) throws SQLException {
        logger.debug("Executing " + statement.describe());
        try (Connection conn = dataSource.getConnection()) {
            if (statement.getParameters().isEmpty()) {
                // trigger bodies reference :NEW columns, which a prepared statement takes for binds
                try (Statement stmt = conn.createStatement()) {
                    stmt.setQueryTimeout(toSeconds(timeout));
                    return drain(statement, stmt, stmt.execute(statement.getSql()));
                }
            }
            try (PreparedStatement stmt = prepare(conn, statement, timeout)) {
                return drain(statement, stmt, stmt.execute());
            }
        }
    }

    @Override
    public List<ResultRow> query(SqlStatement statement, Duration timeout) throws SQLException {
        if (!statement.getOperation().isQuery()) {
            throw new IllegalArgumentException("Not a query: " + statement.describe());
        }
        logger.trace("Querying " + statement.describe());
        try (Connection conn = dataSource.getConnection();
             PreparedStatement stmt = prepare(conn, statement, timeout);
             ResultSet rs = stmt.executeQuery()) {
            ResultSetMetaData meta = rs.getMetaData();
            int columnCount = meta.getColumnCount();
            List<ResultRow> rows = new ArrayList<>();
            while (rs.next()) {
                Map<String, Object> values = new LinkedHashMap<>();
                for (int i = 1; i <= columnCount; i++) {
                    values.put(meta.getColumnLabel(i), rs.getObject(i));
                }
                rows.add(new ResultRow(values));
            }
            return rows;
        }
    }

    private long drain(SqlStatement statement, Statement stmt, boolean returnsRows) throws SQLException {
        if (returnsRows) {
            // ANALYZE TABLE and similar report through a result set
            try (ResultSet rs = stmt.getResultSet()) {
                while (rs.next()) {
                    logger.trace(statement.getOperation() + ": " + rs.getString(rs.getMetaData().getColumnCount()));
                }
            }
            return 0L;
        }
        return Math.max(stmt.getUpdateCount(), 0);
    }

    private PreparedStatement prepare(Connection conn, SqlStatement statement, Duration timeout) throws SQLException {
        PreparedStatement stmt = conn.prepareStatement(statement.getSql());
        try {
            stmt.setQueryTimeout(toSeconds(timeout));
            List<Object> parameters = statement.getParameters();
            for (int i = 0; i < parameters.size(); i++) {
                stmt.setObject(i + 1, parameters.get(i));
            }
            return stmt;
        } catch (SQLException e) {
            stmt.close();
            throw e;
        }
    }

    private static int toSeconds(Duration timeout) {
        if (timeout == null) {
            return 0;
        }
        long seconds = Math.max(1L, (timeout.toMillis() + 999L) / 1000L);
        return (int) Math.min(seconds, Integer.MAX_VALUE);
    }
}
