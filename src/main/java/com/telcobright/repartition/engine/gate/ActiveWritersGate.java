package com.telcobright.repartition.engine.gate;

import com.telcobright.repartition.core.model.GateResult;
import com.telcobright.repartition.core.model.QualifiedName;

import java.sql.SQLException;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * PASS only when no other session is running SQL that names the table.
 */
public class ActiveWritersGate implements GateCheck {

    public static final String KIND = "ActiveWriters";
    public static final String FACT_SESSIONS = "sessions";

    private final QualifiedName table;

    public ActiveWritersGate(QualifiedName table) {
        this.table = Objects.requireNonNull(table, "table");
    }

    @Override
    public String kind() {
        return KIND;
    }

    @Override
    public QualifiedName target() {
        return table;
    }

    @Override
    public GateResult evaluate(GateProbe probe) throws SQLException {
        List<String> sessions = probe.activeSessions(table);
        if (sessions.isEmpty()) {
            return GateResult.pass(KIND, table, "no active sessions on " + table.getName(),
                Collections.singletonMap(FACT_SESSIONS, sessions));
        }
        return GateResult.fail(KIND, table,
            sessions.size() + " active session(s) on " + table.getName() + ": " + sessions,
            Collections.singletonMap(FACT_SESSIONS, sessions));
    }
}
