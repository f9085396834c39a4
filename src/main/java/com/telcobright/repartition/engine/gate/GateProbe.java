package com.telcobright.repartition.engine.gate;

import com.telcobright.repartition.core.model.ConstraintInfo;
import com.telcobright.repartition.core.model.QualifiedName;
import com.telcobright.repartition.core.partition.PartitionSlice;

import java.sql.SQLException;
import java.util.List;

/**
 * Read-only access to the database for gate checks.
 */
public interface GateProbe {

    boolean tableExists(QualifiedName table) throws SQLException;

    long countRows(QualifiedName table) throws SQLException;

    List<ConstraintInfo> constraints(QualifiedName table) throws SQLException;

    /**
     * Ids of other sessions currently running SQL that mentions the table name.
     */
    List<String> activeSessions(QualifiedName table) throws SQLException;

    List<PartitionSlice> partitions(QualifiedName table) throws SQLException;
}
