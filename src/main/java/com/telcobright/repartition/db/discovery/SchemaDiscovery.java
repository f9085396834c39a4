package com.telcobright.repartition.db.discovery;

import com.telcobright.repartition.core.model.ConstraintInfo;
import com.telcobright.repartition.core.model.DependentObject;
import com.telcobright.repartition.core.model.QualifiedName;
import com.telcobright.repartition.core.model.TableMetadata;
import com.telcobright.repartition.core.partition.PartitionSlice;

import java.sql.SQLException;
import java.time.Duration;
import java.util.List;
import java.util.Optional;

/**
 * Typed view of the data dictionary.
 */
public interface SchemaDiscovery {

    /**
     * Columns, primary key, secondary indexes and grants of a table.
     *
     * @return empty if the table does not exist
     */
    Optional<TableMetadata> describe(QualifiedName table, Duration timeout) throws SQLException;

    List<ConstraintInfo> constraints(QualifiedName table, Duration timeout) throws SQLException;

    /**
     * Slices ordered by position, oldest first.
     */
    List<PartitionSlice> partitions(QualifiedName table, Duration timeout) throws SQLException;

    List<DependentObject> dependents(QualifiedName canonical, QualifiedName retired, Duration timeout)
        throws SQLException;
}
