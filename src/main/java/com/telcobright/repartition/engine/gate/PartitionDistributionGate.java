package com.telcobright.repartition.engine.gate;

import com.telcobright.repartition.core.model.GateResult;
import com.telcobright.repartition.core.model.QualifiedName;
import com.telcobright.repartition.core.partition.PartitionSlice;

import java.sql.SQLException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Reports slice sizes from dictionary statistics. Informational: it only
 * warns when the table has no slices at all. The oldest slice is published
 * as the hot-swap candidate.
 */
public class PartitionDistributionGate implements GateCheck {

    public static final String KIND = "PartitionDistribution";
    public static final String FACT_SLICES = "slices";
    public static final String FACT_CANDIDATE = "hotSwapCandidate";
    public static final String FACT_TOTAL_ROWS = "totalRows";

    private final QualifiedName table;

    public PartitionDistributionGate(QualifiedName table) {
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
        List<PartitionSlice> slices = new ArrayList<>(probe.partitions(table));
        slices.sort(PartitionSlice.BY_POSITION);
        if (slices.isEmpty()) {
            return GateResult.warn(KIND, table, table + " has no partitions", null);
        }

        long total = slices.stream().mapToLong(PartitionSlice::getEstimatedRowCount).sum();
        Map<String, Double> shares = new LinkedHashMap<>();
        for (PartitionSlice slice : slices) {
            double pct = total == 0 ? 0.0 : slice.getEstimatedRowCount() * 100.0 / total;
            shares.put(slice.getName(), Math.round(pct * 100.0) / 100.0);
        }

        Map<String, Object> facts = new LinkedHashMap<>();
        facts.put(FACT_SLICES, shares);
        facts.put(FACT_TOTAL_ROWS, total);
        facts.put(FACT_CANDIDATE, slices.get(0).getName());
        return GateResult.pass(KIND, table,
            String.format("%d partition(s), ~%d rows, oldest %s", slices.size(), total, slices.get(0).getName()),
            facts);
    }
}
