package com.telcobright.repartition.support;

import com.telcobright.repartition.RepartitionEngine;
import com.telcobright.repartition.core.config.MigrationSettings;
import com.telcobright.repartition.core.dialect.SqlDialect;
import com.telcobright.repartition.core.event.MigrationEvent;
import com.telcobright.repartition.core.model.QualifiedName;
import com.telcobright.repartition.core.model.TableIdentity;
import com.telcobright.repartition.core.partition.PartitionScheme;
import com.telcobright.repartition.core.partition.PartitionType;

import java.time.Duration;
import java.time.Instant;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

/**
 * Shared names and seed data: a call detail record table {@code APP.CDR}
 * keyed by ID, moved to range partitioning on ID.
 */
public final class Fixtures {

    public static final TableIdentity CDR = TableIdentity.of("APP", "CDR");
    public static final QualifiedName CDR_NAME = CDR.canonicalName();
    public static final QualifiedName CDR_NEW = QualifiedName.of("APP", "CDR_NEW");
    public static final QualifiedName CDR_OLD = QualifiedName.of("APP", "CDR_OLD");
    public static final QualifiedName CDR_BRIDGE = QualifiedName.of("APP", "CDR_BRIDGE");
    public static final QualifiedName CDR_TRIGGER = QualifiedName.of("APP", "TRG_CDR_BRIDGE");

    public static final List<String> CDR_COLUMNS = Arrays.asList("ID", "CALL_DATE", "MSISDN");

    public static final Instant START = Instant.parse("2026-10-17T02:00:00Z");

    private Fixtures() {
    }

    public static PartitionScheme rangeById() {
        return PartitionScheme.builder(PartitionType.RANGE)
            .keyColumn("ID")
            .bound("P1", "1000")
            .bound("PMAX", "MAXVALUE")
            .build();
    }

    /**
     * Unpartitioned CDR table with one secondary index, one grant and
     * {@code rows} rows with ids 1..rows.
     */
    public static SimulatedDatabase.Table seedCdr(SimulatedDatabase db, int rows) {
        return db.table(CDR_NAME, CDR_COLUMNS, Collections.singletonList("ID"))
            .index("CDR_MSISDN_IX", false, "MSISDN")
            .grant("APP_READER", "SELECT", false)
            .rows(1, rows);
    }

    public static RepartitionEngine.Builder engine(SimulatedDatabase db, SqlDialect dialect, MutableClock clock,
                                                   CapturingLogger logger, List<MigrationEvent> events) {
        return RepartitionEngine.builder()
            .gateway(db, dialect)
            .clock(clock)
            .logger(logger)
            .settings(MigrationSettings.builder().gateTimeout(Duration.ofSeconds(5)).build())
            .listener(events::add);
    }
}
