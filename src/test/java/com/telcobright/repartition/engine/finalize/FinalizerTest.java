package com.telcobright.repartition.engine.finalize;

import com.telcobright.repartition.RepartitionEngine;
import com.telcobright.repartition.core.dialect.MySqlDialect;
import com.telcobright.repartition.core.dialect.Operation;
import com.telcobright.repartition.core.dialect.OracleDialect;
import com.telcobright.repartition.core.event.MigrationEvent;
import com.telcobright.repartition.core.event.StepOutcome;
import com.telcobright.repartition.core.exception.PreconditionFailedException;
import com.telcobright.repartition.core.model.MigrationPhase;
import com.telcobright.repartition.core.model.TableGrant;
import com.telcobright.repartition.engine.run.MigrationRun;
import com.telcobright.repartition.support.CapturingLogger;
import com.telcobright.repartition.support.MutableClock;
import com.telcobright.repartition.support.SimulatedDatabase;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

import static com.telcobright.repartition.support.Fixtures.*;
import static org.assertj.core.api.Assertions.*;

@DisplayName("Finalizer Tests")
class FinalizerTest {

    private SimulatedDatabase db;
    private MutableClock clock;
    private CapturingLogger logger;
    private List<MigrationEvent> events;
    private RepartitionEngine engine;

    @BeforeEach
    void setUp() {
        db = new SimulatedDatabase();
        clock = new MutableClock(START);
        logger = new CapturingLogger();
        events = new CopyOnWriteArrayList<>();
        engine = engine(db, new OracleDialect(), clock, logger, events).build();
    }

    @AfterEach
    void tearDown() {
        engine.shutdown();
    }

    private MigrationRun bridgedRun(int rows) {
        seedCdr(db, rows);
        MigrationRun run = engine.plan(CDR, rangeById());
        engine.build(run.getId());
        engine.cutOver(run.getId());
        return run;
    }

    @Test
    @DisplayName("Should refuse to finalize a run that was never cut over")
    void testFinalizeBeforeCutover() {
        // Given
        seedCdr(db, 10);
        MigrationRun run = engine.plan(CDR, rangeById());
        engine.build(run.getId());

        // When/Then
        assertThatThrownBy(() -> engine.finalize(run.getId()))
            .isInstanceOf(PreconditionFailedException.class)
            .hasMessageContaining("not allowed in phase BUILT");
        assertThat(db.count(Operation.DROP_TABLE)).isZero();
        assertThat(db.count(Operation.RENAME_TABLE)).isZero();
    }

    @Test
    @DisplayName("Should wait for the operator's validation")
    void testFinalizeWithoutConfirmation() {
        // Given
        MigrationRun run = bridgedRun(10);
        clock.advance(Duration.ofDays(30));

        // When/Then
        assertThatThrownBy(() -> engine.finalize(run.getId()))
            .isInstanceOf(PreconditionFailedException.class)
            .hasMessageContaining("has not been confirmed");
        assertThat(db.hasTable(CDR_OLD)).isTrue();
        assertThat(db.hasView(CDR_BRIDGE)).isTrue();
    }

    @Test
    @DisplayName("Should wait for the validation window to elapse")
    void testFinalizeInsideWindow() {
        // Given
        MigrationRun run = bridgedRun(10);
        engine.confirmValidation(run.getId());
        clock.advance(Duration.ofDays(6));

        // When/Then
        assertThatThrownBy(() -> engine.finalize(run.getId()))
            .isInstanceOf(PreconditionFailedException.class)
            .hasMessageContaining("validation window");
        assertThat(run.getPhase()).isEqualTo(MigrationPhase.BRIDGED);

        // When
        clock.advance(Duration.ofDays(1));
        FinalizeReport report = engine.finalize(run.getId());

        // Then
        assertThat(report.isRetiredDropped()).isTrue();
        assertThat(run.getPhase()).isEqualTo(MigrationPhase.FINALIZED);
    }

    @Test
    @DisplayName("Should report dependents that stay invalid after one recompilation")
    void testStillInvalidDependents() {
        // Given
        db.dependent("APP", "CDR_RATING_PKG", "PACKAGE BODY", CDR_NAME);
        db.dependent("APP", "CDR_DAILY_V", "VIEW", CDR_NAME);
        db.unfixable("CDR_RATING_PKG");
        MigrationRun run = bridgedRun(10);
        engine.confirmValidation(run.getId());
        clock.advance(Duration.ofDays(7));

        // When
        FinalizeReport report = engine.finalize(run.getId());

        // Then
        assertThat(run.getPhase()).isEqualTo(MigrationPhase.FINALIZED);
        assertThat(report.isClean()).isFalse();
        assertThat(report.getStillInvalid()).extracting(d -> d.getName()).containsExactly("CDR_RATING_PKG");
        assertThat(db.compileCount("CDR_RATING_PKG")).isEqualTo(1);
        assertThat(db.dependentStatus("CDR_DAILY_V")).isEqualTo("VALID");
        assertThat(events).anyMatch(e -> e.getStep().equals("recompile-dependents")
            && e.getOutcome() == StepOutcome.WARNED);
    }

    @Test
    @DisplayName("Should finish finalizing when a grant cannot be reapplied")
    void testGrantFailure() {
        // Given
        MigrationRun run = bridgedRun(10);
        db.failWhen(SimulatedDatabase.operation(Operation.GRANT), "ORA-01917: user or role 'APP_READER' does not exist");
        engine.confirmValidation(run.getId());
        clock.advance(Duration.ofDays(7));

        // When
        FinalizeReport report = engine.finalize(run.getId());

        // Then
        TableGrant grant = new TableGrant("APP_READER", "SELECT", false);
        assertThat(run.getPhase()).isEqualTo(MigrationPhase.FINALIZED);
        assertThat(report.isRetiredDropped()).isTrue();
        assertThat(report.getGrantsApplied()).isEmpty();
        assertThat(report.getGrantsFailed()).containsOnlyKeys(grant);
        assertThat(report.getGrantsFailed().get(grant)).contains("ORA-01917");
        assertThat(report.isClean()).isFalse();
        assertThat(db.hasTable(CDR_OLD)).isFalse();
    }

    @Test
    @DisplayName("Should close the bridge once and tolerate it being closed already")
    void testBridgeClosedBeforeFinalize() {
        // Given
        MigrationRun run = bridgedRun(10);
        engine.closeBridge(run.getId());
        engine.confirmValidation(run.getId());
        clock.advance(Duration.ofDays(7));

        // When
        engine.finalize(run.getId());

        // Then
        assertThat(db.count(Operation.DROP_VIEW)).isEqualTo(1L);
        assertThat(db.count(Operation.DROP_TRIGGER)).isEqualTo(1L);
        assertThat(db.hasView(CDR_BRIDGE)).isFalse();
    }

    @Test
    @DisplayName("Should not recompile anything on MySQL")
    void testNoRecompilationOnMySql() {
        // Given
        engine.shutdown();
        engine = engine(db, new MySqlDialect(), clock, logger, events).build();
        db.table(CDR_NAME, CDR_COLUMNS, Collections.singletonList("ID"))
            .grant("'reporting'@'%'", "SELECT", false)
            .rows(1, 20);
        db.dependent("APP", "CDR_DAILY_V", "VIEW", CDR_NAME);
        MigrationRun run = engine.plan(CDR, rangeById());
        engine.build(run.getId());
        engine.cutOver(run.getId());
        engine.confirmValidation(run.getId());
        clock.advance(Duration.ofDays(7));

        // When
        FinalizeReport report = engine.finalize(run.getId());

        // Then
        assertThat(db.count(Operation.RECOMPILE)).isZero();
        assertThat(report.getRecompiled()).isEmpty();
        assertThat(report.getGrantsApplied()).extracting(TableGrant::getGrantee).containsExactly("'reporting'@'%'");
        assertThat(db.hasTrigger(CDR_TRIGGER)).isFalse();
        assertThat(run.getPhase()).isEqualTo(MigrationPhase.FINALIZED);
    }
}
