package com.telcobright.repartition.engine.run;

import com.telcobright.repartition.core.dialect.OracleDialect;
import com.telcobright.repartition.core.dialect.SqlStatement;
import com.telcobright.repartition.core.event.EventPublisher;
import com.telcobright.repartition.core.event.MigrationEvent;
import com.telcobright.repartition.core.event.StepOutcome;
import com.telcobright.repartition.core.exception.StepTimeoutException;
import com.telcobright.repartition.core.exception.TransientDatabaseException;
import com.telcobright.repartition.core.model.GateResult;
import com.telcobright.repartition.core.model.MigrationPhase;
import com.telcobright.repartition.core.model.PhysicalTable;
import com.telcobright.repartition.core.model.TableRole;
import com.telcobright.repartition.core.partition.PartitionScheme;
import com.telcobright.repartition.db.gateway.DatabaseGateway;
import com.telcobright.repartition.support.CapturingLogger;
import com.telcobright.repartition.support.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.sql.SQLException;
import java.sql.SQLTimeoutException;
import java.time.Duration;
import java.util.Arrays;
import java.util.List;

import static com.telcobright.repartition.support.Fixtures.*;
import static org.assertj.core.api.Assertions.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
@DisplayName("StepRunner Tests")
class StepRunnerTest {

    private static final Duration TIMEOUT = Duration.ofMinutes(5);

    @Mock
    private DatabaseGateway gateway;

    @Mock
    private EventPublisher events;

    private StepRunner steps;
    private MigrationRun run;
    private SqlStatement rename;

    @BeforeEach
    void setUp() {
        steps = new StepRunner(events, new CapturingLogger(), TIMEOUT);
        run = new MigrationRun(CDR,
            new PhysicalTable(CDR_NAME, PartitionScheme.unpartitioned(), TableRole.SOURCE),
            new PhysicalTable(CDR_NEW, rangeById(), TableRole.SHADOW),
            CDR_OLD, rangeById(), new MutableClock(START));
        rename = new OracleDialect().renameTable(CDR_NAME, CDR_OLD);
    }

    private List<MigrationEvent> published(int times) {
        ArgumentCaptor<MigrationEvent> captor = ArgumentCaptor.forClass(MigrationEvent.class);
        verify(events, times(times)).publish(captor.capture());
        return captor.getAllValues();
    }

    @Test
    @DisplayName("Should issue the statement with the step timeout and publish start and success")
    void testExecute() throws SQLException {
        // Given
        when(gateway.execute(rename, TIMEOUT)).thenReturn(0L);

        // When
        steps.execute(run, "rename-source", gateway, rename);

        // Then
        List<MigrationEvent> published = published(2);
        assertThat(published).extracting(MigrationEvent::getOutcome)
            .containsExactly(StepOutcome.STARTED, StepOutcome.SUCCEEDED);
        assertThat(published.get(0).getDetail()).isEqualTo(rename.describe());
        assertThat(published.get(1).getStep()).isEqualTo("rename-source");
        assertThat(published.get(1).getRunId()).isEqualTo(run.getId());
        assertThat(published.get(1).getPhase()).isEqualTo(MigrationPhase.PLANNED);
    }

    @Test
    @DisplayName("Should turn a driver timeout into a step timeout naming the statement")
    void testTimeout() throws SQLException {
        // Given
        when(gateway.execute(rename, TIMEOUT)).thenThrow(new SQLTimeoutException("ORA-01013"));

        // When/Then
        assertThatThrownBy(() -> steps.execute(run, "rename-source", gateway, rename))
            .isInstanceOf(StepTimeoutException.class)
            .satisfies(e -> {
                StepTimeoutException timeout = (StepTimeoutException) e;
                assertThat(timeout.getFailedStatement()).isEqualTo(rename.describe());
                assertThat(timeout.getIdentity()).isEqualTo(CDR);
                assertThat(timeout.getPhase()).isEqualTo(MigrationPhase.PLANNED);
            });
        assertThat(published(2).get(1).getOutcome()).isEqualTo(StepOutcome.FAILED);
    }

    @Test
    @DisplayName("Should recognise a timeout wrapped in another SQL exception")
    void testNestedTimeout() {
        // Given
        SQLException wrapped = new SQLException("statement failed", new SQLTimeoutException("cancelled"));

        // When
        TransientDatabaseException result = StepRunner.wrap(run, "backfill", null, wrapped);

        // Then
        assertThat(result).isInstanceOf(StepTimeoutException.class);
        assertThat(result.getFailedStatement()).isEqualTo("backfill");
        verifyNoInteractions(events);
    }

    @Test
    @DisplayName("Should wrap other SQL failures as transient and keep the driver message")
    void testSqlFailure() {
        // When/Then
        assertThatThrownBy(() -> steps.step(run, "backfill", () -> {
                throw new SQLException("ORA-01652: unable to extend temp segment");
            }))
            .isInstanceOf(TransientDatabaseException.class)
            .isNotInstanceOf(StepTimeoutException.class)
            .hasMessageContaining("Step backfill failed: ORA-01652")
            .hasMessageContaining("[table=APP.CDR, phase=PLANNED]");
        assertThat(published(2)).extracting(MigrationEvent::getOutcome)
            .containsExactly(StepOutcome.STARTED, StepOutcome.FAILED);
    }

    @Test
    @DisplayName("Should rethrow engine failures unchanged")
    void testRuntimeFailure() {
        // Given
        IllegalStateException failure = new IllegalStateException("bad state");

        // When/Then
        assertThatThrownBy(() -> steps.step(run, "plan", () -> {
                throw failure;
            }))
            .isSameAs(failure);
        assertThat(published(2).get(1).getDetail()).isEqualTo("bad state");
    }

    @Test
    @DisplayName("Should report gates with the worst verdict as outcome")
    void testReportGates() {
        // Given
        List<GateResult> results = Arrays.asList(
            GateResult.pass("Existence", CDR_NAME, "exists", null),
            GateResult.warn("ConstraintState", CDR_NEW, "disabled constraints", null));

        // When
        steps.reportGates(run, "pre-build-gates", results);

        // Then
        MigrationEvent event = published(1).get(0);
        assertThat(event.getOutcome()).isEqualTo(StepOutcome.WARNED);
        assertThat(event.getGateResults()).hasSize(2);
        assertThat(event.getDetail()).isEqualTo("2 gate(s)");
    }
}
