package com.telcobright.repartition.engine.gate;

import com.telcobright.repartition.core.model.ConstraintInfo;
import com.telcobright.repartition.core.model.GateResult;
import com.telcobright.repartition.core.model.GateVerdict;
import com.telcobright.repartition.core.model.QualifiedName;
import com.telcobright.repartition.core.partition.PartitionSlice;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.sql.SQLException;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.*;
import static org.mockito.Mockito.*;

/**
 * Existence, constraint, session and distribution gates against a mocked probe.
 */
@ExtendWith(MockitoExtension.class)
@DisplayName("Gate check Tests")
class GateChecksTest {

    private static final QualifiedName TABLE = QualifiedName.of("APP", "CDR_NEW");

    @Mock
    private GateProbe probe;

    @Test
    @DisplayName("Should pass present and fail absent for an existing table")
    void testExistence() throws SQLException {
        // Given
        when(probe.tableExists(TABLE)).thenReturn(true);

        // When
        GateResult present = Gates.present(TABLE).evaluate(probe);
        GateResult absent = Gates.absent(TABLE).evaluate(probe);

        // Then
        assertThat(present.getVerdict()).isEqualTo(GateVerdict.PASS);
        assertThat(absent.getVerdict()).isEqualTo(GateVerdict.FAIL);
        assertThat(absent.getDetail()).contains("required ABSENT");
        assertThat(absent.fact(ExistenceGate.FACT_EXISTS)).isEqualTo(true);
    }

    @Test
    @DisplayName("Should pass when every constraint is enabled")
    void testConstraintsEnabled() throws SQLException {
        // Given
        when(probe.tableExists(TABLE)).thenReturn(true);
        when(probe.constraints(TABLE)).thenReturn(Arrays.asList(
            new ConstraintInfo("CDR_NEW_PK", "P", "ENABLED"),
            new ConstraintInfo("CDR_NEW_DATE_CK", "CHECK", "YES")));

        // When
        GateResult result = Gates.constraintState(TABLE).evaluate(probe);

        // Then
        assertThat(result.isPass()).isTrue();
        assertThat(result.fact(ConstraintStateGate.FACT_TOTAL)).isEqualTo(2);
    }

    @Test
    @DisplayName("Should warn on disabled constraints and name them")
    void testConstraintsDisabled() throws SQLException {
        // Given
        when(probe.tableExists(TABLE)).thenReturn(true);
        when(probe.constraints(TABLE)).thenReturn(Arrays.asList(
            new ConstraintInfo("CDR_NEW_PK", "P", "ENABLED"),
            new ConstraintInfo("CDR_NEW_SW_FK", "R", "DISABLED")));

        // When
        GateResult result = Gates.constraintState(TABLE).evaluate(probe);

        // Then
        assertThat(result.isWarn()).isTrue();
        assertThat(result.fact(ConstraintStateGate.FACT_DISABLED)).isEqualTo(Collections.singletonList("CDR_NEW_SW_FK"));
    }

    @Test
    @DisplayName("Should fail on constraint states it cannot interpret")
    void testConstraintsUnrecognised() throws SQLException {
        // Given
        when(probe.tableExists(TABLE)).thenReturn(true);
        when(probe.constraints(TABLE)).thenReturn(Arrays.asList(
            new ConstraintInfo("CDR_NEW_PK", "P", "ENABLED"),
            new ConstraintInfo("CDR_NEW_X", "O", "ENABLED"),
            new ConstraintInfo("CDR_NEW_Y", "C", "PENDING")));

        // When
        GateResult result = Gates.constraintState(TABLE).evaluate(probe);

        // Then
        assertThat(result.isFail()).isTrue();
        assertThat(result.getDetail()).contains("CDR_NEW_X(O/ENABLED)", "CDR_NEW_Y(C/PENDING)");
    }

    @Test
    @DisplayName("Should fail the constraint gate for a missing table")
    void testConstraintsMissingTable() throws SQLException {
        // Given
        when(probe.tableExists(TABLE)).thenReturn(false);

        // When
        GateResult result = Gates.constraintState(TABLE).evaluate(probe);

        // Then
        assertThat(result.isFail()).isTrue();
        verify(probe, never()).constraints(any());
    }

    @Test
    @DisplayName("Should fail while other sessions reference the table")
    void testActiveWriters() throws SQLException {
        // Given
        when(probe.activeSessions(TABLE)).thenReturn(Arrays.asList("812", "907"));

        // When
        GateResult result = Gates.activeWriters(TABLE).evaluate(probe);

        // Then
        assertThat(result.isFail()).isTrue();
        assertThat(result.getDetail()).contains("2 active session(s)");
        assertThat(result.fact(ActiveWritersGate.FACT_SESSIONS)).isEqualTo(Arrays.asList("812", "907"));
    }

    @Test
    @DisplayName("Should pass when no other session references the table")
    void testNoActiveWriters() throws SQLException {
        // Given
        when(probe.activeSessions(TABLE)).thenReturn(Collections.emptyList());

        // Then
        assertThat(Gates.activeWriters(TABLE).evaluate(probe).isPass()).isTrue();
    }

    @Test
    @DisplayName("Should report shares and pick the lowest position as hot-swap candidate")
    @SuppressWarnings("unchecked")
    void testPartitionDistribution() throws SQLException {
        // Given - dictionary order is not position order
        List<PartitionSlice> slices = Arrays.asList(
            new PartitionSlice(TABLE, "P20260103", 3, "B3", 500),
            new PartitionSlice(TABLE, "P20260101", 1, "B1", 250),
            new PartitionSlice(TABLE, "P20260102", 2, "B2", 250));
        when(probe.partitions(TABLE)).thenReturn(slices);

        // When
        GateResult result = Gates.partitionDistribution(TABLE).evaluate(probe);

        // Then
        assertThat(result.isPass()).isTrue();
        assertThat(result.fact(PartitionDistributionGate.FACT_CANDIDATE)).isEqualTo("P20260101");
        assertThat(result.fact(PartitionDistributionGate.FACT_TOTAL_ROWS)).isEqualTo(1000L);
        Map<String, Double> shares = (Map<String, Double>) result.fact(PartitionDistributionGate.FACT_SLICES);
        assertThat(shares).containsExactly(
            entry("P20260101", 25.0), entry("P20260102", 25.0), entry("P20260103", 50.0));
    }

    @Test
    @DisplayName("Should warn when the table has no partitions")
    void testNoPartitions() throws SQLException {
        // Given
        when(probe.partitions(TABLE)).thenReturn(Collections.emptyList());

        // When
        GateResult result = Gates.partitionDistribution(TABLE).evaluate(probe);

        // Then
        assertThat(result.isWarn()).isTrue();
        assertThat(result.fact(PartitionDistributionGate.FACT_CANDIDATE)).isNull();
    }
}
