package com.telcobright.repartition.core.partition;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.*;

@DisplayName("PartitionScheme Tests")
class PartitionSchemeTest {

    @Test
    @DisplayName("Should keep bounds in declaration order")
    void testRangeScheme() {
        // When
        PartitionScheme scheme = PartitionScheme.builder(PartitionType.RANGE)
            .keyColumn("CALL_DATE")
            .bound("P2025", "TO_DATE('2026-01-01','YYYY-MM-DD')")
            .bound("PMAX", " MAXVALUE ")
            .build();

        // Then
        assertThat(scheme.isPartitioned()).isTrue();
        assertThat(scheme.getBounds()).extracting(PartitionBound::getName).containsExactly("P2025", "PMAX");
        assertThat(scheme.getBounds().get(1).getExpression()).isEqualTo("MAXVALUE");
        assertThat(scheme.toString()).isEqualTo("RANGE[CALL_DATE]");
    }

    @Test
    @DisplayName("Should treat the unpartitioned scheme as a heap table")
    void testUnpartitioned() {
        assertThat(PartitionScheme.unpartitioned().isPartitioned()).isFalse();
        assertThat(PartitionScheme.unpartitioned().getKeyColumns()).isEmpty();
        assertThat(PartitionScheme.unpartitioned().toString()).isEqualTo("NONE");
    }

    @Test
    @DisplayName("Should reject schemes missing what their type requires")
    void testIncompleteSchemes() {
        assertThatThrownBy(() -> PartitionScheme.builder(PartitionType.RANGE).bound("P1", "10").build())
            .isInstanceOf(IllegalStateException.class)
            .hasMessageContaining("key column");
        assertThatThrownBy(() -> PartitionScheme.builder(PartitionType.LIST).keyColumn("REGION").build())
            .isInstanceOf(IllegalStateException.class)
            .hasMessageContaining("at least one bound");
        assertThatThrownBy(() -> PartitionScheme.builder(PartitionType.INTERVAL).keyColumn("CALL_DATE")
                .bound("P_INIT", "10").build())
            .isInstanceOf(IllegalStateException.class)
            .hasMessageContaining("interval expression");
        assertThatThrownBy(() -> PartitionScheme.builder(PartitionType.HASH).keyColumn("ID").build())
            .isInstanceOf(IllegalStateException.class)
            .hasMessageContaining("positive partition count");
        assertThatThrownBy(() -> PartitionScheme.builder(PartitionType.RANGE).keyColumn("CALL_DATE")
                .bound("P1", "10").subpartition(PartitionType.HASH, "MSISDN", 0).build())
            .isInstanceOf(IllegalStateException.class)
            .hasMessageContaining("subpartition count");
    }

    @Test
    @DisplayName("Should reject bound expressions that are not a single expression")
    void testBoundValidation() {
        assertThatThrownBy(() -> new PartitionBound("P1", "10; DROP TABLE CDR"))
            .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new PartitionBound("P1", " "))
            .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new PartitionBound("1P", "10"))
            .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    @DisplayName("Should allow INTERVAL only where the database supports it")
    void testValidateSupported() {
        assertThatCode(() -> PartitionType.INTERVAL.validateSupported(true)).doesNotThrowAnyException();
        assertThatCode(() -> PartitionType.RANGE.validateSupported(false)).doesNotThrowAnyException();
        assertThatThrownBy(() -> PartitionType.INTERVAL.validateSupported(false))
            .isInstanceOf(UnsupportedOperationException.class)
            .hasMessageContaining("Partition type INTERVAL is not supported");
    }
}
