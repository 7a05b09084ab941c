package org.nullmask.model;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class InjectionSummaryTest {

    private final InjectionSummary a = new InjectionSummary(2, 4, 3, 1, Map.of("x", 1L, "y", 0L));
    private final InjectionSummary b = new InjectionSummary(3, 6, 5, 4, Map.of("x", 2L, "y", 2L));
    private final InjectionSummary c = new InjectionSummary(1, 2, 2, 2, Map.of("x", 1L, "y", 1L));

    @Test
    @DisplayName("merge sums every counter")
    void merge_sums() {
        InjectionSummary merged = a.merge(b);

        assertThat(merged.getRowsProcessed()).isEqualTo(5);
        assertThat(merged.getCellsExamined()).isEqualTo(10);
        assertThat(merged.getCandidateCells()).isEqualTo(8);
        assertThat(merged.getCellsReplaced()).isEqualTo(5);
        assertThat(merged.replacedIn("x")).isEqualTo(3);
        assertThat(merged.replacedIn("y")).isEqualTo(2);
    }

    @Test
    @DisplayName("merge is associative and commutative")
    void merge_orderIndependent() {
        assertThat(a.merge(b).merge(c)).isEqualTo(a.merge(b.merge(c)));
        assertThat(a.merge(b)).isEqualTo(b.merge(a));
    }

    @Test
    @DisplayName("empty summary is the identity of merge")
    void empty_isIdentity() {
        InjectionSummary empty = InjectionSummary.empty(List.of("x", "y"));

        assertThat(empty.merge(a)).isEqualTo(a);
        assertThat(empty.getReplacedPerColumn()).containsExactly(Map.entry("x", 0L), Map.entry("y", 0L));
    }

    @Test
    @DisplayName("replaced fraction is relative to candidate cells")
    void replacedFraction() {
        assertThat(b.replacedFraction()).isEqualTo(0.8);
        assertThat(InjectionSummary.empty(List.of("x")).replacedFraction()).isZero();
    }
}
