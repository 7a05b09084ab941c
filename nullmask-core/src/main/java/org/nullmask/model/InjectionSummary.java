package org.nullmask.model;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Counters of a null-injection run. Instances are immutable and combine with {@link #merge},
 * which is associative and commutative so partial summaries from workers can be summed in any order.
 */
@Getter
@ToString
@EqualsAndHashCode
public final class InjectionSummary {

    private final long rowsProcessed;
    private final long cellsExamined;
    private final long candidateCells;
    private final long cellsReplaced;
    private final Map<String, Long> replacedPerColumn;

    public InjectionSummary(long rowsProcessed, long cellsExamined, long candidateCells,
                            long cellsReplaced, Map<String, Long> replacedPerColumn) {
        this.rowsProcessed = rowsProcessed;
        this.cellsExamined = cellsExamined;
        this.candidateCells = candidateCells;
        this.cellsReplaced = cellsReplaced;
        this.replacedPerColumn = Collections.unmodifiableMap(new LinkedHashMap<>(replacedPerColumn));
    }

    /**
     * A zero summary listing every given column with a count of 0.
     */
    public static InjectionSummary empty(Collection<String> columns) {
        Map<String, Long> perColumn = new LinkedHashMap<>();
        columns.forEach(c -> perColumn.put(c, 0L));
        return new InjectionSummary(0, 0, 0, 0, perColumn);
    }

    public InjectionSummary merge(InjectionSummary other) {
        Map<String, Long> perColumn = new LinkedHashMap<>(replacedPerColumn);
        other.replacedPerColumn.forEach((column, count) -> perColumn.merge(column, count, Long::sum));
        return new InjectionSummary(
                rowsProcessed + other.rowsProcessed,
                cellsExamined + other.cellsExamined,
                candidateCells + other.candidateCells,
                cellsReplaced + other.cellsReplaced,
                perColumn);
    }

    /**
     * Share of candidate cells that were replaced, or 0 when there were no candidates.
     */
    public double replacedFraction() {
        return candidateCells == 0 ? 0.0 : (double) cellsReplaced / candidateCells;
    }

    public long replacedIn(String column) {
        return replacedPerColumn.getOrDefault(column, 0L);
    }
}
