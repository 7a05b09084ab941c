package org.nullmask.engine;

import org.nullmask.model.Dataset;
import org.nullmask.model.InjectionSummary;

/**
 * Output of a null-injection run.
 *
 * @param dataset masked copy of the input, same schema and row count
 * @param summary counters of the run
 */
public record InjectionResult(Dataset dataset, InjectionSummary summary) {
}
