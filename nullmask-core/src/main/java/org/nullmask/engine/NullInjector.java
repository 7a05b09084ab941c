package org.nullmask.engine;

import org.nullmask.config.ConfigException;
import org.nullmask.config.InjectionConfig;
import org.nullmask.model.Dataset;
import org.nullmask.model.InjectionSummary;
import org.nullmask.model.Row;
import org.nullmask.model.Value;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Replaces selected cells of a dataset with the null marker.
 * <p>
 * For each cell, in schema order, the checks run cheapest first: column eligibility, already-null,
 * pattern match, then the per-cell draw. The input dataset is never modified. With a parallelism
 * above 1 rows are split into contiguous ranges; since every decision is a pure function of
 * (seed, rowIndex, columnName, value) the output does not depend on the number of workers.
 */
public class NullInjector {

    private static final Logger log = LoggerFactory.getLogger(NullInjector.class);

    /**
     * Creates the sampler for a run.
     */
    @FunctionalInterface
    interface SamplerFactory {
        ProbabilitySampler create(long seed, double probability);
    }

    private final SamplerFactory samplerFactory;

    public NullInjector() {
        this(ProbabilitySampler::new);
    }

    NullInjector(SamplerFactory samplerFactory) {
        this.samplerFactory = samplerFactory;
    }

    /**
     * @throws ConfigException       if the configured columns are not all part of the schema
     * @throws CancellationException if the calling thread is interrupted between rows
     */
    public InjectionResult inject(Dataset dataset, InjectionConfig config) {
        Objects.requireNonNull(dataset, "dataset must not be null");
        Objects.requireNonNull(config, "config must not be null");

        ColumnSelector selector = ColumnSelector.resolve(dataset.schema(), config.columns());
        PatternMatcher matcher = PatternMatcher.of(config.pattern());
        ProbabilitySampler sampler = samplerFactory.create(config.seed(), config.probability());
        CellWalk walk = new CellWalk(dataset, selector, matcher, sampler);

        int workers = Math.max(1, Math.min(config.parallelism(), dataset.size()));
        Row[] output = new Row[dataset.size()];
        InjectionSummary summary = workers == 1
                ? walk.run(0, dataset.size(), output)
                : runParallel(walk, workers, output);

        log.info("Null injection finished: {} rows, {} of {} candidate cells replaced (probability={}, seed={})",
                summary.getRowsProcessed(), summary.getCellsReplaced(), summary.getCandidateCells(),
                config.probability(), config.seed());

        return new InjectionResult(Dataset.of(dataset.schema(), Arrays.asList(output)), summary);
    }

    private InjectionSummary runParallel(CellWalk walk, int workers, Row[] output) {
        int size = output.length;
        int chunk = (size + workers - 1) / workers;
        ExecutorService pool = Executors.newFixedThreadPool(workers, new WorkerThreadFactory());
        try {
            List<Future<InjectionSummary>> partials = new ArrayList<>();
            for (int from = 0; from < size; from += chunk) {
                int start = from;
                int end = Math.min(size, from + chunk);
                partials.add(pool.submit(() -> walk.run(start, end, output)));
            }

            InjectionSummary summary = InjectionSummary.empty(walk.selector.eligibleColumns());
            for (Future<InjectionSummary> partial : partials) {
                summary = summary.merge(partial.get());
            }
            return summary;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new CancellationException("Null injection interrupted");
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof RuntimeException re) throw re;
            if (cause instanceof Error err) throw err;
            throw new IllegalStateException("Null injection worker failed", cause);
        } finally {
            pool.shutdownNow();
        }
    }

    /**
     * Walks a range of rows. Holds no mutable state; each call keeps its own counters.
     */
    private static final class CellWalk {
        private final Dataset dataset;
        private final ColumnSelector selector;
        private final PatternMatcher matcher;
        private final ProbabilitySampler sampler;

        CellWalk(Dataset dataset, ColumnSelector selector, PatternMatcher matcher, ProbabilitySampler sampler) {
            this.dataset = dataset;
            this.selector = selector;
            this.matcher = matcher;
            this.sampler = sampler;
        }

        InjectionSummary run(int from, int to, Row[] output) {
            List<String> schema = dataset.schema();
            long[] replacedPerColumn = new long[schema.size()];
            long examined = 0;
            long candidates = 0;
            long replaced = 0;

            for (int i = from; i < to; i++) {
                if (Thread.currentThread().isInterrupted()) {
                    throw new CancellationException("Null injection cancelled at row " + i);
                }
                Row row = dataset.row(i);
                Map<String, Value> cells = new LinkedHashMap<>();
                for (int c = 0; c < schema.size(); c++) {
                    String column = schema.get(c);
                    Value value = row.get(column);
                    examined++;
                    if (selector.contains(column) && !value.isNull() && matcher.matches(value)) {
                        candidates++;
                        if (sampler.draw(i, column)) {
                            value = Value.nullValue();
                            replaced++;
                            replacedPerColumn[c]++;
                            log.debug("Replaced value at row {}, column '{}' with null", i, column);
                        }
                    }
                    cells.put(column, value);
                }
                output[i] = Row.of(cells);
            }

            Map<String, Long> perColumn = new LinkedHashMap<>();
            for (int c = 0; c < schema.size(); c++) {
                String column = schema.get(c);
                if (selector.contains(column)) {
                    perColumn.put(column, replacedPerColumn[c]);
                }
            }
            return new InjectionSummary(to - from, examined, candidates, replaced, perColumn);
        }
    }

    private static final class WorkerThreadFactory implements ThreadFactory {
        private final AtomicInteger counter = new AtomicInteger();

        @Override
        public Thread newThread(Runnable r) {
            Thread t = new Thread(r, "nullmask-worker-" + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        }
    }
}
