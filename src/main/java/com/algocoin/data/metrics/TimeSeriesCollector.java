package com.algocoin.data.metrics;

import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.common.base.Preconditions;

/**
 * Collects a set of metrics over a window by splitting the work into
 * (metric batch, time batch) cells, fetching each cell through an
 * {@link AutoFilterRetrier} and merging everything onto the window's grid.
 *
 * <p>A failing cell never aborts the run; its rows stay null in the merged
 * table and the failure is reported in the {@link CollectionResult}.
 */
public class TimeSeriesCollector {

    private static final Logger logger = LoggerFactory.getLogger(TimeSeriesCollector.class);

    private final AutoFilterRetrier retrier;
    private final MetricBatcher metricBatcher;
    private final TimeRangeBatcher timeRangeBatcher;
    private final Frequency frequency;
    private final int maxConcurrentBatches;
    private final SeriesMerger merger = new SeriesMerger();

    public TimeSeriesCollector(RemoteFetcher fetcher, int metricBatchSize, Duration timeBatchDuration,
            Frequency frequency) {
        this(fetcher, new MetricBatcher(metricBatchSize), new TimeRangeBatcher(timeBatchDuration), frequency, 1);
    }

    /**
     * @param maxConcurrentBatches number of cells fetched at the same time; 1 runs them sequentially
     */
    public TimeSeriesCollector(RemoteFetcher fetcher, MetricBatcher metricBatcher,
            TimeRangeBatcher timeRangeBatcher, Frequency frequency, int maxConcurrentBatches) {
        Preconditions.checkArgument(maxConcurrentBatches > 0,
                "maxConcurrentBatches must be positive, got %s", maxConcurrentBatches);
        Preconditions.checkArgument(frequency.divides(timeRangeBatcher.getMaxDuration()),
                "Time batch duration %s must be a whole multiple of the frequency %s",
                timeRangeBatcher.getMaxDuration(), frequency);
        this.retrier = new AutoFilterRetrier(fetcher);
        this.metricBatcher = metricBatcher;
        this.timeRangeBatcher = timeRangeBatcher;
        this.frequency = frequency;
        this.maxConcurrentBatches = maxConcurrentBatches;
    }

    public CollectionResult collect(List<String> metrics, TimeWindow window) {
        BatchPlan plan = BatchPlan.create(metrics, window, metricBatcher, timeRangeBatcher);

        logger.info("🚀 Collecting {} metrics over {} at {} frequency", metrics.size(), window, frequency);
        logger.info("📦 {} metric batches x {} time batches = {} requests planned",
                plan.getMetricBatches().size(), plan.getTimeBatches().size(), plan.size());

        List<FetchOutcome> outcomes = maxConcurrentBatches > 1 && plan.size() > 1
                ? fetchConcurrently(plan)
                : fetchSequentially(plan);

        List<Map<String, List<SeriesPoint>>> perTimeBatch = new ArrayList<>();
        for (int t = 0; t < plan.getTimeBatches().size(); t++) {
            perTimeBatch.add(new LinkedHashMap<>());
        }
        List<CollectionResult.CellFailure> failures = new ArrayList<>();
        Set<String> filtered = new LinkedHashSet<>();

        for (BatchPlan.Cell cell : plan.getCells()) {
            FetchOutcome outcome = outcomes.get(cell.getIndex());
            if (outcome.isFailure()) {
                failures.add(new CollectionResult.CellFailure(cell, outcome));
                continue;
            }
            filtered.addAll(outcome.getRemovedMetrics());
            perTimeBatch.get(cell.getTimeBatchIndex()).putAll(outcome.getRows());
        }

        List<SeriesMerger.TimeBatchRows> batches = new ArrayList<>();
        for (int t = 0; t < plan.getTimeBatches().size(); t++) {
            batches.add(new SeriesMerger.TimeBatchRows(plan.getTimeBatches().get(t), perTimeBatch.get(t)));
        }

        List<String> columns = new ArrayList<>();
        for (String metric : metrics) {
            if (!filtered.contains(metric)) {
                columns.add(metric);
            }
        }
        WideTable table = merger.merge(batches, window, frequency, columns);

        if (!filtered.isEmpty()) {
            logger.warn("⚠️ Metrics rejected by the provider: {}", filtered);
        }
        if (failures.isEmpty()) {
            logger.info("✅ Collection complete: {}", table);
        } else {
            logger.warn("❌ {} of {} requests failed, their rows are left empty", failures.size(), plan.size());
            for (CollectionResult.CellFailure failure : failures) {
                logger.warn("   {}", failure);
            }
        }
        return new CollectionResult(table, failures, filtered, plan.size());
    }

    private List<FetchOutcome> fetchSequentially(BatchPlan plan) {
        List<FetchOutcome> outcomes = new ArrayList<>(plan.size());
        for (BatchPlan.Cell cell : plan.getCells()) {
            outcomes.add(fetchCell(cell, plan.size()));
        }
        return outcomes;
    }

    private List<FetchOutcome> fetchConcurrently(BatchPlan plan) {
        int threads = Math.min(maxConcurrentBatches, plan.size());
        logger.info("Running {} requests on {} threads", plan.size(), threads);
        ExecutorService executor = Executors.newFixedThreadPool(threads);
        try {
            List<Future<FetchOutcome>> futures = new ArrayList<>(plan.size());
            for (BatchPlan.Cell cell : plan.getCells()) {
                futures.add(executor.submit(() -> fetchCell(cell, plan.size())));
            }

            List<FetchOutcome> outcomes = new ArrayList<>(plan.size());
            for (int i = 0; i < futures.size(); i++) {
                try {
                    outcomes.add(futures.get(i).get());
                } catch (ExecutionException e) {
                    logger.error("Request {} failed: {}", i, e.getCause().getMessage());
                    outcomes.add(FetchOutcome.failure(FetchErrorKind.UNCLASSIFIED, String.valueOf(e.getCause())));
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    outcomes.add(FetchOutcome.failure(FetchErrorKind.TRANSPORT, "Interrupted while waiting for batch"));
                }
            }
            return outcomes;
        } finally {
            executor.shutdownNow();
        }
    }

    private FetchOutcome fetchCell(BatchPlan.Cell cell, int total) {
        logger.info("📥 Request {}/{}: {} metrics, {}", cell.getIndex() + 1, total,
                cell.getMetrics().size(), cell.getWindow());
        try {
            FetchOutcome outcome = retrier.fetchWithFilter(cell.getMetrics(), cell.getWindow());
            logger.debug("Request {} returned {}", cell.getIndex() + 1, outcome);
            return outcome;
        } catch (RuntimeException e) {
            logger.error("Error fetching {}: {}", cell, e.getMessage(), e);
            return FetchOutcome.failure(FetchErrorKind.UNCLASSIFIED, String.valueOf(e.getMessage()));
        }
    }

    public Frequency getFrequency() {
        return frequency;
    }
}
