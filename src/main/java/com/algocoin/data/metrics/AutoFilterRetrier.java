package com.algocoin.data.metrics;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Wraps a {@link RemoteFetcher} and drops metrics the provider rejects,
 * retrying the batch once without them.
 *
 * <p>A batch costs at most two requests: the first attempt, and one retry
 * when the first attempt named unsupported metrics. Complexity errors and
 * unclassified errors are returned without retrying, since the same query
 * shape cannot succeed.
 */
public class AutoFilterRetrier {

    private static final Logger logger = LoggerFactory.getLogger(AutoFilterRetrier.class);

    static final int MAX_ATTEMPTS = 2;

    private final RemoteFetcher fetcher;

    public AutoFilterRetrier(RemoteFetcher fetcher) {
        this.fetcher = fetcher;
    }

    public FetchOutcome fetchWithFilter(List<String> metrics, TimeWindow window) {
        List<String> requested = metrics;
        Set<String> removed = new LinkedHashSet<>();

        for (int attempt = 1; attempt <= MAX_ATTEMPTS; attempt++) {
            FetchOutcome outcome = fetcher.fetch(requested, window);

            if (!outcome.isFailure()) {
                if (removed.isEmpty()) {
                    return outcome;
                }
                return FetchOutcome.partialFilter(removed, outcome.getRows());
            }

            if (attempt == MAX_ATTEMPTS) {
                logger.warn("Batch {} still failing after filtering {}: {}", window, removed, outcome);
                return outcome;
            }

            switch (outcome.getErrorKind()) {
                case UNSUPPORTED_METRIC:
                    break;
                case QUERY_TOO_COMPLEX:
                    return tooComplex(requested, window, outcome);
                default:
                    logger.warn("Batch {} failed with {}: {}", window, outcome.getErrorKind(), outcome.getMessages());
                    return outcome;
            }

            Set<String> rejected = requested.stream()
                    .filter(outcome.getUnsupportedMetrics()::contains)
                    .collect(Collectors.toCollection(LinkedHashSet::new));
            if (rejected.isEmpty()) {
                // the server named metrics this batch never asked for
                List<String> messages = new ArrayList<>(outcome.getMessages());
                messages.add("Unsupported metrics " + outcome.getUnsupportedMetrics()
                        + " are not part of the batch " + requested);
                return FetchOutcome.failure(FetchErrorKind.UNCLASSIFIED, messages);
            }

            List<String> filtered = requested.stream()
                    .filter(metric -> !rejected.contains(metric))
                    .collect(Collectors.toList());
            if (filtered.isEmpty()) {
                logger.warn("All metrics of batch {} were rejected: {}", window, rejected);
                return FetchOutcome.failure(FetchErrorKind.ALL_METRICS_FILTERED,
                        "All metrics filtered out; nothing to fetch. Rejected: " + rejected);
            }

            logger.warn("Filtered out unsupported metrics {} for {}", rejected, window);
            removed.addAll(rejected);
            requested = filtered;
        }

        throw new IllegalStateException("unreachable");
    }

    private FetchOutcome tooComplex(List<String> requested, TimeWindow window, FetchOutcome outcome) {
        String guidance = String.format(
                "Query too complex for %d metrics over %s (%s). Reduce metricBatchSize or timeBatchDuration.",
                requested.size(), window, window.getDuration());
        logger.error(guidance);
        List<String> messages = new ArrayList<>();
        messages.add(guidance);
        messages.addAll(outcome.getMessages());
        return FetchOutcome.failure(FetchErrorKind.QUERY_TOO_COMPLEX, messages);
    }
}
