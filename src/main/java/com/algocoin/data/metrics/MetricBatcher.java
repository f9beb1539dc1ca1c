package com.algocoin.data.metrics;

import java.util.ArrayList;
import java.util.List;

import com.google.common.base.Preconditions;
import com.google.common.collect.Lists;

/**
 * Splits the requested metric list into groups small enough for the
 * provider's query complexity limit.
 */
public class MetricBatcher {

    private final int batchSize;

    public MetricBatcher(int batchSize) {
        Preconditions.checkArgument(batchSize > 0, "Metric batch size must be positive, got %s", batchSize);
        this.batchSize = batchSize;
    }

    /**
     * Contiguous groups of at most {@code batchSize} metrics, in request order.
     */
    public List<List<String>> split(List<String> metrics) {
        List<List<String>> batches = new ArrayList<>();
        for (List<String> batch : Lists.partition(metrics, batchSize)) {
            batches.add(List.copyOf(batch));
        }
        return batches;
    }
}
