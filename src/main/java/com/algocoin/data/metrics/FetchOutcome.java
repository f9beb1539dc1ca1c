package com.algocoin.data.metrics;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Result of fetching one batch: success, success after removing rejected
 * metrics, or a classified failure.
 */
public final class FetchOutcome {

    public enum Status {
        SUCCESS, PARTIAL_FILTER, FAILURE
    }

    private final Status status;
    private final Map<String, List<SeriesPoint>> rows;
    private final Set<String> removedMetrics;
    private final FetchErrorKind errorKind;
    private final Set<String> unsupportedMetrics;
    private final List<String> messages;

    private FetchOutcome(Status status, Map<String, List<SeriesPoint>> rows, Set<String> removedMetrics,
            FetchErrorKind errorKind, Set<String> unsupportedMetrics, List<String> messages) {
        this.status = status;
        this.rows = Collections.unmodifiableMap(new LinkedHashMap<>(rows));
        this.removedMetrics = Collections.unmodifiableSet(new LinkedHashSet<>(removedMetrics));
        this.errorKind = errorKind;
        this.unsupportedMetrics = Collections.unmodifiableSet(new LinkedHashSet<>(unsupportedMetrics));
        this.messages = List.copyOf(messages);
    }

    public static FetchOutcome success(Map<String, List<SeriesPoint>> rows) {
        return new FetchOutcome(Status.SUCCESS, rows, Set.of(), null, Set.of(), List.of());
    }

    public static FetchOutcome partialFilter(Set<String> removedMetrics, Map<String, List<SeriesPoint>> rows) {
        return new FetchOutcome(Status.PARTIAL_FILTER, rows, removedMetrics, null, Set.of(), List.of());
    }

    public static FetchOutcome failure(FetchErrorKind kind, List<String> messages) {
        return new FetchOutcome(Status.FAILURE, Map.of(), Set.of(), kind, Set.of(), messages);
    }

    public static FetchOutcome failure(FetchErrorKind kind, String message) {
        return failure(kind, List.of(message));
    }

    /**
     * Failure naming the metrics the server refused.
     */
    public static FetchOutcome unsupported(Set<String> unsupportedMetrics, List<String> messages) {
        return new FetchOutcome(Status.FAILURE, Map.of(), Set.of(),
                FetchErrorKind.UNSUPPORTED_METRIC, unsupportedMetrics, messages);
    }

    public Status getStatus() {
        return status;
    }

    public boolean isFailure() {
        return status == Status.FAILURE;
    }

    public Map<String, List<SeriesPoint>> getRows() {
        return rows;
    }

    public Set<String> getRemovedMetrics() {
        return removedMetrics;
    }

    public FetchErrorKind getErrorKind() {
        return errorKind;
    }

    public Set<String> getUnsupportedMetrics() {
        return unsupportedMetrics;
    }

    public List<String> getMessages() {
        return messages;
    }

    @Override
    public String toString() {
        switch (status) {
            case SUCCESS:
                return "Success(" + rows.keySet() + ")";
            case PARTIAL_FILTER:
                return "PartialFilter(removed=" + removedMetrics + ", " + rows.keySet() + ")";
            default:
                return "Failure(" + errorKind
                        + (unsupportedMetrics.isEmpty() ? "" : ", unsupported=" + unsupportedMetrics)
                        + ", " + messages + ")";
        }
    }
}
