package com.algocoin.data.metrics;

/**
 * Closed classification of a failed fetch. Provider clients map their raw
 * error text onto these kinds; nothing downstream parses messages.
 */
public enum FetchErrorKind {

    /** Network failure, timeout or non-2xx response. */
    TRANSPORT,

    /** The server rejected one or more named metrics; recoverable by one filter-retry. */
    UNSUPPORTED_METRIC,

    /** The server rejected the shape of the whole query. */
    QUERY_TOO_COMPLEX,

    /** Every metric of the batch was rejected. */
    ALL_METRICS_FILTERED,

    /** Any other server-reported error. */
    UNCLASSIFIED
}
