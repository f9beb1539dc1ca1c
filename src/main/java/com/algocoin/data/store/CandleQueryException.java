package com.algocoin.data.store;

import java.time.Instant;

/**
 * A candle query that found nothing, with the range the store does hold.
 */
public class CandleQueryException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    public enum Reason {
        /** The store has no rows for the instrument and interval at all. */
        NO_DATA,
        /** The store has rows, none of them in the requested range. */
        RANGE_MISMATCH
    }

    private final Reason reason;
    private final Instant requestedStart;
    private final Instant requestedEnd;
    private final transient AvailableRange availableRange;

    public CandleQueryException(Reason reason, String message, Instant requestedStart, Instant requestedEnd,
            AvailableRange availableRange) {
        super(message);
        this.reason = reason;
        this.requestedStart = requestedStart;
        this.requestedEnd = requestedEnd;
        this.availableRange = availableRange;
    }

    public Reason getReason() {
        return reason;
    }

    public Instant getRequestedStart() {
        return requestedStart;
    }

    public Instant getRequestedEnd() {
        return requestedEnd;
    }

    public AvailableRange getAvailableRange() {
        return availableRange;
    }
}
