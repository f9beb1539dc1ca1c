package com.algocoin.data.store;

import java.time.Instant;
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.common.base.Preconditions;

/**
 * Reads candles and explains empty results. When a query returns nothing the
 * store is asked which range it holds for the instrument; the caller then
 * gets either an error naming that range or, with auto-clip enabled, the
 * result of one retry over the intersection of both ranges.
 */
public class RangeDiagnosingReader {

    private static final Logger logger = LoggerFactory.getLogger(RangeDiagnosingReader.class);

    private final CandleStore store;

    public RangeDiagnosingReader(CandleStore store) {
        this.store = store;
    }

    /**
     * @return the candles of the query, never empty
     * @throws CandleQueryException with {@link CandleQueryException.Reason#NO_DATA} when the store holds
     *         nothing for the instrument, or {@link CandleQueryException.Reason#RANGE_MISMATCH} when it holds
     *         data outside the requested range and auto-clip is off
     */
    public List<Candle> read(CandleQuery query) {
        if (query.getStart() != null && query.getEnd() != null) {
            Preconditions.checkArgument(!query.getStart().isAfter(query.getEnd()),
                    "Start %s is after end %s", query.getStart(), query.getEnd());
        }
        return execute(query);
    }

    private List<Candle> execute(CandleQuery query) {
        List<Candle> candles = store.fetchCandles(query);
        if (!candles.isEmpty()) {
            logger.debug("{} candles for {}", candles.size(), query);
            return candles;
        }

        AvailableRange range = store.availableRange(query);
        if (range.isEmpty()) {
            throw new CandleQueryException(CandleQueryException.Reason.NO_DATA,
                    String.format("No data for %s on %s (%s) for interval '%s' (code %d).",
                            query.getSymbol(), query.getExchange(), query.getMarket(),
                            query.getInterval(), query.getInterval().getCode()),
                    query.getStart(), query.getEnd(), range);
        }

        if (query.isAutoClip()) {
            Instant clippedStart = query.getStart() == null ? range.getMin() : max(range.getMin(), query.getStart());
            Instant clippedEnd = query.getEnd() == null ? range.getMax() : min(range.getMax(), query.getEnd());
            logger.info("⤵️ Auto-clipping {} {} to {} … {}", query.getSymbol(), query.getInterval(),
                    clippedStart, clippedEnd);
            // the retry runs with auto-clip off so it can only succeed or fail
            return execute(query.withRange(clippedStart, clippedEnd).withAutoClip(false));
        }

        throw new CandleQueryException(CandleQueryException.Reason.RANGE_MISMATCH,
                String.format("No rows for %s %s in range %s … %s. In the DB this interval covers: %s … %s. "
                        + "Check the date or use auto-clip.",
                        query.getSymbol(), query.getInterval(), query.getStart(), query.getEnd(),
                        range.getMin(), range.getMax()),
                query.getStart(), query.getEnd(), range);
    }

    private static Instant max(Instant a, Instant b) {
        return a.isAfter(b) ? a : b;
    }

    private static Instant min(Instant a, Instant b) {
        return a.isBefore(b) ? a : b;
    }
}
