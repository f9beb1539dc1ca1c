package com.algocoin.data.store;

import java.util.List;

/**
 * Read access to the candle table.
 */
public interface CandleStore {

    /**
     * Candles of the query's instrument within its range, ordered by open time.
     */
    List<Candle> fetchCandles(CandleQuery query);

    /**
     * Min and max open time for the query's instrument and interval, ignoring its range.
     */
    AvailableRange availableRange(CandleQuery query);
}
