package com.algocoin.data.store;

import java.time.Instant;

/**
 * One row of the candle table.
 */
public final class Candle {

    private final Instant openTime;
    private final double open;
    private final double high;
    private final double low;
    private final double close;
    private final double volume;
    private final double quoteVolume;
    private final double trades;
    private final double takerBase;
    private final double takerQuote;

    public Candle(Instant openTime, double open, double high, double low, double close, double volume,
            double quoteVolume, double trades, double takerBase, double takerQuote) {
        this.openTime = openTime;
        this.open = open;
        this.high = high;
        this.low = low;
        this.close = close;
        this.volume = volume;
        this.quoteVolume = quoteVolume;
        this.trades = trades;
        this.takerBase = takerBase;
        this.takerQuote = takerQuote;
    }

    public Instant getOpenTime() {
        return openTime;
    }

    public double getOpen() {
        return open;
    }

    public double getHigh() {
        return high;
    }

    public double getLow() {
        return low;
    }

    public double getClose() {
        return close;
    }

    public double getVolume() {
        return volume;
    }

    public double getQuoteVolume() {
        return quoteVolume;
    }

    public double getTrades() {
        return trades;
    }

    public double getTakerBase() {
        return takerBase;
    }

    public double getTakerQuote() {
        return takerQuote;
    }

    @Override
    public String toString() {
        return String.format("%s O=%.8f H=%.8f L=%.8f C=%.8f V=%.4f", openTime, open, high, low, close, volume);
    }
}
