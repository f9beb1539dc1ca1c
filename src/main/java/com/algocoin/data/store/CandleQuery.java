package com.algocoin.data.store;

import java.time.Instant;

import com.google.common.base.Preconditions;

/**
 * One candle lookup: instrument, interval and an optional time range whose
 * bounds are both inclusive. A missing bound leaves that side open.
 */
public final class CandleQuery {

    private final String exchange;
    private final String symbol;
    private final SymbolParser.Pair pair;
    private final CandleInterval interval;
    private final MarketKind market;
    private final Instant start;
    private final Instant end;
    private final boolean autoClip;

    private CandleQuery(Builder builder) {
        this.exchange = Exchanges.normalize(builder.exchange);
        this.symbol = builder.symbol;
        this.pair = SymbolParser.parse(builder.symbol);
        this.interval = builder.interval;
        this.market = builder.market;
        this.start = builder.start;
        this.end = builder.end;
        this.autoClip = builder.autoClip;
    }

    public static Builder builder() {
        return new Builder();
    }

    public String getExchange() {
        return exchange;
    }

    public int getExchangeId() {
        return Exchanges.idOf(exchange);
    }

    public String getSymbol() {
        return symbol;
    }

    public SymbolParser.Pair getPair() {
        return pair;
    }

    public CandleInterval getInterval() {
        return interval;
    }

    public MarketKind getMarket() {
        return market;
    }

    public Instant getStart() {
        return start;
    }

    public Instant getEnd() {
        return end;
    }

    public boolean isAutoClip() {
        return autoClip;
    }

    /**
     * Same instrument with another range.
     */
    public CandleQuery withRange(Instant newStart, Instant newEnd) {
        return toBuilder().start(newStart).end(newEnd).build();
    }

    public CandleQuery withAutoClip(boolean enabled) {
        return toBuilder().autoClip(enabled).build();
    }

    private Builder toBuilder() {
        return new Builder().exchange(exchange).symbol(symbol).interval(interval).market(market)
                .start(start).end(end).autoClip(autoClip);
    }

    @Override
    public String toString() {
        return symbol + " " + interval + " on " + exchange + " (" + market + ") " + start + " .. " + end
                + (autoClip ? " auto-clip" : "");
    }

    public static class Builder {
        private String exchange = Exchanges.BINANCE;
        private String symbol;
        private CandleInterval interval;
        private MarketKind market = MarketKind.SPOT;
        private Instant start;
        private Instant end;
        private boolean autoClip;

        public Builder exchange(String exchange) {
            this.exchange = exchange;
            return this;
        }

        public Builder symbol(String symbol) {
            this.symbol = symbol;
            return this;
        }

        public Builder interval(CandleInterval interval) {
            this.interval = interval;
            return this;
        }

        public Builder interval(String label) {
            return interval(CandleInterval.fromLabel(label));
        }

        public Builder market(MarketKind market) {
            this.market = market;
            return this;
        }

        public Builder market(String label) {
            return market(MarketKind.fromLabel(label));
        }

        public Builder start(Instant start) {
            this.start = start;
            return this;
        }

        public Builder end(Instant end) {
            this.end = end;
            return this;
        }

        public Builder autoClip(boolean autoClip) {
            this.autoClip = autoClip;
            return this;
        }

        public CandleQuery build() {
            Preconditions.checkArgument(symbol != null && !symbol.isEmpty(), "Symbol must not be empty");
            Preconditions.checkArgument(interval != null, "Interval must be set");
            Preconditions.checkArgument(market != null, "Market must be set");
            return new CandleQuery(this);
        }
    }
}
