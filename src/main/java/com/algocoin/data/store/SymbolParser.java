package com.algocoin.data.store;

import java.util.Objects;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import com.google.common.base.Preconditions;

/**
 * Splits exchange tickers such as {@code BTCUSDT} into base and quote codes.
 */
public final class SymbolParser {

    private static final Pattern SYMBOL = Pattern.compile(
            "^(.*?)(USDT|BUSD|FDUSD|USDC|BTC|ETH|BNB|SOL|TRX|TRY|EUR|GBP|AUD|RUB|USD)$");

    private SymbolParser() {
    }

    /**
     * Matches a known quote suffix; tickers without one are split in the middle.
     */
    public static Pair parse(String symbol) {
        Preconditions.checkArgument(symbol != null && !symbol.isEmpty(), "Symbol must not be empty");
        Matcher matcher = SYMBOL.matcher(symbol);
        if (matcher.matches()) {
            return new Pair(matcher.group(1), matcher.group(2));
        }
        int mid = symbol.length() / 2;
        return new Pair(symbol.substring(0, mid), symbol.substring(mid));
    }

    public static final class Pair {
        private final String base;
        private final String quote;

        public Pair(String base, String quote) {
            this.base = base;
            this.quote = quote;
        }

        public String getBase() {
            return base;
        }

        public String getQuote() {
            return quote;
        }

        @Override
        public boolean equals(Object o) {
            if (this == o) return true;
            if (!(o instanceof Pair)) return false;
            Pair other = (Pair) o;
            return base.equals(other.base) && quote.equals(other.quote);
        }

        @Override
        public int hashCode() {
            return Objects.hash(base, quote);
        }

        @Override
        public String toString() {
            return base + "/" + quote;
        }
    }
}
