package com.algocoin.data.store;

/**
 * Candle intervals with the codes the candle table stores.
 */
public enum CandleInterval {

    S1("1s", 1),
    M1("1m", 2),
    M3("3m", 3),
    M5("5m", 4),
    M15("15m", 5),
    M30("30m", 6),
    H1("1h", 7),
    H2("2h", 8),
    H4("4h", 9),
    H6("6h", 10),
    H8("8h", 11),
    H12("12h", 12),
    D1("1d", 13),
    D3("3d", 14),
    W1("1w", 15),
    MO1("1mo", 16);

    private final String label;
    private final int code;

    CandleInterval(String label, int code) {
        this.label = label;
        this.code = code;
    }

    public String getLabel() {
        return label;
    }

    public int getCode() {
        return code;
    }

    /**
     * @throws IllegalArgumentException for a label outside the table, e.g. {@code 7m}
     */
    public static CandleInterval fromLabel(String label) {
        for (CandleInterval interval : values()) {
            if (interval.label.equals(label)) {
                return interval;
            }
        }
        throw new IllegalArgumentException("Unsupported timeframe: " + label);
    }

    @Override
    public String toString() {
        return label;
    }
}
