package com.algocoin.data.store;

import java.util.Locale;

import com.google.common.base.Preconditions;

/**
 * Market an instrument trades on: spot, USD-margined or coin-margined futures.
 */
public enum MarketKind {

    SPOT("spot", 1),
    USDM("usdm", 2),
    COINM("coinm", 3);

    private final String label;
    private final int code;

    MarketKind(String label, int code) {
        this.label = label;
        this.code = code;
    }

    public String getLabel() {
        return label;
    }

    public int getCode() {
        return code;
    }

    public static MarketKind fromLabel(String label) {
        Preconditions.checkArgument(label != null, "Market must not be null");
        String lower = label.toLowerCase(Locale.ROOT);
        for (MarketKind kind : values()) {
            if (kind.label.equals(lower)) {
                return kind;
            }
        }
        throw new IllegalArgumentException("Unknown market: " + label);
    }

    @Override
    public String toString() {
        return label;
    }
}
