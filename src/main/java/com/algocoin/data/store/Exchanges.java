package com.algocoin.data.store;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

import com.google.common.base.Preconditions;

/**
 * Exchange names known to the candle store, mapped to their ids.
 */
public final class Exchanges {

    public static final String BINANCE = "BINANCE";

    private static final Map<String, Integer> NAME_TO_ID;

    static {
        Map<String, Integer> ids = new LinkedHashMap<>();
        ids.put(BINANCE, 1);
        NAME_TO_ID = Collections.unmodifiableMap(ids);
    }

    private Exchanges() {
    }

    /**
     * Case-insensitive lookup.
     *
     * @throws IllegalArgumentException for an exchange the store does not know
     */
    public static int idOf(String name) {
        Preconditions.checkArgument(name != null, "Exchange must not be null");
        Integer id = NAME_TO_ID.get(name.toUpperCase(Locale.ROOT));
        Preconditions.checkArgument(id != null, "Unknown exchange: %s", name);
        return id;
    }

    public static String normalize(String name) {
        idOf(name);
        return name.toUpperCase(Locale.ROOT);
    }

    public static List<String> names() {
        List<String> names = new ArrayList<>(NAME_TO_ID.keySet());
        Collections.sort(names);
        return names;
    }
}
