package com.algocoin.data.store;

import static org.junit.jupiter.api.Assertions.*;

import java.time.Instant;

import org.junit.jupiter.api.Test;

public class CandleQueryTest {

    @Test
    public void intervalLabelsMapToStoreCodes() {
        assertEquals(CandleInterval.S1, CandleInterval.fromLabel("1s"));
        assertEquals(7, CandleInterval.fromLabel("1h").getCode());
        assertEquals(13, CandleInterval.fromLabel("1d").getCode());
        assertEquals(16, CandleInterval.fromLabel("1mo").getCode());

        IllegalArgumentException error = assertThrows(IllegalArgumentException.class,
                () -> CandleInterval.fromLabel("7m"));
        assertEquals("Unsupported timeframe: 7m", error.getMessage());
    }

    @Test
    public void marketsAndExchanges() {
        assertEquals(MarketKind.USDM, MarketKind.fromLabel("USDM"));
        assertEquals(3, MarketKind.fromLabel("coinm").getCode());
        assertThrows(IllegalArgumentException.class, () -> MarketKind.fromLabel("options"));

        assertEquals(1, Exchanges.idOf("binance"));
        assertThrows(IllegalArgumentException.class, () -> Exchanges.idOf("KRAKEN"));
    }

    @Test
    public void builderDefaultsAndCopies() {
        CandleQuery query = CandleQuery.builder()
                .exchange("binance")
                .symbol("BTCUSDT")
                .interval("1h")
                .start(Instant.parse("2024-01-01T00:00:00Z"))
                .build();

        assertEquals("BINANCE", query.getExchange());
        assertEquals(1, query.getExchangeId());
        assertEquals(MarketKind.SPOT, query.getMarket());
        assertEquals("USDT", query.getPair().getQuote());
        assertNull(query.getEnd());
        assertFalse(query.isAutoClip());

        Instant newEnd = Instant.parse("2024-02-01T00:00:00Z");
        CandleQuery copy = query.withRange(query.getStart(), newEnd).withAutoClip(true);
        assertEquals(newEnd, copy.getEnd());
        assertTrue(copy.isAutoClip());
        assertEquals(CandleInterval.H1, copy.getInterval());
        assertNull(query.getEnd());
    }

    @Test
    public void symbolAndIntervalAreRequired() {
        assertThrows(IllegalArgumentException.class, () -> CandleQuery.builder().interval("1h").build());
        assertThrows(IllegalArgumentException.class, () -> CandleQuery.builder().symbol("BTCUSDT").build());
        assertThrows(IllegalArgumentException.class,
                () -> CandleQuery.builder().exchange("KRAKEN").symbol("BTCUSDT").interval("1h").build());
    }
}
