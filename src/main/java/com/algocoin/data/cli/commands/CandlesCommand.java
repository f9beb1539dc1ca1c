package com.algocoin.data.cli.commands;

import java.util.List;
import java.util.concurrent.Callable;

import com.algocoin.data.cli.AlgocoinCliMain;
import com.algocoin.data.cli.AlgocoinCliMain.GlobalConfig;
import com.algocoin.data.config.PipelineConfig;
import com.algocoin.data.store.Candle;
import com.algocoin.data.store.CandleQuery;
import com.algocoin.data.store.CandleQueryException;
import com.algocoin.data.store.JdbcCandleStore;
import com.algocoin.data.store.RangeDiagnosingReader;
import com.algocoin.data.store.StoreDataSources;

import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

/**
 * Reads candles from the store, explaining empty results.
 */
@Command(
    name = "candles",
    description = "Read candles for an instrument from the store",
    mixinStandardHelpOptions = true
)
public class CandlesCommand implements Callable<Integer> {

    @Option(names = {"--exchange"}, description = "Exchange (default: BINANCE)", defaultValue = "BINANCE")
    private String exchange;

    @Option(names = {"--symbol"}, description = "Ticker, e.g. BTCUSDT", required = true)
    private String symbol;

    @Option(names = {"--interval"}, description = "Candle interval: 1s, 1m, 3m, 5m, 15m, 30m, 1h, 2h, 4h, 6h, 8h, 12h, 1d, 3d, 1w, 1mo", required = true)
    private String interval;

    @Option(names = {"--market"}, description = "Market: spot, usdm or coinm (default: spot)", defaultValue = "spot")
    private String market;

    @Option(names = {"--start"}, description = "First open time (inclusive), ISO-8601 instant or date")
    private String start;

    @Option(names = {"--end"}, description = "Last open time (inclusive), ISO-8601 instant or date")
    private String end;

    @Option(names = {"--auto-clip"}, description = "Narrow the range to the stored data when nothing matches (default: config autoClip)")
    private Boolean autoClip;

    @Option(names = {"--limit"}, description = "Rows to print, 0 for all (default: 20)", defaultValue = "20")
    private int limit;

    @Option(names = {"--show-sql"}, description = "Log the SQL and its parameters")
    private boolean showSql;

    @Override
    public Integer call() throws Exception {
        try {
            PipelineConfig config = GlobalConfig.getPipelineConfig();
            CandleQuery query = CandleQuery.builder()
                    .exchange(exchange)
                    .symbol(symbol)
                    .interval(interval)
                    .market(market)
                    .start(AlgocoinCliMain.parseInstant(start))
                    .end(AlgocoinCliMain.parseInstant(end))
                    .autoClip(autoClip != null ? autoClip : config.isAutoClip())
                    .build();

            JdbcCandleStore store = new JdbcCandleStore(StoreDataSources.fromConfig(config), config.getStoreDatabase());
            store.setDebug(showSql);
            List<Candle> candles = new RangeDiagnosingReader(store).read(query);

            System.out.println("🕯️ " + candles.size() + " candles for " + query.getSymbol() + " " + query.getInterval()
                    + ": " + candles.get(0).getOpenTime() + " → " + candles.get(candles.size() - 1).getOpenTime());
            System.out.println(String.format("%-22s %16s %16s %16s %16s %18s %8s",
                    "open_time", "open", "high", "low", "close", "volume", "trades"));
            int shown = limit > 0 ? Math.min(limit, candles.size()) : candles.size();
            for (int i = 0; i < shown; i++) {
                Candle c = candles.get(i);
                System.out.println(String.format("%-22s %16.8f %16.8f %16.8f %16.8f %18.6f %8.0f",
                        c.getOpenTime(), c.getOpen(), c.getHigh(), c.getLow(), c.getClose(), c.getVolume(),
                        c.getTrades()));
            }
            if (shown < candles.size()) {
                System.out.println("... " + (candles.size() - shown) + " more rows");
            }
            return 0;
        } catch (CandleQueryException e) {
            System.err.println("❌ " + e.getMessage());
            if (e.getReason() == CandleQueryException.Reason.RANGE_MISMATCH) {
                System.err.println("💡 Available: " + e.getAvailableRange() + " (rerun with --auto-clip)");
            }
            return 1;
        } catch (Exception e) {
            System.err.println("❌ Error reading candles: " + e.getMessage());
            if (GlobalConfig.isVerbose()) {
                e.printStackTrace();
            }
            return 1;
        }
    }
}
