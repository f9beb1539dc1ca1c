package com.algocoin.data.cli.commands;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Instant;
import java.util.List;
import java.util.concurrent.Callable;

import com.algocoin.data.cli.AlgocoinCliMain;
import com.algocoin.data.cli.AlgocoinCliMain.GlobalConfig;
import com.algocoin.data.clients.LunarCrushClient;
import com.algocoin.data.clients.TimeSeriesApiClient;
import com.algocoin.data.config.PipelineConfig;
import com.algocoin.data.export.WideTableJsonExporter;
import com.algocoin.data.metrics.CollectionResult;
import com.algocoin.data.metrics.TimeWindow;

import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

/**
 * Collects the LunarCrush coin time series and saves it as JSON.
 */
@Command(
    name = "lunarcrush",
    description = "Collect LunarCrush sentiment series for a coin into a JSON file",
    mixinStandardHelpOptions = true
)
public class LunarCrushCommand implements Callable<Integer> {

    @Option(names = {"--coin"}, description = "Coin symbol or name (default: BTC)", defaultValue = "BTC")
    private String coin;

    @Option(names = {"--from"}, description = "Window start, ISO-8601 instant or date", required = true)
    private String from;

    @Option(names = {"--to"}, description = "Window end (exclusive), ISO-8601 instant or date", required = true)
    private String to;

    @Option(names = {"--metrics"}, description = "Fields to keep (comma-separated, default: every sentiment field)", split = ",")
    private List<String> metrics;

    @Option(names = {"--interval"}, description = "Sampling frequency (default: 1h)", defaultValue = "1h")
    private String interval;

    @Option(names = {"--no-volume"}, description = "Leave out social_volume_* and social_dominance fields")
    private boolean noVolume;

    @Option(names = {"--out"}, description = "Output JSON file")
    private Path out;

    @Override
    public Integer call() throws Exception {
        try {
            PipelineConfig config = GlobalConfig.getPipelineConfig().with(PipelineConfig.FREQUENCY, interval);
            TimeWindow window = TimeWindow.of(AlgocoinCliMain.parseInstant(from), AlgocoinCliMain.parseInstant(to));

            TimeSeriesApiClient apiClient = new TimeSeriesApiClient(config);
            LunarCrushClient lunarCrush = apiClient.lunarCrush(coin);

            List<String> requested = metrics;
            if (requested == null || requested.isEmpty()) {
                requested = lunarCrush.discoverMetrics(firstBatch(window, config), !noVolume);
                System.out.println("🔍 Selected fields: " + requested);
                if (requested.isEmpty()) {
                    System.err.println("❌ No data received for " + coin + " in the first part of " + window);
                    return 1;
                }
            }

            System.out.println("📡 Fetching " + coin + " " + interval + " " + window.getStart() + " → " + window.getEnd());
            CollectionResult result = apiClient.collector(lunarCrush).collect(requested, window);

            Path target = out != null ? out : Paths.get(coin.toLowerCase() + "_lunarcrush_" + interval + "_"
                    + window.getStart().toString().replace(":", "") + "_"
                    + window.getEnd().toString().replace(":", "") + ".json");
            new WideTableJsonExporter(false).write(result.getTable(), target);

            CommandOutput.printSummary(result, target);
            return result.getSucceededCells() == 0 && result.getCellCount() > 0 ? 1 : 0;
        } catch (Exception e) {
            System.err.println("❌ Error collecting LunarCrush data: " + e.getMessage());
            if (GlobalConfig.isVerbose()) {
                e.printStackTrace();
            }
            return 1;
        }
    }

    private static TimeWindow firstBatch(TimeWindow window, PipelineConfig config) {
        Instant end = window.getStart().plus(config.getTimeBatchDuration());
        return TimeWindow.of(window.getStart(), end.isBefore(window.getEnd()) ? end : window.getEnd());
    }
}
