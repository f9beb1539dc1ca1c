package com.algocoin.data.cli.commands;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;

import com.algocoin.data.cli.AlgocoinCliMain;
import com.algocoin.data.cli.AlgocoinCliMain.GlobalConfig;
import com.algocoin.data.clients.SantimentClient;
import com.algocoin.data.clients.TimeSeriesApiClient;
import com.algocoin.data.config.PipelineConfig;
import com.algocoin.data.export.WideTableJsonExporter;
import com.algocoin.data.metrics.CollectionResult;
import com.algocoin.data.metrics.TimeSeriesCollector;
import com.algocoin.data.metrics.TimeWindow;
import com.algocoin.data.metrics.TotalConsistencyValidator;

import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

/**
 * Collects sentiment balance and social volume series for one asset from
 * Santiment and saves them as JSON.
 */
@Command(
    name = "santiment",
    description = "Collect Santiment sentiment and social volume series into a JSON file",
    mixinStandardHelpOptions = true
)
public class SantimentCommand implements Callable<Integer> {

    static final List<String> SOURCES = List.of(
            "reddit", "twitter", "telegram", "bitcointalk", "youtube_videos", "4chan");

    @Option(names = {"--slug"}, description = "Asset slug (default: bitcoin)", defaultValue = "bitcoin")
    private String slug;

    @Option(names = {"--from"}, description = "Window start, ISO-8601 instant or date", required = true)
    private String from;

    @Option(names = {"--to"}, description = "Window end (exclusive), ISO-8601 instant or date", required = true)
    private String to;

    @Option(names = {"--metrics"}, description = "Metrics to collect (comma-separated, default: sentiment_balance_* and social_volume_* of the usual sources)", split = ",")
    private List<String> metrics;

    @Option(names = {"--interval"}, description = "Sampling frequency, e.g. 5m or 1h (overrides config)")
    private String interval;

    @Option(names = {"--metric-batch-size"}, description = "Metrics per request (overrides config)")
    private Integer metricBatchSize;

    @Option(names = {"--time-batch"}, description = "Longest time span per request, e.g. 30d (overrides config)")
    private String timeBatch;

    @Option(names = {"--out"}, description = "Output JSON file")
    private Path out;

    @Override
    public Integer call() throws Exception {
        try {
            PipelineConfig config = GlobalConfig.getPipelineConfig()
                    .with(PipelineConfig.FREQUENCY, interval)
                    .with(PipelineConfig.METRIC_BATCH_SIZE, metricBatchSize == null ? null : metricBatchSize.toString())
                    .with(PipelineConfig.TIME_BATCH_DURATION, timeBatch);

            TimeWindow window = TimeWindow.of(AlgocoinCliMain.parseInstant(from), AlgocoinCliMain.parseInstant(to));
            List<String> requested = metrics == null || metrics.isEmpty() ? defaultMetrics() : metrics;

            TimeSeriesApiClient apiClient = new TimeSeriesApiClient(config);
            SantimentClient santiment = apiClient.santiment(slug);
            TimeSeriesCollector collector = apiClient.collector(santiment);

            System.out.println("📡 Fetching " + requested.size() + " metrics for " + slug + " over " + window);
            CollectionResult result = collector.collect(requested, window);

            System.out.println("🔎 Total validation: " + new TotalConsistencyValidator().validate(result.getTable()));

            Path target = out != null ? out : Paths.get(defaultFileName(window));
            new WideTableJsonExporter(true).write(result.getTable(), target);

            CommandOutput.printSummary(result, target);
            return result.getSucceededCells() == 0 && result.getCellCount() > 0 ? 1 : 0;
        } catch (Exception e) {
            System.err.println("❌ Error collecting Santiment data: " + e.getMessage());
            if (GlobalConfig.isVerbose()) {
                e.printStackTrace();
            }
            return 1;
        }
    }

    static List<String> defaultMetrics() {
        List<String> defaults = new ArrayList<>();
        for (String source : SOURCES) {
            defaults.add("sentiment_balance_" + source);
        }
        defaults.add(TotalConsistencyValidator.SENTIMENT_TOTAL);
        for (String source : SOURCES) {
            defaults.add("social_volume_" + source);
        }
        defaults.add("social_volume_total");
        return defaults;
    }

    private String defaultFileName(TimeWindow window) {
        return slug + "_sentiment_volume_" + window.getStart().toString().replace(":", "") + "_"
                + window.getEnd().toString().replace(":", "") + ".json";
    }
}
