package com.algocoin.data.cli.commands;

import java.nio.file.Path;
import java.util.concurrent.Callable;

import com.algocoin.data.cli.AlgocoinCliMain;
import com.algocoin.data.cli.AlgocoinCliMain.GlobalConfig;
import com.algocoin.data.config.PipelineConfig;
import com.algocoin.data.export.WideTableJsonExporter;
import com.algocoin.data.metrics.TotalConsistencyValidator;
import com.algocoin.data.metrics.WideTable;
import com.algocoin.data.store.SentimentStore;
import com.algocoin.data.store.StoreDataSources;

import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

/**
 * Prints (or exports) the stored sentiment table.
 */
@Command(
    name = "sentiment",
    description = "Read the stored sentiment table",
    mixinStandardHelpOptions = true
)
public class SentimentCommand implements Callable<Integer> {

    @Option(names = {"--start"}, description = "First timestamp (inclusive), ISO-8601 instant or date")
    private String start;

    @Option(names = {"--end"}, description = "Last timestamp (inclusive), ISO-8601 instant or date")
    private String end;

    @Option(names = {"--limit"}, description = "Rows to print, 0 for all (default: 20)", defaultValue = "20")
    private int limit;

    @Option(names = {"--validate"}, description = "Check sentiment_balance_total against its components")
    private boolean validate;

    @Option(names = {"--out"}, description = "Also write the rows to this JSON file")
    private Path out;

    @Override
    public Integer call() throws Exception {
        try {
            PipelineConfig config = GlobalConfig.getPipelineConfig();
            SentimentStore store = new SentimentStore(StoreDataSources.fromConfig(config), config.getStoreDatabase());
            WideTable table = store.read(AlgocoinCliMain.parseInstant(start), AlgocoinCliMain.parseInstant(end));

            if (table.isEmpty()) {
                System.out.println("📭 No sentiment rows found");
                return 0;
            }
            System.out.println("📊 " + table.rowCount() + " rows: " + table.firstTimestamp() + " → "
                    + table.lastTimestamp());
            CommandOutput.printTable(table, limit);

            if (validate) {
                System.out.println("🔎 Total validation: " + new TotalConsistencyValidator().validate(table));
            }
            if (out != null) {
                new WideTableJsonExporter(true).write(table, out);
                System.out.println("💾 Saved: " + out);
            }
            return 0;
        } catch (Exception e) {
            System.err.println("❌ Error reading sentiment: " + e.getMessage());
            if (GlobalConfig.isVerbose()) {
                e.printStackTrace();
            }
            return 1;
        }
    }
}
