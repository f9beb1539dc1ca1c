package com.algocoin.data.cli.commands;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.concurrent.Callable;

import com.algocoin.data.cli.AlgocoinCliMain.GlobalConfig;
import com.algocoin.data.config.PipelineConfig;
import com.algocoin.data.export.WideTableJsonExporter;
import com.algocoin.data.metrics.WideTable;
import com.algocoin.data.store.SentimentStore;
import com.algocoin.data.store.StoreDataSources;

import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

/**
 * Loads a collected JSON file into the sentiment table.
 */
@Command(
    name = "upload-json",
    description = "Upload a sentiment JSON file to the store",
    mixinStandardHelpOptions = true
)
public class UploadJsonCommand implements Callable<Integer> {

    @Option(names = {"--file"}, description = "JSON file written by the santiment command", required = true)
    private Path file;

    @Option(names = {"--batch-size"}, description = "Rows per insert (default: 5000)", defaultValue = "5000")
    private int batchSize;

    @Option(names = {"--dry-run"}, description = "Preview upload without inserting data")
    private boolean dryRun;

    @Option(names = {"--create-schema"}, description = "Create the sentiment table if it does not exist")
    private boolean createSchema;

    @Override
    public Integer call() throws Exception {
        if (!Files.exists(file)) {
            System.err.println("❌ JSON file does not exist: " + file);
            return 1;
        }
        try {
            System.out.println("🎯 Starting JSON upload from " + file);
            WideTable table = new WideTableJsonExporter().read(file);
            if (table.isEmpty()) {
                System.out.println("⚠️  No data found in " + file.getFileName());
                return 0;
            }

            if (dryRun) {
                System.out.println("🔍 DRY RUN: Would upload " + table.rowCount() + " rows to the sentiment table");
                CommandOutput.printTable(table, 3);
                return 0;
            }

            PipelineConfig config = GlobalConfig.getPipelineConfig();
            SentimentStore store = new SentimentStore(StoreDataSources.fromConfig(config), config.getStoreDatabase());
            if (createSchema) {
                store.createSchema(table.getColumns());
            }
            int uploaded = store.insert(table, batchSize);
            System.out.println("✅ Successfully uploaded " + uploaded + " rows from " + file.getFileName());
            return 0;
        } catch (Exception e) {
            System.err.println("❌ Failed to upload " + file + ": " + e.getMessage());
            if (GlobalConfig.isVerbose()) {
                e.printStackTrace();
            }
            return 1;
        }
    }
}
