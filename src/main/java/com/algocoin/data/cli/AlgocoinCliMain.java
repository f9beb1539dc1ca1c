package com.algocoin.data.cli;

import java.io.File;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.time.format.DateTimeParseException;
import java.util.concurrent.Callable;

import org.slf4j.LoggerFactory;

import com.algocoin.data.cli.commands.CandlesCommand;
import com.algocoin.data.cli.commands.LunarCrushCommand;
import com.algocoin.data.cli.commands.SantimentCommand;
import com.algocoin.data.cli.commands.SentimentCommand;
import com.algocoin.data.cli.commands.UploadJsonCommand;
import com.algocoin.data.config.PipelineConfig;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.ParseResult;
import picocli.CommandLine.PropertiesDefaultProvider;

/**
 * Command line entry point for the market data tools.
 *
 * Usage:
 *   algocoin-data santiment --slug bitcoin --from 2025-03-01 --to 2025-07-01
 *   algocoin-data lunarcrush --coin BTC --from 2025-07-01 --to 2025-07-02
 *   algocoin-data candles --symbol BTCUSDT --interval 1h --start 2024-01-01 --auto-clip
 *   algocoin-data sentiment --start 2025-03-01
 *   algocoin-data upload-json --file data/bitcoin.json --dry-run
 */
@Command(
    name = "algocoin-data",
    description = "Collects sentiment time series and reads candles from the market data store",
    mixinStandardHelpOptions = true,
    version = "algocoin-data 1.0.0",
    defaultValueProvider = PropertiesDefaultProvider.class,
    subcommands = {
        SantimentCommand.class,
        LunarCrushCommand.class,
        CandlesCommand.class,
        SentimentCommand.class,
        UploadJsonCommand.class,
        CommandLine.HelpCommand.class
    }
)
public class AlgocoinCliMain implements Callable<Integer> {

    public static final String DEFAULT_CONFIG_FILE = "algocoin.properties";

    @Option(names = {"-c", "--config"},
            description = "Configuration file",
            defaultValue = DEFAULT_CONFIG_FILE)
    private File configFile;

    @Option(names = {"-v", "--verbose"},
            description = "Print stack traces on errors")
    private boolean verbose;

    @Option(names = {"--debug"},
            description = "Enable debug logging (shows progress and request details)")
    private boolean debug;

    public static void main(String[] args) {
        System.exit(run(args));
    }

    static int run(String[] args) {
        AlgocoinCliMain main = new AlgocoinCliMain();
        int exitCode = 0;
        try {
            File defaultsFile = findConfigFile(args);

            CommandLine cmd = new CommandLine(main);
            if (defaultsFile.exists()) {
                cmd.setDefaultValueProvider(new PropertiesDefaultProvider(defaultsFile));
            }

            ParseResult parseResult = cmd.parseArgs(args);
            if (!CommandLine.printHelpIfRequested(parseResult)) {
                GlobalConfig.setConfigFile(main.configFile);
                GlobalConfig.setVerbose(main.verbose);
                GlobalConfig.setDebug(main.debug);

                setLogLevel("com.algocoin", main.debug ? "INFO" : "WARN");
                setLogLevel("RequestLogger", main.debug ? "DEBUG" : "WARN");

                exitCode = cmd.execute(args);
            }
        } catch (Exception ex) {
            System.err.println("Error: " + ex.getMessage());
            exitCode = 1;
        }
        return exitCode;
    }

    /**
     * First pass over the arguments that only looks for {@code --config}.
     */
    private static File findConfigFile(String[] args) {
        try {
            CommandLine tempCmd = new CommandLine(new AlgocoinCliMain());
            tempCmd.setUnmatchedArgumentsAllowed(true);
            ParseResult tempResult = tempCmd.parseArgs(args);
            AlgocoinCliMain tempMain = tempResult.commandSpec().commandLine().getCommand();
            if (tempMain.configFile != null) {
                return tempMain.configFile;
            }
        } catch (CommandLine.ParameterException e) {
            // reported by the second pass, which sees the same arguments
            LoggerFactory.getLogger(AlgocoinCliMain.class).debug("First pass: {}", e.getMessage());
        }
        return new File(DEFAULT_CONFIG_FILE);
    }

    private static void setLogLevel(String loggerName, String levelStr) {
        Logger logger = (Logger) LoggerFactory.getLogger(loggerName);
        Level level = Level.toLevel(levelStr, Level.INFO);
        logger.setLevel(level);
    }

    @Override
    public Integer call() {
        CommandLine.usage(this, System.out);
        return 0;
    }

    /**
     * Accepts an ISO-8601 instant or a plain date, read as midnight UTC.
     */
    public static Instant parseInstant(String text) {
        if (text == null || text.trim().isEmpty()) {
            return null;
        }
        String value = text.trim();
        try {
            return Instant.parse(value);
        } catch (DateTimeParseException e) {
            try {
                return LocalDate.parse(value).atStartOfDay(ZoneOffset.UTC).toInstant();
            } catch (DateTimeParseException dateError) {
                throw new IllegalArgumentException("Not a date or ISO-8601 instant: " + text, dateError);
            }
        }
    }

    /**
     * Options of the root command, shared with the subcommands.
     */
    public static class GlobalConfig {
        private static File configFile;
        private static boolean verbose;
        private static boolean debug;

        public static PipelineConfig getPipelineConfig() {
            PipelineConfig config = PipelineConfig.load(configFile);
            if (debug && config.getDebugLevel() == 0) {
                config = config.with(PipelineConfig.DEBUG_LEVEL, "1");
            }
            return config;
        }

        public static File getConfigFile() { return configFile; }
        public static void setConfigFile(File configFile) { GlobalConfig.configFile = configFile; }

        public static boolean isVerbose() { return verbose; }
        public static void setVerbose(boolean verbose) { GlobalConfig.verbose = verbose; }

        public static boolean isDebug() { return debug; }
        public static void setDebug(boolean debug) { GlobalConfig.debug = debug; }
    }
}
