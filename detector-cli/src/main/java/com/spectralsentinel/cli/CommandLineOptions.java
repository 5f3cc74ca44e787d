package com.spectralsentinel.cli;

import com.spectralsentinel.core.config.DetectorConfig;
import com.spectralsentinel.core.config.DetectorConfigLoader;
import com.spectralsentinel.core.detection.GradientMode;
import org.apache.commons.cli.CommandLine;
import org.apache.commons.cli.CommandLineParser;
import org.apache.commons.cli.DefaultParser;
import org.apache.commons.cli.HelpFormatter;
import org.apache.commons.cli.Option;
import org.apache.commons.cli.Options;
import org.apache.commons.cli.ParseException;

import java.io.PrintWriter;
import java.util.List;
import java.util.function.Function;

/**
 * Command-line surface of the detector.
 *
 * <p>
 * Hyperparameters resolve in three layers: built-in defaults, then the YAML
 * file given with {@code --config} (or {@link DetectorConfigLoader#load()}
 * when absent), then the individual flags.
 * </p>
 */
public final class CommandLineOptions {

    static final String SYNTAX = "spectral-sentinel [options] [path]";

    static final String SALIENCY_WINDOW = "q";
    static final String SCORE_WINDOW = "z";
    static final String THRESHOLD = "t";
    static final String EXTRAPOLATION_WINDOW = "m";
    static final String EXTRAPOLATED_POINTS = "k";
    static final String CONFIG = "c";
    static final String GRADIENT_MODE = "g";
    static final String INPUT_TIME_FORMAT = "input-time-format";
    static final String OUTPUT_TIME_FORMAT = "output-time-format";
    static final String FORMAT = "f";
    static final String OUTPUT = "o";
    static final String HELP = "h";

    private static final Options OPTIONS = buildOptions();

    private CommandLineOptions() {
    }

    /**
     * @throws ParseException on unknown options, missing arguments or more than one path
     */
    public static CommandLine parse(String[] args) throws ParseException {
        CommandLineParser parser = new DefaultParser();
        CommandLine cmd = parser.parse(OPTIONS, args);
        if (cmd.getArgList().size() > 1) {
            throw new ParseException("Expected at most one input path, got " + cmd.getArgList());
        }
        return cmd;
    }

    public static boolean isHelpRequested(CommandLine cmd) {
        return cmd.hasOption(HELP);
    }

    /**
     * Resolve a parsed command line into a validated {@link RunConfig}.
     *
     * @throws ParseException           if a flag value is not of the expected kind
     * @throws IllegalArgumentException if the configuration file does not exist
     * @throws IllegalStateException    if the resulting configuration is invalid
     */
    public static RunConfig toRunConfig(CommandLine cmd) throws ParseException {
        DetectorConfig detector = cmd.hasOption(CONFIG)
                ? DetectorConfigLoader.fromFile(cmd.getOptionValue(CONFIG))
                : DetectorConfigLoader.load();

        if (cmd.hasOption(SALIENCY_WINDOW)) {
            detector.setSaliencyWindow(intValue(cmd, SALIENCY_WINDOW));
        }
        if (cmd.hasOption(SCORE_WINDOW)) {
            detector.setScoreWindow(intValue(cmd, SCORE_WINDOW));
        }
        if (cmd.hasOption(THRESHOLD)) {
            detector.setThreshold(value(cmd, THRESHOLD, Float::parseFloat));
        }
        if (cmd.hasOption(EXTRAPOLATION_WINDOW)) {
            detector.setExtrapolationWindow(intValue(cmd, EXTRAPOLATION_WINDOW));
        }
        if (cmd.hasOption(EXTRAPOLATED_POINTS)) {
            detector.setExtrapolatedPoints(intValue(cmd, EXTRAPOLATED_POINTS));
        }
        if (cmd.hasOption(GRADIENT_MODE)) {
            detector.setGradientMode(value(cmd, GRADIENT_MODE, GradientMode::fromName).configName());
        }

        RunConfig.Builder builder = new RunConfig.Builder()
                .detectorConfig(detector)
                .outputPath(cmd.getOptionValue(OUTPUT));
        List<String> paths = cmd.getArgList();
        if (!paths.isEmpty()) {
            builder.inputPath(paths.get(0));
        }
        if (cmd.hasOption(INPUT_TIME_FORMAT)) {
            builder.inputTimeFormat(value(cmd, INPUT_TIME_FORMAT, TimestampFormat::fromName));
        }
        if (cmd.hasOption(OUTPUT_TIME_FORMAT)) {
            builder.outputTimeFormat(value(cmd, OUTPUT_TIME_FORMAT, TimestampFormat::fromName));
        }
        if (cmd.hasOption(FORMAT)) {
            builder.outputFormat(value(cmd, FORMAT, OutputFormat::fromName));
        }
        return builder.build();
    }

    public static void printHelp(PrintWriter out) {
        HelpFormatter formatter = new HelpFormatter();
        formatter.printHelp(out, HelpFormatter.DEFAULT_WIDTH, SYNTAX,
                "Flags anomalous points of a Time,value CSV series with the Spectral Residual method.",
                OPTIONS, HelpFormatter.DEFAULT_LEFT_PAD, HelpFormatter.DEFAULT_DESC_PAD,
                "Reads standard input when path is absent or '-'.");
        out.flush();
    }

    private static int intValue(CommandLine cmd, String option) throws ParseException {
        return value(cmd, option, Integer::parseInt);
    }

    private static <T> T value(CommandLine cmd, String option, Function<String, T> converter)
            throws ParseException {
        String raw = cmd.getOptionValue(option);
        try {
            return converter.apply(raw.trim());
        } catch (IllegalArgumentException e) {
            // NumberFormatException is an IllegalArgumentException
            ParseException usage = new ParseException("Invalid value '" + raw + "' for option " + option
                    + ": " + e.getMessage());
            usage.initCause(e);
            throw usage;
        }
    }

    private static Options buildOptions() {
        Options options = new Options();
        options.addOption(withArg(SALIENCY_WINDOW, "saliency-window", "n",
                "log-amplitude smoothing window q (default " + DetectorConfig.DEFAULT_SALIENCY_WINDOW + ")"));
        options.addOption(withArg(SCORE_WINDOW, "score-window", "n",
                "saliency averaging window z (default " + DetectorConfig.DEFAULT_SCORE_WINDOW + ")"));
        options.addOption(withArg(THRESHOLD, "threshold", "x",
                "score threshold t (default " + DetectorConfig.DEFAULT_THRESHOLD + ")"));
        options.addOption(withArg(EXTRAPOLATION_WINDOW, "extrapolation-window", "n",
                "gradient window m (default " + DetectorConfig.DEFAULT_EXTRAPOLATION_WINDOW + ")"));
        options.addOption(withArg(EXTRAPOLATED_POINTS, "extrapolated-points", "n",
                "points padded on each side k (default " + DetectorConfig.DEFAULT_EXTRAPOLATED_POINTS + ")"));
        options.addOption(withArg(CONFIG, "config", "file", "YAML detector configuration"));
        options.addOption(withArg(GRADIENT_MODE, "gradient-mode", "mode", "compatible (default) or signed"));
        options.addOption(Option.builder()
                .longOpt(INPUT_TIME_FORMAT).hasArg().argName("fmt")
                .desc("Time column of the input: millis (default) or datetime")
                .build());
        options.addOption(Option.builder()
                .longOpt(OUTPUT_TIME_FORMAT).hasArg().argName("fmt")
                .desc("Time column of the output: datetime (default) or millis")
                .build());
        options.addOption(withArg(FORMAT, "format", "fmt", "csv (default) or json"));
        options.addOption(withArg(OUTPUT, "output", "file", "output file (default standard output)"));
        options.addOption(Option.builder(HELP).longOpt("help").desc("print this help").build());
        return options;
    }

    private static Option withArg(String shortName, String longName, String argName, String description) {
        return Option.builder(shortName)
                .longOpt(longName)
                .hasArg()
                .argName(argName)
                .desc(description)
                .build();
    }
}
