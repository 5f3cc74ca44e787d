package com.spectralsentinel.cli;

import com.spectralsentinel.cli.io.ResultWriter;
import com.spectralsentinel.cli.io.SampleCsvReader;
import com.spectralsentinel.core.detection.AnomalyDetector;
import com.spectralsentinel.core.detection.SpectralResidualDetector;
import com.spectralsentinel.core.model.DetectionResult;
import com.spectralsentinel.core.model.Sample;
import org.apache.commons.cli.CommandLine;
import org.apache.commons.cli.ParseException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.OutputStreamWriter;
import java.io.PrintStream;
import java.io.PrintWriter;
import java.io.Reader;
import java.io.UncheckedIOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.List;

/**
 * Main entry point of the Spectral Sentinel command-line detector.
 *
 * <h3>Pipeline</h3>
 *
 * <pre>
 *   CSV file or stdin (Time,value)
 *     → SampleCsvReader
 *     → SpectralResidualDetector
 *     → CSV / JSON ResultWriter
 *     → file or stdout
 * </pre>
 *
 * <h3>Exit status</h3>
 * <p>
 * {@code 0} on success, {@code 1} when configuration, input or detection
 * fails, {@code 2} on a usage error. Diagnostics go to the log (stderr);
 * stdout carries only results.
 * </p>
 *
 * @since 1.0.0
 */
public final class SpectralSentinelCli {

    private static final Logger LOG = LoggerFactory.getLogger(SpectralSentinelCli.class);

    static final int EXIT_OK = 0;
    static final int EXIT_FAILURE = 1;
    static final int EXIT_USAGE = 2;

    private SpectralSentinelCli() {
        // entry-point class, not instantiable
    }

    public static void main(String[] args) {
        System.exit(run(args, System.in, System.out, System.err));
    }

    /**
     * Run one invocation against the given standard streams.
     *
     * @return process exit status
     */
    static int run(String[] args, InputStream stdin, PrintStream stdout, PrintStream stderr) {
        // 1. Parse arguments
        CommandLine cmd;
        RunConfig config;
        try {
            cmd = CommandLineOptions.parse(args);
            if (CommandLineOptions.isHelpRequested(cmd)) {
                CommandLineOptions.printHelp(new PrintWriter(new OutputStreamWriter(stdout, StandardCharsets.UTF_8)));
                return EXIT_OK;
            }
            config = CommandLineOptions.toRunConfig(cmd);
        } catch (ParseException e) {
            stderr.println("spectral-sentinel: " + e.getMessage());
            stderr.println("Try 'spectral-sentinel --help' for usage.");
            return EXIT_USAGE;
        } catch (RuntimeException e) {
            LOG.error("Invalid configuration: {}", e.getMessage());
            return EXIT_FAILURE;
        }
        LOG.info("Starting Spectral Sentinel with config: {}", config);

        // 2. Read, detect, write
        try {
            List<Sample> samples = readSamples(config, stdin);
            DetectionResult result = detect(config, samples);
            writeResult(config, samples, result, stdout);
            LOG.info("found {} anomalies in {} records", result.anomalyCount(), samples.size());
            if (LOG.isDebugEnabled()) {
                LOG.debug("Flagged indices: {}", Arrays.toString(result.anomalyIndices()));
            }
            return EXIT_OK;
        } catch (RuntimeException e) {
            LOG.error("Detection failed: {}", e.getMessage(), e);
            return EXIT_FAILURE;
        }
    }

    // ---------------------------------------------------------------
    // Helpers
    // ---------------------------------------------------------------

    static DetectionResult detect(RunConfig config, List<Sample> samples) {
        float[] series = new float[samples.size()];
        for (int i = 0; i < series.length; i++) {
            series[i] = samples.get(i).getValue();
        }
        AnomalyDetector detector = new SpectralResidualDetector(config.getDetectorConfig());
        LOG.debug("Running {} over {} point(s)", detector.getName(), series.length);
        return detector.detect(series);
    }

    private static List<Sample> readSamples(RunConfig config, InputStream stdin) {
        SampleCsvReader reader = new SampleCsvReader(config.getInputTimeFormat());
        if (config.readsStandardInput()) {
            return reader.read(new InputStreamReader(stdin, StandardCharsets.UTF_8));
        }
        Path path = Path.of(config.getInputPath());
        try (Reader in = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
            return reader.read(in);
        } catch (NoSuchFileException e) {
            throw new IllegalArgumentException("Input file not found: " + path, e);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to open input file " + path, e);
        }
    }

    private static void writeResult(RunConfig config, List<Sample> samples, DetectionResult result,
            PrintStream stdout) {
        ResultWriter writer = config.getOutputFormat().newWriter(config.getOutputTimeFormat());
        if (config.writesStandardOutput()) {
            writer.write(samples, result, new OutputStreamWriter(stdout, StandardCharsets.UTF_8));
            return;
        }
        Path path = Path.of(config.getOutputPath());
        try (Writer out = Files.newBufferedWriter(path, StandardCharsets.UTF_8)) {
            writer.write(samples, result, out);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to write output file " + path, e);
        }
    }
}
