package com.spectralsentinel.cli;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * End-to-end tests of {@link SpectralSentinelCli#run}.
 */
class SpectralSentinelCliTest {

    private static final String SHORT_SERIES =
            "\"Time\",\"value\"\n1732163400000,67553\n1732163520000,18875\n1732163640000,0";

    @TempDir
    Path tempDir;

    private ByteArrayOutputStream stdout;
    private ByteArrayOutputStream stderr;

    @BeforeEach
    void setUp() {
        stdout = new ByteArrayOutputStream();
        stderr = new ByteArrayOutputStream();
    }

    private int run(String stdin, String... args) {
        InputStream in = new ByteArrayInputStream(stdin.getBytes(StandardCharsets.UTF_8));
        return SpectralSentinelCli.run(args, in,
                new PrintStream(stdout, true, StandardCharsets.UTF_8),
                new PrintStream(stderr, true, StandardCharsets.UTF_8));
    }

    private String stdoutText() {
        return stdout.toString(StandardCharsets.UTF_8);
    }

    private static String seasonalSeries(int n) {
        StringBuilder csv = new StringBuilder("Time,value\n");
        long start = 1732163400000L;
        for (int i = 0; i < n; i++) {
            double value = 100 + 10 * Math.sin(2 * Math.PI * i / 12.0) + (i == n / 2 ? 80 : 0);
            csv.append(start + i * 120_000L).append(',').append(value).append('\n');
        }
        return csv.toString();
    }

    @Test
    @DisplayName("Should annotate a file and write it to the output file")
    void shouldAnnotateFile() throws IOException {
        Path input = tempDir.resolve("series.csv");
        Path output = tempDir.resolve("annotated.csv");
        Files.writeString(input, seasonalSeries(48));

        int status = run("", input.toString(), "-o", output.toString());

        assertThat(status).isEqualTo(SpectralSentinelCli.EXIT_OK);
        List<String> lines = Files.readAllLines(output);
        assertThat(lines).hasSize(49);
        assertThat(lines.get(0).replace("\"", "")).isEqualTo("Time,value,saliency,score,output");
        assertThat(lines.get(1)).contains("2024-11-21 04:30:00");
        assertThat(lines.subList(1, lines.size())).allSatisfy(line -> assertThat(line).matches(".*,[01]$"));
        assertThat(stdoutText()).isEmpty();
    }

    @Test
    @DisplayName("Should read standard input and write standard output")
    void shouldUseStandardStreams() {
        int status = run(SHORT_SERIES, "-m", "3", "-k", "2");

        assertThat(status).isEqualTo(SpectralSentinelCli.EXIT_OK);
        String[] lines = stdoutText().split("\n");
        assertThat(lines).hasSize(4);
        assertThat(lines[1]).contains("2024-11-21 04:30:00").contains("67553.0");
        assertThat(lines[3]).contains("2024-11-21 04:34:00");
    }

    @Test
    @DisplayName("Should write JSON when asked to")
    void shouldWriteJson() throws IOException {
        int status = run(seasonalSeries(30), "-f", "json", "--output-time-format", "millis");

        assertThat(status).isEqualTo(SpectralSentinelCli.EXIT_OK);
        JsonNode rows = new ObjectMapper().readTree(stdoutText());
        assertThat(rows).hasSize(30);
        assertThat(rows.get(0).get("Time").asText()).isEqualTo("1732163400000");
    }

    @Test
    @DisplayName("Should fail when the series is shorter than the extrapolation window")
    void shouldFailOnShortSeries() {
        int status = run(SHORT_SERIES);

        assertThat(status).isEqualTo(SpectralSentinelCli.EXIT_FAILURE);
        assertThat(stdoutText()).isEmpty();
    }

    @Test
    @DisplayName("Should fail cleanly when k is too large to pad the series")
    void shouldFailOnOversizedPadding() {
        int status = run(SHORT_SERIES, "-m", "3", "-k", String.valueOf(Integer.MAX_VALUE / 2));

        assertThat(status).isEqualTo(SpectralSentinelCli.EXIT_FAILURE);
        assertThat(stdoutText()).isEmpty();
    }

    @Test
    @DisplayName("Should fail on a malformed row")
    void shouldFailOnMalformedInput() {
        int status = run("Time,value\n1732163400000,oops\n", "-k", "0");

        assertThat(status).isEqualTo(SpectralSentinelCli.EXIT_FAILURE);
    }

    @Test
    @DisplayName("Should fail when the input file does not exist")
    void shouldFailOnMissingFile() {
        int status = run("", tempDir.resolve("absent.csv").toString());

        assertThat(status).isEqualTo(SpectralSentinelCli.EXIT_FAILURE);
    }

    @Test
    @DisplayName("Should fail on an invalid hyperparameter value")
    void shouldFailOnInvalidConfiguration() {
        int status = run(SHORT_SERIES, "-q", "0");

        assertThat(status).isEqualTo(SpectralSentinelCli.EXIT_FAILURE);
    }

    @Test
    @DisplayName("Should exit with the usage status on bad arguments")
    void shouldReportUsageErrors() {
        assertThat(run("", "--bogus")).isEqualTo(SpectralSentinelCli.EXIT_USAGE);
        assertThat(run("", "-t", "high")).isEqualTo(SpectralSentinelCli.EXIT_USAGE);
        assertThat(stderr.toString(StandardCharsets.UTF_8)).contains("--help");
    }

    @Test
    @DisplayName("Should print help and succeed")
    void shouldPrintHelp() {
        int status = run("", "--help");

        assertThat(status).isEqualTo(SpectralSentinelCli.EXIT_OK);
        assertThat(stdoutText()).contains("usage: spectral-sentinel");
    }
}
