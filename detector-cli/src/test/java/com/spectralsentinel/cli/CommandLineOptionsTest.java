package com.spectralsentinel.cli;

import com.spectralsentinel.core.config.DetectorConfig;
import com.spectralsentinel.core.detection.GradientMode;
import org.apache.commons.cli.ParseException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.io.PrintWriter;
import java.io.StringWriter;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for {@link CommandLineOptions}.
 */
class CommandLineOptionsTest {

    @TempDir
    Path tempDir;

    private static RunConfig resolve(String... args) throws ParseException {
        return CommandLineOptions.toRunConfig(CommandLineOptions.parse(args));
    }

    @Test
    @DisplayName("Should default to stdin, stdout, millis in, datetime out, CSV")
    void shouldApplyDefaults() throws ParseException {
        RunConfig config = resolve();

        assertThat(config.readsStandardInput()).isTrue();
        assertThat(config.writesStandardOutput()).isTrue();
        assertThat(config.getInputTimeFormat()).isEqualTo(TimestampFormat.EPOCH_MILLIS);
        assertThat(config.getOutputTimeFormat()).isEqualTo(TimestampFormat.DATETIME);
        assertThat(config.getOutputFormat()).isEqualTo(OutputFormat.CSV);
        assertThat(config.getDetectorConfig()).isEqualTo(new DetectorConfig());
    }

    @Test
    @DisplayName("Should read every hyperparameter flag")
    void shouldReadHyperparameters() throws ParseException {
        RunConfig config = resolve("-q", "5", "--score-window", "9", "-t", "2.5",
                "--extrapolation-window", "4", "-k", "0", "-g", "signed");

        DetectorConfig detector = config.getDetectorConfig();
        assertThat(detector.getSaliencyWindow()).isEqualTo(5);
        assertThat(detector.getScoreWindow()).isEqualTo(9);
        assertThat(detector.getThreshold()).isEqualTo(2.5f);
        assertThat(detector.getExtrapolationWindow()).isEqualTo(4);
        assertThat(detector.getExtrapolatedPoints()).isZero();
        assertThat(detector.resolveGradientMode()).isEqualTo(GradientMode.SIGNED);
    }

    @Test
    @DisplayName("Should let flags override the YAML file")
    void shouldLayerFlagsOverYaml() throws IOException, ParseException {
        Path yaml = tempDir.resolve("detector.yml");
        Files.writeString(yaml, "scoreWindow: 11\nthreshold: 1.5\n");

        RunConfig config = resolve("--config", yaml.toString(), "-t", "4.0");

        assertThat(config.getDetectorConfig().getScoreWindow()).isEqualTo(11);
        assertThat(config.getDetectorConfig().getThreshold()).isEqualTo(4.0f);
        assertThat(config.getDetectorConfig().getSaliencyWindow())
                .isEqualTo(DetectorConfig.DEFAULT_SALIENCY_WINDOW);
    }

    @Test
    @DisplayName("Should read paths and formats")
    void shouldReadPathsAndFormats() throws ParseException {
        RunConfig config = resolve("--input-time-format", "datetime", "--output-time-format", "millis",
                "-f", "json", "-o", "out.json", "series.csv");

        assertThat(config.getInputPath()).isEqualTo("series.csv");
        assertThat(config.getOutputPath()).isEqualTo("out.json");
        assertThat(config.getInputTimeFormat()).isEqualTo(TimestampFormat.DATETIME);
        assertThat(config.getOutputTimeFormat()).isEqualTo(TimestampFormat.EPOCH_MILLIS);
        assertThat(config.getOutputFormat()).isEqualTo(OutputFormat.JSON);
    }

    @Test
    @DisplayName("Should treat '-' as standard input")
    void shouldTreatDashAsStdin() throws ParseException {
        assertThat(resolve("-").readsStandardInput()).isTrue();
    }

    @Test
    @DisplayName("Should report a non-numeric flag value as a usage error")
    void shouldRejectNonNumericValue() {
        assertThatThrownBy(() -> resolve("-q", "three"))
                .isInstanceOf(ParseException.class)
                .hasMessageContaining("three");
    }

    @Test
    @DisplayName("Should report an unknown gradient mode as a usage error")
    void shouldRejectUnknownGradientMode() {
        assertThatThrownBy(() -> resolve("--gradient-mode", "sideways"))
                .isInstanceOf(ParseException.class)
                .hasMessageContaining("sideways");
    }

    @Test
    @DisplayName("Should reject unknown options and a second path")
    void shouldRejectBadSyntax() {
        assertThatThrownBy(() -> CommandLineOptions.parse(new String[] {"--bogus"}))
                .isInstanceOf(ParseException.class);
        assertThatThrownBy(() -> CommandLineOptions.parse(new String[] {"a.csv", "b.csv"}))
                .isInstanceOf(ParseException.class)
                .hasMessageContaining("at most one");
    }

    @Test
    @DisplayName("Should fail validation for out-of-range values")
    void shouldValidateResolvedConfig() {
        assertThatThrownBy(() -> resolve("-z", "0"))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("scoreWindow");
    }

    @Test
    @DisplayName("Should describe every option in the help text")
    void shouldPrintHelp() {
        StringWriter text = new StringWriter();

        CommandLineOptions.printHelp(new PrintWriter(text));

        assertThat(text.toString())
                .contains("usage: spectral-sentinel")
                .contains("--saliency-window")
                .contains("--gradient-mode")
                .contains("--input-time-format")
                .contains("--output");
    }
}
