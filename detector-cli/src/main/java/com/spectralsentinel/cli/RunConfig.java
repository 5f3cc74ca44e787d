package com.spectralsentinel.cli;

import com.spectralsentinel.core.config.DetectorConfig;

import java.util.Objects;

/**
 * Typed, immutable configuration of one command-line run.
 *
 * <p>
 * Holds the detector hyperparameters together with where the series comes
 * from, where the result goes and how both are rendered. Use the
 * {@link Builder}; it validates at {@link Builder#build()} time.
 * </p>
 *
 * @since 1.0.0
 */
public final class RunConfig {

    /** Input path meaning "read standard input". */
    public static final String STDIN = "-";

    private final DetectorConfig detectorConfig;
    private final String inputPath;
    private final String outputPath;
    private final TimestampFormat inputTimeFormat;
    private final TimestampFormat outputTimeFormat;
    private final OutputFormat outputFormat;

    private RunConfig(Builder b) {
        this.detectorConfig = new DetectorConfig(b.detectorConfig);
        this.inputPath = b.inputPath;
        this.outputPath = b.outputPath;
        this.inputTimeFormat = b.inputTimeFormat;
        this.outputTimeFormat = b.outputTimeFormat;
        this.outputFormat = b.outputFormat;
    }

    /**
     * @return a copy of the detector configuration
     */
    public DetectorConfig getDetectorConfig() {
        return new DetectorConfig(detectorConfig);
    }

    public String getInputPath() {
        return inputPath;
    }

    /**
     * @return output file, or {@code null} for standard output
     */
    public String getOutputPath() {
        return outputPath;
    }

    public TimestampFormat getInputTimeFormat() {
        return inputTimeFormat;
    }

    public TimestampFormat getOutputTimeFormat() {
        return outputTimeFormat;
    }

    public OutputFormat getOutputFormat() {
        return outputFormat;
    }

    public boolean readsStandardInput() {
        return STDIN.equals(inputPath);
    }

    public boolean writesStandardOutput() {
        return outputPath == null;
    }

    /**
     * Fluent builder for {@link RunConfig}.
     *
     * <p>
     * Defaults: detector defaults, standard input, standard output, epoch
     * milliseconds in, {@code yyyy-MM-dd HH:mm:ss} out, CSV.
     * </p>
     */
    public static class Builder {
        private DetectorConfig detectorConfig = new DetectorConfig();
        private String inputPath = STDIN;
        private String outputPath;
        private TimestampFormat inputTimeFormat = TimestampFormat.EPOCH_MILLIS;
        private TimestampFormat outputTimeFormat = TimestampFormat.DATETIME;
        private OutputFormat outputFormat = OutputFormat.CSV;

        public Builder detectorConfig(DetectorConfig v) {
            this.detectorConfig = v;
            return this;
        }

        /**
         * @param v file path; {@code null}, blank or {@code "-"} selects standard input
         */
        public Builder inputPath(String v) {
            this.inputPath = (v == null || v.isBlank()) ? STDIN : v;
            return this;
        }

        /**
         * @param v file path; {@code null}, blank or {@code "-"} selects standard output
         */
        public Builder outputPath(String v) {
            this.outputPath = (v == null || v.isBlank() || STDIN.equals(v)) ? null : v;
            return this;
        }

        public Builder inputTimeFormat(TimestampFormat v) {
            this.inputTimeFormat = v;
            return this;
        }

        public Builder outputTimeFormat(TimestampFormat v) {
            this.outputTimeFormat = v;
            return this;
        }

        public Builder outputFormat(OutputFormat v) {
            this.outputFormat = v;
            return this;
        }

        /**
         * Build and validate the configuration.
         *
         * @return a validated {@link RunConfig}
         * @throws NullPointerException  if a required value is missing
         * @throws IllegalStateException if the detector configuration is invalid
         */
        public RunConfig build() {
            Objects.requireNonNull(detectorConfig, "detectorConfig required");
            Objects.requireNonNull(inputTimeFormat, "inputTimeFormat required");
            Objects.requireNonNull(outputTimeFormat, "outputTimeFormat required");
            Objects.requireNonNull(outputFormat, "outputFormat required");
            detectorConfig.validate();
            return new RunConfig(this);
        }
    }

    @Override
    public String toString() {
        return "RunConfig{" +
                "detector=" + detectorConfig +
                ", input='" + inputPath + '\'' +
                ", output='" + (outputPath == null ? "<stdout>" : outputPath) + '\'' +
                ", inputTimeFormat=" + inputTimeFormat.optionName() +
                ", outputTimeFormat=" + outputTimeFormat.optionName() +
                ", format=" + outputFormat.optionName() +
                '}';
    }
}
