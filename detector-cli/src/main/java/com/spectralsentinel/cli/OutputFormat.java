package com.spectralsentinel.cli;

import com.spectralsentinel.cli.io.CsvResultWriter;
import com.spectralsentinel.cli.io.JsonResultWriter;
import com.spectralsentinel.cli.io.ResultWriter;

/**
 * Rendering of the annotated series.
 */
public enum OutputFormat {

    CSV("csv"),
    JSON("json");

    private final String optionName;

    OutputFormat(String optionName) {
        this.optionName = optionName;
    }

    public String optionName() {
        return optionName;
    }

    /**
     * Create a writer for this format.
     *
     * @param timeFormat how the {@code Time} column is rendered
     */
    public ResultWriter newWriter(TimestampFormat timeFormat) {
        return switch (this) {
            case CSV -> new CsvResultWriter(timeFormat);
            case JSON -> new JsonResultWriter(timeFormat);
        };
    }

    /**
     * @throws IllegalArgumentException for names other than {@code csv} and {@code json}
     */
    public static OutputFormat fromName(String name) {
        for (OutputFormat format : values()) {
            if (format.optionName.equalsIgnoreCase(name == null ? "" : name.trim())) {
                return format;
            }
        }
        throw new IllegalArgumentException("Unknown output format '" + name + "', expected 'csv' or 'json'");
    }
}
