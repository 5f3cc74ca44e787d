package com.spectralsentinel.cli.io;

import com.fasterxml.jackson.core.JsonLocation;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.MappingIterator;
import com.fasterxml.jackson.dataformat.csv.CsvMapper;
import com.fasterxml.jackson.dataformat.csv.CsvParser;
import com.fasterxml.jackson.dataformat.csv.CsvSchema;
import com.spectralsentinel.cli.TimestampFormat;
import com.spectralsentinel.core.model.Sample;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.Reader;
import java.io.UncheckedIOException;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Reads a {@code Time,value} series from CSV.
 *
 * <p>
 * The first line is a header naming the columns; quoting is optional and
 * columns other than {@code Time} and {@code value} are ignored. Any
 * malformed row aborts the read.
 * </p>
 */
public class SampleCsvReader {

    private static final Logger LOG = LoggerFactory.getLogger(SampleCsvReader.class);

    public static final String TIME_COLUMN = "Time";
    public static final String VALUE_COLUMN = "value";

    private final CsvMapper mapper;
    private final TimestampFormat timeFormat;

    public SampleCsvReader(TimestampFormat timeFormat) {
        this.timeFormat = Objects.requireNonNull(timeFormat, "timeFormat must not be null");
        this.mapper = new CsvMapper();
        mapper.enable(CsvParser.Feature.TRIM_SPACES);
        mapper.enable(CsvParser.Feature.SKIP_EMPTY_LINES);
    }

    /**
     * Read every row of {@code source}. The reader is not closed.
     *
     * @return samples in file order; empty when the input has no data rows
     * @throws IllegalArgumentException if a row is missing a column or cannot be parsed
     * @throws UncheckedIOException     if reading fails
     */
    public List<Sample> read(Reader source) {
        CsvSchema schema = CsvSchema.emptySchema().withHeader();
        List<Sample> samples = new ArrayList<>();
        // line 1 is the header
        int line = 1;
        try (MappingIterator<Map<String, String>> rows =
                     mapper.readerForMapOf(String.class).with(schema).readValues(source)) {
            while (rows.hasNextValue()) {
                line++;
                samples.add(toSample(rows.nextValue(), line));
            }
        } catch (JsonProcessingException e) {
            JsonLocation location = e.getLocation();
            String where = location != null ? " at line " + location.getLineNr() : " after line " + line;
            throw new IllegalArgumentException("Malformed CSV" + where + ": " + e.getOriginalMessage(), e);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read CSV input", e);
        }
        LOG.info("Read {} record(s)", samples.size());
        return samples;
    }

    private Sample toSample(Map<String, String> row, int line) {
        String time = require(row, TIME_COLUMN, line);
        String value = require(row, VALUE_COLUMN, line);
        LocalDateTime parsedTime;
        try {
            parsedTime = timeFormat.parse(time);
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Line " + line + ": " + e.getMessage(), e);
        }
        try {
            return new Sample(parsedTime, Float.parseFloat(value));
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Line " + line + ": not a number '" + value + "'", e);
        }
    }

    private static String require(Map<String, String> row, String column, int line) {
        String text = row.get(column);
        if (text == null || text.isEmpty()) {
            throw new IllegalArgumentException("Line " + line + ": missing column '" + column + "'");
        }
        return text;
    }
}
