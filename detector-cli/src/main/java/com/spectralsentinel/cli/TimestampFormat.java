package com.spectralsentinel.cli;

import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.Locale;

/**
 * Textual representations of a sample timestamp at the CSV/JSON boundary.
 */
public enum TimestampFormat {

    /** Milliseconds since the Unix epoch, interpreted as UTC. */
    EPOCH_MILLIS("millis") {
        @Override
        public LocalDateTime parse(String text) {
            try {
                long millis = Long.parseLong(text.trim());
                return LocalDateTime.ofInstant(Instant.ofEpochMilli(millis), ZoneOffset.UTC);
            } catch (NumberFormatException e) {
                throw new IllegalArgumentException("Not an epoch-millisecond timestamp: '" + text + "'", e);
            }
        }

        @Override
        public String format(LocalDateTime time) {
            return Long.toString(time.toInstant(ZoneOffset.UTC).toEpochMilli());
        }
    },

    /** {@code yyyy-MM-dd HH:mm:ss}. */
    DATETIME("datetime") {
        @Override
        public LocalDateTime parse(String text) {
            try {
                return LocalDateTime.parse(text.trim(), PATTERN);
            } catch (DateTimeParseException e) {
                throw new IllegalArgumentException("Not a yyyy-MM-dd HH:mm:ss timestamp: '" + text + "'", e);
            }
        }

        @Override
        public String format(LocalDateTime time) {
            return PATTERN.format(time);
        }
    };

    private static final DateTimeFormatter PATTERN =
            DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss", Locale.ROOT);

    private final String optionName;

    TimestampFormat(String optionName) {
        this.optionName = optionName;
    }

    /**
     * @throws IllegalArgumentException if {@code text} is not in this format
     */
    public abstract LocalDateTime parse(String text);

    public abstract String format(LocalDateTime time);

    public String optionName() {
        return optionName;
    }

    /**
     * Resolve a command-line name ({@code millis} or {@code datetime}).
     *
     * @throws IllegalArgumentException for any other name
     */
    public static TimestampFormat fromName(String name) {
        for (TimestampFormat format : values()) {
            if (format.optionName.equalsIgnoreCase(name == null ? "" : name.trim())) {
                return format;
            }
        }
        throw new IllegalArgumentException(
                "Unknown timestamp format '" + name + "', expected 'millis' or 'datetime'");
    }
}
