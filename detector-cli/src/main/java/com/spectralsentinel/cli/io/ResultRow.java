package com.spectralsentinel.cli.io;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import com.spectralsentinel.cli.TimestampFormat;
import com.spectralsentinel.core.model.DetectionResult;
import com.spectralsentinel.core.model.Sample;

import java.util.ArrayList;
import java.util.List;

/**
 * One output record: a sample joined with its detection result.
 */
@JsonPropertyOrder({"Time", "value", "saliency", "score", "output"})
public class ResultRow {

    private final String time;
    private final float value;
    private final float saliency;
    private final float score;
    private final int output;

    ResultRow(String time, float value, float saliency, float score, boolean anomaly) {
        this.time = time;
        this.value = value;
        this.saliency = saliency;
        this.score = score;
        this.output = anomaly ? 1 : 0;
    }

    /**
     * Join samples and result index by index.
     *
     * @throws IllegalArgumentException if the two are not the same length
     */
    static List<ResultRow> join(List<Sample> samples, DetectionResult result, TimestampFormat timeFormat) {
        if (samples.size() != result.size()) {
            throw new IllegalArgumentException("Result has " + result.size()
                    + " points but " + samples.size() + " samples were given");
        }
        List<ResultRow> rows = new ArrayList<>(samples.size());
        for (int i = 0; i < samples.size(); i++) {
            Sample sample = samples.get(i);
            rows.add(new ResultRow(timeFormat.format(sample.getTime()), sample.getValue(),
                    result.saliencyAt(i), result.scoreAt(i), result.isAnomaly(i)));
        }
        return rows;
    }

    @JsonProperty("Time")
    public String getTime() {
        return time;
    }

    @JsonProperty("value")
    public float getValue() {
        return value;
    }

    @JsonProperty("saliency")
    public float getSaliency() {
        return saliency;
    }

    @JsonProperty("score")
    public float getScore() {
        return score;
    }

    @JsonProperty("output")
    public int getOutput() {
        return output;
    }
}
