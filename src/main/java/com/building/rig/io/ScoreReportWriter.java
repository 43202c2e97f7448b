package com.building.rig.io;

import com.building.rig.score.PathScore;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.dataformat.csv.CsvMapper;
import com.fasterxml.jackson.dataformat.csv.CsvSchema;

/**
 * Writes path scores as CSV, one row per path. Absent stealth or criticality
 * leaves the cell empty; a whole total cost is written without a fraction.
 */
public final class ScoreReportWriter {
    private static final CsvMapper MAPPER = new CsvMapper();
    private static final CsvSchema SCHEMA = MAPPER.schemaFor(Row.class).withHeader();

    private ScoreReportWriter() {
        // Utility class
    }

    public static String toCsv(List<PathScore> scores) throws JsonProcessingException {
        List<Row> rows = new ArrayList<>(scores.size());
        for (PathScore s : scores)
            rows.add(new Row(s.path(), wholeOrDecimal(s.totalCost()), s.averageStealth(), s.length(), s.criticality()));
        return MAPPER.writer(SCHEMA).writeValueAsString(rows);
    }

    public static void write(List<PathScore> scores, Path file) throws IOException {
        Files.writeString(file, toCsv(scores));
    }

    // 8.0 is written as 8, 8.5 as 8.5.
    static Number wholeOrDecimal(double v) {
        if (v == Math.rint(v) && !Double.isInfinite(v))
            return (long) v;
        return v;
    }

    public static String defaultFileName(String target, String graphName) {
        return "score_" + target + "_" + graphName + ".csv";
    }

    @JsonPropertyOrder({ "Path", "Total Cost", "Average Stealth", "Path Length", "Path Criticality" })
    record Row(
            @JsonProperty("Path") String path,
            @JsonProperty("Total Cost") Number totalCost,
            @JsonProperty("Average Stealth") Double averageStealth,
            @JsonProperty("Path Length") int length,
            @JsonProperty("Path Criticality") Double criticality) {
    }
}
