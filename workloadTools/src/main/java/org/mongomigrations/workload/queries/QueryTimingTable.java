package org.mongomigrations.workload.queries;

import java.io.IOException;
import java.io.Reader;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

import org.mongomigrations.workload.unit.UnitOutcome;

import com.opencsv.CSVReader;
import com.opencsv.CSVReaderBuilder;
import com.opencsv.CSVWriter;
import com.opencsv.exceptions.CsvException;
import lombok.extern.slf4j.Slf4j;

/**
 * Run-over-run query timing table: one row per query description, one column per run.
 * Loading an existing file and adding a run never drops a prior row or column.
 */
@Slf4j
public class QueryTimingTable {

    public static final String DESCRIPTION_COLUMN = "Query Description";
    public static final String ERROR_CELL = "ERROR";

    private final List<String> columns = new ArrayList<>();
    private final Map<String, Map<String, String>> rows = new LinkedHashMap<>();

    public QueryTimingTable() {
        columns.add(DESCRIPTION_COLUMN);
    }

    public static QueryTimingTable load(Path file) throws IOException {
        var table = new QueryTimingTable();
        if (!Files.exists(file)) {
            return table;
        }
        try (Reader reader = Files.newBufferedReader(file, StandardCharsets.UTF_8);
             CSVReader csvReader = new CSVReaderBuilder(reader).build()) {
            var lines = csvReader.readAll();
            if (lines.isEmpty()) {
                return table;
            }
            var header = lines.get(0);
            table.columns.clear();
            table.columns.addAll(List.of(header));
            if (table.columns.isEmpty() || !DESCRIPTION_COLUMN.equals(table.columns.get(0))) {
                throw new IOException(file + " is not a query timing table: first column must be '" + DESCRIPTION_COLUMN + "'");
            }
            for (var line : lines.subList(1, lines.size())) {
                if (line.length == 0 || (line.length == 1 && line[0].isEmpty())) {
                    continue;
                }
                var row = new LinkedHashMap<String, String>();
                for (int i = 0; i < header.length && i < line.length; i++) {
                    row.put(header[i], line[i]);
                }
                table.rows.put(line[0], row);
            }
        } catch (CsvException e) {
            throw new IOException("Unable to read timing table " + file + ": " + e.getMessage(), e);
        }
        log.debug("Loaded {} rows and {} run columns from {}", table.rows.size(), table.columns.size() - 1, file);
        return table;
    }

    /**
     * Adds one run column. Rows are matched by description; unseen descriptions are appended.
     */
    public void addRun(String column, List<UnitOutcome> outcomes) {
        if (columns.contains(column)) {
            throw new IllegalArgumentException("Timing table already has a column " + column);
        }
        columns.add(column);
        for (var outcome : outcomes) {
            rows.computeIfAbsent(outcome.name(), description -> {
                var row = new LinkedHashMap<String, String>();
                row.put(DESCRIPTION_COLUMN, description);
                return row;
            }).put(column, formatCell(outcome));
        }
    }

    /**
     * Returns {@code base}, or {@code base_2}, {@code base_3}, ... when a run with that name is
     * already in the table.
     */
    public String freeColumnName(String base) {
        var candidate = base;
        for (int n = 2; columns.contains(candidate); n++) {
            candidate = base + "_" + n;
        }
        return candidate;
    }

    public void write(Path file) throws IOException {
        var parent = file.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        try (Writer writer = Files.newBufferedWriter(file, StandardCharsets.UTF_8);
             CSVWriter csvWriter = new CSVWriter(writer)) {
            csvWriter.writeNext(columns.toArray(new String[0]), false);
            for (var row : rows.values()) {
                csvWriter.writeNext(columns.stream().map(c -> row.getOrDefault(c, "")).toArray(String[]::new), false);
            }
        }
    }

    public List<String> getColumns() {
        return List.copyOf(columns);
    }

    public List<String> getDescriptions() {
        return List.copyOf(rows.keySet());
    }

    public String getCell(String description, String column) {
        var row = rows.get(description);
        return row == null ? null : row.get(column);
    }

    static String formatCell(UnitOutcome outcome) {
        return outcome.isSuccess() ? String.format(Locale.ROOT, "%.3f", outcome.seconds()) : ERROR_CELL;
    }
}
