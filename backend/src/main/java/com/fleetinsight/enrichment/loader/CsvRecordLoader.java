package com.fleetinsight.enrichment.loader;

import com.opencsv.CSVReader;
import com.opencsv.exceptions.CsvValidationException;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Reads a CSV file with a header row into an immutable list of records. The whole file is read before
 * returning, so the list can be iterated any number of times. Rows that cannot be mapped (wrong cell
 * count, missing or malformed values) are logged and skipped.
 */
@Slf4j
public abstract class CsvRecordLoader<T> {

    public List<T> load(Path path) {
        try (Reader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
            return load(reader, path.toString());
        } catch (IOException e) {
            throw new RecordLoadException("Cannot read " + path, e);
        }
    }

    List<T> load(Reader source, String name) {
        List<T> records = new ArrayList<>();
        int rowIndex = 0;
        int skipped = 0;
        try (CSVReader reader = new CSVReader(source)) {
            String[] header = reader.readNext();
            if (header == null) {
                log.warn("{} is empty", name);
                return List.of();
            }
            for (int i = 0; i < header.length; i++) {
                header[i] = header[i].strip();
            }
            String[] cells;
            while ((cells = reader.readNext()) != null) {
                if (isBlankLine(cells)) {
                    continue;
                }
                try {
                    if (cells.length != header.length) {
                        throw new IllegalArgumentException(
                                "expected " + header.length + " cells, found " + cells.length);
                    }
                    records.add(mapRow(toRow(header, cells), rowIndex));
                } catch (IllegalArgumentException e) {
                    skipped++;
                    log.warn("Skipping row {} (line {}) of {}: {}", rowIndex, reader.getLinesRead(), name,
                            e.getMessage());
                }
                rowIndex++;
            }
        } catch (IOException | CsvValidationException e) {
            throw new RecordLoadException("Cannot parse " + name + " at row " + rowIndex, e);
        }
        log.info("Loaded {} record(s) from {} ({} skipped)", records.size(), name, skipped);
        return Collections.unmodifiableList(records);
    }

    private static boolean isBlankLine(String[] cells) {
        return cells.length == 0 || (cells.length == 1 && cells[0].isBlank());
    }

    private static Map<String, String> toRow(String[] header, String[] cells) {
        Map<String, String> row = new LinkedHashMap<>();
        for (int i = 0; i < header.length; i++) {
            row.put(header[i], cells[i]);
        }
        return row;
    }

    /**
     * Map one CSV row (header name → cell) to a record. Throw {@link IllegalArgumentException} for a row
     * that cannot be mapped.
     */
    protected abstract T mapRow(Map<String, String> row, int rowIndex);

    protected static double requireDouble(Map<String, String> row, String column) {
        String value = require(row, column);
        try {
            return Double.parseDouble(value);
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("column " + column + " is not a number: " + value);
        }
    }

    /** Integral columns are sometimes exported as "12.0". */
    protected static long requireLong(Map<String, String> row, String column) {
        return Math.round(requireDouble(row, column));
    }

    protected static boolean requireBoolean(Map<String, String> row, String column) {
        String value = require(row, column).toLowerCase(Locale.ROOT);
        return switch (value) {
            case "true", "1", "1.0", "yes" -> true;
            case "false", "0", "0.0", "no" -> false;
            default -> throw new IllegalArgumentException("column " + column + " is not a boolean: " + value);
        };
    }

    protected static String require(Map<String, String> row, String column) {
        String value = row.get(column);
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("missing column " + column);
        }
        return value.strip();
    }
}
