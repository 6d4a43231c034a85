package com.skanga.gateway.format;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Renders result records as text for the calling agent.
 *
 * <p>Two formats exist. {@code "markdown"} produces an aligned, pipe-separated table.
 * Anything else, including the default {@code "json"}, produces one line per record
 * of {@code key: value} pairs. Despite its name the {@code "json"} format is not JSON.
 */
public final class ResultFormatter {
    private static final Logger logger = LoggerFactory.getLogger(ResultFormatter.class);
    private static final ObjectMapper objectMapper = new ObjectMapper();

    public static final String FORMAT_MARKDOWN = "markdown";
    public static final String FORMAT_JSON = "json";
    public static final String NO_RESULTS = "No results";

    private ResultFormatter() {
    }

    /**
     * @param results    records (maps) or plain values such as database names
     * @param formatType {@code "markdown"} (case-insensitive) for a table, anything else for lines
     * @return the rendered text
     */
    public static String formatResults(List<?> results, String formatType) {
        if (formatType != null && FORMAT_MARKDOWN.equals(formatType.toLowerCase(Locale.ROOT))) {
            return formatMarkdown(results);
        }
        return formatLines(results);
    }

    /**
     * Line form: each record as {@code key: value} pairs joined by {@code " | "},
     * other values by their string form. Empty input gives an empty string.
     */
    static String formatLines(List<?> results) {
        List<String> outputLines = new ArrayList<>(results.size());
        for (Object resultRow : results) {
            if (resultRow instanceof Map) {
                List<String> fieldPairs = new ArrayList<>();
                for (Map.Entry<?, ?> field : ((Map<?, ?>) resultRow).entrySet()) {
                    fieldPairs.add(field.getKey() + ": " + stringify(field.getValue()));
                }
                outputLines.add(String.join(" | ", fieldPairs));
            } else {
                outputLines.add(stringify(resultRow));
            }
        }
        return String.join("\n", outputLines);
    }

    /**
     * Table form. Columns are the keys of the first record; a later record missing a
     * column gets an empty cell and keys absent from the first record are not shown.
     * Column width is the widest of the header and every cell in that column.
     */
    static String formatMarkdown(List<?> results) {
        if (results.isEmpty()) {
            return NO_RESULTS;
        }
        if (!(results.get(0) instanceof Map)) {
            List<String> outputLines = new ArrayList<>(results.size());
            for (Object resultRow : results) {
                outputLines.add(stringify(resultRow));
            }
            return String.join("\n", outputLines);
        }

        List<String> allColumns = new ArrayList<>();
        for (Object columnName : ((Map<?, ?>) results.get(0)).keySet()) {
            allColumns.add(String.valueOf(columnName));
        }

        int[] columnWidths = new int[allColumns.size()];
        for (int i = 0; i < allColumns.size(); i++) {
            columnWidths[i] = allColumns.get(i).length();
        }

        List<Map<?, ?>> records = new ArrayList<>();
        for (Object resultRow : results) {
            if (resultRow instanceof Map) {
                records.add((Map<?, ?>) resultRow);
            } else {
                logger.debug("Skipping non-record value in table output: {}", resultRow);
            }
        }

        for (Map<?, ?> currRow : records) {
            for (int i = 0; i < allColumns.size(); i++) {
                columnWidths[i] = Math.max(columnWidths[i], cellValue(currRow, allColumns.get(i)).length());
            }
        }

        List<String> outputLines = new ArrayList<>(records.size() + 2);

        List<String> headerCells = new ArrayList<>(allColumns.size());
        List<String> separatorCells = new ArrayList<>(allColumns.size());
        for (int i = 0; i < allColumns.size(); i++) {
            headerCells.add(padRight(allColumns.get(i), columnWidths[i]));
            separatorCells.add("-".repeat(columnWidths[i]));
        }
        outputLines.add(String.join(" | ", headerCells));
        outputLines.add(String.join(" | ", separatorCells));

        for (Map<?, ?> currRow : records) {
            List<String> rowCells = new ArrayList<>(allColumns.size());
            for (int i = 0; i < allColumns.size(); i++) {
                rowCells.add(padRight(cellValue(currRow, allColumns.get(i)), columnWidths[i]));
            }
            outputLines.add(String.join(" | ", rowCells));
        }

        return String.join("\n", outputLines);
    }

    private static String cellValue(Map<?, ?> currRow, String columnName) {
        if (!currRow.containsKey(columnName)) {
            return "";
        }
        return stringify(currRow.get(columnName));
    }

    private static String padRight(String cellText, int width) {
        if (width == 0) {
            return cellText;
        }
        return String.format("%-" + width + "s", cellText);
    }

    /**
     * String form of a single value. Nested records and lists are written as compact JSON.
     */
    static String stringify(Object value) {
        if (value instanceof Map || value instanceof Collection) {
            try {
                return objectMapper.writeValueAsString(value);
            } catch (JsonProcessingException e) {
                logger.debug("Falling back to toString for value of type {}: {}",
                        value.getClass().getSimpleName(), e.getMessage());
                return value.toString();
            }
        }
        return String.valueOf(value);
    }
}
