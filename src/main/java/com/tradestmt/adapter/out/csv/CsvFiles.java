package com.tradestmt.adapter.out.csv;

import com.opencsv.CSVReader;
import com.opencsv.CSVWriter;
import com.opencsv.exceptions.CsvException;

import java.io.IOException;
import java.io.Reader;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * OpenCSV helpers shared by the file adapters
 */
final class CsvFiles {

    private static final String BOM = "\uFEFF";

    private CsvFiles() {
    }

    static List<String[]> readAll(Path file) throws IOException {
        try (Reader reader = Files.newBufferedReader(file, StandardCharsets.UTF_8);
             CSVReader csvReader = new CSVReader(reader)) {
            List<String[]> rows = csvReader.readAll();
            if (!rows.isEmpty() && rows.get(0).length > 0 && rows.get(0)[0].startsWith(BOM)) {
                rows.get(0)[0] = rows.get(0)[0].substring(BOM.length());
            }
            return rows;
        } catch (CsvException e) {
            throw new IOException("Malformed CSV in " + file + " at line " + e.getLineNumber(), e);
        }
    }

    static void writeAll(Path file, List<String[]> rows) throws IOException {
        Path parent = file.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        try (Writer writer = Files.newBufferedWriter(file, StandardCharsets.UTF_8);
             CSVWriter csvWriter = new CSVWriter(writer,
                     CSVWriter.DEFAULT_SEPARATOR,
                     CSVWriter.DEFAULT_QUOTE_CHARACTER,
                     CSVWriter.DEFAULT_ESCAPE_CHARACTER,
                     CSVWriter.DEFAULT_LINE_END)) {
            csvWriter.writeAll(rows);
        }
    }

    static List<String> header(List<String[]> rows) {
        List<String> columns = new ArrayList<>();
        if (!rows.isEmpty()) {
            for (String cell : rows.get(0)) {
                columns.add(cell == null ? "" : cell.trim());
            }
        }
        return columns;
    }

    /**
     * Data rows (header excluded) as column -> value maps; blank lines are skipped
     */
    static List<Map<String, String>> records(List<String[]> rows, List<String> columns) {
        List<Map<String, String>> records = new ArrayList<>();
        for (int r = 1; r < rows.size(); r++) {
            String[] row = rows.get(r);
            if (isBlank(row)) {
                continue;
            }
            Map<String, String> values = new LinkedHashMap<>();
            for (int c = 0; c < columns.size(); c++) {
                values.put(columns.get(c), c < row.length && row[c] != null ? row[c] : "");
            }
            records.add(values);
        }
        return records;
    }

    private static boolean isBlank(String[] row) {
        for (String cell : row) {
            if (cell != null && !cell.isBlank()) {
                return false;
            }
        }
        return true;
    }
}
