package com.tradestmt.domain.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.stream.Collectors;

/**
 * A tabular document as a grid of text cells.
 * Used both for the loaded template and for each populated statement.
 */
public class StatementDocument {

    private final List<List<String>> rows;

    public StatementDocument(List<List<String>> rows) {
        this.rows = rows.stream()
                .map(ArrayList::new)
                .collect(Collectors.toCollection(ArrayList::new));
    }

    /**
     * Fresh independent copy, one per fund
     */
    public StatementDocument copy() {
        return new StatementDocument(rows);
    }

    public int getRowCount() {
        return rows.size();
    }

    public List<String> getRow(int rowIndex) {
        if (rowIndex < 0 || rowIndex >= rows.size()) {
            return Collections.emptyList();
        }
        return Collections.unmodifiableList(rows.get(rowIndex));
    }

    public List<List<String>> getRows() {
        return rows.stream()
                .map(Collections::unmodifiableList)
                .collect(Collectors.toUnmodifiableList());
    }

    public String getCell(int rowIndex, int columnIndex) {
        List<String> row = getRow(rowIndex);
        if (columnIndex < 0 || columnIndex >= row.size()) {
            return "";
        }
        String value = row.get(columnIndex);
        return value == null ? "" : value;
    }

    /**
     * Set a cell, growing the grid as needed
     */
    public void setCell(int rowIndex, int columnIndex, String value) {
        while (rows.size() <= rowIndex) {
            rows.add(new ArrayList<>());
        }
        List<String> row = rows.get(rowIndex);
        while (row.size() <= columnIndex) {
            row.add("");
        }
        row.set(columnIndex, value);
    }

    /**
     * Insert a row before {@code rowIndex}; rows at and below it shift down.
     * An index past the end appends, padding with empty rows.
     */
    public void insertRow(int rowIndex, List<String> values) {
        while (rows.size() < rowIndex) {
            rows.add(new ArrayList<>());
        }
        rows.add(rowIndex, new ArrayList<>(values));
    }

    public String[][] toArray() {
        return rows.stream()
                .map(row -> row.toArray(new String[0]))
                .toArray(String[][]::new);
    }
}
