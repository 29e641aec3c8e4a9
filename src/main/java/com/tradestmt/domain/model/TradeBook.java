package com.tradestmt.domain.model;

import lombok.Value;

import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

/**
 * The trade book as loaded from its file: column order plus rows
 */
@Value
public class TradeBook {
    List<String> columns;
    List<TradeRecord> records;

    public static TradeBook empty() {
        return new TradeBook(List.of(), List.of());
    }

    public boolean hasColumn(TradeField field) {
        return columns.contains(field.getColumn());
    }

    public int size() {
        return records.size();
    }

    /**
     * Deep copy, so callers can work on the rows without touching the stored book
     */
    public TradeBook copy() {
        return new TradeBook(
                new ArrayList<>(columns),
                records.stream().map(TradeRecord::copy).collect(Collectors.toList())
        );
    }
}
