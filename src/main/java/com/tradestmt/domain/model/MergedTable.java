package com.tradestmt.domain.model;

import lombok.Value;

import java.util.List;

/**
 * Trade book joined with the valuation feed.
 * Columns are the book's columns followed by the derived ones.
 */
@Value
public class MergedTable {
    List<String> columns;
    List<MergedRecord> records;

    public boolean hasColumn(TradeField field) {
        return columns.contains(field.getColumn());
    }

    public MergedTable withRecords(List<MergedRecord> newRecords) {
        return new MergedTable(columns, newRecords);
    }

    public long matchedCount() {
        return records.stream().filter(MergedRecord::isMatched).count();
    }

    public long computedCount() {
        return records.stream().filter(r -> r.getAmortization().isComputed()).count();
    }
}
