package com.tradestmt.domain.model;

import lombok.Value;

import java.util.List;

/**
 * One day's valuation feed
 */
@Value
public class ValuationFeed {
    List<String> columns;
    List<ValuationRecord> records;

    public boolean hasColumn(TradeField field) {
        return columns.contains(field.getColumn());
    }
}
