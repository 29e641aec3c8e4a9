package com.tradestmt.domain.model;

/**
 * How a statement cell is rendered
 */
public enum CellFormat {
    TEXT,
    DATE,
    CURRENCY,       // 1,234,567.89
    NUMBER,         // 1234567.89
    PERCENT_2,      // 1.23%
    PERCENT_3;      // 1.234%

    public static CellFormat fromValue(String value) {
        for (CellFormat format : values()) {
            if (format.name().equalsIgnoreCase(value)) {
                return format;
            }
        }
        throw new IllegalArgumentException("Unknown cell format: " + value);
    }
}
