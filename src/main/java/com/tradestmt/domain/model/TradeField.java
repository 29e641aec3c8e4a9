package com.tradestmt.domain.model;

import java.util.ArrayList;
import java.util.List;

/**
 * Column names the pipeline knows about.
 * Everything else in the trade book is carried through as a pass-through attribute.
 */
public enum TradeField {
    // Typed fields of a trade book row
    TRADE_IDENTIFIER("TRADEIDENTIFIER", true),
    TRADE_DATE("TRADE DATE", true),
    NOTIONAL("NOTIONAL", true),
    SPREAD("SPREAD", true),
    PNL("P&L", true),
    FUND_ID("FUND ID", true),

    // Added by the pipeline, in this order
    PV("PV", false),
    ADJUSTED_PNL("ADJUSTED P&L", false),
    COMBINED_VALUE("COMBINED VALUE", false),
    BID("BID", false),
    OFFER("OFFER", false);

    private final String column;
    private final boolean core;

    TradeField(String column, boolean core) {
        this.column = column;
        this.core = core;
    }

    public String getColumn() {
        return column;
    }

    public boolean isCore() {
        return core;
    }

    public static boolean isCoreColumn(String column) {
        return isKnown(column) && fromColumn(column).isCore();
    }

    /**
     * Columns appended to the trade book columns when a merged table is built
     */
    public static List<String> derivedColumns() {
        List<String> columns = new ArrayList<>();
        for (TradeField field : values()) {
            if (!field.core) {
                columns.add(field.column);
            }
        }
        return columns;
    }

    public static TradeField fromColumn(String column) {
        for (TradeField field : values()) {
            if (field.column.equals(column)) {
                return field;
            }
        }
        throw new IllegalArgumentException("Unknown trade field: " + column);
    }

    public static boolean isKnown(String column) {
        for (TradeField field : values()) {
            if (field.column.equals(column)) {
                return true;
            }
        }
        return false;
    }
}
