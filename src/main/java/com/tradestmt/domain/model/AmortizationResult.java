package com.tradestmt.domain.model;

/**
 * Derived pricing fields for one record. Either all four are set or none is.
 */
public record AmortizationResult(Double adjustedPnl, Double combinedValue, Double bid, Double offer) {

    private static final AmortizationResult EMPTY = new AmortizationResult(null, null, null, null);

    public static AmortizationResult empty() {
        return EMPTY;
    }

    public boolean isComputed() {
        return adjustedPnl != null;
    }
}
