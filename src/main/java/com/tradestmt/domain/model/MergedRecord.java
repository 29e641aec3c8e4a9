package com.tradestmt.domain.model;

import lombok.Builder;
import lombok.Value;

/**
 * Trade record joined with its valuation and derived fields.
 * Lives for a single pipeline run.
 */
@Value
@Builder(toBuilder = true)
public class MergedRecord {
    TradeRecord trade;
    double signedPv;        // Book sign convention: feed PV negated, zero when unmatched
    boolean matched;

    @Builder.Default
    AmortizationResult amortization = AmortizationResult.empty();

    public MergedRecord withAmortization(AmortizationResult result) {
        return toBuilder().amortization(result).build();
    }

    public String getFundId() {
        return trade.getFundId();
    }

    public Double getAdjustedPnl() {
        return amortization.adjustedPnl();
    }

    public Double getCombinedValue() {
        return amortization.combinedValue();
    }

    public Double getBid() {
        return amortization.bid();
    }

    public Double getOffer() {
        return amortization.offer();
    }

    /**
     * Value of a column by name, derived columns included.
     */
    public Object valueOf(String column) {
        if (TradeField.PV.getColumn().equals(column)) {
            return signedPv;
        }
        if (TradeField.ADJUSTED_PNL.getColumn().equals(column)) {
            return getAdjustedPnl();
        }
        if (TradeField.COMBINED_VALUE.getColumn().equals(column)) {
            return getCombinedValue();
        }
        if (TradeField.BID.getColumn().equals(column)) {
            return getBid();
        }
        if (TradeField.OFFER.getColumn().equals(column)) {
            return getOffer();
        }
        return trade.valueOf(column);
    }
}
