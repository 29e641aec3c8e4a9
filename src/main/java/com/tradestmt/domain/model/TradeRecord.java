package com.tradestmt.domain.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDate;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Trade book row - typed core fields plus pass-through attributes
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class TradeRecord {
    private String tradeIdentifier;     // Canonical form, at most 7 characters
    private LocalDate tradeDate;
    private Double notional;
    private Double spread;
    private Double pnl;                 // Raw P&L before amortization
    private String fundId;              // Statement grouping key

    // Counterparty terms, rates, currencies... keyed by column name, in file order
    @Builder.Default
    private Map<String, String> attributes = new LinkedHashMap<>();

    // Core cells as read from the file when they could not be parsed, so a save writes them back
    @Builder.Default
    private Map<String, String> unparsedValues = new LinkedHashMap<>();

    public String getAttribute(String column, String defaultValue) {
        String value = attributes == null ? null : attributes.get(column);
        return value == null ? defaultValue : value;
    }

    public String getUnparsedValue(String column) {
        return unparsedValues == null ? null : unparsedValues.get(column);
    }

    public boolean hasIdentifier() {
        return tradeIdentifier != null && !tradeIdentifier.isBlank();
    }

    public boolean isAmortizable() {
        return pnl != null && tradeDate != null;
    }

    public boolean hasFund() {
        return fundId != null && !fundId.isBlank();
    }

    /**
     * Value of a column by name: typed field for known columns, attribute otherwise.
     * Returns null when the record carries nothing under that name.
     */
    public Object valueOf(String column) {
        if (!TradeField.isKnown(column)) {
            return getAttribute(column, null);
        }
        switch (TradeField.fromColumn(column)) {
            case TRADE_IDENTIFIER:
                return tradeIdentifier;
            case TRADE_DATE:
                return tradeDate;
            case NOTIONAL:
                return notional;
            case SPREAD:
                return spread;
            case PNL:
                return pnl;
            case FUND_ID:
                return fundId;
            default:
                return getAttribute(column, null);
        }
    }

    public TradeRecord copy() {
        return toBuilder()
                .attributes(attributes == null ? new LinkedHashMap<>() : new LinkedHashMap<>(attributes))
                .unparsedValues(unparsedValues == null ? new LinkedHashMap<>() : new LinkedHashMap<>(unparsedValues))
                .build();
    }
}
