package com.tradestmt.domain.model;

import lombok.Value;

/**
 * Daily valuation feed row
 * The identifier is kept raw; matching truncates it to the canonical length.
 */
@Value
public class ValuationRecord {
    public static final int CANONICAL_ID_LENGTH = 7;

    String tradeIdentifier;
    Double pv;              // Provider's sign convention, null when the feed cell is blank

    public String canonicalIdentifier() {
        if (tradeIdentifier == null) {
            return null;
        }
        String trimmed = tradeIdentifier.trim();
        return trimmed.length() > CANONICAL_ID_LENGTH ? trimmed.substring(0, CANONICAL_ID_LENGTH) : trimmed;
    }
}
