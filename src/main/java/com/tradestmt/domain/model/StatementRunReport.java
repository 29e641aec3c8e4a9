package com.tradestmt.domain.model;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.time.LocalDate;
import java.util.List;
import java.util.Map;

/**
 * Outcome of one reconciliation run
 */
@Value
@Builder(toBuilder = true)
public class StatementRunReport {
    LocalDate asOfDate;
    int tradeCount;
    int matchedCount;
    int computedCount;
    int unassignedCount;            // Rows dropped for lack of a fund id

    @Singular
    List<String> writtenDocuments;

    @Singular
    Map<String, String> failedFunds; // Fund id -> failure message

    public boolean isPartial() {
        return !failedFunds.isEmpty();
    }

    public String getStatus() {
        return isPartial() ? "PARTIAL" : "COMPLETED";
    }
}
