package com.tradestmt.domain.model;

import lombok.Value;

import java.util.List;
import java.util.Map;

/**
 * What the renderer wrote, what it could not write, and what it left out
 */
@Value
public class StatementRenderResult {
    List<String> writtenDocuments;
    Map<String, String> failedFunds;
    int unassignedCount;
}
