package com.tradestmt.domain.model;

import lombok.Value;

/**
 * A populated template ready to be written for one fund
 */
@Value
public class RenderedStatement {
    String fundId;
    String documentName;
    StatementDocument document;
    int rowCount;           // Data rows inserted
}
