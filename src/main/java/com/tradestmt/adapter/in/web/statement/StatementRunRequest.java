package com.tradestmt.adapter.in.web.statement;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Statement Run Request DTO - HTTP request to run the pipeline
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class StatementRunRequest {
    private String asOfDate;    // ISO yyyy-MM-dd
}
