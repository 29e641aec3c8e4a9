package com.tradestmt.domain.model;

import lombok.Value;

import java.time.LocalDate;
import java.util.List;

/**
 * Merged records of one fund for one run
 */
@Value
public class StatementGroup {
    String fundId;
    LocalDate asOfDate;
    List<MergedRecord> records;
}
