package com.tradestmt.application.service;

import java.util.Collections;
import java.util.List;

/**
 * Result of a column presence check
 */
public record ValidationResult(boolean isValid, List<String> missingColumns) {

    public boolean hasErrors() {
        return !missingColumns.isEmpty();
    }

    public static ValidationResult valid() {
        return new ValidationResult(true, Collections.emptyList());
    }

    public static ValidationResult invalid(List<String> missingColumns) {
        return new ValidationResult(false, Collections.unmodifiableList(missingColumns));
    }
}
