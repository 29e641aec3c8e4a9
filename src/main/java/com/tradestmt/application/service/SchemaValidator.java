package com.tradestmt.application.service;

import com.tradestmt.domain.exception.SchemaException;
import com.tradestmt.domain.model.TradeField;

import java.util.ArrayList;
import java.util.List;

/**
 * Presence-of-column checks for the pipeline's input tables
 */
public class SchemaValidator {

    public ValidationResult validate(List<String> columns, TradeField... required) {
        List<String> missing = new ArrayList<>();
        for (TradeField field : required) {
            if (!columns.contains(field.getColumn())) {
                missing.add(field.getColumn());
            }
        }

        if (missing.isEmpty()) {
            return ValidationResult.valid();
        } else {
            return ValidationResult.invalid(missing);
        }
    }

    /**
     * @throws SchemaException naming the first missing column
     */
    public void requireColumns(String source, List<String> columns, TradeField... required) {
        ValidationResult result = validate(columns, required);
        if (result.hasErrors()) {
            throw new SchemaException(source, result.missingColumns().get(0));
        }
    }
}
