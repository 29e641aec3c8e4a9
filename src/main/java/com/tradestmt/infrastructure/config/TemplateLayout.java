package com.tradestmt.infrastructure.config;

import io.vertx.core.json.JsonObject;
import lombok.Builder;
import lombok.Value;

/**
 * Fixed cell coordinates inside the statement template (0-based)
 */
@Value
@Builder
public class TemplateLayout {
    int titleRow;
    int titleColumn;
    int dateRow;
    int dateColumn;
    int headerRow;      // Row whose cell texts drive the header mapping
    int anchorRow;      // First data row is inserted here

    public static TemplateLayout defaults() {
        return fromJson(new JsonObject());
    }

    public static TemplateLayout fromJson(JsonObject json) {
        return TemplateLayout.builder()
                .titleRow(json.getInteger("titleRow", 0))
                .titleColumn(json.getInteger("titleColumn", 0))
                .dateRow(json.getInteger("dateRow", 1))
                .dateColumn(json.getInteger("dateColumn", 0))
                .headerRow(json.getInteger("headerRow", 3))
                .anchorRow(json.getInteger("anchorRow", 4))
                .build();
    }
}
