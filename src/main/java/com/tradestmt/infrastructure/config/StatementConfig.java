package com.tradestmt.infrastructure.config;

import com.tradestmt.domain.model.CellFormat;
import io.vertx.core.json.JsonArray;
import io.vertx.core.json.JsonObject;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Settings for one process, handed to each component at construction
 */
@Value
@Builder(toBuilder = true)
public class StatementConfig {

    private static final int DEFAULT_PORT = 8080;

    int httpPort;

    Path primaryPath;       // Working folder: trade book, template, located feeds
    Path secondaryPath;     // Fallback folder the feed is copied from
    Path outputPath;        // Statements are written here

    String tradeBookFile;
    String templateFile;
    String feedFilePattern; // DateTimeFormatter pattern, e.g. 'valuation_'yyyyMMdd'.csv'

    String feedLabel;
    String productLabel;
    String filePrefix;
    String dateFormat;      // Date cells and the as-of stamp

    @Singular
    List<String> inputDateFormats;

    TemplateLayout layout;

    @Singular("mapHeader")
    Map<String, String> headerMapping;          // Template header text -> field name

    @Singular("defaultFieldValue")
    Map<String, String> defaultFieldValues;     // Column -> value for appended rows

    @Singular("columnFormat")
    Map<String, CellFormat> columnFormats;      // Field name -> cell format

    public Path tradeBookPath() {
        return primaryPath.resolve(tradeBookFile);
    }

    public Path templatePath() {
        return primaryPath.resolve(templateFile);
    }

    public String fieldForHeader(String header) {
        return headerMapping.getOrDefault(header, header);
    }

    public CellFormat formatFor(String field) {
        return columnFormats.getOrDefault(field, CellFormat.TEXT);
    }

    public DateTimeFormatter statementDateFormatter() {
        return DateTimeFormatter.ofPattern(dateFormat);
    }

    public List<DateTimeFormatter> inputDateFormatters() {
        List<DateTimeFormatter> formatters = new ArrayList<>();
        formatters.add(DateTimeFormatter.ISO_LOCAL_DATE);
        inputDateFormats.forEach(pattern -> formatters.add(DateTimeFormatter.ofPattern(pattern)));
        return formatters;
    }

    public static StatementConfig fromJson(JsonObject config) {
        JsonObject paths = config.getJsonObject("paths", new JsonObject());
        JsonObject files = config.getJsonObject("files", new JsonObject());
        JsonObject statement = config.getJsonObject("statement", new JsonObject());

        String primary = paths.getString("primary", "data");

        StatementConfigBuilder builder = StatementConfig.builder()
                .httpPort(config.getJsonObject("http", new JsonObject()).getInteger("port", DEFAULT_PORT))
                .primaryPath(Paths.get(primary))
                .secondaryPath(Paths.get(paths.getString("secondary", primary)))
                .outputPath(Paths.get(paths.getString("output", primary + "/statements")))
                .tradeBookFile(files.getString("tradeBook", "trade_book.csv"))
                .templateFile(files.getString("template", "statement_template.csv"))
                .feedFilePattern(files.getString("feedPattern", "'valuation_'yyyyMMdd'.csv'"))
                .feedLabel(statement.getString("feedLabel", "Valuation"))
                .productLabel(statement.getString("productLabel", "Statement"))
                .filePrefix(statement.getString("filePrefix", "Statement"))
                .dateFormat(statement.getString("dateFormat", "dd/MM/yyyy"))
                .layout(TemplateLayout.fromJson(config.getJsonObject("template", new JsonObject())));

        JsonArray inputFormats = statement.getJsonArray("inputDateFormats", new JsonArray());
        for (int i = 0; i < inputFormats.size(); i++) {
            builder.inputDateFormat(inputFormats.getString(i));
        }

        stringMap(config.getJsonObject("headerMapping")).forEach(builder::mapHeader);
        stringMap(config.getJsonObject("defaultFieldValues")).forEach(builder::defaultFieldValue);
        stringMap(config.getJsonObject("columnFormats"))
                .forEach((field, format) -> builder.columnFormat(field, CellFormat.fromValue(format)));

        return builder.build();
    }

    private static Map<String, String> stringMap(JsonObject json) {
        Map<String, String> result = new LinkedHashMap<>();
        if (json != null) {
            json.forEach(entry -> result.put(entry.getKey(),
                    entry.getValue() == null ? "" : String.valueOf(entry.getValue())));
        }
        return result;
    }
}
