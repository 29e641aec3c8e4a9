package com.tradestmt.application.service;

import com.tradestmt.domain.model.TradeField;
import com.tradestmt.domain.model.TradeRecord;
import lombok.extern.slf4j.Slf4j;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Converts between raw column values and {@link TradeRecord}.
 * Blank or unparseable numbers and dates become null, which keeps the row out of amortization.
 */
@Slf4j
public class TradeRecordMapper {

    private final List<DateTimeFormatter> dateFormatters;

    public TradeRecordMapper(List<DateTimeFormatter> dateFormatters) {
        this.dateFormatters = List.copyOf(dateFormatters);
    }

    public TradeRecord toRecord(Map<String, String> fields) {
        Map<String, String> attributes = new LinkedHashMap<>();
        fields.forEach((column, value) -> {
            if (!TradeField.isCoreColumn(column)) {
                attributes.put(column, value);
            }
        });

        String identifier = trimToNull(fields.get(TradeField.TRADE_IDENTIFIER.getColumn()));

        LocalDate tradeDate = parseDate(identifier, fields.get(TradeField.TRADE_DATE.getColumn()));
        Double notional = parseNumber(identifier, TradeField.NOTIONAL, fields.get(TradeField.NOTIONAL.getColumn()));
        Double spread = parseNumber(identifier, TradeField.SPREAD, fields.get(TradeField.SPREAD.getColumn()));
        Double pnl = parseNumber(identifier, TradeField.PNL, fields.get(TradeField.PNL.getColumn()));

        Map<String, String> unparsed = new LinkedHashMap<>();
        keepUnparsed(unparsed, fields, TradeField.TRADE_DATE, tradeDate);
        keepUnparsed(unparsed, fields, TradeField.NOTIONAL, notional);
        keepUnparsed(unparsed, fields, TradeField.SPREAD, spread);
        keepUnparsed(unparsed, fields, TradeField.PNL, pnl);

        return TradeRecord.builder()
                .tradeIdentifier(identifier)
                .tradeDate(tradeDate)
                .notional(notional)
                .spread(spread)
                .pnl(pnl)
                .fundId(trimToNull(fields.get(TradeField.FUND_ID.getColumn())))
                .attributes(attributes)
                .unparsedValues(unparsed)
                .build();
    }

    private static void keepUnparsed(Map<String, String> unparsed, Map<String, String> fields,
                                     TradeField field, Object parsed) {
        String raw = fields.get(field.getColumn());
        if (parsed == null && trimToNull(raw) != null) {
            unparsed.put(field.getColumn(), raw);
        }
    }

    /**
     * Column values of a record, in the given column order.
     * A core cell that could not be parsed is written back as it was read.
     */
    public String[] toRow(TradeRecord record, List<String> columns) {
        String[] row = new String[columns.size()];
        for (int i = 0; i < columns.size(); i++) {
            String column = columns.get(i);
            Object value = record.valueOf(column);
            String unparsed = record.getUnparsedValue(column);
            row[i] = value == null && unparsed != null ? unparsed : format(value);
        }
        return row;
    }

    public Double parseNumber(String tradeIdentifier, TradeField field, String raw) {
        String value = trimToNull(raw);
        if (value == null) {
            return null;
        }
        try {
            Double number = Double.valueOf(value.replace(",", ""));
            if (number.isNaN() || number.isInfinite()) {
                log.warn("Trade {}: ignoring non-finite {} value '{}'", tradeIdentifier, field.getColumn(), raw);
                return null;
            }
            return number;
        } catch (NumberFormatException e) {
            log.warn("Trade {}: ignoring non-numeric {} value '{}'", tradeIdentifier, field.getColumn(), raw);
            return null;
        }
    }

    public LocalDate parseDate(String tradeIdentifier, String raw) {
        String value = trimToNull(raw);
        if (value == null) {
            return null;
        }
        // Spreadsheet exports carry a midnight time part
        int space = value.indexOf(' ');
        if (space > 0) {
            value = value.substring(0, space);
        }
        for (DateTimeFormatter formatter : dateFormatters) {
            try {
                return LocalDate.parse(value, formatter);
            } catch (DateTimeParseException e) {
                log.trace("Date '{}' does not match {}", value, formatter);
            }
        }
        log.warn("Trade {}: ignoring unparseable {} value '{}'", tradeIdentifier, TradeField.TRADE_DATE.getColumn(), raw);
        return null;
    }

    private String format(Object value) {
        if (value == null) {
            return "";
        }
        if (value instanceof Double) {
            Double number = (Double) value;
            if (number.isNaN() || number.isInfinite()) {
                return "";
            }
            return BigDecimal.valueOf(number).stripTrailingZeros().toPlainString();
        }
        if (value instanceof LocalDate) {
            return ((LocalDate) value).format(DateTimeFormatter.ISO_LOCAL_DATE);
        }
        return value.toString();
    }

    private static String trimToNull(String value) {
        if (value == null) {
            return null;
        }
        String trimmed = value.trim();
        return trimmed.isEmpty() ? null : trimmed;
    }
}
