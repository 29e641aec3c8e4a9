package com.tradestmt.application.service;

import com.tradestmt.domain.model.CellFormat;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.text.DecimalFormat;
import java.text.DecimalFormatSymbols;
import java.time.LocalDate;
import java.time.format.DateTimeFormatter;
import java.util.Locale;

/**
 * Renders statement cell values as text
 */
public class CellFormatter {

    private static final DecimalFormatSymbols SYMBOLS = DecimalFormatSymbols.getInstance(Locale.US);

    private final DateTimeFormatter dateFormatter;

    public CellFormatter(DateTimeFormatter dateFormatter) {
        this.dateFormatter = dateFormatter;
    }

    public String format(Object value, CellFormat format) {
        if (value == null) {
            return "";
        }
        switch (format) {
            case DATE:
                return formatDate(value);
            case CURRENCY:
                return formatNumber(value, "#,##0.00");
            case NUMBER:
                return formatNumber(value, "0.00");
            case PERCENT_2:
                return formatNumber(value, "0.00%");
            case PERCENT_3:
                return formatNumber(value, "0.000%");
            case TEXT:
            default:
                return formatText(value);
        }
    }

    public String formatDate(LocalDate date) {
        return date == null ? "" : date.format(dateFormatter);
    }

    private String formatDate(Object value) {
        if (value instanceof LocalDate) {
            return formatDate((LocalDate) value);
        }
        return value.toString();
    }

    private String formatNumber(Object value, String pattern) {
        Double number = toDouble(value);
        if (number == null) {
            return isNonFinite(value) ? "" : value.toString();
        }
        DecimalFormat decimalFormat = new DecimalFormat(pattern, SYMBOLS);
        decimalFormat.setRoundingMode(RoundingMode.HALF_UP);
        return decimalFormat.format(number);
    }

    private String formatText(Object value) {
        if (isNonFinite(value)) {
            return "";
        }
        if (value instanceof Double) {
            return BigDecimal.valueOf((Double) value).stripTrailingZeros().toPlainString();
        }
        if (value instanceof LocalDate) {
            return formatDate((LocalDate) value);
        }
        return value.toString();
    }

    private static boolean isNonFinite(Object value) {
        return value instanceof Double && (((Double) value).isNaN() || ((Double) value).isInfinite());
    }

    /**
     * Finite number behind a cell value, or null
     */
    private static Double toDouble(Object value) {
        Double number;
        if (value instanceof Number) {
            number = ((Number) value).doubleValue();
        } else {
            String text = value.toString().trim().replace(",", "");
            if (text.isEmpty()) {
                return null;
            }
            try {
                number = Double.valueOf(text);
            } catch (NumberFormatException e) {
                return null;
            }
        }
        return number.isNaN() || number.isInfinite() ? null : number;
    }
}
