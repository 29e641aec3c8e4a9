package com.tradestmt.application.service;

import com.tradestmt.domain.model.TradeField;
import com.tradestmt.domain.model.TradeRecord;
import org.junit.jupiter.api.Test;

import java.time.LocalDate;
import java.time.format.DateTimeFormatter;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class TradeRecordMapperTest {

    private final TradeRecordMapper mapper = new TradeRecordMapper(List.of(
            DateTimeFormatter.ISO_LOCAL_DATE,
            DateTimeFormatter.ofPattern("dd/MM/yyyy")));

    @Test
    void toRecord_readsCoreColumnsAndKeepsTheRest() {
        Map<String, String> fields = new LinkedHashMap<>();
        fields.put("TRADEIDENTIFIER", " ABC1234 ");
        fields.put("TRADE DATE", "2024-01-01");
        fields.put("NOTIONAL", "1,000,000");
        fields.put("SPREAD", "30");
        fields.put("P&L", "1200.5");
        fields.put("FUND ID", "FUND-A");
        fields.put("CCY", "USD");

        TradeRecord record = mapper.toRecord(fields);

        assertEquals("ABC1234", record.getTradeIdentifier());
        assertEquals(LocalDate.of(2024, 1, 1), record.getTradeDate());
        assertEquals(1_000_000.0, record.getNotional());
        assertEquals(30.0, record.getSpread());
        assertEquals(1200.5, record.getPnl());
        assertEquals("FUND-A", record.getFundId());
        assertEquals(Map.of("CCY", "USD"), record.getAttributes());
    }

    @Test
    void toRecord_blankValuesBecomeNull() {
        TradeRecord record = mapper.toRecord(Map.of(
                "TRADEIDENTIFIER", "ABC1234",
                "P&L", "  ",
                "FUND ID", ""));

        assertNull(record.getPnl());
        assertNull(record.getFundId());
        assertFalse(record.isAmortizable());
    }

    @Test
    void parseNumber_rejectsText() {
        assertNull(mapper.parseNumber("ABC1234", TradeField.PNL, "twelve"));
    }

    @Test
    void parseNumber_rejectsNonFiniteValues() {
        assertNull(mapper.parseNumber("ABC1234", TradeField.PNL, "NaN"));
        assertNull(mapper.parseNumber("ABC1234", TradeField.SPREAD, "Infinity"));
        assertNull(mapper.parseNumber("ABC1234", TradeField.NOTIONAL, "-Infinity"));
    }

    @Test
    void toRecord_nonFiniteNumberIsWrittenBackAsRead() {
        TradeRecord record = mapper.toRecord(Map.of("TRADEIDENTIFIER", "ABC1234", "P&L", "NaN"));

        assertNull(record.getPnl());
        assertFalse(record.isAmortizable());
        assertArrayEquals(new String[]{"ABC1234", "NaN"}, mapper.toRow(record, List.of("TRADEIDENTIFIER", "P&L")));
    }

    @Test
    void toRecord_keepsCellsItCannotParse() {
        Map<String, String> fields = new LinkedHashMap<>();
        fields.put("TRADEIDENTIFIER", "ABC1234");
        fields.put("TRADE DATE", "2024/01/15");
        fields.put("P&L", "TBD");
        fields.put("SPREAD", "30");
        fields.put("FUND ID", "F1");

        TradeRecord record = mapper.toRecord(fields);
        String[] row = mapper.toRow(record, List.of("TRADEIDENTIFIER", "TRADE DATE", "P&L", "SPREAD", "FUND ID"));

        assertNull(record.getTradeDate());
        assertNull(record.getPnl());
        assertEquals("2024/01/15", record.getUnparsedValue("TRADE DATE"));
        assertNull(record.getUnparsedValue("SPREAD"));
        assertArrayEquals(new String[]{"ABC1234", "2024/01/15", "TBD", "30", "F1"}, row);
    }

    @Test
    void toRow_parsedValueWinsOverOldText() {
        TradeRecord record = mapper.toRecord(Map.of("TRADEIDENTIFIER", "ABC1234", "P&L", "TBD"))
                .toBuilder()
                .pnl(500.0)
                .build();

        assertArrayEquals(new String[]{"500"}, mapper.toRow(record, List.of("P&L")));
    }

    @Test
    void toRow_nonFiniteValueRendersEmpty() {
        TradeRecord record = TradeRecord.builder().tradeIdentifier("ABC1234").pnl(Double.NaN).build();

        assertArrayEquals(new String[]{""}, mapper.toRow(record, List.of("P&L")));
    }

    @Test
    void parseDate_triesEachPattern() {
        assertEquals(LocalDate.of(2024, 3, 15), mapper.parseDate("ABC1234", "15/03/2024"));
        assertEquals(LocalDate.of(2024, 3, 15), mapper.parseDate("ABC1234", "2024-03-15"));
    }

    @Test
    void parseDate_dropsTimePart() {
        assertEquals(LocalDate.of(2024, 3, 15), mapper.parseDate("ABC1234", "2024-03-15 00:00:00"));
    }

    @Test
    void parseDate_unparseableIsNull() {
        assertNull(mapper.parseDate("ABC1234", "March 15th"));
        assertNull(mapper.parseDate("ABC1234", null));
    }

    @Test
    void toRow_followsColumnOrder() {
        TradeRecord record = TradeRecord.builder()
                .tradeIdentifier("ABC1234")
                .tradeDate(LocalDate.of(2024, 1, 1))
                .pnl(1200.0)
                .attributes(new LinkedHashMap<>(Map.of("CCY", "USD")))
                .build();

        String[] row = mapper.toRow(record, List.of("CCY", "P&L", "TRADEIDENTIFIER", "TRADE DATE", "FUND ID"));

        assertArrayEquals(new String[]{"USD", "1200", "ABC1234", "2024-01-01", ""}, row);
    }
}
