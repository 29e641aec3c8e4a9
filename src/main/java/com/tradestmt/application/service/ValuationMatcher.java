package com.tradestmt.application.service;

import com.tradestmt.domain.model.MergedRecord;
import com.tradestmt.domain.model.MergedTable;
import com.tradestmt.domain.model.TradeBook;
import com.tradestmt.domain.model.TradeField;
import com.tradestmt.domain.model.TradeRecord;
import com.tradestmt.domain.model.ValuationFeed;
import com.tradestmt.domain.model.ValuationRecord;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Left-joins the day's valuation feed onto the trade book.
 *
 * <p>Feed identifiers are cut to their first 7 characters; book identifiers are compared as they are.
 * Every book row survives the join. A row without a valuation gets PV 0, and PV is always
 * negated into the book's sign convention.
 */
@Slf4j
public class ValuationMatcher {

    private final SchemaValidator schemaValidator;

    public ValuationMatcher(SchemaValidator schemaValidator) {
        this.schemaValidator = schemaValidator;
    }

    /**
     * @throws com.tradestmt.domain.exception.SchemaException if either side has no trade identifier column,
     *         or the feed has no PV column
     */
    public MergedTable merge(TradeBook tradeBook, ValuationFeed valuationFeed) {
        schemaValidator.requireColumns("trade book", tradeBook.getColumns(), TradeField.TRADE_IDENTIFIER);
        schemaValidator.requireColumns("valuation feed", valuationFeed.getColumns(),
                TradeField.TRADE_IDENTIFIER, TradeField.PV);

        Map<String, Double> pvByIdentifier = indexFeed(valuationFeed);

        List<MergedRecord> merged = new ArrayList<>(tradeBook.size());
        int matched = 0;
        for (TradeRecord trade : tradeBook.getRecords()) {
            String identifier = trade.hasIdentifier() ? trade.getTradeIdentifier().trim() : null;
            boolean found = identifier != null && pvByIdentifier.containsKey(identifier);
            Double feedPv = found ? pvByIdentifier.get(identifier) : null;
            if (found) {
                matched++;
            }

            merged.add(MergedRecord.builder()
                    .trade(trade.copy())
                    .signedPv(signedPv(feedPv))
                    .matched(found)
                    .build());
        }

        log.info("Matched {} of {} trades against {} valuation rows",
                matched, tradeBook.size(), valuationFeed.getRecords().size());

        return new MergedTable(mergedColumns(tradeBook.getColumns()), merged);
    }

    /**
     * Fill a missing PV with zero, then flip the sign. Zero stays positive zero.
     */
    static double signedPv(Double feedPv) {
        double filled = feedPv == null ? 0.0 : feedPv;
        return 0.0 - filled;
    }

    private Map<String, Double> indexFeed(ValuationFeed feed) {
        Map<String, Double> index = new HashMap<>();
        for (ValuationRecord record : feed.getRecords()) {
            String identifier = record.canonicalIdentifier();
            if (identifier == null || identifier.isEmpty()) {
                continue;
            }
            if (index.containsKey(identifier)) {
                log.warn("Duplicate valuation for trade {}; keeping the first row", identifier);
                continue;
            }
            index.put(identifier, record.getPv());
        }
        return index;
    }

    private static List<String> mergedColumns(List<String> bookColumns) {
        List<String> columns = new ArrayList<>(bookColumns);
        for (String derived : TradeField.derivedColumns()) {
            if (!columns.contains(derived)) {
                columns.add(derived);
            }
        }
        return columns;
    }
}
