package com.tradestmt.adapter.out.csv;

import com.tradestmt.application.port.out.ValuationFeedProvider;
import com.tradestmt.domain.exception.SourceNotFoundException;
import com.tradestmt.domain.model.TradeField;
import com.tradestmt.domain.model.ValuationFeed;
import com.tradestmt.domain.model.ValuationRecord;
import io.vertx.core.Future;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Reads the daily valuation feed from CSV.
 * Column checks are left to the matcher; this adapter only reads what is there.
 */
@Slf4j
public class CsvValuationFeedAdapter implements ValuationFeedProvider {

    @Override
    public Future<ValuationFeed> load(Path feedFile) {
        if (!Files.isRegularFile(feedFile)) {
            return Future.failedFuture(new SourceNotFoundException("Valuation feed", feedFile));
        }
        try {
            List<String[]> rows = CsvFiles.readAll(feedFile);
            List<String> columns = CsvFiles.header(rows);

            List<ValuationRecord> records = new ArrayList<>();
            for (Map<String, String> values : CsvFiles.records(rows, columns)) {
                String identifier = values.get(TradeField.TRADE_IDENTIFIER.getColumn());
                records.add(new ValuationRecord(identifier, parsePv(identifier, values.get(TradeField.PV.getColumn()))));
            }

            log.info("Read {} valuations from {}", records.size(), feedFile);
            return Future.succeededFuture(new ValuationFeed(columns, records));
        } catch (IOException e) {
            log.error("Failed to read valuation feed {}: {}", feedFile, e.getMessage());
            return Future.failedFuture(new SourceNotFoundException("Valuation feed", feedFile, e));
        }
    }

    private static Double parsePv(String identifier, String raw) {
        if (raw == null || raw.isBlank()) {
            return null;
        }
        try {
            Double pv = Double.valueOf(raw.trim().replace(",", ""));
            if (pv.isNaN() || pv.isInfinite()) {
                log.warn("Valuation {}: ignoring non-finite PV '{}'", identifier, raw);
                return null;
            }
            return pv;
        } catch (NumberFormatException e) {
            log.warn("Valuation {}: ignoring non-numeric PV '{}'", identifier, raw);
            return null;
        }
    }
}
