package com.tradestmt.adapter.out.csv;

import com.tradestmt.application.port.out.TradeBookRepository;
import com.tradestmt.application.service.TradeRecordMapper;
import com.tradestmt.domain.exception.SourceNotFoundException;
import com.tradestmt.domain.exception.StatementException;
import com.tradestmt.domain.model.TradeBook;
import com.tradestmt.domain.model.TradeRecord;
import io.vertx.core.Future;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * CSV implementation of TradeBookRepository
 * The file is read in full and rewritten in full.
 */
@Slf4j
@RequiredArgsConstructor
public class CsvTradeBookAdapter implements TradeBookRepository {

    private final Path file;
    private final TradeRecordMapper mapper;

    @Override
    public Future<TradeBook> load() {
        if (!Files.isRegularFile(file)) {
            return Future.failedFuture(new SourceNotFoundException("Trade book", file));
        }
        try {
            List<String[]> rows = CsvFiles.readAll(file);
            List<String> columns = CsvFiles.header(rows);

            List<TradeRecord> records = new ArrayList<>();
            for (Map<String, String> values : CsvFiles.records(rows, columns)) {
                records.add(mapper.toRecord(values));
            }

            log.debug("Read {} trades from {}", records.size(), file);
            return Future.succeededFuture(new TradeBook(columns, records));
        } catch (IOException e) {
            log.error("Failed to read trade book {}: {}", file, e.getMessage());
            return Future.failedFuture(new SourceNotFoundException("Trade book", file, e));
        }
    }

    @Override
    public Future<Void> save(TradeBook tradeBook) {
        List<String[]> rows = new ArrayList<>(tradeBook.size() + 1);
        rows.add(tradeBook.getColumns().toArray(new String[0]));
        for (TradeRecord record : tradeBook.getRecords()) {
            rows.add(mapper.toRow(record, tradeBook.getColumns()));
        }

        try {
            CsvFiles.writeAll(file, rows);
            log.debug("Wrote {} trades to {}", tradeBook.size(), file);
            return Future.succeededFuture();
        } catch (IOException e) {
            log.error("Failed to save trade book {}: {}", file, e.getMessage());
            return Future.failedFuture(new StatementException("Failed to save trade book to " + file, e));
        }
    }
}
