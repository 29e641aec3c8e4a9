package com.tradestmt.application.service;

import com.tradestmt.application.port.in.TradeBookUseCase;
import com.tradestmt.application.port.out.TradeBookRepository;
import com.tradestmt.domain.model.TradeBook;
import com.tradestmt.domain.model.TradeRecord;
import io.vertx.core.Future;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Record store for the trade book.
 * Keeps the book in memory between runs; a single operator edits it, so there is no locking.
 */
@Slf4j
public class TradeBookService implements TradeBookUseCase {

    private final TradeBookRepository repository;
    private final TradeRecordMapper mapper;
    private final Map<String, String> defaultFieldValues;

    private TradeBook book = TradeBook.empty();
    private boolean loaded;

    public TradeBookService(TradeBookRepository repository, TradeRecordMapper mapper,
                            Map<String, String> defaultFieldValues) {
        this.repository = repository;
        this.mapper = mapper;
        this.defaultFieldValues = Map.copyOf(defaultFieldValues);
    }

    @Override
    public Future<TradeBook> load() {
        return repository.load()
                .map(loadedBook -> {
                    book = loadedBook.copy();
                    loaded = true;
                    log.info("Trade book loaded: {} trades, {} columns", book.size(), book.getColumns().size());
                    return book.copy();
                });
    }

    @Override
    public Future<Void> save() {
        return repository.save(book.copy())
                .onSuccess(v -> log.info("Trade book saved: {} trades", book.size()));
    }

    @Override
    public TradeBook current() {
        return book.copy();
    }

    @Override
    public Future<TradeBook> snapshot() {
        if (loaded) {
            return Future.succeededFuture(current());
        }
        return load();
    }

    @Override
    public Future<TradeRecord> append(Map<String, String> fields) {
        Map<String, String> withDefaults = new LinkedHashMap<>(fields);
        defaultFieldValues.forEach(withDefaults::putIfAbsent);

        TradeRecord record = mapper.toRecord(withDefaults);
        List<TradeRecord> records = new ArrayList<>(book.getRecords());
        records.add(record);
        book = new TradeBook(mergeColumns(withDefaults), records);

        log.info("Appended trade {} (row {})", record.getTradeIdentifier(), records.size() - 1);
        return Future.succeededFuture(record.copy());
    }

    @Override
    public Future<TradeRecord> replace(int index, Map<String, String> fields) {
        if (index < 0 || index >= book.size()) {
            return Future.failedFuture(new IndexOutOfBoundsException(
                    "Row " + index + " does not exist; the trade book has " + book.size() + " rows"));
        }

        TradeRecord record = mapper.toRecord(fields);
        List<TradeRecord> records = new ArrayList<>(book.getRecords());
        records.set(index, record);
        book = new TradeBook(mergeColumns(fields), records);

        log.info("Replaced row {} with trade {}", index, record.getTradeIdentifier());
        return Future.succeededFuture(record.copy());
    }

    /**
     * Book columns plus any new column the edit introduced, appended at the end
     */
    private List<String> mergeColumns(Map<String, String> fields) {
        List<String> columns = new ArrayList<>(book.getColumns());
        for (String column : fields.keySet()) {
            if (!columns.contains(column)) {
                columns.add(column);
            }
        }
        return columns;
    }
}
