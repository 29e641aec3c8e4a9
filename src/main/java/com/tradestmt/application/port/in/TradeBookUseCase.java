package com.tradestmt.application.port.in;

import com.tradestmt.domain.model.TradeBook;
import com.tradestmt.domain.model.TradeRecord;
import io.vertx.core.Future;

import java.util.Map;

/**
 * Input port for the trade book (record store)
 * The book is loaded once and kept in memory between runs.
 */
public interface TradeBookUseCase {

    /**
     * Read the book from its file, replacing the in-memory copy
     */
    Future<TradeBook> load();

    /**
     * Rewrite the whole file from the in-memory copy
     */
    Future<Void> save();

    /**
     * Snapshot of the in-memory book; changes to it do not affect the store
     */
    TradeBook current();

    /**
     * Snapshot for a pipeline run, loading the book first if that has not happened yet
     */
    Future<TradeBook> snapshot();

    /**
     * Append a row built from column values; absent columns take their configured defaults
     * @return Future with the appended record
     */
    Future<TradeRecord> append(Map<String, String> fields);

    /**
     * Replace the row at {@code index} (0-based)
     */
    Future<TradeRecord> replace(int index, Map<String, String> fields);
}
