package com.tradestmt.application.port.out;

import com.tradestmt.domain.model.TradeBook;
import io.vertx.core.Future;

/**
 * Output port for reading and rewriting the trade book file
 */
public interface TradeBookRepository {

    /**
     * Read every row; fails with SourceNotFoundException when the file is missing
     */
    Future<TradeBook> load();

    /**
     * Rewrite the file in full, columns in the book's order
     */
    Future<Void> save(TradeBook tradeBook);
}
