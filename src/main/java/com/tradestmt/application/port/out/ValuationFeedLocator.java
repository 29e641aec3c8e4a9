package com.tradestmt.application.port.out;

import io.vertx.core.Future;

import java.nio.file.Path;
import java.time.LocalDate;

/**
 * Output port resolving the valuation feed file of a given day
 */
public interface ValuationFeedLocator {

    /**
     * @return Future with the path of a readable feed file, failed with SourceNotFoundException otherwise
     */
    Future<Path> locate(LocalDate asOfDate);
}
