package com.tradestmt.application.port.out;

import com.tradestmt.domain.model.ValuationFeed;
import io.vertx.core.Future;

import java.nio.file.Path;

/**
 * Output port for reading a valuation feed file
 */
public interface ValuationFeedProvider {

    Future<ValuationFeed> load(Path feedFile);
}
