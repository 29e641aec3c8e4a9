package com.tradestmt.application.service;

import com.tradestmt.application.port.in.StatementRunUseCase;
import com.tradestmt.application.port.in.TradeBookUseCase;
import com.tradestmt.application.port.out.StatementTemplateProvider;
import com.tradestmt.application.port.out.ValuationFeedLocator;
import com.tradestmt.application.port.out.ValuationFeedProvider;
import com.tradestmt.domain.model.MergedTable;
import com.tradestmt.domain.model.StatementDocument;
import com.tradestmt.domain.model.StatementRunReport;
import com.tradestmt.domain.model.TradeBook;
import com.tradestmt.domain.model.ValuationFeed;
import io.vertx.core.Future;
import lombok.extern.slf4j.Slf4j;

import java.time.LocalDate;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Use case implementation for a statement run
 * Trade book -> valuation match -> amortization -> one statement per fund
 */
@Slf4j
public class StatementRunService implements StatementRunUseCase {

    private final TradeBookUseCase tradeBook;
    private final ValuationFeedLocator feedLocator;
    private final ValuationFeedProvider feedProvider;
    private final StatementTemplateProvider templateProvider;
    private final ValuationMatcher matcher;
    private final AmortizationEngine amortizationEngine;
    private final StatementRenderer renderer;

    private final AtomicBoolean running = new AtomicBoolean(false);

    public StatementRunService(
            TradeBookUseCase tradeBook,
            ValuationFeedLocator feedLocator,
            ValuationFeedProvider feedProvider,
            StatementTemplateProvider templateProvider,
            ValuationMatcher matcher,
            AmortizationEngine amortizationEngine,
            StatementRenderer renderer
    ) {
        this.tradeBook = tradeBook;
        this.feedLocator = feedLocator;
        this.feedProvider = feedProvider;
        this.templateProvider = templateProvider;
        this.matcher = matcher;
        this.amortizationEngine = amortizationEngine;
        this.renderer = renderer;
    }

    @Override
    public Future<StatementRunReport> runStatements(LocalDate asOfDate) {
        if (asOfDate == null) {
            return Future.failedFuture(new IllegalArgumentException("asOfDate is required"));
        }
        if (!running.compareAndSet(false, true)) {
            return Future.failedFuture(new IllegalStateException("A statement run is already in progress"));
        }

        log.info("Starting statement run as of {}", asOfDate);

        // Every source is read before anything is computed
        return tradeBook.snapshot()
                .compose(book -> feedLocator.locate(asOfDate)
                        .compose(feedProvider::load)
                        .compose(feed -> templateProvider.loadTemplate()
                                .compose(template -> process(book, feed, template, asOfDate))))
                .onSuccess(report -> log.info(
                        "Statement run as of {} {}: {} trades, {} matched, {} amortized, {} written, {} failed, {} unassigned",
                        asOfDate, report.getStatus(), report.getTradeCount(), report.getMatchedCount(),
                        report.getComputedCount(), report.getWrittenDocuments().size(),
                        report.getFailedFunds().size(), report.getUnassignedCount()))
                .onFailure(error -> log.error("Statement run as of {} failed: {}", asOfDate, error.getMessage()))
                .onComplete(ar -> running.set(false));
    }

    @Override
    public boolean isRunning() {
        return running.get();
    }

    private Future<StatementRunReport> process(TradeBook book, ValuationFeed feed,
                                               StatementDocument template, LocalDate asOfDate) {
        MergedTable computed;
        try {
            MergedTable merged = matcher.merge(book, feed);
            computed = amortizationEngine.computeAll(merged, asOfDate);
        } catch (RuntimeException e) {
            return Future.failedFuture(e);
        }

        return renderer.render(computed, asOfDate, template)
                .map(result -> StatementRunReport.builder()
                        .asOfDate(asOfDate)
                        .tradeCount(book.size())
                        .matchedCount((int) computed.matchedCount())
                        .computedCount((int) computed.computedCount())
                        .unassignedCount(result.getUnassignedCount())
                        .writtenDocuments(result.getWrittenDocuments())
                        .failedFunds(result.getFailedFunds())
                        .build());
    }
}
