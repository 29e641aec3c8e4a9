package com.tradestmt.application.port.in;

import com.tradestmt.domain.model.StatementRunReport;
import io.vertx.core.Future;

import java.time.LocalDate;

/**
 * Input port for the reconciliation run: merge, compute, render
 */
public interface StatementRunUseCase {

    /**
     * Run the pipeline for one as-of date.
     * Fails on missing sources or columns; per-fund write failures are listed in the report instead.
     * @param asOfDate Date the valuation and amortization are computed for
     * @return Future with the run report
     */
    Future<StatementRunReport> runStatements(LocalDate asOfDate);

    /**
     * Whether a run is in progress
     */
    boolean isRunning();
}
