package com.tradestmt.application.service;

import com.tradestmt.application.port.in.TradeBookUseCase;
import com.tradestmt.application.port.out.StatementTemplateProvider;
import com.tradestmt.application.port.out.StatementWriter;
import com.tradestmt.application.port.out.ValuationFeedLocator;
import com.tradestmt.application.port.out.ValuationFeedProvider;
import com.tradestmt.domain.exception.SchemaException;
import com.tradestmt.domain.exception.SourceNotFoundException;
import com.tradestmt.domain.model.StatementDocument;
import com.tradestmt.domain.model.StatementRunReport;
import com.tradestmt.domain.model.TradeBook;
import com.tradestmt.domain.model.TradeRecord;
import com.tradestmt.domain.model.ValuationFeed;
import com.tradestmt.domain.model.ValuationRecord;
import io.vertx.core.Future;
import io.vertx.core.Promise;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.Mock;
import org.mockito.MockitoAnnotations;

import java.nio.file.Path;
import java.time.LocalDate;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

/**
 * Unit test for StatementRunService
 * Tests the use case implementation in isolation using mocks
 */
class StatementRunServiceTest {

    private static final LocalDate AS_OF = LocalDate.of(2024, 7, 1);
    private static final Path FEED_FILE = Path.of("data", "valuation_20240701.csv");

    @Mock
    private TradeBookUseCase tradeBook;

    @Mock
    private ValuationFeedLocator feedLocator;

    @Mock
    private ValuationFeedProvider feedProvider;

    @Mock
    private StatementTemplateProvider templateProvider;

    @Mock
    private StatementWriter writer;

    private StatementRunService service;
    private AutoCloseable mocks;

    @BeforeEach
    void setUp() {
        mocks = MockitoAnnotations.openMocks(this);
        service = new StatementRunService(
                tradeBook,
                feedLocator,
                feedProvider,
                templateProvider,
                new ValuationMatcher(new SchemaValidator()),
                new AmortizationEngine(),
                new StatementRenderer(StatementRendererTest.config(), writer)
        );

        when(tradeBook.snapshot()).thenReturn(Future.succeededFuture(book()));
        when(feedLocator.locate(AS_OF)).thenReturn(Future.succeededFuture(FEED_FILE));
        when(feedProvider.load(FEED_FILE)).thenReturn(Future.succeededFuture(new ValuationFeed(
                List.of("TRADEIDENTIFIER", "PV"),
                List.of(new ValuationRecord("ABC1234XYZ", 500.0)))));
        when(templateProvider.loadTemplate()).thenReturn(Future.succeededFuture(template()));
        when(writer.resolve(anyString())).thenAnswer(inv -> Path.of("out", inv.<String>getArgument(0)));
        when(writer.write(anyString(), any()))
                .thenAnswer(inv -> Future.succeededFuture(Path.of("out", inv.<String>getArgument(0))));
    }

    @AfterEach
    void tearDown() throws Exception {
        if (mocks != null) {
            mocks.close();
        }
    }

    @Test
    void runStatements_shouldMergeComputeAndWritePerFund() throws InterruptedException {
        CountDownLatch latch = new CountDownLatch(1);

        service.runStatements(AS_OF)
                .onComplete(ar -> {
                    assertTrue(ar.succeeded());
                    StatementRunReport report = ar.result();
                    assertEquals("COMPLETED", report.getStatus());
                    assertEquals(AS_OF, report.getAsOfDate());
                    assertEquals(4, report.getTradeCount());
                    assertEquals(1, report.getMatchedCount());
                    assertEquals(3, report.getComputedCount());
                    assertEquals(1, report.getUnassignedCount());
                    assertEquals(2, report.getWrittenDocuments().size());
                    assertFalse(report.isPartial());
                    latch.countDown();
                });

        assertTrue(latch.await(5, TimeUnit.SECONDS));
        verify(writer, times(2)).write(anyString(), any());
        assertFalse(service.isRunning());
    }

    @Test
    void runStatements_shouldReportPartialOutput() {
        when(writer.write(eq("Statement_FUND-B_20240701.csv"), any()))
                .thenReturn(Future.failedFuture("permission denied"));

        StatementRunReport report = service.runStatements(AS_OF).result();

        assertEquals("PARTIAL", report.getStatus());
        assertTrue(report.isPartial());
        assertEquals(1, report.getWrittenDocuments().size());
        assertTrue(report.getFailedFunds().containsKey("FUND-B"));
    }

    @Test
    void runStatements_shouldFailBeforeComputingWhenFeedIsMissing() {
        when(feedLocator.locate(AS_OF))
                .thenReturn(Future.failedFuture(new SourceNotFoundException("Valuation feed", FEED_FILE)));

        Future<StatementRunReport> future = service.runStatements(AS_OF);

        assertTrue(future.failed());
        assertInstanceOf(SourceNotFoundException.class, future.cause());
        verify(feedProvider, never()).load(any());
        verify(writer, never()).write(anyString(), any());
        assertFalse(service.isRunning());
    }

    @Test
    void runStatements_shouldFailWhenTemplateIsMissing() {
        when(templateProvider.loadTemplate())
                .thenReturn(Future.failedFuture(new SourceNotFoundException("Statement template", Path.of("t.csv"))));

        Future<StatementRunReport> future = service.runStatements(AS_OF);

        assertTrue(future.failed());
        verify(writer, never()).write(anyString(), any());
    }

    @Test
    void runStatements_shouldFailOnSchemaError() {
        when(feedProvider.load(FEED_FILE)).thenReturn(Future.succeededFuture(
                new ValuationFeed(List.of("ID", "PV"), List.of())));

        Future<StatementRunReport> future = service.runStatements(AS_OF);

        assertTrue(future.failed());
        assertInstanceOf(SchemaException.class, future.cause());
        verify(writer, never()).write(anyString(), any());
    }

    @Test
    void runStatements_shouldRejectOverlappingRun() {
        Promise<TradeBook> pending = Promise.promise();
        when(tradeBook.snapshot()).thenReturn(pending.future());

        Future<StatementRunReport> first = service.runStatements(AS_OF);
        Future<StatementRunReport> second = service.runStatements(AS_OF);

        assertTrue(service.isRunning());
        assertTrue(second.failed());
        assertInstanceOf(IllegalStateException.class, second.cause());

        pending.complete(book());

        assertTrue(first.succeeded());
        assertFalse(service.isRunning());
    }

    @Test
    void runStatements_shouldRequireAsOfDate() {
        Future<StatementRunReport> future = service.runStatements(null);

        assertTrue(future.failed());
        assertInstanceOf(IllegalArgumentException.class, future.cause());
        verify(tradeBook, never()).snapshot();
    }

    private static TradeBook book() {
        return new TradeBook(
                List.of("TRADEIDENTIFIER", "TRADE DATE", "P&L", "SPREAD", "FUND ID"),
                List.of(
                        trade("ABC1234", 1200.0, "FUND-A"),
                        trade("DEF5678", 600.0, "FUND-B"),
                        trade("GHI9012", null, "FUND-A"),
                        trade("JKL3456", 300.0, null)
                ));
    }

    private static TradeRecord trade(String identifier, Double pnl, String fundId) {
        return TradeRecord.builder()
                .tradeIdentifier(identifier)
                .tradeDate(LocalDate.of(2024, 1, 1))
                .pnl(pnl)
                .spread(30.0)
                .fundId(fundId)
                .build();
    }

    private static StatementDocument template() {
        return new StatementDocument(List.of(
                List.of("TITLE", ""),
                List.of("As of", ""),
                List.of(""),
                List.of("Trade Ref", "Bid", "Offer")
        ));
    }
}
