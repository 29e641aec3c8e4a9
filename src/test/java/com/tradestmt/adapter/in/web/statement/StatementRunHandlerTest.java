package com.tradestmt.adapter.in.web.statement;

import com.tradestmt.application.port.in.StatementRunUseCase;
import com.tradestmt.domain.exception.SourceNotFoundException;
import com.tradestmt.domain.model.StatementRunReport;
import io.vertx.core.Future;
import io.vertx.core.http.HttpServerResponse;
import io.vertx.core.json.JsonObject;
import io.vertx.ext.web.RequestBody;
import io.vertx.ext.web.RoutingContext;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.MockitoAnnotations;

import java.nio.file.Path;
import java.time.LocalDate;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class StatementRunHandlerTest {

    private static final LocalDate AS_OF = LocalDate.of(2024, 7, 1);

    @Mock
    private StatementRunUseCase useCase;

    @Mock
    private RoutingContext context;

    @Mock
    private RequestBody body;

    @Mock
    private HttpServerResponse response;

    private StatementRunHandler handler;
    private AutoCloseable mocks;

    @BeforeEach
    void setUp() {
        mocks = MockitoAnnotations.openMocks(this);
        handler = new StatementRunHandler(useCase);

        when(context.body()).thenReturn(body);
        when(context.response()).thenReturn(response);
        when(response.setStatusCode(anyInt())).thenReturn(response);
        when(response.putHeader(anyString(), anyString())).thenReturn(response);
        when(response.end(anyString())).thenReturn(Future.succeededFuture());
    }

    @AfterEach
    void tearDown() throws Exception {
        if (mocks != null) {
            mocks.close();
        }
    }

    @Test
    void handle_returnsReport() {
        when(body.asJsonObject()).thenReturn(new JsonObject().put("asOfDate", "2024-07-01"));
        when(useCase.runStatements(AS_OF)).thenReturn(Future.succeededFuture(report()));

        handler.handle(context);

        verify(response).setStatusCode(200);
        JsonObject json = sentBody();
        assertEquals("COMPLETED", json.getString("status"));
        assertEquals("2024-07-01", json.getString("asOfDate"));
        assertEquals(1, json.getJsonArray("writtenDocuments").size());
    }

    @Test
    void handle_rejectsMalformedDate() {
        when(body.asJsonObject()).thenReturn(new JsonObject().put("asOfDate", "01/07/2024"));

        handler.handle(context);

        verify(response).setStatusCode(400);
        verify(useCase, never()).runStatements(any());
    }

    @Test
    void handle_rejectsMissingDate() {
        when(body.asJsonObject()).thenReturn(new JsonObject());

        handler.handle(context);

        verify(response).setStatusCode(400);
        assertEquals("asOfDate is required", sentBody().getString("message"));
    }

    @Test
    void handle_mapsMissingSourceToNotFound() {
        when(body.asJsonObject()).thenReturn(new JsonObject().put("asOfDate", "2024-07-01"));
        when(useCase.runStatements(AS_OF)).thenReturn(Future.failedFuture(
                new SourceNotFoundException("Valuation feed", Path.of("valuation_20240701.csv"))));

        handler.handle(context);

        verify(response).setStatusCode(404);
        assertEquals("error", sentBody().getString("status"));
    }

    @Test
    void toJson_listsFailedFunds() {
        StatementRunReport report = report().toBuilder().failedFund("FUND-B", "disk full").build();

        JsonObject json = StatementRunHandler.toJson(report);

        assertEquals("PARTIAL", json.getString("status"));
        assertEquals("disk full", json.getJsonObject("failedFunds").getString("FUND-B"));
        assertEquals(4, json.getInteger("tradeCount"));
    }

    private JsonObject sentBody() {
        ArgumentCaptor<String> captor = ArgumentCaptor.forClass(String.class);
        verify(response).end(captor.capture());
        return new JsonObject(captor.getValue());
    }

    private static StatementRunReport report() {
        return StatementRunReport.builder()
                .asOfDate(AS_OF)
                .tradeCount(4)
                .matchedCount(3)
                .computedCount(3)
                .unassignedCount(1)
                .writtenDocument("data/statements/Statement_FUND-A_20240701.csv")
                .build();
    }
}
