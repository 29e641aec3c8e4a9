package com.tradestmt.adapter.in.web.statement;

import com.tradestmt.adapter.in.web.ErrorResponses;
import com.tradestmt.application.port.in.StatementRunUseCase;
import com.tradestmt.domain.model.StatementRunReport;
import io.vertx.core.Handler;
import io.vertx.core.json.JsonArray;
import io.vertx.core.json.JsonObject;
import io.vertx.ext.web.RoutingContext;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.LocalDate;
import java.time.format.DateTimeParseException;

/**
 * HTTP Controller for statement runs
 * Presentation layer - Primary adapter
 */
public class StatementRunHandler implements Handler<RoutingContext> {
    private static final Logger log = LoggerFactory.getLogger(StatementRunHandler.class);

    private final StatementRunUseCase statementRunUseCase;

    public StatementRunHandler(StatementRunUseCase statementRunUseCase) {
        this.statementRunUseCase = statementRunUseCase;
    }

    @Override
    public void handle(RoutingContext context) {
        JsonObject requestBody = context.body().asJsonObject();

        if (requestBody == null) {
            ErrorResponses.send(context, 400, "Request body is required");
            return;
        }

        LocalDate asOfDate;
        try {
            StatementRunRequest request = requestBody.mapTo(StatementRunRequest.class);
            if (request.getAsOfDate() == null) {
                ErrorResponses.send(context, 400, "asOfDate is required");
                return;
            }
            asOfDate = LocalDate.parse(request.getAsOfDate());
        } catch (DateTimeParseException e) {
            ErrorResponses.send(context, 400, "asOfDate must be in ISO format (YYYY-MM-DD)");
            return;
        } catch (Exception e) {
            log.error("Error parsing request", e);
            ErrorResponses.send(context, 400, "Invalid request format: " + e.getMessage());
            return;
        }

        statementRunUseCase.runStatements(asOfDate)
                .onSuccess(report -> context.response()
                        .setStatusCode(200)
                        .putHeader("Content-Type", "application/json")
                        .end(toJson(report).encode()))
                .onFailure(error -> {
                    log.error("Statement run failed", error);
                    ErrorResponses.send(context, error);
                });
    }

    static JsonObject toJson(StatementRunReport report) {
        JsonObject failed = new JsonObject();
        report.getFailedFunds().forEach(failed::put);

        return new JsonObject()
                .put("status", report.getStatus())
                .put("asOfDate", report.getAsOfDate().toString())
                .put("tradeCount", report.getTradeCount())
                .put("matchedCount", report.getMatchedCount())
                .put("computedCount", report.getComputedCount())
                .put("unassignedCount", report.getUnassignedCount())
                .put("writtenDocuments", new JsonArray(report.getWrittenDocuments()))
                .put("failedFunds", failed);
    }
}
