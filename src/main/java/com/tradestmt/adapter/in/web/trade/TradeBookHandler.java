package com.tradestmt.adapter.in.web.trade;

import com.tradestmt.adapter.in.web.ErrorResponses;
import com.tradestmt.application.port.in.TradeBookUseCase;
import com.tradestmt.application.service.TradeRecordMapper;
import com.tradestmt.domain.model.TradeBook;
import com.tradestmt.domain.model.TradeRecord;
import io.vertx.core.json.JsonArray;
import io.vertx.core.json.JsonObject;
import io.vertx.ext.web.RoutingContext;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * HTTP Controller for browsing and editing the trade book
 * Every edit is saved straight away.
 */
@Slf4j
@RequiredArgsConstructor
public class TradeBookHandler {

    private final TradeBookUseCase tradeBookUseCase;
    private final TradeRecordMapper mapper;

    public void list(RoutingContext context) {
        TradeBook book = tradeBookUseCase.current();
        JsonArray rows = new JsonArray();
        book.getRecords().forEach(record -> rows.add(toJson(record, book.getColumns())));

        sendJson(context, 200, new JsonObject()
                .put("columns", new JsonArray(book.getColumns()))
                .put("count", book.size())
                .put("trades", rows));
    }

    public void append(RoutingContext context) {
        Map<String, String> fields = fieldsOf(context);
        if (fields == null) {
            return;
        }

        tradeBookUseCase.append(fields)
                .compose(record -> tradeBookUseCase.save().map(record))
                .onSuccess(record -> sendJson(context, 201,
                        toJson(record, tradeBookUseCase.current().getColumns())))
                .onFailure(error -> {
                    log.error("Failed to append trade", error);
                    ErrorResponses.send(context, error);
                });
    }

    public void replace(RoutingContext context) {
        int index;
        try {
            index = Integer.parseInt(context.pathParam("index"));
        } catch (NumberFormatException e) {
            ErrorResponses.send(context, 400, "index must be a row number");
            return;
        }

        Map<String, String> fields = fieldsOf(context);
        if (fields == null) {
            return;
        }

        tradeBookUseCase.replace(index, fields)
                .compose(record -> tradeBookUseCase.save().map(record))
                .onSuccess(record -> sendJson(context, 200,
                        toJson(record, tradeBookUseCase.current().getColumns())))
                .onFailure(error -> {
                    log.error("Failed to replace trade at row {}", index, error);
                    ErrorResponses.send(context, error);
                });
    }

    public void reload(RoutingContext context) {
        tradeBookUseCase.load()
                .onSuccess(book -> sendJson(context, 200, new JsonObject()
                        .put("status", "LOADED")
                        .put("count", book.size())))
                .onFailure(error -> {
                    log.error("Failed to reload trade book", error);
                    ErrorResponses.send(context, error);
                });
    }

    /**
     * Column -> value body, or null after an error response has been sent
     */
    private Map<String, String> fieldsOf(RoutingContext context) {
        JsonObject body;
        try {
            body = context.body().asJsonObject();
        } catch (Exception e) {
            ErrorResponses.send(context, 400, "Invalid request format: " + e.getMessage());
            return null;
        }
        if (body == null || body.isEmpty()) {
            ErrorResponses.send(context, 400, "Request body is required");
            return null;
        }

        Map<String, String> fields = new LinkedHashMap<>();
        body.forEach(entry -> fields.put(entry.getKey(),
                entry.getValue() == null ? "" : String.valueOf(entry.getValue())));
        return fields;
    }

    private JsonObject toJson(TradeRecord record, List<String> columns) {
        String[] values = mapper.toRow(record, columns);
        JsonObject json = new JsonObject();
        for (int i = 0; i < columns.size(); i++) {
            json.put(columns.get(i), values[i]);
        }
        return json;
    }

    private static void sendJson(RoutingContext context, int statusCode, JsonObject body) {
        context.response()
                .setStatusCode(statusCode)
                .putHeader("Content-Type", "application/json")
                .end(body.encode());
    }
}
