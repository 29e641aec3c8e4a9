package com.tradestmt.adapter.in.web;

import com.tradestmt.adapter.in.web.statement.StatementRunHandler;
import com.tradestmt.adapter.in.web.trade.TradeBookHandler;
import io.vertx.ext.web.Router;
import io.vertx.ext.web.handler.BodyHandler;
import lombok.RequiredArgsConstructor;

/**
 * Router configuration for statement and trade book endpoints
 */
@RequiredArgsConstructor
public class WebRouter {

    private final Router router;
    private final StatementRunHandler statementRunHandler;
    private final TradeBookHandler tradeBookHandler;

    public void setupRoutes() {
        router.route("/api/*").handler(BodyHandler.create());

        // Statement run
        router.post("/api/statements").handler(statementRunHandler);

        // Trade book
        router.get("/api/trades").handler(tradeBookHandler::list);
        router.post("/api/trades").handler(tradeBookHandler::append);
        router.post("/api/trades/reload").handler(tradeBookHandler::reload);
        router.put("/api/trades/:index").handler(tradeBookHandler::replace);

        // Health check endpoint
        router.get("/health")
                .handler(ctx -> {
                    ctx.response()
                            .putHeader("Content-Type", "application/json")
                            .end("{\"status\":\"UP\",\"service\":\"trade-statement-reconciliation\"}");
                });

        // Root endpoint
        router.get("/")
                .handler(ctx -> {
                    ctx.response()
                            .putHeader("Content-Type", "application/json")
                            .end("{\"name\":\"Trade Statement Reconciliation\",\"version\":\"1.0.0\"}");
                });
    }
}
