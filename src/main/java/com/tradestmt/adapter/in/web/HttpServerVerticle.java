package com.tradestmt.adapter.in.web;

import com.tradestmt.adapter.in.web.statement.StatementRunHandler;
import com.tradestmt.adapter.in.web.trade.TradeBookHandler;
import com.tradestmt.infrastructure.config.ApplicationServices;
import com.tradestmt.infrastructure.config.StatementConfig;
import io.vertx.core.AbstractVerticle;
import io.vertx.core.Future;
import io.vertx.core.Promise;
import io.vertx.core.json.JsonObject;
import io.vertx.ext.web.Router;
import io.vertx.ext.web.handler.LoggerHandler;
import lombok.extern.slf4j.Slf4j;

/**
 * HTTP Server Verticle - handles all HTTP requests
 * Infrastructure component that wires up the hexagonal architecture
 */
@Slf4j
public class HttpServerVerticle extends AbstractVerticle {

    private StatementConfig statementConfig;
    private ApplicationServices services;

    @Override
    public void start(Promise<Void> startPromise) {
        log.info("Starting HTTP Server Verticle...");

        initializeServices()
                .compose(v -> {
                    log.info("All services initialized successfully");
                    return startHttpServer();
                })
                .onSuccess(v -> {
                    log.info("HTTP Server Verticle started successfully on port {}", statementConfig.getHttpPort());
                    startPromise.complete();
                })
                .onFailure(error -> {
                    log.error("Failed to start HTTP Server Verticle", error);
                    startPromise.fail(error);
                });
    }

    @Override
    public void stop() {
        log.info("HTTP Server Verticle stopped");
    }

    private Future<Void> initializeServices() {
        try {
            statementConfig = StatementConfig.fromJson(config());
            services = ApplicationServices.create(statementConfig);
        } catch (Exception e) {
            log.error("Error wiring services", e);
            return Future.failedFuture(e);
        }

        // The trade book has to be readable before the app can serve anything
        log.info("Loading trade book (critical for startup)...");
        return services.getTradeBookUseCase().load()
                .onSuccess(book -> log.info("Trade book loaded: {} trades", book.size()))
                .onFailure(error -> log.error("CRITICAL: Failed to load trade book - app cannot start", error))
                .mapEmpty();
    }

    private Future<Void> startHttpServer() {
        Router router = Router.router(vertx);

        // Global handlers
        router.route().handler(LoggerHandler.create());

        WebRouter webRouter = new WebRouter(
                router,
                new StatementRunHandler(services.getStatementRunUseCase()),
                new TradeBookHandler(services.getTradeBookUseCase(), services.getTradeRecordMapper())
        );
        webRouter.setupRoutes();

        // Default route - 404
        router.route().handler(ctx -> {
            ctx.response()
                    .setStatusCode(404)
                    .putHeader("Content-Type", "application/json")
                    .end(new JsonObject()
                            .put("status", "error")
                            .put("message", "Endpoint not found")
                            .encode()
                    );
        });

        int port = statementConfig.getHttpPort();

        return vertx.createHttpServer()
                .requestHandler(router)
                .listen(port)
                .onSuccess(server -> log.info("HTTP server listening on port {}", port))
                .mapEmpty();
    }
}
