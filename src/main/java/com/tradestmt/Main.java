package com.tradestmt;

import com.tradestmt.adapter.in.web.HttpServerVerticle;
import com.tradestmt.domain.model.StatementRunReport;
import com.tradestmt.infrastructure.config.ApplicationServices;
import com.tradestmt.infrastructure.config.StatementConfig;
import com.tradestmt.infrastructure.config.YamlConfigurationLoader;
import io.vertx.core.DeploymentOptions;
import io.vertx.core.ThreadingModel;
import io.vertx.core.Vertx;
import io.vertx.core.VertxOptions;
import io.vertx.core.json.JsonObject;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.LocalDate;
import java.time.format.DateTimeParseException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;

/**
 * Main application entry point
 *
 * <p>Without arguments the HTTP server is started. With {@code --as-of=YYYY-MM-DD} a single
 * statement run is executed and the process exits: 0 when every statement was written,
 * 2 when some funds failed, 1 when the run failed.
 */
public class Main {
    private static final Logger log = LoggerFactory.getLogger(Main.class);

    private static final String AS_OF_ARG = "--as-of=";

    public static void main(String[] args) {
        JsonObject config = new YamlConfigurationLoader().load();

        LocalDate asOfDate = parseAsOf(args);
        if (asOfDate != null) {
            System.exit(runOnce(config, asOfDate));
        }

        startServer(config);
    }

    private static void startServer(JsonObject config) {
        log.info("Starting Trade Statement Reconciliation...");

        Vertx vertx = Vertx.vertx(new VertxOptions().setWorkerPoolSize(1));

        // Worker model with a single instance: one request, and so one run, at a time
        vertx.deployVerticle(new HttpServerVerticle(), new DeploymentOptions()
                        .setConfig(config)
                        .setThreadingModel(ThreadingModel.WORKER)
                        .setInstances(1))
                .onSuccess(deploymentId -> {
                    log.info("HTTP Server Verticle deployed successfully: {}", deploymentId);

                    Runtime.getRuntime().addShutdownHook(new Thread(() -> {
                        log.info("Shutting down Trade Statement Reconciliation...");
                        vertx.close();
                    }));

                    log.info("Trade Statement Reconciliation is ready!");
                    log.info("Run endpoint: POST /api/statements");
                })
                .onFailure(error -> {
                    log.error("Failed to deploy HTTP Server Verticle", error);
                    vertx.close();
                });
    }

    static int runOnce(JsonObject config, LocalDate asOfDate) {
        ApplicationServices services = ApplicationServices.create(StatementConfig.fromJson(config));
        try {
            CompletableFuture<StatementRunReport> run = services.getStatementRunUseCase()
                    .runStatements(asOfDate)
                    .toCompletionStage()
                    .toCompletableFuture();
            StatementRunReport report = run.get();
            report.getWrittenDocuments().forEach(path -> log.info("Written: {}", path));
            report.getFailedFunds().forEach((fund, message) -> log.error("Not written: {} - {}", fund, message));
            return report.isPartial() ? 2 : 0;
        } catch (ExecutionException e) {
            log.error("Statement run failed: {}", e.getCause().getMessage());
            return 1;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.error("Statement run interrupted");
            return 1;
        }
    }

    static LocalDate parseAsOf(String[] args) {
        for (String arg : args) {
            if (arg.startsWith(AS_OF_ARG)) {
                String value = arg.substring(AS_OF_ARG.length());
                try {
                    return LocalDate.parse(value);
                } catch (DateTimeParseException e) {
                    throw new IllegalArgumentException("--as-of must be in ISO format (YYYY-MM-DD): " + value, e);
                }
            }
        }
        return null;
    }
}
