package com.tradestmt.adapter.in.web;

import com.tradestmt.domain.exception.SchemaException;
import com.tradestmt.domain.exception.SourceNotFoundException;
import io.vertx.core.json.JsonObject;
import io.vertx.ext.web.RoutingContext;

/**
 * Maps failures to HTTP responses
 */
public final class ErrorResponses {

    private ErrorResponses() {
    }

    public static int statusFor(Throwable error) {
        if (error instanceof SourceNotFoundException) {
            return 404;
        }
        if (error instanceof SchemaException) {
            return 422;
        }
        if (error instanceof IllegalStateException) {
            return 409;
        }
        if (error instanceof IllegalArgumentException || error instanceof IndexOutOfBoundsException) {
            return 400;
        }
        return 500;
    }

    public static void send(RoutingContext context, Throwable error) {
        send(context, statusFor(error), error.getMessage());
    }

    public static void send(RoutingContext context, int statusCode, String message) {
        JsonObject response = new JsonObject()
                .put("status", "error")
                .put("message", message);

        context.response()
                .setStatusCode(statusCode)
                .putHeader("Content-Type", "application/json")
                .end(response.encode());
    }
}
