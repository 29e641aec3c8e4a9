package com.tradestmt.domain.exception;

import java.nio.file.Path;

/**
 * Writing one fund's statement failed. Other funds are still written.
 */
public class RenderWriteException extends StatementException {

    private final String fundId;
    private final Path path;

    public RenderWriteException(String fundId, Path path, Throwable cause) {
        super("Failed to write statement for fund " + fundId + " to " + path + ": " + cause.getMessage(), cause);
        this.fundId = fundId;
        this.path = path;
    }

    public String getFundId() {
        return fundId;
    }

    public Path getPath() {
        return path;
    }
}
