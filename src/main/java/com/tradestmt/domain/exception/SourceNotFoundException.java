package com.tradestmt.domain.exception;

import java.nio.file.Path;

/**
 * Trade book, valuation feed or template could not be found. Raised before any computation.
 */
public class SourceNotFoundException extends StatementException {

    private final Path path;

    public SourceNotFoundException(String what, Path path) {
        super(what + " not found: " + path);
        this.path = path;
    }

    public SourceNotFoundException(String what, Path path, Throwable cause) {
        super(what + " could not be read: " + path, cause);
        this.path = path;
    }

    public Path getPath() {
        return path;
    }
}
