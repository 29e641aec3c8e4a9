package com.tradestmt.application.port.out;

import com.tradestmt.domain.model.StatementDocument;
import io.vertx.core.Future;

import java.nio.file.Path;

/**
 * Output port persisting one rendered statement
 */
public interface StatementWriter {

    /**
     * Where a document of this name ends up
     */
    Path resolve(String documentName);

    /**
     * @return Future with the written file
     */
    Future<Path> write(String documentName, StatementDocument document);
}
