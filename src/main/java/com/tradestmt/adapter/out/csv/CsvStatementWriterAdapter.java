package com.tradestmt.adapter.out.csv;

import com.tradestmt.application.port.out.StatementWriter;
import com.tradestmt.domain.model.StatementDocument;
import io.vertx.core.Future;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.file.Path;
import java.util.Arrays;

/**
 * Writes rendered statements as CSV files into the output folder
 */
@Slf4j
@RequiredArgsConstructor
public class CsvStatementWriterAdapter implements StatementWriter {

    private final Path outputDirectory;

    @Override
    public Path resolve(String documentName) {
        return outputDirectory.resolve(documentName);
    }

    @Override
    public Future<Path> write(String documentName, StatementDocument document) {
        Path target = resolve(documentName);
        try {
            CsvFiles.writeAll(target, Arrays.asList(document.toArray()));
            log.debug("Wrote {} rows to {}", document.getRowCount(), target);
            return Future.succeededFuture(target);
        } catch (IOException e) {
            return Future.failedFuture(e);
        }
    }
}
