package com.tradestmt.adapter.out.csv;

import com.tradestmt.application.port.out.StatementTemplateProvider;
import com.tradestmt.domain.exception.SourceNotFoundException;
import com.tradestmt.domain.model.StatementDocument;
import io.vertx.core.Future;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Loads the statement template grid from CSV
 */
@Slf4j
@RequiredArgsConstructor
public class CsvStatementTemplateAdapter implements StatementTemplateProvider {

    private final Path templateFile;

    @Override
    public Future<StatementDocument> loadTemplate() {
        if (!Files.isRegularFile(templateFile)) {
            return Future.failedFuture(new SourceNotFoundException("Statement template", templateFile));
        }
        try {
            List<List<String>> rows = CsvFiles.readAll(templateFile).stream()
                    .map(Arrays::asList)
                    .collect(Collectors.toList());
            log.debug("Loaded template {} ({} rows)", templateFile, rows.size());
            return Future.succeededFuture(new StatementDocument(rows));
        } catch (IOException e) {
            log.error("Failed to read template {}: {}", templateFile, e.getMessage());
            return Future.failedFuture(new SourceNotFoundException("Statement template", templateFile, e));
        }
    }
}
