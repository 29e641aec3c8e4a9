package com.tradestmt.adapter.out.file;

import com.tradestmt.application.port.out.ValuationFeedLocator;
import com.tradestmt.domain.exception.SourceNotFoundException;
import io.vertx.core.Future;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.time.LocalDate;
import java.time.format.DateTimeFormatter;

/**
 * Finds the day's valuation feed in the primary folder, copying it over from the secondary folder when needed
 */
@Slf4j
public class FileSystemValuationFeedLocator implements ValuationFeedLocator {

    private final Path primaryPath;
    private final Path secondaryPath;
    private final DateTimeFormatter fileNameFormat;

    public FileSystemValuationFeedLocator(Path primaryPath, Path secondaryPath, String fileNamePattern) {
        this.primaryPath = primaryPath;
        this.secondaryPath = secondaryPath;
        this.fileNameFormat = DateTimeFormatter.ofPattern(fileNamePattern);
    }

    @Override
    public Future<Path> locate(LocalDate asOfDate) {
        String fileName = asOfDate.format(fileNameFormat);
        Path primary = primaryPath.resolve(fileName);
        if (Files.isRegularFile(primary)) {
            log.info("Using valuation feed {}", primary);
            return Future.succeededFuture(primary);
        }

        Path secondary = secondaryPath.resolve(fileName);
        if (!Files.isRegularFile(secondary)) {
            log.error("Valuation feed {} found in neither {} nor {}", fileName, primaryPath, secondaryPath);
            return Future.failedFuture(new SourceNotFoundException("Valuation feed", primary));
        }

        try {
            Files.createDirectories(primaryPath);
            Files.copy(secondary, primary, StandardCopyOption.REPLACE_EXISTING);
            log.info("Copied valuation feed from {} to {}", secondary, primary);
            return Future.succeededFuture(primary);
        } catch (IOException e) {
            log.warn("Could not copy {} to {} ({}); reading it in place", secondary, primaryPath, e.getMessage());
            return Future.succeededFuture(secondary);
        }
    }
}
