package com.tradestmt.application.service;

import com.tradestmt.application.port.out.StatementWriter;
import com.tradestmt.domain.exception.MissingGroupingColumnException;
import com.tradestmt.domain.exception.RenderWriteException;
import com.tradestmt.domain.model.MergedRecord;
import com.tradestmt.domain.model.MergedTable;
import com.tradestmt.domain.model.RenderedStatement;
import com.tradestmt.domain.model.StatementDocument;
import com.tradestmt.domain.model.StatementGroup;
import com.tradestmt.domain.model.StatementRenderResult;
import com.tradestmt.domain.model.TradeField;
import com.tradestmt.infrastructure.config.StatementConfig;
import com.tradestmt.infrastructure.config.TemplateLayout;
import io.vertx.core.Future;
import lombok.extern.slf4j.Slf4j;

import java.time.LocalDate;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Writes one statement per fund from the template.
 *
 * <p>Funds are written one after the other. A fund whose document cannot be written is
 * recorded as failed and the remaining funds are still written; documents already written stay.
 */
@Slf4j
public class StatementRenderer {

    private static final DateTimeFormatter FILE_DATE = DateTimeFormatter.BASIC_ISO_DATE;

    private final StatementConfig config;
    private final StatementWriter writer;
    private final CellFormatter cellFormatter;

    public StatementRenderer(StatementConfig config, StatementWriter writer) {
        this.config = config;
        this.writer = writer;
        this.cellFormatter = new CellFormatter(config.statementDateFormatter());
    }

    /**
     * Partition, populate and write.
     * Fails with {@link MissingGroupingColumnException} before writing anything if the fund column is absent.
     */
    public Future<StatementRenderResult> render(MergedTable table, LocalDate asOfDate, StatementDocument template) {
        if (!table.hasColumn(TradeField.FUND_ID)) {
            return Future.failedFuture(new MissingGroupingColumnException(TradeField.FUND_ID.getColumn()));
        }

        Partition partition = partition(table, asOfDate);
        log.info("Rendering {} statements as of {}", partition.groups().size(), asOfDate);

        List<String> written = new ArrayList<>();
        Map<String, String> failed = new LinkedHashMap<>();
        Set<String> usedNames = new HashSet<>();

        Future<Void> chain = Future.succeededFuture();
        for (StatementGroup group : partition.groups()) {
            chain = chain.compose(v -> {
                RenderedStatement statement = populate(group, template, usedNames);
                return writeStatement(statement, written, failed);
            });
        }

        return chain.map(v -> {
            if (!failed.isEmpty()) {
                log.error("{} of {} statements could not be written: {}",
                        failed.size(), partition.groups().size(), failed.keySet());
            }
            return new StatementRenderResult(written, failed, partition.unassignedCount());
        });
    }

    /**
     * Group rows by fund id in first-seen order. Rows without a fund are counted, not grouped.
     */
    public Partition partition(MergedTable table, LocalDate asOfDate) {
        Map<String, List<MergedRecord>> byFund = new LinkedHashMap<>();
        int unassigned = 0;
        for (MergedRecord record : table.getRecords()) {
            if (!record.getTrade().hasFund()) {
                unassigned++;
                continue;
            }
            byFund.computeIfAbsent(record.getFundId().trim(), k -> new ArrayList<>()).add(record);
        }

        if (unassigned > 0) {
            log.warn("{} trades have no {} and are left out of every statement",
                    unassigned, TradeField.FUND_ID.getColumn());
        }

        List<StatementGroup> groups = new ArrayList<>();
        byFund.forEach((fundId, records) -> groups.add(new StatementGroup(fundId, asOfDate, List.copyOf(records))));
        return new Partition(List.copyOf(groups), unassigned);
    }

    /**
     * Fill a fresh copy of the template for one fund
     */
    public RenderedStatement populate(StatementGroup group, StatementDocument template, Set<String> usedNames) {
        TemplateLayout layout = config.getLayout();
        StatementDocument document = template.copy();
        List<String> headers = new ArrayList<>(document.getRow(layout.getHeaderRow()));

        document.setCell(layout.getTitleRow(), layout.getTitleColumn(), title(group.getFundId()));
        document.setCell(layout.getDateRow(), layout.getDateColumn(), cellFormatter.formatDate(group.getAsOfDate()));

        int rowIndex = layout.getAnchorRow();
        for (MergedRecord record : group.getRecords()) {
            document.insertRow(rowIndex++, toCells(record, headers));
        }

        String name = uniqueName(documentName(group.getFundId(), group.getAsOfDate()), usedNames);
        return new RenderedStatement(group.getFundId(), name, document, group.getRecords().size());
    }

    public String title(String fundId) {
        return config.getFeedLabel() + " - " + fundId + " " + config.getProductLabel();
    }

    public String documentName(String fundId, LocalDate asOfDate) {
        String safeFund = fundId.replaceAll("[^A-Za-z0-9._-]", "_");
        return config.getFilePrefix() + "_" + safeFund + "_" + asOfDate.format(FILE_DATE) + ".csv";
    }

    private List<String> toCells(MergedRecord record, List<String> headers) {
        List<String> cells = new ArrayList<>(headers.size());
        for (String header : headers) {
            if (header == null || header.isBlank()) {
                cells.add("");
                continue;
            }
            String field = config.fieldForHeader(header.trim());
            cells.add(cellFormatter.format(record.valueOf(field), config.formatFor(field)));
        }
        return cells;
    }

    private Future<Void> writeStatement(RenderedStatement statement, List<String> written, Map<String, String> failed) {
        return writer.write(statement.getDocumentName(), statement.getDocument())
                .onSuccess(path -> {
                    written.add(path.toString());
                    log.info("Wrote statement for fund {} ({} trades) to {}",
                            statement.getFundId(), statement.getRowCount(), path);
                })
                .<Void>mapEmpty()
                .recover(error -> {
                    RenderWriteException failure = error instanceof RenderWriteException
                            ? (RenderWriteException) error
                            : new RenderWriteException(statement.getFundId(),
                                    writer.resolve(statement.getDocumentName()), error);
                    log.error(failure.getMessage(), failure);
                    failed.put(statement.getFundId(), failure.getMessage());
                    return Future.succeededFuture();
                });
    }

    private static String uniqueName(String name, Set<String> usedNames) {
        String candidate = name;
        int suffix = 2;
        while (!usedNames.add(candidate)) {
            candidate = name.replaceFirst("\\.csv$", "") + "_" + suffix++ + ".csv";
        }
        return candidate;
    }

    /**
     * Fund groups of one run plus the number of rows that belong to none
     */
    public record Partition(List<StatementGroup> groups, int unassignedCount) {}
}
