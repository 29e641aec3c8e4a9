package com.tradestmt.infrastructure.config;

import com.tradestmt.adapter.out.csv.CsvStatementTemplateAdapter;
import com.tradestmt.adapter.out.csv.CsvStatementWriterAdapter;
import com.tradestmt.adapter.out.csv.CsvTradeBookAdapter;
import com.tradestmt.adapter.out.csv.CsvValuationFeedAdapter;
import com.tradestmt.adapter.out.file.FileSystemValuationFeedLocator;
import com.tradestmt.application.port.in.StatementRunUseCase;
import com.tradestmt.application.port.in.TradeBookUseCase;
import com.tradestmt.application.port.out.StatementTemplateProvider;
import com.tradestmt.application.port.out.StatementWriter;
import com.tradestmt.application.port.out.TradeBookRepository;
import com.tradestmt.application.port.out.ValuationFeedLocator;
import com.tradestmt.application.port.out.ValuationFeedProvider;
import com.tradestmt.application.service.AmortizationEngine;
import com.tradestmt.application.service.SchemaValidator;
import com.tradestmt.application.service.StatementRenderer;
import com.tradestmt.application.service.StatementRunService;
import com.tradestmt.application.service.TradeBookService;
import com.tradestmt.application.service.TradeRecordMapper;
import com.tradestmt.application.service.ValuationMatcher;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

/**
 * Wires adapters and use cases for one {@link StatementConfig}
 */
@Slf4j
@Getter
public class ApplicationServices {

    private final StatementConfig config;
    private final TradeRecordMapper tradeRecordMapper;
    private final TradeBookUseCase tradeBookUseCase;
    private final StatementRunUseCase statementRunUseCase;

    private ApplicationServices(StatementConfig config) {
        this.config = config;

        // Output ports (adapters)
        tradeRecordMapper = new TradeRecordMapper(config.inputDateFormatters());
        TradeBookRepository tradeBookRepository = new CsvTradeBookAdapter(config.tradeBookPath(), tradeRecordMapper);
        ValuationFeedLocator feedLocator = new FileSystemValuationFeedLocator(
                config.getPrimaryPath(), config.getSecondaryPath(), config.getFeedFilePattern());
        ValuationFeedProvider feedProvider = new CsvValuationFeedAdapter();
        StatementTemplateProvider templateProvider = new CsvStatementTemplateAdapter(config.templatePath());
        StatementWriter statementWriter = new CsvStatementWriterAdapter(config.getOutputPath());

        // Application services (use cases)
        tradeBookUseCase = new TradeBookService(tradeBookRepository, tradeRecordMapper, config.getDefaultFieldValues());
        statementRunUseCase = new StatementRunService(
                tradeBookUseCase,
                feedLocator,
                feedProvider,
                templateProvider,
                new ValuationMatcher(new SchemaValidator()),
                new AmortizationEngine(),
                new StatementRenderer(config, statementWriter)
        );

        log.info("Services wired up: trade book {}, template {}, output {}",
                config.tradeBookPath(), config.templatePath(), config.getOutputPath());
    }

    public static ApplicationServices create(StatementConfig config) {
        return new ApplicationServices(config);
    }
}
