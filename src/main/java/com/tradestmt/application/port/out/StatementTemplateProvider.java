package com.tradestmt.application.port.out;

import com.tradestmt.domain.model.StatementDocument;
import io.vertx.core.Future;

/**
 * Output port for the statement template
 */
public interface StatementTemplateProvider {

    Future<StatementDocument> loadTemplate();
}
