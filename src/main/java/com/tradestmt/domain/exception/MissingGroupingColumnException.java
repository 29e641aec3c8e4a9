package com.tradestmt.domain.exception;

/**
 * The merged table has no fund column, so no statement can be produced
 */
public class MissingGroupingColumnException extends SchemaException {

    public MissingGroupingColumnException(String column) {
        super("merged table", column, "Cannot group statements: column '" + column + "' is missing");
    }
}
