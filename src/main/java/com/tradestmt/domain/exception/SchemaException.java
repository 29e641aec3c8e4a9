package com.tradestmt.domain.exception;

/**
 * A required column is absent from an input table. Fatal to the run.
 */
public class SchemaException extends StatementException {

    private final String source;
    private final String column;

    public SchemaException(String source, String column) {
        this(source, column, "Required column '" + column + "' is missing from " + source);
    }

    protected SchemaException(String source, String column, String message) {
        super(message);
        this.source = source;
        this.column = column;
    }

    public String getSource() {
        return source;
    }

    public String getColumn() {
        return column;
    }
}
