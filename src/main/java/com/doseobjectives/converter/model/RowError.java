package com.doseobjectives.converter.model;

import com.doseobjectives.converter.exception.RowValidationException;

/**
 * A collected row-level failure, kept for the end-of-run report.
 */
public final class RowError {

    private final int rowNumber;
    private final String column;
    private final String rawValue;
    private final String kind;
    private final String message;

    public RowError(int rowNumber, String column, String rawValue, String kind, String message) {
        this.rowNumber = rowNumber;
        this.column = column;
        this.rawValue = rawValue;
        this.kind = kind;
        this.message = message;
    }

    public static RowError from(RowValidationException e) {
        return new RowError(e.getRowNumber(), e.getColumn(), e.getRawValue(), e.getKind(), e.getMessage());
    }

    public int getRowNumber() {
        return rowNumber;
    }

    public String getColumn() {
        return column;
    }

    public String getRawValue() {
        return rawValue;
    }

    public String getKind() {
        return kind;
    }

    public String getMessage() {
        return message;
    }

    @Override
    public String toString() {
        return kind + ": " + message;
    }
}
