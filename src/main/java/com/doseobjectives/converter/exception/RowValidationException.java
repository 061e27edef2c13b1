package com.doseobjectives.converter.exception;

/**
 * Base class for row-level validation failures.
 * <p>
 * A row-level failure never aborts a conversion: the row is reported with its spreadsheet
 * row number, the offending column and the raw cell value, and the remaining rows are
 * processed normally.
 *
 * @invariant rowNumber is the 1-based spreadsheet row (the header being row 1).
 * @invariant column and rawValue are never null; rawValue is "" for blank cells.
 */
public abstract class RowValidationException extends Exception {

    private static final long serialVersionUID = 1L;

    private final int rowNumber;
    private final String column;
    private final String rawValue;

    /**
     * @param rowNumber 1-based spreadsheet row number
     * @param column the column whose value failed validation
     * @param rawValue the raw cell text, "" when blank
     * @param message a human-readable description of the problem
     */
    protected RowValidationException(int rowNumber, String column, String rawValue, String message) {
        super("Row " + rowNumber + ", column '" + column + "' (value '" + rawValue + "'): " + message);
        this.rowNumber = rowNumber;
        this.column = column;
        this.rawValue = rawValue == null ? "" : rawValue;
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

    /**
     * Short, stable name of the failure kind, used in reports.
     *
     * @return the error kind
     */
    public abstract String getKind();
}
