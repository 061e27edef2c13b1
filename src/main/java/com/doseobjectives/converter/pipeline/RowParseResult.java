package com.doseobjectives.converter.pipeline;

import com.doseobjectives.converter.exception.RowValidationException;
import com.doseobjectives.converter.model.ParsedRow;

import java.util.Objects;

/**
 * Tagged outcome of parsing one row: parsed, skipped (spacer row without structure) or failed.
 *
 * @invariant exactly one of parsedRow / error is set for PARSED / FAILED; neither for SKIPPED.
 */
public final class RowParseResult {

    public enum Status {
        PARSED, SKIPPED, FAILED
    }

    private final Status status;
    private final int rowNumber;
    private final ParsedRow parsedRow;
    private final RowValidationException error;

    private RowParseResult(Status status, int rowNumber, ParsedRow parsedRow, RowValidationException error) {
        this.status = status;
        this.rowNumber = rowNumber;
        this.parsedRow = parsedRow;
        this.error = error;
    }

    public static RowParseResult parsed(ParsedRow row) {
        return new RowParseResult(Status.PARSED, row.getRowNumber(), row, null);
    }

    public static RowParseResult skipped(int rowNumber) {
        return new RowParseResult(Status.SKIPPED, rowNumber, null, null);
    }

    public static RowParseResult failed(RowValidationException error) {
        return new RowParseResult(Status.FAILED, error.getRowNumber(), null, Objects.requireNonNull(error));
    }

    public Status getStatus() {
        return status;
    }

    public int getRowNumber() {
        return rowNumber;
    }

    /**
     * @throws IllegalStateException if the row was not parsed
     */
    public ParsedRow getParsedRow() {
        if (status != Status.PARSED) {
            throw new IllegalStateException("Row " + rowNumber + " was not parsed: " + status);
        }
        return parsedRow;
    }

    /**
     * @throws IllegalStateException if the row did not fail
     */
    public RowValidationException getError() {
        if (status != Status.FAILED) {
            throw new IllegalStateException("Row " + rowNumber + " did not fail: " + status);
        }
        return error;
    }
}
