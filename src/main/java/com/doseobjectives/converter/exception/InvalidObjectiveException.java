package com.doseobjectives.converter.exception;

/**
 * Thrown when the DVH Objective cell is blank or names a metric the importer does not support.
 */
public class InvalidObjectiveException extends RowValidationException {

    private static final long serialVersionUID = 1L;

    public InvalidObjectiveException(int rowNumber, String column, String rawValue, String message) {
        super(rowNumber, column, rawValue, message);
    }

    @Override
    public String getKind() {
        return "INVALID_OBJECTIVE";
    }
}
