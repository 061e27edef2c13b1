package com.doseobjectives.converter.exception;

/**
 * Thrown when the Priority cell is blank or not an integer.
 */
public class InvalidPriorityException extends RowValidationException {

    private static final long serialVersionUID = 1L;

    public InvalidPriorityException(int rowNumber, String column, String rawValue, String message) {
        super(rowNumber, column, rawValue, message);
    }

    @Override
    public String getKind() {
        return "INVALID_PRIORITY";
    }
}
