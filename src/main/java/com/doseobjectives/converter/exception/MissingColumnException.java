package com.doseobjectives.converter.exception;

import java.util.List;

/**
 * Thrown when the header row of a constraint sheet lacks one or more required columns.
 * Fatal for the file being converted.
 */
public class MissingColumnException extends ConversionException {

    private final List<String> missingColumns;

    /**
     * @param sheetName the sheet whose header was inspected
     * @param missingColumns the required column names that were not found, in declaration order
     * @pre missingColumns is not empty
     */
    public MissingColumnException(String sheetName, List<String> missingColumns) {
        super("Sheet '" + sheetName + "' is missing required column(s): " + missingColumns);
        this.missingColumns = List.copyOf(missingColumns);
    }

    public List<String> getMissingColumns() {
        return missingColumns;
    }
}
