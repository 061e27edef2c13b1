package com.doseobjectives.converter.exception;

/**
 * Thrown when the requested worksheet does not exist in a workbook or has no header row.
 * Fatal for the file being converted.
 */
public class MissingSheetException extends ConversionException {

    private final String sheetName;

    public MissingSheetException(String sheetName, String detail) {
        super("Worksheet '" + sheetName + "' " + detail);
        this.sheetName = sheetName;
    }

    public String getSheetName() {
        return sheetName;
    }
}
