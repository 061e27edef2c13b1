package com.doseobjectives.converter.exception;

import java.nio.file.Path;
import java.util.Optional;

/**
 * Exception thrown when a spreadsheet cannot be converted at all.
 * <p>
 * This exception marks file-level failures: a worksheet that cannot be found, a required
 * column that is missing, or a workbook that cannot be opened. Such a failure aborts the
 * current file only; a batch run records it and moves on to the next file.
 */
public class ConversionException extends RuntimeException {

    private final Path source;

    public ConversionException(String message) {
        this(message, null, null);
    }

    public ConversionException(String message, Throwable cause) {
        this(message, null, cause);
    }

    protected ConversionException(String message, Path source, Throwable cause) {
        super(message, cause);
        this.source = source;
    }

    /**
     * Wraps a parser failure raised while a row source reads one worksheet.
     *
     * @param source the workbook being read
     * @param sheetName the requested worksheet
     * @param cause the reader's own exception
     * @return an exception naming the workbook and the worksheet
     */
    public static ConversionException unreadable(Path source, String sheetName, Exception cause) {
        return new ConversionException(
                "Failed to read sheet '" + sheetName + "' of " + source + ": " + cause.getMessage(), source, cause);
    }

    /**
     * Wraps a failure to open a workbook container at all.
     *
     * @param source the workbook being opened
     * @param cause the reader's own exception
     * @return an exception naming the workbook
     */
    public static ConversionException unopenable(Path source, Exception cause) {
        return new ConversionException("Failed to open Excel file " + source + ": " + cause.getMessage(), source, cause);
    }

    /**
     * @return the workbook the failure belongs to, when the reader knew it
     */
    public Optional<Path> getSource() {
        return Optional.ofNullable(source);
    }
}
