package com.doseobjectives.converter.strategy;

import com.doseobjectives.converter.model.ConstraintSheet;

import java.io.IOException;
import java.nio.file.Path;

/**
 * Reads the constraint table of one input file into named-column rows.
 * Each implementation wraps one reading library; the conversion pipeline never touches the
 * file format itself.
 */
public interface RowSource {

    /**
     * Reads a sheet.
     *
     * @param input the file to read
     * @param sheetName the worksheet to read; formats with a single table may ignore it
     * @return the header names and non-blank data rows, in sheet order
     * @throws IOException if the file cannot be read
     * @throws com.doseobjectives.converter.exception.MissingSheetException if the sheet does not exist
     * @throws com.doseobjectives.converter.exception.ConversionException if the file is not a readable workbook
     */
    ConstraintSheet read(Path input, String sheetName) throws IOException;
}
