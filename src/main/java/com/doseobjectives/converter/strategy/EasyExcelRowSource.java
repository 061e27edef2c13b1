package com.doseobjectives.converter.strategy;

import com.alibaba.excel.EasyExcel;
import com.alibaba.excel.ExcelReader;
import com.alibaba.excel.exception.ExcelRuntimeException;
import com.alibaba.excel.read.metadata.ReadSheet;
import com.doseobjectives.converter.core.ConstraintRowListener;
import com.doseobjectives.converter.core.SheetRowCollector;
import com.doseobjectives.converter.exception.ConversionException;
import com.doseobjectives.converter.exception.MissingSheetException;
import com.doseobjectives.converter.model.ConstraintSheet;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Reads a worksheet with EasyExcel's streaming reader. The first row is the header row.
 * <p>
 * The sheet is looked up by name ignoring case, the same way {@link PoiEventRowSource} does,
 * so both readers accept the same workbooks.
 *
 * @invariant row order of the input sheet is preserved.
 */
public class EasyExcelRowSource implements RowSource {

    private static final Logger logger = LoggerFactory.getLogger(EasyExcelRowSource.class);

    @Override
    public ConstraintSheet read(Path input, String sheetName) throws IOException {
        logger.info("Reading sheet '{}' of {} with EasyExcel.", sheetName, input);

        try (InputStream inputStream = Files.newInputStream(input)) {
            ExcelReader excelReader = null;
            try {
                excelReader = EasyExcel.read(inputStream)
                        .autoCloseStream(false)
                        .build();
                ReadSheet match = findSheet(excelReader.excelExecutor().sheetList(), sheetName);

                SheetRowCollector collector = new SheetRowCollector(match.getSheetName());
                ConstraintRowListener listener = new ConstraintRowListener(collector);
                ReadSheet readSheet = EasyExcel.readSheet(match.getSheetNo(), match.getSheetName())
                        .registerReadListener(listener)
                        .headRowNumber(1)
                        .build();
                excelReader.read(readSheet);
                logger.debug("EasyExcel delivered {} data rows from {}.", listener.getRowsReceived(), input);
                return collector.toSheet();
            } catch (ExcelRuntimeException e) {
                throw ConversionException.unreadable(input, sheetName, e);
            } finally {
                if (excelReader != null) {
                    excelReader.finish();
                }
            }
        }
    }

    static ReadSheet findSheet(List<ReadSheet> sheets, String sheetName) {
        List<String> availableSheetNames = new ArrayList<>();
        for (ReadSheet sheet : sheets) {
            availableSheetNames.add(sheet.getSheetName());
            if (sheet.getSheetName() != null && sheet.getSheetName().equalsIgnoreCase(sheetName)) {
                logger.debug("Processing sheet '{}' (index {}).", sheet.getSheetName(), sheet.getSheetNo());
                return sheet;
            }
        }
        throw new MissingSheetException(sheetName, "was not found. Available sheets: " + availableSheetNames);
    }
}
