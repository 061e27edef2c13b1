package com.doseobjectives.converter.strategy;

import com.doseobjectives.converter.core.SheetRowCollector;
import com.doseobjectives.converter.model.ConstraintSheet;
import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVParser;
import org.apache.commons.csv.CSVRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.HashMap;
import java.util.Map;

/**
 * Reads a CSV export of the constraint worksheet with Commons CSV. The first record is the
 * header; row numbers count records, so the first data record is row 2 as in the workbook.
 * The sheet name is not meaningful for CSV and is only used in messages.
 */
public class CsvRowSource implements RowSource {

    private static final Logger logger = LoggerFactory.getLogger(CsvRowSource.class);

    public static final char DEFAULT_DELIMITER = ',';

    private final CSVFormat format;

    public CsvRowSource() {
        this(DEFAULT_DELIMITER);
    }

    public CsvRowSource(char delimiter) {
        this.format = CSVFormat.DEFAULT.builder()
                .setDelimiter(delimiter)
                .setIgnoreEmptyLines(true)
                .build();
    }

    @Override
    public ConstraintSheet read(Path input, String sheetName) throws IOException {
        logger.info("Reading {} as CSV (delimiter '{}').", input, format.getDelimiterString());
        SheetRowCollector collector = new SheetRowCollector(input.getFileName().toString());
        try (Reader reader = Files.newBufferedReader(input, StandardCharsets.UTF_8);
             CSVParser parser = format.parse(reader)) {
            for (CSVRecord record : parser) {
                Map<Integer, String> cells = new HashMap<>();
                for (int i = 0; i < record.size(); i++) {
                    cells.put(i, record.get(i));
                }
                int rowNumber = (int) record.getRecordNumber();
                if (!collector.isHeaderSeen()) {
                    collector.onHeader(cells);
                } else {
                    collector.onRow(rowNumber, cells);
                }
            }
        }
        return collector.toSheet();
    }
}
