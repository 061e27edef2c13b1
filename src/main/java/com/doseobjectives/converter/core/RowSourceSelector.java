package com.doseobjectives.converter.core;

import com.doseobjectives.converter.config.ConverterConfig;
import com.doseobjectives.converter.strategy.CsvRowSource;
import com.doseobjectives.converter.strategy.EasyExcelRowSource;
import com.doseobjectives.converter.strategy.PoiEventRowSource;
import com.doseobjectives.converter.strategy.RowSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.File;
import java.nio.file.Path;
import java.util.Locale;

/**
 * Selects the {@link RowSource} for an input file from the {@code --reader} hint, or from the
 * file's extension and size when the hint is {@code AUTO}.
 */
public class RowSourceSelector {

    private static final Logger logger = LoggerFactory.getLogger(RowSourceSelector.class);

    // Workbooks larger than this are read with the POI event model.
    static final long LARGE_FILE_THRESHOLD_BYTES = 50L * 1024L * 1024L;

    private final ConverterConfig.Reader hint;
    private final char csvDelimiter;

    public RowSourceSelector(ConverterConfig.Reader hint, char csvDelimiter) {
        this.hint = hint == null ? ConverterConfig.Reader.AUTO : hint;
        this.csvDelimiter = csvDelimiter;
    }

    /**
     * @param input the file about to be read
     * @return a non-null row source
     */
    public RowSource select(Path input) {
        switch (hint) {
            case POI_EVENT:
                logger.debug("Reader hint: POI event model.");
                return new PoiEventRowSource();
            case EASY_EXCEL:
                logger.debug("Reader hint: EasyExcel.");
                return new EasyExcelRowSource();
            case CSV:
                logger.debug("Reader hint: CSV.");
                return new CsvRowSource(csvDelimiter);
            case AUTO:
            default:
                return selectDefault(input);
        }
    }

    private RowSource selectDefault(Path input) {
        String fileName = input.getFileName().toString().toLowerCase(Locale.ROOT);
        if (fileName.endsWith(".csv")) {
            logger.debug("{} is a CSV file. Selecting CsvRowSource.", input);
            return new CsvRowSource(csvDelimiter);
        }
        File file = input.toFile();
        long fileSize = file.length();
        if (fileSize > LARGE_FILE_THRESHOLD_BYTES) {
            logger.info("File size ({} MB) exceeds threshold ({} MB). Selecting PoiEventRowSource.",
                    fileSize / (1024L * 1024L), LARGE_FILE_THRESHOLD_BYTES / (1024L * 1024L));
            return new PoiEventRowSource();
        }
        logger.debug("File size ({} KB) is within threshold. Selecting EasyExcelRowSource.", fileSize / 1024L);
        return new EasyExcelRowSource();
    }
}
