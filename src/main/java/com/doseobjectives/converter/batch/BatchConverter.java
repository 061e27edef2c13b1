package com.doseobjectives.converter.batch;

import com.doseobjectives.converter.config.ConverterConfig;
import com.doseobjectives.converter.core.FileConverter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Converts every spreadsheet the locator finds, each into {@code name.xml} beside its source.
 * No preview id override is applied in batch mode. A failing file is recorded and the batch
 * continues with the next one.
 * <p>
 * Sources that share a stem ({@code plan.xlsx} and {@code plan.csv}) would share an output.
 * The first one in locator order is converted; the others fail without touching its output.
 * Targets are compared ignoring case.
 */
public class BatchConverter {

    private static final Logger logger = LoggerFactory.getLogger(BatchConverter.class);

    private final TemplateLocator locator;
    private final FileConverter fileConverter;

    public BatchConverter(TemplateLocator locator, FileConverter fileConverter) {
        this.locator = locator;
        this.fileConverter = fileConverter;
    }

    /**
     * @param directory the templates directory
     * @return one outcome per located file, in locator order
     * @throws IOException if the directory itself cannot be listed
     */
    public BatchSummary convertAll(Path directory) throws IOException {
        List<Path> files = locator.locate(directory);
        if (files.isEmpty()) {
            logger.warn("No .xlsx or .csv files found in {}.", directory);
        }
        List<FileOutcome> outcomes = new ArrayList<>();
        Map<String, Path> claimedOutputs = new HashMap<>();
        for (Path file : files) {
            Path output = ConverterConfig.xmlSibling(file);
            Path claimedBy = claimedOutputs.putIfAbsent(outputKey(output), file);
            if (claimedBy != null) {
                String message = "Output " + output + " is already written from " + claimedBy.getFileName()
                        + " in this batch; rename one of the sources.";
                logger.error("Skipping {}: {}", file, message);
                outcomes.add(FileOutcome.failed(file, message));
                continue;
            }
            outcomes.add(fileConverter.convert(file, output, null));
        }
        BatchSummary summary = new BatchSummary(outcomes);
        logSummary(summary);
        return summary;
    }

    private static String outputKey(Path output) {
        return output.toAbsolutePath().normalize().toString().toLowerCase(Locale.ROOT);
    }

    static void logSummary(BatchSummary summary) {
        for (FileOutcome outcome : summary.getOutcomes()) {
            if (outcome.isFailed()) {
                logger.error("  {}", outcome);
            } else if (outcome.getStatus() == FileOutcome.Status.CONVERTED_WITH_ROW_ERRORS) {
                logger.warn("  {}", outcome);
            } else {
                logger.info("  {}", outcome);
            }
        }
        logger.info("Summary: {}", summary);
    }
}
