package com.doseobjectives.converter;

import java.io.IOException;
import java.time.Clock;
import java.util.Collections;
import java.util.concurrent.TimeUnit;

import org.apache.poi.openxml4j.util.ZipSecureFile;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.doseobjectives.converter.batch.BatchConverter;
import com.doseobjectives.converter.batch.BatchSummary;
import com.doseobjectives.converter.batch.FileOutcome;
import com.doseobjectives.converter.batch.FileSystemTemplateLocator;
import com.doseobjectives.converter.config.ConverterConfig;
import com.doseobjectives.converter.core.FileConverter;
import com.doseobjectives.converter.core.writers.BatchReportWriter;

import ch.qos.logback.classic.Level;
import picocli.CommandLine;

/**
 * Main class of the clinical goals converter.
 * <p>
 * Parses the command line, converts one file or every file of the templates directory, and
 * maps the outcome to an exit code: 0 when every file converted (row errors included),
 * 1 when a file failed or the configuration is invalid, picocli's invalid-input code for bad
 * arguments.
 */
public class DoseObjectivesConverter {

    private static final Logger logger = LoggerFactory.getLogger(DoseObjectivesConverter.class);

    public static final int EXIT_OK = 0;
    public static final int EXIT_FAILURE = 1;

    public static void main(String[] args) {
        int exitCode = run(args);
        if (exitCode != EXIT_OK) {
            System.exit(exitCode);
        }
    }

    public static int run(String[] args) {
        return run(args, Clock.systemDefaultZone());
    }

    /**
     * @param args command line arguments
     * @param clock source of the conversion timestamps written into the documents
     * @return the process exit code
     */
    public static int run(String[] args, Clock clock) {
        if (args == null) {
            throw new IllegalArgumentException("args must not be null");
        }
        long startTime = System.nanoTime();

        ConverterConfig config = new ConverterConfig();
        CommandLine cmd = new CommandLine(config);
        cmd.setCaseInsensitiveEnumValuesAllowed(true);

        try {
            cmd.parseArgs(args);

            if (cmd.isUsageHelpRequested()) {
                cmd.usage(System.out);
                return EXIT_OK;
            }
            if (cmd.isVersionHelpRequested()) {
                cmd.printVersionHelp(System.out);
                return EXIT_OK;
            }
            if (config.verbose) {
                enableVerboseLogging();
            }

            config.validate();
            logger.debug("Reader: {}, sheet: '{}', alias mode: {}, overwrite: {}",
                    config.reader, config.sheetName, config.aliasMode, config.overwrite);

            ZipSecureFile.setMinInflateRatio(config.minInflateRatio);
            logger.debug("ZipSecureFile.minInflateRatio set to: {}", config.minInflateRatio);

            FileConverter fileConverter = FileConverter.fromConfig(config, clock);
            BatchSummary summary;
            if (config.isBatchMode()) {
                logger.info("Converting all templates in {}", config.templatesDir);
                summary = new BatchConverter(new FileSystemTemplateLocator(), fileConverter)
                        .convertAll(config.templatesDir);
            } else {
                FileOutcome outcome = fileConverter.convert(config.inputFile, config.resolveOutputFile(), config.previewId);
                summary = new BatchSummary(Collections.singletonList(outcome));
                logger.info("{}", outcome);
            }

            if (config.reportFile != null) {
                new BatchReportWriter(clock).writeFile(summary, config.reportFile);
            }
            return summary.hasFailures() ? EXIT_FAILURE : EXIT_OK;

        } catch (CommandLine.ParameterException ex) {
            logger.error("Invalid parameter(s): {}", ex.getMessage());
            cmd.usage(System.err);
            return cmd.getCommandSpec().exitCodeOnInvalidInput();
        } catch (IllegalArgumentException ex) {
            logger.error("Configuration validation failed: {}", ex.getMessage());
            cmd.usage(System.err);
            return EXIT_FAILURE;
        } catch (IOException ex) {
            logger.error("I/O error: {}", ex.getMessage(), ex);
            return EXIT_FAILURE;
        } finally {
            long durationMillis = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - startTime);
            logger.info("Clinical goals converter finished in {} ms.", durationMillis);
        }
    }

    private static void enableVerboseLogging() {
        org.slf4j.Logger appLogger = LoggerFactory.getLogger("com.doseobjectives");
        if (appLogger instanceof ch.qos.logback.classic.Logger) {
            ((ch.qos.logback.classic.Logger) appLogger).setLevel(Level.DEBUG);
        } else {
            logger.warn("Verbose logging requested but the logging backend is not Logback.");
        }
    }
}
