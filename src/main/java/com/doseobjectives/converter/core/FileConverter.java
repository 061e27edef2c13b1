package com.doseobjectives.converter.core;

import com.doseobjectives.converter.batch.FileOutcome;
import com.doseobjectives.converter.config.ConverterConfig;
import com.doseobjectives.converter.core.writers.DoseObjectivesXmlWriter;
import com.doseobjectives.converter.exception.ConversionException;
import com.doseobjectives.converter.model.ConstraintSheet;
import com.doseobjectives.converter.pipeline.ConversionPipeline;
import com.doseobjectives.converter.pipeline.ConversionResult;
import com.doseobjectives.converter.pipeline.IdentityResolver;
import com.doseobjectives.converter.pipeline.RowParser;
import com.doseobjectives.converter.pipeline.TemplateIdRule;
import com.doseobjectives.converter.pipeline.XmlBuilder;
import com.doseobjectives.converter.strategy.RowSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Path;
import java.time.Clock;
import java.util.function.Supplier;

/**
 * Converts one spreadsheet into one XML file: read rows, run the pipeline, write the document.
 * File-level failures are returned as a {@link FileOutcome} rather than thrown, so a batch can
 * carry on with the next file.
 *
 * @invariant every call starts from a pipeline obtained from the factory; nothing is shared
 *            between files except the configuration.
 */
public class FileConverter {

    private static final Logger logger = LoggerFactory.getLogger(FileConverter.class);

    private final RowSourceSelector rowSourceSelector;
    private final Supplier<ConversionPipeline> pipelineFactory;
    private final DoseObjectivesXmlWriter writer;
    private final String sheetName;
    private final boolean overwrite;

    public FileConverter(RowSourceSelector rowSourceSelector, Supplier<ConversionPipeline> pipelineFactory,
                         DoseObjectivesXmlWriter writer, String sheetName, boolean overwrite) {
        this.rowSourceSelector = rowSourceSelector;
        this.pipelineFactory = pipelineFactory;
        this.writer = writer;
        this.sheetName = sheetName;
        this.overwrite = overwrite;
    }

    /**
     * Wires a converter from the command-line configuration.
     */
    public static FileConverter fromConfig(ConverterConfig config, Clock clock) {
        Supplier<ConversionPipeline> pipelineFactory = () -> new ConversionPipeline(
                new RowParser(),
                new TemplateIdRule(),
                new IdentityResolver(config.aliasMode),
                new XmlBuilder(clock, config.codeScheme, config.codeSchemeVersion, config.assignedUsers,
                        config.addPreviewIdAlias));
        return new FileConverter(new RowSourceSelector(config.reader, config.csvDelimiter), pipelineFactory,
                new DoseObjectivesXmlWriter(), config.sheetName, config.overwrite);
    }

    /**
     * @param input the spreadsheet to read
     * @param output the XML file to write
     * @param previewIdOverride optional id for the first template group, may be null
     * @return the outcome; {@link FileOutcome.Status#FAILED} if the file could not be converted
     */
    public FileOutcome convert(Path input, Path output, String previewIdOverride) {
        logger.info("Converting {} -> {}", input, output);
        try {
            RowSource rowSource = rowSourceSelector.select(input);
            logger.debug("Selected row source: {}", rowSource.getClass().getSimpleName());
            ConstraintSheet sheet = rowSource.read(input, sheetName);
            ConversionResult result = pipelineFactory.get()
                    .convert(sheet, previewIdOverride, input.getFileName().toString());
            writer.writeFile(result.getDocument(), output, overwrite);
            FileOutcome outcome = FileOutcome.converted(input, output, result);
            if (result.hasRowErrors()) {
                logger.warn("{}: {} row(s) rejected.", input.getFileName(), result.getRowErrors().size());
            }
            return outcome;
        } catch (ConversionException | IOException | UncheckedIOException e) {
            logger.error("Failed to convert {}: {}", input, e.getMessage());
            logger.debug("Failure detail for {}", input, e);
            return FileOutcome.failed(input, e.getMessage());
        } catch (RuntimeException e) {
            logger.error("An unexpected error occurred while converting {}: {}", input, e.getMessage(), e);
            return FileOutcome.failed(input, e.getClass().getSimpleName() + ": " + e.getMessage());
        }
    }
}
