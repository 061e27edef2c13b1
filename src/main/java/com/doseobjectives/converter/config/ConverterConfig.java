package com.doseobjectives.converter.config;

import com.doseobjectives.converter.model.ConstraintColumns;
import com.doseobjectives.converter.pipeline.AliasMode;
import com.doseobjectives.converter.pipeline.XmlBuilder;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.nio.file.Path;

/**
 * Configuration holder and command definition for the clinical goals converter.
 * Fields are populated by picocli and not mutated after {@link #validate()}.
 * <p>
 * With no positional arguments every spreadsheet in {@link #templatesDir} is converted beside
 * its source. With INPUT only, the output is INPUT with an {@code .xml} extension.
 */
@Command(name = "clinical-goals-converter",
         mixinStandardHelpOptions = true,
         version = "Clinical Goals Converter 1.0.0",
         description = "Converts clinical goal constraint sheets (xlsx or csv) into DoseObjectives XML templates.")
public class ConverterConfig {

    @Parameters(index = "0", arity = "0..1", paramLabel = "INPUT",
                description = "Constraint spreadsheet to convert. Omit to convert every file in --templates-dir.")
    public Path inputFile;

    @Parameters(index = "1", arity = "0..1", paramLabel = "OUTPUT",
                description = "Output XML file. Defaults to INPUT with an .xml extension.")
    public Path outputFile;

    @Parameters(index = "2", arity = "0..1", paramLabel = "PREVIEW_ID",
                description = "Replaces the ID of the first template group.")
    public String previewId;

    @Option(names = {"-d", "--templates-dir"}, description = "Directory scanned in batch mode. Default: ${DEFAULT-VALUE}")
    public Path templatesDir = Path.of("templates");

    @Option(names = {"-s", "--sheet"}, description = "Worksheet holding the constraints. Default: ${DEFAULT-VALUE}")
    public String sheetName = ConstraintColumns.DEFAULT_SHEET_NAME;

    @Option(names = {"-r", "--reader"}, description = "Row reader: ${COMPLETION-CANDIDATES}. Default: ${DEFAULT-VALUE}")
    public Reader reader = Reader.AUTO;

    @Option(names = {"--csv-delimiter"}, description = "Field delimiter for CSV input. Default: ${DEFAULT-VALUE}")
    public char csvDelimiter = ',';

    @Option(names = {"-a", "--alias-mode"}, description = "Source of measure item ids: ${COMPLETION-CANDIDATES}. Default: ${DEFAULT-VALUE}")
    public AliasMode aliasMode = AliasMode.ID_ALIASES;

    @Option(names = {"--add-preview-id-alias"},
            description = "Also emit every goal under its template group's preview id.")
    public boolean addPreviewIdAlias = false;

    @Option(names = {"--assigned-users"}, description = "Value of the preview AssignedUsers attribute.")
    public String assignedUsers = "";

    @Option(names = {"--code-scheme"}, description = "Structure code scheme. Default: ${DEFAULT-VALUE}")
    public String codeScheme = XmlBuilder.DEFAULT_CODE_SCHEME;

    @Option(names = {"--code-scheme-version"}, description = "Structure code scheme version. Default: ${DEFAULT-VALUE}")
    public String codeSchemeVersion = XmlBuilder.DEFAULT_CODE_SCHEME_VERSION;

    @Option(names = {"--report"}, description = "Write a JSON report of all conversions to this file.")
    public Path reportFile;

    @Option(names = {"--overwrite"}, arity = "0..1", fallbackValue = "true",
            description = "Overwrite existing output files; --overwrite=false keeps them. Default: ${DEFAULT-VALUE}")
    public boolean overwrite = true;

    @Option(names = {"--min-inflate-ratio"}, description = "Minimum XML inflation ratio for zip bomb protection (0 disables). Default: ${DEFAULT-VALUE}")
    public double minInflateRatio = 0.01;

    @Option(names = {"-v", "--verbose"}, description = "Enable verbose logging.")
    public boolean verbose = false;

    public ConverterConfig() {}

    public boolean isBatchMode() {
        return inputFile == null;
    }

    /**
     * @return the explicit output file, or the input path with its extension replaced by {@code .xml}
     */
    public Path resolveOutputFile() {
        if (outputFile != null) {
            return outputFile;
        }
        return xmlSibling(inputFile);
    }

    /**
     * @return {@code name.xml} in the directory of {@code source}
     */
    public static Path xmlSibling(Path source) {
        String fileName = source.getFileName().toString();
        int dot = fileName.lastIndexOf('.');
        String base = dot > 0 ? fileName.substring(0, dot) : fileName;
        return source.resolveSibling(base + ".xml");
    }

    /**
     * Performs validation that picocli does not cover.
     *
     * @throws IllegalArgumentException if validation fails
     */
    public void validate() {
        if (minInflateRatio < 0) {
            throw new IllegalArgumentException("Minimum inflate ratio cannot be negative: " + minInflateRatio);
        }
        if (sheetName == null || sheetName.strip().isEmpty()) {
            throw new IllegalArgumentException("Sheet name must not be blank");
        }
        if (previewId != null && previewId.strip().isEmpty()) {
            throw new IllegalArgumentException("PREVIEW_ID must not be blank");
        }
        if (codeScheme == null || codeScheme.strip().isEmpty()) {
            throw new IllegalArgumentException("Code scheme must not be blank");
        }
        if (csvDelimiter == '"' || csvDelimiter == '\n' || csvDelimiter == '\r') {
            throw new IllegalArgumentException("Unsupported CSV delimiter: " + csvDelimiter);
        }
        if (isBatchMode() && !templatesDir.toFile().isDirectory()) {
            throw new IllegalArgumentException("Templates directory not found: " + templatesDir);
        }
        if (!isBatchMode() && !inputFile.toFile().isFile()) {
            throw new IllegalArgumentException("Input file not found: " + inputFile);
        }
    }

    // Row readers selectable with --reader
    public enum Reader {
        AUTO,       // chosen from the file extension and size
        POI_EVENT,  // Apache POI XSSFReader event model
        EASY_EXCEL, // EasyExcel streaming listener
        CSV         // Commons CSV, for CSV exports of the sheet
    }
}
