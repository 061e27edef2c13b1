package com.doseobjectives.converter.core.writers;

import com.doseobjectives.converter.batch.BatchSummary;
import com.doseobjectives.converter.batch.FileOutcome;
import com.doseobjectives.converter.model.RowError;
import com.fasterxml.jackson.core.JsonEncoding;
import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedOutputStream;
import java.io.IOException;
import java.io.OutputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;

/**
 * Writes a {@link BatchSummary} as a JSON report with Jackson's streaming generator.
 * <pre>
 * { "generatedAt": "...", "files": 2, "converted": 1, "convertedWithRowErrors": 0, "failed": 1,
 *   "outcomes": [ { "source": "...", "output": "...", "status": "CONVERTED", ..., "rowErrors": [...] } ] }
 * </pre>
 */
public class BatchReportWriter {

    private static final Logger logger = LoggerFactory.getLogger(BatchReportWriter.class);

    private final ObjectMapper objectMapper = new ObjectMapper();
    private final Clock clock;

    public BatchReportWriter(Clock clock) {
        this.clock = clock;
    }

    public void write(BatchSummary summary, OutputStream out) throws IOException {
        try (JsonGenerator json = objectMapper.getFactory().createGenerator(out, JsonEncoding.UTF8)) {
            json.configure(JsonGenerator.Feature.AUTO_CLOSE_TARGET, false);
            json.useDefaultPrettyPrinter();

            json.writeStartObject();
            json.writeStringField("generatedAt", Instant.now(clock).toString());
            json.writeNumberField("files", summary.getFileCount());
            json.writeNumberField("converted", summary.count(FileOutcome.Status.CONVERTED));
            json.writeNumberField("convertedWithRowErrors", summary.count(FileOutcome.Status.CONVERTED_WITH_ROW_ERRORS));
            json.writeNumberField("failed", summary.count(FileOutcome.Status.FAILED));
            json.writeArrayFieldStart("outcomes");
            for (FileOutcome outcome : summary.getOutcomes()) {
                writeOutcome(json, outcome);
            }
            json.writeEndArray();
            json.writeEndObject();
        }
    }

    /**
     * @post parent directories of {@code target} exist and the file holds the complete report
     */
    public void writeFile(BatchSummary summary, Path target) throws IOException {
        Path parent = target.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        try (OutputStream out = new BufferedOutputStream(Files.newOutputStream(target))) {
            write(summary, out);
        }
        logger.info("Report written to {}", target);
    }

    private void writeOutcome(JsonGenerator json, FileOutcome outcome) throws IOException {
        json.writeStartObject();
        json.writeStringField("source", outcome.getSource().toString());
        if (outcome.getOutput().isPresent()) {
            json.writeStringField("output", outcome.getOutput().get().toString());
        } else {
            json.writeNullField("output");
        }
        json.writeStringField("status", outcome.getStatus().name());
        json.writeNumberField("goals", outcome.getGoalCount());
        json.writeNumberField("templateGroups", outcome.getGroupCount());
        json.writeNumberField("measureItems", outcome.getItemCount());
        json.writeNumberField("skippedRows", outcome.getSkippedRows());
        if (outcome.getFailureMessage().isPresent()) {
            json.writeStringField("failure", outcome.getFailureMessage().get());
        }
        json.writeArrayFieldStart("rowErrors");
        for (RowError error : outcome.getRowErrors()) {
            json.writeStartObject();
            json.writeNumberField("row", error.getRowNumber());
            json.writeStringField("column", error.getColumn());
            json.writeStringField("value", error.getRawValue());
            json.writeStringField("kind", error.getKind());
            json.writeStringField("message", error.getMessage());
            json.writeEndObject();
        }
        json.writeEndArray();
        json.writeEndObject();
    }
}
