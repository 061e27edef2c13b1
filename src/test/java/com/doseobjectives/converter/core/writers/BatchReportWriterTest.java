package com.doseobjectives.converter.core.writers;

import com.doseobjectives.converter.batch.BatchSummary;
import com.doseobjectives.converter.batch.FileOutcome;
import com.doseobjectives.converter.document.DoseObjectivesDocument;
import com.doseobjectives.converter.model.RowError;
import com.doseobjectives.converter.pipeline.ConversionResult;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;

import static org.assertj.core.api.Assertions.*;

/**
 * Unit tests for BatchReportWriter.
 */
class BatchReportWriterTest {

    @Test
    void testWritesOutcomesAndCounts(@TempDir Path tempDir) throws Exception {
        RowError error = new RowError(4, "Priority", "high", "INVALID_PRIORITY", "Row 4, column 'Priority' (value 'high'): Priority must be an integer");
        ConversionResult result = new ConversionResult(List.of(), List.of(), new DoseObjectivesDocument(List.of()),
                List.of(error), 1);
        BatchSummary summary = new BatchSummary(List.of(
                FileOutcome.converted(tempDir.resolve("a.xlsx"), tempDir.resolve("a.xml"), result),
                FileOutcome.failed(tempDir.resolve("b.xlsx"), "Sheet 'Constraints' was not found")));
        Path report = tempDir.resolve("reports/report.json");

        new BatchReportWriter(Clock.fixed(Instant.parse("2024-03-05T14:07:09Z"), ZoneOffset.UTC)).writeFile(summary, report);

        JsonNode json = new ObjectMapper().readTree(report.toFile());
        assertThat(json.get("generatedAt").asText()).isEqualTo("2024-03-05T14:07:09Z");
        assertThat(json.get("files").asInt()).isEqualTo(2);
        assertThat(json.get("convertedWithRowErrors").asInt()).isEqualTo(1);
        assertThat(json.get("failed").asInt()).isEqualTo(1);

        JsonNode first = json.get("outcomes").get(0);
        assertThat(first.get("status").asText()).isEqualTo("CONVERTED_WITH_ROW_ERRORS");
        assertThat(first.get("skippedRows").asInt()).isEqualTo(1);
        assertThat(first.get("rowErrors").get(0).get("row").asInt()).isEqualTo(4);
        assertThat(first.get("rowErrors").get(0).get("kind").asText()).isEqualTo("INVALID_PRIORITY");

        JsonNode second = json.get("outcomes").get(1);
        assertThat(second.get("status").asText()).isEqualTo("FAILED");
        assertThat(second.get("output").isNull()).isTrue();
        assertThat(second.get("failure").asText()).contains("Constraints");
    }
}
