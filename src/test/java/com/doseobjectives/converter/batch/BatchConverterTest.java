package com.doseobjectives.converter.batch;

import com.doseobjectives.converter.config.ConverterConfig;
import com.doseobjectives.converter.core.FileConverter;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;

import static com.doseobjectives.converter.SheetFixtures.goal;
import static com.doseobjectives.converter.SheetFixtures.sheet;
import static com.doseobjectives.converter.SheetFixtures.writeCsv;
import static com.doseobjectives.converter.SheetFixtures.writeWorkbook;
import static org.assertj.core.api.Assertions.*;

/**
 * Tests BatchConverter with an injected locator and real files.
 */
class BatchConverterTest {

    private static FileConverter fileConverter() {
        return FileConverter.fromConfig(new ConverterConfig(), Clock.fixed(Instant.EPOCH, ZoneOffset.UTC));
    }

    @Test
    void testContinuesAfterFailingFile(@TempDir Path tempDir) throws Exception {
        Path first = writeWorkbook(tempDir.resolve("a.xlsx"), "Constraints", sheet(goal("Heart", "", "", "Dmean", "", "", "1", "T1")));
        Path broken = tempDir.resolve("b.xlsx");
        Files.write(broken, "not a workbook".getBytes(StandardCharsets.UTF_8));
        Path third = writeCsv(tempDir.resolve("c.csv"), ',', sheet(
                goal("Lung", "", "", "Dmean", "", "", "x", "T1"),
                goal("Cord", "", "", "Dmax", "", "", "1", "T1")));

        BatchSummary summary = new BatchConverter(new FileSystemTemplateLocator(), fileConverter()).convertAll(tempDir);

        assertThat(summary.getOutcomes()).extracting(FileOutcome::getStatus).containsExactly(
                FileOutcome.Status.CONVERTED, FileOutcome.Status.FAILED, FileOutcome.Status.CONVERTED_WITH_ROW_ERRORS);
        assertThat(summary.hasFailures()).isTrue();
        assertThat(summary.getRowErrorCount()).isEqualTo(1);
        assertThat(tempDir.resolve("a.xml")).exists();
        assertThat(tempDir.resolve("b.xml")).doesNotExist();
        assertThat(tempDir.resolve("c.xml")).exists();
        assertThat(summary.toString()).isEqualTo("3 file(s): 1 converted, 1 converted with row errors, 1 failed");
        assertThat(first).exists();
        assertThat(third).exists();
    }

    @Test
    void testSourcesSharingAStemDoNotOverwriteEachOther(@TempDir Path tempDir) throws Exception {
        writeWorkbook(tempDir.resolve("plan.xlsx"), "Constraints", sheet(goal("HeartFromXlsx", "", "", "Dmean", "", "", "1", "T1")));
        writeCsv(tempDir.resolve("plan.csv"), ',', sheet(goal("LungFromCsv", "", "", "Dmean", "", "", "1", "T1")));

        BatchSummary summary = new BatchConverter(new FileSystemTemplateLocator(), fileConverter()).convertAll(tempDir);

        assertThat(summary.getOutcomes()).extracting(FileOutcome::getSource)
                .containsExactly(tempDir.resolve("plan.csv"), tempDir.resolve("plan.xlsx"));
        assertThat(summary.getOutcomes()).extracting(FileOutcome::getStatus)
                .containsExactly(FileOutcome.Status.CONVERTED, FileOutcome.Status.FAILED);
        assertThat(summary.getOutcomes().get(1).getFailureMessage()).hasValueSatisfying(
                message -> assertThat(message).contains("plan.xml").contains("plan.csv"));
        assertThat(summary.toString()).isEqualTo("2 file(s): 1 converted, 0 converted with row errors, 1 failed");

        String xml = new String(Files.readAllBytes(tempDir.resolve("plan.xml")), StandardCharsets.UTF_8);
        assertThat(xml).contains("LungFromCsv").doesNotContain("HeartFromXlsx");
    }

    @Test
    void testNoPreviewOverrideInBatchMode(@TempDir Path tempDir) throws Exception {
        writeWorkbook(tempDir.resolve("plan.xlsx"), "Constraints", sheet(goal("Heart", "", "", "Dmean", "", "", "1", "T1")));

        new BatchConverter(new FileSystemTemplateLocator(), fileConverter()).convertAll(tempDir);

        String xml = new String(Files.readAllBytes(tempDir.resolve("plan.xml")), StandardCharsets.UTF_8);
        assertThat(xml).contains("<MeasureGroup ID=\"T1\">");
    }

    @Test
    void testUsesInjectedLocator(@TempDir Path tempDir) throws Exception {
        Path only = writeWorkbook(tempDir.resolve("chosen.xlsx"), "Constraints", sheet(goal("Heart", "", "", "Dmean", "", "", "1", "T1")));
        writeWorkbook(tempDir.resolve("ignored.xlsx"), "Constraints", sheet(goal("Lung", "", "", "Dmean", "", "", "1", "T1")));
        TemplateLocator locator = directory -> List.of(only);

        BatchSummary summary = new BatchConverter(locator, fileConverter()).convertAll(tempDir);

        assertThat(summary.getFileCount()).isEqualTo(1);
        assertThat(tempDir.resolve("ignored.xml")).doesNotExist();
    }

    @Test
    void testEmptyDirectory(@TempDir Path tempDir) throws Exception {
        BatchSummary summary = new BatchConverter(new FileSystemTemplateLocator(), fileConverter()).convertAll(tempDir);

        assertThat(summary.getOutcomes()).isEmpty();
        assertThat(summary.hasFailures()).isFalse();
    }
}
