package com.doseobjectives.converter.strategy;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import static com.doseobjectives.converter.SheetFixtures.goal;
import static com.doseobjectives.converter.SheetFixtures.sheet;
import static com.doseobjectives.converter.SheetFixtures.writeWorkbook;
import static org.assertj.core.api.Assertions.*;

/**
 * Tests for PoiEventRowSource.
 */
class PoiEventRowSourceTest extends RowSourceContractTest {

    @Override
    RowSource rowSource() {
        return new PoiEventRowSource();
    }

    @Test
    void testNumericPriorityCellIsFormattedAsInteger(@TempDir Path tempDir) throws Exception {
        Path file = writeWorkbook(tempDir.resolve("plan.xlsx"), "Constraints", sheet(goal("Heart", "", "", "Dmean", "", "", 2.0, "T1")));

        assertThat(rowSource().read(file, "Constraints").getRows().get(0).get("Priority")).isEqualTo("2");
    }

    @Test
    void testNotAWorkbook(@TempDir Path tempDir) throws Exception {
        Path file = tempDir.resolve("broken.xlsx");
        Files.write(file, "not a zip".getBytes(StandardCharsets.UTF_8));

        assertThatThrownBy(() -> rowSource().read(file, "Constraints")).isInstanceOf(RuntimeException.class);
    }
}
