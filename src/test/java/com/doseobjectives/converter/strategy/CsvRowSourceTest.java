package com.doseobjectives.converter.strategy;

import com.doseobjectives.converter.exception.MissingSheetException;
import com.doseobjectives.converter.model.ClinicalGoalRow;
import com.doseobjectives.converter.model.ConstraintSheet;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import static com.doseobjectives.converter.SheetFixtures.goal;
import static com.doseobjectives.converter.SheetFixtures.sheet;
import static com.doseobjectives.converter.SheetFixtures.writeCsv;
import static org.assertj.core.api.Assertions.*;

/**
 * Tests for CsvRowSource.
 */
class CsvRowSourceTest {

    @Test
    void testReadsQuotedPipesAndSemicolons(@TempDir Path tempDir) throws Exception {
        Path file = writeCsv(tempDir.resolve("plan.csv"), ',', sheet(
                goal("PTV70|PTV_70", "1234", "A;B", "V[x]", "60,5Gy", "5%", "1", "T1"),
                goal("Heart", "", "", "Dmean", "", "", "2", "T1")));

        ConstraintSheet sheet = new CsvRowSource().read(file, "Constraints");

        assertThat(sheet.getRows()).extracting(ClinicalGoalRow::getRowNumber).containsExactly(2, 3);
        assertThat(sheet.getRows().get(0).get("Structure IDs")).isEqualTo("PTV70|PTV_70");
        assertThat(sheet.getRows().get(0).get("Evaluation Point")).isEqualTo("60,5Gy");
        assertThat(sheet.getRows().get(1).get("Priority")).isEqualTo("2");
    }

    @Test
    void testSemicolonDelimiter(@TempDir Path tempDir) throws Exception {
        Path file = writeCsv(tempDir.resolve("plan.csv"), ';', sheet(goal("Heart", "", "A;B", "Dmean", "", "", "2", "T1")));

        ConstraintSheet sheet = new CsvRowSource(';').read(file, "Constraints");

        assertThat(sheet.getRows().get(0).get("IDAliases")).isEqualTo("A;B");
        assertThat(sheet.getRows().get(0).get("TemplateID")).isEqualTo("T1");
    }

    @Test
    void testByteOrderMarkIsIgnored(@TempDir Path tempDir) throws Exception {
        Path file = tempDir.resolve("bom.csv");
        Files.write(file, "\uFEFFStructure IDs,DVH Objective,Priority\r\nHeart,Dmean,1\r\n".getBytes(StandardCharsets.UTF_8));

        ConstraintSheet sheet = new CsvRowSource().read(file, "Constraints");

        assertThat(sheet.getHeaders()).containsExactly("Structure IDs", "DVH Objective", "Priority");
        assertThat(sheet.getRows().get(0).get("Structure IDs")).isEqualTo("Heart");
    }

    @Test
    void testEmptyFileHasNoHeader(@TempDir Path tempDir) throws Exception {
        Path file = Files.createFile(tempDir.resolve("empty.csv"));

        assertThatThrownBy(() -> new CsvRowSource().read(file, "Constraints")).isInstanceOf(MissingSheetException.class);
    }
}
