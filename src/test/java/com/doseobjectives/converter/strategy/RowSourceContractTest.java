package com.doseobjectives.converter.strategy;

import com.doseobjectives.converter.exception.MissingSheetException;
import com.doseobjectives.converter.model.ClinicalGoalRow;
import com.doseobjectives.converter.model.ConstraintSheet;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.util.Arrays;
import java.util.List;

import static com.doseobjectives.converter.SheetFixtures.HEADER;
import static com.doseobjectives.converter.SheetFixtures.goal;
import static com.doseobjectives.converter.SheetFixtures.sheet;
import static com.doseobjectives.converter.SheetFixtures.writeWorkbook;
import static org.assertj.core.api.Assertions.*;

/**
 * Shared checks for the workbook readers. Subclasses supply the reader under test.
 */
abstract class RowSourceContractTest {

    abstract RowSource rowSource();

    @Test
    void testReadsHeaderAndRowsInOrder(@TempDir Path tempDir) throws Exception {
        Path file = writeWorkbook(tempDir.resolve("plan.xlsx"), "Constraints", sheet(
                goal("PTV70|PTV_70", "1234", "A;B", "V[x]", "60Gy", "5%", 1, "T1"),
                null,
                goal("Heart", "", "", "Dmean", "", "", "2", "T1")));

        ConstraintSheet sheet = rowSource().read(file, "Constraints");

        assertThat(sheet.getSheetName()).isEqualToIgnoringCase("Constraints");
        assertThat(sheet.getHeaders()).containsExactlyElementsOf(HEADER);
        assertThat(sheet.getRows()).extracting(ClinicalGoalRow::getRowNumber).containsExactly(2, 4);

        ClinicalGoalRow first = sheet.getRows().get(0);
        assertThat(first.get("Structure IDs")).isEqualTo("PTV70|PTV_70");
        assertThat(first.get("IDAliases")).isEqualTo("A;B");
        assertThat(first.get("Evaluation Point")).isEqualTo("60Gy");
        assertThat(first.get("Priority")).isEqualTo("1");
        assertThat(first.get("Endpoint (grade ≥ 3)")).isEqualTo("grade 3 toxicity");

        ClinicalGoalRow second = sheet.getRows().get(1);
        assertThat(second.get("Structure Codes")).isEmpty();
        assertThat(second.get("DVH Objective")).isEqualTo("Dmean");
    }

    @Test
    void testHeaderVariantsAreCanonicalized(@TempDir Path tempDir) throws Exception {
        List<Object> header = Arrays.asList(" Structure IDs ", "DVH Objective", "Priority", "Zusatzinfo", "Endpoint (grade >= 3)");
        List<Object> data = Arrays.asList("Cord", "Dmax", "1", "info", "myelopathy");
        Path file = writeWorkbook(tempDir.resolve("variants.xlsx"), "Constraints", Arrays.asList(header, data));

        ConstraintSheet sheet = rowSource().read(file, "Constraints");

        assertThat(sheet.getHeaders()).containsExactly("Structure IDs", "DVH Objective", "Priority", "ZusatzInfo",
                "Endpoint (grade ≥ 3)");
        assertThat(sheet.getRows().get(0).get("ZusatzInfo")).isEqualTo("info");
    }

    @Test
    void testMissingSheet(@TempDir Path tempDir) throws Exception {
        Path file = writeWorkbook(tempDir.resolve("plan.xlsx"), "Other", sheet(goal("Heart", "", "", "Dmean", "", "", "1", "T1")));

        assertThatThrownBy(() -> rowSource().read(file, "Constraints"))
                .isInstanceOf(MissingSheetException.class)
                .hasMessageContaining("Constraints");
    }

    @Test
    void testMissingSheetListsAvailableSheets(@TempDir Path tempDir) throws Exception {
        Path file = writeWorkbook(tempDir.resolve("plan.xlsx"), "Other", sheet());

        assertThatThrownBy(() -> rowSource().read(file, "Constraints"))
                .isInstanceOf(MissingSheetException.class)
                .hasMessageContaining("Info")
                .hasMessageContaining("Other");
    }

    @Test
    void testSheetNameIsCaseInsensitive(@TempDir Path tempDir) throws Exception {
        Path file = writeWorkbook(tempDir.resolve("plan.xlsx"), "CONSTRAINTS", sheet(goal("Heart", "", "", "Dmean", "", "", "2", "T1")));

        ConstraintSheet sheet = rowSource().read(file, "constraints");

        assertThat(sheet.getSheetName()).isEqualTo("CONSTRAINTS");
        assertThat(sheet.getRows()).hasSize(1);
        assertThat(sheet.getRows().get(0).get("Structure IDs")).isEqualTo("Heart");
    }
}
