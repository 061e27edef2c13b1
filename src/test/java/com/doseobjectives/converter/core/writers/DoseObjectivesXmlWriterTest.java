package com.doseobjectives.converter.core.writers;

import com.doseobjectives.converter.document.DoseObjectivesDocument;
import com.doseobjectives.converter.document.MeasureGroup;
import com.doseobjectives.converter.document.MeasureItem;
import com.doseobjectives.converter.document.PreviewHeader;
import com.doseobjectives.converter.model.Quantity;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.w3c.dom.Document;
import org.w3c.dom.Element;

import javax.xml.parsers.DocumentBuilderFactory;
import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.math.BigDecimal;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Locale;

import static org.assertj.core.api.Assertions.*;

/**
 * Unit tests for DoseObjectivesXmlWriter.
 */
class DoseObjectivesXmlWriterTest {

    private final DoseObjectivesXmlWriter writer = new DoseObjectivesXmlWriter();

    private static DoseObjectivesDocument document() {
        MeasureItem coded = MeasureItem.builder("A")
                .structure("PTV70", 1234L, "FMA", "3.2")
                .type(3, new Quantity(new BigDecimal("60"), "Gy"))
                .reportInAbsoluteUnits(false)
                .priority(1)
                .variationAcceptable(new Quantity(new BigDecimal("2.25"), "%"))
                .build();
        MeasureItem plain = MeasureItem.builder("Heart & Co")
                .structure("Heart", null, "FMA", "3.2")
                .type(8, null)
                .priority(2)
                .build();
        PreviewHeader preview = new PreviewHeader("T1", "Source: plan.xlsx | Converted: 2024-03-05 14:07:09", "",
                " March 05 2024 14:07:09:123");
        return new DoseObjectivesDocument(List.of(new MeasureGroup("T1", preview, List.of(coded, plain))));
    }

    @Test
    void testFormatDecimalHalfUp() {
        assertThat(DoseObjectivesXmlWriter.formatDecimal(new BigDecimal("60"))).isEqualTo("60.0");
        assertThat(DoseObjectivesXmlWriter.formatDecimal(new BigDecimal("2.25"))).isEqualTo("2.3");
        assertThat(DoseObjectivesXmlWriter.formatDecimal(new BigDecimal("2.35"))).isEqualTo("2.4");
        assertThat(DoseObjectivesXmlWriter.formatDecimal(new BigDecimal("0.04"))).isEqualTo("0.0");
        assertThat(DoseObjectivesXmlWriter.formatDecimal(new BigDecimal("1E+3"))).isEqualTo("1000.0");
    }

    @Test
    void testFormatParameterRoundsAbsoluteVolumesUp() {
        assertThat(DoseObjectivesXmlWriter.formatParameter(new Quantity(new BigDecimal("2.01"), "cc"))).isEqualTo("2.1");
        assertThat(DoseObjectivesXmlWriter.formatParameter(new Quantity(new BigDecimal("2"), "cc"))).isEqualTo("2.0");
        assertThat(DoseObjectivesXmlWriter.formatParameter(new Quantity(new BigDecimal("2.01"), "%"))).isEqualTo("2.0");
        assertThat(DoseObjectivesXmlWriter.formatParameter(new Quantity(new BigDecimal("60.04"), "Gy"))).isEqualTo("60.0");
        assertThat(DoseObjectivesXmlWriter.formatParameter(new Quantity(new BigDecimal("2.25"), null))).isEqualTo("2.3");
    }

    @Test
    void testDoseAtVolumeItemWritesRoundedUpVolumeWithUnit() throws IOException {
        MeasureItem doseAtVolume = MeasureItem.builder("Rectum")
                .structure("Rectum", null, "FMA", "3.2")
                .type(5, new Quantity(new BigDecimal("2.01"), "cc"))
                .priority(3)
                .build();
        PreviewHeader preview = new PreviewHeader("T1", "", "", " March 05 2024 14:07:09:123");
        DoseObjectivesDocument doc = new DoseObjectivesDocument(List.of(new MeasureGroup("T1", preview, List.of(doseAtVolume))));

        String xml = new String(writer.toBytes(doc), StandardCharsets.UTF_8);

        assertThat(xml).contains("<Type>5</Type>")
                .contains("<TypeSpecifier Unit=\"cc\">2.1</TypeSpecifier>")
                .doesNotContain("PrimaryClinicalGoal");
    }

    @Test
    void testFormattingIgnoresDefaultLocale() throws IOException {
        Locale previous = Locale.getDefault();
        Locale.setDefault(Locale.GERMANY);
        try {
            String xml = new String(writer.toBytes(document()), StandardCharsets.UTF_8);
            assertThat(xml).contains("<TypeSpecifier Unit=\"Gy\">60.0</TypeSpecifier>")
                    .contains("<VariationAcceptable Unit=\"%\">2.3</VariationAcceptable>")
                    .doesNotContain("60,0");
        } finally {
            Locale.setDefault(previous);
        }
    }

    @Test
    void testDeclarationAndIndentation() throws IOException {
        String xml = new String(writer.toBytes(document()), StandardCharsets.UTF_8);

        assertThat(xml).matches("(?s)<\\?xml version=['\"]1\\.0['\"] encoding=['\"]UTF-8['\"]\\?>.*");
        assertThat(xml).contains("<DoseObjectives Version=\"1.0\" xmlns:xsi=\"http://www.w3.org/2001/XMLSchema-instance\">");
        assertThat(xml).contains("\n  <MeasureGroup ID=\"T1\">");
        assertThat(xml).contains("\n    <Prescription Version=\"1.10\">");
        assertThat(xml).contains("\n      <MeasureItem ID=\"A\">");
        assertThat(xml).contains("\n        <Priority>1</Priority>");
        assertThat(xml.strip()).endsWith("</DoseObjectives>");
    }

    @Test
    void testWellFormedAndEscaped() throws Exception {
        byte[] bytes = writer.toBytes(document());

        Document dom = DocumentBuilderFactory.newInstance().newDocumentBuilder().parse(new ByteArrayInputStream(bytes));
        Element root = dom.getDocumentElement();
        assertThat(root.getTagName()).isEqualTo("DoseObjectives");

        Element preview = (Element) root.getElementsByTagName("Preview").item(0);
        assertThat(preview.getAttribute("Type")).isEqualTo("DoseObjectives");
        assertThat(preview.getAttribute("ApprovalStatus")).isEqualTo("Unapproved");
        assertThat(preview.getAttribute("ApprovalHistory")).isEqualTo("Created [  March 05 2024 14:07:09:123 ]");

        Element second = (Element) root.getElementsByTagName("MeasureItem").item(1);
        assertThat(second.getAttribute("ID")).isEqualTo("Heart & Co");
        assertThat(second.getElementsByTagName("StructureCode").getLength()).isZero();
        assertThat(second.getElementsByTagName("TypeSpecifier").getLength()).isZero();

        Element code = (Element) root.getElementsByTagName("StructureCode").item(0);
        assertThat(code.getAttribute("Code")).isEqualTo("1234");
        assertThat(code.getAttribute("CodeScheme")).isEqualTo("FMA");
        assertThat(code.getAttribute("CodeSchemeVersion")).isEqualTo("3.2");
    }

    @Test
    void testWriteFileCreatesParentsAndRespectsOverwrite(@TempDir Path tempDir) throws IOException {
        Path target = tempDir.resolve("out/nested/plan.xml");

        writer.writeFile(document(), target, false);
        assertThat(target).exists();
        long size = Files.size(target);

        assertThatThrownBy(() -> writer.writeFile(document(), target, false))
                .isInstanceOf(IOException.class)
                .hasMessageContaining("already exists");

        writer.writeFile(document(), target, true);
        assertThat(Files.size(target)).isEqualTo(size);
    }
}
