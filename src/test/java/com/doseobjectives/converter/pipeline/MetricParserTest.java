package com.doseobjectives.converter.pipeline;

import com.doseobjectives.converter.model.Metric;
import com.doseobjectives.converter.model.MetricFamily;
import com.doseobjectives.converter.model.Quantity;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;

import static org.assertj.core.api.Assertions.*;

/**
 * Unit tests for MetricParser.
 */
class MetricParserTest {

    private final MetricParser parser = new MetricParser();

    @Test
    void testFixedFormNames() {
        assertThat(parser.parse("Dmean")).contains(Metric.of(MetricFamily.DMEAN));
        assertThat(parser.parse("DMAX")).contains(Metric.of(MetricFamily.DMAX));
        assertThat(parser.parse("dmin")).contains(Metric.of(MetricFamily.DMIN));
    }

    @Test
    void testFixedFormWithReportingUnit() {
        Metric mean = parser.parse("Mean [Gy]").orElseThrow();
        assertThat(mean.getFamily()).isEqualTo(MetricFamily.DMEAN);
        assertThat(mean.getReportUnit()).contains("Gy");
        assertThat(mean.reportsAbsoluteUnits()).contains(true);

        Metric max = parser.parse("Max [%]").orElseThrow();
        assertThat(max.getFamily()).isEqualTo(MetricFamily.DMAX);
        assertThat(max.reportsAbsoluteUnits()).contains(false);
    }

    @Test
    void testBracketedParameterForms() {
        Metric v = parser.parse("V[x]").orElseThrow();
        assertThat(v.getFamily()).isEqualTo(MetricFamily.V);
        assertThat(v.requiresEvaluationPoint()).isTrue();
        assertThat(v.getReportUnit()).isEmpty();

        Metric d = parser.parse("D [x] [Gy]").orElseThrow();
        assertThat(d.getFamily()).isEqualTo(MetricFamily.D);
        assertThat(d.getReportUnit()).contains("Gy");
    }

    @Test
    void testInlineVolumeAtDose() {
        Metric metric = parser.parse("V20Gy [%]").orElseThrow();

        assertThat(metric.getFamily()).isEqualTo(MetricFamily.V);
        assertThat(metric.getInlineParameter()).contains(new Quantity(new BigDecimal("20"), "Gy"));
        assertThat(metric.getReportUnit()).contains("%");
        assertThat(metric.requiresEvaluationPoint()).isFalse();
    }

    @Test
    void testInlineDoseAtVolume() {
        Metric cc = parser.parse("D2cc [Gy]").orElseThrow();
        assertThat(cc.getFamily()).isEqualTo(MetricFamily.D);
        assertThat(cc.getInlineParameter()).contains(new Quantity(new BigDecimal("2"), "cc"));

        Metric percent = parser.parse("D95% [%]").orElseThrow();
        assertThat(percent.getInlineParameter()).contains(new Quantity(new BigDecimal("95"), "%"));
        assertThat(percent.reportsAbsoluteUnits()).contains(false);
    }

    @Test
    void testInlineDecimalComma() {
        Metric metric = parser.parse("V5,5Gy [cc]").orElseThrow();
        assertThat(metric.getInlineParameter()).contains(new Quantity(new BigDecimal("5.5"), "Gy"));
    }

    @Test
    void testRejectsUnsupportedIndices() {
        assertThat(parser.parse("CI")).isEmpty();
        assertThat(parser.parse("HI [%]")).isEmpty();
        assertThat(parser.describeRejection("GI")).contains("'GI'");
    }

    @Test
    void testRejectsBlankAndUnknown() {
        assertThat(parser.parse("")).isEmpty();
        assertThat(parser.parse(null)).isEmpty();
        assertThat(parser.parse("Dmedian")).isEmpty();
        assertThat(parser.parse("V[y]")).isEmpty();
        assertThat(parser.describeRejection(" ")).isEqualTo("DVH Objective is required");
        assertThat(parser.describeRejection("foo")).startsWith("unrecognized DVH objective");
    }
}
