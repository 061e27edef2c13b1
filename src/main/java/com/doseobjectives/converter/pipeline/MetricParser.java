package com.doseobjectives.converter.pipeline;

import com.doseobjectives.converter.model.Metric;
import com.doseobjectives.converter.model.MetricFamily;
import com.doseobjectives.converter.model.Quantity;

import java.math.BigDecimal;
import java.util.Locale;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Parses the "DVH Objective" cell into a {@link Metric}.
 * <p>
 * Accepted forms:
 * <ul>
 *   <li>fixed-form: {@code Dmean}, {@code Dmax}, {@code Dmin}, also written {@code Mean [Gy]},
 *       {@code Max [%]}, {@code Min [Gy]}</li>
 *   <li>bracketed parameter: {@code V[x]}, {@code D[x]}, optionally followed by a reporting unit</li>
 *   <li>inline parameter: {@code V20Gy [%]}, {@code D2cc [Gy]}, {@code D95% [%]}</li>
 * </ul>
 * Conformity, homogeneity and gradient indices (CI, HI, GI, CV) have no DoseObjectives
 * representation and are rejected.
 */
public class MetricParser {

    private static final String NUMBER = "(\\d+(?:[.,]\\d+)?)";

    private static final Pattern FIXED_FORM = Pattern.compile(
            "^D?(mean|max|min)(?:\\s*\\[\\s*(Gy|%)\\s*])?$", Pattern.CASE_INSENSITIVE);
    private static final Pattern BRACKETED_PARAMETER = Pattern.compile(
            "^([VD])\\s*\\[\\s*x\\s*](?:\\s*\\[\\s*(Gy|%|cc)\\s*])?$", Pattern.CASE_INSENSITIVE);
    private static final Pattern INLINE_VOLUME_AT_DOSE = Pattern.compile(
            "^V\\s*" + NUMBER + "\\s*(c?Gy|%)\\s*\\[\\s*(%|cc)\\s*]$", Pattern.CASE_INSENSITIVE);
    private static final Pattern INLINE_DOSE_AT_VOLUME = Pattern.compile(
            "^D\\s*" + NUMBER + "\\s*(cc|%)\\s*\\[\\s*(Gy|%)\\s*]$", Pattern.CASE_INSENSITIVE);
    private static final Pattern UNSUPPORTED_INDEX = Pattern.compile(
            "\\b(CI|HI|GI|CV)\\b", Pattern.CASE_INSENSITIVE);

    /**
     * @param objective the trimmed cell text
     * @return the metric, or empty when the text is blank or not a supported objective
     */
    public Optional<Metric> parse(String objective) {
        if (objective == null || objective.isBlank()) {
            return Optional.empty();
        }
        String s = objective.strip();
        if (UNSUPPORTED_INDEX.matcher(s).find()) {
            return Optional.empty();
        }

        Matcher m = FIXED_FORM.matcher(s);
        if (m.matches()) {
            MetricFamily family = fixedFamily(m.group(1));
            return Optional.of(new Metric(family, null, canonicalReportUnit(m.group(2))));
        }

        m = BRACKETED_PARAMETER.matcher(s);
        if (m.matches()) {
            MetricFamily family = m.group(1).equalsIgnoreCase("V") ? MetricFamily.V : MetricFamily.D;
            return Optional.of(new Metric(family, null, canonicalReportUnit(m.group(2))));
        }

        m = INLINE_VOLUME_AT_DOSE.matcher(s);
        if (m.matches()) {
            return Optional.of(inline(MetricFamily.V, m));
        }

        m = INLINE_DOSE_AT_VOLUME.matcher(s);
        if (m.matches()) {
            return Optional.of(inline(MetricFamily.D, m));
        }
        return Optional.empty();
    }

    /**
     * Explains why {@link #parse(String)} rejected a value, for row error messages.
     */
    public String describeRejection(String objective) {
        if (objective == null || objective.isBlank()) {
            return "DVH Objective is required";
        }
        Matcher index = UNSUPPORTED_INDEX.matcher(objective);
        if (index.find()) {
            return "index '" + index.group(1).toUpperCase(Locale.ROOT) + "' has no dose objective representation";
        }
        return "unrecognized DVH objective; expected Dmean, Dmax, Dmin, V[x], D[x] or an inline form such as V20Gy [%]";
    }

    private static Metric inline(MetricFamily family, Matcher m) {
        BigDecimal value = new BigDecimal(m.group(1).replace(',', '.'));
        String unit = family.canonicalUnit(m.group(2)).orElse(m.group(2));
        return new Metric(family, new Quantity(value, unit), canonicalReportUnit(m.group(3)));
    }

    private static MetricFamily fixedFamily(String word) {
        switch (word.toLowerCase(Locale.ROOT)) {
            case "max":
                return MetricFamily.DMAX;
            case "min":
                return MetricFamily.DMIN;
            default:
                return MetricFamily.DMEAN;
        }
    }

    private static String canonicalReportUnit(String unit) {
        if (unit == null) {
            return null;
        }
        if (unit.equalsIgnoreCase("gy")) {
            return "Gy";
        }
        return unit.toLowerCase(Locale.ROOT);
    }
}
