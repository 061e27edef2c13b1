package com.doseobjectives.converter.model;

import java.util.Objects;
import java.util.Optional;

/**
 * A parsed DVH objective: the metric family, an optional parameter written inline in the
 * objective (as in {@code V20Gy [%]}), and an optional reporting unit taken from the trailing
 * bracket.
 */
public final class Metric {

    private final MetricFamily family;
    private final Quantity inlineParameter;
    private final String reportUnit;

    public Metric(MetricFamily family, Quantity inlineParameter, String reportUnit) {
        this.family = Objects.requireNonNull(family, "family");
        this.inlineParameter = inlineParameter;
        this.reportUnit = reportUnit;
    }

    public static Metric of(MetricFamily family) {
        return new Metric(family, null, null);
    }

    public MetricFamily getFamily() {
        return family;
    }

    public Optional<Quantity> getInlineParameter() {
        return Optional.ofNullable(inlineParameter);
    }

    public Optional<String> getReportUnit() {
        return Optional.ofNullable(reportUnit);
    }

    /**
     * @return true when the parameter has to come from the Evaluation Point column
     */
    public boolean requiresEvaluationPoint() {
        return family.isParametrized() && inlineParameter == null;
    }

    /**
     * @return whether the importer should report the value in absolute units; empty when the
     *         objective names no reporting unit
     */
    public Optional<Boolean> reportsAbsoluteUnits() {
        return getReportUnit().map(unit -> !"%".equals(unit));
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof Metric)) {
            return false;
        }
        Metric other = (Metric) o;
        return family == other.family
                && Objects.equals(inlineParameter, other.inlineParameter)
                && Objects.equals(reportUnit, other.reportUnit);
    }

    @Override
    public int hashCode() {
        return Objects.hash(family, inlineParameter, reportUnit);
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder(family.getLabel());
        if (inlineParameter != null) {
            sb.append(" x=").append(inlineParameter);
        }
        if (reportUnit != null) {
            sb.append(" [").append(reportUnit).append(']');
        }
        return sb.toString();
    }
}
