package com.doseobjectives.converter.model;

import java.util.List;
import java.util.Optional;

/**
 * Metric families understood by the importer, with their DoseObjectives type codes.
 * <p>
 * Fixed-form families ({@code Dmean}, {@code Dmax}, {@code Dmin}) take no parameter.
 * Parametrized families take one: {@code V[x]} is the volume receiving dose x and
 * {@code D[x]} is the dose received by volume x. The parameter unit decides which units
 * are legal and, for {@code D[x]}, which type code is written.
 */
public enum MetricFamily {

    DMEAN("Dmean", 8, List.of()),
    DMAX("Dmax", 6, List.of()),
    DMIN("Dmin", 7, List.of()),
    V("V[x]", 3, List.of("Gy", "cGy", "%")),
    D("D[x]", 4, List.of("%", "cc"));

    private static final int DOSE_AT_ABSOLUTE_VOLUME_TYPE_CODE = 5;

    private final String label;
    private final int typeCode;
    private final List<String> parameterUnits;

    MetricFamily(String label, int typeCode, List<String> parameterUnits) {
        this.label = label;
        this.typeCode = typeCode;
        this.parameterUnits = parameterUnits;
    }

    public String getLabel() {
        return label;
    }

    public boolean isParametrized() {
        return !parameterUnits.isEmpty();
    }

    public List<String> getParameterUnits() {
        return parameterUnits;
    }

    /**
     * Importer type code for this family.
     *
     * @param parameter the metric parameter, or null for fixed-form families
     * @return the DoseObjectives {@code Type} value
     */
    public int typeCode(Quantity parameter) {
        if (this == D && parameter != null && parameter.getUnit().filter("cc"::equals).isPresent()) {
            return DOSE_AT_ABSOLUTE_VOLUME_TYPE_CODE;
        }
        return typeCode;
    }

    /**
     * Matches a unit token against the units this family accepts, ignoring case.
     *
     * @param unit the unit as written in the sheet
     * @return the canonical spelling, or empty when the unit is not accepted
     */
    public Optional<String> canonicalUnit(String unit) {
        if (unit == null) {
            return Optional.empty();
        }
        for (String accepted : parameterUnits) {
            if (accepted.equalsIgnoreCase(unit)) {
                return Optional.of(accepted);
            }
        }
        return Optional.empty();
    }
}
