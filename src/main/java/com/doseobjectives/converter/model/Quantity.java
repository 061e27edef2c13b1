package com.doseobjectives.converter.model;

import java.math.BigDecimal;
import java.util.Objects;
import java.util.Optional;

/**
 * A numeric value with an optional unit token, e.g. {@code 60Gy}, {@code 5%} or {@code 2cc}.
 * Used for evaluation points, variations and inline metric parameters.
 */
public final class Quantity {

    private final BigDecimal value;
    private final String unit;

    /**
     * @param value the numeric value, not null
     * @param unit the unit token, or null/empty when the value is unit-less
     */
    public Quantity(BigDecimal value, String unit) {
        this.value = Objects.requireNonNull(value, "value");
        this.unit = unit == null || unit.isEmpty() ? null : unit;
    }

    public BigDecimal getValue() {
        return value;
    }

    public Optional<String> getUnit() {
        return Optional.ofNullable(unit);
    }

    public Quantity withUnit(String newUnit) {
        return new Quantity(value, newUnit);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof Quantity)) {
            return false;
        }
        Quantity other = (Quantity) o;
        return value.compareTo(other.value) == 0 && Objects.equals(unit, other.unit);
    }

    @Override
    public int hashCode() {
        return Objects.hash(value.stripTrailingZeros(), unit);
    }

    @Override
    public String toString() {
        return value.toPlainString() + (unit == null ? "" : unit);
    }
}
