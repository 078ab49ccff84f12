package com.questrail.homeshadow.api;

import java.math.BigDecimal;
import java.util.Objects;
import java.util.OptionalLong;

/**
 * PropertyValue
 * -----------------------------------------------------------------------------
 * Immutable value of an entity status or auxiliary property.
 *
 * <p>
 * The controller reports integers scaled by a decimal {@code precision}
 * ({@code 725} with precision {@code 1} is {@code 72.5}), a unit code, and
 * optionally a human-readable formatted form. The raw value may be unknown
 * (the controller sends an empty value for a device it has not heard from).
 * </p>
 *
 * <p>
 * {@link #sameValueAs(PropertyValue)} is the comparison used to decide whether
 * an update is a real transition. It ignores the formatted text, which the
 * controller may render differently for the same value.
 * </p>
 */
public final class PropertyValue
{
    private static final PropertyValue UNKNOWN = new PropertyValue(null, 0, UnitOfMeasure.NOT_SET, "");

    private final Long value;
    private final int precision;
    private final UnitOfMeasure unit;
    private final String formatted;

    private PropertyValue(Long value, int precision, UnitOfMeasure unit, String formatted) {
        if (precision < 0) {
            throw new IllegalArgumentException("precision must be >= 0");
        }
        this.value = value;
        this.precision = precision;
        this.unit = Objects.requireNonNull(unit, "unit");
        this.formatted = Objects.requireNonNull(formatted, "formatted");
    }

    public static PropertyValue of(long value) {
        return new PropertyValue(value, 0, UnitOfMeasure.NOT_SET, "");
    }

    public static PropertyValue of(long value, int precision, UnitOfMeasure unit, String formatted) {
        return new PropertyValue(value, precision, unit, formatted);
    }

    public static PropertyValue unknown() {
        return UNKNOWN;
    }

    public static PropertyValue unknown(UnitOfMeasure unit, String formatted) {
        return new PropertyValue(null, 0, unit, formatted);
    }

    public OptionalLong value() {
        return value == null ? OptionalLong.empty() : OptionalLong.of(value);
    }

    public boolean isKnown() {
        return value != null;
    }

    public int precision() {
        return precision;
    }

    public UnitOfMeasure unit() {
        return unit;
    }

    /**
     * Formatted text as reported by the controller; empty when none was sent.
     */
    public String formatted() {
        return formatted;
    }

    /**
     * The decimal reading of the raw value, e.g. {@code "72.5"}; empty when the
     * value is unknown.
     */
    public String decimalText() {
        return value == null ? "" : BigDecimal.valueOf(value, precision).toPlainString();
    }

    public PropertyValue withUnit(UnitOfMeasure newUnit) {
        return new PropertyValue(value, precision, newUnit, formatted);
    }

    public PropertyValue withFormatted(String newFormatted) {
        return new PropertyValue(value, precision, unit, newFormatted);
    }

    public boolean sameValueAs(PropertyValue other) {
        return other != null
                && Objects.equals(value, other.value)
                && precision == other.precision
                && unit.equals(other.unit);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof PropertyValue)) return false;
        PropertyValue that = (PropertyValue) o;
        return sameValueAs(that) && formatted.equals(that.formatted);
    }

    @Override
    public int hashCode() {
        return Objects.hash(value, precision, unit, formatted);
    }

    @Override
    public String toString() {
        String text = value == null ? "?" : decimalText();
        return formatted.isEmpty() ? text + " [" + unit + "]" : text + " [" + unit + "] '" + formatted + "'";
    }
}
