package com.questrail.homeshadow.api;

import java.util.Objects;
import java.util.Optional;

/**
 * Unit qualifier of a property value, as the controller's numeric UOM code.
 *
 * <p>An absent unit is {@link #NOT_SET}, which is distinct from an explicit
 * code such as {@code "0"}.</p>
 */
public final class UnitOfMeasure
{
    public static final UnitOfMeasure NOT_SET = new UnitOfMeasure(null);

    /** Seconds; used for translated ramp rates. */
    public static final UnitOfMeasure SECONDS = new UnitOfMeasure("57");

    private final String code;

    private UnitOfMeasure(String code) {
        this.code = code;
    }

    public static UnitOfMeasure of(String code) {
        Objects.requireNonNull(code, "code");
        return new UnitOfMeasure(code);
    }

    public boolean isSet() {
        return code != null;
    }

    public Optional<String> code() {
        return Optional.ofNullable(code);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof UnitOfMeasure)) return false;
        return Objects.equals(code, ((UnitOfMeasure) o).code);
    }

    @Override
    public int hashCode() {
        return Objects.hashCode(code);
    }

    @Override
    public String toString() {
        return code == null ? "<not set>" : code;
    }
}
