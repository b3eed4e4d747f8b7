package com.jdc.catalog_manager.domain.entity;

import jakarta.persistence.Column;
import jakarta.persistence.Embeddable;
import lombok.AccessLevel;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.util.Objects;

/**
 * Amount of an ingredient in a recipe. The unit is an opaque label,
 * no conversion between units is attempted.
 */
@Embeddable
@Getter
@EqualsAndHashCode
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class Quantity {

    public static final int MAX_UNIT_LENGTH = 50;

    @Column(name = "quantity_value", nullable = false, precision = 8, scale = 2)
    private BigDecimal value;

    @Column(name = "quantity_unit", nullable = false, length = MAX_UNIT_LENGTH)
    private String unit;

    private Quantity(BigDecimal value, String unit) {
        this.value = value;
        this.unit = unit;
    }

    public static Quantity of(BigDecimal value, String unit) {
        Objects.requireNonNull(value, "quantity value");
        if (value.signum() < 0) {
            throw new IllegalArgumentException("Quantity value cannot be negative: " + value);
        }
        if (unit == null || unit.isBlank() || unit.length() > MAX_UNIT_LENGTH) {
            throw new IllegalArgumentException("Quantity unit must be 1-" + MAX_UNIT_LENGTH + " characters");
        }
        return new Quantity(value, unit);
    }

    @Override
    public String toString() {
        return value.toPlainString() + " " + unit;
    }
}
