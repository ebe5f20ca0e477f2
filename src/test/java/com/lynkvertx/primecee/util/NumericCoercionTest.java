package com.lynkvertx.primecee.util;

import org.junit.jupiter.api.Test;

import java.math.BigDecimal;

import static org.assertj.core.api.Assertions.assertThat;

class NumericCoercionTest {

    @Test
    void numbersPassThrough() {
        assertThat(NumericCoercion.toNumber(42)).isEqualTo(42d);
        assertThat(NumericCoercion.toNumber(new BigDecimal("12.50"))).isEqualTo(12.5d);
    }

    @Test
    void frenchFormattedStringsAreParsed() {
        assertThat(NumericCoercion.toNumber("1 250,5")).isEqualTo(1250.5d);
        assertThat(NumericCoercion.toNumber("1 250,5")).isEqualTo(1250.5d);
        assertThat(NumericCoercion.toNumber("1 000")).isEqualTo(1000d);
        assertThat(NumericCoercion.toNumber(" 12.75 ")).isEqualTo(12.75d);
    }

    @Test
    void unparseableOrNonFiniteValuesAreAbsent() {
        assertThat(NumericCoercion.toNumber(null)).isNull();
        assertThat(NumericCoercion.toNumber("")).isNull();
        assertThat(NumericCoercion.toNumber("abc")).isNull();
        assertThat(NumericCoercion.toNumber("12 m²")).isNull();
        assertThat(NumericCoercion.toNumber("NaN")).isNull();
        assertThat(NumericCoercion.toNumber("Infinity")).isNull();
        assertThat(NumericCoercion.toNumber(Double.POSITIVE_INFINITY)).isNull();
        assertThat(NumericCoercion.toNumber(true)).isNull();
    }

    @Test
    void positiveAndNonNegativeFilters() {
        assertThat(NumericCoercion.toPositiveNumber("0")).isNull();
        assertThat(NumericCoercion.toPositiveNumber(-3)).isNull();
        assertThat(NumericCoercion.toPositiveNumber("3,5")).isEqualTo(3.5d);
        assertThat(NumericCoercion.toNonNegativeNumber(0)).isEqualTo(0d);
        assertThat(NumericCoercion.toNonNegativeNumber(-0.1)).isNull();
    }
}
