package com.wayq.geo;

import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.junit.jupiter.params.provider.ValueSource;

import static org.junit.jupiter.api.Assertions.*;

public class DecimalsTest {

    @ParameterizedTest
    @CsvSource({
            "100, 100",
            "10000, 10000",
            "-37.8, -37.8",
            "144.9, 144.9",
            "0.1, 0.1",
            "1.234567, 1.23457",
            "0.000001, 0",
            "-0.000001, 0",
            "-0.0, 0",
            "1609.344, 1609.344",
    })
    public void testFormat(double value, String expected) {
        assertEquals(expected, Decimals.format(value));
    }

    @ParameterizedTest
    @ValueSource(doubles = {Double.NaN, Double.POSITIVE_INFINITY, Double.NEGATIVE_INFINITY})
    public void testNonFiniteValues(double value) {
        assertThrows(IllegalArgumentException.class, () -> Decimals.format(value));
    }
}
