package com.creditsim.common.model;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;

import static org.junit.jupiter.api.Assertions.*;

class AmountsTest {

    @Test
    @DisplayName("truncate() keeps cents and never rounds up")
    void truncateDown() {
        assertEquals(new BigDecimal("12.34"), Amounts.truncate(new BigDecimal("12.349")));
        assertEquals(new BigDecimal("0.99"), Amounts.truncate(0.999));
        assertEquals(new BigDecimal("5.00"), Amounts.truncate(5));
    }

    @Test
    @DisplayName("parse() accepts numbers and numeric strings")
    void parseLenient() {
        assertEquals(0, new BigDecimal("42").compareTo(Amounts.parse(42)));
        assertEquals(0, new BigDecimal("3.5").compareTo(Amounts.parse(3.5)));
        assertEquals(0, new BigDecimal("7.25").compareTo(Amounts.parse(" 7.25 ")));
    }

    @Test
    @DisplayName("parse() → null for null or garbage")
    void parseRejects() {
        assertNull(Amounts.parse(null));
        assertNull(Amounts.parse("ten"));
    }

    @Test
    @DisplayName("min() and max()")
    void minMax() {
        BigDecimal a = new BigDecimal("1.00");
        BigDecimal b = new BigDecimal("2.00");
        assertSame(a, Amounts.min(a, b));
        assertSame(b, Amounts.max(a, b));
    }
}
