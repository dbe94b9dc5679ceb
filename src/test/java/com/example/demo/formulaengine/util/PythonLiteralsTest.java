package com.example.demo.formulaengine.util;

import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.LocalDateTime;

import static org.junit.jupiter.api.Assertions.*;

public class PythonLiteralsTest {

    @Test
    public void testStringsAreEscaped() {
        assertEquals("'plain'", PythonLiterals.string("plain"));
        assertEquals("'it\\'s'", PythonLiterals.string("it's"));
        assertEquals("'a\\\\b'", PythonLiterals.string("a\\b"));
        assertEquals("'line\\nbreak'", PythonLiterals.string("line\nbreak"));
        assertEquals("'\\x01'", PythonLiterals.string("\u0001"));
    }

    @Test
    public void testScalarValues() {
        assertEquals("None", PythonLiterals.value(null));
        assertEquals("True", PythonLiterals.value(Boolean.TRUE));
        assertEquals("2.5", PythonLiterals.value(2.5));
        assertEquals("float('nan')", PythonLiterals.value(Double.NaN));
        assertEquals("float('-inf')", PythonLiterals.value(Double.NEGATIVE_INFINITY));
        assertEquals("0.10", PythonLiterals.value(new BigDecimal("0.10")));
        assertEquals("42", PythonLiterals.value(42));
        assertEquals("'text'", PythonLiterals.value("text"));
    }

    @Test
    public void testDatesBecomeDatetimeConstructors() {
        assertEquals("datetime.datetime(2024, 3, 5, 14, 30, 0)",
                PythonLiterals.value(LocalDateTime.of(2024, 3, 5, 14, 30)));
    }
}
