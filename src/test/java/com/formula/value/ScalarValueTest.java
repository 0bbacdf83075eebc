package com.formula.value;

import com.formula.exception.IncompatibleTypeException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.LocalDateTime;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for scalar coercion and comparison.
 */
class ScalarValueTest {

    @Test
    @DisplayName("Blank coerces to zero, empty text and false")
    void blankCoercion() {
        assertEquals(new NumberValue(0), Blank.INSTANCE.toNumber());
        assertEquals("", Blank.INSTANCE.toText().value());
        assertEquals(BooleanValue.FALSE, Blank.INSTANCE.toBool());
        assertTrue(Blank.INSTANCE.equal(Blank.INSTANCE));
        assertFalse(Blank.INSTANCE.less(Blank.INSTANCE));
    }

    @Test
    @DisplayName("Numbers render in their shortest plain form")
    void numberRendering() {
        assertEquals("2", new NumberValue(2).toText().value());
        assertEquals("2.5", new NumberValue(2.5).toText().value());
        assertEquals("-3", new NumberValue(-3).toString());
        assertEquals("1000000", new NumberValue(1e6).toString());
        assertEquals("0.001", new NumberValue(0.001).toString());
    }

    @Test
    @DisplayName("Number truthiness")
    void numberToBool() {
        assertEquals(BooleanValue.TRUE, new NumberValue(-1).toBool());
        assertEquals(BooleanValue.FALSE, new NumberValue(0).toBool());
    }

    @Test
    @DisplayName("Text parses as number or gives #N/A")
    void textToNumber() {
        assertEquals(new NumberValue(12.5), new TextValue(" 12.5 ").toNumber());
        assertEquals(ErrorValue.of(ErrorCode.NA), new TextValue("abc").toNumber());
        assertEquals(BooleanValue.FALSE, new TextValue("").toBool());
        assertEquals(BooleanValue.TRUE, new TextValue("x").toBool());
    }

    @Test
    @DisplayName("Booleans convert to 0/1 and order false before true")
    void booleanCoercion() {
        assertEquals(new NumberValue(1), BooleanValue.TRUE.toNumber());
        assertEquals("false", BooleanValue.FALSE.toText().value());
        assertTrue(BooleanValue.FALSE.less(BooleanValue.TRUE));
        assertFalse(BooleanValue.TRUE.less(BooleanValue.FALSE));
    }

    @Test
    @DisplayName("Dates convert to epoch seconds and ISO date text")
    void dateCoercion() {
        DateValue date = new DateValue(LocalDateTime.of(1970, 1, 2, 0, 0));

        assertEquals(new NumberValue(86400), date.toNumber());
        assertEquals("1970-01-02", date.toText().value());
        assertEquals(BooleanValue.TRUE, date.toBool());
        assertEquals(BooleanValue.FALSE, new DateValue(LocalDateTime.of(1970, 1, 1, 0, 0)).toBool());
        assertTrue(new DateValue(LocalDateTime.of(1969, 12, 31, 0, 0)).less(date));
    }

    @Test
    @DisplayName("Errors convert to themselves and display their code")
    void errorCoercion() {
        ErrorValue err = ErrorValue.of(ErrorCode.DIV0);

        assertSame(err, err.toNumber());
        assertSame(err, err.toBool());
        assertEquals("#DIV/0!", err.toText().value());
        assertEquals(ValueKind.ERROR, err.kind());
        assertTrue(err.isError());
        assertTrue(err.equal(ErrorValue.of(ErrorCode.DIV0)));
        assertFalse(err.equal(ErrorValue.of(ErrorCode.NA)));
        assertThrows(IncompatibleTypeException.class, () -> err.less(ErrorValue.of(ErrorCode.NA)));
    }

    @Test
    @DisplayName("Error codes display as in spreadsheets")
    void errorCodes() {
        assertEquals("#NULL!", ErrorValue.of(ErrorCode.NULL).toString());
        assertEquals("#VALUE!", ErrorValue.of(ErrorCode.VALUE).toString());
        assertEquals("#REF!", ErrorValue.of(ErrorCode.REF).toString());
        assertEquals("#NAME?", ErrorValue.of(ErrorCode.NAME).toString());
        assertEquals("#NUM!", ErrorValue.of(ErrorCode.NUM).toString());
        assertEquals("#N/A", ErrorValue.of(ErrorCode.NA).toString());
    }

    @Test
    @DisplayName("Comparing different variants is an error")
    void crossVariantComparison() {
        assertThrows(IncompatibleTypeException.class, () -> new NumberValue(1).equal(new TextValue("1")));
        assertThrows(IncompatibleTypeException.class, () -> new TextValue("a").less(BooleanValue.TRUE));
        assertThrows(IncompatibleTypeException.class, () -> Blank.INSTANCE.equal(new NumberValue(0)));
    }

    @Test
    @DisplayName("Type names")
    void typeNames() {
        assertEquals("blank", Blank.INSTANCE.typeName());
        assertEquals("number", new NumberValue(1).typeName());
        assertEquals("text", new TextValue("").typeName());
        assertEquals("boolean", BooleanValue.TRUE.typeName());
        assertEquals("error", ErrorValue.of(ErrorCode.NA).typeName());
    }
}
