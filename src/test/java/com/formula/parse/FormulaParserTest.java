package com.formula.parse;

import com.formula.ast.CellRef;
import com.formula.ast.Expr;
import com.formula.ast.ExprDumper;
import com.formula.ast.RangeRef;
import com.formula.exception.SyntaxException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.junit.jupiter.params.provider.ValueSource;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for FormulaParser.
 */
class FormulaParserTest {

    private FormulaParser parser;

    @BeforeEach
    void setUp() {
        parser = new FormulaParser();
    }

    @ParameterizedTest
    @DisplayName("Should build expression trees")
    @CsvSource(delimiter = '|', quoteCharacter = '"', value = {
            "'foobar'|literal(foobar)",
            "42|number(42)",
            "2.5|number(2.5)",
            "-42|unary(number(42), -)",
            "'foo' & 'bar'|binary(literal(foo), literal(bar), &)",
            "1+1*2|binary(number(1), binary(number(1), number(2), *), +)",
            "(1+1)*2|binary(binary(number(1), number(1), +), number(2), *)",
            "1-2-3|binary(binary(number(1), number(2), -), number(3), -)",
            "2^3^2|binary(number(2), binary(number(3), number(2), ^), ^)",
            "-2^2|binary(unary(number(2), -), number(2), ^)",
            "5%|unary(number(5), %)",
            "100 ^ 1%|binary(number(100), unary(number(1), %), ^)",
            "-A1%|unary(unary(cell(A1, false, false), %), -)",
            "a & b + 1|binary(identifier(a), binary(identifier(b), number(1), +), &)",
            "1 < 2 = true|binary(binary(number(1), number(2), <), identifier(true), =)",
            "one()|call(identifier(one), args: )",
            "test(1+1, 42)|call(identifier(test), args: binary(number(1), number(1), +), number(42))",
            "A2|cell(A2, false, false)",
            "$A2|cell(A2, true, false)",
            "$A$2|cell(A2, true, true)",
            "A1:A1000|range(cell(A1, false, false), cell(A1000, false, false))",
            "Sheet2!B3|cell(Sheet2!B3, false, false)",
            "'My Sheet'!A1:B2|range(cell(My Sheet!A1, false, false), cell(My Sheet!B2, false, false))",
            "=SUM(A1:A3)|call(identifier(SUM), args: range(cell(A1, false, false), cell(A3, false, false)))",
            "total|identifier(total)"
    })
    void shouldParse(String formula, String expected) {
        assertEquals(expected, ExprDumper.dump(parser.parse(formula)));
    }

    @Test
    @DisplayName("Identifier followed by a parenthesis is a call target even if it looks like an address")
    void shouldPreferCallOverAddress() {
        assertEquals("call(identifier(LOG10), args: number(100))", ExprDumper.dump(parser.parse("LOG10(100)")));
    }

    @Test
    @DisplayName("Should propagate the sheet of the start to the end of a range")
    void shouldPropagateSheetToRangeEnd() {
        Expr expr = parser.parse("Data!B2:C9");

        RangeRef range = assertInstanceOf(RangeRef.class, expr);
        assertEquals("Data", range.start().position().sheet());
        assertEquals("Data", range.end().position().sheet());
    }

    @Test
    @DisplayName("Should keep absolute markers on cell references")
    void shouldKeepAbsoluteMarkers() {
        CellRef cell = assertInstanceOf(CellRef.class, parser.parse("$C7"));

        assertTrue(cell.absoluteColumn());
        assertFalse(cell.absoluteRow());
    }

    @ParameterizedTest
    @DisplayName("Should reject invalid formulas")
    @ValueSource(strings = {
            "1 +",
            "(1+2",
            "1 2",
            "sum(1, 2",
            "sum(1,)",
            "Sheet1!foo",
            "A1:foo",
            "1 ? 2",
            "$foo",
            "A$",
            "$1",
            "$foo(1)",
            "Sheet1!$foo",
            "\"open",
            "Sheet1!A1:Sheet2!B2",
            ""
    })
    void shouldRejectInvalidFormulas(String formula) {
        assertThrows(SyntaxException.class, () -> parser.parse(formula));
    }

    @Test
    @DisplayName("Should report position of the offending token")
    void shouldReportPosition() {
        SyntaxException ex = assertThrows(SyntaxException.class, () -> parser.parse("1 + )"));
        assertEquals(1, ex.getLine());
        assertEquals(5, ex.getColumn());

        SyntaxException multiline = assertThrows(SyntaxException.class, () -> parser.parse("1 +\n )"));
        assertEquals(2, multiline.getLine());
        assertEquals(2, multiline.getColumn());
    }

    @Test
    @DisplayName("Parser can be reused for several formulas")
    void shouldReuseParser() {
        assertEquals("number(1)", ExprDumper.dump(parser.parse("1")));
        assertThrows(SyntaxException.class, () -> parser.parse("1 +"));
        assertEquals("number(2)", ExprDumper.dump(parser.parse("2")));
    }
}
