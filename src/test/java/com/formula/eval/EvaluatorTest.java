package com.formula.eval;

import com.formula.ast.BinaryOperator;
import com.formula.context.Environment;
import com.formula.context.ReferenceTracker;
import com.formula.context.WorkbookContext;
import com.formula.exception.CircularReferenceException;
import com.formula.exception.NotCallableException;
import com.formula.exception.UndefinedIdentifierException;
import com.formula.function.Builtins;
import com.formula.grid.InMemorySheet;
import com.formula.grid.InMemoryWorkbook;
import com.formula.layout.Position;
import com.formula.parse.FormulaParser;
import com.formula.value.ArrayValue;
import com.formula.value.BooleanValue;
import com.formula.value.ErrorCode;
import com.formula.value.ErrorValue;
import com.formula.value.NumberValue;
import com.formula.value.TextValue;
import com.formula.value.Value;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for Evaluator.
 */
class EvaluatorTest {

    private final FormulaParser parser = new FormulaParser();
    private final Evaluator evaluator = new Evaluator();
    private Environment env;
    private InMemoryWorkbook workbook;
    private InMemorySheet sheet1;

    @BeforeEach
    void setUp() {
        env = new Environment(Builtins.environment());
        env.define("x", new NumberValue(42));

        workbook = new InMemoryWorkbook();
        sheet1 = workbook.addSheet("Sheet1");
        sheet1.setValue(Position.of(1, 1), new NumberValue(1));
        sheet1.setValue(Position.of(1, 2), new NumberValue(2));
        sheet1.setValue(Position.of(1, 3), new NumberValue(3));
        sheet1.setFormula(Position.of(2, 1), parser.parse("=A1+A2"));
        sheet1.setValue(Position.of(2, 2), new TextValue("foo"));

        InMemorySheet sheet2 = workbook.addSheet("Sheet2");
        sheet2.setValue(Position.of(1, 1), new NumberValue(10));
        sheet2.setFormula(Position.of(2, 1), parser.parse("A1 * 2"));
    }

    private Value eval(String formula) {
        return evaluator.evaluate(parser.parse(formula), new WorkbookContext(env, workbook));
    }

    private static NumberValue n(double value) {
        return new NumberValue(value);
    }

    @ParameterizedTest(name = "{0} = {1}")
    @DisplayName("Should evaluate arithmetic")
    @CsvSource(delimiter = '|', value = {
            "1 + 2 * 3|7",
            "(1 + 2) * 3|9",
            "2 ^ 3 ^ 2|512",
            "-2 ^ 2|4",
            "10 - 4 - 3|3",
            "7 / 2|3.5",
            "-A1 + 10|9",
            "A1 + A2 * A3|7",
            "x / 2|21",
            "true + 1|2",
            "50%|0.5",
            "A2%|0.02",
            "-A3%|-0.03",
            "2 ^ 100%|2"
    })
    void shouldEvaluateArithmetic(String formula, double expected) {
        assertEquals(n(expected), eval(formula));
    }

    @Test
    @DisplayName("Should concatenate and compare")
    void shouldConcatenateAndCompare() {
        assertEquals(new TextValue("a1"), eval("\"a\" & 1"));
        assertEquals(new TextValue("foo!"), eval("B2 & '!'"));
        assertEquals(BooleanValue.TRUE, eval("1 < 2"));
        assertEquals(BooleanValue.TRUE, eval("'a' < 'b'"));
        assertEquals(BooleanValue.FALSE, eval("A1 <> 1"));
        assertEquals(BooleanValue.TRUE, eval("A3 >= 3"));
    }

    @Test
    @DisplayName("Comparing different types gives #VALUE!")
    void shouldRejectMixedComparison() {
        assertEquals(ErrorValue.of(ErrorCode.VALUE), eval("1 = '1'"));
    }

    @Test
    @DisplayName("Bad data gives error values")
    void shouldProduceErrorValues() {
        assertEquals(ErrorValue.of(ErrorCode.DIV0), eval("1 / 0"));
        assertEquals(ErrorValue.of(ErrorCode.NUM), eval("(0 - 8) ^ 0.5"));
        assertEquals(ErrorValue.of(ErrorCode.NA), eval("'abc' + 1"));
        assertEquals(ErrorValue.of(ErrorCode.VALUE), eval("-'abc'"));
        assertEquals(ErrorValue.of(ErrorCode.VALUE), eval("'abc'%"));
        assertEquals(ErrorValue.of(ErrorCode.DIV0), eval("(1/0)%"));
    }

    @Test
    @DisplayName("An error on the left is returned without evaluating the right")
    void shouldShortCircuitOnError() {
        assertEquals(ErrorValue.of(ErrorCode.DIV0), eval("1/0 + nope"));
        assertEquals(ErrorValue.of(ErrorCode.DIV0), eval("2 * (1/0) + 'abc'"));
        assertEquals(ErrorValue.of(ErrorCode.NA), eval("1 + ('x' + 1)"));
    }

    @Test
    @DisplayName("Unknown names fail, unknown functions give #NAME?")
    void shouldHandleUndefinedNames() {
        assertThrows(UndefinedIdentifierException.class, () -> eval("nope + 1"));
        assertEquals(ErrorValue.of(ErrorCode.NAME), eval("nope(1)"));
    }

    @Test
    @DisplayName("Calling something else than a function fails")
    void shouldRejectCallOnValue() {
        assertThrows(NotCallableException.class, () -> eval("x(1)"));
    }

    @Test
    @DisplayName("Should call builtins in both cases")
    void shouldCallBuiltins() {
        assertEquals(n(6), eval("sum(A1:A3)"));
        assertEquals(n(6), eval("SUM(A1:A3)"));
        assertEquals(n(2), eval("if(A1 > 0, 2, 3)"));
    }

    @Test
    @DisplayName("Should evaluate formula cells and cross-sheet references")
    void shouldEvaluateFormulaCells() {
        assertEquals(n(3), eval("B1"));
        assertEquals(n(11), eval("Sheet2!A1 + A1"));
        assertEquals(n(20), eval("Sheet2!B1"));
        assertEquals(ErrorValue.of(ErrorCode.REF), eval("Sheet9!A1"));
        assertEquals(ErrorValue.of(ErrorCode.REF), eval("Sheet9!A1:A2"));
    }

    @Test
    @DisplayName("Empty cells are blank and count as zero")
    void shouldReadEmptyCells() {
        assertEquals(n(1), eval("Z99 + 1"));
    }

    @Test
    @DisplayName("Ranges evaluate to arrays and combine element-wise")
    void shouldBroadcastArrays() {
        assertEquals(ArrayValue.column(n(1), n(2), n(3)), eval("A1:A3"));
        assertEquals(ArrayValue.column(n(1), n(2), n(3)), eval("A3:A1"));
        assertEquals(ArrayValue.column(n(2), n(4), n(6)), eval("A1:A3 * 2"));
        assertEquals(ArrayValue.column(n(-1), n(-2), n(-3)), eval("-A1:A3"));
        assertEquals(ArrayValue.column(n(2), n(4), n(6)), eval("A1:A3 + A1:A3"));
        assertEquals(ArrayValue.column(BooleanValue.FALSE, BooleanValue.TRUE, BooleanValue.TRUE), eval("A1:A3 > 1"));
    }

    @Test
    @DisplayName("A circular reference fails when cycle detection is strict")
    void shouldDetectCycles() {
        sheet1.setFormula(Position.of(3, 1), parser.parse("C2 + 1"));
        sheet1.setFormula(Position.of(3, 2), parser.parse("C1"));

        WorkbookContext ctx = new WorkbookContext(env, workbook, new ReferenceTracker(true), evaluator);

        assertThrows(CircularReferenceException.class, () -> evaluator.evaluate(parser.parse("C1"), ctx));
    }

    @Test
    @DisplayName("A circular reference gives #REF! when cycle detection is relaxed")
    void shouldReportCyclesAsRef() {
        sheet1.setFormula(Position.of(3, 1), parser.parse("C2 + 1"));
        sheet1.setFormula(Position.of(3, 2), parser.parse("C1"));

        WorkbookContext ctx = new WorkbookContext(env, workbook, new ReferenceTracker(false), evaluator);

        assertEquals(ErrorValue.of(ErrorCode.REF), evaluator.evaluate(parser.parse("C1"), ctx));
        assertEquals(n(3), evaluator.evaluate(parser.parse("B1"), ctx));
    }

    @Test
    @DisplayName("A cell read twice in one formula is not a cycle")
    void shouldAllowRepeatedReads() {
        assertEquals(n(6), eval("B1 + B1"));
    }

    @Test
    @DisplayName("Should compare scalars with comparison operators only")
    void shouldCompare() {
        assertTrue(Evaluator.compare(BinaryOperator.LE, n(1), n(1)));
        assertTrue(Evaluator.compare(BinaryOperator.GT, n(2), n(1)));
        assertFalse(Evaluator.compare(BinaryOperator.GE, n(0), n(1)));
        assertThrows(IllegalArgumentException.class,
                () -> Evaluator.compare(BinaryOperator.ADD, n(1), n(1)));
    }
}
