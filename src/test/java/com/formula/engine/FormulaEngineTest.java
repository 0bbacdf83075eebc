package com.formula.engine;

import com.formula.ast.Expr;
import com.formula.config.ConfigLoader;
import com.formula.config.FormulaConfig;
import com.formula.context.Context;
import com.formula.context.ScopedContext;
import com.formula.exception.CircularReferenceException;
import com.formula.exception.SyntaxException;
import com.formula.grid.InMemorySheet;
import com.formula.grid.InMemoryWorkbook;
import com.formula.grid.WorkbookLoader;
import com.formula.layout.Position;
import com.formula.parse.ScanMode;
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

import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * End-to-end tests for FormulaEngine.
 * Tests cover:
 * - Parsing and evaluating against a workbook
 * - Constants from configuration
 * - Copying formulas to other cells
 * - Cycle detection modes
 * - Scoped evaluation
 */
class FormulaEngineTest {

    private FormulaEngine engine;
    private InMemoryWorkbook workbook;

    @BeforeEach
    void setUp() {
        engine = new FormulaEngine(ConfigLoader.load("classpath:formula-test.yaml"));
        workbook = new WorkbookLoader().load("classpath:workbook.json");
    }

    // =====================================================================
    // Workbook Evaluation Tests
    // =====================================================================

    @ParameterizedTest(name = "{0} = {1}")
    @DisplayName("Should evaluate formulas against the loaded workbook")
    @CsvSource(delimiter = '|', value = {
            "A1|60",
            "A2|20",
            "B1|80",
            "=B1 / 4|20",
            "Data!A3 - Data!A2|10",
            "sum(Data!A1:A3) * rate|12",
            "countif(Data!A1:A3 >= 20)|2",
            "max(Data!A1:A3) ^ 2|900"
    })
    void shouldEvaluateAgainstWorkbook(String formula, double expected) {
        Value result = engine.evaluate(formula, engine.context(workbook));

        assertEquals(new NumberValue(expected), result);
    }

    @Test
    @DisplayName("Text and boolean constants are available to formulas")
    void shouldResolveConstants() {
        Context ctx = engine.context(workbook);

        assertEquals(new TextValue("net: 60"), engine.evaluate("label & ': ' & A1", ctx));
        assertEquals(BooleanValue.TRUE, engine.evaluate("enabled", ctx));
        assertTrue(engine.rootEnvironment().isDefined("rate"));
    }

    @Test
    @DisplayName("Syntax errors are reported with their position")
    void shouldReportSyntaxErrors() {
        SyntaxException ex = assertThrows(SyntaxException.class, () -> engine.parse("sum(1, "));

        assertTrue(ex.getMessage().contains("1:"), ex.getMessage());
    }

    // =====================================================================
    // Relocation Tests
    // =====================================================================

    @Test
    @DisplayName("Copying a formula moves relative references only")
    void shouldRelocateFormula() {
        Expr expr = engine.parse("A1 + $B$1 * A$2");

        Expr moved = engine.relocate(expr, 2, 1);

        assertEquals("B3 + ($B$1 * B$2)", moved.toString());
        assertEquals("A1 + ($B$1 * A$2)", expr.toString());
    }

    @Test
    @DisplayName("A relocated formula evaluates against its new cells")
    void shouldEvaluateRelocatedFormula() {
        InMemorySheet sheet = (InMemorySheet) workbook.sheet("Data").orElseThrow();
        Expr expr = engine.parse("Data!A1 * 2");

        assertEquals(new NumberValue(20), engine.evaluate(expr, engine.context(workbook)));
        assertEquals(new NumberValue(60), engine.evaluate(engine.relocate(expr, 2, 0), engine.context(workbook)));
        assertEquals(3, sheet.bounds().height());
    }

    // =====================================================================
    // Configuration Tests
    // =====================================================================

    @Test
    @DisplayName("Without builtins, function calls give #NAME?")
    void shouldDisableBuiltins() {
        FormulaEngine bare = new FormulaEngine(new FormulaConfig("bare", false, true, ScanMode.FORMULA, Map.of("k", 2)));

        assertEquals(ErrorValue.of(ErrorCode.NAME), bare.evaluate("sum(1, 2)", bare.context(workbook)));
        assertEquals(new NumberValue(4), bare.evaluate("k * 2", bare.context(workbook)));
    }

    @Test
    @DisplayName("Cycle detection mode follows the configuration")
    void shouldFollowCycleDetectionMode() {
        InMemorySheet sheet = workbook.addSheet("Loop");
        sheet.setFormula(Position.of(1, 1), engine.parse("A2 + 1"));
        sheet.setFormula(Position.of(1, 2), engine.parse("A1 + 1"));

        assertEquals(ErrorValue.of(ErrorCode.REF), engine.evaluate("Loop!A1", engine.context(workbook)));

        FormulaEngine strict = new FormulaEngine();
        assertThrows(CircularReferenceException.class,
                () -> strict.evaluate("Loop!A1", strict.context(workbook)));
    }

    // =====================================================================
    // Scope Tests
    // =====================================================================

    @Test
    @DisplayName("Names defined in a scope are visible to formulas")
    void shouldEvaluateInScope() {
        ScopedContext scope = engine.scope();
        scope.define("qty", new NumberValue(3));

        try (ScopedContext.Scope ignored = scope.pushReadable(workbook.sheet("Data").orElseThrow())) {
            assertEquals(new NumberValue(30), engine.evaluate("A1 * qty", scope));
            assertEquals(new NumberValue(60), engine.evaluate("sum(A1:A3)", scope));
        }
        assertEquals(1, scope.depth());
        assertEquals(new NumberValue(6), engine.evaluate("qty * 2", scope));
    }
}
