package com.formula.context;

import com.formula.exception.EvaluationException;
import com.formula.exception.NotAvailableException;
import com.formula.exception.ReadOnlyException;
import com.formula.exception.UndefinedIdentifierException;
import com.formula.grid.InMemorySheet;
import com.formula.grid.InMemoryWorkbook;
import com.formula.layout.AddressCodec;
import com.formula.layout.Position;
import com.formula.value.NumberValue;
import com.formula.value.TextValue;
import com.formula.value.ViewValue;
import com.formula.value.WorkbookValue;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for ScopedContext.
 */
class ScopedContextTest {

    private ScopedContext ctx;
    private InMemoryWorkbook workbook;
    private InMemorySheet first;
    private InMemorySheet second;

    @BeforeEach
    void setUp() {
        ctx = new ScopedContext();
        workbook = new InMemoryWorkbook();
        first = workbook.addSheet("First");
        first.setValue(Position.of(1, 1), new NumberValue(1));
        second = workbook.addSheet("Second");
        second.setValue(Position.of(1, 1), new NumberValue(2));
    }

    private static Environment env(String name, double value) {
        Environment env = new Environment();
        env.define(name, new NumberValue(value));
        return env;
    }

    @Test
    @DisplayName("An empty stack resolves nothing")
    void shouldFailWhenEmpty() {
        assertEquals(0, ctx.depth());
        assertThrows(UndefinedIdentifierException.class, () -> ctx.resolve("x"));
        assertThrows(NotAvailableException.class, () -> ctx.at(Position.of(1, 1)));
        assertThrows(NotAvailableException.class, () -> ctx.define("x", new NumberValue(1)));
    }

    @Test
    @DisplayName("Closing a scope restores the previous depth")
    void shouldRestoreDepthOnClose() {
        try (ScopedContext.Scope outer = ctx.push(env("x", 1))) {
            assertEquals(1, ctx.depth());
            try (ScopedContext.Scope inner = ctx.push(env("x", 2))) {
                assertEquals(2, ctx.depth());
                assertEquals(new NumberValue(2), ctx.resolve("x"));
            }
            assertEquals(1, ctx.depth());
            assertEquals(new NumberValue(1), ctx.resolve("x"));
        }
        assertEquals(0, ctx.depth());
    }

    @Test
    @DisplayName("Scopes are restored when the block throws")
    void shouldRestoreDepthOnException() {
        ctx.push(env("x", 1));

        assertThrows(IllegalStateException.class, () -> {
            try (ScopedContext.Scope scope = ctx.pushView(first)) {
                assertEquals(2, ctx.depth());
                throw new IllegalStateException("boom");
            }
        });
        assertEquals(1, ctx.depth());
    }

    @Test
    @DisplayName("Closing an outer scope pops the inner ones, closing twice has no effect")
    void shouldTruncateOnOuterClose() {
        ScopedContext.Scope base = ctx.push(env("x", 1));
        ScopedContext.Scope outer = ctx.push(env("y", 2));
        ScopedContext.Scope inner = ctx.push(env("z", 3));

        outer.close();
        assertEquals(1, ctx.depth());

        inner.close();
        outer.close();
        assertEquals(1, ctx.depth());
        assertEquals(0, base.getDepth());
    }

    @Test
    @DisplayName("The top-most view answers unqualified references")
    void shouldSearchTopDown() {
        ctx.push(env("x", 1));
        try (ScopedContext.Scope a = ctx.pushView(first)) {
            assertEquals(new NumberValue(1), ctx.at(Position.of(1, 1)));
            try (ScopedContext.Scope b = ctx.pushView(second)) {
                assertEquals(new NumberValue(2), ctx.at(Position.of(1, 1)));
                assertEquals(new NumberValue(1), ctx.resolve("x"));
            }
            assertEquals(new NumberValue(1), ctx.at(Position.of(1, 1)));
        }
    }

    @Test
    @DisplayName("Other sheets fall through to the workbook below")
    void shouldFallThroughToWorkbook() {
        ctx.push(new WorkbookContext(null, workbook));
        ctx.pushView(first);

        assertEquals(new NumberValue(2), ctx.at(AddressCodec.decode("Second!A1")));
    }

    @Test
    @DisplayName("Define writes into the top-most environment")
    void shouldDefineInTopEnvironment() {
        Environment bottom = env("x", 1);
        Environment top = env("y", 2);
        ctx.push(bottom);
        ctx.push(top);
        ctx.pushView(first);

        ctx.define("z", new TextValue("new"));

        assertTrue(top.isDefined("z"));
        assertFalse(bottom.isDefined("z"));
        assertEquals(new TextValue("new"), ctx.resolve("z"));
    }

    @Test
    @DisplayName("A locked sheet can not be pushed as mutable")
    void shouldRejectLockedSheet() {
        first.lock();

        assertThrows(ReadOnlyException.class, () -> ctx.pushMutable(first));
        assertEquals(0, ctx.depth());

        try (ScopedContext.Scope scope = ctx.pushReadable(first)) {
            assertEquals(new NumberValue(1), ctx.at(Position.of(1, 1)));
        }
    }

    @Test
    @DisplayName("Should push workbook and view values")
    void shouldPushValues() {
        WorkbookValue wb = new WorkbookValue(workbook, false);

        try (ScopedContext.Scope scope = ctx.pushValue(wb, null)) {
            assertEquals(new NumberValue(1), ctx.at(Position.of(1, 1)));
        }
        try (ScopedContext.Scope scope = ctx.pushValue(wb, "Second")) {
            assertEquals(new NumberValue(2), ctx.at(Position.of(1, 1)));
        }
        try (ScopedContext.Scope scope = ctx.pushValue(new ViewValue(second), null)) {
            assertEquals(new NumberValue(2), ctx.at(Position.of(1, 1)));
        }
        assertEquals(0, ctx.depth());
    }

    @Test
    @DisplayName("Values other than workbooks and views are rejected")
    void shouldRejectOtherValues() {
        WorkbookValue wb = new WorkbookValue(workbook, true);

        assertThrows(EvaluationException.class, () -> ctx.pushValue(wb, "Missing"));
        assertThrows(EvaluationException.class, () -> ctx.pushValue(new NumberValue(1), null));
        assertEquals(0, ctx.depth());
    }
}
