package com.formula.context;

import com.formula.eval.Evaluator;
import com.formula.exception.EvaluationException;
import com.formula.exception.NotAvailableException;
import com.formula.exception.UndefinedIdentifierException;
import com.formula.grid.ReadOnlyView;
import com.formula.grid.View;
import com.formula.layout.Position;
import com.formula.value.Value;
import com.formula.value.ViewValue;
import com.formula.value.WorkbookValue;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * Stack of contexts searched from the top down.
 * <p>
 * Each push returns a {@link Scope}; closing it pops everything pushed since, so a
 * try-with-resources block always leaves the stack as it found it:
 * <pre>
 * try (ScopedContext.Scope scope = ctx.pushView(sheet)) {
 *     engine.evaluate("sum(A1:A9)", ctx);
 * }
 * </pre>
 * Views pushed on the stack are chained to the context below them, so a reference to
 * another sheet falls through to the workbook underneath.
 * <p>
 * Not thread-safe.
 */
public class ScopedContext implements Context {

    private static final Logger log = LoggerFactory.getLogger(ScopedContext.class);

    private final List<Context> stack = new ArrayList<>();
    private final ReferenceTracker tracker;
    private final Evaluator evaluator;

    public ScopedContext() {
        this(new ReferenceTracker(), new Evaluator());
    }

    public ScopedContext(ReferenceTracker tracker, Evaluator evaluator) {
        this.tracker = tracker;
        this.evaluator = evaluator;
    }

    /**
     * Push a context on top of the stack.
     *
     * @return Guard restoring the current depth when closed
     */
    public Scope push(Context ctx) {
        int depth = stack.size();
        stack.add(ctx);
        log.debug("Pushed {} at depth {}", ctx, depth);
        return new Scope(this, depth);
    }

    /**
     * Push a view, chained to the current top of the stack.
     */
    public Scope pushView(View view) {
        return push(new SheetContext(top(), view, tracker, evaluator));
    }

    /**
     * Push a view that formulas can not modify.
     */
    public Scope pushReadable(View view) {
        return pushView(ReadOnlyView.of(view));
    }

    /**
     * Push a view that formulas may modify.
     *
     * @throws com.formula.exception.ReadOnlyException if the view is read-only or protected
     */
    public Scope pushMutable(View view) {
        return pushView(view.mutable());
    }

    /**
     * Push a workbook or view value, e.g. the result of a formula.
     *
     * @param value     {@link WorkbookValue} or {@link ViewValue}
     * @param sheetName Sheet of the workbook to push instead of the whole workbook, may be null
     * @throws EvaluationException if the value can not be used as a context
     */
    public Scope pushValue(Value value, String sheetName) {
        if (value instanceof WorkbookValue wb) {
            if (sheetName == null || sheetName.isEmpty()) {
                return push(new WorkbookContext(top(), wb.getWorkbook(), tracker, evaluator));
            }
            View sheet = wb.getWorkbook().sheet(sheetName)
                    .orElseThrow(() -> new EvaluationException(sheetName + ": sheet not found"));
            return wb.isReadonly() ? pushReadable(sheet) : pushView(sheet);
        }
        if (value instanceof ViewValue view) {
            return pushView(view.getView());
        }
        throw new EvaluationException(value.typeName() + ": value can not be used as a context");
    }

    /**
     * Define a name in the top-most environment of the stack.
     *
     * @throws NotAvailableException if the stack holds no environment
     */
    public void define(String name, Value value) {
        for (int i = stack.size() - 1; i >= 0; i--) {
            if (stack.get(i) instanceof Environment env) {
                env.define(name, value);
                return;
            }
        }
        throw new NotAvailableException("no environment in scope to define " + name);
    }

    public int depth() {
        return stack.size();
    }

    @Override
    public Value resolve(String name) {
        for (int i = stack.size() - 1; i >= 0; i--) {
            try {
                return stack.get(i).resolve(name);
            } catch (UndefinedIdentifierException e) {
                log.trace("{} not defined in {}", name, stack.get(i));
            }
        }
        throw new UndefinedIdentifierException(name);
    }

    @Override
    public Value at(Position position) {
        for (int i = stack.size() - 1; i >= 0; i--) {
            try {
                return stack.get(i).at(position);
            } catch (NotAvailableException e) {
                log.trace("{} not available in {}", position, stack.get(i));
            }
        }
        throw new NotAvailableException(position + ": no view in scope");
    }

    @Override
    public Value range(Position start, Position end) {
        for (int i = stack.size() - 1; i >= 0; i--) {
            try {
                return stack.get(i).range(start, end);
            } catch (NotAvailableException e) {
                log.trace("{}:{} not available in {}", start, end, stack.get(i));
            }
        }
        throw new NotAvailableException(start + ":" + end + ": no view in scope");
    }

    private Context top() {
        return stack.isEmpty() ? null : stack.get(stack.size() - 1);
    }

    private void truncate(int depth) {
        while (stack.size() > depth) {
            Context ctx = stack.remove(stack.size() - 1);
            log.debug("Popped {} from depth {}", ctx, stack.size());
        }
    }

    /**
     * Guard returned by every push. Closing it more than once has no effect.
     */
    public static final class Scope implements AutoCloseable {

        private final ScopedContext owner;
        private final int depth;
        private boolean closed;

        private Scope(ScopedContext owner, int depth) {
            this.owner = owner;
            this.depth = depth;
        }

        public int getDepth() {
            return depth;
        }

        @Override
        public void close() {
            if (closed) {
                return;
            }
            closed = true;
            owner.truncate(depth);
        }
    }
}
