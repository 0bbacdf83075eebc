package com.formula.context;

import com.formula.eval.Evaluator;
import com.formula.exception.UndefinedIdentifierException;
import com.formula.grid.View;
import com.formula.grid.Workbook;
import com.formula.layout.Position;
import com.formula.value.ErrorCode;
import com.formula.value.ErrorValue;
import com.formula.value.Value;

import java.util.Objects;
import java.util.Optional;

/**
 * Context reading the sheets of a workbook.
 * <p>
 * A qualified reference is read from the sheet it names, an unqualified one from the
 * active sheet. A reference to an unknown sheet gives {@code #REF!}.
 */
public class WorkbookContext implements Context {

    private final Context parent;
    private final Workbook workbook;
    private final ReferenceTracker tracker;
    private final Evaluator evaluator;

    public WorkbookContext(Context parent, Workbook workbook) {
        this(parent, workbook, new ReferenceTracker(), new Evaluator());
    }

    public WorkbookContext(Context parent, Workbook workbook, ReferenceTracker tracker, Evaluator evaluator) {
        this.parent = parent;
        this.workbook = Objects.requireNonNull(workbook, "workbook");
        this.tracker = Objects.requireNonNull(tracker, "tracker");
        this.evaluator = Objects.requireNonNull(evaluator, "evaluator");
    }

    public Workbook getWorkbook() {
        return workbook;
    }

    @Override
    public Value resolve(String name) {
        if (parent == null) {
            throw new UndefinedIdentifierException(name);
        }
        return parent.resolve(name);
    }

    @Override
    public Value at(Position position) {
        return sheetFor(position)
                .map(sheet -> sheet.at(position))
                .orElse(ErrorValue.of(ErrorCode.REF));
    }

    @Override
    public Value range(Position start, Position end) {
        return sheetFor(start)
                .map(sheet -> sheet.range(start, end))
                .orElse(ErrorValue.of(ErrorCode.REF));
    }

    private Optional<SheetContext> sheetFor(Position position) {
        Optional<View> view = position.isQualified()
                ? workbook.sheet(position.sheet())
                : workbook.activeSheet();
        return view.map(v -> new SheetContext(this, v, tracker, evaluator));
    }

    @Override
    public String toString() {
        return "workbook";
    }
}
