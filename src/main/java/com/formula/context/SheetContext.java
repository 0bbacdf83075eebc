package com.formula.context;

import com.formula.ast.Expr;
import com.formula.eval.Evaluator;
import com.formula.exception.UndefinedIdentifierException;
import com.formula.grid.Cell;
import com.formula.grid.View;
import com.formula.layout.Position;
import com.formula.layout.Range;
import com.formula.value.ArrayValue;
import com.formula.value.Blank;
import com.formula.value.ErrorCode;
import com.formula.value.ErrorValue;
import com.formula.value.ScalarValue;
import com.formula.value.Value;

import java.util.Objects;
import java.util.Optional;

/**
 * Context reading the cells of one view.
 * <p>
 * References without sheet, or qualified with the name of the view, are read locally.
 * Other references and every name go to the parent. Formula cells are evaluated when read.
 */
public class SheetContext implements Context {

    private final Context parent;
    private final View view;
    private final ReferenceTracker tracker;
    private final Evaluator evaluator;

    public SheetContext(Context parent, View view) {
        this(parent, view, new ReferenceTracker(), new Evaluator());
    }

    public SheetContext(Context parent, View view, ReferenceTracker tracker, Evaluator evaluator) {
        this.parent = parent;
        this.view = Objects.requireNonNull(view, "view");
        this.tracker = Objects.requireNonNull(tracker, "tracker");
        this.evaluator = Objects.requireNonNull(evaluator, "evaluator");
    }

    public View getView() {
        return view;
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
        if (!isLocal(position)) {
            return parent == null ? ErrorValue.of(ErrorCode.REF) : parent.at(position);
        }
        return read(position);
    }

    @Override
    public Value range(Position start, Position end) {
        if (!isLocal(start)) {
            return parent == null ? ErrorValue.of(ErrorCode.REF) : parent.range(start, end);
        }
        Range rg = new Range(start, end).normalize();
        long height = rg.height();
        long width = rg.width();
        if (height > Integer.MAX_VALUE || width > Integer.MAX_VALUE) {
            return ErrorValue.of(ErrorCode.REF);
        }
        ArrayValue array = ArrayValue.blank((int) height, (int) width);
        for (int i = 0; i < height; i++) {
            for (int j = 0; j < width; j++) {
                Position pos = Position.of(rg.start().column() + j, rg.start().row() + i);
                Value value = read(pos);
                array.set(i, j, value instanceof ScalarValue scalar ? scalar : ErrorValue.of(ErrorCode.VALUE));
            }
        }
        return array;
    }

    /**
     * Write a value in the view.
     *
     * @throws com.formula.exception.ReadOnlyException if the view is not mutable
     */
    public void setValue(Position position, ScalarValue value) {
        view.mutable().setValue(position, value);
    }

    private boolean isLocal(Position position) {
        return !position.isQualified() || position.sheet().equals(view.name());
    }

    private Value read(Position position) {
        Optional<Cell> cell = view.cell(position);
        if (cell.isEmpty()) {
            return Blank.INSTANCE;
        }
        Optional<Expr> formula = cell.get().formula();
        if (formula.isEmpty()) {
            return cell.get().value();
        }
        Position key = position.withSheet(view.name());
        if (!tracker.enter(key)) {
            return ErrorValue.of(ErrorCode.REF);
        }
        try {
            return evaluator.evaluate(formula.get(), this);
        } finally {
            tracker.leave(key);
        }
    }

    @Override
    public String toString() {
        return "sheet(" + view.name() + ")";
    }
}
