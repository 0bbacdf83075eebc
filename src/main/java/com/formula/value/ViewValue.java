package com.formula.value;

import com.formula.exception.EvaluationException;
import com.formula.grid.ReadOnlyView;
import com.formula.grid.View;
import com.formula.layout.Range;

import java.util.List;
import java.util.Objects;

/**
 * Sheet seen from a formula.
 * <p>
 * Properties: {@code name}, {@code lines}, {@code columns}, {@code cells},
 * {@code readonly} and {@code protected}.
 */
public final class ViewValue implements ObjectValue {

    private final View view;
    private final boolean readonly;

    public ViewValue(View view) {
        this(view, false);
    }

    public ViewValue(View view, boolean readonly) {
        this.view = Objects.requireNonNull(view, "view");
        this.readonly = readonly;
    }

    /**
     * The wrapped view, made read-only if the value is.
     */
    public View getView() {
        return readonly ? ReadOnlyView.of(view) : view;
    }

    public boolean isReadonly() {
        return readonly;
    }

    @Override
    public Value get(String name) {
        Range bounds = view.bounds();
        switch (name) {
            case "name":
                return new TextValue(view.name());
            case "lines":
                return new NumberValue(bounds.equals(Range.EMPTY) ? 0 : bounds.height());
            case "columns":
                return new NumberValue(bounds.equals(Range.EMPTY) ? 0 : bounds.width());
            case "cells":
                return new NumberValue(view.rows().stream().mapToInt(List::size).sum());
            case "readonly":
                return BooleanValue.of(readonly);
            case "protected":
                return BooleanValue.of(view.isLocked());
            default:
                throw new EvaluationException(name + ": unknown view property");
        }
    }

    @Override
    public String typeName() {
        return "view";
    }

    @Override
    public String toString() {
        return view.name();
    }
}
