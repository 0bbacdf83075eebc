package com.formula.value;

import com.formula.exception.EvaluationException;
import com.formula.grid.View;
import com.formula.grid.Workbook;

import java.util.Objects;

/**
 * Workbook seen from a formula.
 * <p>
 * Properties: {@code sheets} (number of sheets), {@code active} (active sheet),
 * {@code readonly}, {@code protected}, and every sheet by its name.
 */
public final class WorkbookValue implements ObjectValue {

    private final Workbook workbook;
    private final boolean readonly;

    public WorkbookValue(Workbook workbook, boolean readonly) {
        this.workbook = Objects.requireNonNull(workbook, "workbook");
        this.readonly = readonly;
    }

    public Workbook getWorkbook() {
        return workbook;
    }

    public boolean isReadonly() {
        return readonly;
    }

    @Override
    public Value get(String name) {
        switch (name) {
            case "sheets":
                return new NumberValue(workbook.sheets().size());
            case "readonly":
                return BooleanValue.of(readonly);
            case "protected":
                return BooleanValue.FALSE;
            case "active":
                return workbook.activeSheet()
                        .map(this::wrap)
                        .orElse(ErrorValue.of(ErrorCode.REF));
            default:
                return workbook.sheet(name)
                        .map(this::wrap)
                        .orElseThrow(() -> new EvaluationException(name + ": unknown workbook property"));
        }
    }

    private Value wrap(View view) {
        return new ViewValue(view, readonly);
    }

    @Override
    public String typeName() {
        return "workbook";
    }

    @Override
    public String toString() {
        return "workbook";
    }
}
