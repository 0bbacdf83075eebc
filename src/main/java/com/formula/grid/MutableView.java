package com.formula.grid;

import com.formula.ast.Expr;
import com.formula.layout.Position;
import com.formula.value.ScalarValue;

/**
 * View whose cells can be written.
 */
public interface MutableView extends View {

    void setValue(Position position, ScalarValue value);

    void setFormula(Position position, Expr formula);

    void clearCell(Position position);

    @Override
    default MutableView mutable() {
        return this;
    }
}
