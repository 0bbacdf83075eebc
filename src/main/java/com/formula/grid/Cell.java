package com.formula.grid;

import com.formula.ast.Expr;
import com.formula.layout.Position;
import com.formula.value.ScalarValue;

import java.util.Optional;

/**
 * Content of one cell of a view.
 */
public interface Cell {

    Position position();

    /**
     * Text shown to the user.
     */
    String display();

    /**
     * Stored value. For formula cells this is the last known result, if any.
     */
    ScalarValue value();

    /**
     * Formula of the cell, empty for plain values.
     */
    Optional<Expr> formula();
}
