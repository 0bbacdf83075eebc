package com.formula.context;

import com.formula.exception.NotAvailableException;
import com.formula.exception.UndefinedIdentifierException;
import com.formula.layout.Position;
import com.formula.value.Value;

/**
 * Resolves the names and cell references of a formula.
 * <p>
 * Contexts form a chain: a context answers what it knows and hands the rest to its parent.
 */
public interface Context {

    /**
     * Resolve a name.
     *
     * @throws UndefinedIdentifierException if no context of the chain defines it
     */
    Value resolve(String name);

    /**
     * Value of a single cell. A missing cell is blank.
     *
     * @throws NotAvailableException if the context can not address cells
     */
    Value at(Position position);

    /**
     * Values of a block of cells, as an array. The corners can be given in any order.
     *
     * @throws NotAvailableException if the context can not address cells
     */
    Value range(Position start, Position end);
}
