package com.formula.context;

import com.formula.exception.CircularReferenceException;
import com.formula.layout.Position;

import java.util.HashSet;
import java.util.Set;

/**
 * Cells whose formula is being evaluated.
 * <p>
 * Entering a cell that is already being evaluated means its formula depends on itself.
 * In strict mode this raises a {@link CircularReferenceException}; otherwise the caller is
 * told to stop and reports {@code #REF!} for the cell.
 * <p>
 * Not thread-safe: one tracker per evaluation.
 */
public final class ReferenceTracker {

    private final Set<Position> visiting = new HashSet<>();
    private final boolean strict;

    public ReferenceTracker() {
        this(true);
    }

    public ReferenceTracker(boolean strict) {
        this.strict = strict;
    }

    /**
     * Mark a cell as being evaluated.
     *
     * @param position Qualified cell position
     * @return false if the cell is already being evaluated and the tracker is not strict
     * @throws CircularReferenceException if the cell is already being evaluated in strict mode
     */
    public boolean enter(Position position) {
        Position key = key(position);
        if (visiting.add(key)) {
            return true;
        }
        if (strict) {
            throw new CircularReferenceException(key.toString());
        }
        return false;
    }

    public void leave(Position position) {
        visiting.remove(key(position));
    }

    public boolean isVisiting(Position position) {
        return visiting.contains(key(position));
    }

    public boolean isStrict() {
        return strict;
    }

    private static Position key(Position position) {
        return position.coordinates().withSheet(position.sheet());
    }
}
