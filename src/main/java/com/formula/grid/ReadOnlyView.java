package com.formula.grid;

import com.formula.exception.ReadOnlyException;
import com.formula.layout.Position;
import com.formula.layout.Range;
import com.formula.value.ScalarValue;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Wraps a view and refuses every attempt to modify it.
 */
public final class ReadOnlyView implements View {

    private final View delegate;

    public ReadOnlyView(View delegate) {
        this.delegate = Objects.requireNonNull(delegate, "delegate");
    }

    /**
     * Wrap a view, unless it is already read-only.
     */
    public static View of(View view) {
        if (view instanceof ReadOnlyView) {
            return view;
        }
        return new ReadOnlyView(view);
    }

    @Override
    public String name() {
        return delegate.name();
    }

    @Override
    public Optional<Cell> cell(Position position) {
        return delegate.cell(position);
    }

    @Override
    public Range bounds() {
        return delegate.bounds();
    }

    @Override
    public List<List<ScalarValue>> rows() {
        return delegate.rows();
    }

    @Override
    public MutableView mutable() {
        throw new ReadOnlyException(delegate.name());
    }

    @Override
    public boolean isLocked() {
        return delegate.isLocked();
    }

    @Override
    public String toString() {
        return delegate.toString();
    }
}
