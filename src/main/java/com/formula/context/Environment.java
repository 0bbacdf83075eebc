package com.formula.context;

import com.formula.exception.NotAvailableException;
import com.formula.exception.UndefinedIdentifierException;
import com.formula.layout.Position;
import com.formula.value.Value;

import java.util.Collections;
import java.util.HashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Named values such as builtin functions and constants. Names are case-sensitive.
 */
public class Environment implements Context {

    private final Map<String, Value> values = new HashMap<>();
    private final Context parent;

    public Environment() {
        this(null);
    }

    public Environment(Context parent) {
        this.parent = parent;
    }

    public void define(String name, Value value) {
        values.put(Objects.requireNonNull(name, "name"), Objects.requireNonNull(value, "value"));
    }

    public boolean isDefined(String name) {
        return values.containsKey(name);
    }

    public Set<String> names() {
        return Collections.unmodifiableSet(values.keySet());
    }

    public Context getParent() {
        return parent;
    }

    @Override
    public Value resolve(String name) {
        Value value = values.get(name);
        if (value != null) {
            return value;
        }
        if (parent == null) {
            throw new UndefinedIdentifierException(name);
        }
        return parent.resolve(name);
    }

    @Override
    public Value at(Position position) {
        throw new NotAvailableException("cell references are not available in an environment");
    }

    @Override
    public Value range(Position start, Position end) {
        throw new NotAvailableException("range references are not available in an environment");
    }
}
