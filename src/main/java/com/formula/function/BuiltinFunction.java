package com.formula.function;

import com.formula.context.Context;
import com.formula.eval.Argument;
import com.formula.value.ErrorCode;
import com.formula.value.ErrorValue;
import com.formula.value.FunctionValue;
import com.formula.value.Value;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Function evaluating all of its arguments before running.
 */
public final class BuiltinFunction implements FunctionValue {

    /**
     * Body of a builtin, receiving evaluated arguments.
     */
    @FunctionalInterface
    public interface Body {
        Value apply(List<Value> args);
    }

    private final String name;
    private final int minArgs;
    private final int maxArgs;
    private final Body body;

    /**
     * @param name    Function name
     * @param minArgs Minimum number of arguments
     * @param maxArgs Maximum number of arguments, -1 for no limit
     * @param body    Implementation
     */
    public BuiltinFunction(String name, int minArgs, int maxArgs, Body body) {
        this.name = Objects.requireNonNull(name, "name");
        this.minArgs = minArgs;
        this.maxArgs = maxArgs;
        this.body = Objects.requireNonNull(body, "body");
    }

    public static BuiltinFunction variadic(String name, Body body) {
        return new BuiltinFunction(name, 0, -1, body);
    }

    @Override
    public String name() {
        return name;
    }

    /**
     * Wrong number of arguments gives {@code #VALUE!}.
     */
    @Override
    public Value call(List<Argument> args, Context ctx) {
        if (args.size() < minArgs || (maxArgs >= 0 && args.size() > maxArgs)) {
            return ErrorValue.of(ErrorCode.VALUE);
        }
        List<Value> values = new ArrayList<>(args.size());
        for (Argument arg : args) {
            values.add(arg.eval(ctx));
        }
        return body.apply(values);
    }

    @Override
    public String toString() {
        return name;
    }
}
