package com.formula.function;

import com.formula.context.Context;
import com.formula.eval.Argument;
import com.formula.value.ErrorCode;
import com.formula.value.ErrorValue;
import com.formula.value.FunctionValue;
import com.formula.value.Value;

import java.util.List;
import java.util.Objects;
import java.util.function.Function;

/**
 * Function aggregating a single argument filtered by a predicate.
 * <p>
 * The argument is either a comparison such as {@code A1:A9 > 2}, in which case only the
 * values of the left operand satisfying it are kept, or a plain value filtered by a fallback
 * predicate, which accepts everything unless told otherwise.
 */
public final class Reducer implements FunctionValue {

    private final String name;
    private final Predicate fallback;
    private final Function<Filter, Value> body;

    public Reducer(String name, Function<Filter, Value> body) {
        this(name, Predicate.always(), body);
    }

    /**
     * @param name     Function name
     * @param fallback Predicate used when the argument is not a comparison
     * @param body     Aggregation
     */
    public Reducer(String name, Predicate fallback, Function<Filter, Value> body) {
        this.name = Objects.requireNonNull(name, "name");
        this.fallback = Objects.requireNonNull(fallback, "fallback");
        this.body = Objects.requireNonNull(body, "body");
    }

    @Override
    public String name() {
        return name;
    }

    @Override
    public Value call(List<Argument> args, Context ctx) {
        if (args.size() != 1) {
            return ErrorValue.of(ErrorCode.VALUE);
        }
        Argument arg = args.get(0);
        Filter filter = arg.tryAsPredicate(ctx)
                .orElseGet(() -> new Filter(fallback, arg.eval(ctx)));
        if (filter.source().isError()) {
            return filter.source();
        }
        return body.apply(filter);
    }

    @Override
    public String toString() {
        return name;
    }
}
