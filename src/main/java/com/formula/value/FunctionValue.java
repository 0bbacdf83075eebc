package com.formula.value;

import com.formula.context.Context;
import com.formula.eval.Argument;

import java.util.List;

/**
 * Callable value.
 * <p>
 * Arguments are handed over unevaluated so that a function can decide how to treat
 * each of them, e.g. read a comparison as a predicate.
 */
public non-sealed interface FunctionValue extends Value {

    String name();

    /**
     * Invoke the function.
     *
     * @param args Arguments of the call, in order
     * @param ctx  Context of the call, used to evaluate the arguments
     * @return Result, an {@link ErrorValue} for invalid input
     */
    Value call(List<Argument> args, Context ctx);

    @Override
    default ValueKind kind() {
        return ValueKind.FUNCTION;
    }

    @Override
    default String typeName() {
        return "function";
    }
}
