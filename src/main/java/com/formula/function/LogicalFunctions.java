package com.formula.function;

import com.formula.context.Context;
import com.formula.eval.Argument;
import com.formula.value.Blank;
import com.formula.value.BooleanValue;
import com.formula.value.ErrorCode;
import com.formula.value.ErrorValue;
import com.formula.value.FunctionValue;
import com.formula.value.ScalarValue;
import com.formula.value.Value;

import java.util.ArrayList;
import java.util.List;

/**
 * Logical functions.
 */
final class LogicalFunctions {

    private LogicalFunctions() {
    }

    static List<FunctionValue> functions() {
        return List.of(
                new IfFunction(),
                BuiltinFunction.variadic("and", args -> combine(args, Mode.AND)),
                BuiltinFunction.variadic("or", args -> combine(args, Mode.OR)),
                BuiltinFunction.variadic("xor", args -> combine(args, Mode.XOR)),
                new BuiltinFunction("not", 1, 1, args -> Args.mapScalar(args.get(0), v -> {
                    ScalarValue b = v.toBool();
                    return b instanceof BooleanValue bool ? BooleanValue.of(!bool.value()) : b;
                }))
        );
    }

    private enum Mode {
        AND, OR, XOR
    }

    /**
     * Blanks are ignored; no value at all gives {@code #VALUE!}.
     */
    private static Value combine(List<Value> args, Mode mode) {
        List<Boolean> flags = new ArrayList<>();
        for (ScalarValue value : Args.flatten(args)) {
            if (value instanceof Blank) {
                continue;
            }
            ScalarValue b = value.toBool();
            if (!(b instanceof BooleanValue bool)) {
                return b;
            }
            flags.add(bool.value());
        }
        if (flags.isEmpty()) {
            return ErrorValue.of(ErrorCode.VALUE);
        }
        switch (mode) {
            case AND:
                return BooleanValue.of(flags.stream().allMatch(f -> f));
            case OR:
                return BooleanValue.of(flags.stream().anyMatch(f -> f));
            default:
                return BooleanValue.of(flags.stream().filter(f -> f).count() % 2 == 1);
        }
    }

    /**
     * {@code if(condition, then, else)}. Only the selected branch is evaluated.
     * Without else branch a false condition gives {@code false}.
     */
    static final class IfFunction implements FunctionValue {

        @Override
        public String name() {
            return "if";
        }

        @Override
        public Value call(List<Argument> args, Context ctx) {
            if (args.size() < 2 || args.size() > 3) {
                return ErrorValue.of(ErrorCode.VALUE);
            }
            ScalarValue cond = Args.scalar(args.get(0).eval(ctx)).toBool();
            if (!(cond instanceof BooleanValue flag)) {
                return cond;
            }
            if (flag.value()) {
                return args.get(1).eval(ctx);
            }
            return args.size() > 2 ? args.get(2).eval(ctx) : BooleanValue.FALSE;
        }

        @Override
        public String toString() {
            return name();
        }
    }
}
