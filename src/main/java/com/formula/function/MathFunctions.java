package com.formula.function;

import com.formula.value.ErrorCode;
import com.formula.value.ErrorValue;
import com.formula.value.FunctionValue;
import com.formula.value.NumberValue;
import com.formula.value.ScalarValue;
import com.formula.value.Value;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.List;
import java.util.Optional;

/**
 * Numeric functions. Aggregates skip blank cells; an error in the data is returned as is.
 */
final class MathFunctions {

    private MathFunctions() {
    }

    static List<FunctionValue> functions() {
        return List.of(
                BuiltinFunction.variadic("sum", MathFunctions::sum),
                BuiltinFunction.variadic("min", MathFunctions::min),
                BuiltinFunction.variadic("max", MathFunctions::max),
                BuiltinFunction.variadic("avg", MathFunctions::average),
                BuiltinFunction.variadic("average", MathFunctions::average),
                BuiltinFunction.variadic("count", MathFunctions::count),
                new BuiltinFunction("round", 1, 2, args -> round(args, RoundingMode.HALF_UP)),
                new BuiltinFunction("rounddown", 1, 2, args -> round(args, RoundingMode.DOWN)),
                new BuiltinFunction("roundup", 1, 2, args -> round(args, RoundingMode.UP)),
                new BuiltinFunction("sqrt", 1, 1, args -> Args.mapNumber(args.get(0), MathFunctions::sqrt)),
                new BuiltinFunction("abs", 1, 1, args -> Args.mapNumber(args.get(0), v -> new NumberValue(Math.abs(v)))),
                new BuiltinFunction("mod", 2, 2, MathFunctions::mod),
                new BuiltinFunction("power", 2, 2, MathFunctions::power)
        );
    }

    private static Value sum(List<Value> args) {
        Args.Numbers numbers = Args.numbers(Args.flatten(args));
        if (numbers.failed()) {
            return numbers.error();
        }
        return new NumberValue(numbers.sum());
    }

    private static Value min(List<Value> args) {
        Args.Numbers numbers = Args.numbers(Args.flatten(args));
        if (numbers.failed()) {
            return numbers.error();
        }
        return new NumberValue(numbers.values().stream().mapToDouble(Double::doubleValue).min().orElse(0));
    }

    private static Value max(List<Value> args) {
        Args.Numbers numbers = Args.numbers(Args.flatten(args));
        if (numbers.failed()) {
            return numbers.error();
        }
        return new NumberValue(numbers.values().stream().mapToDouble(Double::doubleValue).max().orElse(0));
    }

    private static Value average(List<Value> args) {
        Args.Numbers numbers = Args.numbers(Args.flatten(args));
        if (numbers.failed()) {
            return numbers.error();
        }
        if (numbers.values().isEmpty()) {
            return ErrorValue.of(ErrorCode.DIV0);
        }
        return new NumberValue(numbers.sum() / numbers.values().size());
    }

    /**
     * Number of numeric values; anything else, errors included, is ignored.
     */
    private static Value count(List<Value> args) {
        long count = Args.flatten(args).stream()
                .filter(v -> v instanceof NumberValue)
                .count();
        return new NumberValue(count);
    }

    private static Value round(List<Value> args, RoundingMode mode) {
        int digits = 0;
        if (args.size() > 1) {
            ScalarValue arg = Args.scalar(args.get(1));
            if (arg.isError()) {
                return arg;
            }
            Optional<Integer> parsed = Args.integer(arg);
            if (parsed.isEmpty()) {
                return ErrorValue.of(ErrorCode.VALUE);
            }
            digits = parsed.get();
        }
        int scale = digits;
        return Args.mapNumber(args.get(0), v -> {
            if (Double.isNaN(v) || Double.isInfinite(v)) {
                return ErrorValue.of(ErrorCode.NUM);
            }
            return new NumberValue(BigDecimal.valueOf(v).setScale(scale, mode).doubleValue());
        });
    }

    private static ScalarValue sqrt(double value) {
        if (value < 0) {
            return ErrorValue.of(ErrorCode.NUM);
        }
        return new NumberValue(Math.sqrt(value));
    }

    /**
     * Remainder with the sign of the divisor: {@code mod(-3, 2)} is 1.
     */
    private static Value mod(List<Value> args) {
        ScalarValue left = Args.scalar(args.get(0)).toNumber();
        ScalarValue right = Args.scalar(args.get(1)).toNumber();
        if (!(left instanceof NumberValue a)) {
            return left.isError() ? left : ErrorValue.of(ErrorCode.VALUE);
        }
        if (!(right instanceof NumberValue b)) {
            return right.isError() ? right : ErrorValue.of(ErrorCode.VALUE);
        }
        if (b.value() == 0) {
            return ErrorValue.of(ErrorCode.DIV0);
        }
        return new NumberValue(a.value() - b.value() * Math.floor(a.value() / b.value()));
    }

    private static Value power(List<Value> args) {
        ScalarValue base = Args.scalar(args.get(0)).toNumber();
        ScalarValue exp = Args.scalar(args.get(1)).toNumber();
        if (!(base instanceof NumberValue a)) {
            return base;
        }
        if (!(exp instanceof NumberValue b)) {
            return exp;
        }
        double res = Math.pow(a.value(), b.value());
        if (Double.isNaN(res) || Double.isInfinite(res)) {
            return ErrorValue.of(ErrorCode.NUM);
        }
        return new NumberValue(res);
    }
}
