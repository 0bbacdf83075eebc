package com.formula.function;

import com.formula.value.ArrayValue;
import com.formula.value.Blank;
import com.formula.value.ErrorCode;
import com.formula.value.ErrorValue;
import com.formula.value.NumberValue;
import com.formula.value.ScalarValue;
import com.formula.value.TextValue;
import com.formula.value.Value;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.function.DoubleFunction;
import java.util.function.Function;

/**
 * Argument helpers shared by the builtin functions.
 */
final class Args {

    private Args() {
    }

    /**
     * Spread array arguments into their elements. Objects and functions become {@code #VALUE!}.
     */
    static List<ScalarValue> flatten(List<Value> args) {
        List<ScalarValue> list = new ArrayList<>();
        for (Value arg : args) {
            if (arg instanceof ArrayValue array) {
                list.addAll(array.values());
            } else if (arg instanceof ScalarValue scalar) {
                list.add(scalar);
            } else {
                list.add(ErrorValue.of(ErrorCode.VALUE));
            }
        }
        return list;
    }

    static List<ScalarValue> flatten(Value arg) {
        return flatten(List.of(arg));
    }

    /**
     * Numbers of a list of scalars, blanks skipped.
     */
    static Numbers numbers(List<ScalarValue> values) {
        List<Double> list = new ArrayList<>(values.size());
        for (ScalarValue value : values) {
            if (value instanceof Blank) {
                continue;
            }
            if (value instanceof ErrorValue err) {
                return new Numbers(list, err);
            }
            ScalarValue num = value.toNumber();
            if (!(num instanceof NumberValue n)) {
                return new Numbers(list, ErrorValue.of(ErrorCode.VALUE));
            }
            list.add(n.value());
        }
        return new Numbers(list, null);
    }

    /**
     * Apply a numeric function to a scalar or, element by element, to an array.
     */
    static Value mapNumber(Value arg, DoubleFunction<ScalarValue> fn) {
        return mapScalar(arg, value -> {
            if (value instanceof ErrorValue) {
                return value;
            }
            ScalarValue num = value.toNumber();
            if (num instanceof NumberValue n) {
                return fn.apply(n.value());
            }
            return ErrorValue.of(ErrorCode.VALUE);
        });
    }

    static Value mapScalar(Value arg, Function<ScalarValue, ScalarValue> fn) {
        if (arg instanceof ArrayValue array) {
            return array.apply(fn::apply);
        }
        if (arg instanceof ScalarValue scalar) {
            return fn.apply(scalar);
        }
        return ErrorValue.of(ErrorCode.VALUE);
    }

    /**
     * Argument as a scalar, {@code #VALUE!} for arrays and objects.
     */
    static ScalarValue scalar(Value arg) {
        if (arg instanceof ScalarValue scalar) {
            return scalar;
        }
        return ErrorValue.of(ErrorCode.VALUE);
    }

    /**
     * Integer argument, truncated toward zero.
     *
     * @return The number, empty if the argument does not convert
     */
    static Optional<Integer> integer(Value arg) {
        ScalarValue num = scalar(arg).toNumber();
        if (num instanceof NumberValue n && !Double.isNaN(n.value())) {
            return Optional.of((int) n.value());
        }
        return Optional.empty();
    }

    static ScalarValue text(Value arg, Function<String, ScalarValue> fn) {
        ScalarValue value = scalar(arg);
        if (value instanceof ErrorValue) {
            return value;
        }
        return fn.apply(value.toText().value());
    }

    static TextValue textOf(String value) {
        return new TextValue(value);
    }

    /**
     * Numbers extracted from arguments, or the error that stopped the extraction.
     */
    record Numbers(List<Double> values, ErrorValue error) {

        boolean failed() {
            return error != null;
        }

        double sum() {
            double total = 0;
            for (double v : values) {
                total += v;
            }
            return total;
        }
    }
}
