package com.formula.function;

import com.formula.value.Blank;
import com.formula.value.BooleanValue;
import com.formula.value.ErrorCode;
import com.formula.value.ErrorValue;
import com.formula.value.FunctionValue;
import com.formula.value.NumberValue;
import com.formula.value.ScalarValue;
import com.formula.value.Value;

import java.util.ArrayList;
import java.util.List;

/**
 * Reducers: {@code countif(A1:A9 > 2)}, {@code sumif}, {@code averageif}, {@code any} and {@code all}.
 */
final class ReducerFunctions {

    private ReducerFunctions() {
    }

    static List<FunctionValue> functions() {
        return List.of(
                new Reducer("countif", ReducerFunctions::countIf),
                new Reducer("sumif", ReducerFunctions::sumIf),
                new Reducer("averageif", ReducerFunctions::averageIf),
                new Reducer("any", ScalarValue::isTruthy, ReducerFunctions::any),
                new Reducer("all", ScalarValue::isTruthy, ReducerFunctions::all)
        );
    }

    private static Value countIf(Filter filter) {
        long count = Args.flatten(filter.source()).stream()
                .filter(v -> filter.predicate().test(v))
                .count();
        return new NumberValue(count);
    }

    private static Value sumIf(Filter filter) {
        List<Double> numbers = new ArrayList<>();
        ScalarValue error = select(filter, numbers);
        if (error != null) {
            return error;
        }
        return new NumberValue(numbers.stream().mapToDouble(Double::doubleValue).sum());
    }

    private static Value averageIf(Filter filter) {
        List<Double> numbers = new ArrayList<>();
        ScalarValue error = select(filter, numbers);
        if (error != null) {
            return error;
        }
        if (numbers.isEmpty()) {
            return ErrorValue.of(ErrorCode.DIV0);
        }
        return new NumberValue(numbers.stream().mapToDouble(Double::doubleValue).average().orElse(0));
    }

    private static Value any(Filter filter) {
        return BooleanValue.of(Args.flatten(filter.source()).stream()
                .anyMatch(v -> filter.predicate().test(v)));
    }

    private static Value all(Filter filter) {
        return BooleanValue.of(Args.flatten(filter.source()).stream()
                .allMatch(v -> filter.predicate().test(v)));
    }

    /**
     * Collect the numbers accepted by the filter. Blanks and text are skipped.
     *
     * @return The first accepted error, null if there is none
     */
    private static ScalarValue select(Filter filter, List<Double> numbers) {
        for (ScalarValue value : Args.flatten(filter.source())) {
            if (value instanceof Blank || !filter.predicate().test(value)) {
                continue;
            }
            if (value.isError()) {
                return value;
            }
            ScalarValue num = value.toNumber();
            if (num instanceof NumberValue n) {
                numbers.add(n.value());
            }
        }
        return null;
    }
}
