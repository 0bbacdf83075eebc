package com.formula.function;

import com.formula.value.Blank;
import com.formula.value.BooleanValue;
import com.formula.value.FunctionValue;
import com.formula.value.NumberValue;
import com.formula.value.TextValue;
import com.formula.value.Value;

import java.util.List;
import java.util.function.Function;

/**
 * Functions inspecting the type of their argument.
 */
final class InfoFunctions {

    private InfoFunctions() {
    }

    static List<FunctionValue> functions() {
        return List.of(
                new BuiltinFunction("typeof", 1, 1, args -> new TextValue(args.get(0).typeName())),
                is("isnumber", v -> v instanceof NumberValue),
                is("istext", v -> v instanceof TextValue),
                is("isblank", v -> v instanceof Blank),
                is("iserror", Value::isError)
        );
    }

    private static FunctionValue is(String name, Function<Value, Boolean> test) {
        return new BuiltinFunction(name, 1, 1, args -> BooleanValue.of(test.apply(args.get(0))));
    }
}
