package com.formula.function;

import com.formula.value.ErrorCode;
import com.formula.value.ErrorValue;
import com.formula.value.FunctionValue;
import com.formula.value.NumberValue;
import com.formula.value.ScalarValue;
import com.formula.value.Value;

import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * Text functions. Positions are 1-based, as in spreadsheets.
 */
final class TextFunctions {

    private TextFunctions() {
    }

    static List<FunctionValue> functions() {
        return List.of(
                BuiltinFunction.variadic("concat", TextFunctions::concat),
                new BuiltinFunction("left", 1, 2, TextFunctions::left),
                new BuiltinFunction("right", 1, 2, TextFunctions::right),
                new BuiltinFunction("mid", 3, 3, TextFunctions::mid),
                new BuiltinFunction("substr", 2, 3, TextFunctions::mid),
                new BuiltinFunction("len", 1, 1,
                        args -> Args.text(args.get(0), s -> new NumberValue(s.length()))),
                new BuiltinFunction("upper", 1, 1,
                        args -> Args.text(args.get(0), s -> Args.textOf(s.toUpperCase(Locale.ROOT)))),
                new BuiltinFunction("lower", 1, 1,
                        args -> Args.text(args.get(0), s -> Args.textOf(s.toLowerCase(Locale.ROOT)))),
                new BuiltinFunction("trim", 1, 1,
                        args -> Args.text(args.get(0), s -> Args.textOf(s.trim().replaceAll(" {2,}", " ")))),
                new BuiltinFunction("replace", 4, 4, TextFunctions::replace)
        );
    }

    private static Value concat(List<Value> args) {
        StringBuilder sb = new StringBuilder();
        for (ScalarValue value : Args.flatten(args)) {
            if (value instanceof ErrorValue) {
                return value;
            }
            sb.append(value.toText().value());
        }
        return Args.textOf(sb.toString());
    }

    private static Value left(List<Value> args) {
        Optional<Integer> count = args.size() > 1 ? Args.integer(args.get(1)) : Optional.of(1);
        return Args.text(args.get(0), s -> {
            if (count.isEmpty() || count.get() < 0) {
                return ErrorValue.of(ErrorCode.VALUE);
            }
            return Args.textOf(s.substring(0, Math.min(count.get(), s.length())));
        });
    }

    private static Value right(List<Value> args) {
        Optional<Integer> count = args.size() > 1 ? Args.integer(args.get(1)) : Optional.of(1);
        return Args.text(args.get(0), s -> {
            if (count.isEmpty() || count.get() < 0) {
                return ErrorValue.of(ErrorCode.VALUE);
            }
            return Args.textOf(s.substring(Math.max(0, s.length() - count.get())));
        });
    }

    /**
     * {@code mid(text, start, count)}; without count, up to the end of the text.
     */
    private static Value mid(List<Value> args) {
        Optional<Integer> start = Args.integer(args.get(1));
        Optional<Integer> count = args.size() > 2 ? Args.integer(args.get(2)) : Optional.of(Integer.MAX_VALUE);
        return Args.text(args.get(0), s -> {
            if (start.isEmpty() || count.isEmpty() || start.get() < 1 || count.get() < 0) {
                return ErrorValue.of(ErrorCode.VALUE);
            }
            int from = Math.min(start.get() - 1, s.length());
            int to = (int) Math.min((long) from + count.get(), s.length());
            return Args.textOf(s.substring(from, to));
        });
    }

    /**
     * {@code replace(text, start, count, replacement)}.
     */
    private static Value replace(List<Value> args) {
        Optional<Integer> start = Args.integer(args.get(1));
        Optional<Integer> count = Args.integer(args.get(2));
        ScalarValue replacement = Args.scalar(args.get(3));
        if (replacement.isError()) {
            return replacement;
        }
        return Args.text(args.get(0), s -> {
            if (start.isEmpty() || count.isEmpty() || start.get() < 1 || count.get() < 0) {
                return ErrorValue.of(ErrorCode.VALUE);
            }
            int from = Math.min(start.get() - 1, s.length());
            int to = (int) Math.min((long) from + count.get(), s.length());
            return Args.textOf(s.substring(0, from) + replacement.toText().value() + s.substring(to));
        });
    }
}
