package com.formula.eval;

import com.formula.ast.BinaryExpr;
import com.formula.ast.Expr;
import com.formula.context.Context;
import com.formula.function.ComparisonPredicate;
import com.formula.function.Filter;
import com.formula.value.ScalarValue;
import com.formula.value.Value;

import java.util.Objects;
import java.util.Optional;

/**
 * Argument of a function call.
 * <p>
 * Most functions simply evaluate their arguments. Reducers first ask whether the argument
 * reads as a predicate, e.g. {@code A1:A9 > 2}, to filter the data they aggregate.
 */
public sealed interface Argument permits Argument.ExprArgument, Argument.ValueArgument {

    Value eval(Context ctx);

    /**
     * Read the argument as {@code source <op> operand}.
     *
     * @return Filter over the left operand, empty if the argument is not a comparison
     */
    Optional<Filter> tryAsPredicate(Context ctx);

    /**
     * Argument taken from the formula text, evaluated on demand.
     */
    record ExprArgument(Expr expr, Evaluator evaluator) implements Argument {

        public ExprArgument {
            Objects.requireNonNull(expr, "expr");
            Objects.requireNonNull(evaluator, "evaluator");
        }

        @Override
        public Value eval(Context ctx) {
            return evaluator.evaluate(expr, ctx);
        }

        @Override
        public Optional<Filter> tryAsPredicate(Context ctx) {
            if (!(expr instanceof BinaryExpr bin) || !bin.op().isComparison()) {
                return Optional.empty();
            }
            Value source = evaluator.evaluate(bin.left(), ctx);
            Value operand = evaluator.evaluate(bin.right(), ctx);
            if (!(operand instanceof ScalarValue scalar)) {
                return Optional.empty();
            }
            return Optional.of(new Filter(new ComparisonPredicate(bin.op(), scalar), source));
        }
    }

    /**
     * Argument whose value is already known.
     */
    record ValueArgument(Value value) implements Argument {

        public ValueArgument {
            Objects.requireNonNull(value, "value");
        }

        @Override
        public Value eval(Context ctx) {
            return value;
        }

        @Override
        public Optional<Filter> tryAsPredicate(Context ctx) {
            return Optional.empty();
        }
    }
}
