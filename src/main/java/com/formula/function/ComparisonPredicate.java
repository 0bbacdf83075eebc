package com.formula.function;

import com.formula.ast.BinaryOperator;
import com.formula.eval.Evaluator;
import com.formula.exception.IncompatibleTypeException;
import com.formula.value.ScalarValue;

import java.util.Objects;

/**
 * Predicate comparing each value with a fixed operand, e.g. the {@code > 2} of {@code countif(A1:A9 > 2)}.
 * Values of another variant than the operand never match.
 */
public final class ComparisonPredicate implements Predicate {

    private final BinaryOperator op;
    private final ScalarValue operand;

    public ComparisonPredicate(BinaryOperator op, ScalarValue operand) {
        if (!op.isComparison()) {
            throw new IllegalArgumentException("Not a comparison operator: " + op);
        }
        this.op = op;
        this.operand = Objects.requireNonNull(operand, "operand");
    }

    @Override
    public boolean test(ScalarValue value) {
        try {
            return Evaluator.compare(op, value, operand);
        } catch (IncompatibleTypeException e) {
            return false;
        }
    }

    public BinaryOperator getOp() {
        return op;
    }

    public ScalarValue getOperand() {
        return operand;
    }

    @Override
    public String toString() {
        return op.getSymbol() + " " + operand;
    }
}
