package com.formula.eval;

import com.formula.ast.BinaryExpr;
import com.formula.ast.BinaryOperator;
import com.formula.ast.CallExpr;
import com.formula.ast.CellRef;
import com.formula.ast.Expr;
import com.formula.ast.ExprVisitor;
import com.formula.ast.Identifier;
import com.formula.ast.NumberLiteral;
import com.formula.ast.RangeRef;
import com.formula.ast.TextLiteral;
import com.formula.ast.UnaryExpr;
import com.formula.ast.UnaryOperator;
import com.formula.context.Context;
import com.formula.exception.IncompatibleTypeException;
import com.formula.exception.NotCallableException;
import com.formula.exception.UndefinedIdentifierException;
import com.formula.layout.Position;
import com.formula.value.ArrayValue;
import com.formula.value.BooleanValue;
import com.formula.value.ErrorCode;
import com.formula.value.ErrorValue;
import com.formula.value.FunctionValue;
import com.formula.value.NumberValue;
import com.formula.value.ScalarValue;
import com.formula.value.TextValue;
import com.formula.value.Value;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Tree-walking evaluator.
 * <p>
 * Bad data never throws: it produces an {@link ErrorValue} which then flows through the
 * rest of the formula unchanged. Exceptions are reserved for structural failures such as
 * an unknown identifier, calling something that is not a function or a circular reference.
 * <p>
 * The evaluator is stateless and can be shared between threads.
 */
public class Evaluator {

    /**
     * Evaluate an expression.
     *
     * @param expr Expression to evaluate
     * @param ctx  Context resolving identifiers and cell references
     * @return Result of the expression
     */
    public Value evaluate(Expr expr, Context ctx) {
        return expr.accept(new Walker(ctx));
    }

    /**
     * Compare two scalars with a comparison operator.
     *
     * @throws IncompatibleTypeException if the scalars are of different variants
     */
    public static boolean compare(BinaryOperator op, ScalarValue left, ScalarValue right) {
        return switch (op) {
            case EQ -> left.equal(right);
            case NE -> !left.equal(right);
            case LT -> left.less(right);
            case LE -> left.equal(right) || left.less(right);
            case GT -> !left.equal(right) && !left.less(right);
            case GE -> left.equal(right) || !left.less(right);
            default -> throw new IllegalArgumentException("Not a comparison operator: " + op);
        };
    }

    /**
     * Apply a binary operator to two scalars.
     * An error operand is returned as is, the left one first.
     */
    static ScalarValue combine(BinaryOperator op, ScalarValue left, ScalarValue right) {
        if (left instanceof ErrorValue) {
            return left;
        }
        if (right instanceof ErrorValue) {
            return right;
        }
        if (op == BinaryOperator.CONCAT) {
            return new TextValue(left.toText().value() + right.toText().value());
        }
        if (op.isComparison()) {
            try {
                return BooleanValue.of(compare(op, left, right));
            } catch (IncompatibleTypeException e) {
                return ErrorValue.of(ErrorCode.VALUE);
            }
        }
        return arithmetic(op, left, right);
    }

    private static ScalarValue arithmetic(BinaryOperator op, ScalarValue left, ScalarValue right) {
        ScalarValue lhs = left.toNumber();
        if (!(lhs instanceof NumberValue l)) {
            return lhs;
        }
        ScalarValue rhs = right.toNumber();
        if (!(rhs instanceof NumberValue r)) {
            return rhs;
        }
        switch (op) {
            case ADD:
                return new NumberValue(l.value() + r.value());
            case SUB:
                return new NumberValue(l.value() - r.value());
            case MUL:
                return new NumberValue(l.value() * r.value());
            case DIV:
                if (r.value() == 0) {
                    return ErrorValue.of(ErrorCode.DIV0);
                }
                return new NumberValue(l.value() / r.value());
            case POW:
                double res = Math.pow(l.value(), r.value());
                if (Double.isNaN(res) || Double.isInfinite(res)) {
                    return ErrorValue.of(ErrorCode.NUM);
                }
                return new NumberValue(res);
            default:
                throw new IllegalArgumentException("Not an arithmetic operator: " + op);
        }
    }

    private static ScalarValue applyUnary(UnaryOperator op, ScalarValue value) {
        if (value instanceof ErrorValue) {
            return value;
        }
        if (!(value instanceof NumberValue n)) {
            return ErrorValue.of(ErrorCode.VALUE);
        }
        return switch (op) {
            case MINUS -> new NumberValue(-n.value());
            case PERCENT -> new NumberValue(n.value() / 100);
            case PLUS -> n;
        };
    }

    private final class Walker implements ExprVisitor<Value> {

        private final Context ctx;

        Walker(Context ctx) {
            this.ctx = ctx;
        }

        @Override
        public Value visitIdentifier(Identifier expr) {
            return ctx.resolve(expr.name());
        }

        @Override
        public Value visitNumber(NumberLiteral expr) {
            return new NumberValue(expr.value());
        }

        @Override
        public Value visitText(TextLiteral expr) {
            return new TextValue(expr.value());
        }

        @Override
        public Value visitUnary(UnaryExpr expr) {
            Value operand = expr.operand().accept(this);
            if (operand instanceof ArrayValue array) {
                return array.apply(v -> applyUnary(expr.op(), v));
            }
            if (operand instanceof ScalarValue scalar) {
                return applyUnary(expr.op(), scalar);
            }
            return ErrorValue.of(ErrorCode.VALUE);
        }

        @Override
        public Value visitBinary(BinaryExpr expr) {
            Value left = expr.left().accept(this);
            if (left.isError()) {
                return left;
            }
            Value right = expr.right().accept(this);
            if (right.isError()) {
                return right;
            }
            if (left instanceof ArrayValue || right instanceof ArrayValue) {
                ArrayValue lhs = asArray(left);
                ArrayValue rhs = asArray(right);
                if (lhs == null || rhs == null) {
                    return ErrorValue.of(ErrorCode.VALUE);
                }
                return lhs.applyWith(rhs, (l, r) -> combine(expr.op(), l, r));
            }
            if (left instanceof ScalarValue l && right instanceof ScalarValue r) {
                return combine(expr.op(), l, r);
            }
            return ErrorValue.of(ErrorCode.VALUE);
        }

        @Override
        public Value visitCall(CallExpr expr) {
            Value callee;
            String name = expr.callee().toString();
            if (expr.callee() instanceof Identifier id) {
                try {
                    callee = ctx.resolve(id.name());
                } catch (UndefinedIdentifierException e) {
                    return ErrorValue.of(ErrorCode.NAME);
                }
            } else {
                callee = expr.callee().accept(this);
            }
            if (callee.isError()) {
                return callee;
            }
            if (!(callee instanceof FunctionValue fn)) {
                throw new NotCallableException(name);
            }
            List<Argument> args = expr.args().stream()
                    .map(arg -> new Argument.ExprArgument(arg, Evaluator.this))
                    .collect(Collectors.toList());
            return fn.call(args, ctx);
        }

        @Override
        public Value visitCell(CellRef expr) {
            return ctx.at(expr.position());
        }

        @Override
        public Value visitRange(RangeRef expr) {
            Position start = expr.start().position();
            Position end = expr.end().position();
            if (end.isQualified() && !end.sheet().equals(start.sheet())) {
                return ErrorValue.of(ErrorCode.REF);
            }
            return ctx.range(start, end.withSheet(start.sheet()));
        }

        private ArrayValue asArray(Value value) {
            if (value instanceof ArrayValue array) {
                return array;
            }
            if (value instanceof ScalarValue scalar) {
                return ArrayValue.scalar(scalar);
            }
            return null;
        }
    }
}
