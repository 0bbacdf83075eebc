package com.formula.ast;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Function call.
 *
 * @param callee Expression giving the function, usually an {@link Identifier}
 * @param args   Arguments, in order
 */
public record CallExpr(Expr callee, List<Expr> args) implements Expr {

    public CallExpr {
        args = List.copyOf(args);
    }

    @Override
    public <R> R accept(ExprVisitor<R> visitor) {
        return visitor.visitCall(this);
    }

    @Override
    public Expr cloneWithOffset(long lines, long columns) {
        List<Expr> moved = args.stream()
                .map(arg -> arg.cloneWithOffset(lines, columns))
                .collect(Collectors.toList());
        return new CallExpr(callee, moved);
    }

    @Override
    public String toString() {
        return callee + "(" + args.stream().map(Expr::toString).collect(Collectors.joining(", ")) + ")";
    }
}
