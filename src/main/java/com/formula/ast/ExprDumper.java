package com.formula.ast;

import com.formula.layout.AddressCodec;
import com.formula.layout.Position;
import com.formula.value.NumberValue;

import java.util.stream.Collectors;

/**
 * Renders the structure of an expression tree, e.g.
 * {@code binary(number(1), binary(number(1), number(2), *), +)} for {@code 1+1*2}.
 * Used in tests and debug logs.
 */
public final class ExprDumper implements ExprVisitor<String> {

    private static final ExprDumper INSTANCE = new ExprDumper();

    private ExprDumper() {
    }

    public static String dump(Expr expr) {
        return expr.accept(INSTANCE);
    }

    @Override
    public String visitIdentifier(Identifier expr) {
        return "identifier(" + expr.name() + ")";
    }

    @Override
    public String visitNumber(NumberLiteral expr) {
        return "number(" + NumberValue.format(expr.value()) + ")";
    }

    @Override
    public String visitText(TextLiteral expr) {
        return "literal(" + expr.value() + ")";
    }

    @Override
    public String visitUnary(UnaryExpr expr) {
        return "unary(" + expr.operand().accept(this) + ", " + expr.op().getSymbol() + ")";
    }

    @Override
    public String visitBinary(BinaryExpr expr) {
        return "binary(" + expr.left().accept(this) + ", " + expr.right().accept(this)
                + ", " + expr.op().getSymbol() + ")";
    }

    @Override
    public String visitCall(CallExpr expr) {
        String args = expr.args().stream()
                .map(arg -> arg.accept(this))
                .collect(Collectors.joining(", "));
        return "call(" + expr.callee().accept(this) + ", args: " + args + ")";
    }

    @Override
    public String visitCell(CellRef expr) {
        Position pos = expr.position();
        String address = AddressCodec.encode(new Position(null, pos.column(), pos.row(), false, false));
        if (pos.isQualified()) {
            address = pos.sheet() + "!" + address;
        }
        return "cell(" + address + ", " + pos.absoluteColumn() + ", " + pos.absoluteRow() + ")";
    }

    @Override
    public String visitRange(RangeRef expr) {
        return "range(" + visitCell(expr.start()) + ", " + visitCell(expr.end()) + ")";
    }
}
