package com.formula.parse;

import com.formula.ast.BinaryExpr;
import com.formula.ast.BinaryOperator;
import com.formula.ast.CallExpr;
import com.formula.ast.CellRef;
import com.formula.ast.Expr;
import com.formula.ast.Identifier;
import com.formula.ast.NumberLiteral;
import com.formula.ast.RangeRef;
import com.formula.ast.TextLiteral;
import com.formula.ast.UnaryExpr;
import com.formula.ast.UnaryOperator;
import com.formula.layout.AddressCodec;
import com.formula.layout.Position;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Prefix and infix tables of the formula language.
 * <p>
 * Instances are immutable once built and can be shared by several parsers.
 */
public final class Grammar {

    private final Map<TokenType, PrefixRule> prefixes;
    private final Map<TokenType, InfixRule> infixes;
    private final Map<TokenType, BindingPower> powers;

    private Grammar(Map<TokenType, PrefixRule> prefixes,
                    Map<TokenType, InfixRule> infixes,
                    Map<TokenType, BindingPower> powers) {
        this.prefixes = Collections.unmodifiableMap(prefixes);
        this.infixes = Collections.unmodifiableMap(infixes);
        this.powers = Collections.unmodifiableMap(powers);
    }

    /**
     * Build the grammar of cell formulas.
     */
    public static Grammar formula() {
        Map<TokenType, PrefixRule> prefixes = new EnumMap<>(TokenType.class);
        Map<TokenType, InfixRule> infixes = new EnumMap<>(TokenType.class);
        Map<TokenType, BindingPower> powers = new EnumMap<>(TokenType.class);

        prefixes.put(TokenType.IDENT, Grammar::parseIdentifier);
        prefixes.put(TokenType.NUMBER, Grammar::parseNumber);
        prefixes.put(TokenType.LITERAL, Grammar::parseLiteral);
        prefixes.put(TokenType.ADD, (parser, token) -> parseUnary(parser, UnaryOperator.PLUS));
        prefixes.put(TokenType.SUB, (parser, token) -> parseUnary(parser, UnaryOperator.MINUS));
        prefixes.put(TokenType.BEG_GROUP, Grammar::parseGroup);

        infixes.put(TokenType.BEG_GROUP, Grammar::parseCall);
        powers.put(TokenType.BEG_GROUP, BindingPower.CALL);

        binary(infixes, powers, TokenType.ADD, BinaryOperator.ADD, BindingPower.ADDITIVE);
        binary(infixes, powers, TokenType.SUB, BinaryOperator.SUB, BindingPower.ADDITIVE);
        binary(infixes, powers, TokenType.MUL, BinaryOperator.MUL, BindingPower.MULTIPLICATIVE);
        binary(infixes, powers, TokenType.DIV, BinaryOperator.DIV, BindingPower.MULTIPLICATIVE);
        binary(infixes, powers, TokenType.CONCAT, BinaryOperator.CONCAT, BindingPower.CONCAT);
        binary(infixes, powers, TokenType.EQ, BinaryOperator.EQ, BindingPower.EQUALITY);
        binary(infixes, powers, TokenType.NE, BinaryOperator.NE, BindingPower.EQUALITY);
        binary(infixes, powers, TokenType.LT, BinaryOperator.LT, BindingPower.COMPARISON);
        binary(infixes, powers, TokenType.LE, BinaryOperator.LE, BindingPower.COMPARISON);
        binary(infixes, powers, TokenType.GT, BinaryOperator.GT, BindingPower.COMPARISON);
        binary(infixes, powers, TokenType.GE, BinaryOperator.GE, BindingPower.COMPARISON);

        // right-associative: 2^3^2 is 2^(3^2)
        infixes.put(TokenType.POW, (parser, left, token) -> new BinaryExpr(BinaryOperator.POW, left,
                parser.parseExpression(BindingPower.POWER.value() - 1)));
        powers.put(TokenType.POW, BindingPower.POWER);

        infixes.put(TokenType.PERCENT, (parser, left, token) -> new UnaryExpr(UnaryOperator.PERCENT, left));
        powers.put(TokenType.PERCENT, BindingPower.PERCENT);

        return new Grammar(prefixes, infixes, powers);
    }

    public PrefixRule prefix(TokenType type) {
        return prefixes.get(type);
    }

    public InfixRule infix(TokenType type) {
        return infixes.get(type);
    }

    /**
     * Binding power of a token in infix position, {@link BindingPower#LOWEST} when it has no infix rule.
     */
    public BindingPower power(TokenType type) {
        return powers.getOrDefault(type, BindingPower.LOWEST);
    }

    private static void binary(Map<TokenType, InfixRule> infixes, Map<TokenType, BindingPower> powers,
                               TokenType type, BinaryOperator op, BindingPower power) {
        infixes.put(type, (parser, left, token) -> new BinaryExpr(op, left, parser.parseExpression(power.value())));
        powers.put(type, power);
    }

    private static Expr parseNumber(FormulaParser parser, Token token) {
        try {
            return new NumberLiteral(Double.parseDouble(token.literal()));
        } catch (NumberFormatException e) {
            throw parser.error(token, "invalid number " + token.literal());
        }
    }

    private static Expr parseLiteral(FormulaParser parser, Token token) {
        if (parser.check(TokenType.SHEET_REF)) {
            return parseQualified(parser, token.literal());
        }
        return new TextLiteral(token.literal());
    }

    private static Expr parseUnary(FormulaParser parser, UnaryOperator op) {
        return new UnaryExpr(op, parser.parseExpression(BindingPower.UNARY.value()));
    }

    private static Expr parseGroup(FormulaParser parser, Token token) {
        Expr expr = parser.parseExpression(BindingPower.LOWEST.value());
        parser.expect(TokenType.END_GROUP, "missing closing parenthesis");
        return expr;
    }

    private static Expr parseCall(FormulaParser parser, Expr callee, Token token) {
        List<Expr> args = new ArrayList<>();
        if (parser.check(TokenType.END_GROUP)) {
            parser.advance();
            return new CallExpr(callee, args);
        }
        while (true) {
            args.add(parser.parseExpression(BindingPower.LOWEST.value()));
            if (parser.check(TokenType.COMMA)) {
                parser.advance();
                continue;
            }
            parser.expect(TokenType.END_GROUP, "missing closing parenthesis after arguments");
            return new CallExpr(callee, args);
        }
    }

    /**
     * An identifier is the target of a call, a sheet qualifier, a cell address or a plain name,
     * depending on what follows it.
     */
    private static Expr parseIdentifier(FormulaParser parser, Token token) {
        if (token.literal().indexOf('$') >= 0 && AddressCodec.tryDecode(token.literal()).isEmpty()) {
            throw parser.error(token, token.literal() + ": invalid cell address");
        }
        if (parser.check(TokenType.BEG_GROUP)) {
            return new Identifier(token.literal());
        }
        if (parser.check(TokenType.SHEET_REF)) {
            return parseQualified(parser, token.literal());
        }
        Optional<Position> position = AddressCodec.tryDecode(token.literal());
        if (position.isEmpty()) {
            return new Identifier(token.literal());
        }
        return parseRangeTail(parser, new CellRef(position.get()));
    }

    private static Expr parseQualified(FormulaParser parser, String sheet) {
        parser.advance(); // '!'
        Position position = expectAddress(parser).withSheet(sheet);
        return parseRangeTail(parser, new CellRef(position));
    }

    private static Expr parseRangeTail(FormulaParser parser, CellRef start) {
        if (!parser.check(TokenType.RANGE_REF)) {
            return start;
        }
        parser.advance(); // ':'
        Token at = parser.current();
        String sheet = null;
        if ((at.is(TokenType.IDENT) || at.is(TokenType.LITERAL)) && parser.lookahead().is(TokenType.SHEET_REF)) {
            sheet = parser.advance().literal();
            parser.advance();
        }
        Position end = expectAddress(parser);
        if (sheet != null && !sheet.equals(start.position().sheet())) {
            throw parser.error(at, "range spans multiple sheets");
        }
        return new RangeRef(start, new CellRef(end.withSheet(start.position().sheet())));
    }

    private static Position expectAddress(FormulaParser parser) {
        Token token = parser.current();
        if (!token.is(TokenType.IDENT)) {
            throw parser.error(token, "expected cell address, got " + token);
        }
        Optional<Position> position = AddressCodec.tryDecode(token.literal());
        if (position.isEmpty() || position.get().isQualified()) {
            throw parser.error(token, token.literal() + ": invalid cell address");
        }
        parser.advance();
        return position.get();
    }
}
