package dev.macros.expr;

import dev.macros.expr.Expression.Operator;

import java.util.List;

/**
 * Recursive-descent parser. Precedence, loosest first:
 * {@code or, and, not, comparison, + -, * / %, unary -, postfix (. [])}.
 */
final class ExpressionParser {

    private final List<Token> tokens;
    private int pos;

    private ExpressionParser(List<Token> tokens) {
        this.tokens = tokens;
    }

    static Expression parse(String source) {
        if (source == null || source.isBlank()) {
            throw new ExpressionException("Empty expression");
        }
        var parser = new ExpressionParser(ExpressionLexer.tokenize(source));
        Expression expression = parser.or();
        Token trailing = parser.peek();
        if (trailing.type() != Token.Type.EOF) {
            throw new ExpressionException("Unexpected '%s' at %d".formatted(trailing.text(), trailing.position()));
        }
        return expression;
    }

    private Expression or() {
        Expression left = and();
        while (accept(Token.Type.OR)) {
            left = new Expression.Binary(Operator.OR, left, and());
        }
        return left;
    }

    private Expression and() {
        Expression left = not();
        while (accept(Token.Type.AND)) {
            left = new Expression.Binary(Operator.AND, left, not());
        }
        return left;
    }

    private Expression not() {
        if (accept(Token.Type.NOT)) {
            return new Expression.Unary(Operator.NOT, not());
        }
        return comparison();
    }

    private Expression comparison() {
        Expression left = additive();
        Operator operator = switch (peek().type()) {
            case EQ -> Operator.EQ;
            case NE -> Operator.NE;
            case LT -> Operator.LT;
            case LE -> Operator.LE;
            case GT -> Operator.GT;
            case GE -> Operator.GE;
            default -> null;
        };
        if (operator == null) {
            return left;
        }
        pos++;
        return new Expression.Binary(operator, left, additive());
    }

    private Expression additive() {
        Expression left = multiplicative();
        while (true) {
            if (accept(Token.Type.PLUS)) {
                left = new Expression.Binary(Operator.ADD, left, multiplicative());
            } else if (accept(Token.Type.MINUS)) {
                left = new Expression.Binary(Operator.SUBTRACT, left, multiplicative());
            } else {
                return left;
            }
        }
    }

    private Expression multiplicative() {
        Expression left = unary();
        while (true) {
            if (accept(Token.Type.STAR)) {
                left = new Expression.Binary(Operator.MULTIPLY, left, unary());
            } else if (accept(Token.Type.SLASH)) {
                left = new Expression.Binary(Operator.DIVIDE, left, unary());
            } else if (accept(Token.Type.PERCENT)) {
                left = new Expression.Binary(Operator.MODULO, left, unary());
            } else {
                return left;
            }
        }
    }

    private Expression unary() {
        if (accept(Token.Type.MINUS)) {
            return new Expression.Unary(Operator.NEGATE, unary());
        }
        return postfix();
    }

    private Expression postfix() {
        Expression target = primary();
        while (true) {
            if (accept(Token.Type.DOT)) {
                Token name = expect(Token.Type.IDENT, "member name");
                target = new Expression.Member(target, name.text());
            } else if (accept(Token.Type.LBRACKET)) {
                Expression key = or();
                expect(Token.Type.RBRACKET, "']'");
                target = new Expression.Index(target, key);
            } else {
                return target;
            }
        }
    }

    private Expression primary() {
        Token token = peek();
        pos++;
        switch (token.type()) {
            case NUMBER:
                return new Expression.Literal(number(token));
            case STRING:
                return new Expression.Literal(token.text());
            case TRUE:
                return new Expression.Literal(Boolean.TRUE);
            case FALSE:
                return new Expression.Literal(Boolean.FALSE);
            case NULL:
                return new Expression.Literal(null);
            case IDENT:
                return new Expression.Variable(token.text());
            case LPAREN:
                Expression inner = or();
                expect(Token.Type.RPAREN, "')'");
                return inner;
            default:
                throw new ExpressionException(token.type() == Token.Type.EOF
                    ? "Unexpected end of expression"
                    : "Unexpected '%s' at %d".formatted(token.text(), token.position()));
        }
    }

    private static Object number(Token token) {
        try {
            return token.text().contains(".")
                ? (Object) Double.valueOf(token.text())
                : (Object) Long.valueOf(token.text());
        } catch (NumberFormatException e) {
            throw new ExpressionException("Number out of range at %d: %s".formatted(token.position(), token.text()));
        }
    }

    private Token peek() {
        return tokens.get(pos);
    }

    private boolean accept(Token.Type type) {
        if (peek().type() == type) {
            pos++;
            return true;
        }
        return false;
    }

    private Token expect(Token.Type type, String what) {
        Token token = peek();
        if (token.type() != type) {
            throw new ExpressionException("Expected %s at %d".formatted(what, token.position()));
        }
        pos++;
        return token;
    }
}
