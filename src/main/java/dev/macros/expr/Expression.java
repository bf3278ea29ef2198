package dev.macros.expr;

/**
 * Parsed expression tree. Only literals, variable lookups, member/index access and
 * boolean, comparison and arithmetic operators exist; nothing can call code.
 */
public sealed interface Expression {

    record Literal(Object value) implements Expression {}

    /** Variable lookup by name; {@code variables} names the whole variable map. */
    record Variable(String name) implements Expression {}

    /** {@code target.name} on a map value. */
    record Member(Expression target, String name) implements Expression {}

    /** {@code target[key]} on a map or list value. */
    record Index(Expression target, Expression key) implements Expression {}

    record Unary(Operator operator, Expression operand) implements Expression {}

    record Binary(Operator operator, Expression left, Expression right) implements Expression {}

    enum Operator {
        NOT("!"), NEGATE("-"),
        AND("&&"), OR("||"),
        EQ("=="), NE("!="), LT("<"), LE("<="), GT(">"), GE(">="),
        ADD("+"), SUBTRACT("-"), MULTIPLY("*"), DIVIDE("/"), MODULO("%");

        private final String symbol;

        Operator(String symbol) {
            this.symbol = symbol;
        }

        public String symbol() {
            return symbol;
        }
    }

    /** Parse {@code source}, throwing {@link ExpressionException} on malformed input. */
    static Expression parse(String source) {
        return ExpressionParser.parse(source);
    }
}
