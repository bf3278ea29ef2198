package dev.macros.expr;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ExpressionParserTest {

    @Test
    void parsesComparisonIntoBinaryTree() {
        Expression e = Expression.parse("a + 1 > b");

        assertThat(e).isInstanceOf(Expression.Binary.class);
        Expression.Binary top = (Expression.Binary) e;
        assertThat(top.operator()).isEqualTo(Expression.Operator.GT);
        assertThat(top.left()).isInstanceOf(Expression.Binary.class);
        assertThat(top.right()).isEqualTo(new Expression.Variable("b"));
    }

    @Test
    void rejectsTrailingTokens() {
        assertThatThrownBy(() -> Expression.parse("a b")).isInstanceOf(ExpressionException.class);
    }

    @Test
    void rejectsUnterminatedString() {
        assertThatThrownBy(() -> Expression.parse("'open")).isInstanceOf(ExpressionException.class);
    }

    @Test
    void rejectsCallsAndAssignment() {
        assertThatThrownBy(() -> Expression.parse("exit()")).isInstanceOf(ExpressionException.class);
        assertThatThrownBy(() -> Expression.parse("a = 1")).isInstanceOf(ExpressionException.class);
    }

    @Test
    void rejectsOversizedIntegerLiteral() {
        assertThatThrownBy(() -> Expression.parse("99999999999999999999")).isInstanceOf(ExpressionException.class);
    }
}
