package dev.macros.expr;

import org.junit.jupiter.api.Test;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ExpressionEvaluatorTest {

    private final Map<String, Object> vars = new HashMap<>();

    private Object eval(String source) {
        return ExpressionEvaluator.evaluate(Expression.parse(source), vars::get, vars);
    }

    @Test
    void arithmeticFollowsPrecedence() {
        assertThat(eval("1 + 2 * 3")).isEqualTo(7L);
        assertThat(eval("(1 + 2) * 3")).isEqualTo(9L);
        assertThat(eval("7 / 2")).isEqualTo(3.5);
        assertThat(eval("-7 % 3")).isEqualTo(2L);
    }

    @Test
    void comparesNumbersByValueAcrossTypes() {
        vars.put("count", 3);
        assertThat(eval("count == 3.0")).isEqualTo(true);
        assertThat(eval("count >= 3 and count < 4")).isEqualTo(true);
    }

    @Test
    void acceptsWordAndSymbolLogicalOperators() {
        vars.put("ready", true);
        assertThat(eval("ready && !false")).isEqualTo(true);
        assertThat(eval("not ready or False")).isEqualTo(false);
    }

    @Test
    void undefinedVariablesReadAsNull() {
        assertThat(eval("missing == null")).isEqualTo(true);
        assertThat(eval("missing == None")).isEqualTo(true);
    }

    @Test
    void arithmeticOnNullFails() {
        assertThatThrownBy(() -> eval("missing + 1"))
            .isInstanceOf(ExpressionException.class);
    }

    @Test
    void orderingMismatchedTypesFails() {
        vars.put("name", "abc");
        assertThatThrownBy(() -> eval("name > 1")).isInstanceOf(ExpressionException.class);
    }

    @Test
    void divisionByZeroFails() {
        assertThatThrownBy(() -> eval("1 / 0")).isInstanceOf(ExpressionException.class);
    }

    @Test
    void readsNestedResultsByMemberAndIndex() {
        vars.put("crop_result", Map.of("x", 12, "y", 40, "confidence", 0.98));
        vars.put("items", List.of("a", "b"));

        assertThat(eval("crop_result.x + crop_result['y']")).isEqualTo(52L);
        assertThat(eval("crop_result.confidence > 0.9")).isEqualTo(true);
        assertThat(eval("items[1]")).isEqualTo("b");
        assertThat(eval("variables['crop_result'].x")).isEqualTo(12L);
    }

    @Test
    void stringsConcatenateAndCompare() {
        vars.put("who", "bob");
        assertThat(eval("'hi ' + who")).isEqualTo("hi bob");
        assertThat(eval("who == \"bob\"")).isEqualTo(true);
    }

    @Test
    void truthiness() {
        assertThat(ExpressionEvaluator.isTruthy(null)).isFalse();
        assertThat(ExpressionEvaluator.isTruthy(0L)).isFalse();
        assertThat(ExpressionEvaluator.isTruthy("")).isFalse();
        assertThat(ExpressionEvaluator.isTruthy(List.of())).isFalse();
        assertThat(ExpressionEvaluator.isTruthy(2.5)).isTrue();
        assertThat(ExpressionEvaluator.isTruthy("x")).isTrue();
    }
}
