package dev.macros.expr;

import dev.macros.expr.Expression.Operator;

import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.function.Function;

/**
 * Tree-walking evaluator over a variable lookup. Values are {@code null}, Boolean,
 * Long, Double, String, Map and List; other numeric types are widened on read.
 */
public final class ExpressionEvaluator {

    /** Identifier that names the whole variable map, for {@code variables["key"]} access. */
    public static final String VARIABLES_ROOT = "variables";

    private ExpressionEvaluator() {}

    /**
     * Evaluate {@code expression}. Unknown variables read as {@code null}.
     *
     * @param lookup resolves a variable name, or returns null when undefined
     * @param all    the whole variable map, bound to {@link #VARIABLES_ROOT}
     */
    public static Object evaluate(Expression expression, Function<String, Object> lookup, Map<String, Object> all) {
        if (expression instanceof Expression.Literal literal) {
            return literal.value();
        }
        if (expression instanceof Expression.Variable variable) {
            Object value = lookup.apply(variable.name());
            if (value == null && VARIABLES_ROOT.equals(variable.name())) {
                return all;
            }
            return normalize(value);
        }
        if (expression instanceof Expression.Member member) {
            Object target = evaluate(member.target(), lookup, all);
            if (target instanceof Map<?, ?> map) {
                return normalize(map.get(member.name()));
            }
            throw new ExpressionException("Cannot read '%s' of %s".formatted(member.name(), describe(target)));
        }
        if (expression instanceof Expression.Index index) {
            return index(evaluate(index.target(), lookup, all), evaluate(index.key(), lookup, all));
        }
        if (expression instanceof Expression.Unary unary) {
            Object operand = evaluate(unary.operand(), lookup, all);
            if (unary.operator() == Operator.NOT) {
                return !isTruthy(operand);
            }
            if (operand instanceof Long l) {
                return -l;
            }
            if (operand instanceof Double d) {
                return -d;
            }
            throw new ExpressionException("Cannot negate " + describe(operand));
        }
        if (expression instanceof Expression.Binary binary) {
            return binary(binary, lookup, all);
        }
        throw new IllegalStateException("Unhandled expression node: " + expression);
    }

    /** Evaluate and reduce to a boolean with {@link #isTruthy}. */
    public static boolean test(Expression expression, Function<String, Object> lookup, Map<String, Object> all) {
        return isTruthy(evaluate(expression, lookup, all));
    }

    /**
     * null, false, zero, and empty strings/collections are false; everything else is true.
     */
    public static boolean isTruthy(Object value) {
        if (value == null) {
            return false;
        }
        if (value instanceof Boolean b) {
            return b;
        }
        if (value instanceof Number n) {
            return n.doubleValue() != 0.0;
        }
        if (value instanceof String s) {
            return !s.isEmpty();
        }
        if (value instanceof Map<?, ?> m) {
            return !m.isEmpty();
        }
        if (value instanceof List<?> l) {
            return !l.isEmpty();
        }
        return true;
    }

    private static Object binary(Expression.Binary binary, Function<String, Object> lookup, Map<String, Object> all) {
        Operator op = binary.operator();
        if (op == Operator.AND) {
            return test(binary.left(), lookup, all) && test(binary.right(), lookup, all);
        }
        if (op == Operator.OR) {
            return test(binary.left(), lookup, all) || test(binary.right(), lookup, all);
        }

        Object left = evaluate(binary.left(), lookup, all);
        Object right = evaluate(binary.right(), lookup, all);

        switch (op) {
            case EQ:
                return equalValues(left, right);
            case NE:
                return !equalValues(left, right);
            case LT:
                return compare(op, left, right) < 0;
            case LE:
                return compare(op, left, right) <= 0;
            case GT:
                return compare(op, left, right) > 0;
            case GE:
                return compare(op, left, right) >= 0;
            case ADD:
                if (left instanceof String || right instanceof String) {
                    return String.valueOf(left) + right;
                }
                return arithmetic(op, left, right);
            default:
                return arithmetic(op, left, right);
        }
    }

    private static Object arithmetic(Operator op, Object left, Object right) {
        if (!(left instanceof Number) || !(right instanceof Number)) {
            throw new ExpressionException("Operator '%s' needs numbers, got %s and %s"
                .formatted(op.symbol(), describe(left), describe(right)));
        }
        if (left instanceof Long a && right instanceof Long b && op != Operator.DIVIDE) {
            switch (op) {
                case ADD: return a + b;
                case SUBTRACT: return a - b;
                case MULTIPLY: return a * b;
                case MODULO:
                    if (b == 0) {
                        throw new ExpressionException("Modulo by zero");
                    }
                    return Math.floorMod(a, b);
                default: throw new IllegalStateException("Unhandled operator " + op);
            }
        }
        double a = ((Number) left).doubleValue();
        double b = ((Number) right).doubleValue();
        switch (op) {
            case ADD: return a + b;
            case SUBTRACT: return a - b;
            case MULTIPLY: return a * b;
            case DIVIDE:
                if (b == 0.0) {
                    throw new ExpressionException("Division by zero");
                }
                return a / b;
            case MODULO:
                if (b == 0.0) {
                    throw new ExpressionException("Modulo by zero");
                }
                return a % b;
            default: throw new IllegalStateException("Unhandled operator " + op);
        }
    }

    private static boolean equalValues(Object left, Object right) {
        if (left instanceof Number a && right instanceof Number b) {
            return Double.compare(a.doubleValue(), b.doubleValue()) == 0;
        }
        return Objects.equals(left, right);
    }

    private static int compare(Operator op, Object left, Object right) {
        if (left instanceof Number a && right instanceof Number b) {
            return Double.compare(a.doubleValue(), b.doubleValue());
        }
        if (left instanceof String a && right instanceof String b) {
            return a.compareTo(b);
        }
        throw new ExpressionException("Cannot order %s %s %s"
            .formatted(describe(left), op.symbol(), describe(right)));
    }

    private static Object index(Object target, Object key) {
        if (target instanceof Map<?, ?> map) {
            return normalize(map.get(key instanceof String ? key : String.valueOf(key)));
        }
        if (target instanceof List<?> list && key instanceof Long i) {
            if (i < 0 || i >= list.size()) {
                throw new ExpressionException("Index %d out of bounds for length %d".formatted(i, list.size()));
            }
            return normalize(list.get(i.intValue()));
        }
        throw new ExpressionException("Cannot index %s with %s".formatted(describe(target), describe(key)));
    }

    private static Object normalize(Object value) {
        if (value instanceof Integer || value instanceof Short || value instanceof Byte) {
            return ((Number) value).longValue();
        }
        if (value instanceof Float f) {
            return f.doubleValue();
        }
        return value;
    }

    private static String describe(Object value) {
        return value == null ? "null" : value.getClass().getSimpleName() + " " + value;
    }
}
