package org.sysmlite.engine.eval;

import org.sysmlite.kerml.m3.Element;
import org.sysmlite.kerml.m3.expression.InvocationExpression;

import java.util.List;

/**
 * {@code DataFunctions}: arithmetic, comparison, ranges and eager boolean
 * operators.
 *
 * Integers stay {@link Long} as long as the result is exact; any
 * {@link Double} operand makes the result a {@link Double}. Relational
 * operators compare numbers numerically and strings lexicographically.
 */
public final class DataFunctions {

    public static final String PACKAGE = "DataFunctions";

    private DataFunctions() {
        // Static utility class
    }

    static void register(BuiltinFunctionRegistry registry) {
        registry.register(PACKAGE, "+", new Arithmetic() {
            @Override
            Object unary(Number x, ExpressionEvaluator evaluator) {
                return x;
            }

            @Override
            Object binary(long x, long y, ExpressionEvaluator evaluator) {
                return Math.addExact(x, y);
            }

            @Override
            Object binary(double x, double y, ExpressionEvaluator evaluator) {
                return x + y;
            }

            @Override
            Object binary(String x, String y, ExpressionEvaluator evaluator) {
                return x.concat(y);
            }
        });
        registry.register(PACKAGE, "-", new Arithmetic() {
            @Override
            Object unary(Number x, ExpressionEvaluator evaluator) {
                return x instanceof Long value ? (Object) Math.negateExact(value) : (Object) (-x.doubleValue());
            }

            @Override
            Object binary(long x, long y, ExpressionEvaluator evaluator) {
                return Math.subtractExact(x, y);
            }

            @Override
            Object binary(double x, double y, ExpressionEvaluator evaluator) {
                return x - y;
            }
        });
        registry.register(PACKAGE, "*", new Arithmetic() {
            @Override
            Object binary(long x, long y, ExpressionEvaluator evaluator) {
                return Math.multiplyExact(x, y);
            }

            @Override
            Object binary(double x, double y, ExpressionEvaluator evaluator) {
                return x * y;
            }
        });
        registry.register(PACKAGE, "/", new Arithmetic() {
            @Override
            Object binary(long x, long y, ExpressionEvaluator evaluator) {
                if (y == 0) {
                    throw evaluator.error("Cannot divide by 0");
                }
                return x % y == 0 ? (Object) (x / y) : (Object) ((double) x / y);
            }

            @Override
            Object binary(double x, double y, ExpressionEvaluator evaluator) {
                if (y == 0) {
                    throw evaluator.error("Cannot divide by 0");
                }
                return x / y;
            }
        });
        registry.register(PACKAGE, "%", new Arithmetic() {
            @Override
            Object binary(long x, long y, ExpressionEvaluator evaluator) {
                if (y == 0) {
                    throw evaluator.error("Cannot use modulo operation on 0");
                }
                return x % y;
            }

            @Override
            Object binary(double x, double y, ExpressionEvaluator evaluator) {
                if (y == 0) {
                    throw evaluator.error("Cannot use modulo operation on 0");
                }
                return x % y;
            }
        });
        Arithmetic power = new Arithmetic() {
            @Override
            Object binary(long x, long y, ExpressionEvaluator evaluator) {
                if (y < 0) {
                    return Math.pow(x, y);
                }
                if (x == 0 || x == 1) {
                    return y == 0 ? 1L : x;
                }
                if (x == -1) {
                    return y % 2 == 0 ? 1L : -1L;
                }
                // exponentiation by squaring; any other base overflows within 63 steps
                long result = 1;
                long base = x;
                long exponent = y;
                while (exponent > 0) {
                    if ((exponent & 1) == 1) {
                        result = Math.multiplyExact(result, base);
                    }
                    exponent >>= 1;
                    if (exponent > 0) {
                        base = Math.multiplyExact(base, base);
                    }
                }
                return result;
            }

            @Override
            Object binary(double x, double y, ExpressionEvaluator evaluator) {
                return Math.pow(x, y);
            }
        };
        registry.register(PACKAGE, "**", power);
        registry.register(PACKAGE, "^", power);

        registry.register(PACKAGE, "<", new Comparison() {
            @Override
            boolean test(int comparison) {
                return comparison < 0;
            }
        });
        registry.register(PACKAGE, ">", new Comparison() {
            @Override
            boolean test(int comparison) {
                return comparison > 0;
            }
        });
        registry.register(PACKAGE, "<=", new Comparison() {
            @Override
            boolean test(int comparison) {
                return comparison <= 0;
            }
        });
        registry.register(PACKAGE, ">=", new Comparison() {
            @Override
            boolean test(int comparison) {
                return comparison >= 0;
            }
        });

        registry.register(PACKAGE, "..", DataFunctions::range);

        BuiltinFunction not = (expression, target, evaluator) -> List.of(!evaluator.asBoolean(expression, 0, target));
        registry.register(PACKAGE, "not", not);
        registry.register(PACKAGE, "~", not);
        registry.register(PACKAGE, "xor", (expression, target, evaluator) -> List.of(
                evaluator.asBoolean(expression, 0, target) != evaluator.asBoolean(expression, 1, target)));
        // both operands are always evaluated, unlike 'and' and 'or'
        registry.register(PACKAGE, "&", (expression, target, evaluator) -> {
            boolean x = evaluator.asBoolean(expression, 0, target);
            boolean y = evaluator.asBoolean(expression, 1, target);
            return List.of(x && y);
        });
        registry.register(PACKAGE, "|", (expression, target, evaluator) -> {
            boolean x = evaluator.asBoolean(expression, 0, target);
            boolean y = evaluator.asBoolean(expression, 1, target);
            return List.of(x || y);
        });
    }

    private static List<Object> range(InvocationExpression expression, Element target, ExpressionEvaluator evaluator) {
        long start = evaluator.asInteger(expression, 0, target);
        long stop = evaluator.asInteger(expression, 1, target);
        try {
            return new RangeSequence(start, stop);
        } catch (IllegalArgumentException e) {
            throw evaluator.error(e.getMessage());
        }
    }

    // ========================================
    // Function shapes
    // ========================================

    /**
     * Unary or binary numeric operator, optionally defined on strings.
     */
    abstract static class Arithmetic implements BuiltinFunction {

        Object unary(Number x, ExpressionEvaluator evaluator) {
            throw evaluator.error("Cannot evaluate unary number");
        }

        abstract Object binary(long x, long y, ExpressionEvaluator evaluator);

        abstract Object binary(double x, double y, ExpressionEvaluator evaluator);

        Object binary(String x, String y, ExpressionEvaluator evaluator) {
            throw evaluator.error("Cannot evaluate binary strings");
        }

        @Override
        public List<Object> call(InvocationExpression expression, Element target, ExpressionEvaluator evaluator) {
            Object x = evaluator.asArgument(expression, 0, target);
            Object y = expression.arguments().size() == 1 ? null : evaluator.asArgument(expression, 1, target);
            try {
                if (expression.arguments().size() == 1) {
                    if (isNumber(x)) {
                        return List.of(unary((Number) x, evaluator));
                    }
                    throw evaluator.error("Expected a number argument");
                }
                if (x instanceof Long a && y instanceof Long b) {
                    return List.of(binary(a.longValue(), b.longValue(), evaluator));
                }
                if (isNumber(x) && isNumber(y)) {
                    return List.of(binary(((Number) x).doubleValue(), ((Number) y).doubleValue(), evaluator));
                }
            } catch (ArithmeticException e) {
                throw evaluator.error("Integer overflow");
            }
            if (x instanceof String a && y instanceof String b) {
                return List.of(binary(a, b, evaluator));
            }
            throw evaluator.error("Mismatched argument types");
        }
    }

    /**
     * Relational operator over two numbers or two strings.
     */
    abstract static class Comparison implements BuiltinFunction {

        abstract boolean test(int comparison);

        @Override
        public List<Object> call(InvocationExpression expression, Element target, ExpressionEvaluator evaluator) {
            Object x = evaluator.asArgument(expression, 0, target);
            Object y = evaluator.asArgument(expression, 1, target);
            if (x instanceof Long a && y instanceof Long b) {
                return List.of(test(Long.compare(a, b)));
            }
            if (isNumber(x) && isNumber(y)) {
                return List.of(test(Double.compare(((Number) x).doubleValue(), ((Number) y).doubleValue())));
            }
            if (x instanceof String a && y instanceof String b) {
                return List.of(test(a.compareTo(b)));
            }
            throw evaluator.error("Mismatched argument types");
        }
    }

    static boolean isNumber(Object value) {
        return value instanceof Long || value instanceof Double;
    }
}
