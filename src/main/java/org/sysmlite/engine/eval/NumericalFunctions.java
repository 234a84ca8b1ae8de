package org.sysmlite.engine.eval;

import org.sysmlite.kerml.m3.Element;
import org.sysmlite.kerml.m3.expression.InvocationExpression;

import java.util.List;
import java.util.function.BinaryOperator;

/**
 * {@code NumericalFunctions}: aggregates over a sequence of numbers.
 */
public final class NumericalFunctions {

    public static final String PACKAGE = "NumericalFunctions";

    private NumericalFunctions() {
        // Static utility class
    }

    static void register(BuiltinFunctionRegistry registry) {
        registry.register(PACKAGE, "sum", (expression, target, evaluator) ->
                List.of(fold(expression, target, evaluator, 0L, Math::addExact, Double::sum)));
        registry.register(PACKAGE, "product", (expression, target, evaluator) ->
                List.of(fold(expression, target, evaluator, 1L, Math::multiplyExact, (x, y) -> x * y)));
        registry.register(PACKAGE, "max", (expression, target, evaluator) ->
                extreme(expression, target, evaluator, true));
        registry.register(PACKAGE, "min", (expression, target, evaluator) ->
                extreme(expression, target, evaluator, false));
    }

    private static Object fold(InvocationExpression expression, Element target, ExpressionEvaluator evaluator,
            long identity, BinaryOperator<Long> longOp, BinaryOperator<Double> doubleOp) {
        Number result = identity;
        try {
            for (Object value : evaluator.evaluateArgument(expression, 0, target)) {
                if (!DataFunctions.isNumber(value)) {
                    throw evaluator.error("Not a number argument");
                }
                if (result instanceof Long x && value instanceof Long y) {
                    result = longOp.apply(x, y);
                } else {
                    result = doubleOp.apply(result.doubleValue(), ((Number) value).doubleValue());
                }
            }
        } catch (ArithmeticException e) {
            throw evaluator.error("Integer overflow");
        }
        return result;
    }

    private static List<Object> extreme(InvocationExpression expression, Element target,
            ExpressionEvaluator evaluator, boolean max) {
        List<Object> values = evaluator.evaluateArgument(expression, 0, target);
        if (values instanceof RangeSequence range) {
            if (range.isEmpty()) {
                return List.of();
            }
            return List.of(max ? range.stop() : range.start());
        }
        Object best = null;
        for (Object value : values) {
            if (!DataFunctions.isNumber(value)) {
                throw evaluator.error("Not a number argument");
            }
            if (best == null) {
                best = value;
                continue;
            }
            int comparison = Double.compare(((Number) value).doubleValue(), ((Number) best).doubleValue());
            if (max ? comparison > 0 : comparison < 0) {
                best = value;
            }
        }
        return best == null ? List.of() : List.of(best);
    }
}
