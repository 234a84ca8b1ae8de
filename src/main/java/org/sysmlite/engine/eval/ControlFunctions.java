package org.sysmlite.engine.eval;

import org.sysmlite.kerml.m3.Element;
import org.sysmlite.kerml.m3.Feature;
import org.sysmlite.kerml.m3.Type;
import org.sysmlite.kerml.m3.expression.FeatureChainExpression;
import org.sysmlite.kerml.m3.expression.InvocationExpression;

import java.util.ArrayList;
import java.util.List;

/**
 * {@code ControlFunctions}: operators that evaluate some of their operands
 * only when needed, and feature chain navigation.
 */
public final class ControlFunctions {

    public static final String PACKAGE = "ControlFunctions";

    private ControlFunctions() {
        // Static utility class
    }

    static void register(BuiltinFunctionRegistry registry) {
        registry.register(PACKAGE, "if", (expression, target, evaluator) -> {
            boolean test = evaluator.asBoolean(expression, 0, target);
            return evaluator.evaluateArgument(expression, test ? 1 : 2, target);
        });
        registry.register(PACKAGE, "??", (expression, target, evaluator) -> {
            List<Object> values = evaluator.evaluateArgument(expression, 0, target);
            return values.isEmpty() ? evaluator.evaluateArgument(expression, 1, target) : values;
        });
        registry.register(PACKAGE, "and", (expression, target, evaluator) ->
                evaluator.asBoolean(expression, 0, target)
                        ? List.of(evaluator.asBoolean(expression, 1, target))
                        : List.of(false));
        registry.register(PACKAGE, "or", (expression, target, evaluator) ->
                evaluator.asBoolean(expression, 0, target)
                        ? List.of(true)
                        : List.of(evaluator.asBoolean(expression, 1, target)));
        registry.register(PACKAGE, "implies", (expression, target, evaluator) ->
                evaluator.asBoolean(expression, 0, target)
                        ? List.of(evaluator.asBoolean(expression, 1, target))
                        : List.of(true));
        registry.register(PACKAGE, ".", ControlFunctions::navigate);
    }

    /**
     * {@code source.feature}: evaluates the feature against each value of
     * the source.
     */
    private static List<Object> navigate(InvocationExpression expression, Element target, ExpressionEvaluator evaluator) {
        if (!(expression instanceof FeatureChainExpression chain)) {
            throw evaluator.error("Not a feature chain expression");
        }
        Feature feature = chain.targetFeature();
        if (feature == null) {
            throw evaluator.error("No linked reference");
        }
        List<Object> result = new ArrayList<>();
        for (Object value : evaluator.evaluateArgument(expression, 0, target)) {
            if (!(value instanceof Type type)) {
                throw evaluator.error("Cannot navigate to '" + feature.effectiveName() + "' from " + value);
            }
            result.addAll(evaluator.evaluateFeature(feature, type));
        }
        return result;
    }
}
