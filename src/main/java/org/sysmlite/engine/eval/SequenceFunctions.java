package org.sysmlite.engine.eval;

import java.util.List;

/**
 * {@code SequenceFunctions}. Sizes of ranges are computed without
 * enumerating them.
 */
public final class SequenceFunctions {

    public static final String PACKAGE = "SequenceFunctions";

    private SequenceFunctions() {
        // Static utility class
    }

    static void register(BuiltinFunctionRegistry registry) {
        registry.register(PACKAGE, "size", (expression, target, evaluator) ->
                List.of(size(evaluator.evaluateArgument(expression, 0, target))));
        registry.register(PACKAGE, "isEmpty", (expression, target, evaluator) ->
                List.of(evaluator.evaluateArgument(expression, 0, target).isEmpty()));
        registry.register(PACKAGE, "notEmpty", (expression, target, evaluator) ->
                List.of(!evaluator.evaluateArgument(expression, 0, target).isEmpty()));
        BuiltinFunction includes = (expression, target, evaluator) -> {
            List<Object> values = evaluator.evaluateArgument(expression, 0, target);
            Object value = evaluator.asArgument(expression, 1, target);
            if (values instanceof RangeSequence range && value instanceof Long) {
                return List.of(range.contains(value));
            }
            for (Object candidate : values) {
                if (evaluator.equal(candidate, value)) {
                    return List.of(true);
                }
            }
            return List.of(false);
        };
        registry.register(PACKAGE, "includes", includes);
        registry.register(PACKAGE, "excludes", BaseFunctions.negate(includes));
        registry.register(PACKAGE, "head", (expression, target, evaluator) -> {
            List<Object> values = evaluator.evaluateArgument(expression, 0, target);
            return values.isEmpty() ? List.of() : List.of(values.get(0));
        });
        registry.register(PACKAGE, "tail", (expression, target, evaluator) -> {
            List<Object> values = evaluator.evaluateArgument(expression, 0, target);
            if (values instanceof RangeSequence range) {
                return range.tail();
            }
            return values.isEmpty() ? List.of() : List.copyOf(values.subList(1, values.size()));
        });
        registry.register(PACKAGE, "last", (expression, target, evaluator) -> {
            List<Object> values = evaluator.evaluateArgument(expression, 0, target);
            if (values.isEmpty()) {
                return List.of();
            }
            if (values instanceof RangeSequence range) {
                return List.of(range.stop());
            }
            return List.of(values.get(values.size() - 1));
        });
    }

    static long size(List<Object> values) {
        return values instanceof RangeSequence range ? range.count() : values.size();
    }
}
