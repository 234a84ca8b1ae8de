package org.sysmlite.engine.eval;

import java.util.List;

/**
 * {@code StringFunctions}. Positions are 1-based and inclusive.
 */
public final class StringFunctions {

    public static final String PACKAGE = "StringFunctions";

    private StringFunctions() {
        // Static utility class
    }

    static void register(BuiltinFunctionRegistry registry) {
        registry.register(PACKAGE, "Length", (expression, target, evaluator) ->
                List.of((long) evaluator.asString(expression, 0, target).length()));
        registry.register(PACKAGE, "Substring", (expression, target, evaluator) -> {
            String string = evaluator.asString(expression, 0, target);
            long lower = evaluator.asInteger(expression, 1, target);
            long upper = evaluator.asInteger(expression, 2, target);
            if (lower < 1) {
                throw evaluator.error("Start " + lower + " is out of bounds");
            }
            if (upper > string.length()) {
                throw evaluator.error("End " + upper + " is out of bounds for string of size " + string.length());
            }
            if (lower > upper + 1) {
                throw evaluator.error("Start is beyond end");
            }
            return List.of(string.substring((int) lower - 1, (int) upper));
        });
    }
}
