package org.sysmlite.engine.eval;

import org.sysmlite.kerml.m3.Element;
import org.sysmlite.kerml.m3.Feature;
import org.sysmlite.kerml.m3.Type;
import org.sysmlite.kerml.m3.expression.InvocationExpression;
import org.sysmlite.kerml.m3.expression.OperatorExpression;

import java.util.ArrayList;
import java.util.List;

/**
 * {@code BaseFunctions}: classification, equality, indexing and sequence
 * concatenation.
 */
public final class BaseFunctions {

    public static final String PACKAGE = "BaseFunctions";

    // largest array the JVM allocates reliably
    private static final int MAX_CONCATENATED_SIZE = Integer.MAX_VALUE - 8;

    private BaseFunctions() {
        // Static utility class
    }

    static void register(BuiltinFunctionRegistry registry) {
        registry.register(PACKAGE, "as", BaseFunctions::as);
        registry.register(PACKAGE, "meta", BaseFunctions::as);
        registry.register(PACKAGE, "@", BaseFunctions::at);
        registry.register(PACKAGE, "@@", BaseFunctions::at);
        registry.register(PACKAGE, "hastype", BaseFunctions::hasType);
        registry.register(PACKAGE, "istype", BaseFunctions::isType);

        BuiltinFunction equals = (expression, target, evaluator) -> List.of(evaluator.equal(
                evaluator.asArgument(expression, 0, target), evaluator.asArgument(expression, 1, target)));
        BuiltinFunction same = (expression, target, evaluator) -> List.of(evaluator.same(
                evaluator.asArgument(expression, 0, target), evaluator.asArgument(expression, 1, target)));
        registry.register(PACKAGE, "==", equals);
        registry.register(PACKAGE, "===", same);
        registry.register(PACKAGE, "!=", negate(equals));
        registry.register(PACKAGE, "!==", negate(same));

        registry.register(PACKAGE, "#", BaseFunctions::index);
        registry.register(PACKAGE, ",", BaseFunctions::concat);
    }

    /**
     * @return a function whose single boolean result is the negation of {@code function}'s
     */
    static BuiltinFunction negate(BuiltinFunction function) {
        return (expression, target, evaluator) -> {
            List<Object> result = function.call(expression, target, evaluator);
            return List.of(!(Boolean) result.get(0));
        };
    }

    // ========================================
    // Classification
    // ========================================

    private static List<Object> as(InvocationExpression expression, Element target, ExpressionEvaluator evaluator) {
        Type type = evaluator.typeArgument((OperatorExpression) expression);
        List<Object> values = evaluator.evaluateArgument(expression, 0, target);
        if (values instanceof RangeSequence) {
            // every element of a range is an integer
            return values.isEmpty() || evaluator.isType(values.get(0), type, expression) ? values : List.of();
        }
        List<Object> result = new ArrayList<>();
        for (Object value : values) {
            if (evaluator.isType(value, type, expression)) {
                result.add(value);
            }
        }
        return result;
    }

    private static List<Object> at(InvocationExpression expression, Element target, ExpressionEvaluator evaluator) {
        Type type = evaluator.typeArgument((OperatorExpression) expression);
        for (Object value : evaluator.evaluateArgument(expression, 0, target)) {
            if (evaluator.isType(value, type, expression)) {
                return List.of(true);
            }
        }
        return List.of(false);
    }

    private static List<Object> hasType(InvocationExpression expression, Element target, ExpressionEvaluator evaluator) {
        Type type = evaluator.typeArgument((OperatorExpression) expression);
        for (Object value : evaluator.evaluateArgument(expression, 0, target)) {
            if (evaluator.hasType(value, type, expression)) {
                return List.of(true);
            }
        }
        return List.of(false);
    }

    private static List<Object> isType(InvocationExpression expression, Element target, ExpressionEvaluator evaluator) {
        Type type = evaluator.typeArgument((OperatorExpression) expression);
        for (Object value : evaluator.evaluateArgument(expression, 0, target)) {
            if (!evaluator.isType(value, type, expression)) {
                return List.of(false);
            }
        }
        return List.of(true);
    }

    // ========================================
    // Indexing
    // ========================================

    private static List<Object> index(InvocationExpression expression, Element target, ExpressionEvaluator evaluator) {
        List<Object> values = evaluator.evaluateArgument(expression, 0, target);
        List<Object> indices = evaluator.evaluateArgument(expression, 1, target);

        if (isCollection(values, "Collections::Array")) {
            return indexArray((Feature) values.get(0), indices, expression, evaluator);
        }
        if (indices.size() == 1) {
            if (!(indices.get(0) instanceof Long index)) {
                throw evaluator.error("Index is not a number");
            }
            if (isCollection(values, "Collections::OrderedCollection")) {
                return indexCollection((Feature) values.get(0), index, expression, evaluator);
            }
            return indexSequence(values, index, evaluator);
        }
        throw evaluator.error("Cannot use multi-dimensional index on a one-dimensional sequence");
    }

    private static boolean isCollection(List<Object> values, String qualifiedName) {
        return !(values instanceof RangeSequence)
                && values.size() == 1
                && values.get(0) instanceof Feature feature
                && feature.conforms(qualifiedName);
    }

    /**
     * 1-based positional access.
     */
    static List<Object> indexSequence(List<Object> values, long index, ExpressionEvaluator evaluator) {
        long size = SequenceFunctions.size(values);
        if (index < 1 || index > size) {
            throw evaluator.error("Index " + index + " out of bounds for sequence of size " + size);
        }
        if (values instanceof RangeSequence range) {
            return List.of(range.valueAt(index - 1));
        }
        return List.of(values.get((int) index - 1));
    }

    private static List<Object> indexCollection(Feature collection, long index, Element context,
            ExpressionEvaluator evaluator) {
        Feature elements = libraryFeature(ExpressionEvaluator.COLLECTION_ELEMENTS, context, evaluator);
        return indexSequence(evaluator.evaluateFeature(elements, collection), index, evaluator);
    }

    /**
     * Converts the index tuple to a flat row-major offset into the
     * collection elements.
     */
    private static List<Object> indexArray(Feature array, List<Object> indices, Element context,
            ExpressionEvaluator evaluator) {
        Feature dimensionsFeature = libraryFeature(ExpressionEvaluator.ARRAY_DIMENSIONS, context, evaluator);
        List<Object> dimensions = evaluator.evaluateFeature(dimensionsFeature, array);
        if (dimensions.size() == 1 && dimensions.get(0) == dimensionsFeature) {
            dimensions = List.of();
        }
        if (dimensions.size() != indices.size()) {
            throw evaluator.error("Array and index dimensions do not match: "
                    + dimensions.size() + " != " + indices.size());
        }
        if (dimensions.isEmpty()) {
            return indexCollection(array, 1, context, evaluator);
        }
        long index = 1;
        for (int i = 0; i < dimensions.size(); i++) {
            if (!(dimensions.get(i) instanceof Long dimension)) {
                throw evaluator.error("Dimension at index " + i + " is not a number");
            }
            if (!(indices.get(i) instanceof Long offset)) {
                throw evaluator.error("Index at index " + i + " is not a number");
            }
            if (offset > dimension || offset < 1) {
                throw evaluator.error("Index at dimension " + i + " is out of bounds ("
                        + offset + (offset < 1 ? " < 1)" : " > " + dimension + ")"));
            }
            try {
                index = Math.addExact(Math.multiplyExact(dimension, index - 1), offset);
            } catch (ArithmeticException e) {
                throw evaluator.error("Array index overflow at dimension " + i);
            }
        }
        return indexCollection(array, index, context, evaluator);
    }

    private static Feature libraryFeature(String qualifiedName, Element context, ExpressionEvaluator evaluator) {
        if (!(evaluator.libraryElement(qualifiedName, context) instanceof Feature feature)) {
            throw evaluator.error("Feature '" + qualifiedName + "' not found");
        }
        return feature;
    }

    // ========================================
    // Sequences
    // ========================================

    private static List<Object> concat(InvocationExpression expression, Element target, ExpressionEvaluator evaluator) {
        List<List<Object>> parts = new ArrayList<>();
        long total = 0;
        for (int i = 0; i < expression.arguments().size(); i++) {
            List<Object> part = evaluator.evaluateArgument(expression, i, target);
            long size = SequenceFunctions.size(part);
            if (size > MAX_CONCATENATED_SIZE - total) {
                throw evaluator.error("Sequence is too large to concatenate");
            }
            parts.add(part);
            total += size;
        }
        List<Object> result = new ArrayList<>((int) total);
        parts.forEach(result::addAll);
        return result;
    }
}
