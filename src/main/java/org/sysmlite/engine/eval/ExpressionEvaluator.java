package org.sysmlite.engine.eval;

import org.sysmlite.kerml.m3.ChildRole;
import org.sysmlite.kerml.m3.Element;
import org.sysmlite.kerml.m3.ElementKind;
import org.sysmlite.kerml.m3.Expression;
import org.sysmlite.kerml.m3.Feature;
import org.sysmlite.kerml.m3.Namespace;
import org.sysmlite.kerml.m3.Type;
import org.sysmlite.kerml.m3.expression.FeatureChainExpression;
import org.sysmlite.kerml.m3.expression.FeatureReferenceExpression;
import org.sysmlite.kerml.m3.expression.Infinity;
import org.sysmlite.kerml.m3.expression.InvocationExpression;
import org.sysmlite.kerml.m3.expression.LiteralExpression;
import org.sysmlite.kerml.m3.expression.MetadataAccessExpression;
import org.sysmlite.kerml.m3.expression.NullExpression;
import org.sysmlite.kerml.m3.expression.OperatorExpression;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Evaluates model-level evaluable expressions against a target element.
 *
 * Operators and library function invocations dispatch to the
 * {@link BuiltinFunctionRegistry}. Feature references evaluate the value of
 * the referenced feature, preferring a redefining feature of the target
 * that carries its own value. Evaluation is all or nothing: any
 * {@link EvaluationException} turns the whole result into an
 * {@link EvaluationError}.
 *
 * Not thread-safe; a workspace evaluates from its build thread only.
 */
public class ExpressionEvaluator {

    private static final Logger LOGGER = LoggerFactory.getLogger(ExpressionEvaluator.class);

    public static final String SELF = "Base::Anything::self";
    public static final String COLLECTION_ELEMENTS = "Collections::Collection::elements";
    public static final String ARRAY_DIMENSIONS = "Collections::Array::dimensions";

    private final BuiltinFunctionRegistry registry;
    private final LibraryLookup library;
    private final List<Element> stack = new ArrayList<>();
    private final Set<Feature> evaluatingValues = Collections.newSetFromMap(new IdentityHashMap<>());

    public ExpressionEvaluator() {
        this(BuiltinFunctionRegistry.withBuiltins(), LibraryLookup.NONE);
    }

    public ExpressionEvaluator(BuiltinFunctionRegistry registry, LibraryLookup library) {
        this.registry = Objects.requireNonNull(registry, "Function registry cannot be null");
        this.library = Objects.requireNonNull(library, "Library lookup cannot be null");
    }

    public BuiltinFunctionRegistry registry() {
        return registry;
    }

    /**
     * Evaluates {@code expression} with {@code target} as the context for
     * feature references. Never throws on evaluation problems.
     */
    public EvaluationResult evaluate(Expression expression, Element target) {
        int depth = stack.size();
        try {
            return EvaluationResult.success(evaluateExpression(expression, target));
        } catch (EvaluationException e) {
            LOGGER.debug("Evaluation of {} failed: {}", expression, e.getMessage());
            return EvaluationResult.failure(new EvaluationError(e.getMessage(), e.stack()));
        } finally {
            while (stack.size() > depth) {
                stack.remove(stack.size() - 1);
            }
        }
    }

    /**
     * @throws EvaluationException if the expression cannot be evaluated
     */
    public List<Object> evaluateExpression(Expression expression, Element target) {
        if (expression == null) {
            throw error("No expression to evaluate");
        }
        stack.add(expression);
        try {
            return dispatch(expression, target);
        } finally {
            stack.remove(stack.size() - 1);
        }
    }

    private List<Object> dispatch(Expression expression, Element target) {
        if (expression instanceof NullExpression) {
            return List.of();
        }
        if (expression instanceof LiteralExpression literal) {
            return List.of(literal.value());
        }
        if (expression instanceof FeatureChainExpression || expression instanceof OperatorExpression) {
            return evaluateOperator((OperatorExpression) expression, target);
        }
        if (expression instanceof InvocationExpression invocation) {
            return evaluateInvocation(invocation, target);
        }
        if (expression instanceof FeatureReferenceExpression reference) {
            return evaluateFeatureReference(reference, target);
        }
        if (expression instanceof MetadataAccessExpression access) {
            return evaluateMetadataAccess(access, target);
        }
        Expression result = expression.resultExpression();
        if (result != null) {
            return evaluateExpression(result, target);
        }
        throw error("No evaluator found for " + expression.kind().displayName());
    }

    // ========================================
    // Dispatch
    // ========================================

    private List<Object> evaluateOperator(OperatorExpression expression, Element target) {
        FunctionKey key = Operators.functionFor(expression.operator())
                .orElseThrow(() -> error("Unknown operator '" + expression.operator() + "'"));
        BuiltinFunction function = registry.find(key)
                .orElseThrow(() -> error("No associated builtin function found for " + key));
        return function.call(expression, target, this);
    }

    private List<Object> evaluateInvocation(InvocationExpression expression, Element target) {
        BuiltinFunction function = null;
        if (expression.function() != null) {
            Element resolved = expression.function().resolve();
            String qualifiedName = resolved == null ? null : resolved.qualifiedName();
            if (qualifiedName != null) {
                function = registry.find(qualifiedName).orElse(null);
            }
        }
        String name = expression.functionName();
        if (function == null && name != null) {
            function = registry.find(name).orElse(null);
        }
        if (function == null) {
            throw error("No associated builtin function found for '" + name + "'");
        }
        return function.call(expression, target, this);
    }

    private List<Object> evaluateFeatureReference(FeatureReferenceExpression expression, Element target) {
        Element referenced = expression.referent();
        if (referenced == null) {
            throw error("No linked reference");
        }
        if (referenced instanceof Feature feature) {
            return evaluateFeature(feature, target);
        }
        return List.of(referenced);
    }

    private List<Object> evaluateMetadataAccess(MetadataAccessExpression expression, Element target) {
        List<Element> annotated = new ArrayList<>();
        if (expression.referent() != null) {
            annotated.add(expression.referent());
        } else if (!expression.children(ChildRole.ARGUMENT).isEmpty()) {
            Expression source = (Expression) expression.children(ChildRole.ARGUMENT).get(0);
            for (Object value : evaluateExpression(source, target)) {
                if (value instanceof Element element) {
                    annotated.add(element);
                }
            }
        } else {
            throw error("No linked reference");
        }
        List<Object> result = new ArrayList<>();
        for (Element element : annotated) {
            if (element instanceof Namespace namespace) {
                for (Element member : namespace.ownedMembers()) {
                    if (member.isKind(ElementKind.METADATA_FEATURE)) {
                        result.add(member);
                    }
                }
            }
        }
        return result;
    }

    // ========================================
    // Features
    // ========================================

    /**
     * Evaluates {@code feature} as seen from {@code target}: {@code self}
     * is the target, chained features are navigated, and a feature of the
     * target that redefines {@code feature} with a value takes precedence
     * over the feature's own value. A feature without any value evaluates
     * to itself.
     */
    public List<Object> evaluateFeature(Feature feature, Element target) {
        if (feature.conforms(SELF)) {
            return List.of(target);
        }
        List<Feature> chain = feature.chainingFeatures();
        if (!chain.isEmpty()) {
            return evaluateFeatureChain(chain, target);
        }
        if (target instanceof Type type && type != feature) {
            for (Feature candidate : type.allFeatures()) {
                if (candidate != feature && candidate.value() != null && redefines(candidate, feature)) {
                    return evaluateValue(candidate, type);
                }
            }
        }
        if (feature.value() != null) {
            return evaluateValue(feature, target);
        }
        return List.of(feature);
    }

    /**
     * Navigates {@code features} in order, evaluating each one against the
     * values of the previous one.
     */
    public List<Object> evaluateFeatureChain(List<Feature> features, Element target) {
        if (features.isEmpty()) {
            return List.of();
        }
        List<Object> values = evaluateFeature(features.get(0), target);
        if (features.size() == 1 || values instanceof RangeSequence) {
            return values;
        }
        List<Feature> rest = features.subList(1, features.size());
        List<Object> result = new ArrayList<>();
        for (Object value : values) {
            if (value instanceof Type type) {
                result.addAll(evaluateFeatureChain(rest, type));
            } else {
                result.add(value);
            }
        }
        return result;
    }

    private List<Object> evaluateValue(Feature feature, Element target) {
        if (!evaluatingValues.add(feature)) {
            throw error("Circular value of feature '" + feature.effectiveName() + "'");
        }
        try {
            return evaluateExpression(feature.value(), target);
        } finally {
            evaluatingValues.remove(feature);
        }
    }

    private static boolean redefines(Feature feature, Feature redefined) {
        Deque<Feature> pending = new ArrayDeque<>(feature.redefinedFeatures());
        Set<Feature> visited = Collections.newSetFromMap(new IdentityHashMap<>());
        while (!pending.isEmpty()) {
            Feature next = pending.poll();
            if (next == redefined) {
                return true;
            }
            if (visited.add(next)) {
                pending.addAll(next.redefinedFeatures());
            }
        }
        return false;
    }

    // ========================================
    // Argument helpers for builtin functions
    // ========================================

    /**
     * @throws EvaluationException if the argument is missing
     */
    public List<Object> evaluateArgument(InvocationExpression expression, int index, Element target) {
        Expression argument = expression.argument(index);
        if (argument == null) {
            throw error("Missing argument at position " + index);
        }
        return evaluateExpression(argument, target);
    }

    /**
     * @return the single value of an argument, or null if it is empty
     * @throws EvaluationException if it has more than one value
     */
    public Object asArgument(InvocationExpression expression, int index, Element target) {
        List<Object> values = evaluateArgument(expression, index, target);
        if (values.size() > 1) {
            throw error("Too many values, expected 1");
        }
        return values.isEmpty() ? null : values.get(0);
    }

    public boolean asBoolean(InvocationExpression expression, int index, Element target) {
        Object value = asArgument(expression, index, target);
        if (!(value instanceof Boolean bool)) {
            throw error("Not a boolean");
        }
        return bool;
    }

    public String asString(InvocationExpression expression, int index, Element target) {
        Object value = asArgument(expression, index, target);
        if (!(value instanceof String string)) {
            throw error("Not a string");
        }
        return string;
    }

    /**
     * @return a {@link Long} or {@link Double}
     */
    public Number asNumber(InvocationExpression expression, int index, Element target) {
        Object value = asArgument(expression, index, target);
        if (!(value instanceof Long) && !(value instanceof Double)) {
            throw error("Not a number");
        }
        return (Number) value;
    }

    public long asInteger(InvocationExpression expression, int index, Element target) {
        Object value = asArgument(expression, index, target);
        if (!(value instanceof Long number)) {
            throw error("Not an integer");
        }
        return number;
    }

    /**
     * @throws EvaluationException if the type operand did not resolve to a type
     */
    public Type typeArgument(OperatorExpression expression) {
        Element type = expression.typeReference() == null ? null : expression.typeReference().resolve();
        if (!(type instanceof Type result)) {
            throw error("Error computing type argument");
        }
        return result;
    }

    // ========================================
    // Value semantics
    // ========================================

    /**
     * Value equality: numbers compare by numeric value regardless of
     * representation, elements by identity, and null equals only null.
     */
    public boolean equal(Object left, Object right) {
        if (left instanceof Number x && right instanceof Number y) {
            if (x instanceof Long && y instanceof Long) {
                return x.longValue() == y.longValue();
            }
            return x.doubleValue() == y.doubleValue();
        }
        return same(left, right);
    }

    /**
     * Identity-level equality: no numeric coercion.
     */
    public boolean same(Object left, Object right) {
        if (left == null || right == null) {
            return left == right;
        }
        if (left instanceof Element || right instanceof Element) {
            return left == right;
        }
        return left.equals(right);
    }

    /**
     * @return true if {@code value} is an instance of {@code type} or one of its subtypes
     */
    public boolean isType(Object value, Type type, Element context) {
        if (value instanceof Type valueType) {
            return valueType.conforms(type);
        }
        Type primitive = primitiveType(value, context);
        return primitive != null && primitive.conforms(type);
    }

    /**
     * @return true if {@code value} is directly typed by {@code type}
     */
    public boolean hasType(Object value, Type type, Element context) {
        if (value instanceof Feature feature) {
            return feature.typings().contains(type);
        }
        if (value instanceof Type valueType) {
            return valueType == type;
        }
        return primitiveType(value, context) == type;
    }

    private Type primitiveType(Object value, Element context) {
        String name;
        if (value instanceof Boolean) {
            name = "ScalarValues::Boolean";
        } else if (value instanceof String) {
            name = "ScalarValues::String";
        } else if (value instanceof Long) {
            name = "ScalarValues::Integer";
        } else if (value instanceof Double) {
            name = "ScalarValues::Real";
        } else if (value instanceof Infinity) {
            name = "ScalarValues::Natural";
        } else {
            return null;
        }
        return libraryElement(name, context) instanceof Type type ? type : null;
    }

    /**
     * @return the library element, or null if it is not available
     */
    public Element libraryElement(String qualifiedName, Element context) {
        return library.find(qualifiedName, context);
    }

    /**
     * @return an exception carrying the current expression stack
     */
    public EvaluationException error(String message) {
        return new EvaluationException(message, stack);
    }

    /**
     * @return the expressions currently being evaluated, innermost last
     */
    public List<Element> currentStack() {
        return Collections.unmodifiableList(stack);
    }
}
