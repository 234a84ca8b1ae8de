package org.sysmlite.kerml.m3;

import org.sysmlite.kerml.m3.expression.Infinity;

import java.util.List;

/**
 * Multiplicity {@code [lower..upper]} of a type. Bounds are expressions,
 * evaluated lazily through the document's {@link ValueEvaluator}.
 */
public class MultiplicityRange extends Feature {

    private Expression lower;
    private Expression upper;
    private final Memo<BoundsResult> bounds = new Memo<>();

    public MultiplicityRange(ModelDocument document) {
        super(ElementKind.MULTIPLICITY_RANGE, document);
    }

    public Expression lowerBound() {
        return lower;
    }

    public Expression upperBound() {
        return upper;
    }

    public void setLowerBound(Expression expression) {
        this.lower = addChild(ChildRole.BOUND, expression);
    }

    public void setUpperBound(Expression expression) {
        this.upper = addChild(ChildRole.BOUND, expression);
    }

    @Override
    public RelationshipKind specializationKind() {
        return RelationshipKind.FEATURE_TYPING;
    }

    /**
     * @return the evaluated bounds, or null if a bound could not be evaluated
     */
    public Bounds bounds() {
        BoundsResult result = bounds.get(version(), this::computeBounds);
        return result == null ? null : result.bounds();
    }

    /**
     * @return the reason the bounds could not be evaluated, or null
     */
    public String boundsError() {
        BoundsResult result = bounds.get(version(), this::computeBounds);
        return result == null ? null : result.error();
    }

    private BoundsResult computeBounds() {
        if (upper == null) {
            return new BoundsResult(null, "Multiplicity has no upper bound");
        }
        try {
            Object upperValue = last(evaluate(upper));
            if (lower == null) {
                if (upperValue instanceof Infinity) {
                    return new BoundsResult(Bounds.MANY, null);
                }
                long value = natural(upperValue, "upper");
                return new BoundsResult(new Bounds(value, value), null);
            }
            Object lowerValue = last(evaluate(lower));
            long lowerBound = lowerValue instanceof Infinity ? 0 : natural(lowerValue, "lower");
            Long upperBound = upperValue instanceof Infinity ? null : natural(upperValue, "upper");
            if (upperBound != null && upperBound < lowerBound) {
                return new BoundsResult(null, "Upper bound " + upperBound + " is less than lower bound " + lowerBound);
            }
            return new BoundsResult(new Bounds(lowerBound, upperBound), null);
        } catch (RuntimeException e) {
            return new BoundsResult(null, e.getMessage());
        }
    }

    private List<Object> evaluate(Expression expression) {
        return document().valueEvaluator().evaluate(expression, this);
    }

    private static Object last(List<Object> values) {
        if (values.isEmpty()) {
            throw new IllegalArgumentException("Bound evaluated to an empty sequence");
        }
        return values.get(values.size() - 1);
    }

    private static long natural(Object value, String which) {
        if (value instanceof Long number && number >= 0) {
            return number;
        }
        throw new IllegalArgumentException("The " + which + " bound must be a natural number, got " + value);
    }

    @Override
    public void reset() {
        super.reset();
        bounds.clear();
    }

    private record BoundsResult(Bounds bounds, String error) {
    }
}
