package org.sysmlite.kerml.m3;

import java.util.List;

/**
 * Model-level evaluation hook used by derived properties that depend on
 * expression values, such as multiplicity bounds.
 */
@FunctionalInterface
public interface ValueEvaluator {

    /**
     * @return the values of {@code expression} evaluated against {@code target}
     * @throws RuntimeException if evaluation fails
     */
    List<Object> evaluate(Expression expression, Element target);
}
