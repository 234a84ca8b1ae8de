package org.sysmlite.engine.eval;

import org.sysmlite.kerml.m3.Element;

import java.util.List;
import java.util.Objects;

/**
 * A failed evaluation.
 *
 * @param message Human-readable reason
 * @param stack   Expressions being evaluated when it failed, innermost last
 */
public record EvaluationError(String message, List<Element> stack) {

    public EvaluationError {
        Objects.requireNonNull(message, "Error message cannot be null");
        stack = stack == null ? List.of() : List.copyOf(stack);
    }

    /**
     * @return the innermost expression, or null if the stack is empty
     */
    public Element source() {
        return stack.isEmpty() ? null : stack.get(stack.size() - 1);
    }
}
