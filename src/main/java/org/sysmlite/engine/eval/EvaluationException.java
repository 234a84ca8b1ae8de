package org.sysmlite.engine.eval;

import org.sysmlite.kerml.m3.Element;

import java.util.List;

/**
 * Exception thrown when an expression cannot be evaluated.
 * Carries the expressions being evaluated when the error occurred,
 * innermost last.
 */
public class EvaluationException extends RuntimeException {

    private final List<Element> stack;

    public EvaluationException(String message) {
        this(message, List.of());
    }

    public EvaluationException(String message, List<Element> stack) {
        super(message);
        this.stack = List.copyOf(stack);
    }

    public List<Element> stack() {
        return stack;
    }
}
