package org.sysmlite.engine.eval;

import org.sysmlite.kerml.m3.Element;
import org.sysmlite.kerml.m3.expression.Infinity;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Outcome of {@link ExpressionEvaluator#evaluate}: either a sequence of
 * values or an {@link EvaluationError}.
 *
 * Values are {@link Long}, {@link Double}, {@link String}, {@link Boolean},
 * {@link Element} or {@link Infinity#INSTANCE}. A range result is a lazy
 * {@link RangeSequence}.
 */
public final class EvaluationResult {

    private final List<Object> values;
    private final EvaluationError error;

    private EvaluationResult(List<Object> values, EvaluationError error) {
        this.values = values;
        this.error = error;
    }

    public static EvaluationResult success(List<Object> values) {
        return new EvaluationResult(Objects.requireNonNull(values, "Values cannot be null"), null);
    }

    public static EvaluationResult failure(EvaluationError error) {
        return new EvaluationResult(List.of(), Objects.requireNonNull(error, "Error cannot be null"));
    }

    /**
     * @return the values, empty for a failed evaluation
     */
    public List<Object> values() {
        return values;
    }

    public boolean isError() {
        return error != null;
    }

    /**
     * @return the error, or null on success
     */
    public EvaluationError error() {
        return error;
    }

    /**
     * Serializes the values for tests and debugging. Elements become
     * {@code {qualifiedName=...}} maps and infinity becomes {@code "*"}.
     *
     * @throws IllegalStateException if the evaluation failed
     */
    public List<Object> toDebugList() {
        if (error != null) {
            throw new IllegalStateException("Evaluation failed: " + error.message());
        }
        List<Object> result = new ArrayList<>(values.size());
        for (Object value : values) {
            result.add(toDebugValue(value));
        }
        return result;
    }

    static Object toDebugValue(Object value) {
        if (value instanceof Element element) {
            Map<String, Object> map = new LinkedHashMap<>();
            map.put("qualifiedName", element.qualifiedName());
            return map;
        }
        if (value instanceof Infinity) {
            return "*";
        }
        return value;
    }

    @Override
    public String toString() {
        return error != null ? "EvaluationResult[error=" + error.message() + "]" : "EvaluationResult" + values;
    }
}
