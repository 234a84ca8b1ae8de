package org.sysmlite.engine.eval;

import org.sysmlite.kerml.m3.Element;
import org.sysmlite.kerml.m3.expression.InvocationExpression;

import java.util.List;

/**
 * Native implementation of a library function or operator. Implementations
 * evaluate their own arguments through the evaluator, so control functions
 * can skip arguments they do not need.
 */
@FunctionalInterface
public interface BuiltinFunction {

    /**
     * @throws EvaluationException if the arguments are not acceptable
     */
    List<Object> call(InvocationExpression expression, Element target, ExpressionEvaluator evaluator);
}
