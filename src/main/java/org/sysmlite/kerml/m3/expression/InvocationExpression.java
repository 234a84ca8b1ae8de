package org.sysmlite.kerml.m3.expression;

import org.sysmlite.kerml.m3.ChildRole;
import org.sysmlite.kerml.m3.ElementKind;
import org.sysmlite.kerml.m3.ElementReference;
import org.sysmlite.kerml.m3.Expression;
import org.sysmlite.kerml.m3.ModelDocument;

import java.util.ArrayList;
import java.util.List;

/**
 * Invocation of a function, {@code f(a, b)} or {@code a->f(b)}. Arguments
 * are owned in order; an arrow invocation has its receiver as first argument.
 */
public class InvocationExpression extends Expression {

    private ElementReference function;
    private boolean arrow;

    public InvocationExpression(ElementKind kind, ModelDocument document) {
        super(kind, document);
    }

    public ElementReference function() {
        return function;
    }

    public void setFunction(ElementReference function) {
        this.function = function;
    }

    public boolean isArrow() {
        return arrow;
    }

    public void setArrow(boolean arrow) {
        this.arrow = arrow;
    }

    public List<Expression> arguments() {
        return children(ChildRole.ARGUMENT, Expression.class);
    }

    public Expression argument(int index) {
        List<Expression> arguments = arguments();
        return index < arguments.size() ? arguments.get(index) : null;
    }

    public void addArgument(Expression argument) {
        addChild(ChildRole.ARGUMENT, argument);
    }

    /**
     * @return the simple name of the invoked function as written
     */
    public String functionName() {
        return function == null || function.syntax() == null ? null : function.syntax().lastName();
    }

    @Override
    public List<ElementReference> references() {
        List<ElementReference> result = new ArrayList<>(super.references());
        if (function != null) {
            result.add(function);
        }
        return result;
    }
}
