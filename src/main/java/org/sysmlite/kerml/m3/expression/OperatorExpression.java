package org.sysmlite.kerml.m3.expression;

import org.sysmlite.kerml.m3.ElementKind;
import org.sysmlite.kerml.m3.ElementReference;
import org.sysmlite.kerml.m3.ModelDocument;

import java.util.ArrayList;
import java.util.List;

/**
 * An operator application such as {@code a + b}, {@code x#(1)} or
 * {@code v istype T}. Classification operators keep their type operand as a
 * reference rather than an argument.
 */
public class OperatorExpression extends InvocationExpression {

    private final String operator;
    private ElementReference typeReference;

    public OperatorExpression(ModelDocument document, String operator) {
        this(ElementKind.OPERATOR_EXPRESSION, document, operator);
    }

    protected OperatorExpression(ElementKind kind, ModelDocument document, String operator) {
        super(kind, document);
        this.operator = operator;
    }

    public String operator() {
        return operator;
    }

    public ElementReference typeReference() {
        return typeReference;
    }

    public void setTypeReference(ElementReference typeReference) {
        this.typeReference = typeReference;
    }

    @Override
    public List<ElementReference> references() {
        List<ElementReference> result = new ArrayList<>(super.references());
        if (typeReference != null) {
            result.add(typeReference);
        }
        return result;
    }

    @Override
    public String toString() {
        return "OperatorExpression#" + id() + "(" + operator + ")";
    }
}
