package org.sysmlite.kerml.m3.expression;

import org.sysmlite.kerml.m3.ElementKind;
import org.sysmlite.kerml.m3.Expression;
import org.sysmlite.kerml.m3.ModelDocument;

/**
 * {@code null} or {@code ()}, evaluating to the empty sequence.
 */
public class NullExpression extends Expression {

    public NullExpression(ModelDocument document) {
        super(ElementKind.NULL_EXPRESSION, document);
    }
}
