package org.sysmlite.kerml.m3.expression;

import org.sysmlite.kerml.m3.Element;
import org.sysmlite.kerml.m3.ElementKind;
import org.sysmlite.kerml.m3.ElementReference;
import org.sysmlite.kerml.m3.Expression;
import org.sysmlite.kerml.m3.ModelDocument;

import java.util.List;

/**
 * A name used as an expression. The referent is usually a feature but may be
 * any element, e.g. a type used as a value.
 */
public class FeatureReferenceExpression extends Expression {

    private ElementReference referent;

    public FeatureReferenceExpression(ModelDocument document) {
        super(ElementKind.FEATURE_REFERENCE_EXPRESSION, document);
    }

    public ElementReference referentReference() {
        return referent;
    }

    public void setReferent(ElementReference referent) {
        this.referent = referent;
    }

    public Element referent() {
        return referent == null ? null : referent.resolve();
    }

    @Override
    public List<ElementReference> references() {
        return referent == null ? List.of() : List.of(referent);
    }
}
