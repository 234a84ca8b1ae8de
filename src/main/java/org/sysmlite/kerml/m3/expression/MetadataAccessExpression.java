package org.sysmlite.kerml.m3.expression;

import org.sysmlite.kerml.m3.Element;
import org.sysmlite.kerml.m3.ElementKind;
import org.sysmlite.kerml.m3.ElementReference;
import org.sysmlite.kerml.m3.Expression;
import org.sysmlite.kerml.m3.ModelDocument;

import java.util.List;

/**
 * {@code x.metadata}: evaluates to the metadata features annotating the
 * referenced element.
 */
public class MetadataAccessExpression extends Expression {

    private ElementReference referent;

    public MetadataAccessExpression(ModelDocument document) {
        super(ElementKind.METADATA_ACCESS_EXPRESSION, document);
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
