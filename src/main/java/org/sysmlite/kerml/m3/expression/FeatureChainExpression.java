package org.sysmlite.kerml.m3.expression;

import org.sysmlite.kerml.m3.ElementKind;
import org.sysmlite.kerml.m3.ElementReference;
import org.sysmlite.kerml.m3.Expression;
import org.sysmlite.kerml.m3.Feature;
import org.sysmlite.kerml.m3.ModelDocument;

import java.util.ArrayList;
import java.util.List;

/**
 * {@code source.feature}: navigates from the values of the source expression
 * to the target feature, which is looked up among the source's types.
 */
public class FeatureChainExpression extends OperatorExpression {

    private ElementReference targetFeature;

    public FeatureChainExpression(ModelDocument document) {
        super(ElementKind.FEATURE_CHAIN_EXPRESSION, document, ".");
    }

    public Expression source() {
        return argument(0);
    }

    public ElementReference targetReference() {
        return targetFeature;
    }

    public void setTargetReference(ElementReference reference) {
        this.targetFeature = reference;
    }

    public Feature targetFeature() {
        return targetFeature != null && targetFeature.resolve() instanceof Feature feature ? feature : null;
    }

    @Override
    public List<ElementReference> references() {
        List<ElementReference> result = new ArrayList<>(super.references());
        if (targetFeature != null) {
            result.add(targetFeature);
        }
        return result;
    }
}
