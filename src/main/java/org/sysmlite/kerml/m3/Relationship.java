package org.sysmlite.kerml.m3;

import java.util.ArrayList;
import java.util.List;

/**
 * A directed edge between two elements.
 *
 * The source is either an explicit reference (standalone relationships) or,
 * when absent, the owner of the relationship. The target is always a
 * reference, possibly resolved from the start for implied relationships.
 */
public class Relationship extends Element {

    private final RelationshipKind relationshipKind;
    private ElementReference sourceReference;
    private ElementReference targetReference;
    private Element source;
    private final boolean implied;

    public Relationship(ElementKind kind, RelationshipKind relationshipKind, ModelDocument document, boolean implied) {
        super(kind, document);
        this.relationshipKind = relationshipKind;
        this.implied = implied;
    }

    public RelationshipKind relationshipKind() {
        return relationshipKind;
    }

    /**
     * @return true if the relationship was synthesized rather than written in source
     */
    public boolean isImplied() {
        return implied;
    }

    public ElementReference sourceReference() {
        return sourceReference;
    }

    public void setSourceReference(ElementReference reference) {
        this.sourceReference = reference;
    }

    public ElementReference targetReference() {
        return targetReference;
    }

    public void setTargetReference(ElementReference reference) {
        this.targetReference = reference;
    }

    /**
     * Sets an explicit source element, e.g. for implied relationships owned elsewhere.
     */
    public void setSource(Element source) {
        this.source = source;
    }

    /**
     * @return the source element without triggering resolution
     */
    public Element source() {
        if (source != null) {
            return source;
        }
        if (sourceReference != null) {
            return sourceReference.target();
        }
        return owner();
    }

    /**
     * @return the target element without triggering resolution
     */
    public Element target() {
        return targetReference == null ? null : targetReference.target();
    }

    /**
     * @return the target element, resolving its reference if needed
     */
    public Element resolveTarget() {
        return targetReference == null ? null : targetReference.resolve();
    }

    public Element resolveSource() {
        if (source == null && sourceReference != null) {
            return sourceReference.resolve();
        }
        return source();
    }

    @Override
    public List<ElementReference> references() {
        List<ElementReference> result = new ArrayList<>(2);
        if (sourceReference != null) {
            result.add(sourceReference);
        }
        if (targetReference != null) {
            result.add(targetReference);
        }
        return result;
    }

    @Override
    public String toString() {
        return relationshipKind + (implied ? "(implied)" : "") + "#" + id()
                + "[" + (targetReference == null ? "?" : targetReference.text()) + "]";
    }
}
