package org.sysmlite.kerml.m3;

import java.util.ArrayList;
import java.util.List;

/**
 * A feature linking the features referenced by its ends. Each end is an
 * end feature whose reference subsetting names the connected feature.
 */
public class Connector extends Feature {

    public Connector(ElementKind kind, ModelDocument document) {
        super(kind, document);
    }

    public List<Feature> connectorEnds() {
        return ends().owned();
    }

    /**
     * @return the connected features in end order; unresolved ends are skipped
     */
    public List<Feature> relatedFeatures() {
        List<Feature> result = new ArrayList<>();
        for (Feature end : connectorEnds()) {
            for (Relationship relationship : end.relationships(RelationshipKind.REFERENCE_SUBSETTING)) {
                if (relationship.resolveTarget() instanceof Feature related) {
                    result.add(related);
                    break;
                }
            }
        }
        return result;
    }

    public boolean isBinary() {
        return connectorEnds().size() == 2;
    }
}
