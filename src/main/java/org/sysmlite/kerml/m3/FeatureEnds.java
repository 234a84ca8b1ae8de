package org.sysmlite.kerml.m3;

import java.util.ArrayList;
import java.util.List;

/**
 * End-feature tracking for associations and connectors.
 */
public final class FeatureEnds {

    private final Type type;
    private final Memo<List<Feature>> owned = new Memo<>();
    private final Memo<List<Feature>> all = new Memo<>();

    FeatureEnds(Type type) {
        this.type = type;
    }

    /**
     * @return end features declared directly in the type
     */
    public List<Feature> owned() {
        List<Feature> result = owned.get(type.version(), () -> endsOf(type.ownedFeatures()));
        return result == null ? List.of() : result;
    }

    /**
     * @return owned and inherited end features, redefined ends removed
     */
    public List<Feature> all() {
        List<Feature> result = all.get(type.version(), () -> endsOf(type.allFeatures()));
        return result == null ? owned() : result;
    }

    public int count() {
        return all().size();
    }

    public boolean isBinary() {
        return count() == 2;
    }

    private static List<Feature> endsOf(List<Feature> features) {
        List<Feature> result = new ArrayList<>();
        for (Feature feature : features) {
            if (feature.isEnd()) {
                result.add(feature);
            }
        }
        return result;
    }

    void clear() {
        owned.clear();
        all.clear();
    }
}
