package org.sysmlite.kerml.m3;

import java.util.ArrayList;
import java.util.List;

/**
 * Positional parameters of behaviors, functions, steps and expressions.
 */
public final class ParameterList {

    private final Type type;
    private final Memo<List<Feature>> parameters = new Memo<>();

    ParameterList(Type type) {
        this.type = type;
    }

    /**
     * @return directed features in declaration order, inherited ones after owned ones
     */
    public List<Feature> all() {
        List<Feature> result = parameters.get(type.version(), this::compute);
        return result == null ? List.of() : result;
    }

    private List<Feature> compute() {
        List<Feature> result = new ArrayList<>();
        for (Feature feature : type.allFeatures()) {
            if (feature.direction() != FeatureDirection.NONE) {
                result.add(feature);
            }
        }
        return result;
    }

    /**
     * @return parameters with direction {@code in} or {@code inout}
     */
    public List<Feature> inputs() {
        List<Feature> result = new ArrayList<>();
        for (Feature feature : all()) {
            if (feature.direction() == FeatureDirection.IN || feature.direction() == FeatureDirection.INOUT) {
                result.add(feature);
            }
        }
        return result;
    }

    /**
     * @return the parameter at the 0-based {@code position}, or null
     */
    public Feature get(int position) {
        List<Feature> all = all();
        return position >= 0 && position < all.size() ? all.get(position) : null;
    }

    /**
     * @return the return parameter, or null
     */
    public Feature result() {
        for (Feature feature : type.allFeatures()) {
            Membership membership = feature.owningMembership();
            if (membership != null && membership.membershipKind() == MembershipKind.RETURN_PARAMETER) {
                return feature;
            }
        }
        return null;
    }

    void clear() {
        parameters.clear();
    }
}
