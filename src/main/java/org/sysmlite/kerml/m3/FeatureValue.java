package org.sysmlite.kerml.m3;

/**
 * Membership owning the value expression of a feature
 * ({@code = expr}, {@code := expr}, {@code default = expr}).
 */
public class FeatureValue extends Membership {

    private final boolean isDefault;
    private final boolean isInitial;

    public FeatureValue(ModelDocument document, boolean isDefault, boolean isInitial) {
        super(MembershipKind.FEATURE_VALUE, document);
        this.isDefault = isDefault;
        this.isInitial = isInitial;
    }

    public boolean isDefault() {
        return isDefault;
    }

    public boolean isInitial() {
        return isInitial;
    }

    public Expression value() {
        return ownedMemberElement() instanceof Expression expression ? expression : null;
    }
}
