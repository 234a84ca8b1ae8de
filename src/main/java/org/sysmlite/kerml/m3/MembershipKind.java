package org.sysmlite.kerml.m3;

public enum MembershipKind {
    OWNING,
    FEATURE,
    END_FEATURE,
    PARAMETER,
    RETURN_PARAMETER,
    RESULT_EXPRESSION,
    FEATURE_VALUE,
    VARIANT,
    ALIAS;

    /**
     * @return true for memberships that make their element a feature of the owning type
     */
    public boolean isFeatureMembership() {
        return this == FEATURE || this == END_FEATURE || this == PARAMETER
                || this == RETURN_PARAMETER || this == RESULT_EXPRESSION;
    }
}
