package org.sysmlite.kerml.m3;

/**
 * A step that computes a value. Expression bodies end with a result
 * expression; literal, operator and reference expressions specialize this.
 */
public class Expression extends Feature {

    public Expression(ElementKind kind, ModelDocument document) {
        super(kind, document);
    }

    /**
     * @return the trailing result expression of the body, or null
     */
    public Expression resultExpression() {
        for (Membership membership : memberships()) {
            if (membership.membershipKind() == MembershipKind.RESULT_EXPRESSION
                    && membership.ownedMemberElement() instanceof Expression result) {
                return result;
            }
        }
        return null;
    }
}
