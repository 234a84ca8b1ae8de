package org.sysmlite.kerml.m3;

/**
 * Makes an element a named or unnamed member of a namespace.
 *
 * Owning memberships own their member element under
 * {@link ChildRole#MEMBER_ELEMENT}. Alias memberships own nothing and refer
 * to their member through the target reference.
 */
public class Membership extends Relationship {

    private final MembershipKind membershipKind;

    public Membership(MembershipKind membershipKind, ModelDocument document) {
        super(ElementKind.MEMBERSHIP, RelationshipKind.MEMBERSHIP, document, false);
        this.membershipKind = membershipKind;
    }

    public MembershipKind membershipKind() {
        return membershipKind;
    }

    public boolean isAlias() {
        return membershipKind == MembershipKind.ALIAS;
    }

    /**
     * @return the owned member element, or null for aliases
     */
    public Element ownedMemberElement() {
        var owned = children(ChildRole.MEMBER_ELEMENT);
        return owned.isEmpty() ? null : owned.get(0);
    }

    /**
     * @return the member element, following an alias to its target
     */
    public Element memberElement() {
        if (isAlias()) {
            Element target = resolveTarget();
            if (target instanceof Membership aliased && aliased != this) {
                return aliased.memberElement();
            }
            return target;
        }
        return ownedMemberElement();
    }

    public void setMemberElement(Element element) {
        addChild(ChildRole.MEMBER_ELEMENT, element);
    }

    /**
     * @return the name under which the member is visible
     */
    public String memberName() {
        if (isAlias()) {
            return name();
        }
        Element element = ownedMemberElement();
        return element == null ? null : element.effectiveName();
    }

    public String memberShortName() {
        if (isAlias()) {
            return shortName();
        }
        Element element = ownedMemberElement();
        return element == null ? null : element.shortName();
    }

    /**
     * Visibility of the member: the more restrictive of the membership's and
     * the element's declared visibility.
     */
    @Override
    public Visibility visibility() {
        Visibility own = super.visibility();
        Element element = isAlias() ? null : ownedMemberElement();
        if (element != null && element.declaredVisibility() != null) {
            return own.restrict(element.declaredVisibility());
        }
        return own;
    }

    @Override
    public String effectiveName() {
        return null;
    }

    @Override
    public String toString() {
        return membershipKind + "Membership#" + id() + "[" + memberName() + "]";
    }
}
