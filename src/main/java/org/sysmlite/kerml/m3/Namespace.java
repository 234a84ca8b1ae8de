package org.sysmlite.kerml.m3;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * An element that owns memberships and imports.
 *
 * Members are reached through {@link Membership} children; the named member
 * table maps both names and short names to memberships in declaration order.
 */
public class Namespace extends Element {

    private final Memo<Map<String, List<Membership>>> namedMembers = new Memo<>();
    private final Memo<Map<String, Membership>> redefinitionShadows = new Memo<>();

    public Namespace(ElementKind kind, ModelDocument document) {
        super(kind, document);
    }

    public List<Membership> memberships() {
        return children(ChildRole.MEMBERSHIP, Membership.class);
    }

    public List<Import> imports() {
        return children(ChildRole.IMPORT, Import.class);
    }

    /**
     * Adds an owning membership of the given kind for {@code element}.
     */
    public <T extends Element> T addMember(MembershipKind membershipKind, T element) {
        Membership membership = membershipKind == MembershipKind.FEATURE_VALUE
                ? new FeatureValue(document(), false, false)
                : new Membership(membershipKind, document());
        addChild(ChildRole.MEMBERSHIP, membership);
        membership.setMemberElement(element);
        return element;
    }

    /**
     * @return elements owned through non-alias memberships
     */
    public List<Element> ownedMembers() {
        List<Element> result = new ArrayList<>();
        for (Membership membership : memberships()) {
            Element element = membership.ownedMemberElement();
            if (element != null) {
                result.add(element);
            }
        }
        return result;
    }

    /**
     * @return features owned through feature memberships
     */
    public List<Feature> features() {
        List<Feature> result = new ArrayList<>();
        for (Membership membership : memberships()) {
            if (membership.membershipKind().isFeatureMembership() || membership.membershipKind() == MembershipKind.VARIANT) {
                if (membership.ownedMemberElement() instanceof Feature feature) {
                    result.add(feature);
                }
            }
        }
        return result;
    }

    /**
     * @return memberships by member name and short name
     */
    public Map<String, List<Membership>> namedMembers() {
        return namedMembers.get(version(), this::computeNamedMembers);
    }

    private Map<String, List<Membership>> computeNamedMembers() {
        Map<String, List<Membership>> table = new LinkedHashMap<>();
        for (Membership membership : memberships()) {
            String name = membership.memberName();
            if (name != null) {
                table.computeIfAbsent(name, k -> new ArrayList<>()).add(membership);
            }
            String shortName = membership.memberShortName();
            if (shortName != null && !shortName.equals(name)) {
                table.computeIfAbsent(shortName, k -> new ArrayList<>()).add(membership);
            }
        }
        return table;
    }

    /**
     * Names of inherited features hidden by owned redefinitions, mapped to the
     * membership of the redefining feature. Computed from the written
     * redefinition names, so no reference has to be resolved.
     */
    public Map<String, Membership> redefinitionShadows() {
        return redefinitionShadows.get(version(), this::computeShadows);
    }

    private Map<String, Membership> computeShadows() {
        Map<String, Membership> shadows = new LinkedHashMap<>();
        for (Membership membership : memberships()) {
            if (membership.ownedMemberElement() instanceof Feature feature) {
                for (String redefined : feature.redefinedNames()) {
                    shadows.putIfAbsent(redefined, membership);
                }
            }
        }
        return shadows;
    }

    /**
     * @return the first owned membership whose member is named {@code name}, or null
     */
    public Membership findMembership(String name) {
        List<Membership> found = namedMembers().get(name);
        return found == null || found.isEmpty() ? null : found.get(0);
    }

    /**
     * @return the first owned member named {@code name}, or null
     */
    public Element findMember(String name) {
        Membership membership = findMembership(name);
        return membership == null ? null : membership.memberElement();
    }

    @Override
    public void reset() {
        super.reset();
        namedMembers.clear();
        redefinitionShadows.clear();
    }
}
