package org.sysmlite.kerml.m3;

import org.sysmlite.kerml.dsl.ReferenceSyntax;

import java.util.ArrayList;
import java.util.EnumSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * A type whose instances are values of its featuring types, e.g. the
 * {@code wheels} of a {@code Car}.
 */
public class Feature extends Type {

    private FeatureDirection direction = FeatureDirection.NONE;
    private final Memo<List<Type>> allTypings = new Memo<>();

    public Feature(ElementKind kind, ModelDocument document) {
        super(kind, document);
    }

    // ========================================
    // Declaration properties
    // ========================================

    public FeatureDirection declaredDirection() {
        return direction;
    }

    public void setDirection(FeatureDirection direction) {
        this.direction = direction;
    }

    /**
     * @return the declared direction, or the direction implied by a parameter membership
     */
    public FeatureDirection direction() {
        if (direction != FeatureDirection.NONE) {
            return direction;
        }
        Membership membership = owningMembership();
        if (membership != null) {
            if (membership.membershipKind() == MembershipKind.PARAMETER) {
                return FeatureDirection.IN;
            }
            if (membership.membershipKind() == MembershipKind.RETURN_PARAMETER) {
                return FeatureDirection.OUT;
            }
        }
        return FeatureDirection.NONE;
    }

    /**
     * Occurrence usages are composite unless declared {@code ref} or {@code end};
     * portions are always composite.
     */
    public boolean isComposite() {
        if (has(Modifier.COMPOSITE) || isPortion()) {
            return true;
        }
        return isKind(ElementKind.OCCURRENCE_USAGE) && !has(Modifier.REF) && !isEnd();
    }

    public boolean isPortion() {
        return has(Modifier.PORTION) || portionKind() != null;
    }

    /**
     * @return {@link Modifier#TIMESLICE}, {@link Modifier#SNAPSHOT} or null
     */
    public Modifier portionKind() {
        if (has(Modifier.TIMESLICE)) {
            return Modifier.TIMESLICE;
        }
        return has(Modifier.SNAPSHOT) ? Modifier.SNAPSHOT : null;
    }

    public boolean isReadonly() {
        return has(Modifier.READONLY);
    }

    public boolean isDerived() {
        return has(Modifier.DERIVED);
    }

    public boolean isEnd() {
        if (has(Modifier.END)) {
            return true;
        }
        Membership membership = owningMembership();
        return membership != null && membership.membershipKind() == MembershipKind.END_FEATURE;
    }

    public boolean isOrdered() {
        return has(Modifier.ORDERED);
    }

    public boolean isUnique() {
        return !has(Modifier.NONUNIQUE);
    }

    public boolean isNegated() {
        return has(Modifier.NEGATED);
    }

    public Type owningType() {
        return owner() instanceof Type type ? type : null;
    }

    @Override
    public RelationshipKind specializationKind() {
        return RelationshipKind.SUBSETTING;
    }

    /**
     * Unnamed redefining features take the name of the first feature they redefine.
     */
    @Override
    public String effectiveName() {
        if (name() != null) {
            return name();
        }
        List<String> redefined = redefinedNames();
        return redefined.isEmpty() ? null : redefined.get(0);
    }

    /**
     * @return the last simple names of written redefinition targets
     */
    public List<String> redefinedNames() {
        List<String> names = new ArrayList<>();
        for (Relationship relationship : children(ChildRole.RELATIONSHIP, Relationship.class)) {
            if (relationship.relationshipKind() == RelationshipKind.REDEFINITION
                    && relationship.targetReference() != null) {
                ReferenceSyntax syntax = relationship.targetReference().syntax();
                if (syntax != null) {
                    names.add(syntax.lastName());
                }
            }
        }
        return names;
    }

    // ========================================
    // Value
    // ========================================

    public FeatureValue valueMembership() {
        for (Membership membership : memberships()) {
            if (membership instanceof FeatureValue featureValue) {
                return featureValue;
            }
        }
        return null;
    }

    /**
     * @return the value expression, or null if the feature has no value
     */
    public Expression value() {
        FeatureValue membership = valueMembership();
        return membership == null ? null : membership.value();
    }

    // ========================================
    // Typing and subsetting
    // ========================================

    /**
     * @return types reached through direct typing relationships
     */
    public List<Type> typings() {
        return targets(RelationshipKind.FEATURE_TYPING);
    }

    /**
     * @return types of this feature and of every feature it subsets or
     *         redefines, plus the types of the last chaining feature
     */
    public List<Type> allTypings() {
        List<Type> result = allTypings.get(version(), this::computeAllTypings);
        return result == null ? typings() : result;
    }

    private List<Type> computeAllTypings() {
        Set<Type> result = new LinkedHashSet<>();
        for (Type type : allTypes()) {
            if (type instanceof Feature feature) {
                result.addAll(feature.typings());
            }
        }
        List<Feature> chain = chainingFeatures();
        if (!chain.isEmpty()) {
            result.addAll(chain.get(chain.size() - 1).allTypings());
        }
        return new ArrayList<>(result);
    }

    public List<Feature> redefinedFeatures() {
        return features(RelationshipKind.REDEFINITION);
    }

    /**
     * @return features subsetted directly, including redefined and referenced ones
     */
    public List<Feature> subsettedFeatures() {
        return features(RelationshipKind.SUBSETTING);
    }

    /**
     * @return explicit featuring types, or the owning type
     */
    public List<Type> featuringTypes() {
        List<Type> result = targets(RelationshipKind.TYPE_FEATURING);
        if (result.isEmpty() && owningType() != null) {
            result.add(owningType());
        }
        return result;
    }

    /**
     * @return the features of a {@code chains a.b.c} declaration, in chain order
     */
    public List<Feature> chainingFeatures() {
        List<Feature> result = new ArrayList<>();
        for (Relationship relationship : relationships(RelationshipKind.FEATURE_CHAINING)) {
            relationship.resolveTarget();
            ElementReference reference = relationship.targetReference();
            for (Element segment : reference.segments()) {
                if (segment instanceof Feature feature) {
                    result.add(feature);
                }
            }
        }
        return result;
    }

    @Override
    public Set<ClassifierFlag> classifierFlags() {
        EnumSet<ClassifierFlag> flags = EnumSet.noneOf(ClassifierFlag.class);
        for (Type typing : allTypings()) {
            if (!(typing instanceof Feature)) {
                flags.addAll(typing.classifierFlags());
            }
        }
        return flags;
    }

    private List<Type> targets(RelationshipKind kind) {
        List<Type> result = new ArrayList<>();
        for (Relationship relationship : relationships(kind)) {
            if (relationship.resolveTarget() instanceof Type type && !result.contains(type)) {
                result.add(type);
            }
        }
        return result;
    }

    private List<Feature> features(RelationshipKind kind) {
        List<Feature> result = new ArrayList<>();
        for (Type type : targets(kind)) {
            if (type instanceof Feature feature) {
                result.add(feature);
            }
        }
        return result;
    }

    @Override
    public void reset() {
        super.reset();
        allTypings.clear();
    }
}
