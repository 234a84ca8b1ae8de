package org.sysmlite.kerml.m3;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.EnumSet;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * A namespace that classifies things and can specialize other types.
 *
 * Heritage relationships of a type come from three places:
 * - owned relationships written in its declaration ({@code :>}, {@code :}, ...)
 * - standalone relationships elsewhere whose source resolved to this type
 * - implied relationships added by implicit generalization
 *
 * Derived properties are memoized against the workspace {@link ModelVersion}.
 */
public class Type extends Namespace {

    private final EnumSet<Modifier> modifiers = EnumSet.noneOf(Modifier.class);
    private final List<Relationship> external = new ArrayList<>();
    private final List<Specialization> implied = new ArrayList<>();
    private final Memo<List<Specialization>> allSpecializations = new Memo<>();
    private final Memo<List<Type>> allTypes = new Memo<>();
    private final Memo<List<Feature>> allFeatures = new Memo<>();
    private final FeatureEnds ends = new FeatureEnds(this);
    private final ParameterList parameters = new ParameterList(this);

    public Type(ElementKind kind, ModelDocument document) {
        super(kind, document);
    }

    // ========================================
    // Modifiers
    // ========================================

    public boolean has(Modifier modifier) {
        return modifiers.contains(modifier);
    }

    public void addModifier(Modifier modifier) {
        modifiers.add(modifier);
    }

    public Set<Modifier> modifiers() {
        return Collections.unmodifiableSet(modifiers);
    }

    public boolean isAbstract() {
        return has(Modifier.ABSTRACT);
    }

    public boolean isSufficient() {
        return has(Modifier.SUFFICIENT);
    }

    public boolean isVariation() {
        return has(Modifier.VARIATION);
    }

    public boolean isIndividual() {
        return has(Modifier.INDIVIDUAL);
    }

    /**
     * @return the owned multiplicity, or null
     */
    public MultiplicityRange multiplicity() {
        var owned = children(ChildRole.MULTIPLICITY, MultiplicityRange.class);
        return owned.isEmpty() ? null : owned.get(0);
    }

    /**
     * @return the owned multiplicity or the first one found on a supertype
     */
    public MultiplicityRange effectiveMultiplicity() {
        for (Type type : allTypes()) {
            MultiplicityRange multiplicity = type.multiplicity();
            if (multiplicity != null) {
                return multiplicity;
            }
        }
        return null;
    }

    // ========================================
    // Relationships
    // ========================================

    /**
     * @return owned, external and implied relationships in that order
     */
    public List<Relationship> relationships() {
        List<Relationship> all = new ArrayList<>(children(ChildRole.RELATIONSHIP, Relationship.class));
        all.addAll(external);
        all.addAll(implied);
        return all;
    }

    /**
     * @return relationships of {@code kind} or one of its subkinds
     */
    public List<Relationship> relationships(RelationshipKind kind) {
        List<Relationship> result = new ArrayList<>();
        for (Relationship relationship : relationships()) {
            if (relationship.relationshipKind().isKind(kind)) {
                result.add(relationship);
            }
        }
        return result;
    }

    /**
     * @return direct heritage relationships (specializations and conjugation)
     */
    public List<Specialization> specializations() {
        List<Specialization> result = new ArrayList<>();
        for (Relationship relationship : relationships()) {
            if (relationship instanceof Specialization specialization && relationship.relationshipKind().isHeritage()) {
                result.add(specialization);
            }
        }
        return result;
    }

    /**
     * @return direct specializations of {@code kind} or one of its subkinds
     */
    public List<Specialization> specializations(RelationshipKind kind) {
        List<Specialization> result = new ArrayList<>();
        for (Specialization specialization : specializations()) {
            if (specialization.relationshipKind().isKind(kind)) {
                result.add(specialization);
            }
        }
        return result;
    }

    /**
     * @return true if a relationship of {@code kind} was written in source
     */
    public boolean hasExplicit(RelationshipKind kind) {
        for (Relationship relationship : relationships(kind)) {
            if (!relationship.isImplied()) {
                return true;
            }
        }
        return false;
    }

    /**
     * Registers a standalone relationship whose source is this type.
     */
    public void addExternal(Relationship relationship) {
        if (!external.contains(relationship)) {
            external.add(relationship);
            version().bump();
        }
    }

    public void addImplied(Specialization specialization) {
        implied.add(specialization);
        version().bump();
    }

    public List<Specialization> impliedSpecializations() {
        return Collections.unmodifiableList(implied);
    }

    /**
     * @return the resolved targets of the direct heritage relationships
     */
    public List<Type> directSupertypes() {
        Set<Type> result = new LinkedHashSet<>();
        for (Specialization specialization : specializations()) {
            if (specialization.resolveTarget() instanceof Type general && general != this) {
                result.add(general);
            }
        }
        return new ArrayList<>(result);
    }

    /**
     * Breadth-first closure of heritage relationships, one relationship per
     * reachable supertype. Cycles are cut by the visited set.
     */
    public List<Specialization> allSpecializations() {
        List<Specialization> result = allSpecializations.get(version(), this::computeAllSpecializations);
        return result == null ? List.of() : result;
    }

    private List<Specialization> computeAllSpecializations() {
        List<Specialization> result = new ArrayList<>();
        Set<Type> visited = new HashSet<>();
        Deque<Type> queue = new ArrayDeque<>();
        visited.add(this);
        queue.add(this);
        while (!queue.isEmpty()) {
            Type current = queue.poll();
            for (Specialization specialization : current.specializations()) {
                if (specialization.resolveTarget() instanceof Type general && visited.add(general)) {
                    result.add(specialization);
                    queue.add(general);
                }
            }
        }
        return result;
    }

    /**
     * @return this type followed by every type it transitively specializes
     */
    public List<Type> allTypes() {
        List<Type> result = allTypes.get(version(), this::computeAllTypes);
        return result == null ? List.of(this) : result;
    }

    private List<Type> computeAllTypes() {
        List<Type> result = new ArrayList<>();
        result.add(this);
        for (Specialization specialization : allSpecializations()) {
            if (specialization.target() instanceof Type general) {
                result.add(general);
            }
        }
        return result;
    }

    public boolean conforms(Type other) {
        return other != null && allTypes().contains(other);
    }

    /**
     * @param qualifiedName e.g. {@code Base::Anything}
     */
    public boolean conforms(String qualifiedName) {
        for (Type type : allTypes()) {
            if (qualifiedName.equals(type.qualifiedName())) {
                return true;
            }
        }
        return false;
    }

    /**
     * @return true if this type directly or transitively specializes {@code other}
     */
    public boolean specializes(Type other) {
        return other != this && conforms(other);
    }

    public boolean isConjugated() {
        return !relationships(RelationshipKind.CONJUGATION).isEmpty();
    }

    /**
     * @return the relationship kind used for implied supertypes of this type
     */
    public RelationshipKind specializationKind() {
        return isKind(ElementKind.CLASSIFIER) ? RelationshipKind.SUBCLASSIFICATION : RelationshipKind.SPECIALIZATION;
    }

    // ========================================
    // Features
    // ========================================

    public List<Feature> ownedFeatures() {
        return features();
    }

    /**
     * @return owned and inherited features, without features redefined by another one
     */
    public List<Feature> allFeatures() {
        List<Feature> result = allFeatures.get(version(), this::computeAllFeatures);
        return result == null ? ownedFeatures() : result;
    }

    private List<Feature> computeAllFeatures() {
        Set<Feature> result = new LinkedHashSet<>();
        Set<Feature> redefined = new HashSet<>();
        for (Type type : allTypes()) {
            for (Feature feature : type.ownedFeatures()) {
                result.add(feature);
                redefined.addAll(feature.redefinedFeatures());
            }
        }
        result.removeAll(redefined);
        return new ArrayList<>(result);
    }

    public FeatureEnds ends() {
        return ends;
    }

    public ParameterList parameters() {
        return parameters;
    }

    /**
     * @return the classifier families of this type and its supertypes
     */
    public Set<ClassifierFlag> classifierFlags() {
        EnumSet<ClassifierFlag> flags = EnumSet.noneOf(ClassifierFlag.class);
        for (Type type : allTypes()) {
            if (!(type instanceof Feature)) {
                addFlags(type.kind(), flags);
            }
        }
        return flags;
    }

    static void addFlags(ElementKind kind, Set<ClassifierFlag> flags) {
        if (kind.isKind(ElementKind.DATA_TYPE)) {
            flags.add(ClassifierFlag.DATA_TYPE);
        }
        if (kind.isKind(ElementKind.CLASS)) {
            flags.add(ClassifierFlag.CLASS);
        }
        if (kind.isKind(ElementKind.STRUCTURE)) {
            flags.add(ClassifierFlag.STRUCTURE);
        }
        if (kind.isKind(ElementKind.ASSOCIATION)) {
            flags.add(ClassifierFlag.ASSOCIATION);
        }
    }

    @Override
    public void reset() {
        super.reset();
        external.clear();
        implied.clear();
        allSpecializations.clear();
        allTypes.clear();
        allFeatures.clear();
        ends.clear();
        parameters.clear();
    }
}
