package org.sysmlite.kerml.m3;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Metaclass of a model element.
 *
 * Kinds form a multiple-inheritance lattice: each constant names its direct
 * super kinds, e.g. a connection definition is both a part definition and an
 * association structure.
 */
public enum ElementKind {
    ELEMENT,
    COMMENT(ELEMENT),
    DOCUMENTATION(COMMENT),

    // relationships
    RELATIONSHIP(ELEMENT),
    MEMBERSHIP(RELATIONSHIP),
    IMPORT(RELATIONSHIP),
    SPECIALIZATION(RELATIONSHIP),
    DEPENDENCY(RELATIONSHIP),

    // namespaces
    NAMESPACE(ELEMENT),
    PACKAGE(NAMESPACE),
    LIBRARY_PACKAGE(PACKAGE),

    // KerML classifiers
    TYPE(NAMESPACE),
    CLASSIFIER(TYPE),
    DATA_TYPE(CLASSIFIER),
    CLASS(CLASSIFIER),
    STRUCTURE(CLASS),
    ASSOCIATION(CLASSIFIER),
    ASSOCIATION_STRUCTURE(ASSOCIATION, STRUCTURE),
    BEHAVIOR(CLASS),
    FUNCTION(BEHAVIOR),
    PREDICATE(FUNCTION),
    INTERACTION(ASSOCIATION, BEHAVIOR),
    METACLASS(STRUCTURE),

    // SysML definitions
    DEFINITION(CLASSIFIER),
    ATTRIBUTE_DEFINITION(DEFINITION, DATA_TYPE),
    ENUMERATION_DEFINITION(ATTRIBUTE_DEFINITION),
    OCCURRENCE_DEFINITION(DEFINITION, CLASS),
    ITEM_DEFINITION(OCCURRENCE_DEFINITION, STRUCTURE),
    PART_DEFINITION(ITEM_DEFINITION),
    PORT_DEFINITION(OCCURRENCE_DEFINITION, STRUCTURE),
    CONNECTION_DEFINITION(PART_DEFINITION, ASSOCIATION_STRUCTURE),
    METADATA_DEFINITION(ITEM_DEFINITION, METACLASS),
    ACTION_DEFINITION(OCCURRENCE_DEFINITION, BEHAVIOR),
    STATE_DEFINITION(ACTION_DEFINITION),
    CALCULATION_DEFINITION(ACTION_DEFINITION, FUNCTION),
    CONSTRAINT_DEFINITION(OCCURRENCE_DEFINITION, PREDICATE),
    REQUIREMENT_DEFINITION(CONSTRAINT_DEFINITION),

    // KerML features
    FEATURE(TYPE),
    MULTIPLICITY_RANGE(FEATURE),
    STEP(FEATURE),
    EXPRESSION(STEP),
    BOOLEAN_EXPRESSION(EXPRESSION),
    INVARIANT(BOOLEAN_EXPRESSION),
    CONNECTOR(FEATURE),
    BINDING_CONNECTOR(CONNECTOR),
    SUCCESSION(CONNECTOR),
    METADATA_FEATURE(FEATURE),

    // SysML usages
    USAGE(FEATURE),
    REFERENCE_USAGE(USAGE),
    ATTRIBUTE_USAGE(USAGE),
    OCCURRENCE_USAGE(USAGE),
    ITEM_USAGE(OCCURRENCE_USAGE),
    PART_USAGE(ITEM_USAGE),
    PORT_USAGE(OCCURRENCE_USAGE),
    CONNECTION_USAGE(PART_USAGE, CONNECTOR),
    ACTION_USAGE(OCCURRENCE_USAGE, STEP),
    STATE_USAGE(ACTION_USAGE),
    CALCULATION_USAGE(ACTION_USAGE, EXPRESSION),
    CONSTRAINT_USAGE(OCCURRENCE_USAGE, BOOLEAN_EXPRESSION),
    REQUIREMENT_USAGE(CONSTRAINT_USAGE),

    // expressions
    LITERAL_EXPRESSION(EXPRESSION),
    LITERAL_BOOLEAN(LITERAL_EXPRESSION),
    LITERAL_INTEGER(LITERAL_EXPRESSION),
    LITERAL_RATIONAL(LITERAL_EXPRESSION),
    LITERAL_STRING(LITERAL_EXPRESSION),
    LITERAL_INFINITY(LITERAL_EXPRESSION),
    NULL_EXPRESSION(EXPRESSION),
    INVOCATION_EXPRESSION(EXPRESSION),
    OPERATOR_EXPRESSION(INVOCATION_EXPRESSION),
    FEATURE_CHAIN_EXPRESSION(OPERATOR_EXPRESSION),
    FEATURE_REFERENCE_EXPRESSION(EXPRESSION),
    METADATA_ACCESS_EXPRESSION(EXPRESSION);

    private static final Map<ElementKind, Set<ElementKind>> ALL_SUPERTYPES = new EnumMap<>(ElementKind.class);

    static {
        for (ElementKind kind : values()) {
            Set<ElementKind> closure = EnumSet.noneOf(ElementKind.class);
            Deque<ElementKind> pending = new ArrayDeque<>(kind.supertypes);
            while (!pending.isEmpty()) {
                ElementKind next = pending.poll();
                if (closure.add(next)) {
                    pending.addAll(next.supertypes);
                }
            }
            ALL_SUPERTYPES.put(kind, closure);
        }
    }

    private final List<ElementKind> supertypes;

    ElementKind(ElementKind... supertypes) {
        this.supertypes = List.of(supertypes);
    }

    public List<ElementKind> supertypes() {
        return supertypes;
    }

    /**
     * @return true if this kind is {@code other} or (transitively) a subkind of it
     */
    public boolean isKind(ElementKind other) {
        return this == other || ALL_SUPERTYPES.get(this).contains(other);
    }

    public boolean isAny(ElementKind... kinds) {
        for (ElementKind kind : kinds) {
            if (isKind(kind)) {
                return true;
            }
        }
        return false;
    }

    /**
     * @return the metaclass name as used in messages, e.g. {@code PartDefinition}
     */
    public String displayName() {
        StringBuilder sb = new StringBuilder();
        for (String part : name().split("_")) {
            sb.append(part.charAt(0)).append(part.substring(1).toLowerCase());
        }
        return sb.toString();
    }
}
