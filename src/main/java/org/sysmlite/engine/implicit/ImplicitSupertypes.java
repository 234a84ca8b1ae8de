package org.sysmlite.engine.implicit;

import org.sysmlite.kerml.m3.ElementKind;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.HashMap;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;

/**
 * Standard library elements used as implicit supertypes, by element kind
 * and selector.
 *
 * A kind without an entry for a selector inherits the entry of its nearest
 * super kind, searched breadth-first in declaration order.
 */
public final class ImplicitSupertypes {

    // ========================================
    // Selectors
    // ========================================

    public static final String BASE = "base";
    public static final String BINARY = "binary";
    public static final String DATA_VALUE = "dataValue";
    public static final String OCCURRENCE = "occurrence";
    public static final String SUBOCCURRENCE = "suboccurrence";
    public static final String OBJECT = "object";
    public static final String SUBOBJECT = "subobject";
    public static final String BINARY_OBJECT = "binaryObject";
    public static final String PARTICIPANT = "participant";
    public static final String NEGATED = "negated";
    public static final String ENCLOSED_PERFORMANCE = "enclosedPerformance";
    public static final String SUBPERFORMANCE = "subperformance";
    public static final String OWNED_PERFORMANCE = "ownedPerformance";
    public static final String SUBITEM = "subitem";
    public static final String OWNED_PORT = "ownedPort";
    public static final String SUBPORT = "subport";
    public static final String SUBACTION = "subaction";
    public static final String OWNED_ACTION = "ownedAction";
    public static final String SUBSTATE = "substate";
    public static final String SUBCALCULATION = "subcalculation";
    public static final String CHECKED_CONSTRAINT = "checkedConstraint";
    public static final String SUBREQUIREMENT = "subrequirement";
    public static final String TIMESLICE = "timeslice";
    public static final String SNAPSHOT = "snapshot";
    public static final String ENTRY = "entry";
    public static final String DO = "do";
    public static final String EXIT = "exit";
    public static final String ASSUMPTION = "assumption";
    public static final String REQUIREMENT = "requirement";
    public static final String REQUIREMENT_ACTOR = "requirementActor";
    public static final String REQUIREMENT_STAKEHOLDER = "requirementStakeholder";

    private static final Map<ElementKind, Map<String, String>> TABLE = new EnumMap<>(ElementKind.class);

    static {
        // KerML classifiers
        put(ElementKind.TYPE, BASE, "Base::Anything");
        put(ElementKind.CLASSIFIER, BASE, "Base::Anything");
        put(ElementKind.DATA_TYPE, BASE, "Base::DataValue");
        put(ElementKind.CLASS, BASE, "Occurrences::Occurrence");
        put(ElementKind.STRUCTURE, BASE, "Objects::Object");
        put(ElementKind.ASSOCIATION, BASE, "Links::Link");
        put(ElementKind.ASSOCIATION, BINARY, "Links::BinaryLink");
        put(ElementKind.ASSOCIATION_STRUCTURE, BASE, "Objects::LinkObject");
        put(ElementKind.ASSOCIATION_STRUCTURE, BINARY, "Objects::BinaryLinkObject");
        put(ElementKind.BEHAVIOR, BASE, "Performances::Performance");
        put(ElementKind.FUNCTION, BASE, "Performances::Evaluation");
        put(ElementKind.PREDICATE, BASE, "Performances::BooleanEvaluation");
        put(ElementKind.INTERACTION, BASE, "Performances::Performance");
        put(ElementKind.INTERACTION, BINARY, "Performances::Performance");
        put(ElementKind.METACLASS, BASE, "Metaobjects::Metaobject");

        // SysML definitions
        put(ElementKind.ATTRIBUTE_DEFINITION, BASE, "Base::DataValue");
        put(ElementKind.OCCURRENCE_DEFINITION, BASE, "Occurrences::Occurrence");
        put(ElementKind.ITEM_DEFINITION, BASE, "Items::Item");
        put(ElementKind.PART_DEFINITION, BASE, "Parts::Part");
        put(ElementKind.PORT_DEFINITION, BASE, "Ports::Port");
        put(ElementKind.CONNECTION_DEFINITION, BASE, "Connections::Connection");
        put(ElementKind.CONNECTION_DEFINITION, BINARY, "Connections::BinaryConnection");
        put(ElementKind.METADATA_DEFINITION, BASE, "Metaobjects::Metaobject");
        put(ElementKind.ACTION_DEFINITION, BASE, "Actions::Action");
        put(ElementKind.STATE_DEFINITION, BASE, "States::StateAction");
        put(ElementKind.CALCULATION_DEFINITION, BASE, "Calculations::Calculation");
        put(ElementKind.CONSTRAINT_DEFINITION, BASE, "Constraints::ConstraintCheck");
        put(ElementKind.REQUIREMENT_DEFINITION, BASE, "Requirements::RequirementCheck");

        // KerML features
        put(ElementKind.FEATURE, BASE, "Base::things");
        put(ElementKind.FEATURE, DATA_VALUE, "Base::dataValues");
        put(ElementKind.FEATURE, OCCURRENCE, "Occurrences::occurrences");
        put(ElementKind.FEATURE, SUBOCCURRENCE, "Occurrences::Occurrence::suboccurrences");
        put(ElementKind.FEATURE, OBJECT, "Objects::objects");
        put(ElementKind.FEATURE, SUBOBJECT, "Objects::Object::subobjects");
        put(ElementKind.FEATURE, PARTICIPANT, "Links::Link::participant");
        put(ElementKind.MULTIPLICITY_RANGE, BASE, "Base::naturals");
        put(ElementKind.STEP, BASE, "Performances::performances");
        put(ElementKind.STEP, ENCLOSED_PERFORMANCE, "Performances::Performance::enclosedPerformances");
        put(ElementKind.STEP, SUBPERFORMANCE, "Performances::Performance::subperformances");
        put(ElementKind.STEP, OWNED_PERFORMANCE, "Objects::Object::ownedPerformances");
        put(ElementKind.EXPRESSION, BASE, "Performances::evaluations");
        put(ElementKind.BOOLEAN_EXPRESSION, BASE, "Performances::booleanEvaluations");
        put(ElementKind.INVARIANT, BASE, "Performances::trueEvaluations");
        put(ElementKind.INVARIANT, NEGATED, "Performances::falseEvaluations");
        put(ElementKind.CONNECTOR, BASE, "Links::links");
        put(ElementKind.CONNECTOR, BINARY, "Links::binaryLinks");
        put(ElementKind.CONNECTOR, OBJECT, "Objects::linkObjects");
        put(ElementKind.CONNECTOR, BINARY_OBJECT, "Objects::binaryLinkObjects");
        put(ElementKind.BINDING_CONNECTOR, BASE, "Links::selfLinks");
        put(ElementKind.BINDING_CONNECTOR, BINARY, "Links::selfLinks");
        put(ElementKind.SUCCESSION, BASE, "Occurrences::happensBeforeLinks");
        put(ElementKind.SUCCESSION, BINARY, "Occurrences::happensBeforeLinks");
        put(ElementKind.METADATA_FEATURE, BASE, "Metaobjects::metaobjects");

        // SysML usages
        put(ElementKind.ATTRIBUTE_USAGE, BASE, "Base::dataValues");
        put(ElementKind.OCCURRENCE_USAGE, BASE, "Occurrences::occurrences");
        put(ElementKind.OCCURRENCE_USAGE, TIMESLICE, "Occurrences::Occurrence::timeSlices");
        put(ElementKind.OCCURRENCE_USAGE, SNAPSHOT, "Occurrences::Occurrence::snapshots");
        put(ElementKind.ITEM_USAGE, BASE, "Items::items");
        put(ElementKind.ITEM_USAGE, SUBITEM, "Items::Item::subitems");
        put(ElementKind.PART_USAGE, BASE, "Parts::parts");
        put(ElementKind.PART_USAGE, SUBITEM, "Items::Item::subparts");
        put(ElementKind.PART_USAGE, REQUIREMENT_ACTOR, "Requirements::RequirementCheck::actors");
        put(ElementKind.PART_USAGE, REQUIREMENT_STAKEHOLDER, "Requirements::RequirementCheck::stakeholders");
        put(ElementKind.PORT_USAGE, BASE, "Ports::ports");
        put(ElementKind.PORT_USAGE, OWNED_PORT, "Parts::Part::ownedPorts");
        put(ElementKind.PORT_USAGE, SUBPORT, "Ports::Port::subports");
        put(ElementKind.CONNECTION_USAGE, BASE, "Connections::connections");
        put(ElementKind.CONNECTION_USAGE, BINARY, "Connections::binaryConnections");
        put(ElementKind.ACTION_USAGE, BASE, "Actions::actions");
        put(ElementKind.ACTION_USAGE, SUBACTION, "Actions::Action::subactions");
        put(ElementKind.ACTION_USAGE, OWNED_ACTION, "Parts::Part::ownedActions");
        put(ElementKind.ACTION_USAGE, ENTRY, "States::StateAction::entryAction");
        put(ElementKind.ACTION_USAGE, DO, "States::StateAction::doAction");
        put(ElementKind.ACTION_USAGE, EXIT, "States::StateAction::exitAction");
        put(ElementKind.STATE_USAGE, BASE, "States::stateActions");
        put(ElementKind.STATE_USAGE, SUBSTATE, "States::StateAction::substates");
        put(ElementKind.STATE_USAGE, OWNED_ACTION, "Parts::Part::ownedStates");
        put(ElementKind.CALCULATION_USAGE, BASE, "Calculations::calculations");
        put(ElementKind.CALCULATION_USAGE, SUBCALCULATION, "Calculations::Calculation::subcalculations");
        put(ElementKind.CONSTRAINT_USAGE, BASE, "Constraints::constraintChecks");
        put(ElementKind.CONSTRAINT_USAGE, CHECKED_CONSTRAINT, "Items::Item::checkedConstraints");
        put(ElementKind.CONSTRAINT_USAGE, ASSUMPTION, "Requirements::RequirementCheck::assumptions");
        put(ElementKind.CONSTRAINT_USAGE, REQUIREMENT, "Requirements::RequirementCheck::constraints");
        put(ElementKind.REQUIREMENT_USAGE, BASE, "Requirements::requirementChecks");
        put(ElementKind.REQUIREMENT_USAGE, SUBREQUIREMENT, "Requirements::RequirementCheck::subrequirements");

        // expressions
        put(ElementKind.LITERAL_EXPRESSION, BASE, "Performances::literalEvaluations");
        put(ElementKind.LITERAL_BOOLEAN, BASE, "Performances::literalBooleanEvaluations");
        put(ElementKind.LITERAL_INTEGER, BASE, "Performances::literalIntegerEvaluations");
        put(ElementKind.LITERAL_RATIONAL, BASE, "Performances::literalRationalEvaluations");
        put(ElementKind.LITERAL_STRING, BASE, "Performances::literalStringEvaluations");
        put(ElementKind.NULL_EXPRESSION, BASE, "Performances::nullEvaluations");
    }

    private ImplicitSupertypes() {
        // Static utility class
    }

    private static void put(ElementKind kind, String selector, String qualifiedName) {
        TABLE.computeIfAbsent(kind, k -> new HashMap<>()).put(selector, qualifiedName);
    }

    /**
     * @return the qualified name of the library element for {@code selector},
     *         or null if neither the kind nor any super kind defines one
     */
    public static String get(ElementKind kind, String selector) {
        Deque<ElementKind> pending = new ArrayDeque<>();
        Set<ElementKind> visited = EnumSet.noneOf(ElementKind.class);
        pending.add(kind);
        while (!pending.isEmpty()) {
            ElementKind current = pending.poll();
            if (!visited.add(current)) {
                continue;
            }
            Map<String, String> entries = TABLE.get(current);
            if (entries != null && entries.containsKey(selector)) {
                return entries.get(selector);
            }
            pending.addAll(current.supertypes());
        }
        return null;
    }

    /**
     * @return every qualified name in the table, for library completeness checks
     */
    public static Set<String> allNames() {
        Set<String> names = new TreeSet<>();
        TABLE.values().forEach(entries -> names.addAll(entries.values()));
        return names;
    }
}
