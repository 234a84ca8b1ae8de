package org.sysmlite.engine.implicit;

import org.sysmlite.engine.build.BuildOptions;
import org.sysmlite.engine.build.StandardLibrary;
import org.sysmlite.engine.scope.Linker;
import org.sysmlite.engine.workspace.Diagnostic;
import org.sysmlite.engine.workspace.SourceDocument;
import org.sysmlite.kerml.m3.ClassifierFlag;
import org.sysmlite.kerml.m3.Element;
import org.sysmlite.kerml.m3.ElementKind;
import org.sysmlite.kerml.m3.Feature;
import org.sysmlite.kerml.m3.Modifier;
import org.sysmlite.kerml.m3.RelationshipKind;
import org.sysmlite.kerml.m3.Specialization;
import org.sysmlite.kerml.m3.Type;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import static org.sysmlite.engine.implicit.ImplicitSupertypes.*;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;

/**
 * Adds implied specializations to standard library elements for types that
 * do not declare the supertypes their kind requires.
 *
 * Each type yields an ordered list of selectors: the kind-specific selector
 * first, then containment selectors such as {@code subobject} or
 * {@code ownedPerformance}. Each selector is mapped to a library element by
 * {@link ImplicitSupertypes}; missing library elements are skipped.
 */
public class ImplicitSynthesizer {

    private static final Logger LOGGER = LoggerFactory.getLogger(ImplicitSynthesizer.class);

    private final Linker linker;

    public ImplicitSynthesizer(Linker linker) {
        this.linker = linker;
    }

    /**
     * Adds implicit supertypes to every type of the document, then implicit
     * end redefinitions to its associations and connectors.
     *
     * @return number of implied relationships added
     */
    public int addImplicits(SourceDocument document, BuildOptions options) {
        if (options.standardLibrary() == StandardLibrary.NONE) {
            return 0;
        }
        List<Type> types = new ArrayList<>();
        for (Element element : document.root().descendants()) {
            if (element instanceof Type type) {
                types.add(type);
            }
        }
        int added = 0;
        for (Type type : types) {
            added += addSupertypes(type, document, options);
        }
        for (Type type : types) {
            if (type.isAny(ElementKind.ASSOCIATION, ElementKind.CONNECTOR)) {
                added += redefineEnds(type);
            }
        }
        LOGGER.debug("Added {} implied relationship(s) in {}", added, document.uri());
        return added;
    }

    // ========================================
    // Supertypes
    // ========================================

    private int addSupertypes(Type type, SourceDocument document, BuildOptions options) {
        RelationshipKind kind = type.specializationKind();
        ImplicitPolicy policy = options.implicitPolicy();
        if (policy != ImplicitPolicy.ALWAYS && type.hasExplicit(kind)) {
            return 0;
        }
        int added = 0;
        for (String selector : selectors(type)) {
            String qualifiedName = ImplicitSupertypes.get(type.kind(), selector);
            if (qualifiedName == null) {
                LOGGER.debug("No implicit supertype for {} ({})", type.kind().displayName(), selector);
                continue;
            }
            Element target = linker.findLibraryElement(qualifiedName, type);
            if (!(target instanceof Type general)) {
                if (!options.ignoreMetamodelErrors()) {
                    document.addDiagnostic(Diagnostic.warning(Diagnostic.MISSING_LIBRARY_ELEMENT,
                            "Could not find implicit specialization '" + qualifiedName + "' for "
                                    + type.kind().displayName() + ".",
                            type));
                }
                continue;
            }
            if (general == type || type.directSupertypes().contains(general)) {
                continue;
            }
            if (policy == ImplicitPolicy.SKIP_IF_REACHABLE && type.conforms(general)) {
                continue;
            }
            type.addImplied(Specialization.implied(kind, type, general));
            added++;
        }
        return added;
    }

    /**
     * @return selector names in the order their supertypes are added
     */
    static List<String> selectors(Type type) {
        List<String> selectors = new ArrayList<>();
        if (!(type instanceof Feature feature)) {
            if (type.kind().isKind(ElementKind.ASSOCIATION)) {
                selectors.add(isBinary(type) ? BINARY : BASE);
            } else {
                selectors.add(BASE);
            }
            return selectors;
        }
        ElementKind kind = feature.kind();
        if (kind.isKind(ElementKind.MULTIPLICITY_RANGE) || kind.isKind(ElementKind.METADATA_FEATURE)
                || kind.isKind(ElementKind.ATTRIBUTE_USAGE)) {
            selectors.add(BASE);
        } else if (kind.isKind(ElementKind.CONNECTION_USAGE)) {
            selectors.add(isBinary(feature) ? BINARY : BASE);
        } else if (kind.isKind(ElementKind.CONNECTOR)) {
            selectors.add(connectorSelector(feature));
        } else if (kind.isKind(ElementKind.REQUIREMENT_USAGE)) {
            addRequirementConstraintSelector(feature, selectors);
            selectors.add(!feature.has(Modifier.ASSUME)
                    && isOwnedComposite(feature, ElementKind.REQUIREMENT_DEFINITION, ElementKind.REQUIREMENT_USAGE)
                    ? SUBREQUIREMENT : BASE);
            addConstraintSelectors(feature, selectors);
        } else if (kind.isKind(ElementKind.CONSTRAINT_USAGE)) {
            addRequirementConstraintSelector(feature, selectors);
            selectors.add(BASE);
            addConstraintSelectors(feature, selectors);
        } else if (kind.isKind(ElementKind.ACTION_USAGE)) {
            selectors.add(BASE);
            addActionSelectors(feature, selectors);
        } else if (kind.isKind(ElementKind.PORT_USAGE)) {
            if (isOwnedComposite(feature, ElementKind.PART_DEFINITION, ElementKind.PART_USAGE)) {
                selectors.add(OWNED_PORT);
            } else if (isOwnedComposite(feature, ElementKind.PORT_DEFINITION, ElementKind.PORT_USAGE)) {
                selectors.add(SUBPORT);
            } else {
                selectors.add(BASE);
            }
        } else if (kind.isKind(ElementKind.ITEM_USAGE)) {
            boolean subitem = isOwnedComposite(feature, ElementKind.ITEM_DEFINITION, ElementKind.ITEM_USAGE);
            String actorSelector = kind.isKind(ElementKind.PART_USAGE) ? requirementPartSelector(feature) : null;
            if (actorSelector != null) {
                selectors.add(actorSelector);
            } else {
                selectors.add(subitem ? SUBITEM : BASE);
            }
            addOccurrenceSelectors(feature, !subitem, selectors);
        } else if (kind.isKind(ElementKind.OCCURRENCE_USAGE)) {
            selectors.add(BASE);
            addOccurrenceSelectors(feature, true, selectors);
        } else if (kind.isKind(ElementKind.EXPRESSION)) {
            selectors.add(feature.isNegated() && kind.isKind(ElementKind.INVARIANT) ? NEGATED : BASE);
            addPerformanceSelectors(feature, selectors);
        } else if (kind.isKind(ElementKind.STEP)) {
            selectors.add(stepSelector(feature));
        } else {
            selectors.add(featureSelector(feature));
            if (isAssociationEnd(feature)) {
                selectors.add(PARTICIPANT);
            }
        }
        return selectors;
    }

    private static String featureSelector(Feature feature) {
        if (feature.classifierFlags().contains(ClassifierFlag.STRUCTURE)) {
            return isSubobject(feature) ? SUBOBJECT : OBJECT;
        }
        if (feature.classifierFlags().contains(ClassifierFlag.CLASS)) {
            return isSuboccurrence(feature) ? SUBOCCURRENCE : OCCURRENCE;
        }
        if (feature.classifierFlags().contains(ClassifierFlag.DATA_TYPE)) {
            return DATA_VALUE;
        }
        return BASE;
    }

    private static String connectorSelector(Feature connector) {
        boolean binary = isBinary(connector);
        if (connector.classifierFlags().contains(ClassifierFlag.STRUCTURE)) {
            return binary ? BINARY_OBJECT : OBJECT;
        }
        return binary ? BINARY : BASE;
    }

    private static String stepSelector(Feature step) {
        if (isStructureOwnedComposite(step)) {
            return OWNED_PERFORMANCE;
        }
        if (step.isComposite() && isBehaviorOwned(step)) {
            return SUBPERFORMANCE;
        }
        if (isBehaviorOwned(step)) {
            return ENCLOSED_PERFORMANCE;
        }
        return BASE;
    }

    private static void addPerformanceSelectors(Feature feature, List<String> selectors) {
        if (isStructureOwnedComposite(feature)) {
            selectors.add(OWNED_PERFORMANCE);
        }
        if (feature.isComposite() && isBehaviorOwned(feature)) {
            selectors.add(SUBPERFORMANCE);
        }
        if (isBehaviorOwned(feature)) {
            selectors.add(ENCLOSED_PERFORMANCE);
        }
    }

    private static void addOccurrenceSelectors(Feature occurrence, boolean suboccurrence, List<String> selectors) {
        if (suboccurrence && isSuboccurrence(occurrence)) {
            selectors.add(SUBOCCURRENCE);
        }
        Modifier portionKind = occurrence.portionKind();
        if (portionKind == Modifier.TIMESLICE) {
            selectors.add(TIMESLICE);
        } else if (portionKind == Modifier.SNAPSHOT) {
            selectors.add(SNAPSHOT);
        }
    }

    private static String requirementPartSelector(Feature part) {
        Element owner = part.owner();
        if (owner == null || !owner.isAny(ElementKind.REQUIREMENT_DEFINITION, ElementKind.REQUIREMENT_USAGE)) {
            return null;
        }
        if (part.has(Modifier.ACTOR)) {
            return REQUIREMENT_ACTOR;
        }
        return part.has(Modifier.STAKEHOLDER) ? REQUIREMENT_STAKEHOLDER : null;
    }

    private static void addRequirementConstraintSelector(Feature constraint, List<String> selectors) {
        Element owner = constraint.owner();
        if (owner == null || !owner.isAny(ElementKind.REQUIREMENT_DEFINITION, ElementKind.REQUIREMENT_USAGE)) {
            return;
        }
        if (constraint.has(Modifier.ASSUME)) {
            selectors.add(ASSUMPTION);
        } else if (constraint.has(Modifier.REQUIRE)) {
            selectors.add(REQUIREMENT);
        }
    }

    private static void addActionSelectors(Feature action, List<String> selectors) {
        String stateSubaction = stateSubactionSelector(action);
        if (stateSubaction != null) {
            selectors.add(stateSubaction);
        }
        // entry and exit actions are never subactions
        if (!ENTRY.equals(stateSubaction) && !EXIT.equals(stateSubaction)) {
            addSubactionSelector(action, selectors);
        }
        if (isStructureOwnedComposite(action)) {
            selectors.add(OWNED_PERFORMANCE);
        } else if (isBehaviorOwned(action)) {
            selectors.add(ENCLOSED_PERFORMANCE);
        }
    }

    private static void addSubactionSelector(Feature action, List<String> selectors) {
        if (action.kind().isKind(ElementKind.STATE_USAGE)
                && isOwnedComposite(action, ElementKind.STATE_DEFINITION, ElementKind.STATE_USAGE)) {
            selectors.add(SUBSTATE);
        } else if (action.kind().isKind(ElementKind.CALCULATION_USAGE)
                && isOwnedComposite(action, ElementKind.CALCULATION_DEFINITION, ElementKind.CALCULATION_USAGE)) {
            selectors.add(SUBCALCULATION);
        } else if (isOwnedComposite(action, ElementKind.ACTION_DEFINITION, ElementKind.ACTION_USAGE)) {
            selectors.add(SUBACTION);
        } else if (isOwnedComposite(action, ElementKind.PART_DEFINITION, ElementKind.PART_USAGE)) {
            selectors.add(OWNED_ACTION);
        }
    }

    private static String stateSubactionSelector(Feature action) {
        Element owner = action.owner();
        if (owner == null || !owner.isAny(ElementKind.STATE_DEFINITION, ElementKind.STATE_USAGE)) {
            return null;
        }
        if (action.has(Modifier.ENTRY)) {
            return ENTRY;
        }
        if (action.has(Modifier.DO)) {
            return DO;
        }
        return action.has(Modifier.EXIT) ? EXIT : null;
    }

    private static void addConstraintSelectors(Feature constraint, List<String> selectors) {
        if (isOwnedComposite(constraint, ElementKind.ITEM_DEFINITION, ElementKind.ITEM_USAGE)) {
            selectors.add(CHECKED_CONSTRAINT);
        }
        addPerformanceSelectors(constraint, selectors);
    }

    // ========================================
    // Containment predicates
    // ========================================

    private static boolean isOwnedComposite(Feature feature, ElementKind... ownerKinds) {
        Element owner = feature.owner();
        return feature.isComposite() && owner != null && owner.isAny(ownerKinds);
    }

    private static boolean isBehaviorOwned(Feature feature) {
        Element owner = feature.owner();
        return owner != null && owner.isAny(ElementKind.BEHAVIOR, ElementKind.STEP);
    }

    private static boolean isStructureOwnedComposite(Feature feature) {
        return isSubobject(feature);
    }

    private static boolean isSubobject(Feature feature) {
        return feature.isComposite() && ownerHas(feature, ElementKind.STRUCTURE, ClassifierFlag.STRUCTURE);
    }

    private static boolean isSuboccurrence(Feature feature) {
        return feature.isComposite() && ownerHas(feature, ElementKind.CLASS, ClassifierFlag.CLASS);
    }

    private static boolean ownerHas(Feature feature, ElementKind classifierKind, ClassifierFlag flag) {
        Element owner = feature.owner();
        if (owner instanceof Feature owningFeature) {
            return owningFeature.classifierFlags().contains(flag);
        }
        return owner != null && owner.isKind(classifierKind);
    }

    private static boolean isAssociationEnd(Feature feature) {
        Element owner = feature.owner();
        return feature.isEnd() && owner != null && owner.isAny(ElementKind.ASSOCIATION, ElementKind.CONNECTOR);
    }

    private static boolean isBinary(Type type) {
        List<Feature> owned = type.ends().owned();
        return owned.isEmpty() ? type.ends().isBinary() : owned.size() == 2;
    }

    // ========================================
    // End redefinitions
    // ========================================

    /**
     * Redefines each owned end without an explicit redefinition with the end
     * at the same position of the nearest association the type specializes.
     */
    private int redefineEnds(Type type) {
        List<Feature> ownedEnds = type.ends().owned();
        if (ownedEnds.isEmpty()) {
            return 0;
        }
        List<Feature> baseEnds = baseEnds(type);
        int added = 0;
        Iterator<Feature> base = baseEnds.iterator();
        for (Feature end : ownedEnds) {
            if (!base.hasNext()) {
                break;
            }
            Feature target = base.next();
            if (end.hasExplicit(RelationshipKind.REDEFINITION) || target == end) {
                continue;
            }
            end.addImplied(Specialization.implied(RelationshipKind.REDEFINITION, end, target));
            added++;
        }
        return added;
    }

    private static List<Feature> baseEnds(Type type) {
        for (Type general : type.allTypes()) {
            if (general == type || !general.kind().isKind(ElementKind.ASSOCIATION)) {
                continue;
            }
            List<Feature> ends = general.ends().all();
            if (!ends.isEmpty()) {
                return ends;
            }
        }
        return List.of();
    }
}
