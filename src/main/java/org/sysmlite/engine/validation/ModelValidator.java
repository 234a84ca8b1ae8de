package org.sysmlite.engine.validation;

import org.sysmlite.engine.build.BuildOptions;
import org.sysmlite.engine.build.StandardLibrary;
import org.sysmlite.engine.eval.EvaluationResult;
import org.sysmlite.engine.eval.ExpressionEvaluator;
import org.sysmlite.engine.workspace.Diagnostic;
import org.sysmlite.engine.workspace.Severity;
import org.sysmlite.kerml.m3.Connector;
import org.sysmlite.kerml.m3.Element;
import org.sysmlite.kerml.m3.ElementKind;
import org.sysmlite.kerml.m3.Expression;
import org.sysmlite.kerml.m3.Feature;
import org.sysmlite.kerml.m3.FeatureValue;
import org.sysmlite.kerml.m3.Membership;
import org.sysmlite.kerml.m3.MultiplicityRange;
import org.sysmlite.kerml.m3.Namespace;
import org.sysmlite.kerml.m3.Package;
import org.sysmlite.kerml.m3.Relationship;
import org.sysmlite.kerml.m3.RelationshipKind;
import org.sysmlite.kerml.m3.Specialization;
import org.sysmlite.kerml.m3.Type;
import org.sysmlite.kerml.m3.Bounds;
import org.sysmlite.kerml.m3.expression.FeatureChainExpression;
import org.sysmlite.kerml.m3.expression.FeatureReferenceExpression;
import org.sysmlite.kerml.m3.expression.InvocationExpression;
import org.sysmlite.kerml.m3.expression.LiteralExpression;
import org.sysmlite.kerml.m3.expression.NullExpression;
import org.sysmlite.kerml.m3.expression.OperatorExpression;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Semantic checks run on a fully resolved document.
 *
 * Each check has a stable name that doubles as its diagnostic code and can
 * be selected through {@link org.sysmlite.engine.validation.ValidationChecks}.
 * Implied relationships are never reported; they are correct by construction
 * or the underlying problem is reported on the explicit relationship.
 */
public class ModelValidator {

    private static final Logger LOGGER = LoggerFactory.getLogger(ModelValidator.class);

    public static final String TYPE_SPECIALIZATION_CYCLE = "validateTypeSpecializationCycle";
    public static final String NAMESPACE_DISTINGUISHABILITY = "validateNamespaceDistinguishability";
    public static final String SPECIALIZATION_SPECIFIC_NOT_CONJUGATED = "validateSpecializationSpecificNotConjugated";
    public static final String TYPE_AT_MOST_ONE_CONJUGATOR = "validateTypeAtMostOneConjugator";
    public static final String FEATURE_TYPING = "validateFeatureTyping";
    public static final String SUBSETTING_MULTIPLICITY_CONFORMANCE = "validateSubsettingMultiplicityConformance";
    public static final String REDEFINITION_MULTIPLICITY_CONFORMANCE = "validateRedefinitionMultiplicityConformance";
    public static final String SUBSETTING_UNIQUENESS_CONFORMANCE = "validateSubsettingUniquenessConformance";
    public static final String REDEFINITION_TYPE_CONFORMANCE = "validateRedefinitionTypeConformance";
    public static final String DATATYPE_SPECIALIZATION = "validateDatatypeSpecialization";
    public static final String CLASS_SPECIALIZATION = "validateClassSpecialization";
    public static final String BINDING_CONNECTOR_IS_BINARY = "validateBindingConnectorIsBinary";
    public static final String MULTIPLICITY_RANGE_BOUND_RESULT_TYPES = "validateMultiplicityRangeBoundResultTypes";
    public static final String FEATURE_VALUE_EVALUATION = "validateFeatureValueEvaluation";
    public static final String FEATURE_VALUE_OVERRIDING = "validateFeatureValueOverriding";
    public static final String LIBRARY_PACKAGE_NOT_STANDARD = "validateLibraryPackageNotStandard";

    public static final Set<String> CHECK_NAMES = Set.of(
            TYPE_SPECIALIZATION_CYCLE,
            NAMESPACE_DISTINGUISHABILITY,
            SPECIALIZATION_SPECIFIC_NOT_CONJUGATED,
            TYPE_AT_MOST_ONE_CONJUGATOR,
            FEATURE_TYPING,
            SUBSETTING_MULTIPLICITY_CONFORMANCE,
            REDEFINITION_MULTIPLICITY_CONFORMANCE,
            SUBSETTING_UNIQUENESS_CONFORMANCE,
            REDEFINITION_TYPE_CONFORMANCE,
            DATATYPE_SPECIALIZATION,
            CLASS_SPECIALIZATION,
            BINDING_CONNECTOR_IS_BINARY,
            MULTIPLICITY_RANGE_BOUND_RESULT_TYPES,
            FEATURE_VALUE_EVALUATION,
            FEATURE_VALUE_OVERRIDING,
            LIBRARY_PACKAGE_NOT_STANDARD);

    private final BuildOptions options;
    private final ExpressionEvaluator evaluator;
    private final List<Diagnostic> diagnostics = new ArrayList<>();

    public ModelValidator(BuildOptions options, ExpressionEvaluator evaluator) {
        this.options = options;
        this.evaluator = evaluator;
    }

    /**
     * Runs the enabled checks on {@code root} and everything it owns.
     *
     * @return diagnostics in document order
     */
    public List<Diagnostic> validate(Namespace root) {
        diagnostics.clear();
        if (root == null || options.validationChecks().isNone()) {
            return List.of();
        }
        validateElement(root);
        for (Element element : root.descendants()) {
            validateElement(element);
        }
        LOGGER.debug("Validation produced {} diagnostic(s)", diagnostics.size());
        return List.copyOf(diagnostics);
    }

    private void validateElement(Element element) {
        if (element instanceof Namespace namespace && enabled(NAMESPACE_DISTINGUISHABILITY)) {
            validateNamespaceDistinguishability(namespace);
        }
        if (element instanceof Package pkg && enabled(LIBRARY_PACKAGE_NOT_STANDARD)) {
            validateLibraryPackageNotStandard(pkg);
        }
        if (element instanceof Type type) {
            validateType(type);
        }
        if (element instanceof Feature feature) {
            validateFeature(feature);
        }
        if (element instanceof MultiplicityRange range && enabled(MULTIPLICITY_RANGE_BOUND_RESULT_TYPES)) {
            validateMultiplicityRangeBoundResultTypes(range);
        }
    }

    private boolean enabled(String check) {
        return options.validationChecks().isEnabled(check);
    }

    private void accept(Severity severity, String code, String message, Element element) {
        diagnostics.add(Diagnostic.of(severity, code, message, element));
    }

    // ========================================
    // Namespaces
    // ========================================

    /**
     * Only direct members are compared; inherited and imported names may
     * legitimately repeat.
     */
    private void validateNamespaceDistinguishability(Namespace namespace) {
        Map<String, List<Element>> byName = new LinkedHashMap<>();
        for (Membership membership : namespace.memberships()) {
            if (membership instanceof FeatureValue) {
                continue;
            }
            Element target = membership.isAlias() ? membership : membership.ownedMemberElement();
            if (target == null) {
                continue;
            }
            String name = membership.memberName();
            if (name != null) {
                byName.computeIfAbsent(name, k -> new ArrayList<>()).add(target);
            }
            String shortName = membership.memberShortName();
            if (shortName != null && !shortName.equals(name)) {
                byName.computeIfAbsent(shortName, k -> new ArrayList<>()).add(target);
            }
        }
        byName.forEach((name, members) -> {
            if (members.size() > 1) {
                for (Element member : members) {
                    accept(Severity.WARNING, NAMESPACE_DISTINGUISHABILITY,
                            "Duplicate of another member named " + name + ".", member);
                }
            }
        });
    }

    private void validateLibraryPackageNotStandard(Package pkg) {
        if (pkg.isStandard() && !pkg.document().isStandardLibrary()) {
            accept(Severity.ERROR, LIBRARY_PACKAGE_NOT_STANDARD,
                    "User library packages should not be marked as standard.", pkg);
        }
    }

    // ========================================
    // Types
    // ========================================

    private void validateType(Type type) {
        if (enabled(TYPE_SPECIALIZATION_CYCLE)) {
            List<Type> cycle = SpecializationCycles.find(type);
            if (!cycle.isEmpty()) {
                accept(Severity.ERROR, TYPE_SPECIALIZATION_CYCLE,
                        "Specialization cycle: " + SpecializationCycles.describe(cycle) + ".", type);
            }
        }
        if (enabled(SPECIALIZATION_SPECIFIC_NOT_CONJUGATED) && type.isConjugated()) {
            for (Specialization specialization : type.specializations()) {
                if (!specialization.isImplied() && specialization.relationshipKind() != RelationshipKind.CONJUGATION) {
                    accept(Severity.ERROR, SPECIALIZATION_SPECIFIC_NOT_CONJUGATED,
                            "Conjugated type cannot be a specialized type.", specialization);
                }
            }
        }
        if (enabled(TYPE_AT_MOST_ONE_CONJUGATOR)) {
            List<Relationship> conjugations = type.relationships(RelationshipKind.CONJUGATION);
            if (conjugations.size() > 1) {
                for (Relationship conjugation : conjugations) {
                    accept(Severity.WARNING, TYPE_AT_MOST_ONE_CONJUGATOR,
                            "Type can have at most one conjugator.", conjugation);
                }
            }
        }
        if (enabled(DATATYPE_SPECIALIZATION) && type.isKind(ElementKind.DATA_TYPE)) {
            reportSpecializations(type, DATATYPE_SPECIALIZATION,
                    "A DataType must not specialize a Class or an Association.",
                    ElementKind.CLASS, ElementKind.ASSOCIATION);
        }
        if (enabled(CLASS_SPECIALIZATION) && type.isKind(ElementKind.CLASS) && !type.isKind(ElementKind.FEATURE)) {
            if (type.isKind(ElementKind.ASSOCIATION_STRUCTURE) || type.isKind(ElementKind.INTERACTION)) {
                reportSpecializations(type, CLASS_SPECIALIZATION,
                        "An " + type.kind().displayName() + " must not specialize a DataType.",
                        ElementKind.DATA_TYPE);
            } else {
                reportSpecializations(type, CLASS_SPECIALIZATION,
                        "A Class must not specialize a DataType or an Association.",
                        ElementKind.DATA_TYPE, ElementKind.ASSOCIATION);
            }
        }
    }

    private void reportSpecializations(Type type, String code, String message, ElementKind... forbidden) {
        for (Specialization specialization : type.specializations(RelationshipKind.SPECIALIZATION)) {
            if (!specialization.isImplied() && specialization.target() instanceof Type general
                    && general.isAny(forbidden)) {
                accept(Severity.ERROR, code, message, specialization);
            }
        }
    }

    // ========================================
    // Features
    // ========================================

    private void validateFeature(Feature feature) {
        if (enabled(FEATURE_TYPING) && options.standardLibrary() != StandardLibrary.NONE && needsTyping(feature)) {
            if (feature.allTypings().isEmpty() && feature.relationships(RelationshipKind.FEATURE_TYPING).isEmpty()) {
                accept(Severity.ERROR, FEATURE_TYPING, "A Feature must be typed by at least one type.", feature);
            }
        }
        if (feature instanceof Connector connector && connector.isKind(ElementKind.BINDING_CONNECTOR)
                && enabled(BINDING_CONNECTOR_IS_BINARY) && connector.relatedFeatures().size() != 2) {
            accept(Severity.ERROR, BINDING_CONNECTOR_IS_BINARY, "A BindingConnector must be binary.", connector);
        }
        for (Specialization specialization : feature.specializations(RelationshipKind.SUBSETTING)) {
            if (!specialization.isImplied() && specialization.target() instanceof Feature subsetted) {
                validateSubsetting(specialization, feature, subsetted);
            }
        }
        if (feature.value() != null) {
            if (enabled(FEATURE_VALUE_OVERRIDING)) {
                validateFeatureValueOverriding(feature);
            }
            if (enabled(FEATURE_VALUE_EVALUATION)) {
                validateFeatureValueEvaluation(feature);
            }
        }
    }

    /**
     * Expressions, multiplicities and metadata get their types from their
     * own kind rather than a declared typing.
     */
    private static boolean needsTyping(Feature feature) {
        return !feature.isAny(ElementKind.EXPRESSION, ElementKind.MULTIPLICITY_RANGE, ElementKind.METADATA_FEATURE,
                ElementKind.CONNECTOR, ElementKind.STEP);
    }

    private void validateSubsetting(Specialization relationship, Feature subsetting, Feature subsetted) {
        // connector ends have their own rules
        if (subsetting.owner() instanceof Connector || subsetted.owner() instanceof Connector) {
            return;
        }
        boolean redefinition = relationship.relationshipKind() == RelationshipKind.REDEFINITION;
        validateMultiplicityConformance(redefinition, subsetting, subsetted);
        if (enabled(SUBSETTING_UNIQUENESS_CONFORMANCE) && subsetted.isUnique() && !subsetting.isUnique()) {
            accept(Severity.ERROR, SUBSETTING_UNIQUENESS_CONFORMANCE, redefinition
                    ? "Redefining feature cannot be nonunique if redefined feature is unique"
                    : "Subsetting feature cannot be nonunique if subsetted feature is unique", relationship);
        }
        if (redefinition && enabled(REDEFINITION_TYPE_CONFORMANCE)) {
            validateRedefinitionTypeConformance(relationship, subsetting, subsetted);
        }
    }

    private void validateMultiplicityConformance(boolean redefinition, Feature subsetting, Feature subsetted) {
        if (subsetting.isEnd() != subsetted.isEnd()) {
            return;
        }
        Bounds bounds = bounds(subsetting);
        Bounds subsettedBounds = bounds(subsetted);
        if (bounds == null || subsettedBounds == null) {
            return;
        }
        String source = redefinition ? "Redefining" : "Subsetting";
        String target = redefinition ? "redefined" : "subsetted";
        if (redefinition && !subsetting.isEnd() && enabled(REDEFINITION_MULTIPLICITY_CONFORMANCE)
                && bounds.lower() < subsettedBounds.lower()) {
            accept(Severity.WARNING, REDEFINITION_MULTIPLICITY_CONFORMANCE, source
                    + " feature should not have smaller multiplicity lower bound (" + bounds.lower() + ") than "
                    + target + " feature (" + subsettedBounds.lower() + ")", subsetting.multiplicity());
        }
        if (enabled(SUBSETTING_MULTIPLICITY_CONFORMANCE) && bounds.upper() != null && subsettedBounds.upper() != null
                && bounds.upper() > subsettedBounds.upper()) {
            accept(Severity.WARNING, SUBSETTING_MULTIPLICITY_CONFORMANCE, source
                    + " feature should not have larger multiplicity upper bound (" + bounds.upper() + ") than "
                    + target + " feature (" + subsettedBounds.upper() + ")", subsetting.multiplicity());
        }
    }

    private static Bounds bounds(Feature feature) {
        MultiplicityRange multiplicity = feature.multiplicity();
        return multiplicity == null ? null : multiplicity.bounds();
    }

    /**
     * Each type of the redefined feature must be conformed to by one of the
     * redefining feature's own typings.
     */
    private void validateRedefinitionTypeConformance(Specialization relationship, Feature redefining, Feature redefined) {
        List<Type> own = redefining.typings();
        if (own.isEmpty()) {
            return;
        }
        for (Type required : redefined.allTypings()) {
            boolean conforms = false;
            for (Type type : own) {
                if (type.conforms(required)) {
                    conforms = true;
                    break;
                }
            }
            if (!conforms) {
                accept(Severity.WARNING, REDEFINITION_TYPE_CONFORMANCE,
                        "Redefining feature type should conform to the redefined feature type '"
                                + nameOf(required) + "'.", relationship);
            }
        }
    }

    private void validateFeatureValueOverriding(Feature feature) {
        FeatureValue own = feature.valueMembership();
        for (Feature redefined : feature.redefinedFeatures()) {
            FeatureValue inherited = redefined.valueMembership();
            if (inherited != null && inherited != own && !inherited.isDefault()) {
                accept(Severity.ERROR, FEATURE_VALUE_OVERRIDING, "Cannot override a non-default feature value.", own);
                return;
            }
        }
    }

    /**
     * Reports values built only from literals, operators, builtin functions
     * and resolved references that still fail to evaluate.
     */
    private void validateFeatureValueEvaluation(Feature feature) {
        Expression value = feature.value();
        if (evaluator == null || !isModelLevelEvaluable(value)) {
            return;
        }
        Element target = feature.owningType() != null ? feature.owningType() : feature;
        EvaluationResult result = evaluator.evaluate(value, target);
        if (result.isError()) {
            accept(Severity.ERROR, FEATURE_VALUE_EVALUATION,
                    "Feature value could not be evaluated: " + result.error().message(), value);
        }
    }

    private void validateMultiplicityRangeBoundResultTypes(MultiplicityRange range) {
        if (!isModelLevelEvaluable(range.upperBound())
                || (range.lowerBound() != null && !isModelLevelEvaluable(range.lowerBound()))) {
            return;
        }
        if (range.bounds() == null) {
            accept(Severity.ERROR, MULTIPLICITY_RANGE_BOUND_RESULT_TYPES,
                    "The results of the bound Expression(s) of a MultiplicityRange must be Naturals.", range);
        }
    }

    boolean isModelLevelEvaluable(Expression expression) {
        if (expression == null) {
            return false;
        }
        if (expression instanceof LiteralExpression || expression instanceof NullExpression) {
            return true;
        }
        if (expression instanceof FeatureChainExpression chain) {
            return chain.targetFeature() != null && isModelLevelEvaluable(chain.source());
        }
        if (expression instanceof FeatureReferenceExpression reference) {
            return reference.referent() != null;
        }
        if (expression instanceof InvocationExpression invocation) {
            if (!(invocation instanceof OperatorExpression)) {
                String name = invocation.functionName();
                if (name == null || evaluator == null || !evaluator.registry().hasFunction(name)) {
                    return false;
                }
            } else if (((OperatorExpression) invocation).typeReference() != null
                    && ((OperatorExpression) invocation).typeReference().resolve() == null) {
                return false;
            }
            for (Expression argument : invocation.arguments()) {
                if (!isModelLevelEvaluable(argument)) {
                    return false;
                }
            }
            return true;
        }
        return false;
    }

    private static String nameOf(Element element) {
        String name = element.qualifiedName();
        return name != null ? name : element.toString();
    }
}
