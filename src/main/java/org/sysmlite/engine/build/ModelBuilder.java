package org.sysmlite.engine.build;

import org.sysmlite.kerml.dsl.ReferenceSyntax;
import org.sysmlite.kerml.dsl.SyntaxKind;
import org.sysmlite.kerml.dsl.SyntaxNode;
import org.sysmlite.kerml.m3.ChildRole;
import org.sysmlite.kerml.m3.Comment;
import org.sysmlite.kerml.m3.Connector;
import org.sysmlite.kerml.m3.Dependency;
import org.sysmlite.kerml.m3.Documentation;
import org.sysmlite.kerml.m3.Element;
import org.sysmlite.kerml.m3.ElementKind;
import org.sysmlite.kerml.m3.ElementReference;
import org.sysmlite.kerml.m3.Expression;
import org.sysmlite.kerml.m3.Feature;
import org.sysmlite.kerml.m3.FeatureDirection;
import org.sysmlite.kerml.m3.FeatureValue;
import org.sysmlite.kerml.m3.Import;
import org.sysmlite.kerml.m3.Membership;
import org.sysmlite.kerml.m3.MembershipKind;
import org.sysmlite.kerml.m3.ModelDocument;
import org.sysmlite.kerml.m3.Modifier;
import org.sysmlite.kerml.m3.MultiplicityRange;
import org.sysmlite.kerml.m3.Namespace;
import org.sysmlite.kerml.m3.Package;
import org.sysmlite.kerml.m3.RelationshipKind;
import org.sysmlite.kerml.m3.Specialization;
import org.sysmlite.kerml.m3.Type;
import org.sysmlite.kerml.m3.Visibility;
import org.sysmlite.kerml.m3.expression.FeatureChainExpression;
import org.sysmlite.kerml.m3.expression.FeatureReferenceExpression;
import org.sysmlite.kerml.m3.expression.InvocationExpression;
import org.sysmlite.kerml.m3.expression.LiteralExpression;
import org.sysmlite.kerml.m3.expression.MetadataAccessExpression;
import org.sysmlite.kerml.m3.expression.NullExpression;
import org.sysmlite.kerml.m3.expression.OperatorExpression;

import java.util.Map;

/**
 * Builds metamodel elements from a syntax tree.
 *
 * Every declaration and expression node gets exactly one element, attached to
 * the node in both directions. Building an already attached node returns its
 * element without allocating anything, so re-running the builder on a tree
 * keeps element identity. Specifier nodes expand to one relationship per
 * written target.
 */
public final class ModelBuilder {

    private static final Map<String, ElementKind> TYPE_KINDS = Map.ofEntries(
            Map.entry("type", ElementKind.TYPE),
            Map.entry("classifier", ElementKind.CLASSIFIER),
            Map.entry("class", ElementKind.CLASS),
            Map.entry("datatype", ElementKind.DATA_TYPE),
            Map.entry("struct", ElementKind.STRUCTURE),
            Map.entry("assoc", ElementKind.ASSOCIATION),
            Map.entry("assoc struct", ElementKind.ASSOCIATION_STRUCTURE),
            Map.entry("behavior", ElementKind.BEHAVIOR),
            Map.entry("function", ElementKind.FUNCTION),
            Map.entry("predicate", ElementKind.PREDICATE),
            Map.entry("interaction", ElementKind.INTERACTION),
            Map.entry("metaclass", ElementKind.METACLASS),
            Map.entry("part def", ElementKind.PART_DEFINITION),
            Map.entry("item def", ElementKind.ITEM_DEFINITION),
            Map.entry("attribute def", ElementKind.ATTRIBUTE_DEFINITION),
            Map.entry("port def", ElementKind.PORT_DEFINITION),
            Map.entry("action def", ElementKind.ACTION_DEFINITION),
            Map.entry("state def", ElementKind.STATE_DEFINITION),
            Map.entry("calc def", ElementKind.CALCULATION_DEFINITION),
            Map.entry("constraint def", ElementKind.CONSTRAINT_DEFINITION),
            Map.entry("requirement def", ElementKind.REQUIREMENT_DEFINITION),
            Map.entry("connection def", ElementKind.CONNECTION_DEFINITION),
            Map.entry("occurrence def", ElementKind.OCCURRENCE_DEFINITION),
            Map.entry("enum def", ElementKind.ENUMERATION_DEFINITION),
            Map.entry("metadata def", ElementKind.METADATA_DEFINITION));

    private static final Map<String, ElementKind> FEATURE_KINDS = Map.ofEntries(
            Map.entry("feature", ElementKind.FEATURE),
            Map.entry("step", ElementKind.STEP),
            Map.entry("expr", ElementKind.EXPRESSION),
            Map.entry("bool", ElementKind.BOOLEAN_EXPRESSION),
            Map.entry("inv", ElementKind.INVARIANT),
            Map.entry("connector", ElementKind.CONNECTOR),
            Map.entry("binding", ElementKind.BINDING_CONNECTOR),
            Map.entry("succession", ElementKind.SUCCESSION),
            Map.entry("metadata", ElementKind.METADATA_FEATURE),
            Map.entry("part", ElementKind.PART_USAGE),
            Map.entry("item", ElementKind.ITEM_USAGE),
            Map.entry("attribute", ElementKind.ATTRIBUTE_USAGE),
            Map.entry("port", ElementKind.PORT_USAGE),
            Map.entry("action", ElementKind.ACTION_USAGE),
            Map.entry("state", ElementKind.STATE_USAGE),
            Map.entry("calc", ElementKind.CALCULATION_USAGE),
            Map.entry("constraint", ElementKind.CONSTRAINT_USAGE),
            Map.entry("requirement", ElementKind.REQUIREMENT_USAGE),
            Map.entry("connection", ElementKind.CONNECTION_USAGE),
            Map.entry("occurrence", ElementKind.OCCURRENCE_USAGE));

    private final ModelDocument document;

    private ModelBuilder(ModelDocument document) {
        this.document = document;
    }

    /**
     * Builds (or returns the already built) root namespace for {@code root}.
     */
    public static Namespace build(ModelDocument document, SyntaxNode root) {
        if (root.kind() != SyntaxKind.ROOT) {
            throw new IllegalArgumentException("Expected a ROOT node, got " + root.kind());
        }
        if (root.meta() instanceof Namespace existing) {
            return existing;
        }
        ModelBuilder builder = new ModelBuilder(document);
        Namespace namespace = builder.attach(new Namespace(ElementKind.NAMESPACE, document), root);
        builder.addMembers(namespace, root);
        return namespace;
    }

    // ========================================
    // Namespaces and members
    // ========================================

    private void addMembers(Namespace namespace, SyntaxNode node) {
        for (SyntaxNode child : node.children()) {
            switch (child.kind()) {
                case PACKAGE, TYPE, COMMENT, DOCUMENTATION, DEPENDENCY, RELATIONSHIP ->
                        addMember(namespace, MembershipKind.OWNING, child);
                case FEATURE -> addMember(namespace, featureMembershipKind(namespace, child), child);
                case IMPORT -> addImport(namespace, child);
                case ALIAS -> addAlias(namespace, child);
                case RESULT_EXPRESSION -> child.children().stream().filter(c -> c.kind().isExpression()).findFirst()
                        .ifPresent(e -> addMember(namespace, MembershipKind.RESULT_EXPRESSION, e));
                default -> {
                    // specifiers, multiplicity, values and ends are handled by their declaration
                }
            }
        }
    }

    private void addMember(Namespace namespace, MembershipKind membershipKind, SyntaxNode node) {
        Element existing = node.meta();
        if (existing != null && existing.parent() != null) {
            return;
        }
        Element element = existing != null ? existing : buildDeclaration(namespace, node);
        namespace.addMember(membershipKind, element);
        buildContents(element, node);
    }

    private MembershipKind featureMembershipKind(Namespace owner, SyntaxNode node) {
        if (!(owner instanceof Type)) {
            return MembershipKind.OWNING;
        }
        if (node.hasFlag("end")) {
            return MembershipKind.END_FEATURE;
        }
        boolean directed = node.hasFlag("in") || node.hasFlag("out") || node.hasFlag("inout");
        if (directed && owner.isAny(ElementKind.BEHAVIOR, ElementKind.STEP)) {
            if (node.hasFlag("out") && "result".equals(node.attribute("name"))
                    && owner.isAny(ElementKind.FUNCTION, ElementKind.EXPRESSION)) {
                return MembershipKind.RETURN_PARAMETER;
            }
            return MembershipKind.PARAMETER;
        }
        return MembershipKind.FEATURE;
    }

    private Element buildDeclaration(Namespace owner, SyntaxNode node) {
        return switch (node.kind()) {
            case PACKAGE -> buildPackage(node);
            case TYPE -> buildType(node);
            case FEATURE -> buildFeature(owner, node);
            case COMMENT -> buildComment(new Comment(ElementKind.COMMENT, document), node);
            case DOCUMENTATION -> buildComment(new Documentation(document), node);
            case DEPENDENCY -> buildDependency(node);
            case RELATIONSHIP -> buildRelationship(node);
            default -> buildExpression(node);
        };
    }

    /**
     * Second step of a declaration, run after it has been added to its owner
     * so that references see the final ownership.
     */
    private void buildContents(Element element, SyntaxNode node) {
        if (element instanceof Type type && (node.kind() == SyntaxKind.TYPE || node.kind() == SyntaxKind.FEATURE)) {
            addSpecifiers(type, node);
            node.child(SyntaxKind.MULTIPLICITY).ifPresent(m -> addMultiplicity(type, m));
            if (element instanceof Feature feature) {
                addConnectorEnds(feature, node);
                node.children(SyntaxKind.FEATURE_VALUE).forEach(v -> addFeatureValue(feature, v));
            }
            addMembers(type, node);
        } else if (element instanceof Namespace namespace && node.kind() == SyntaxKind.PACKAGE) {
            addMembers(namespace, node);
        }
    }

    private Package buildPackage(SyntaxNode node) {
        ElementKind kind = node.hasFlag("library") ? ElementKind.LIBRARY_PACKAGE : ElementKind.PACKAGE;
        Package pkg = attach(new Package(kind, document), node);
        pkg.setLibrary(node.hasFlag("library"));
        pkg.setStandard(node.hasFlag("standard"));
        return pkg;
    }

    private Type buildType(SyntaxNode node) {
        String keyword = node.attribute("keyword");
        ElementKind kind = TYPE_KINDS.getOrDefault(keyword == null ? "type" : keyword, ElementKind.TYPE);
        Type type = attach(new Type(kind, document), node);
        addModifiers(type, node);
        return type;
    }

    private Feature buildFeature(Namespace owner, SyntaxNode node) {
        ElementKind kind = featureKind(owner, node);
        Feature feature;
        if (kind.isKind(ElementKind.CONNECTOR)) {
            feature = new Connector(kind, document);
        } else if (kind.isKind(ElementKind.EXPRESSION)) {
            feature = new Expression(kind, document);
        } else {
            feature = new Feature(kind, document);
        }
        attach(feature, node);
        addModifiers(feature, node);
        for (String direction : new String[] {"in", "out", "inout"}) {
            if (node.hasFlag(direction)) {
                feature.setDirection(FeatureDirection.fromKeyword(direction));
            }
        }
        return feature;
    }

    private static ElementKind featureKind(Namespace owner, SyntaxNode node) {
        String keyword = node.attribute("keyword");
        if (keyword != null) {
            return FEATURE_KINDS.getOrDefault(keyword, ElementKind.FEATURE);
        }
        if (node.hasFlag("actor") || node.hasFlag("stakeholder")) {
            return ElementKind.PART_USAGE;
        }
        if (node.hasFlag("timeslice") || node.hasFlag("snapshot")) {
            return ElementKind.OCCURRENCE_USAGE;
        }
        // a bare SysML feature such as ":>> x = 1;" inside a definition or usage
        if (owner != null && owner.isAny(ElementKind.DEFINITION, ElementKind.USAGE)) {
            return ElementKind.REFERENCE_USAGE;
        }
        return ElementKind.FEATURE;
    }

    private static void addModifiers(Type type, SyntaxNode node) {
        for (String flag : node.flags()) {
            Modifier modifier = Modifier.fromKeyword(flag);
            if (modifier != null) {
                type.addModifier(modifier);
            }
        }
    }

    // ========================================
    // Specifiers
    // ========================================

    private void addSpecifiers(Type type, SyntaxNode node) {
        for (SyntaxNode specifier : node.children(SyntaxKind.SPECIFIER)) {
            RelationshipKind kind = specifierKind(type, specifier.attribute("relation"));
            for (ReferenceSyntax target : specifier.references("target")) {
                Specialization relationship = new Specialization(kind, document, false);
                relationship.setSyntax(specifier);
                type.addChild(ChildRole.RELATIONSHIP, relationship);
                relationship.setTargetReference(heritageReference(target, relationship, type, expectedKind(kind)));
            }
        }
    }

    private static RelationshipKind specifierKind(Type type, String relation) {
        return switch (relation) {
            case "specializes" -> type.specializationKind();
            case "subsets" -> RelationshipKind.SUBSETTING;
            case "redefines" -> RelationshipKind.REDEFINITION;
            case "references" -> RelationshipKind.REFERENCE_SUBSETTING;
            case "typedBy" -> type instanceof Feature ? RelationshipKind.FEATURE_TYPING : type.specializationKind();
            case "conjugates" -> RelationshipKind.CONJUGATION;
            case "disjoint" -> RelationshipKind.DISJOINING;
            case "featuredBy" -> RelationshipKind.TYPE_FEATURING;
            case "inverse" -> RelationshipKind.INVERTING;
            case "chains" -> RelationshipKind.FEATURE_CHAINING;
            default -> throw new IllegalArgumentException("Unknown specifier relation: " + relation);
        };
    }

    static ElementKind expectedKind(RelationshipKind kind) {
        if (kind.isKind(RelationshipKind.SUBSETTING) || kind == RelationshipKind.FEATURE_CHAINING
                || kind == RelationshipKind.INVERTING) {
            return ElementKind.FEATURE;
        }
        if (kind == RelationshipKind.SUBCLASSIFICATION) {
            return ElementKind.CLASSIFIER;
        }
        return ElementKind.TYPE;
    }

    /**
     * References written in a declaration are looked up from the enclosing
     * namespace, never from the declared type itself.
     */
    private static ElementReference heritageReference(ReferenceSyntax syntax, Element holder, Type declared,
            ElementKind expectedKind) {
        ElementReference reference = ElementReference.pending(syntax, holder, expectedKind).skipping(declared);
        Element owner = declared.parent() == null ? null : declared.parent();
        if (owner != null && owner.nearestNamespace() != null) {
            reference.startingAt(owner.nearestNamespace());
        }
        return reference;
    }

    private void addMultiplicity(Type type, SyntaxNode node) {
        if (node.meta() != null) {
            return;
        }
        MultiplicityRange multiplicity = attach(new MultiplicityRange(document), node);
        type.addChild(ChildRole.MULTIPLICITY, multiplicity);
        for (SyntaxNode bound : node.children()) {
            if ("lower".equals(bound.attribute("bound"))) {
                multiplicity.setLowerBound(buildExpression(bound));
            } else {
                multiplicity.setUpperBound(buildExpression(bound));
            }
        }
    }

    private void addFeatureValue(Feature feature, SyntaxNode node) {
        // ordered / nonunique carriers have no expression
        SyntaxNode expression = node.children().stream().filter(c -> c.kind().isExpression()).findFirst().orElse(null);
        if (expression == null || node.meta() != null) {
            return;
        }
        FeatureValue value = new FeatureValue(document, node.hasFlag("default"), node.hasFlag("initial"));
        attach(value, node);
        feature.addChild(ChildRole.MEMBERSHIP, value);
        value.setMemberElement(buildExpression(expression));
    }

    private void addConnectorEnds(Feature feature, SyntaxNode node) {
        for (SyntaxNode endNode : node.children(SyntaxKind.CONNECTOR_END)) {
            if (endNode.meta() != null) {
                continue;
            }
            Feature end = attach(new Feature(ElementKind.FEATURE, document), endNode);
            end.setName(endNode.attribute("name"));
            end.addModifier(Modifier.END);
            feature.addMember(MembershipKind.END_FEATURE, end);
            endNode.firstReference("target").ifPresent(target -> {
                Specialization subsetting = new Specialization(RelationshipKind.REFERENCE_SUBSETTING, document, false);
                subsetting.setSyntax(endNode);
                end.addChild(ChildRole.RELATIONSHIP, subsetting);
                subsetting.setTargetReference(heritageReference(target, subsetting, feature, ElementKind.FEATURE));
            });
        }
    }

    // ========================================
    // Other members
    // ========================================

    private void addImport(Namespace namespace, SyntaxNode node) {
        if (node.meta() != null) {
            return;
        }
        boolean namespaceImport = node.hasFlag("namespace");
        Import imp = attach(new Import(
                namespaceImport ? RelationshipKind.NAMESPACE_IMPORT : RelationshipKind.MEMBERSHIP_IMPORT,
                document, node.hasFlag("recursive"), node.hasFlag("all")), node);
        namespace.addChild(ChildRole.IMPORT, imp);
        node.firstReference("target").ifPresent(target -> imp.setTargetReference(
                ElementReference.pending(target, imp, namespaceImport ? ElementKind.NAMESPACE : ElementKind.ELEMENT)));
    }

    private void addAlias(Namespace namespace, SyntaxNode node) {
        if (node.meta() != null) {
            return;
        }
        Membership alias = attach(new Membership(MembershipKind.ALIAS, document), node);
        namespace.addChild(ChildRole.MEMBERSHIP, alias);
        node.firstReference("target").ifPresent(target ->
                alias.setTargetReference(ElementReference.pending(target, alias, ElementKind.ELEMENT)));
    }

    private Comment buildComment(Comment comment, SyntaxNode node) {
        attach(comment, node);
        comment.setBody(node.attribute("body") == null ? "" : node.attribute("body"));
        comment.setLocale(node.attribute("locale"));
        for (ReferenceSyntax about : node.references("about")) {
            comment.addAbout(ElementReference.pending(about, comment, ElementKind.ELEMENT));
        }
        return comment;
    }

    private Dependency buildDependency(SyntaxNode node) {
        Dependency dependency = attach(new Dependency(document), node);
        for (ReferenceSyntax client : node.references("client")) {
            dependency.addClient(ElementReference.pending(client, dependency, ElementKind.ELEMENT));
        }
        for (ReferenceSyntax supplier : node.references("supplier")) {
            dependency.addSupplier(ElementReference.pending(supplier, dependency, ElementKind.ELEMENT));
        }
        return dependency;
    }

    private Specialization buildRelationship(SyntaxNode node) {
        RelationshipKind kind = switch (node.attribute("relation")) {
            case "subclassifies" -> RelationshipKind.SUBCLASSIFICATION;
            case "subsets" -> RelationshipKind.SUBSETTING;
            case "redefines" -> RelationshipKind.REDEFINITION;
            case "conjugates" -> RelationshipKind.CONJUGATION;
            case "disjoint" -> RelationshipKind.DISJOINING;
            default -> RelationshipKind.SPECIALIZATION;
        };
        Specialization relationship = attach(new Specialization(kind, document, false), node);
        ElementKind expected = expectedKind(kind);
        node.firstReference("source").ifPresent(source ->
                relationship.setSourceReference(ElementReference.pending(source, relationship,
                        kind == RelationshipKind.SUBCLASSIFICATION ? ElementKind.CLASSIFIER : expected)));
        node.firstReference("target").ifPresent(target ->
                relationship.setTargetReference(ElementReference.pending(target, relationship, expected)));
        return relationship;
    }

    // ========================================
    // Expressions
    // ========================================

    private Expression buildExpression(SyntaxNode node) {
        if (node.meta() instanceof Expression existing) {
            return existing;
        }
        Expression expression = switch (node.kind()) {
            case LITERAL_BOOLEAN -> LiteralExpression.ofBoolean(document, Boolean.parseBoolean(node.attribute("value")));
            case LITERAL_INTEGER -> integerLiteral(node.attribute("value"));
            case LITERAL_REAL -> LiteralExpression.ofRational(document, Double.parseDouble(node.attribute("value")));
            case LITERAL_STRING -> LiteralExpression.ofString(document, node.attribute("value"));
            case LITERAL_INFINITY -> LiteralExpression.infinity(document);
            case NULL_EXPRESSION -> new NullExpression(document);
            case OPERATOR_EXPRESSION -> operatorExpression(node);
            case INVOCATION_EXPRESSION -> invocationExpression(node);
            case FEATURE_REFERENCE -> featureReference(node);
            case FEATURE_CHAIN -> featureChain(node);
            case METADATA_ACCESS -> metadataAccess(node);
            default -> throw new IllegalArgumentException("Not an expression node: " + node);
        };
        attach(expression, node);
        return expression;
    }

    private LiteralExpression integerLiteral(String text) {
        try {
            return LiteralExpression.ofInteger(document, Long.parseLong(text));
        } catch (NumberFormatException e) {
            // too large for a long
            return LiteralExpression.ofRational(document, Double.parseDouble(text));
        }
    }

    private Expression operatorExpression(SyntaxNode node) {
        OperatorExpression expression = new OperatorExpression(document, node.attribute("operator"));
        addArguments(expression, node);
        node.firstReference("type").ifPresent(type ->
                expression.setTypeReference(ElementReference.pending(type, expression, ElementKind.TYPE)));
        return expression;
    }

    private Expression invocationExpression(SyntaxNode node) {
        InvocationExpression expression = new InvocationExpression(ElementKind.INVOCATION_EXPRESSION, document);
        expression.setArrow(node.hasFlag("arrow"));
        addArguments(expression, node);
        node.firstReference("function").ifPresent(function ->
                expression.setFunction(ElementReference.pending(function, expression, ElementKind.TYPE)));
        return expression;
    }

    private void addArguments(InvocationExpression expression, SyntaxNode node) {
        for (SyntaxNode child : node.children()) {
            if (child.kind().isExpression()) {
                expression.addArgument(buildExpression(child));
            }
        }
    }

    private Expression featureReference(SyntaxNode node) {
        FeatureReferenceExpression expression = new FeatureReferenceExpression(document);
        node.firstReference("referent").ifPresent(referent ->
                expression.setReferent(ElementReference.pending(referent, expression, ElementKind.ELEMENT)));
        return expression;
    }

    private Expression featureChain(SyntaxNode node) {
        FeatureChainExpression expression = new FeatureChainExpression(document);
        addArguments(expression, node);
        node.firstReference("target").ifPresent(target -> expression.setTargetReference(
                ElementReference.pending(target, expression, ElementKind.FEATURE).qualifiedBy(expression.source())));
        return expression;
    }

    private Expression metadataAccess(SyntaxNode node) {
        MetadataAccessExpression expression = new MetadataAccessExpression(document);
        node.firstReference("referent").ifPresent(referent ->
                expression.setReferent(ElementReference.pending(referent, expression, ElementKind.ELEMENT)));
        for (SyntaxNode child : node.children()) {
            if (child.kind().isExpression()) {
                expression.addChild(ChildRole.ARGUMENT, buildExpression(child));
            }
        }
        return expression;
    }

    // ========================================
    // Helpers
    // ========================================

    private <T extends Element> T attach(T element, SyntaxNode node) {
        node.attach(element);
        element.setSyntax(node);
        element.setName(node.attribute("name"));
        element.setShortName(node.attribute("shortName"));
        String visibility = node.attribute("visibility");
        if (visibility != null) {
            element.setDeclaredVisibility(Visibility.fromKeyword(visibility));
        }
        return element;
    }
}
