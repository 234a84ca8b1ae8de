package org.sysmlite.kerml.dsl.antlr;

import org.antlr.v4.runtime.ParserRuleContext;
import org.antlr.v4.runtime.Token;
import org.antlr.v4.runtime.tree.ParseTree;
import org.antlr.v4.runtime.tree.TerminalNode;
import org.sysmlite.kerml.dsl.ReferenceSyntax;
import org.sysmlite.kerml.dsl.SyntaxKind;
import org.sysmlite.kerml.dsl.SyntaxNode;
import org.sysmlite.kerml.dsl.TextRange;

import java.util.ArrayList;
import java.util.List;

/**
 * ANTLR visitor that converts the parse tree into the {@link SyntaxNode} tree.
 *
 * Declarations become TYPE / FEATURE / PACKAGE / ... nodes carrying:
 * - "name", "shortName", "visibility", "keyword" attributes
 * - prefix flags ("abstract", "end", "in", ...)
 * - SPECIFIER children for every specialization part ({@code :>}, {@code :}, ...)
 * - a MULTIPLICITY child, a FEATURE_VALUE child and body members in source order
 *
 * Expressions become expression nodes whose "operator" attribute is the
 * operator token as written, e.g. "+", "==", "#", "," or "if".
 */
public class SyntaxTreeBuilder extends KerMLBaseVisitor<SyntaxNode> {

    // ========================================
    // ENTRY POINT
    // ========================================

    @Override
    public SyntaxNode visitRoot(KerMLParser.RootContext ctx) {
        SyntaxNode root = new SyntaxNode(SyntaxKind.ROOT, rangeOf(ctx));
        for (KerMLParser.NamespaceMemberContext member : ctx.namespaceMember()) {
            root.addChild(visitNamespaceMember(member));
        }
        return root;
    }

    @Override
    public SyntaxNode visitNamespaceMember(KerMLParser.NamespaceMemberContext ctx) {
        if (ctx.memberElement() == null || ctx.memberElement().getChildCount() == 0) {
            return null;
        }
        SyntaxNode node = visit(ctx.memberElement().getChild(0));
        if (node != null && ctx.visibility() != null) {
            node.attribute("visibility", ctx.visibility().getText());
        }
        return node;
    }

    private void addBody(SyntaxNode node, KerMLParser.BodyContext body) {
        if (body == null) {
            return;
        }
        for (KerMLParser.NamespaceMemberContext member : body.namespaceMember()) {
            node.addChild(visitNamespaceMember(member));
        }
        if (body.ownedExpression() != null) {
            SyntaxNode result = new SyntaxNode(SyntaxKind.RESULT_EXPRESSION, rangeOf(body.ownedExpression()));
            result.addChild(expression(body.ownedExpression().expression()));
            node.addChild(result);
        }
    }

    private void addIdentification(SyntaxNode node, KerMLParser.IdentificationContext ctx) {
        if (ctx == null) {
            return;
        }
        if (ctx.shortName != null) {
            node.attribute("shortName", nameOf(ctx.shortName));
        }
        if (ctx.declaredName != null) {
            node.attribute("name", nameOf(ctx.declaredName));
        }
    }

    // ========================================
    // NAMESPACES
    // ========================================

    @Override
    public SyntaxNode visitPackageDeclaration(KerMLParser.PackageDeclarationContext ctx) {
        SyntaxNode node = new SyntaxNode(SyntaxKind.PACKAGE, rangeOf(ctx));
        node.attribute("keyword", ctx.NAMESPACE() != null ? "namespace" : "package");
        if (ctx.LIBRARY() != null) {
            node.flag("library");
        }
        if (ctx.STANDARD() != null) {
            node.flag("standard");
        }
        addIdentification(node, ctx.identification());
        addBody(node, ctx.body());
        return node;
    }

    @Override
    public SyntaxNode visitImportDeclaration(KerMLParser.ImportDeclarationContext ctx) {
        SyntaxNode node = new SyntaxNode(SyntaxKind.IMPORT, rangeOf(ctx));
        node.reference("target", qualifiedReference(ctx.qualifiedName()));
        if (ctx.ALL() != null) {
            node.flag("all");
        }
        if (ctx.star != null) {
            node.flag("namespace");
        }
        if (ctx.recursive != null) {
            node.flag("recursive");
        }
        addBody(node, ctx.body());
        return node;
    }

    @Override
    public SyntaxNode visitAliasDeclaration(KerMLParser.AliasDeclarationContext ctx) {
        SyntaxNode node = new SyntaxNode(SyntaxKind.ALIAS, rangeOf(ctx));
        addIdentification(node, ctx.identification());
        node.reference("target", qualifiedReference(ctx.qualifiedName()));
        addBody(node, ctx.body());
        return node;
    }

    @Override
    public SyntaxNode visitCommentAnnotation(KerMLParser.CommentAnnotationContext ctx) {
        SyntaxNode node = new SyntaxNode(SyntaxKind.COMMENT, rangeOf(ctx));
        addIdentification(node, ctx.identification());
        for (KerMLParser.QualifiedNameContext about : ctx.qualifiedName()) {
            node.reference("about", qualifiedReference(about));
        }
        if (ctx.STRING() != null) {
            node.attribute("locale", unquote(ctx.STRING().getText()));
        }
        node.attribute("body", commentBody(ctx.REGULAR_COMMENT()));
        return node;
    }

    @Override
    public SyntaxNode visitDocAnnotation(KerMLParser.DocAnnotationContext ctx) {
        SyntaxNode node = new SyntaxNode(SyntaxKind.DOCUMENTATION, rangeOf(ctx));
        addIdentification(node, ctx.identification());
        if (ctx.STRING() != null) {
            node.attribute("locale", unquote(ctx.STRING().getText()));
        }
        node.attribute("body", commentBody(ctx.REGULAR_COMMENT()));
        return node;
    }

    @Override
    public SyntaxNode visitBareComment(KerMLParser.BareCommentContext ctx) {
        SyntaxNode node = new SyntaxNode(SyntaxKind.COMMENT, rangeOf(ctx));
        node.attribute("body", commentBody(ctx.REGULAR_COMMENT()));
        return node;
    }

    @Override
    public SyntaxNode visitDependencyDeclaration(KerMLParser.DependencyDeclarationContext ctx) {
        SyntaxNode node = new SyntaxNode(SyntaxKind.DEPENDENCY, rangeOf(ctx));
        addIdentification(node, ctx.identification());
        for (KerMLParser.QualifiedNameContext client : ctx.clients) {
            node.reference("client", qualifiedReference(client));
        }
        for (KerMLParser.QualifiedNameContext supplier : ctx.suppliers) {
            node.reference("supplier", qualifiedReference(supplier));
        }
        addBody(node, ctx.body());
        return node;
    }

    // ========================================
    // STANDALONE RELATIONSHIPS
    // ========================================

    @Override
    public SyntaxNode visitSpecializationDeclaration(KerMLParser.SpecializationDeclarationContext ctx) {
        SyntaxNode node = relationship(ctx, "specializes", ctx.source, ctx.target, ctx.body());
        addIdentification(node, ctx.identification());
        return node;
    }

    @Override
    public SyntaxNode visitSubclassificationDeclaration(KerMLParser.SubclassificationDeclarationContext ctx) {
        return relationship(ctx, "subclassifies", ctx.source, ctx.target, ctx.body());
    }

    @Override
    public SyntaxNode visitSubsettingDeclaration(KerMLParser.SubsettingDeclarationContext ctx) {
        return relationship(ctx, "subsets", ctx.source, ctx.target, ctx.body());
    }

    @Override
    public SyntaxNode visitRedefinitionDeclaration(KerMLParser.RedefinitionDeclarationContext ctx) {
        return relationship(ctx, "redefines", ctx.source, ctx.target, ctx.body());
    }

    @Override
    public SyntaxNode visitConjugationDeclaration(KerMLParser.ConjugationDeclarationContext ctx) {
        SyntaxNode node = relationship(ctx, "conjugates", ctx.source, ctx.target, ctx.body());
        addIdentification(node, ctx.identification());
        return node;
    }

    @Override
    public SyntaxNode visitDisjoiningDeclaration(KerMLParser.DisjoiningDeclarationContext ctx) {
        SyntaxNode node = relationship(ctx, "disjoint", ctx.source, ctx.target, ctx.body());
        addIdentification(node, ctx.identification());
        return node;
    }

    private SyntaxNode relationship(ParserRuleContext ctx, String relation,
            KerMLParser.ChainReferenceContext source, KerMLParser.ChainReferenceContext target,
            KerMLParser.BodyContext body) {
        SyntaxNode node = new SyntaxNode(SyntaxKind.RELATIONSHIP, rangeOf(ctx));
        node.attribute("relation", relation);
        node.reference("source", chainReference(source));
        node.reference("target", chainReference(target));
        addBody(node, body);
        return node;
    }

    // ========================================
    // TYPES
    // ========================================

    @Override
    public SyntaxNode visitTypeDeclaration(KerMLParser.TypeDeclarationContext ctx) {
        SyntaxNode node = new SyntaxNode(SyntaxKind.TYPE, rangeOf(ctx));
        node.attribute("keyword", typeKeyword(ctx.typeKeyword()));
        for (KerMLParser.TypePrefixContext prefix : ctx.typePrefix()) {
            node.flag(prefix.getText());
        }
        if (ctx.ALL() != null) {
            node.flag("all");
        }
        addIdentification(node, ctx.identification());
        addSpecifiers(node, ctx.typeSpecifier());
        addBody(node, ctx.body());
        return node;
    }

    private static String typeKeyword(KerMLParser.TypeKeywordContext ctx) {
        if (ctx == null) {
            return "type";
        }
        if (ctx.definitionKeyword() != null) {
            return ctx.definitionKeyword().getText() + " def";
        }
        if (ctx.ASSOC() != null) {
            return ctx.STRUCT() != null ? "assoc struct" : "assoc";
        }
        return ctx.getText();
    }

    private void addSpecifiers(SyntaxNode node, List<KerMLParser.TypeSpecifierContext> specifiers) {
        for (KerMLParser.TypeSpecifierContext specifier : specifiers) {
            SyntaxNode child = visit(specifier);
            if (child == null) {
                continue;
            }
            if (child.kind() == SyntaxKind.SPECIFIER) {
                node.addChild(child);
            } else if (child.kind() == SyntaxKind.MULTIPLICITY) {
                node.addChild(child);
            } else {
                // ordered / nonunique come back as flag carriers
                child.flags().forEach(node::flag);
            }
        }
    }

    @Override
    public SyntaxNode visitSpecializesSpecifier(KerMLParser.SpecializesSpecifierContext ctx) {
        return specifier(ctx, "specializes", chainList(ctx.chainList()));
    }

    @Override
    public SyntaxNode visitSubsetsSpecifier(KerMLParser.SubsetsSpecifierContext ctx) {
        return specifier(ctx, "subsets", chainList(ctx.chainList()));
    }

    @Override
    public SyntaxNode visitRedefinesSpecifier(KerMLParser.RedefinesSpecifierContext ctx) {
        return specifier(ctx, "redefines", chainList(ctx.chainList()));
    }

    @Override
    public SyntaxNode visitReferencesSpecifier(KerMLParser.ReferencesSpecifierContext ctx) {
        return specifier(ctx, "references", single(chainReference(ctx.chainReference())));
    }

    @Override
    public SyntaxNode visitTypedBySpecifier(KerMLParser.TypedBySpecifierContext ctx) {
        return specifier(ctx, "typedBy", chainList(ctx.chainList()));
    }

    @Override
    public SyntaxNode visitConjugatesSpecifier(KerMLParser.ConjugatesSpecifierContext ctx) {
        return specifier(ctx, "conjugates", single(qualifiedReference(ctx.qualifiedName())));
    }

    @Override
    public SyntaxNode visitDisjointSpecifier(KerMLParser.DisjointSpecifierContext ctx) {
        return specifier(ctx, "disjoint", chainList(ctx.chainList()));
    }

    @Override
    public SyntaxNode visitFeaturedBySpecifier(KerMLParser.FeaturedBySpecifierContext ctx) {
        return specifier(ctx, "featuredBy", chainList(ctx.chainList()));
    }

    @Override
    public SyntaxNode visitInverseSpecifier(KerMLParser.InverseSpecifierContext ctx) {
        return specifier(ctx, "inverse", single(chainReference(ctx.chainReference())));
    }

    @Override
    public SyntaxNode visitChainsSpecifier(KerMLParser.ChainsSpecifierContext ctx) {
        return specifier(ctx, "chains", single(chainReference(ctx.chainReference())));
    }

    @Override
    public SyntaxNode visitMultiplicitySpecifier(KerMLParser.MultiplicitySpecifierContext ctx) {
        return multiplicity(ctx.multiplicityBounds());
    }

    @Override
    public SyntaxNode visitOrderedSpecifier(KerMLParser.OrderedSpecifierContext ctx) {
        return flagCarrier(ctx, "ordered");
    }

    @Override
    public SyntaxNode visitNonuniqueSpecifier(KerMLParser.NonuniqueSpecifierContext ctx) {
        return flagCarrier(ctx, "nonunique");
    }

    private SyntaxNode flagCarrier(ParserRuleContext ctx, String flag) {
        // FEATURE_VALUE is never a specifier, so it is used as a carrier for bare flags
        return new SyntaxNode(SyntaxKind.FEATURE_VALUE, rangeOf(ctx)).flag(flag);
    }

    private SyntaxNode specifier(ParserRuleContext ctx, String relation, List<ReferenceSyntax> targets) {
        SyntaxNode node = new SyntaxNode(SyntaxKind.SPECIFIER, rangeOf(ctx));
        node.attribute("relation", relation);
        for (ReferenceSyntax target : targets) {
            node.reference("target", target);
        }
        return node;
    }

    private SyntaxNode multiplicity(KerMLParser.MultiplicityBoundsContext ctx) {
        if (ctx == null) {
            return null;
        }
        SyntaxNode node = new SyntaxNode(SyntaxKind.MULTIPLICITY, rangeOf(ctx));
        if (ctx.lower != null) {
            node.addChild(multiplicityBound(ctx.lower).attribute("bound", "lower"));
        }
        if (ctx.upper != null) {
            node.addChild(multiplicityBound(ctx.upper).attribute("bound", "upper"));
        }
        return node;
    }

    private SyntaxNode multiplicityBound(KerMLParser.MultiplicityBoundContext ctx) {
        if (ctx.DECIMAL() != null) {
            return new SyntaxNode(SyntaxKind.LITERAL_INTEGER, rangeOf(ctx)).attribute("value", ctx.DECIMAL().getText());
        }
        if (ctx.STAR() != null) {
            return new SyntaxNode(SyntaxKind.LITERAL_INFINITY, rangeOf(ctx));
        }
        if (ctx.qualifiedName() != null) {
            return new SyntaxNode(SyntaxKind.FEATURE_REFERENCE, rangeOf(ctx))
                    .reference("referent", qualifiedReference(ctx.qualifiedName()));
        }
        return expression(ctx.expression());
    }

    // ========================================
    // FEATURES
    // ========================================

    @Override
    public SyntaxNode visitKeywordFeature(KerMLParser.KeywordFeatureContext ctx) {
        SyntaxNode node = new SyntaxNode(SyntaxKind.FEATURE, rangeOf(ctx));
        KerMLParser.FeatureKeywordContext keyword = ctx.featureKeyword();
        if (keyword != null) {
            node.attribute("keyword", keyword.getStart().getText());
            if (keyword.NOT() != null) {
                node.flag("negated");
            }
        }
        addPrefixes(node, ctx.featurePrefix());
        addIdentification(node, ctx.identification());
        addSpecifiers(node, ctx.typeSpecifier());
        addConnectorPart(node, ctx.connectorPart());
        addFeatureValue(node, ctx.featureValue());
        addBody(node, ctx.body());
        return node;
    }

    @Override
    public SyntaxNode visitPrefixedFeature(KerMLParser.PrefixedFeatureContext ctx) {
        SyntaxNode node = new SyntaxNode(SyntaxKind.FEATURE, rangeOf(ctx));
        addPrefixes(node, ctx.featurePrefix());
        addIdentification(node, ctx.identification());
        addSpecifiers(node, ctx.typeSpecifier());
        addFeatureValue(node, ctx.featureValue());
        addBody(node, ctx.body());
        return node;
    }

    @Override
    public SyntaxNode visitRedefinitionShorthand(KerMLParser.RedefinitionShorthandContext ctx) {
        SyntaxNode node = new SyntaxNode(SyntaxKind.FEATURE, rangeOf(ctx));
        addPrefixes(node, ctx.featurePrefix());
        node.flag("shorthand");
        SyntaxNode redefines = new SyntaxNode(SyntaxKind.SPECIFIER, rangeOf(ctx.chainReference()));
        redefines.attribute("relation", "redefines");
        redefines.reference("target", chainReference(ctx.chainReference()));
        node.addChild(redefines);
        addSpecifiers(node, ctx.typeSpecifier());
        addFeatureValue(node, ctx.featureValue());
        addBody(node, ctx.body());
        return node;
    }

    private static void addPrefixes(SyntaxNode node, List<KerMLParser.FeaturePrefixContext> prefixes) {
        for (KerMLParser.FeaturePrefixContext prefix : prefixes) {
            node.flag(prefix.getText());
        }
    }

    private void addFeatureValue(SyntaxNode node, KerMLParser.FeatureValueContext ctx) {
        if (ctx == null || ctx.ownedExpression() == null) {
            return;
        }
        SyntaxNode value = new SyntaxNode(SyntaxKind.FEATURE_VALUE, rangeOf(ctx));
        if (ctx.DEFAULT() != null) {
            value.flag("default");
        }
        if (ctx.COLON_EQ() != null) {
            value.flag("initial");
        }
        value.addChild(expression(ctx.ownedExpression().expression()));
        node.addChild(value);
    }

    private void addConnectorPart(SyntaxNode node, KerMLParser.ConnectorPartContext ctx) {
        if (ctx == null) {
            return;
        }
        List<KerMLParser.ConnectorEndContext> ends;
        if (ctx instanceof KerMLParser.BinaryConnectorPartContext binary) {
            ends = binary.connectorEnd();
        } else if (ctx instanceof KerMLParser.NaryConnectorPartContext nary) {
            ends = nary.connectorEnd();
        } else if (ctx instanceof KerMLParser.SuccessionPartContext succession) {
            ends = succession.connectorEnd();
        } else if (ctx instanceof KerMLParser.BindingPartContext binding) {
            ends = binding.connectorEnd();
        } else {
            return;
        }
        for (KerMLParser.ConnectorEndContext end : ends) {
            SyntaxNode endNode = new SyntaxNode(SyntaxKind.CONNECTOR_END, rangeOf(end));
            if (end.endName != null) {
                endNode.attribute("name", nameOf(end.endName));
            }
            endNode.reference("target", chainReference(end.chainReference()));
            node.addChild(endNode);
        }
    }

    // ========================================
    // EXPRESSIONS
    // ========================================

    private SyntaxNode expression(KerMLParser.ExpressionContext ctx) {
        return ctx == null ? null : visit(ctx);
    }

    @Override
    public SyntaxNode visitPrimary(KerMLParser.PrimaryContext ctx) {
        return visit(ctx.primaryExpression());
    }

    @Override
    public SyntaxNode visitMetadataAccessExpression(KerMLParser.MetadataAccessExpressionContext ctx) {
        SyntaxNode node = new SyntaxNode(SyntaxKind.METADATA_ACCESS, rangeOf(ctx));
        SyntaxNode source = expression(ctx.expression());
        if (source != null && source.kind() == SyntaxKind.FEATURE_REFERENCE) {
            source.firstReference("referent").ifPresent(ref -> node.reference("referent", ref));
        } else {
            node.addChild(source);
        }
        return node;
    }

    @Override
    public SyntaxNode visitFeatureChainExpression(KerMLParser.FeatureChainExpressionContext ctx) {
        SyntaxNode node = new SyntaxNode(SyntaxKind.FEATURE_CHAIN, rangeOf(ctx));
        node.attribute("operator", ".");
        node.addChild(expression(ctx.expression()));
        node.reference("target", qualifiedReference(ctx.qualifiedName()));
        return node;
    }

    @Override
    public SyntaxNode visitArrowInvocationExpression(KerMLParser.ArrowInvocationExpressionContext ctx) {
        SyntaxNode node = new SyntaxNode(SyntaxKind.INVOCATION_EXPRESSION, rangeOf(ctx));
        node.reference("function", qualifiedReference(ctx.qualifiedName()));
        node.flag("arrow");
        node.addChild(expression(ctx.expression()));
        addArguments(node, ctx.argumentList());
        return node;
    }

    @Override
    public SyntaxNode visitIndexExpression(KerMLParser.IndexExpressionContext ctx) {
        SyntaxNode node = operator(ctx, "#");
        node.addChild(expression(ctx.expression()));
        KerMLParser.ArgumentListContext args = ctx.argumentList();
        if (args != null && args.expression().size() > 1) {
            // multi-dimensional index becomes a single sequence argument
            SyntaxNode tuple = operator(args, ",");
            args.expression().forEach(e -> tuple.addChild(expression(e)));
            node.addChild(tuple);
        } else {
            addArguments(node, args);
        }
        return node;
    }

    @Override
    public SyntaxNode visitUnaryExpression(KerMLParser.UnaryExpressionContext ctx) {
        return operator(ctx, ctx.op.getText()).addChild(expression(ctx.expression()));
    }

    @Override
    public SyntaxNode visitExponentExpression(KerMLParser.ExponentExpressionContext ctx) {
        return binary(ctx, ctx.op.getText(), ctx.expression(0), ctx.expression(1));
    }

    @Override
    public SyntaxNode visitMultiplicativeExpression(KerMLParser.MultiplicativeExpressionContext ctx) {
        return binary(ctx, ctx.op.getText(), ctx.expression(0), ctx.expression(1));
    }

    @Override
    public SyntaxNode visitAdditiveExpression(KerMLParser.AdditiveExpressionContext ctx) {
        return binary(ctx, ctx.op.getText(), ctx.expression(0), ctx.expression(1));
    }

    @Override
    public SyntaxNode visitRangeExpression(KerMLParser.RangeExpressionContext ctx) {
        return binary(ctx, "..", ctx.expression(0), ctx.expression(1));
    }

    @Override
    public SyntaxNode visitRelationalExpression(KerMLParser.RelationalExpressionContext ctx) {
        return binary(ctx, ctx.op.getText(), ctx.expression(0), ctx.expression(1));
    }

    @Override
    public SyntaxNode visitClassificationExpression(KerMLParser.ClassificationExpressionContext ctx) {
        SyntaxNode node = operator(ctx, ctx.op.getText());
        node.addChild(expression(ctx.expression()));
        node.reference("type", qualifiedReference(ctx.qualifiedName()));
        return node;
    }

    @Override
    public SyntaxNode visitEqualityExpression(KerMLParser.EqualityExpressionContext ctx) {
        return binary(ctx, ctx.op.getText(), ctx.expression(0), ctx.expression(1));
    }

    @Override
    public SyntaxNode visitAndExpression(KerMLParser.AndExpressionContext ctx) {
        return binary(ctx, ctx.op.getText(), ctx.expression(0), ctx.expression(1));
    }

    @Override
    public SyntaxNode visitXorExpression(KerMLParser.XorExpressionContext ctx) {
        return binary(ctx, "xor", ctx.expression(0), ctx.expression(1));
    }

    @Override
    public SyntaxNode visitOrExpression(KerMLParser.OrExpressionContext ctx) {
        return binary(ctx, ctx.op.getText(), ctx.expression(0), ctx.expression(1));
    }

    @Override
    public SyntaxNode visitImpliesExpression(KerMLParser.ImpliesExpressionContext ctx) {
        return binary(ctx, "implies", ctx.expression(0), ctx.expression(1));
    }

    @Override
    public SyntaxNode visitNullCoalescingExpression(KerMLParser.NullCoalescingExpressionContext ctx) {
        return binary(ctx, "??", ctx.expression(0), ctx.expression(1));
    }

    @Override
    public SyntaxNode visitConditionalExpression(KerMLParser.ConditionalExpressionContext ctx) {
        SyntaxNode node = operator(ctx, "if");
        ctx.expression().forEach(e -> node.addChild(expression(e)));
        return node;
    }

    // primary

    @Override
    public SyntaxNode visitTrueLiteral(KerMLParser.TrueLiteralContext ctx) {
        return new SyntaxNode(SyntaxKind.LITERAL_BOOLEAN, rangeOf(ctx)).attribute("value", "true");
    }

    @Override
    public SyntaxNode visitFalseLiteral(KerMLParser.FalseLiteralContext ctx) {
        return new SyntaxNode(SyntaxKind.LITERAL_BOOLEAN, rangeOf(ctx)).attribute("value", "false");
    }

    @Override
    public SyntaxNode visitIntegerLiteral(KerMLParser.IntegerLiteralContext ctx) {
        return new SyntaxNode(SyntaxKind.LITERAL_INTEGER, rangeOf(ctx)).attribute("value", ctx.DECIMAL().getText());
    }

    @Override
    public SyntaxNode visitRealLiteral(KerMLParser.RealLiteralContext ctx) {
        return new SyntaxNode(SyntaxKind.LITERAL_REAL, rangeOf(ctx)).attribute("value", ctx.REAL().getText());
    }

    @Override
    public SyntaxNode visitStringLiteral(KerMLParser.StringLiteralContext ctx) {
        return new SyntaxNode(SyntaxKind.LITERAL_STRING, rangeOf(ctx)).attribute("value", unquote(ctx.STRING().getText()));
    }

    @Override
    public SyntaxNode visitInfinityLiteral(KerMLParser.InfinityLiteralContext ctx) {
        return new SyntaxNode(SyntaxKind.LITERAL_INFINITY, rangeOf(ctx));
    }

    @Override
    public SyntaxNode visitNullLiteral(KerMLParser.NullLiteralContext ctx) {
        return new SyntaxNode(SyntaxKind.NULL_EXPRESSION, rangeOf(ctx));
    }

    @Override
    public SyntaxNode visitSequenceExpression(KerMLParser.SequenceExpressionContext ctx) {
        List<KerMLParser.ExpressionContext> items = ctx.expression();
        if (items.isEmpty()) {
            return new SyntaxNode(SyntaxKind.NULL_EXPRESSION, rangeOf(ctx));
        }
        if (items.size() == 1) {
            return expression(items.get(0));
        }
        SyntaxNode node = operator(ctx, ",");
        items.forEach(e -> node.addChild(expression(e)));
        return node;
    }

    @Override
    public SyntaxNode visitInvocationExpression(KerMLParser.InvocationExpressionContext ctx) {
        SyntaxNode node = new SyntaxNode(SyntaxKind.INVOCATION_EXPRESSION, rangeOf(ctx));
        node.reference("function", qualifiedReference(ctx.qualifiedName()));
        addArguments(node, ctx.argumentList());
        return node;
    }

    @Override
    public SyntaxNode visitFeatureReferenceExpression(KerMLParser.FeatureReferenceExpressionContext ctx) {
        return new SyntaxNode(SyntaxKind.FEATURE_REFERENCE, rangeOf(ctx))
                .reference("referent", qualifiedReference(ctx.qualifiedName()));
    }

    private void addArguments(SyntaxNode node, KerMLParser.ArgumentListContext args) {
        if (args == null) {
            return;
        }
        for (KerMLParser.ExpressionContext arg : args.expression()) {
            node.addChild(expression(arg));
        }
    }

    private SyntaxNode operator(ParserRuleContext ctx, String operator) {
        return new SyntaxNode(SyntaxKind.OPERATOR_EXPRESSION, rangeOf(ctx)).attribute("operator", operator);
    }

    private SyntaxNode binary(ParserRuleContext ctx, String operator,
            KerMLParser.ExpressionContext left, KerMLParser.ExpressionContext right) {
        return operator(ctx, operator).addChild(expression(left)).addChild(expression(right));
    }

    // ========================================
    // NAMES AND REFERENCES
    // ========================================

    static String nameOf(KerMLParser.NameContext ctx) {
        if (ctx == null) {
            return null;
        }
        if (ctx.UNRESTRICTED_NAME() != null) {
            return unquote(ctx.UNRESTRICTED_NAME().getText());
        }
        return ctx.getText();
    }

    private static List<String> segments(KerMLParser.QualifiedNameContext ctx) {
        List<String> segments = new ArrayList<>();
        for (KerMLParser.NameContext name : ctx.name()) {
            segments.add(nameOf(name));
        }
        return segments;
    }

    static ReferenceSyntax qualifiedReference(KerMLParser.QualifiedNameContext ctx) {
        if (ctx == null || ctx.name().isEmpty()) {
            return null;
        }
        return ReferenceSyntax.qualified(segments(ctx), rangeOf(ctx));
    }

    static ReferenceSyntax chainReference(KerMLParser.ChainReferenceContext ctx) {
        if (ctx == null || ctx.qualifiedName() == null || ctx.qualifiedName().name().isEmpty()) {
            return null;
        }
        List<List<String>> chain = new ArrayList<>();
        chain.add(segments(ctx.qualifiedName()));
        for (KerMLParser.NameContext name : ctx.name()) {
            chain.add(List.of(nameOf(name)));
        }
        return new ReferenceSyntax(chain, rangeOf(ctx));
    }

    private static List<ReferenceSyntax> chainList(KerMLParser.ChainListContext ctx) {
        List<ReferenceSyntax> refs = new ArrayList<>();
        if (ctx != null) {
            for (KerMLParser.ChainReferenceContext ref : ctx.chainReference()) {
                ReferenceSyntax syntax = chainReference(ref);
                if (syntax != null) {
                    refs.add(syntax);
                }
            }
        }
        return refs;
    }

    private static List<ReferenceSyntax> single(ReferenceSyntax reference) {
        return reference == null ? List.of() : List.of(reference);
    }

    // ========================================
    // TEXT HELPERS
    // ========================================

    static TextRange rangeOf(ParserRuleContext ctx) {
        if (ctx == null || ctx.getStart() == null) {
            return TextRange.NONE;
        }
        Token start = ctx.getStart();
        Token stop = ctx.getStop();
        if (stop == null || stop.getTokenIndex() < start.getTokenIndex()) {
            stop = start;
        }
        return rangeOf(start, stop);
    }

    static TextRange rangeOf(Token start, Token stop) {
        String stopText = stop.getText() == null ? "" : stop.getText();
        int endLine = stop.getLine();
        int endColumn = stop.getCharPositionInLine() + stopText.length();
        int newline = stopText.lastIndexOf('\n');
        if (newline >= 0) {
            endLine += (int) stopText.chars().filter(c -> c == '\n').count();
            endColumn = stopText.length() - newline - 1;
        }
        return new TextRange(start.getLine(), start.getCharPositionInLine(), endLine, endColumn,
                start.getStartIndex(), stop.getStopIndex() + 1);
    }

    static String unquote(String raw) {
        if (raw.length() < 2) {
            return raw;
        }
        String body = raw.substring(1, raw.length() - 1);
        StringBuilder sb = new StringBuilder(body.length());
        for (int i = 0; i < body.length(); i++) {
            char c = body.charAt(i);
            if (c == '\\' && i + 1 < body.length()) {
                char next = body.charAt(++i);
                switch (next) {
                    case 'n' -> sb.append('\n');
                    case 't' -> sb.append('\t');
                    case 'r' -> sb.append('\r');
                    default -> sb.append(next);
                }
            } else {
                sb.append(c);
            }
        }
        return sb.toString();
    }

    /**
     * Strips the comment delimiters and leading asterisks of each line.
     */
    static String commentBody(TerminalNode comment) {
        if (comment == null) {
            return "";
        }
        String raw = comment.getText();
        String body = raw.substring(2, Math.max(2, raw.length() - 2));
        String[] lines = body.split("\\R", -1);
        StringBuilder sb = new StringBuilder();
        for (String line : lines) {
            String stripped = line.strip();
            if (stripped.startsWith("*")) {
                stripped = stripped.substring(1).strip();
            }
            if (sb.length() > 0 || !stripped.isEmpty()) {
                if (sb.length() > 0) {
                    sb.append('\n');
                }
                sb.append(stripped);
            }
        }
        return sb.toString().strip();
    }

    @Override
    protected SyntaxNode aggregateResult(SyntaxNode aggregate, SyntaxNode nextResult) {
        return nextResult != null ? nextResult : aggregate;
    }

    @Override
    public SyntaxNode visit(ParseTree tree) {
        return tree == null ? null : super.visit(tree);
    }
}
