package org.sysmlite.engine.scope;

import org.sysmlite.engine.workspace.Diagnostic;
import org.sysmlite.engine.workspace.Severity;
import org.sysmlite.engine.workspace.SourceDocument;
import org.sysmlite.engine.workspace.Workspace;
import org.sysmlite.kerml.dsl.ReferenceSyntax;
import org.sysmlite.kerml.m3.Element;
import org.sysmlite.kerml.m3.ElementKind;
import org.sysmlite.kerml.m3.ElementReference;
import org.sysmlite.kerml.m3.Import;
import org.sysmlite.kerml.m3.Membership;
import org.sysmlite.kerml.m3.Namespace;
import org.sysmlite.kerml.m3.ReferenceResolver;
import org.sysmlite.kerml.m3.Relationship;
import org.sysmlite.kerml.m3.Specialization;
import org.sysmlite.kerml.m3.Type;
import org.sysmlite.kerml.m3.expression.FeatureChainExpression;
import org.sysmlite.kerml.m3.expression.FeatureReferenceExpression;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Resolves element references against the scopes of a workspace.
 *
 * Linking a document runs in two passes. {@link #linkRelationships} resolves
 * the references that define the specialization graph: standalone
 * relationships, heritage targets, imports and aliases. After implicit
 * supertypes are added, {@link #linkRemaining} resolves everything else and
 * reports references that could not be resolved.
 */
public class Linker implements ReferenceResolver {

    private static final Logger LOGGER = LoggerFactory.getLogger(Linker.class);

    private final Workspace workspace;
    private final ScopeProvider scopes;
    private final Map<String, Element> libraryCache = new HashMap<>();

    public Linker(Workspace workspace) {
        this.workspace = workspace;
        this.scopes = new ScopeProvider(workspace.globalScope());
    }

    public ScopeProvider scopes() {
        return scopes;
    }

    // ========================================
    // Reference resolution
    // ========================================

    @Override
    public void resolve(ElementReference reference) {
        ReferenceSyntax syntax = reference.syntax();
        if (syntax == null) {
            return;
        }
        List<Element> found = new ArrayList<>();
        Element current = null;
        List<List<String>> chain = syntax.chain();
        for (int i = 0; i < chain.size(); i++) {
            List<String> part = chain.get(i);
            for (int j = 0; j < part.size(); j++) {
                boolean last = i == chain.size() - 1 && j == part.size() - 1;
                ElementKind expected = last
                        ? reference.expectedKind()
                        : (j < part.size() - 1 ? ElementKind.NAMESPACE : ElementKind.TYPE);
                Scope scope;
                if (i == 0 && j == 0) {
                    scope = initialScope(reference);
                } else if (j > 0) {
                    scope = scopes.memberScope(current, reference.owner());
                } else {
                    scope = scopes.featureScope(current);
                }
                LookupResult result = scope == null
                        ? LookupResult.NOT_FOUND
                        : scope.lookup(part.get(j), new LookupContext(expected, reference.skip()));
                if (result.isAmbiguous()) {
                    reference.markFailed(ambiguous(part.get(j), result), found);
                    return;
                }
                if (!result.isFound()) {
                    reference.markFailed(notFound(reference), found);
                    return;
                }
                current = result.element();
                found.add(current);
            }
        }
        reference.markResolved(current, found);
        found.forEach(target -> recordDependency(reference.owner(), target));
    }

    private Scope initialScope(ElementReference reference) {
        Element qualifier = reference.qualifier();
        if (qualifier != null) {
            Element source = qualifierSource(qualifier);
            if (source instanceof Type type) {
                return scopes.featureScope(type);
            }
        }
        return scopes.lexicalScope(reference.scopeStart(), isLibraryOnly(reference.owner()));
    }

    /**
     * @return the feature a qualifying expression evaluates through, or null if unknown
     */
    private static Element qualifierSource(Element qualifier) {
        if (qualifier instanceof FeatureReferenceExpression reference) {
            return reference.referent();
        }
        if (qualifier instanceof FeatureChainExpression chain) {
            return chain.targetFeature();
        }
        return null;
    }

    private static boolean isLibraryOnly(Element owner) {
        if (owner == null) {
            return false;
        }
        if (owner.isStandardLibrary()) {
            return true;
        }
        return owner.document() instanceof SourceDocument document
                && document.options() != null
                && document.options().standalone();
    }

    private static void recordDependency(Element owner, Element target) {
        if (owner != null && owner.document() instanceof SourceDocument document && target.document() != document) {
            document.addDependency(target.document().uri());
        }
    }

    private static String notFound(ElementReference reference) {
        return "Could not resolve reference to " + reference.expectedKind().displayName()
                + " named '" + reference.text() + "'.";
    }

    private static String ambiguous(String name, LookupResult result) {
        String candidates = result.candidates().stream()
                .map(m -> {
                    Element element = m.memberElement();
                    String qualified = element.qualifiedName();
                    return qualified != null ? qualified : element.toString();
                })
                .collect(Collectors.joining(", "));
        return "Ambiguous reference to '" + name + "', candidates: " + candidates + ".";
    }

    // ========================================
    // Document passes
    // ========================================

    /**
     * Resolves the references that shape the specialization graph and
     * registers standalone relationships with their source types.
     */
    public void linkRelationships(SourceDocument document) {
        for (Element element : document.root().descendants()) {
            if (element instanceof Relationship relationship && relationship.sourceReference() != null) {
                Element source = relationship.resolveSource();
                relationship.resolveTarget();
                if (source instanceof Type type) {
                    type.addExternal(relationship);
                }
            }
        }
        for (Element element : document.root().descendants()) {
            if (element instanceof Specialization specialization && specialization.sourceReference() == null) {
                specialization.resolveTarget();
            } else if (element instanceof Import imp) {
                imp.resolveTarget();
            } else if (element instanceof Membership membership && membership.isAlias()) {
                membership.resolveTarget();
            }
        }
    }

    /**
     * Resolves every remaining reference of the document and reports failures
     * as {@link Diagnostic#LINKING_ERROR} diagnostics.
     */
    public void linkRemaining(SourceDocument document) {
        int failed = 0;
        List<Element> elements = new ArrayList<>();
        elements.add(document.root());
        elements.addAll(document.root().descendants());
        for (Element element : elements) {
            for (ElementReference reference : element.references()) {
                reference.resolve();
                if (reference.isFailed()) {
                    failed++;
                    document.addDiagnostic(new Diagnostic(Severity.ERROR, reference.error(),
                            reference.syntax().range(), Diagnostic.LINKING_ERROR, element));
                }
            }
        }
        if (failed > 0) {
            LOGGER.debug("{} unresolved reference(s) in {}", failed, document.uri());
        }
    }

    // ========================================
    // Library lookup
    // ========================================

    /**
     * Finds an element by qualified name, as seen from {@code context}: the
     * document root of the context first, then the standard library.
     *
     * @return the element, or null if it does not exist
     */
    public Element findLibraryElement(String qualifiedName, Element context) {
        Element root = context == null ? null : context.root();
        if (root instanceof Namespace namespace) {
            Element local = findQualified(qualifiedName, new NamespaceScope(namespace, VisibilityOptions.LINKING), null);
            if (local != null) {
                return local;
            }
        }
        Element cached = libraryCache.get(qualifiedName);
        if (cached == null) {
            cached = findQualified(qualifiedName, workspace.globalScope().libraryOnly(), null);
            if (cached != null) {
                libraryCache.put(qualifiedName, cached);
            }
        }
        return cached;
    }

    /**
     * Forgets library elements found so far; called when the library is reloaded.
     */
    public void clearLibraryCache() {
        libraryCache.clear();
    }

    private Element findQualified(String qualifiedName, Scope first, Element context) {
        Element current = null;
        for (String segment : qualifiedName.split("::")) {
            Scope scope = current == null ? first : scopes.memberScope(current, context);
            if (scope == null) {
                return null;
            }
            LookupResult result = scope.lookup(segment, LookupContext.any());
            if (!result.isFound()) {
                return null;
            }
            current = result.element();
        }
        return current;
    }
}
