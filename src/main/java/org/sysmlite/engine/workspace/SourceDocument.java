package org.sysmlite.engine.workspace;

import org.sysmlite.engine.build.BuildOptions;
import org.sysmlite.kerml.dsl.ParseResult;
import org.sysmlite.kerml.m3.IdAllocator;
import org.sysmlite.kerml.m3.ModelDocument;
import org.sysmlite.kerml.m3.ModelVersion;
import org.sysmlite.kerml.m3.Namespace;
import org.sysmlite.kerml.m3.ReferenceResolver;
import org.sysmlite.kerml.m3.ValueEvaluator;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * One source file of a workspace: its text, syntax tree, root namespace,
 * build state and diagnostics.
 */
public class SourceDocument implements ModelDocument {

    private final Workspace workspace;
    private final String uri;
    private final boolean standardLibrary;
    private String text;
    private boolean textChanged = true;
    private DocumentState state = DocumentState.CHANGED;
    private ParseResult parseResult;
    private Namespace root;
    private BuildOptions options;
    private boolean notesAttached;
    private final List<Diagnostic> diagnostics = new ArrayList<>();
    private final Set<String> dependencies = new LinkedHashSet<>();

    SourceDocument(Workspace workspace, String uri, String text, boolean standardLibrary) {
        this.workspace = Objects.requireNonNull(workspace, "Workspace cannot be null");
        this.uri = Objects.requireNonNull(uri, "Document URI cannot be null");
        this.text = Objects.requireNonNull(text, "Document text cannot be null");
        this.standardLibrary = standardLibrary;
    }

    // ========================================
    // ModelDocument
    // ========================================

    @Override
    public String uri() {
        return uri;
    }

    @Override
    public IdAllocator idAllocator() {
        return workspace.idAllocator();
    }

    @Override
    public ModelVersion modelVersion() {
        return workspace.modelVersion();
    }

    @Override
    public ReferenceResolver referenceResolver() {
        return workspace.linker();
    }

    @Override
    public ValueEvaluator valueEvaluator() {
        return workspace.valueEvaluator();
    }

    @Override
    public boolean isStandardLibrary() {
        return standardLibrary;
    }

    // ========================================
    // Content
    // ========================================

    public Workspace workspace() {
        return workspace;
    }

    public String text() {
        return text;
    }

    /**
     * Replaces the text. The document is rebuilt from scratch on the next build.
     */
    void setText(String newText) {
        this.text = Objects.requireNonNull(newText, "Document text cannot be null");
        this.textChanged = true;
        this.state = DocumentState.CHANGED;
    }

    /**
     * Marks the document for relinking without discarding its elements.
     */
    public void invalidate() {
        this.state = DocumentState.CHANGED;
    }

    public boolean isTextChanged() {
        return textChanged;
    }

    public ParseResult parseResult() {
        return parseResult;
    }

    public void setParseResult(ParseResult parseResult) {
        this.parseResult = parseResult;
        this.textChanged = false;
    }

    /**
     * @return the root namespace, or null before model construction
     */
    public Namespace root() {
        return root;
    }

    public void setRoot(Namespace root) {
        this.root = root;
    }

    // ========================================
    // Build state
    // ========================================

    public DocumentState state() {
        return state;
    }

    public void setState(DocumentState state) {
        this.state = state;
    }

    /**
     * @return options of the last build of this document
     */
    public BuildOptions options() {
        return options;
    }

    public void setOptions(BuildOptions options) {
        this.options = options;
    }

    public boolean notesAttached() {
        return notesAttached;
    }

    public void setNotesAttached(boolean notesAttached) {
        this.notesAttached = notesAttached;
    }

    public List<Diagnostic> diagnostics() {
        return Collections.unmodifiableList(diagnostics);
    }

    public void addDiagnostic(Diagnostic diagnostic) {
        diagnostics.add(diagnostic);
    }

    public void clearDiagnostics() {
        diagnostics.clear();
    }

    /**
     * @return URIs of other documents that references in this document resolved into
     */
    public Set<String> dependencies() {
        return Collections.unmodifiableSet(dependencies);
    }

    public void addDependency(String otherUri) {
        if (!otherUri.equals(uri)) {
            dependencies.add(otherUri);
        }
    }

    public void clearDependencies() {
        dependencies.clear();
    }

    @Override
    public String toString() {
        return "SourceDocument[" + uri + ", " + state + "]";
    }
}
