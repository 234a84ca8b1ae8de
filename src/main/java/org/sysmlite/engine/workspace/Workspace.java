package org.sysmlite.engine.workspace;

import org.sysmlite.engine.build.BuildOptions;
import org.sysmlite.engine.build.BuildResult;
import org.sysmlite.engine.build.CancellationToken;
import org.sysmlite.engine.build.DocumentBuilder;
import org.sysmlite.engine.build.StandardLibrary;
import org.sysmlite.engine.eval.BuiltinFunctionRegistry;
import org.sysmlite.engine.eval.EvaluationException;
import org.sysmlite.engine.eval.EvaluationResult;
import org.sysmlite.engine.eval.ExpressionEvaluator;
import org.sysmlite.engine.scope.GlobalScope;
import org.sysmlite.engine.scope.Linker;
import org.sysmlite.kerml.m3.IdAllocator;
import org.sysmlite.kerml.m3.ModelVersion;
import org.sysmlite.kerml.m3.ValueEvaluator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * A set of interdependent documents analyzed together, plus the standard
 * library they build on.
 *
 * The workspace owns the shared services: id allocation, the model version
 * stamping all memoized properties, the global scope index, the linker and
 * the expression evaluator. Builds are single-threaded; callers must not
 * read the model while a build of the same workspace is running.
 */
public class Workspace {

    private static final Logger LOGGER = LoggerFactory.getLogger(Workspace.class);

    private final EngineConfig config;
    private final IdAllocator idAllocator = new IdAllocator();
    private final ModelVersion modelVersion = new ModelVersion();
    private final GlobalScope globalScope = new GlobalScope();
    private final Linker linker;
    private final ExpressionEvaluator evaluator;
    private final ValueEvaluator valueEvaluator;
    private final DocumentBuilder documentBuilder;
    private final Map<String, SourceDocument> documents = new LinkedHashMap<>();
    private final List<SourceDocument> library = new ArrayList<>();
    private StandardLibrary loadedLibrary;
    private Path loadedLibraryPath;

    public Workspace() {
        this(EngineConfig.load());
    }

    public Workspace(EngineConfig config) {
        this.config = Objects.requireNonNull(config, "Engine config cannot be null");
        this.linker = new Linker(this);
        this.evaluator = new ExpressionEvaluator(BuiltinFunctionRegistry.withBuiltins(), linker::findLibraryElement);
        this.documentBuilder = new DocumentBuilder(this);
        this.valueEvaluator = (expression, target) -> {
            EvaluationResult result = evaluator.evaluate(expression, target);
            if (result.isError()) {
                throw new EvaluationException(result.error().message(), result.error().stack());
            }
            return result.values();
        };
    }

    // ========================================
    // Services
    // ========================================

    public EngineConfig config() {
        return config;
    }

    public IdAllocator idAllocator() {
        return idAllocator;
    }

    public ModelVersion modelVersion() {
        return modelVersion;
    }

    public GlobalScope globalScope() {
        return globalScope;
    }

    public Linker linker() {
        return linker;
    }

    public ExpressionEvaluator evaluator() {
        return evaluator;
    }

    public ValueEvaluator valueEvaluator() {
        return valueEvaluator;
    }

    public DocumentBuilder documentBuilder() {
        return documentBuilder;
    }

    // ========================================
    // Documents
    // ========================================

    /**
     * Adds a document or replaces its text. Documents that referenced the old
     * content are marked for relinking.
     */
    public SourceDocument update(String uri, String text) {
        SourceDocument existing = documents.get(uri);
        if (existing != null) {
            if (existing.text().equals(text)) {
                return existing;
            }
            existing.setText(text);
            globalScope.invalidateDocuments(List.of(uri));
            invalidateDependents(uri);
            return existing;
        }
        SourceDocument document = new SourceDocument(this, uri, text, false);
        documents.put(uri, document);
        // a new document may satisfy references that failed before
        documents.values().stream()
                .filter(d -> d != document && hasFailedReferences(d))
                .forEach(SourceDocument::invalidate);
        return document;
    }

    /**
     * Removes a document and marks documents that referenced it for relinking.
     *
     * @return true if the document existed
     */
    public boolean remove(String uri) {
        SourceDocument removed = documents.remove(uri);
        if (removed == null) {
            return false;
        }
        globalScope.invalidateDocuments(List.of(uri));
        invalidateDependents(uri);
        return true;
    }

    private void invalidateDependents(String uri) {
        Deque<String> pending = new ArrayDeque<>();
        pending.add(uri);
        while (!pending.isEmpty()) {
            String changed = pending.poll();
            for (SourceDocument document : documents.values()) {
                if (document.dependencies().contains(changed) && document.state() != DocumentState.CHANGED) {
                    LOGGER.debug("Invalidating {} after change of {}", document.uri(), changed);
                    document.invalidate();
                    pending.add(document.uri());
                }
            }
        }
    }

    private static boolean hasFailedReferences(SourceDocument document) {
        return document.diagnostics().stream().anyMatch(d -> Diagnostic.LINKING_ERROR.equals(d.code()));
    }

    public SourceDocument document(String uri) {
        SourceDocument document = documents.get(uri);
        if (document != null) {
            return document;
        }
        for (SourceDocument libraryDocument : library) {
            if (libraryDocument.uri().equals(uri)) {
                return libraryDocument;
            }
        }
        return null;
    }

    public Collection<SourceDocument> documents() {
        return Collections.unmodifiableCollection(documents.values());
    }

    public List<SourceDocument> libraryDocuments() {
        return Collections.unmodifiableList(library);
    }

    // ========================================
    // Build
    // ========================================

    public BuildResult build() {
        return build(config.toBuildOptions(), CancellationToken.NONE);
    }

    public BuildResult build(BuildOptions options) {
        return build(options, CancellationToken.NONE);
    }

    /**
     * Builds the standard library if needed, then every document that is not
     * fully built for {@code options}.
     */
    public BuildResult build(BuildOptions options, CancellationToken token) {
        prepareLibrary(options);
        return documentBuilder.build(new ArrayList<>(documents.values()), options, token);
    }

    /**
     * Loads the library variant selected by {@code options}, replacing a
     * previously loaded one.
     */
    void prepareLibrary(BuildOptions options) {
        if (options.standardLibrary() == loadedLibrary && Objects.equals(options.localLibraryPath(), loadedLibraryPath)) {
            return;
        }
        if (!library.isEmpty()) {
            globalScope.invalidateDocuments(library.stream().map(SourceDocument::uri).toList());
            library.clear();
            linker.clearLibraryCache();
            documents.values().forEach(SourceDocument::invalidate);
        }
        for (Map.Entry<String, String> entry : StandardLibraryLoader.load(options).entrySet()) {
            library.add(new SourceDocument(this, entry.getKey(), entry.getValue(), true));
        }
        loadedLibrary = options.standardLibrary();
        loadedLibraryPath = options.localLibraryPath();
        LOGGER.info("Loaded {} standard library document(s) for {}", library.size(), loadedLibrary);
    }
}
