package org.sysmlite.engine.build;

import org.sysmlite.engine.implicit.ImplicitSynthesizer;
import org.sysmlite.engine.validation.ModelValidator;
import org.sysmlite.engine.validation.ValidationChecks;
import org.sysmlite.engine.workspace.Diagnostic;
import org.sysmlite.engine.workspace.DocumentState;
import org.sysmlite.engine.workspace.SourceDocument;
import org.sysmlite.engine.workspace.Workspace;
import org.sysmlite.kerml.dsl.ParseResult;
import org.sysmlite.kerml.dsl.SyntaxError;
import org.sysmlite.kerml.dsl.antlr.KerMLParserAdapter;
import org.sysmlite.kerml.m3.Element;
import org.sysmlite.kerml.m3.Namespace;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Runs the build pipeline over a batch of documents.
 *
 * The standard library is built first as its own batch. Each batch then goes
 * through the phases phase by phase, so every document is indexed before any
 * document is linked:
 * <ol>
 *   <li>parse (skipped if the text did not change)</li>
 *   <li>model construction</li>
 *   <li>indexing into the global scope</li>
 *   <li>linking of specialization, import and alias references</li>
 *   <li>implicit generalization</li>
 *   <li>resolution of the remaining references</li>
 *   <li>validation and note attachment</li>
 * </ol>
 * The cancellation token is checked after each document and each phase. A
 * cancelled build keeps what was completed; the next build resumes from the
 * recorded {@link DocumentState}.
 */
public class DocumentBuilder {

    private static final Logger LOGGER = LoggerFactory.getLogger(DocumentBuilder.class);

    private static final List<DocumentState> PHASES = List.of(
            DocumentState.PARSED,
            DocumentState.CONSTRUCTED,
            DocumentState.INDEXED,
            DocumentState.LINKED,
            DocumentState.GENERALIZED,
            DocumentState.RESOLVED,
            DocumentState.VALIDATED);

    /**
     * Notified each time a document completes a phase.
     */
    @FunctionalInterface
    public interface PhaseListener {
        void onPhase(SourceDocument document, DocumentState reached);
    }

    private final Workspace workspace;
    private final ImplicitSynthesizer synthesizer;
    private final List<PhaseListener> listeners = new CopyOnWriteArrayList<>();

    public DocumentBuilder(Workspace workspace) {
        this.workspace = workspace;
        this.synthesizer = new ImplicitSynthesizer(workspace.linker());
    }

    public void onDocumentPhase(PhaseListener listener) {
        listeners.add(listener);
    }

    public void removeListener(PhaseListener listener) {
        listeners.remove(listener);
    }

    /**
     * Builds the library and then {@code documents} with {@code options}.
     * Documents that are fully built with the same options are skipped.
     */
    public BuildResult build(List<SourceDocument> documents, BuildOptions options, CancellationToken token) {
        try {
            buildBatch(workspace.libraryDocuments(), libraryOptions(options), token);
            buildBatch(dependencyOrder(documents), options, token);
            return new BuildResult(documents, false);
        } catch (OperationCancelledException e) {
            LOGGER.info("Build of {} document(s) cancelled", documents.size());
            return new BuildResult(documents, true);
        }
    }

    private static BuildOptions libraryOptions(BuildOptions options) {
        return options.withValidationChecks(ValidationChecks.NONE)
                .withStandalone(false)
                .withIgnoreMetamodelErrors(true);
    }

    private void buildBatch(List<SourceDocument> documents, BuildOptions options, CancellationToken token) {
        List<SourceDocument> batch = new ArrayList<>();
        for (SourceDocument document : documents) {
            if (!options.equals(document.options())) {
                document.invalidate();
            }
            if (document.state() != DocumentState.VALIDATED) {
                batch.add(document);
            }
        }
        if (batch.isEmpty()) {
            return;
        }
        LOGGER.debug("Building {} document(s)", batch.size());
        for (DocumentState phase : PHASES) {
            for (SourceDocument document : batch) {
                if (document.state().isAtLeast(phase)) {
                    continue;
                }
                runPhase(document, phase, options);
                document.setState(phase);
                for (PhaseListener listener : listeners) {
                    listener.onPhase(document, phase);
                }
                token.checkCancelled();
            }
            token.checkCancelled();
        }
    }

    private void runPhase(SourceDocument document, DocumentState phase, BuildOptions options) {
        LOGGER.debug("{}: {}", document.uri(), phase);
        switch (phase) {
            case PARSED -> parse(document, options);
            case CONSTRUCTED -> {
                if (document.root() == null) {
                    document.setRoot(ModelBuilder.build(document, document.parseResult().root()));
                }
            }
            case INDEXED -> workspace.globalScope().collectDocument(document.uri(), document.root());
            case LINKED -> workspace.linker().linkRelationships(document);
            case GENERALIZED -> synthesizer.addImplicits(document, options);
            case RESOLVED -> workspace.linker().linkRemaining(document);
            case VALIDATED -> {
                if (!options.validationChecks().isNone()) {
                    new ModelValidator(options, workspace.evaluator())
                            .validate(document.root())
                            .forEach(document::addDiagnostic);
                }
                NoteAttacher.attach(document);
            }
            default -> throw new IllegalStateException("Not a build phase: " + phase);
        }
        workspace.modelVersion().bump();
    }

    /**
     * Starts a document over: clears diagnostics and derived state, and
     * reparses if the text changed. Elements keep their identity when the text
     * is the same.
     */
    private void parse(SourceDocument document, BuildOptions options) {
        document.clearDiagnostics();
        document.clearDependencies();
        document.setNotesAttached(false);
        document.setOptions(options);
        if (document.isTextChanged() || document.parseResult() == null) {
            if (document.root() != null) {
                workspace.globalScope().invalidateDocument(document.uri());
            }
            document.setRoot(null);
            document.setParseResult(KerMLParserAdapter.parse(document.text()));
        } else if (document.root() != null) {
            resetElements(document.root());
        }
        ParseResult result = document.parseResult();
        for (SyntaxError error : result.errors()) {
            document.addDiagnostic(Diagnostic.fromSyntaxError(error));
        }
        if (result.hasErrors()) {
            LOGGER.debug("{} syntax error(s) in {}", result.errors().size(), document.uri());
        }
    }

    private void resetElements(Namespace root) {
        root.reset();
        for (Element element : root.descendants()) {
            element.reset();
        }
        workspace.modelVersion().bump();
    }

    /**
     * Orders documents so that the documents a document resolved references
     * into during its previous build come first. Cycles keep input order.
     */
    static List<SourceDocument> dependencyOrder(List<SourceDocument> documents) {
        Map<String, SourceDocument> byUri = new LinkedHashMap<>();
        documents.forEach(d -> byUri.put(d.uri(), d));
        List<SourceDocument> ordered = new ArrayList<>();
        Set<String> visited = new HashSet<>();
        for (SourceDocument document : documents) {
            visit(document, byUri, visited, ordered);
        }
        return ordered;
    }

    private static void visit(SourceDocument document, Map<String, SourceDocument> byUri,
            Set<String> visited, List<SourceDocument> ordered) {
        if (!visited.add(document.uri())) {
            return;
        }
        for (String dependency : document.dependencies()) {
            SourceDocument other = byUri.get(dependency);
            if (other != null) {
                visit(other, byUri, visited, ordered);
            }
        }
        ordered.add(document);
    }
}
