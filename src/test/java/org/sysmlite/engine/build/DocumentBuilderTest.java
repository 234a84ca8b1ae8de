package org.sysmlite.engine.build;

import org.sysmlite.engine.AbstractModelTest;
import org.sysmlite.engine.workspace.Diagnostic;
import org.sysmlite.engine.workspace.DocumentState;
import org.sysmlite.engine.workspace.SourceDocument;
import org.sysmlite.kerml.dsl.ReferenceSyntax;
import org.sysmlite.kerml.dsl.TextRange;
import org.sysmlite.kerml.m3.Element;
import org.sysmlite.kerml.m3.ElementKind;
import org.sysmlite.kerml.m3.ElementReference;
import org.sysmlite.kerml.m3.Type;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for the phased build pipeline: phase order, incremental rebuilds
 * and cancellation.
 */
class DocumentBuilderTest extends AbstractModelTest {

    private final List<String> events = new ArrayList<>();
    private final DocumentBuilder.PhaseListener recorder = (document, reached) ->
            events.add(document.uri().substring(document.uri().lastIndexOf('/') + 1) + ":" + reached);

    @Override
    protected BuildOptions options() {
        return withoutLibrary();
    }

    @BeforeEach
    void listen() {
        workspace.documentBuilder().onDocumentPhase(recorder);
    }

    @AfterEach
    void stopListening() {
        workspace.documentBuilder().removeListener(recorder);
    }

    @Nested
    @DisplayName("Phases")
    class PhaseTests {

        @Test
        void runsEveryPhaseInOrder() {
            SourceDocument document = build("package P { class A; }");
            assertEquals(List.of(
                    "model.kerml:PARSED",
                    "model.kerml:CONSTRUCTED",
                    "model.kerml:INDEXED",
                    "model.kerml:LINKED",
                    "model.kerml:GENERALIZED",
                    "model.kerml:RESOLVED",
                    "model.kerml:VALIDATED"), events);
            assertEquals(DocumentState.VALIDATED, document.state());
        }

        @Test
        void everyPhaseAdvancesTheModelVersion() {
            List<Long> versions = new ArrayList<>();
            DocumentBuilder.PhaseListener versionRecorder = (document, reached) ->
                    versions.add(workspace.modelVersion().current());
            workspace.documentBuilder().onDocumentPhase(versionRecorder);
            try {
                build("package P { class A; class B specializes A; }");
            } finally {
                workspace.documentBuilder().removeListener(versionRecorder);
            }
            assertEquals(7, versions.size());
            for (int i = 1; i < versions.size(); i++) {
                assertTrue(versions.get(i) > versions.get(i - 1), versions::toString);
            }
        }

        @Test
        void resolvingAReferenceKeepsTheModelVersion() {
            SourceDocument document = build("package P { class A; class B specializes A; }");
            Type b = find(document, "P::B", Type.class);
            Element a = find(document, "P::A");
            long version = workspace.modelVersion().current();

            ElementReference reference = ElementReference.pending(
                    ReferenceSyntax.qualified(List.of("A"), TextRange.NONE), b, ElementKind.CLASSIFIER);
            assertSame(a, reference.resolve());
            assertTrue(reference.isResolved());
            assertEquals(List.of(a), b.directSupertypes());
            assertTrue(b.conforms((Type) a));
            assertEquals(version, workspace.modelVersion().current());
        }

        @Test
        void everyDocumentFinishesAPhaseBeforeTheNextPhase() {
            workspace.update("test:/a.kerml", "package A { class X specializes B::Y; }");
            workspace.update("test:/b.kerml", "package B { class Y; }");
            BuildResult result = buildAll(options());

            assertFalse(result.cancelled());
            assertFalse(result.hasErrors(), () -> result.errors().toString());
            int lastIndexed = Math.max(events.indexOf("a.kerml:INDEXED"), events.indexOf("b.kerml:INDEXED"));
            int firstLinked = Math.min(events.indexOf("a.kerml:LINKED"), events.indexOf("b.kerml:LINKED"));
            assertTrue(lastIndexed < firstLinked, events::toString);
        }

        @Test
        void builtDocumentsAreSkipped() {
            build("package P { class A; }");
            events.clear();
            buildAll(options());
            assertEquals(List.of(), events);
        }

        @Test
        void changedOptionsRebuildTheDocument() {
            build("package P { class A; }");
            events.clear();
            buildAll(options().withStandalone(true));
            assertEquals(7, events.size());
        }

        @Test
        void syntaxErrorsDoNotStopTheBuild() {
            SourceDocument document = build("package P { class A specializes ; class B; }");
            assertFalse(diagnostics(document, Diagnostic.PARSE_ERROR).isEmpty());
            assertEquals(DocumentState.VALIDATED, document.state());
        }

        @Test
        void resultExcludesLibraryDocuments() {
            workspace.update(URI, "package P { class A specializes Missing; }");
            BuildResult result = buildAll(BuildOptions.defaults());
            assertEquals(1, result.documents().size());
            assertTrue(result.hasErrors());
            assertEquals(Diagnostic.LINKING_ERROR, result.errors().get(0).code());
            assertFalse(workspace.libraryDocuments().isEmpty());
        }
    }

    @Nested
    @DisplayName("Incremental rebuilds")
    class RebuildTests {

        @Test
        void unchangedTextKeepsElementIdentity() {
            SourceDocument document = build("package P { class A; class B specializes A; }");
            Element a = find(document, "P::A");

            document.invalidate();
            buildAll(options());

            assertSame(a, find(document, "P::A"));
            assertSame(a, find(document, "P::B", Type.class).directSupertypes().get(0));
        }

        @Test
        void changedTextRebuildsElements() {
            SourceDocument document = build("package P { class A; }");
            Element a = find(document, "P::A");

            build("package P { class A; class C; }");

            assertNotSame(a, find(document, "P::A"));
            assertNotNull(find(document, "P::C"));
        }

        @Test
        void dependenciesAreBuiltFirst() {
            SourceDocument a = workspace.update("test:/a.kerml", "package A { class X specializes B::Y; }");
            SourceDocument b = workspace.update("test:/b.kerml", "package B { class Y; }");
            buildAll(options());

            assertEquals(List.of(b, a), DocumentBuilder.dependencyOrder(List.of(a, b)));
            assertEquals(List.of(b, a), DocumentBuilder.dependencyOrder(List.of(b, a)));
        }
    }

    @Nested
    @DisplayName("Cancellation")
    class CancellationTests {

        @Test
        void cancelledBuildKeepsCompletedPhases() {
            CancellationToken token = new CancellationToken();
            workspace.documentBuilder().onDocumentPhase((document, reached) -> {
                if (reached == DocumentState.LINKED) {
                    token.cancel();
                }
            });
            SourceDocument document = workspace.update(URI, "package P { class A; }");

            BuildResult result = workspace.build(options(), token);

            assertTrue(result.cancelled());
            assertEquals(DocumentState.LINKED, document.state());
        }

        @Test
        void nextBuildResumes() {
            CancellationToken token = new CancellationToken();
            token.cancel();
            SourceDocument document = workspace.update(URI, "package P { class A; }");

            assertTrue(workspace.build(options(), token).cancelled());
            assertEquals(DocumentState.PARSED, document.state());

            events.clear();
            BuildResult result = workspace.build(options());
            assertFalse(result.cancelled());
            assertEquals(DocumentState.VALIDATED, document.state());
            assertEquals("model.kerml:CONSTRUCTED", events.get(0));
        }

        @Test
        void noneTokenCannotBeCancelled() {
            assertThrows(UnsupportedOperationException.class, CancellationToken.NONE::cancel);
            assertFalse(CancellationToken.NONE.isCancelled());
        }

        @Test
        void checkThrowsOnceCancelled() {
            CancellationToken token = new CancellationToken();
            token.checkCancelled();
            token.cancel();
            OperationCancelledException e = assertThrows(OperationCancelledException.class, token::checkCancelled);
            assertEquals("Operation cancelled", e.getMessage());
        }
    }
}
