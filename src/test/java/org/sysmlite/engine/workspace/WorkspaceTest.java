package org.sysmlite.engine.workspace;

import org.sysmlite.engine.AbstractModelTest;
import org.sysmlite.engine.build.BuildOptions;
import org.sysmlite.engine.build.StandardLibrary;
import org.sysmlite.kerml.m3.Type;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.Properties;

import static org.junit.jupiter.api.Assertions.*;

class WorkspaceTest extends AbstractModelTest {

    private static final String A = "test:/a.kerml";
    private static final String B = "test:/b.kerml";

    @Override
    protected BuildOptions options() {
        return withoutLibrary();
    }

    @Test
    void buildsSysmlDocumentAgainstBundledLibrary() {
        SourceDocument document = workspace.update(A, """
                package Vehicles {
                    part def Engine;
                    part def Car {
                        part engine : Engine;
                    }
                    part car : Car;
                }
                """);

        workspace.build(BuildOptions.defaults());

        assertEquals(DocumentState.VALIDATED, document.state());
        assertNoErrors(document);
        Type car = find(document, "Vehicles::Car", Type.class);
        assertTrue(car.conforms("Parts::Part"));
        assertTrue(find(document, "Vehicles::car", Type.class).conforms("Vehicles::Car"));
    }

    @Nested
    @DisplayName("Document updates")
    class UpdateTests {

        @Test
        void sameTextKeepsDocumentBuilt() {
            SourceDocument first = build(A, "package A { class X; }");
            SourceDocument second = workspace.update(A, "package A { class X; }");
            assertSame(first, second);
            assertEquals(DocumentState.VALIDATED, second.state());
        }

        @Test
        void changedTextInvalidatesDependents() {
            build(A, "package A { class X; }");
            SourceDocument b = build(B, "package B { class Y specializes A::X; }");
            assertEquals(DocumentState.VALIDATED, b.state());

            SourceDocument a = workspace.update(A, "package A { class X; class Z; }");
            assertEquals(DocumentState.CHANGED, a.state());
            assertTrue(a.isTextChanged());
            assertEquals(DocumentState.CHANGED, b.state());
            assertFalse(b.isTextChanged());

            workspace.build(options());
            assertNoErrors(b);
            Type x = find(a, "A::X", Type.class);
            assertSame(x, find(b, "B::Y", Type.class).directSupertypes().get(0));
        }

        @Test
        void unrelatedDocumentsStayBuilt() {
            build(A, "package A { class X; }");
            SourceDocument b = build(B, "package B { class Y; }");
            workspace.update(A, "package A { class X2; }");
            assertEquals(DocumentState.VALIDATED, b.state());
        }

        @Test
        void newDocumentRelinksFailedReferences() {
            SourceDocument b = build(B, "package B { class Y specializes A::X; }");
            assertEquals(1, diagnostics(b, Diagnostic.LINKING_ERROR).size());

            workspace.update(A, "package A { class X; }");
            assertEquals(DocumentState.CHANGED, b.state());

            workspace.build(options());
            assertNoErrors(b);
            assertTrue(b.dependencies().contains(A));
        }

        @Test
        void removeInvalidatesDependents() {
            build(A, "package A { class X; }");
            SourceDocument b = build(B, "package B { class Y specializes A::X; }");

            assertTrue(workspace.remove(A));
            assertFalse(workspace.remove(A));
            assertNull(workspace.document(A));
            assertEquals(DocumentState.CHANGED, b.state());

            workspace.build(options());
            assertEquals(1, diagnostics(b, Diagnostic.LINKING_ERROR).size());
            assertFalse(workspace.globalScope().contains("A"));
        }
    }

    @Nested
    @DisplayName("Standard library")
    class LibraryTests {

        @Test
        void loadsBundledLibrary() {
            workspace.update(A, "package A { class X; }");
            workspace.build(BuildOptions.defaults());

            assertFalse(workspace.libraryDocuments().isEmpty());
            SourceDocument base = workspace.document("library:/Base.kerml");
            assertNotNull(base);
            assertTrue(base.isStandardLibrary());
            assertEquals(DocumentState.VALIDATED, base.state());
            assertEquals(1, workspace.documents().size());
            assertTrue(workspace.globalScope().contains("Base"));
        }

        @Test
        void switchingLibraryRebuildsDocuments() {
            SourceDocument a = workspace.update(A, "package A { class X; }");
            workspace.build(BuildOptions.defaults());
            assertFalse(workspace.libraryDocuments().isEmpty());

            workspace.build(withoutLibrary());
            assertTrue(workspace.libraryDocuments().isEmpty());
            assertNull(workspace.document("library:/Base.kerml"));
            assertFalse(workspace.globalScope().contains("Base"));
            assertEquals(DocumentState.VALIDATED, a.state());
            assertEquals(withoutLibrary(), a.options());
        }

        @Test
        void buildWithoutOptionsUsesConfiguration() {
            Properties properties = new Properties();
            properties.setProperty(EngineConfig.LIBRARY, "none");
            properties.setProperty(EngineConfig.VALIDATION_CHECKS, "none");
            Workspace configured = new Workspace(EngineConfig.of(properties));
            SourceDocument a = configured.update(A, "package A { class X; }");

            configured.build();

            assertTrue(configured.libraryDocuments().isEmpty());
            assertEquals(StandardLibrary.NONE, a.options().standardLibrary());
            assertTrue(a.options().validationChecks().isNone());
        }
    }
}
