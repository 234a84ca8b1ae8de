package org.sysmlite.engine;

import org.sysmlite.engine.build.BuildOptions;
import org.sysmlite.engine.build.BuildResult;
import org.sysmlite.engine.build.StandardLibrary;
import org.sysmlite.engine.eval.EvaluationResult;
import org.sysmlite.engine.validation.ValidationChecks;
import org.sysmlite.engine.workspace.Diagnostic;
import org.sysmlite.engine.workspace.EngineConfig;
import org.sysmlite.engine.workspace.SourceDocument;
import org.sysmlite.engine.workspace.Workspace;
import org.sysmlite.kerml.m3.Element;
import org.sysmlite.kerml.m3.Feature;
import org.sysmlite.kerml.m3.Namespace;
import org.junit.jupiter.api.BeforeEach;

import java.util.List;
import java.util.Properties;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.junit.jupiter.api.Assertions.fail;

/**
 * Base class for tests that build models from text in a fresh workspace.
 */
public abstract class AbstractModelTest {

    protected static final String URI = "test:/model.kerml";

    protected Workspace workspace;

    @BeforeEach
    void createWorkspace() {
        workspace = new Workspace(EngineConfig.of(new Properties()));
    }

    /**
     * Options used by {@link #build(String)}; override to change them for a test class.
     */
    protected BuildOptions options() {
        return BuildOptions.defaults();
    }

    protected static BuildOptions withoutLibrary() {
        return BuildOptions.defaults()
                .withStandardLibrary(StandardLibrary.NONE)
                .withValidationChecks(ValidationChecks.NONE);
    }

    protected SourceDocument build(String text) {
        return build(URI, text);
    }

    protected SourceDocument build(String uri, String text) {
        SourceDocument document = workspace.update(uri, text);
        workspace.build(options());
        return document;
    }

    protected BuildResult buildAll(BuildOptions options) {
        return workspace.build(options);
    }

    // ========================================
    // Lookup
    // ========================================

    /**
     * Finds an element by a {@code ::}-separated path of owned member names.
     */
    protected static <T extends Element> T find(SourceDocument document, String path, Class<T> type) {
        Element current = document.root();
        for (String segment : path.split("::")) {
            if (!(current instanceof Namespace)) {
                fail("'" + segment + "' looked up in non-namespace " + current);
            }
            current = ((Namespace) current).findMember(segment);
            assertNotNull(current, "No member '" + segment + "' on path " + path);
        }
        assertTrue(type.isInstance(current), path + " is not a " + type.getSimpleName() + ": " + current);
        return type.cast(current);
    }

    protected static Element find(SourceDocument document, String path) {
        return find(document, path, Element.class);
    }

    // ========================================
    // Diagnostics
    // ========================================

    protected static List<Diagnostic> diagnostics(SourceDocument document, String code) {
        return document.diagnostics().stream()
                .filter(d -> d.code().equals(code))
                .collect(Collectors.toList());
    }

    protected static List<String> codes(SourceDocument document) {
        return document.diagnostics().stream().map(Diagnostic::code).collect(Collectors.toList());
    }

    protected static void assertNoErrors(SourceDocument document) {
        List<Diagnostic> errors = document.diagnostics().stream().filter(Diagnostic::isError).toList();
        assertTrue(errors.isEmpty(), "Unexpected errors: " + errors);
    }

    // ========================================
    // Evaluation
    // ========================================

    /**
     * Evaluates the value of the feature at {@code path} against its owning type.
     */
    protected EvaluationResult evaluate(SourceDocument document, String path) {
        Feature feature = find(document, path, Feature.class);
        assertNotNull(feature.value(), path + " has no value");
        Element target = feature.owningType() != null ? feature.owningType() : feature;
        return workspace.evaluator().evaluate(feature.value(), target);
    }

    /**
     * Builds {@code package P { feature x = <expression>; }} and evaluates x.
     */
    protected EvaluationResult evaluate(String expression) {
        SourceDocument document = build("package P { feature x = " + expression + "; }");
        return evaluate(document, "P::x");
    }

    protected List<Object> values(String expression) {
        EvaluationResult result = evaluate(expression);
        if (result.isError()) {
            fail("Evaluation of '" + expression + "' failed: " + result.error().message());
        }
        return result.values();
    }

    protected String error(String expression) {
        EvaluationResult result = evaluate(expression);
        assertTrue(result.isError(), "Expected '" + expression + "' to fail but got " + result.values());
        return result.error().message();
    }
}
