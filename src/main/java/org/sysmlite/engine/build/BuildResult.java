package org.sysmlite.engine.build;

import org.sysmlite.engine.workspace.Diagnostic;
import org.sysmlite.engine.workspace.SourceDocument;

import java.util.ArrayList;
import java.util.List;

/**
 * Outcome of {@link DocumentBuilder#build}.
 *
 * @param documents The documents of the batch, library documents excluded
 * @param cancelled True if the build stopped at a cancellation check
 */
public record BuildResult(List<SourceDocument> documents, boolean cancelled) {

    public BuildResult {
        documents = List.copyOf(documents);
    }

    /**
     * @return diagnostics of all documents in the batch
     */
    public List<Diagnostic> diagnostics() {
        List<Diagnostic> all = new ArrayList<>();
        for (SourceDocument document : documents) {
            all.addAll(document.diagnostics());
        }
        return all;
    }

    public List<Diagnostic> errors() {
        return diagnostics().stream().filter(Diagnostic::isError).toList();
    }

    public boolean hasErrors() {
        return !errors().isEmpty();
    }
}
