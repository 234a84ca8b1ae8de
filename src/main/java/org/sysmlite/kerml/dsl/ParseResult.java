package org.sysmlite.kerml.dsl;

import java.util.List;

/**
 * Output of parsing one document: the syntax tree (best effort if there were
 * errors), the syntax errors and the hidden-channel notes in source order.
 */
public record ParseResult(SyntaxNode root, List<SyntaxError> errors, List<Note> notes) {

    public ParseResult {
        errors = List.copyOf(errors);
        notes = List.copyOf(notes);
    }

    public boolean hasErrors() {
        return !errors.isEmpty();
    }
}
