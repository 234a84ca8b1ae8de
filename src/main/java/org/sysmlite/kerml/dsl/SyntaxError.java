package org.sysmlite.kerml.dsl;

/**
 * A syntax error reported while parsing a document.
 */
public record SyntaxError(String message, TextRange range) {

    public int line() {
        return range.startLine();
    }

    public int column() {
        return range.startColumn();
    }
}
