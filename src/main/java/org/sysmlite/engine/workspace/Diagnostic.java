package org.sysmlite.engine.workspace;

import org.sysmlite.kerml.dsl.SyntaxError;
import org.sysmlite.kerml.dsl.TextRange;
import org.sysmlite.kerml.m3.Element;

import java.util.Objects;

/**
 * A problem reported against a document.
 *
 * @param severity How serious the problem is
 * @param message  Human-readable description
 * @param range    Source range, {@link TextRange#NONE} if unknown
 * @param code     Stable code, e.g. {@code linking-error} or a validation check name
 * @param element  The element the problem is about, or null
 */
public record Diagnostic(Severity severity, String message, TextRange range, String code, Element element) {

    public static final String PARSE_ERROR = "parse-error";
    public static final String LINKING_ERROR = "linking-error";
    public static final String MISSING_LIBRARY_ELEMENT = "missing-library-element";

    public Diagnostic {
        Objects.requireNonNull(severity, "Severity cannot be null");
        Objects.requireNonNull(message, "Message cannot be null");
        Objects.requireNonNull(code, "Code cannot be null");
        if (range == null) {
            range = TextRange.NONE;
        }
    }

    public static Diagnostic of(Severity severity, String code, String message, Element element) {
        TextRange range = element != null && element.syntax() != null ? element.syntax().range() : TextRange.NONE;
        return new Diagnostic(severity, message, range, code, element);
    }

    public static Diagnostic error(String code, String message, Element element) {
        return of(Severity.ERROR, code, message, element);
    }

    public static Diagnostic warning(String code, String message, Element element) {
        return of(Severity.WARNING, code, message, element);
    }

    public static Diagnostic fromSyntaxError(SyntaxError error) {
        return new Diagnostic(Severity.ERROR, error.message(), error.range(), PARSE_ERROR, null);
    }

    public boolean isError() {
        return severity == Severity.ERROR;
    }

    @Override
    public String toString() {
        return severity + " [" + code + "] " + message
                + (range.isKnown() ? " at " + range.startLine() + ":" + range.startColumn() : "");
    }
}
