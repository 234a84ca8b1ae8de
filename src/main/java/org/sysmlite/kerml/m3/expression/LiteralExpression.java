package org.sysmlite.kerml.m3.expression;

import org.sysmlite.kerml.m3.ElementKind;
import org.sysmlite.kerml.m3.Expression;
import org.sysmlite.kerml.m3.ModelDocument;

/**
 * A literal value: {@link Boolean}, {@link Long}, {@link Double},
 * {@link String} or {@link Infinity#INSTANCE}.
 */
public class LiteralExpression extends Expression {

    private final Object value;

    public LiteralExpression(ElementKind kind, ModelDocument document, Object value) {
        super(kind, document);
        if (!kind.isKind(ElementKind.LITERAL_EXPRESSION)) {
            throw new IllegalArgumentException("Not a literal kind: " + kind);
        }
        this.value = value;
    }

    public Object value() {
        return value;
    }

    public static LiteralExpression ofBoolean(ModelDocument document, boolean value) {
        return new LiteralExpression(ElementKind.LITERAL_BOOLEAN, document, value);
    }

    public static LiteralExpression ofInteger(ModelDocument document, long value) {
        return new LiteralExpression(ElementKind.LITERAL_INTEGER, document, value);
    }

    public static LiteralExpression ofRational(ModelDocument document, double value) {
        return new LiteralExpression(ElementKind.LITERAL_RATIONAL, document, value);
    }

    public static LiteralExpression ofString(ModelDocument document, String value) {
        return new LiteralExpression(ElementKind.LITERAL_STRING, document, value);
    }

    public static LiteralExpression infinity(ModelDocument document) {
        return new LiteralExpression(ElementKind.LITERAL_INFINITY, document, Infinity.INSTANCE);
    }

    @Override
    public String toString() {
        return kind().displayName() + "#" + id() + "(" + value + ")";
    }
}
