package org.sysmlite.kerml.dsl;

/**
 * Exception thrown when strict parsing of KerML/SysML text fails.
 * Includes optional source location information for IDE integration.
 */
public class KerMLParseException extends RuntimeException {

    private final int line;
    private final int column;

    public KerMLParseException(String message) {
        super(message);
        this.line = -1;
        this.column = -1;
    }

    public KerMLParseException(String message, int line, int column) {
        super("line " + line + ":" + column + " " + message);
        this.line = line;
        this.column = column;
    }

    public KerMLParseException(String message, Throwable cause) {
        super(message, cause);
        this.line = -1;
        this.column = -1;
    }

    public int getLine() {
        return line;
    }

    public int getColumn() {
        return column;
    }

    public boolean hasLocation() {
        return line >= 0 && column >= 0;
    }
}
