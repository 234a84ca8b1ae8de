package org.sysmlite.kerml.dsl;

/**
 * Source span of a syntax node or token.
 *
 * Lines are 1-based, columns are 0-based (as reported by ANTLR), offsets are
 * 0-based character indices with an exclusive end.
 */
public record TextRange(int startLine, int startColumn, int endLine, int endColumn,
        int startOffset, int endOffset) {

    public static final TextRange NONE = new TextRange(0, 0, 0, 0, -1, -1);

    public boolean isKnown() {
        return startOffset >= 0;
    }

    public boolean contains(TextRange other) {
        return isKnown() && other.isKnown()
                && startOffset <= other.startOffset && other.endOffset <= endOffset;
    }

    /**
     * @return true if this range ends before {@code other} starts
     */
    public boolean isBefore(TextRange other) {
        return endOffset <= other.startOffset;
    }

    @Override
    public String toString() {
        return startLine + ":" + startColumn + "-" + endLine + ":" + endColumn;
    }
}
