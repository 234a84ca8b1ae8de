package org.sysmlite.kerml.dsl;

import java.util.List;

/**
 * A name reference as written in source.
 *
 * A qualified reference {@code A::B::C} has segments {@code [A, B, C]}. A chain
 * reference {@code a.b.c} is a list of qualified references navigated through
 * feature types: {@code chain} holds each dot-separated part.
 */
public record ReferenceSyntax(List<List<String>> chain, TextRange range) {

    public ReferenceSyntax {
        if (chain.isEmpty()) {
            throw new IllegalArgumentException("Reference must have at least one segment");
        }
        chain = List.copyOf(chain.stream().map(List::copyOf).toList());
    }

    public static ReferenceSyntax qualified(List<String> segments, TextRange range) {
        return new ReferenceSyntax(List.of(segments), range);
    }

    public boolean isChain() {
        return chain.size() > 1;
    }

    /**
     * @return segments of the first (or only) qualified part
     */
    public List<String> segments() {
        return chain.get(0);
    }

    /**
     * @return the last simple name of the reference
     */
    public String lastName() {
        List<String> last = chain.get(chain.size() - 1);
        return last.get(last.size() - 1);
    }

    public String text() {
        StringBuilder sb = new StringBuilder();
        for (int i = 0; i < chain.size(); i++) {
            if (i > 0) {
                sb.append('.');
            }
            sb.append(String.join("::", chain.get(i)));
        }
        return sb.toString();
    }

    @Override
    public String toString() {
        return text();
    }
}
