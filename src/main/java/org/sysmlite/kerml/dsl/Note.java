package org.sysmlite.kerml.dsl;

/**
 * A free-floating note from the hidden token channel: either a line note
 * ({@code // text}) or a block note ({@code //* text *}{@code /}).
 */
public record Note(String text, TextRange range, boolean block) {

    public static Note fromToken(String raw, TextRange range) {
        if (raw.startsWith("//*")) {
            String body = raw.substring(3, Math.max(3, raw.length() - 2));
            return new Note(body.strip(), range, true);
        }
        return new Note(raw.substring(2).strip(), range, false);
    }
}
