package org.sysmlite.kerml.dsl.antlr;

import org.antlr.v4.runtime.BaseErrorListener;
import org.antlr.v4.runtime.CharStreams;
import org.antlr.v4.runtime.CommonTokenStream;
import org.antlr.v4.runtime.RecognitionException;
import org.antlr.v4.runtime.Recognizer;
import org.antlr.v4.runtime.Token;
import org.sysmlite.kerml.dsl.KerMLParseException;
import org.sysmlite.kerml.dsl.Note;
import org.sysmlite.kerml.dsl.ParseResult;
import org.sysmlite.kerml.dsl.SyntaxError;
import org.sysmlite.kerml.dsl.SyntaxKind;
import org.sysmlite.kerml.dsl.SyntaxNode;
import org.sysmlite.kerml.dsl.TextRange;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * ANTLR-based KerML/SysML parser using the KerMLLexer/KerMLParser generated
 * from KerML.g4.
 *
 * {@link #parse(String)} never throws on bad input: syntax errors are collected
 * into the {@link ParseResult} together with a best-effort tree, so that a
 * document with errors can still be built and linked.
 */
public final class KerMLParserAdapter {

    private static final Logger LOG = LoggerFactory.getLogger(KerMLParserAdapter.class);

    private KerMLParserAdapter() {
        // Static utility class
    }

    /**
     * Parses a document, collecting syntax errors and notes.
     *
     * @param text The document text
     * @return The syntax tree, errors and notes
     */
    public static ParseResult parse(String text) {
        List<SyntaxError> errors = new ArrayList<>();
        CollectingErrorListener listener = new CollectingErrorListener(errors);

        KerMLLexer lexer = new KerMLLexer(CharStreams.fromString(text));
        lexer.removeErrorListeners();
        lexer.addErrorListener(listener);

        CommonTokenStream tokens = new CommonTokenStream(lexer);
        KerMLParser parser = new KerMLParser(tokens);
        parser.removeErrorListeners();
        parser.addErrorListener(listener);

        KerMLParser.RootContext tree = parser.root();
        SyntaxNode root;
        try {
            root = new SyntaxTreeBuilder().visitRoot(tree);
        } catch (RuntimeException e) {
            // Error recovery may leave contexts the builder cannot read
            LOG.warn("Could not build syntax tree after {} syntax error(s): {}", errors.size(), e.toString());
            if (errors.isEmpty()) {
                errors.add(new SyntaxError("Malformed input: " + e.getMessage(), TextRange.NONE));
            }
            root = new SyntaxNode(SyntaxKind.ROOT, SyntaxTreeBuilder.rangeOf(tree));
        }
        return new ParseResult(root, errors, collectNotes(tokens));
    }

    /**
     * Parses a document and fails on the first syntax error.
     *
     * @throws KerMLParseException if the text is not well formed
     */
    public static SyntaxNode parseStrict(String text) {
        ParseResult result = parse(text);
        if (result.hasErrors()) {
            SyntaxError first = result.errors().get(0);
            throw new KerMLParseException(first.message(), first.line(), first.column());
        }
        return result.root();
    }

    private static List<Note> collectNotes(CommonTokenStream tokens) {
        tokens.fill();
        List<Note> notes = new ArrayList<>();
        for (Token token : tokens.getTokens()) {
            if (token.getChannel() == Token.HIDDEN_CHANNEL) {
                notes.add(Note.fromToken(token.getText(), SyntaxTreeBuilder.rangeOf(token, token)));
            }
        }
        return notes;
    }

    /**
     * Error listener that records ANTLR errors instead of throwing.
     */
    private static class CollectingErrorListener extends BaseErrorListener {
        private final List<SyntaxError> errors;

        CollectingErrorListener(List<SyntaxError> errors) {
            this.errors = errors;
        }

        @Override
        public void syntaxError(Recognizer<?, ?> recognizer, Object offendingSymbol,
                int line, int charPositionInLine, String msg,
                RecognitionException e) {
            TextRange range;
            if (offendingSymbol instanceof Token token && token.getType() != Token.EOF) {
                range = SyntaxTreeBuilder.rangeOf(token, token);
            } else {
                range = new TextRange(line, charPositionInLine, line, charPositionInLine, -1, -1);
            }
            errors.add(new SyntaxError(msg, range));
        }
    }
}
