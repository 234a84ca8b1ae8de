package org.sysmlite.engine.build;

import org.sysmlite.engine.workspace.SourceDocument;
import org.sysmlite.kerml.dsl.Note;
import org.sysmlite.kerml.dsl.TextRange;
import org.sysmlite.kerml.m3.AttachedNote;
import org.sysmlite.kerml.m3.Element;
import org.sysmlite.kerml.m3.Membership;
import org.sysmlite.kerml.m3.Placement;

import java.util.ArrayList;
import java.util.List;

/**
 * Attaches the free-floating notes of a document to model elements.
 *
 * A note following an element on the line where it ends trails it. Otherwise
 * a note ending on the line where an element starts, or on the line before
 * it, leads that element. Any other note is inner to the innermost element containing
 * it, or to the root namespace.
 */
public final class NoteAttacher {

    private NoteAttacher() {
        // Static utility class
    }

    /**
     * Attaches notes once per build; does nothing if the document's notes are
     * attached already.
     */
    public static void attach(SourceDocument document) {
        if (document.notesAttached() || document.root() == null || document.parseResult() == null) {
            return;
        }
        List<Element> elements = new ArrayList<>();
        for (Element element : document.root().descendants()) {
            if (!(element instanceof Membership) && element.range().isKnown()) {
                elements.add(element);
            }
        }
        for (Note note : document.parseResult().notes()) {
            attach(note, elements, document.root());
        }
        document.setNotesAttached(true);
    }

    private static void attach(Note note, List<Element> elements, Element root) {
        TextRange range = note.range();
        Element leading = null;
        Element trailing = null;
        Element inner = null;
        // elements are in pre-order, so the first match is the outermost one
        for (Element element : elements) {
            TextRange target = element.range();
            if (leading == null && range.isBefore(target)
                    && (target.startLine() == range.endLine() || target.startLine() == range.endLine() + 1)) {
                leading = element;
            }
            if (trailing == null && target.isBefore(range) && target.endLine() == range.startLine()) {
                trailing = element;
            }
            if (target.contains(range) && (inner == null || inner.range().contains(target))) {
                inner = element;
            }
        }
        if (trailing != null && (inner == null || trailing.isOwnedBy(inner))) {
            trailing.attachNote(new AttachedNote(note, Placement.TRAILING));
        } else if (leading != null && (inner == null || leading.isOwnedBy(inner))) {
            leading.attachNote(new AttachedNote(note, Placement.LEADING));
        } else {
            (inner != null ? inner : root).attachNote(new AttachedNote(note, Placement.INNER));
        }
    }
}
