package org.sysmlite.engine.build;

import org.sysmlite.engine.AbstractModelTest;
import org.sysmlite.engine.workspace.SourceDocument;
import org.sysmlite.kerml.m3.AttachedNote;
import org.sysmlite.kerml.m3.Element;
import org.sysmlite.kerml.m3.Placement;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class NoteAttacherTest extends AbstractModelTest {

    private static final String MODEL = """
            // file note

            package P {
                // leads A
                class A; // trails A

                class B {
                    // inside B

                }
            }
            """;

    @Override
    protected BuildOptions options() {
        return withoutLibrary();
    }

    private static List<String> notes(Element element, Placement placement) {
        return element.notes().stream()
                .filter(n -> n.placement() == placement)
                .map(AttachedNote::text)
                .toList();
    }

    @Test
    void attachesLeadingAndTrailingNotes() {
        SourceDocument document = build(MODEL);
        Element a = find(document, "P::A");
        assertEquals(List.of("leads A"), notes(a, Placement.LEADING));
        assertEquals(List.of("trails A"), notes(a, Placement.TRAILING));
    }

    @Test
    void attachesInnerNotesToTheInnermostElement() {
        SourceDocument document = build(MODEL);
        assertEquals(List.of("inside B"), notes(find(document, "P::B"), Placement.INNER));
        assertEquals(List.of(), find(document, "P").notes());
    }

    @Test
    void looseNotesGoToTheRoot() {
        SourceDocument document = build(MODEL);
        assertEquals(List.of("file note"), notes(document.root(), Placement.INNER));
        assertTrue(document.notesAttached());
    }

    @Test
    void blockNotes() {
        SourceDocument document = build("""
                package Q {
                    //* describes
                        C */
                    class C;
                }
                """);
        AttachedNote note = find(document, "Q::C").notes().get(0);
        assertEquals(Placement.LEADING, note.placement());
        assertTrue(note.note().block());
        assertTrue(note.text().startsWith("describes"));
    }

    @Test
    void attachingTwiceHasNoEffect() {
        SourceDocument document = build(MODEL);
        NoteAttacher.attach(document);
        assertEquals(2, find(document, "P::A").notes().size());
    }

    @Test
    void rebuildReattachesOnce() {
        SourceDocument document = build(MODEL);
        document.invalidate();
        buildAll(options());
        assertEquals(2, find(document, "P::A").notes().size());
        assertEquals(1, document.root().notes().size());
    }
}
