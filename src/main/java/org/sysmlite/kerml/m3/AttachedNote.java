package org.sysmlite.kerml.m3;

import org.sysmlite.kerml.dsl.Note;

/**
 * A hidden-channel note attached to an element.
 */
public record AttachedNote(Note note, Placement placement) {

    public String text() {
        return note.text();
    }
}
