package org.sysmlite.kerml.m3;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * A comment element ({@code comment about X /* ... *}{@code /}). Without
 * {@code about} references it annotates its owning namespace.
 */
public class Comment extends Element {

    private final List<ElementReference> about = new ArrayList<>();
    private String body = "";
    private String locale;

    public Comment(ElementKind kind, ModelDocument document) {
        super(kind, document);
    }

    public String body() {
        return body;
    }

    public void setBody(String body) {
        this.body = body;
    }

    public String locale() {
        return locale;
    }

    public void setLocale(String locale) {
        this.locale = locale;
    }

    public List<ElementReference> about() {
        return Collections.unmodifiableList(about);
    }

    public void addAbout(ElementReference reference) {
        about.add(reference);
    }

    /**
     * @return the resolved annotated elements, or the owner if there are no {@code about} references
     */
    public List<Element> annotatedElements() {
        if (about.isEmpty()) {
            Element owner = owner();
            return owner == null ? List.of() : List.of(owner);
        }
        List<Element> result = new ArrayList<>();
        for (ElementReference reference : about) {
            Element target = reference.target();
            if (target != null) {
                result.add(target);
            }
        }
        return result;
    }

    @Override
    public List<ElementReference> references() {
        return Collections.unmodifiableList(about);
    }
}
