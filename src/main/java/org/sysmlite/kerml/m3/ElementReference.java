package org.sysmlite.kerml.m3;

import org.sysmlite.kerml.dsl.ReferenceSyntax;

import java.util.List;
import java.util.Objects;

/**
 * A name reference from one element to another.
 *
 * A reference is either pending (a name plus the element it is written in),
 * resolved to an element handle, or failed with a message. Resolution only
 * happens through {@link #resolve()}; {@link #target()} never triggers it.
 */
public final class ElementReference {

    public enum State {
        PENDING,
        RESOLVING,
        RESOLVED,
        FAILED
    }

    private final ReferenceSyntax syntax;
    private final Element owner;
    private final ElementKind expectedKind;
    private Namespace scopeStart;
    private Element skip;
    private Element qualifier;
    private State state;
    private Element target;
    private List<Element> segments = List.of();
    private String error;
    private boolean readWhileResolving;

    private ElementReference(ReferenceSyntax syntax, Element owner, ElementKind expectedKind, Element target) {
        this.syntax = syntax;
        this.owner = owner;
        this.expectedKind = expectedKind;
        this.target = target;
        this.state = target != null ? State.RESOLVED : State.PENDING;
    }

    /**
     * @param syntax the name as written
     * @param owner the element the reference is written in
     * @param expectedKind the kind of element the reference must resolve to
     */
    public static ElementReference pending(ReferenceSyntax syntax, Element owner, ElementKind expectedKind) {
        Objects.requireNonNull(syntax, "Reference syntax cannot be null");
        Objects.requireNonNull(owner, "Reference owner cannot be null");
        return new ElementReference(syntax, owner, expectedKind, null);
    }

    /**
     * A reference that is resolved from the start, used for implied relationships.
     */
    public static ElementReference to(Element target) {
        Objects.requireNonNull(target, "Reference target cannot be null");
        return new ElementReference(null, null, target.kind(), target);
    }

    // ========================================
    // Resolution
    // ========================================

    /**
     * Resolves the reference if it is still pending.
     *
     * The model version is only bumped when the reference was read while it
     * was being resolved, since a value derived during that time misses the
     * target. The build bumps it after each phase otherwise.
     *
     * @return the target element, or null if resolution failed or is in progress
     */
    public Element resolve() {
        if (state == State.RESOLVING) {
            readWhileResolving = true;
            return null;
        }
        if (state != State.PENDING) {
            return target;
        }
        state = State.RESOLVING;
        readWhileResolving = false;
        try {
            owner.document().referenceResolver().resolve(this);
        } finally {
            if (state == State.RESOLVING) {
                state = State.FAILED;
                error = "Could not resolve reference to " + expectedKind.displayName()
                        + " named '" + syntax.text() + "'.";
            }
            if (readWhileResolving) {
                owner.document().modelVersion().bump();
            }
        }
        return target;
    }

    public void markResolved(Element element, List<Element> found) {
        this.target = element;
        this.segments = List.copyOf(found);
        this.error = null;
        this.state = State.RESOLVED;
    }

    public void markFailed(String message, List<Element> found) {
        this.target = null;
        this.segments = List.copyOf(found);
        this.error = message;
        this.state = State.FAILED;
    }

    /**
     * Puts a textual reference back into the pending state.
     */
    public void reset() {
        if (syntax != null) {
            state = State.PENDING;
            target = null;
            segments = List.of();
            error = null;
        }
    }

    // ========================================
    // Accessors
    // ========================================

    public Element target() {
        return target;
    }

    public State state() {
        return state;
    }

    public boolean isResolved() {
        return state == State.RESOLVED;
    }

    public boolean isFailed() {
        return state == State.FAILED;
    }

    public String error() {
        return error;
    }

    public ReferenceSyntax syntax() {
        return syntax;
    }

    public Element owner() {
        return owner;
    }

    public ElementKind expectedKind() {
        return expectedKind;
    }

    /**
     * @return elements found for each segment, the last one being the target
     */
    public List<Element> segments() {
        return segments;
    }

    public String text() {
        return syntax != null ? syntax.text() : (target != null ? target.qualifiedName() : "");
    }

    /**
     * Namespace whose scope is searched first. Defaults to the nearest
     * namespace enclosing the owner.
     */
    public Namespace scopeStart() {
        if (scopeStart != null) {
            return scopeStart;
        }
        return owner == null ? null : owner.nearestNamespace();
    }

    public ElementReference startingAt(Namespace namespace) {
        this.scopeStart = namespace;
        return this;
    }

    /**
     * @return element that must not be returned, e.g. the feature whose own
     *         redefinition is being resolved
     */
    public Element skip() {
        return skip;
    }

    public ElementReference skipping(Element element) {
        this.skip = element;
        return this;
    }

    /**
     * @return element whose type members are searched instead of the lexical
     *         scope, e.g. the source feature of a feature chain expression
     */
    public Element qualifier() {
        return qualifier;
    }

    public ElementReference qualifiedBy(Element element) {
        this.qualifier = element;
        return this;
    }

    @Override
    public String toString() {
        return text() + "[" + state + "]";
    }
}
