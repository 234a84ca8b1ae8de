package org.sysmlite.kerml.m3;

import org.sysmlite.kerml.dsl.SyntaxNode;
import org.sysmlite.kerml.dsl.TextRange;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Base class of every model element.
 *
 * An element has a workspace-unique id, an optional name and short name, a
 * declared visibility and owned children grouped by {@link ChildRole}.
 * Ownership forms a tree: each element has at most one parent.
 *
 * {@link #parent()} is the direct owner (often a {@link Membership});
 * {@link #owner()} skips memberships and returns the owning element proper.
 */
public class Element {

    private final long id;
    private final ElementKind kind;
    private final ModelDocument document;
    private final Map<ChildRole, List<Element>> children = new EnumMap<>(ChildRole.class);
    private final List<AttachedNote> notes = new ArrayList<>();
    private String name;
    private String shortName;
    private Visibility declaredVisibility;
    private Element parent;
    private ChildRole role;
    private SyntaxNode syntax;

    public Element(ElementKind kind, ModelDocument document) {
        this.kind = Objects.requireNonNull(kind, "Element kind cannot be null");
        this.document = Objects.requireNonNull(document, "Element document cannot be null");
        this.id = document.idAllocator().next();
    }

    public long id() {
        return id;
    }

    public ElementKind kind() {
        return kind;
    }

    public boolean isKind(ElementKind other) {
        return kind.isKind(other);
    }

    public boolean isAny(ElementKind... kinds) {
        return kind.isAny(kinds);
    }

    public ModelDocument document() {
        return document;
    }

    protected ModelVersion version() {
        return document.modelVersion();
    }

    public boolean isStandardLibrary() {
        return document.isStandardLibrary();
    }

    // ========================================
    // Naming
    // ========================================

    public String name() {
        return name;
    }

    public void setName(String name) {
        this.name = name;
    }

    public String shortName() {
        return shortName;
    }

    public void setShortName(String shortName) {
        this.shortName = shortName;
    }

    /**
     * @return the name used for lookup and qualified names; subclasses may
     *         derive one for unnamed elements
     */
    public String effectiveName() {
        return name;
    }

    /**
     * @return the {@code ::}-separated path of effective names from the
     *         document root, or null if this element or one of its owners is unnamed
     */
    public String qualifiedName() {
        String own = effectiveName();
        if (own == null) {
            return null;
        }
        Element owner = owner();
        if (owner == null || owner.owner() == null) {
            // owned by the document root namespace
            return quoteIfNeeded(own);
        }
        String ownerName = owner.qualifiedName();
        return ownerName == null ? null : ownerName + "::" + quoteIfNeeded(own);
    }

    private static String quoteIfNeeded(String name) {
        if (name.isEmpty()) {
            return "''";
        }
        boolean plain = Character.isLetter(name.charAt(0)) || name.charAt(0) == '_';
        for (int i = 1; plain && i < name.length(); i++) {
            char c = name.charAt(i);
            plain = Character.isLetterOrDigit(c) || c == '_';
        }
        return plain ? name : "'" + name.replace("'", "\\'") + "'";
    }

    public Visibility declaredVisibility() {
        return declaredVisibility;
    }

    public void setDeclaredVisibility(Visibility visibility) {
        this.declaredVisibility = visibility;
    }

    /**
     * @return declared visibility, public by default
     */
    public Visibility visibility() {
        return declaredVisibility != null ? declaredVisibility : Visibility.PUBLIC;
    }

    // ========================================
    // Ownership
    // ========================================

    public Element parent() {
        return parent;
    }

    public ChildRole role() {
        return role;
    }

    /**
     * @return the owning element, skipping an owning membership
     */
    public Element owner() {
        if (parent instanceof Membership) {
            return parent.parent;
        }
        return parent;
    }

    /**
     * @return the membership owning this element, if any
     */
    public Membership owningMembership() {
        return parent instanceof Membership membership ? membership : null;
    }

    /**
     * @return the nearest namespace owning this element, or this element if
     *         it is a namespace
     */
    public Namespace nearestNamespace() {
        for (Element e = this; e != null; e = e.parent) {
            if (e instanceof Namespace namespace) {
                return namespace;
            }
        }
        return null;
    }

    /**
     * @return the root of the ownership tree this element belongs to
     */
    public Element root() {
        Element e = this;
        while (e.parent != null) {
            e = e.parent;
        }
        return e;
    }

    /**
     * @return true if {@code other} is this element or one of its (transitive) owners
     */
    public boolean isOwnedBy(Element other) {
        for (Element e = this; e != null; e = e.parent) {
            if (e == other) {
                return true;
            }
        }
        return false;
    }

    /**
     * Adds {@code child} under {@code childRole}.
     *
     * @throws IllegalStateException if the child already has another owner or
     *         if the edge would close an ownership cycle
     */
    public <T extends Element> T addChild(ChildRole childRole, T child) {
        Objects.requireNonNull(child, "Child cannot be null");
        if (((Element) child).parent == this && ((Element) child).role == childRole) {
            return child;
        }
        if (((Element) child).parent != null) {
            throw new IllegalStateException("Element " + child + " is already owned by " + ((Element) child).parent);
        }
        if (isOwnedBy(child)) {
            throw new IllegalStateException("Adding " + child + " to " + this + " would create an ownership cycle");
        }
        children.computeIfAbsent(childRole, k -> new ArrayList<>()).add(child);
        ((Element) child).parent = this;
        ((Element) child).role = childRole;
        version().bump();
        return child;
    }

    /**
     * Detaches {@code child}; used when a rebuild drops implied elements.
     */
    public void removeChild(Element child) {
        if (child.parent != this) {
            return;
        }
        List<Element> list = children.get(child.role);
        if (list != null) {
            list.remove(child);
        }
        child.parent = null;
        child.role = null;
        version().bump();
    }

    public List<Element> children(ChildRole childRole) {
        List<Element> list = children.get(childRole);
        return list == null ? List.of() : Collections.unmodifiableList(list);
    }

    @SuppressWarnings("unchecked")
    protected <T extends Element> List<T> children(ChildRole childRole, Class<T> type) {
        List<T> result = new ArrayList<>();
        for (Element child : children(childRole)) {
            if (type.isInstance(child)) {
                result.add((T) child);
            }
        }
        return result;
    }

    /**
     * @return all owned children, role by role in {@link ChildRole} order
     */
    public List<Element> ownedElements() {
        List<Element> all = new ArrayList<>();
        children.values().forEach(all::addAll);
        return all;
    }

    /**
     * @return all transitively owned elements in pre-order, excluding this one
     */
    public List<Element> descendants() {
        List<Element> result = new ArrayList<>();
        collectDescendants(result);
        return result;
    }

    private void collectDescendants(List<Element> result) {
        for (List<Element> list : children.values()) {
            for (Element child : list) {
                result.add(child);
                child.collectDescendants(result);
            }
        }
    }

    // ========================================
    // Notes and syntax
    // ========================================

    public List<AttachedNote> notes() {
        return Collections.unmodifiableList(notes);
    }

    public void attachNote(AttachedNote note) {
        notes.add(note);
    }

    public SyntaxNode syntax() {
        return syntax;
    }

    /**
     * @return source range of the syntax node, {@link TextRange#NONE} for
     *         elements without one
     */
    public TextRange range() {
        return syntax != null ? syntax.range() : TextRange.NONE;
    }

    public void setSyntax(SyntaxNode syntax) {
        this.syntax = syntax;
    }

    /**
     * Clears derived state before a rebuild. Identity, name and ownership
     * are kept.
     */
    public void reset() {
        notes.clear();
        for (ElementReference reference : references()) {
            reference.reset();
        }
    }

    /**
     * @return textual references written in this element, resolved by the linker
     */
    public List<ElementReference> references() {
        return List.of();
    }

    @Override
    public String toString() {
        String qualified = qualifiedName();
        return kind.displayName() + "#" + id + (qualified != null ? "(" + qualified + ")" : "");
    }
}
