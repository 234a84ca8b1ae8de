package org.sysmlite.kerml.dsl;

import org.sysmlite.kerml.m3.Element;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * A node of the concrete syntax tree.
 *
 * Nodes carry a type tag, ordered children, a source range and a few typed
 * property bags filled by the parser:
 * - attributes: single string values (names, keywords, operators, literal text)
 * - flags: boolean modifiers present in source (abstract, end, in, ...)
 * - references: named reference slots (e.g. "target", "function")
 *
 * A metamodel element is attached to each node once it has been built.
 */
public final class SyntaxNode {

    private final SyntaxKind kind;
    private final TextRange range;
    private final List<SyntaxNode> children = new ArrayList<>();
    private final Map<String, String> attributes = new LinkedHashMap<>();
    private final Set<String> flags = new LinkedHashSet<>();
    private final Map<String, List<ReferenceSyntax>> references = new LinkedHashMap<>();
    private SyntaxNode parent;
    private Element meta;

    public SyntaxNode(SyntaxKind kind, TextRange range) {
        this.kind = kind;
        this.range = range;
    }

    public SyntaxKind kind() {
        return kind;
    }

    public TextRange range() {
        return range;
    }

    public SyntaxNode parent() {
        return parent;
    }

    public List<SyntaxNode> children() {
        return Collections.unmodifiableList(children);
    }

    public List<SyntaxNode> children(SyntaxKind childKind) {
        return children.stream().filter(c -> c.kind == childKind).toList();
    }

    public Optional<SyntaxNode> child(SyntaxKind childKind) {
        return children.stream().filter(c -> c.kind == childKind).findFirst();
    }

    public SyntaxNode addChild(SyntaxNode child) {
        if (child != null) {
            child.parent = this;
            children.add(child);
        }
        return this;
    }

    // ========================================
    // Properties
    // ========================================

    public SyntaxNode attribute(String key, String value) {
        if (value != null) {
            attributes.put(key, value);
        }
        return this;
    }

    public String attribute(String key) {
        return attributes.get(key);
    }

    public SyntaxNode flag(String flag) {
        flags.add(flag);
        return this;
    }

    public boolean hasFlag(String flag) {
        return flags.contains(flag);
    }

    public Set<String> flags() {
        return Collections.unmodifiableSet(flags);
    }

    public SyntaxNode reference(String slot, ReferenceSyntax reference) {
        if (reference != null) {
            references.computeIfAbsent(slot, k -> new ArrayList<>()).add(reference);
        }
        return this;
    }

    public List<ReferenceSyntax> references(String slot) {
        return references.getOrDefault(slot, List.of());
    }

    public Optional<ReferenceSyntax> firstReference(String slot) {
        List<ReferenceSyntax> refs = references(slot);
        return refs.isEmpty() ? Optional.empty() : Optional.of(refs.get(0));
    }

    // ========================================
    // Metamodel attachment
    // ========================================

    public Element meta() {
        return meta;
    }

    /**
     * Attaches the metamodel element built for this node. A node can only ever
     * be attached to one element.
     */
    public void attach(Element element) {
        if (meta != null && meta != element) {
            throw new IllegalStateException("Syntax node " + kind + " at " + range + " is already attached");
        }
        this.meta = element;
    }

    @Override
    public String toString() {
        return String.valueOf(kind) + attributes + (flags.isEmpty() ? "" : flags.toString()) + "@" + range;
    }
}
