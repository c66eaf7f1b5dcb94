package com.rusttrace.adapter.static_analysis;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Node of the traced item tree built while walking a source file.
 *
 * A node is mutable only while it sits on the traversal stack. Once it has been folded into its
 * parent's children it is not touched again.
 */
public class TraceableNode {

    private final String name;
    private final NodeKind kind;
    private final FileReference location;
    private final List<TraceableNode> children = new ArrayList<>();
    private final List<String> refs = new ArrayList<>();
    private final List<String> justifications = new ArrayList<>();
    private final ContextData contextData;

    public TraceableNode(String name, NodeKind kind, FileReference location) {
        this(name, kind, location, null);
    }

    public TraceableNode(String name, NodeKind kind, FileReference location, ContextData contextData) {
        this.name = name;
        this.kind = kind;
        this.location = location;
        this.contextData = contextData;
    }

    public String getName()                  { return name; }
    public NodeKind getKind()                { return kind; }
    public FileReference getLocation()       { return location; }
    public List<TraceableNode> getChildren() { return Collections.unmodifiableList(children); }
    public List<String> getRefs()            { return Collections.unmodifiableList(refs); }
    public List<String> getJustifications()  { return Collections.unmodifiableList(justifications); }
    public ContextData getContextData()      { return contextData; }

    public void appendChild(TraceableNode child) {
        children.add(child);
    }

    public void addRef(String ref) {
        refs.add(ref);
    }

    public void addJustification(String justification) {
        justifications.add(justification);
    }

    /** Namespace this node contributes to enclosed items, {@link NamespaceContext#EMPTY} if none. */
    public NamespaceContext namespace() {
        return contextData != null ? contextData.namespace() : NamespaceContext.EMPTY;
    }

    @Override
    public String toString() {
        return "Node " + kind.displayName() + " " + name + " at " + location;
    }
}
