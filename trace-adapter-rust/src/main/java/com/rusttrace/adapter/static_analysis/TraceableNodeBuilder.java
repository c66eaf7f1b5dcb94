package com.rusttrace.adapter.static_analysis;

import com.rusttrace.syntax.SyntaxKind;
import com.rusttrace.syntax.SyntaxNode;

import java.util.List;
import java.util.Optional;

/**
 * Converts syntax nodes of the kinds the extractor cares about into {@link TraceableNode}s.
 */
public class TraceableNodeBuilder {

    static final String IMPL_NODE_NAME = "Impl";

    /**
     * Root node for a source file.
     *
     * @throws AnalysisException if {@code node} is not a SOURCE_FILE
     */
    public TraceableNode source(SyntaxNode node, String name, FileReference location) {
        if (node.kind() != SyntaxKind.SOURCE_FILE) {
            throw new AnalysisException("Expected a source file root but got " + node.kind()
                + " in " + location.getFilename());
        }
        return new TraceableNode(name, NodeKind.SOURCE, location);
    }

    /**
     * Function or struct node named {@code prefix.name}.
     * Empty if the node has no name or is of another kind.
     */
    public Optional<TraceableNode> item(SyntaxNode node, String prefix, FileReference location) {
        NodeKind kind = switch (node.kind()) {
            case FN -> NodeKind.FUNCTION;
            case STRUCT -> NodeKind.STRUCT;
            default -> null;
        };
        if (kind == null) return Optional.empty();
        return nameOf(node).map(name -> new TraceableNode(prefix + "." + name, kind, location));
    }

    /**
     * Trait node. It only exists to keep the stack shape right while the trait body is walked;
     * a trait without a name still gets a node so its body is suppressed.
     */
    public TraceableNode trait(SyntaxNode node, FileReference location) {
        String name = nameOf(node).orElseGet(() -> {
            System.err.println("[trace-adapter] WARNING: trait without a name at " + location);
            return "";
        });
        return new TraceableNode(name, NodeKind.TRAIT, location);
    }

    /**
     * Context node for an impl block.
     * {@code impl Type} scopes members under {@code Type}; {@code impl Trait for Type} also
     * scopes them under {@code Type} and remembers the trait. Anything else is malformed.
     */
    public Optional<TraceableNode> fromImpl(SyntaxNode node, FileReference location) {
        List<SyntaxNode> paths = node.childrenOfKind(SyntaxKind.PATH_TYPE);
        ContextData data;
        if (paths.size() == 1) {
            data = new ContextData(NamespaceContext.fromString(paths.get(0).text()), null);
        } else if (paths.size() == 2 && !node.tokensOfKind(SyntaxKind.FOR_KW).isEmpty()) {
            data = new ContextData(NamespaceContext.fromString(paths.get(1).text()), paths.get(0).text());
        } else {
            System.err.println("[trace-adapter] WARNING: Malformed impl node with " + paths.size()
                + " path types at " + location + ". Continuing...");
            return Optional.empty();
        }
        return Optional.of(new TraceableNode(IMPL_NODE_NAME, NodeKind.CONTEXT, location, data));
    }

    /**
     * Context node for an inline module definition ({@code mod name { ... }}).
     *
     * @throws AnalysisException if the module has no name
     */
    public TraceableNode fromModule(SyntaxNode node, FileReference location) {
        String name = nameOf(node).orElseThrow(() ->
            new AnalysisException("Module definition without a name at " + location));
        ContextData data = new ContextData(NamespaceContext.fromString(name), null);
        return new TraceableNode(name, NodeKind.CONTEXT, location, data);
    }

    private static Optional<String> nameOf(SyntaxNode node) {
        return node.firstChildOfKind(SyntaxKind.NAME).map(SyntaxNode::text);
    }
}
