package com.rusttrace.adapter.static_analysis;

import com.rusttrace.syntax.SyntaxElement;
import com.rusttrace.syntax.SyntaxKind;
import com.rusttrace.syntax.SyntaxNode;
import com.rusttrace.syntax.SyntaxToken;
import com.rusttrace.syntax.SyntaxVisitor;
import com.rusttrace.syntax.TreeSitterRustParser;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Walks the syntax tree of one source file and builds its tree of traceable nodes.
 *
 * A stack mirrors the nesting of the items being walked. Items are pushed on enter and folded
 * into the new stack top on exit; the file's SOURCE root stays at the bottom until
 * {@link #takeTraceableNodes()} hands it out. Comments annotate whatever is on top of the stack.
 *
 * Module declarations ({@code mod name;}) register a child extractor for the resolved file.
 * Child extractors run only after this file's own walk has finished, in declaration order.
 * A declaration leading back to a file in its own chain of parent modules is skipped.
 */
public class TraceExtractor implements SyntaxVisitor {

    enum State { BEFORE, TRAVERSING, DONE }

    /** A stack entry: the traceable node and the syntax node that created it. */
    private record Frame(SyntaxNode origin, TraceableNode node) {}

    static final int FN_PLACEHOLDER_COLUMN = 0;
    static final int STRUCT_PLACEHOLDER_COLUMN = 1;

    private final Path filePath;
    private final NamespaceContext defaultContext;
    private final Collaborators collaborators;
    /** Files of the parent modules that led to this one, outermost first. */
    private final List<Path> parentFiles;

    private final List<Frame> stack = new ArrayList<>();
    private final LocationTracker locationTracker = new LocationTracker();
    private final List<TraceExtractor> moduleExtractors = new ArrayList<>();
    private State state = State.BEFORE;

    /** Stateless helpers shared by an extractor and all of its module extractors. */
    record Collaborators(
        TraceableNodeBuilder builder,
        ModuleResolver moduleResolver,
        AnnotationScanner annotationScanner,
        PathAttributeExtractor pathAttributes
    ) {
        static Collaborators defaults() {
            return new Collaborators(new TraceableNodeBuilder(), new ModuleResolver(),
                new AnnotationScanner(), new PathAttributeExtractor());
        }
    }

    /**
     * @param filePath       source file this extractor walks
     * @param defaultContext namespace prepended to every name found in the file
     */
    public TraceExtractor(Path filePath, NamespaceContext defaultContext) {
        this(filePath, defaultContext, Collaborators.defaults(), List.of());
    }

    TraceExtractor(Path filePath, NamespaceContext defaultContext, Collaborators collaborators,
                   List<Path> parentFiles) {
        this.filePath = filePath;
        this.defaultContext = defaultContext;
        this.collaborators = collaborators;
        this.parentFiles = parentFiles;
    }

    /**
     * Reads and walks this extractor's file, then every module file it declared.
     * Module files that cannot be read are skipped with a warning.
     *
     * @throws IOException if this extractor's own file cannot be read
     */
    public void parseFile() throws IOException {
        String text = Files.readString(filePath);
        travel(TreeSitterRustParser.parse(text));

        for (TraceExtractor moduleExtractor : moduleExtractors) {
            try {
                moduleExtractor.parseFile();
            } catch (IOException | UncheckedIOException e) {
                System.err.println("[trace-adapter] WARNING: could not read module file "
                    + moduleExtractor.filePath + ": " + e.getMessage());
            }
        }
    }

    /**
     * Walks an already parsed tree. Module extractors are registered but not run.
     */
    public void travel(SyntaxNode root) {
        if (state != State.BEFORE) {
            throw new IllegalStateException("Extractor for " + filePath + " has already been run");
        }
        state = State.TRAVERSING;
        root.accept(this);
        state = State.DONE;

        if (stack.size() != 1) {
            throw new AnalysisException("Unbalanced node stack after walking " + filePath
                + ": expected only the file root but found " + stack.size() + " nodes");
        }
    }

    /**
     * Removes this file's root node from the stack and returns it, followed by the roots of all
     * module files (recursively, in declaration order).
     */
    public List<TraceableNode> takeTraceableNodes() {
        List<TraceableNode> nodes = new ArrayList<>();
        if (!stack.isEmpty()) {
            nodes.add(stack.remove(0).node());
        }
        for (TraceExtractor moduleExtractor : moduleExtractors) {
            nodes.addAll(moduleExtractor.takeTraceableNodes());
        }
        return nodes;
    }

    State state() { return state; }

    List<TraceExtractor> moduleExtractors() { return moduleExtractors; }

    Path filePath() { return filePath; }

    NamespaceContext defaultContext() { return defaultContext; }

    // --- Node callbacks ---

    @Override
    public void enterNode(SyntaxNode node) {
        switch (node.kind()) {
            case SOURCE_FILE -> enterSource(node);
            case FN -> enterItem(node, FN_PLACEHOLDER_COLUMN);
            case STRUCT -> enterItem(node, STRUCT_PLACEHOLDER_COLUMN);
            case TRAIT -> enterTrait(node);
            case IMPL -> enterImpl(node);
            case MODULE -> enterModule(node);
            default -> { }
        }
    }

    @Override
    public void exitNode(SyntaxNode node) {
        switch (node.kind()) {
            case FN -> close(node, NodeKind.FUNCTION, true);
            case STRUCT -> close(node, NodeKind.STRUCT, true);
            case IMPL, MODULE -> close(node, NodeKind.CONTEXT, true);
            // Traits are dropped with everything inside them.
            case TRAIT -> close(node, NodeKind.TRAIT, false);
            default -> { }
        }
    }

    private void enterSource(SyntaxNode node) {
        TraceableNode root = collaborators.builder()
            .source(node, fileStem(), FileReference.unpositioned(locationFile()));
        push(node, root);
    }

    private void enterItem(SyntaxNode node, int placeholderColumn) {
        // Approximate position; corrected when the fn / struct keyword is visited.
        FileReference location = new FileReference(locationFile(), locationTracker.currentLine(), placeholderColumn);
        String prefix = defaultContext.combine(fileStem()).combine(enclosingContext()).toString();

        Optional<TraceableNode> built = collaborators.builder().item(node, prefix, location);
        if (built.isPresent()) {
            push(node, built.get());
        } else {
            System.err.println("[trace-adapter] WARNING: skipping " + node.kind() + " without a name at " + location);
        }
    }

    private void enterTrait(SyntaxNode node) {
        FileReference location = new FileReference(locationFile(), locationTracker.currentLine(), null);
        push(node, collaborators.builder().trait(node, location));
    }

    private void enterImpl(SyntaxNode node) {
        FileReference location = new FileReference(locationFile(), locationTracker.currentLine(), null);
        collaborators.builder().fromImpl(node, location).ifPresent(context -> push(node, context));
    }

    private void enterModule(SyntaxNode node) {
        Optional<SyntaxElement> last = node.lastChildOrToken();
        if (last.isEmpty()) return;

        SyntaxKind lastKind = last.get().kind();
        if (lastKind == SyntaxKind.SEMICOLON) {
            declareModule(node);
        } else if (lastKind == SyntaxKind.ITEM_LIST) {
            FileReference location = new FileReference(locationFile(), locationTracker.currentLine(), null);
            push(node, collaborators.builder().fromModule(node, location));
        }
    }

    /**
     * {@code mod name;}: find the file holding the module and register an extractor for it.
     * A {@code #[path]} attribute wins over the standard lookup. It adds no namespace segment
     * for the module, so names found there are shallower than they would be otherwise.
     */
    private void declareModule(SyntaxNode node) {
        Optional<Path> override = collaborators.pathAttributes().extract(node);
        if (override.isPresent()) {
            registerModule(directory().resolve(override.get()), defaultContext);
            return;
        }

        Optional<String> name = node.firstChildOfKind(SyntaxKind.NAME).map(SyntaxNode::text);
        if (name.isEmpty()) {
            System.err.println("[trace-adapter] WARNING: module declaration without a name in " + filePath);
            return;
        }

        Optional<ModuleResolver.ResolvedModule> resolved =
            collaborators.moduleResolver().resolve(filePath, name.get());
        if (resolved.isPresent()) {
            registerModule(resolved.get().path(), defaultContext.combine(resolved.get().context()));
        } else {
            System.err.println("[trace-adapter] WARNING: could not resolve module '" + name.get()
                + "' declared in " + filePath);
        }
    }

    private void registerModule(Path modulePath, NamespaceContext context) {
        List<Path> chain = new ArrayList<>(parentFiles);
        chain.add(identity(filePath));
        if (chain.contains(identity(modulePath))) {
            System.err.println("[trace-adapter] WARNING: module file " + modulePath + " declared in " + filePath
                + " is one of its own parent modules. Skipping...");
            return;
        }
        moduleExtractors.add(new TraceExtractor(modulePath, context, collaborators, List.copyOf(chain)));
    }

    /** Real path of {@code path} when it exists, so links and {@code ..} segments compare equal. */
    private static Path identity(Path path) {
        try {
            return path.toRealPath();
        } catch (IOException e) {
            return path.toAbsolutePath().normalize();
        }
    }

    // --- Token callbacks ---

    @Override
    public void visitToken(SyntaxToken token) {
        switch (token.kind()) {
            case WHITESPACE -> locationTracker.advance(token.text(), token.textRange().start());
            case COMMENT -> {
                trackMultiline(token);
                if (!stack.isEmpty()) {
                    collaborators.annotationScanner().scan(token.text(), top().node());
                }
            }
            case STRING, BYTE_STRING, C_STRING -> trackMultiline(token);
            case FN_KW -> correctLocation(token, SyntaxKind.FN, NodeKind.FUNCTION);
            case STRUCT_KW -> correctLocation(token, SyntaxKind.STRUCT, NodeKind.STRUCT);
            default -> { }
        }
    }

    private void trackMultiline(SyntaxToken token) {
        if (token.text().indexOf('\n') >= 0) {
            locationTracker.advance(token.text(), token.textRange().start());
        }
    }

    /**
     * Sets the exact position of the stack top from its defining keyword.
     * Keywords that do not introduce an item (e.g. {@code fn(u8)} pointer types) are ignored.
     */
    private void correctLocation(SyntaxToken keyword, SyntaxKind itemKind, NodeKind nodeKind) {
        SyntaxNode owner = keyword.parent();
        if (owner == null || owner.kind() != itemKind || owner.tokensOfKind(keyword.kind()).get(0) != keyword) {
            return;
        }

        LocationTracker.Position position = locationTracker.positionOf(keyword.textRange().start());
        if (!stack.isEmpty() && top().origin() == owner && top().node().getKind() == nodeKind) {
            top().node().getLocation().setPosition(position.line(), position.column());
        } else {
            System.err.println("[trace-adapter] WARNING: parsed '" + keyword.text() + "' keyword outside of its "
                + nodeKind.displayName() + " node @" + position.line() + "," + position.column() + " in " + filePath);
        }
    }

    // --- Stack handling ---

    private void push(SyntaxNode origin, TraceableNode node) {
        stack.add(new Frame(origin, node));
    }

    private Frame top() {
        return stack.get(stack.size() - 1);
    }

    /**
     * Pops the stack top if {@code node} created it; when {@code fold} is set the popped node
     * becomes the last child of the new stack top.
     */
    private void close(SyntaxNode node, NodeKind expected, boolean fold) {
        if (stack.isEmpty() || top().origin() != node || top().node().getKind() != expected) {
            return;
        }
        TraceableNode closed = stack.remove(stack.size() - 1).node();
        if (fold && !stack.isEmpty()) {
            top().node().appendChild(closed);
        }
    }

    /** Combined namespace of all CONTEXT nodes on the stack, outermost first. */
    private NamespaceContext enclosingContext() {
        return NamespaceContext.sum(stack.stream()
            .map(Frame::node)
            .filter(n -> n.getKind() == NodeKind.CONTEXT)
            .map(TraceableNode::namespace)
            .collect(Collectors.toList()));
    }

    private String fileStem() {
        Path name = filePath.getFileName();
        return name != null ? ModuleResolver.stem(name.toString()) : "";
    }

    private String locationFile() {
        return filePath.toString();
    }

    private Path directory() {
        return filePath.getParent() != null ? filePath.getParent() : Paths.get("");
    }
}
