package com.rusttrace.adapter.static_analysis;

import com.rusttrace.syntax.SyntaxKind;
import com.rusttrace.syntax.SyntaxNode;
import com.rusttrace.syntax.SyntaxToken;

import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.List;
import java.util.Optional;

/**
 * Reads the file override from a {@code #[path = "..."]} attribute on a module declaration.
 */
public class PathAttributeExtractor {

    private static final String PATH_ATTRIBUTE = "path";

    /**
     * Returns the first path override among the module node's attributes.
     */
    public Optional<Path> extract(SyntaxNode moduleNode) {
        for (SyntaxNode attr : moduleNode.childrenOfKind(SyntaxKind.ATTR)) {
            Optional<Path> path = fromAttribute(attr);
            if (path.isPresent()) return path;
        }
        return Optional.empty();
    }

    Optional<Path> fromAttribute(SyntaxNode attr) {
        Optional<SyntaxNode> meta = attr.firstChildOfKind(SyntaxKind.META);
        if (meta.isEmpty()) return Optional.empty();

        Optional<SyntaxNode> path = meta.get().firstChildOfKind(SyntaxKind.PATH);
        if (path.isEmpty() || !PATH_ATTRIBUTE.equals(path.get().text())) return Optional.empty();

        Optional<SyntaxNode> literal = meta.get().firstChildOfKind(SyntaxKind.LITERAL);
        if (literal.isEmpty()) return Optional.empty();

        List<SyntaxToken> strings = literal.get().tokensOfKind(SyntaxKind.STRING);
        if (strings.isEmpty()) return Optional.empty();
        String value = unquote(strings.get(0).text());
        try {
            return Optional.of(Paths.get(value));
        } catch (InvalidPathException e) {
            System.err.println("[trace-adapter] WARNING: ignoring unusable path attribute \"" + value + "\": "
                + e.getMessage());
            return Optional.empty();
        }
    }

    // "foo.rs" and r#"foo.rs"#
    private static String unquote(String literal) {
        int open = literal.indexOf('"');
        int close = literal.lastIndexOf('"');
        if (open < 0 || close <= open) return literal;
        return literal.substring(open + 1, close);
    }
}
