package com.rusttrace.syntax;

import org.treesitter.TSNode;
import org.treesitter.TSParser;
import org.treesitter.TSTree;
import org.treesitter.TreeSitterRust;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

import static com.rusttrace.syntax.SyntaxKind.*;

/**
 * Builds the lossless syntax tree of a Rust source file from a tree-sitter parse.
 *
 * tree-sitter leaves whitespace out of its tree and keeps attributes and comments as siblings of
 * the items they annotate. The conversion fills every byte gap between leaves with WHITESPACE
 * tokens, and moves outer attributes plus the comments directly above an item into the item node,
 * so that the item owns its {@code #[path]} attribute and its trace comments.
 *
 * Parsing never fails; regions tree-sitter could not parse end up in OPAQUE nodes and ERROR tokens.
 */
public final class TreeSitterRustParser {

    private static final Map<String, SyntaxKind> NODE_KINDS = Map.ofEntries(
        Map.entry("source_file", SOURCE_FILE),
        Map.entry("function_item", FN),
        Map.entry("function_signature_item", FN),
        Map.entry("struct_item", STRUCT),
        Map.entry("enum_item", ENUM),
        Map.entry("trait_item", TRAIT),
        Map.entry("impl_item", IMPL),
        Map.entry("mod_item", MODULE),
        Map.entry("foreign_mod_item", EXTERN_BLOCK),
        Map.entry("block", BLOCK),
        Map.entry("token_tree", TOKEN_TREE),
        Map.entry("type_parameters", GENERIC_PARAM_LIST),
        Map.entry("type_arguments", GENERIC_ARG_LIST),
        Map.entry("where_clause", WHERE_CLAUSE),
        Map.entry("visibility_modifier", VISIBILITY),
        Map.entry("attribute_item", ATTR),
        Map.entry("inner_attribute_item", ATTR),
        Map.entry("attribute", META),
        Map.entry("macro_invocation", MACRO_CALL),
        Map.entry("macro_definition", MACRO_CALL)
    );

    /** Node types that take the outer attributes and attached comments in front of them. */
    private static final Set<String> ITEMS = Set.of(
        "function_item", "function_signature_item", "struct_item", "enum_item", "union_item",
        "trait_item", "impl_item", "mod_item", "foreign_mod_item", "const_item", "static_item",
        "type_item", "use_declaration", "extern_crate_declaration", "macro_definition",
        "macro_invocation", "associated_type", "enum_variant", "field_declaration");

    /** Node types whose name, trait and type fields get NAME, PATH_TYPE or TYPE wrappers. */
    private static final Set<String> FIELD_PARENTS = Set.of(
        "function_item", "function_signature_item", "struct_item", "enum_item", "union_item",
        "trait_item", "mod_item", "impl_item");

    /** impl header types that are paths, with or without generic arguments. */
    private static final Set<String> PATH_TYPES = Set.of(
        "type_identifier", "scoped_type_identifier", "generic_type", "primitive_type");

    private static final Set<String> ATTRIBUTE_PATHS = Set.of(
        "identifier", "scoped_identifier", "crate", "self", "super");

    private static final Set<String> LITERALS = Set.of(
        "string_literal", "raw_string_literal", "char_literal", "integer_literal",
        "float_literal", "boolean_literal");

    private static final Map<String, SyntaxKind> PUNCTUATION = Map.ofEntries(
        Map.entry(";", SEMICOLON),
        Map.entry(",", COMMA),
        Map.entry(":", COLON),
        Map.entry("::", COLON2),
        Map.entry("{", L_CURLY),
        Map.entry("}", R_CURLY),
        Map.entry("(", L_PAREN),
        Map.entry(")", R_PAREN),
        Map.entry("[", L_BRACK),
        Map.entry("]", R_BRACK),
        Map.entry("<", L_ANGLE),
        Map.entry(">", R_ANGLE),
        Map.entry("#", POUND),
        Map.entry("!", BANG),
        Map.entry("=", EQ),
        Map.entry("->", THIN_ARROW),
        Map.entry("=>", FAT_ARROW),
        Map.entry("&", AMP),
        Map.entry("*", STAR)
    );

    /** A child of a tree-sitter node, or the gap before it ({@code node == null}). */
    private record Piece(TSNode node, int start, int end) {
        boolean isGap() { return node == null; }
    }

    private final byte[] source;

    private TreeSitterRustParser(byte[] source) {
        this.source = source;
    }

    /**
     * Parses {@code text} into a tree rooted at a SOURCE_FILE node.
     */
    public static SyntaxNode parse(String text) {
        TSParser parser = new TSParser();
        parser.setLanguage(new TreeSitterRust());
        TSTree tree = Objects.requireNonNull(parser.parseString(null, text), "tree-sitter returned no tree");

        byte[] bytes = text.getBytes(StandardCharsets.UTF_8);
        TreeSitterRustParser converter = new TreeSitterRustParser(bytes);
        SyntaxNode root = new SyntaxNode(SOURCE_FILE);
        converter.fill(root, tree.getRootNode(), 0, bytes.length);
        return root;
    }

    // --- Nodes ---

    private SyntaxElement convert(Piece piece) {
        TSNode node = piece.node();
        if (isAtomic(node)) {
            return token(tokenKind(node, node.getType()), piece.start(), piece.end());
        }
        SyntaxNode result = new SyntaxNode(nodeKind(node.getType()));
        fill(result, node, piece.start(), piece.end());
        return result;
    }

    /** Appends the children of {@code node}, and the gaps around them, to {@code target}. */
    private void fill(SyntaxNode target, TSNode node, int start, int end) {
        appendPieces(target, node, pieces(node, start, end));
        target.seal(start);
    }

    private void appendPieces(SyntaxNode target, TSNode parent, List<Piece> pieces) {
        List<Piece> pending = new ArrayList<>();
        for (Piece piece : pieces) {
            if (piece.isGap() || isComment(piece.node()) || isOuterAttribute(piece.node())) {
                pending.add(piece);
            } else if (ITEMS.contains(piece.node().getType())) {
                int attached = attachedCount(pending);
                for (Piece p : pending.subList(0, pending.size() - attached)) {
                    appendPiece(target, parent, p);
                }
                target.append(item(piece, pending.subList(pending.size() - attached, pending.size())));
                pending.clear();
            } else {
                for (Piece p : pending) {
                    appendPiece(target, parent, p);
                }
                pending.clear();
                appendPiece(target, parent, piece);
            }
        }
        for (Piece p : pending) {
            appendPiece(target, parent, p);
        }
    }

    /** An item node whose leading children are the attributes and comments it took over. */
    private SyntaxNode item(Piece piece, List<Piece> leading) {
        TSNode node = piece.node();
        SyntaxNode result = new SyntaxNode(nodeKind(node.getType()));
        for (Piece p : leading) {
            appendPiece(result, null, p);
        }
        appendPieces(result, node, pieces(node, piece.start(), piece.end()));
        result.seal(piece.start());
        return result;
    }

    private void appendPiece(SyntaxNode target, TSNode parent, Piece piece) {
        if (piece.isGap()) {
            appendGap(target, piece.start(), piece.end());
            return;
        }
        TSNode node = piece.node();
        if (node.getType().equals("ERROR") && node.getChildCount() == 0) {
            appendGap(target, piece.start(), piece.end());
            return;
        }
        String field = parent != null && FIELD_PARENTS.contains(parent.getType()) ? fieldOf(parent, node) : null;
        if ("name".equals(field)) {
            target.append(wrap(NAME, piece));
        } else if (parent != null && "impl_item".equals(parent.getType())
                && ("trait".equals(field) || "type".equals(field))) {
            target.append(wrap(PATH_TYPES.contains(node.getType()) ? PATH_TYPE : TYPE, piece));
        } else if (parent != null && "attribute".equals(parent.getType()) && isAttributePath(parent, node)) {
            target.append(wrap(PATH, piece));
        } else if (parent != null && "attribute".equals(parent.getType()) && LITERALS.contains(node.getType())) {
            target.append(wrap(LITERAL, piece));
        } else if (node.getType().equals("declaration_list") && parent != null) {
            SyntaxNode list = new SyntaxNode(itemListKind(parent.getType()));
            fill(list, node, piece.start(), piece.end());
            target.append(list);
        } else {
            target.append(convert(piece));
        }
    }

    /** A node of {@code kind} holding the converted piece. */
    private SyntaxNode wrap(SyntaxKind kind, Piece piece) {
        SyntaxNode wrapper = new SyntaxNode(kind);
        wrapper.append(convert(piece));
        wrapper.seal(piece.start());
        return wrapper;
    }

    /**
     * Children of {@code node} with the gaps between them. Zero-width children (tokens tree-sitter
     * inserted during error recovery) are dropped. Line comments give their trailing line break
     * back to the following gap.
     */
    private List<Piece> pieces(TSNode node, int start, int end) {
        List<Piece> result = new ArrayList<>();
        int cursor = start;
        int count = node.getChildCount();
        for (int i = 0; i < count; i++) {
            TSNode child = node.getChild(i);
            if (child == null || child.isNull()) continue;
            int childStart = Math.max(child.getStartByte(), cursor);
            int childEnd = Math.min(child.getEndByte(), end);
            if (childEnd <= childStart) continue;
            if (isComment(child)) {
                childEnd = withoutLineBreak(childStart, childEnd);
            }
            if (childStart > cursor) {
                result.add(new Piece(null, cursor, childStart));
            }
            result.add(new Piece(child, childStart, childEnd));
            cursor = childEnd;
        }
        if (end > cursor) {
            result.add(new Piece(null, cursor, end));
        }
        return result;
    }

    private int withoutLineBreak(int start, int end) {
        if (source[start] != '/' || start + 1 >= end || source[start + 1] != '/') return end;
        int trimmed = end;
        while (trimmed > start && (source[trimmed - 1] == '\n' || source[trimmed - 1] == '\r')) trimmed--;
        return trimmed;
    }

    // --- Tokens ---

    /** Whitespace runs become WHITESPACE tokens; bytes tree-sitter skipped become ERROR tokens. */
    private void appendGap(SyntaxNode target, int start, int end) {
        int runStart = start;
        while (runStart < end) {
            boolean whitespace = isWhitespace(source[runStart]);
            int runEnd = runStart;
            while (runEnd < end && isWhitespace(source[runEnd]) == whitespace) runEnd++;
            target.append(token(whitespace ? WHITESPACE : ERROR, runStart, runEnd));
            runStart = runEnd;
        }
    }

    private SyntaxToken token(SyntaxKind kind, int start, int end) {
        String text = new String(source, start, end - start, StandardCharsets.UTF_8);
        return new SyntaxToken(kind, text, start, end - start);
    }

    private SyntaxKind tokenKind(TSNode node, String type) {
        switch (type) {
            case "line_comment", "block_comment" -> { return COMMENT; }
            case "string_literal", "raw_string_literal" -> { return stringKind(node); }
            case "char_literal" -> { return source[node.getStartByte()] == 'b' ? BYTE : CHAR; }
            case "integer_literal" -> { return INT_NUMBER; }
            case "float_literal" -> { return FLOAT_NUMBER; }
            case "lifetime" -> { return LIFETIME_IDENT; }
            default -> { }
        }
        SyntaxKind punctuation = PUNCTUATION.get(type);
        if (punctuation != null) return punctuation;
        String text = new String(source, node.getStartByte(), node.getEndByte() - node.getStartByte(),
            StandardCharsets.UTF_8);
        return isWord(text) ? SyntaxKind.fromIdentifier(text) : PUNCT;
    }

    private SyntaxKind stringKind(TSNode node) {
        return switch (source[node.getStartByte()]) {
            case 'b' -> BYTE_STRING;
            case 'c' -> C_STRING;
            default -> STRING;
        };
    }

    // --- Classification ---

    private static SyntaxKind nodeKind(String type) {
        return NODE_KINDS.getOrDefault(type, OPAQUE);
    }

    private static SyntaxKind itemListKind(String parentType) {
        return switch (parentType) {
            case "mod_item" -> ITEM_LIST;
            case "foreign_mod_item" -> EXTERN_ITEM_LIST;
            default -> ASSOC_ITEM_LIST;
        };
    }

    /** Leaves, plus literals and comments whose inner structure is not kept. */
    private static boolean isAtomic(TSNode node) {
        String type = node.getType();
        return node.getChildCount() == 0 || isComment(node) || LITERALS.contains(type) || type.equals("lifetime");
    }

    private static boolean isComment(TSNode node) {
        String type = node.getType();
        return type.equals("line_comment") || type.equals("block_comment");
    }

    private static boolean isOuterAttribute(TSNode node) {
        return node.getType().equals("attribute_item");
    }

    private static boolean isAttributePath(TSNode attribute, TSNode node) {
        return ATTRIBUTE_PATHS.contains(node.getType()) && sameNode(attribute.getNamedChild(0), node);
    }

    private static String fieldOf(TSNode parent, TSNode child) {
        for (String field : List.of("name", "trait", "type")) {
            TSNode candidate = parent.getChildByFieldName(field);
            if (sameNode(candidate, child)) return field;
        }
        return null;
    }

    private static boolean sameNode(TSNode a, TSNode b) {
        return a != null && !a.isNull() && b != null && !b.isNull()
            && a.getStartByte() == b.getStartByte()
            && a.getEndByte() == b.getEndByte()
            && a.getType().equals(b.getType());
    }

    /**
     * Number of trailing pending pieces that belong to the next item. Every piece from the first
     * outer attribute on is taken. Before that, walking backwards, comments are taken until a
     * blank line (unless an outer doc comment sits right before it) or an inner doc comment.
     */
    private int attachedCount(List<Piece> pending) {
        int firstAttribute = pending.size();
        for (int i = 0; i < pending.size(); i++) {
            if (!pending.get(i).isGap() && isOuterAttribute(pending.get(i).node())) {
                firstAttribute = i;
                break;
            }
        }
        int attachedFrom = firstAttribute;
        for (int i = firstAttribute - 1; i >= 0; i--) {
            Piece piece = pending.get(i);
            if (piece.isGap()) {
                if (newlineCount(piece) >= 2) {
                    if (i > 0 && !pending.get(i - 1).isGap() && isOuterDocComment(text(pending.get(i - 1)))) {
                        continue;
                    }
                    break;
                }
                if (containsNonWhitespace(piece)) break;
                continue;
            }
            if (isInnerDocComment(text(piece))) break;
            attachedFrom = i;
        }
        return pending.size() - attachedFrom;
    }

    private int newlineCount(Piece piece) {
        int count = 0;
        for (int i = piece.start(); i < piece.end(); i++) {
            if (source[i] == '\n') count++;
        }
        return count;
    }

    private boolean containsNonWhitespace(Piece piece) {
        for (int i = piece.start(); i < piece.end(); i++) {
            if (!isWhitespace(source[i])) return true;
        }
        return false;
    }

    private String text(Piece piece) {
        return new String(source, piece.start(), piece.end() - piece.start(), StandardCharsets.UTF_8);
    }

    private static boolean isOuterDocComment(String text) {
        return (text.startsWith("///") && !text.startsWith("////"))
            || (text.startsWith("/**") && !text.startsWith("/***") && !text.equals("/**/"));
    }

    private static boolean isInnerDocComment(String text) {
        return text.startsWith("//!") || text.startsWith("/*!");
    }

    private static boolean isWhitespace(byte b) {
        return b == ' ' || b == '\t' || b == '\n' || b == '\r' || b == '\f' || b == 0x0B;
    }

    private static boolean isWord(String text) {
        if (text.isEmpty()) return false;
        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            if (!(Character.isLetterOrDigit(c) || c == '_' || c == '#')) return false;
        }
        return true;
    }
}
