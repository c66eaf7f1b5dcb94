package com.rusttrace.syntax;

import java.util.Map;

/**
 * Kinds of nodes and tokens in the Rust concrete syntax tree.
 * Only the constructs the trace adapter cares about get dedicated node kinds;
 * every other construct becomes an OPAQUE node.
 */
public enum SyntaxKind {

    // --- Nodes ---
    SOURCE_FILE,
    FN,
    STRUCT,
    ENUM,
    TRAIT,
    IMPL,
    MODULE,
    NAME,
    PATH_TYPE,
    TYPE,
    ITEM_LIST,
    ASSOC_ITEM_LIST,
    EXTERN_BLOCK,
    EXTERN_ITEM_LIST,
    BLOCK,
    TOKEN_TREE,
    GENERIC_PARAM_LIST,
    GENERIC_ARG_LIST,
    WHERE_CLAUSE,
    VISIBILITY,
    ATTR,
    META,
    PATH,
    LITERAL,
    MACRO_CALL,
    OPAQUE,

    // --- Trivia ---
    WHITESPACE,
    COMMENT,

    // --- Literals and identifiers ---
    IDENT,
    LIFETIME_IDENT,
    STRING,
    BYTE_STRING,
    C_STRING,
    CHAR,
    BYTE,
    INT_NUMBER,
    FLOAT_NUMBER,

    // --- Keywords ---
    FN_KW,
    STRUCT_KW,
    ENUM_KW,
    TRAIT_KW,
    IMPL_KW,
    MOD_KW,
    FOR_KW,
    PUB_KW,
    USE_KW,
    CONST_KW,
    STATIC_KW,
    TYPE_KW,
    UNSAFE_KW,
    ASYNC_KW,
    EXTERN_KW,
    WHERE_KW,
    CRATE_KW,
    SELF_KW,
    SELF_TYPE_KW,
    SUPER_KW,
    DYN_KW,

    // --- Punctuation ---
    SEMICOLON,
    COMMA,
    COLON,
    COLON2,
    L_CURLY,
    R_CURLY,
    L_PAREN,
    R_PAREN,
    L_BRACK,
    R_BRACK,
    L_ANGLE,
    R_ANGLE,
    POUND,
    BANG,
    EQ,
    THIN_ARROW,
    FAT_ARROW,
    AMP,
    STAR,
    PUNCT,

    // --- Source bytes the parser skipped ---
    ERROR;

    private static final Map<String, SyntaxKind> KEYWORDS = Map.ofEntries(
        Map.entry("fn", FN_KW),
        Map.entry("struct", STRUCT_KW),
        Map.entry("enum", ENUM_KW),
        Map.entry("trait", TRAIT_KW),
        Map.entry("impl", IMPL_KW),
        Map.entry("mod", MOD_KW),
        Map.entry("for", FOR_KW),
        Map.entry("pub", PUB_KW),
        Map.entry("use", USE_KW),
        Map.entry("const", CONST_KW),
        Map.entry("static", STATIC_KW),
        Map.entry("type", TYPE_KW),
        Map.entry("unsafe", UNSAFE_KW),
        Map.entry("async", ASYNC_KW),
        Map.entry("extern", EXTERN_KW),
        Map.entry("where", WHERE_KW),
        Map.entry("crate", CRATE_KW),
        Map.entry("self", SELF_KW),
        Map.entry("Self", SELF_TYPE_KW),
        Map.entry("super", SUPER_KW),
        Map.entry("dyn", DYN_KW)
    );

    /** Returns the keyword kind for {@code word}, or IDENT if it is not a keyword we distinguish. */
    public static SyntaxKind fromIdentifier(String word) {
        return KEYWORDS.getOrDefault(word, IDENT);
    }

    public boolean isTrivia() {
        return this == WHITESPACE || this == COMMENT;
    }

    public boolean isNode() {
        return ordinal() <= OPAQUE.ordinal();
    }
}
