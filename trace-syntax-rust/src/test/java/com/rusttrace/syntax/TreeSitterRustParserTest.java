package com.rusttrace.syntax;

import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.List;
import java.util.stream.Stream;

import static com.rusttrace.syntax.SyntaxKind.*;
import static org.junit.jupiter.api.Assertions.*;

class TreeSitterRustParserTest {

    private static final Path FIXTURE_ROOT =
        Paths.get(System.getProperty("user.dir"))
             .getParent()
             .resolve("test-fixtures/rust-crate/src");

    private static SyntaxNode only(SyntaxNode parent, SyntaxKind kind) {
        List<SyntaxNode> found = parent.childrenOfKind(kind);
        assertEquals(1, found.size(), "expected exactly one " + kind + " in " + parent.text());
        return found.get(0);
    }

    private static String name(SyntaxNode item) {
        return item.firstChildOfKind(NAME).map(SyntaxNode::text).orElse(null);
    }

    private static List<SyntaxToken> tokens(SyntaxNode root) {
        List<SyntaxToken> result = new ArrayList<>();
        root.accept(new SyntaxVisitor() {
            @Override public void enterNode(SyntaxNode node) { }
            @Override public void exitNode(SyntaxNode node) { }
            @Override public void visitToken(SyntaxToken token) { result.add(token); }
        });
        return result;
    }

    /** Collects every node of {@code kind} in document order. */
    private static List<SyntaxNode> descendants(SyntaxNode root, SyntaxKind kind) {
        List<SyntaxNode> result = new ArrayList<>();
        root.accept(new SyntaxVisitor() {
            @Override public void enterNode(SyntaxNode node) { if (node.kind() == kind) result.add(node); }
            @Override public void exitNode(SyntaxNode node) { }
            @Override public void visitToken(SyntaxToken token) { }
        });
        return result;
    }

    @Test
    void functionHasNameKeywordAndBody() {
        SyntaxNode root = TreeSitterRustParser.parse("fn alpha() {}");
        assertEquals(SOURCE_FILE, root.kind());
        SyntaxNode fn = only(root, FN);
        assertEquals("alpha", name(fn));
        assertEquals(1, fn.tokensOfKind(FN_KW).size());
        assertTrue(fn.firstChildOfKind(BLOCK).isPresent());
        assertEquals(new TextRange(0, 13), fn.textRange());
    }

    @Test
    void modulesEndInSemicolonOrItemList() {
        SyntaxNode root = TreeSitterRustParser.parse("mod a;\nmod b {\n    fn c() {}\n}\n");
        List<SyntaxNode> modules = root.childrenOfKind(MODULE);
        assertEquals(2, modules.size());

        assertEquals("a", name(modules.get(0)));
        assertEquals(SEMICOLON, modules.get(0).lastChildOrToken().orElseThrow().kind());

        assertEquals("b", name(modules.get(1)));
        SyntaxElement last = modules.get(1).lastChildOrToken().orElseThrow();
        assertEquals(ITEM_LIST, last.kind());
        assertEquals("c", name(only((SyntaxNode) last, FN)));
    }

    @Test
    void inherentImplHasOnePathType() {
        SyntaxNode impl = only(TreeSitterRustParser.parse("impl<T> Wrapper<T> { fn get(&self) -> &T { &self.0 } }"), IMPL);
        SyntaxNode path = only(impl, PATH_TYPE);
        assertEquals("Wrapper<T>", path.text());
        assertTrue(impl.tokensOfKind(FOR_KW).isEmpty());
        assertEquals("get", name(only(only(impl, ASSOC_ITEM_LIST), FN)));
    }

    @Test
    void traitImplHasTwoPathTypesAndFor() {
        SyntaxNode impl = only(TreeSitterRustParser.parse("impl fmt::Display for Point {\n    fn fmt(&self) {}\n}"), IMPL);
        List<SyntaxNode> paths = impl.childrenOfKind(PATH_TYPE);
        assertEquals(2, paths.size());
        assertEquals("fmt::Display", paths.get(0).text());
        assertEquals("Point", paths.get(1).text());
        assertEquals(1, impl.tokensOfKind(FOR_KW).size());
    }

    @Test
    void implForReferenceTypeHasOnlyOnePathType() {
        SyntaxNode impl = only(TreeSitterRustParser.parse("impl Trait for &Point {}"), IMPL);
        assertEquals(1, impl.childrenOfKind(PATH_TYPE).size());
        assertEquals(1, impl.childrenOfKind(TYPE).size());
    }

    @Test
    void pathAttributeIsStructured() {
        SyntaxNode module = only(TreeSitterRustParser.parse("#[path = \"gen/out.rs\"]\nmod generated;"), MODULE);
        SyntaxNode attr = only(module, ATTR);
        SyntaxNode meta = only(attr, META);
        assertEquals("path", only(meta, PATH).text());
        SyntaxNode literal = only(meta, LITERAL);
        assertEquals("\"gen/out.rs\"", literal.tokensOfKind(STRING).get(0).text());
        assertEquals("generated", name(module));
    }

    @Test
    void commentDirectlyAboveItemBelongsToItem() {
        SyntaxNode root = TreeSitterRustParser.parse("fn a() {}\n\n// lobster-trace: X.b\nfn b() {}");
        List<SyntaxNode> fns = root.childrenOfKind(FN);
        SyntaxElement first = fns.get(1).firstChildOrToken().orElseThrow();
        assertEquals(COMMENT, first.kind());
        assertEquals("// lobster-trace: X.b", first.text());
        assertTrue(root.tokensOfKind(COMMENT).isEmpty());
    }

    @Test
    void blankLineDetachesPlainComment() {
        SyntaxNode root = TreeSitterRustParser.parse("// detached\n\nfn g() {}");
        assertEquals(1, root.tokensOfKind(COMMENT).size());
        assertTrue(only(root, FN).tokensOfKind(COMMENT).isEmpty());
    }

    @Test
    void docCommentStaysAttachedAcrossBlankLine() {
        SyntaxNode root = TreeSitterRustParser.parse("/// doc\n\nfn h() {}");
        assertTrue(root.tokensOfKind(COMMENT).isEmpty());
        assertEquals(1, only(root, FN).tokensOfKind(COMMENT).size());
    }

    @Test
    void innerDocCommentStaysWithParent() {
        SyntaxNode root = TreeSitterRustParser.parse("//! crate docs\nfn h() {}");
        assertEquals(1, root.tokensOfKind(COMMENT).size());
        assertTrue(only(root, FN).tokensOfKind(COMMENT).isEmpty());
    }

    @Test
    void itemsInsideFunctionBodiesAreParsed() {
        SyntaxNode root = TreeSitterRustParser.parse(
            "fn outer() {\n    let x = 1;\n    struct Local;\n    fn inner() {}\n    x\n}");
        SyntaxNode body = only(only(root, FN), BLOCK);
        assertEquals("inner", name(only(body, FN)));
        assertEquals("Local", name(only(body, STRUCT)));
    }

    @Test
    void traitBodyHoldsFunctions() {
        SyntaxNode trait = only(TreeSitterRustParser.parse("pub trait T: Clone {\n    fn t(&self);\n    fn u() {}\n}"), TRAIT);
        assertEquals("T", name(trait));
        assertEquals(2, only(trait, ASSOC_ITEM_LIST).childrenOfKind(FN).size());
    }

    @Test
    void qualifiedFunctionsAreRecognized() {
        SyntaxNode root = TreeSitterRustParser.parse(
            "pub(crate) async unsafe fn a() {}\nconst fn b() {}\nextern \"C\" fn c() {}\n");
        List<SyntaxNode> fns = root.childrenOfKind(FN);
        assertEquals(List.of("a", "b", "c"), fns.stream().map(TreeSitterRustParserTest::name).toList());
    }

    @Test
    void functionPointerKeywordBelongsToItsType() {
        SyntaxNode fn = only(TreeSitterRustParser.parse("fn f() -> fn(u8) -> u8 { g }"), FN);
        assertEquals(1, fn.tokensOfKind(FN_KW).size());
        assertEquals(0, fn.tokensOfKind(FN_KW).get(0).textRange().start());

        List<SyntaxToken> keywords = new ArrayList<>();
        fn.accept(new SyntaxVisitor() {
            @Override public void enterNode(SyntaxNode node) { }
            @Override public void exitNode(SyntaxNode node) { }
            @Override public void visitToken(SyntaxToken token) { if (token.kind() == FN_KW) keywords.add(token); }
        });
        assertEquals(2, keywords.size());
        assertNotEquals(FN, keywords.get(1).parent().kind());
    }

    @Test
    void opaqueItemsDoNotHideFollowingItems() {
        SyntaxNode root = TreeSitterRustParser.parse(
            "use std::fmt;\nconst N: usize = 3;\nmacro_rules! m { () => {} }\nenum E { A, B }\nstruct S(u8);\n");
        assertEquals(1, root.childrenOfKind(ENUM).size());
        assertEquals("S", name(only(root, STRUCT)));
    }

    @Test
    void gapsBecomeWhitespaceTokens() {
        SyntaxNode root = TreeSitterRustParser.parse("\n\nfn a()  {}\n");
        List<SyntaxToken> tokens = tokens(root);
        assertEquals(WHITESPACE, tokens.get(0).kind());
        assertEquals("\n\n", tokens.get(0).text());
        assertEquals(FN_KW, tokens.get(1).kind());
        assertEquals(new TextRange(2, 4), tokens.get(1).textRange());
        assertTrue(tokens.stream().anyMatch(t -> t.kind() == WHITESPACE && t.text().equals("  ")));
        assertEquals(WHITESPACE, tokens.get(tokens.size() - 1).kind());
    }

    @Test
    void tokensCoverInputExactly() {
        String source = "impl<'a> Foo<'a> {\r\n    fn b(&self) -> char { 'x' } // tail\r\n}\r\n";
        int expected = 0;
        StringBuilder text = new StringBuilder();
        for (SyntaxToken token : tokens(TreeSitterRustParser.parse(source))) {
            assertEquals(expected, token.textRange().start(), "gap or overlap before " + token);
            expected = token.textRange().end();
            text.append(token.text());
        }
        assertEquals(source.length(), expected);
        assertEquals(source, text.toString());
    }

    @Test
    void offsetsAreUtf8ByteOffsets() {
        SyntaxNode root = TreeSitterRustParser.parse("// \u00e9t\u00e9\nfn f() {}");
        SyntaxToken keyword = only(root, FN).tokensOfKind(FN_KW).get(0);
        assertEquals(new TextRange(9, 11), keyword.textRange());
    }

    @Test
    void lineCommentLeavesItsLineBreakToWhitespace() {
        List<SyntaxToken> tokens = tokens(TreeSitterRustParser.parse("fn f() {\r\n    let x = 1; // note\r\n}"));
        SyntaxToken comment = tokens.stream().filter(t -> t.kind() == COMMENT).findFirst().orElseThrow();
        assertEquals("// note", comment.text());
        assertEquals("\r\n", comment.nextSiblingOrToken().text());
    }

    @Test
    void nestedBlockCommentIsOneToken() {
        List<SyntaxToken> comments = tokens(TreeSitterRustParser.parse("/* a /* b */\n c */ fn f() {}")).stream()
            .filter(t -> t.kind() == COMMENT).toList();
        assertEquals(1, comments.size());
        assertEquals("/* a /* b */\n c */", comments.get(0).text());
    }

    @Test
    void stringLiteralsAreSingleTokens() {
        List<SyntaxToken> tokens = tokens(TreeSitterRustParser.parse(
            "fn f() { let a = \"x\\\"\ny\"; let b = r#\"raw\"#; let c = b\"by\"; }"));
        List<SyntaxToken> strings = tokens.stream()
            .filter(t -> t.kind() == STRING || t.kind() == BYTE_STRING).toList();
        assertEquals(3, strings.size());
        assertEquals("\"x\\\"\ny\"", strings.get(0).text());
        assertEquals("r#\"raw\"#", strings.get(1).text());
        assertEquals(BYTE_STRING, strings.get(2).kind());
    }

    @Test
    void attributesMoveIntoTheirItem() {
        SyntaxNode root = TreeSitterRustParser.parse("#[derive(Debug)]\n// lobster-trace: S.s\n#[repr(C)]\nstruct S;\n");
        SyntaxNode struct = only(root, STRUCT);
        assertEquals(2, struct.childrenOfKind(ATTR).size());
        assertEquals(1, struct.tokensOfKind(COMMENT).size());
        assertEquals(0, struct.textRange().start());
        assertTrue(root.childrenOfKind(ATTR).isEmpty());
    }

    @Test
    void innerAttributeStaysWithParent() {
        SyntaxNode root = TreeSitterRustParser.parse("#![allow(dead_code)]\nfn f() {}");
        assertEquals(1, root.childrenOfKind(ATTR).size());
        assertTrue(only(root, FN).childrenOfKind(ATTR).isEmpty());
    }

    @Test
    void keywordsAndPunctuationAreClassified() {
        SyntaxNode impl = only(TreeSitterRustParser.parse("impl A for B { fn c(); }"), IMPL);
        assertEquals(1, impl.tokensOfKind(IMPL_KW).size());
        SyntaxNode fn = only(only(impl, ASSOC_ITEM_LIST), FN);
        assertEquals(SEMICOLON, fn.lastChildOrToken().orElseThrow().kind());
    }

    @Test
    void navigationBetweenSiblings() {
        SyntaxNode root = TreeSitterRustParser.parse("fn a() {}\nstruct B;\n");
        SyntaxNode fn = only(root, FN);
        assertEquals(STRUCT, fn.nextSibling().kind());
        assertSame(fn, fn.nextSibling().prevSibling());
        assertSame(root, fn.parent());
        assertNull(root.parent());
    }

    @Test
    void invalidInputNeverThrows() {
        for (String source : List.of("fn (", "}}} impl for {", "struct", "mod ;", "impl", "#[", "fn f() -> {")) {
            SyntaxNode root = assertDoesNotThrow(() -> TreeSitterRustParser.parse(source));
            assertEquals(source, root.text());
        }
    }

    @Test
    void fixtureFilesRoundTrip() throws IOException {
        try (Stream<Path> files = Files.walk(FIXTURE_ROOT)) {
            for (Path file : files.filter(p -> p.toString().endsWith(".rs")).toList()) {
                String text = Files.readString(file);
                assertEquals(text, TreeSitterRustParser.parse(text).text(), "lossy parse of " + file);
            }
        }
    }

    @Test
    void fixtureMainDeclaresItems() throws IOException {
        SyntaxNode root = TreeSitterRustParser.parse(Files.readString(FIXTURE_ROOT.resolve("main.rs")));
        assertEquals(5, root.childrenOfKind(MODULE).size());
        assertEquals(2, root.childrenOfKind(FN).size());
        assertEquals(6, descendants(root, FN).size());
    }
}
