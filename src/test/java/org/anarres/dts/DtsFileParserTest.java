/*
 * Anarres C Preprocessor
 * Copyright (c) 2007-2015, Shevek
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express
 * or implied.  See the License for the specific language governing
 * permissions and limitations under the License.
 */
package org.anarres.dts;

import java.net.URI;
import java.nio.file.Paths;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import static org.anarres.dts.ContextFixture.BOARD;
import static org.anarres.dts.ContextFixture.find;
import static org.anarres.dts.ContextFixture.messages;
import static org.junit.jupiter.api.Assertions.*;

public class DtsFileParserTest {

    private ContextFixture fixture;

    @BeforeEach
    public void setUp() {
        fixture = new ContextFixture();
    }

    @Test
    public void testEmptyRoot() {
        DtsContext ctx = fixture.board("/dts-v1/;\n\n/ { };\n");
        assertEquals(Collections.emptyList(), messages(ctx));
        Node root = ctx.getRoot();
        assertNotNull(root);
        assertTrue(root.isRoot());
        assertEquals("/", root.getPath());
        assertTrue(root.uniqueProperties().isEmpty());
        assertTrue(root.children().isEmpty());
        assertEquals(1, ctx.getRoots().size());
    }

    @Test
    public void testNestedNodes() {
        DtsContext ctx = fixture.board("/ {\n\tsoc {\n\t\tuart0: uart@1000 {\n\t\t\tstatus = \"okay\";\n\t\t};\n\t};\n};");
        assertEquals(Collections.emptyList(), messages(ctx));
        Node uart = ctx.lookupNode("/soc/uart@1000");
        assertNotNull(uart);
        assertEquals("uart", uart.getName());
        assertEquals("uart@1000", uart.getFullName());
        assertEquals("1000", uart.getUnitAddress());
        assertEquals(Long.valueOf(0x1000), uart.getAddress());
        assertEquals("/soc/uart@1000/", uart.getPath());
        assertEquals("/soc/", uart.getParent().getPath());
        assertSame(uart, ctx.lookupNode("&uart0"));
        assertEquals(Arrays.asList("uart0"), uart.labels());
        assertEquals("&uart0", uart.refName());

        NodeEntry entry = uart.getEntries().get(0);
        assertEquals(2, entry.getDepth());
        assertEquals(2, entry.getNameSpan().getStart().getLine());
        assertEquals(4, entry.getSpan().getEnd().getLine());
    }

    @Test
    public void testTopLevelNode() {
        DtsContext ctx = fixture.board("node@10 { };");
        Node node = ctx.lookupNode("/node@10");
        assertNotNull(node);
        assertSame(ctx.getRoot(), node.getParent());
    }

    @Test
    public void testMissingSemicolon() {
        DtsContext ctx = fixture.board("/ { a = <1> };");
        assertEquals(Arrays.asList("Missing semicolon"), messages(ctx));
        QuickFix fix = find(ctx, "Missing semicolon").getFixes().get(0);
        assertEquals("Add semicolon", fix.getTitle());
        assertTrue(fix.isPreferred());
        assertEquals(Long.valueOf(1), ctx.getRoot().property("a").getNumber());
    }

    @Test
    public void testExpectedSemicolonAtEnd() {
        DtsContext ctx = fixture.board("/ { }");
        assertEquals(Arrays.asList("Expected semicolon"), messages(ctx));
    }

    @Test
    public void testUnexpectedClosingBracket() {
        DtsContext ctx = fixture.board("/ { };\n};");
        Diagnostic d = find(ctx, "Unexpected closing bracket");
        assertNotNull(d);
        assertEquals(1, d.getSpan().getStart().getLine());
        assertEquals("Delete unnecessary closing bracket", d.getFixes().get(0).getTitle());
        assertTrue(d.getFixes().get(0).getEdits().get(0).isDelete());
    }

    @Test
    public void testUnexpectedToken() {
        DtsContext ctx = fixture.board("/ { a = <1>; $ };");
        assertEquals(Arrays.asList("Unexpected token"), messages(ctx));
        assertEquals("Delete invalid token", find(ctx, "Unexpected token").getFixes().get(0).getTitle());
    }

    @Test
    public void testUnterminatedNode() {
        DtsContext ctx = fixture.board("/ {\n\tnode {\n\t\ta = <1>;");
        assertEquals(Arrays.asList("Unterminated node", "Unterminated node"), messages(ctx));
        List<Diagnostic> diags = ctx.getDiagnostics().all();
        // Innermost first.
        assertEquals(1, diags.get(0).getSpan().getStart().getLine());
        assertEquals("\n\t};\n", diags.get(0).getFixes().get(0).getEdits().get(0).getNewText());
        assertEquals(0, diags.get(1).getSpan().getStart().getLine());
        assertEquals("\n\t};\n};\n", diags.get(1).getFixes().get(0).getEdits().get(0).getNewText());
        // The partial content is kept.
        assertEquals(Long.valueOf(1), ctx.lookupNode("/node").property("a").getNumber());
    }

    @Test
    public void testLeadingZeros() {
        DtsContext ctx = fixture.board("/ { node@0010 { }; };");
        Diagnostic d = find(ctx, "Address should not start with leading 0's");
        assertNotNull(d);
        assertEquals(Severity.WARNING, d.getSeverity());
        QuickFix fix = d.getFixes().get(0);
        assertEquals("Trim leading 0's", fix.getTitle());
        Span span = fix.getEdits().get(0).getSpan();
        assertEquals(new Position(0, 9), span.getStart());
        assertEquals(new Position(0, 11), span.getEnd());

        assertNull(find(fixture.board("/ { node@0 { }; };"), "Address should not start with leading 0's"));
    }

    @Test
    public void testAddressOnProperty() {
        DtsContext ctx = fixture.board("/ { a@1 = <1>; };");
        assertNotNull(find(ctx, "Only nodes have addresses. Expecting opening node block"));
    }

    @Test
    public void testPropertyOutsideNode() {
        DtsContext ctx = fixture.board("a = <1>;");
        assertEquals(Arrays.asList("Property outside of node context"), messages(ctx));
    }

    @Test
    public void testUnknownLabel() {
        DtsContext ctx = fixture.board("&missing { a = <1>; };");
        assertEquals(Arrays.asList("Unknown label"), messages(ctx));
        NodeEntry entry = ctx.getRoots().get(0);
        assertEquals("&missing", entry.getRef());
        assertTrue(entry.getNode().isPlaceholder());
        assertEquals(1, entry.getProperties().size());
    }

    @Test
    public void testReferenceWithoutBlock() {
        DtsContext ctx = fixture.board("/ { foo: a { }; };\n&foo;");
        assertTrue(messages(ctx).contains("References can only be made to nodes"));
    }

    @Test
    public void testLabelReopen() {
        DtsContext ctx = fixture.board("/ { foo: a { x = <1>; }; };\n&foo { y = <2>; };\n&{/a} { z; };");
        assertEquals(Collections.emptyList(), messages(ctx));
        Node a = ctx.lookupNode("/a");
        assertEquals(3, a.getEntries().size());
        assertEquals(3, a.uniqueProperties().size());
        assertTrue(a.property("z").isBoolean());
    }

    @Test
    public void testNestedReferenceIsNotRoot() {
        DtsContext ctx = fixture.board("/ { foo: a { }; b { &foo { x; }; }; };\n&foo { y; };");
        List<NodeEntry> roots = ctx.getRoots();
        assertEquals(2, roots.size());
        assertTrue(roots.get(0).getNode().isRoot());
        assertEquals("&foo", roots.get(1).getRef());
        assertEquals(3, ctx.lookupNode("/a").getEntries().size());
        assertTrue(ctx.lookupNode("/a").property("x").isBoolean());
    }

    @Test
    public void testPropertyLabels() {
        DtsContext ctx = fixture.board("/ { lbl: a = <1>; };");
        assertEquals(Arrays.asList("lbl"), ctx.getRoot().property("a").getLabels());
    }

    @Test
    public void testDanglingLabel() {
        DtsContext ctx = fixture.board("/ { lbl: };");
        assertEquals(Arrays.asList("Expected node or property after label"), messages(ctx));
    }

    @Test
    public void testDeleteNode() {
        DtsContext ctx = fixture.board("/ { foo: node { }; other { }; };\n/delete-node/ &foo;\n/ { /delete-node/ other; };");
        assertEquals(Collections.emptyList(), messages(ctx));
        assertNotNull(ctx.lookupNode("/node").getDeleted());
        assertTrue(ctx.lookupNode("/other").isDeleted());
        assertTrue(ctx.getRoot().toString(true, "").indexOf("node") < 0);
    }

    @Test
    public void testDeleteNodeByPath() {
        DtsContext ctx = fixture.board("/ { a { b { }; }; };\n/delete-node/ &{/a};");
        assertTrue(ctx.lookupNode("/a").isDeleted());
        // Children of a deleted node are deleted too.
        assertTrue(ctx.lookupNode("/a/b").isDeleted());
    }

    @Test
    public void testRedeclaredAfterDelete() {
        DtsContext ctx = fixture.board("/ { node { a; }; };\n/delete-node/ &{/node};\n/ { node { b; }; };");
        Node node = ctx.lookupNode("/node");
        assertNull(node.getDeleted());
        assertNull(node.property("a"));
        assertNotNull(node.property("b"));
    }

    @Test
    public void testDeleteUnknownNode() {
        DtsContext ctx = fixture.board("/delete-node/ &nothing;");
        Diagnostic d = find(ctx, "Unknown node");
        assertNotNull(d);
        assertEquals(Severity.WARNING, d.getSeverity());
    }

    @Test
    public void testDeleteProperty() {
        DtsContext ctx = fixture.board("/ { foo = <2>; bar; /delete-property/ foo; };");
        assertEquals(Collections.emptyList(), messages(ctx));
        Node root = ctx.getRoot();
        assertNull(root.property("foo"));
        assertNotNull(root.property("bar"));
        // The tombstone is kept on the entry.
        assertTrue(root.getEntries().get(0).getProperties().get(2).isDeleted());
    }

    @Test
    public void testDeletePropertyErrors() {
        assertEquals(Arrays.asList("Can only delete properties inside a node"),
                messages(fixture.board("/delete-property/ foo;")));
        Diagnostic d = find(fixture.board("/ { /delete-property/ foo; };"), "Unknown property");
        assertEquals(Severity.WARNING, d.getSeverity());
    }

    @Test
    public void testRedefineAfterDeleteProperty() {
        DtsContext ctx = fixture.board("/ { foo = <2>; /delete-property/ foo; foo = <1>; };");
        assertEquals("< 1 >", ctx.getRoot().property("foo").valueString(0));
    }

    @Test
    public void testPluginAndMemreserve() {
        DtsContext ctx = fixture.board("/dts-v1/;\n/plugin/;\n/memreserve/ 0x1000 0x100;\n/ { };");
        assertEquals(Collections.emptyList(), messages(ctx));
        DtsFile file = ctx.getBoard();
        assertTrue(file.isPlugin());
        assertEquals(1, file.getMemreserves().size());
        assertArrayEquals(new long[]{0x1000, 0x100}, file.getMemreserves().get(0));

        assertEquals(Arrays.asList("Expected address and size"), messages(fixture.board("/memreserve/ 0x1000;")));
    }

    @Test
    public void testPositionQueries() {
        DtsContext ctx = fixture.board("/ {\n\tnode {\n\t\tprop = <1 2>;\n\t};\n};");
        assertEquals("/node/", ctx.nodeAt(BOARD, new Position(2, 3)).getPath());
        assertEquals("/", ctx.nodeAt(BOARD, new Position(0, 2)).getPath());
        Property prop = ctx.propertyAt(BOARD, new Position(2, 4));
        assertEquals("prop", prop.getName());
        assertEquals("/node/prop", prop.getPath());
        PropertyValue v = prop.valueAt(BOARD, new Position(2, 11));
        assertNotNull(v);
        assertNull(ctx.nodeAt(BOARD, new Position(10, 0)));
    }

    @Test
    public void testMacroExpansion() {
        DtsContext ctx = fixture.board("#define ADDR 0x10\n/ { a = <ADDR>; };");
        assertEquals(Collections.emptyList(), messages(ctx));
        assertEquals(Long.valueOf(16), ctx.getRoot().property("a").getNumber());
        assertNotNull(ctx.getMacros().get("ADDR"));
    }

    @Test
    public void testDiagnosticInMacroMapsToRawText() {
        DtsContext ctx = fixture.board("#define VAL (1 / 0)\n/ { a = <VAL>; };");
        Diagnostic d = find(ctx, "Unable to evaluate expression: Division by zero");
        assertNotNull(d);
        assertEquals(new Position(1, 9), d.getSpan().getStart());
        assertEquals(new Position(1, 12), d.getSpan().getEnd());
    }

    @Test
    public void testIncludedFile() {
        URI inc = Paths.get("/board/common.dtsi").toUri();
        fixture.provider.open(inc, "/ {\n\tcommon { };\n};");
        DtsContext ctx = fixture.board("#include \"common.dtsi\"\n/ { board { }; };");
        assertEquals(Collections.emptyList(), messages(ctx));
        assertNotNull(ctx.lookupNode("/common"));
        assertTrue(ctx.has(inc));
        assertSame(ctx.getBoard(), ctx.file(inc));
        assertEquals("/common/", ctx.nodeAt(inc, new Position(1, 3)).getPath());
    }

    @Test
    public void testUnreadableBoardInclude() {
        DtsContext ctx = fixture.board("#include \"gone.dtsi\"\n/ { };");
        assertEquals(Arrays.asList("Unable to resolve include gone.dtsi"), messages(ctx));
    }
}
