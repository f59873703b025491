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

import org.junit.jupiter.api.Test;
import static org.junit.jupiter.api.Assertions.*;

public class PrinterTest {

    private final ContextFixture fixture = new ContextFixture();

    @Test
    public void testRoot() {
        DtsContext ctx = fixture.board("/ { compatible = \"foo\"; node@10 { reg = <0x10 0x20>; }; };");
        assertEquals("/ {\n    compatible = \"foo\";\n\n    node@10 {\n        reg = < 0x10 0x20 >;\n    };\n};",
                ctx.getRoot().toString(true, ""));
    }

    @Test
    public void testCollapsed() {
        DtsContext ctx = fixture.board("/ { a { x; }; b { }; };");
        assertEquals("/ {\n    a { /* ... */ };\n\n    b { /* ... */ };\n};", ctx.getRoot().toString(false, ""));
    }

    @Test
    public void testValues() {
        DtsContext ctx = fixture.board("/ { n = <(1 + 2) 0xA 7>; b = [0a]; p = <&lbl 1>, &{/x}; d; };");
        Node root = ctx.getRoot();
        assertEquals("n = < (1 + 2) 0xa 7 >", root.property("n").toString());
        assertEquals("b = [ 0a ]", root.property("b").toString());
        assertEquals("p = < &lbl 1 >, &{/x}", root.property("p").toString());
        assertEquals("d", root.property("d").toString());
    }

    @Test
    public void testWrapping() {
        StringBuilder decl = new StringBuilder("compatible = ");
        for (int i = 0; i < 6; i++) {
            if (i > 0)
                decl.append(", ");
            decl.append("\"vendor,device-").append(i).append('"');
        }
        DtsContext ctx = fixture.board("/ { " + decl + "; };");
        String text = ctx.getRoot().property("compatible").toString(4);
        String[] lines = text.split("\n");
        assertEquals(6, lines.length);
        assertEquals("compatible = \"vendor,device-0\",", lines[0]);
        assertEquals("                 \"vendor,device-1\",", lines[1]);
    }

    @Test
    public void testEntry() {
        DtsContext ctx = fixture.board("/ { node { a = <1>; }; };");
        NodeEntry entry = ctx.lookupNode("/node").getEntries().get(0);
        assertEquals("node {\n\ta = < 1 >;\n}", entry.toString(""));
    }

    @Test
    public void testTombstone() {
        DtsContext ctx = fixture.board("/ { a; /delete-property/ a; };");
        Property tombstone = ctx.getRoot().getEntries().get(0).getProperties().get(1);
        assertEquals("/delete-property/ a", tombstone.toString());
    }
}
