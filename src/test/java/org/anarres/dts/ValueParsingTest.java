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
import java.util.ArrayList;
import java.util.List;
import java.util.Random;
import java.util.regex.Pattern;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import static org.junit.jupiter.api.Assertions.*;

public class ValueParsingTest {

    private static final URI URI = Paths.get("/board/test.dts").toUri();

    private DiagnosticSet diags;

    @BeforeEach
    public void setUp() {
        diags = new DiagnosticSet();
    }

    private TokenCursor cursor(String text) {
        List<Line> lines = new ArrayList<Line>();
        String[] raw = text.split("\n", -1);
        for (int i = 0; i < raw.length; i++)
            lines.add(new Line(raw[i], i, URI));
        return new TokenCursor(URI, lines, diags);
    }

    private List<PropertyValue> parse(String text) {
        return ValueListParser.parse(cursor(text));
    }

    private PropertyValue single(String text) {
        List<PropertyValue> values = parse(text);
        assertEquals(1, values.size(), "values of " + text);
        return values.get(0);
    }

    @Test
    public void testArray() {
        ArrayValue v = (ArrayValue) single("<0x10 0x20>;");
        assertTrue(diags.isEmpty(), diags.toString());
        assertEquals("< 0x10 0x20 >", v.toString());
        assertArrayEquals(new long[]{16, 32}, v.toLongArray());
        assertTrue(v.isNumberArray());

        assertEquals("< 1 2 >", single("<  1\t2 >;").toString());
        assertEquals("< >", single("<>;").toString());
    }

    /** Whitespace-normalizes array text the way values print: single spaces, canonical hex. */
    private static String normalize(String text) {
        StringBuilder buf = new StringBuilder("<");
        for (String cell : text.substring(1, text.length() - 1).trim().split("\\s+")) {
            if (cell.isEmpty())
                continue;
            if (cell.startsWith("0x") || cell.startsWith("0X")) {
                String digits = cell.substring(2).toLowerCase().replaceFirst("^0+(?=.)", "");
                cell = "0x" + digits;
            }
            buf.append(' ').append(cell);
        }
        return buf.append(" >").toString();
    }

    @Test
    public void testArrayRoundTrip() {
        String[] separators = {" ", "  ", "\t", " \t "};
        Random random = new Random(42);
        for (int n = 0; n < 200; n++) {
            StringBuilder text = new StringBuilder("<");
            int count = random.nextInt(9);
            for (int i = 0; i < count; i++) {
                long value = random.nextInt() & 0xffffffffL;
                String cell;
                switch (random.nextInt(4)) {
                    case 0:
                        cell = Long.toString(value);
                        break;
                    case 1:
                        cell = "0x" + Long.toHexString(value);
                        break;
                    case 2:
                        cell = "0x" + Long.toHexString(value).toUpperCase();
                        break;
                    default:
                        cell = "0x00" + Long.toHexString(value);
                        break;
                }
                text.append(separators[random.nextInt(separators.length)]).append(cell);
            }
            text.append(separators[random.nextInt(separators.length)]).append('>');

            setUp();
            PropertyValue value = single(text + ";");
            assertTrue(diags.isEmpty(), text + ": " + diags);
            assertEquals(normalize(text.toString()), value.toString(), text.toString());
        }
        assertEquals("< 0xab 0x10 >", normalize("<0xAB 0x0010>"));
    }

    @Test
    public void testArrayAcrossLines() {
        ArrayValue v = (ArrayValue) single("<1\n\t2>;");
        assertEquals(2, v.size());
        assertEquals(0, v.getSpan().getStart().getLine());
        assertEquals(1, v.getSpan().getEnd().getLine());
    }

    @Test
    public void testExpression() {
        ArrayValue v = (ArrayValue) single("<(1 << 4) 2>;");
        assertTrue(diags.isEmpty(), diags.toString());
        PropertyValue cell = v.getCells().get(0);
        assertEquals(PropertyValue.Kind.EXPRESSION, cell.getKind());
        assertEquals(16, ((ExpressionValue) cell).getValue());
        assertEquals("(1 << 4)", ((ExpressionValue) cell).getRaw());
        assertEquals("< (1 << 4) 2 >", v.toString());
    }

    @Test
    public void testDivisionByZero() {
        ArrayValue v = (ArrayValue) single("<(1 / 0)>;");
        assertEquals(1, diags.size());
        assertEquals("Unable to evaluate expression: Division by zero", diags.getLast().getMessage());
        assertEquals(0, ((IntValue) v.getCells().get(0)).getValue());
    }

    @Test
    public void testString() {
        StringValue v = (StringValue) single("\"hello \\\"world\\\"\";");
        assertEquals("hello \\\"world\\\"", v.getValue());

        List<PropertyValue> values = parse("\"a\", \"b\";");
        assertEquals(2, values.size());
        assertEquals("\"b\"", values.get(1).toString());
    }

    @Test
    public void testBytestring() {
        BytestringValue v = (BytestringValue) single("[0a 1B ff];");
        assertTrue(diags.isEmpty(), diags.toString());
        assertEquals(3, v.size());
        assertEquals("[ 0a 1b ff ]", v.toString());
    }

    @Test
    public void testPHandles() {
        PHandle label = (PHandle) single("&uart0;");
        assertEquals(PHandle.RefKind.LABEL_REF, label.getRefKind());
        assertEquals("uart0", label.getLabel());

        PHandle path = (PHandle) single("&{/soc/uart@1000};");
        assertEquals(PHandle.RefKind.PATH_REF, path.getRefKind());
        assertEquals("/soc/uart@1000", path.getReference());
        assertNull(path.getLabel());

        ArrayValue cells = (ArrayValue) single("<&gpio0 3 0>;");
        assertFalse(cells.isNumberArray());
        assertNull(cells.toLongArray());
        assertEquals(PropertyValue.Kind.PHANDLE, cells.getCells().get(0).getKind());
    }

    @Test
    public void testBoolean() {
        PropertyValue v = single(";");
        assertEquals(PropertyValue.Kind.BOOL, v.getKind());
    }

    @Test
    public void testMixed() {
        List<PropertyValue> values = parse("\"a\", <1>, [00];");
        assertEquals(3, values.size());
        assertEquals(PropertyValue.Kind.STRING, values.get(0).getKind());
        assertEquals(PropertyValue.Kind.ARRAY, values.get(1).getKind());
        assertEquals(PropertyValue.Kind.BYTESTRING, values.get(2).getKind());
    }

    @Test
    public void testMissingComma() {
        List<PropertyValue> values = parse("\"a\" \"b\";");
        assertEquals(2, values.size());
        assertEquals(1, diags.size());
        Diagnostic d = diags.getLast();
        assertEquals("Expected comma between property values", d.getMessage());
        assertEquals("Separate values by comma", d.getFixes().get(0).getTitle());
        assertTrue(d.getFixes().get(0).isPreferred());
    }

    @Test
    public void testBareNumber() {
        List<PropertyValue> values = parse("5;");
        assertTrue(values.isEmpty());
        Diagnostic d = diags.getLast();
        assertEquals("Missing < > brackets around number", d.getMessage());
        QuickFix fix = d.getFixes().get(0);
        assertEquals("Add brackets", fix.getTitle());
        assertEquals("< 5 >", fix.getEdits().get(0).getNewText());
    }

    @Test
    public void testUnterminated() {
        ArrayValue v = (ArrayValue) single("<1 2;");
        assertEquals(2, v.size());
        assertEquals(1, diags.size());
        Diagnostic d = diags.getLast();
        assertEquals("Unterminated expression", d.getMessage());
        assertEquals(new Position(0, 0), d.getSpan().getStart());
        assertEquals("Add closing bracket", d.getFixes().get(0).getTitle());
        assertEquals(" >", d.getFixes().get(0).getEdits().get(0).getNewText());
    }

    @Test
    public void testUnbracedOperator() {
        ArrayValue v = (ArrayValue) single("<1 + 2>;");
        assertEquals(2, v.size());
        assertEquals("Expression without a surrounding parenthesis", diags.getLast().getMessage());
    }

    @Test
    public void testSyntaxError() {
        ArrayValue v = (ArrayValue) single("<1 foo>;");
        assertEquals(1, v.size());
        assertEquals("Syntax error", diags.getLast().getMessage());
    }

    @Test
    public void testStopsAtSemicolon() {
        TokenCursor cursor = cursor("<1>; next");
        ValueListParser.parse(cursor);
        assertNotNull(cursor.match(Pattern.compile(";")));
    }
}
