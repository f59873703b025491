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

import java.io.IOException;
import java.net.URI;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import static org.junit.jupiter.api.Assertions.*;

public class PreprocessorTest {

    private static final URI MAIN = Paths.get("/board/main.dts").toUri();
    private static final URI INC = Paths.get("/board/inc.dtsi").toUri();

    private OpenDocumentProvider provider;
    private DiagnosticSet diags;

    @BeforeEach
    public void setUp() {
        provider = new OpenDocumentProvider();
        diags = new DiagnosticSet();
    }

    private PreprocessedFile preprocess(String text) {
        return new Preprocessor(provider).preprocess(MAIN, text, diags);
    }

    private static List<String> texts(PreprocessedFile result) {
        List<String> out = new ArrayList<String>();
        for (Line line : result.getLines())
            out.add(line.getText());
        return out;
    }

    private List<String> messages() {
        List<String> out = new ArrayList<String>();
        for (Diagnostic d : diags.all())
            out.add(d.getMessage());
        return out;
    }

    @Test
    public void testObjectMacro() {
        PreprocessedFile result = preprocess("#define FOO 0x10\n/ { a = <FOO>; };");
        assertTrue(diags.isEmpty(), diags.toString());
        assertEquals(1, result.getLines().size());
        Line line = result.getLines().get(0);
        assertEquals("/ { a = <0x10>; };", line.getText());
        assertEquals("/ { a = <FOO>; };", line.getRaw());
        assertEquals(1, line.getNumber());
        assertNotNull(result.getMacros().get("FOO"));
    }

    @Test
    public void testFunctionMacro() {
        PreprocessedFile result = preprocess("#define ADD(a, b) ((a) + (b))\nx = <ADD(1, 2)>;");
        assertEquals(Arrays.asList("x = <((1) + (2))>;"), texts(result));
    }

    @Test
    public void testStringifyAndPaste() {
        PreprocessedFile result = preprocess("#define STR(x) #x\n#define CAT(a, b) a ## b\nSTR(hello)\nCAT(foo, bar)");
        assertEquals(Arrays.asList("\"hello\"", "foobar"), texts(result));
    }

    @Test
    public void testSelfReference() {
        PreprocessedFile result = preprocess("#define X X + 1\nX");
        assertEquals(Arrays.asList("X + 1"), texts(result));
    }

    @Test
    public void testArgumentCount() {
        preprocess("#define ADD(a, b) a + b\nADD(1)");
        assertEquals(Arrays.asList("Macro ADD expects 2 arguments, but got 1"), messages());
    }

    @Test
    public void testConditionals() {
        PreprocessedFile result = preprocess("#define A\n#ifdef A\nyes\n#else\nno\n#endif\n#ifndef A\nnot\n#endif");
        assertEquals(Arrays.asList("yes"), texts(result));
    }

    @Test
    public void testIfDefined() {
        PreprocessedFile result = preprocess("#if defined(A) && B > 1\none\n#elif 2 * 2 == 4\ntwo\n#else\nthree\n#endif");
        assertTrue(diags.isEmpty(), diags.toString());
        assertEquals(Arrays.asList("two"), texts(result));
    }

    @Test
    public void testUnterminatedConditional() {
        preprocess("#ifdef A\nfoo");
        assertEquals(Arrays.asList("Unterminated conditional"), messages());
        assertEquals(0, diags.getLast().getSpan().getStart().getLine());
    }

    @Test
    public void testStrayEndif() {
        preprocess("#endif");
        assertEquals(Arrays.asList("#endif without #if"), messages());
    }

    @Test
    public void testErrorDirective() {
        preprocess("#error Board not supported\n#warning Deprecated");
        assertEquals(Arrays.asList("Board not supported", "Deprecated"), messages());
        assertEquals(1, diags.count(Severity.ERROR));
        assertEquals(1, diags.count(Severity.WARNING));
    }

    @Test
    public void testErrorInInactiveBranch() {
        preprocess("#if 0\n#error unreachable\n#endif");
        assertTrue(diags.isEmpty(), diags.toString());
    }

    @Test
    public void testInclude() {
        provider.open(INC, "#define INC_VAL 7\ninc = <INC_VAL>;");
        PreprocessedFile result = preprocess("#include \"inc.dtsi\"\nmain = <INC_VAL>;");
        assertTrue(diags.isEmpty(), diags.toString());
        assertEquals(Arrays.asList("inc = <7>;", "main = <7>;"), texts(result));
        assertEquals(INC, result.getLines().get(0).getUri());
        assertEquals(MAIN, result.getLines().get(1).getUri());
        assertEquals(1, result.getIncludes().size());
        assertEquals(INC, result.getIncludes().get(0).getDst());
    }

    @Test
    public void testDtsInclude() {
        provider.open(INC, "inc;");
        PreprocessedFile result = preprocess("/include/ \"inc.dtsi\"\nmain;");
        assertEquals(Arrays.asList("inc;", "main;"), texts(result));
    }

    @Test
    public void testIncludePath() {
        provider.open(Paths.get("/inc/dt-bindings/gpio.h").toUri(), "#define GPIO_ACTIVE_LOW 1");
        Preprocessor pp = new Preprocessor(provider);
        pp.setIncludePath(Arrays.asList("/inc"));
        PreprocessedFile result = pp.preprocess(MAIN, "#include <dt-bindings/gpio.h>\nflags = <GPIO_ACTIVE_LOW>;", diags);
        assertTrue(diags.isEmpty(), diags.toString());
        assertEquals(Arrays.asList("flags = <1>;"), texts(result));
    }

    @Test
    public void testUnresolvedInclude() {
        preprocess("#include \"missing.h\"");
        assertEquals(Arrays.asList("Unable to resolve include missing.h"), messages());
        assertEquals(1, diags.get(MAIN).size());
    }

    @Test
    public void testIncludeReadFailure() {
        FileContentProvider failing = new FileContentProvider() {
            @Override
            public CompletableFuture<FileContent> read(URI uri) {
                CompletableFuture<FileContent> result = new CompletableFuture<FileContent>();
                result.completeExceptionally(new IOException("disk gone"));
                return result;
            }

            @Override
            public boolean exists(URI uri) {
                return true;
            }
        };
        PreprocessedFile result = new Preprocessor(failing).preprocess(MAIN, "#include \"inc.dtsi\"\n/ { };", diags);
        assertEquals(1, diags.size());
        assertTrue(messages().get(0).startsWith("Unable to resolve include inc.dtsi: "), messages().get(0));
        assertTrue(messages().get(0).contains("disk gone"));
        assertEquals(Arrays.asList("/ { };"), texts(result));
    }

    @Test
    public void testRecursiveInclude() {
        provider.open(INC, "#include \"inc.dtsi\"");
        preprocess("#include \"inc.dtsi\"");
        assertEquals(Arrays.asList("Recursive include of inc.dtsi"), messages());
        // Reported against the file that contains the directive.
        assertEquals(1, diags.get(INC).size());
    }

    @Test
    public void testMacrosChain() {
        PreprocessedFile first = preprocess("#define FOO 3");
        Preprocessor pp = new Preprocessor(provider, first.getMacros());
        PreprocessedFile second = pp.preprocess(INC, "x = <FOO>;", diags);
        assertEquals(Arrays.asList("x = <3>;"), texts(second));
    }

    @Test
    public void testBuiltins() {
        PreprocessedFile result = preprocess("a\nx = __LINE__");
        assertEquals("x = 2", result.getLines().get(1).getText());
    }

    @Test
    public void testBlockComment() {
        PreprocessedFile result = preprocess("#define FOO 1\n/* FOO\nFOO */ FOO");
        assertEquals(Arrays.asList("/* FOO", "FOO */ 1"), texts(result));
    }

    @Test
    public void testAddMacro() {
        Preprocessor pp = new Preprocessor(provider);
        pp.addMacro("ENABLED");
        pp.addMacro("SIZE", "0x100");
        PreprocessedFile result = pp.preprocess(MAIN, "#ifdef ENABLED\nsize = <SIZE>;\n#endif", diags);
        assertEquals(Arrays.asList("size = <0x100>;"), texts(result));
        assertEquals("1", pp.getMacro("ENABLED").getText());
    }

    @Test
    public void testText() {
        PreprocessedFile result = preprocess("#define A 1\nfoo = <A>;\nbar;");
        assertEquals("foo = <1>;\nbar;\n", result.getText());
    }
}
