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
import com.google.gson.JsonArray;
import com.google.gson.JsonObject;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.function.Executable;
import static org.junit.jupiter.api.Assertions.*;

public class DiagnosticSetTest {

    private static final URI A = Paths.get("/board/a.dts").toUri();
    private static final URI B = Paths.get("/board/b.dtsi").toUri();

    @Test
    public void testBucketsBySpan() {
        DiagnosticSet diags = new DiagnosticSet();
        diags.push(new Span(A, 0, 0, 0, 1), "first", Severity.ERROR);
        diags.push(new Span(B, 3, 0, 3, 1), "second", Severity.WARNING);
        diags.push(new Span(A, 1, 0, 1, 1), "third", Severity.HINT);

        assertEquals(3, diags.size());
        assertEquals(2, diags.get(A).size());
        assertEquals("third", diags.get(A).get(1).getMessage());
        assertEquals(1, diags.get(B).size());
        assertTrue(diags.get(Paths.get("/other").toUri()).isEmpty());
        assertEquals(1, diags.count(Severity.ERROR));
        assertEquals("third", diags.getLast().getMessage());
    }

    @Test
    public void testActionsAttachToLast() {
        final DiagnosticSet diags = new DiagnosticSet();
        assertThrows(IllegalStateException.class, new Executable() {
            @Override
            public void execute() throws Throwable {
                diags.pushAction(new QuickFix("Nothing", QuickFix.Kind.QUICK_FIX));
            }
        });

        diags.push(new Span(A, 0, 4, 0, 5), "Missing semicolon", Severity.ERROR);
        QuickFix fix = diags.pushAction(new QuickFix("Add semicolon", QuickFix.Kind.QUICK_FIX))
                .addEdit(TextEdit.insert(Span.at(A, new Position(0, 5)), ";"))
                .setPreferred(true);
        assertSame(fix, diags.getLast().getFixes().get(0));
        assertTrue(fix.getEdits().get(0).isInsert());
    }

    @Test
    public void testMerge() {
        DiagnosticSet a = new DiagnosticSet();
        a.push(new Span(A, 0, 0, 0, 1), "a", Severity.ERROR);
        DiagnosticSet b = new DiagnosticSet();
        b.push(new Span(A, 1, 0, 1, 1), "b", Severity.ERROR);
        b.push(new Span(B, 1, 0, 1, 1), "c", Severity.ERROR);
        a.merge(b);
        assertEquals(3, a.size());
        assertEquals(2, a.get(A).size());
        assertEquals(2, a.getUris().size());
    }

    @Test
    public void testJson() {
        DiagnosticSet diags = new DiagnosticSet();
        Diagnostic d = diags.push(new Span(A, 2, 4, 2, 9), "Disabled", Severity.HINT);
        d.addTag(Diagnostic.Tag.UNNECESSARY);
        d.setRelated(new Span(B, 0, 0, 0, 6), "Disabled here");

        JsonObject json = diags.toJson();
        JsonArray list = json.getAsJsonArray(A.toString());
        assertEquals(1, list.size());
        JsonObject first = list.get(0).getAsJsonObject();
        assertEquals("Disabled", first.get("message").getAsString());
        assertEquals(Severity.HINT.getText(), first.get("severity").getAsString());
        assertEquals("unnecessary", first.getAsJsonArray("tags").get(0).getAsString());
        assertEquals(4, first.getAsJsonObject("range").getAsJsonObject("start").get("character").getAsInt());
        assertEquals("Disabled here", first.getAsJsonObject("related").get("message").getAsString());
    }

    @Test
    public void testSpans() {
        Span span = new Span(A, 1, 2, 3, 4);
        assertTrue(span.contains(A, new Position(2, 0)));
        assertFalse(span.contains(B, new Position(2, 0)));
        assertFalse(span.contains(A, new Position(3, 5)));
        assertEquals(new Span(A, 0, 0, 3, 4), span.union(new Span(A, 0, 0, 0, 1)));
        assertSame(span, span.union(new Span(B, 0, 0, 0, 1)));
        assertEquals(new Span(A, 1, 2, 5, 0), span.extendTo(new Span(A, 4, 0, 5, 0)));
        assertTrue(span.intersects(new Span(A, 3, 4, 6, 0)));
        assertFalse(span.intersects(new Span(A, 3, 5, 6, 0)));
    }
}
