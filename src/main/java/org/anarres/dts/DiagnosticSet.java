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
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import javax.annotation.CheckForNull;
import javax.annotation.Nonnull;

import com.google.gson.JsonArray;
import com.google.gson.JsonObject;

/**
 * Diagnostics bucketed by the file their span points into.
 *
 * A single parse may touch several files through includes, so the
 * bucket is chosen from the span and not from the file being parsed.
 * Quick fixes are attached to the most recently pushed diagnostic.
 */
public class DiagnosticSet {

    private final Map<URI, List<Diagnostic>> diags = new LinkedHashMap<URI, List<Diagnostic>>();
    @CheckForNull
    private Diagnostic last;

    @Nonnull
    public Diagnostic push(@Nonnull Diagnostic diag) {
        URI uri = diag.getSpan().getUri();
        List<Diagnostic> list = diags.get(uri);
        if (list == null) {
            list = new ArrayList<Diagnostic>();
            diags.put(uri, list);
        }
        list.add(diag);
        last = diag;
        return diag;
    }

    @Nonnull
    public Diagnostic push(@Nonnull Span span, @Nonnull String message, @Nonnull Severity severity) {
        return push(new Diagnostic(span, message, severity));
    }

    /**
     * Attaches a fix to the last pushed diagnostic.
     *
     * @throws IllegalStateException if no diagnostic has been pushed.
     */
    @Nonnull
    public QuickFix pushAction(@Nonnull QuickFix fix) {
        if (last == null)
            throw new IllegalStateException("No diagnostic to attach '" + fix.getTitle() + "' to");
        last.addFix(fix);
        return fix;
    }

    @CheckForNull
    public Diagnostic getLast() {
        return last;
    }

    @Nonnull
    public List<Diagnostic> get(@Nonnull URI uri) {
        List<Diagnostic> list = diags.get(uri);
        if (list == null)
            return Collections.emptyList();
        return Collections.unmodifiableList(list);
    }

    @Nonnull
    public Set<URI> getUris() {
        return Collections.unmodifiableSet(diags.keySet());
    }

    @Nonnull
    public List<Diagnostic> all() {
        List<Diagnostic> result = new ArrayList<Diagnostic>();
        for (List<Diagnostic> list : diags.values())
            result.addAll(list);
        return result;
    }

    public void merge(@Nonnull DiagnosticSet other) {
        for (Map.Entry<URI, List<Diagnostic>> e : other.diags.entrySet()) {
            for (Diagnostic d : e.getValue())
                push(d);
        }
    }

    public int size() {
        int size = 0;
        for (List<Diagnostic> list : diags.values())
            size += list.size();
        return size;
    }

    public boolean isEmpty() {
        return size() == 0;
    }

    public int count(@Nonnull Severity severity) {
        int count = 0;
        for (List<Diagnostic> list : diags.values())
            for (Diagnostic d : list)
                if (d.getSeverity() == severity)
                    count++;
        return count;
    }

    @Nonnull
    public JsonObject toJson() {
        JsonObject result = new JsonObject();
        for (Map.Entry<URI, List<Diagnostic>> e : diags.entrySet()) {
            JsonArray list = new JsonArray();
            for (Diagnostic d : e.getValue())
                list.add(d.toJson());
            result.add(e.getKey().toString(), list);
        }
        return result;
    }

    @Override
    public String toString() {
        return toJson().toString();
    }
}
