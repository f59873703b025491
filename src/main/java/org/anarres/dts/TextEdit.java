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

import javax.annotation.Nonnull;

import com.google.gson.JsonObject;

/**
 * Replaces the text covered by a span.
 * An empty span is an insertion, an empty replacement a deletion.
 */
public final class TextEdit {

    private final Span span;
    private final String newText;

    public TextEdit(@Nonnull Span span, @Nonnull String newText) {
        this.span = span;
        this.newText = newText;
    }

    @Nonnull
    public static TextEdit insert(@Nonnull Span at, @Nonnull String text) {
        return new TextEdit(at.endSpan(), text);
    }

    @Nonnull
    public static TextEdit delete(@Nonnull Span span) {
        return new TextEdit(span, "");
    }

    @Nonnull
    public Span getSpan() {
        return span;
    }

    @Nonnull
    public String getNewText() {
        return newText;
    }

    public boolean isInsert() {
        return span.isEmpty();
    }

    public boolean isDelete() {
        return newText.isEmpty() && !span.isEmpty();
    }

    @Nonnull
    public JsonObject toJson() {
        JsonObject result = new JsonObject();
        result.add("range", span.toJson());
        result.addProperty("newText", newText);
        return result;
    }

    @Override
    public String toString() {
        return toJson().toString();
    }
}
