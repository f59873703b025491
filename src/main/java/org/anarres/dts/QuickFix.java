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

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import javax.annotation.Nonnull;

import com.google.gson.JsonArray;
import com.google.gson.JsonObject;

/**
 * An edit-producing action attached to a {@link Diagnostic}.
 */
public class QuickFix {

    public enum Kind {
        QUICK_FIX,
        REFACTOR
    }

    private final String title;
    private final Kind kind;
    private final List<TextEdit> edits = new ArrayList<TextEdit>();
    private boolean preferred;

    public QuickFix(@Nonnull String title, @Nonnull Kind kind) {
        this.title = title;
        this.kind = kind;
    }

    @Nonnull
    public String getTitle() {
        return title;
    }

    @Nonnull
    public Kind getKind() {
        return kind;
    }

    @Nonnull
    public List<TextEdit> getEdits() {
        return Collections.unmodifiableList(edits);
    }

    @Nonnull
    public QuickFix addEdit(@Nonnull TextEdit edit) {
        edits.add(edit);
        return this;
    }

    public boolean isPreferred() {
        return preferred;
    }

    @Nonnull
    public QuickFix setPreferred(boolean preferred) {
        this.preferred = preferred;
        return this;
    }

    @Nonnull
    public JsonObject toJson() {
        JsonObject result = new JsonObject();
        result.addProperty("title", title);
        result.addProperty("kind", kind.name().toLowerCase());
        if (preferred)
            result.addProperty("preferred", true);
        JsonArray e = new JsonArray();
        for (TextEdit edit : edits)
            e.add(edit.toJson());
        result.add("edits", e);
        return result;
    }

    @Override
    public String toString() {
        return toJson().toString();
    }
}
