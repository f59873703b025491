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
import java.util.EnumSet;
import java.util.List;
import java.util.Set;
import javax.annotation.CheckForNull;
import javax.annotation.Nonnull;

import com.google.gson.JsonArray;
import com.google.gson.JsonObject;
import com.google.gson.JsonPrimitive;

/**
 * A message attached to a raw source span, with optional quick fixes.
 */
public class Diagnostic {

    public enum Tag {
        UNNECESSARY,
        DEPRECATED
    }

    private final Span span;
    private final String message;
    private final Severity severity;
    private final Set<Tag> tags = EnumSet.noneOf(Tag.class);
    private final List<QuickFix> fixes = new ArrayList<QuickFix>();
    @CheckForNull
    private Span relatedSpan;
    @CheckForNull
    private String relatedMessage;

    public Diagnostic(@Nonnull Span span, @Nonnull String message, @Nonnull Severity severity) {
        this.span = span;
        this.message = message;
        this.severity = severity;
    }

    @Nonnull
    public Span getSpan() {
        return span;
    }

    @Nonnull
    public String getMessage() {
        return message;
    }

    @Nonnull
    public Severity getSeverity() {
        return severity;
    }

    @Nonnull
    public Set<Tag> getTags() {
        return Collections.unmodifiableSet(tags);
    }

    public void addTag(@Nonnull Tag tag) {
        tags.add(tag);
    }

    @Nonnull
    public List<QuickFix> getFixes() {
        return Collections.unmodifiableList(fixes);
    }

    /* pp */ void addFix(@Nonnull QuickFix fix) {
        fixes.add(fix);
    }

    public void setRelated(@Nonnull Span span, @Nonnull String message) {
        this.relatedSpan = span;
        this.relatedMessage = message;
    }

    @CheckForNull
    public Span getRelatedSpan() {
        return relatedSpan;
    }

    @CheckForNull
    public String getRelatedMessage() {
        return relatedMessage;
    }

    @Nonnull
    public JsonObject toJson() {
        JsonObject result = new JsonObject();
        result.add("range", span.toJson());
        result.addProperty("severity", severity.getText());
        result.addProperty("message", message);
        if (!tags.isEmpty()) {
            JsonArray t = new JsonArray();
            for (Tag tag : tags)
                t.add(new JsonPrimitive(tag.name().toLowerCase()));
            result.add("tags", t);
        }
        if (relatedSpan != null) {
            JsonObject related = new JsonObject();
            related.add("range", relatedSpan.toJson());
            related.addProperty("message", relatedMessage);
            result.add("related", related);
        }
        if (!fixes.isEmpty()) {
            JsonArray f = new JsonArray();
            for (QuickFix fix : fixes)
                f.add(fix.toJson());
            result.add("fixes", f);
        }
        return result;
    }

    @Override
    public String toString() {
        Position p = span.getStart();
        return span.getUri().getPath() + ":" + p + ": " + severity.getText() + ": " + message;
    }
}
