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
import javax.annotation.Nonnull;

import com.google.gson.JsonObject;

/**
 * A range of raw source text in one file.
 *
 * Spans are always expressed against the text the user wrote, never
 * against preprocessor output. The end position is exclusive for
 * edits but inclusive for {@link #contains(URI, Position)}, so a
 * cursor placed right after a token still hits it.
 */
public final class Span {

    private final URI uri;
    private final Position start;
    private final Position end;

    public Span(@Nonnull URI uri, @Nonnull Position start, @Nonnull Position end) {
        this.uri = uri;
        if (end.isBefore(start)) {
            this.start = end;
            this.end = start;
        } else {
            this.start = start;
            this.end = end;
        }
    }

    public Span(@Nonnull URI uri, int startLine, int startCharacter, int endLine, int endCharacter) {
        this(uri, new Position(startLine, startCharacter), new Position(endLine, endCharacter));
    }

    /** An empty span at the given position. */
    @Nonnull
    public static Span at(@Nonnull URI uri, @Nonnull Position position) {
        return new Span(uri, position, position);
    }

    @Nonnull
    public URI getUri() {
        return uri;
    }

    @Nonnull
    public Position getStart() {
        return start;
    }

    @Nonnull
    public Position getEnd() {
        return end;
    }

    public boolean isEmpty() {
        return start.equals(end);
    }

    public boolean isSingleLine() {
        return start.getLine() == end.getLine();
    }

    public boolean contains(@Nonnull URI uri, @Nonnull Position position) {
        return this.uri.equals(uri)
                && !position.isBefore(start)
                && !position.isAfter(end);
    }

    public boolean contains(@Nonnull Span other) {
        return uri.equals(other.uri)
                && !other.start.isBefore(start)
                && !other.end.isAfter(end);
    }

    public boolean intersects(@Nonnull Span other) {
        return uri.equals(other.uri)
                && !other.end.isBefore(start)
                && !other.start.isAfter(end);
    }

    /**
     * Returns the smallest span covering both spans.
     * Spans in different files cannot be joined; this span is returned as is.
     */
    @Nonnull
    public Span union(@Nonnull Span other) {
        if (!uri.equals(other.uri))
            return this;
        Position s = other.start.isBefore(start) ? other.start : start;
        Position e = other.end.isAfter(end) ? other.end : end;
        return new Span(uri, s, e);
    }

    /** Returns a span from the start of this span to the end of {@code other}. */
    @Nonnull
    public Span extendTo(@Nonnull Span other) {
        if (!uri.equals(other.uri))
            return this;
        return new Span(uri, start, other.end);
    }

    @Nonnull
    public Span startSpan() {
        return at(uri, start);
    }

    @Nonnull
    public Span endSpan() {
        return at(uri, end);
    }

    @Nonnull
    public JsonObject toJson() {
        JsonObject result = new JsonObject();
        result.addProperty("uri", uri.toString());
        JsonObject s = new JsonObject();
        s.addProperty("line", start.getLine());
        s.addProperty("character", start.getCharacter());
        result.add("start", s);
        JsonObject e = new JsonObject();
        e.addProperty("line", end.getLine());
        e.addProperty("character", end.getCharacter());
        result.add("end", e);
        return result;
    }

    @Override
    public boolean equals(Object obj) {
        if (obj instanceof Span) {
            Span o = (Span) obj;
            return o.uri.equals(uri) && o.start.equals(start) && o.end.equals(end);
        }
        return false;
    }

    @Override
    public int hashCode() {
        return uri.hashCode() ^ (start.hashCode() * 17) ^ end.hashCode();
    }

    @Override
    public String toString() {
        return uri + ":" + start + "-" + end;
    }
}
