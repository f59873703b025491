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

/**
 * One value of a property's right hand side.
 *
 * Values are immutable once parsed. Code that depends on the variant
 * switches on {@link #getKind()}.
 */
public abstract class PropertyValue {

    public enum Kind {
        STRING,
        BOOL,
        INT,
        EXPRESSION,
        ARRAY,
        BYTESTRING,
        PHANDLE
    }

    private final Kind kind;
    private final Span span;

    protected PropertyValue(@Nonnull Kind kind, @Nonnull Span span) {
        this.kind = kind;
        this.span = span;
    }

    @Nonnull
    public Kind getKind() {
        return kind;
    }

    @Nonnull
    public Span getSpan() {
        return span;
    }

    public boolean contains(@Nonnull URI uri, @Nonnull Position position) {
        return span.contains(uri, position);
    }

    /** Returns true for integer cells, including evaluated expressions. */
    public boolean isNumeric() {
        return kind == Kind.INT || kind == Kind.EXPRESSION;
    }

    /** Returns the canonical DTS text of this value. */
    @Override
    public abstract String toString();
}
