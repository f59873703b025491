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
 * A resolved include directive.
 */
public class IncludeStatement {

    private final Span span;
    private final URI dst;

    public IncludeStatement(@Nonnull Span span, @Nonnull URI dst) {
        this.span = span;
        this.dst = dst;
    }

    /** Returns the location of the directive in the including file. */
    @Nonnull
    public Span getSpan() {
        return span;
    }

    /** Returns the included file. */
    @Nonnull
    public URI getDst() {
        return dst;
    }

    @Override
    public String toString() {
        return span + " -> " + dst;
    }
}
