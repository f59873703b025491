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
import javax.annotation.CheckForNull;
import javax.annotation.Nonnull;

/**
 * A macro defined by {@code #define}, on the command line, or built in.
 *
 * A macro with a null parameter list is object-like. A function-like
 * macro with no parameters has an empty list.
 */
public class Macro {

    private final String name;
    @CheckForNull
    private final List<String> params;
    private final boolean variadic;
    private final String text;
    @CheckForNull
    private final Span span;

    public Macro(@Nonnull String name, @CheckForNull List<String> params, boolean variadic,
            @Nonnull String text, @CheckForNull Span span) {
        this.name = name;
        this.params = (params == null) ? null : Collections.unmodifiableList(new ArrayList<String>(params));
        this.variadic = variadic;
        this.text = text;
        this.span = span;
    }

    /** Constructs an object-like macro. */
    public Macro(@Nonnull String name, @Nonnull String text) {
        this(name, null, false, text, null);
    }

    @Nonnull
    public String getName() {
        return name;
    }

    public boolean isFunctionLike() {
        return params != null;
    }

    @Nonnull
    public List<String> getParameters() {
        if (params == null)
            return Collections.emptyList();
        return params;
    }

    public boolean isVariadic() {
        return variadic;
    }

    /** Returns the replacement text as written in the definition. */
    @Nonnull
    public String getText() {
        return text;
    }

    /**
     * Returns the replacement text for an expansion at the given location.
     * Builtin macros override this to compute their text on demand.
     */
    @Nonnull
    public String getText(@Nonnull Preprocessor pp, @Nonnull Span at) {
        return text;
    }

    /** Returns the location of the definition, or null for builtin and command line macros. */
    @CheckForNull
    public Span getSpan() {
        return span;
    }

    @Override
    public String toString() {
        StringBuilder buf = new StringBuilder(name);
        if (params != null) {
            buf.append('(');
            for (int i = 0; i < params.size(); i++) {
                if (i > 0)
                    buf.append(", ");
                buf.append(params.get(i));
            }
            if (variadic) {
                if (!params.isEmpty())
                    buf.append(", ");
                buf.append("...");
            }
            buf.append(')');
        }
        if (!text.isEmpty())
            buf.append(' ').append(text);
        return buf.toString();
    }
}

/** {@code __LINE__}: the 1-based line of the expansion. */
/* pp */ class LineMacro extends Macro {

    LineMacro() {
        super("__LINE__", "");
    }

    @Override
    public String getText(Preprocessor pp, Span at) {
        return Integer.toString(at.getStart().getLine() + 1);
    }
}

/** {@code __FILE__}: the quoted path of the file being preprocessed. */
/* pp */ class FileMacro extends Macro {

    FileMacro() {
        super("__FILE__", "");
    }

    @Override
    public String getText(Preprocessor pp, Span at) {
        StringBuilder buf = new StringBuilder("\"");
        Preprocessor.escape(buf, at.getUri().getPath());
        return buf.append('"').toString();
    }
}

/** {@code __COUNTER__}: increments on every expansion. */
/* pp */ class CounterMacro extends Macro {

    CounterMacro() {
        super("__COUNTER__", "");
    }

    @Override
    public String getText(Preprocessor pp, Span at) {
        return Integer.toString(pp.nextCounter());
    }
}
