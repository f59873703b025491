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

import java.util.regex.MatchResult;
import java.util.regex.Pattern;
import javax.annotation.CheckForNull;
import javax.annotation.Nonnull;

/**
 * A parenthesised integer expression cell, such as {@code (1 << 4)}.
 *
 * The value is computed when the expression is parsed. An expression
 * that cannot be evaluated is reported once and takes the value 0.
 */
public class ExpressionValue extends IntValue {

    private static final Pattern OPEN = Pattern.compile("\\(");
    /* Operators and literals up to the next parenthesis. */
    private static final Pattern PART = Pattern.compile(
            "(?:(?:<<|>>|&&|\\|\\||[!=<>]=|[|&~^<>!=+/*%?:-]|0[xX][\\da-fA-F]+[uUlL]*|\\d+[uUlL]*|'(?:\\\\.|[^'\\\\])')\\s*)*([()])");

    private final String raw;

    public ExpressionValue(@Nonnull String raw, long value, @Nonnull Span span) {
        super(Kind.EXPRESSION, value, false, span);
        this.raw = raw;
    }

    @CheckForNull
    public static ExpressionValue match(@Nonnull TokenCursor cursor) {
        TokenCursor.Offset start = cursor.freeze();
        if (cursor.match(OPEN) == null)
            return null;

        int level = 1;
        boolean terminated = true;
        while (level != 0) {
            cursor.skipWhitespace();
            MatchResult m = cursor.match(PART);
            if (m == null) {
                cursor.pushDiag("Unterminated expression", Severity.ERROR, cursor.location(start));
                terminated = false;
                break;
            }
            if ("(".equals(m.group(1)))
                level++;
            else
                level--;
        }

        Span span = cursor.location(start);
        String raw = cursor.raw(span);
        long value = 0;
        if (terminated) {
            try {
                value = ExpressionEvaluator.evaluate(cursor.since(start));
            } catch (ExpressionException e) {
                cursor.pushDiag("Unable to evaluate expression: " + e.getMessage(), Severity.ERROR, span);
            }
        }
        return new ExpressionValue(raw, value, span);
    }

    /** Returns the expression as written. */
    @Nonnull
    public String getRaw() {
        return raw;
    }

    @Override
    public String toCellString() {
        return raw;
    }

    @Override
    public String toString() {
        return "< " + getValue() + " >";
    }
}
