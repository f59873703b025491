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
 * A double quoted string. Escapes are kept as written.
 */
public class StringValue extends PropertyValue {

    private static final Pattern PATTERN = Pattern.compile("\"((?:\\\\.|[^\"\\\\])*)\"");

    private final String value;

    public StringValue(@Nonnull String value, @Nonnull Span span) {
        super(Kind.STRING, span);
        this.value = value;
    }

    @CheckForNull
    public static StringValue match(@Nonnull TokenCursor cursor) {
        MatchResult m = cursor.match(PATTERN);
        if (m == null)
            return null;
        return new StringValue(m.group(1), cursor.location());
    }

    @Nonnull
    public String getValue() {
        return value;
    }

    @Override
    public String toString() {
        return "\"" + value + "\"";
    }
}
