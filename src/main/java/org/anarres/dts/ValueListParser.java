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
import java.util.List;
import java.util.regex.MatchResult;
import java.util.regex.Pattern;
import javax.annotation.CheckForNull;
import javax.annotation.Nonnull;

/**
 * Parses the comma separated values on the right hand side of a property.
 */
/* pp */ class ValueListParser {

    private static final Pattern SEMICOLON = Pattern.compile(";");
    private static final Pattern COMMA = Pattern.compile(",");
    private static final Pattern BARE_NUMBER = Pattern.compile("0[xX][\\da-fA-F]+|\\d+");

    private ValueListParser() {
    }

    @CheckForNull
    private static PropertyValue matchValue(@Nonnull TokenCursor cursor) {
        PropertyValue v = ArrayValue.match(cursor);
        if (v == null)
            v = StringValue.match(cursor);
        if (v == null)
            v = BytestringValue.match(cursor);
        if (v == null)
            v = PHandle.match(cursor);
        return v;
    }

    /**
     * Parses values up to, but not including, the terminating semicolon.
     *
     * A property without values gets a single {@link BoolValue}. Parsing
     * stops without consuming anything at the first token that is not a
     * value, leaving the caller to report the missing semicolon.
     */
    @Nonnull
    public static List<PropertyValue> parse(@Nonnull TokenCursor cursor) {
        List<PropertyValue> values = new ArrayList<PropertyValue>();

        while (cursor.skipWhitespace()) {
            if (cursor.peek(SEMICOLON) != null)
                break;

            Span missingComma = null;
            if (!values.isEmpty()) {
                if (cursor.match(COMMA) == null) {
                    /* Only an error if another value follows; otherwise this is likely a missing semicolon. */
                    missingComma = cursor.location();
                }
                cursor.skipWhitespace();
            }

            PropertyValue v = matchValue(cursor);
            if (v != null) {
                if (missingComma != null) {
                    cursor.pushDiag("Expected comma between property values", Severity.ERROR, missingComma);
                    cursor.pushInsertAction("Separate values by comma", ",", missingComma).setPreferred(true);
                }
                values.add(v);
                continue;
            }

            /* Easy to miss brackets around numbers. */
            MatchResult number = cursor.match(BARE_NUMBER);
            if (number != null) {
                Span span = cursor.location();
                cursor.pushDiag("Missing < > brackets around number");
                cursor.pushReplaceAction("Add brackets", "< " + number.group() + " >", span).setPreferred(true);
            }

            return values;
        }

        if (values.isEmpty())
            values.add(new BoolValue(cursor.location()));
        return values;
    }
}
