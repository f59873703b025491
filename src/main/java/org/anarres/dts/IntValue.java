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
 * An integer cell.
 */
public class IntValue extends PropertyValue {

    private static final Pattern PATTERN = Pattern.compile("(0[xX][\\da-fA-F]+|\\d+)\\b");

    private final long value;
    private final boolean hex;

    protected IntValue(@Nonnull Kind kind, long value, boolean hex, @Nonnull Span span) {
        super(kind, span);
        this.value = value;
        this.hex = hex;
    }

    public IntValue(long value, boolean hex, @Nonnull Span span) {
        this(Kind.INT, value, hex, span);
    }

    @CheckForNull
    public static IntValue match(@Nonnull TokenCursor cursor) {
        MatchResult m = cursor.match(PATTERN);
        if (m == null)
            return null;
        String text = m.group(1);
        boolean hex = text.length() > 1 && (text.charAt(1) == 'x' || text.charAt(1) == 'X');
        try {
            long value = hex ? Long.parseUnsignedLong(text.substring(2), 16) : Long.parseUnsignedLong(text);
            return new IntValue(value, hex, cursor.location());
        } catch (NumberFormatException e) {
            cursor.pushDiag("Number out of range");
            return new IntValue(0, hex, cursor.location());
        }
    }

    public long getValue() {
        return value;
    }

    public boolean isHex() {
        return hex;
    }

    /**
     * Returns the text of this value as a cell inside {@code < >}.
     * Hex values are printed in lower case without leading zeros, so
     * {@code 0xAB} prints as {@code 0xab} and {@code 0x0010} as {@code 0x10}.
     */
    @Nonnull
    public String toCellString() {
        return hex ? "0x" + Long.toHexString(value) : Long.toString(value);
    }

    @Override
    public String toString() {
        return "< " + toCellString() + " >";
    }
}
