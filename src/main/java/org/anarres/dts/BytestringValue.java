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

import org.pcollections.PVector;
import org.pcollections.TreePVector;

/**
 * A {@code [ ... ]} block of hexadecimal bytes.
 */
public class BytestringValue extends PropertyValue {

    private static final Pattern OPEN = Pattern.compile("\\[");
    private static final Pattern BYTE = Pattern.compile("\\s*([\\da-fA-F]{2})");
    private static final Pattern CLOSE = Pattern.compile("\\s*\\]");

    private final PVector<Integer> bytes;

    public BytestringValue(@Nonnull List<Integer> bytes, @Nonnull Span span) {
        super(Kind.BYTESTRING, span);
        this.bytes = TreePVector.from(bytes);
    }

    @CheckForNull
    public static BytestringValue match(@Nonnull TokenCursor cursor) {
        TokenCursor.Offset start = cursor.freeze();
        if (cursor.match(OPEN) == null)
            return null;

        List<Integer> bytes = new ArrayList<Integer>();
        MatchResult m;
        while ((m = cursor.match(BYTE)) != null)
            bytes.add(Integer.parseInt(m.group(1), 16));

        if (cursor.match(CLOSE) == null) {
            cursor.pushDiag("Missing terminating ]");
            cursor.pushInsertAction("Add terminating ]", " ]").setPreferred(true);
        }

        return new BytestringValue(bytes, cursor.location(start));
    }

    @Nonnull
    public PVector<Integer> getBytes() {
        return bytes;
    }

    public int size() {
        return bytes.size();
    }

    @Override
    public String toString() {
        if (bytes.isEmpty())
            return "[ ]";
        StringBuilder buf = new StringBuilder("[");
        for (int b : bytes) {
            buf.append(' ');
            if (b < 0x10)
                buf.append('0');
            buf.append(Integer.toHexString(b));
        }
        return buf.append(" ]").toString();
    }
}
