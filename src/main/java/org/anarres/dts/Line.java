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
import java.util.Collections;
import java.util.List;
import javax.annotation.Nonnull;

/**
 * One line of source after preprocessing.
 *
 * Holds both the raw text and the expanded text, along with the macro
 * instances that turn one into the other, so that any offset into the
 * expanded text can be mapped back to the raw text.
 */
public class Line {

    private final String raw;
    private final String text;
    private final int number;
    private final URI uri;
    private final List<MacroInstance> macros;

    public Line(@Nonnull String raw, int number, @Nonnull URI uri, @Nonnull List<MacroInstance> macros) {
        this.raw = raw;
        this.number = number;
        this.uri = uri;
        this.macros = Collections.unmodifiableList(MacroInstance.filterOverlapping(macros));
        this.text = MacroInstance.process(raw, this.macros);
    }

    public Line(@Nonnull String raw, int number, @Nonnull URI uri) {
        this(raw, number, uri, Collections.<MacroInstance>emptyList());
    }

    @Nonnull
    public String getRaw() {
        return raw;
    }

    /** Returns the expanded text. */
    @Nonnull
    public String getText() {
        return text;
    }

    /** Returns the zero-based line number in the raw file. */
    public int getNumber() {
        return number;
    }

    @Nonnull
    public URI getUri() {
        return uri;
    }

    @Nonnull
    public List<MacroInstance> getMacros() {
        return macros;
    }

    public int length() {
        return text.length();
    }

    @Nonnull
    public Span getSpan() {
        return new Span(uri, number, 0, number, raw.length());
    }

    public boolean contains(@Nonnull URI uri, @Nonnull Position pos) {
        return getSpan().contains(uri, pos);
    }

    /**
     * Maps an offset in the expanded text to an offset in the raw text.
     *
     * Offsets outside any expansion are shifted by the width difference
     * of the expansions before them. An offset inside an expansion maps
     * to the start of the macro invocation if {@code earliest} is set,
     * and to its end otherwise.
     *
     * For the raw line {@code foo MACRO_1 MACRO_2} expanding to
     * {@code foo bar 1234}, offset 4 maps to 4, offset 5 maps to 4
     * (or 11 when not earliest), and offset 9 maps to 12.
     */
    public int rawPos(int offset, boolean earliest) {
        int loc = offset;
        for (MacroInstance m : macros) {
            if (m.getStart() > loc)
                break;
            if (loc < m.getStart() + m.getInsert().length()) {
                loc = m.getStart();
                if (!earliest)
                    loc += m.getRaw().length();
                break;
            }
            loc += m.getRaw().length() - m.getInsert().length();
        }
        return loc;
    }

    @Nonnull
    public Position rawPosition(int offset, boolean earliest) {
        return new Position(number, rawPos(offset, earliest));
    }

    @Override
    public String toString() {
        return uri.getPath() + ":" + (number + 1) + ": " + text;
    }
}
