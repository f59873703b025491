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
import java.util.Comparator;
import java.util.List;
import javax.annotation.CheckForNull;
import javax.annotation.Nonnull;

/**
 * One replacement of raw line text by expanded text.
 *
 * Offsets are into the raw line. The macro is null for replacements
 * that do not come from a macro, such as a spliced line continuation.
 */
public class MacroInstance {

    private static final Comparator<MacroInstance> BY_START = new Comparator<MacroInstance>() {
        @Override
        public int compare(MacroInstance a, MacroInstance b) {
            return Integer.compare(a.start, b.start);
        }
    };

    @CheckForNull
    private final Macro macro;
    private final String raw;
    private final String insert;
    private final int start;

    public MacroInstance(@CheckForNull Macro macro, @Nonnull String raw, @Nonnull String insert, int start) {
        this.macro = macro;
        this.raw = raw;
        this.insert = insert;
        this.start = start;
    }

    @CheckForNull
    public Macro getMacro() {
        return macro;
    }

    @Nonnull
    public String getRaw() {
        return raw;
    }

    @Nonnull
    public String getInsert() {
        return insert;
    }

    public int getStart() {
        return start;
    }

    public int getEnd() {
        return start + raw.length();
    }

    /**
     * Sorts the instances by start offset and drops any instance that
     * overlaps an earlier one.
     */
    @Nonnull
    public static List<MacroInstance> filterOverlapping(@Nonnull List<MacroInstance> macros) {
        List<MacroInstance> sorted = new ArrayList<MacroInstance>(macros);
        Collections.sort(sorted, BY_START);
        List<MacroInstance> result = new ArrayList<MacroInstance>(sorted.size());
        int end = 0;
        for (MacroInstance m : sorted) {
            if (m.start < end)
                continue;
            result.add(m);
            end = m.getEnd();
        }
        return result;
    }

    /** Applies non-overlapping instances, sorted by start, to the raw text. */
    @Nonnull
    public static String process(@Nonnull String raw, @Nonnull List<MacroInstance> macros) {
        StringBuilder buf = new StringBuilder();
        int pos = 0;
        for (MacroInstance m : macros) {
            buf.append(raw, pos, m.start);
            buf.append(m.insert);
            pos = m.getEnd();
        }
        buf.append(raw, pos, raw.length());
        return buf.toString();
    }

    @Override
    public String toString() {
        return start + ":" + raw + " -> " + insert;
    }
}
