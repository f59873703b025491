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

import java.util.Collections;
import java.util.List;
import javax.annotation.Nonnull;

import org.pcollections.PMap;

/**
 * The output of {@link Preprocessor#preprocess}.
 */
public class PreprocessedFile {

    private final List<Line> lines;
    private final List<IncludeStatement> includes;
    private final PMap<String, Macro> macros;

    public PreprocessedFile(@Nonnull List<Line> lines, @Nonnull List<IncludeStatement> includes, @Nonnull PMap<String, Macro> macros) {
        this.lines = Collections.unmodifiableList(lines);
        this.includes = Collections.unmodifiableList(includes);
        this.macros = macros;
    }

    /** Returns the active lines, in order, including lines from included files. */
    @Nonnull
    public List<Line> getLines() {
        return lines;
    }

    @Nonnull
    public List<IncludeStatement> getIncludes() {
        return includes;
    }

    /** Returns the macro table as it stands at the end of the file. */
    @Nonnull
    public PMap<String, Macro> getMacros() {
        return macros;
    }

    /** Returns the expanded text, one line per {@link Line}. */
    @Nonnull
    public String getText() {
        StringBuilder buf = new StringBuilder();
        for (Line line : lines)
            buf.append(line.getText()).append('\n');
        return buf.toString();
    }
}
