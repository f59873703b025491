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

import javax.annotation.Nonnull;

/**
 * A zero-based line and character offset in raw source text.
 */
public final class Position implements Comparable<Position> {

    private final int line;
    private final int character;

    public Position(int line, int character) {
        this.line = line;
        this.character = character;
    }

    public int getLine() {
        return line;
    }

    public int getCharacter() {
        return character;
    }

    public boolean isBefore(@Nonnull Position other) {
        return compareTo(other) < 0;
    }

    public boolean isAfter(@Nonnull Position other) {
        return compareTo(other) > 0;
    }

    @Override
    public int compareTo(@Nonnull Position o) {
        if (line != o.line)
            return Integer.compare(line, o.line);
        return Integer.compare(character, o.character);
    }

    @Override
    public boolean equals(Object obj) {
        if (obj instanceof Position) {
            Position o = (Position) obj;
            return o.line == line && o.character == character;
        }
        return false;
    }

    @Override
    public int hashCode() {
        return line * 31 + character;
    }

    @Override
    public String toString() {
        return (line + 1) + ":" + (character + 1);
    }
}
