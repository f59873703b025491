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
import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;
import javax.annotation.CheckForNull;
import javax.annotation.Nonnull;

import org.pcollections.PVector;
import org.pcollections.TreePVector;

/**
 * One {@code < ... >} block of integer, expression and phandle cells.
 */
public class ArrayValue extends PropertyValue {

    private static final Pattern OPEN = Pattern.compile("<");
    private static final Pattern CLOSE = Pattern.compile(">");
    private static final Pattern UNBRACED_OPERATOR = Pattern.compile("&&|<<|>>|==|[+|!^*/-]");
    /* Tokens that belong to the enclosing statement, and are never consumed as cells. */
    private static final Pattern TERMINATOR = Pattern.compile("[;{}=<]");

    private final PVector<PropertyValue> cells;

    public ArrayValue(@Nonnull List<? extends PropertyValue> cells, @Nonnull Span span) {
        super(Kind.ARRAY, span);
        this.cells = TreePVector.<PropertyValue>from(cells);
    }

    @CheckForNull
    private static PropertyValue matchCell(@Nonnull TokenCursor cursor) {
        PropertyValue v = IntValue.match(cursor);
        if (v == null)
            v = PHandle.match(cursor);
        if (v == null)
            v = ExpressionValue.match(cursor);
        return v;
    }

    @CheckForNull
    public static ArrayValue match(@Nonnull TokenCursor cursor) {
        TokenCursor.Offset start = cursor.freeze();
        if (cursor.match(OPEN) == null)
            return null;
        Span open = cursor.location();

        List<PropertyValue> values = new ArrayList<PropertyValue>();
        for (;;) {
            if (!cursor.skipWhitespace()) {
                unterminated(cursor, cursor.location(start), cursor.location());
                break;
            }
            if (cursor.match(CLOSE) != null)
                break;

            PropertyValue v = matchCell(cursor);
            if (v != null) {
                values.add(v);
                continue;
            }

            if (cursor.match(UNBRACED_OPERATOR) != null) {
                cursor.pushDiag("Expression without a surrounding parenthesis");
                continue;
            }

            if (cursor.peek(TERMINATOR) != null) {
                unterminated(cursor, cursor.location(start), cursor.location());
                break;
            }

            /* Unexpected data: skip to the closing bracket, or give up at the end of the statement. */
            cursor.skipToken();
            Span error = cursor.location();
            for (;;) {
                if (!cursor.skipWhitespace()) {
                    unterminated(cursor, open.extendTo(error), error);
                    break;
                }
                if (cursor.match(CLOSE) != null) {
                    cursor.pushDiag("Syntax error", Severity.ERROR, error);
                    break;
                }
                if (cursor.peek(TERMINATOR) != null) {
                    unterminated(cursor, open.extendTo(error), error);
                    break;
                }
                cursor.skipToken();
                error = error.extendTo(cursor.location());
            }
            break;
        }

        return new ArrayValue(values, cursor.location(start));
    }

    private static void unterminated(@Nonnull TokenCursor cursor, @Nonnull Span span, @Nonnull Span last) {
        cursor.pushDiag("Unterminated expression", Severity.ERROR, span);
        cursor.pushInsertAction("Add closing bracket", " >", last).setPreferred(true);
    }

    @Nonnull
    public PVector<PropertyValue> getCells() {
        return cells;
    }

    public int size() {
        return cells.size();
    }

    @CheckForNull
    public PropertyValue cellAt(@Nonnull URI uri, @Nonnull Position position) {
        for (PropertyValue cell : cells) {
            if (cell.contains(uri, position))
                return cell;
        }
        return null;
    }

    /** Returns true if every cell is an integer or expression. */
    public boolean isNumberArray() {
        for (PropertyValue cell : cells) {
            if (!cell.isNumeric())
                return false;
        }
        return true;
    }

    public boolean isPHandleArray() {
        for (PropertyValue cell : cells) {
            if (cell.getKind() != Kind.PHANDLE)
                return false;
        }
        return true;
    }

    /** Returns the numeric value of each cell, or null if any cell is not numeric. */
    @CheckForNull
    public long[] toLongArray() {
        if (!isNumberArray())
            return null;
        long[] result = new long[cells.size()];
        for (int i = 0; i < result.length; i++)
            result[i] = ((IntValue) cells.get(i)).getValue();
        return result;
    }

    @Nonnull
    /* pp */ static String cellString(@Nonnull PropertyValue cell) {
        switch (cell.getKind()) {
            case INT:
            case EXPRESSION:
                return ((IntValue) cell).toCellString();
            default:
                return cell.toString();
        }
    }

    @Override
    public String toString() {
        if (cells.isEmpty())
            return "< >";
        StringBuilder buf = new StringBuilder("<");
        for (PropertyValue cell : cells)
            buf.append(' ').append(cellString(cell));
        return buf.append(" >").toString();
    }
}
