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
import java.util.regex.MatchResult;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import javax.annotation.CheckForNull;
import javax.annotation.Nonnull;

/**
 * A scanning cursor over preprocessed lines.
 *
 * Patterns are matched against the expanded text, one line at a time,
 * anchored at the cursor. Every location handed out is mapped back to
 * the raw text through the {@link Line} it was found on. Diagnostics
 * pushed through the cursor go to the file the location points into.
 */
public class TokenCursor {

    /** The fallback token: a run of name characters, or any single character. */
    public static final Pattern TOKEN = Pattern.compile("[#\\w-]+|.");
    private static final Pattern WHITESPACE = Pattern.compile("\\s+");
    private static final Pattern LINE_COMMENT = Pattern.compile("//.*");
    private static final Pattern BLOCK_COMMENT_START = Pattern.compile("/\\*");

    /**
     * A position in the expanded text: an index into the line list and
     * a column in that line's expanded text.
     */
    public static final class Offset {

        private final int line;
        private final int col;

        public Offset(int line, int col) {
            this.line = line;
            this.col = col;
        }

        public int getLine() {
            return line;
        }

        public int getCol() {
            return col;
        }

        @Override
        public String toString() {
            return line + ":" + col;
        }
    }

    private final URI uri;
    private final List<Line> lines;
    private final DiagnosticSet diags;
    private int line;
    private int col;
    private Offset prevStart;
    private int prevLength;

    public TokenCursor(@Nonnull URI uri, @Nonnull List<Line> lines, @Nonnull DiagnosticSet diags) {
        this.uri = uri;
        this.lines = lines;
        this.diags = diags;
        this.line = 0;
        this.col = 0;
        normalize();
        this.prevStart = freeze();
        this.prevLength = 0;
    }

    @Nonnull
    public URI getUri() {
        return uri;
    }

    @Nonnull
    public List<Line> getLines() {
        return Collections.unmodifiableList(lines);
    }

    @Nonnull
    public DiagnosticSet getDiags() {
        return diags;
    }

    /* Moves past the end of exhausted lines, so the cursor always points at text or EOF. */
    private void normalize() {
        while (line < lines.size() && col >= lines.get(line).length()) {
            line++;
            col = 0;
        }
    }

    public boolean eof() {
        return line >= lines.size();
    }

    /** Returns the remaining expanded text of the current line. */
    @Nonnull
    public String next() {
        if (eof())
            return "";
        return lines.get(line).getText().substring(col);
    }

    /**
     * Matches the pattern at the cursor without advancing.
     *
     * Group offsets of the result are relative to the start of the line.
     */
    @CheckForNull
    public MatchResult peek(@Nonnull Pattern pattern) {
        if (eof())
            return null;
        String text = lines.get(line).getText();
        Matcher m = pattern.matcher(text);
        m.region(col, text.length());
        if (!m.lookingAt())
            return null;
        return m.toMatchResult();
    }

    @CheckForNull
    public MatchResult peek() {
        return peek(TOKEN);
    }

    /**
     * Matches the pattern at the cursor and advances past it on success.
     * The matched text becomes the current {@link #location()}.
     */
    @CheckForNull
    public MatchResult match(@Nonnull Pattern pattern) {
        MatchResult m = peek(pattern);
        if (m == null)
            return null;
        prevStart = freeze();
        prevLength = m.end() - m.start();
        col = m.end();
        normalize();
        return m;
    }

    /** Skips whitespace and comments. Returns false at end of input. */
    public boolean skipWhitespace() {
        Offset start = prevStart;
        int length = prevLength;
        for (;;) {
            if (match(WHITESPACE) != null || match(LINE_COMMENT) != null)
                continue;
            if (match(BLOCK_COMMENT_START) != null) {
                skipBlockComment();
                continue;
            }
            break;
        }
        /* Whitespace never ends up in a diagnostic range. */
        prevStart = start;
        prevLength = length;
        return !eof();
    }

    private void skipBlockComment() {
        while (!eof()) {
            String text = lines.get(line).getText();
            int end = text.indexOf("*/", col);
            if (end >= 0) {
                col = end + 2;
                normalize();
                return;
            }
            line++;
            col = 0;
            normalize();
        }
    }

    /** Skips one token. At a position no token matches, moves to the end of input. */
    @Nonnull
    public String skipToken() {
        MatchResult m = match(TOKEN);
        if (m == null) {
            line = lines.size();
            col = 0;
            return "";
        }
        return m.group();
    }

    @Nonnull
    public Offset freeze() {
        return new Offset(line, col);
    }

    public void reset(@Nonnull Offset offset) {
        this.line = offset.line;
        this.col = offset.col;
        normalize();
    }

    /** Returns the offset just past the most recent match. */
    @Nonnull
    public Offset prevEnd() {
        return new Offset(prevStart.line, prevStart.col + prevLength);
    }

    /** Returns the raw span of the most recent match. */
    @Nonnull
    public Span location() {
        return location(prevStart, prevEnd());
    }

    /** Returns the raw span from {@code start} to the end of the most recent match. */
    @Nonnull
    public Span location(@Nonnull Offset start) {
        return location(start, prevEnd());
    }

    @Nonnull
    public Span location(@Nonnull Offset start, @Nonnull Offset end) {
        if (lines.isEmpty())
            return Span.at(uri, new Position(0, 0));
        Position s = position(start, true);
        Position e = position(end, false);
        Line startLine = lines.get(Math.min(start.line, lines.size() - 1));
        Line endLine = lines.get(Math.min(end.line, lines.size() - 1));
        if (!startLine.getUri().equals(endLine.getUri()) || e.isBefore(s))
            e = new Position(startLine.getNumber(), startLine.getRaw().length());
        return new Span(startLine.getUri(), s, e);
    }

    @Nonnull
    private Position position(@Nonnull Offset offset, boolean earliest) {
        if (offset.line >= lines.size()) {
            Line last = lines.get(lines.size() - 1);
            return new Position(last.getNumber(), last.getRaw().length());
        }
        return lines.get(offset.line).rawPosition(offset.col, earliest);
    }

    /** Returns the expanded text between {@code start} and the cursor, lines joined by newlines. */
    @Nonnull
    public String since(@Nonnull Offset start) {
        StringBuilder buf = new StringBuilder();
        int last = Math.min(line, lines.size() - 1);
        for (int i = start.line; i <= last; i++) {
            String text = lines.get(i).getText();
            int from = (i == start.line) ? Math.min(start.col, text.length()) : 0;
            int to = (i == line) ? Math.min(col, text.length()) : text.length();
            if (i > start.line)
                buf.append('\n');
            if (from < to)
                buf.append(text, from, to);
        }
        return buf.toString();
    }

    /** Returns the raw text covered by the span. */
    @Nonnull
    public String raw(@Nonnull Span span) {
        StringBuilder buf = new StringBuilder();
        int first = span.getStart().getLine();
        int last = span.getEnd().getLine();
        for (Line l : lines) {
            if (!l.getUri().equals(span.getUri()) || l.getNumber() < first || l.getNumber() > last)
                continue;
            String raw = l.getRaw();
            int from = (l.getNumber() == first) ? Math.min(span.getStart().getCharacter(), raw.length()) : 0;
            int to = (l.getNumber() == last) ? Math.min(span.getEnd().getCharacter(), raw.length()) : raw.length();
            if (buf.length() > 0 || l.getNumber() > first)
                buf.append('\n');
            if (from < to)
                buf.append(raw, from, to);
        }
        return buf.toString();
    }

    @Nonnull
    public Diagnostic pushDiag(@Nonnull String message) {
        return pushDiag(message, Severity.ERROR, location());
    }

    @Nonnull
    public Diagnostic pushDiag(@Nonnull String message, @Nonnull Severity severity) {
        return pushDiag(message, severity, location());
    }

    @Nonnull
    public Diagnostic pushDiag(@Nonnull String message, @Nonnull Severity severity, @Nonnull Span span) {
        return diags.push(span, message, severity);
    }

    @Nonnull
    public QuickFix pushAction(@Nonnull QuickFix fix) {
        return diags.pushAction(fix);
    }

    /** Attaches a fix inserting text after the most recent match. */
    @Nonnull
    public QuickFix pushInsertAction(@Nonnull String title, @Nonnull String insert) {
        return pushInsertAction(title, insert, location());
    }

    /** Attaches a fix inserting text at the end of the span. */
    @Nonnull
    public QuickFix pushInsertAction(@Nonnull String title, @Nonnull String insert, @Nonnull Span span) {
        QuickFix fix = new QuickFix(title, QuickFix.Kind.QUICK_FIX);
        fix.addEdit(TextEdit.insert(span, insert));
        return pushAction(fix);
    }

    @Nonnull
    public QuickFix pushDeleteAction(@Nonnull String title) {
        return pushDeleteAction(title, location());
    }

    @Nonnull
    public QuickFix pushDeleteAction(@Nonnull String title, @Nonnull Span span) {
        QuickFix fix = new QuickFix(title, QuickFix.Kind.REFACTOR);
        fix.addEdit(TextEdit.delete(span));
        return pushAction(fix);
    }

    @Nonnull
    public QuickFix pushReplaceAction(@Nonnull String title, @Nonnull String text, @Nonnull Span span) {
        QuickFix fix = new QuickFix(title, QuickFix.Kind.QUICK_FIX);
        fix.addEdit(new TextEdit(span, text));
        return pushAction(fix);
    }

    @Nonnull
    public QuickFix pushSemicolonAction() {
        return pushSemicolonAction(location());
    }

    @Nonnull
    public QuickFix pushSemicolonAction(@Nonnull Span span) {
        return pushInsertAction("Add semicolon", ";", span).setPreferred(true);
    }

    @Override
    public String toString() {
        return "TokenCursor[" + uri + " @ " + line + ":" + col + "]";
    }
}
