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

import javax.annotation.CheckForNull;
import javax.annotation.Nonnull;

/**
 * Evaluates the bounded C integer expression grammar used by
 * {@code #if} directives and by parenthesised property cells.
 *
 * Literals may be decimal, octal, hexadecimal or character constants,
 * with optional U and L suffixes. All arithmetic is done on 64-bit
 * signed integers.
 */
public class ExpressionEvaluator {

    private static final int EOF = -1;
    private static final int NUMBER = 256;
    private static final int IDENTIFIER = 257;
    private static final int LSH = 258;
    private static final int RSH = 259;
    private static final int LE = 260;
    private static final int GE = 261;
    private static final int EQ = 262;
    private static final int NE = 263;
    private static final int LAND = 264;
    private static final int LOR = 265;

    private static class Tok {

        private final int type;
        private final String text;
        private final long value;
        private final int offset;

        Tok(int type, String text, long value, int offset) {
            this.type = type;
            this.text = text;
            this.value = value;
            this.offset = offset;
        }
    }

    private final String text;
    private int pos;
    @CheckForNull
    private Tok expr_token;

    private ExpressionEvaluator(@Nonnull String text) {
        this.text = text;
        this.pos = 0;
    }

    /**
     * Evaluates the given expression.
     *
     * @throws ExpressionException if the text is not a well formed expression,
     * or if it divides by zero.
     */
    public static long evaluate(@Nonnull String text) throws ExpressionException {
        ExpressionEvaluator e = new ExpressionEvaluator(text);
        long value = e.expr(0);
        Tok tok = e.expr_token();
        if (tok.type != EOF)
            throw new ExpressionException("Unexpected '" + tok.text + "' in expression", tok.offset);
        return value;
    }

    private static boolean isIdentifierStart(char c) {
        return Character.isLetter(c) || c == '_';
    }

    private static boolean isIdentifierPart(char c) {
        return Character.isLetterOrDigit(c) || c == '_';
    }

    @Nonnull
    private Tok lex() throws ExpressionException {
        while (pos < text.length() && Character.isWhitespace(text.charAt(pos)))
            pos++;
        int start = pos;
        if (pos >= text.length())
            return new Tok(EOF, "<end of expression>", 0, start);
        char c = text.charAt(pos);
        if (Character.isDigit(c))
            return lexNumber(start);
        if (c == '\'')
            return lexCharacter(start);
        if (isIdentifierStart(c)) {
            while (pos < text.length() && isIdentifierPart(text.charAt(pos)))
                pos++;
            return new Tok(IDENTIFIER, text.substring(start, pos), 0, start);
        }
        char d = pos + 1 < text.length() ? text.charAt(pos + 1) : 0;
        int type = c;
        switch (c) {
            case '<':
                if (d == '<')
                    type = LSH;
                else if (d == '=')
                    type = LE;
                break;
            case '>':
                if (d == '>')
                    type = RSH;
                else if (d == '=')
                    type = GE;
                break;
            case '=':
                if (d == '=')
                    type = EQ;
                break;
            case '!':
                if (d == '=')
                    type = NE;
                break;
            case '&':
                if (d == '&')
                    type = LAND;
                break;
            case '|':
                if (d == '|')
                    type = LOR;
                break;
            default:
                break;
        }
        pos += (type == c) ? 1 : 2;
        return new Tok(type, text.substring(start, pos), 0, start);
    }

    @Nonnull
    private Tok lexNumber(int start) throws ExpressionException {
        int radix = 10;
        int digits = pos;
        if (text.charAt(pos) == '0' && pos + 1 < text.length()
                && (text.charAt(pos + 1) == 'x' || text.charAt(pos + 1) == 'X')) {
            radix = 16;
            digits = pos + 2;
        } else if (text.charAt(pos) == '0') {
            radix = 8;
        }
        pos = digits;
        while (pos < text.length() && Character.digit(text.charAt(pos), 16) >= 0)
            pos++;
        String body = text.substring(digits, pos);
        while (pos < text.length() && "uUlL".indexOf(text.charAt(pos)) >= 0)
            pos++;
        if (pos < text.length() && isIdentifierPart(text.charAt(pos)))
            throw new ExpressionException("Invalid suffix on number '" + text.substring(start, pos + 1) + "'", start);
        if (body.isEmpty()) {
            if (radix == 8)
                return new Tok(NUMBER, text.substring(start, pos), 0, start);
            throw new ExpressionException("Invalid number '" + text.substring(start, pos) + "'", start);
        }
        try {
            long value = Long.parseUnsignedLong(body, radix);
            return new Tok(NUMBER, text.substring(start, pos), value, start);
        } catch (NumberFormatException e) {
            throw new ExpressionException("Invalid number '" + text.substring(start, pos) + "'", start);
        }
    }

    @Nonnull
    private Tok lexCharacter(int start) throws ExpressionException {
        pos++;
        if (pos >= text.length())
            throw new ExpressionException("Unterminated character literal", start);
        char c = text.charAt(pos++);
        long value = c;
        if (c == '\\') {
            if (pos >= text.length())
                throw new ExpressionException("Unterminated character literal", start);
            char e = text.charAt(pos++);
            switch (e) {
                case 'n':
                    value = '\n';
                    break;
                case 't':
                    value = '\t';
                    break;
                case 'r':
                    value = '\r';
                    break;
                case '0':
                    value = 0;
                    break;
                case 'a':
                    value = 7;
                    break;
                case 'b':
                    value = '\b';
                    break;
                case 'f':
                    value = '\f';
                    break;
                case 'v':
                    value = 11;
                    break;
                case 'x': {
                    int s = pos;
                    while (pos < text.length() && Character.digit(text.charAt(pos), 16) >= 0)
                        pos++;
                    if (s == pos)
                        throw new ExpressionException("Invalid escape in character literal", start);
                    value = Long.parseLong(text.substring(s, pos), 16);
                    break;
                }
                default:
                    value = e;
                    break;
            }
        }
        if (pos >= text.length() || text.charAt(pos) != '\'')
            throw new ExpressionException("Unterminated character literal", start);
        pos++;
        return new Tok(NUMBER, text.substring(start, pos), value, start);
    }

    @Nonnull
    private Tok expr_token() throws ExpressionException {
        Tok tok = expr_token;
        if (tok != null) {
            expr_token = null;
            return tok;
        }
        return lex();
    }

    private void expr_untoken(@Nonnull Tok tok) {
        if (expr_token != null)
            throw new IllegalStateException("Cannot unget two expression tokens.");
        expr_token = tok;
    }

    private static int expr_priority(@Nonnull Tok op) {
        switch (op.type) {
            case '/':
            case '%':
            case '*':
                return 11;
            case '+':
            case '-':
                return 10;
            case LSH:
            case RSH:
                return 9;
            case '<':
            case '>':
            case LE:
            case GE:
                return 8;
            case EQ:
            case NE:
                return 7;
            case '&':
                return 6;
            case '^':
                return 5;
            case '|':
                return 4;
            case LAND:
                return 3;
            case LOR:
                return 2;
            case '?':
                return 1;
            default:
                return 0;
        }
    }

    private long expr(int priority) throws ExpressionException {
        Tok tok = expr_token();
        long lhs, rhs;

        switch (tok.type) {
            case '(':
                lhs = expr(0);
                tok = expr_token();
                if (tok.type != ')')
                    throw new ExpressionException("Missing ) in expression. Got " + tok.text, tok.offset);
                break;
            case '~':
                lhs = ~expr(11);
                break;
            case '!':
                lhs = expr(11) == 0 ? 1 : 0;
                break;
            case '-':
                lhs = -expr(11);
                break;
            case '+':
                lhs = expr(11);
                break;
            case NUMBER:
                lhs = tok.value;
                break;
            case EOF:
                throw new ExpressionException("Expected expression", tok.offset);
            default:
                throw new ExpressionException("Bad token in expression: " + tok.text, tok.offset);
        }

        for (;;) {
            Tok op = expr_token();
            int pri = expr_priority(op);    /* 0 if not a binop. */

            if (pri == 0 || priority >= pri) {
                expr_untoken(op);
                break;
            }
            rhs = expr(pri);
            switch (op.type) {
                case '/':
                    if (rhs == 0)
                        throw new ExpressionException("Division by zero", op.offset);
                    lhs = lhs / rhs;
                    break;
                case '%':
                    if (rhs == 0)
                        throw new ExpressionException("Modulus by zero", op.offset);
                    lhs = lhs % rhs;
                    break;
                case '*':
                    lhs = lhs * rhs;
                    break;
                case '+':
                    lhs = lhs + rhs;
                    break;
                case '-':
                    lhs = lhs - rhs;
                    break;
                case '<':
                    lhs = lhs < rhs ? 1 : 0;
                    break;
                case '>':
                    lhs = lhs > rhs ? 1 : 0;
                    break;
                case '&':
                    lhs = lhs & rhs;
                    break;
                case '^':
                    lhs = lhs ^ rhs;
                    break;
                case '|':
                    lhs = lhs | rhs;
                    break;
                case LSH:
                    lhs = lhs << rhs;
                    break;
                case RSH:
                    lhs = lhs >> rhs;
                    break;
                case LE:
                    lhs = lhs <= rhs ? 1 : 0;
                    break;
                case GE:
                    lhs = lhs >= rhs ? 1 : 0;
                    break;
                case EQ:
                    lhs = lhs == rhs ? 1 : 0;
                    break;
                case NE:
                    lhs = lhs != rhs ? 1 : 0;
                    break;
                case LAND:
                    lhs = (lhs != 0) && (rhs != 0) ? 1 : 0;
                    break;
                case LOR:
                    lhs = (lhs != 0) || (rhs != 0) ? 1 : 0;
                    break;
                case '?': {
                    tok = expr_token();
                    if (tok.type != ':')
                        throw new ExpressionException("Missing : in conditional expression. Got " + tok.text, tok.offset);
                    long falseResult = expr(0);
                    lhs = (lhs != 0) ? rhs : falseResult;
                }
                break;
                default:
                    throw new ExpressionException("Unexpected operator " + op.text, op.offset);
            }
        }
        return lhs;
    }
}
