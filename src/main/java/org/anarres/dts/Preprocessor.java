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
import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CompletionException;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import javax.annotation.CheckForNull;
import javax.annotation.Nonnull;

import org.pcollections.ConsPStack;
import org.pcollections.HashTreePMap;
import org.pcollections.HashTreePSet;
import org.pcollections.PMap;
import org.pcollections.PSet;
import org.pcollections.PStack;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * A line oriented C preprocessor for DeviceTree sources.
 *
 * Directives are consumed and macros are expanded one line at a time.
 * Rather than producing a token stream, every expansion is recorded as
 * a {@link MacroInstance} on its {@link Line}, so that positions in the
 * expanded text can always be mapped back to the text the user wrote.
 *
 * Function-like macro invocations must be complete on one line.
 * The output of an expansion is never rescanned by the line pass.
 *
 * The macro table is persistent: the table returned with one file can
 * be handed to the preprocessor of the next file of a context, without
 * the later file's definitions leaking back.
 */
public class Preprocessor {

    private static final Logger LOG = LoggerFactory.getLogger(Preprocessor.class);

    private static final Pattern DIRECTIVE = Pattern.compile(
            "^\\s*#\\s*(include|define|undef|ifdef|ifndef|if|elif|else|endif|error|warning|pragma|line)(?![\\w-])(.*)$");
    private static final Pattern DTS_INCLUDE = Pattern.compile("^\\s*/include/\\s*(.*)$");
    private static final Pattern DEFINE = Pattern.compile("^([A-Za-z_]\\w*)(?:\\(([^)]*)\\))?(.*)$", Pattern.DOTALL);
    private static final Pattern IDENTIFIER = Pattern.compile("^[A-Za-z_]\\w*$");
    private static final Pattern INCLUDE_NAME = Pattern.compile("^\\s*(?:\"([^\"]*)\"|<([^>]*)>)");
    private static final Pattern DEFINED = Pattern.compile("\\bdefined\\s*(?:\\(\\s*([A-Za-z_]\\w*)\\s*\\)|([A-Za-z_]\\w*))");
    private static final Pattern CONDITION_TOKEN = Pattern.compile("'(?:\\\\.|[^'\\\\])*'|(?<![\\w.])[A-Za-z_]\\w*");

    private final FileContentProvider provider;
    private final List<String> includePath = new ArrayList<String>();
    private PMap<String, Macro> macros;
    private final Set<URI> onceSeen = new HashSet<URI>();
    private final Set<URI> includeStack = new HashSet<URI>();
    private int counter = 0;

    /* Per invocation of preprocess() */
    private DiagnosticSet diags;
    private List<Line> lines;
    private List<IncludeStatement> includes;
    private PStack<ConditionalState> states;
    private boolean inBlockComment;

    public Preprocessor(@Nonnull FileContentProvider provider, @Nonnull PMap<String, Macro> macros) {
        this.provider = provider;
        PMap<String, Macro> m = macros;
        for (Macro builtin : new Macro[]{new LineMacro(), new FileMacro(), new CounterMacro()}) {
            if (!m.containsKey(builtin.getName()))
                m = m.plus(builtin.getName(), builtin);
        }
        this.macros = m;
    }

    public Preprocessor(@Nonnull FileContentProvider provider) {
        this(provider, HashTreePMap.<String, Macro>empty());
    }

    /**
     * Defines the given name as a macro, with the value <code>1</code>.
     */
    public void addMacro(@Nonnull String name) {
        addMacro(name, "1");
    }

    /**
     * Defines the given name as a macro.
     *
     * The value is the replacement text, as it would appear after the
     * name in a <code>#define</code> directive.
     */
    public void addMacro(@Nonnull String name, @Nonnull String value) {
        addMacro(new Macro(name, value));
    }

    public void addMacro(@Nonnull Macro m) {
        macros = macros.plus(m.getName(), m);
    }

    @CheckForNull
    public Macro getMacro(@Nonnull String name) {
        return macros.get(name);
    }

    @Nonnull
    public PMap<String, Macro> getMacros() {
        return macros;
    }

    /**
     * Sets the include path used by this Preprocessor.
     * Directories are searched in order, and the first match wins.
     */
    public void setIncludePath(@Nonnull List<String> path) {
        includePath.clear();
        includePath.addAll(path);
    }

    @Nonnull
    public List<String> getIncludePath() {
        return Collections.unmodifiableList(includePath);
    }

    /* pp */ int nextCounter() {
        return counter++;
    }

    /**
     * Preprocesses the given text.
     *
     * Include directives are resolved through the content provider of
     * this preprocessor; their lines are spliced into the result. All
     * problems are reported to {@code diags}, bucketed by the file they
     * occur in.
     */
    @Nonnull
    public PreprocessedFile preprocess(@Nonnull URI uri, @Nonnull String text, @Nonnull DiagnosticSet diags) {
        this.diags = diags;
        this.lines = new ArrayList<Line>();
        this.includes = new ArrayList<IncludeStatement>();
        this.states = ConsPStack.singleton(new ConditionalState());
        this.inBlockComment = false;
        includeStack.clear();
        processFile(uri, text);
        PreprocessedFile result = new PreprocessedFile(lines, includes, macros);
        this.diags = null;
        this.lines = null;
        this.includes = null;
        return result;
    }

    @Nonnull
    private static String[] split(@Nonnull String text) {
        String[] raw = text.split("\n", -1);
        for (int i = 0; i < raw.length; i++) {
            if (raw[i].endsWith("\r"))
                raw[i] = raw[i].substring(0, raw[i].length() - 1);
        }
        return raw;
    }

    private boolean isActive() {
        ConditionalState state = states.get(0);
        return state.isParentActive() && state.isActive();
    }

    private void processFile(@Nonnull URI uri, @Nonnull String text) {
        includeStack.add(uri);
        boolean outerComment = inBlockComment;
        inBlockComment = false;
        int depth = states.size();

        String[] raw = split(text);
        for (int i = 0; i < raw.length; i++) {
            String line = raw[i];
            if (!inBlockComment) {
                Matcher d = DIRECTIVE.matcher(line);
                if (d.matches()) {
                    int first = i;
                    StringBuilder content = new StringBuilder(d.group(2));
                    while (endsWithBackslash(content) && i + 1 < raw.length) {
                        content.setLength(content.length() - 1);
                        content.append(' ').append(raw[++i]);
                    }
                    Span span = new Span(uri, first, 0, i, raw[i].length());
                    directive(uri, d.group(1), stripComments(content.toString()), span);
                    continue;
                }
            }

            if (!isActive())
                continue;

            if (!inBlockComment) {
                Matcher inc = DTS_INCLUDE.matcher(line);
                if (inc.matches()) {
                    include(uri, inc.group(1), new Span(uri, i, 0, i, line.length()));
                    continue;
                }
            }

            Span at = new Span(uri, i, 0, i, line.length());
            List<MacroInstance> instances = scan(line, HashTreePSet.<String>empty(), at, true);
            if (endsWithBackslash(line))
                instances.add(new MacroInstance(null, "\\", "", line.length() - 1));
            lines.add(new Line(line, i, uri, instances));
        }

        while (states.size() > depth) {
            Span opener = states.get(0).getOpener();
            if (opener != null)
                diags.push(opener, "Unterminated conditional", Severity.ERROR);
            states = states.minus(0);
        }

        inBlockComment = outerComment;
        includeStack.remove(uri);
    }

    private static boolean endsWithBackslash(@Nonnull CharSequence s) {
        return s.length() > 0 && s.charAt(s.length() - 1) == '\\';
    }

    private void directive(@Nonnull URI uri, @Nonnull String command, @Nonnull String args, @Nonnull Span span) {
        ConditionalState state = states.get(0);

        if ("ifdef".equals(command) || "ifndef".equals(command)) {
            boolean value = false;
            if (isActive()) {
                String name = args.trim();
                if (!IDENTIFIER.matcher(name).matches())
                    diags.push(span, "Expected macro name after #" + command, Severity.ERROR);
                value = macros.containsKey(name) == "ifdef".equals(command);
            }
            states = states.plus(state.push(value, span));
            return;
        }
        if ("if".equals(command)) {
            boolean value = isActive() && evaluateCondition(args, span);
            states = states.plus(state.push(value, span));
            return;
        }
        if ("elif".equals(command)) {
            if (states.size() == 1) {
                diags.push(span, "#elif without #if", Severity.ERROR);
                return;
            }
            if (state.sawElse())
                diags.push(span, "#elif after #else", Severity.ERROR);
            boolean value = state.isParentActive() && !state.isTaken() && evaluateCondition(args, span);
            states = states.minus(0).plus(state.elif(value));
            return;
        }
        if ("else".equals(command)) {
            if (states.size() == 1) {
                diags.push(span, "#else without #if", Severity.ERROR);
                return;
            }
            if (state.sawElse())
                diags.push(span, "#else after #else", Severity.ERROR);
            states = states.minus(0).plus(state.withElse());
            return;
        }
        if ("endif".equals(command)) {
            if (states.size() == 1) {
                diags.push(span, "#endif without #if", Severity.ERROR);
                return;
            }
            states = states.minus(0);
            return;
        }

        if (!isActive())
            return;

        if ("define".equals(command)) {
            define(args, span);
        } else if ("undef".equals(command)) {
            String name = args.trim();
            if (!IDENTIFIER.matcher(name).matches())
                diags.push(span, "Expected macro name after #undef", Severity.ERROR);
            else
                macros = macros.minus(name);
        } else if ("include".equals(command)) {
            include(uri, args, span);
        } else if ("error".equals(command)) {
            String message = args.trim();
            diags.push(span, message.isEmpty() ? "#error" : message, Severity.ERROR);
        } else if ("warning".equals(command)) {
            String message = args.trim();
            diags.push(span, message.isEmpty() ? "#warning" : message, Severity.WARNING);
        } else if ("pragma".equals(command)) {
            if ("once".equals(args.trim()))
                onceSeen.add(uri);
        }
        // #line is accepted and ignored; positions always refer to the raw file.
    }

    private void define(@Nonnull String args, @Nonnull Span span) {
        Matcher m = DEFINE.matcher(args.replaceFirst("^\\s+", ""));
        if (!m.matches()) {
            diags.push(span, "Expected macro name after #define", Severity.ERROR);
            return;
        }
        String name = m.group(1);
        List<String> params = null;
        boolean variadic = false;
        if (m.group(2) != null) {
            params = new ArrayList<String>();
            String list = m.group(2).trim();
            if (!list.isEmpty()) {
                for (String param : list.split(",")) {
                    param = param.trim();
                    if ("...".equals(param)) {
                        variadic = true;
                    } else if (IDENTIFIER.matcher(param).matches()) {
                        params.add(param);
                    } else {
                        diags.push(span, "Invalid parameter '" + param + "' in definition of " + name, Severity.ERROR);
                        return;
                    }
                }
            }
        }
        Macro macro = new Macro(name, params, variadic, m.group(3).trim(), span);
        macros = macros.plus(name, macro);
        if (LOG.isDebugEnabled())
            LOG.debug("Defined macro " + macro);
    }

    private void include(@Nonnull URI from, @Nonnull String args, @Nonnull Span span) {
        Matcher m = INCLUDE_NAME.matcher(args);
        if (!m.lookingAt()) {
            // #include MACRO
            m = INCLUDE_NAME.matcher(expandText(args, HashTreePSet.<String>empty(), span));
            if (!m.lookingAt()) {
                diags.push(span, "Expected file name in include", Severity.ERROR);
                return;
            }
        }
        boolean quoted = m.group(1) != null;
        String name = quoted ? m.group(1) : m.group(2);

        URI dst = resolveInclude(from, name, quoted);
        if (dst == null) {
            diags.push(span, "Unable to resolve include " + name, Severity.ERROR);
            return;
        }
        if (includeStack.contains(dst)) {
            diags.push(span, "Recursive include of " + name, Severity.ERROR);
            return;
        }
        includes.add(new IncludeStatement(span, dst));
        if (onceSeen.contains(dst))
            return;

        FileContent content;
        try {
            content = provider.read(dst).join();
        } catch (CompletionException e) {
            LOG.warn("Unable to read include {}", dst, e.getCause());
            content = FileContent.unavailable(dst, String.valueOf(e.getCause()));
        }
        if (!content.isAvailable()) {
            diags.push(span, "Unable to resolve include " + name + ": " + content.getReason(), Severity.ERROR);
            return;
        }
        if (LOG.isDebugEnabled())
            LOG.debug("pp: including " + dst);
        processFile(dst, content.getText());
    }

    @CheckForNull
    private URI resolveInclude(@Nonnull URI from, @Nonnull String name, boolean quoted) {
        List<URI> candidates = new ArrayList<URI>();
        try {
            Path path = Paths.get(name);
            if (path.isAbsolute()) {
                candidates.add(path.toUri());
            } else {
                if (quoted && "file".equals(from.getScheme()))
                    candidates.add(Paths.get(from).resolveSibling(name).normalize().toUri());
                for (String dir : includePath)
                    candidates.add(Paths.get(dir).resolve(name).normalize().toUri());
            }
        } catch (InvalidPathException e) {
            LOG.debug("Invalid include name " + name + ": " + e);
            return null;
        }
        for (URI candidate : candidates) {
            if (provider.exists(candidate))
                return candidate;
        }
        return null;
    }

    private boolean evaluateCondition(@Nonnull String expr, @Nonnull Span span) {
        Matcher d = DEFINED.matcher(expr);
        StringBuffer buf = new StringBuffer();
        while (d.find()) {
            String name = d.group(1) != null ? d.group(1) : d.group(2);
            d.appendReplacement(buf, macros.containsKey(name) ? "1" : "0");
        }
        d.appendTail(buf);

        String expanded = expandText(buf.toString(), HashTreePSet.<String>empty(), span);

        /* Identifiers which survive expansion are zero. */
        Matcher t = CONDITION_TOKEN.matcher(expanded);
        buf = new StringBuffer();
        while (t.find()) {
            if (t.group().startsWith("'"))
                t.appendReplacement(buf, Matcher.quoteReplacement(t.group()));
            else
                t.appendReplacement(buf, "0");
        }
        t.appendTail(buf);

        try {
            return ExpressionEvaluator.evaluate(buf.toString()) != 0;
        } catch (ExpressionException e) {
            diags.push(span, e.getMessage(), Severity.ERROR);
            return false;
        }
    }

    private static boolean isIdentifierStart(char c) {
        return Character.isLetter(c) || c == '_';
    }

    private static boolean isIdentifierPart(char c) {
        return Character.isLetterOrDigit(c) || c == '_';
    }

    /* Returns the offset just past the string or character literal starting at i. */
    private static int skipQuoted(@Nonnull String text, int i) {
        char quote = text.charAt(i);
        int j = i + 1;
        while (j < text.length()) {
            char c = text.charAt(j);
            if (c == '\\')
                j += 2;
            else if (c == quote)
                return j + 1;
            else
                j++;
        }
        return text.length();
    }

    private static int skipIdentifier(@Nonnull String text, int i) {
        int j = i;
        while (j < text.length() && isIdentifierPart(text.charAt(j)))
            j++;
        return j;
    }

    private static int skipWhitespace(@Nonnull String text, int i) {
        int j = i;
        while (j < text.length() && Character.isWhitespace(text.charAt(j)))
            j++;
        return j;
    }

    @Nonnull
    /* pp */ static String stripComments(@Nonnull String text) {
        StringBuilder buf = new StringBuilder();
        int i = 0;
        while (i < text.length()) {
            char c = text.charAt(i);
            if (c == '"' || c == '\'') {
                int j = skipQuoted(text, i);
                buf.append(text, i, j);
                i = j;
            } else if (text.startsWith("//", i)) {
                break;
            } else if (text.startsWith("/*", i)) {
                int e = text.indexOf("*/", i + 2);
                buf.append(' ');
                i = (e < 0) ? text.length() : e + 2;
            } else {
                buf.append(c);
                i++;
            }
        }
        return buf.toString();
    }

    /**
     * Finds the macro invocations in the text.
     *
     * @param top true when scanning a raw source line, in which case block
     * comments may carry over between lines and each invocation gets its own
     * span and argument diagnostics.
     */
    @Nonnull
    private List<MacroInstance> scan(@Nonnull String text, @Nonnull PSet<String> disabled, @Nonnull Span at, boolean top) {
        List<MacroInstance> out = new ArrayList<MacroInstance>();
        int n = text.length();
        int i = 0;
        while (i < n) {
            if (top && inBlockComment) {
                int e = text.indexOf("*/", i);
                if (e < 0)
                    break;
                inBlockComment = false;
                i = e + 2;
                continue;
            }
            char c = text.charAt(i);
            if (c == '/' && i + 1 < n && text.charAt(i + 1) == '/')
                break;
            if (c == '/' && i + 1 < n && text.charAt(i + 1) == '*') {
                if (top) {
                    inBlockComment = true;
                    i += 2;
                } else {
                    int e = text.indexOf("*/", i + 2);
                    i = (e < 0) ? n : e + 2;
                }
                continue;
            }
            if (c == '"' || c == '\'') {
                i = skipQuoted(text, i);
                continue;
            }
            if (Character.isDigit(c)) {
                /* A preprocessing number, such as 0x10 or 10UL. */
                i = skipIdentifier(text, i);
                continue;
            }
            if (!isIdentifierStart(c)) {
                i++;
                continue;
            }

            int j = skipIdentifier(text, i);
            String name = text.substring(i, j);
            Macro m = macros.get(name);
            if (m == null || disabled.contains(name)) {
                i = j;
                continue;
            }
            Span span = top ? new Span(at.getUri(), at.getStart().getLine(), i, at.getStart().getLine(), j) : at;

            if (!m.isFunctionLike()) {
                String insert = expandText(m.getText(this, span), disabled.plus(name), span);
                out.add(new MacroInstance(m, name, insert, i));
                i = j;
                continue;
            }

            int k = skipWhitespace(text, j);
            if (k >= n || text.charAt(k) != '(') {
                /* A function-like macro name without arguments is not an invocation. */
                i = j;
                continue;
            }
            List<String> args = new ArrayList<String>();
            int end = parseArguments(text, k, args);
            if (end < 0) {
                if (top)
                    diags.push(span, "Unterminated argument list invoking macro " + name, Severity.ERROR);
                i = j;
                continue;
            }
            int expected = m.getParameters().size();
            if (expected == 0 && args.size() == 1 && args.get(0).isEmpty())
                args.clear();
            if (m.isVariadic() ? args.size() < expected : args.size() != expected) {
                if (top)
                    diags.push(new Span(at.getUri(), at.getStart().getLine(), i, at.getStart().getLine(), end),
                            "Macro " + name + " expects " + expected + " arguments, but got " + args.size(),
                            Severity.ERROR);
                i = end;
                continue;
            }
            String insert = expandText(substitute(m, args, disabled, span), disabled.plus(name), span);
            out.add(new MacroInstance(m, text.substring(i, end), insert, i));
            i = end;
        }
        return out;
    }

    @Nonnull
    private String expandText(@Nonnull String text, @Nonnull PSet<String> disabled, @Nonnull Span at) {
        return MacroInstance.process(text, scan(text, disabled, at, false));
    }

    /*
     * Splits the argument list opening at text[open] at its top level commas.
     * Returns the offset just past the closing parenthesis, or -1.
     */
    private static int parseArguments(@Nonnull String text, int open, @Nonnull List<String> args) {
        int depth = 0;
        int start = open + 1;
        int i = open;
        while (i < text.length()) {
            char c = text.charAt(i);
            if (c == '"' || c == '\'') {
                i = skipQuoted(text, i);
                continue;
            }
            if (c == '(') {
                depth++;
            } else if (c == ')') {
                if (--depth == 0) {
                    args.add(text.substring(start, i).trim());
                    return i + 1;
                }
            } else if (c == ',' && depth == 1) {
                args.add(text.substring(start, i).trim());
                start = i + 1;
            }
            i++;
        }
        return -1;
    }

    /* Replaces parameters in the body of a function-like macro. */
    @Nonnull
    private String substitute(@Nonnull Macro m, @Nonnull List<String> args, @Nonnull PSet<String> disabled, @Nonnull Span at) {
        Map<String, String> values = new HashMap<String, String>();
        List<String> params = m.getParameters();
        for (int i = 0; i < params.size(); i++)
            values.put(params.get(i), args.get(i));
        if (m.isVariadic()) {
            StringBuilder rest = new StringBuilder();
            for (int i = params.size(); i < args.size(); i++) {
                if (rest.length() > 0)
                    rest.append(", ");
                rest.append(args.get(i));
            }
            values.put("__VA_ARGS__", rest.toString());
        }

        String body = m.getText(this, at);
        StringBuilder buf = new StringBuilder();
        boolean pasted = false;
        int i = 0;
        while (i < body.length()) {
            char c = body.charAt(i);
            if (c == '"' || c == '\'') {
                int j = skipQuoted(body, i);
                buf.append(body, i, j);
                pasted = false;
                i = j;
            } else if (c == '#' && i + 1 < body.length() && body.charAt(i + 1) == '#') {
                while (buf.length() > 0 && Character.isWhitespace(buf.charAt(buf.length() - 1)))
                    buf.setLength(buf.length() - 1);
                i = skipWhitespace(body, i + 2);
                pasted = true;
            } else if (c == '#') {
                int k = skipWhitespace(body, i + 1);
                int j = skipIdentifier(body, k);
                String name = body.substring(k, j);
                if (values.containsKey(name)) {
                    buf.append('"');
                    escape(buf, values.get(name));
                    buf.append('"');
                    i = j;
                } else {
                    buf.append(c);
                    i++;
                }
                pasted = false;
            } else if (isIdentifierStart(c)) {
                int j = skipIdentifier(body, i);
                String name = body.substring(i, j);
                String value = values.get(name);
                if (value == null)
                    buf.append(name);
                else if (pasted || body.startsWith("##", skipWhitespace(body, j)))
                    buf.append(value);
                else
                    buf.append(expandText(value, disabled, at));
                pasted = false;
                i = j;
            } else if (Character.isDigit(c)) {
                int j = skipIdentifier(body, i);
                buf.append(body, i, j);
                pasted = false;
                i = j;
            } else {
                buf.append(c);
                if (!Character.isWhitespace(c))
                    pasted = false;
                i++;
            }
        }
        return buf.toString();
    }

    /* pp */ static void escape(@Nonnull StringBuilder buf, @Nonnull CharSequence cs) {
        for (int i = 0; i < cs.length(); i++) {
            char c = cs.charAt(i);
            switch (c) {
                case '\\':
                    buf.append("\\\\");
                    break;
                case '"':
                    buf.append("\\\"");
                    break;
                case '\n':
                    buf.append("\\n");
                    break;
                case '\r':
                    buf.append("\\r");
                    break;
                default:
                    buf.append(c);
            }
        }
    }

    @Override
    public String toString() {
        StringBuilder buf = new StringBuilder();
        buf.append("Include path: ").append(includePath).append('\n');
        List<String> names = new ArrayList<String>(macros.keySet());
        Collections.sort(names);
        for (String name : names)
            buf.append("#define ").append(macros.get(name)).append('\n');
        return buf.toString();
    }
}
