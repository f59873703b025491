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

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Builds the node entries of one file from its preprocessed lines.
 *
 * The parser never gives up on a file: anything it does not recognize
 * is reported, skipped, and scanning resumes at the next token.
 */
/* pp */ class DtsFileParser {

    private static final Logger LOG = LoggerFactory.getLogger(DtsFileParser.class);

    private static final Pattern SEMICOLON = Pattern.compile(";");
    private static final Pattern LABEL = Pattern.compile("([\\w-]+):\\s*");
    private static final Pattern NAME = Pattern.compile("([#?\\w,.+-]+)");
    private static final Pattern ADDRESS = Pattern.compile("@([\\da-fA-F]+)");
    private static final Pattern OPEN_BRACE = Pattern.compile("\\{");
    private static final Pattern CLOSE_BRACE = Pattern.compile("\\}");
    private static final Pattern EQUALS = Pattern.compile("=");
    private static final Pattern REF = Pattern.compile("(&[\\w-]+|&\\{[\\w@/,.+-]+\\})");
    private static final Pattern VERSION = Pattern.compile("/dts-v.+?/\\s*");
    private static final Pattern PLUGIN = Pattern.compile("/plugin/\\s*");
    private static final Pattern MEMRESERVE = Pattern.compile("/memreserve/");
    private static final Pattern DELETE_NODE = Pattern.compile("/delete-node/");
    private static final Pattern DELETE_NODE_NAME = Pattern.compile("&\\{[\\w@/,.+-]+\\}|&?[\\w,.+/@-]+");
    private static final Pattern DELETE_PROPERTY = Pattern.compile("/delete-property/");
    private static final Pattern DELETE_PROPERTY_NAME = Pattern.compile("[#?\\w,._+-]+");
    private static final Pattern ROOT = Pattern.compile("/\\s*\\{");

    private final DtsContext ctx;
    private final DtsFile file;
    private final TokenCursor cursor;
    private final NodeRegistry registry;
    private final List<NodeEntry> stack = new ArrayList<NodeEntry>();
    private int number;

    /* pp */ DtsFileParser(@Nonnull DtsContext ctx, @Nonnull DtsFile file, @Nonnull TokenCursor cursor) {
        this.ctx = ctx;
        this.file = file;
        this.cursor = cursor;
        this.registry = ctx.getRegistry();
    }

    @CheckForNull
    private NodeEntry top() {
        return stack.isEmpty() ? null : stack.get(stack.size() - 1);
    }

    @Nonnull
    private NodeEntry open(@Nonnull Node node, @Nonnull Span nameSpan, @CheckForNull String ref, @Nonnull List<String> labels) {
        NodeEntry parent = (ref == null) ? top() : null;
        NodeEntry entry = new NodeEntry(node, file, number++, nameSpan, parent, ref);
        entry.addLabels(labels);
        node.addEntry(entry);
        file.addEntry(entry, stack.isEmpty());
        if (parent != null)
            parent.addChild(entry);
        stack.add(entry);
        return entry;
    }

    public void parse() {
        boolean requireSemicolon = false;
        List<String> labels = new ArrayList<String>();

        while (cursor.skipWhitespace()) {
            if (requireSemicolon) {
                requireSemicolon = false;
                if (cursor.match(SEMICOLON) == null) {
                    Span span = cursor.location();
                    cursor.pushDiag("Missing semicolon", Severity.ERROR, span);
                    cursor.pushSemicolonAction(span);
                }
                continue;
            }

            MatchResult label = cursor.match(LABEL);
            if (label != null) {
                labels.add(label.group(1));
                continue;
            }

            TokenCursor.Offset nameStart = cursor.freeze();
            MatchResult name = cursor.match(NAME);
            if (name != null) {
                MatchResult addr = cursor.match(ADDRESS);
                Span nameSpan = cursor.location(nameStart);
                cursor.skipWhitespace();

                if (cursor.match(OPEN_BRACE) != null) {
                    String unitAddress = (addr == null) ? null : addr.group(1);
                    NodeEntry parent = top();
                    Node parentNode = (parent == null) ? registry.getOrCreateRoot() : parent.getNode();
                    Node node = registry.getOrCreate(name.group(1), unitAddress, parentNode);
                    open(node, nameSpan, null, labels);
                    if (unitAddress != null)
                        checkLeadingZeros(name.group(1), unitAddress, nameSpan);
                    labels = new ArrayList<String>();
                    continue;
                }

                requireSemicolon = true;

                if (addr != null) {
                    cursor.pushDiag("Only nodes have addresses. Expecting opening node block", Severity.WARNING, nameSpan);
                    continue;
                }

                cursor.skipWhitespace();
                cursor.match(EQUALS);
                List<PropertyValue> values = ValueListParser.parse(cursor);
                NodeEntry entry = top();
                if (entry == null) {
                    cursor.pushDiag("Property outside of node context", Severity.ERROR, nameSpan);
                    labels = new ArrayList<String>();
                    continue;
                }
                Span fullSpan = nameSpan;
                for (PropertyValue v : values)
                    fullSpan = fullSpan.union(v.getSpan());
                entry.addProperty(new Property(name.group(1), nameSpan, labels, values, fullSpan, entry));
                labels = new ArrayList<String>();
                continue;
            }

            MatchResult ref = cursor.match(REF);
            if (ref != null) {
                Span refSpan = cursor.location();
                cursor.skipWhitespace();
                if (cursor.match(OPEN_BRACE) == null) {
                    cursor.pushDiag("References can only be made to nodes", Severity.ERROR, refSpan);
                    requireSemicolon = true;
                    labels = new ArrayList<String>();
                    continue;
                }

                Node node = ctx.lookupNode(ref.group(1));
                if (node == null) {
                    cursor.pushDiag("Unknown label", Severity.ERROR, refSpan);
                    node = registry.placeholder(ref.group(1));
                }
                open(node, refSpan, ref.group(1), labels);
                labels = new ArrayList<String>();
                continue;
            }

            if (!labels.isEmpty()) {
                cursor.pushDiag("Expected node or property after label", Severity.WARNING);
                labels = new ArrayList<String>();
            }

            if (cursor.match(VERSION) != null) {
                requireSemicolon = true;
                continue;
            }

            if (cursor.match(PLUGIN) != null) {
                file.setPlugin(true);
                requireSemicolon = true;
                continue;
            }

            if (cursor.match(MEMRESERVE) != null) {
                requireSemicolon = true;
                cursor.skipWhitespace();
                IntValue address = IntValue.match(cursor);
                cursor.skipWhitespace();
                IntValue size = (address == null) ? null : IntValue.match(cursor);
                if (address == null || size == null)
                    cursor.pushDiag("Expected address and size");
                else
                    file.addMemreserve(address.getValue(), size.getValue());
                continue;
            }

            if (cursor.match(DELETE_NODE) != null) {
                cursor.skipWhitespace();
                requireSemicolon = true;
                MatchResult target = cursor.match(DELETE_NODE_NAME);
                if (target == null) {
                    cursor.pushDiag("Expected node");
                    continue;
                }

                NodeEntry entry = top();
                Node node;
                if (target.group().startsWith("&") || entry == null)
                    node = ctx.lookupNode(target.group());
                else
                    node = ctx.lookupNode(target.group(), entry.getNode());
                if (node == null) {
                    cursor.pushDiag("Unknown node", Severity.WARNING);
                    continue;
                }
                file.addDeletion(node, new Node.Deletion(cursor.location(), file, number++));
                continue;
            }

            if (cursor.match(DELETE_PROPERTY) != null) {
                cursor.skipWhitespace();
                requireSemicolon = true;
                MatchResult prop = cursor.match(DELETE_PROPERTY_NAME);
                if (prop == null) {
                    cursor.pushDiag("Expected property");
                    continue;
                }

                NodeEntry entry = top();
                if (entry == null) {
                    cursor.pushDiag("Can only delete properties inside a node");
                    continue;
                }
                if (entry.getNode().property(prop.group()) == null) {
                    cursor.pushDiag("Unknown property", Severity.WARNING);
                    continue;
                }
                entry.addProperty(Property.tombstone(prop.group(), cursor.location(), entry));
                continue;
            }

            if (stack.isEmpty() && cursor.match(ROOT) != null) {
                Span span = cursor.location();
                Position start = span.getStart();
                Span nameSpan = new Span(span.getUri(), start.getLine(), start.getCharacter(), start.getLine(), start.getCharacter() + 1);
                NodeEntry entry = open(registry.getOrCreateRoot(), nameSpan, null, labels);
                entry.extendTo(span);
                continue;
            }

            if (cursor.match(CLOSE_BRACE) != null) {
                if (!stack.isEmpty()) {
                    NodeEntry entry = stack.remove(stack.size() - 1);
                    entry.extendTo(cursor.location());
                } else {
                    cursor.pushDiag("Unexpected closing bracket");
                    cursor.pushDeleteAction("Delete unnecessary closing bracket").setPreferred(true);
                }
                requireSemicolon = true;
                continue;
            }

            cursor.skipToken();
            cursor.pushDiag("Unexpected token");
            cursor.pushDeleteAction("Delete invalid token").setPreferred(true);
        }

        if (!stack.isEmpty()) {
            Span end = cursor.location();
            for (int level = stack.size() - 1; level >= 0; level--) {
                NodeEntry entry = stack.get(level);
                entry.extendTo(end);
                LOG.warn("Unterminated node: {}", entry.getNode().getPath());
                cursor.pushDiag("Unterminated node", Severity.ERROR, entry.getNameSpan());
                StringBuilder close = new StringBuilder("\n");
                for (int i = stack.size() - 1; i >= level; i--) {
                    for (int t = 0; t < i; t++)
                        close.append('\t');
                    close.append("};\n");
                }
                cursor.pushInsertAction("Close brackets", close.toString(), end).setPreferred(true);
            }
        }

        if (requireSemicolon) {
            cursor.pushDiag("Expected semicolon");
            cursor.pushSemicolonAction();
        }
    }

    private void checkLeadingZeros(@Nonnull String name, @Nonnull String unitAddress, @Nonnull Span nameSpan) {
        if (!unitAddress.startsWith("0"))
            return;
        int zeros = 0;
        while (zeros < unitAddress.length() && unitAddress.charAt(zeros) == '0')
            zeros++;
        if (zeros == unitAddress.length())
            return;
        cursor.pushDiag("Address should not start with leading 0's", Severity.WARNING, nameSpan);
        if (!nameSpan.isSingleLine())
            return;
        Position start = nameSpan.getStart();
        int from = start.getCharacter() + name.length() + 1;
        QuickFix fix = new QuickFix("Trim leading 0's", QuickFix.Kind.QUICK_FIX);
        fix.addEdit(TextEdit.delete(new Span(nameSpan.getUri(), start.getLine(), from, start.getLine(), from + zeros)));
        cursor.pushAction(fix);
    }
}
