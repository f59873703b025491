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
import java.util.Collections;
import java.util.List;
import javax.annotation.CheckForNull;
import javax.annotation.Nonnull;

/**
 * One textual occurrence of a node: either a node block, or a
 * {@code &label { ... }} block reopening an existing node.
 *
 * The entry refers to its {@link Node} by registry index. The list of
 * children mirrors the lexical nesting in this file only.
 */
public class NodeEntry {

    private final NodeRegistry registry;
    private int nodeId;
    private final DtsFile file;
    private final int number;
    private final Span nameSpan;
    private Span span;
    @CheckForNull
    private final NodeEntry parent;
    @CheckForNull
    private final String ref;
    private final List<String> labels = new ArrayList<String>();
    private final List<Property> properties = new ArrayList<Property>();
    private final List<NodeEntry> children = new ArrayList<NodeEntry>();

    public NodeEntry(@Nonnull Node node, @Nonnull DtsFile file, int number,
            @Nonnull Span nameSpan, @CheckForNull NodeEntry parent, @CheckForNull String ref) {
        this.registry = node.getRegistry();
        this.nodeId = node.getId();
        this.file = file;
        this.number = number;
        this.nameSpan = nameSpan;
        this.span = nameSpan;
        this.parent = parent;
        this.ref = ref;
    }

    @Nonnull
    public Node getNode() {
        return registry.get(nodeId);
    }

    public int getNodeId() {
        return nodeId;
    }

    /* pp */ void setNodeId(int nodeId) {
        this.nodeId = nodeId;
    }

    @Nonnull
    public DtsFile getFile() {
        return file;
    }

    /** Returns the sequence number of this entry within its file. */
    public int getNumber() {
        return number;
    }

    @Nonnull
    public Span getNameSpan() {
        return nameSpan;
    }

    /** Returns the span of the whole block, up to the closing brace once it has been seen. */
    @Nonnull
    public Span getSpan() {
        return span;
    }

    /* pp */ void extendTo(@Nonnull Span end) {
        this.span = span.extendTo(end);
    }

    @CheckForNull
    public NodeEntry getParent() {
        return parent;
    }

    /** Returns the reference this entry was opened with, such as {@code &foo}, or null for a named block. */
    @CheckForNull
    public String getRef() {
        return ref;
    }

    @Nonnull
    public List<String> getLabels() {
        return Collections.unmodifiableList(labels);
    }

    /* pp */ void addLabels(@Nonnull List<String> labels) {
        this.labels.addAll(labels);
    }

    /** Returns the properties in declaration order, including deletion markers. */
    @Nonnull
    public List<Property> getProperties() {
        return Collections.unmodifiableList(properties);
    }

    /* pp */ void addProperty(@Nonnull Property property) {
        properties.add(property);
    }

    @Nonnull
    public List<NodeEntry> getChildren() {
        return Collections.unmodifiableList(children);
    }

    /* pp */ void addChild(@Nonnull NodeEntry child) {
        children.add(child);
    }

    public int getDepth() {
        int depth = 0;
        for (NodeEntry e = parent; e != null; e = e.parent)
            depth++;
        return depth;
    }

    @CheckForNull
    public Property getPropertyAt(@Nonnull URI uri, @Nonnull Position position) {
        for (Property p : properties) {
            if (!p.isDeleted() && p.getFullSpan().contains(uri, position))
                return p;
        }
        return null;
    }

    /** Prints the entry as it was written, with tabs for indentation. */
    @Nonnull
    public String toString(@Nonnull String indent) {
        StringBuilder buf = new StringBuilder(indent);
        for (String label : labels)
            buf.append(label).append(": ");
        buf.append(ref != null ? ref : getNode().getFullName()).append(" {\n");
        String inner = indent + "\t";
        for (Property p : properties)
            buf.append(inner).append(p.toString(inner.length())).append(";\n");
        if (!properties.isEmpty() && !children.isEmpty())
            buf.append('\n');
        for (int i = 0; i < children.size(); i++) {
            if (i > 0)
                buf.append('\n');
            buf.append(children.get(i).toString(inner)).append(";\n");
        }
        return buf.append(indent).append('}').toString();
    }

    @Override
    public String toString() {
        return toString("");
    }
}
