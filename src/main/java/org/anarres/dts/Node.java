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
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import javax.annotation.CheckForNull;
import javax.annotation.Nonnull;

/**
 * A node in the composed tree, identified by its absolute path.
 *
 * A node collects the {@link NodeEntry entries} of every block that
 * declares or reopens it, across all files of a context. The parent is
 * held as a registry index. Deleting a node with {@code /delete-node/}
 * leaves it in the registry with a deletion mark.
 */
public class Node {

    /** The location of a {@code /delete-node/} directive naming this node. */
    public static class Deletion {

        private final Span span;
        private final DtsFile file;
        private final int number;

        public Deletion(@Nonnull Span span, @Nonnull DtsFile file, int number) {
            this.span = span;
            this.file = file;
            this.number = number;
        }

        @Nonnull
        public Span getSpan() {
            return span;
        }

        @Nonnull
        public DtsFile getFile() {
            return file;
        }

        public int getNumber() {
            return number;
        }
    }

    /** Largest value accepted from a {@code #...-cells} property. */
    /* pp */ static final int MAX_CELLS = 16;

    private static final Comparator<NodeEntry> ENTRY_ORDER = new Comparator<NodeEntry>() {
        @Override
        public int compare(NodeEntry a, NodeEntry b) {
            return compareOrder(a.getFile(), a.getNumber(), b.getFile(), b.getNumber());
        }
    };

    private final int id;
    private final NodeRegistry registry;
    private final String name;
    private final String fullName;
    @CheckForNull
    private final String unitAddress;
    @CheckForNull
    private final Long address;
    private final String path;
    private final int parentId;
    private final List<NodeEntry> entries = new ArrayList<NodeEntry>();
    private final List<Deletion> deletions = new ArrayList<Deletion>();
    @CheckForNull
    private NodeType type;

    /* pp */ Node(int id, @Nonnull NodeRegistry registry, @Nonnull String name, @CheckForNull String unitAddress,
            @Nonnull String fullName, @Nonnull String path, int parentId) {
        this.id = id;
        this.registry = registry;
        this.name = name;
        this.unitAddress = unitAddress;
        this.fullName = fullName;
        this.path = path;
        this.parentId = parentId;
        Long address = null;
        if (unitAddress != null) {
            try {
                address = Long.parseUnsignedLong(unitAddress, 16);
            } catch (NumberFormatException e) {
                address = null;
            }
        }
        this.address = address;
    }

    private static int compareOrder(@Nonnull DtsFile fa, int na, @Nonnull DtsFile fb, int nb) {
        if (fa.getPriority() != fb.getPriority())
            return fa.getPriority() < fb.getPriority() ? -1 : 1;
        return Integer.compare(na, nb);
    }

    public int getId() {
        return id;
    }

    @Nonnull
    /* pp */ NodeRegistry getRegistry() {
        return registry;
    }

    /** Returns the name without the unit address. */
    @Nonnull
    public String getName() {
        return name;
    }

    /** Returns the name with the unit address, {@code "/"} for the root node. */
    @Nonnull
    public String getFullName() {
        return fullName;
    }

    @CheckForNull
    public String getUnitAddress() {
        return unitAddress;
    }

    @CheckForNull
    public Long getAddress() {
        return address;
    }

    /** Returns the absolute path, with a trailing slash. */
    @Nonnull
    public String getPath() {
        return path;
    }

    public boolean isRoot() {
        return "/".equals(path);
    }

    /** Returns true if this node stands in for a reference that did not resolve. */
    public boolean isPlaceholder() {
        return parentId < 0 && !isRoot();
    }

    @CheckForNull
    public Node getParent() {
        if (parentId < 0)
            return null;
        return registry.get(parentId);
    }

    /* pp */ int getParentId() {
        return parentId;
    }

    @Nonnull
    public List<NodeEntry> getEntries() {
        return Collections.unmodifiableList(entries);
    }

    /** Returns the entries ordered by file priority, then by position in the file. */
    @Nonnull
    public List<NodeEntry> getSortedEntries() {
        List<NodeEntry> sorted = new ArrayList<NodeEntry>(entries);
        Collections.sort(sorted, ENTRY_ORDER);
        return sorted;
    }

    /* pp */ void addEntry(@Nonnull NodeEntry entry) {
        if (entries.contains(entry))
            return;
        entries.add(entry);
        type = null;
    }

    /* pp */ void removeEntry(@Nonnull NodeEntry entry) {
        entries.remove(entry);
        type = null;
    }

    /* pp */ void addDeletion(@Nonnull Deletion deletion) {
        deletions.add(deletion);
    }

    /* pp */ void removeDeletions(@Nonnull DtsFile file) {
        for (Iterator<Deletion> it = deletions.iterator(); it.hasNext();) {
            if (it.next().getFile() == file)
                it.remove();
        }
    }

    /* pp */ boolean hasDeletions() {
        return !deletions.isEmpty();
    }

    @CheckForNull
    private Deletion latestDeletion() {
        Deletion latest = null;
        for (Deletion d : deletions) {
            if (latest == null || compareOrder(d.getFile(), d.getNumber(), latest.getFile(), latest.getNumber()) > 0)
                latest = d;
        }
        return latest;
    }

    /**
     * Returns the deletion in effect for this node, or null.
     * A node declared again after it was deleted is live.
     */
    @CheckForNull
    public Deletion getDeleted() {
        Deletion latest = latestDeletion();
        if (latest == null)
            return null;
        for (NodeEntry e : entries) {
            if (compareOrder(e.getFile(), e.getNumber(), latest.getFile(), latest.getNumber()) > 0)
                return null;
        }
        return latest;
    }

    public boolean isDeleted() {
        for (Node n = this; n != null; n = n.getParent()) {
            if (n.getDeleted() != null)
                return true;
        }
        return false;
    }

    @CheckForNull
    public NodeType getType() {
        return type;
    }

    /* pp */ void setType(@CheckForNull NodeType type) {
        this.type = type;
    }

    /* pp */ void invalidateType() {
        this.type = null;
    }

    /** Returns the live child nodes, in registry order. */
    @Nonnull
    public List<Node> children() {
        List<Node> children = new ArrayList<Node>();
        for (Node n : registry.getNodes()) {
            if (n.parentId == id && !n.entries.isEmpty())
                children.add(n);
        }
        return children;
    }

    @Nonnull
    public List<String> labels() {
        List<String> labels = new ArrayList<String>();
        for (NodeEntry e : entries)
            labels.addAll(e.getLabels());
        return labels;
    }

    public boolean hasLabel(@Nonnull String label) {
        for (NodeEntry e : entries) {
            if (e.getLabels().contains(label))
                return true;
        }
        return false;
    }

    /** Returns every property declared on this node, shadowed or not. */
    @Nonnull
    public List<Property> properties() {
        List<Property> props = new ArrayList<Property>();
        for (NodeEntry e : entries) {
            for (Property p : e.getProperties())
                if (!p.isDeleted())
                    props.add(p);
        }
        return props;
    }

    /**
     * Returns the effective properties: for every name, the declaration
     * from the latest entry. A {@code /delete-property/} hides earlier
     * declarations, and a {@code /delete-node/} hides everything declared
     * before it.
     */
    @Nonnull
    public List<Property> uniqueProperties() {
        Deletion deletion = latestDeletion();
        Map<String, Property> props = new LinkedHashMap<String, Property>();
        for (NodeEntry e : getSortedEntries()) {
            if (deletion != null && compareOrder(e.getFile(), e.getNumber(), deletion.getFile(), deletion.getNumber()) < 0)
                continue;
            for (Property p : e.getProperties()) {
                if (p.isDeleted())
                    props.remove(p.getName());
                else
                    props.put(p.getName(), p);
            }
        }
        return new ArrayList<Property>(props.values());
    }

    @CheckForNull
    public Property property(@Nonnull String name) {
        for (Property p : uniqueProperties()) {
            if (p.getName().equals(name))
                return p;
        }
        return null;
    }

    public boolean enabled() {
        Property status = property("status");
        String value = (status == null) ? null : status.getString();
        return value == null || "okay".equals(value) || "ok".equals(value);
    }

    /** User readable name for this node. */
    @Nonnull
    public String uniqueName() {
        List<String> labels = labels();
        if (!labels.isEmpty())
            return "&" + labels.get(0);
        return path;
    }

    /** Name of this node among its siblings. */
    @Nonnull
    public String localUniqueName() {
        List<String> labels = labels();
        if (!labels.isEmpty())
            return "&" + labels.get(0);
        return fullName;
    }

    /** Returns a reference to this node, usable in a property value. */
    @Nonnull
    public String refName() {
        List<String> labels = labels();
        if (!labels.isEmpty())
            return "&" + labels.get(0);
        if (isRoot())
            return "&{/}";
        return "&{" + path.substring(0, path.length() - 1) + "}";
    }

    /**
     * Returns the value of a {@code #...-cells} property, or -1 if the
     * property is missing or its value is not a plausible cell count.
     */
    /* pp */ int cells(@Nonnull String propName) {
        Property p = property(propName);
        Long n = (p == null) ? null : p.getNumber();
        if (n == null || n.longValue() < 0 || n.longValue() > MAX_CELLS)
            return -1;
        return n.intValue();
    }

    public int addrCells() {
        int n = cells("#address-cells");
        return (n < 0) ? 2 : n;
    }

    public int sizeCells() {
        int n = cells("#size-cells");
        return (n < 0) ? 1 : n;
    }

    @CheckForNull
    public List<Property.Reg> regs() {
        Property reg = property("reg");
        return (reg == null) ? null : reg.getRegs();
    }

    /** Returns the number of specifier cells a reference to this node takes in the given property. */
    public int cellCount(@Nonnull String propName) {
        String cellName = Property.cellName(propName);
        int n = (cellName == null) ? -1 : cells("#" + cellName);
        return (n < 0) ? 1 : n;
    }

    /** Cell names exposed when the node is referenced. */
    @CheckForNull
    public List<String> refCellNames(@Nonnull String propName) {
        String cellName = Property.cellName(propName);
        if (cellName == null)
            return null;
        if (type != null) {
            List<String> cells = type.getCells(cellName);
            if (cells != null)
                return cells;
        }
        int count = cells("#" + cellName);
        if (count < 0)
            return null;
        List<String> names = new ArrayList<String>();
        for (int i = 0; i < count; i++)
            names.add(name + "-" + i);
        return names;
    }

    /**
     * Prints the effective content of this node as DTS text.
     *
     * @param expandChildren print children in full, instead of a placeholder block.
     */
    @Nonnull
    public String toString(boolean expandChildren, @Nonnull String indent) {
        StringBuilder buf = new StringBuilder(indent);
        buf.append(fullName).append(" {\n");
        String inner = indent + "    ";

        List<Property> props = uniqueProperties();
        List<Node> children = new ArrayList<Node>();
        for (Node child : children()) {
            if (child.getDeleted() == null)
                children.add(child);
        }

        for (Property p : props)
            buf.append(inner).append(p.toString(inner.length())).append(";\n");
        if (!props.isEmpty() && !children.isEmpty())
            buf.append('\n');
        for (int i = 0; i < children.size(); i++) {
            if (i > 0)
                buf.append('\n');
            Node child = children.get(i);
            if (expandChildren)
                buf.append(child.toString(true, inner)).append('\n');
            else
                buf.append(inner).append(child.getFullName()).append(" { /* ... */ };\n");
        }
        return buf.append(indent).append("};").toString();
    }

    @Override
    public String toString() {
        return path;
    }
}
