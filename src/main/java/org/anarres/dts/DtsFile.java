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

import org.pcollections.HashTreePMap;
import org.pcollections.PMap;

/**
 * One board or overlay file in a context, with everything its last
 * parse produced: the preprocessed lines, the entries it contributed
 * to the node registry, its includes, macros and diagnostics.
 */
public class DtsFile {

    private final URI uri;
    private List<Line> lines = Collections.emptyList();
    private final List<NodeEntry> roots = new ArrayList<NodeEntry>();
    private final List<NodeEntry> entries = new ArrayList<NodeEntry>();
    private List<IncludeStatement> includes = Collections.emptyList();
    private PMap<String, Macro> macros = HashTreePMap.empty();
    private DiagnosticSet diags = new DiagnosticSet();
    private final List<Node> deletedNodes = new ArrayList<Node>();
    private final List<long[]> memreserves = new ArrayList<long[]>();
    private boolean dirty = true;
    private boolean available = true;
    private boolean plugin;
    private int priority;

    public DtsFile(@Nonnull URI uri) {
        this.uri = uri;
    }

    @Nonnull
    public URI getUri() {
        return uri;
    }

    /** Returns the preprocessed lines, including those of included files. */
    @Nonnull
    public List<Line> getLines() {
        return lines;
    }

    /** Returns the top level entries. */
    @Nonnull
    public List<NodeEntry> getRoots() {
        return Collections.unmodifiableList(roots);
    }

    /** Returns every entry of this file, in the order they were opened. */
    @Nonnull
    public List<NodeEntry> getEntries() {
        return Collections.unmodifiableList(entries);
    }

    @Nonnull
    public List<IncludeStatement> getIncludes() {
        return includes;
    }

    /** Returns the macros defined once this file has been preprocessed. */
    @Nonnull
    public PMap<String, Macro> getMacros() {
        return macros;
    }

    @Nonnull
    public DiagnosticSet getDiags() {
        return diags;
    }

    /** Returns the address and size of each {@code /memreserve/} directive. */
    @Nonnull
    public List<long[]> getMemreserves() {
        return Collections.unmodifiableList(memreserves);
    }

    public boolean isDirty() {
        return dirty;
    }

    /* pp */ void setDirty(boolean dirty) {
        this.dirty = dirty;
    }

    /** Returns false if the content of this file could not be read on the last parse. */
    public boolean isAvailable() {
        return available;
    }

    /** Returns true if the file declares itself an overlay with {@code /plugin/}. */
    public boolean isPlugin() {
        return plugin;
    }

    /** Returns the position of this file in its context; later files override earlier ones. */
    public int getPriority() {
        return priority;
    }

    /* pp */ void setPriority(int priority) {
        this.priority = priority;
    }

    /* pp */ void setPreprocessed(@Nonnull PreprocessedFile pp) {
        this.lines = pp.getLines();
        this.includes = pp.getIncludes();
        this.macros = pp.getMacros();
    }

    /* pp */ void setMacros(@Nonnull PMap<String, Macro> macros) {
        this.macros = macros;
    }

    /* pp */ void setDiags(@Nonnull DiagnosticSet diags) {
        this.diags = diags;
    }

    /* pp */ void setAvailable(boolean available) {
        this.available = available;
    }

    /* pp */ void setPlugin(boolean plugin) {
        this.plugin = plugin;
    }

    /**
     * @param topLevel true if the entry was opened outside any other block.
     */
    /* pp */ void addEntry(@Nonnull NodeEntry entry, boolean topLevel) {
        entries.add(entry);
        if (topLevel)
            roots.add(entry);
    }

    /* pp */ void addDeletion(@Nonnull Node node, @Nonnull Node.Deletion deletion) {
        node.addDeletion(deletion);
        deletedNodes.add(node);
    }

    /* pp */ void addMemreserve(long address, long size) {
        memreserves.add(new long[]{address, size});
    }

    /**
     * Detaches everything this file contributed to the node registry,
     * and forgets the result of the last parse.
     */
    public void remove() {
        for (NodeEntry e : entries) {
            Node node = e.getNode();
            node.removeEntry(e);
            Node parent = node.getParent();
            if (parent != null)
                parent.invalidateType();
        }
        for (Node node : deletedNodes)
            node.removeDeletions(this);
        entries.clear();
        roots.clear();
        deletedNodes.clear();
        memreserves.clear();
        lines = Collections.emptyList();
        includes = Collections.emptyList();
        macros = HashTreePMap.empty();
        diags = new DiagnosticSet();
        plugin = false;
        available = true;
        dirty = true;
    }

    /** Returns true if this is the file, or it was included by this file. */
    public boolean has(@Nonnull URI uri) {
        if (this.uri.equals(uri))
            return true;
        for (IncludeStatement include : includes) {
            if (uri.equals(include.getDst()))
                return true;
        }
        return false;
    }

    /**
     * Returns the innermost entry containing the position.
     * Entries of nested blocks contain each other, so the one with the
     * longest path wins.
     */
    @CheckForNull
    public NodeEntry getEntryAt(@Nonnull URI uri, @Nonnull Position position) {
        NodeEntry result = null;
        for (NodeEntry e : entries) {
            if (!e.getSpan().contains(uri, position))
                continue;
            if (result == null || e.getNode().getPath().length() > result.getNode().getPath().length())
                result = e;
        }
        return result;
    }

    @CheckForNull
    public Node getNodeAt(@Nonnull URI uri, @Nonnull Position position) {
        NodeEntry entry = getEntryAt(uri, position);
        return (entry == null) ? null : entry.getNode();
    }

    @CheckForNull
    public Property getPropertyAt(@Nonnull URI uri, @Nonnull Position position) {
        NodeEntry entry = getEntryAt(uri, position);
        return (entry == null) ? null : entry.getPropertyAt(uri, position);
    }

    @Override
    public String toString() {
        return uri.toString();
    }
}
