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
import java.util.Comparator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.atomic.AtomicInteger;
import javax.annotation.CheckForNull;
import javax.annotation.Nonnull;

import org.pcollections.HashTreePMap;
import org.pcollections.PMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * A board file and its overlays, composed into one device tree.
 *
 * Files are ordered board first, then overlays in their configured
 * order. A later file overrides properties set by an earlier one.
 *
 * A context is mutated only by the {@link Parser} that owns it, on the
 * parser's executor. Queries are not synchronized: run them on the
 * executor's thread, or once the parser's {@link Parser#stable()} future
 * has completed.
 */
public class DtsContext {

    private static final Logger LOG = LoggerFactory.getLogger(DtsContext.class);
    private static final AtomicInteger IDS = new AtomicInteger();

    private final int id = IDS.incrementAndGet();
    @CheckForNull
    private String name;
    @CheckForNull
    private DtsFile board;
    private final List<DtsFile> overlays = new ArrayList<DtsFile>();
    private final NodeRegistry registry = new NodeRegistry();
    private final Set<URI> dirty = Collections.synchronizedSet(new LinkedHashSet<URI>());
    private final List<String> includes = new ArrayList<String>();
    private DiagnosticSet contextDiags = new DiagnosticSet();
    /* pp */ volatile boolean parsing;
    /* pp */ volatile boolean cancelled;
    /* pp */ CompletableFuture<DtsContext> completion = CompletableFuture.completedFuture(this);

    public int getId() {
        return id;
    }

    @Nonnull
    public String getName() {
        if (name != null)
            return name;
        List<DtsFile> files = getFiles();
        if (files.isEmpty())
            return "context-" + id;
        String path = files.get(files.size() - 1).getUri().getPath();
        return path.substring(path.lastIndexOf('/') + 1);
    }

    public void setName(@CheckForNull String name) {
        this.name = name;
    }

    @Nonnull
    public NodeRegistry getRegistry() {
        return registry;
    }

    @CheckForNull
    public DtsFile getBoard() {
        return board;
    }

    @Nonnull
    public List<DtsFile> getOverlays() {
        return Collections.unmodifiableList(overlays);
    }

    /** Returns the board file followed by the overlays. */
    @Nonnull
    public List<DtsFile> getFiles() {
        List<DtsFile> files = new ArrayList<DtsFile>();
        if (board != null)
            files.add(board);
        files.addAll(overlays);
        return files;
    }

    /** Returns the include directories specific to this context. */
    @Nonnull
    public List<String> getIncludes() {
        return includes;
    }

    public boolean isParsing() {
        return parsing;
    }

    /** Returns the URIs changed since the last parse. */
    @Nonnull
    public Set<URI> getDirty() {
        synchronized (dirty) {
            return new LinkedHashSet<URI>(dirty);
        }
    }

    /** Records a change to a file this context depends on. */
    public void markDirty(@Nonnull URI uri) {
        dirty.add(uri);
    }

    public boolean isValid() {
        if (!dirty.isEmpty())
            return false;
        for (DtsFile f : getFiles())
            if (f.isDirty())
                return false;
        return true;
    }

    /* pp */ void setBoard(@Nonnull URI uri) {
        if (board != null)
            board.remove();
        board = new DtsFile(uri);
        invalidateFrom(0);
        markDirty(uri);
    }

    /* pp */ void addOverlay(@Nonnull URI uri) {
        overlays.add(new DtsFile(uri));
        markDirty(uri);
    }

    /** Adds an overlay in front of the existing ones. */
    /* pp */ void insertOverlay(@Nonnull URI uri) {
        overlays.add(0, new DtsFile(uri));
        invalidateFrom(board == null ? 0 : 1);
        markDirty(uri);
    }

    /* pp */ void setOverlays(@Nonnull List<URI> uris) {
        for (DtsFile overlay : overlays)
            overlay.remove();
        overlays.clear();
        for (URI uri : uris)
            addOverlay(uri);
    }

    /* pp */ void setIncludes(@Nonnull List<String> includes) {
        this.includes.clear();
        this.includes.addAll(includes);
    }

    /* Files resolve references against earlier files, so everything after a change is stale. */
    private void invalidateFrom(int index) {
        List<DtsFile> files = getFiles();
        for (int i = index; i < files.size(); i++)
            files.get(i).setDirty(true);
    }

    /**
     * Returns the files that need parsing: the first file affected by a
     * change, and every file after it.
     */
    @Nonnull
    /* pp */ List<DtsFile> getStaleFiles() {
        Set<URI> changed = getDirty();
        List<DtsFile> files = getFiles();
        List<DtsFile> stale = new ArrayList<DtsFile>();
        for (DtsFile f : files) {
            if (!stale.isEmpty() || f.isDirty()) {
                stale.add(f);
                continue;
            }
            for (URI uri : changed) {
                if (f.has(uri)) {
                    stale.add(f);
                    break;
                }
            }
        }
        return stale;
    }

    /**
     * Detaches the entries of the stale files from the registry, and
     * forgets the changes a parse has picked up. Node objects and the
     * entries of other files stay in place.
     *
     * @param handled the changes read by the parse; later ones stay pending.
     * @return the files to parse again, in file order.
     */
    @Nonnull
    /* pp */ List<DtsFile> reset(@Nonnull Set<URI> handled) {
        List<DtsFile> stale = getStaleFiles();
        for (DtsFile f : stale)
            f.remove();
        dirty.removeAll(handled);
        return stale;
    }

    /** Attaches the entries of a file that did not need parsing, and sets its priority. */
    /* pp */ void adopt(@Nonnull DtsFile file) {
        file.setPriority(getFiles().indexOf(file));
        for (NodeEntry e : file.getEntries())
            registry.adopt(e);
    }

    /* pp */ void resolveTypes(@Nonnull TypeResolver resolver) {
        List<Node> nodes = new ArrayList<Node>(registry.getNodes());
        Collections.sort(nodes, new Comparator<Node>() {
            @Override
            public int compare(Node a, Node b) {
                return Integer.compare(depth(a), depth(b));
            }
        });
        for (Node n : nodes) {
            NodeType type = n.getType();
            if (type != null && type.isValid())
                continue;
            Node parent = n.getParent();
            n.setType(resolver.resolve(n, parent == null ? null : parent.getType()));
        }
    }

    private static int depth(@Nonnull Node n) {
        int depth = 0;
        for (Node p = n.getParent(); p != null; p = p.getParent())
            depth++;
        return depth;
    }

    /* pp */ void prune() {
        int pruned = registry.prune();
        if (pruned > 0)
            LOG.debug("{}: pruned {} nodes", getName(), pruned);
    }

    /**
     * Recomputes the diagnostics that depend on the composed tree rather
     * than on a single file.
     */
    /* pp */ void refreshContextDiagnostics(boolean disabledHints) {
        DiagnosticSet diags = new DiagnosticSet();
        if (disabledHints) {
            for (Node node : registry.getNodes()) {
                if (node.enabled())
                    continue;
                Property status = node.property("status");
                if (status == null)
                    continue;
                for (NodeEntry e : node.getEntries()) {
                    if (e == status.getEntry())
                        continue;
                    Diagnostic d = diags.push(e.getNameSpan(), "Disabled", Severity.HINT);
                    d.addTag(Diagnostic.Tag.UNNECESSARY);
                    d.setRelated(status.getFullSpan(), "Disabled here");
                }
            }
        }
        this.contextDiags = diags;
    }

    /**
     * Finds a node by reference or path.
     *
     * @param name {@code &label}, {@code &{/path}}, or a path. A path
     *  is relative to {@code parent} if given, and absolute otherwise.
     */
    @CheckForNull
    public Node lookupNode(@Nonnull String name, @CheckForNull Node parent) {
        if (name.startsWith("&{")) {
            if (!name.endsWith("}"))
                return null;
            name = name.substring(2, name.length() - 1);
        } else if (name.startsWith("&")) {
            String label = name.substring(1);
            for (Node n : registry.getNodes()) {
                if (n.hasLabel(label))
                    return n;
            }
            return null;
        }

        name = PHandle.normalizePath(name);
        if (parent != null)
            name = parent.getPath() + name;
        return registry.get(name);
    }

    @CheckForNull
    public Node lookupNode(@Nonnull String name) {
        return lookupNode(name, null);
    }

    @CheckForNull
    public Node lookupNode(@Nonnull PHandle handle) {
        switch (handle.getRefKind()) {
            case LABEL_REF:
                return lookupNode(handle.getReference());
            case PATH_REF:
            case STRING_REF:
                return lookupNode(handle.getReference(), null);
            default:
                return null;
        }
    }

    @CheckForNull
    public NodeEntry entryAt(@Nonnull URI uri, @Nonnull Position position) {
        for (DtsFile f : getFiles()) {
            if (!f.has(uri))
                continue;
            NodeEntry e = f.getEntryAt(uri, position);
            if (e != null)
                return e;
        }
        return null;
    }

    @CheckForNull
    public Node nodeAt(@Nonnull URI uri, @Nonnull Position position) {
        NodeEntry e = entryAt(uri, position);
        return (e == null) ? null : e.getNode();
    }

    @CheckForNull
    public Property propertyAt(@Nonnull URI uri, @Nonnull Position position) {
        for (DtsFile f : getFiles()) {
            if (!f.has(uri))
                continue;
            Property p = f.getPropertyAt(uri, position);
            if (p != null)
                return p;
        }
        return null;
    }

    /** Returns every entry of every file, in file order. */
    @Nonnull
    public List<NodeEntry> getEntries() {
        List<NodeEntry> entries = new ArrayList<NodeEntry>();
        for (DtsFile f : getFiles())
            entries.addAll(f.getEntries());
        return entries;
    }

    @Nonnull
    public List<NodeEntry> getRoots() {
        List<NodeEntry> roots = new ArrayList<NodeEntry>();
        for (DtsFile f : getFiles())
            roots.addAll(f.getRoots());
        return roots;
    }

    /** Returns every property declaration, shadowed or not. */
    @Nonnull
    public List<Property> getProperties() {
        List<Property> props = new ArrayList<Property>();
        for (NodeEntry e : getEntries()) {
            for (Property p : e.getProperties())
                if (!p.isDeleted())
                    props.add(p);
        }
        return props;
    }

    /** Returns the effective properties declared in the given range. */
    @Nonnull
    public List<Property> getProperties(@Nonnull Span range) {
        List<Property> props = new ArrayList<Property>();
        for (Node n : registry.getNodes()) {
            for (Property p : n.uniqueProperties())
                if (p.getFullSpan().intersects(range))
                    props.add(p);
        }
        return props;
    }

    /** Returns every phandle pointing at the node. */
    @Nonnull
    public List<PHandle> getReferences(@Nonnull Node node) {
        List<PHandle> refs = new ArrayList<PHandle>();
        for (Property p : getProperties()) {
            for (PropertyValue v : p.getValues()) {
                if (v.getKind() == PropertyValue.Kind.PHANDLE) {
                    if (((PHandle) v).is(node))
                        refs.add((PHandle) v);
                } else if (v.getKind() == PropertyValue.Kind.ARRAY) {
                    for (PropertyValue c : ((ArrayValue) v).getCells())
                        if (c.getKind() == PropertyValue.Kind.PHANDLE && ((PHandle) c).is(node))
                            refs.add((PHandle) c);
                }
            }
        }
        return refs;
    }

    /** Returns the node whose {@code phandle} property has the given value. */
    @CheckForNull
    public Node getPHandleNode(long handle) {
        for (Node n : registry.getNodes()) {
            Property p = n.property("phandle");
            Long value = (p == null) ? null : p.getNumber();
            if (value != null && value == handle)
                return n;
        }
        return null;
    }

    @CheckForNull
    public Node getPHandleNode(@Nonnull String label) {
        return lookupNode("&" + label);
    }

    @CheckForNull
    public Node getRoot() {
        return registry.getRoot();
    }

    /** Returns the macros in effect at the end of the last file. */
    @Nonnull
    public PMap<String, Macro> getMacros() {
        List<DtsFile> files = getFiles();
        if (files.isEmpty())
            return HashTreePMap.empty();
        return files.get(files.size() - 1).getMacros();
    }

    public boolean has(@Nonnull URI uri) {
        return file(uri) != null;
    }

    @CheckForNull
    public DtsFile file(@Nonnull URI uri) {
        for (DtsFile f : getFiles())
            if (f.has(uri))
                return f;
        return null;
    }

    /** Returns the diagnostics of all files, and those of the composed tree. */
    @Nonnull
    public DiagnosticSet getDiagnostics() {
        DiagnosticSet all = new DiagnosticSet();
        for (DtsFile f : getFiles())
            all.merge(f.getDiags());
        all.merge(contextDiags);
        return all;
    }

    @Override
    public String toString() {
        Node root = getRoot();
        return (root == null) ? "" : root.toString(true, "");
    }
}
