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
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import javax.annotation.CheckForNull;
import javax.annotation.Nonnull;

/**
 * The nodes of one context, indexed by integer id and by path.
 *
 * Ids are never reused. Pruning a node only drops it from the path
 * index, so entries that still hold its id can be adopted back in.
 */
public class NodeRegistry {

    private final List<Node> nodes = new ArrayList<Node>();
    private final Map<String, Integer> paths = new HashMap<String, Integer>();

    /** Returns the node with the given id, attached or not. */
    @Nonnull
    public Node get(int id) {
        return nodes.get(id);
    }

    @CheckForNull
    public Node get(@Nonnull String path) {
        Integer id = paths.get(path);
        return (id == null) ? null : nodes.get(id);
    }

    @CheckForNull
    public Node getRoot() {
        return get("/");
    }

    @Nonnull
    public Node getOrCreateRoot() {
        Node root = getRoot();
        if (root == null)
            root = create("/", null, "/", "/", -1);
        return root;
    }

    /**
     * Returns the child of {@code parent} with the given name and unit
     * address, creating it if needed.
     */
    @Nonnull
    public Node getOrCreate(@Nonnull String name, @CheckForNull String unitAddress, @Nonnull Node parent) {
        String fullName = (unitAddress == null) ? name : name + "@" + unitAddress;
        String path = parent.getPath() + fullName + "/";
        Node node = get(path);
        if (node == null)
            node = create(name, unitAddress, fullName, path, parent.getId());
        return node;
    }

    /** Returns a parentless stand-in for a reference that did not resolve. */
    @Nonnull
    public Node placeholder(@Nonnull String ref) {
        String path = ref + "/";
        Node node = get(path);
        if (node == null)
            node = create(ref, null, ref, path, -1);
        return node;
    }

    @Nonnull
    private Node create(@Nonnull String name, @CheckForNull String unitAddress, @Nonnull String fullName, @Nonnull String path, int parentId) {
        Node node = new Node(nodes.size(), this, name, unitAddress, fullName, path, parentId);
        nodes.add(node);
        paths.put(path, node.getId());
        return node;
    }

    /**
     * Attaches an entry of a previously parsed file.
     *
     * If its node was pruned and the path has since been taken by a new
     * node, the entry moves over to that node.
     */
    /* pp */ void adopt(@Nonnull NodeEntry entry) {
        Node node = entry.getNode();
        Integer id = paths.get(node.getPath());
        if (id == null) {
            reattach(node);
        } else if (id != node.getId()) {
            entry.setNodeId(id);
            node = nodes.get(id);
        }
        node.addEntry(entry);
    }

    private void reattach(@Nonnull Node node) {
        paths.put(node.getPath(), node.getId());
        Node parent = node.getParent();
        if (parent != null && !paths.containsKey(parent.getPath()))
            reattach(parent);
    }

    /** Returns the nodes in the path index, in creation order. */
    @Nonnull
    public List<Node> getNodes() {
        List<Node> result = new ArrayList<Node>();
        for (Node n : nodes) {
            Integer id = paths.get(n.getPath());
            if (id != null && id == n.getId())
                result.add(n);
        }
        return Collections.unmodifiableList(result);
    }

    public int size() {
        return paths.size();
    }

    /** Drops nodes without entries that are not on the path to a live node. */
    public int prune() {
        Set<Integer> live = new HashSet<Integer>();
        for (Node n : getNodes()) {
            if (n.getEntries().isEmpty() && !n.hasDeletions())
                continue;
            Node p = n;
            while (p != null && live.add(p.getId()))
                p = p.getParent();
        }
        int pruned = 0;
        for (Node n : getNodes()) {
            if (!live.contains(n.getId())) {
                paths.remove(n.getPath());
                pruned++;
            }
        }
        return pruned;
    }

    @Override
    public String toString() {
        return "NodeRegistry" + paths.keySet();
    }
}
