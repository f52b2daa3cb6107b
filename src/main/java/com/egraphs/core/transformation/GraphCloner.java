/*
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at https://mozilla.org/MPL/2.0/.
 */

package com.egraphs.core.transformation;

import com.egraphs.core.graph.Hyperedge;
import com.egraphs.core.graph.Hypergraph;
import com.egraphs.core.graph.Identifier;
import com.egraphs.core.graph.Node;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Deep-copies items from one graph into a context of another (or the same) graph under fresh
 * identifiers. References to nodes that were not copied are kept as they are.
 */
public class GraphCloner {

    private final Hypergraph source;
    private final Hypergraph target;
    private final Map<Identifier, Identifier> remap;

    public GraphCloner(Hypergraph source, Hypergraph target) {
        this.source = source;
        this.target = target;
        this.remap = new HashMap<>();
    }

    /**
     * Copies the items, and everything nested inside them, to the end of the container. Within
     * each context the nodes are copied before the hyperedges, so every copied hyperedge finds the
     * copies of its nodes already in place.
     *
     * @return the identifiers of the top-level copies
     */
    public List<Identifier> cloneInto(List<Identifier> items, Identifier container) {
        List<Identifier> clones = new ArrayList<>();
        for (Identifier item : items) {
            if (source.isNode(item)) clones.add(clone(source.node(item), container));
        }
        for (Identifier item : items) {
            if (source.isEdge(item)) clones.add(clone(source.edge(item), container));
        }
        return clones;
    }

    private Identifier clone(Node node, Identifier container) {
        if (remap.containsKey(node.id())) return remap.get(node.id());
        Node newClone = target.addNode(node.withId(Identifier.random()), container);
        remap.put(node.id(), newClone.id());
        return newClone.id();
    }

    private Identifier clone(Hyperedge edge, Identifier container) {
        if (remap.containsKey(edge.id())) return remap.get(edge.id());
        List<Identifier> nodes = new ArrayList<>();
        for (Identifier ref : edge.nodes()) nodes.add(remap.getOrDefault(ref, ref));
        Hyperedge newClone = target.addEdge(edge.withId(Identifier.random()).withNodes(nodes), container);
        remap.put(edge.id(), newClone.id());
        if (edge.isCut()) cloneInto(source.itemsIn(edge.id()), newClone.id());
        return newClone.id();
    }

    public Map<Identifier, Identifier> remapping() {
        return Collections.unmodifiableMap(remap);
    }
}
