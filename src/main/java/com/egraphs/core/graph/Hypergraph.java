/*
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at https://mozilla.org/MPL/2.0/.
 */

package com.egraphs.core.graph;

import com.egraphs.core.common.exception.EGException;
import com.egraphs.core.common.iterator.FunctionalIterator;
import com.google.common.collect.ImmutableList;

import java.util.ArrayList;
import java.util.Collection;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

import static com.egraphs.core.common.exception.ErrorMessage.GraphRead.UNKNOWN_CONTAINER;
import static com.egraphs.core.common.exception.ErrorMessage.GraphRead.UNKNOWN_EDGE;
import static com.egraphs.core.common.exception.ErrorMessage.GraphRead.UNKNOWN_ITEM;
import static com.egraphs.core.common.exception.ErrorMessage.GraphRead.UNKNOWN_NODE;
import static com.egraphs.core.common.exception.ErrorMessage.GraphWrite.CYCLIC_CONTAINMENT;
import static com.egraphs.core.common.exception.ErrorMessage.GraphWrite.DANGLING_REFERENCE;
import static com.egraphs.core.common.exception.ErrorMessage.GraphWrite.DUPLICATE_ID;
import static com.egraphs.core.common.exception.ErrorMessage.GraphWrite.OUT_OF_SCOPE_REFERENCE;
import static com.egraphs.core.common.exception.ErrorMessage.GraphWrite.STRANDED_REFERENCE;
import static com.egraphs.core.common.iterator.Iterators.empty;
import static com.egraphs.core.common.iterator.Iterators.iterate;
import static com.egraphs.core.common.iterator.Iterators.loop;
import static com.egraphs.core.common.iterator.Iterators.tree;
import static com.google.common.base.Preconditions.checkPositionIndex;
import static com.google.common.base.Verify.verify;

/**
 * An Existential Graph held as a property hypergraph.
 *
 * The graph owns every {@link Node} and {@link Hyperedge} and records, for each of them, the
 * context it is placed in: either the {@link Identifier#SHEET} or a cut. Each context keeps its
 * items in insertion order, which is also the order the items are rendered in.
 */
public class Hypergraph {

    private final Map<Identifier, Node> nodes;
    private final Map<Identifier, Hyperedge> edges;
    private final Map<Identifier, Identifier> containment;
    private final Map<Identifier, List<Identifier>> contents;

    public Hypergraph() {
        nodes = new LinkedHashMap<>();
        edges = new LinkedHashMap<>();
        containment = new LinkedHashMap<>();
        contents = new LinkedHashMap<>();
        contents.put(Identifier.SHEET, new ArrayList<>());
    }

    private Hypergraph(Hypergraph source) {
        nodes = new LinkedHashMap<>(source.nodes);
        edges = new LinkedHashMap<>(source.edges);
        containment = new LinkedHashMap<>(source.containment);
        contents = new LinkedHashMap<>();
        source.contents.forEach((container, items) -> contents.put(container, new ArrayList<>(items)));
    }

    public Hypergraph copy() {
        return new Hypergraph(this);
    }

    public Node addNode(Node node) {
        return addNode(node, Identifier.SHEET);
    }

    public Node addNode(Node node, Identifier container) {
        return addNode(node, container, itemsOf(container).size());
    }

    public Node addNode(Node node, Identifier container, int position) {
        validateNewItem(node.id(), container, position);
        nodes.put(node.id(), node);
        place(node.id(), container, position);
        return node;
    }

    public Hyperedge addEdge(Hyperedge edge) {
        return addEdge(edge, Identifier.SHEET);
    }

    public Hyperedge addEdge(Hyperedge edge, Identifier container) {
        return addEdge(edge, container, itemsOf(container).size());
    }

    public Hyperedge addEdge(Hyperedge edge, Identifier container, int position) {
        validateNewItem(edge.id(), container, position);
        for (Identifier ref : edge.nodes()) {
            if (!nodes.containsKey(ref)) throw EGException.of(DANGLING_REFERENCE, edge.id(), ref);
            if (!isAncestor(containment.get(ref), container)) {
                throw EGException.of(OUT_OF_SCOPE_REFERENCE, edge.id(), ref);
            }
        }
        edges.put(edge.id(), edge);
        if (edge.isCut()) contents.put(edge.id(), new ArrayList<>());
        place(edge.id(), container, position);
        return edge;
    }

    private void validateNewItem(Identifier id, Identifier container, int position) {
        if (id.isSheet() || containment.containsKey(id)) throw EGException.of(DUPLICATE_ID, id);
        checkPositionIndex(position, itemsOf(container).size());
    }

    private void place(Identifier item, Identifier container, int position) {
        containment.put(item, container);
        contents.get(container).add(position, item);
    }

    private List<Identifier> itemsOf(Identifier container) {
        List<Identifier> items = contents.get(container);
        if (items == null) throw EGException.of(UNKNOWN_CONTAINER, container);
        return items;
    }

    public boolean contains(Identifier item) {
        return containment.containsKey(item);
    }

    public boolean isNode(Identifier item) {
        return nodes.containsKey(item);
    }

    public boolean isEdge(Identifier item) {
        return edges.containsKey(item);
    }

    public Node node(Identifier id) {
        Node node = nodes.get(id);
        if (node == null) throw EGException.of(UNKNOWN_NODE, id);
        return node;
    }

    public Hyperedge edge(Identifier id) {
        Hyperedge edge = edges.get(id);
        if (edge == null) throw EGException.of(UNKNOWN_EDGE, id);
        return edge;
    }

    public ImmutableList<Node> nodes() {
        return ImmutableList.copyOf(nodes.values());
    }

    public ImmutableList<Hyperedge> edges() {
        return ImmutableList.copyOf(edges.values());
    }

    public ImmutableList<Identifier> itemsIn(Identifier container) {
        return ImmutableList.copyOf(itemsOf(container));
    }

    public Identifier containerOf(Identifier item) {
        Identifier container = containment.get(item);
        if (container == null) throw EGException.of(UNKNOWN_ITEM, item);
        return container;
    }

    public int indexOf(Identifier item) {
        return contents.get(containerOf(item)).indexOf(item);
    }

    /**
     * The number of cuts enclosing an item.
     */
    public int depth(Identifier item) {
        return (int) loop(containerOf(item), c -> !c.isSheet(), this::containerOf).count();
    }

    /**
     * The number of cuts that separate the inside of a container from the sheet: 0 for the sheet,
     * and one more than the cut's own depth for a cut. Even values are positive contexts.
     */
    public int contextDepth(Identifier container) {
        itemsOf(container);
        return container.isSheet() ? 0 : depth(container) + 1;
    }

    public static boolean isPositive(int contextDepth) {
        return contextDepth % 2 == 0;
    }

    /**
     * Whether {@code ancestor} lies on the containment chain of {@code item}, counting the item
     * itself. The sheet is an ancestor of everything.
     */
    public boolean isAncestor(Identifier ancestor, Identifier item) {
        if (ancestor.equals(item) || ancestor.isSheet()) return true;
        if (item.isSheet()) return false;
        return contextChain(containerOf(item)).anyMatch(ancestor::equals);
    }

    /**
     * The given container followed by every enclosing context, ending with the sheet.
     */
    public FunctionalIterator<Identifier> contextChain(Identifier container) {
        itemsOf(container);
        return loop(container, Objects::nonNull, c -> c.isSheet() ? null : containerOf(c));
    }

    /**
     * The item together with everything nested inside it, outermost first.
     */
    public FunctionalIterator<Identifier> subtree(Identifier item) {
        containerOf(item);
        return tree(item, i -> contents.containsKey(i) ? iterate(new ArrayList<>(contents.get(i))) : empty());
    }

    public FunctionalIterator<Hyperedge> referrers(Identifier node) {
        return iterate(new ArrayList<>(edges.values())).filter(edge -> edge.nodes().contains(node));
    }

    public Optional<Hyperedge> producer(Identifier output) {
        return iterate(edges.values()).filter(e -> e.isFunction() && e.output().equals(output)).first();
    }

    /**
     * Moves an item, with everything nested inside it, into another context.
     * The position is taken in the target's item list after the item has left its old context.
     */
    public void moveItem(Identifier item, Identifier container, int position) {
        Identifier source = containerOf(item);
        itemsOf(container);
        if (isAncestor(item, container)) throw EGException.of(CYCLIC_CONTAINMENT, item, container);
        contents.get(source).remove(item);
        checkPositionIndex(position, contents.get(container).size());
        place(item, container, position);
    }

    public void moveItem(Identifier item, Identifier container) {
        moveItem(item, container, container.equals(containerOf(item))
                ? itemsOf(container).size() - 1
                : itemsOf(container).size());
    }

    public void removeItem(Identifier item) {
        removeItems(ImmutableList.of(item));
    }

    /**
     * Removes the items with everything nested inside them. Fails, leaving the graph untouched,
     * if a hyperedge that survives the removal still refers to a removed node.
     */
    public void removeItems(Collection<Identifier> items) {
        Set<Identifier> removed = new LinkedHashSet<>();
        for (Identifier item : items) removed.addAll(subtree(item).toList());
        for (Hyperedge edge : edges.values()) {
            if (removed.contains(edge.id())) continue;
            for (Identifier ref : edge.nodes()) {
                if (removed.contains(ref)) throw EGException.of(STRANDED_REFERENCE, ref, edge.id());
            }
        }
        for (Identifier item : items) contents.get(containment.get(item)).remove(item);
        for (Identifier item : removed) {
            nodes.remove(item);
            edges.remove(item);
            contents.remove(item);
            containment.remove(item);
        }
    }

    /**
     * Checks the structural invariants of the graph, failing with a
     * {@link com.google.common.base.VerifyException} on the first violation.
     */
    public void verifyIntegrity() {
        verify(contents.containsKey(Identifier.SHEET), "The sheet of assertion is missing");
        verify(containment.size() == nodes.size() + edges.size(),
               "Containment holds %s items, but the graph has %s nodes and %s edges",
               containment.size(), nodes.size(), edges.size());
        Set<Identifier> listed = new HashSet<>();
        for (Map.Entry<Identifier, List<Identifier>> entry : contents.entrySet()) {
            Identifier container = entry.getKey();
            verify(container.isSheet() || (edges.containsKey(container) && edges.get(container).isCut()),
                   "The container %s is not a cut", container);
            for (Identifier item : entry.getValue()) {
                verify(listed.add(item), "The item %s is listed more than once", item);
                verify(container.equals(containment.get(item)), "The item %s is listed in %s but placed in %s",
                       item, container, containment.get(item));
            }
        }
        verify(listed.size() == containment.size(), "Some items are not listed in their context");
        for (Hyperedge edge : edges.values()) {
            verify(edge.isCut() == contents.containsKey(edge.id()), "The edge %s has mismatched contents", edge.id());
        }
        int bound = containment.size() + 1;
        for (Identifier item : containment.keySet()) {
            long chain = loop(containment.get(item), c -> c != null && !c.isSheet(), containment::get)
                    .stream().limit(bound).count();
            verify(chain < bound, "The containment of %s is cyclic", item);
        }
        for (Hyperedge edge : edges.values()) {
            for (Identifier ref : edge.nodes()) {
                verify(nodes.containsKey(ref), "The edge %s refers to the missing node %s", edge.id(), ref);
                verify(isAncestor(containment.get(ref), containment.get(edge.id())),
                       "The edge %s refers to the out of scope node %s", edge.id(), ref);
            }
        }
    }

    @Override
    public String toString() {
        StringBuilder builder = new StringBuilder();
        builder.append("Hypergraph(").append(nodes.size()).append(" nodes, ").append(edges.size()).append(" edges)");
        print(builder, Identifier.SHEET, 1);
        return builder.toString();
    }

    private void print(StringBuilder builder, Identifier container, int indent) {
        for (Identifier item : contents.get(container)) {
            builder.append("\n").append("  ".repeat(indent));
            builder.append(nodes.containsKey(item) ? nodes.get(item) : edges.get(item));
            if (contents.containsKey(item)) print(builder, item, indent + 1);
        }
    }
}
