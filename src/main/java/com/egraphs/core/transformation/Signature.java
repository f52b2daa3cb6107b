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
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * A canonical encoding of a selection of sibling items, equal for two selections exactly when
 * one is a copy of the other up to the identity of the nodes they own.
 *
 * Nodes owned by the selection are named by ordinal: nodes are numbered context by context,
 * each context's nodes in stored order before descending into its cuts. Nodes the selection only
 * refers to keep their identifier, so a copy matches only when it refers to the same outside
 * nodes. Relation arguments stay in positional order; sibling items are sorted.
 */
public class Signature {

    private final String encoding;

    private Signature(String encoding) {
        this.encoding = encoding;
    }

    public static Signature of(Hypergraph graph, List<Identifier> items) {
        Map<Identifier, Integer> ordinals = new HashMap<>();
        assignOrdinals(graph, items, ordinals);
        return new Signature(encodeAll(graph, items, ordinals, "|"));
    }

    private static void assignOrdinals(Hypergraph graph, List<Identifier> items, Map<Identifier, Integer> ordinals) {
        for (Identifier item : items) {
            if (graph.isNode(item)) ordinals.putIfAbsent(item, ordinals.size());
        }
        for (Identifier item : items) {
            if (graph.isEdge(item) && graph.edge(item).isCut()) assignOrdinals(graph, graph.itemsIn(item), ordinals);
        }
    }

    private static String encodeAll(Hypergraph graph, List<Identifier> items, Map<Identifier, Integer> ordinals,
                                    String separator) {
        List<String> encodings = new ArrayList<>();
        for (Identifier item : items) encodings.add(encode(graph, item, ordinals));
        return encodings.stream().sorted().collect(Collectors.joining(separator));
    }

    private static String encode(Hypergraph graph, Identifier item, Map<Identifier, Integer> ordinals) {
        if (graph.isNode(item)) {
            Node node = graph.node(item);
            StringBuilder builder = new StringBuilder("node/").append(node.type().label());
            if (node.isConstant()) builder.append("/").append(node.name().orElse(""));
            return builder.append("=").append(reference(item, ordinals)).toString();
        }
        Hyperedge edge = graph.edge(item);
        if (edge.isCut()) {
            String tag = edge.construct().map(c -> "/" + c.label()).orElse("");
            return "cut" + tag + ":{" + encodeAll(graph, graph.itemsIn(item), ordinals, ",") + "}";
        }
        String relation = edge.isIdentity() ? "=" : edge.name().orElse("");
        return relation + "/" + edge.type().label() + ":("
                + edge.nodes().stream().map(n -> reference(n, ordinals)).collect(Collectors.joining(",")) + ")";
    }

    private static String reference(Identifier node, Map<Identifier, Integer> ordinals) {
        Integer ordinal = ordinals.get(node);
        return ordinal != null ? "internal:n" + ordinal : "external:" + node;
    }

    public String encoding() {
        return encoding;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        Signature that = (Signature) o;
        return encoding.equals(that.encoding);
    }

    @Override
    public int hashCode() {
        return encoding.hashCode();
    }

    @Override
    public String toString() {
        return encoding;
    }
}
