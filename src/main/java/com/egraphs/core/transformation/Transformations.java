/*
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at https://mozilla.org/MPL/2.0/.
 */

package com.egraphs.core.transformation;

import com.egraphs.core.common.config.Config;
import com.egraphs.core.common.exception.EGException;
import com.egraphs.core.common.iterator.Iterators;
import com.egraphs.core.graph.Hyperedge;
import com.egraphs.core.graph.Hypergraph;
import com.egraphs.core.graph.Identifier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.annotation.Nullable;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;

import static com.egraphs.core.common.config.ConfigKey.VERIFY_INTEGRITY;
import static com.egraphs.core.common.exception.ErrorMessage.Internal.ILLEGAL_STATE;
import static com.egraphs.core.common.exception.ErrorMessage.Rule.ESCAPING_REFERENCE;
import static com.egraphs.core.common.exception.ErrorMessage.Rule.INVALID_DOUBLE_CUT;
import static com.egraphs.core.common.exception.ErrorMessage.Rule.INVALID_SUBGRAPH;
import static com.egraphs.core.common.exception.ErrorMessage.Rule.ITERATION_INTO_SELF;
import static com.egraphs.core.common.exception.ErrorMessage.Rule.NEGATIVE_CONTEXT;
import static com.egraphs.core.common.exception.ErrorMessage.Rule.NON_NESTED_TARGET;
import static com.egraphs.core.common.exception.ErrorMessage.Rule.NO_MATCHING_GRAPH;
import static com.egraphs.core.common.exception.ErrorMessage.Rule.POSITIVE_CONTEXT;
import static com.egraphs.core.common.exception.ErrorMessage.Rule.ROOT_INSERTION;

/**
 * Applies the rules of transformation. Every rule checks its preconditions against the given
 * graph, performs its edit on a copy, and returns the copy; the given graph is never modified.
 */
public class Transformations {

    private static final Logger LOG = LoggerFactory.getLogger(Transformations.class);

    private final boolean verifyIntegrity;

    public Transformations() {
        this(Config.create());
    }

    public Transformations(Config config) {
        this.verifyIntegrity = config.getProperty(VERIFY_INTEGRITY);
    }

    public Hypergraph apply(Hypergraph graph, Rule rule, Rule.Arguments arguments) {
        LOG.debug("Applying {} with {}", rule, arguments);
        switch (rule) {
            case ADD_DOUBLE_CUT:
                return addDoubleCut(graph, arguments.items(), arguments.container().orElse(null));
            case REMOVE_DOUBLE_CUT:
                return removeDoubleCut(graph, arguments.requireCut(rule));
            case ERASE:
                return erase(graph, arguments.items());
            case INSERT:
                return insert(graph, arguments.requireSubgraph(rule), arguments.requireTarget(rule));
            case ITERATE:
                return iterate(graph, arguments.items(), arguments.requireTarget(rule));
            case DEITERATE:
                return deiterate(graph, arguments.items());
            default:
                throw EGException.of(ILLEGAL_STATE);
        }
    }

    /**
     * Draws two nested cuts around the items, in the place of the first of them. With no items,
     * draws an empty double cut at the end of the container, or of the sheet.
     */
    public Hypergraph addDoubleCut(Hypergraph graph, List<Identifier> items, @Nullable Identifier container) {
        Identifier context;
        List<Identifier> ordered;
        if (items.isEmpty()) {
            context = container != null ? container : Identifier.SHEET;
            graph.itemsIn(context);
            ordered = List.of();
        } else {
            context = requireSiblings(graph, items);
            if (container != null && !container.equals(context)) {
                throw EGException.of(INVALID_SUBGRAPH, "the items are not in the context " + container);
            }
            ordered = inStoredOrder(graph, items);
            Set<Identifier> enclosed = closure(graph, ordered);
            for (Hyperedge edge : graph.edges()) {
                if (enclosed.contains(edge.id())) continue;
                for (Identifier ref : edge.nodes()) {
                    if (enclosed.contains(ref)) throw EGException.of(ESCAPING_REFERENCE, ref, edge.id());
                }
            }
        }

        Hypergraph result = graph.copy();
        int position = ordered.isEmpty() ? result.itemsIn(context).size() : result.indexOf(ordered.get(0));
        Hyperedge outer = result.addEdge(Hyperedge.cut(), context, position);
        Hyperedge inner = result.addEdge(Hyperedge.cut(), outer.id());
        for (Identifier item : ordered) result.moveItem(item, inner.id());
        return publish(Rule.ADD_DOUBLE_CUT, result);
    }

    /**
     * Removes an outer cut that holds nothing but one inner cut, splicing the inner cut's items
     * into the outer cut's place.
     */
    public Hypergraph removeDoubleCut(Hypergraph graph, Identifier outerCut) {
        Hyperedge outer = graph.edge(outerCut);
        if (!outer.isCut()) throw EGException.of(INVALID_DOUBLE_CUT, outerCut, "it is not a cut");
        List<Identifier> between = graph.itemsIn(outerCut);
        if (between.size() != 1) {
            throw EGException.of(INVALID_DOUBLE_CUT, outerCut, "it holds " + between.size() + " items instead of one cut");
        }
        Identifier innerCut = between.get(0);
        if (!graph.isEdge(innerCut) || !graph.edge(innerCut).isCut()) {
            throw EGException.of(INVALID_DOUBLE_CUT, outerCut, "the item it holds is not a cut");
        }

        Hypergraph result = graph.copy();
        Identifier context = result.containerOf(outerCut);
        int position = result.indexOf(outerCut);
        for (Identifier item : result.itemsIn(innerCut)) result.moveItem(item, context, position++);
        result.removeItem(outerCut);
        return publish(Rule.REMOVE_DOUBLE_CUT, result);
    }

    public Hypergraph erase(Hypergraph graph, List<Identifier> items) {
        Identifier context = requireSiblings(graph, items);
        int depth = graph.contextDepth(context);
        if (!Hypergraph.isPositive(depth)) throw EGException.of(NEGATIVE_CONTEXT, context, depth);

        Hypergraph result = graph.copy();
        result.removeItems(items);
        return publish(Rule.ERASE, result);
    }

    /**
     * Copies everything on the sheet of the subgraph into a negative context.
     */
    public Hypergraph insert(Hypergraph graph, Hypergraph subgraph, Identifier target) {
        if (target.isSheet()) throw EGException.of(ROOT_INSERTION);
        int depth = graph.contextDepth(target);
        if (Hypergraph.isPositive(depth)) throw EGException.of(POSITIVE_CONTEXT, target, depth);

        Hypergraph result = graph.copy();
        new GraphCloner(subgraph, result).cloneInto(subgraph.itemsIn(Identifier.SHEET), target);
        return publish(Rule.INSERT, result);
    }

    /**
     * Copies the items into their own context or a context nested within it.
     */
    public Hypergraph iterate(Hypergraph graph, List<Identifier> items, Identifier target) {
        Identifier context = requireSiblings(graph, items);
        graph.itemsIn(target);
        if (!graph.isAncestor(context, target)) throw EGException.of(NON_NESTED_TARGET, target, context);
        if (Iterators.iterate(items).anyMatch(item -> graph.isAncestor(item, target))) {
            throw EGException.of(ITERATION_INTO_SELF, target);
        }

        Hypergraph result = graph.copy();
        new GraphCloner(result, result).cloneInto(inStoredOrder(graph, items), target);
        return publish(Rule.ITERATE, result);
    }

    /**
     * Removes items that are a copy of sibling items in their own context or an enclosing one.
     */
    public Hypergraph deiterate(Hypergraph graph, List<Identifier> items) {
        Identifier context = requireSiblings(graph, items);
        List<Identifier> ordered = inStoredOrder(graph, items);
        Signature signature = Signature.of(graph, ordered);
        Optional<List<Identifier>> original = findCopy(graph, context, ordered, signature);
        if (original.isEmpty()) throw EGException.of(NO_MATCHING_GRAPH, context);
        LOG.trace("Deiterating {} against {}", ordered, original.get());

        Hypergraph result = graph.copy();
        result.removeItems(items);
        return publish(Rule.DEITERATE, result);
    }

    private Optional<List<Identifier>> findCopy(Hypergraph graph, Identifier context, List<Identifier> items,
                                                Signature signature) {
        Set<Identifier> selected = new HashSet<>(items);
        return graph.contextChain(context).map(ancestor -> {
            List<Identifier> siblings = graph.itemsIn(ancestor);
            for (int start = 0; start + items.size() <= siblings.size(); start++) {
                List<Identifier> window = siblings.subList(start, start + items.size());
                if (Iterators.iterate(window).anyMatch(w -> selected.contains(w) || graph.isAncestor(w, context))) continue;
                if (Signature.of(graph, window).equals(signature)) return Optional.of(window);
            }
            return Optional.<List<Identifier>>empty();
        }).filter(Optional::isPresent).map(Optional::get).first();
    }

    private static Identifier requireSiblings(Hypergraph graph, List<Identifier> items) {
        if (items.isEmpty()) throw EGException.of(INVALID_SUBGRAPH, "no items are selected");
        if (new HashSet<>(items).size() != items.size()) {
            throw EGException.of(INVALID_SUBGRAPH, "the selection repeats an item");
        }
        Identifier context = graph.containerOf(items.get(0));
        for (Identifier item : items) {
            if (!graph.containerOf(item).equals(context)) {
                throw EGException.of(INVALID_SUBGRAPH, "the items lie in different contexts");
            }
        }
        return context;
    }

    private static List<Identifier> inStoredOrder(Hypergraph graph, List<Identifier> items) {
        return items.stream().sorted(Comparator.comparingInt(graph::indexOf)).collect(Collectors.toList());
    }

    private static Set<Identifier> closure(Hypergraph graph, List<Identifier> items) {
        Set<Identifier> closure = new HashSet<>();
        for (Identifier item : items) closure.addAll(graph.subtree(item).toList());
        return closure;
    }

    private Hypergraph publish(Rule rule, Hypergraph result) {
        if (verifyIntegrity) result.verifyIntegrity();
        LOG.debug("Applied {}: {} nodes, {} hyperedges", rule, result.nodes().size(), result.edges().size());
        return result;
    }
}
