/*
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at https://mozilla.org/MPL/2.0/.
 */

package com.egraphs.core.transformation;

import com.egraphs.core.common.exception.EGException;
import com.egraphs.core.common.exception.ErrorMessage;
import com.egraphs.core.graph.Hyperedge;
import com.egraphs.core.graph.Hypergraph;
import com.egraphs.core.graph.Identifier;
import com.egraphs.core.translator.BackwardTranslator;
import com.egraphs.core.translator.ForwardTranslator;
import org.junit.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertThrows;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

public class RulePropertiesTest {

    private static final List<String> SENTENCES = List.of(
            "(exists (x) (and (Cat x) (Black x)))",
            "(exists (x y) (and (Farmer x) (Donkey y) (Owns x y) (Beats x y)))",
            "(not (and (P) (Q)))",
            "(forall (x) (if (Man x) (Mortal x)))",
            "(forall (x) (if (Person x) (exists (y) (and (Woman y) (IsMotherOf y x)))))",
            "(exists (x) (and (Person x) (= (FatherOf x) Zeus)))",
            "(or (exists (x) (Cat x)) (exists (y) (Dog y)))",
            "(not (exists (d) (and (Dog d) (not (exists (m) (and (Master m d) (Loves d m)))))))",
            "(and (A) (not (and (B) (not (C)))) (D))"
    );

    private final ForwardTranslator forward = new ForwardTranslator();
    private final BackwardTranslator backward = new BackwardTranslator();
    private final Transformations transformations = new Transformations();

    private static List<Identifier> contexts(Hypergraph graph) {
        List<Identifier> contexts = new ArrayList<>();
        contexts.add(Identifier.SHEET);
        for (Hyperedge edge : graph.edges()) {
            if (edge.isCut()) contexts.add(edge.id());
        }
        return contexts;
    }

    private static List<Identifier> added(Hypergraph before, Hypergraph after, Identifier container) {
        List<Identifier> items = new ArrayList<>(after.itemsIn(container));
        items.removeIf(before::contains);
        return items;
    }

    @Test
    public void removing_a_double_cut_just_drawn_restores_the_graph() {
        int applications = 0;
        for (String sentence : SENTENCES) {
            Hypergraph graph = forward.translate(sentence);
            String text = backward.translate(graph);
            for (Identifier context : contexts(graph)) {
                List<Identifier> items = graph.itemsIn(context);
                for (int from = 0; from <= items.size(); from++) {
                    for (int to = from; to <= items.size(); to++) {
                        Hypergraph doubled;
                        try {
                            doubled = transformations.addDoubleCut(graph, items.subList(from, to), context);
                        } catch (EGException e) {
                            assertEquals(ErrorMessage.Rule.ESCAPING_REFERENCE, e.errorMessage());
                            continue;
                        }
                        List<Identifier> outer = added(graph, doubled, context);
                        assertEquals(1, outer.size());
                        Hypergraph restored = transformations.removeDoubleCut(doubled, outer.get(0));
                        assertEquals(sentence, text, backward.translate(restored));
                        applications++;
                    }
                }
            }
        }
        assertTrue(applications > SENTENCES.size());
    }

    @Test
    public void deiterating_a_copy_just_made_restores_the_graph() {
        int applications = 0;
        for (String sentence : SENTENCES) {
            Hypergraph graph = forward.translate(sentence);
            String text = backward.translate(graph);
            for (Identifier context : contexts(graph)) {
                for (Identifier item : graph.itemsIn(context)) {
                    for (Identifier target : contexts(graph)) {
                        if (!graph.isAncestor(context, target) || graph.isAncestor(item, target)) continue;
                        Hypergraph iterated = transformations.iterate(graph, List.of(item), target);
                        List<Identifier> copy = added(graph, iterated, target);
                        assertEquals(1, copy.size());
                        Hypergraph restored = transformations.deiterate(iterated, copy);
                        assertEquals(sentence, text, backward.translate(restored));
                        applications++;
                    }
                }
            }
        }
        assertTrue(applications > SENTENCES.size());
    }

    @Test
    public void erasure_is_allowed_exactly_at_even_depth() {
        for (int depth = 0; depth <= 6; depth++) {
            Hypergraph graph = forward.translate("(not ".repeat(depth) + "(and (P) (Q))" + ")".repeat(depth));
            Identifier p = graph.edges().stream().filter(e -> e.name().filter("P"::equals).isPresent()).findFirst().get().id();
            try {
                Hypergraph result = transformations.erase(graph, List.of(p));
                assertTrue("depth " + depth, depth % 2 == 0);
                assertFalse(result.contains(p));
            } catch (EGException e) {
                assertEquals(ErrorMessage.Rule.NEGATIVE_CONTEXT, e.errorMessage());
                assertTrue("depth " + depth, depth % 2 == 1);
            }
        }
    }

    @Test
    public void insertion_is_allowed_exactly_at_odd_depth() {
        Hypergraph subgraph = forward.translate("(exists (z) (R z))");
        for (int depth = 0; depth <= 6; depth++) {
            Hypergraph graph = forward.translate("(not ".repeat(depth) + "(P)" + ")".repeat(depth));
            Identifier innermost = Identifier.SHEET;
            for (Identifier context : contexts(graph)) {
                if (context.isSheet() || graph.contextDepth(context) == depth) innermost = context;
            }
            assertEquals(depth, graph.contextDepth(innermost));
            final Identifier target = innermost;
            if (depth == 0) {
                EGException e = assertThrows(EGException.class, () -> transformations.insert(graph, subgraph, target));
                assertEquals(ErrorMessage.Rule.ROOT_INSERTION, e.errorMessage());
            } else if (depth % 2 == 0) {
                EGException e = assertThrows(EGException.class, () -> transformations.insert(graph, subgraph, target));
                assertEquals(ErrorMessage.Rule.POSITIVE_CONTEXT, e.errorMessage());
            } else {
                Hypergraph result = transformations.insert(graph, subgraph, target);
                assertEquals(graph.nodes().size() + 1, result.nodes().size());
            }
        }
    }

    @Test
    public void deiteration_without_an_enclosing_copy_is_rejected() {
        for (String sentence : SENTENCES) {
            Hypergraph graph = forward.translate(sentence);
            for (Identifier context : contexts(graph)) {
                Hypergraph extended = graph.copy();
                Hyperedge unmatched = extended.addEdge(Hyperedge.predicate("Unmatched", List.of()), context);
                try {
                    transformations.deiterate(extended, List.of(unmatched.id()));
                    fail("deiterated an item with no copy in " + sentence);
                } catch (EGException e) {
                    assertEquals(ErrorMessage.Rule.NO_MATCHING_GRAPH, e.errorMessage());
                }
            }
        }
    }
}
