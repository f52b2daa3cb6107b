/*
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at https://mozilla.org/MPL/2.0/.
 */

package com.egraphs.core.translator;

import com.egraphs.core.common.config.Config;
import com.egraphs.core.common.exception.EGException;
import com.egraphs.core.common.exception.ErrorMessage;
import com.egraphs.core.graph.Hyperedge;
import com.egraphs.core.graph.Hypergraph;
import com.egraphs.core.graph.Identifier;
import com.egraphs.core.graph.Node;
import org.junit.Test;

import java.util.List;

import static com.egraphs.core.common.config.ConfigKey.FRESH_NAME_PREFIX;
import static com.egraphs.core.common.config.ConfigKey.STRICT_CONSTRUCTS;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertThrows;

public class BackwardTranslatorTest {

    private final ForwardTranslator forward = new ForwardTranslator();
    private final BackwardTranslator backward = new BackwardTranslator();
    private final BackwardTranslator strict = new BackwardTranslator(Config.create().with(STRICT_CONSTRUCTS, true));

    private static Identifier onlyCut(Hypergraph graph, Identifier container) {
        return graph.itemsIn(container).stream()
                .filter(i -> graph.isEdge(i) && graph.edge(i).isCut())
                .findFirst().get();
    }

    @Test
    public void empty_graph_renders_as_empty_text() {
        assertEquals("", backward.translate(new Hypergraph()));
    }

    @Test
    public void empty_cut_renders_an_empty_conjunction() {
        Hypergraph graph = new Hypergraph();
        graph.addEdge(Hyperedge.cut());
        assertEquals("(not (and))", backward.translate(graph));
    }

    @Test
    public void equality_renders_with_the_equals_sign() {
        assertEquals("(= (FatherOf Cain) Adam)", backward.translate(forward.translate("(= (FatherOf Cain) Adam)")));
    }

    @Test
    public void unnamed_nodes_receive_fresh_names() {
        Hypergraph graph = new Hypergraph();
        Node v = graph.addNode(Node.variable(null));
        Node constant = graph.addNode(Node.constant("v1"));
        graph.addEdge(Hyperedge.predicate("P", List.of(v.id(), constant.id())));
        assertEquals("(exists (v2) (P v2 v1))", backward.translate(graph));

        BackwardTranslator prefixed = new BackwardTranslator(Config.create().with(FRESH_NAME_PREFIX, "w"));
        assertEquals("(exists (w1) (P w1 v1))", prefixed.translate(graph));
    }

    @Test
    public void inner_variable_is_renamed_when_it_would_capture_an_outer_one() {
        Hypergraph graph = new Hypergraph();
        Node outer = graph.addNode(Node.variable("x"));
        Hyperedge cut = graph.addEdge(Hyperedge.cut());
        Node inner = graph.addNode(Node.variable("x"), cut.id());
        graph.addEdge(Hyperedge.predicate("Q", List.of(outer.id(), inner.id())), cut.id());
        assertEquals("(exists (x) (not (exists (v1) (Q x v1))))", backward.translate(graph));
    }

    @Test
    public void variable_is_renamed_when_it_would_capture_a_constant() {
        Hypergraph graph = new Hypergraph();
        Node constant = graph.addNode(Node.constant("x"));
        Hyperedge cut = graph.addEdge(Hyperedge.cut());
        Node variable = graph.addNode(Node.variable("x"), cut.id());
        graph.addEdge(Hyperedge.predicate("R", List.of(constant.id(), variable.id())), cut.id());
        assertEquals("(not (exists (v1) (R x v1)))", backward.translate(graph));
    }

    @Test
    public void shadowing_without_capture_keeps_names() {
        String text = "(exists (x) (and (P x) (not (exists (x) (Q x)))))";
        assertEquals(text, backward.translate(forward.translate(text)));
    }

    @Test
    public void variables_sharing_a_context_and_a_name_are_told_apart() {
        Hypergraph graph = new Hypergraph();
        Node first = graph.addNode(Node.variable("x"));
        Node second = graph.addNode(Node.variable("x"));
        graph.addEdge(Hyperedge.predicate("R", List.of(first.id(), second.id())));
        assertEquals("(exists (x v1) (R x v1))", backward.translate(graph));
    }

    @Test
    public void reshaped_universal_renders_as_negation() {
        Hypergraph graph = forward.translate("(forall (x) (P x))");
        graph.addEdge(Hyperedge.predicate("Q", List.of()), onlyCut(graph, Identifier.SHEET));
        assertEquals("(not (exists (x) (and (not (P x)) (Q))))", backward.translate(graph));

        EGException e = assertThrows(EGException.class, () -> strict.translate(graph));
        assertEquals(ErrorMessage.Translation.MALFORMED_CONSTRUCT, e.errorMessage());
    }

    @Test
    public void conditional_whose_consequent_reaches_into_the_antecedent_renders_as_negation() {
        Hypergraph graph = forward.translate("(if (exists (y) (P y)) (Q))");
        Identifier conditional = onlyCut(graph, Identifier.SHEET);
        Identifier y = graph.itemsIn(conditional).get(0);
        graph.addEdge(Hyperedge.predicate("R", List.of(y)), onlyCut(graph, conditional));
        assertEquals("(not (exists (y) (and (P y) (not (and (Q) (R y))))))", backward.translate(graph));
    }

    @Test
    public void disjunction_with_a_stray_item_renders_as_negation() {
        Hypergraph graph = forward.translate("(or (P) (Q))");
        graph.addEdge(Hyperedge.predicate("S", List.of()), onlyCut(graph, Identifier.SHEET));
        assertEquals("(not (and (not (P)) (not (Q)) (S)))", backward.translate(graph));
        assertThrows(EGException.class, () -> strict.translate(graph));
    }

    @Test
    public void conditional_consequent_is_the_last_plain_cut() {
        String text = "(if (not (A)) (B))";
        assertEquals(text, backward.translate(forward.translate(text)));
    }

    @Test
    public void function_output_without_producer_is_a_variable_unless_strict() {
        Hypergraph graph = new Hypergraph();
        Node output = graph.addNode(Node.functionOutput("f"));
        graph.addEdge(Hyperedge.predicate("P", List.of(output.id())));
        assertEquals("(exists (v1) (P v1))", backward.translate(graph));

        EGException e = assertThrows(EGException.class, () -> strict.translate(graph));
        assertEquals(ErrorMessage.Translation.MISSING_FUNCTION_EDGE, e.errorMessage());
    }

    @Test
    public void unreferenced_quantifier_renders_an_empty_body() {
        Hypergraph graph = new Hypergraph();
        graph.addNode(Node.variable("x"));
        assertEquals("(exists (x) (and))", backward.translate(graph));
    }
}
