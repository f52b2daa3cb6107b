/*
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at https://mozilla.org/MPL/2.0/.
 */

package com.egraphs.core.translator;

import com.egraphs.core.common.config.Config;
import com.egraphs.core.common.exception.EGException;
import com.egraphs.core.graph.Encoding;
import com.egraphs.core.graph.Hyperedge;
import com.egraphs.core.graph.Hypergraph;
import com.egraphs.core.graph.Identifier;
import com.egraphs.core.graph.Node;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

import static com.egraphs.core.common.config.ConfigKey.FRESH_NAME_PREFIX;
import static com.egraphs.core.common.config.ConfigKey.STRICT_CONSTRUCTS;
import static com.egraphs.core.common.exception.ErrorMessage.Internal.ILLEGAL_STATE;
import static com.egraphs.core.common.exception.ErrorMessage.Translation.MALFORMED_CONSTRUCT;
import static com.egraphs.core.common.exception.ErrorMessage.Translation.MISSING_FUNCTION_EDGE;
import static com.egraphs.core.common.iterator.Iterators.iterate;

/**
 * Renders an Existential Graph back into an s-expression sentence.
 *
 * Each context renders as the conjunction of its hyperedges, wrapped in {@code exists} when it
 * owns variables. Cuts tagged with a construct render as that construct when their children
 * still have its desugared shape. Otherwise they render as a plain {@code not}, or fail when
 * strict construct checking is configured.
 */
public class BackwardTranslator {

    private static final Logger LOG = LoggerFactory.getLogger(BackwardTranslator.class);

    private static final String EMPTY_CONJUNCTION = "(" + Operator.AND + ")";

    private final String freshNamePrefix;
    private final boolean strictConstructs;

    public BackwardTranslator() {
        this(Config.create());
    }

    public BackwardTranslator(Config config) {
        this.freshNamePrefix = config.getProperty(FRESH_NAME_PREFIX);
        this.strictConstructs = config.getProperty(STRICT_CONSTRUCTS);
    }

    public String translate(Hypergraph graph) {
        String text = new Renderer(graph).renderContext(graph.itemsIn(Identifier.SHEET), "");
        LOG.debug("Rendered {} nodes and {} hyperedges as '{}'", graph.nodes().size(), graph.edges().size(), text);
        return text;
    }

    private class Renderer {

        private final Hypergraph graph;
        private final Map<Identifier, String> names;
        private final Set<String> usedNames;
        private int freshCounter;

        private Renderer(Hypergraph graph) {
            this.graph = graph;
            this.names = new HashMap<>();
            this.usedNames = new HashSet<>();
            for (Node node : graph.nodes()) node.name().ifPresent(usedNames::add);
            this.freshCounter = 0;
        }

        private String renderContext(List<Identifier> items, String emptyText) {
            List<Identifier> variables = new ArrayList<>();
            List<String> parts = new ArrayList<>();
            for (Identifier item : items) {
                if (graph.isNode(item) && isBound(graph.node(item))) variables.add(item);
            }
            List<String> variableNames = bind(variables, items);
            for (Identifier item : items) {
                if (!graph.isEdge(item)) continue;
                Hyperedge edge = graph.edge(item);
                if (edge.isPredicate()) parts.add(renderPredicate(edge));
                else if (edge.isCut()) parts.add(renderCut(edge));
            }

            String body;
            if (parts.isEmpty()) body = variables.isEmpty() ? emptyText : EMPTY_CONJUNCTION;
            else if (parts.size() == 1) body = parts.get(0);
            else body = "(" + Operator.AND + " " + String.join(" ", parts) + ")";
            if (variables.isEmpty()) return body;
            return "(" + Operator.EXISTS + " (" + String.join(" ", variableNames) + ") " + body + ")";
        }

        /**
         * Whether a node is introduced by a quantifier, rather than written out where it is used.
         */
        private boolean isBound(Node node) {
            if (!node.isVariable()) return false;
            if (!node.isFunctionOutput()) return true;
            if (graph.producer(node.id()).isPresent()) return false;
            if (strictConstructs) {
                throw EGException.of(MISSING_FUNCTION_EDGE, node.id(), node.sourceFunction().orElse(""));
            }
            return true;
        }

        private String renderPredicate(Hyperedge edge) {
            String relation = edge.isIdentity()
                    ? Operator.EQUALS.toString()
                    : edge.name().orElseThrow(() -> EGException.of(ILLEGAL_STATE));
            StringBuilder builder = new StringBuilder("(").append(relation);
            for (Identifier node : edge.nodes()) builder.append(" ").append(renderTerm(node));
            return builder.append(")").toString();
        }

        private String renderTerm(Identifier id) {
            Node node = graph.node(id);
            if (node.isConstant()) return node.name().orElseGet(() -> nameOf(id));
            if (node.isFunctionOutput()) {
                Optional<Hyperedge> producer = graph.producer(id);
                if (producer.isPresent()) {
                    Hyperedge function = producer.get();
                    StringBuilder builder = new StringBuilder("(").append(function.name().orElse(node.sourceFunction().get()));
                    for (Identifier argument : function.arguments()) builder.append(" ").append(renderTerm(argument));
                    return builder.append(")").toString();
                }
            }
            return nameOf(id);
        }

        private String nameOf(Identifier id) {
            return names.computeIfAbsent(id, n -> freshName());
        }

        private String renderCut(Hyperedge cut) {
            Optional<Encoding.Construct> construct = cut.construct();
            if (construct.isPresent()) {
                String rendered;
                switch (construct.get()) {
                    case FORALL:
                        rendered = renderUniversal(cut);
                        break;
                    case IF:
                        rendered = renderConditional(cut);
                        break;
                    case OR:
                        rendered = renderDisjunction(cut);
                        break;
                    default:
                        throw EGException.of(ILLEGAL_STATE);
                }
                if (rendered != null) return rendered;
                if (strictConstructs) throw EGException.of(MALFORMED_CONSTRUCT, cut.id(), construct.get());
                LOG.debug("Cut {} no longer has the shape of '{}', rendering it as a negation", cut.id(), construct.get());
            }
            return "(" + Operator.NOT + " " + renderContext(graph.itemsIn(cut.id()), EMPTY_CONJUNCTION) + ")";
        }

        private String renderUniversal(Hyperedge cut) {
            List<Identifier> items = graph.itemsIn(cut.id());
            List<Identifier> variables = new ArrayList<>();
            Identifier body = null;
            for (Identifier item : items) {
                if (graph.isNode(item) && isBound(graph.node(item))) variables.add(item);
                else if (body == null && isPlainCut(item)) body = item;
                else return null;
            }
            if (body == null) return null;
            List<String> variableNames = bind(variables, items);
            return "(" + Operator.FORALL + " (" + String.join(" ", variableNames) + ") "
                    + renderContext(graph.itemsIn(body), EMPTY_CONJUNCTION) + ")";
        }

        private String renderConditional(Hyperedge cut) {
            List<Identifier> items = graph.itemsIn(cut.id());
            Identifier consequent = null;
            for (Identifier item : items) {
                if (isPlainCut(item)) consequent = item;
            }
            if (consequent == null) return null;
            boolean reachesAntecedent = iterate(graph.subtree(consequent).toList())
                    .filter(graph::isEdge)
                    .flatMap(e -> iterate(graph.edge(e).nodes()))
                    .anyMatch(n -> graph.containerOf(n).equals(cut.id()));
            if (reachesAntecedent) return null;

            List<Identifier> antecedent = new ArrayList<>(items);
            antecedent.remove(consequent);
            return "(" + Operator.IF + " " + renderContext(antecedent, EMPTY_CONJUNCTION) + " "
                    + renderContext(graph.itemsIn(consequent), EMPTY_CONJUNCTION) + ")";
        }

        private String renderDisjunction(Hyperedge cut) {
            List<Identifier> items = graph.itemsIn(cut.id());
            if (!iterate(items).allMatch(this::isPlainCut)) return null;
            StringBuilder builder = new StringBuilder("(").append(Operator.OR);
            for (Identifier disjunct : items) {
                builder.append(" ").append(renderContext(graph.itemsIn(disjunct), EMPTY_CONJUNCTION));
            }
            return builder.append(")").toString();
        }

        private boolean isPlainCut(Identifier item) {
            return graph.isEdge(item) && graph.edge(item).isCut() && graph.edge(item).construct().isEmpty();
        }

        /**
         * Chooses display names for variables introduced over the given scope. A variable keeps its
         * own name unless another node referenced within the scope would be shadowed by it.
         */
        private List<String> bind(List<Identifier> variables, List<Identifier> scope) {
            if (variables.isEmpty()) return List.of();
            Map<String, Identifier> visible = visibleNames(scope);
            Map<Identifier, String> chosen = new LinkedHashMap<>();
            Set<String> taken = new HashSet<>();
            for (Identifier variable : variables) {
                String name = graph.node(variable).name().orElse(null);
                if (name == null || taken.contains(name)
                        || (visible.containsKey(name) && !variables.contains(visible.get(name)))) {
                    name = freshName();
                }
                taken.add(name);
                chosen.put(variable, name);
            }
            names.putAll(chosen);
            return new ArrayList<>(chosen.values());
        }

        /**
         * The names already fixed for nodes referenced inside the scope: constants, and variables
         * bound by an enclosing context.
         */
        private Map<String, Identifier> visibleNames(List<Identifier> scope) {
            Map<String, Identifier> visible = new HashMap<>();
            iterate(scope).flatMap(graph::subtree).filter(graph::isEdge)
                    .flatMap(e -> iterate(graph.edge(e).nodes()))
                    .forEachRemaining(id -> collectVisible(id, visible));
            return visible;
        }

        private void collectVisible(Identifier id, Map<String, Identifier> visible) {
            Node node = graph.node(id);
            if (node.isConstant() && node.name().isPresent()) {
                visible.put(node.name().get(), id);
            } else if (names.containsKey(id)) {
                visible.put(names.get(id), id);
            } else if (node.isFunctionOutput()) {
                graph.producer(id).ifPresent(f -> f.arguments().forEach(arg -> collectVisible(arg, visible)));
            }
        }

        private String freshName() {
            String name;
            do {
                name = freshNamePrefix + (++freshCounter);
            } while (usedNames.contains(name));
            usedNames.add(name);
            return name;
        }
    }
}
