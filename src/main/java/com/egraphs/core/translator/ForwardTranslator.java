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
import com.egraphs.core.parser.Parser;
import com.egraphs.core.parser.SyntaxTree;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.annotation.Nullable;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static com.egraphs.core.common.config.ConfigKey.SHARE_CONSTANTS;
import static com.egraphs.core.common.exception.ErrorMessage.Translation.ATOM_SENTENCE;
import static com.egraphs.core.common.exception.ErrorMessage.Translation.EMPTY_LIST;
import static com.egraphs.core.common.exception.ErrorMessage.Translation.INVALID_ARITY;
import static com.egraphs.core.common.exception.ErrorMessage.Translation.INVALID_OPERATOR;
import static com.egraphs.core.common.exception.ErrorMessage.Translation.INVALID_TERM;
import static com.egraphs.core.common.exception.ErrorMessage.Translation.MALFORMED_VARIABLE_LIST;
import static com.egraphs.core.common.exception.ErrorMessage.Translation.RESERVED_SYMBOL;
import static com.egraphs.core.common.iterator.Iterators.iterate;

/**
 * Translates a first-order sentence in s-expression form into an Existential Graph.
 *
 * {@code not} draws a cut; {@code exists} places its variables as nodes in the current context;
 * {@code forall}, {@code if} and {@code or} are desugared into nested cuts, with the outer cut
 * tagged by the construct so that it can be rendered back. Functional terms become an output
 * node plus a {@code function} hyperedge listing the output first.
 */
public class ForwardTranslator {

    private static final Logger LOG = LoggerFactory.getLogger(ForwardTranslator.class);

    private final boolean shareConstants;

    public ForwardTranslator() {
        this(Config.create());
    }

    public ForwardTranslator(Config config) {
        this.shareConstants = config.getProperty(SHARE_CONSTANTS);
    }

    public Hypergraph translate(String text) {
        return translate(Parser.parse(text));
    }

    public Hypergraph translate(@Nullable SyntaxTree sentence) {
        Hypergraph graph = new Hypergraph();
        if (sentence == null) return graph;
        new Builder(graph).visitSentence(sentence, Identifier.SHEET);
        if (LOG.isDebugEnabled()) {
            LOG.debug("Translated '{}' into {} nodes and {} hyperedges",
                      sentence, graph.nodes().size(), graph.edges().size());
        }
        return graph;
    }

    private class Builder {

        private final Hypergraph graph;
        private final Deque<Map<String, Identifier>> scopes;

        private Builder(Hypergraph graph) {
            this.graph = graph;
            this.scopes = new ArrayDeque<>();
        }

        private void visitSentence(SyntaxTree sentence, Identifier container) {
            if (sentence.isToken()) {
                String atom = sentence.asToken().text();
                throw EGException.of(ATOM_SENTENCE, atom, atom);
            }
            SyntaxTree.Compound form = sentence.asCompound();
            if (form.isEmpty()) throw EGException.of(EMPTY_LIST);
            String head = form.head();
            if (head == null) throw EGException.of(INVALID_OPERATOR, form);
            Operator operator = Operator.of(head);
            if (operator == null) {
                visitAtomic(head, form.arguments(), container);
                return;
            }

            List<SyntaxTree> args = form.arguments();
            if (!operator.isVariadic() && args.size() != operator.arity()) {
                throw EGException.of(INVALID_ARITY, operator, operator.arity(), args.size());
            }
            switch (operator) {
                case AND:
                    for (SyntaxTree conjunct : args) visitSentence(conjunct, container);
                    break;
                case NOT:
                    visitSentence(args.get(0), addCut(null, container));
                    break;
                case OR:
                    Identifier disjunction = addCut(Encoding.Construct.OR, container);
                    for (SyntaxTree disjunct : args) visitSentence(disjunct, addCut(null, disjunction));
                    break;
                case IF:
                    Identifier conditional = addCut(Encoding.Construct.IF, container);
                    visitSentence(args.get(0), conditional);
                    visitSentence(args.get(1), addCut(null, conditional));
                    break;
                case EXISTS:
                    scopes.push(bindVariables(operator, args.get(0), container));
                    visitSentence(args.get(1), container);
                    scopes.pop();
                    break;
                case FORALL:
                    Identifier universal = addCut(Encoding.Construct.FORALL, container);
                    scopes.push(bindVariables(operator, args.get(0), universal));
                    visitSentence(args.get(1), addCut(null, universal));
                    scopes.pop();
                    break;
                case EQUALS:
                    Identifier left = visitTerm(args.get(0), container);
                    Identifier right = visitTerm(args.get(1), container);
                    graph.addEdge(Hyperedge.identity(left, right), container);
                    break;
                default:
                    throw EGException.of(INVALID_OPERATOR, form);
            }
        }

        private void visitAtomic(String relation, List<SyntaxTree> terms, Identifier container) {
            List<Identifier> nodes = new ArrayList<>();
            for (SyntaxTree term : terms) nodes.add(visitTerm(term, container));
            graph.addEdge(Hyperedge.predicate(relation, nodes), container);
        }

        private Identifier addCut(@Nullable Encoding.Construct construct, Identifier container) {
            return graph.addEdge(Hyperedge.cut(construct), container).id();
        }

        private Map<String, Identifier> bindVariables(Operator operator, SyntaxTree variables, Identifier container) {
            if (!variables.isCompound()) throw EGException.of(MALFORMED_VARIABLE_LIST, operator, variables);
            Map<String, Identifier> scope = new HashMap<>();
            for (SyntaxTree variable : variables.asCompound().children()) {
                if (!variable.isToken() || !variable.asToken().isSymbol() || Operator.of(variable.asToken().text()) != null) {
                    throw EGException.of(MALFORMED_VARIABLE_LIST, operator, variables);
                }
                String name = variable.asToken().text();
                scope.put(name, graph.addNode(Node.variable(name), container).id());
            }
            return scope;
        }

        private Identifier visitTerm(SyntaxTree term, Identifier container) {
            if (term.isToken()) {
                SyntaxTree.Token token = term.asToken();
                switch (token.kind()) {
                    case SYMBOL:
                        if (Operator.of(token.text()) != null) throw EGException.of(RESERVED_SYMBOL, token);
                        Identifier bound = lookup(token.text());
                        return bound != null ? bound : constant(token.text(), container);
                    case NUMBER:
                    case STRING:
                        return constant(token.text(), container);
                    default:
                        throw EGException.of(RESERVED_SYMBOL, token);
                }
            }

            SyntaxTree.Compound application = term.asCompound();
            if (application.isEmpty()) throw EGException.of(EMPTY_LIST);
            String function = application.head();
            if (function == null) throw EGException.of(INVALID_TERM, application);
            if (Operator.of(function) != null) throw EGException.of(RESERVED_SYMBOL, function);

            Identifier output = graph.addNode(Node.functionOutput(function), container).id();
            List<Identifier> arguments = new ArrayList<>();
            for (SyntaxTree argument : application.arguments()) arguments.add(visitTerm(argument, container));
            graph.addEdge(Hyperedge.function(function, output, arguments), container);
            return output;
        }

        @Nullable
        private Identifier lookup(String name) {
            for (Map<String, Identifier> scope : scopes) {
                Identifier id = scope.get(name);
                if (id != null) return id;
            }
            return null;
        }

        private Identifier constant(String name, Identifier container) {
            if (shareConstants) {
                Identifier shared = iterate(graph.itemsIn(container))
                        .filter(graph::isNode).map(graph::node)
                        .filter(n -> n.isConstant() && n.name().filter(name::equals).isPresent())
                        .map(Node::id).first().orElse(null);
                if (shared != null) return shared;
            }
            LOG.trace("Adding constant '{}' to context {}", name, container);
            return graph.addNode(Node.constant(name), container).id();
        }
    }
}
