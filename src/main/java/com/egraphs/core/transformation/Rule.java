/*
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at https://mozilla.org/MPL/2.0/.
 */

package com.egraphs.core.transformation;

import com.egraphs.core.common.exception.EGException;
import com.egraphs.core.graph.Hypergraph;
import com.egraphs.core.graph.Identifier;
import com.google.common.collect.ImmutableList;

import javax.annotation.Nullable;
import java.util.Arrays;
import java.util.List;
import java.util.Optional;

import static com.egraphs.core.common.exception.ErrorMessage.Internal.UNRECOGNISED_VALUE;
import static com.egraphs.core.common.exception.ErrorMessage.Rule.MISSING_ARGUMENT;

/**
 * The Alpha and Beta rules of transformation.
 */
public enum Rule {
    ADD_DOUBLE_CUT("add_double_cut"),
    REMOVE_DOUBLE_CUT("remove_double_cut"),
    ERASE("erase"),
    INSERT("insert"),
    ITERATE("iterate"),
    DEITERATE("deiterate");

    private final String label;

    Rule(String label) {
        this.label = label;
    }

    public String label() {
        return label;
    }

    public static Rule of(String label) {
        for (Rule rule : values()) {
            if (rule.label.equals(label)) return rule;
        }
        throw EGException.of(UNRECOGNISED_VALUE, label);
    }

    @Override
    public String toString() {
        return label;
    }

    /**
     * The operands of a rule application. Each rule reads only the operands it needs:
     * {@code items} for every rule but {@code remove_double_cut} and {@code insert}, the outer
     * {@code cut} for {@code remove_double_cut}, the {@code target} context for {@code insert} and
     * {@code iterate}, the {@code subgraph} for {@code insert}, and an optional {@code container}
     * for {@code add_double_cut}.
     */
    public static class Arguments {

        private final ImmutableList<Identifier> items;
        private final Identifier container;
        private final Identifier target;
        private final Identifier cut;
        private final Hypergraph subgraph;

        private Arguments(List<Identifier> items, @Nullable Identifier container, @Nullable Identifier target,
                          @Nullable Identifier cut, @Nullable Hypergraph subgraph) {
            this.items = ImmutableList.copyOf(items);
            this.container = container;
            this.target = target;
            this.cut = cut;
            this.subgraph = subgraph;
        }

        public static Arguments none() {
            return new Arguments(ImmutableList.of(), null, null, null, null);
        }

        public static Arguments items(List<Identifier> items) {
            return new Arguments(items, null, null, null, null);
        }

        public static Arguments items(Identifier... items) {
            return items(Arrays.asList(items));
        }

        public Arguments container(Identifier container) {
            return new Arguments(items, container, target, cut, subgraph);
        }

        public Arguments target(Identifier target) {
            return new Arguments(items, container, target, cut, subgraph);
        }

        public Arguments cut(Identifier cut) {
            return new Arguments(items, container, target, cut, subgraph);
        }

        public Arguments subgraph(Hypergraph subgraph) {
            return new Arguments(items, container, target, cut, subgraph);
        }

        public ImmutableList<Identifier> items() {
            return items;
        }

        public Optional<Identifier> container() {
            return Optional.ofNullable(container);
        }

        Identifier requireTarget(Rule rule) {
            if (target == null) throw EGException.of(MISSING_ARGUMENT, rule, "target");
            return target;
        }

        Identifier requireCut(Rule rule) {
            if (cut == null) throw EGException.of(MISSING_ARGUMENT, rule, "cut");
            return cut;
        }

        Hypergraph requireSubgraph(Rule rule) {
            if (subgraph == null) throw EGException.of(MISSING_ARGUMENT, rule, "subgraph");
            return subgraph;
        }

        @Override
        public String toString() {
            return "Arguments{items=" + items + ", container=" + container + ", target=" + target + ", cut=" + cut + "}";
        }
    }
}
