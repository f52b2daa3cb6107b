/*
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at https://mozilla.org/MPL/2.0/.
 */

package com.egraphs.core.graph;

import java.util.Optional;

public class Encoding {

    public static final String EQUALS_RELATION = "equals";

    public enum NodeType {
        VARIABLE("variable"),
        CONSTANT("constant");

        private final String label;

        NodeType(String label) {
            this.label = label;
        }

        public String label() {
            return label;
        }

        @Override
        public String toString() {
            return label;
        }
    }

    public enum EdgeType {
        PREDICATE("predicate"),
        CUT("cut"),
        FUNCTION("function");

        private final String label;

        EdgeType(String label) {
            this.label = label;
        }

        public String label() {
            return label;
        }

        @Override
        public String toString() {
            return label;
        }
    }

    /**
     * The sugared sentence form a cut was produced from, kept so that the cut can be rendered back
     * into the same form rather than its primitive negation.
     */
    public enum Construct {
        FORALL("forall"),
        IF("if"),
        OR("or");

        private final String label;

        Construct(String label) {
            this.label = label;
        }

        public String label() {
            return label;
        }

        public static Optional<Construct> of(String label) {
            for (Construct construct : Construct.values()) {
                if (construct.label.equals(label)) return Optional.of(construct);
            }
            return Optional.empty();
        }

        @Override
        public String toString() {
            return label;
        }
    }

    public enum Property {
        NAME("name"),
        SOURCE_FUNCTION("source_function"),
        CONSTRUCT("construct"),
        IDENTITY("identity");

        private final String key;

        Property(String key) {
            this.key = key;
        }

        public String key() {
            return key;
        }

        @Override
        public String toString() {
            return key;
        }
    }
}
