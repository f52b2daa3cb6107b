/*
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at https://mozilla.org/MPL/2.0/.
 */

package com.egraphs.core.common.exception;

import java.util.HashMap;
import java.util.Map;

public abstract class ErrorMessage {

    private static final Map<String, Map<Integer, ErrorMessage>> errors = new HashMap<>();
    private static int maxCodeNumber = 0;
    private static int maxCodeDigits = 0;

    // every group registers its numbers before any code is padded
    static {
        loadConstants();
    }

    private final String codePrefix;
    private final int codeNumber;
    private final String messagePrefix;
    private final String messageBody;
    private String code = null;

    private ErrorMessage(String codePrefix, int codeNumber, String messagePrefix, String messageBody) {
        this.codePrefix = codePrefix;
        this.codeNumber = codeNumber;
        this.messagePrefix = messagePrefix;
        this.messageBody = messageBody;

        assert errors.get(codePrefix) == null || errors.get(codePrefix).get(codeNumber) == null;
        errors.computeIfAbsent(codePrefix, p -> new HashMap<>()).put(codeNumber, this);
        maxCodeNumber = Math.max(codeNumber, maxCodeNumber);
        maxCodeDigits = String.valueOf(maxCodeNumber).length();
    }

    public static void loadConstants() {
        for (Class<?> group : ErrorMessage.class.getDeclaredClasses()) {
            try {
                Class.forName(group.getName(), true, group.getClassLoader());
            } catch (ClassNotFoundException e) {
                throw new IllegalStateException(e);
            }
        }
    }

    public String code() {
        if (code != null) return code;
        StringBuilder zeros = new StringBuilder();
        for (int digits = String.valueOf(codeNumber).length(); digits < maxCodeDigits; digits++) {
            zeros.append("0");
        }
        code = codePrefix + zeros + codeNumber;
        return code;
    }

    public String codePrefix() {
        return codePrefix;
    }

    public String message(Object... parameters) {
        return String.format(toString(), parameters);
    }

    @Override
    public String toString() {
        return String.format("[%s] %s: %s", code(), messagePrefix, messageBody);
    }

    public static class Internal extends ErrorMessage {
        public static final Internal ILLEGAL_STATE =
                new Internal(1, "Illegal internal state!");
        public static final Internal UNRECOGNISED_VALUE =
                new Internal(2, "Unrecognised encoding value '%s'.");
        public static final Internal ILLEGAL_CAST =
                new Internal(3, "Illegal cast from '%s' to '%s'.");

        private static final String codePrefix = "INT";
        private static final String messagePrefix = "Invalid Internal State";

        Internal(int number, String message) {
            super(codePrefix, number, messagePrefix, message);
        }
    }

    public static class Config extends ErrorMessage {
        public static final Config CONFIG_KEY_MISSING =
                new Config(1, "Required configuration '%s' is missing.");
        public static final Config CONFIG_FILE_NOT_READABLE =
                new Config(2, "Could not find/read the configuration file '%s'.");
        public static final Config CONFIG_VALUE_UNEXPECTED =
                new Config(3, "Configuration '%s' received an unexpected value '%s'.");

        private static final String codePrefix = "CFG";
        private static final String messagePrefix = "Invalid Configuration";

        Config(int number, String message) {
            super(codePrefix, number, messagePrefix, message);
        }
    }

    public static class Syntax extends ErrorMessage {
        public static final Syntax UNEXPECTED_CHARACTER =
                new Syntax(1, "Unexpected character '%s' at offset %s.");
        public static final Syntax UNEXPECTED_CLOSE =
                new Syntax(2, "Expected a form, but found ')' at offset %s.");
        public static final Syntax UNTERMINATED_LIST =
                new Syntax(3, "The list opened at offset %s is never closed.");
        public static final Syntax UNTERMINATED_STRING =
                new Syntax(4, "The string opened at offset %s is never closed.");
        public static final Syntax TRAILING_INPUT =
                new Syntax(5, "Expected a single sentence, but found more input at offset %s.");
        public static final Syntax MALFORMED_NUMBER =
                new Syntax(6, "The number '%s' at offset %s is malformed.");

        private static final String codePrefix = "SYN";
        private static final String messagePrefix = "Syntax Error";

        Syntax(int number, String message) {
            super(codePrefix, number, messagePrefix, message);
        }
    }

    public static class Translation extends ErrorMessage {
        public static final Translation INVALID_ARITY =
                new Translation(1, "The operator '%s' expects %s argument(s), but received %s.");
        public static final Translation MALFORMED_VARIABLE_LIST =
                new Translation(2, "The operator '%s' expects a list of variable symbols, but received '%s'.");
        public static final Translation INVALID_OPERATOR =
                new Translation(3, "The form '%s' does not start with a relation or operator symbol.");
        public static final Translation INVALID_TERM =
                new Translation(4, "The term '%s' is not a symbol, number, string or function application.");
        public static final Translation EMPTY_LIST =
                new Translation(5, "An empty list '()' is neither a sentence nor a term.");
        public static final Translation ATOM_SENTENCE =
                new Translation(6, "The atom '%s' cannot stand alone as a sentence; write '(%s)' for a proposition.");
        public static final Translation RESERVED_SYMBOL =
                new Translation(7, "The operator '%s' cannot be used as a term.");
        public static final Translation MALFORMED_CONSTRUCT =
                new Translation(8, "The cut '%s' is tagged '%s' but does not have the desugared shape of that construct.");
        public static final Translation MISSING_FUNCTION_EDGE =
                new Translation(9, "The node '%s' is the output of function '%s', but no function edge produces it.");

        private static final String codePrefix = "TRN";
        private static final String messagePrefix = "Invalid Translation";

        Translation(int number, String message) {
            super(codePrefix, number, messagePrefix, message);
        }
    }

    public static class GraphRead extends ErrorMessage {
        public static final GraphRead UNKNOWN_ITEM =
                new GraphRead(1, "The item '%s' does not exist in the graph.");
        public static final GraphRead UNKNOWN_CONTAINER =
                new GraphRead(2, "The container '%s' is neither the sheet of assertion nor a cut in the graph.");
        public static final GraphRead UNKNOWN_NODE =
                new GraphRead(3, "The item '%s' is not a node of the graph.");
        public static final GraphRead UNKNOWN_EDGE =
                new GraphRead(4, "The item '%s' is not a hyperedge of the graph.");

        private static final String codePrefix = "GRR";
        private static final String messagePrefix = "Invalid Graph Read";

        GraphRead(int number, String message) {
            super(codePrefix, number, messagePrefix, message);
        }
    }

    public static class GraphWrite extends ErrorMessage {
        public static final GraphWrite DUPLICATE_ID =
                new GraphWrite(1, "An item with the id '%s' already exists in the graph.");
        public static final GraphWrite DANGLING_REFERENCE =
                new GraphWrite(2, "The hyperedge '%s' refers to the node '%s', which is not in the graph.");
        public static final GraphWrite OUT_OF_SCOPE_REFERENCE =
                new GraphWrite(3, "The hyperedge '%s' refers to the node '%s', which lives outside the edge's context and its ancestors.");
        public static final GraphWrite STRANDED_REFERENCE =
                new GraphWrite(4, "The node '%s' cannot be removed while the hyperedge '%s' outside the removed items still refers to it.");
        public static final GraphWrite CYCLIC_CONTAINMENT =
                new GraphWrite(5, "The item '%s' cannot be moved into '%s', which is nested inside it.");

        private static final String codePrefix = "GRW";
        private static final String messagePrefix = "Invalid Graph Write";

        GraphWrite(int number, String message) {
            super(codePrefix, number, messagePrefix, message);
        }
    }

    public static class Rule extends ErrorMessage {
        public static final Rule INVALID_SUBGRAPH =
                new Rule(1, "The selected items do not form a subgraph of a single context: %s");
        public static final Rule INVALID_DOUBLE_CUT =
                new Rule(2, "The cut '%s' is not the outer cut of a double cut: %s");
        public static final Rule NEGATIVE_CONTEXT =
                new Rule(3, "Erasure is only valid in a positive context, but the context '%s' has depth %s.");
        public static final Rule POSITIVE_CONTEXT =
                new Rule(4, "Insertion is only valid in a negative context, but the context '%s' has depth %s.");
        public static final Rule ROOT_INSERTION =
                new Rule(5, "Insertion onto the sheet of assertion is never valid.");
        public static final Rule NON_NESTED_TARGET =
                new Rule(6, "The target context '%s' is not the context '%s' of the iterated items, nor nested within it.");
        public static final Rule ITERATION_INTO_SELF =
                new Rule(7, "The target context '%s' lies inside the iterated items.");
        public static final Rule NO_MATCHING_GRAPH =
                new Rule(8, "No context enclosing '%s' holds a copy of the selected items for deiteration.");
        public static final Rule ESCAPING_REFERENCE =
                new Rule(9, "The node '%s' cannot be enclosed while the hyperedge '%s' outside the selection still refers to it.");
        public static final Rule MISSING_ARGUMENT =
                new Rule(10, "The rule '%s' requires the argument '%s'.");

        private static final String codePrefix = "RUL";
        private static final String messagePrefix = "Invalid Rule Application";

        Rule(int number, String message) {
            super(codePrefix, number, messagePrefix, message);
        }
    }
}
