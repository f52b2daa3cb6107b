/*
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at https://mozilla.org/MPL/2.0/.
 */

package com.egraphs.core.parser;

import com.egraphs.core.common.exception.EGException;
import com.google.common.collect.ImmutableList;

import java.util.Arrays;
import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

import static com.egraphs.core.common.exception.ErrorMessage.Internal.ILLEGAL_CAST;

/**
 * A parsed s-expression: either a single {@link Token} or a parenthesised {@link Compound} of
 * further trees. Trees compare structurally and print back as canonical text.
 */
public abstract class SyntaxTree {

    public boolean isToken() {
        return false;
    }

    public boolean isCompound() {
        return false;
    }

    public Token asToken() {
        throw EGException.of(ILLEGAL_CAST, getClass().getSimpleName(), Token.class.getSimpleName());
    }

    public Compound asCompound() {
        throw EGException.of(ILLEGAL_CAST, getClass().getSimpleName(), Compound.class.getSimpleName());
    }

    public static class Token extends SyntaxTree {

        public enum Kind {SYMBOL, NUMBER, STRING, EQUALS}

        private final Kind kind;
        private final String text;
        private final int hash;

        private Token(Kind kind, String text) {
            this.kind = kind;
            this.text = text;
            this.hash = Objects.hash(kind, text);
        }

        public static Token symbol(String text) {
            return new Token(Kind.SYMBOL, text);
        }

        public static Token number(String text) {
            return new Token(Kind.NUMBER, text);
        }

        /**
         * @param lexeme the string as written, quotes and escapes included
         */
        public static Token string(String lexeme) {
            return new Token(Kind.STRING, lexeme);
        }

        public static Token equalsSign() {
            return new Token(Kind.EQUALS, "=");
        }

        public Kind kind() {
            return kind;
        }

        public String text() {
            return text;
        }

        public boolean isSymbol() {
            return kind == Kind.SYMBOL;
        }

        @Override
        public boolean isToken() {
            return true;
        }

        @Override
        public Token asToken() {
            return this;
        }

        @Override
        public boolean equals(Object o) {
            if (this == o) return true;
            if (o == null || getClass() != o.getClass()) return false;
            Token that = (Token) o;
            return kind == that.kind && text.equals(that.text);
        }

        @Override
        public int hashCode() {
            return hash;
        }

        @Override
        public String toString() {
            return text;
        }
    }

    public static class Compound extends SyntaxTree {

        private final ImmutableList<SyntaxTree> children;

        private Compound(List<SyntaxTree> children) {
            this.children = ImmutableList.copyOf(children);
        }

        public static Compound of(List<SyntaxTree> children) {
            return new Compound(children);
        }

        public static Compound of(SyntaxTree... children) {
            return new Compound(Arrays.asList(children));
        }

        public ImmutableList<SyntaxTree> children() {
            return children;
        }

        public int size() {
            return children.size();
        }

        public boolean isEmpty() {
            return children.isEmpty();
        }

        public SyntaxTree get(int index) {
            return children.get(index);
        }

        /**
         * The leading symbol of this form, or null if it does not start with one.
         */
        public String head() {
            if (children.isEmpty() || !children.get(0).isToken()) return null;
            Token first = children.get(0).asToken();
            return first.kind() == Token.Kind.SYMBOL || first.kind() == Token.Kind.EQUALS ? first.text() : null;
        }

        public List<SyntaxTree> arguments() {
            return children.isEmpty() ? children : children.subList(1, children.size());
        }

        @Override
        public boolean isCompound() {
            return true;
        }

        @Override
        public Compound asCompound() {
            return this;
        }

        @Override
        public boolean equals(Object o) {
            if (this == o) return true;
            if (o == null || getClass() != o.getClass()) return false;
            Compound that = (Compound) o;
            return children.equals(that.children);
        }

        @Override
        public int hashCode() {
            return children.hashCode();
        }

        @Override
        public String toString() {
            return children.stream().map(SyntaxTree::toString).collect(Collectors.joining(" ", "(", ")"));
        }
    }
}
