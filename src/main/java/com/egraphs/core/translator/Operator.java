/*
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at https://mozilla.org/MPL/2.0/.
 */

package com.egraphs.core.translator;

import javax.annotation.Nullable;

/**
 * The reserved leading symbols of the sentence grammar. Any other leading symbol names a relation.
 */
public enum Operator {
    AND("and", -1),
    OR("or", -1),
    NOT("not", 1),
    IF("if", 2),
    EXISTS("exists", 2),
    FORALL("forall", 2),
    EQUALS("=", 2);

    private final String operator;
    private final int arity;

    Operator(String operator, int arity) {
        this.operator = operator;
        this.arity = arity;
    }

    public boolean isVariadic() {
        return arity < 0;
    }

    public int arity() {
        return arity;
    }

    @Override
    public String toString() {
        return this.operator;
    }

    @Nullable
    public static Operator of(String value) {
        for (Operator o : values()) {
            if (o.operator.equals(value)) {
                return o;
            }
        }
        return null;
    }
}
