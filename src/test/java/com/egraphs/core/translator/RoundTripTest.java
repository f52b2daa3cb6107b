/*
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at https://mozilla.org/MPL/2.0/.
 */

package com.egraphs.core.translator;

import com.egraphs.core.parser.Parser;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.Parameterized;

import java.util.Arrays;
import java.util.Collection;

import static org.junit.Assert.assertEquals;

@RunWith(Parameterized.class)
public class RoundTripTest {

    private static final ForwardTranslator FORWARD = new ForwardTranslator();
    private static final BackwardTranslator BACKWARD = new BackwardTranslator();

    @Parameterized.Parameters(name = "{0}")
    public static Collection<String> sentences() {
        return Arrays.asList(
                "(exists (x) (and (Cat x) (Black x)))",
                "(exists (x y) (and (Farmer x) (Donkey y) (Owns x y) (Beats x y)))",
                "(exists (x y z) (and (R x y) (S y z) (T z x)))",
                "(not (exists (x) (Unicorn x)))",
                "(not (and (P) (Q)))",
                "(not (exists (x) (not (Person x))))",
                "(forall (x) (if (Man x) (Mortal x)))",
                "(forall (x) (if (Person x) (exists (y) (and (Woman y) (IsMotherOf y x)))))",
                "(forall (x y) (if (and (Person x) (Loves x y)) (Person y)))",
                "(= (FatherOf Cain) Adam)",
                "(exists (x) (and (Person x) (= (FatherOf x) Zeus)))",
                "(forall (x) (if (Person x) (= (MotherOf (FatherOf x)) (PaternalGrandmotherOf x))))",
                "(TuringWasAComputerScientist)",
                "(or (exists (x) (Cat x)) (exists (y) (Dog y)))",
                "(exists (x) (or (Cat x) (Dog x)))",
                "(forall (x) (if (and (Man x) (Rich x)) (Happy x)))",
                "(not (exists (x) (and (Cat x) (not (Black x)))))",
                "(not (exists (d) (and (Dog d) (not (exists (m) (and (Master m d) (Loves d m)))))))",
                "(if (P) (not (Q)))",
                "(if (not (A)) (B))",
                "(or (P) (and (Q) (R)) (not (S)))",
                "(forall () (P))",
                "(or)",
                "(not (and))",
                "(Age \"Tom\" 42 3.5)",
                "(Ratio 1. .5 .5e3)",
                "(equals a b)",
                "(and (equals a b) (= a b))",
                "(exists (x) (and (equals x x) (not (= x Zeus))))",
                "(exists (x) (and (P x) (not (exists (x) (Q x)))))"
        );
    }

    private final String sentence;

    public RoundTripTest(String sentence) {
        this.sentence = sentence;
    }

    @Test
    public void rendering_a_translation_reproduces_the_sentence() {
        String rendered = BACKWARD.translate(FORWARD.translate(sentence));
        assertEquals(Parser.parse(sentence), Parser.parse(rendered));
    }
}
