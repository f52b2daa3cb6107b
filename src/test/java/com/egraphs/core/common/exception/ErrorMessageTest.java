/*
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at https://mozilla.org/MPL/2.0/.
 */

package com.egraphs.core.common.exception;

import com.egraphs.core.parser.Parser;
import org.junit.Test;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.containsString;
import static org.hamcrest.Matchers.startsWith;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertNotEquals;
import static org.junit.Assert.assertSame;
import static org.junit.Assert.fail;

public class ErrorMessageTest {

    @Test
    public void message_carries_code_prefix_and_parameters() {
        String message = ErrorMessage.GraphRead.UNKNOWN_ITEM.message("abc");
        assertThat(message, startsWith("[" + ErrorMessage.GraphRead.UNKNOWN_ITEM.code() + "] Invalid Graph Read: "));
        assertThat(message, containsString("'abc'"));
    }

    @Test
    public void codes_start_with_their_group_prefix() {
        assertThat(ErrorMessage.Syntax.TRAILING_INPUT.code(), startsWith("SYN"));
        assertThat(ErrorMessage.Rule.ROOT_INSERTION.code(), startsWith("RUL"));
        assertEquals("RUL", ErrorMessage.Rule.ROOT_INSERTION.codePrefix());
        assertNotEquals(ErrorMessage.Rule.ROOT_INSERTION.code(), ErrorMessage.Rule.NEGATIVE_CONTEXT.code());
    }

    @Test
    public void exception_exposes_its_error_message() {
        EGException exception = EGException.of(ErrorMessage.Rule.NEGATIVE_CONTEXT, "cut", 1);
        assertSame(ErrorMessage.Rule.NEGATIVE_CONTEXT, exception.errorMessage());
        assertEquals(ErrorMessage.Rule.NEGATIVE_CONTEXT.message("cut", 1), exception.getMessage());
    }

    @Test
    public void exceptions_with_the_same_error_are_equal() {
        assertEquals(EGException.of(ErrorMessage.GraphRead.UNKNOWN_ITEM, "a"),
                     EGException.of(ErrorMessage.GraphRead.UNKNOWN_ITEM, "b"));
        assertNotEquals(EGException.of(ErrorMessage.GraphRead.UNKNOWN_ITEM, "a"),
                        EGException.of(ErrorMessage.GraphRead.UNKNOWN_NODE, "a"));
    }

    @Test
    public void codes_keep_one_width_whichever_group_is_used_first() {
        String first = null;
        try {
            Parser.parse(")");
            fail();
        } catch (EGException e) {
            first = e.errorMessage().code();
        }
        String rule = ErrorMessage.Rule.MISSING_ARGUMENT.code();
        String second = ErrorMessage.Syntax.TRAILING_INPUT.code();
        assertEquals(first.length(), second.length());
        assertEquals("RUL10", rule);
        assertEquals("SYN05", second);
        assertEquals("INT01", ErrorMessage.Internal.ILLEGAL_STATE.code());
    }
}
