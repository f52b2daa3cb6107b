/*
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at https://mozilla.org/MPL/2.0/.
 */

package com.egraphs.core.common.exception;

import java.util.Objects;

/**
 * The single exception type of the library. Every caller-recoverable failure (malformed text,
 * unsupported sentence shapes, graph lookups and rule preconditions) is reported through it,
 * and {@link #errorMessage()} identifies which one occurred.
 */
public class EGException extends RuntimeException {

    private final ErrorMessage error;

    private EGException(ErrorMessage error, Throwable cause) {
        super(error.message(cause), cause);
        assert !getMessage().contains("%s");
        this.error = error;
    }

    private EGException(ErrorMessage error, Object... parameters) {
        super(error.message(parameters));
        assert !getMessage().contains("%s");
        this.error = error;
    }

    public static EGException of(ErrorMessage errorMessage, Throwable cause) {
        return new EGException(errorMessage, cause);
    }

    public static EGException of(ErrorMessage errorMessage, Object... parameters) {
        return new EGException(errorMessage, parameters);
    }

    public ErrorMessage errorMessage() {
        return error;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        EGException that = (EGException) o;
        return error.equals(that.error);
    }

    @Override
    public int hashCode() {
        return Objects.hash(error);
    }
}
