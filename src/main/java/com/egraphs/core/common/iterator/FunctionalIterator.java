/*
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at https://mozilla.org/MPL/2.0/.
 */

package com.egraphs.core.common.iterator;

import java.util.Iterator;
import java.util.List;
import java.util.Optional;
import java.util.function.Function;
import java.util.function.Predicate;
import java.util.stream.Stream;

/**
 * A lazy, single-use iterator with chainable operations. Each terminal operation consumes it.
 */
public interface FunctionalIterator<T> extends Iterator<T> {

    <U> FunctionalIterator<U> map(Function<T, U> mappingFn);

    <U> FunctionalIterator<U> flatMap(Function<T, FunctionalIterator<U>> mappingFn);

    FunctionalIterator<T> filter(Predicate<T> predicate);

    boolean allMatch(Predicate<T> predicate);

    boolean anyMatch(Predicate<T> predicate);

    Optional<T> first();

    Stream<T> stream();

    List<T> toList();

    long count();
}
