/*
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at https://mozilla.org/MPL/2.0/.
 */

package com.egraphs.core.common.iterator;

import com.google.common.collect.AbstractIterator;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.function.Function;
import java.util.function.Predicate;
import java.util.stream.Stream;
import java.util.stream.StreamSupport;

import static java.util.Spliterator.IMMUTABLE;
import static java.util.Spliterator.ORDERED;
import static java.util.Spliterators.spliteratorUnknownSize;

/**
 * Implementations only compute the next element, or call {@code endOfData()} once exhausted.
 */
abstract class AbstractFunctionalIterator<T> extends AbstractIterator<T> implements FunctionalIterator<T> {

    @Override
    public <U> FunctionalIterator<U> map(Function<T, U> mappingFn) {
        FunctionalIterator<T> source = this;
        return new AbstractFunctionalIterator<U>() {
            @Override
            protected U computeNext() {
                return source.hasNext() ? mappingFn.apply(source.next()) : endOfData();
            }
        };
    }

    @Override
    public <U> FunctionalIterator<U> flatMap(Function<T, FunctionalIterator<U>> mappingFn) {
        FunctionalIterator<T> source = this;
        return new AbstractFunctionalIterator<U>() {
            private FunctionalIterator<U> current = Iterators.empty();

            @Override
            protected U computeNext() {
                while (!current.hasNext()) {
                    if (!source.hasNext()) return endOfData();
                    current = mappingFn.apply(source.next());
                }
                return current.next();
            }
        };
    }

    @Override
    public FunctionalIterator<T> filter(Predicate<T> predicate) {
        FunctionalIterator<T> source = this;
        return new AbstractFunctionalIterator<T>() {
            @Override
            protected T computeNext() {
                while (source.hasNext()) {
                    T candidate = source.next();
                    if (predicate.test(candidate)) return candidate;
                }
                return endOfData();
            }
        };
    }

    @Override
    public boolean allMatch(Predicate<T> predicate) {
        return !anyMatch(predicate.negate());
    }

    @Override
    public boolean anyMatch(Predicate<T> predicate) {
        return filter(predicate).hasNext();
    }

    @Override
    public Optional<T> first() {
        return hasNext() ? Optional.of(next()) : Optional.empty();
    }

    @Override
    public Stream<T> stream() {
        return StreamSupport.stream(spliteratorUnknownSize(this, ORDERED | IMMUTABLE), false);
    }

    @Override
    public List<T> toList() {
        List<T> list = new ArrayList<>();
        forEachRemaining(list::add);
        return list;
    }

    @Override
    public long count() {
        long count = 0;
        while (hasNext()) {
            next();
            count++;
        }
        return count;
    }
}
