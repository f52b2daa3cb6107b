/*
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at https://mozilla.org/MPL/2.0/.
 */

package com.egraphs.core.common.iterator;

import java.util.ArrayDeque;
import java.util.Arrays;
import java.util.Collection;
import java.util.Collections;
import java.util.Deque;
import java.util.Iterator;
import java.util.function.Function;
import java.util.function.Predicate;
import java.util.function.UnaryOperator;

public class Iterators {

    public static <T> FunctionalIterator<T> empty() {
        return iterate(Collections.emptyList());
    }

    @SafeVarargs
    public static <T> FunctionalIterator<T> iterate(T... elements) {
        return iterate(Arrays.asList(elements));
    }

    public static <T> FunctionalIterator<T> iterate(Collection<T> collection) {
        Iterator<T> iterator = collection.iterator();
        return new AbstractFunctionalIterator<T>() {
            @Override
            protected T computeNext() {
                return iterator.hasNext() ? iterator.next() : endOfData();
            }
        };
    }

    /**
     * Yields the seed and each successive application of the function, for as long as the
     * predicate holds.
     */
    public static <T> FunctionalIterator<T> loop(T seed, Predicate<T> predicate, UnaryOperator<T> function) {
        return new AbstractFunctionalIterator<T>() {
            private T current;
            private boolean started;

            @Override
            protected T computeNext() {
                current = started ? function.apply(current) : seed;
                started = true;
                return predicate.test(current) ? current : endOfData();
            }
        };
    }

    /**
     * Walks a tree breadth-first, starting with the root itself.
     */
    public static <T> FunctionalIterator<T> tree(T root, Function<T, FunctionalIterator<T>> childrenFn) {
        return new AbstractFunctionalIterator<T>() {
            // one iterator over the children of each visited parent, oldest first
            private final Deque<FunctionalIterator<T>> families = new ArrayDeque<>();
            private boolean rootVisited;

            @Override
            protected T computeNext() {
                T next;
                if (!rootVisited) {
                    rootVisited = true;
                    next = root;
                } else {
                    while (!families.isEmpty() && !families.peekFirst().hasNext()) families.removeFirst();
                    if (families.isEmpty()) return endOfData();
                    next = families.peekFirst().next();
                }
                families.addLast(childrenFn.apply(next));
                return next;
            }
        };
    }
}
