/*
 * Copyright (C) 2011-2025 Frederic Langlet
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 *
 * You may obtain a copy of the License at
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package io.github.flanglet.ordo.util.sort;

import io.github.flanglet.ordo.Event;
import io.github.flanglet.ordo.Listener;
import io.github.flanglet.ordo.OrderException;
import io.github.flanglet.ordo.Sorter;
import java.util.Comparator;

/**
 * The {@code HeapSort} class implements the heap sort algorithm, a
 * comparison-based sorting algorithm with an average and worst-case time
 * complexity of O(n log n).
 *
 * <p>
 * The range is first rearranged into a max-heap (0-based: the children of
 * {@code k} are {@code 2k+1} and {@code 2k+2}), then the root is repeatedly
 * exchanged with the last key of the shrinking heap and sunk back into place.
 * No auxiliary storage is used. Unlike quicksort, the bound does not depend on
 * randomness. The sort is not stable.
 * </p>
 *
 * @param <T> the type of the keys
 */
public final class HeapSort<T> implements Sorter<T> {

    private final Comparator<? super T> cmp;
    private final Listener listener;

    /**
     * Constructs a {@code HeapSort} instance using the natural ordering of the keys.
     */
    public HeapSort() {
        this(null, null);
    }

    /**
     * Constructs a {@code HeapSort} instance with the specified comparator.
     *
     * @param cmp
     *            the comparator to use, or {@code null} to use natural ordering.
     */
    public HeapSort(Comparator<? super T> cmp) {
        this(cmp, null);
    }

    /**
     * Constructs a {@code HeapSort} instance with the specified comparator and listener.
     *
     * @param cmp
     *            the comparator to use, or {@code null} to use natural ordering.
     * @param listener
     *            an optional listener notified at the end of each phase, or {@code null}.
     */
    public HeapSort(Comparator<? super T> cmp, Listener listener) {
        this.cmp = NaturalComparator.orNatural(cmp);
        this.listener = listener;
    }

    @Override
    public boolean sort(T[] input) {
        if (input == null)
            throw new OrderException("Invalid null array parameter", OrderException.INVALID_ARGUMENT);

        return this.sort(input, 0, input.length);
    }

    @Override
    public boolean sort(T[] input, int blkptr, int len) {
        if (input == null)
            throw new OrderException("Invalid null array parameter", OrderException.INVALID_ARGUMENT);

        if ((blkptr < 0) || (len < 0) || (len > input.length - blkptr))
            return false;

        this.notify(Event.Type.SORT_START, blkptr, blkptr + len - 1);

        if (len > 1) {
            // n is the index of the last key of the heap
            int n = len - 1;

            // Leaves are trivial heaps
            for (int k = n >> 1; k >= 0; k--)
                this.sink(input, blkptr, k, n);

            this.notify(Event.Type.HEAP_BUILT, blkptr, blkptr + n);

            while (n > 0) {
                Partitioner.swap(input, blkptr, blkptr + n);
                n--;
                this.sink(input, blkptr, 0, n);
            }
        }

        this.notify(Event.Type.SORT_END, blkptr, blkptr + len - 1);
        return true;
    }

    // Sink the key at idx within heap array[blkptr..blkptr+n]
    private void sink(T[] array, int blkptr, int idx, int n) {
        int k = idx;
        final T temp = array[blkptr + k];

        while ((k << 1) + 1 <= n) {
            int j = (k << 1) + 1; // Left child

            // Take the larger child, the right one on ties
            if ((j < n) && (this.cmp.compare(array[blkptr + j], array[blkptr + j + 1]) <= 0))
                j++;

            if (this.cmp.compare(temp, array[blkptr + j]) >= 0)
                break;

            // Move the child up to the parent node
            array[blkptr + k] = array[blkptr + j];
            k = j;
        }

        array[blkptr + k] = temp;
    }

    private void notify(Event.Type type, int low, int high) {
        if (this.listener != null)
            this.listener.processEvent(new Event(type, low, high));
    }
}
