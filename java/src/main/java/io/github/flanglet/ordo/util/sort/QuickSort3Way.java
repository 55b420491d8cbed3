/*
Copyright 2011-2025 Frederic Langlet
Licensed under the Apache License, Version 2.0 (the "License");
you may not use this file except in compliance with the License.
you may obtain a copy of the License at

                http://www.apache.org/licenses/LICENSE-2.0

Unless required by applicable law or agreed to in writing, software
distributed under the License is distributed on an "AS IS" BASIS,
WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
See the License for the specific language governing permissions and
limitations under the License.
*/

package io.github.flanglet.ordo.util.sort;

import io.github.flanglet.ordo.Event;
import io.github.flanglet.ordo.Listener;
import io.github.flanglet.ordo.OrderException;
import io.github.flanglet.ordo.Sorter;
import java.util.Comparator;
import java.util.Random;


/**
 * Randomized quicksort with 3-way partitioning (Dijkstra's Dutch national flag).
 *
 * <p>Each pass splits the range into keys less than, equal to and greater than
 * the pivot. The band of keys equal to the pivot is final and never visited
 * again, which makes the sort entropy-optimal: linear on inputs with a bounded
 * number of distinct keys. The sort is not stable.</p>
 *
 * <p>This class is not thread-safe.</p>
 *
 * @param <T> the type of the keys
 */
public class QuickSort3Way<T> implements Sorter<T> {

    private final Partitioner<T> partitioner;
    private final Shuffler shuffler;
    private final InsertionSort<T> insertionSort;
    private final int cutoff;
    private final Listener listener;

    /**
     * Creates a QuickSort3Way instance using the natural ordering of the keys.
     */
    public QuickSort3Way() {
        this(null);
    }

    /**
     * Creates a QuickSort3Way instance with a custom comparator.
     *
     * @param cmp the comparator to use for sorting, or {@code null} for natural ordering.
     */
    public QuickSort3Way(Comparator<? super T> cmp) {
        this(cmp, new Random(), 0, null);
    }

    /**
     * Creates a fully configured QuickSort3Way instance.
     *
     * @param cmp the comparator to use for sorting, or {@code null} for natural ordering.
     * @param random the source of randomness used to shuffle the input.
     * @param cutoff ranges of at most this many keys are sorted by insertion sort (0 to disable).
     * @param listener an optional listener notified of each range and partition, or {@code null}.
     * @throws IllegalArgumentException if the cutoff is negative
     */
    public QuickSort3Way(Comparator<? super T> cmp, Random random, int cutoff, Listener listener) {
        if (cutoff < 0)
            throw new IllegalArgumentException("The cutoff must be positive or null");

        this.partitioner = new Partitioner<>(cmp);
        this.shuffler = new Shuffler(random);
        this.insertionSort = new InsertionSort<>(cmp);
        this.cutoff = cutoff;
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

        final int end = blkptr + len - 1;
        this.notify(Event.Type.SORT_START, blkptr, end);

        if (len > 1) {
            this.shuffler.shuffle(input, blkptr, len);
            this.recursiveSort(input, blkptr, end, new int[2]);
        }

        this.notify(Event.Type.SORT_END, blkptr, end);
        return true;
    }

    // bounds receives lt and gt of each 3-way pass
    private void recursiveSort(T[] block, int low, int high, int[] bounds) {
        while (low < high) {
            this.notify(Event.Type.RANGE, low, high);

            if (high - low < this.cutoff) {
                this.insertionSort.sortRange(block, low, high);
                return;
            }

            this.partitioner.partition3WayRange(block, low, high, bounds);
            final int lt = bounds[0];
            final int gt = bounds[1];
            this.notify(Event.Type.PARTITION, lt, gt);

            // block[lt..gt] is final
            if (lt - low < high - gt) {
                this.recursiveSort(block, low, lt - 1, bounds);
                low = gt + 1;
            } else {
                this.recursiveSort(block, gt + 1, high, bounds);
                high = lt - 1;
            }
        }
    }

    private void notify(Event.Type type, int low, int high) {
        if (this.listener != null)
            this.listener.processEvent(new Event(type, low, high));
    }
}
