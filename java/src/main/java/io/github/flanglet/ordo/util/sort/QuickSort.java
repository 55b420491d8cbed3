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
 * Randomized quicksort with 2-way (Hoare) partitioning.
 *
 * <p>The range is shuffled once, then recursively split around the key found at
 * its lowest index. The average number of compares is ~2N ln N. The quadratic
 * worst case requires an unlucky shuffle and is vanishingly unlikely for
 * non trivial inputs. The sort is not stable.</p>
 *
 * <p>Two optional refinements can be enabled at construction:</p>
 * <ul>
 *   <li>a cutoff: ranges of at most {@code cutoff} keys are finished with insertion sort,</li>
 *   <li>median-of-three: the median of the first, middle and last keys becomes the pivot.</li>
 * </ul>
 *
 * <p>The engine recurses into the smaller side of each partition and loops on the
 * larger one, so the stack depth stays logarithmic.</p>
 *
 * <p>This class is not thread-safe.</p>
 *
 * @param <T> the type of the keys
 */
public class QuickSort<T> implements Sorter<T> {

    private final Partitioner<T> partitioner;
    private final Shuffler shuffler;
    private final InsertionSort<T> insertionSort;
    private final int cutoff;
    private final boolean medianOfThree;
    private final Listener listener;

    /**
     * Creates a QuickSort instance using the natural ordering of the keys.
     */
    public QuickSort() {
        this(null);
    }

    /**
     * Creates a QuickSort instance with a custom comparator.
     *
     * @param cmp the comparator to use for sorting, or {@code null} for natural ordering.
     */
    public QuickSort(Comparator<? super T> cmp) {
        this(cmp, new Random(), 0, false, null);
    }

    /**
     * Creates a fully configured QuickSort instance.
     *
     * @param cmp the comparator to use for sorting, or {@code null} for natural ordering.
     * @param random the source of randomness used to shuffle the input.
     * @param cutoff ranges of at most this many keys are sorted by insertion sort (0 to disable).
     * @param medianOfThree true to use the median of three keys as pivot.
     * @param listener an optional listener notified of each range and partition, or {@code null}.
     * @throws IllegalArgumentException if the cutoff is negative
     */
    public QuickSort(Comparator<? super T> cmp, Random random, int cutoff, boolean medianOfThree, Listener listener) {
        if (cutoff < 0)
            throw new IllegalArgumentException("The cutoff must be positive or null");

        this.partitioner = new Partitioner<>(cmp);
        this.shuffler = new Shuffler(random);
        this.insertionSort = new InsertionSort<>(cmp);
        this.cutoff = cutoff;
        this.medianOfThree = medianOfThree;
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
            this.recursiveSort(input, blkptr, end);
        }

        this.notify(Event.Type.SORT_END, blkptr, end);
        return true;
    }

    private void recursiveSort(T[] block, int low, int high) {
        while (low < high) {
            this.notify(Event.Type.RANGE, low, high);

            if (high - low < this.cutoff) {
                this.insertionSort.sortRange(block, low, high);
                return;
            }

            if (this.medianOfThree == true)
                this.partitioner.medianOfThreeRange(block, low, high);

            final int j = this.partitioner.partitionRange(block, low, high);
            this.notify(Event.Type.PARTITION, j, j);

            if (j - low < high - j) {
                this.recursiveSort(block, low, j - 1);
                low = j + 1;
            } else {
                this.recursiveSort(block, j + 1, high);
                high = j - 1;
            }
        }
    }

    private void notify(Event.Type type, int low, int high) {
        if (this.listener != null)
            this.listener.processEvent(new Event(type, low, high));
    }
}
