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
import io.github.flanglet.ordo.Selector;
import java.util.Comparator;
import java.util.Random;


/**
 * Quickselect (Hoare's FIND): finds the k-th smallest key in linear expected time.
 *
 * <p>The array is shuffled once, then repeatedly partitioned, keeping only the
 * side that contains index {@code k}. On return {@code array[k]} holds the
 * result, with no larger key before it and no smaller key after it.</p>
 *
 * <p>This class is not thread-safe.</p>
 *
 * @param <T> the type of the keys
 */
public class QuickSelect<T> implements Selector<T> {

    private final Partitioner<T> partitioner;
    private final Shuffler shuffler;
    private final Listener listener;

    /**
     * Creates a QuickSelect instance using the natural ordering of the keys.
     */
    public QuickSelect() {
        this(null);
    }

    /**
     * Creates a QuickSelect instance with a custom comparator.
     *
     * @param cmp the comparator, or {@code null} for natural ordering.
     */
    public QuickSelect(Comparator<? super T> cmp) {
        this(cmp, new Random(), null);
    }

    /**
     * Creates a fully configured QuickSelect instance.
     *
     * @param cmp the comparator, or {@code null} for natural ordering.
     * @param random the source of randomness used to shuffle the input.
     * @param listener an optional listener notified of each partition, or {@code null}.
     */
    public QuickSelect(Comparator<? super T> cmp, Random random, Listener listener) {
        this.partitioner = new Partitioner<>(cmp);
        this.shuffler = new Shuffler(random);
        this.listener = listener;
    }

    @Override
    public T select(T[] array, int k) {
        if (array == null)
            throw new OrderException("Invalid null array parameter", OrderException.INVALID_ARGUMENT);

        if ((k < 0) || (k >= array.length))
            throw new OrderException("Invalid rank " + k + " for an array of length " + array.length,
                    OrderException.INVALID_ARGUMENT);

        this.notify(Event.Type.SORT_START, 0, array.length - 1);
        this.shuffler.shuffle(array, 0, array.length);
        int low = 0;
        int high = array.length - 1;

        // Invariant: the k-th smallest key lies in array[low..high]
        while (low <= high) {
            this.notify(Event.Type.RANGE, low, high);
            final int j = this.partitioner.partitionRange(array, low, high);
            this.notify(Event.Type.PARTITION, j, j);

            if (j > k)
                high = j - 1;
            else if (j < k)
                low = j + 1;
            else
                break;
        }

        this.notify(Event.Type.SORT_END, 0, array.length - 1);
        return array[k];
    }

    /**
     * Returns the lower median of the array, that is the key of rank
     * {@code (length-1)/2}. The array is reordered in place.
     *
     * @param array the array
     * @return the lower median
     * @throws OrderException if the array is {@code null} or empty
     */
    public T median(T[] array) {
        if (array == null)
            throw new OrderException("Invalid null array parameter", OrderException.INVALID_ARGUMENT);

        return this.select(array, (array.length - 1) >> 1);
    }

    private void notify(Event.Type type, int low, int high) {
        if (this.listener != null)
            this.listener.processEvent(new Event(type, low, high));
    }
}
