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

import io.github.flanglet.ordo.OrderException;
import io.github.flanglet.ordo.Sorter;
import java.util.Comparator;

/**
 * The {@code InsertionSort} class implements the insertion sort algorithm, a simple comparison-based sorting algorithm with
 * a worst-case time complexity of O(n²) and an average-case complexity of O(n+k), where k is the number of inversions.
 *
 * <p>It is efficient for small or nearly sorted data. The quicksort engines hand small ranges over to it when configured
 * with a cutoff.</p>
 *
 * @param <T> the type of the keys
 */
public class InsertionSort<T> implements Sorter<T> {

    private final Comparator<? super T> cmp;

    /**
     * Constructs an {@code InsertionSort} instance using the natural ordering of the keys.
     */
    public InsertionSort() {
        this(null);
    }

    /**
     * Constructs an {@code InsertionSort} instance with the specified comparator.
     * If {@code cmp} is {@code null}, the natural ordering of the keys will be used.
     *
     * @param cmp the comparator to use for key comparisons, or {@code null} to use natural ordering.
     */
    public InsertionSort(Comparator<? super T> cmp) {
        this.cmp = NaturalComparator.orNatural(cmp);
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

        if (len > 1)
            this.sortRange(input, blkptr, blkptr + len - 1);

        return true;
    }

    /**
     * Sorts the closed range {@code [low, high]}, no argument check.
     */
    void sortRange(T[] array, int low, int high) {
        // Shortcut for 2-element sub-array
        if (high == low + 1) {
            if (this.cmp.compare(array[low], array[high]) > 0)
                Partitioner.swap(array, low, high);

            return;
        }

        for (int i = low + 1; i <= high; i++) {
            final T val = array[i];
            int j = i;

            while ((j > low) && (this.cmp.compare(array[j - 1], val) > 0)) {
                array[j] = array[j - 1];
                j--;
            }

            array[j] = val;
        }
    }
}
