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
import java.util.Comparator;

/**
 * In-place partitioning of a sub-array around the key found at its lowest index.
 *
 * <p>The 2-way scheme (Hoare) is shared by {@link QuickSort} and
 * {@link QuickSelect}. Both scans stop on keys equal to the pivot, so long runs
 * of duplicates are split in the middle instead of degenerating into a
 * quadratic number of compares. The 3-way scheme (Dijkstra's Dutch national
 * flag) is used by {@link QuickSort3Way}.</p>
 *
 * <p>Ranges are closed: {@code [low, high]}.</p>
 *
 * @param <T> the type of the keys
 */
public final class Partitioner<T> {

    private final Comparator<? super T> cmp;

    /**
     * Creates a partitioner using the natural ordering of the keys.
     */
    public Partitioner() {
        this(null);
    }

    /**
     * Creates a partitioner using the provided comparator, or the natural ordering
     * if it is {@code null}.
     *
     * @param cmp the comparator, or {@code null}
     */
    public Partitioner(Comparator<? super T> cmp) {
        this.cmp = NaturalComparator.orNatural(cmp);
    }

    /**
     * Partitions {@code array[low..high]} around {@code v = array[low]}.
     * On return, with {@code j} the returned index,
     * {@code array[low..j-1] <= array[j] == v <= array[j+1..high]}.
     *
     * @param array the array to partition
     * @param low the first index of the range
     * @param high the last index of the range (inclusive)
     * @return the final position of the pivot
     * @throws OrderException if the array is {@code null} or the range is empty
     *         or out of bounds
     */
    public int partition(T[] array, int low, int high) {
        checkRange(array, low, high);
        return this.partitionRange(array, low, high);
    }

    int partitionRange(T[] array, int low, int high) {
        if (low == high)
            return low;

        final T v = array[low];
        int i = low;
        int j = high + 1;

        while (true) {
            while (this.cmp.compare(array[++i], v) < 0) {
                if (i == high)
                    break;
            }

            while (this.cmp.compare(v, array[--j]) < 0) {
                if (j == low)
                    break;
            }

            if (i >= j)
                break;

            swap(array, i, j);
        }

        swap(array, low, j);
        return j;
    }

    /**
     * Partitions {@code array[low..high]} in three bands around {@code v = array[low]}.
     * On return {@code bounds[0] = lt} and {@code bounds[1] = gt} with
     * {@code array[low..lt-1] < v}, {@code array[lt..gt] == v} and
     * {@code array[gt+1..high] > v}.
     *
     * @param array the array to partition
     * @param low the first index of the range
     * @param high the last index of the range (inclusive)
     * @param bounds an array of at least 2 slots receiving {@code lt} and {@code gt}
     * @throws OrderException if an argument is invalid
     */
    public void partition3Way(T[] array, int low, int high, int[] bounds) {
        checkRange(array, low, high);

        if ((bounds == null) || (bounds.length < 2))
            throw new OrderException("Invalid bounds parameter (2 slots required)", OrderException.INVALID_ARGUMENT);

        this.partition3WayRange(array, low, high, bounds);
    }

    void partition3WayRange(T[] array, int low, int high, int[] bounds) {
        final T v = array[low];
        int lt = low;
        int gt = high;
        int i = low;

        while (i <= gt) {
            final int c = this.cmp.compare(array[i], v);

            if (c < 0)
                swap(array, lt++, i++);
            else if (c > 0)
                swap(array, i, gt--); // array[i] is unexamined, do not advance
            else
                i++;
        }

        bounds[0] = lt;
        bounds[1] = gt;
    }

    /**
     * Moves the median of {@code array[low]}, {@code array[mid]} and
     * {@code array[high]} to {@code array[low]}, where it becomes the pivot of
     * the next partition. Ranges of less than 3 keys are left unchanged.
     *
     * @param array the array
     * @param low the first index of the range
     * @param high the last index of the range (inclusive)
     * @throws OrderException if the array is {@code null} or the range is empty
     *         or out of bounds
     */
    public void medianOfThree(T[] array, int low, int high) {
        checkRange(array, low, high);
        this.medianOfThreeRange(array, low, high);
    }

    void medianOfThreeRange(T[] array, int low, int high) {
        if (high - low < 2)
            return;

        final int mid = (low + high) >>> 1;
        final int m;

        if (this.cmp.compare(array[low], array[mid]) < 0) {
            if (this.cmp.compare(array[mid], array[high]) < 0)
                m = mid;
            else if (this.cmp.compare(array[low], array[high]) < 0)
                m = high;
            else
                m = low;
        } else {
            if (this.cmp.compare(array[low], array[high]) < 0)
                m = low;
            else if (this.cmp.compare(array[mid], array[high]) < 0)
                m = high;
            else
                m = mid;
        }

        swap(array, low, m);
    }

    static void swap(Object[] array, int i, int j) {
        final Object tmp = array[i];
        array[i] = array[j];
        array[j] = tmp;
    }

    private static void checkRange(Object[] array, int low, int high) {
        if (array == null)
            throw new OrderException("Invalid null array parameter", OrderException.INVALID_ARGUMENT);

        if ((low < 0) || (high >= array.length) || (low > high))
            throw new OrderException("Invalid range [" + low + ", " + high + "] for an array of length "
                    + array.length, OrderException.INVALID_ARGUMENT);
    }
}
