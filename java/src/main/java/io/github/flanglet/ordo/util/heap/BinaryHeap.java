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

package io.github.flanglet.ordo.util.heap;

import io.github.flanglet.ordo.OrderException;
import io.github.flanglet.ordo.PriorityQueue;
import io.github.flanglet.ordo.util.sort.NaturalComparator;
import java.util.Arrays;
import java.util.Comparator;
import java.util.Iterator;
import java.util.NoSuchElementException;


/**
 * Max-oriented priority queue backed by a binary heap.
 *
 * <p>The heap is stored in a growable array using 1-based level order: the
 * root is at index 1, the children of {@code k} at {@code 2k} and
 * {@code 2k+1}, its parent at {@code k/2}. Slot 0 is unused. After each public
 * call, no key is larger than its parent.</p>
 *
 * <p>{@code insert} and {@code delMax} take a logarithmic number of compares,
 * {@code max}, {@code size} and {@code isEmpty} constant time. The buffer
 * doubles when full and halves when a quarter full, never below the initial
 * capacity.</p>
 *
 * <p>A min-oriented queue is obtained with {@link #minOriented(Comparator)}.</p>
 *
 * <p>This class is not thread-safe.</p>
 *
 * @param <T> the type of the keys
 */
public class BinaryHeap<T> implements PriorityQueue<T> {

    private static final int DEFAULT_CAPACITY = 16;

    private final Comparator<? super T> cmp;
    private final int minCapacity;
    private Object[] heap;
    private int n;


    public BinaryHeap() {
        this(DEFAULT_CAPACITY, null);
    }


    public BinaryHeap(Comparator<? super T> cmp) {
        this(DEFAULT_CAPACITY, cmp);
    }


    /**
     * Creates an empty heap.
     *
     * @param capacity the initial capacity, at least 1
     * @param cmp the comparator, or {@code null} for natural ordering
     * @throws IllegalArgumentException if the capacity is less than 1
     */
    public BinaryHeap(int capacity, Comparator<? super T> cmp) {
        if (capacity < 1)
            throw new IllegalArgumentException("The capacity must be at least 1");

        this.cmp = NaturalComparator.orNatural(cmp);
        this.minCapacity = capacity;
        this.heap = new Object[capacity + 1];
        this.n = 0;
    }


    /**
     * Creates a heap holding a copy of the provided keys. The heap is built
     * bottom-up in a linear number of compares.
     *
     * @param keys the initial keys, none of them {@code null}
     * @param cmp the comparator, or {@code null} for natural ordering
     * @throws OrderException if the array or one of the keys is {@code null}
     */
    public BinaryHeap(T[] keys, Comparator<? super T> cmp) {
        if (keys == null)
            throw new OrderException("Invalid null array parameter", OrderException.INVALID_ARGUMENT);

        this.cmp = NaturalComparator.orNatural(cmp);
        this.minCapacity = DEFAULT_CAPACITY;
        this.heap = new Object[Math.max(keys.length, DEFAULT_CAPACITY) + 1];

        for (int i = 0; i < keys.length; i++) {
            if (keys[i] == null)
                throw new OrderException("Invalid null key at index " + i, OrderException.INVALID_ARGUMENT);

            this.heap[i + 1] = keys[i];
        }

        this.n = keys.length;

        for (int k = this.n >> 1; k >= 1; k--)
            this.sink(k);
    }


    /**
     * Creates an empty heap whose {@code max} is the smallest key under the
     * provided ordering.
     *
     * @param <T> the type of the keys
     * @param cmp the comparator, or {@code null} for natural ordering
     * @return a min-oriented priority queue
     */
    public static <T> BinaryHeap<T> minOriented(Comparator<? super T> cmp) {
        final Comparator<? super T> c = NaturalComparator.orNatural(cmp);
        return new BinaryHeap<T>(DEFAULT_CAPACITY, (T k1, T k2) -> c.compare(k2, k1));
    }


    @Override
    public void insert(T key) {
        if (key == null)
            throw new OrderException("Invalid null key", OrderException.INVALID_ARGUMENT);

        if (this.n == this.heap.length - 1)
            this.resize(this.heap.length << 1);

        this.heap[++this.n] = key;
        this.swim(this.n);
    }


    @Override
    public T max() {
        if (this.n == 0)
            throw new OrderException("Priority queue underflow", OrderException.EMPTY_QUEUE);

        return this.key(1);
    }


    @Override
    public T delMax() {
        if (this.n == 0)
            throw new OrderException("Priority queue underflow", OrderException.EMPTY_QUEUE);

        final T max = this.key(1);
        this.swap(1, this.n);
        this.heap[this.n--] = null; // no loitering
        this.sink(1);
        final int capacity = this.heap.length - 1;

        if ((this.n > 0) && (this.n == capacity >> 2) && ((capacity >> 1) >= this.minCapacity))
            this.resize((capacity >> 1) + 1);

        return max;
    }


    @Override
    public int size() {
        return this.n;
    }


    @Override
    public boolean isEmpty() {
        return this.n == 0;
    }


    @Override
    public void clear() {
        this.heap = new Object[this.minCapacity + 1];
        this.n = 0;
    }


    /**
     * Returns the number of keys the heap can hold before growing.
     *
     * @return the current capacity
     */
    public int capacity() {
        return this.heap.length - 1;
    }


    /**
     * Checks the heap order: no key is larger than its parent.
     *
     * @return {@code true} if the heap order holds for every occupied slot
     */
    public boolean isHeapOrdered() {
        for (int k = 2; k <= this.n; k++) {
            if (this.less(k >> 1, k))
                return false;
        }

        return true;
    }


    /**
     * Returns an iterator over the keys in descending priority order. The
     * iterator drains a copy, so the heap is not modified.
     */
    @Override
    public Iterator<T> iterator() {
        final BinaryHeap<T> copy = new BinaryHeap<>(Math.max(this.n, 1), this.cmp);
        System.arraycopy(this.heap, 1, copy.heap, 1, this.n);
        copy.n = this.n;

        return new Iterator<T>() {
            @Override
            public boolean hasNext() {
                return copy.isEmpty() == false;
            }

            @Override
            public T next() {
                if (copy.isEmpty())
                    throw new NoSuchElementException();

                return copy.delMax();
            }
        };
    }


    private void swim(int k) {
        while ((k > 1) && this.less(k >> 1, k)) {
            this.swap(k >> 1, k);
            k >>= 1;
        }
    }


    private void sink(int k) {
        while ((k << 1) <= this.n) {
            int child = k << 1;

            // Larger child, the right one on ties
            if ((child < this.n) && (this.less(child + 1, child) == false))
                child++;

            if (this.less(k, child) == false)
                break;

            this.swap(k, child);
            k = child;
        }
    }


    private boolean less(int i, int j) {
        return this.cmp.compare(this.key(i), this.key(j)) < 0;
    }


    private void swap(int i, int j) {
        final Object tmp = this.heap[i];
        this.heap[i] = this.heap[j];
        this.heap[j] = tmp;
    }


    @SuppressWarnings("unchecked")
    private T key(int i) {
        return (T) this.heap[i];
    }


    private void resize(int length) {
        this.heap = Arrays.copyOf(this.heap, length);
    }
}
