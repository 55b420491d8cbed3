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

package io.github.flanglet.ordo;

/**
 * A max-oriented priority queue: the key returned by {@link #max()} and
 * {@link #delMax()} is always a largest key currently stored.
 *
 * <p>Iteration yields the keys in descending priority order and leaves the
 * queue untouched.</p>
 *
 * @param <T> the type of the keys
 */
public interface PriorityQueue<T> extends Iterable<T> {

    /**
     * Adds a key to the queue.
     *
     * @param key the key to add, not {@code null}
     */
    public void insert(T key);

    /**
     * Returns a largest key without removing it.
     *
     * @return a largest key
     * @throws OrderException with code {@link OrderException#EMPTY_QUEUE} if the queue is empty
     */
    public T max();

    /**
     * Removes and returns a largest key.
     *
     * @return a largest key
     * @throws OrderException with code {@link OrderException#EMPTY_QUEUE} if the queue is empty
     */
    public T delMax();

    /**
     * @return the number of keys in the queue
     */
    public int size();

    /**
     * @return {@code true} if the queue holds no key
     */
    public boolean isEmpty();

    /**
     * Removes all keys from the queue.
     */
    public void clear();
}
