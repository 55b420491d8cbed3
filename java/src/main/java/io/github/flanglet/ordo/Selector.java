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
 * This interface defines a method for finding an order statistic of an array.
 *
 * @param <T> the type of the keys
 */
public interface Selector<T> {

    /**
     * Returns the k-th smallest key of the array (0-based). The array is
     * reordered in place.
     *
     * @param array the array to search
     * @param k the rank of the requested key, in {@code [0, array.length-1]}
     * @return the k-th smallest key
     * @throws OrderException if the array is {@code null} or {@code k} is out of range
     */
    public T select(T[] array, int k);
}
