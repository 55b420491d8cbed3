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
 * This interface defines methods for sorting an array or a sub-array of
 * objects in place.
 *
 * @param <T> the type of the keys to sort
 */
public interface Sorter<T> {

    /**
     * Sorts the whole array in place.
     *
     * @param array the array to sort
     * @return {@code true} once the array is sorted
     * @throws OrderException if the array is {@code null}
     */
    public boolean sort(T[] array);

    /**
     * Sorts a sub-array in place.
     *
     * @param array the array containing the sub-array to be sorted
     * @param idx the starting index of the sub-array
     * @param len the length of the sub-array
     * @return {@code true} if the sub-array was successfully sorted, {@code false}
     *         if the sub-array does not fit in the array (nothing is modified)
     * @throws OrderException if the array is {@code null}
     */
    public boolean sort(T[] array, int idx, int len);
}
