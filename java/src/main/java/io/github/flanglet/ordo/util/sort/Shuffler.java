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
import java.util.Random;

/**
 * Uniform random permutation of an array (Knuth / Fisher-Yates shuffle).
 *
 * <p>The quicksort engines and quickselect shuffle their input once before the
 * first partition, which makes the quadratic worst case vanishingly unlikely
 * whatever the initial order. Providing a seeded {@code Random} makes runs
 * reproducible.</p>
 *
 * <p>This class is not thread-safe: {@code java.util.Random} is, but sharing
 * a shuffler across threads defeats reproducibility.</p>
 */
public final class Shuffler {

    private final Random random;

    /**
     * Creates a shuffler backed by a new unseeded {@code Random}.
     */
    public Shuffler() {
        this(new Random());
    }

    /**
     * Creates a shuffler backed by the provided source of randomness.
     *
     * @param random the source of randomness
     * @throws NullPointerException if {@code random} is {@code null}
     */
    public Shuffler(Random random) {
        if (random == null)
            throw new NullPointerException("Invalid null random parameter");

        this.random = random;
    }

    /**
     * Shuffles the whole array in place.
     *
     * @param array the array to shuffle
     * @throws OrderException if the array is {@code null}
     */
    public void shuffle(Object[] array) {
        if (array == null)
            throw new OrderException("Invalid null array parameter", OrderException.INVALID_ARGUMENT);

        this.shuffle(array, 0, array.length);
    }

    /**
     * Shuffles a sub-array in place. Keys outside the sub-array are not touched.
     *
     * @param array the array containing the sub-array
     * @param idx the starting index of the sub-array
     * @param len the length of the sub-array
     * @return {@code false} if the sub-array does not fit in the array
     * @throws OrderException if the array is {@code null}
     */
    public boolean shuffle(Object[] array, int idx, int len) {
        if (array == null)
            throw new OrderException("Invalid null array parameter", OrderException.INVALID_ARGUMENT);

        if ((idx < 0) || (len < 0) || (len > array.length - idx))
            return false;

        for (int i = len - 1; i > 0; i--) {
            final int j = idx + this.random.nextInt(i + 1);
            final Object tmp = array[idx + i];
            array[idx + i] = array[j];
            array[j] = tmp;
        }

        return true;
    }
}
