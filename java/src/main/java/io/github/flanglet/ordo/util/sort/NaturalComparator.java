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

import java.util.Comparator;

/**
 * A comparator applying the natural ordering of {@link Comparable} keys. It is
 * used by the sorters when no comparator is provided.
 *
 * <p>Comparing keys that do not implement {@code Comparable} raises a
 * {@code ClassCastException}, as {@link java.util.Arrays#sort(Object[])} does.</p>
 */
public final class NaturalComparator implements Comparator<Object> {

    /**
     * The shared instance. This class is stateless and thread-safe.
     */
    public static final NaturalComparator INSTANCE = new NaturalComparator();

    private NaturalComparator() {
    }

    @Override
    @SuppressWarnings("unchecked")
    public int compare(Object o1, Object o2) {
        return ((Comparable<Object>) o1).compareTo(o2);
    }

    /**
     * Returns the provided comparator or the natural ordering if it is {@code null}.
     *
     * @param <T> the type of the keys
     * @param cmp the comparator, or {@code null}
     * @return a non null comparator
     */
    public static <T> Comparator<? super T> orNatural(Comparator<? super T> cmp) {
        if (cmp != null)
            return cmp;

        return INSTANCE;
    }
}
