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

package io.github.flanglet.ordo.test;

import io.github.flanglet.ordo.Event;
import io.github.flanglet.ordo.util.sort.HeapSort;
import java.util.Arrays;
import java.util.Collections;
import java.util.Comparator;
import java.util.Random;
import org.junit.Assert;
import org.junit.Test;

public class TestHeapSort {
    private final static Random RANDOM = new Random(Long.MAX_VALUE);

    @Test
    public void testAllEqual() {
        Integer[] a = new Integer[] { 1, 1, 1 };
        Integer[] orig = a.clone();
        Assert.assertTrue(new HeapSort<Integer>().sort(a));
        Assert.assertArrayEquals(new Integer[] { 1, 1, 1 }, a);

        // Equal keys are never moved by the build phase
        Integer[] b = orig.clone();
        new HeapSort<Integer>(null, evt -> {
            if (evt.getType() == Event.Type.HEAP_BUILT) {
                for (int i = 0; i < b.length; i++)
                    Assert.assertSame(orig[i], b[i]);
            }
        }).sort(b);
    }

    @Test
    public void testSmallInputs() {
        HeapSort<Integer> hs = new HeapSort<>();
        Integer[] a = new Integer[] { 2, 1 };
        hs.sort(a);
        Assert.assertArrayEquals(new Integer[] { 1, 2 }, a);
        a = new Integer[] { 1, 2 };
        hs.sort(a);
        Assert.assertArrayEquals(new Integer[] { 1, 2 }, a);
        a = new Integer[] { 3, 1, 2 };
        hs.sort(a);
        Assert.assertArrayEquals(new Integer[] { 1, 2, 3 }, a);
        a = new Integer[] { 9 };
        hs.sort(a);
        Assert.assertArrayEquals(new Integer[] { 9 }, a);
    }

    @Test
    public void testHeapBuilt() {
        for (int ii = 0; ii < 100; ii++) {
            final Integer[] a = TestQuickSort.randomArray(1 + RANDOM.nextInt(200), 50);
            final Integer[] expected = a.clone();
            Arrays.sort(expected);
            final int[] calls = new int[1];

            new HeapSort<Integer>(null, evt -> {
                if (evt.getType() == Event.Type.HEAP_BUILT) {
                    calls[0]++;

                    // Max-heap, 0-based
                    for (int k = 1; k <= evt.getHigh(); k++)
                        Assert.assertTrue(a[k] <= a[(k - 1) >> 1]);
                }
            }).sort(a);

            Assert.assertEquals((a.length > 1) ? 1 : 0, calls[0]);
            Assert.assertArrayEquals(expected, a);
        }
    }

    @Test
    public void testEqualChildrenTieBreak() {
        // Keys ordered on their first character only
        final Comparator<String> cmp = Comparator.comparingInt((String key) -> key.charAt(0));
        final String[] a = new String[] { "1x", "5a", "5b" };
        final String[] roots = new String[1];

        new HeapSort<String>(cmp, evt -> {
            if (evt.getType() == Event.Type.HEAP_BUILT)
                roots[0] = a[0];
        }).sort(a);

        // The build phase promotes the right child of two equal ones
        Assert.assertEquals("5b", roots[0]);
        Assert.assertArrayEquals(new String[] { "1x", "5a", "5b" }, a);
    }

    @Test
    public void testComparator() {
        Integer[] a = TestQuickSort.randomArray(500, 1000);
        Integer[] expected = a.clone();
        Arrays.sort(expected, Collections.reverseOrder());
        new HeapSort<Integer>(Collections.reverseOrder()).sort(a);
        Assert.assertArrayEquals(expected, a);
    }
}
