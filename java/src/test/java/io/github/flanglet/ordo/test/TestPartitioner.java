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

import io.github.flanglet.ordo.OrderException;
import io.github.flanglet.ordo.util.sort.Partitioner;
import java.util.Arrays;
import java.util.Random;
import org.junit.Assert;
import org.junit.Test;

public class TestPartitioner {
    private final static Random RANDOM = new Random(Long.MAX_VALUE);

    @Test
    public void testPartitionScenario() {
        Integer[] a = new Integer[] { 4, 2, 7, 8, 1 };
        Partitioner<Integer> p = new Partitioner<>();
        int j = p.partition(a, 0, 4);
        Assert.assertEquals(2, j);
        Assert.assertEquals(Integer.valueOf(4), a[j]);
        assertPartitioned(a, 0, 4, j);
        Assert.assertArrayEquals(new Integer[] { 1, 2, 4, 8, 7 }, a);
    }

    @Test
    public void testPartitionRandom() {
        Partitioner<Integer> p = new Partitioner<>();

        for (int ii = 0; ii < 500; ii++) {
            final int len = 1 + RANDOM.nextInt(200);
            final int range = (ii % 3 == 0) ? 3 : 1000;
            Integer[] a = randomArray(len, range);
            final Integer[] orig = a.clone();
            final int low = RANDOM.nextInt(len);
            final int high = low + RANDOM.nextInt(len - low);
            final Integer pivot = a[low];
            final int j = p.partition(a, low, high);

            Assert.assertTrue((j >= low) && (j <= high));
            Assert.assertEquals(pivot, a[j]);
            assertPartitioned(a, low, high, j);

            for (int i = 0; i < low; i++)
                Assert.assertSame(orig[i], a[i]);

            for (int i = high + 1; i < len; i++)
                Assert.assertSame(orig[i], a[i]);

            Arrays.sort(orig, low, high + 1);
            Integer[] sorted = a.clone();
            Arrays.sort(sorted, low, high + 1);
            Assert.assertArrayEquals(orig, sorted);
        }
    }

    @Test
    public void testPartitionDuplicates() {
        Integer[] a = new Integer[1000];
        Arrays.fill(a, 5);
        final int j = new Partitioner<Integer>().partition(a, 0, a.length - 1);

        // Scans stop on equal keys, so the split lands in the middle
        Assert.assertTrue(Math.abs(j - a.length / 2) <= 1);
    }

    @Test
    public void testPartitionSingleKey() {
        Integer[] a = new Integer[] { 3, 9, 1 };
        Assert.assertEquals(1, new Partitioner<Integer>().partition(a, 1, 1));
        Assert.assertArrayEquals(new Integer[] { 3, 9, 1 }, a);
    }

    @Test
    public void testPartitionInvalidRange() {
        Partitioner<Integer> p = new Partitioner<>();
        Integer[] a = new Integer[] { 3, 9, 1 };

        try {
            p.partition(a, 2, 1);
            Assert.fail("Empty range accepted");
        } catch (OrderException e) {
            Assert.assertEquals(OrderException.INVALID_ARGUMENT, e.getErrorCode());
        }

        try {
            p.partition(a, 0, 3);
            Assert.fail("Out of bounds range accepted");
        } catch (OrderException e) {
            Assert.assertEquals(OrderException.INVALID_ARGUMENT, e.getErrorCode());
        }

        try {
            p.partition(null, 0, 0);
            Assert.fail("Null array accepted");
        } catch (OrderException e) {
            Assert.assertEquals(OrderException.INVALID_ARGUMENT, e.getErrorCode());
        }
    }

    @Test
    public void testPartition3Way() {
        Partitioner<Integer> p = new Partitioner<>();
        final int[] bounds = new int[2];

        for (int ii = 0; ii < 500; ii++) {
            final int len = 1 + RANDOM.nextInt(100);
            Integer[] a = randomArray(len, 1 + RANDOM.nextInt(6));
            final Integer v = a[0];
            p.partition3Way(a, 0, len - 1, bounds);
            final int lt = bounds[0];
            final int gt = bounds[1];
            Assert.assertTrue(lt <= gt);

            for (int i = 0; i < lt; i++)
                Assert.assertTrue(a[i] < v);

            for (int i = lt; i <= gt; i++)
                Assert.assertEquals(v, a[i]);

            for (int i = gt + 1; i < len; i++)
                Assert.assertTrue(a[i] > v);
        }
    }

    @Test
    public void testPartition3WayScenario() {
        Integer[] a = new Integer[] { 3, 3, 3, 3, 1, 2 };
        final int[] bounds = new int[2];
        new Partitioner<Integer>().partition3Way(a, 0, 5, bounds);
        Assert.assertEquals(2, bounds[0]);
        Assert.assertEquals(5, bounds[1]);
        Assert.assertEquals(Integer.valueOf(3), a[2]);
        Assert.assertEquals(Integer.valueOf(3), a[5]);
    }

    @Test
    public void testMedianOfThree() {
        Partitioner<Integer> p = new Partitioner<>();
        final int[][] orders = new int[][] {
            { 1, 2, 3 }, { 1, 3, 2 }, { 2, 1, 3 }, { 2, 3, 1 }, { 3, 1, 2 }, { 3, 2, 1 }, { 2, 2, 1 }, { 1, 1, 1 }
        };

        for (int[] order : orders) {
            Integer[] a = new Integer[] { order[0], 0, order[1], 0, order[2] };
            p.medianOfThree(a, 0, 4);
            int[] sorted = order.clone();
            Arrays.sort(sorted);
            Assert.assertEquals("Order " + Arrays.toString(order), Integer.valueOf(sorted[1]), a[0]);
        }
    }

    private static Integer[] randomArray(int len, int range) {
        Integer[] a = new Integer[len];

        for (int i = 0; i < len; i++)
            a[i] = RANDOM.nextInt(range);

        return a;
    }

    private static void assertPartitioned(Integer[] a, int low, int high, int j) {
        for (int i = low; i < j; i++)
            Assert.assertTrue(a[i] <= a[j]);

        for (int i = j + 1; i <= high; i++)
            Assert.assertTrue(a[i] >= a[j]);
    }
}
