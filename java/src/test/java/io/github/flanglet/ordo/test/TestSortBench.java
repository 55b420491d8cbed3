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

import io.github.flanglet.ordo.Error;
import io.github.flanglet.ordo.Listener;
import io.github.flanglet.ordo.app.InfoPrinter;
import io.github.flanglet.ordo.app.SortBench;
import io.github.flanglet.ordo.util.sort.QuickSort;
import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.util.HashMap;
import java.util.Map;
import java.util.Random;
import org.junit.Assert;
import org.junit.Test;

public class TestSortBench {

    @Test
    public void testCommandLine() {
        Map<String, Object> map = new HashMap<>();
        String[] args = new String[] { "--algo=quick,heap", "--size=100", "--seed=42", "--verbose=0", "-m" };
        Assert.assertEquals(0, SortBench.processCommandLine(args, map));
        Assert.assertEquals("QUICK,HEAP", map.get("algo"));
        Assert.assertEquals(Integer.valueOf(100), map.get("size"));
        Assert.assertEquals(Long.valueOf(42), map.get("seed"));
        Assert.assertEquals(Boolean.TRUE, map.get("median"));
    }

    @Test
    public void testInvalidCommandLine() {
        Assert.assertEquals(Error.ERR_INVALID_ALGORITHM,
                SortBench.processCommandLine(new String[] { "--algo=bogo", "--verbose=0" }, new HashMap<>()));
        Assert.assertEquals(Error.ERR_INVALID_PARAM,
                SortBench.processCommandLine(new String[] { "--size=lots", "--verbose=0" }, new HashMap<>()));
        Assert.assertEquals(Error.ERR_INVALID_PARAM,
                SortBench.processCommandLine(new String[] { "--verbose=9" }, new HashMap<>()));
        Assert.assertEquals(Error.ERR_MISSING_PARAM,
                SortBench.processCommandLine(new String[] { "--runs=" }, new HashMap<>()));
    }

    @Test
    public void testRun() {
        Map<String, Object> map = new HashMap<>();
        String[] args = new String[] { "--algo=all", "--size=2000", "--keys=10", "--runs=2", "--cutoff=5",
            "--seed=7", "--median", "--verbose=0" };
        Assert.assertEquals(0, SortBench.processCommandLine(args, map));
        Assert.assertEquals(Integer.valueOf(0), new SortBench(map).call());
    }

    @Test
    public void testRunWithEngineEvents() {
        Map<String, Object> map = new HashMap<>();
        map.put("algo", "QUICK3,SELECT");
        map.put("size", 300);
        map.put("verbose", 4);
        Assert.assertEquals(Integer.valueOf(0), new SortBench(map).call());
    }

    @Test
    public void testUnexpectedFailure() {
        Map<String, Object> map = new HashMap<>();
        map.put("algo", "QUICK");
        map.put("size", 100);
        map.put("verbose", 0);

        SortBench bench = new SortBench(map) {
            @Override
            protected Listener createListener() {
                return evt -> {
                    throw new IllegalStateException("listener failure");
                };
            }
        };

        Assert.assertEquals(Integer.valueOf(Error.ERR_UNKNOWN), bench.call());
    }

    @Test
    public void testInfoPrinter() {
        ByteArrayOutputStream baos = new ByteArrayOutputStream();
        InfoPrinter printer = new InfoPrinter(4, new PrintStream(baos, true));
        Integer[] a = TestQuickSort.randomArray(500, 1000);
        new QuickSort<Integer>(null, new Random(8), 0, false, printer).sort(a);
        Assert.assertTrue(TestQuickSort.isSorted(a));
        Assert.assertTrue(printer.getPartitions() > 0);

        // No cutoff: every range reported by the engine is partitioned
        Assert.assertEquals(printer.getRanges(), printer.getPartitions());
        String out = new String(baos.toByteArray());
        Assert.assertTrue(out, out.contains("Keys: 500, ranges: " + printer.getRanges()
                + ", partitions: " + printer.getPartitions()));

        // Counters restart with each sort
        Integer[] b = new Integer[] { 2, 1 };
        new QuickSort<Integer>(null, new Random(9), 0, false, printer).sort(b);
        Assert.assertEquals(1, printer.getRanges());
        Assert.assertEquals(1, printer.getPartitions());
    }

    @Test(expected = IllegalArgumentException.class)
    public void testUnknownAlgorithm() {
        Map<String, Object> map = new HashMap<>();
        map.put("algo", "BOGO");
        new SortBench(map);
    }
}
