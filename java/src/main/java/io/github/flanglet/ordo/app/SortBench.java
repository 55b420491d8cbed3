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

package io.github.flanglet.ordo.app;

import io.github.flanglet.ordo.Error;
import io.github.flanglet.ordo.Listener;
import io.github.flanglet.ordo.OrderException;
import io.github.flanglet.ordo.PriorityQueue;
import io.github.flanglet.ordo.util.heap.BinaryHeap;
import io.github.flanglet.ordo.util.sort.HeapSort;
import io.github.flanglet.ordo.util.sort.QuickSelect;
import io.github.flanglet.ordo.util.sort.QuickSort;
import io.github.flanglet.ordo.util.sort.QuickSort3Way;
import java.text.DecimalFormat;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Random;
import java.util.concurrent.Callable;


/**
 * The {@code SortBench} class is a command-line application timing the sorting
 * and selection engines on random integer keys.
 *
 * <p>Every run is verified against {@code java.util.Arrays.sort}.</p>
 *
 * Usage: java -cp ordo.jar io.github.flanglet.ordo.app.SortBench --algo=all --size=1000000
 */
public class SortBench implements Callable<Integer>
{
   private static final String ORDO_VERSION = "1.0.0";
   private static final String APP_HEADER = "Ordo " + ORDO_VERSION + " (c) Frederic Langlet";
   private static final String APP_SUB_HEADER = "Sorting and selection benchmark.";
   private static final String APP_USAGE = "Usage: java -cp ordo.jar io.github.flanglet.ordo.app.SortBench [flags]";

   static final String[] ALGORITHMS = { "QUICK", "QUICK3", "HEAP", "SELECT", "PQ" };

   private static final int DEFAULT_SIZE = 1000000;
   private static final int DEFAULT_RUNS = 3;

   private static final DecimalFormat TIME_FORMAT = new DecimalFormat("0.000");
   private static final DecimalFormat SPEED_FORMAT = new DecimalFormat("0.00");

   private final List<String> algorithms;
   private final int size;
   private final int keys;
   private final int runs;
   private final int cutoff;
   private final boolean medianOfThree;
   private final long seed;
   private final int verbosity;


   /**
    * The main method that serves as the entry point for the application.
    *
    * @param args command line arguments passed to the application
    */
   public static void main(String[] args)
   {
      Map<String, Object> map = new HashMap<>();
      int status = processCommandLine(args, map);

      // Command line processing error ?
      if (status != 0)
         System.exit(status);

      // Help mode only ?
      if (map.containsKey("algo") == false)
         System.exit(0);

      SortBench bench = null;

      try
      {
         bench = new SortBench(map);
      }
      catch (Exception e)
      {
         System.err.println("Could not create the benchmark: "+e.getMessage());
         System.exit(Error.ERR_INVALID_PARAM);
      }

      System.exit(bench.call());
   }


   /**
    * Creates a benchmark from the options produced by {@link #processCommandLine}.
    *
    * @param map the options: algo (String), size, keys, runs, cutoff, verbose
    *        (Integer), median (Boolean), seed (Long). Missing entries take defaults.
    * @throws IllegalArgumentException if an option is invalid
    */
   public SortBench(Map<String, Object> map)
   {
      String algo = (String) map.getOrDefault("algo", "ALL");
      this.algorithms = new ArrayList<>();

      if ("ALL".equals(algo))
      {
         this.algorithms.addAll(Arrays.asList(ALGORITHMS));
      }
      else
      {
         for (String name : algo.split(","))
         {
            name = name.trim().toUpperCase();

            if (Arrays.asList(ALGORITHMS).contains(name) == false)
               throw new IllegalArgumentException("Unknown algorithm: " + name);

            this.algorithms.add(name);
         }
      }

      this.size = (Integer) map.getOrDefault("size", DEFAULT_SIZE);
      this.keys = (Integer) map.getOrDefault("keys", 0);
      this.runs = (Integer) map.getOrDefault("runs", DEFAULT_RUNS);
      this.cutoff = (Integer) map.getOrDefault("cutoff", 0);
      this.medianOfThree = (Boolean) map.getOrDefault("median", Boolean.FALSE);
      this.seed = (Long) map.getOrDefault("seed", System.nanoTime());
      this.verbosity = (Integer) map.getOrDefault("verbose", 1);

      if (this.size < 1)
         throw new IllegalArgumentException("The size must be at least 1");

      if (this.keys < 0)
         throw new IllegalArgumentException("The number of distinct keys must be positive or null");

      if (this.runs < 1)
         throw new IllegalArgumentException("The number of runs must be at least 1");

      if (this.cutoff < 0)
         throw new IllegalArgumentException("The cutoff must be positive or null");
   }


   /**
    * Runs every selected algorithm and prints one line per algorithm.
    *
    * @return 0 on success, an {@link Error} code otherwise
    */
   @Override
   public Integer call()
   {
      final Random rnd = new Random(this.seed);
      final Listener listener = this.createListener();
      printOut("Keys: " + this.size + ", distinct: " + ((this.keys == 0) ? "any" : this.keys)
            + ", runs: " + this.runs + ", seed: " + this.seed, this.verbosity >= 2);
      printOut(String.format("%-8s %12s %12s %12s", "ALGO", "KEYS", "TIME (ms)", "MKEYS/S"), this.verbosity >= 1);

      for (String algo : this.algorithms)
      {
         long elapsed = 0;

         for (int r = 0; r < this.runs; r++)
         {
            final Integer[] data = this.generate(rnd);
            final Integer[] expected = data.clone();
            Arrays.sort(expected);
            final Integer selected;
            final long before = System.nanoTime();

            try
            {
               selected = this.process(algo, data, rnd, listener);
            }
            catch (OrderException e)
            {
               System.err.println("Failure of " + algo + ": " + e.getMessage());
               return Error.ERR_PROCESS;
            }
            catch (Exception e)
            {
               System.err.println("Unexpected failure of " + algo + ": " + e);
               return Error.ERR_UNKNOWN;
            }

            elapsed += System.nanoTime() - before;

            if (verify(algo, data, expected, selected) == false)
            {
               System.err.println("Verification failed for " + algo);
               return Error.ERR_VERIFICATION;
            }
         }

         final double ms = (double) elapsed / this.runs / 1000000.0;
         final double speed = (ms == 0) ? 0 : this.size / (ms * 1000.0);
         printOut(String.format("%-8s %12d %12s %12s", algo, this.size, TIME_FORMAT.format(ms),
               SPEED_FORMAT.format(speed)), this.verbosity >= 1);
      }

      return 0;
   }


   /**
    * Returns the listener passed to the engines, or {@code null} for none.
    * An {@link InfoPrinter} on {@code System.out} is used from verbosity 4.
    *
    * @return the engine listener or {@code null}
    */
   protected Listener createListener()
   {
      return (this.verbosity >= 4) ? new InfoPrinter(this.verbosity, System.out) : null;
   }


   private Integer[] generate(Random rnd)
   {
      final Integer[] data = new Integer[this.size];

      for (int i = 0; i < data.length; i++)
         data[i] = (this.keys == 0) ? rnd.nextInt() : rnd.nextInt(this.keys);

      return data;
   }


   // Returns the selected key for SELECT, null otherwise
   private Integer process(String algo, Integer[] data, Random rnd, Listener listener)
   {
      switch (algo)
      {
         case "QUICK":
            new QuickSort<Integer>(null, rnd, this.cutoff, this.medianOfThree, listener).sort(data);
            return null;

         case "QUICK3":
            new QuickSort3Way<Integer>(null, rnd, this.cutoff, listener).sort(data);
            return null;

         case "HEAP":
            new HeapSort<Integer>(null, listener).sort(data);
            return null;

         case "SELECT":
            return new QuickSelect<Integer>(null, rnd, listener).select(data, data.length >> 1);

         case "PQ":
         {
            PriorityQueue<Integer> pq = new BinaryHeap<>();

            for (Integer key : data)
               pq.insert(key);

            for (int i = data.length - 1; i >= 0; i--)
               data[i] = pq.delMax();

            return null;
         }

         default:
            throw new OrderException("Unknown algorithm: " + algo, OrderException.INVALID_ARGUMENT);
      }
   }


   private static boolean verify(String algo, Integer[] data, Integer[] expected, Integer selected)
   {
      if ("SELECT".equals(algo))
         return expected[data.length >> 1].equals(selected);

      return Arrays.equals(data, expected);
   }


   /**
    * Parses the command line into the provided map.
    *
    * @param args the command line arguments
    * @param map the map receiving the options
    * @return 0 on success, an {@link Error} code otherwise
    */
   public static int processCommandLine(String[] args, Map<String, Object> map)
   {
      boolean showHelp = false;
      int verbose = 1;
      String algo = null;

      for (String arg : args)
      {
         arg = arg.trim();

         if (arg.equals("--help") || arg.equals("-h"))
         {
            showHelp = true;
            continue;
         }

         if (arg.equals("--median") || arg.equals("-m"))
         {
            map.put("median", Boolean.TRUE);
            continue;
         }

         final int eq = arg.indexOf('=');

         if ((arg.startsWith("--") == false) || (eq < 0))
         {
            printWarning(arg, " (unknown option).", verbose);
            continue;
         }

         final String name = arg.substring(2, eq);
         final String value = arg.substring(eq + 1).trim();

         if (value.length() == 0)
         {
            System.err.println("Missing value for option --" + name);
            return Error.ERR_MISSING_PARAM;
         }

         if (name.equals("algo"))
         {
            algo = value.toUpperCase();
            continue;
         }

         if (name.equals("seed"))
         {
            try
            {
               map.put("seed", Long.parseLong(value));
            }
            catch (NumberFormatException e)
            {
               System.err.println("Invalid seed provided on command line: "+arg);
               return Error.ERR_INVALID_PARAM;
            }

            continue;
         }

         if (name.equals("size") || name.equals("keys") || name.equals("runs")
               || name.equals("cutoff") || name.equals("verbose"))
         {
            try
            {
               final int val = Integer.parseInt(value);

               if ((val < 0) || ((name.equals("verbose")) && (val > 5)))
                  throw new NumberFormatException();

               if (name.equals("verbose"))
                  verbose = val;

               map.put(name, val);
            }
            catch (NumberFormatException e)
            {
               System.err.println("Invalid " + name + " provided on command line: "+arg);
               return Error.ERR_INVALID_PARAM;
            }

            continue;
         }

         printWarning(arg, " (unknown option).", verbose);
      }

      if (showHelp == true)
      {
         printHelp();
         return 0;
      }

      if (algo == null)
         algo = "ALL";

      if (algo.equals("ALL") == false)
      {
         for (String name : algo.split(","))
         {
            if (Arrays.asList(ALGORITHMS).contains(name.trim()) == false)
            {
               System.err.println("Invalid algorithm provided on command line: "+name);
               return Error.ERR_INVALID_ALGORITHM;
            }
         }
      }

      map.put("algo", algo);
      printOut("\n"+APP_HEADER+"\n", verbose >= 1);
      printOut(APP_SUB_HEADER, verbose > 1);
      return 0;
   }


   private static void printHelp()
   {
      printOut(APP_HEADER, true);
      printOut(APP_SUB_HEADER, true);
      printOut(APP_USAGE, true);
      printOut("", true);
      printOut("   -h, --help", true);
      printOut("        Display this message\n", true);
      printOut("   --algo=<names>", true);
      printOut("        Comma separated list among QUICK, QUICK3, HEAP, SELECT, PQ or ALL (default)\n", true);
      printOut("   --size=<n>", true);
      printOut("        Number of keys per run (default " + DEFAULT_SIZE + ")\n", true);
      printOut("   --keys=<n>", true);
      printOut("        Number of distinct keys, 0 for the whole int range (default)\n", true);
      printOut("   --runs=<n>", true);
      printOut("        Number of runs per algorithm (default " + DEFAULT_RUNS + ")\n", true);
      printOut("   --cutoff=<n>", true);
      printOut("        Insertion sort cutoff of the quicksort engines (default 0)\n", true);
      printOut("   -m, --median", true);
      printOut("        Median-of-three pivot for QUICK\n", true);
      printOut("   --seed=<n>", true);
      printOut("        Seed of the key generator and shuffles\n", true);
      printOut("   --verbose=<level>", true);
      printOut("        0=silent, 1=default, 2=display details, 4=engine summary,", true);
      printOut("        5=display engine events\n", true);
   }


   private static void printWarning(String arg, String msg, int verbose)
   {
      printOut("Warning: ignoring option [" + arg + "]" + msg, verbose > 0);
   }


   private static void printOut(String msg, boolean print)
   {
      if ((print == true) && (msg != null))
         System.out.println(msg);
   }
}
