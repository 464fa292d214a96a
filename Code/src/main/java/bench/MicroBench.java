package bench;

import avl.AVLTreeMap;
import java.io.PrintStream;
import java.util.Random;
import java.util.TreeMap;

/**
 * Single-threaded throughput of AVLTreeMap against java.util.TreeMap on the
 * same preload and the same random find/insert/delete mix.
 *
 * Usage: MicroBench [keyRange] [operations] [seed]
 */
public class MicroBench {

    interface KV {
        void insert(int k);
        void delete(int k);
        Integer get(int k);
        int size();
    }

    static class AvlKV implements KV {
        final AVLTreeMap<Integer,Integer> map = new AVLTreeMap<>();
        public void insert(int k) { map.insert(k, k); }
        public void delete(int k) { map.delete(k); }
        public Integer get(int k) { return map.find(k); }
        public int size() { return map.size(); }
    }

    static class TreeMapKV implements KV {
        private final TreeMap<Integer,Integer> map = new TreeMap<>();
        public void insert(int k) { map.put(k, k); }
        public void delete(int k) { map.remove(k); }
        public Integer get(int k) { return map.get(k); }
        public int size() { return map.size(); }
    }

    static class Result {
        final String name;
        final long ops;
        final long nanos;
        final int finalSize;

        Result(String name, long ops, long nanos, int finalSize) {
            this.name = name;
            this.ops = ops;
            this.nanos = nanos;
            this.finalSize = finalSize;
        }

        double mopsPerSec() {
            return ops / (nanos / 1e9) / 1_000_000.0;
        }
    }

    static Result runOne(String name, KV ds, int keyRange, long operations, long seed) {
        // Preload half the key range in ascending order, the worst case for an unbalanced BST
        for (int i = 0; i < keyRange / 2; i++) ds.insert(i);

        Random rnd = new Random(seed);
        long start = System.nanoTime();
        for (long i = 0; i < operations; i++) {
            int k = rnd.nextInt(keyRange);
            int r = rnd.nextInt(100);
            // 80% gets, 10% inserts, 10% deletes
            if (r < 80) { ds.get(k); }
            else if (r < 90) { ds.insert(k); }
            else { ds.delete(k); }
        }
        long elapsed = Math.max(1, System.nanoTime() - start);
        return new Result(name, operations, elapsed, ds.size());
    }

    /** Runs both structures with the same seed and prints one line per structure. */
    public static boolean run(int keyRange, long operations, long seed, PrintStream out) {
        AvlKV avl = new AvlKV();
        Result a = runOne("AVLTreeMap", avl, keyRange, operations, seed);
        Result t = runOne("TreeMap", new TreeMapKV(), keyRange, operations, seed);

        out.printf("KeyRange=%d, Ops=%d, Seed=%d%n", keyRange, operations, seed);
        for (Result r : new Result[]{a, t}) {
            out.printf("  %-10s Time=%6.1fms, FinalSize=%d, Throughput=%.2f Mops/s%n",
                    r.name, r.nanos / 1e6, r.finalSize, r.mopsPerSec());
        }
        out.printf("  AVLTreeMap height=%d, rebalances=%d%n", avl.map.height(), avl.map.rebalanceCount());

        // same seed, same ops: both structures must end up holding the same keys
        if (a.finalSize != t.finalSize) {
            out.printf("  SIZE MISMATCH: AVLTreeMap=%d, TreeMap=%d%n", a.finalSize, t.finalSize);
            return false;
        }
        return true;
    }

    public static void main(String[] args) {
        int keyRange = (args.length >= 1) ? Integer.parseInt(args[0]) : 200_000;
        long operations = (args.length >= 2) ? Long.parseLong(args[1]) : 5_000_000L;
        long seed = (args.length >= 3) ? Long.parseLong(args[2]) : 42L;

        if (!run(keyRange, operations, seed, System.out)) {
            System.exit(1);
        }
    }
}
