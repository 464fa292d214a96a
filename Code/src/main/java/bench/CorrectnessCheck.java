package bench;

import avl.AVLTreeMap;
import java.io.PrintStream;
import java.util.Iterator;
import java.util.Map;
import java.util.Objects;
import java.util.Random;
import java.util.TreeMap;

/**
 * Randomized differential run of AVLTreeMap against java.util.TreeMap.
 * Every operation's result is compared, and the tree's order, height and
 * balance invariants are re-verified after each one.
 *
 * Usage: CorrectnessCheck [operations] [keyRange] [seed]
 */
public class CorrectnessCheck {

    // AVL height never exceeds ~1.44 * log2(n + 2); this is the bound the report checks against
    static final double HEIGHT_FACTOR = 1.45;

    static double heightBound(int n) {
        return HEIGHT_FACTOR * (Math.log(n + 1) / Math.log(2));
    }

    public static boolean run(int operations, int keyRange, long seed, PrintStream out) {
        out.println("========================================");
        out.println("AVLTreeMap Correctness Check");
        out.printf("Keys 0-%d, %d operations, seed %d%n", keyRange - 1, operations, seed);
        out.println("========================================");

        AVLTreeMap<Integer,Integer> tree = new AVLTreeMap<>();
        TreeMap<Integer,Integer> ref = new TreeMap<>();
        Random rnd = new Random(seed);
        int maxHeight = 0;
        int failures = 0;

        for (int i = 0; i < operations && failures == 0; i++) {
            int k = rnd.nextInt(keyRange);
            int r = rnd.nextInt(100);
            String op;
            Integer expected, got;

            if (r < 45) {
                op = "insert";
                expected = ref.put(k, i);
                got = tree.insert(k, i);
            } else if (r < 80) {
                op = "delete";
                expected = ref.remove(k);
                got = tree.delete(k);
            } else {
                op = "find";
                expected = ref.get(k);
                got = tree.find(k);
            }

            if (!Objects.equals(expected, got)) {
                out.printf("❌ [op %d] %s(%d) returned %s, expected %s%n", i, op, k, got, expected);
                failures++;
                continue;
            }

            try {
                int h = tree.checkInvariants();
                maxHeight = Math.max(maxHeight, h);
                if (tree.size() > 0 && h > heightBound(tree.size())) {
                    out.printf("❌ [op %d] height %d exceeds %.2f for %d keys%n",
                            i, h, heightBound(tree.size()), tree.size());
                    failures++;
                }
            } catch (IllegalStateException e) {
                out.printf("❌ [op %d] after %s(%d): %s%n", i, op, k, e.getMessage());
                failures++;
            }
        }

        if (failures == 0 && !sameEntries(tree, ref)) {
            out.println("❌ final traversal differs from reference");
            failures++;
        }

        out.println("\n========== Final Verification ==========");
        out.printf("Final size: %d (reference %d)%n", tree.size(), ref.size());
        out.printf("Final height: %d (bound %.2f)%n", tree.height(), heightBound(tree.size()));
        out.printf("Max height seen: %d%n", maxHeight);
        out.printf("Rebalances: %d%n", tree.rebalanceCount());

        if (failures == 0) {
            out.println("\n✅ CORRECTNESS CHECK PASSED!");
        } else {
            out.println("\n❌ CORRECTNESS CHECK FAILED!");
        }
        return failures == 0;
    }

    private static boolean sameEntries(AVLTreeMap<Integer,Integer> tree, TreeMap<Integer,Integer> ref) {
        Iterator<Map.Entry<Integer,Integer>> it = tree.iterator();
        for (Map.Entry<Integer,Integer> e : ref.entrySet()) {
            if (!it.hasNext() || !e.equals(it.next())) return false;
        }
        return !it.hasNext();
    }

    public static void main(String[] args) {
        int operations = (args.length >= 1) ? Integer.parseInt(args[0]) : 100_000;
        int keyRange = (args.length >= 2) ? Integer.parseInt(args[1]) : 1_000;
        long seed = (args.length >= 3) ? Long.parseLong(args[2]) : 12345L;

        if (!run(operations, keyRange, seed, System.out)) {
            System.exit(1);
        }
    }
}
