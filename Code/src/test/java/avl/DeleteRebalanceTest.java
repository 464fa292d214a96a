package avl;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.util.*;
import static org.junit.jupiter.api.Assertions.*;

/**
 * Deletion cases that insertion never produces: a heavier child with a
 * balance factor of 0, and imbalances that cascade up past a rotation.
 */
class DeleteRebalanceTest {

    private static AVLTreeMap<Integer,Integer> build(int... keys) {
        AVLTreeMap<Integer,Integer> t = new AVLTreeMap<>();
        for (int k : keys) t.insert(k, k);
        t.checkInvariants();
        return t;
    }

    @Test
    void right_heavy_child_with_zero_balance_takes_single_left_rotation() {
        //     2                 4
        //    / \               / \
        //   1   4     -1->    2   5
        //      / \             \
        //     3   5             3
        AVLTreeMap<Integer,Integer> t = build(2, 1, 4, 3, 5);
        assertEquals(0, t.rebalanceCount());
        assertEquals(0, Rotations.balanceFactor(t.root.right));

        assertEquals(1, t.delete(1));

        assertEquals(4, t.root.key);
        assertEquals(2, t.root.left.key);
        assertEquals(3, t.root.left.right.key);
        assertEquals(5, t.root.right.key);
        assertEquals(3, t.height());
        assertEquals(1, t.rebalanceCount());
        t.checkInvariants();
    }

    @Test
    void left_heavy_child_with_zero_balance_takes_single_right_rotation() {
        //       4             2
        //      / \           / \
        //     2   5  -5->   1   4
        //    / \               /
        //   1   3             3
        AVLTreeMap<Integer,Integer> t = build(4, 5, 2, 1, 3);
        assertEquals(0, Rotations.balanceFactor(t.root.left));

        assertEquals(5, t.delete(5));

        assertEquals(2, t.root.key);
        assertEquals(1, t.root.left.key);
        assertEquals(4, t.root.right.key);
        assertEquals(3, t.root.right.left.key);
        assertEquals(3, t.height());
        t.checkInvariants();
    }

    @Test
    void imbalance_cascades_to_the_root() {
        // Minimal (Fibonacci-shaped) tree of height 5, inserted level by level
        // so no rotation happens while building:
        //
        //              8
        //          /       \
        //         5         11
        //       /   \      /  \
        //      3     7    10   12
        //     / \   /    /
        //    2   4 6    9
        //   /
        //  1
        AVLTreeMap<Integer,Integer> t = build(8, 5, 11, 3, 7, 10, 12, 2, 4, 6, 9, 1);
        assertEquals(0, t.rebalanceCount());
        assertEquals(5, t.height());

        // Removing 12 unbalances 11, and fixing 11 shortens the right side enough
        // to unbalance the root too.
        assertEquals(12, t.delete(12));

        assertEquals(2, t.rebalanceCount());
        assertEquals(5, t.root.key);
        assertEquals(3, t.root.left.key);
        assertEquals(8, t.root.right.key);
        assertEquals(7, t.root.right.left.key);
        assertEquals(10, t.root.right.right.key);
        assertEquals(9, t.root.right.right.left.key);
        assertEquals(11, t.root.right.right.right.key);
        assertEquals(4, t.height());
        t.checkInvariants();
    }

    @Test
    void deleting_the_root_repeatedly() {
        AVLTreeMap<Integer,Integer> t = new AVLTreeMap<>();
        for (int k = 0; k < 64; k++) t.insert(k, k);

        while (!t.isEmpty()) {
            int rootKey = t.root.key;
            int before = t.size();
            assertEquals(rootKey, t.delete(rootKey));
            assertEquals(before - 1, t.size());
            assertFalse(t.contains(rootKey));
            t.checkInvariants();
        }
        assertNull(t.root);
    }

    @ParameterizedTest
    @ValueSource(longs = {1L, 7L, 42L, 2024L, 99991L})
    void random_deletes_keep_invariants_at_every_step(long seed) {
        Random rnd = new Random(seed);
        List<Integer> keys = new ArrayList<>();
        for (int i = 0; i < 500; i++) keys.add(i);
        Collections.shuffle(keys, rnd);

        AVLTreeMap<Integer,Integer> t = new AVLTreeMap<>();
        for (int k : keys) t.insert(k, k);

        Collections.shuffle(keys, rnd);
        Set<Integer> remaining = new TreeSet<>(keys);
        for (int k : keys) {
            assertEquals(k, t.delete(k));
            remaining.remove(k);
            t.checkInvariants();
            assertEquals(remaining.size(), t.size());
        }
        assertTrue(t.isEmpty());
    }
}
