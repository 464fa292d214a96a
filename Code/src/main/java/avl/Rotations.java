package avl;

import avl.AVLTreeMap.Node;

/**
 * Structural operations on a two or three node neighbourhood of an AVL tree.
 * None of these methods touch a subtree other than the one transplanted by
 * the rotation, and all of them run in constant time.
 */
final class Rotations {

    private Rotations() {}

    //--------------------------------------------------------------------------------
    // HEIGHT BOOKKEEPING
    //--------------------------------------------------------------------------------

    static int height(final Node<?,?> n) {
        return n == null ? 0 : n.height;
    }

    static void updateHeight(final Node<?,?> n) {
        n.height = 1 + Math.max(height(n.left), height(n.right));
    }

    /** height(left) - height(right); 0 for an empty subtree */
    static int balanceFactor(final Node<?,?> n) {
        return n == null ? 0 : height(n.left) - height(n.right);
    }

    //--------------------------------------------------------------------------------
    // ROTATIONS
    //--------------------------------------------------------------------------------

    /**
     * x's right child y takes x's place, x becomes y's left child and y's old
     * left subtree becomes x's right subtree.
     *
     * @return the new root of the subtree (y)
     */
    static <K,V> Node<K,V> rotateLeft(final Node<K,V> x) {
        final Node<K,V> y = x.right;
        x.right = y.left;
        y.left = x;
        updateHeight(x);   // y's height depends on x, so x first
        updateHeight(y);
        return y;
    }

    /** Mirror of {@link #rotateLeft}. */
    static <K,V> Node<K,V> rotateRight(final Node<K,V> x) {
        final Node<K,V> y = x.left;
        x.left = y.right;
        y.right = x;
        updateHeight(x);
        updateHeight(y);
        return y;
    }

    /**
     * Refreshes the height of x and, if x is out of balance, applies the
     * single or double rotation that restores it. A heavier child with a
     * balance factor of exactly 0 (only possible after a delete) takes the
     * single rotation.
     *
     * PRECONDITION: both subtrees of x are themselves balanced and their
     * heights differ by at most 2.
     *
     * @return the root of the rebalanced subtree, x itself if nothing rotated
     */
    static <K,V> Node<K,V> rebalance(final Node<K,V> x) {
        updateHeight(x);
        final int bf = balanceFactor(x);
        Node<K,V> top = x;
        if (bf > 1) {
            if (balanceFactor(x.left) < 0) {          // left-right
                x.left = rotateLeft(x.left);
            }
            top = rotateRight(x);                     // left-left
        } else if (bf < -1) {
            if (balanceFactor(x.right) > 0) {         // right-left
                x.right = rotateRight(x.right);
            }
            top = rotateLeft(x);                      // right-right
        }
        assert Math.abs(balanceFactor(top)) <= 1 : "unbalanced after rebalance at " + top.key;
        return top;
    }
}
