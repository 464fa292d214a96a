package avl;

import java.util.AbstractMap;
import java.util.ArrayDeque;
import java.util.Comparator;
import java.util.Iterator;
import java.util.Map;
import java.util.Objects;
import java.util.function.BiConsumer;

/**
 * Ordered map of unique keys kept as an AVL tree: after every insert and
 * delete the heights of the two subtrees of any node differ by at most one,
 * so lookups and updates are O(log n) whatever the insertion order.
 *
 * <p>Keys are ordered by the comparator given at construction, or by their
 * natural order. The comparator must be a total order and stored keys must not
 * be mutated in a way that changes their order; neither is checked.
 *
 * <p>Not thread safe. Iterators are fail-fast: a structural change (a new key,
 * a removed key, {@link #clear()}) made while an iterator is outstanding makes
 * its next {@code next()} throw {@link java.util.ConcurrentModificationException}.
 * Replacing the value of an existing key is not a structural change.
 */
public class AVLTreeMap<K, V> implements Iterable<Map.Entry<K, V>> {
    //--------------------------------------------------------------------------------
    // Class: Node
    //--------------------------------------------------------------------------------
    static final class Node<K, V> {
        K key;          // overwritten by the successor when a two-child node is deleted
        V value;
        Node<K,V> left;
        Node<K,V> right;
        int height;

        Node(final K key, final V value) {
            this.key = key;
            this.value = value;
            this.height = 1;
        }
    }

    private final Comparator<? super K> comparator;

    Node<K,V> root;
    private int size;
    int modCount;               // structural changes only, checked by iterators
    private long rebalanceCount;

    /** Orders keys by their natural order; K must implement Comparable. */
    public AVLTreeMap() {
        this.comparator = null;
    }

    public AVLTreeMap(final Comparator<? super K> comparator) {
        this.comparator = Objects.requireNonNull(comparator, "comparator");
    }

//--------------------------------------------------------------------------------
// PUBLIC METHODS:
// - find     : value or null
// - insert   : previous value or null
// - delete   : removed value or null
//--------------------------------------------------------------------------------

    /** PRECONDITION: key CANNOT BE NULL **/
    public final V find(final K key) {
        final Node<K,V> n = lookup(key);
        return n == null ? null : n.value;
    }

    /** PRECONDITION: key CANNOT BE NULL **/
    public final boolean contains(final K key) {
        return lookup(key) != null;
    }

    // Associate value with key, return the previous value associated with key,
    // or null if there was no mapping for it
    /** PRECONDITION: key, value CANNOT BE NULL **/
    public final V insert(final K key, final V value) {
        Objects.requireNonNull(key, "key");
        Objects.requireNonNull(value, "value");

        if (root == null) {
            compare(key, key); // type check for natural ordering
            root = new Node<>(key, value);
            size = 1;
            modCount++;
            return null;
        }

        /** SEARCH **/
        final ArrayDeque<Node<K,V>> path = new ArrayDeque<>();
        Node<K,V> p = root;
        int c;
        while (true) {
            c = compare(key, p.key);
            if (c == 0) {
                // key already in the tree: overwrite in place, shape is untouched
                final V old = p.value;
                p.value = value;
                return old;
            }
            path.push(p);
            final Node<K,V> next = (c < 0) ? p.left : p.right;
            if (next == null) break;
            p = next;
        }
        /** END SEARCH **/

        final Node<K,V> leaf = new Node<>(key, value);
        if (c < 0) p.left = leaf;
        else       p.right = leaf;
        size++;
        modCount++;

        retrace(path, true);
        return null;
    }

    // Remove key, return the value it was associated with, or null if it was absent
    /** PRECONDITION: key CANNOT BE NULL **/
    public final V delete(final K key) {
        Objects.requireNonNull(key, "key");

        /** SEARCH **/
        final ArrayDeque<Node<K,V>> path = new ArrayDeque<>();
        Node<K,V> n = root;
        while (n != null) {
            final int c = compare(key, n.key);
            if (c == 0) break;
            path.push(n);
            n = (c < 0) ? n.left : n.right;
        }
        /** END SEARCH **/
        if (n == null) return null;

        final V removed = n.value;

        if (n.left != null && n.right != null) {
            // two children: pull the in-order successor up, then unlink the
            // successor node instead, which has no left child
            path.push(n);
            Node<K,V> s = n.right;
            while (s.left != null) {
                path.push(s);
                s = s.left;
            }
            n.key = s.key;
            n.value = s.value;
            n = s;
        }

        // leaf or single child: splice the child (possibly null) into n's slot
        final Node<K,V> child = (n.left != null) ? n.left : n.right;
        relink(path.peek(), n, child);
        n.left = n.right = null;
        size--;
        modCount++;

        // a rotation can leave a higher ancestor unbalanced, so go all the way up
        retrace(path, false);
        return removed;
    }

    public final int size() {
        return size;
    }

    public final boolean isEmpty() {
        return size == 0;
    }

    /** @return the entry with the smallest key, or null when empty */
    public final Map.Entry<K,V> min() {
        Node<K,V> n = root;
        if (n == null) return null;
        while (n.left != null) n = n.left;
        return entry(n);
    }

    /** @return the entry with the largest key, or null when empty */
    public final Map.Entry<K,V> max() {
        Node<K,V> n = root;
        if (n == null) return null;
        while (n.right != null) n = n.right;
        return entry(n);
    }

    /** Ascending traversal of all entries. */
    @Override
    public final Iterator<Map.Entry<K,V>> iterator() {
        return new InOrderIterator<>(this);
    }

    // Ascending traversal starting at the first key greater than or equal to from
    /** PRECONDITION: from CANNOT BE NULL **/
    public final Iterator<Map.Entry<K,V>> iterateFrom(final K from) {
        Objects.requireNonNull(from, "from");
        return new InOrderIterator<>(this, from);
    }

    /** Visits every mapping in ascending key order. */
    public final void forEach(final BiConsumer<? super K, ? super V> action) {
        Objects.requireNonNull(action, "action");
        for (Map.Entry<K,V> e : this) {
            action.accept(e.getKey(), e.getValue());
        }
    }

    public final void clear() {
        root = null;
        size = 0;
        modCount++;
    }

    /** @return height of the root node, 0 when empty */
    public final int height() {
        return Rotations.height(root);
    }

    /** Number of rebalancing steps (single or double rotations) performed so far. */
    public final long rebalanceCount() {
        return rebalanceCount;
    }

    @Override
    public String toString() {
        final StringBuilder sb = new StringBuilder("{");
        for (Map.Entry<K,V> e : this) {
            if (sb.length() > 1) sb.append(", ");
            sb.append(e.getKey()).append('=').append(e.getValue());
        }
        return sb.append('}').toString();
    }

//--------------------------------------------------------------------------------
// PRIVATE METHODS
// - lookup
// - retrace
// - relink
//--------------------------------------------------------------------------------

    private Node<K,V> lookup(final K key) {
        Objects.requireNonNull(key, "key");
        Node<K,V> n = root;
        while (n != null) {
            final int c = compare(key, n.key);
            if (c == 0) return n;
            n = (c < 0) ? n.left : n.right;
        }
        return null;
    }

    // Walk the recorded path bottom-up, refreshing heights and rotating where
    // needed. With stopWhenStable, stop as soon as a subtree's height comes out
    // the same as before: nothing above it can have changed.
    private void retrace(final ArrayDeque<Node<K,V>> path, final boolean stopWhenStable) {
        while (!path.isEmpty()) {
            final Node<K,V> n = path.pop();
            final int before = n.height;
            final Node<K,V> top = Rotations.rebalance(n);
            if (top != n) {
                rebalanceCount++;
                relink(path.peek(), n, top);
            }
            if (stopWhenStable && top.height == before) return;
        }
    }

    // Replace parent's link to old by replacement; a null parent means old was the root
    private void relink(final Node<K,V> parent, final Node<K,V> old, final Node<K,V> replacement) {
        if (parent == null)           root = replacement;
        else if (parent.left == old)  parent.left = replacement;
        else                          parent.right = replacement;
    }

    @SuppressWarnings("unchecked")
    final int compare(final K a, final K b) {
        return (comparator == null)
                ? ((Comparable<? super K>) a).compareTo(b)
                : comparator.compare(a, b);
    }

    static <K,V> Map.Entry<K,V> entry(final Node<K,V> n) {
        return new AbstractMap.SimpleImmutableEntry<>(n.key, n.value);
    }

    /**
     *
     * DEBUG CODE (FOR TESTBED)
     *
     */

    /**
     * Walks the whole tree and verifies key order, height bookkeeping, balance
     * and the cached size.
     *
     * @return the verified height of the tree
     * @throws IllegalStateException naming the first offending key
     */
    public int checkInvariants() {
        final int[] count = new int[1];
        final int h = checkSubtree(root, null, null, count);
        if (count[0] != size) {
            throw new IllegalStateException("size is " + size + " but tree holds " + count[0] + " nodes");
        }
        return h;
    }

    private int checkSubtree(final Node<K,V> n, final K lo, final K hi, final int[] count) {
        if (n == null) return 0;
        if (lo != null && compare(n.key, lo) <= 0) {
            throw new IllegalStateException("order violated: " + n.key + " is not greater than " + lo);
        }
        if (hi != null && compare(n.key, hi) >= 0) {
            throw new IllegalStateException("order violated: " + n.key + " is not less than " + hi);
        }
        count[0]++;
        final int hl = checkSubtree(n.left, lo, n.key, count);
        final int hr = checkSubtree(n.right, n.key, hi, count);
        if (n.height != 1 + Math.max(hl, hr)) {
            throw new IllegalStateException("stale height " + n.height + " at " + n.key
                    + ", expected " + (1 + Math.max(hl, hr)));
        }
        if (Math.abs(hl - hr) > 1) {
            throw new IllegalStateException("unbalanced at " + n.key + ": left=" + hl + " right=" + hr);
        }
        return n.height;
    }

    public int sizeStructural() {
        return sizeStructural(root);
    }

    private int sizeStructural(final Node<K,V> n) {
        if (n == null) return 0;
        return 1 + sizeStructural(n.left) + sizeStructural(n.right);
    }
}
