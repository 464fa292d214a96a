package avl;

import avl.AVLTreeMap.Node;

import java.util.ArrayDeque;
import java.util.ConcurrentModificationException;
import java.util.Iterator;
import java.util.Map;
import java.util.NoSuchElementException;

/**
 * Lazy ascending traversal of an {@link AVLTreeMap}. The stack holds the nodes
 * still to be emitted whose right subtrees have not been entered yet, so its
 * depth never exceeds the height of the tree.
 */
final class InOrderIterator<K, V> implements Iterator<Map.Entry<K, V>> {

    private final AVLTreeMap<K,V> tree;
    private final ArrayDeque<Node<K,V>> stack = new ArrayDeque<>();
    private final int expectedModCount;

    InOrderIterator(final AVLTreeMap<K,V> tree) {
        this.tree = tree;
        this.expectedModCount = tree.modCount;
        pushLeftSpine(tree.root);
    }

    /** Starts at the first key >= from. */
    InOrderIterator(final AVLTreeMap<K,V> tree, final K from) {
        this.tree = tree;
        this.expectedModCount = tree.modCount;
        Node<K,V> n = tree.root;
        while (n != null) {
            final int c = tree.compare(from, n.key);
            if (c == 0) {
                stack.push(n);
                break;
            }
            if (c < 0) {
                // n is in range; everything to its left still has to be looked at
                stack.push(n);
                n = n.left;
            } else {
                // n and its left subtree are all below from
                n = n.right;
            }
        }
    }

    @Override
    public boolean hasNext() {
        return !stack.isEmpty();
    }

    @Override
    public Map.Entry<K,V> next() {
        if (tree.modCount != expectedModCount) throw new ConcurrentModificationException();
        if (stack.isEmpty()) throw new NoSuchElementException();
        final Node<K,V> n = stack.pop();
        pushLeftSpine(n.right);
        return AVLTreeMap.entry(n);
    }

    private void pushLeftSpine(Node<K,V> n) {
        while (n != null) {
            stack.push(n);
            n = n.left;
        }
    }
}
