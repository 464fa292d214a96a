package avl;

import java.util.Comparator;
import java.util.Iterator;
import java.util.Map;

/**
 * Ordered set of unique keys backed by an {@link AVLTreeMap} whose values are
 * all the same placeholder object. Same ordering, threading and iterator rules
 * as the map.
 */
public class AVLTreeSet<K> implements Iterable<K> {

    private static final Object PRESENT = new Object();

    private final AVLTreeMap<K,Object> map;

    public AVLTreeSet() {
        this.map = new AVLTreeMap<>();
    }

    public AVLTreeSet(final Comparator<? super K> comparator) {
        this.map = new AVLTreeMap<>(comparator);
    }

    /** @return true if key was not already present */
    public boolean add(final K key) {
        return map.insert(key, PRESENT) == null;
    }

    /** @return true if key was present */
    public boolean remove(final K key) {
        return map.delete(key) != null;
    }

    public boolean contains(final K key) {
        return map.contains(key);
    }

    public int size() {
        return map.size();
    }

    public boolean isEmpty() {
        return map.isEmpty();
    }

    /** @return smallest key, or null when empty */
    public K first() {
        final Map.Entry<K,Object> e = map.min();
        return e == null ? null : e.getKey();
    }

    /** @return largest key, or null when empty */
    public K last() {
        final Map.Entry<K,Object> e = map.max();
        return e == null ? null : e.getKey();
    }

    @Override
    public Iterator<K> iterator() {
        return keys(map.iterator());
    }

    /** Ascending keys starting at the first key >= from. */
    public Iterator<K> iteratorFrom(final K from) {
        return keys(map.iterateFrom(from));
    }

    public void clear() {
        map.clear();
    }

    int height() {
        return map.height();
    }

    private static <K> Iterator<K> keys(final Iterator<Map.Entry<K,Object>> entries) {
        return new Iterator<K>() {
            @Override
            public boolean hasNext() {
                return entries.hasNext();
            }

            @Override
            public K next() {
                return entries.next().getKey();
            }
        };
    }
}
