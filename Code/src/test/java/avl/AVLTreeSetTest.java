package avl;

import org.junit.jupiter.api.Test;

import java.util.*;
import static org.junit.jupiter.api.Assertions.*;

class AVLTreeSetTest {

    private static <K> List<K> drain(Iterator<K> it) {
        List<K> out = new ArrayList<>();
        while (it.hasNext()) out.add(it.next());
        return out;
    }

    @Test
    void add_remove_contains() {
        AVLTreeSet<String> s = new AVLTreeSet<>();
        assertTrue(s.isEmpty());
        assertNull(s.first());
        assertNull(s.last());

        assertTrue(s.add("m"));
        assertTrue(s.add("c"));
        assertTrue(s.add("x"));
        assertFalse(s.add("c"));
        assertEquals(3, s.size());

        assertTrue(s.contains("x"));
        assertFalse(s.contains("a"));
        assertEquals("c", s.first());
        assertEquals("x", s.last());

        assertTrue(s.remove("m"));
        assertFalse(s.remove("m"));
        assertEquals(List.of("c", "x"), drain(s.iterator()));
    }

    @Test
    void ascending_adds_stay_balanced() {
        AVLTreeSet<Integer> s = new AVLTreeSet<>();
        for (int i = 1; i <= 1023; i++) s.add(i);
        assertEquals(1023, s.size());
        assertEquals(10, s.height());
    }

    @Test
    void iteratorFrom_and_comparator() {
        AVLTreeSet<Integer> s = new AVLTreeSet<>(Comparator.reverseOrder());
        for (int i = 0; i < 10; i++) s.add(i);

        assertEquals(9, s.first());
        assertEquals(0, s.last());
        // "from" follows the set's own order, here descending
        assertEquals(List.of(4, 3, 2, 1, 0), drain(s.iteratorFrom(4)));
    }

    @Test
    void clear_and_reuse() {
        AVLTreeSet<Integer> s = new AVLTreeSet<>();
        for (int i = 0; i < 50; i++) s.add(i);
        s.clear();
        assertTrue(s.isEmpty());
        assertFalse(s.iterator().hasNext());
        assertTrue(s.add(7));
        assertEquals(List.of(7), drain(s.iterator()));
    }

    @Test
    void iterator_fails_fast_after_add() {
        AVLTreeSet<Integer> s = new AVLTreeSet<>();
        s.add(1);
        s.add(2);
        Iterator<Integer> it = s.iterator();
        it.next();
        s.add(3);
        assertThrows(ConcurrentModificationException.class, it::next);
    }
}
