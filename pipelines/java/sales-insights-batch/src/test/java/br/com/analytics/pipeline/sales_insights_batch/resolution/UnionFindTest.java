package br.com.analytics.pipeline.sales_insights_batch.resolution;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Set;
import java.util.SortedSet;
import java.util.TreeSet;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("UnionFind Tests")
class UnionFindTest {

    @Test
    @DisplayName("Should start every element as its own set")
    void testPartitions_Singletons() {
        UnionFind<Integer> sets = new UnionFind<>();
        sets.addAll(List.of(3, 1, 2));

        assertEquals(List.of(Set.of(1), Set.of(2), Set.of(3)), sets.partitions());
        assertEquals(3, sets.size());
    }

    @Test
    @DisplayName("Should close unions transitively")
    void testUnion_Transitive() {
        UnionFind<Integer> sets = new UnionFind<>();
        sets.addAll(List.of(1, 2, 3, 4, 5));

        assertTrue(sets.union(1, 2));
        assertTrue(sets.union(4, 2));
        assertFalse(sets.union(1, 4));

        assertEquals(sets.find(1), sets.find(4));
        assertNotEquals(sets.find(1), sets.find(3));
        assertEquals(List.of(new TreeSet<>(Set.of(1, 2, 4)), Set.of(3), Set.of(5)), sets.partitions());
    }

    @Test
    @DisplayName("Should build the same partition whatever the union order")
    void testPartitions_OrderIndependent() {
        UnionFind<String> forward = new UnionFind<>();
        forward.addAll(List.of("a", "b", "c", "d", "e"));
        forward.union("a", "b");
        forward.union("c", "d");
        forward.union("b", "d");

        UnionFind<String> backward = new UnionFind<>();
        backward.addAll(List.of("e", "d", "c", "b", "a"));
        backward.union("d", "b");
        backward.union("d", "c");
        backward.union("b", "a");

        List<SortedSet<String>> expected = List.of(new TreeSet<>(Set.of("a", "b", "c", "d")), new TreeSet<>(Set.of("e")));
        assertEquals(expected, forward.partitions());
        assertEquals(expected, backward.partitions());
    }

    @Test
    @DisplayName("Should reject elements that were never added")
    void testFind_UnknownElement() {
        UnionFind<Integer> sets = new UnionFind<>();
        sets.add(1);
        assertThrows(IllegalArgumentException.class, () -> sets.find(2));
    }
}
