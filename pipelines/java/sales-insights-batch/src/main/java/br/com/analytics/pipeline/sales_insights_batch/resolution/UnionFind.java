package br.com.analytics.pipeline.sales_insights_batch.resolution;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.SortedSet;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * Disjoint sets over comparable elements, with path compression and union
 * by rank. The resulting partition depends only on which pairs were united,
 * never on the order of {@link #add} or {@link #union} calls.
 */
public class UnionFind<T extends Comparable<? super T>> {

    private final Map<T, T> parent = new HashMap<>();
    private final Map<T, Integer> rank = new HashMap<>();

    public void add(T element) {
        if (!parent.containsKey(element)) {
            parent.put(element, element);
            rank.put(element, 0);
        }
    }

    public void addAll(Collection<? extends T> elements) {
        elements.forEach(this::add);
    }

    public T find(T element) {
        if (!parent.containsKey(element)) {
            throw new IllegalArgumentException("Unknown element " + element);
        }
        T root = element;
        while (!parent.get(root).equals(root)) {
            root = parent.get(root);
        }
        T current = element;
        while (!current.equals(root)) {
            T next = parent.get(current);
            parent.put(current, root);
            current = next;
        }
        return root;
    }

    /**
     * @return true when the two elements were in different sets before the call
     */
    public boolean union(T left, T right) {
        T leftRoot = find(left);
        T rightRoot = find(right);
        if (leftRoot.equals(rightRoot)) {
            return false;
        }
        int leftRank = rank.get(leftRoot);
        int rightRank = rank.get(rightRoot);
        if (leftRank < rightRank) {
            parent.put(leftRoot, rightRoot);
        } else if (leftRank > rightRank) {
            parent.put(rightRoot, leftRoot);
        } else {
            parent.put(rightRoot, leftRoot);
            rank.put(leftRoot, leftRank + 1);
        }
        return true;
    }

    public int size() {
        return parent.size();
    }

    /**
     * All sets, each sorted, ordered by their smallest element.
     */
    public List<SortedSet<T>> partitions() {
        Map<T, SortedSet<T>> byRoot = new HashMap<>();
        for (T element : parent.keySet()) {
            byRoot.computeIfAbsent(find(element), root -> new TreeSet<>()).add(element);
        }
        Map<T, SortedSet<T>> byFirst = new TreeMap<>(Comparator.naturalOrder());
        byRoot.values().forEach(set -> byFirst.put(set.first(), set));
        return new ArrayList<>(byFirst.values());
    }
}
