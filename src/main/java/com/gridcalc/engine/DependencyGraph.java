package com.gridcalc.engine;

import com.gridcalc.api.Address;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.Deque;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.SortedSet;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * Precedent/dependent edges between cells, keyed by {@link Address}.
 *
 * {@code precedents[a]} holds the cells a's formula reads (ranges expanded);
 * {@code dependents} is maintained as its exact inverse. Empty sets are never
 * stored, so an address without edges is simply absent.
 *
 * Not thread-safe. Owned by one grid.
 */
public final class DependencyGraph {
    private final Map<Address, SortedSet<Address>> precedents = new TreeMap<>();
    private final Map<Address, SortedSet<Address>> dependents = new TreeMap<>();

    /** Cells read by {@code a}'s formula. */
    public SortedSet<Address> precedentsOf(Address a) {
        SortedSet<Address> p = precedents.get(a);
        return p == null ? Collections.emptySortedSet() : Collections.unmodifiableSortedSet(p);
    }

    /** Cells whose formulas read {@code a}. */
    public SortedSet<Address> dependentsOf(Address a) {
        SortedSet<Address> d = dependents.get(a);
        return d == null ? Collections.emptySortedSet() : Collections.unmodifiableSortedSet(d);
    }

    /**
     * Replaces the precedent set of {@code a}, updating the inverse edges.
     *
     * @return the previous precedent set (a detached copy), for rollback
     */
    public SortedSet<Address> replacePrecedents(Address a, Collection<Address> newPrecedents) {
        SortedSet<Address> old = precedents.remove(a);
        if (old == null)
            old = new TreeSet<>();
        for (Address p : old) {
            SortedSet<Address> d = dependents.get(p);
            if (d != null) {
                d.remove(a);
                if (d.isEmpty())
                    dependents.remove(p);
            }
        }
        if (!newPrecedents.isEmpty()) {
            SortedSet<Address> copy = new TreeSet<>(newPrecedents);
            precedents.put(a, copy);
            for (Address p : copy)
                dependents.computeIfAbsent(p, k -> new TreeSet<>()).add(a);
        }
        return old;
    }

    /**
     * Looks for a cycle through {@code a} by following dependent edges
     * breadth-first.
     *
     * @return the shortest cycle as a chain starting at {@code a}, where each
     *         element is read by the next one and the last is read by {@code a};
     *         or empty if {@code a} cannot reach itself
     */
    public Optional<List<Address>> findCycle(Address a) {
        Map<Address, Address> parent = new HashMap<>();
        Deque<Address> queue = new ArrayDeque<>();
        queue.add(a);
        while (!queue.isEmpty()) {
            Address cur = queue.poll();
            for (Address next : dependentsOf(cur)) {
                if (next.equals(a)) {
                    List<Address> path = new ArrayList<>();
                    for (Address x = cur; x != null && !x.equals(a); x = parent.get(x))
                        path.add(x);
                    path.add(a);
                    Collections.reverse(path);
                    return Optional.of(path);
                }
                if (!parent.containsKey(next)) {
                    parent.put(next, cur);
                    queue.add(next);
                }
            }
        }
        return Optional.empty();
    }

    /** {@code a} plus all of its transitive dependents. */
    public SortedSet<Address> affectedBy(Address a) {
        return affectedBy(List.of(a));
    }

    /** The roots plus all of their transitive dependents. */
    public SortedSet<Address> affectedBy(Collection<Address> roots) {
        SortedSet<Address> seen = new TreeSet<>(roots);
        Deque<Address> stack = new ArrayDeque<>(roots);
        while (!stack.isEmpty()) {
            for (Address d : dependentsOf(stack.pop()))
                if (seen.add(d))
                    stack.push(d);
        }
        return seen;
    }

    /** Addresses that have a formula with at least one precedent. */
    public Set<Address> formulaCells() {
        return Collections.unmodifiableSet(precedents.keySet());
    }

    public int edgeCount() {
        int n = 0;
        for (SortedSet<Address> p : precedents.values())
            n += p.size();
        return n;
    }

    public void clear() {
        precedents.clear();
        dependents.clear();
    }

    /** True if {@code dependents} is exactly the inverse of {@code precedents}. */
    public boolean isConsistent() {
        Map<Address, SortedSet<Address>> inverse = new TreeMap<>();
        precedents.forEach((a, ps) -> {
            for (Address p : ps)
                inverse.computeIfAbsent(p, k -> new TreeSet<>()).add(a);
        });
        return inverse.equals(dependents);
    }
}
