package com.gridcalc.engine;

import com.gridcalc.api.Address;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.PriorityQueue;
import java.util.SortedSet;
import java.util.TreeSet;

import lombok.extern.log4j.Log4j2;

/**
 * Recalculation schedule for a set of cells.
 *
 * Every cell appears after all of its precedents that are in the same set.
 * Among cells that are ready at the same time the smallest address (row-major)
 * goes first, so the schedule is reproducible for a given graph state.
 */
@Log4j2
public final class TopologicalOrder {
    private final List<Address> order;
    private final Map<Address, Integer> position;
    private final SortedSet<Address> unresolved;

    private TopologicalOrder(List<Address> order, SortedSet<Address> unresolved) {
        this.order = Collections.unmodifiableList(order);
        this.unresolved = Collections.unmodifiableSortedSet(unresolved);
        this.position = new HashMap<>(order.size() * 2);
        for (int i = 0; i < order.size(); i++)
            position.put(order.get(i), i);
    }

    /** Schedules {@code cells} using the edges of {@code graph} that stay inside the set. */
    public static TopologicalOrder of(Collection<Address> cells, DependencyGraph graph) {
        return from(cells, graph).build();
    }

    /** Like {@link #of}, but leaves cells on or behind a cycle in {@link #unresolved()}. */
    public static TopologicalOrder ofAllowingCycles(Collection<Address> cells, DependencyGraph graph) {
        return from(cells, graph).buildAllowingCycles();
    }

    private static Builder from(Collection<Address> cells, DependencyGraph graph) {
        Builder b = builder();
        for (Address a : cells)
            b.addCell(a);
        for (Address a : cells)
            for (Address p : graph.precedentsOf(a))
                if (b.contains(p) && !p.equals(a))
                    b.addEdge(p, a);
        return b;
    }

    public int size() {
        return order.size();
    }

    public Address cell(int i) {
        return order.get(i);
    }

    public List<Address> order() {
        return order;
    }

    /** Index of the cell in the schedule, or -1. */
    public int positionOf(Address a) {
        Integer i = position.get(a);
        return i == null ? -1 : i;
    }

    /** Cells that could not be scheduled because they sit on or behind a cycle. */
    public SortedSet<Address> unresolved() {
        return unresolved;
    }

    public boolean isComplete() {
        return unresolved.isEmpty();
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Collects cells and precedent-to-dependent edges, then sorts them with
     * Kahn's algorithm.
     */
    public static final class Builder {
        private final Map<Address, List<Address>> forwardEdges = new HashMap<>();
        private final Map<Address, Integer> inDegree = new HashMap<>();

        public Builder addCell(Address a) {
            if (forwardEdges.putIfAbsent(a, new ArrayList<>()) == null)
                inDegree.put(a, 0);
            return this;
        }

        /** {@code from} must be computed before {@code to}. */
        public Builder addEdge(Address from, Address to) {
            if (from.equals(to))
                throw new IllegalArgumentException("Self-edge not allowed: " + from);
            requireCell(to);
            List<Address> out = forwardEdges.get(requireCell(from));
            if (!out.contains(to)) {
                out.add(to);
                inDegree.merge(to, 1, Integer::sum);
            }
            return this;
        }

        public boolean contains(Address a) {
            return forwardEdges.containsKey(a);
        }

        private Address requireCell(Address a) {
            if (!forwardEdges.containsKey(a))
                throw new IllegalArgumentException("Unknown cell: " + a);
            return a;
        }

        /**
         * @throws IllegalStateException if the edges contain a cycle
         */
        public TopologicalOrder build() {
            TopologicalOrder t = buildAllowingCycles();
            if (!t.isComplete())
                throw new IllegalStateException("Cycle detected! Processed " + t.size() + " of "
                        + (t.size() + t.unresolved().size()));
            return t;
        }

        public TopologicalOrder buildAllowingCycles() {
            Map<Address, Integer> remaining = new HashMap<>(inDegree);
            PriorityQueue<Address> ready = new PriorityQueue<>();
            remaining.forEach((a, d) -> {
                if (d == 0)
                    ready.add(a);
            });

            List<Address> order = new ArrayList<>(remaining.size());
            while (!ready.isEmpty()) {
                Address cur = ready.poll();
                order.add(cur);
                for (Address next : forwardEdges.get(cur))
                    if (remaining.merge(next, -1, Integer::sum) == 0)
                        ready.add(next);
            }

            SortedSet<Address> unresolved = new TreeSet<>();
            if (order.size() != remaining.size()) {
                remaining.forEach((a, d) -> {
                    if (d > 0)
                        unresolved.add(a);
                });
                log.debug("{} of {} cells left unscheduled by a cycle", unresolved.size(), remaining.size());
            }
            return new TopologicalOrder(order, unresolved);
        }
    }
}
