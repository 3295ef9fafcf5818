package com.gridcalc.util;

import com.gridcalc.api.Address;
import com.gridcalc.grid.CellData;
import com.gridcalc.grid.Grid;

import java.util.Collection;
import java.util.SortedSet;
import java.util.TreeSet;
import java.util.stream.Collectors;

/**
 * Diagnostic dumps of a grid's cells and dependency edges.
 *
 * <p>
 * Intended for debugging sessions and error logs. Allocates freely.
 */
public final class GridExplain {
    private final Grid grid;

    public GridExplain(Grid grid) {
        this.grid = grid;
    }

    /** Contents, error and edges of a single cell. */
    public String explainCell(Address a) {
        CellData cell = grid.getCell(a);
        StringBuilder sb = new StringBuilder(256);
        sb.append("Cell: ").append(a).append('\n')
                .append("  Input: ").append(cell.rawInput().orElse("<empty>")).append('\n')
                .append("  Value: ").append(cell.value()).append('\n')
                .append("  Display: ").append(cell.displayValue()).append('\n');
        cell.lastError().ifPresent(e -> sb.append("  Error: ").append(e.kind())
                .append(e.reason() != null ? "/" + e.reason() : "")
                .append(" ").append(e.message()).append('\n'));
        sb.append("  Precedents (").append(grid.precedentsOf(a).size()).append("): ")
                .append(join(grid.precedentsOf(a))).append('\n');
        sb.append("  Dependents (").append(grid.dependentsOf(a).size()).append("): ")
                .append(join(grid.dependentsOf(a))).append('\n');
        return sb.toString();
    }

    public String explainLastRecalc() {
        return "Epoch: " + grid.epoch() + ", Recalculated: " + grid.lastRecalculatedCount() + "/" + grid.addresses().size();
    }

    /** One line per populated cell: address, input and the cells that read it. */
    public String dumpDependencies() {
        SortedSet<Address> cells = grid.addresses();
        StringBuilder sb = new StringBuilder(1024);
        sb.append("Grid (").append(cells.size()).append(" cells):\n");
        for (Address a : cells) {
            sb.append("  ").append(a).append(' ').append(grid.getCell(a).rawInput().orElse(""));
            SortedSet<Address> deps = grid.dependentsOf(a);
            if (!deps.isEmpty())
                sb.append(" -> ").append(join(deps));
            sb.append('\n');
        }
        return sb.toString();
    }

    /**
     * Mermaid flowchart of every cell that takes part in a dependency edge,
     * with edges pointing from precedent to dependent.
     */
    public String toMermaid() {
        SortedSet<Address> nodes = new TreeSet<>();
        for (Address a : grid.addresses()) {
            if (!grid.precedentsOf(a).isEmpty() || !grid.dependentsOf(a).isEmpty()) {
                nodes.add(a);
                nodes.addAll(grid.precedentsOf(a));
            }
        }

        StringBuilder sb = new StringBuilder(1024);
        sb.append("graph TD;\n");
        for (Address a : nodes) {
            sb.append("  ").append(sanitize(a)).append("[\"").append(a).append(": ")
                    .append(escape(grid.display(a))).append("\"];\n");
        }
        for (Address a : nodes)
            for (Address d : grid.dependentsOf(a))
                sb.append("  ").append(sanitize(a)).append(" --> ").append(sanitize(d)).append(";\n");
        return sb.toString();
    }

    private static String join(Collection<Address> addresses) {
        return addresses.stream().map(Address::toA1).collect(Collectors.joining(", "));
    }

    private static String sanitize(Address a) {
        return a.toA1().replaceAll("[^a-zA-Z0-9_]", "_");
    }

    private static String escape(String s) {
        return s.replace("\"", "#quot;");
    }
}
