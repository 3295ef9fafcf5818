package com.gridcalc.grid;

import com.gridcalc.api.Address;
import com.gridcalc.api.CellError;
import com.gridcalc.api.EditException;
import com.gridcalc.api.ErrorKind;
import com.gridcalc.api.RecalcListener;
import com.gridcalc.api.Value;
import com.gridcalc.engine.CellStore;
import com.gridcalc.engine.CircularReferenceException;
import com.gridcalc.engine.DependencyGraph;
import com.gridcalc.engine.Evaluator;
import com.gridcalc.engine.RecalculationEngine;
import com.gridcalc.engine.TopologicalOrder;
import com.gridcalc.expr.Expr;
import com.gridcalc.expr.ParseException;
import com.gridcalc.expr.Parser;
import com.gridcalc.expr.ReferenceCollector;
import com.gridcalc.expr.ReferenceShifter;
import com.gridcalc.fn.FunctionRegistry;
import com.gridcalc.fn.JdkHttpFetcher;
import com.gridcalc.util.CompositeRecalcListener;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.SortedMap;
import java.util.SortedSet;
import java.util.TreeMap;
import java.util.TreeSet;

import lombok.extern.log4j.Log4j2;

/**
 * A bounded sheet of cells with live formulas.
 *
 * <p>
 * {@link #setCell} is the mutation entry point. It parses the input, checks
 * references against the bounds, updates the dependency graph, rejects the
 * edit if it closes a cycle and finally recalculates the edited cell and all
 * of its transitive dependents in topological order. Either the whole edit
 * happens or nothing changes.
 *
 * <p>
 * Cells are stored sparsely and created on first write. Clearing a cell
 * resets it to an empty literal; the entry itself stays.
 *
 * <p>
 * Not thread-safe: one logical session owns a grid. Use
 * {@link com.gridcalc.wiring.EditPublisher} to funnel edits from several
 * threads.
 */
@Log4j2
public final class Grid {
    private final GridConfig config;
    private final Map<Address, CellData> cells = new HashMap<>();
    private final DependencyGraph graph = new DependencyGraph();
    private final Evaluator evaluator;
    private final RecalculationEngine engine;
    private final Store store = new Store();
    private final CompositeRecalcListener listeners = new CompositeRecalcListener();

    private final SortedMap<Integer, Integer> columnWidths = new TreeMap<>();
    private int defaultColumnWidth;

    public Grid() {
        this(GridConfig.defaults());
    }

    public Grid(GridConfig config) {
        this(config, FunctionRegistry.builtIns(new JdkHttpFetcher(config.getHttpTimeout())));
    }

    public Grid(GridConfig config, FunctionRegistry registry) {
        if (config.getRows() <= 0 || config.getCols() <= 0)
            throw new IllegalArgumentException("Grid needs at least one row and column: " + config);
        this.config = config;
        this.evaluator = new Evaluator(registry, config.getMaxEvalDepth());
        this.engine = new RecalculationEngine(evaluator);
        this.engine.setListener(listeners);
        this.defaultColumnWidth = config.getDefaultColumnWidth();
    }

    public GridConfig config() {
        return config;
    }

    public int rows() {
        return config.getRows();
    }

    public int cols() {
        return config.getCols();
    }

    public FunctionRegistry registry() {
        return evaluator.registry();
    }

    /**
     * Registers a listener for every later recalculation pass. Listeners run
     * inline; one that throws aborts the edit, which is then rolled back.
     */
    public void addListener(RecalcListener listener) {
        listeners.add(listener);
    }

    public boolean removeListener(RecalcListener listener) {
        return listeners.remove(listener);
    }

    /** Recalculation passes run so far. */
    public long epoch() {
        return engine.epoch();
    }

    public int lastRecalculatedCount() {
        return engine.lastRecalculatedCount();
    }

    public boolean inBounds(Address a) {
        return a.row() < config.getRows() && a.col() < config.getCols();
    }

    // ── Edits ───────────────────────────────────────────────────────

    /**
     * Sets a cell from raw input. Text starting with {@code =} is a formula,
     * anything else a literal (a number if it reads as one).
     *
     * @throws ParseException              malformed formula
     * @throws ReferenceException          the cell, or a reference in the formula, is out of bounds
     * @throws CircularReferenceException  the formula would close a cycle
     */
    public void setCell(Address a, String raw) throws EditException {
        try {
            applyEdit(a, raw == null ? "" : raw);
        } catch (EditException e) {
            log.debug("Rejected edit {} <- '{}': {}", a, raw, e.getMessage());
            throw e;
        }
    }

    /** {@link #setCell(Address, String)} with an A1-style address. */
    public void setCell(String ref, String raw) throws EditException {
        setCell(resolveRef(ref), raw);
    }

    /** Resets a cell to the empty literal and recalculates its dependents. */
    public void clearCell(Address a) {
        try {
            applyEdit(a, "");
        } catch (EditException e) {
            // an empty literal has no references, so only the bounds check can fail
            throw new IllegalArgumentException(e.getMessage(), e);
        }
    }

    private void applyEdit(Address a, String raw) throws EditException {
        requireInBounds(a);
        Optional<Expr> formula = Parser.parseCellInput(raw);
        SortedSet<Address> precedents = new TreeSet<>();
        if (formula.isPresent()) {
            // corners first, so an out-of-grid range is never expanded
            for (Address p : ReferenceCollector.corners(formula.get()))
                requireInBounds(p);
            precedents = ReferenceCollector.collect(formula.get());
        }

        SortedSet<Address> previous = graph.replacePrecedents(a, precedents);
        Optional<List<Address>> cycle = graph.findCycle(a);
        if (cycle.isPresent()) {
            graph.replacePrecedents(a, previous);
            throw new CircularReferenceException(cycle.get());
        }

        SortedSet<Address> affected = graph.affectedBy(a);
        Map<Address, CellData> before = new HashMap<>();
        for (Address x : affected)
            if (cells.containsKey(x))
                before.put(x, cells.get(x));
        try {
            Value initial = formula.isPresent() ? getCell(a).value() : Value.fromLiteral(raw);
            cells.put(a, new CellData(raw, formula.orElse(null), initial, null));
            recalculate(affected);
        } catch (RuntimeException e) {
            graph.replacePrecedents(a, previous);
            for (Address x : affected) {
                if (before.containsKey(x))
                    cells.put(x, before.get(x));
                else
                    cells.remove(x); // first written by this edit
            }
            log.error("Edit {} <- '{}' failed during recalculation, rolled back", a, raw, e);
            throw e;
        }
        growColumn(a.col(), cells.get(a));
    }

    private void recalculate(SortedSet<Address> affected) {
        TopologicalOrder order = TopologicalOrder.of(affected, graph);
        engine.recalculate(order.order(), store);
    }

    // ── Reads ───────────────────────────────────────────────────────

    /** Contents of a cell; {@link CellData#EMPTY} if it was never written. */
    public CellData getCell(Address a) {
        return cells.getOrDefault(a, CellData.EMPTY);
    }

    public CellData getCell(String ref) {
        return getCell(Address.parse(ref));
    }

    /** Cached value; {@link Value#ERROR} for failed cells. */
    public Value value(Address a) {
        return getCell(a).value();
    }

    public Value value(String ref) {
        return value(Address.parse(ref));
    }

    /** Display text, {@code #ERROR} for failed cells. */
    public String display(Address a) {
        return getCell(a).displayValue();
    }

    public String display(String ref) {
        return display(Address.parse(ref));
    }

    /** Addresses of every cell written so far, row-major. */
    public SortedSet<Address> addresses() {
        return Collections.unmodifiableSortedSet(new TreeSet<>(cells.keySet()));
    }

    public SortedSet<Address> precedentsOf(Address a) {
        return graph.precedentsOf(a);
    }

    public SortedSet<Address> dependentsOf(Address a) {
        return graph.dependentsOf(a);
    }

    // ── Bulk load ───────────────────────────────────────────────────

    /**
     * Stores a persisted cell without touching the dependency graph. Call
     * {@link #rebuildDependencies()} once all cells are loaded and before the
     * next {@link #setCell}.
     *
     * @param value   the persisted display value (the literal text for literal cells)
     * @param formula the formula text, or null for a literal cell
     */
    public void load(Address a, String value, String formula) {
        if (!inBounds(a))
            throw new IllegalArgumentException("Cell " + a + " is outside the grid");
        if (formula == null || !formula.startsWith("=")) {
            cells.put(a, CellData.literal(value == null ? "" : value));
            return;
        }
        try {
            Expr expr = Parser.parseCellInput(formula).orElseThrow();
            cells.put(a, new CellData(formula, expr, Value.fromLiteral(value == null ? "" : value), null));
        } catch (ParseException e) {
            log.warn("Stored formula at {} does not parse: {}", a, e.getMessage());
            cells.put(a, new CellData(formula, null, Value.ERROR, CellError.of(ErrorKind.PARSE, e.getMessage())));
        }
    }

    /**
     * Re-derives every edge from the stored formulas and recalculates the
     * whole sheet.
     *
     * Formulas referencing cells outside the grid get a REFERENCE error.
     * Formulas on a cycle get a CIRCULAR_REFERENCE error and keep no edges, so
     * the graph is acyclic afterwards; cells downstream of them read the error
     * sentinel.
     */
    public void rebuildDependencies() {
        graph.clear();
        List<Address> formulaCells = new ArrayList<>();
        for (Map.Entry<Address, CellData> e : new TreeMap<>(cells).entrySet()) {
            Address a = e.getKey();
            Optional<Expr> formula = e.getValue().formula();
            if (formula.isEmpty())
                continue;
            Optional<Address> outside = ReferenceCollector.corners(formula.get()).stream()
                    .filter(p -> !inBounds(p))
                    .findFirst();
            if (outside.isPresent()) {
                markFailed(a, ErrorKind.REFERENCE,
                        new ReferenceException(outside.get(), rows(), cols()).getMessage());
                continue;
            }
            graph.replacePrecedents(a, ReferenceCollector.collect(formula.get()));
            formulaCells.add(a);
        }

        TopologicalOrder order = TopologicalOrder.ofAllowingCycles(formulaCells, graph);
        int cyclic = 0;
        if (!order.isComplete()) {
            Map<Address, String> onCycle = new TreeMap<>();
            for (Address a : order.unresolved())
                graph.findCycle(a).ifPresent(c -> onCycle.put(a, new CircularReferenceException(c).getMessage()));
            onCycle.forEach(this::onCycleDetected);
            cyclic = onCycle.size();
            order = TopologicalOrder.of(formulaCells, graph);
        }
        engine.recalculate(order.order(), store);
        log.info("Rebuilt dependencies: {} cells, {} formulas, {} edges, {} on cycles",
                cells.size(), formulaCells.size(), graph.edgeCount(), cyclic);
    }

    private void onCycleDetected(Address a, String message) {
        graph.replacePrecedents(a, List.of());
        markFailed(a, ErrorKind.CIRCULAR_REFERENCE, message);
    }

    private void markFailed(Address a, ErrorKind kind, String message) {
        // the formula stays on the cell but is no longer evaluated
        CellData c = getCell(a);
        cells.put(a, new CellData(c.rawInput().orElse(null), null, Value.ERROR, CellError.of(kind, message)));
    }

    // ── Undo hooks ──────────────────────────────────────────────────

    /** Captures a cell and its precedent set verbatim. */
    public CellSnapshot snapshot(Address a) {
        return new CellSnapshot(a, getCell(a), graph.precedentsOf(a), cells.containsKey(a));
    }

    /**
     * Puts a snapshot back verbatim and recalculates the cell's dependents. A
     * cell that did not exist when the snapshot was taken is reset to
     * {@link CellData#EMPTY}; the entry itself stays.
     *
     * @throws CircularReferenceException if the restored edges would close a
     *                                    cycle with edits made since the snapshot
     */
    public void restore(CellSnapshot s) throws EditException {
        Address a = s.address();
        requireInBounds(a);
        SortedSet<Address> previous = graph.replacePrecedents(a, s.precedents());
        Optional<List<Address>> cycle = graph.findCycle(a);
        if (cycle.isPresent()) {
            graph.replacePrecedents(a, previous);
            throw new CircularReferenceException(cycle.get());
        }
        cells.put(a, s.existed() ? s.cell() : CellData.EMPTY);

        SortedSet<Address> affected = graph.affectedBy(a);
        affected.remove(a);
        recalculate(affected);
    }

    // ── Copy / paste ────────────────────────────────────────────────

    /**
     * Moves every reference in a raw formula by the given offsets, clamping
     * at A1. Literals and unparsable formulas come back unchanged.
     */
    public String shiftFormula(String raw, int dRow, int dCol) {
        return ReferenceShifter.shiftFormula(raw, dRow, dCol);
    }

    // ── Column widths ───────────────────────────────────────────────

    public static final int MIN_AUTO_WIDTH = 3;
    public static final int MAX_AUTO_WIDTH = 50;

    public int columnWidth(int col) {
        return columnWidths.getOrDefault(col, defaultColumnWidth);
    }

    public void setColumnWidth(int col, int width) {
        if (width <= 0)
            throw new IllegalArgumentException("Column width must be positive: " + width);
        columnWidths.put(col, width);
    }

    public int defaultColumnWidth() {
        return defaultColumnWidth;
    }

    public void setDefaultColumnWidth(int width) {
        if (width <= 0)
            throw new IllegalArgumentException("Column width must be positive: " + width);
        this.defaultColumnWidth = width;
    }

    /** Explicit width overrides, by column index. */
    public SortedMap<Integer, Integer> columnWidths() {
        return Collections.unmodifiableSortedMap(columnWidths);
    }

    /** Widens a column to fit its widest cell. Never narrows it. */
    public void autoResizeColumn(int col) {
        int needed = Address.columnLabel(col).length();
        for (Map.Entry<Address, CellData> e : cells.entrySet())
            if (e.getKey().col() == col)
                needed = Math.max(needed, contentWidth(e.getValue()));
        widenTo(col, needed);
    }

    public void autoResizeAllColumns() {
        for (int col = 0; col < cols(); col++)
            autoResizeColumn(col);
    }

    private void growColumn(int col, CellData cell) {
        widenTo(col, Math.max(Address.columnLabel(col).length(), contentWidth(cell)));
    }

    private void widenTo(int col, int needed) {
        int width = Math.min(MAX_AUTO_WIDTH, Math.max(MIN_AUTO_WIDTH, needed));
        if (width > columnWidth(col))
            columnWidths.put(col, width);
    }

    private static int contentWidth(CellData cell) {
        String formula = cell.formulaText();
        return Math.max(cell.displayValue().length(), formula == null ? 0 : formula.length());
    }

    // ── Helpers ─────────────────────────────────────────────────────

    private void requireInBounds(Address a) throws ReferenceException {
        if (!inBounds(a))
            throw new ReferenceException(a, rows(), cols());
    }

    private static Address resolveRef(String ref) throws ReferenceException {
        return Address.tryParse(ref).orElseThrow(() -> new ReferenceException(ref));
    }

    /** The grid as seen by the recalculation engine. */
    private final class Store implements CellStore {

        @Override
        public Value resolve(Address address) {
            return getCell(address).value();
        }

        @Override
        public Optional<Expr> formulaAt(Address address) {
            return getCell(address).formula();
        }

        @Override
        public void storeResult(Address address, Value value, CellError error) {
            cells.put(address, getCell(address).withResult(value, error));
        }
    }
}
