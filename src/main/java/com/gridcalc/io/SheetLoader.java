package com.gridcalc.io;

import com.gridcalc.api.Address;
import com.gridcalc.fn.FunctionRegistry;
import com.gridcalc.grid.CellData;
import com.gridcalc.grid.Grid;
import com.gridcalc.grid.GridConfig;

import java.util.List;
import java.util.Map;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Moves sheets between {@link SheetDocument} and a live {@link Grid}.
 *
 * Loading stores the raw (value, formula) pairs, then rebuilds the dependency
 * graph and recalculates everything.
 */
public final class SheetLoader {
    private static final Logger log = LogManager.getLogger(SheetLoader.class);

    private SheetLoader() {
    }

    public static Grid load(SheetDocument doc, FunctionRegistry registry) {
        return load(doc, GridConfig.defaults(), registry);
    }

    /**
     * Builds a grid from a document. Dimensions and the default column width
     * come from the document; other settings from {@code base}. Cells outside
     * the declared bounds are skipped.
     */
    public static Grid load(SheetDocument doc, GridConfig base, FunctionRegistry registry) {
        GridConfig config = base.toBuilder()
                .rows(doc.getRows())
                .cols(doc.getCols())
                .defaultColumnWidth(doc.getDefaultColumnWidth() > 0 ? doc.getDefaultColumnWidth() : base.getDefaultColumnWidth())
                .build();
        Grid grid = new Grid(config, registry);

        int skipped = 0;
        for (SheetDocument.CellEntry e : nullToEmpty(doc.getCells())) {
            if (e.getRow() < 0 || e.getCol() < 0 || e.getRow() >= config.getRows() || e.getCol() >= config.getCols()) {
                skipped++;
                continue;
            }
            SheetDocument.CellContent content = e.getContent();
            if (content == null)
                continue;
            grid.load(Address.of(e.getRow(), e.getCol()), content.getValue(), content.getFormula());
        }
        if (skipped > 0)
            log.warn("Skipped {} cells outside the {}x{} grid", skipped, config.getRows(), config.getCols());

        if (doc.getColumnWidths() != null)
            for (Map.Entry<Integer, Integer> w : doc.getColumnWidths().entrySet())
                if (w.getKey() != null && w.getKey() >= 0 && w.getValue() != null && w.getValue() > 0)
                    grid.setColumnWidth(w.getKey(), w.getValue());

        grid.rebuildDependencies();
        return grid;
    }

    private static <T> List<T> nullToEmpty(List<T> list) {
        return list == null ? List.of() : list;
    }

    /** Writes every populated cell as its display value plus formula text. */
    public static SheetDocument export(Grid grid) {
        SheetDocument doc = new SheetDocument();
        doc.setRows(grid.rows());
        doc.setCols(grid.cols());
        doc.setDefaultColumnWidth(grid.defaultColumnWidth());
        doc.getColumnWidths().putAll(grid.columnWidths());
        for (Address a : grid.addresses()) {
            CellData cell = grid.getCell(a);
            String formula = cell.formulaText();
            String value = formula != null ? cell.displayValue() : cell.rawInput().orElse("");
            doc.getCells().add(new SheetDocument.CellEntry(a.row(), a.col(),
                    new SheetDocument.CellContent(value, formula)));
        }
        return doc;
    }
}
