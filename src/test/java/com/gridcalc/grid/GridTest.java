package com.gridcalc.grid;

import com.gridcalc.api.Address;
import com.gridcalc.api.EditException;
import com.gridcalc.api.ErrorKind;
import com.gridcalc.api.EvaluationError;
import com.gridcalc.api.EvaluationException;
import com.gridcalc.api.RecalcListener;
import com.gridcalc.api.Value;
import com.gridcalc.engine.CircularReferenceException;
import com.gridcalc.expr.ParseException;
import com.gridcalc.fn.FunctionRegistry;
import org.junit.Before;
import org.junit.Test;

import java.io.IOException;
import java.util.List;
import java.util.Optional;
import java.util.Set;

import static org.junit.Assert.*;

public class GridTest {
    private Grid grid;

    @Before
    public void setUp() {
        grid = new Grid(GridConfig.defaults(), FunctionRegistry.builtIns(url -> "42"));
    }

    @Test
    public void testLiterals() throws EditException {
        grid.setCell("A1", "42");
        grid.setCell("A2", "hello");
        grid.setCell("A3", " 7 ");
        assertEquals(Value.number(42), grid.value("A1"));
        assertEquals("42", grid.display("A1"));
        assertEquals(Value.text("hello"), grid.value("A2"));
        assertEquals(Value.number(7), grid.value("A3"));
        assertEquals(Optional.of(" 7 "), grid.getCell("A3").rawInput());
        assertFalse(grid.getCell("A1").isFormula());
    }

    @Test
    public void testNeverWrittenCell() {
        assertEquals(CellData.EMPTY, grid.getCell("Z99"));
        assertEquals("", grid.display("Z99"));
        assertTrue(grid.addresses().isEmpty());
    }

    @Test
    public void testFormulaFollowsPrecedent() throws EditException {
        grid.setCell("A1", "5");
        grid.setCell("B1", "=A1*2");
        assertEquals(Value.number(10), grid.value("B1"));
        grid.setCell("A1", "6");
        assertEquals(Value.number(12), grid.value("B1"));
        assertEquals(Set.of(Address.parse("A1")), grid.precedentsOf(Address.parse("B1")));
        assertEquals(Set.of(Address.parse("B1")), grid.dependentsOf(Address.parse("A1")));
    }

    @Test
    public void testDiamondInAnyEditOrder() throws EditException {
        grid.setCell("D1", "=B1+C1");
        grid.setCell("C1", "=A1+1");
        grid.setCell("B1", "=A1+1");
        grid.setCell("A1", "1");
        assertEquals(Value.number(4), grid.value("D1"));

        Grid other = new Grid(GridConfig.defaults(), grid.registry());
        other.setCell("A1", "1");
        other.setCell("B1", "=A1+1");
        other.setCell("C1", "=A1+1");
        other.setCell("D1", "=B1+C1");
        assertEquals(Value.number(4), other.value("D1"));
    }

    @Test
    public void testCycleIsRejectedAndNothingChanges() throws EditException {
        grid.setCell("A1", "=B1+1");
        assertEquals(Value.number(1), grid.value("A1"));
        try {
            grid.setCell("B1", "=A1+1");
            fail("Expected CircularReferenceException");
        } catch (CircularReferenceException e) {
            assertEquals(ErrorKind.CIRCULAR_REFERENCE, e.kind());
            assertEquals(Address.parse("B1"), e.address());
            assertEquals("Circular reference: B1 -> A1 -> B1", e.getMessage());
        }
        assertEquals(CellData.EMPTY, grid.getCell("B1"));
        assertTrue(grid.precedentsOf(Address.parse("B1")).isEmpty());
        assertEquals(Set.of(Address.parse("A1")), grid.dependentsOf(Address.parse("B1")));
        assertEquals(Value.number(1), grid.value("A1"));
    }

    @Test
    public void testCycleKeepsPreviousContents() throws EditException {
        grid.setCell("B1", "5");
        grid.setCell("A1", "=B1+1");
        try {
            grid.setCell("B1", "=A1");
            fail("Expected CircularReferenceException");
        } catch (CircularReferenceException expected) {
            // rejected
        }
        assertEquals(Optional.of("5"), grid.getCell("B1").rawInput());
        assertEquals(Value.number(6), grid.value("A1"));
    }

    @Test
    public void testSelfReference() {
        try {
            grid.setCell("A1", "=A1+1");
            fail("Expected CircularReferenceException");
        } catch (EditException e) {
            assertTrue(e instanceof CircularReferenceException);
            assertEquals(List.of(Address.parse("A1")), ((CircularReferenceException) e).cycle());
        }
        assertFalse(grid.addresses().contains(Address.parse("A1")));
    }

    @Test
    public void testRangeCycle() {
        try {
            grid.setCell("A3", "=SUM(A1:A5)");
            fail("Expected CircularReferenceException");
        } catch (EditException e) {
            assertEquals(ErrorKind.CIRCULAR_REFERENCE, e.kind());
        }
    }

    @Test
    public void testQuoteEscaping() throws EditException {
        grid.setCell("A1", "=\"Quote\"\"Test\"");
        assertEquals("Quote\"Test", grid.display("A1"));
    }

    @Test
    public void testFind() throws EditException {
        grid.setCell("A1", "=FIND(\"lo\",\"Hello\")");
        assertEquals(Value.number(3), grid.value("A1"));
        grid.setCell("A2", "=FIND(\"xyz\",\"Hello\")");
        assertEquals("#ERROR", grid.display("A2"));
        assertEquals(ErrorKind.EVALUATION, grid.getCell("A2").lastError().get().kind());
        assertEquals(EvaluationError.INDEX_OUT_OF_RANGE, grid.getCell("A2").lastError().get().reason());
    }

    @Test
    public void testEmptyCellCoercion() throws EditException {
        grid.setCell("B1", "=A1+1");
        grid.setCell("C1", "=A1&\"x\"");
        assertEquals(Value.number(1), grid.value("B1"));
        assertEquals(Value.text("x"), grid.value("C1"));
    }

    @Test
    public void testErrorsPropagateAsSentinelAndRecover() throws EditException {
        grid.setCell("A1", "=1/0");
        grid.setCell("B1", "=A1&\"!\"");
        grid.setCell("C1", "=LEN(A1)");
        assertTrue(grid.getCell("A1").hasError());
        assertEquals(EvaluationError.DIVISION_BY_ZERO, grid.getCell("A1").lastError().get().reason());
        assertEquals("#ERROR!", grid.display("B1"));
        assertFalse(grid.getCell("B1").hasError());
        assertEquals(Value.number(6), grid.value("C1"));

        grid.setCell("A1", "2");
        assertFalse(grid.getCell("A1").hasError());
        assertEquals("2!", grid.display("B1"));
        assertEquals(Value.number(1), grid.value("C1"));
    }

    @Test
    public void testParseErrorLeavesCellAlone() throws EditException {
        grid.setCell("A1", "=B1");
        try {
            grid.setCell("A1", "=C1+");
            fail("Expected ParseException");
        } catch (ParseException e) {
            assertEquals(ErrorKind.PARSE, e.kind());
            assertEquals(4, e.position());
        }
        assertEquals(Optional.of("=B1"), grid.getCell("A1").rawInput());
        assertEquals(Set.of(Address.parse("B1")), grid.precedentsOf(Address.parse("A1")));
    }

    @Test
    public void testOutOfBounds() {
        try {
            grid.setCell(new Address(100, 0), "1");
            fail("Expected ReferenceException");
        } catch (EditException e) {
            assertEquals(ErrorKind.REFERENCE, e.kind());
            assertEquals(new Address(100, 0), ((ReferenceException) e).address());
        }
        try {
            grid.setCell("A1", "=A101");
            fail("Expected ReferenceException");
        } catch (EditException e) {
            assertTrue(e instanceof ReferenceException);
        }
        try {
            grid.setCell("A1", "=SUM(Y1:AA1)");
            fail("Expected ReferenceException");
        } catch (EditException e) {
            assertEquals(Address.parse("AA1"), ((ReferenceException) e).address());
        }
        assertTrue(grid.addresses().isEmpty());
    }

    @Test
    public void testHugeRangeIsRejectedBeforeExpansion() throws EditException {
        grid.setCell("A1", "1");
        grid.setCell("C1", "=A1+1");
        try {
            grid.setCell("B1", "=SUM(A1:ZZZ10000000)");
            fail("Expected ReferenceException");
        } catch (EditException e) {
            assertEquals(ErrorKind.REFERENCE, e.kind());
            assertEquals(Address.parse("ZZZ10000000"), ((ReferenceException) e).address());
        }
        try {
            grid.setCell("B2", "=SUM(A1:A2000000000)");
            fail("Expected ReferenceException");
        } catch (EditException e) {
            assertEquals(Address.parse("A2000000000"), ((ReferenceException) e).address());
        }
        assertEquals(Set.of(Address.parse("A1"), Address.parse("C1")), grid.addresses());
        assertTrue(grid.precedentsOf(Address.parse("B1")).isEmpty());
        assertEquals(Set.of(Address.parse("C1")), grid.dependentsOf(Address.parse("A1")));
    }

    @Test
    public void testExtremeRoundPlacesStayLocal() throws EditException {
        grid.setCell("A1", "1");
        grid.setCell("C1", "=B1+A1");
        grid.setCell("B1", "=ROUND(1.5,-3000000000)");
        assertEquals(Value.number(0), grid.value("B1"));
        assertFalse(grid.getCell("B1").lastError().isPresent());
        assertEquals(Value.number(1), grid.value("C1"));

        grid.setCell("B1", "=ROUND(1.25,1000000000)");
        assertEquals(Value.number(1.25), grid.value("B1"));
        assertEquals(Value.number(2.25), grid.value("C1"));
    }

    @Test
    public void testEditIsRolledBackWhenRecalculationThrows() throws EditException {
        grid.setCell("A1", "1");
        grid.setCell("C1", "=B1+A1");
        CellData c1 = grid.getCell("C1");
        grid.addListener(new RecalcListener() {
            @Override
            public void onRecalcStart(long epoch, int cells) {
            }

            @Override
            public void onCellEvaluated(long epoch, int order, Address address, boolean changed) {
                if (address.equals(Address.parse("C1")))
                    throw new IllegalStateException("listener failed");
            }

            @Override
            public void onCellError(long epoch, int order, Address address, EvaluationException error) {
            }

            @Override
            public void onRecalcEnd(long epoch, int cellsEvaluated) {
            }
        });

        try {
            grid.setCell("B1", "=A1*10");
            fail("Expected IllegalStateException");
        } catch (IllegalStateException e) {
            assertEquals("listener failed", e.getMessage());
        }
        assertFalse(grid.addresses().contains(Address.parse("B1")));
        assertTrue(grid.precedentsOf(Address.parse("B1")).isEmpty());
        assertEquals(Set.of(Address.parse("C1")), grid.dependentsOf(Address.parse("A1")));
        assertEquals(c1, grid.getCell("C1"));
        assertEquals(Value.number(1), grid.value("C1"));
    }

    @Test(expected = ReferenceException.class)
    public void testMalformedAddress() throws EditException {
        grid.setCell("ZZ", "1");
    }

    @Test
    public void testClearCell() throws EditException {
        grid.setCell("A1", "5");
        grid.setCell("B1", "=A1*2");
        grid.clearCell(Address.parse("A1"));
        assertEquals(Value.number(0), grid.value("B1"));
        assertEquals(Optional.of(""), grid.getCell("A1").rawInput());
        assertEquals(Value.EMPTY, grid.value("A1"));

        grid.clearCell(Address.parse("B1"));
        assertTrue(grid.dependentsOf(Address.parse("A1")).isEmpty());
    }

    @Test(expected = IllegalArgumentException.class)
    public void testClearOutOfBounds() {
        grid.clearCell(new Address(0, 26));
    }

    @Test
    public void testOnlyAffectedCellsRecalculate() throws EditException {
        grid.setCell("A1", "1");
        grid.setCell("B1", "=A1+1");
        grid.setCell("C1", "=B1+1");
        grid.setCell("D1", "=2+3");
        grid.setCell("A1", "2");
        assertEquals(2, grid.lastRecalculatedCount());
        assertEquals(Value.number(4), grid.value("C1"));
        grid.setCell("C1", "=B1*10");
        assertEquals(1, grid.lastRecalculatedCount());
    }

    @Test
    public void testRecalculationIsDeterministic() throws EditException {
        grid.setCell("A1", "3");
        grid.setCell("A2", "=A1*A1");
        grid.setCell("A3", "=SUM(A1:A2)&\"/\"&AVERAGE(A1:A2)");
        String first = grid.display("A3");
        grid.setCell("A1", "3");
        assertEquals(first, grid.display("A3"));
        assertEquals("12/6", first);
    }

    @Test
    public void testGetUsesRegistryFetcher() throws EditException {
        grid.setCell("A1", "=GET(\"http://rates\")*2");
        assertEquals(Value.number(84), grid.value("A1"));

        Grid offline = new Grid(GridConfig.defaults(), FunctionRegistry.builtIns(url -> {
            throw new IOException("offline");
        }));
        offline.setCell("A1", "=GET(\"http://rates\")");
        assertEquals("#ERROR", offline.display("A1"));
        assertEquals(EvaluationError.NETWORK, offline.getCell("A1").lastError().get().reason());
    }

    @Test
    public void testDepthLimitFromConfig() throws EditException {
        Grid shallow = new Grid(GridConfig.builder().maxEvalDepth(2).build(), grid.registry());
        shallow.setCell("A1", "=1+1");
        shallow.setCell("A2", "=(1+1)+1");
        assertEquals(Value.number(2), shallow.value("A1"));
        assertEquals(EvaluationError.DEPTH_EXCEEDED, shallow.getCell("A2").lastError().get().reason());
    }

    @Test
    public void testSnapshotAndRestore() throws EditException {
        grid.setCell("A1", "1");
        grid.setCell("B1", "=A1+1");
        grid.setCell("C1", "=B1*100");
        CellSnapshot snap = grid.snapshot(Address.parse("B1"));

        grid.setCell("B1", "=A1*10");
        assertEquals(Value.number(1000), grid.value("C1"));

        grid.restore(snap);
        assertEquals(Optional.of("=A1+1"), grid.getCell("B1").rawInput());
        assertEquals(Value.number(2), grid.value("B1"));
        assertEquals(Value.number(200), grid.value("C1"));
        assertEquals(Set.of(Address.parse("A1")), grid.precedentsOf(Address.parse("B1")));
    }

    @Test
    public void testRestoreOfNeverWrittenCellResetsIt() throws EditException {
        grid.setCell("A1", "1");
        CellSnapshot snap = grid.snapshot(Address.parse("C1"));
        assertFalse(snap.existed());
        grid.setCell("C1", "=A1");
        grid.restore(snap);
        assertTrue(grid.addresses().contains(Address.parse("C1")));
        assertEquals(CellData.EMPTY, grid.getCell("C1"));
        assertTrue(grid.dependentsOf(Address.parse("A1")).isEmpty());
    }

    @Test
    public void testRestoreThatWouldCloseCycle() throws EditException {
        grid.setCell("A1", "1");
        grid.setCell("B1", "=A1+1");
        CellSnapshot snap = grid.snapshot(Address.parse("B1"));
        grid.setCell("B1", "7");
        grid.setCell("A1", "=B1");
        try {
            grid.restore(snap);
            fail("Expected CircularReferenceException");
        } catch (CircularReferenceException expected) {
            // rejected
        }
        assertEquals(Value.number(7), grid.value("B1"));
        assertTrue(grid.precedentsOf(Address.parse("B1")).isEmpty());
    }

    @Test
    public void testShiftFormula() {
        assertEquals("=SUM(C4:C6)", grid.shiftFormula("=SUM(B4:B6)", 0, 1));
    }

    @Test
    public void testColumnsGrowToFitContent() throws EditException {
        assertEquals(8, grid.columnWidth(0));
        grid.setCell("A1", "short");
        assertEquals(8, grid.columnWidth(0));
        grid.setCell("A2", "a long piece of text here");
        assertEquals(25, grid.columnWidth(0));
        grid.setCell("A3", "x".repeat(80));
        assertEquals(Grid.MAX_AUTO_WIDTH, grid.columnWidth(0));
        // never narrows
        grid.clearCell(Address.parse("A3"));
        assertEquals(Grid.MAX_AUTO_WIDTH, grid.columnWidth(0));
    }

    @Test
    public void testFormulaTextCountsTowardWidth() throws EditException {
        grid.setCell("B1", "=LEN(\"abcdefghijkl\")");
        assertEquals(20, grid.columnWidth(1));
    }

    @Test
    public void testExplicitWidths() {
        grid.setColumnWidth(2, 20);
        assertEquals(20, grid.columnWidth(2));
        assertEquals(Integer.valueOf(20), grid.columnWidths().get(2));
        grid.setDefaultColumnWidth(12);
        assertEquals(12, grid.columnWidth(3));
        assertEquals(20, grid.columnWidth(2));
    }

    @Test
    public void testAutoResizeAllColumns() throws EditException {
        grid.setDefaultColumnWidth(2);
        grid.setColumnWidth(0, 2);
        grid.load(Address.parse("A1"), "twelve chars", null);
        grid.autoResizeAllColumns();
        assertEquals(12, grid.columnWidth(0));
        assertEquals(Grid.MIN_AUTO_WIDTH, grid.columnWidth(1));
    }

    @Test(expected = IllegalArgumentException.class)
    public void testNonPositiveWidth() {
        grid.setColumnWidth(0, 0);
    }

    @Test(expected = IllegalArgumentException.class)
    public void testEmptyGridIsRejected() {
        new Grid(GridConfig.builder().rows(0).build(), grid.registry());
    }
}
