package com.gridcalc.expr;

import com.gridcalc.api.Address;
import org.junit.Test;

import static org.junit.Assert.*;

public class ReferenceShifterTest {

    @Test
    public void testShiftColumns() {
        assertEquals("=SUM(C4:C6)", ReferenceShifter.shiftFormula("=SUM(B4:B6)", 0, 1));
    }

    @Test
    public void testShiftRows() {
        assertEquals("=A2+B2", ReferenceShifter.shiftFormula("=A1+B1", 1, 0));
        assertEquals("=A1*2", ReferenceShifter.shiftFormula("=A3*2", -2, 0));
    }

    @Test
    public void testShiftClampsAtOrigin() {
        assertEquals("=A1+A1", ReferenceShifter.shiftFormula("=B2+A1", -1, -1));
    }

    @Test
    public void testLiteralsAndBrokenFormulasAreUnchanged() {
        assertEquals("hello", ReferenceShifter.shiftFormula("hello", 3, 3));
        assertEquals("=1+", ReferenceShifter.shiftFormula("=1+", 3, 3));
        assertNull(ReferenceShifter.shiftFormula(null, 1, 1));
    }

    @Test
    public void testShiftTree() throws ParseException {
        Expr shifted = ReferenceShifter.shift(Parser.parse("LEN(A1)"), 2, 2);
        assertEquals(Address.parse("C3"), ReferenceCollector.collect(shifted).first());
    }
}
