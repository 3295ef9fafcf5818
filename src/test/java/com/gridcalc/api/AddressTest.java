package com.gridcalc.api;

import org.junit.Test;

import static org.junit.Assert.*;

public class AddressTest {

    @Test
    public void testColumnLabels() {
        assertEquals("A", Address.columnLabel(0));
        assertEquals("Z", Address.columnLabel(25));
        assertEquals("AA", Address.columnLabel(26));
        assertEquals("AZ", Address.columnLabel(51));
        assertEquals("ZZ", Address.columnLabel(701));
        assertEquals("AAA", Address.columnLabel(702));
    }

    @Test
    public void testColumnIndex() {
        assertEquals(0, Address.columnIndex("A"));
        assertEquals(26, Address.columnIndex("aa"));
        assertEquals(701, Address.columnIndex("ZZ"));
        assertEquals(-1, Address.columnIndex("A1"));
        assertEquals(-1, Address.columnIndex(""));
    }

    @Test
    public void testLabelAndIndexAgree() {
        for (int col = 0; col < 2000; col++)
            assertEquals(col, Address.columnIndex(Address.columnLabel(col)));
    }

    @Test
    public void testParse() {
        assertEquals(new Address(2, 1), Address.parse("B3"));
        assertEquals(new Address(2, 1), Address.parse("b3"));
        assertEquals(new Address(99, 27), Address.parse("AB100"));
        assertEquals("AB100", Address.parse("ab100").toString());
    }

    @Test
    public void testInvalidReferences() {
        assertTrue(Address.tryParse("A0").isEmpty());
        assertTrue(Address.tryParse("1A").isEmpty());
        assertTrue(Address.tryParse("A").isEmpty());
        assertTrue(Address.tryParse("12").isEmpty());
        assertTrue(Address.tryParse("A1B").isEmpty());
        assertTrue(Address.tryParse("").isEmpty());
        assertTrue(Address.tryParse(null).isEmpty());
        assertTrue(Address.tryParse("A99999999999").isEmpty());
    }

    @Test(expected = IllegalArgumentException.class)
    public void testParseRejectsGarbage() {
        Address.parse("not a cell");
    }

    @Test(expected = IllegalArgumentException.class)
    public void testNegativeCoordinates() {
        new Address(-1, 0);
    }

    @Test
    public void testRowMajorOrdering() {
        assertTrue(Address.parse("F1").compareTo(Address.parse("A2")) < 0);
        assertTrue(Address.parse("A2").compareTo(Address.parse("B2")) < 0);
        assertEquals(0, Address.parse("C3").compareTo(new Address(2, 2)));
    }

    @Test
    public void testOffsetClampsAtOrigin() {
        assertEquals(Address.parse("B3"), Address.parse("A1").offset(2, 1));
        assertEquals(Address.parse("A1"), Address.parse("B2").offset(-5, -5));
    }
}
