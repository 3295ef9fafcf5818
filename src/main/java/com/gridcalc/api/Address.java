package com.gridcalc.api;

import java.util.Optional;

/**
 * Zero-based (row, column) identity of a cell.
 *
 * Addresses are plain values: the dependency graph keys every edge by
 * address, never by a reference to a cell object. Ordering is row-major
 * (row first, then column), which is also the tie-break order used when
 * scheduling recalculation.
 *
 * The external A1 notation maps columns to base-26 letters (A..Z, AA..ZZ,
 * AAA..) and rows to 1-based numbers.
 */
public record Address(int row, int col) implements Comparable<Address> {

    public Address {
        if (row < 0 || col < 0)
            throw new IllegalArgumentException("Negative address: row=" + row + ", col=" + col);
    }

    public static Address of(int row, int col) {
        return new Address(row, col);
    }

    /**
     * Parses an A1-style reference (case-insensitive).
     *
     * @throws IllegalArgumentException if the text is not a valid reference
     */
    public static Address parse(String ref) {
        return tryParse(ref).orElseThrow(() -> new IllegalArgumentException("Invalid cell reference: " + ref));
    }

    /** Parses an A1-style reference, or returns empty for malformed input (including row 0). */
    public static Optional<Address> tryParse(String ref) {
        if (ref == null || ref.isEmpty())
            return Optional.empty();
        int i = 0;
        int n = ref.length();
        while (i < n && isAsciiLetter(ref.charAt(i)))
            i++;
        if (i == 0 || i == n)
            return Optional.empty();
        int col = columnIndex(ref.substring(0, i));
        long row = 0;
        for (int j = i; j < n; j++) {
            char c = ref.charAt(j);
            if (c < '0' || c > '9')
                return Optional.empty();
            row = row * 10 + (c - '0');
            if (row > Integer.MAX_VALUE)
                return Optional.empty();
        }
        if (row == 0 || col < 0)
            return Optional.empty();
        return Optional.of(new Address((int) row - 1, col));
    }

    /** Column letters for a zero-based column index: 0 -> A, 25 -> Z, 26 -> AA. */
    public static String columnLabel(int col) {
        if (col < 0)
            throw new IllegalArgumentException("Negative column: " + col);
        StringBuilder sb = new StringBuilder(4);
        int c = col;
        while (true) {
            sb.append((char) ('A' + c % 26));
            if (c < 26)
                break;
            c = c / 26 - 1;
        }
        return sb.reverse().toString();
    }

    /** Zero-based column index for column letters, or -1 if the letters are invalid. */
    public static int columnIndex(String letters) {
        if (letters.isEmpty())
            return -1;
        long result = 0;
        for (int i = 0; i < letters.length(); i++) {
            char c = Character.toUpperCase(letters.charAt(i));
            if (c < 'A' || c > 'Z')
                return -1;
            result = result * 26 + (c - 'A' + 1);
            if (result > Integer.MAX_VALUE)
                return -1;
        }
        return (int) result - 1;
    }

    /** Returns this address moved by the given offsets, clamped at row/column 0. */
    public Address offset(int dRow, int dCol) {
        return new Address(Math.max(0, row + dRow), Math.max(0, col + dCol));
    }

    public String toA1() {
        return columnLabel(col) + (row + 1);
    }

    @Override
    public int compareTo(Address o) {
        int c = Integer.compare(row, o.row);
        return c != 0 ? c : Integer.compare(col, o.col);
    }

    @Override
    public String toString() {
        return toA1();
    }

    private static boolean isAsciiLetter(char c) {
        return (c >= 'A' && c <= 'Z') || (c >= 'a' && c <= 'z');
    }
}
