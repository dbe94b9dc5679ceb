package com.example.demo.formulaengine.util;

/**
 * Conversion between spreadsheet column letters and 1-based column indexes.
 * A = 1, Z = 26, AA = 27, XFD = 16384.
 */
public final class ColumnLetters {

    /** Largest column index a workbook can hold (XFD). */
    public static final int MAX_COLUMN = 16384;

    /** Largest row number a workbook can hold. */
    public static final int MAX_ROW = 1048576;

    private ColumnLetters() {
    }

    /**
     * Convert letters such as "AB" (case-insensitive, '$' ignored) to a 1-based index.
     *
     * @throws IllegalArgumentException if the text is empty or contains non-letters
     */
    public static int toIndex(String letters) {
        if (letters == null) {
            throw new IllegalArgumentException("Column letters must not be null");
        }
        String clean = letters.replace("$", "");
        if (clean.isEmpty()) {
            throw new IllegalArgumentException("Column letters must not be empty");
        }
        int index = 0;
        for (int i = 0; i < clean.length(); i++) {
            char ch = Character.toUpperCase(clean.charAt(i));
            if (ch < 'A' || ch > 'Z') {
                throw new IllegalArgumentException("Invalid column letters: " + letters);
            }
            index = index * 26 + (ch - 'A' + 1);
        }
        return index;
    }

    /**
     * Convert a 1-based index to column letters.
     *
     * @throws IllegalArgumentException if the index is below 1
     */
    public static String toLetters(int index) {
        if (index < 1) {
            throw new IllegalArgumentException("Column index must be >= 1, got " + index);
        }
        StringBuilder sb = new StringBuilder();
        int n = index;
        while (n > 0) {
            int rem = (n - 1) % 26;
            sb.append((char) ('A' + rem));
            n = (n - 1) / 26;
        }
        return sb.reverse().toString();
    }

    public static boolean isValidColumn(int index) {
        return index >= 1 && index <= MAX_COLUMN;
    }

    public static boolean isValidRow(int row) {
        return row >= 1 && row <= MAX_ROW;
    }
}
