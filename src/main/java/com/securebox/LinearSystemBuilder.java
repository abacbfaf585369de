package com.securebox;

/**
 * Turns one snapshot of a Y×X box into the system A·x = b, where
 * {@code A[i][j]} is set when toggling flattened cell j flips cell i and
 * {@code b} is the snapshot in row-major order.
 */
public final class LinearSystemBuilder {

    private LinearSystemBuilder() {}

    /** Flattened row-major index of (row, col) in a grid {@code x} wide. */
    public static int index(int row, int col, int x) {
        return row * x + col;
    }

    public static LinearSystem build(int y, int x, boolean[][] snapshot) {
        if (y < 0 || x < 0) {
            throw new IllegalArgumentException("Negative dimensions: " + y + "x" + x);
        }
        if (snapshot.length != y) {
            throw new IllegalArgumentException("Snapshot has " + snapshot.length + " rows, expected " + y);
        }
        final int n = y * x;
        BoolMatrix a = new BoolMatrix(n, n);
        boolean[] b = new boolean[n];

        for (int row = 0; row < y; row++) {
            if (snapshot[row].length != x) {
                throw new IllegalArgumentException("Snapshot row " + row + " has "
                        + snapshot[row].length + " cells, expected " + x);
            }
            for (int col = 0; col < x; col++) {
                int idx = index(row, col, x);
                b[idx] = snapshot[row][col];

                a.set(idx, idx, true);
                for (int i = 0; i < x; i++) a.set(idx, index(row, i, x), true);
                for (int i = 0; i < y; i++) a.set(idx, index(i, col, x), true);
            }
        }
        return new LinearSystem(a, b);
    }

    /** Reads the snapshot exactly once and builds the system for it. */
    public static LinearSystem build(Box box) {
        return build(box.rows(), box.cols(), box.getState());
    }
}
