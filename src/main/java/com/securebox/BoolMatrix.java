package com.securebox;

import java.io.IOException;
import java.io.Writer;

/**
 * A dense matrix over GF(2).  Rows and columns are indexed from zero;
 * addition is exclusive or, so there is no scaling step anywhere.
 */
public class BoolMatrix {
    private final int rows;
    private final int cols;
    private final boolean[][] data;

    /** Constructs a {@code rows × cols} matrix with all entries false. */
    public BoolMatrix(int rows, int cols) {
        if (rows < 0 || cols < 0) {
            throw new IllegalArgumentException("Negative dimensions");
        }
        this.rows = rows;
        this.cols = cols;
        this.data = new boolean[rows][cols];
    }

    /** Copies a rectangular {@code boolean[][]}. */
    public static BoolMatrix of(boolean[][] values) {
        int m = values.length;
        int n = m == 0 ? 0 : values[0].length;
        BoolMatrix mat = new BoolMatrix(m, n);
        for (int i = 0; i < m; i++) {
            if (values[i].length != n) {
                throw new IllegalArgumentException("Ragged row " + i);
            }
            System.arraycopy(values[i], 0, mat.data[i], 0, n);
        }
        return mat;
    }

    public int getRowCount() { return rows; }
    public int getColumnCount() { return cols; }

    public boolean get(int r, int c) {
        return data[r][c];
    }

    public void set(int r, int c, boolean value) {
        data[r][c] = value;
    }

    /** Swaps rows {@code a} and {@code b} in place. */
    public void swapRows(int a, int b) {
        if (a == b) return;
        boolean[] t = data[a];
        data[a] = data[b];
        data[b] = t;
    }

    /** {@code row[target] ^= row[source]}, starting at column {@code fromCol}. */
    public void xorRowInto(int source, int target, int fromCol) {
        boolean[] src = data[source];
        boolean[] dst = data[target];
        for (int k = fromCol; k < cols; k++) {
            dst[k] ^= src[k];
        }
    }

    /** True when every entry of row {@code r} is false. */
    public boolean isZeroRow(int r) {
        for (boolean v : data[r]) if (v) return false;
        return true;
    }

    public boolean[][] toArray() {
        boolean[][] a = new boolean[rows][];
        for (int i = 0; i < rows; i++) a[i] = data[i].clone();
        return a;
    }

    /** Writes this matrix as {@code 0}/{@code 1} tokens, one row per line. */
    public void write(Writer out) throws IOException {
        for (int i = 0; i < rows; i++) {
            StringBuilder sb = new StringBuilder();
            for (int j = 0; j < cols; j++) {
                if (j > 0) sb.append(' ');
                sb.append(data[i][j] ? '1' : '0');
            }
            out.write(sb.toString());
            out.write(System.lineSeparator());
        }
    }
}
