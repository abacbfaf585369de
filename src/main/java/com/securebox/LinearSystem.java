package com.securebox;

import java.util.Arrays;
import java.util.Objects;

/**
 * Augmented system (A | b) over GF(2).  Elimination mutates it in place;
 * row operations always move the matrix row and its b entry together.
 */
public final class LinearSystem {
    private final BoolMatrix a;
    private final boolean[] b;

    public LinearSystem(BoolMatrix a, boolean[] b) {
        this.a = Objects.requireNonNull(a, "a");
        this.b = Objects.requireNonNull(b, "b");
        if (a.getRowCount() != b.length) {
            throw new IllegalArgumentException(
                    "Row count " + a.getRowCount() + " != rhs length " + b.length);
        }
    }

    public int size() { return b.length; }
    public int unknowns() { return a.getColumnCount(); }

    public BoolMatrix matrix() { return a; }
    public boolean rhs(int r) { return b[r]; }
    public boolean[] rhs() { return Arrays.copyOf(b, b.length); }

    void swapRows(int r1, int r2) {
        a.swapRows(r1, r2);
        boolean t = b[r1];
        b[r1] = b[r2];
        b[r2] = t;
    }

    /** Adds (XOR) row {@code source} into row {@code target}. */
    void addRow(int source, int target, int fromCol) {
        a.xorRowInto(source, target, fromCol);
        b[target] ^= b[source];
    }
}
