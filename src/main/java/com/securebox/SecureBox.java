package com.securebox;

import java.util.Objects;
import java.util.Random;

/**
 * A Y×X grid of lock cells.  {@code true} means locked.  The only way to
 * change the grid after construction is {@link #toggle(int, int)}.
 */
public final class SecureBox implements Box {

    /** Exclusive upper bound on the number of shuffle toggles. */
    static final int MAX_SHUFFLE_TOGGLES = 1000;

    private final int ySize, xSize;
    private final boolean[][] box;

    /**
     * Creates a box and shuffles it with random toggles drawn from
     * {@code rng}.  A box with a zero dimension is left empty.
     */
    public SecureBox(int y, int x, Random rng) {
        this(y, x);
        Objects.requireNonNull(rng, "rng");
        shuffle(rng);
    }

    private SecureBox(int y, int x) {
        if (y < 0 || x < 0) {
            throw new IllegalArgumentException("Negative dimensions: " + y + "x" + x);
        }
        this.ySize = y;
        this.xSize = x;
        this.box = new boolean[y][x];
    }

    /** Builds a box holding exactly {@code state} (copied). */
    public static SecureBox of(boolean[][] state) {
        Objects.requireNonNull(state, "state");
        int y = state.length;
        int x = y == 0 ? 0 : state[0].length;
        SecureBox b = new SecureBox(y, x);
        for (int r = 0; r < y; r++) {
            if (state[r] == null || state[r].length != x) {
                throw new IllegalArgumentException("Ragged state at row " + r);
            }
            System.arraycopy(state[r], 0, b.box[r], 0, x);
        }
        return b;
    }

    @Override public int rows() { return ySize; }
    @Override public int cols() { return xSize; }

    /**
     * Flips the cell itself, then every cell of its row and every cell of
     * its column.  The cell is hit three times, so the net effect is one
     * flip of each member of row ∪ column.
     */
    @Override
    public void toggle(int y, int x) {
        if (y < 0 || y >= ySize || x < 0 || x >= xSize) {
            throw new IndexOutOfBoundsException(
                    "toggle(" + y + ", " + x + ") outside " + ySize + "x" + xSize + " box");
        }
        box[y][x] = !box[y][x];
        for (int i = 0; i < xSize; i++) box[y][i] = !box[y][i];
        for (int i = 0; i < ySize; i++) box[i][x] = !box[i][x];
    }

    @Override
    public boolean isLocked() {
        for (boolean[] row : box)
            for (boolean cell : row)
                if (cell) return true;
        return false;
    }

    @Override
    public boolean[][] getState() {
        boolean[][] copy = new boolean[ySize][];
        for (int r = 0; r < ySize; r++) copy[r] = box[r].clone();
        return copy;
    }

    private void shuffle(Random rng) {
        if (ySize == 0 || xSize == 0) return;
        for (int t = rng.nextInt(MAX_SHUFFLE_TOGGLES); t > 0; t--) {
            toggle(rng.nextInt(ySize), rng.nextInt(xSize));
        }
    }
}
