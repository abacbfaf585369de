package com.securebox;

/** Replays a solution vector as toggles on the box. */
public final class SolutionApplier {

    private SolutionApplier() {}

    /**
     * Toggles every flattened index set in {@code x}, in index order.
     *
     * @return number of toggles applied
     */
    public static int apply(Box box, boolean[] x) {
        final int cols = box.cols();
        if (x.length != box.rows() * cols) {
            throw new IllegalArgumentException(
                    "Solution has " + x.length + " entries for a " + box.rows() + "x" + cols + " box");
        }
        int applied = 0;
        for (int i = 0; i < x.length; i++) {
            if (x[i]) {
                box.toggle(i / cols, i % cols);
                applied++;
            }
        }
        return applied;
    }
}
