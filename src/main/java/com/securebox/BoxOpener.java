package com.securebox;

import java.io.IOException;
import java.io.PrintStream;
import java.io.PrintWriter;
import java.util.Objects;

/**
 * Opens a box through its public surface only: one {@code getState()}
 * snapshot, a GF(2) solve, then the toggles the solution asks for.
 */
public class BoxOpener {

    private final boolean strict;
    private final boolean verbose;
    private final PrintStream err;

    private EliminationStats lastStats = null;
    public EliminationStats getLastStats() { return lastStats; }

    public BoxOpener(boolean strict, boolean verbose, PrintStream err) {
        this.strict = strict;
        this.verbose = verbose;
        this.err = Objects.requireNonNull(err, "err");
    }

    /**
     * @return {@code true} if the box is still locked afterwards
     * @throws RankDeficiencyException if the toggle system has no exact solution,
     *         or is singular while running strict
     */
    public boolean openBox(Box box) {
        final int y = box.rows();
        final int x = box.cols();

        lastStats = new EliminationStats();
        if (y == 0 || x == 0) {
            debug("empty " + y + "x" + x + " box, nothing to toggle");
            return false;
        }

        LinearSystem sys = LinearSystemBuilder.build(box);
        if (verbose) {
            debug("initial state " + y + "x" + x + ":");
            dump(sys, y, x);
        }

        EliminationStats st = GaussianEliminator.eliminate(sys);
        lastStats = st;
        debug("rank " + st.rank + " of " + st.unknowns);
        if (!st.isFullRank()) {
            if (strict) {
                GaussianEliminator.requireFullRank(st);
            }
            err.println("*warning: singular toggle matrix for " + y + "x" + x
                    + " box, rank " + st.rank + " of " + st.unknowns + "; free toggles left off");
        }

        boolean[] solution = BackSubstitution.solve(sys, st);
        st.togglesApplied = SolutionApplier.apply(box, solution);
        debug("applied " + st.togglesApplied + " toggles");

        boolean locked = box.isLocked();
        if (verbose) {
            debug("final state:");
            dumpState(box.getState());
        }
        return locked;
    }

    private void debug(String msg) {
        if (verbose) err.println("DEBUG: " + msg);
    }

    private void dump(LinearSystem sys, int y, int x) {
        boolean[][] grid = new boolean[y][x];
        for (int i = 0; i < sys.size(); i++) grid[i / x][i % x] = sys.rhs(i);
        dumpState(grid);
    }

    private void dumpState(boolean[][] state) {
        PrintWriter pw = new PrintWriter(err, true);
        try {
            BoolMatrix.of(state).write(pw);
        } catch (IOException e) {
            throw new IllegalStateException("Could not write grid", e);
        }
        pw.flush();
    }
}
