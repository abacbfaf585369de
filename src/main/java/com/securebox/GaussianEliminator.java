package com.securebox;

import java.util.Arrays;

/**
 * Forward elimination over GF(2).  Every entry is 0 or 1, so a pivot is
 * just a true entry and eliminating below it is a row XOR.
 */
public final class GaussianEliminator {

    private GaussianEliminator() {}

    /**
     * Reduces {@code sys} to row-echelon form in place.  A column with no
     * true entry at or below the next pivot row is skipped.
     *
     * @return rank and pivot layout of the reduced system
     */
    public static EliminationStats eliminate(LinearSystem sys) {
        final BoolMatrix a = sys.matrix();
        final int m = sys.size();
        final int n = sys.unknowns();

        EliminationStats st = new EliminationStats();
        st.unknowns = n;
        int[] pivots = new int[Math.min(m, n)];
        int rank = 0;

        for (int col = 0; col < n && rank < m; col++) {
            int pivot = rank;
            while (pivot < m && !a.get(pivot, col)) pivot++;

            // no true entry in this column
            if (pivot == m) continue;

            if (pivot != rank) {
                sys.swapRows(rank, pivot);
                st.rowSwaps++;
            }

            for (int row = rank + 1; row < m; row++) {
                if (a.get(row, col)) {
                    sys.addRow(rank, row, col);
                    st.rowXors++;
                }
            }
            pivots[rank++] = col;
        }

        st.rank = rank;
        st.pivotColumns = Arrays.copyOf(pivots, rank);
        return st;
    }

    /** Throws unless every unknown received a pivot. */
    public static void requireFullRank(EliminationStats st) {
        if (!st.isFullRank()) {
            throw new RankDeficiencyException(
                    "Toggle matrix is singular, free columns " + Arrays.toString(st.freeColumns()),
                    st.rank, st.unknowns);
        }
    }
}
