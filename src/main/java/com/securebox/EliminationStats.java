package com.securebox;

import java.util.Arrays;

public final class EliminationStats {
    public int unknowns;
    public int rank;
    public int rowSwaps;
    public int rowXors;
    public int togglesApplied;
    public int[] pivotColumns = new int[0];   // pivotColumns[r] = column of pivot row r

    public boolean isFullRank() {
        return rank == unknowns;
    }

    /** Columns that ended up without a pivot (free unknowns). */
    public int[] freeColumns() {
        boolean[] pivot = new boolean[unknowns];
        for (int c : pivotColumns) pivot[c] = true;
        int[] free = new int[unknowns - rank];
        int k = 0;
        for (int c = 0; c < unknowns; c++) if (!pivot[c]) free[k++] = c;
        return free;
    }

    @Override
    public String toString() {
        return "*Totals: unknowns=" + unknowns +
                " rank=" + rank +
                " swaps=" + rowSwaps +
                " xors=" + rowXors +
                " toggles=" + togglesApplied +
                (isFullRank() ? "" : " free=" + Arrays.toString(freeColumns()));
    }
}
