package com.securebox;

/**
 * Solves a row-echelon system from the last pivot row upwards, using XOR for
 * subtraction and AND for multiplication.  Unknowns without a pivot stay false.
 */
public final class BackSubstitution {

    private BackSubstitution() {}

    public static boolean[] solve(LinearSystem sys, EliminationStats st) {
        final BoolMatrix a = sys.matrix();
        final int n = sys.unknowns();

        // rows below the rank are all zero; they are satisfiable only with b' = 0
        for (int row = st.rank; row < sys.size(); row++) {
            if (sys.rhs(row)) {
                throw new RankDeficiencyException(
                        "Inconsistent toggle system at row " + row, st.rank, n);
            }
        }

        boolean[] x = new boolean[n];
        for (int row = st.rank - 1; row >= 0; row--) {
            int p = st.pivotColumns[row];
            boolean sum = sys.rhs(row);
            for (int col = p + 1; col < n; col++) {
                sum ^= a.get(row, col) & x[col];
            }
            x[p] = sum;
        }
        return x;
    }
}
