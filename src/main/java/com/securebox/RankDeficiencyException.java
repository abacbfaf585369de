package com.securebox;

/**
 * The toggle system could not be solved exactly: either it lost rank while
 * full rank was required, or no combination of toggles reaches b.
 * Distinct from a box that simply stays locked.
 */
public class RankDeficiencyException extends IllegalStateException {
    private final int rank;
    private final int unknowns;

    public RankDeficiencyException(String message, int rank, int unknowns) {
        super(message + " (rank " + rank + " of " + unknowns + ")");
        this.rank = rank;
        this.unknowns = unknowns;
    }

    public int getRank() { return rank; }
    public int getUnknowns() { return unknowns; }
}
