package com.securebox;

/** Narrow capability surface the solver is allowed to use on a grid. */
public interface Box {
    int rows();                      // Y
    int cols();                      // X
    void toggle(int row, int col);   // flips row ∪ column, each cell once
    boolean isLocked();              // any cell still true
    boolean[][] getState();          // independent copy
}
