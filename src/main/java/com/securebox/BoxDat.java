package com.securebox;

public final class BoxDat {
    public final int y;                     // rows
    public final int x;                     // columns
    public final long seed;                 // shuffle generator seed
    public final boolean strict;            // any singular system is an internal error
    public final boolean verbose;           // DEBUG lines on stderr

    private BoxDat(Builder b) {
        this.y = b.y;
        this.x = b.x;
        this.seed = b.seed != null ? b.seed : System.currentTimeMillis();
        this.strict = b.strict;
        this.verbose = b.verbose;
    }

    public static final class Builder {
        private int y, x;
        private Long seed;
        private boolean strict, verbose;

        public Builder rows(int v){ this.y=requireNonNegative(v, "rows"); return this; }
        public Builder cols(int v){ this.x=requireNonNegative(v, "cols"); return this; }
        public Builder seed(long v){ this.seed=v; return this; }
        public Builder strict(boolean v){ this.strict=v; return this; }
        public Builder verbose(boolean v){ this.verbose=v; return this; }
        public BoxDat build(){ return new BoxDat(this); }
    }

    private static int requireNonNegative(int v, String what) {
        if (v < 0) throw new IllegalArgumentException(what + " must be >= 0: " + v);
        return v;
    }
}
