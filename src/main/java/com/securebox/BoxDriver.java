package com.securebox;

import java.io.PrintStream;
import java.util.Random;
import java.util.function.Function;

/**
 * Runs one solve for the command line: parse, build the box, open, report.
 *
 * Exit status: 0 opened, 1 still locked, 2 bad arguments, 3 internal error.
 */
public final class BoxDriver {

    public static final String LOCKED = "BOX: LOCKED!";
    public static final String OPENED = "BOX: OPENED!";

    static final int EXIT_OPENED = 0;
    static final int EXIT_LOCKED = 1;
    static final int EXIT_USAGE = 2;
    static final int EXIT_INTERNAL = 3;

    private final PrintStream out;
    private final PrintStream err;
    private final Function<BoxDat, Box> boxFactory;

    public BoxDriver() {
        this(System.out, System.err);
    }

    public BoxDriver(PrintStream out, PrintStream err) {
        this(out, err, BoxDriver::shuffledBox);
    }

    public BoxDriver(PrintStream out, PrintStream err, Function<BoxDat, Box> boxFactory) {
        this.out = out;
        this.err = err;
        this.boxFactory = boxFactory;
    }

    static Box shuffledBox(BoxDat dat) {
        return new SecureBox(dat.y, dat.x, new Random(dat.seed));
    }

    public int run(String[] args) {
        final BoxDat dat;
        try {
            dat = OptionsParser.parse(args);
        } catch (IllegalArgumentException e) {
            usage();
            err.println("Argument error: " + e.getMessage());
            return EXIT_USAGE;
        }

        if (dat.verbose) {
            err.println("DEBUG: box " + dat.y + "x" + dat.x + " seed=" + dat.seed);
        }

        try {
            BoxOpener opener = new BoxOpener(dat.strict, dat.verbose, err);
            boolean locked = opener.openBox(boxFactory.apply(dat));
            if (dat.verbose) {
                err.println(opener.getLastStats());
            }
            out.println(locked ? LOCKED : OPENED);
            return locked ? EXIT_LOCKED : EXIT_OPENED;
        } catch (RuntimeException e) {
            // RankDeficiencyException lands here too
            err.println("*internal error: " + e.getMessage());
            return EXIT_INTERNAL;
        } catch (OutOfMemoryError e) {
            err.println("*internal error: out of memory solving " + dat.y + "x" + dat.x + " box");
            return EXIT_INTERNAL;
        }
    }

    private void usage() {
        err.println(
                "Usage: securebox [options] <Y> <X>\n" +
                        "  <Y> <X>        grid rows and columns (non-negative, Y*X <= " + OptionsParser.MAX_CELLS + ")\n" +
                        "Options:\n" +
                        "  -seed N        seed for the shuffle (default: current time)\n" +
                        "  -strict        treat a singular toggle matrix as an internal error\n" +
                        "  -verbose       print grids, rank and toggle count to stderr\n"
        );
    }
}
