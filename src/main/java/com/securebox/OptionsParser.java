package com.securebox;

import java.util.ArrayList;
import java.util.List;

public final class OptionsParser {

    /** Largest Y·X accepted; the solver holds a dense (Y·X)² matrix. */
    public static final int MAX_CELLS = 4096;

    private OptionsParser() {}

    public static BoxDat parse(String[] args){
        BoxDat.Builder b = new BoxDat.Builder();
        List<String> dims = new ArrayList<>(2);

        for (int i=0; i<args.length; i++) {
            String a = args[i];
            switch (a) {
                case "-seed": b.seed(parseLong("-seed", next(args, ++i, a))); break;
                case "-strict": b.strict(true); break;
                case "-verbose": b.verbose(true); break;
                default:
                    if (a.startsWith("-") && !isNumber(a)) throw new IllegalArgumentException("Unknown option: " + a);
                    if (dims.size() == 2) throw new IllegalArgumentException("Unexpected argument: " + a);
                    dims.add(a);
            }
        }
        if (dims.size() < 2) throw new IllegalArgumentException("Expected <Y> <X>, got " + dims.size() + " dimension(s)");
        int y = parseDimension("Y", dims.get(0));
        int x = parseDimension("X", dims.get(1));
        requireSolvableSize(y, x);
        return b.rows(y).cols(x).build();
    }

    private static String next(String[] args, int i, String opt){
        if (i >= args.length) throw new IllegalArgumentException("Missing value for " + opt);
        return args[i];
    }

    private static int parseDimension(String name, String s){
        int v;
        try {
            v = Integer.parseInt(s.trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException(name + " is not an integer: " + s, e);
        }
        if (v < 0) throw new IllegalArgumentException(name + " must be >= 0: " + v);
        return v;
    }

    private static void requireSolvableSize(int y, int x){
        int cells;
        try {
            cells = Math.multiplyExact(y, x);
        } catch (ArithmeticException e) {
            throw new IllegalArgumentException("Grid too large: " + y + "x" + x + " overflows", e);
        }
        if (cells > MAX_CELLS) {
            throw new IllegalArgumentException("Grid too large: " + y + "x" + x + " has " + cells
                    + " cells, limit is " + MAX_CELLS);
        }
    }

    private static long parseLong(String opt, String s){
        try {
            return Long.parseLong(s.trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException(opt + " expects an integer: " + s, e);
        }
    }

    private static boolean isNumber(String s){
        return s.matches("-\\d+");
    }
}
