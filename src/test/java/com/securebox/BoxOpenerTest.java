package com.securebox;

import static org.junit.jupiter.api.Assertions.*;
import org.junit.jupiter.api.Test;
import java.io.*;
import java.nio.charset.StandardCharsets;
import java.util.*;

public class BoxOpenerTest {

    private static final PrintStream QUIET = new PrintStream(OutputStream.nullOutputStream());

    private static BoxOpener quiet() {
        return new BoxOpener(false, false, QUIET);
    }

    /** Counts toggle calls while delegating to a real box. */
    private static final class CountingBox implements Box {
        final SecureBox inner;
        int toggles, snapshots;
        CountingBox(SecureBox inner) { this.inner = inner; }
        @Override public int rows() { return inner.rows(); }
        @Override public int cols() { return inner.cols(); }
        @Override public void toggle(int row, int col) { toggles++; inner.toggle(row, col); }
        @Override public boolean isLocked() { return inner.isLocked(); }
        @Override public boolean[][] getState() { snapshots++; return inner.getState(); }
    }

    @Test
    public void singleLockedCellOpens() {
        CountingBox box = new CountingBox(SecureBox.of(new boolean[][]{{ true }}));
        assertFalse(quiet().openBox(box));
        assertEquals(1, box.toggles);
        assertArrayEquals(new boolean[]{ false }, box.getState()[0]);
    }

    @Test
    public void twoByTwoScenarioEndsAllFalse() {
        SecureBox box = SecureBox.of(new boolean[][]{{ true, false }, { false, false }});
        BoxOpener opener = quiet();
        assertFalse(opener.openBox(box));
        assertTrue(Arrays.deepEquals(new boolean[2][2], box.getState()));
        assertEquals(3, opener.getLastStats().togglesApplied);
    }

    @Test
    public void emptyBoxIsOpenWithoutToggles() {
        for (int[] d : new int[][]{{ 0, 0 }, { 0, 5 }, { 4, 0 }}) {
            CountingBox box = new CountingBox(new SecureBox(d[0], d[1], new Random(1)));
            BoxOpener opener = quiet();
            assertFalse(opener.openBox(box));
            assertEquals(0, box.toggles);
            assertEquals(0, opener.getLastStats().togglesApplied);
        }
    }

    @Test
    public void anyStateOpensOnFullRankGrids() {
        Random rng = new Random(2024);
        int[][] sizes = {{ 1, 1 }, { 2, 2 }, { 2, 6 }, { 4, 4 }, { 8, 2 }, { 6, 6 }};
        for (int[] d : sizes) {
            for (int t = 0; t < 5; t++) {
                SecureBox box = SecureBox.of(SecureBoxTest.randomState(d[0], d[1], rng));
                assertFalse(quiet().openBox(box), d[0] + "x" + d[1]);
                assertFalse(box.isLocked());
            }
        }
    }

    @Test
    public void shuffledBoxesOpenForEverySize() {
        for (int y = 1; y <= 7; y++) {
            for (int x = 1; x <= 7; x++) {
                for (long seed = 0; seed < 3; seed++) {
                    assertFalse(quiet().openBox(new SecureBox(y, x, new Random(seed * 31 + y * 7 + x))),
                            y + "x" + x + " seed " + seed);
                }
            }
        }
    }

    @Test
    public void snapshotTakenOnce() {
        CountingBox box = new CountingBox(SecureBox.of(new boolean[][]{{ true, true }, { false, true }}));
        quiet().openBox(box);
        assertEquals(1, box.snapshots);
    }

    @Test
    public void solutionOrderDoesNotMatter() {
        boolean[][] start = SecureBoxTest.randomState(4, 4, new Random(5));
        LinearSystem sys = LinearSystemBuilder.build(4, 4, start);
        boolean[] x = BackSubstitution.solve(sys, GaussianEliminator.eliminate(sys));

        List<Integer> idx = new ArrayList<>();
        for (int i = 0; i < x.length; i++) if (x[i]) idx.add(i);
        Collections.reverse(idx);
        Collections.shuffle(idx, new Random(9));

        SecureBox box = SecureBox.of(start);
        for (int i : idx) box.toggle(i / 4, i % 4);
        assertFalse(box.isLocked());
    }

    @Test
    public void unreachableStateIsAnInternalError() {
        SecureBox box = SecureBox.of(new boolean[][]{{ true, false }});
        assertThrows(RankDeficiencyException.class, () -> quiet().openBox(box));
    }

    @Test
    public void strictModeRejectsSingularGrid() {
        BoxOpener strict = new BoxOpener(true, false, QUIET);
        assertThrows(RankDeficiencyException.class, () -> strict.openBox(new SecureBox(3, 3, new Random(1))));
        assertFalse(strict.openBox(new SecureBox(2, 2, new Random(1))));
    }

    @Test
    public void singularGridLogsWarning() {
        ByteArrayOutputStream err = new ByteArrayOutputStream();
        BoxOpener opener = new BoxOpener(false, false, new PrintStream(err, true, StandardCharsets.UTF_8));
        assertFalse(opener.openBox(new SecureBox(3, 3, new Random(8))));
        String log = err.toString(StandardCharsets.UTF_8);
        assertTrue(log.contains("*warning: singular toggle matrix"), log);
        assertEquals(5, opener.getLastStats().rank);
    }

    @Test
    public void verboseWritesDebugLines() {
        ByteArrayOutputStream err = new ByteArrayOutputStream();
        BoxOpener opener = new BoxOpener(false, true, new PrintStream(err, true, StandardCharsets.UTF_8));
        opener.openBox(SecureBox.of(new boolean[][]{{ true, false }, { false, false }}));
        String log = err.toString(StandardCharsets.UTF_8);
        assertTrue(log.contains("DEBUG: rank 4 of 4"), log);
        assertTrue(log.contains("DEBUG: applied 3 toggles"), log);
        assertTrue(log.contains("1 0"), log);
    }
}
