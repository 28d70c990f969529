package edu.mcmaster.erpshape;

import org.junit.Test;

import static org.junit.Assert.assertArrayEquals;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertNotNull;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

public class GroupFitTest {

    private static double[][] rows() {
        double[] failing = SignalFixtures.bumps(50, 2, 3);
        failing[20] = Double.NaN;
        return new double[][]{
                SignalFixtures.bumps(50, 2, 3),
                new double[SignalFixtures.N],
                failing,
                SignalFixtures.bumps(40, -1, 2)};
    }

    private static GroupFit fit(int nThreads) {
        FitSettings settings = new FitSettings().setMaxNPeaks(1).setVerbose(false);
        return GroupFit.fit(SignalFixtures.positions(), rows(), null, settings, new RunModes(), nThreads);
    }

    private static void checkGroup(GroupFit group) {
        assertEquals(4, group.size());
        assertNotNull(group.getResult(0));
        // flat row: fit completes with no peak, so no model
        assertNull(group.getResult(1));
        assertNull(group.getResult(2));
        assertEquals(2, group.getNNull());
        assertArrayEquals(new int[]{1, 2}, group.getNullIndices());
        assertArrayEquals(new Integer[]{1, null, null, 1}, group.getNPeaks());
        assertEquals(50, group.getResult(0).getBumps().get(0).getMean(), 1e-3);
        assertEquals(-1, group.getResult(3).getBumps().get(0).getHeight(), 1e-3);
    }

    @Test
    public void sequentialFit() {
        checkGroup(fit(1));
    }

    @Test
    public void parallelFit() {
        checkGroup(fit(3));
    }

    @Test
    public void stackedParams() {
        GroupFit group = fit(2);
        double[][] gauss = group.getParams(ParamType.GAUSSIAN);
        // rows 1 and 2 are null and give no table row
        assertEquals(2, gauss.length);
        assertEquals(4, gauss[0].length);
        assertEquals(0, gauss[0][3], 0);
        assertEquals(3, gauss[1][3], 0);
        assertArrayEquals(new double[]{50, 40}, group.getParams(ParamType.PEAK, "CT"), 1e-9);

        double[] r2 = group.getParams(ParamType.R_SQUARED, null);
        assertEquals(4, r2.length);
        assertEquals(1, r2[0], 1e-6);
        assertTrue(Double.isNaN(r2[1]));
        assertTrue(Double.isNaN(r2[2]));
    }

    @Test
    public void clean() {
        GroupFit group = fit(1);
        assertEquals(0, group.clean(0.99, Double.NaN));
        assertEquals(2, group.getNNull());
        assertEquals(2, group.clean(Double.NaN, -1));
        assertEquals(4, group.getNNull());
    }

    @Test(expected = DataException.class)
    public void rowErrorIsThrownInDebugMode() {
        GroupFit.fit(SignalFixtures.positions(), rows(), null, new FitSettings().setMaxNPeaks(1), new RunModes().setDebug(true), 1);
    }

    private static double[][] failingRows() {
        double[][] rows = new double[6][];
        for (int i = 0; i < rows.length; i++) rows[i] = SignalFixtures.bumps(50, 2, 3);
        rows[4][10] = Double.NaN;
        rows[1][10] = Double.POSITIVE_INFINITY;
        return rows;
    }

    @Test
    public void debugModeRethrowsLowestFailingRow() {
        for (int nThreads : new int[]{1, 4}) {
            try {
                GroupFit.fit(SignalFixtures.positions(), failingRows(), null, new FitSettings().setMaxNPeaks(1),
                        new RunModes().setDebug(true), nThreads);
                fail("expected a DataException with " + nThreads + " threads");
            } catch (DataException e) {
                assertTrue(e.getMessage(), e.getMessage().contains("Infinity"));
            }
        }
    }

    @Test
    public void failingRowsAreNullInBothPaths() {
        for (int nThreads : new int[]{1, 4}) {
            GroupFit group = GroupFit.fit(SignalFixtures.positions(), failingRows(), null,
                    new FitSettings().setMaxNPeaks(1), new RunModes(), nThreads);
            assertArrayEquals(new int[]{1, 4}, group.getNullIndices());
        }
    }

    @Test(expected = DataException.class)
    public void positionsAreCheckedFirst() {
        double[] pos = SignalFixtures.positions();
        pos[10] += 0.05;
        GroupFit.fit(pos, rows(), null, new FitSettings(), new RunModes(), 2);
    }

    @Test(expected = InconsistentDataException.class)
    public void rowLengthMismatch() {
        GroupFit.fit(SignalFixtures.positions(), new double[][]{new double[3]}, new FitSettings());
    }
}
