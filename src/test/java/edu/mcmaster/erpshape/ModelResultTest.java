package edu.mcmaster.erpshape;

import org.junit.Test;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import static org.junit.Assert.assertArrayEquals;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

public class ModelResultTest {

    private static List<FitPeak> measuredPeaks() {
        Signal s = Signal.of(SignalFixtures.positions(), SignalFixtures.bumps(30, 2, 2, 70, -1, 3));
        return ShapeMeasurements.measure(s, Arrays.asList(new Bump(30, 2, 2), new Bump(70, -1, 3)),
                FitSettings.GAUSS_OVERLAP_THRESHOLD);
    }

    @Test
    public void tablesAndColumns() {
        ModelResult res = ModelResult.of(measuredPeaks(), 0.9, 0.1);
        assertTrue(res.hasModel());
        assertEquals(2, res.getNPeaks());
        assertArrayEquals(new double[]{2, 3}, res.getParams(ParamType.GAUSSIAN, "SD"), 0);
        assertArrayEquals(new double[]{4, 6}, res.getParams(ParamType.PEAK, PeakParams.BW), 0);
        assertEquals(7, res.getParams(ParamType.SHAPE)[0].length);
        assertArrayEquals(new double[][]{{0.9}}, res.getParams(ParamType.R_SQUARED));
        assertEquals(0.1, res.getScalar(ParamType.ERROR), 0);
    }

    @Test
    public void emptyResult() {
        ModelResult res = ModelResult.empty();
        assertFalse(res.hasModel());
        assertEquals(0, res.getNPeaks());
        assertTrue(Double.isNaN(res.getRSquared()));
    }

    @Test(expected = NoModelException.class)
    public void noParamsWithoutModel() {
        ModelResult.empty().getParams(ParamType.PEAK);
    }

    @Test(expected = NoModelException.class)
    public void noErrorsWithoutModel() {
        ModelResult.empty().pointwiseError(Signal.of(new double[]{0, 1}, new double[]{0, 1}));
    }

    @Test
    public void zeroPeaksHoldNoModel() {
        ModelResult res = ModelResult.of(Collections.<FitPeak>emptyList(), Double.NaN, 0.25);
        assertFalse(res.hasModel());
        assertEquals(0.25, res.getError(), 0);
        assertEquals(0, res.getShapeParams().length);
        try {
            res.getParams(ParamType.SHAPE);
            fail("expected NoModelException");
        } catch (NoModelException e) {
            // expected
        }
    }

    @Test(expected = IllegalArgumentException.class)
    public void unresolvedPeaksAreRefused() {
        Signal s = Signal.of(SignalFixtures.positions(), SignalFixtures.bumps(0, 2, 3));
        ModelResult.of(ShapeMeasurements.measure(s, Arrays.asList(new Bump(0, 2, 3)), FitSettings.GAUSS_OVERLAP_THRESHOLD), 1, 0);
    }

    @Test
    public void crossingIndices() {
        ModelResult res = ModelResult.of(measuredPeaks(), 0.9, 0.1);
        int[][] idx = res.getCrossingIndices();
        assertEquals(300, idx[0][1]);
        assertTrue(idx[0][0] < 300 && idx[0][2] > 300);
        assertEquals(700, idx[1][1]);
    }

    @Test(expected = IllegalArgumentException.class)
    public void unknownColumn() {
        ParamType.PEAK.columnIndex("MN");
    }

    @Test
    public void paramTypes() {
        assertEquals(2, ParamType.GAUSSIAN.columnIndex("SD"));
        assertEquals(ShapeParams.SHARPNESS_DECAY, ParamType.SHAPE.columnIndex("sharpness_decay"));
        assertTrue(ParamType.SHAPE.isTable());
        assertFalse(ParamType.R_SQUARED.isTable());
    }
}
