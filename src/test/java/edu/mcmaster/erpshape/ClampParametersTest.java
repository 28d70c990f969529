package edu.mcmaster.erpshape;

import org.apache.commons.math3.linear.ArrayRealVector;
import org.apache.commons.math3.linear.RealVector;
import org.junit.Test;

import java.util.Arrays;

import static org.junit.Assert.assertArrayEquals;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;

public class ClampParametersTest {

    @Test
    public void boundsFromGuesses() {
        ClampParameters bounds = ClampParameters.forGuesses(
                Arrays.asList(new Bump(50, 2, 3), new Bump(5, -1, 2)),
                new double[]{0.25, 6}, new double[]{0, 100}, FitSettings.CENTER_BOUND);
        assertEquals(6, bounds.getDimension());
        double[] lower = bounds.getLower();
        double[] upper = bounds.getUpper();
        // mean within guess ± 2 × 1.5 × std
        assertEquals(41, lower[Bump.MEAN], 1e-12);
        assertEquals(59, upper[Bump.MEAN], 1e-12);
        assertEquals(Double.NEGATIVE_INFINITY, lower[Bump.HEIGHT], 0);
        assertEquals(Double.POSITIVE_INFINITY, upper[Bump.HEIGHT], 0);
        assertEquals(0.25, lower[Bump.STD], 0);
        assertEquals(6, upper[Bump.STD], 0);
        // second mean bound clamped to the range
        assertEquals(0, lower[Bump.NPARAMS + Bump.MEAN], 0);
        assertEquals(11, upper[Bump.NPARAMS + Bump.MEAN], 1e-12);
    }

    @Test
    public void clampAndValidate() {
        ClampParameters bounds = ClampParameters.forGuesses(Arrays.asList(new Bump(50, 2, 3)),
                new double[]{0.25, 6}, new double[]{0, 100}, FitSettings.CENTER_BOUND);
        assertTrue(bounds.contains(new double[]{50, 1e6, 3}));
        assertFalse(bounds.contains(new double[]{60, 2, 3}));
        assertArrayEquals(new double[]{59, -5, 0.25}, bounds.clamp(new double[]{70, -5, 0.01}), 1e-12);

        RealVector v = new ArrayRealVector(new double[]{30, 4, 10});
        RealVector validated = bounds.validate(v);
        assertArrayEquals(new double[]{41, 4, 6}, validated.toArray(), 1e-12);
    }
}
