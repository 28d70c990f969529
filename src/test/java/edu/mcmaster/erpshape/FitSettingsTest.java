package edu.mcmaster.erpshape;

import org.junit.Test;

import static org.junit.Assert.assertArrayEquals;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertNotSame;
import static org.junit.Assert.assertSame;

public class FitSettingsTest {

    @Test
    public void defaults() {
        FitSettings s = new FitSettings();
        assertArrayEquals(new double[]{0.5, 12}, s.peakWidthLimits, 0);
        assertArrayEquals(new double[]{0.25, 6}, s.getGaussStdLimits(), 0);
        assertEquals(Integer.MAX_VALUE, s.maxNPeaks);
        assertEquals(2.0, s.peakThreshold, 0);
        assertSame(ErrorMetric.MAE, s.errorMetric);
    }

    @Test
    public void duplicateIsIndependent() {
        FitSettings s = new FitSettings(1, 8, 3, 1.5, 0.2).setErrorMetric("rmse").setRectify(true);
        FitSettings d = s.duplicate();
        assertNotSame(s.peakWidthLimits, d.peakWidthLimits);
        d.setPeakWidthLimits(2, 4);
        assertArrayEquals(new double[]{1, 8}, s.peakWidthLimits, 0);
        assertEquals(3, d.maxNPeaks);
        assertEquals(0.2, d.minPeakHeight, 0);
        assertSame(ErrorMetric.RMSE, d.errorMetric);
        assertEquals(true, d.rectify);
    }

    @Test(expected = IllegalArgumentException.class)
    public void invertedWidthLimits() {
        new FitSettings().setPeakWidthLimits(4, 2);
    }

    @Test(expected = IllegalArgumentException.class)
    public void negativeMaxNPeaks() {
        new FitSettings().setMaxNPeaks(-1);
    }

    @Test(expected = IllegalArgumentException.class)
    public void negativeThreshold() {
        new FitSettings().setPeakThreshold(-0.1);
    }

    @Test(expected = IllegalArgumentException.class)
    public void unknownErrorMetric() {
        new FitSettings().setErrorMetric("chi2");
    }
}
