package edu.mcmaster.erpshape;

import org.junit.Test;

import static org.junit.Assert.assertArrayEquals;
import static org.junit.Assert.assertEquals;

public class GaussianFunctionTest {

    @Test
    public void valueAtMeanAndAtOneStd() {
        assertEquals(2.0, GaussianFunction.value(5, 5, 2, 1.5), 1e-12);
        assertEquals(2.0 * Math.exp(-0.5), GaussianFunction.value(6.5, 5, 2, 1.5), 1e-12);
        assertEquals(-3.0 * Math.exp(-0.5), GaussianFunction.value(3.5, 5, -3, 1.5), 1e-12);
    }

    @Test
    public void sumOfNoBumpIsFlat() {
        double[] ys = GaussianFunction.sum(new double[]{0, 1, 2});
        assertArrayEquals(new double[]{0, 0, 0}, ys, 0);
    }

    @Test
    public void sumAddsBumps() {
        double[] pos = {0, 1, 2, 3};
        double[] a = GaussianFunction.evaluate(pos, 1, 2, 0.5);
        double[] b = GaussianFunction.evaluate(pos, 2.5, -1, 1);
        double[] s = GaussianFunction.sum(pos, 1, 2, 0.5, 2.5, -1, 1);
        for (int i = 0; i < pos.length; i++) assertEquals(a[i] + b[i], s[i], 1e-12);
    }

    @Test
    public void gradientMatchesFiniteDifferences() {
        final double[] params = {1.2, 2.0, 0.7, 3.0, -0.5, 1.3};
        final double x = 1.9;
        final double[] grad = GaussianFunction.gradient(x, params);
        final double h = 1e-6;
        for (int p = 0; p < params.length; p++) {
            double[] up = params.clone();
            double[] down = params.clone();
            up[p] += h;
            down[p] -= h;
            double fd = (GaussianFunction.sum(new double[]{x}, up)[0] - GaussianFunction.sum(new double[]{x}, down)[0]) / (2 * h);
            assertEquals("parameter " + p, fd, grad[p], 1e-6);
        }
    }
}
