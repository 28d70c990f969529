package edu.mcmaster.erpshape;

import org.apache.commons.math3.analysis.function.Gaussian;

/**
 * Gaussian bump y = h * exp(-(x - m)² / (2 s²)) and sums of such bumps, with derivatives
 * with respect to the parameters for the least-squares solver.
 */
public final class GaussianFunction {

    private GaussianFunction() {
    }

    public static double value(final double x, final double mean, final double height, final double std) {
        final double xt = x - mean;
        return height * Math.exp(-xt * xt / (2.0 * std * std));
    }

    public static double[] evaluate(final double[] positions, final double mean,
                                    final double height, final double std) {
        double[] ys = new double[positions.length];
        for (int i = 0; i < positions.length; i++) {
            ys[i] = value(positions[i], mean, height, std);
        }
        return ys;
    }

    /**
     * Sum of all bumps whose parameters are concatenated in {@code params} as
     * (mean, height, std) triplets. An empty parameter array gives a flat zero curve.
     */
    public static double[] sum(final double[] positions, final double... params) {
        assert(params.length % Bump.NPARAMS == 0);
        double[] ys = new double[positions.length];
        for (int p = 0; p < params.length; p += Bump.NPARAMS) {
            final double mean = params[p + Bump.MEAN];
            final double height = params[p + Bump.HEIGHT];
            final double std = params[p + Bump.STD];
            for (int i = 0; i < positions.length; i++) {
                ys[i] += value(positions[i], mean, height, std);
            }
        }
        return ys;
    }

    /**
     * Partial derivatives of the bump sum at {@code x}, in the parameter order of {@code params}.
     * Uses commons-math {@link Gaussian.Parametric}, whose parameter order is (norm, mean, sigma).
     */
    public static double[] gradient(final double x, final double... params) {
        final Gaussian.Parametric gaussian = new Gaussian.Parametric();
        double[] grad = new double[params.length];
        for (int p = 0; p < params.length; p += Bump.NPARAMS) {
            final double[] g = gaussian.gradient(x,
                    params[p + Bump.HEIGHT], params[p + Bump.MEAN], params[p + Bump.STD]);
            grad[p + Bump.HEIGHT] = g[0];
            grad[p + Bump.MEAN] = g[1];
            grad[p + Bump.STD] = g[2];
        }
        return grad;
    }
}
