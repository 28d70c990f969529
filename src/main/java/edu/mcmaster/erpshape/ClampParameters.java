package edu.mcmaster.erpshape;

import org.apache.commons.math3.fitting.leastsquares.ParameterValidator;
import org.apache.commons.math3.linear.RealVector;

import java.util.Arrays;
import java.util.List;

/**
 * Lower and upper bounds of the flattened (mean, height, std) parameter vector of a joint fit.
 * Used as the {@link ParameterValidator} of the solver: every trial point is clamped into the bounds.
 */
public class ClampParameters implements ParameterValidator {

    private final double[] lower;
    private final double[] upper;

    ClampParameters(final double[] lower, final double[] upper) {
        assert(lower.length == upper.length);
        this.lower = lower;
        this.upper = upper;
    }

    /**
     * Bounds for a set of guesses:
     * mean within guess ± 2 × centerBound × std, clamped to {@code range};
     * height unbounded, as peaks may go below baseline;
     * std within {@code stdLimits}.
     */
    public static ClampParameters forGuesses(final List<Bump> guesses,
                                             final double[] stdLimits,
                                             final double[] range,
                                             final double centerBound) {
        assert(stdLimits.length == 2 && range.length == 2);
        final int n = guesses.size();
        double[] lower = new double[n * Bump.NPARAMS];
        double[] upper = new double[n * Bump.NPARAMS];
        for (int i = 0; i < n; i++) {
            final Bump guess = guesses.get(i);
            final int offset = i * Bump.NPARAMS;
            final double meanBound = 2 * centerBound * guess.getStd();
            lower[offset + Bump.MEAN] = Math.max(guess.getMean() - meanBound, range[0]);
            upper[offset + Bump.MEAN] = Math.min(guess.getMean() + meanBound, range[1]);
            lower[offset + Bump.HEIGHT] = Double.NEGATIVE_INFINITY;
            upper[offset + Bump.HEIGHT] = Double.POSITIVE_INFINITY;
            lower[offset + Bump.STD] = stdLimits[0];
            upper[offset + Bump.STD] = stdLimits[1];
        }
        return new ClampParameters(lower, upper);
    }

    public double[] getLower() {
        return lower.clone();
    }

    public double[] getUpper() {
        return upper.clone();
    }

    public int getDimension() {
        return lower.length;
    }

    public boolean contains(final double[] params) {
        if (params.length != lower.length) return false;
        for (int i = 0; i < params.length; i++) {
            if (params[i] < lower[i] || params[i] > upper[i]) return false;
        }
        return true;
    }

    public double[] clamp(final double[] params) {
        assert(params.length == lower.length);
        double[] out = new double[params.length];
        for (int i = 0; i < params.length; i++) {
            out[i] = Math.min(Math.max(params[i], lower[i]), upper[i]);
        }
        return out;
    }

    @Override
    public RealVector validate(final RealVector params) {
        for (int i = 0; i < params.getDimension(); i++) {
            final double v = params.getEntry(i);
            if (v < lower[i]) params.setEntry(i, lower[i]);
            else if (v > upper[i]) params.setEntry(i, upper[i]);
        }
        return params;
    }

    @Override
    public String toString() {
        return "ClampParameters[lower=" + Arrays.toString(lower) + ", upper=" + Arrays.toString(upper) + "]";
    }
}
