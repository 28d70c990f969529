package edu.mcmaster.erpshape;

import java.util.ArrayList;
import java.util.List;

/**
 * Parameters of one Gaussian component, either a guess from the peak search or the result of
 * the joint fit. Stored as [mean, height, standard deviation], the layout the solver works on.
 */
public class Bump {
    public static final int NPARAMS = 3;

    public static final int MEAN = 0;
    public static final int HEIGHT = 1;
    public static final int STD = 2;

    private final double[] paramArray;

    public Bump(double mean, double height, double std) {
        this.paramArray = new double[NPARAMS];
        this.paramArray[MEAN] = mean;
        this.paramArray[HEIGHT] = height;
        this.paramArray[STD] = std;
    }

    /*----------- Public Interface ------------------*/
    public double[] getParameterArray() {
        return this.paramArray.clone();
    }

    public double getMean() {
        return this.paramArray[MEAN];
    }

    public double getHeight() {
        return this.paramArray[HEIGHT];
    }

    public double getStd() {
        return this.paramArray[STD];
    }

    /**
     * Evaluates this bump alone at {@code positions}.
     */
    public double[] evaluate(final double[] positions) {
        return GaussianFunction.evaluate(positions, getMean(), getHeight(), getStd());
    }

    /**
     * Concatenates the parameters of {@code bumps} as (mean, height, std) triplets.
     */
    public static double[] flatten(final List<Bump> bumps) {
        double[] flat = new double[bumps.size() * NPARAMS];
        int offset = 0;
        for (Bump b : bumps) {
            System.arraycopy(b.paramArray, 0, flat, offset, NPARAMS);
            offset += NPARAMS;
        }
        return flat;
    }

    /**
     * Inverse of {@link #flatten(List)}.
     */
    public static List<Bump> group(final double[] flat) {
        assert(flat.length % NPARAMS == 0);
        List<Bump> bumps = new ArrayList<>(flat.length / NPARAMS);
        for (int i = 0; i < flat.length; i += NPARAMS) {
            bumps.add(new Bump(flat[i + MEAN], flat[i + HEIGHT], flat[i + STD]));
        }
        return bumps;
    }

    @Override
    public String toString() {
        return String.format("Bump[mean=%.4f, height=%.4f, std=%.4f]", getMean(), getHeight(), getStd());
    }
}
