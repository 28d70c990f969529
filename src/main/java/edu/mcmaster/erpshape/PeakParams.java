package edu.mcmaster.erpshape;

/**
 * Reported view of a fitted bump: the position and value of the signal extremum near the bump,
 * and the two-sided width (2 × std).
 */
public class PeakParams {
    public static final int NPARAMS = 3;

    public static final int CT = 0;
    public static final int PW = 1;
    public static final int BW = 2;

    private final double center;
    private final double power;
    private final double bandwidth;

    public PeakParams(double center, double power, double bandwidth) {
        this.center = center;
        this.power = power;
        this.bandwidth = bandwidth;
    }

    /** position of the extremum */
    public double getCenter() {
        return center;
    }

    /** signal value at the extremum */
    public double getPower() {
        return power;
    }

    /** two-sided width */
    public double getBandwidth() {
        return bandwidth;
    }

    public double[] toArray() {
        return new double[]{center, power, bandwidth};
    }

    @Override
    public String toString() {
        return String.format("PeakParams[CT=%.4f, PW=%.4f, BW=%.4f]", center, power, bandwidth);
    }
}
